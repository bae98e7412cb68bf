package infrastructure.parallel;

import domain.engine.DirectSearchEngine;
import domain.model.Solution;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RecursiveTask;

/**
 * {@link RecursiveTask} that runs direct enumeration of one integer count in
 * parallel.
 *
 * <p>The leading-integer range {@code [0, |pool|)} is recursively bisected until
 * each leaf task handles a single leading integer.
 *
 * <h3>Decomposition strategy</h3>
 * <ol>
 *   <li>If the range has only one integer, enumerate it directly.</li>
 *   <li>If the range size {@code ≤ fineGrainThreshold}, split into one task per
 *       integer to maximise work-stealing granularity.</li>
 *   <li>Otherwise, split at the midpoint and recurse.</li>
 * </ol>
 *
 * <p>Results of subtasks are concatenated in range order, so the output matches
 * sequential enumeration exactly.
 */
public final class DirectSearchTask extends RecursiveTask<List<Solution>> {

    private final DirectSearchEngine engine;
    private final int integerCount;
    /** Inclusive start of the leading-integer range. */
    private final int rangeStart;
    /** Exclusive end of the leading-integer range. */
    private final int rangeEnd;
    private final int fineGrainThreshold;

    /**
     * @param engine             engine performing the enumeration of each leaf range
     * @param integerCount       number of integers per expression
     * @param rangeStart         inclusive start index into the pool
     * @param rangeEnd           exclusive end index
     * @param fineGrainThreshold range size at which per-integer decomposition begins
     */
    public DirectSearchTask(DirectSearchEngine engine, int integerCount,
                            int rangeStart, int rangeEnd, int fineGrainThreshold) {
        this.engine = engine;
        this.integerCount = integerCount;
        this.rangeStart = rangeStart;
        this.rangeEnd = rangeEnd;
        this.fineGrainThreshold = fineGrainThreshold;
    }

    @Override
    protected List<Solution> compute() {
        int rangeSize = rangeEnd - rangeStart;

        if (rangeSize <= 1) {
            return engine.searchLeadingRange(integerCount, rangeStart, rangeEnd);
        }

        List<DirectSearchTask> subtasks;
        if (rangeSize <= fineGrainThreshold) {
            subtasks = new ArrayList<>(rangeSize);
            for (int i = rangeStart; i < rangeEnd; i++) {
                subtasks.add(createSubtask(i, i + 1));
            }
        } else {
            int splitPoint = rangeStart + rangeSize / 2;
            subtasks = List.of(createSubtask(rangeStart, splitPoint), createSubtask(splitPoint, rangeEnd));
        }

        invokeAll(subtasks);

        List<Solution> solutions = new ArrayList<>();
        for (DirectSearchTask subtask : subtasks) {
            solutions.addAll(subtask.join());
        }
        return solutions;
    }

    private DirectSearchTask createSubtask(int start, int end) {
        return new DirectSearchTask(engine, integerCount, start, end, fineGrainThreshold);
    }
}
