package domain.engine;

import domain.expression.ExpressionFormatter;
import domain.model.Operator;
import domain.model.Solution;
import infrastructure.parallel.DirectSearchTask;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ForkJoinPool;

/**
 * Exhaustive search over every flat expression of one integer count.
 *
 * <p>Every ordered selection of pool integers (with repetition) is crossed with
 * every ordered selection of enabled operators and evaluated with standard
 * precedence. Assignments equal to the target become {@link Solution}s.
 *
 * <h3>Work decomposition</h3>
 * The leading integer of the expression partitions the work. With an executor,
 * a {@link DirectSearchTask} bisects the leading-integer range the same way for
 * every count; without one, the whole range runs on the calling thread.
 *
 * <p>The cost is {@code |pool|^c × |ops|^(c-1)} evaluations, so this engine is
 * only selected for small counts.
 */
public final class DirectSearchEngine implements SearchEngine {

    private final long target;
    private final int[] pool;
    private final Operator[] operators;
    /** {@code null} for sequential execution. */
    private final ForkJoinPool executor;
    private final int fineGrainThreshold;

    /**
     * @param target             value every solution must equal
     * @param pool               available integers, ascending
     * @param operators          enabled operators
     * @param executor           pool for parallel execution, or {@code null} for sequential
     * @param fineGrainThreshold leading-range size at which tasks stop bisecting
     */
    public DirectSearchEngine(long target, int[] pool, Operator[] operators,
                              ForkJoinPool executor, int fineGrainThreshold) {
        this.target = target;
        this.pool = pool.clone();
        this.operators = operators.clone();
        this.executor = executor;
        this.fineGrainThreshold = fineGrainThreshold;
    }

    @Override
    public List<Solution> searchSize(int integerCount) {
        if (integerCount <= 0 || pool.length == 0) return Collections.emptyList();

        if (executor != null && integerCount > 1) {
            return executor.invoke(new DirectSearchTask(this, integerCount, 0, pool.length, fineGrainThreshold));
        }
        return searchLeadingRange(integerCount, 0, pool.length);
    }

    /**
     * Searches the expressions of {@code integerCount} integers whose leading
     * integer is {@code pool[from..to)}.
     *
     * @param integerCount number of integers per expression
     * @param from         inclusive start of the leading-integer range
     * @param to           exclusive end of the leading-integer range
     * @return solutions in enumeration order
     */
    public List<Solution> searchLeadingRange(int integerCount, int from, int to) {
        List<Solution> solutions = new ArrayList<>();
        AssignmentEnumerator.enumerate(pool, operators, integerCount, from, to,
            (integers, numbers, ops, value) -> {
                if (value != target) return;
                String expression = ExpressionFormatter.format(numbers, ops);
                solutions.add(Solution.of(expression, value, integers, ops.length));
            });
        return solutions;
    }

    public int getPoolSize() {
        return pool.length;
    }

    public long getTarget() {
        return target;
    }
}
