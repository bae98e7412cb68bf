package domain.collection;

import domain.model.Solution;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The running, deduplicated collection of solutions for one search.
 *
 * <p>Solutions are indexed by their canonical key in a {@link LinkedHashMap}.
 * Insertion is a single insert-if-absent step: the first solution seen for a
 * key is kept and every later solution with the same key is rejected. The
 * index spans all integer counts of the search, so a solution found again at a
 * larger size is still a duplicate.
 *
 * <h3>Invariants</h3>
 * <ul>
 *   <li>No two held solutions share a canonical key.</li>
 *   <li>Every held solution evaluates to the target; inserting anything else
 *       is a programming error and is rejected with an exception.</li>
 * </ul>
 *
 * <h3>Concurrency Design</h3>
 * <p>The orchestrator is the only writer: search tasks accumulate into private
 * lists that are merged here once a size is done. Mutations and snapshots are
 * still guarded by a {@link ReentrantLock} so that reads from a progress
 * listener on another thread see a consistent state. The best operator count
 * is {@code volatile} for lock-free reads.
 */
public final class SolutionCollector {

    private final long target;
    private final Map<String, Solution> solutionIndex = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /** Smallest operator count among held solutions; {@code Integer.MAX_VALUE} while empty. */
    private volatile int bestOperatorCount = Integer.MAX_VALUE;

    /**
     * Constructs an empty collector for {@code target}.
     *
     * @param target the value every collected solution must have
     */
    public SolutionCollector(long target) {
        this.target = target;
    }

    /**
     * Inserts {@code solution} unless a solution with the same canonical key is held.
     *
     * @param solution candidate solution
     * @return {@code true} if inserted; {@code false} if it was a duplicate
     * @throws IllegalArgumentException if the solution's result is not the target
     */
    public boolean tryCollect(Solution solution) {
        if (solution.result != target) {
            throw new IllegalArgumentException(
                "Solution '" + solution.expression + "' evaluates to " + solution.result
                    + ", expected " + target);
        }

        lock.lock();
        try {
            if (solutionIndex.putIfAbsent(solution.canonicalKey, solution) != null) {
                return false;
            }
            if (solution.operatorCount < bestOperatorCount) {
                bestOperatorCount = solution.operatorCount;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts every solution of {@code solutions}, in iteration order.
     *
     * @param solutions candidates
     * @return how many were new
     */
    public int collectAll(Collection<Solution> solutions) {
        int added = 0;
        for (Solution solution : solutions) {
            if (tryCollect(solution)) added++;
        }
        return added;
    }

    /**
     * Returns the smallest operator count among held solutions.
     *
     * @return the best operator count, or empty if nothing has been collected
     */
    public OptionalInt getBestOperatorCount() {
        int best = bestOperatorCount;
        return best == Integer.MAX_VALUE ? OptionalInt.empty() : OptionalInt.of(best);
    }

    /**
     * Returns the best {@code limit} solutions in ranking order.
     *
     * @param limit maximum number of solutions to return
     * @return a new sorted list of at most {@code limit} solutions
     */
    public List<Solution> getRankedSolutions(int limit) {
        List<Solution> ranked;
        lock.lock();
        try {
            ranked = new ArrayList<>(solutionIndex.values());
        } finally {
            lock.unlock();
        }
        Collections.sort(ranked);
        return ranked.size() <= limit ? ranked : new ArrayList<>(ranked.subList(0, limit));
    }

    /**
     * Returns all held solutions in ranking order.
     *
     * @return a new sorted list
     */
    public List<Solution> getRankedSolutions() {
        return getRankedSolutions(Integer.MAX_VALUE);
    }

    public boolean contains(String canonicalKey) {
        lock.lock();
        try {
            return solutionIndex.containsKey(canonicalKey);
        } finally {
            lock.unlock();
        }
    }

    public long getTarget() {
        return target;
    }

    public int getCurrentSize() {
        lock.lock();
        try {
            return solutionIndex.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return getCurrentSize() == 0;
    }
}
