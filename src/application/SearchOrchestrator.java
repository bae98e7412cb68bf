package application;

import application.SearchConfiguration.SearchStrategy;
import domain.collection.SolutionCollector;
import domain.engine.SearchEngine;
import domain.model.Operator;
import domain.model.Solution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ForkJoinPool;

import static application.OrchestratorConfiguration.DEFAULT_MIN_INTEGER;
import static application.OrchestratorConfiguration.DEFAULT_PARALLELISM;

/**
 * Orchestrates the search for expressions equal to a target.
 *
 * <h3>Size loop</h3>
 * For every integer count {@code c = 1..maxIntegerCount}:
 * <ol>
 *   <li>Notify the {@link ProgressListener}.</li>
 *   <li>Search exactly {@code c} integers with the engine chosen by
 *       {@link SearchEngineFactory#selectStrategy(int)}.</li>
 *   <li>Merge the solutions into the {@link SolutionCollector}, which keeps one
 *       solution per canonical form across all counts.</li>
 *   <li>Outside exhaustive mode, stop once the collector holds at least
 *       {@code resultCount} solutions and the best of them uses no more than
 *       {@code c - 1} operators.</li>
 * </ol>
 * The collected solutions are then ranked and truncated to {@code resultCount}.
 *
 * <p>The orchestrator owns a {@link ForkJoinPool} when parallel search is
 * enabled; close it to release the worker threads.
 *
 * @see SearchConfiguration
 * @see SearchEngineFactory
 */
public final class SearchOrchestrator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SearchOrchestrator.class);

    private final SearchConfiguration config;
    /** {@code null} when parallel search is disabled. */
    private final ForkJoinPool executorPool;

    /**
     * Constructs an orchestrator for the given configuration.
     *
     * <p>Creates a dedicated {@link ForkJoinPool} when parallel search is enabled.
     * The pool is reused across every count and every {@link #search()} call.
     *
     * @param config immutable search parameters
     */
    public SearchOrchestrator(SearchConfiguration config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        this.executorPool = config.useParallelSearch() ? new ForkJoinPool(DEFAULT_PARALLELISM) : null;
    }

    /**
     * Runs the search.
     *
     * @return up to {@code resultCount} solutions, best first; empty when nothing is found
     */
    public List<Solution> search() {
        SolutionCollector collector = new SolutionCollector(config.getTarget());
        Map<SearchStrategy, SearchEngine> engines = new EnumMap<>(SearchStrategy.class);

        long startTime = System.currentTimeMillis();
        int maxCount = config.getMaxIntegerCount();

        if (config.getAvailableIntegers().length == 0) {
            logger.debug("Empty integer pool, nothing to search");
            maxCount = 0;
        }

        for (int count = 1; count <= maxCount; count++) {
            config.getProgressListener().onProgress(progressMessage(count));

            long sizeStart = System.currentTimeMillis();
            SearchStrategy strategy = SearchEngineFactory.selectStrategy(count);
            SearchEngine engine = engines.computeIfAbsent(strategy,
                s -> SearchEngineFactory.createSearchEngine(s, config, executorPool));

            List<Solution> found = engine.searchSize(count);
            int added = collector.collectAll(found);
            logSizeCompletion(count, strategy, found.size(), added, sizeStart);

            if (shouldStop(collector, count)) {
                logger.debug("Stopping after {} integers: best uses {} operators, {} solutions held",
                    count, collector.getBestOperatorCount().getAsInt(), collector.getCurrentSize());
                break;
            }
        }

        List<Solution> ranked = collector.getRankedSolutions(config.getResultCount());
        logger.info("Search for {} finished in {} ms: {} distinct solutions, returning {}",
            config.getTarget(), System.currentTimeMillis() - startTime,
            collector.getCurrentSize(), ranked.size());
        return ranked;
    }

    /**
     * Early-termination rule: no later count can beat a solution with at most
     * {@code count - 1} operators, and enough solutions are already held.
     */
    private boolean shouldStop(SolutionCollector collector, int count) {
        if (config.isExhaustive()) return false;
        OptionalInt best = collector.getBestOperatorCount();
        return best.isPresent()
            && best.getAsInt() <= count - 1
            && collector.getCurrentSize() >= config.getResultCount();
    }

    static String progressMessage(int count) {
        return count == 1 ? "Searching 1 number..." : "Searching " + count + " numbers...";
    }

    private void logSizeCompletion(int count, SearchStrategy strategy, int found, int added, long startTime) {
        if (logger.isDebugEnabled()) {
            long duration = System.currentTimeMillis() - startTime;
            logger.debug("[Size {}] {} search: {} solutions, {} new, {} ms",
                count, strategy, found, added, duration);
        }
    }

    public SearchConfiguration getConfig() {
        return config;
    }

    /**
     * Shuts the worker pool down. Idempotent.
     */
    @Override
    public void close() {
        if (executorPool != null) {
            executorPool.shutdown();
        }
    }

    // =========================================================================
    // Convenience entry point
    // =========================================================================

    /**
     * Searches the pool {@code 1..maxInteger} minus {@code excluded} in one call.
     *
     * @param target           value every expression must equal
     * @param maxInteger       largest pool integer
     * @param operators        enabled operators
     * @param excluded         integers removed from the pool
     * @param maxIntegerCount  largest number of integers per expression
     * @param resultCount      number of solutions to return
     * @param exhaustive       disables the per-value cap and early termination
     * @param progressListener progress sink, or {@code null}
     * @return up to {@code resultCount} solutions, best first
     * @throws IllegalArgumentException if a parameter is out of range
     * @throws IllegalStateException    if no operator is enabled and the target is not in the pool
     */
    public static List<Solution> search(long target, int maxInteger, Set<Operator> operators,
                                        Set<Integer> excluded, int maxIntegerCount, int resultCount,
                                        boolean exhaustive, ProgressListener progressListener) {
        SearchConfiguration config = new SearchConfiguration.Builder()
            .setTarget(target)
            .setMinInteger(DEFAULT_MIN_INTEGER)
            .setMaxInteger(maxInteger)
            .setOperators(operators)
            .setExcludedIntegers(excluded)
            .setMaxIntegerCount(maxIntegerCount)
            .setResultCount(resultCount)
            .setExhaustive(exhaustive)
            .setProgressListener(progressListener)
            .build();

        try (SearchOrchestrator orchestrator = new SearchOrchestrator(config)) {
            return orchestrator.search();
        }
    }
}
