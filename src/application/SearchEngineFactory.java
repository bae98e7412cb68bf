package application;

import application.SearchConfiguration.SearchStrategy;
import domain.engine.DirectSearchEngine;
import domain.engine.MeetInTheMiddleEngine;
import domain.engine.SearchEngine;
import domain.engine.SolutionCombiner;
import domain.engine.SubexpressionGenerator;

import java.util.concurrent.ForkJoinPool;

import static application.OrchestratorConfiguration.DIRECT_SEARCH_MAX_COUNT;
import static application.OrchestratorConfiguration.FINE_GRAIN_THRESHOLD;

/**
 * Factory for creating {@link SearchEngine} instances based on configuration.
 *
 * <p>Centralizes engine creation in a single class. This decouples
 * {@link SearchOrchestrator} from the concrete engines and their collaborators
 * (generator, combiner).
 *
 * <h3>Supported strategies</h3>
 * <ul>
 *   <li><b>DIRECT</b>: exhaustive enumeration, counts up to
 *       {@value OrchestratorConfiguration#DIRECT_SEARCH_MAX_COUNT}</li>
 *   <li><b>MEET_IN_THE_MIDDLE</b>: half-table matching, larger counts</li>
 * </ul>
 *
 * @see SearchEngine
 * @see SearchConfiguration.SearchStrategy
 */
public final class SearchEngineFactory {

    private SearchEngineFactory() {
        // Prevent instantiation: static methods only
    }

    /**
     * Picks the algorithm for one integer count.
     *
     * @param integerCount number of integers per expression
     * @return {@code DIRECT} up to {@link OrchestratorConfiguration#DIRECT_SEARCH_MAX_COUNT},
     *         {@code MEET_IN_THE_MIDDLE} beyond
     */
    public static SearchStrategy selectStrategy(int integerCount) {
        return integerCount <= DIRECT_SEARCH_MAX_COUNT
            ? SearchStrategy.DIRECT
            : SearchStrategy.MEET_IN_THE_MIDDLE;
    }

    /**
     * Creates a {@link SearchEngine} for the given strategy.
     *
     * @param strategy the algorithm
     * @param config   search parameters
     * @param executor pool for parallel execution, or {@code null} for sequential
     * @return the engine
     * @throws IllegalStateException if strategy is unknown
     */
    public static SearchEngine createSearchEngine(SearchStrategy strategy,
                                                  SearchConfiguration config,
                                                  ForkJoinPool executor) {
        switch (strategy) {
            case DIRECT:
                return new DirectSearchEngine(
                    config.getTarget(),
                    config.getAvailableIntegers(),
                    config.getOperatorArray(),
                    executor,
                    FINE_GRAIN_THRESHOLD);

            case MEET_IN_THE_MIDDLE:
                SubexpressionGenerator generator = new SubexpressionGenerator(
                    config.getAvailableIntegers(),
                    config.getOperatorArray(),
                    config.getEffectiveResultsPerValue(),
                    executor);
                SolutionCombiner combiner = new SolutionCombiner(
                    config.getTarget(), config.getOperatorArray(), executor);
                return new MeetInTheMiddleEngine(generator, combiner);

            default:
                throw new IllegalStateException(
                    "Unknown search strategy: " + strategy + ". " +
                    "This indicates a configuration validation bug.");
        }
    }
}
