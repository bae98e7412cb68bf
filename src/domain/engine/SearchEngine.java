package domain.engine;

import domain.model.Solution;

import java.util.List;

/**
 * Common interface for the per-size search strategies.
 *
 * <p>Both strategies are <em>exact</em> for the expressions they reach: every
 * returned {@link Solution} evaluates to the target. They differ in how the
 * expressions of one integer count are reached:
 * <ul>
 *   <li><b>Direct enumeration</b>: every integer/operator assignment of the count
 *       is evaluated. Complete, but exponential in the count.</li>
 *   <li><b>Meet in the middle</b>: subexpression tables of the two halves are
 *       generated and matched against the target per operator.</li>
 * </ul>
 *
 * <h3>Implemented strategies</h3>
 * <ul>
 *   <li>{@link DirectSearchEngine}: small counts</li>
 *   <li>{@link MeetInTheMiddleEngine}: larger counts</li>
 * </ul>
 *
 * <p><b>Thread safety</b>: implementations hold only immutable search
 * parameters, so one engine may serve several counts in sequence.
 */
public interface SearchEngine {

    /**
     * Finds expressions of exactly {@code integerCount} integers that equal the target.
     *
     * <p>The returned list may hold several solutions with the same canonical
     * form; de-duplication is the collector's job.
     *
     * @param integerCount number of integers per expression
     * @return solutions found, empty for a count of zero or less
     */
    List<Solution> searchSize(int integerCount);
}
