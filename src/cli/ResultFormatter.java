package cli;

import application.OrchestratorConfiguration;
import domain.model.Solution;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Formats and prints search results.
 *
 * <p>Results are presented as a ranked table with columns for rank, expression,
 * operator count and distinct integers used. A summary (execution time,
 * solution count, memory) is appended at the end.
 *
 * <p>Floating-point values use {@link Locale#ROOT} so the output does not
 * depend on the system locale.
 */
public final class ResultFormatter {

    private static final String RULE = "=================================================";

    private final PrintStream out;

    /**
     * Constructs a formatter writing to {@code out}.
     *
     * @param out destination stream
     */
    public ResultFormatter(PrintStream out) {
        this.out = out;
    }

    /**
     * Prints the ranked solutions and performance statistics.
     *
     * @param target          the searched target
     * @param solutions       solutions, best first (as returned by the orchestrator)
     * @param executionTimeMs wall-clock search time in ms
     * @param memoryUsedMB    heap memory in use when the result was ready, in megabytes
     */
    public void printResults(long target, List<Solution> solutions, long executionTimeMs, double memoryUsedMB) {
        out.println(RULE);
        out.printf("TOP-%d EXPRESSIONS FOR %d%n", solutions.size(), target);
        out.println(RULE);

        if (solutions.isEmpty()) {
            out.println("No solutions found.");
        } else {
            out.printf("%-6s %-40s %-6s %-8s%n", "Rank", "Expression", "Ops", "Distinct");
            out.println("-------------------------------------------------");

            int rank = 1;
            for (Solution solution : solutions) {
                out.printf("%-6d %-40s %-6d %-8d%n",
                    rank++,
                    solution.getExpression(),
                    solution.getOperatorCount(),
                    solution.getDistinctIntegerCount());
            }
        }

        out.println(RULE);
        out.printf(Locale.ROOT, "Execution time: %.3f seconds%n", executionTimeMs / OrchestratorConfiguration.MS_PER_SECOND);
        out.printf("Solutions found: %d%n", solutions.size());
        out.printf(Locale.ROOT, "Memory used: %.2f MB%n", memoryUsedMB);
        out.println(RULE);
        out.flush();
    }
}
