package cli;

import application.OrchestratorConfiguration;
import application.SearchConfiguration;
import application.SearchOrchestrator;
import domain.model.Solution;

import java.io.FileOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Command-line entry point for the number combination search.
 *
 * <h3>Usage</h3>
 * <pre>
 *   java cli.CommandLineInterface &lt;target&gt; [options]
 * </pre>
 *
 * <h3>Optional flags</h3>
 * <p>See {@link ArgumentParser} for full list of optional flags.
 *
 * <h3>Output</h3>
 * <ul>
 *   <li>Results are printed to stdout via {@link ResultFormatter} (or to a file if --output is used)</li>
 *   <li>Progress lines and debug output go to stderr</li>
 *   <li>Exit code is 0 on success, non-zero on error</li>
 * </ul>
 *
 * @see ArgumentParser
 * @see SearchOrchestrator
 * @see ResultFormatter
 */
public final class CommandLineInterface {

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        try {
            execute(args);
        } catch (IllegalArgumentException | IllegalStateException e) {
            System.err.println("Argument Error: " + e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            System.err.println("I/O Error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Unexpected error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    /**
     * Executes the search workflow.
     *
     * @param args command-line arguments
     * @throws IOException if the output file cannot be written
     * @throws IllegalArgumentException if arguments are invalid
     */
    private static void execute(String[] args) throws IOException {
        ArgumentParser parser = new ArgumentParser();
        parser.parse(args);

        if (parser.isHelpRequested()) {
            parser.printHelp();
            return;
        }

        LoggingConfigurator.configure(parser.isDebugMode());

        SearchConfiguration config = parser.buildConfiguration(new ConsoleProgressListener(System.err));

        if (parser.isDebugMode()) {
            System.err.println("[CLI] " + config);
        }

        SearchResult result = executeSearch(config);

        displayResults(parser, config, result);
    }

    private static SearchResult executeSearch(SearchConfiguration config) {
        long startTime = System.currentTimeMillis();

        List<Solution> solutions;
        try (SearchOrchestrator orchestrator = new SearchOrchestrator(config)) {
            solutions = orchestrator.search();
        }

        long executionTime = System.currentTimeMillis() - startTime;
        return new SearchResult(solutions, executionTime, measureMemoryUsage());
    }

    /**
     * Measures memory usage after the search completes.
     *
     * @return memory used in megabytes
     */
    private static double measureMemoryUsage() {
        Runtime runtime = Runtime.getRuntime();
        long memoryBytes = runtime.totalMemory() - runtime.freeMemory();
        return memoryBytes / OrchestratorConfiguration.BYTES_PER_MB;
    }

    /**
     * Displays results to stdout or to a file.
     *
     * @throws IOException if output file cannot be written
     */
    private static void displayResults(ArgumentParser parser, SearchConfiguration config,
                                       SearchResult result) throws IOException {
        if (parser.getOutputFile() != null) {
            try (PrintStream fileOut = new PrintStream(
                    new FileOutputStream(parser.getOutputFile()), false, StandardCharsets.UTF_8)) {
                new ResultFormatter(fileOut).printResults(
                    config.getTarget(), result.solutions, result.executionTimeMs, result.memoryUsedMB);
                if (fileOut.checkError()) {
                    throw new IOException("Could not write " + parser.getOutputFile());
                }
            }
            System.err.println("[CLI] Results written to: " + parser.getOutputFile());
        } else {
            new ResultFormatter(System.out).printResults(
                config.getTarget(), result.solutions, result.executionTimeMs, result.memoryUsedMB);
        }
    }

    // =========================================================================
    // Result Container
    // =========================================================================

    /**
     * Immutable container for search results.
     */
    private static final class SearchResult {
        final List<Solution> solutions;
        final long executionTimeMs;
        final double memoryUsedMB;

        SearchResult(List<Solution> solutions, long executionTimeMs, double memoryUsedMB) {
            this.solutions = solutions;
            this.executionTimeMs = executionTimeMs;
            this.memoryUsedMB = memoryUsedMB;
        }
    }
}
