package cli;

import domain.model.Solution;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ResultFormatterTest {

    private static String render(long target, List<Solution> solutions) {
        final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        new ResultFormatter(out).printResults(target, solutions, 1500, 12.5);
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldPrintRankedTable() {
        final List<Solution> solutions = List.of(
            Solution.of("4 * 5 * 5", 100, new int[] {4, 5, 5}, 2),
            Solution.of("2 * 2 * 25", 100, new int[] {2, 2, 25}, 2));

        final String output = render(100, solutions);

        assertThat(output).contains("TOP-2 EXPRESSIONS FOR 100");
        assertThat(output).contains("Rank", "Expression", "Ops", "Distinct");
        assertThat(output).containsPattern("1\\s+4 \\* 5 \\* 5\\s+2\\s+2");
        assertThat(output).containsPattern("2\\s+2 \\* 2 \\* 25\\s+2\\s+2");
        assertThat(output).contains("Execution time: 1.500 seconds");
        assertThat(output).contains("Solutions found: 2");
        assertThat(output).contains("Memory used: 12.50 MB");
    }

    @Test
    void shouldReportNoSolutions() {
        final String output = render(7, List.of());

        assertThat(output).contains("TOP-0 EXPRESSIONS FOR 7");
        assertThat(output).contains("No solutions found.");
        assertThat(output).doesNotContain("Rank");
    }
}
