package benchmark;

import benchmark.OperatorComparisonBenchmark.Scenario;
import benchmark.OperatorComparisonBenchmark.ScenarioResult;
import benchmark.OperatorComparisonBenchmark.Verdict;
import domain.model.Solution;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OperatorComparisonBenchmarkTest {

    private static ScenarioResult result(Scenario scenario, Solution... solutions) {
        return new ScenarioResult(scenario, List.of(solutions), 0);
    }

    private static Solution solution(String expression, int[] numbers) {
        return Solution.of(expression, 0, numbers, numbers.length - 1);
    }

    @Test
    void shouldRunEveryScenario() {
        final List<ScenarioResult> results = OperatorComparisonBenchmark.compare(343, 8, 3);

        assertThat(results).extracting(ScenarioResult::getScenario).containsExactly(Scenario.values());
        assertThat(results.get(Scenario.WITH_EXPONENTIATION.ordinal()).getSolutions().get(0).getExpression())
            .isEqualTo("7 ^ 3");
        assertThat(OperatorComparisonBenchmark.verdict(results)).isEqualTo(Verdict.IMPROVED_FEWER_OPERATIONS);
    }

    @Test
    void shouldReportFewerIntegers() {
        final List<ScenarioResult> results = List.of(
            result(Scenario.STANDARD, solution("2 * 4", new int[] {2, 4})),
            result(Scenario.WITH_EXPONENTIATION, solution("2 ^ 2", new int[] {2, 2})));

        assertThat(OperatorComparisonBenchmark.verdict(results)).isEqualTo(Verdict.IMPROVED_FEWER_INTEGERS);
    }

    @Test
    void shouldReportNotImproved() {
        final List<ScenarioResult> results = List.of(
            result(Scenario.STANDARD, solution("2 * 4", new int[] {2, 4})),
            result(Scenario.WITH_EXPONENTIATION, solution("2 * 4", new int[] {2, 4})));

        assertThat(OperatorComparisonBenchmark.verdict(results)).isEqualTo(Verdict.NOT_IMPROVED);
    }

    @Test
    void shouldReportMissingSolutions() {
        final Solution any = solution("8", new int[] {8});

        assertThat(OperatorComparisonBenchmark.verdict(List.of(
            result(Scenario.STANDARD), result(Scenario.WITH_EXPONENTIATION))))
            .isEqualTo(Verdict.NO_SOLUTIONS);
        assertThat(OperatorComparisonBenchmark.verdict(List.of(
            result(Scenario.STANDARD), result(Scenario.WITH_EXPONENTIATION, any))))
            .isEqualTo(Verdict.ENABLED_SOLUTION);
        assertThat(OperatorComparisonBenchmark.verdict(List.of(
            result(Scenario.STANDARD, any), result(Scenario.WITH_EXPONENTIATION))))
            .isEqualTo(Verdict.LOST_SOLUTION);
    }
}
