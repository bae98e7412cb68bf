package application;

import domain.expression.CanonicalForm;
import domain.expression.StandardPrecedenceParser;
import domain.model.Operator;
import domain.model.Solution;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchOrchestratorTest {

    private static final Set<Operator> MULTIPLY_SUBTRACT_DIVIDE =
        EnumSet.of(Operator.MULTIPLY, Operator.SUBTRACT, Operator.DIVIDE);
    private static final Set<Operator> BASIC_FOUR =
        EnumSet.of(Operator.ADD, Operator.SUBTRACT, Operator.MULTIPLY, Operator.DIVIDE);

    private static List<Solution> run(SearchConfiguration config) {
        try (SearchOrchestrator orchestrator = new SearchOrchestrator(config)) {
            return orchestrator.search();
        }
    }

    @Test
    void shouldRankShortestProductFirst() {
        final List<Solution> solutions = SearchOrchestrator.search(
            100, 8, EnumSet.of(Operator.MULTIPLY), Set.of(), 6, 5, false, null);

        assertThat(solutions).isNotEmpty();
        assertThat(solutions.get(0).getExpression()).isEqualTo("4 * 5 * 5");
        assertThat(solutions.get(0).getOperatorCount()).isEqualTo(2);
        assertThat(solutions).hasSizeLessThanOrEqualTo(5);
    }

    @Test
    void shouldFindFourFactorProductOf2275() {
        final List<Solution> solutions = SearchOrchestrator.search(
            2275, 25, MULTIPLY_SUBTRACT_DIVIDE, Set.of(), 4, 10_000, false, null);

        assertThat(solutions.get(0).getCanonicalKey()).isEqualTo(CanonicalForm.of("7 * 13 * 25"));
        assertThat(solutions).extracting(Solution::getCanonicalKey)
            .contains(CanonicalForm.of("5 * 5 * 7 * 13"));
    }

    @Test
    void shouldOnlyReturnExpressionsEqualTo2285() {
        final List<Solution> solutions = SearchOrchestrator.search(
            2285, 25, BASIC_FOUR, Set.of(), 4, 5, false, null);

        assertThat(solutions).hasSize(5);
        for (Solution solution : solutions) {
            assertThat(solution.getResult()).isEqualTo(2285);
            assertThat(solution.getOperatorCount()).isEqualTo(3);
            assertThat(StandardPrecedenceParser.evaluate(solution.getExpression()))
                .as(solution.getExpression())
                .isEqualTo(BigInteger.valueOf(2285));
        }
    }

    @Test
    void shouldReturnDistinctCanonicalForms() {
        final List<Solution> solutions = SearchOrchestrator.search(
            24, 6, BASIC_FOUR, Set.of(), 4, 200, true, null);

        final Set<String> keys = solutions.stream().map(Solution::getCanonicalKey).collect(Collectors.toSet());
        assertThat(keys).hasSize(solutions.size());
    }

    @Test
    void shouldReturnSolutionsInRankingOrder() {
        final List<Solution> solutions = SearchOrchestrator.search(
            24, 6, BASIC_FOUR, Set.of(), 4, 50, false, null);

        for (int i = 1; i < solutions.size(); i++) {
            assertThat(solutions.get(i - 1).compareTo(solutions.get(i))).isLessThanOrEqualTo(0);
        }
    }

    @Test
    void shouldStopEarlyWithoutChangingTopResults() {
        final Set<Operator> ops = EnumSet.of(Operator.ADD, Operator.MULTIPLY);
        final List<Solution> early = SearchOrchestrator.search(24, 6, ops, Set.of(), 4, 5, false, null);
        final List<Solution> exhaustive = SearchOrchestrator.search(24, 6, ops, Set.of(), 4, 5, true, null);

        assertThat(early).extracting(Solution::getCanonicalKey)
            .containsExactlyElementsOf(exhaustive.stream().map(Solution::getCanonicalKey).toList());
    }

    @Test
    void shouldStopAfterFirstSizeWhenLiteralSuffices() {
        final List<String> messages = new ArrayList<>();
        final List<Solution> solutions = SearchOrchestrator.search(
            5, 25, EnumSet.of(Operator.ADD), Set.of(), 6, 1, false, messages::add);

        assertThat(solutions).extracting(Solution::getExpression).containsExactly("5");
        assertThat(messages).containsExactly("Searching 1 number...");
    }

    @Test
    void shouldReportProgressForEverySize() {
        final List<String> messages = new ArrayList<>();
        SearchOrchestrator.search(7, 5, EnumSet.of(Operator.ADD), Set.of(), 3, 5, true, messages::add);

        assertThat(messages).containsExactly(
            "Searching 1 number...", "Searching 2 numbers...", "Searching 3 numbers...");
    }

    @Test
    void shouldReachLargeCountsThroughMeetInTheMiddle() {
        final SearchConfiguration config = new SearchConfiguration.Builder()
            .setTarget(72)
            .setMinInteger(2)
            .setMaxInteger(3)
            .setOperators(EnumSet.of(Operator.MULTIPLY))
            .setMaxIntegerCount(5)
            .build();

        final List<Solution> solutions = run(config);

        assertThat(solutions).isNotEmpty();
        assertThat(solutions.get(0).getOperatorCount()).isEqualTo(4);
        assertThat(solutions.get(0).getCanonicalKey()).isEqualTo(CanonicalForm.of("2 * 2 * 2 * 3 * 3"));
    }

    @Test
    void shouldGiveSameResultsSequentially() {
        final SearchConfiguration.Builder builder = new SearchConfiguration.Builder()
            .setTarget(97)
            .setMaxInteger(12)
            .setOperators(BASIC_FOUR)
            .setMaxIntegerCount(5)
            .setResultCount(20);

        final List<Solution> parallel = run(builder.setUseParallelSearch(true).build());
        final List<Solution> sequential = run(builder.setUseParallelSearch(false).build());

        assertThat(parallel).extracting(Solution::getExpression)
            .containsExactlyElementsOf(sequential.stream().map(Solution::getExpression).toList());
    }

    @Test
    void shouldReturnEmptyForNonPositiveMaxCount() {
        assertThat(SearchOrchestrator.search(5, 25, BASIC_FOUR, Set.of(), 0, 5, false, null)).isEmpty();
        assertThat(SearchOrchestrator.search(5, 25, BASIC_FOUR, Set.of(), -1, 5, false, null)).isEmpty();
    }

    @Test
    void shouldReturnEmptyForEmptyPool() {
        final SearchConfiguration config = new SearchConfiguration.Builder()
            .setTarget(5)
            .setMaxInteger(3)
            .setExcludedIntegers(Set.of(1, 2, 3))
            .setOperators(BASIC_FOUR)
            .build();

        assertThat(run(config)).isEmpty();
    }

    @Test
    void shouldReturnOnlyLiteralWithoutOperators() {
        final List<Solution> solutions = SearchOrchestrator.search(
            7, 25, EnumSet.noneOf(Operator.class), Set.of(), 6, 5, false, null);

        assertThat(solutions).extracting(Solution::getExpression).containsExactly("7");
    }

    @Test
    void shouldRejectNoOperatorsWhenTargetIsUnreachable() {
        assertThatThrownBy(() -> SearchOrchestrator.search(
                30, 25, EnumSet.noneOf(Operator.class), Set.of(), 6, 5, false, null))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void shouldFindNothingForUnreachableTarget() {
        final List<Solution> solutions = SearchOrchestrator.search(
            1000, 3, EnumSet.of(Operator.ADD), Set.of(), 3, 5, false, null);

        assertThat(solutions).isEmpty();
    }

    @Test
    void shouldHonourExclusions() {
        final List<Solution> solutions = SearchOrchestrator.search(
            10, 25, BASIC_FOUR, Set.of(10), 2, 50, true, null);

        assertThat(solutions).isNotEmpty();
        for (Solution solution : solutions) {
            assertThat(solution.getIntegersUsed()).doesNotContain(10);
        }
    }

    @Test
    void shouldFormatProgressMessages() {
        assertThat(SearchOrchestrator.progressMessage(1)).isEqualTo("Searching 1 number...");
        assertThat(SearchOrchestrator.progressMessage(4)).isEqualTo("Searching 4 numbers...");
    }
}
