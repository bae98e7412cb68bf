package domain.engine;

import domain.expression.StandardPrecedenceParser;
import domain.model.Operator;
import domain.model.PartialResult;
import domain.model.Solution;
import domain.model.SubexpressionTable;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.concurrent.ForkJoinPool;

import static org.assertj.core.api.Assertions.assertThat;

class SolutionCombinerTest {

    private static SubexpressionTable table(PartialResult... partials) {
        final SubexpressionTable table = new SubexpressionTable(SubexpressionTable.UNLIMITED);
        for (PartialResult partial : partials) table.add(partial);
        return table;
    }

    private static PartialResult partial(long value, String expression, int... numbers) {
        return PartialResult.of(value, expression, numbers, numbers.length - 1);
    }

    private static List<String> expressions(List<Solution> solutions) {
        return solutions.stream().map(Solution::getExpression).toList();
    }

    @Test
    void shouldMatchAddition() {
        final SolutionCombiner combiner = new SolutionCombiner(5, new Operator[] {Operator.ADD}, null);
        final List<Solution> found = combiner.combine(
            table(partial(3, "1 + 2", 1, 2)), table(PartialResult.literal(2), PartialResult.literal(4)));

        assertThat(expressions(found)).containsExactly("1 + 2 + 2");
        assertThat(found.get(0).getOperatorCount()).isEqualTo(2);
    }

    @Test
    void shouldMatchMultiplicationSkippingZero() {
        final SolutionCombiner combiner = new SolutionCombiner(12, new Operator[] {Operator.MULTIPLY}, null);
        final List<Solution> found = combiner.combine(
            table(PartialResult.literal(3), PartialResult.literal(0), partial(5, "1 + 4", 1, 4)),
            table(PartialResult.literal(4)));

        assertThat(expressions(found)).containsExactly("3 * 4");
    }

    @Test
    void shouldMatchSubtractionInBothDirections() {
        final SolutionCombiner combiner = new SolutionCombiner(2, new Operator[] {Operator.SUBTRACT}, null);
        final List<Solution> found = combiner.combine(
            table(PartialResult.literal(5)),
            table(PartialResult.literal(3), PartialResult.literal(7)));

        assertThat(expressions(found)).containsExactlyInAnyOrder("5 - 3", "7 - 5");
    }

    @Test
    void shouldMatchExactDivisionInBothDirections() {
        final SolutionCombiner combiner = new SolutionCombiner(3, new Operator[] {Operator.DIVIDE}, null);
        final List<Solution> found = combiner.combine(
            table(partial(12, "3 * 4", 3, 4)),
            table(PartialResult.literal(4), partial(36, "6 * 6", 6, 6), PartialResult.literal(5)));

        assertThat(expressions(found)).containsExactlyInAnyOrder("3 * 4 / 4", "6 * 6 / (3 * 4)");
    }

    @Test
    void shouldNeverDivideTowardsZeroTarget() {
        final SolutionCombiner combiner = new SolutionCombiner(0, new Operator[] {Operator.DIVIDE}, null);
        final List<Solution> found = combiner.combine(
            table(partial(0, "1 - 1", 1, 1)), table(PartialResult.literal(3)));

        assertThat(found).isEmpty();
    }

    @Test
    void shouldMatchPowersThroughExactRoots() {
        final SolutionCombiner combiner = new SolutionCombiner(343, new Operator[] {Operator.EXPONENTIATE}, null);
        final List<Solution> found = combiner.combine(
            table(PartialResult.literal(7)), table(PartialResult.literal(3)));

        assertThat(expressions(found)).containsExactly("7 ^ 3");
    }

    @Test
    void shouldMatchNegativeBaseOfEvenPower() {
        final SolutionCombiner combiner = new SolutionCombiner(49, new Operator[] {Operator.EXPONENTIATE}, null);
        final List<Solution> found = combiner.combine(
            table(partial(-7, "1 - 8", 1, 8)), table(PartialResult.literal(2)));

        assertThat(expressions(found)).containsExactly("(1 - 8) ^ 2");
    }

    @Test
    void shouldMatchEveryBaseForZeroExponentWhenTargetIsOne() {
        final SolutionCombiner combiner = new SolutionCombiner(1, new Operator[] {Operator.EXPONENTIATE}, null);
        final List<Solution> found = combiner.combine(
            table(PartialResult.literal(5), PartialResult.literal(9)),
            table(partial(0, "2 - 2", 2, 2)));

        assertThat(expressions(found)).containsExactlyInAnyOrder("5 ^ (2 - 2)", "9 ^ (2 - 2)");
    }

    @Test
    void shouldReturnNothingForEmptyTable() {
        final SolutionCombiner combiner = new SolutionCombiner(5, Operator.values(), null);
        assertThat(combiner.combine(table(), table(PartialResult.literal(5)))).isEmpty();
    }

    @Test
    void shouldOnlyReturnExpressionsEqualToTarget() {
        final Operator[] ops = Operator.values();
        final SubexpressionGenerator generator = new SubexpressionGenerator(
            new int[] {1, 2, 3, 4}, ops, SubexpressionTable.UNLIMITED, null);
        final SubexpressionTable two = generator.generate(2);

        for (long target : new long[] {-3, 0, 1, 16, 24, 81}) {
            final List<Solution> found = new SolutionCombiner(target, ops, null).combine(two, two);
            assertThat(found).isNotEmpty();
            for (Solution solution : found) {
                assertThat(solution.getResult()).isEqualTo(target);
                assertThat(StandardPrecedenceParser.evaluate(solution.getExpression()))
                    .as(solution.getExpression())
                    .isEqualTo(BigInteger.valueOf(target));
            }
        }
    }

    @Test
    void shouldCombineSameSolutionsInParallel() {
        final Operator[] ops = Operator.values();
        final SubexpressionTable two = new SubexpressionGenerator(
            new int[] {1, 2, 3, 4, 5}, ops, 3, null).generate(2);
        final ForkJoinPool pool = new ForkJoinPool(4);
        try {
            final List<Solution> sequential = new SolutionCombiner(20, ops, null).combine(two, two);
            final List<Solution> parallel = new SolutionCombiner(20, ops, pool).combine(two, two);
            assertThat(expressions(parallel)).containsExactlyElementsOf(expressions(sequential));
        } finally {
            pool.shutdown();
        }
    }
}
