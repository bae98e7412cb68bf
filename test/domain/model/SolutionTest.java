package domain.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SolutionTest {

    @Test
    void shouldTrackDistinctIntegers() {
        final Solution solution = Solution.of("4 * 5 * 5", 100, new int[] {4, 5, 5}, 2);
        assertThat(solution.getIntegersUsed()).containsExactly(4, 5);
        assertThat(solution.getDistinctIntegerCount()).isEqualTo(2);
        assertThat(solution.getCanonicalKey()).isEqualTo("+4*5*5");
    }

    @Test
    void shouldRankByOperatorsThenDistinctIntegersThenKey() {
        final Solution fewerOps = Solution.of("4 * 25", 100, new int[] {4, 25}, 1);
        final Solution fewerDistinct = Solution.of("4 * 5 * 5", 100, new int[] {4, 5, 5}, 2);
        final Solution moreDistinct = Solution.of("2 * 5 * 10", 100, new int[] {2, 5, 10}, 2);
        final Solution sameShapeLaterKey = Solution.of("5 * 5 * 4", 100, new int[] {5, 5, 4}, 2);

        final List<Solution> solutions = new ArrayList<>(List.of(moreDistinct, fewerDistinct, fewerOps));
        Collections.sort(solutions);
        assertThat(solutions).containsExactly(fewerOps, fewerDistinct, moreDistinct);

        assertThat(fewerDistinct.compareTo(sameShapeLaterKey)).isZero();
    }

    @Test
    void shouldComposeFromPartials() {
        final PartialResult left = PartialResult.of(2300, "23 * 25 * 4", new int[] {23, 25, 4}, 2);
        final PartialResult right = PartialResult.literal(15);

        final Solution solution = Solution.compose(left, Operator.SUBTRACT, right, 2285);

        assertThat(solution.getExpression()).isEqualTo("23 * 25 * 4 - 15");
        assertThat(solution.getOperatorCount()).isEqualTo(3);
        assertThat(solution.getIntegersUsed()).containsExactly(4, 15, 23, 25);
        assertThat(solution.toString()).isEqualTo("23 * 25 * 4 - 15 = 2285");
    }

    @Test
    void shouldPromotePartial() {
        final Solution solution = Solution.fromPartial(PartialResult.literal(7));
        assertThat(solution.getResult()).isEqualTo(7);
        assertThat(solution.getOperatorCount()).isZero();
    }
}
