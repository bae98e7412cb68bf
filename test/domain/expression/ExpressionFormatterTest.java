package domain.expression;

import domain.model.Operator;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.OptionalLong;

import static domain.model.Operator.ADD;
import static domain.model.Operator.DIVIDE;
import static domain.model.Operator.EXPONENTIATE;
import static domain.model.Operator.MULTIPLY;
import static domain.model.Operator.SUBTRACT;
import static org.assertj.core.api.Assertions.assertThat;

class ExpressionFormatterTest {

    @Test
    void shouldFormatSingleNumber() {
        assertThat(ExpressionFormatter.format(new long[] {7}, new Operator[0])).isEqualTo("7");
        assertThat(ExpressionFormatter.format(new long[0], new Operator[0])).isEmpty();
    }

    @Test
    void shouldLeaveLoneProductBare() {
        assertThat(ExpressionFormatter.format(new long[] {4, 5, 5}, new Operator[] {MULTIPLY, MULTIPLY}))
            .isEqualTo("4 * 5 * 5");
    }

    @Test
    void shouldParenthesizeProductsInsideSums() {
        assertThat(ExpressionFormatter.format(new long[] {23, 25, 4, 15},
                new Operator[] {MULTIPLY, MULTIPLY, SUBTRACT}))
            .isEqualTo("(23 * 25 * 4) - 15");
        assertThat(ExpressionFormatter.format(new long[] {1, 2, 3}, new Operator[] {ADD, MULTIPLY}))
            .isEqualTo("1 + (2 * 3)");
    }

    @Test
    void shouldParenthesizeChainedPowers() {
        assertThat(ExpressionFormatter.format(new long[] {2, 3, 2}, new Operator[] {EXPONENTIATE, EXPONENTIATE}))
            .isEqualTo("(2 ^ 3) ^ 2");
        assertThat(ExpressionFormatter.format(new long[] {7, 3}, new Operator[] {EXPONENTIATE}))
            .isEqualTo("7 ^ 3");
    }

    @Test
    void shouldComposeWithMinimalParentheses() {
        assertThat(ExpressionFormatter.compose("2 + 3", MULTIPLY, "4")).isEqualTo("(2 + 3) * 4");
        assertThat(ExpressionFormatter.compose("2 * 3", ADD, "4")).isEqualTo("2 * 3 + 4");
        assertThat(ExpressionFormatter.compose("8", SUBTRACT, "5 - 2")).isEqualTo("8 - (5 - 2)");
        assertThat(ExpressionFormatter.compose("8", ADD, "5 - 2")).isEqualTo("8 + 5 - 2");
        assertThat(ExpressionFormatter.compose("12", DIVIDE, "2 * 3")).isEqualTo("12 / (2 * 3)");
        assertThat(ExpressionFormatter.compose("2 * 3", EXPONENTIATE, "2")).isEqualTo("(2 * 3) ^ 2");
        assertThat(ExpressionFormatter.compose("2", EXPONENTIATE, "1 + 1")).isEqualTo("2 ^ (1 + 1)");
    }

    @Test
    void shouldReportTopLevelPrecedence() {
        assertThat(ExpressionFormatter.topLevelPrecedence("7")).isEqualTo(Operator.ATOM_PRECEDENCE);
        assertThat(ExpressionFormatter.topLevelPrecedence("(1 + 2) * 3")).isEqualTo(2);
        assertThat(ExpressionFormatter.topLevelPrecedence("2 * 3 - 1")).isEqualTo(1);
        assertThat(ExpressionFormatter.topLevelPrecedence("2 ^ 3")).isEqualTo(3);
    }

    @Test
    void shouldRenderTextThatEvaluatesToTheComputedValue() {
        final long[] pool = {1, 2, 3, 4};
        final Operator[] ops = Operator.values();
        final long[] numbers = new long[3];
        final Operator[] operators = new Operator[2];

        for (long a : pool) for (long b : pool) for (long c : pool) {
            for (Operator x : ops) for (Operator y : ops) {
                numbers[0] = a;
                numbers[1] = b;
                numbers[2] = c;
                operators[0] = x;
                operators[1] = y;
                final OptionalLong value = ExpressionEvaluator.evaluate(numbers, operators);
                if (value.isEmpty()) continue;

                final String text = ExpressionFormatter.format(numbers, operators);
                assertThat(StandardPrecedenceParser.evaluate(text))
                    .as(text)
                    .isEqualTo(BigInteger.valueOf(value.getAsLong()));
            }
        }
    }
}
