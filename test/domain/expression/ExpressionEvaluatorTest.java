package domain.expression;

import domain.model.Operator;
import org.junit.jupiter.api.Test;

import static domain.model.Operator.ADD;
import static domain.model.Operator.DIVIDE;
import static domain.model.Operator.EXPONENTIATE;
import static domain.model.Operator.MULTIPLY;
import static domain.model.Operator.SUBTRACT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExpressionEvaluatorTest {

    @Test
    void shouldApplyMultiplicationBeforeAddition() {
        assertThat(ExpressionEvaluator.evaluate(new long[] {2, 3, 4}, new Operator[] {ADD, MULTIPLY}))
            .hasValue(14);
        assertThat(ExpressionEvaluator.evaluate(new long[] {2, 3, 4}, new Operator[] {MULTIPLY, ADD}))
            .hasValue(10);
    }

    @Test
    void shouldSubtractLeftToRight() {
        assertThat(ExpressionEvaluator.evaluate(new long[] {8, 5, 2}, new Operator[] {SUBTRACT, SUBTRACT}))
            .hasValue(1);
        assertThat(ExpressionEvaluator.evaluate(new long[] {8, 5, 1}, new Operator[] {SUBTRACT, ADD}))
            .hasValue(4);
    }

    @Test
    void shouldDivideExactly() {
        assertThat(ExpressionEvaluator.evaluate(new long[] {8, 2}, new Operator[] {DIVIDE})).hasValue(4);
        assertThat(ExpressionEvaluator.evaluate(new long[] {7, 2}, new Operator[] {DIVIDE})).isEmpty();
        assertThat(ExpressionEvaluator.evaluate(new long[] {7, 0}, new Operator[] {DIVIDE})).isEmpty();
    }

    @Test
    void shouldFoldProductGroupsLeftToRight() {
        assertThat(ExpressionEvaluator.evaluate(new long[] {2, 3, 2}, new Operator[] {MULTIPLY, DIVIDE}))
            .hasValue(3);
        // 3 / 2 is inexact before the multiplication happens
        assertThat(ExpressionEvaluator.evaluate(new long[] {3, 2, 2}, new Operator[] {DIVIDE, MULTIPLY}))
            .isEmpty();
    }

    @Test
    void shouldFoldPowersLeftAssociatively() {
        assertThat(ExpressionEvaluator.evaluate(new long[] {2, 3, 2}, new Operator[] {EXPONENTIATE, EXPONENTIATE}))
            .hasValue(64);
        assertThat(ExpressionEvaluator.evaluate(new long[] {1, 2, 3}, new Operator[] {ADD, EXPONENTIATE}))
            .hasValue(9);
    }

    @Test
    void shouldReportOverflowAsEmpty() {
        assertThat(ExpressionEvaluator.evaluate(new long[] {25, 25}, new Operator[] {EXPONENTIATE}))
            .isEmpty();
    }

    @Test
    void shouldHandleDegenerateSequences() {
        assertThat(ExpressionEvaluator.evaluate(new long[0], new Operator[0])).hasValue(0);
        assertThat(ExpressionEvaluator.evaluate(new long[] {17}, new Operator[0])).hasValue(17);
    }

    @Test
    void shouldNotModifyInputs() {
        final long[] numbers = {6, 2, 3};
        final Operator[] operators = {DIVIDE, ADD};
        ExpressionEvaluator.evaluate(numbers, operators);
        assertThat(numbers).containsExactly(6, 2, 3);
        assertThat(operators).containsExactly(DIVIDE, ADD);
    }

    @Test
    void shouldRejectMismatchedArrays() {
        assertThatThrownBy(() -> ExpressionEvaluator.evaluate(new long[] {1, 2}, new Operator[] {ADD, ADD}))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
