package domain.engine;

import domain.expression.ExpressionEvaluator;
import domain.model.Operator;

import java.util.OptionalLong;

/**
 * Enumerates every assignment of pool integers and operators to a flat
 * expression of a fixed length, evaluating each one.
 *
 * <p>For an expression of {@code count} integers the enumeration covers every
 * ordered selection of {@code count} pool integers (with repetition) crossed
 * with every ordered selection of {@code count - 1} enabled operators. The
 * leading integer is restricted to a sub-range of the pool so the work can be
 * split across tasks.
 *
 * <p>Only assignments that evaluate to a value are reported. The arrays passed
 * to the visitor are reused between calls; a visitor that keeps them must copy.
 */
final class AssignmentEnumerator {

    /** Receives each successfully evaluated assignment. */
    interface Visitor {
        void visit(int[] integers, long[] numbers, Operator[] operators, long value);
    }

    private AssignmentEnumerator() {
        // Prevent instantiation: static methods only
    }

    /**
     * Enumerates assignments whose leading integer is {@code pool[leadingFrom..leadingTo)}.
     *
     * @param pool        the available integers
     * @param operators   the enabled operators
     * @param count       number of integers per expression, at least 1
     * @param leadingFrom inclusive start index of the leading integer
     * @param leadingTo   exclusive end index of the leading integer
     * @param visitor     callback for every assignment with a value
     */
    static void enumerate(int[] pool, Operator[] operators, int count,
                          int leadingFrom, int leadingTo, Visitor visitor) {
        if (count < 1 || pool.length == 0) return;
        if (count > 1 && operators.length == 0) return;

        int[] integers = new int[count];
        long[] numbers = new long[count];
        Operator[] ops = new Operator[count - 1];
        int[] numberIndex = new int[count];
        int[] operatorIndex = new int[count - 1];

        for (int lead = leadingFrom; lead < leadingTo; lead++) {
            numberIndex[0] = lead;
            for (int i = 1; i < count; i++) numberIndex[i] = 0;

            // Odometer over positions 1..count-1 of the number tuple
            while (true) {
                for (int i = 0; i < count; i++) {
                    integers[i] = pool[numberIndex[i]];
                    numbers[i] = integers[i];
                }
                visitOperatorTuples(integers, numbers, ops, operatorIndex, operators, visitor);

                if (!advance(numberIndex, 1, pool.length)) break;
            }
        }
    }

    private static void visitOperatorTuples(int[] integers, long[] numbers, Operator[] ops,
                                            int[] operatorIndex, Operator[] operators, Visitor visitor) {
        if (ops.length == 0) {
            visitor.visit(integers, numbers, ops, numbers[0]);
            return;
        }
        for (int i = 0; i < operatorIndex.length; i++) operatorIndex[i] = 0;
        while (true) {
            for (int i = 0; i < ops.length; i++) ops[i] = operators[operatorIndex[i]];
            OptionalLong value = ExpressionEvaluator.evaluate(numbers, ops);
            if (value.isPresent()) {
                visitor.visit(integers, numbers, ops, value.getAsLong());
            }
            if (!advance(operatorIndex, 0, operators.length)) break;
        }
    }

    /**
     * Advances a mixed-radix counter over {@code digits[from..]} with base {@code radix}.
     *
     * @return {@code false} once the counter wraps around
     */
    private static boolean advance(int[] digits, int from, int radix) {
        for (int i = digits.length - 1; i >= from; i--) {
            if (++digits[i] < radix) return true;
            digits[i] = 0;
        }
        return false;
    }
}
