package infrastructure.computation;

import domain.model.Operator;

import java.util.OptionalLong;

/**
 * Overflow-checked 64-bit integer arithmetic for the expression search.
 *
 * <p>Every operation returns an {@link OptionalLong}: a present value when the
 * operation is defined over the integers and fits in a {@code long}, and
 * {@link OptionalLong#empty()} otherwise. An empty result is a normal outcome
 * of trying an operator assignment that the domain does not allow, so nothing
 * here throws.
 *
 * <h3>No-result cases</h3>
 * <ul>
 *   <li><b>Division</b> by zero, or a dividend that is not an exact multiple
 *       of the divisor.</li>
 *   <li><b>Exponentiation</b> with a negative exponent (unless the base is
 *       {@code 1} or {@code -1}, where the result is still an integer).</li>
 *   <li><b>Overflow</b> in any operation.</li>
 * </ul>
 *
 * <p>The overflow tests follow the same bit tricks as {@link Math#addExact},
 * {@link Math#subtractExact} and {@link Math#multiplyExact}, without raising
 * {@link ArithmeticException} on the hot path.
 */
public final class ExactArithmetic {

    private ExactArithmetic() {
        // Prevent instantiation: static methods only
    }

    /**
     * Applies {@code operator} to {@code left} and {@code right}.
     *
     * @param operator the binary operator
     * @param left     left operand
     * @param right    right operand
     * @return the exact result, or empty if undefined or overflowing
     */
    public static OptionalLong apply(Operator operator, long left, long right) {
        switch (operator) {
            case ADD:
                return add(left, right);
            case SUBTRACT:
                return subtract(left, right);
            case MULTIPLY:
                return multiply(left, right);
            case DIVIDE:
                return divide(left, right);
            case EXPONENTIATE:
                return power(left, right);
            default:
                throw new IllegalStateException("Unknown operator: " + operator);
        }
    }

    public static OptionalLong add(long left, long right) {
        long result = left + right;
        if (((left ^ result) & (right ^ result)) < 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(result);
    }

    public static OptionalLong subtract(long left, long right) {
        long result = left - right;
        if (((left ^ right) & (left ^ result)) < 0) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(result);
    }

    public static OptionalLong multiply(long left, long right) {
        long high = Math.multiplyHigh(left, right);
        long low = left * right;
        // The 128-bit product fits in 64 bits iff the high word is the sign extension of the low word
        if ((high == 0 && low >= 0) || (high == -1 && low < 0)) {
            return OptionalLong.of(low);
        }
        return OptionalLong.empty();
    }

    /**
     * Exact integer division.
     *
     * @param dividend numerator
     * @param divisor  denominator
     * @return the quotient, or empty when the divisor is zero, the division is
     *         not exact, or the quotient overflows ({@code Long.MIN_VALUE / -1})
     */
    public static OptionalLong divide(long dividend, long divisor) {
        if (divisor == 0 || dividend % divisor != 0) {
            return OptionalLong.empty();
        }
        if (dividend == Long.MIN_VALUE && divisor == -1) {
            return OptionalLong.empty();
        }
        return OptionalLong.of(dividend / divisor);
    }

    /**
     * Exact integer power by repeated squaring.
     *
     * <p>{@code 0 ^ 0} is defined as {@code 1}.
     *
     * @param base     the base
     * @param exponent the exponent
     * @return {@code base ^ exponent}, or empty for a non-integer or overflowing result
     */
    public static OptionalLong power(long base, long exponent) {
        if (exponent < 0) {
            if (base == 1) return OptionalLong.of(1);
            if (base == -1) return OptionalLong.of((exponent & 1) == 0 ? 1 : -1);
            return OptionalLong.empty();
        }
        if (base == 0) return OptionalLong.of(exponent == 0 ? 1 : 0);
        if (base == 1) return OptionalLong.of(1);
        if (base == -1) return OptionalLong.of((exponent & 1) == 0 ? 1 : -1);
        // |base| >= 2 overflows for any exponent >= 64
        if (exponent >= Long.SIZE) return OptionalLong.empty();

        long result = 1;
        long factor = base;
        long remaining = exponent;
        while (true) {
            if ((remaining & 1) != 0) {
                OptionalLong next = multiply(result, factor);
                if (next.isEmpty()) return OptionalLong.empty();
                result = next.getAsLong();
            }
            remaining >>= 1;
            if (remaining == 0) break;
            OptionalLong squared = multiply(factor, factor);
            if (squared.isEmpty()) return OptionalLong.empty();
            factor = squared.getAsLong();
        }
        return OptionalLong.of(result);
    }

    /**
     * Exact integer {@code degree}-th root of {@code value}.
     *
     * <p>Returns the non-negative root {@code r} with {@code r ^ degree == value}
     * when {@code value >= 0}; for negative values and odd degrees, the negative
     * root. Callers wanting both signs of an even-degree root negate the result
     * themselves.
     *
     * @param value  the radicand
     * @param degree the root degree, at least 1
     * @return the exact root, or empty when {@code value} is not a perfect power
     */
    public static OptionalLong exactRoot(long value, int degree) {
        if (degree < 1) {
            throw new IllegalArgumentException("degree must be positive, got: " + degree);
        }
        if (degree == 1) return OptionalLong.of(value);
        if (value == 0 || value == 1) return OptionalLong.of(value);
        if (value < 0 && (degree & 1) == 0) {
            return OptionalLong.empty();
        }

        // Negating as a double keeps Long.MIN_VALUE representable
        long magnitude = Math.round(Math.pow(Math.abs((double) value), 1.0 / degree));
        long estimate = value < 0 ? -magnitude : magnitude;
        // Floating-point estimate may be off by one in either direction
        for (long candidate = estimate - 1; candidate <= estimate + 1; candidate++) {
            if (value > 0 && candidate < 0) continue;
            OptionalLong check = power(candidate, degree);
            if (check.isPresent() && check.getAsLong() == value) {
                return OptionalLong.of(candidate);
            }
        }
        return OptionalLong.empty();
    }
}
