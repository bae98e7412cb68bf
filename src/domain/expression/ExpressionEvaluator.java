package domain.expression;

import domain.model.Operator;
import infrastructure.computation.ExactArithmetic;

import java.util.OptionalLong;

/**
 * Evaluates a flat, interleaved sequence of integers and operators under the
 * usual precedence rules, with exact integer semantics.
 *
 * <p>The sequence {@code n0 op0 n1 op1 ... n(k-1)} is reduced in three staged
 * passes. Each pass reads the previous stage and produces a fresh, shorter
 * stage; the caller's arrays are never modified.
 *
 * <ol>
 *   <li><b>Exponentiation</b>: folded left to right, so {@code 2 ^ 3 ^ 2}
 *       evaluates as {@code (2 ^ 3) ^ 2 = 64}. This left associativity is the
 *       documented behavior of the engine and the formatter renders chains
 *       accordingly.</li>
 *   <li><b>Multiplication / division</b>: folded left to right. A division
 *       that is not exact (or divides by zero) ends the evaluation with no
 *       result.</li>
 *   <li><b>Addition / subtraction</b>: folded left to right into the final
 *       value.</li>
 * </ol>
 *
 * <p>No-result outcomes are reported as {@link OptionalLong#empty()}; they are
 * expected during the search and never raised as exceptions.
 */
public final class ExpressionEvaluator {

    private ExpressionEvaluator() {
        // Prevent instantiation: static methods only
    }

    /**
     * Evaluates {@code numbers} interleaved with {@code operators}.
     *
     * @param numbers   the operands, in order
     * @param operators the operators between consecutive operands;
     *                  {@code operators.length == numbers.length - 1}
     * @return the exact value, or empty if any step is undefined or overflows;
     *         {@code 0} for an empty sequence
     * @throws IllegalArgumentException if the array lengths do not interleave
     */
    public static OptionalLong evaluate(long[] numbers, Operator[] operators) {
        if (numbers.length == 0) {
            if (operators.length != 0) {
                throw new IllegalArgumentException("Operators given without operands");
            }
            return OptionalLong.of(0);
        }
        if (operators.length != numbers.length - 1) {
            throw new IllegalArgumentException(
                "Expected " + (numbers.length - 1) + " operators, got: " + operators.length);
        }
        if (numbers.length == 1) {
            return OptionalLong.of(numbers[0]);
        }

        Stage powers = foldPass(new Stage(numbers, operators), Operator.EXPONENTIATE, null);
        if (powers == null) return OptionalLong.empty();

        Stage products = foldPass(powers, Operator.MULTIPLY, Operator.DIVIDE);
        if (products == null) return OptionalLong.empty();

        return sumPass(products);
    }

    /**
     * Folds every site of {@code first} or {@code second} into its left neighbour.
     *
     * @return the reduced stage, or {@code null} if an operation had no result
     */
    private static Stage foldPass(Stage stage, Operator first, Operator second) {
        int foldCount = 0;
        for (Operator op : stage.operators) {
            if (op == first || op == second) foldCount++;
        }
        if (foldCount == 0) return stage;

        long[] nextNumbers = new long[stage.numbers.length - foldCount];
        Operator[] nextOperators = new Operator[stage.operators.length - foldCount];

        int out = 0;
        long accumulator = stage.numbers[0];
        for (int i = 0; i < stage.operators.length; i++) {
            Operator op = stage.operators[i];
            long operand = stage.numbers[i + 1];
            if (op == first || op == second) {
                OptionalLong folded = ExactArithmetic.apply(op, accumulator, operand);
                if (folded.isEmpty()) return null;
                accumulator = folded.getAsLong();
            } else {
                nextNumbers[out] = accumulator;
                nextOperators[out] = op;
                out++;
                accumulator = operand;
            }
        }
        nextNumbers[out] = accumulator;
        return new Stage(nextNumbers, nextOperators);
    }

    private static OptionalLong sumPass(Stage stage) {
        long result = stage.numbers[0];
        for (int i = 0; i < stage.operators.length; i++) {
            OptionalLong next = ExactArithmetic.apply(stage.operators[i], result, stage.numbers[i + 1]);
            if (next.isEmpty()) return OptionalLong.empty();
            result = next.getAsLong();
        }
        return OptionalLong.of(result);
    }

    /** One immutable intermediate sequence between passes. */
    private static final class Stage {
        final long[] numbers;
        final Operator[] operators;

        Stage(long[] numbers, Operator[] operators) {
            this.numbers = numbers;
            this.operators = operators;
        }
    }
}
