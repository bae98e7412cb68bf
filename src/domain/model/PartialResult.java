package domain.model;

import domain.expression.ExpressionFormatter;
import infrastructure.util.IntegerSets;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An achievable intermediate value together with the expression that
 * produces it.
 *
 * <p>Partial results are the entries of a {@link SubexpressionTable}. They are
 * created while generating the table for one integer count and are dropped once
 * that count has been searched.
 *
 * <p>Instances are immutable: composing two partial results always creates a
 * new one. The set of distinct integers consumed is kept for ranking
 * solutions; it plays no role in correctness.
 */
public final class PartialResult {

    /** The value the expression evaluates to. */
    public final long value;

    /** The formatted expression. */
    public final String expression;

    /** Number of binary operators in {@link #expression}. */
    public final int operatorCount;

    /** Sorted distinct pool integers used by the expression. Never mutated. */
    private final int[] integersUsed;

    private PartialResult(long value, String expression, int[] integersUsed, int operatorCount) {
        this.value = value;
        this.expression = expression;
        this.integersUsed = integersUsed;
        this.operatorCount = operatorCount;
    }

    /**
     * Creates the single-number partial result {@code n}.
     *
     * @param number a pool integer
     * @return a partial result with operator count 0
     */
    public static PartialResult literal(int number) {
        return new PartialResult(number, Integer.toString(number), new int[] {number}, 0);
    }

    /**
     * Creates a partial result from a directly enumerated sequence.
     *
     * @param value         the evaluated value
     * @param expression    the formatted expression
     * @param numbers       the operands as enumerated (duplicates allowed)
     * @param operatorCount number of operators in the expression
     * @return the partial result
     */
    public static PartialResult of(long value, String expression, int[] numbers, int operatorCount) {
        return new PartialResult(value, expression, IntegerSets.distinctSorted(numbers), operatorCount);
    }

    /**
     * Composes {@code left op right} whose value has already been computed.
     *
     * @param left  left operand
     * @param op    the joining operator
     * @param right right operand
     * @param value the exact value of {@code left.value op right.value}
     * @return the composed partial result
     */
    public static PartialResult compose(PartialResult left, Operator op, PartialResult right, long value) {
        return new PartialResult(
            value,
            ExpressionFormatter.compose(left.expression, op, right.expression),
            IntegerSets.union(left.integersUsed, right.integersUsed),
            left.operatorCount + right.operatorCount + 1);
    }

    public long getValue() { return value; }
    public String getExpression() { return expression; }
    public int getOperatorCount() { return operatorCount; }

    /**
     * Returns the distinct integers used, ascending.
     *
     * @return an unmodifiable list
     */
    public List<Integer> getIntegersUsed() {
        List<Integer> list = new ArrayList<>(integersUsed.length);
        for (int n : integersUsed) list.add(n);
        return Collections.unmodifiableList(list);
    }

    /** Raw sorted array for {@link Solution}; callers in this package must not modify it. */
    int[] integersUsedArray() {
        return integersUsed;
    }

    @Override
    public String toString() {
        return expression + " = " + value;
    }
}
