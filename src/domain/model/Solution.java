package domain.model;

import domain.expression.CanonicalForm;
import domain.expression.ExpressionFormatter;
import infrastructure.util.IntegerSets;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A finished expression that evaluates exactly to the search target.
 *
 * <h3>Key Concepts</h3>
 * <ul>
 *   <li><b>Operator count</b>: number of binary operators; the primary ranking
 *       key (fewer is better).</li>
 *   <li><b>Distinct integers</b>: the set of pool integers the expression uses;
 *       the secondary ranking key (fewer is better).</li>
 *   <li><b>Canonical key</b>: see {@link CanonicalForm}; computed once at
 *       construction and used by the collector to reject duplicates.</li>
 * </ul>
 *
 * <h3>Example</h3>
 * <pre>
 *   expression    = "4 * 5 * 5"
 *   result        = 100
 *   integers used = [4, 5]
 *   operatorCount = 2
 *   canonicalKey  = "+4*5*5"
 * </pre>
 *
 * <h3>Comparison Semantics</h3>
 * <ul>
 *   <li><b>compareTo()</b>: operator count ascending, then distinct integer
 *       count ascending, then canonical key (a total order, so rankings are
 *       reproducible).</li>
 *   <li><b>equals()</b>: identity. Duplicate detection is done explicitly by
 *       the collector on {@link #canonicalKey}.</li>
 * </ul>
 *
 * <p>All fields are final and the integer set is never exposed mutably, so
 * instances are immutable.
 *
 * @see domain.collection.SolutionCollector
 */
public final class Solution implements Comparable<Solution> {

    /** The formatted expression. */
    public final String expression;

    /** The value of {@link #expression}; always the search target. */
    public final long result;

    /** Number of binary operators in {@link #expression}. */
    public final int operatorCount;

    /** Duplicate-detection key derived from {@link #expression}. */
    public final String canonicalKey;

    /** Sorted distinct pool integers used. Never mutated. */
    private final int[] integersUsed;

    private Solution(String expression, long result, int[] integersUsed, int operatorCount) {
        this.expression = expression;
        this.result = result;
        this.integersUsed = integersUsed;
        this.operatorCount = operatorCount;
        this.canonicalKey = CanonicalForm.of(expression);
    }

    /**
     * Creates a solution from a directly enumerated sequence.
     *
     * @param expression    the formatted expression
     * @param result        its value
     * @param numbers       the operands as enumerated (duplicates allowed)
     * @param operatorCount number of operators
     * @return the solution
     */
    public static Solution of(String expression, long result, int[] numbers, int operatorCount) {
        return new Solution(expression, result, IntegerSets.distinctSorted(numbers), operatorCount);
    }

    /**
     * Promotes a partial result that already equals the target.
     *
     * @param partial the partial result
     * @return the solution
     */
    public static Solution fromPartial(PartialResult partial) {
        return new Solution(partial.expression, partial.value, partial.integersUsedArray(),
            partial.operatorCount);
    }

    /**
     * Composes {@code left op right} whose value is the target.
     *
     * @param left   left operand
     * @param op     the joining operator
     * @param right  right operand
     * @param result the exact value of {@code left.value op right.value}
     * @return the solution
     */
    public static Solution compose(PartialResult left, Operator op, PartialResult right, long result) {
        return new Solution(
            ExpressionFormatter.compose(left.expression, op, right.expression),
            result,
            IntegerSets.union(left.integersUsedArray(), right.integersUsedArray()),
            left.operatorCount + right.operatorCount + 1);
    }

    public String getExpression() { return expression; }
    public long getResult() { return result; }
    public int getOperatorCount() { return operatorCount; }
    public String getCanonicalKey() { return canonicalKey; }

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

    public int getDistinctIntegerCount() {
        return integersUsed.length;
    }

    @Override
    public int compareTo(Solution other) {
        int opsCmp = Integer.compare(this.operatorCount, other.operatorCount);
        if (opsCmp != 0) return opsCmp;

        int distinctCmp = Integer.compare(this.integersUsed.length, other.integersUsed.length);
        if (distinctCmp != 0) return distinctCmp;

        return this.canonicalKey.compareTo(other.canonicalKey);
    }

    @Override
    public String toString() {
        return expression + " = " + result;
    }
}
