package domain.engine;

import domain.expression.ExpressionFormatter;
import domain.model.Operator;
import domain.model.PartialResult;
import domain.model.SubexpressionTable;
import infrastructure.computation.ExactArithmetic;
import infrastructure.parallel.GenerationTask;

import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ForkJoinPool;

import static application.OrchestratorConfiguration.DIRECT_GENERATION_MAX_COUNT;

/**
 * Builds {@link SubexpressionTable}s: every value reachable with exactly
 * {@code count} pool integers, with the expressions that produce it.
 *
 * <h3>Generation by count</h3>
 * <ul>
 *   <li><b>count ≤ 0</b>: empty table.</li>
 *   <li><b>count = 1</b>: one literal per pool integer.</li>
 *   <li><b>count ≤ {@value application.OrchestratorConfiguration#DIRECT_GENERATION_MAX_COUNT}</b>:
 *       every flat assignment is evaluated, as in direct search.</li>
 *   <li><b>larger</b>: the tables of {@code count / 2} and {@code count - count / 2}
 *       are generated recursively and combined pairwise with every operator.</li>
 * </ul>
 *
 * <h3>Per-value cap</h3>
 * A capped table keeps at most {@code maxPerValue} expressions per value and
 * combination uses only the first expression of each value. An uncapped
 * ({@link SubexpressionTable#UNLIMITED}) table keeps everything and combines
 * every pair, which is what exhaustive mode relies on.
 */
public final class SubexpressionGenerator {

    private final int[] pool;
    private final Operator[] operators;
    private final int maxPerValue;
    /** {@code null} for sequential execution. */
    private final ForkJoinPool executor;

    /**
     * @param pool        available integers, ascending
     * @param operators   enabled operators
     * @param maxPerValue per-value cap, or {@link SubexpressionTable#UNLIMITED}
     * @param executor    pool for parallel generation, or {@code null} for sequential
     */
    public SubexpressionGenerator(int[] pool, Operator[] operators, int maxPerValue, ForkJoinPool executor) {
        if (maxPerValue < 0) {
            throw new IllegalArgumentException("maxPerValue must be non-negative, got: " + maxPerValue);
        }
        this.pool = pool.clone();
        this.operators = operators.clone();
        this.maxPerValue = maxPerValue;
        this.executor = executor;
    }

    /**
     * Generates the table of all values reachable with exactly {@code count} integers.
     *
     * @param count number of integers
     * @return the table, never {@code null}
     */
    public SubexpressionTable generate(int count) {
        if (executor != null && count > DIRECT_GENERATION_MAX_COUNT) {
            return executor.invoke(new GenerationTask(this, count));
        }
        return generateSequential(count);
    }

    /**
     * Generates on the calling thread.
     *
     * @param count number of integers
     * @return the table
     */
    public SubexpressionTable generateSequential(int count) {
        if (count > DIRECT_GENERATION_MAX_COUNT) {
            int leftCount = count / 2;
            return combineHalves(generateSequential(leftCount), generateSequential(count - leftCount));
        }
        return generateDirect(count);
    }

    /**
     * Builds the table of a small count by enumerating flat assignments.
     *
     * @param count number of integers, at most
     *              {@value application.OrchestratorConfiguration#DIRECT_GENERATION_MAX_COUNT}
     * @return the table
     */
    public SubexpressionTable generateDirect(int count) {
        SubexpressionTable table = new SubexpressionTable(maxPerValue);
        if (count <= 0) return table;

        if (count == 1) {
            for (int n : pool) table.add(PartialResult.literal(n));
            return table;
        }

        AssignmentEnumerator.enumerate(pool, operators, count, 0, pool.length,
            (integers, numbers, ops, value) -> {
                // Formatting dominates the cost, so check the cap first
                if (!table.accepts(value)) return;
                String expression = ExpressionFormatter.format(numbers, ops);
                table.add(PartialResult.of(value, expression, integers, ops.length));
            });
        return table;
    }

    /**
     * Combines every value of {@code left} with every value of {@code right}
     * under every enabled operator.
     *
     * @param left  table of the left operands
     * @param right table of the right operands
     * @return the combined table, with this generator's cap
     */
    public SubexpressionTable combineHalves(SubexpressionTable left, SubexpressionTable right) {
        SubexpressionTable table = new SubexpressionTable(maxPerValue);
        boolean capped = maxPerValue != SubexpressionTable.UNLIMITED;

        for (Map.Entry<Long, List<PartialResult>> leftEntry : left.entries()) {
            List<PartialResult> lefts = representatives(leftEntry.getValue(), capped);
            long leftValue = leftEntry.getKey();

            for (Map.Entry<Long, List<PartialResult>> rightEntry : right.entries()) {
                List<PartialResult> rights = representatives(rightEntry.getValue(), capped);
                long rightValue = rightEntry.getKey();

                for (Operator op : operators) {
                    OptionalLong result = ExactArithmetic.apply(op, leftValue, rightValue);
                    if (result.isEmpty()) continue;
                    long value = result.getAsLong();

                    pairs:
                    for (PartialResult l : lefts) {
                        for (PartialResult r : rights) {
                            if (!table.accepts(value)) break pairs;
                            table.add(PartialResult.compose(l, op, r, value));
                        }
                    }
                }
            }
        }
        return table;
    }

    private static List<PartialResult> representatives(List<PartialResult> partials, boolean capped) {
        return capped ? partials.subList(0, 1) : partials;
    }

    public int getMaxPerValue() {
        return maxPerValue;
    }
}
