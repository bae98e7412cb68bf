package domain.engine;

import domain.model.Operator;
import domain.model.PartialResult;
import domain.model.Solution;
import domain.model.SubexpressionTable;
import infrastructure.computation.ExactArithmetic;
import infrastructure.parallel.OperatorPassTask;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.ForkJoinPool;

import static application.OrchestratorConfiguration.MAX_EXPONENT;

/**
 * Matches two subexpression tables against the target: finds every pair
 * {@code (l, r)} with {@code l op r = target} for each enabled operator.
 *
 * <p>Instead of trying every pair, each pass iterates one table and computes the
 * value the other table must hold, then looks it up.
 *
 * <h3>Operator passes</h3>
 * <ul>
 *   <li><b>ADD</b>: {@code r = target - l}.</li>
 *   <li><b>MULTIPLY</b>: for non-zero {@code l} dividing the target, {@code r = target / l}.</li>
 *   <li><b>SUBTRACT</b>: both {@code l - r} and {@code r - l}.</li>
 *   <li><b>DIVIDE</b>: both {@code l / r} and {@code r / l}; never for a zero target.</li>
 *   <li><b>EXPONENTIATE</b>: both {@code l ^ r} and {@code r ^ l}, via exact integer
 *       roots for exponents up to {@value application.OrchestratorConfiguration#MAX_EXPONENT}.</li>
 * </ul>
 *
 * <p>Every candidate pair is re-evaluated with {@link ExactArithmetic} before it
 * becomes a solution, so a returned solution always equals the target.
 */
public final class SolutionCombiner {

    private final long target;
    private final Operator[] operators;
    /** {@code null} for sequential execution. */
    private final ForkJoinPool executor;

    public SolutionCombiner(long target, Operator[] operators, ForkJoinPool executor) {
        this.target = target;
        this.operators = operators.clone();
        this.executor = executor;
    }

    /**
     * Runs the pass of every enabled operator over the two tables.
     *
     * @param left  table of left operands
     * @param right table of right operands
     * @return solutions, grouped by operator in declaration order
     */
    public List<Solution> combine(SubexpressionTable left, SubexpressionTable right) {
        if (left.isEmpty() || right.isEmpty()) return new ArrayList<>();

        if (executor != null && operators.length > 1) {
            return executor.invoke(new OperatorPassTask(this, operators, left, right));
        }

        List<Solution> solutions = new ArrayList<>();
        for (Operator op : operators) {
            solutions.addAll(pass(op, left, right));
        }
        return solutions;
    }

    /**
     * Finds the pairs of one operator.
     *
     * @param op    the operator
     * @param left  table of left operands
     * @param right table of right operands
     * @return solutions of this operator
     */
    public List<Solution> pass(Operator op, SubexpressionTable left, SubexpressionTable right) {
        List<Solution> solutions = new ArrayList<>();
        switch (op) {
            case ADD:
                for (Map.Entry<Long, List<PartialResult>> l : left.entries()) {
                    OptionalLong need = ExactArithmetic.subtract(target, l.getKey());
                    if (need.isPresent()) {
                        emit(solutions, l.getValue(), Operator.ADD, right.get(need.getAsLong()));
                    }
                }
                break;

            case MULTIPLY:
                for (Map.Entry<Long, List<PartialResult>> l : left.entries()) {
                    long lv = l.getKey();
                    if (lv == 0 || target % lv != 0) continue;
                    OptionalLong need = ExactArithmetic.divide(target, lv);
                    if (need.isPresent()) {
                        emit(solutions, l.getValue(), Operator.MULTIPLY, right.get(need.getAsLong()));
                    }
                }
                break;

            case SUBTRACT:
                subtractPass(solutions, left, right);
                subtractPass(solutions, right, left);
                break;

            case DIVIDE:
                if (target == 0) break;
                dividePass(solutions, left, right);
                dividePass(solutions, right, left);
                break;

            case EXPONENTIATE:
                powerPass(solutions, left, right);
                powerPass(solutions, right, left);
                break;

            default:
                throw new IllegalArgumentException("Unsupported operator: " + op);
        }
        return solutions;
    }

    // =========================================================================
    // Directional passes
    // =========================================================================

    /** {@code a - b = target}, iterating {@code a}'s table. */
    private void subtractPass(List<Solution> out, SubexpressionTable minuends,
                              SubexpressionTable subtrahends) {
        for (Map.Entry<Long, List<PartialResult>> a : minuends.entries()) {
            OptionalLong need = ExactArithmetic.subtract(a.getKey(), target);
            if (need.isPresent()) {
                emit(out, a.getValue(), Operator.SUBTRACT, subtrahends.get(need.getAsLong()));
            }
        }
    }

    /** {@code a / b = target} with an exact quotient, iterating {@code a}'s table. */
    private void dividePass(List<Solution> out, SubexpressionTable dividends,
                            SubexpressionTable divisors) {
        for (Map.Entry<Long, List<PartialResult>> a : dividends.entries()) {
            long av = a.getKey();
            if (av % target != 0) continue;
            OptionalLong need = ExactArithmetic.divide(av, target);
            if (need.isPresent() && need.getAsLong() != 0) {
                emit(out, a.getValue(), Operator.DIVIDE, divisors.get(need.getAsLong()));
            }
        }
    }

    /** {@code base ^ e = target}, iterating the exponent table {@code exponents}. */
    private void powerPass(List<Solution> out, SubexpressionTable bases,
                           SubexpressionTable exponents) {
        for (Map.Entry<Long, List<PartialResult>> e : exponents.entries()) {
            long exponent = e.getKey();
            if (exponent == 0) {
                // x ^ 0 = 1 for every base
                if (target != 1) continue;
                for (Map.Entry<Long, List<PartialResult>> b : bases.entries()) {
                    emit(out, b.getValue(), Operator.EXPONENTIATE, e.getValue());
                }
                continue;
            }
            for (long base : candidateBases(exponent)) {
                emit(out, bases.get(base), Operator.EXPONENTIATE, e.getValue());
            }
        }
    }

    /**
     * Bases {@code b} for which {@code b ^ exponent} may equal the target.
     * Candidates are verified again when emitted.
     */
    private long[] candidateBases(long exponent) {
        if (exponent > MAX_EXPONENT) {
            // Only ±1 and 0 stay in range
            return new long[] {0, 1, -1};
        }
        if (exponent < 0) {
            return new long[] {1, -1};
        }
        OptionalLong root = ExactArithmetic.exactRoot(target, (int) exponent);
        if (root.isEmpty()) return new long[0];
        long r = root.getAsLong();
        if (exponent % 2 == 0 && r != 0 && r != Long.MIN_VALUE) {
            return new long[] {r, -r};
        }
        return new long[] {r};
    }

    // =========================================================================
    // Emission
    // =========================================================================

    /**
     * Emits {@code a op b} for every pair whose exact value is the target.
     */
    private void emit(List<Solution> out, List<PartialResult> as, Operator op, List<PartialResult> bs) {
        if (as.isEmpty() || bs.isEmpty()) return;
        for (PartialResult a : as) {
            for (PartialResult b : bs) {
                OptionalLong value = ExactArithmetic.apply(op, a.value, b.value);
                if (value.isPresent() && value.getAsLong() == target) {
                    out.add(Solution.compose(a, op, b, target));
                }
            }
        }
    }

    public long getTarget() {
        return target;
    }
}
