package domain.expression;

import domain.model.Operator;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders expressions as human-readable strings whose conventional reading
 * (standard precedence, right-associative {@code ^}) gives the same value as
 * {@link ExpressionEvaluator}.
 *
 * <h3>Flat sequences</h3>
 * {@link #format(long[], Operator[])} renders {@code n0 op0 n1 ... } in three
 * layers, mirroring the evaluator's passes:
 * <ol>
 *   <li>Exponentiation chains. Because the evaluator folds {@code ^} left to
 *       right, a chain keeps its left part grouped: {@code (2 ^ 3) ^ 2}.</li>
 *   <li>Multiply/divide groups. When the expression also has additive
 *       operators, a group containing {@code *} or {@code /} is wrapped in
 *       parentheses: {@code (2 * 3) + 1}. A lone group is left bare:
 *       {@code 4 * 5 * 5}.</li>
 *   <li>Additive chains, rendered without parentheses.</li>
 * </ol>
 *
 * <h3>Composition</h3>
 * {@link #compose(String, Operator, String)} joins two already formatted
 * operands under a new operator, wrapping an operand only when its lowest
 * top-level operator would otherwise bind the wrong way.
 */
public final class ExpressionFormatter {

    private ExpressionFormatter() {
        // Prevent instantiation: static methods only
    }

    /**
     * Formats a flat operand/operator sequence.
     *
     * @param numbers   the operands, in order
     * @param operators the operators between consecutive operands
     * @return the rendered expression; empty string for an empty sequence
     * @throws IllegalArgumentException if the array lengths do not interleave
     */
    public static String format(long[] numbers, Operator[] operators) {
        if (numbers.length == 0) return "";
        if (operators.length != numbers.length - 1) {
            throw new IllegalArgumentException(
                "Expected " + (numbers.length - 1) + " operators, got: " + operators.length);
        }
        if (numbers.length == 1) return Long.toString(numbers[0]);

        // Layer 1: exponentiation chains become atoms
        List<String> atoms = new ArrayList<>();
        List<Operator> atomOperators = new ArrayList<>();
        String atom = Long.toString(numbers[0]);
        boolean chained = false;
        for (int i = 0; i < operators.length; i++) {
            String next = Long.toString(numbers[i + 1]);
            if (operators[i] == Operator.EXPONENTIATE) {
                atom = (chained ? "(" + atom + ")" : atom) + " ^ " + next;
                chained = true;
            } else {
                atoms.add(atom);
                atomOperators.add(operators[i]);
                atom = next;
                chained = false;
            }
        }
        atoms.add(atom);

        // Layer 2: multiply/divide groups
        List<String> groups = new ArrayList<>();
        List<Boolean> groupIsProduct = new ArrayList<>();
        List<Operator> additiveOperators = new ArrayList<>();
        StringBuilder group = new StringBuilder(atoms.get(0));
        boolean product = false;
        for (int i = 0; i < atomOperators.size(); i++) {
            Operator op = atomOperators.get(i);
            if (op.isMultiplicative()) {
                group.append(' ').append(op.getSymbol()).append(' ').append(atoms.get(i + 1));
                product = true;
            } else {
                groups.add(group.toString());
                groupIsProduct.add(product);
                additiveOperators.add(op);
                group = new StringBuilder(atoms.get(i + 1));
                product = false;
            }
        }
        groups.add(group.toString());
        groupIsProduct.add(product);

        if (groups.size() == 1) return groups.get(0);

        // Layer 3: additive chain
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < groups.size(); i++) {
            if (i > 0) {
                out.append(' ').append(additiveOperators.get(i - 1).getSymbol()).append(' ');
            }
            if (groupIsProduct.get(i)) {
                out.append('(').append(groups.get(i)).append(')');
            } else {
                out.append(groups.get(i));
            }
        }
        return out.toString();
    }

    /**
     * Composes {@code left op right}, parenthesizing operands as needed.
     *
     * <p>An operand is wrapped when its lowest top-level operator binds looser
     * than {@code op}, when it is the right operand of a non-commutative
     * operator at the same level ({@code 8 - (5 - 2)}), or, under
     * exponentiation, whenever it is not a plain number.
     *
     * @param left  formatted left operand
     * @param op    the joining operator
     * @param right formatted right operand
     * @return the composed expression
     */
    public static String compose(String left, Operator op, String right) {
        int leftPrecedence = topLevelPrecedence(left);
        int rightPrecedence = topLevelPrecedence(right);

        boolean wrapLeft;
        boolean wrapRight;
        if (op == Operator.EXPONENTIATE) {
            wrapLeft = leftPrecedence != Operator.ATOM_PRECEDENCE;
            wrapRight = rightPrecedence != Operator.ATOM_PRECEDENCE;
        } else {
            wrapLeft = leftPrecedence < op.getPrecedence();
            wrapRight = rightPrecedence < op.getPrecedence()
                || (!op.isCommutative() && rightPrecedence == op.getPrecedence());
        }

        return wrap(left, wrapLeft) + " " + op.getSymbol() + " " + wrap(right, wrapRight);
    }

    /**
     * Returns the precedence of the loosest-binding operator outside all
     * parentheses, or {@link Operator#ATOM_PRECEDENCE} if there is none.
     *
     * <p>Binary operators are recognised by the space that precedes them in
     * formatted text, so a leading sign is never mistaken for subtraction.
     *
     * @param expression a formatted expression
     * @return the top-level precedence
     */
    public static int topLevelPrecedence(String expression) {
        int lowest = Operator.ATOM_PRECEDENCE;
        int depth = 0;
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (depth == 0 && i > 0 && expression.charAt(i - 1) == ' ' && isOperatorSymbol(c)) {
                lowest = Math.min(lowest, Operator.fromSymbol(c).getPrecedence());
            }
        }
        return lowest;
    }

    private static boolean isOperatorSymbol(char c) {
        return c == '+' || c == '-' || c == '*' || c == '/' || c == '^';
    }

    private static String wrap(String expression, boolean needed) {
        return needed ? "(" + expression + ")" : expression;
    }
}
