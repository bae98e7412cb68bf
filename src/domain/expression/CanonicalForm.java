package domain.expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Derives the canonical key used to recognise duplicate solutions.
 *
 * <p>Two expressions that differ only by reordering top-level addends, or by
 * reordering the factors of a division-free product, map to the same key:
 * <pre>
 *   "3 + 2"        → "+2+3"
 *   "2 + 3"        → "+2+3"
 *   "(3 * 2) + 1"  → "+1+2*3"
 *   "1 + (2 * 3)"  → "+1+2*3"
 *   "8 - 5 + 1"    → "+1+8-5"
 * </pre>
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Remove all whitespace.</li>
 *   <li>Split at {@code +} / {@code -} outside parentheses into signed terms;
 *       the leading term is positive.</li>
 *   <li>Strip redundant outer parentheses from each term. If the term has no
 *       {@code /}, split it at top-level {@code *} and sort the factors.</li>
 *   <li>Sort positive and negative terms separately, then emit all positive
 *       terms followed by all negative terms, each with an explicit sign.</li>
 * </ol>
 *
 * <p>Terms containing division are kept verbatim. No numeric reasoning is done:
 * {@code 2 * 3} and {@code 6} have different keys.
 */
public final class CanonicalForm {

    private CanonicalForm() {
        // Prevent instantiation: static methods only
    }

    /**
     * Computes the canonical key of {@code expression}.
     *
     * @param expression a formatted expression
     * @return the canonical key
     */
    public static String of(String expression) {
        String compact = removeWhitespace(expression);

        List<String> positive = new ArrayList<>();
        List<String> negative = new ArrayList<>();

        StringBuilder current = new StringBuilder();
        char sign = '+';
        int depth = 0;
        for (int i = 0; i < compact.length(); i++) {
            char c = compact.charAt(i);
            if (c == '(') {
                depth++;
                current.append(c);
            } else if (c == ')') {
                depth--;
                current.append(c);
            } else if ((c == '+' || c == '-') && depth == 0 && current.length() > 0) {
                addTerm(sign, current.toString(), positive, negative);
                sign = c;
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            addTerm(sign, current.toString(), positive, negative);
        }

        Collections.sort(positive);
        Collections.sort(negative);

        StringBuilder key = new StringBuilder(compact.length() + positive.size() + negative.size());
        for (String term : positive) key.append('+').append(term);
        for (String term : negative) key.append('-').append(term);
        return key.toString();
    }

    /**
     * Normalises one multiplicative term: outer parentheses removed, factors
     * of a division-free product sorted.
     *
     * @param term a whitespace-free term
     * @return the normalised term
     */
    static String normaliseTerm(String term) {
        String stripped = stripOuterParentheses(term);
        if (stripped.indexOf('/') >= 0) {
            return stripped;
        }

        List<String> factors = splitTopLevel(stripped, '*');
        if (factors.size() < 2) {
            return stripped;
        }
        Collections.sort(factors);
        return String.join("*", factors);
    }

    private static void addTerm(char sign, String term, List<String> positive, List<String> negative) {
        String normalised = normaliseTerm(term);
        if (sign == '-') {
            negative.add(normalised);
        } else {
            positive.add(normalised);
        }
    }

    /**
     * Removes parentheses that enclose the whole term, repeatedly.
     * {@code ((2*3))} becomes {@code 2*3}; {@code (1+2)*(3+4)} is left alone.
     */
    static String stripOuterParentheses(String term) {
        String result = term;
        while (result.length() >= 2 && result.charAt(0) == '(' && result.charAt(result.length() - 1) == ')'
                && closingIndex(result) == result.length() - 1) {
            result = result.substring(1, result.length() - 1);
        }
        return result;
    }

    /** Index of the parenthesis closing the one at index 0, or -1 if unbalanced. */
    private static int closingIndex(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }

    private static List<String> splitTopLevel(String text, char separator) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') depth++;
            else if (c == ')') depth--;
            else if (c == separator && depth == 0) {
                parts.add(text.substring(start, i));
                start = i + 1;
            }
        }
        parts.add(text.substring(start));
        return parts;
    }

    private static String removeWhitespace(String expression) {
        StringBuilder sb = new StringBuilder(expression.length());
        for (int i = 0; i < expression.length(); i++) {
            char c = expression.charAt(i);
            if (!Character.isWhitespace(c)) sb.append(c);
        }
        return sb.toString();
    }
}
