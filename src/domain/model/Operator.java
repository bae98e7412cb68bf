package domain.model;

/**
 * Binary arithmetic operators available to the expression search.
 *
 * <p>Each operator carries its rendered symbol and a precedence level used by
 * the formatter when deciding where parentheses are required:
 * <ul>
 *   <li>{@code 1}: {@link #ADD}, {@link #SUBTRACT}</li>
 *   <li>{@code 2}: {@link #MULTIPLY}, {@link #DIVIDE}</li>
 *   <li>{@code 3}: {@link #EXPONENTIATE}</li>
 * </ul>
 */
public enum Operator {
    ADD('+', 1, true),
    SUBTRACT('-', 1, false),
    MULTIPLY('*', 2, true),
    DIVIDE('/', 2, false),
    EXPONENTIATE('^', 3, false);

    /** Highest precedence level; assigned to atoms (plain numbers) by the formatter. */
    public static final int ATOM_PRECEDENCE = 4;

    private final char symbol;
    private final int precedence;
    private final boolean commutative;

    Operator(char symbol, int precedence, boolean commutative) {
        this.symbol = symbol;
        this.precedence = precedence;
        this.commutative = commutative;
    }

    public char getSymbol() { return symbol; }
    public int getPrecedence() { return precedence; }
    public boolean isCommutative() { return commutative; }

    /**
     * Returns {@code true} for the multiplicative level (multiply, divide).
     */
    public boolean isMultiplicative() {
        return precedence == 2;
    }

    /**
     * Returns {@code true} for the additive level (add, subtract).
     */
    public boolean isAdditive() {
        return precedence == 1;
    }

    /**
     * Looks up the operator rendered with {@code symbol}.
     *
     * <p>{@code 'x'} is accepted for multiply and {@code ':'} for divide as
     * command-line conveniences; {@code '^'} is the exponentiation symbol.
     *
     * @param symbol operator character
     * @return the matching operator
     * @throws IllegalArgumentException if no operator uses {@code symbol}
     */
    public static Operator fromSymbol(char symbol) {
        switch (symbol) {
            case '+': return ADD;
            case '-': return SUBTRACT;
            case '*':
            case 'x': return MULTIPLY;
            case '/':
            case ':': return DIVIDE;
            case '^': return EXPONENTIATE;
            default:
                throw new IllegalArgumentException("Unknown operator symbol: " + symbol);
        }
    }

    @Override
    public String toString() {
        return String.valueOf(symbol);
    }
}
