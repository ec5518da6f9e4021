package RTK.Model;

/**
 * Fixed operator set of the regex grammar, with arity and shunting-yard precedence.
 * Precedence (low to high): grouping, alternation, concatenation, suffix quantifiers.
 */
public enum Operator {
    CONCATENATION(-1, 2, 2, false, false),
    ALTERNATION('|', 2, 1, false, true),
    STAR('*', 1, 3, true, false),
    PLUS('+', 1, 3, true, false),
    OPTIONAL('?', 1, 3, true, false),
    GROUP_OPEN('(', 0, 0, false, false),
    GROUP_CLOSE(')', 0, 0, false, false);

    /** Code point of the operator in regex text, -1 for the implicit concatenation. */
    public final int symbol;
    public final int numArgs;
    public final int precedence;
    /** Suffix operators apply to the operand immediately before them. */
    public final boolean suffix;
    public final boolean commutative;

    Operator(int symbol, int numArgs, int precedence, boolean suffix, boolean commutative) {
        this.symbol = symbol;
        this.numArgs = numArgs;
        this.precedence = precedence;
        this.suffix = suffix;
        this.commutative = commutative;
    }

    /**
     * @param codePoint - character of the regex text
     * @return operator spelled by the character, or null for a literal
     */
    public static Operator forSymbol(int codePoint) {
        return switch (codePoint) {
            case '|' -> ALTERNATION;
            case '*' -> STAR;
            case '+' -> PLUS;
            case '?' -> OPTIONAL;
            case '(' -> GROUP_OPEN;
            case ')' -> GROUP_CLOSE;
            default -> null;
        };
    }

    public boolean isQuantifier() {
        return this == STAR || this == PLUS || this == OPTIONAL;
    }

    /**
     * Collapses a quantifier applied directly to a quantified operand, e.g. (E*)* = E*, (E+)? = E*,
     * (E?)? = E?.
     * @param inner - top-level operator of the operand
     * @param outer - quantifier being applied
     * @return the single equivalent quantifier, or null if the pair does not collapse
     */
    public static Operator collapse(Operator inner, Operator outer) {
        if (inner == null || !inner.isQuantifier() || !outer.isQuantifier()) {
            return null;
        }
        return inner == outer ? outer : STAR;
    }

    public String text() {
        return symbol < 0 ? "" : new String(Character.toChars(symbol));
    }
}
