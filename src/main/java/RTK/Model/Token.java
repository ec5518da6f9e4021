package RTK.Model;

import java.util.Objects;

/**
 * Element of a postfix program: a literal symbol or an operator.
 * @param <I> - symbol type
 */
public record Token<I>(I symbol, Operator operator) {
    public Token {
        if ((symbol == null) == (operator == null)) {
            throw new IllegalArgumentException("A token is either a literal or an operator");
        }
    }

    public static <I> Token<I> literal(I symbol) {
        return new Token<>(Objects.requireNonNull(symbol, "symbol"), null);
    }

    public static <I> Token<I> operator(Operator operator) {
        return new Token<>(null, Objects.requireNonNull(operator, "operator"));
    }

    public boolean isOperator() {
        return operator != null;
    }

    @Override
    public String toString() {
        return isOperator() ? operator.name() : symbol.toString();
    }
}
