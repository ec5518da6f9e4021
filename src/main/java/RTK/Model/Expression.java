package RTK.Model;

import RTK.Parsing.PostfixCompiler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable postfix expression over symbols of type I, used as a transition label during symbolic state
 * elimination. The empty expression denotes the empty string.
 * @param <I> - symbol type
 */
public final class Expression<I> {
    private final List<Token<I>> tokens;

    private Expression(List<Token<I>> tokens) {
        this.tokens = tokens;
    }

    public static <I> Expression<I> empty() {
        return new Expression<>(List.of());
    }

    public static <I> Expression<I> literal(I symbol) {
        return new Expression<>(List.of(Token.literal(symbol)));
    }

    public static <I> Expression<I> of(List<Token<I>> tokens) {
        return tokens.isEmpty() ? empty() : new Expression<>(Collections.unmodifiableList(new ArrayList<>(tokens)));
    }

    public List<Token<I>> tokens() {
        return tokens;
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    /**
     * @return operator at the root of the expression tree, null for a lone literal or the empty expression
     */
    public Operator topOperator() {
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1).operator();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof Expression<?> other && tokens.equals(other.tokens));
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    /**
     * @return the expression in regex syntax
     */
    @Override
    public String toString() {
        return PostfixCompiler.toRegexString(tokens);
    }
}
