package RTK.Model;

import java.util.Objects;

/**
 * Transition label: either a symbol of the alphabet or epsilon (the empty-string transition).
 * Epsilon is never a member of an alphabet.
 * @param <I> - symbol type
 */
public final class Label<I> {
    public static final String EPSILON_DISPLAY = "ε";

    private final I symbol;

    private Label(I symbol) {
        this.symbol = symbol;
    }

    public static <I> Label<I> epsilon() {
        return new Label<>(null);
    }

    public static <I> Label<I> of(I symbol) {
        return new Label<>(Objects.requireNonNull(symbol, "symbol"));
    }

    public boolean isEpsilon() {
        return symbol == null;
    }

    /**
     * @return the symbol carried by this label
     * @throws IllegalStateException for epsilon
     */
    public I symbol() {
        if (symbol == null) {
            throw new IllegalStateException("Epsilon carries no symbol");
        }
        return symbol;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Label<?> other)) {
            return false;
        }
        return Objects.equals(symbol, other.symbol);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(symbol);
    }

    @Override
    public String toString() {
        return isEpsilon() ? EPSILON_DISPLAY : symbol.toString();
    }
}
