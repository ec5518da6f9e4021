package RTK.Model;

import net.automatalib.alphabet.Alphabet;
import net.automatalib.alphabet.impl.Alphabets;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * The set of distinguishable input symbols of an automaton. Iteration follows insertion order,
 * which keeps subset construction and minimization deterministic.
 * Epsilon is not a symbol; see {@link Label#epsilon()}.
 * @param <I> - symbol type
 */
public class SymbolAlphabet<I> implements Iterable<I> {
    private final Set<I> symbols;

    public SymbolAlphabet() {
        this.symbols = new LinkedHashSet<>();
    }

    public SymbolAlphabet(Collection<? extends I> symbols) {
        this();
        addAll(symbols);
    }

    public SymbolAlphabet<I> copy() {
        return new SymbolAlphabet<>(symbols);
    }

    public boolean add(I symbol) {
        return symbols.add(Objects.requireNonNull(symbol, "Epsilon/null cannot be part of an alphabet"));
    }

    public void addAll(Iterable<? extends I> other) {
        for (I sym : other) {
            add(sym);
        }
    }

    /**
     * Adds the symbol of a label, ignoring epsilon.
     * @return true if the alphabet grew
     */
    public boolean addLabel(Label<I> label) {
        return !label.isEpsilon() && add(label.symbol());
    }

    public boolean contains(Object symbol) {
        return symbols.contains(symbol);
    }

    public int size() {
        return symbols.size();
    }

    public boolean isEmpty() {
        return symbols.isEmpty();
    }

    public Set<I> asSet() {
        return Collections.unmodifiableSet(symbols);
    }

    /**
     * @return AutomataLib alphabet over the same symbols, indexed in iteration order.
     */
    public Alphabet<I> toAlphabet() {
        return Alphabets.fromCollection(symbols);
    }

    @Override
    public Iterator<I> iterator() {
        return Collections.unmodifiableSet(symbols).iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SymbolAlphabet<?> other && symbols.equals(other.symbols);
    }

    @Override
    public int hashCode() {
        return symbols.hashCode();
    }

    @Override
    public String toString() {
        return symbols.toString();
    }
}
