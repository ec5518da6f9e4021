package RTK.Elimination;

import RTK.Model.Label;
import RTK.Model.Transition;
import RTK.Nfa;

import java.util.function.ToIntFunction;

/**
 * Cost of eliminating a state next; the cheapest non-terminal state is ripped first.
 * @param <I> - symbol type
 */
@FunctionalInterface
public interface EliminationHeuristic<I> {

    long cost(int state, Nfa.Neighbourhood<I> neighbourhood);

    /**
     * Approximates label blow-up: (weight of incoming labels, self-loops excluded) x out-degree + (weight of outgoing
     * labels, self-loops excluded) x in-degree. Epsilon weighs 0.
     * @param weight - size of a symbol, e.g. its text or token length
     */
    static <I> EliminationHeuristic<I> labelWeight(ToIntFunction<? super I> weight) {
        return (state, neighbourhood) -> {
            long in = 0;
            for (Transition<I> t : neighbourhood.incoming()) {
                if (t.source() != state) {
                    in += weightOf(t.label(), weight);
                }
            }
            long out = 0;
            for (Transition<I> t : neighbourhood.outgoing()) {
                if (t.target() != state) {
                    out += weightOf(t.label(), weight);
                }
            }
            return in * neighbourhood.outgoing().size() + out * neighbourhood.incoming().size();
        };
    }

    /**
     * Rip states in ascending id order.
     */
    static <I> EliminationHeuristic<I> lowestState() {
        return (state, neighbourhood) -> state;
    }

    private static <I> int weightOf(Label<I> label, ToIntFunction<? super I> weight) {
        return label.isEpsilon() ? 0 : weight.applyAsInt(label.symbol());
    }
}
