package RTK;

import RTK.Model.Label;
import it.unimi.dsi.fastutil.ints.IntIntPair;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;

import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Graphviz DOT text for automata: left to right, an invisible entry node pointing at the start state, double circles
 * on final states and one edge per (source, target) pair.
 */
public final class DotFormat {

    private DotFormat() {}

    /**
     * Labels sorted by their text, epsilon shown as ε, joined by ','.
     */
    public static <I> String defaultEdgeLabel(Collection<Label<I>> labels) {
        return labels.stream()
            .map(Label::toString)
            .sorted(Comparator.naturalOrder())
            .collect(Collectors.joining(","));
    }

    public static <I> String toDot(Nfa<I> nfa) {
        return toDot(nfa, DotFormat::defaultEdgeLabel);
    }

    public static <I> String toDot(Nfa<I> nfa, Function<Collection<Label<I>>, String> edgeLabel) {
        return render(nfa.getStates(), IntSets.singleton(nfa.getFinalState()), nfa.getStartState(), nfa.edges(),
            edgeLabel);
    }

    public static <I> String toDot(Dfa<I> dfa) {
        return toDot(dfa, DotFormat::defaultEdgeLabel);
    }

    public static <I> String toDot(Dfa<I> dfa, Function<Collection<Label<I>>, String> edgeLabel) {
        return render(dfa.getStates(), dfa.getFinalStates(), dfa.getStartState(), dfa.edges(), edgeLabel);
    }

    private static <I> String render(IntSet states,
                                     IntSet finalStates,
                                     int startState,
                                     Map<IntIntPair, Set<Label<I>>> edges,
                                     Function<Collection<Label<I>>, String> edgeLabel) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph automaton {\n");
        sb.append("  rankdir=LR;\n");
        sb.append("  __start [shape=none, label=\"\", width=0, height=0];\n");
        for (int s : states) {
            sb.append("  ").append(s)
                .append(" [shape=").append(finalStates.contains(s) ? "doublecircle" : "circle").append("];\n");
        }
        sb.append("  __start -> ").append(startState).append(";\n");
        for (Map.Entry<IntIntPair, Set<Label<I>>> edge : edges.entrySet()) {
            sb.append("  ").append(edge.getKey().leftInt()).append(" -> ").append(edge.getKey().rightInt())
                .append(" [label=\"").append(quote(edgeLabel.apply(edge.getValue()))).append("\"];\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    private static String quote(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
