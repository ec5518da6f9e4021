package RTK.Elimination;

import RTK.Model.Expression;
import RTK.Model.Label;
import RTK.Model.Transition;
import RTK.Nfa;
import RTK.Parsing.StringAlgebra;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Converts automata to regular expressions by repeatedly ripping the cheapest intermediate state.
 */
public final class StateElimination {
    private static final Logger LOGGER = LoggerFactory.getLogger(StateElimination.class);

    private StateElimination() {}

    /**
     * Symbolic elimination with the default label-weight heuristic. The input is not modified.
     * @return postfix expression of the accepted language, or empty if the final state is unreachable
     */
    public static <I> Optional<Expression<I>> synthesize(Nfa<I> nfa) {
        return synthesize(nfa, EliminationHeuristic.labelWeight(Expression::size));
    }

    /**
     * Symbolic elimination with a custom heuristic. The input is not modified.
     * @param nfa - automaton to convert
     * @param heuristic - order in which intermediate states are ripped
     * @return postfix expression of the accepted language, or empty if the final state is unreachable
     */
    public static <I> Optional<Expression<I>> synthesize(Nfa<I> nfa, EliminationHeuristic<Expression<I>> heuristic) {
        Nfa<Expression<I>> symbolic = nfa.relabel(Expression::literal).isolateStartAndFinal();
        eliminate(symbolic, ExpressionCombiners.rip(), ExpressionCombiners.union(), heuristic);
        return startToFinal(symbolic).map(label -> label.isEpsilon() ? Expression.<I>empty() : label.symbol());
    }

    /**
     * Regex text of the language of an automaton over single-character string symbols.
     * @return regex text, empty string for the empty-string language, or empty if the final state is unreachable
     */
    public static Optional<String> toRegex(Nfa<String> nfa) {
        return synthesize(nfa).map(Expression::toString);
    }

    /**
     * Elimination on labels that are regex text, using {@link RegexCombiners}. Symbols are escaped first. The
     * input is not modified.
     * @return regex text, or empty if the final state is unreachable
     */
    public static Optional<String> toRegexText(Nfa<String> nfa) {
        Nfa<String> work = nfa.relabel(StringAlgebra::escape).isolateStartAndFinal();
        eliminate(work, RegexCombiners.rip(), RegexCombiners.union(), EliminationHeuristic.labelWeight(String::length));
        return startToFinal(work).map(label -> label.isEpsilon() ? "" : label.symbol());
    }

    /**
     * Rip intermediate states of nfa in place until only the start and final state remain, merging parallel edges
     * after every step. The start state should have no incoming and the final state no outgoing edges, see
     * {@link Nfa#isolateStartAndFinal()}.
     * @param nfa - automaton to reduce, modified
     * @param rip - combines the labels around a ripped state
     * @param union - merges parallel edges
     * @param heuristic - picks the next state to rip; ties go to the lowest state id
     * @return nfa
     */
    public static <I> Nfa<I> eliminate(Nfa<I> nfa,
                                       RipCombiner<I> rip,
                                       UnionCombiner<I> union,
                                       EliminationHeuristic<I> heuristic) {
        nfa.unionEdges(union);
        while (nfa.size() > 2) {
            int best = -1;
            long bestCost = Long.MAX_VALUE;
            for (int s : nfa.getStates()) {
                if (s == nfa.getStartState() || s == nfa.getFinalState()) {
                    continue;
                }
                long cost = heuristic.cost(s, nfa.inOutSets(s));
                if (best < 0 || cost < bestCost) {
                    best = s;
                    bestCost = cost;
                }
            }
            LOGGER.debug("Ripping state {} (cost {})", best, bestCost);
            nfa.rip(best, rip);
            nfa.unionEdges(union);
        }
        return nfa;
    }

    private static <I> Optional<Label<I>> startToFinal(Nfa<I> nfa) {
        for (Transition<I> t : nfa.transitions()) {
            if (t.source() == nfa.getStartState() && t.target() == nfa.getFinalState()) {
                return Optional.of(t.label());
            }
        }
        return Optional.empty();
    }
}
