package RTK.Distance;

import RTK.Model.Transition;
import RTK.Nfa;

import java.util.List;

/**
 * Outcome of {@link WagnerCorrection#correct(Nfa, List)}.
 * @param automaton - the corrected automaton
 * @param distance - number of edits the input needed before correction
 * @param path - transitions of the aligned path that were added to the automaton
 * @param <I> - symbol type
 */
public record Correction<I>(Nfa<I> automaton, int distance, List<Transition<I>> path) { }
