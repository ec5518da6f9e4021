package RTK;

import RTK.Elimination.RipCombiner;
import RTK.Elimination.UnionCombiner;
import RTK.Model.Label;
import RTK.Model.SymbolAlphabet;
import RTK.Model.Transition;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntArrayFIFOQueue;
import it.unimi.dsi.fastutil.ints.IntIntImmutablePair;
import it.unimi.dsi.fastutil.ints.IntIntPair;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSets;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.MutableNFA;
import net.automatalib.automaton.fsa.impl.CompactNFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Nondeterministic automaton with epsilon transitions, one start state and one final state.
 * <p>
 * Transformations (concat, union, star, plus, opt, rip, unionEdges, renumberStates) mutate the receiver and return
 * it. Arguments are only read; their states are copied into fresh ids of the receiver.
 * @param <I> - symbol type
 */
public class Nfa<I> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Nfa.class);

    private final IntSortedSet states;
    private final SymbolAlphabet<I> alphabet;
    // source -> label -> destinations
    private Int2ObjectMap<Map<Label<I>, IntSet>> transitions;
    private int startState;
    private int finalState;
    private int nextState;

    private Nfa(SymbolAlphabet<I> alphabet) {
        this.states = new IntAVLTreeSet();
        this.alphabet = alphabet;
        this.transitions = new Int2ObjectLinkedOpenHashMap<>();
    }

    /**
     * Build an automaton from explicit components.
     * @param states - state ids, non-negative
     * @param alphabet - input symbols; symbols used by transitions are added as well
     * @param transitions - labelled edges between members of states
     * @param startState - start state, must be in states
     * @param finalState - final state, must be in states
     * @throws IllegalArgumentException if any component references a state outside of states
     */
    public Nfa(Collection<Integer> states,
               Collection<? extends I> alphabet,
               Collection<Transition<I>> transitions,
               int startState,
               int finalState) {
        this(new SymbolAlphabet<>(alphabet));
        for (int s : states) {
            if (s < 0) {
                throw new IllegalArgumentException("States must be non-negative: " + s);
            }
            this.states.add(s);
        }
        if (!this.states.contains(startState)) {
            throw new IllegalArgumentException("Start state must be in states");
        }
        if (!this.states.contains(finalState)) {
            throw new IllegalArgumentException("Final state must be in states");
        }
        this.startState = startState;
        this.finalState = finalState;
        this.nextState = Math.addExact(this.states.lastInt(), 1);
        for (Transition<I> t : transitions) {
            addTransition(t.source(), t.label(), t.target());
        }
    }

    /**
     * @return two-state automaton accepting exactly the one-symbol string
     */
    public static <I> Nfa<I> literal(I symbol) {
        Nfa<I> nfa = new Nfa<>(new SymbolAlphabet<>());
        nfa.startState = nfa.addState();
        nfa.finalState = nfa.addState();
        nfa.addTransition(nfa.startState, Label.of(symbol), nfa.finalState);
        return nfa;
    }

    /**
     * @return single-state automaton accepting only the empty string
     */
    public static <I> Nfa<I> emptyString() {
        Nfa<I> nfa = new Nfa<>(new SymbolAlphabet<>());
        nfa.startState = nfa.addState();
        nfa.finalState = nfa.startState;
        return nfa;
    }

    public Nfa<I> copy() {
        Nfa<I> out = new Nfa<>(alphabet.copy());
        out.states.addAll(states);
        for (Int2ObjectMap.Entry<Map<Label<I>, IntSet>> entry : transitions.int2ObjectEntrySet()) {
            Map<Label<I>, IntSet> labels = new LinkedHashMap<>();
            entry.getValue().forEach((label, dsts) -> labels.put(label, new IntLinkedOpenHashSet(dsts)));
            out.transitions.put(entry.getIntKey(), labels);
        }
        out.startState = startState;
        out.finalState = finalState;
        out.nextState = nextState;
        return out;
    }

    /**
     * Non-destructive concatenation.
     */
    public static <I> Nfa<I> concatenation(Nfa<I> first, Nfa<I> second) {
        return first.copy().concat(second);
    }

    /**
     * Non-destructive union.
     */
    public static <I> Nfa<I> alternation(Nfa<I> first, Nfa<I> second) {
        return first.copy().union(second);
    }

    /**
     * Allocate a fresh state id.
     * @throws ArithmeticException if state ids are exhausted
     */
    public int addState() {
        int state = nextState;
        nextState = Math.addExact(nextState, 1);
        states.add(state);
        return state;
    }

    public void addTransition(int source, Label<I> label, int target) {
        if (!states.contains(source) || !states.contains(target)) {
            throw new IllegalArgumentException("Transition " + source + " -" + label + "-> " + target
                + " references a state outside of the automaton");
        }
        alphabet.addLabel(label);
        mutableDestinations(transitions, source, label).add(target);
    }

    public void addTransition(int source, I symbol, int target) {
        addTransition(source, Label.of(symbol), target);
    }

    public void addEpsilon(int source, int target) {
        addTransition(source, Label.<I>epsilon(), target);
    }

    public IntSortedSet getStates() {
        return IntSortedSets.unmodifiable(states);
    }

    public int size() {
        return states.size();
    }

    public SymbolAlphabet<I> getAlphabet() {
        return alphabet;
    }

    public int getStartState() {
        return startState;
    }

    public int getFinalState() {
        return finalState;
    }

    /**
     * @return destinations of (source, label), empty if there are none
     */
    public IntSet getTransitions(int source, Label<I> label) {
        return IntSets.unmodifiable(destinations(source, label));
    }

    /**
     * @return every edge of the automaton, grouped by source
     */
    public List<Transition<I>> transitions() {
        List<Transition<I>> result = new ArrayList<>();
        for (Int2ObjectMap.Entry<Map<Label<I>, IntSet>> entry : transitions.int2ObjectEntrySet()) {
            int src = entry.getIntKey();
            for (Map.Entry<Label<I>, IntSet> edge : entry.getValue().entrySet()) {
                for (int dst : edge.getValue()) {
                    result.add(new Transition<>(src, edge.getKey(), dst));
                }
            }
        }
        return result;
    }

    /**
     * @return labels of all parallel edges, keyed by (source, target)
     */
    public Map<IntIntPair, Set<Label<I>>> edges() {
        Map<IntIntPair, Set<Label<I>>> edges = new LinkedHashMap<>();
        for (Transition<I> t : transitions()) {
            edges.computeIfAbsent(new IntIntImmutablePair(t.source(), t.target()), k -> new LinkedHashSet<>())
                .add(t.label());
        }
        return edges;
    }

    public Nfa<I> concat(Nfa<I> other) {
        if (other == this) {
            other = other.copy();
        }
        if (hasOutgoing(finalState) && other.hasIncoming(other.startState)) {
            // identifying the two states would let other's loops re-enter this automaton
            isolateFinal();
        }
        Int2IntMap remap = new Int2IntOpenHashMap();
        remap.put(other.startState, finalState);
        importStates(other, remap);
        finalState = remap.get(other.finalState);
        return this;
    }

    /**
     * Union by identifying the start states and the final states of both automata. Start states with incoming edges
     * and final states with outgoing edges are first moved behind fresh epsilon-linked states.
     */
    public Nfa<I> union(Nfa<I> other) {
        Nfa<I> isolated = other.copy().isolateStartAndFinal();
        isolateStartAndFinal();
        Int2IntMap remap = new Int2IntOpenHashMap();
        remap.put(isolated.startState, startState);
        remap.put(isolated.finalState, finalState);
        importStates(isolated, remap);
        return this;
    }

    public Nfa<I> star() {
        int start = addState();
        int fin = addState();
        addEpsilon(start, startState);
        addEpsilon(start, fin);
        addEpsilon(finalState, startState);
        addEpsilon(finalState, fin);
        startState = start;
        finalState = fin;
        return this;
    }

    public Nfa<I> plus() {
        int start = addState();
        int fin = addState();
        addEpsilon(start, startState);
        addEpsilon(finalState, startState);
        addEpsilon(finalState, fin);
        startState = start;
        finalState = fin;
        return this;
    }

    public Nfa<I> opt() {
        isolateStartAndFinal();
        addEpsilon(startState, finalState);
        return this;
    }

    /**
     * Ensure the start state has no incoming edges, the final state has no outgoing edges, and both differ. Adds at
     * most two epsilon-linked states; automata already in that shape are left untouched.
     */
    public Nfa<I> isolateStartAndFinal() {
        if (startState == finalState || hasIncoming(startState)) {
            int start = addState();
            addEpsilon(start, startState);
            startState = start;
        }
        if (hasOutgoing(finalState)) {
            isolateFinal();
        }
        return this;
    }

    private void isolateFinal() {
        int fin = addState();
        addEpsilon(finalState, fin);
        finalState = fin;
    }

    private void importStates(Nfa<I> other, Int2IntMap remap) {
        alphabet.addAll(other.alphabet);
        for (int s : other.states) {
            if (!remap.containsKey(s)) {
                remap.put(s, addState());
            }
        }
        for (Transition<I> t : other.transitions()) {
            addTransition(remap.get(t.source()), t.label(), remap.get(t.target()));
        }
    }

    public boolean hasIncoming(int state) {
        for (Map<Label<I>, IntSet> labels : transitions.values()) {
            for (IntSet dsts : labels.values()) {
                if (dsts.contains(state)) {
                    return true;
                }
            }
        }
        return false;
    }

    public boolean hasOutgoing(int state) {
        Map<Label<I>, IntSet> labels = transitions.get(state);
        return labels != null && !labels.isEmpty();
    }

    /**
     * States reachable from state using only epsilon edges.
     * @param state - origin
     * @param includeState - whether the origin itself is part of the result
     */
    public IntSet epsClosure(int state, boolean includeState) {
        IntSet closure = new IntLinkedOpenHashSet();
        if (includeState) {
            closure.add(state);
        }
        IntArrayFIFOQueue worklist = new IntArrayFIFOQueue();
        worklist.enqueue(state);
        while (!worklist.isEmpty()) {
            int curr = worklist.dequeueInt();
            for (int next : destinations(curr, Label.epsilon())) {
                if (closure.add(next)) {
                    worklist.enqueue(next);
                }
            }
        }
        return closure;
    }

    /**
     * States reachable from state by one sym edge, taken from the state or any member of its epsilon closure.
     * @param inclEps - whether to also add the epsilon closure of each destination
     * @return empty if sym is not part of the alphabet
     */
    public IntSet nextStates(int state, I sym, boolean inclEps) {
        IntSet result = new IntLinkedOpenHashSet();
        if (!alphabet.contains(sym)) {
            return result;
        }
        Label<I> label = Label.of(sym);
        for (int from : epsClosure(state, true)) {
            for (int next : destinations(from, label)) {
                if (result.add(next) && inclEps) {
                    result.addAll(epsClosure(next, false));
                }
            }
        }
        return result;
    }

    /**
     * Subset simulation over the set of active states.
     */
    public boolean accept(Iterable<? extends I> input) {
        IntSet active = epsClosure(startState, true);
        Int2ObjectMap<IntSet> closures = new Int2ObjectOpenHashMap<>();
        for (I sym : input) {
            if (!alphabet.contains(sym)) {
                return false;
            }
            Label<I> label = Label.of(sym);
            IntSet next = new IntOpenHashSet();
            for (int s : active) {
                for (int t : destinations(s, label)) {
                    if (next.add(t)) {
                        IntSet closure = closures.get(t);
                        if (closure == null) {
                            closure = epsClosure(t, false);
                            closures.put(t, closure);
                        }
                        next.addAll(closure);
                    }
                }
            }
            if (next.isEmpty()) {
                return false;
            }
            active = next;
        }
        return active.contains(finalState);
    }

    /**
     * Eliminate a state that is neither start nor final, replacing every path p -a-> state (-c-> state)* -b-> r by
     * an edge p -combiner(a, {c...}, b)-> r.
     * @throws IllegalArgumentException if state is the start or final state, or not part of the automaton
     */
    public Nfa<I> rip(int state, RipCombiner<I> combiner) {
        return rip(state, false, Objects.requireNonNull(combiner, "combiner")).orElseThrow();
    }

    /**
     * Eliminate a state that is neither start nor final.
     * @param state - state to eliminate
     * @param safe - if true, no labels are combined: each replacement edge keeps whichever of its two labels is not
     *             epsilon, and the call yields no result when that is impossible (two non-epsilon labels, or a
     *             non-epsilon self-loop on the state). The automaton is left unchanged in that case.
     * @param combiner - label combiner, ignored if safe
     * @return this automaton, or empty if a safe elimination is impossible
     * @throws IllegalArgumentException if state is the start or final state, or not part of the automaton
     */
    public Optional<Nfa<I>> rip(int state, boolean safe, RipCombiner<I> combiner) {
        if (state == startState || state == finalState) {
            throw new IllegalArgumentException("Cannot rip the start or final state");
        }
        if (!states.contains(state)) {
            throw new IllegalArgumentException("State " + state + " is not part of the automaton");
        }

        Map<Label<I>, IntSet> outgoing = new LinkedHashMap<>();
        Set<I> selfLoops = new LinkedHashSet<>();
        Map<Label<I>, IntSet> fromState = transitions.get(state);
        if (fromState != null) {
            for (Map.Entry<Label<I>, IntSet> entry : fromState.entrySet()) {
                IntSet others = new IntLinkedOpenHashSet(entry.getValue());
                if (others.remove(state) && !entry.getKey().isEpsilon()) {
                    selfLoops.add(entry.getKey().symbol());
                }
                if (!others.isEmpty()) {
                    outgoing.put(entry.getKey(), others);
                }
            }
        }
        Set<I> loops = Collections.unmodifiableSet(selfLoops);

        Int2ObjectMap<Map<Label<I>, IntSet>> rebuilt = new Int2ObjectLinkedOpenHashMap<>();
        List<Label<I>> newLabels = new ArrayList<>();
        for (Int2ObjectMap.Entry<Map<Label<I>, IntSet>> entry : transitions.int2ObjectEntrySet()) {
            int src = entry.getIntKey();
            if (src == state) {
                continue;
            }
            for (Map.Entry<Label<I>, IntSet> edge : entry.getValue().entrySet()) {
                Label<I> pre = edge.getKey();
                IntSet dsts = edge.getValue();
                if (dsts.contains(state)) {
                    for (Map.Entry<Label<I>, IntSet> out : outgoing.entrySet()) {
                        Label<I> post = out.getKey();
                        Label<I> combined;
                        if (safe) {
                            if (!loops.isEmpty() || (!pre.isEpsilon() && !post.isEpsilon())) {
                                return Optional.empty();
                            }
                            combined = pre.isEpsilon() ? post : pre;
                        } else {
                            combined = combiner.combine(pre, loops, post);
                            newLabels.add(combined);
                        }
                        mutableDestinations(rebuilt, src, combined).addAll(out.getValue());
                    }
                }
                for (int dst : dsts) {
                    if (dst != state) {
                        mutableDestinations(rebuilt, src, pre).add(dst);
                    }
                }
            }
        }

        states.remove(state);
        transitions = rebuilt;
        newLabels.forEach(alphabet::addLabel);
        LOGGER.debug("Ripped state {}: {} states left", state, states.size());
        return Optional.of(this);
    }

    /**
     * Merge all parallel edges between each ordered pair of states into a single edge.
     */
    public Nfa<I> unionEdges(UnionCombiner<I> combiner) {
        Int2ObjectMap<Map<Label<I>, IntSet>> rebuilt = new Int2ObjectLinkedOpenHashMap<>();
        for (Map.Entry<IntIntPair, Set<Label<I>>> edge : edges().entrySet()) {
            Label<I> label = combiner.combine(Collections.unmodifiableSet(edge.getValue()));
            alphabet.addLabel(label);
            mutableDestinations(rebuilt, edge.getKey().leftInt(), label).add(edge.getKey().rightInt());
        }
        transitions = rebuilt;
        return this;
    }

    /**
     * Renumber states to 0..size()-1, keeping their relative order.
     */
    public Nfa<I> renumberStates() {
        if (states.isEmpty() || states.lastInt() == states.size() - 1) {
            return this;
        }
        Int2IntMap stateMap = new Int2IntOpenHashMap();
        int index = 0;
        for (int s : states) {
            stateMap.put(s, index++);
        }
        List<Transition<I>> edges = transitions();
        states.clear();
        transitions = new Int2ObjectLinkedOpenHashMap<>();
        for (int s = 0; s < index; s++) {
            states.add(s);
        }
        for (Transition<I> t : edges) {
            mutableDestinations(transitions, stateMap.get(t.source()), t.label()).add(stateMap.get(t.target()));
        }
        startState = stateMap.get(startState);
        finalState = stateMap.get(finalState);
        nextState = index;
        return this;
    }

    /**
     * @return number of edges entering plus number of edges leaving state (a self-loop counts twice)
     */
    public int degree(int state) {
        Neighbourhood<I> neighbourhood = inOutSets(state);
        return neighbourhood.incoming().size() + neighbourhood.outgoing().size();
    }

    /**
     * Edges entering and edges leaving a state. Self-loops appear in both lists.
     */
    public Neighbourhood<I> inOutSets(int state) {
        List<Transition<I>> incoming = new ArrayList<>();
        List<Transition<I>> outgoing = new ArrayList<>();
        for (Transition<I> t : transitions()) {
            if (t.target() == state) {
                incoming.add(t);
            }
            if (t.source() == state) {
                outgoing.add(t);
            }
        }
        return new Neighbourhood<>(incoming, outgoing);
    }

    /**
     * Subset construction. DFA state 0 is the epsilon closure of the start state; a DFA state is final iff its
     * subset contains the final state.
     * @param complete - if true, the empty subset becomes an explicit absorbing reject state; otherwise transitions
     *                 into it are omitted
     */
    public Dfa<I> toDfa(boolean complete) {
        Dfa<I> out = new Dfa<>(alphabet.copy());
        Int2ObjectMap<BitSet> closures = new Int2ObjectOpenHashMap<>();
        Object2IntMap<BitSet> outStateMap = new Object2IntOpenHashMap<>();
        outStateMap.defaultReturnValue(Dfa.MISSING_STATE);
        Deque<DeterminizeRecord> stack = new ArrayDeque<>();

        BitSet init = closureBits(startState, closures);
        int initOut = out.addState(init.get(finalState));
        out.setStartState(initOut);
        outStateMap.put(init, initOut);
        stack.push(new DeterminizeRecord(init, initOut));

        while (!stack.isEmpty()) {
            DeterminizeRecord curr = stack.pop();
            BitSet inState = curr.inputState();
            int outState = curr.outputState();

            if (inState.isEmpty()) {
                for (I sym : alphabet) {
                    out.setTransition(outState, sym, outState);
                }
                continue;
            }

            for (I sym : alphabet) {
                Label<I> label = Label.of(sym);
                BitSet succ = new BitSet();
                for (int s = inState.nextSetBit(0); s >= 0; s = inState.nextSetBit(s + 1)) {
                    for (int t : destinations(s, label)) {
                        succ.or(closureBits(t, closures));
                    }
                }
                if (!complete && succ.isEmpty()) {
                    continue;
                }
                int outSucc = outStateMap.getInt(succ);
                if (outSucc == Dfa.MISSING_STATE) {
                    // add new state to DFA and to stack
                    outSucc = out.addState(succ.get(finalState));
                    outStateMap.put(succ, outSucc);
                    stack.push(new DeterminizeRecord(succ, outSucc));
                }
                out.setTransition(outState, sym, outSucc);
            }
        }
        LOGGER.debug("Subset construction: {} NFA states -> {} DFA states", states.size(), out.size());
        return out;
    }

    private BitSet closureBits(int state, Int2ObjectMap<BitSet> closures) {
        BitSet closure = closures.get(state);
        if (closure == null) {
            closure = new BitSet();
            for (int s : epsClosure(state, true)) {
                closure.set(s);
            }
            closures.put(state, closure);
        }
        return closure;
    }

    /**
     * Epsilon-free AutomataLib view of this automaton: initial states are the epsilon closure of the start state,
     * accepting states are those whose closure contains the final state.
     */
    public CompactNFA<I> toCompactNFA() {
        final Alphabet<I> inputs = alphabet.toAlphabet();
        final CompactNFA<I> out = new CompactNFA<>(inputs, states.size());
        final MutableNFA<Integer, I> view = out;
        Map<Integer, Integer> ids = new HashMap<>();
        for (int s : states) {
            ids.put(s, view.addState(epsClosure(s, true).contains(finalState)));
        }
        for (int s : epsClosure(startState, true)) {
            view.setInitial(ids.get(s), true);
        }
        for (int s : states) {
            for (I sym : inputs) {
                for (int t : nextStates(s, sym, true)) {
                    view.addTransition(ids.get(s), sym, ids.get(t));
                }
            }
        }
        return out;
    }

    /**
     * @return a new automaton with the same shape whose symbols are mapped by relabel
     */
    public <J> Nfa<J> relabel(Function<? super I, ? extends J> relabel) {
        SymbolAlphabet<J> mapped = new SymbolAlphabet<>();
        for (I sym : alphabet) {
            mapped.add(relabel.apply(sym));
        }
        Nfa<J> out = new Nfa<>(mapped);
        out.states.addAll(states);
        out.startState = startState;
        out.finalState = finalState;
        out.nextState = nextState;
        for (Transition<I> t : transitions()) {
            Label<J> label = t.label().isEpsilon() ? Label.epsilon() : Label.of(relabel.apply(t.label().symbol()));
            out.addTransition(t.source(), label, t.target());
        }
        return out;
    }

    private IntSet destinations(int source, Label<I> label) {
        Map<Label<I>, IntSet> labels = transitions.get(source);
        if (labels == null) {
            return IntSets.EMPTY_SET;
        }
        IntSet dsts = labels.get(label);
        return dsts == null ? IntSets.EMPTY_SET : dsts;
    }

    private static <I> IntSet mutableDestinations(Int2ObjectMap<Map<Label<I>, IntSet>> transitions,
                                                  int source,
                                                  Label<I> label) {
        Map<Label<I>, IntSet> labels = transitions.get(source);
        if (labels == null) {
            labels = new LinkedHashMap<>();
            transitions.put(source, labels);
        }
        return labels.computeIfAbsent(label, k -> new IntLinkedOpenHashSet());
    }

    @Override
    public String toString() {
        return "NFA[states=" + states + ", alphabet=" + alphabet + ", start=" + startState + ", final=" + finalState
            + ", transitions=" + transitions() + "]";
    }

    /**
     * Edges incident to one state.
     */
    public record Neighbourhood<I>(List<Transition<I>> incoming, List<Transition<I>> outgoing) { }

    private record DeterminizeRecord(BitSet inputState, int outputState) { }
}
