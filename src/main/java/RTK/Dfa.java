package RTK;

import RTK.Model.Label;
import RTK.Model.SymbolAlphabet;
import RTK.Model.Transition;
import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectLinkedOpenHashMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.IntAVLTreeSet;
import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntIntImmutablePair;
import it.unimi.dsi.fastutil.ints.IntIntPair;
import it.unimi.dsi.fastutil.ints.IntLinkedOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import it.unimi.dsi.fastutil.ints.IntSortedSet;
import it.unimi.dsi.fastutil.ints.IntSortedSets;
import it.unimi.dsi.fastutil.objects.Object2IntLinkedOpenHashMap;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.DFA;
import net.automatalib.automaton.fsa.MutableDFA;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic automaton with a partial transition function; a missing transition rejects.
 * Transformations mutate the receiver and return it.
 * @param <I> - symbol type
 */
public class Dfa<I> {
    private static final Logger LOGGER = LoggerFactory.getLogger(Dfa.class);

    /** Returned by {@link #getTransition(int, Object)} when no transition is defined. */
    public static final int MISSING_STATE = -1;

    private final IntSortedSet states;
    private final SymbolAlphabet<I> alphabet;
    private Int2ObjectMap<Object2IntMap<I>> transitions;
    private int startState;
    private IntSortedSet finalStates;
    private int nextState;

    Dfa(SymbolAlphabet<I> alphabet) {
        this.states = new IntAVLTreeSet();
        this.alphabet = alphabet;
        this.transitions = new Int2ObjectLinkedOpenHashMap<>();
        this.finalStates = new IntAVLTreeSet();
    }

    /**
     * Build a DFA from explicit components.
     * @throws IllegalArgumentException if the start state or a final state is not in states, if a transition
     *         references an unknown state or is labelled epsilon, or if two transitions share source and symbol
     *         but not target
     */
    public Dfa(Collection<Integer> states,
               Collection<? extends I> alphabet,
               Collection<Transition<I>> transitions,
               int startState,
               Collection<Integer> finalStates) {
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
        for (int f : finalStates) {
            if (!this.states.contains(f)) {
                throw new IllegalArgumentException("All final states must be in states");
            }
            this.finalStates.add(f);
        }
        this.startState = startState;
        this.nextState = Math.addExact(this.states.lastInt(), 1);
        for (Transition<I> t : transitions) {
            if (t.label().isEpsilon()) {
                throw new IllegalArgumentException("A DFA has no epsilon transitions: " + t);
            }
            int existing = getTransition(t.source(), t.label().symbol());
            if (existing != MISSING_STATE && existing != t.target()) {
                throw new IllegalArgumentException("Nondeterministic transitions from state " + t.source()
                    + " on " + t.label());
            }
            setTransition(t.source(), t.label().symbol(), t.target());
        }
    }

    /**
     * Import any AutomataLib DFA, restricted to the given inputs.
     */
    public static <S, I> Dfa<I> fromDFA(DFA<S, I> dfa, Collection<? extends I> inputs) {
        final S init = dfa.getInitialState();
        if (init == null) {
            throw new IllegalArgumentException("DFA has no initial state");
        }
        Dfa<I> out = new Dfa<>(new SymbolAlphabet<>(inputs));
        Map<S, Integer> ids = new HashMap<>();
        for (S s : dfa.getStates()) {
            ids.put(s, out.addState(dfa.isAccepting(s)));
        }
        out.setStartState(ids.get(init));
        for (S s : dfa.getStates()) {
            for (I i : inputs) {
                S succ = dfa.getSuccessor(s, i);
                if (succ != null) {
                    out.setTransition(ids.get(s), i, ids.get(succ));
                }
            }
        }
        return out;
    }

    public int addState(boolean accepting) {
        int state = nextState;
        nextState = Math.addExact(nextState, 1);
        states.add(state);
        if (accepting) {
            finalStates.add(state);
        }
        return state;
    }

    public void setStartState(int state) {
        if (!states.contains(state)) {
            throw new IllegalArgumentException("Start state must be in states");
        }
        this.startState = state;
    }

    /**
     * Define or replace the transition of (source, symbol). The symbol joins the alphabet if needed.
     */
    public void setTransition(int source, I symbol, int target) {
        if (!states.contains(source) || !states.contains(target)) {
            throw new IllegalArgumentException("Transition " + source + " -" + symbol + "-> " + target
                + " references a state outside of the automaton");
        }
        alphabet.add(symbol);
        Object2IntMap<I> row = transitions.get(source);
        if (row == null) {
            row = new Object2IntLinkedOpenHashMap<>();
            row.defaultReturnValue(MISSING_STATE);
            transitions.put(source, row);
        }
        row.put(symbol, target);
    }

    /**
     * @return successor of (source, symbol), or {@link #MISSING_STATE}
     */
    public int getTransition(int source, I symbol) {
        Object2IntMap<I> row = transitions.get(source);
        return row == null ? MISSING_STATE : row.getInt(symbol);
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

    public IntSortedSet getFinalStates() {
        return IntSortedSets.unmodifiable(finalStates);
    }

    public boolean isFinal(int state) {
        return finalStates.contains(state);
    }

    public List<Transition<I>> transitions() {
        List<Transition<I>> result = new ArrayList<>();
        for (Int2ObjectMap.Entry<Object2IntMap<I>> entry : transitions.int2ObjectEntrySet()) {
            for (Object2IntMap.Entry<I> t : entry.getValue().object2IntEntrySet()) {
                result.add(Transition.of(entry.getIntKey(), t.getKey(), t.getIntValue()));
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

    /**
     * @return true if every state has a transition on every symbol
     */
    public boolean isComplete() {
        for (int s : states) {
            for (I sym : alphabet) {
                if (getTransition(s, sym) == MISSING_STATE) {
                    return false;
                }
            }
        }
        return true;
    }

    /**
     * Route every missing transition to one fresh non-accepting state. Complete automata are left untouched.
     */
    public Dfa<I> complete() {
        if (isComplete()) {
            return this;
        }
        final int sink = addState(false);
        for (int s : states) {
            for (I sym : alphabet) {
                if (getTransition(s, sym) == MISSING_STATE) {
                    setTransition(s, sym, sink);
                }
            }
        }
        return this;
    }

    public boolean accept(Iterable<? extends I> input) {
        int current = startState;
        for (I sym : input) {
            current = getTransition(current, sym);
            if (current == MISSING_STATE) {
                return false;
            }
        }
        return finalStates.contains(current);
    }

    /**
     * Partition refinement over the reachable states that can still reach a final state. States that cannot are
     * dropped together with the transitions into them, so they merge with the implicit reject state.
     * If no final state is reachable, the result is a single non-accepting state without transitions.
     * <p>
     * Splitters are processed from a worklist. Splitting a block keeps the smaller half in place and appends the
     * larger one; if the block was waiting as a splitter both halves wait, otherwise only the smaller one.
     */
    public Dfa<I> minimize() {
        final int before = states.size();
        final IntSet reachable = reachableStates();
        final IntSet live = coaccessibleStates(reachable);

        IntArrayList reachableFinals = new IntArrayList();
        IntArrayList reachableStates = new IntArrayList();
        for (int s : reachable) {
            if (finalStates.contains(s)) {
                reachableFinals.add(s);
            } else if (live.contains(s)) {
                reachableStates.add(s);
            }
        }

        if (reachableFinals.isEmpty()) {
            states.clear();
            states.add(0);
            transitions = new Int2ObjectLinkedOpenHashMap<>();
            startState = 0;
            finalStates = new IntAVLTreeSet();
            nextState = 1;
            LOGGER.debug("Minimized DFA: {} -> 1 states (empty language)", before);
            return this;
        }

        List<IntArrayList> partitions = new ArrayList<>();
        partitions.add(reachableFinals);
        if (!reachableStates.isEmpty()) {
            partitions.add(reachableStates);
        }
        BitSet finalPartitions = new BitSet();
        finalPartitions.set(0);

        IntArrayList worklist = new IntArrayList();
        BitSet inWorklist = new BitSet();
        for (int i = 0; i < partitions.size(); i++) {
            worklist.push(i);
            inWorklist.set(i);
        }

        while (!worklist.isEmpty()) {
            int splitterIndex = worklist.popInt();
            inWorklist.clear(splitterIndex);
            final IntSet splitter = new IntOpenHashSet(partitions.get(splitterIndex));

            for (I sym : alphabet) {
                final int count = partitions.size();
                for (int index = 0; index < count; index++) {
                    IntArrayList part = partitions.get(index);
                    IntArrayList toSplitter = new IntArrayList();
                    IntArrayList notToSplitter = new IntArrayList();
                    for (int s : part) {
                        int dst = getTransition(s, sym);
                        if (dst != MISSING_STATE && splitter.contains(dst)) {
                            toSplitter.add(s);
                        } else {
                            notToSplitter.add(s);
                        }
                    }
                    if (toSplitter.isEmpty() || notToSplitter.isEmpty()) {
                        continue;
                    }
                    boolean toSmaller = toSplitter.size() <= notToSplitter.size();
                    IntArrayList smaller = toSmaller ? toSplitter : notToSplitter;
                    IntArrayList larger = toSmaller ? notToSplitter : toSplitter;
                    partitions.set(index, smaller);
                    partitions.add(larger);
                    int added = partitions.size() - 1;
                    if (finalPartitions.get(index)) {
                        finalPartitions.set(added);
                    }
                    if (inWorklist.get(index)) {
                        worklist.push(added);
                        inWorklist.set(added);
                    } else {
                        worklist.push(index);
                        inWorklist.set(index);
                    }
                }
            }
        }

        Int2IntMap stateMap = new Int2IntOpenHashMap();
        for (int index = 0; index < partitions.size(); index++) {
            for (int s : partitions.get(index)) {
                stateMap.put(s, index);
            }
        }
        Int2ObjectMap<Object2IntMap<I>> oldTransitions = transitions;
        int oldStart = startState;
        transitions = new Int2ObjectLinkedOpenHashMap<>();
        states.clear();
        for (int index = 0; index < partitions.size(); index++) {
            states.add(index);
        }
        // every member of a partition agrees, so the first one represents it
        for (int index = 0; index < partitions.size(); index++) {
            Object2IntMap<I> row = oldTransitions.get(partitions.get(index).getInt(0));
            if (row == null) {
                continue;
            }
            for (Object2IntMap.Entry<I> t : row.object2IntEntrySet()) {
                if (stateMap.containsKey(t.getIntValue())) {
                    setTransition(index, t.getKey(), stateMap.get(t.getIntValue()));
                }
            }
        }
        startState = stateMap.get(oldStart);
        finalStates = new IntAVLTreeSet();
        for (int f = finalPartitions.nextSetBit(0); f >= 0; f = finalPartitions.nextSetBit(f + 1)) {
            finalStates.add(f);
        }
        nextState = partitions.size();
        LOGGER.debug("Minimized DFA: {} -> {} states", before, states.size());
        return this;
    }

    private IntSet reachableStates() {
        IntSet reachable = new IntLinkedOpenHashSet();
        reachable.add(startState);
        IntArrayList worklist = IntArrayList.of(startState);
        while (!worklist.isEmpty()) {
            int curr = worklist.popInt();
            Object2IntMap<I> row = transitions.get(curr);
            if (row == null) {
                continue;
            }
            for (int dst : row.values()) {
                if (reachable.add(dst)) {
                    worklist.push(dst);
                }
            }
        }
        return reachable;
    }

    private IntSet coaccessibleStates(IntSet within) {
        Int2ObjectMap<IntArrayList> predecessors = new Int2ObjectLinkedOpenHashMap<>();
        for (int s : within) {
            Object2IntMap<I> row = transitions.get(s);
            if (row == null) {
                continue;
            }
            for (int dst : row.values()) {
                IntArrayList preds = predecessors.get(dst);
                if (preds == null) {
                    preds = new IntArrayList();
                    predecessors.put(dst, preds);
                }
                preds.add(s);
            }
        }
        IntSet live = new IntOpenHashSet();
        IntArrayList worklist = new IntArrayList();
        for (int s : within) {
            if (finalStates.contains(s)) {
                live.add(s);
                worklist.push(s);
            }
        }
        while (!worklist.isEmpty()) {
            IntArrayList preds = predecessors.get(worklist.popInt());
            if (preds == null) {
                continue;
            }
            for (int p : preds) {
                if (live.add(p)) {
                    worklist.push(p);
                }
            }
        }
        return live;
    }

    /**
     * Lift into an NFA with one fresh final state, epsilon-linked from every final state of this DFA.
     */
    public Nfa<I> toNfa() {
        final int fin = nextState;
        List<Integer> nfaStates = new ArrayList<>(states);
        nfaStates.add(fin);
        List<Transition<I>> nfaTransitions = transitions();
        for (int f : finalStates) {
            nfaTransitions.add(Transition.epsilon(f, fin));
        }
        return new Nfa<>(nfaStates, alphabet.asSet(), nfaTransitions, startState, fin);
    }

    /**
     * @return the same automaton as an AutomataLib CompactDFA (state ids are reassigned, initial state first)
     */
    public CompactDFA<I> toCompactDFA() {
        final Alphabet<I> inputs = alphabet.toAlphabet();
        final CompactDFA<I> out = new CompactDFA<>(inputs);
        final MutableDFA<Integer, I> view = out;
        Map<Integer, Integer> ids = new HashMap<>();
        ids.put(startState, view.addInitialState(finalStates.contains(startState)));
        for (int s : states) {
            if (s != startState) {
                ids.put(s, view.addState(finalStates.contains(s)));
            }
        }
        for (Transition<I> t : transitions()) {
            view.setTransition(ids.get(t.source()), t.label().symbol(), ids.get(t.target()));
        }
        return out;
    }

    @Override
    public String toString() {
        return "DFA[states=" + states + ", alphabet=" + alphabet + ", start=" + startState + ", final="
            + finalStates + ", transitions=" + transitions() + "]";
    }
}
