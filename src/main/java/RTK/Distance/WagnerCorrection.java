package RTK.Distance;

import RTK.Model.Label;
import RTK.Model.Transition;
import RTK.Nfa;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Order-n correction for regular languages (Wagner, CACM 17(5), 1974): the least number of symbol substitutions,
 * insertions and deletions that turn an input into a string the automaton accepts.
 * <p>
 * With D(p,q) the least number of literal edges on a path p to q and A_a(p,q) the least number of literal edges on
 * such a path through an a-edge, consuming input symbol a while moving from p to q costs
 * min(max(D(p,q), 1), A_a(p,q) - 1): either the symbol is matched by an a-edge and the other edges are insertions,
 * or it is substituted (deleted when D is 0).
 */
public final class WagnerCorrection {
    private static final Logger LOGGER = LoggerFactory.getLogger(WagnerCorrection.class);

    private WagnerCorrection() {}

    /**
     * Fill the correction table of nfa for input.
     * @throws IllegalArgumentException if the final state is unreachable from the start state
     */
    public static <I> DistanceTable<I> distanceTable(Nfa<I> nfa, List<? extends I> input) {
        final int[] states = nfa.getStates().toIntArray();
        final List<I> symbols = List.copyOf(input);
        final int m = states.length;
        final int[][] d = new int[m][m];
        DistanceTable<I> table = new DistanceTable<>(states, nfa.getStartState(), nfa.getFinalState(), symbols, d);

        // all-pairs least literal-edge counts, epsilon edges are free
        for (int[] row : d) {
            Arrays.fill(row, DistanceTable.UNREACHABLE);
        }
        for (int p = 0; p < m; p++) {
            d[p][p] = 0;
        }
        for (Transition<I> t : nfa.transitions()) {
            int p = table.indexOf(t.source());
            int q = table.indexOf(t.target());
            d[p][q] = Math.min(d[p][q], t.label().isEpsilon() ? 0 : 1);
        }
        for (int k = 0; k < m; k++) {
            for (int p = 0; p < m; p++) {
                if (d[p][k] == DistanceTable.UNREACHABLE) {
                    continue;
                }
                for (int q = 0; q < m; q++) {
                    d[p][q] = Math.min(d[p][q], add(d[p][k], d[k][q]));
                }
            }
        }

        // per input symbol, least literal-edge counts of paths through one of its edges
        Map<I, int[][]> through = new HashMap<>();
        for (I sym : symbols) {
            if (!through.containsKey(sym)) {
                through.put(sym, throughSymbol(nfa, table, d, sym));
            }
        }

        final int start = table.indexOf(nfa.getStartState());
        for (int q = 0; q < m; q++) {
            table.set(0, q, d[start][q], start);
        }
        for (int i = 0; i < symbols.size(); i++) {
            int[][] a = through.get(symbols.get(i));
            for (int q = 0; q < m; q++) {
                int best = DistanceTable.UNREACHABLE;
                int bestPred = start;
                for (int p = 0; p < m; p++) {
                    int prev = table.costAt(i, p);
                    if (prev == DistanceTable.UNREACHABLE || d[p][q] == DistanceTable.UNREACHABLE) {
                        continue;
                    }
                    int step = Math.max(d[p][q], 1);
                    if (a[p][q] != DistanceTable.UNREACHABLE) {
                        step = Math.min(step, a[p][q] - 1);
                    }
                    int cost = add(prev, step);
                    if (cost < best) {
                        best = cost;
                        bestPred = p;
                    }
                }
                table.set(i + 1, q, best, bestPred);
            }
        }

        if (table.distance() == DistanceTable.UNREACHABLE) {
            throw new IllegalArgumentException("Final state " + nfa.getFinalState() + " is unreachable");
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Correction table for {}:\n{}", symbols, table.format());
        }
        return table;
    }

    /**
     * @return least number of edits after which nfa accepts input; 0 iff it already does
     * @throws IllegalArgumentException if the final state is unreachable from the start state
     */
    public static <I> int distance(Nfa<I> nfa, List<? extends I> input) {
        return distanceTable(nfa, input).distance();
    }

    /**
     * Add the optimal aligned path for input to nfa so that it accepts input. Previously accepted strings stay
     * accepted.
     * @param nfa - automaton to correct, modified
     * @param input - string to accept
     * @throws IllegalArgumentException if the final state is unreachable from the start state
     */
    public static <I> Correction<I> correct(Nfa<I> nfa, List<? extends I> input) {
        DistanceTable<I> table = distanceTable(nfa, input);
        int[] aligned = table.alignedStates();
        List<Transition<I>> path = new ArrayList<>();
        if (aligned[0] != nfa.getStartState()) {
            path.add(Transition.epsilon(nfa.getStartState(), aligned[0]));
        }
        for (int i = 1; i < aligned.length; i++) {
            path.add(new Transition<>(aligned[i - 1], Label.of(table.getInput().get(i - 1)), aligned[i]));
        }
        for (Transition<I> t : path) {
            nfa.addTransition(t.source(), t.label(), t.target());
        }
        LOGGER.debug("Corrected with distance {} along {}", table.distance(), path);
        return new Correction<>(nfa, table.distance(), List.copyOf(path));
    }

    private static <I> int[][] throughSymbol(Nfa<I> nfa, DistanceTable<I> table, int[][] d, I sym) {
        final int m = d.length;
        int[][] a = new int[m][m];
        for (int[] row : a) {
            Arrays.fill(row, DistanceTable.UNREACHABLE);
        }
        Label<I> label = Label.of(sym);
        for (Transition<I> t : nfa.transitions()) {
            if (!t.label().equals(label)) {
                continue;
            }
            int u = table.indexOf(t.source());
            int v = table.indexOf(t.target());
            for (int p = 0; p < m; p++) {
                if (d[p][u] == DistanceTable.UNREACHABLE) {
                    continue;
                }
                for (int q = 0; q < m; q++) {
                    a[p][q] = Math.min(a[p][q], add(add(d[p][u], 1), d[v][q]));
                }
            }
        }
        return a;
    }

    private static int add(int x, int y) {
        if (x == DistanceTable.UNREACHABLE || y == DistanceTable.UNREACHABLE) {
            return DistanceTable.UNREACHABLE;
        }
        return x + y;
    }
}
