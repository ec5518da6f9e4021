package RTK.Distance;

import it.unimi.dsi.fastutil.ints.Int2IntMap;
import it.unimi.dsi.fastutil.ints.Int2IntOpenHashMap;

import java.util.List;

/**
 * Result of the correction dynamic program for one automaton and one input string.
 * <p>
 * Rows are automaton states, columns are input prefix lengths 0..n. Entry (q, i) is the least number of edits after
 * which the first i input symbols have led from the start state to q; the predecessor entry records the state the
 * optimal alignment came from.
 * @param <I> - symbol type
 */
public class DistanceTable<I> {
    public static final int UNREACHABLE = Integer.MAX_VALUE;
    private static final int MISSING_ELEMENT = -1;

    private final int[] states;
    private final Int2IntMap index;
    private final int startState;
    private final int finalState;
    private final List<I> input;
    private final int[][] pathLengths;
    private final int[][] costs;
    private final int[][] predecessors;

    DistanceTable(int[] states, int startState, int finalState, List<I> input, int[][] pathLengths) {
        this.states = states;
        this.index = new Int2IntOpenHashMap();
        this.index.defaultReturnValue(MISSING_ELEMENT);
        for (int i = 0; i < states.length; i++) {
            index.put(states[i], i);
        }
        this.startState = startState;
        this.finalState = finalState;
        this.input = input;
        this.pathLengths = pathLengths;
        this.costs = new int[input.size() + 1][states.length];
        this.predecessors = new int[input.size() + 1][states.length];
    }

    int indexOf(int state) {
        int i = index.get(state);
        if (i == MISSING_ELEMENT) {
            throw new IllegalArgumentException("State " + state + " is not part of the automaton");
        }
        return i;
    }

    int[] stateIds() {
        return states;
    }

    void set(int prefix, int stateIndex, int cost, int predecessorIndex) {
        costs[prefix][stateIndex] = cost;
        predecessors[prefix][stateIndex] = predecessorIndex;
    }

    int costAt(int prefix, int stateIndex) {
        return costs[prefix][stateIndex];
    }

    public List<I> getInput() {
        return input;
    }

    /**
     * @return least number of literal edges on a path from source to target, {@link #UNREACHABLE} if there is none
     */
    public int pathLength(int source, int target) {
        return pathLengths[indexOf(source)][indexOf(target)];
    }

    /**
     * @return least edit count reaching state after prefix input symbols, {@link #UNREACHABLE} if it cannot
     */
    public int cost(int prefix, int state) {
        return costs[prefix][indexOf(state)];
    }

    /**
     * @return the correction distance: the cost of the final state after the whole input
     */
    public int distance() {
        return cost(input.size(), finalState);
    }

    /**
     * Backtrack the optimal alignment.
     * @return states q0..qn visited after consuming 0..n input symbols; qn is the final state
     */
    public int[] alignedStates() {
        int n = input.size();
        int[] path = new int[n + 1];
        int curr = indexOf(finalState);
        for (int i = n; i >= 0; i--) {
            path[i] = states[curr];
            curr = predecessors[i][curr];
        }
        return path;
    }

    /**
     * Text rendering of the path-length matrix, the DP table (cost and predecessor per cell) and the aligned path.
     * Unreachable entries show as '.' in the matrix and '-' in the table.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        sb.append("    ");
        for (int q : states) {
            sb.append(String.format("%3d", q));
        }
        sb.append('\n');
        for (int p = 0; p < states.length; p++) {
            sb.append(String.format("%3d ", states[p]));
            for (int q = 0; q < states.length; q++) {
                int d = pathLengths[p][q];
                sb.append(d == UNREACHABLE ? "  ." : String.format("%3d", d));
            }
            sb.append('\n');
        }
        sb.append('\n');

        sb.append(String.format("%-7s%7s", "", "ε"));
        for (I sym : input) {
            sb.append(String.format("%7s", sym));
        }
        sb.append('\n');
        for (int q = 0; q < states.length; q++) {
            sb.append(states[q] == finalState ? '>' : ' ')
                .append(String.format("S%-4d", states[q]))
                .append(states[q] == startState ? '>' : ' ');
            for (int i = 0; i <= input.size(); i++) {
                int c = costs[i][q];
                sb.append(c == UNREACHABLE ? "      -" : String.format(" %2d,S%-2d", c, states[predecessors[i][q]]));
            }
            sb.append('\n');
        }

        if (distance() != UNREACHABLE) {
            int[] path = alignedStates();
            sb.append('\n').append("S").append(path[0]);
            for (int i = 1; i < path.length; i++) {
                sb.append(" -").append(input.get(i - 1)).append("-> S").append(path[i]);
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
