package RTK.Elimination;

import RTK.Model.Label;

import java.util.Set;

/**
 * Builds the replacement label of a path p -pre-> q (-loop-> q)* -post-> r when state q is eliminated.
 * @param <I> - symbol type
 */
@FunctionalInterface
public interface RipCombiner<I> {
    /**
     * @param pre - label of the edge into the eliminated state
     * @param selfLoops - non-epsilon self-loop labels of the eliminated state, possibly empty
     * @param post - label of the edge out of the eliminated state
     * @return combined label, epsilon if the combination denotes only the empty string
     */
    Label<I> combine(Label<I> pre, Set<I> selfLoops, Label<I> post);
}
