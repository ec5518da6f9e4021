package RTK.Elimination;

import RTK.Model.Label;

import java.util.Set;

/**
 * Merges the labels of parallel edges between one ordered pair of states into a single label.
 * @param <I> - symbol type
 */
@FunctionalInterface
public interface UnionCombiner<I> {
    Label<I> combine(Set<Label<I>> labels);
}
