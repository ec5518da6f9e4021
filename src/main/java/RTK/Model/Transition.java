package RTK.Model;

/**
 * A single labelled edge between two states.
 * @param <I> - symbol type
 */
public record Transition<I>(int source, Label<I> label, int target) {
    public static <I> Transition<I> of(int source, I symbol, int target) {
        return new Transition<>(source, Label.of(symbol), target);
    }

    public static <I> Transition<I> epsilon(int source, int target) {
        return new Transition<>(source, Label.epsilon(), target);
    }

    @Override
    public String toString() {
        return source + " -" + label + "-> " + target;
    }
}
