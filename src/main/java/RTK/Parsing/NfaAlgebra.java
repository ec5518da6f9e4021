package RTK.Parsing;

import RTK.Model.Operator;
import RTK.Nfa;

import java.util.List;

/**
 * Evaluates a postfix program into an automaton with the NFA combinators.
 * Operands are consumed: each is combined in place into the result.
 */
public class NfaAlgebra<I> implements PostfixAlgebra<I, Nfa<I>> {
    @Override
    public Nfa<I> empty() {
        return Nfa.emptyString();
    }

    @Override
    public Nfa<I> literal(I symbol) {
        return Nfa.literal(symbol);
    }

    @Override
    public Nfa<I> apply(Operator operator, List<Nfa<I>> args) {
        return switch (operator) {
            case CONCATENATION -> args.get(0).concat(args.get(1));
            case ALTERNATION -> args.get(0).union(args.get(1));
            case STAR -> args.get(0).star();
            case PLUS -> args.get(0).plus();
            case OPTIONAL -> args.get(0).opt();
            default -> throw new IllegalArgumentException("Not an expression operator: " + operator);
        };
    }
}
