package RTK.Parsing;

import RTK.Model.Operator;

import java.util.List;

/**
 * Interpretation of a postfix program: how literals and operators evaluate to values of type T.
 * @param <I> - symbol type
 * @param <T> - result type
 */
public interface PostfixAlgebra<I, T> {
    /**
     * @return value of the empty program, i.e. the empty string
     */
    T empty();

    T literal(I symbol);

    /**
     * @param operator - concatenation, alternation or a quantifier
     * @param args - operands in left-to-right order, exactly operator.numArgs of them
     */
    T apply(Operator operator, List<T> args);
}
