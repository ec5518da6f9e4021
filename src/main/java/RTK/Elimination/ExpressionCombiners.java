package RTK.Elimination;

import RTK.Model.Expression;
import RTK.Model.Label;
import RTK.Model.Operator;
import RTK.Model.Token;
import RTK.Parsing.PostfixCompiler;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Combiners over postfix expressions, for symbolic state elimination. Quantifiers applied directly to a quantified
 * operand are collapsed, see {@link Operator#collapse(Operator, Operator)}.
 */
public final class ExpressionCombiners {

    private ExpressionCombiners() {}

    public static <I> RipCombiner<Expression<I>> rip() {
        return ExpressionCombiners::combineRip;
    }

    public static <I> UnionCombiner<Expression<I>> union() {
        return ExpressionCombiners::combineUnion;
    }

    static <I> Label<Expression<I>> combineRip(Label<Expression<I>> preLabel,
                                               Set<Expression<I>> selfLoops,
                                               Label<Expression<I>> postLabel) {
        final List<Token<I>> pre = tokensOf(preLabel);
        final List<Token<I>> post = tokensOf(postLabel);
        List<Token<I>> repeat = List.of();
        for (Expression<I> loop : selfLoops) {
            repeat = opIfNonEmpty(Operator.ALTERNATION, loop.tokens(), repeat);
        }

        final boolean loopPre = pre.equals(repeat);
        final boolean loopPost = post.equals(repeat);
        List<Token<I>> combined;
        if (loopPre && loopPost) {
            combined = opIfNonEmpty(Operator.CONCATENATION, repeat, opIfNonEmpty(Operator.PLUS, repeat));
        } else if (loopPre) {
            combined = opIfNonEmpty(Operator.CONCATENATION, opIfNonEmpty(Operator.PLUS, repeat), post);
        } else if (loopPost) {
            combined = opIfNonEmpty(Operator.CONCATENATION, pre, opIfNonEmpty(Operator.PLUS, repeat));
        } else {
            combined = opIfNonEmpty(Operator.CONCATENATION, pre, opIfNonEmpty(Operator.STAR, repeat), post);
        }
        return toLabel(combined);
    }

    static <I> Label<Expression<I>> combineUnion(Set<Label<Expression<I>>> options) {
        List<Token<I>> union = List.of();
        boolean optional = false;
        for (Label<Expression<I>> option : options) {
            List<Token<I>> tokens = tokensOf(option);
            if (tokens.isEmpty()) {
                optional = true;
            } else {
                union = opIfNonEmpty(Operator.ALTERNATION, union, tokens);
            }
        }
        if (optional) {
            union = opIfNonEmpty(Operator.OPTIONAL, union);
        }
        return toLabel(union);
    }

    /**
     * Render a set of parallel expression labels as one regex; ε for the empty string.
     */
    public static <I> String edgeLabel(Collection<Label<Expression<I>>> labels) {
        Label<Expression<I>> union = combineUnion(new LinkedHashSet<>(labels));
        String text = union.isEpsilon() ? "" : PostfixCompiler.toRegexString(union.symbol().tokens());
        return text.isEmpty() ? Label.EPSILON_DISPLAY : text;
    }

    /**
     * Apply op to the non-empty operands. An n-ary use of a binary operator emits n-1 operator tokens; commutative
     * operands are ordered by length first.
     * @return the combined postfix tokens, empty if every operand is empty
     * @throws IllegalArgumentException if the operand count does not fit the operator
     */
    @SafeVarargs
    static <I> List<Token<I>> opIfNonEmpty(Operator op, List<Token<I>>... args) {
        List<List<Token<I>>> operands = new ArrayList<>();
        for (List<Token<I>> arg : args) {
            if (!arg.isEmpty()) {
                operands.add(arg);
            }
        }
        if (operands.isEmpty()) {
            return List.of();
        }
        if (op.commutative) {
            operands.sort(Comparator.comparingInt(List::size));
        }
        final int numOperands = operands.size();
        if (op.numArgs == 1 ? numOperands != 1 : (numOperands - 1) % (op.numArgs - 1) != 0) {
            throw new IllegalArgumentException("Invalid number of operands for " + op + ": " + numOperands);
        }
        final int numOperators = op.numArgs == 1 ? 1 : (numOperands - 1) / (op.numArgs - 1);

        List<Token<I>> result = new ArrayList<>();
        operands.forEach(result::addAll);
        Operator applied = op;
        Operator collapsed = Operator.collapse(result.get(result.size() - 1).operator(), op);
        if (collapsed != null) {
            applied = collapsed;
            result.remove(result.size() - 1);
        }
        for (int i = 0; i < numOperators; i++) {
            result.add(Token.operator(applied));
        }
        return result;
    }

    private static <I> List<Token<I>> tokensOf(Label<Expression<I>> label) {
        return label.isEpsilon() ? List.of() : label.symbol().tokens();
    }

    private static <I> Label<Expression<I>> toLabel(List<Token<I>> tokens) {
        return tokens.isEmpty() ? Label.epsilon() : Label.of(Expression.of(tokens));
    }
}
