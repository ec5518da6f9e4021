package RTK.Parsing;

import RTK.Model.Token;
import RTK.Nfa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Evaluates postfix programs under an algebra. The same program yields an automaton ({@link NfaAlgebra}) or regex
 * text ({@link StringAlgebra}).
 */
public final class PostfixCompiler {

    private PostfixCompiler() {}

    /**
     * @throws RegexSyntaxException if an operator lacks operands or operands are left over
     */
    public static <I, T> T evaluate(List<Token<I>> postfix, PostfixAlgebra<I, T> algebra) {
        if (postfix.isEmpty()) {
            return algebra.empty();
        }
        Deque<T> stack = new ArrayDeque<>();
        for (int index = 0; index < postfix.size(); index++) {
            Token<I> token = postfix.get(index);
            if (!token.isOperator()) {
                stack.push(algebra.literal(token.symbol()));
                continue;
            }
            int numArgs = token.operator().numArgs;
            if (numArgs == 0) {
                throw new RegexSyntaxException("Grouping is not allowed in a postfix program", describe(postfix), index);
            }
            if (stack.size() < numArgs) {
                throw new RegexSyntaxException(token.operator() + " expects " + numArgs + " operand(s)",
                    describe(postfix), index);
            }
            List<T> args = new ArrayList<>(numArgs);
            for (int i = 0; i < numArgs; i++) {
                args.add(0, stack.pop());
            }
            stack.push(algebra.apply(token.operator(), args));
        }
        if (stack.size() != 1) {
            throw new RegexSyntaxException("Missing operator between " + stack.size() + " operands",
                describe(postfix), postfix.size());
        }
        return stack.pop();
    }

    public static <I> Nfa<I> toNfa(List<Token<I>> postfix) {
        return evaluate(postfix, new NfaAlgebra<>());
    }

    public static <I> String toRegexString(List<Token<I>> postfix) {
        return evaluate(postfix, new StringAlgebra<I>()).text();
    }

    private static <I> String describe(List<Token<I>> postfix) {
        return postfix.stream().map(Token::toString).collect(Collectors.joining(" "));
    }
}
