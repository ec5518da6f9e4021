package RTK.Parsing;

import RTK.Model.Operator;

import java.util.List;

/**
 * Evaluates a postfix program back into regex text. An operand is parenthesized when its top-level operator binds
 * looser than the operator applied to it. A quantifier applied to a quantified operand is merged into one, see
 * {@link Operator#collapse(Operator, Operator)}.
 */
public class StringAlgebra<I> implements PostfixAlgebra<I, StringAlgebra.Rendered> {

    /**
     * Regex text of a sub-expression together with its top-level operator (null for literals).
     */
    public record Rendered(String text, Operator top) { }

    @Override
    public Rendered empty() {
        return new Rendered("", null);
    }

    @Override
    public Rendered literal(I symbol) {
        return new Rendered(escape(symbol.toString()), null);
    }

    @Override
    public Rendered apply(Operator operator, List<Rendered> args) {
        Operator collapsed = Operator.collapse(args.get(0).top(), operator);
        if (collapsed != null) {
            String inner = args.get(0).text();
            return new Rendered(inner.substring(0, inner.length() - 1) + collapsed.text(), collapsed);
        }
        String first = operand(operator, args.get(0));
        String text = switch (operator) {
            case CONCATENATION -> first + operand(operator, args.get(1));
            case ALTERNATION -> first + "|" + operand(operator, args.get(1));
            case STAR, PLUS, OPTIONAL -> first + operator.text();
            default -> throw new IllegalArgumentException("Not an expression operator: " + operator);
        };
        return new Rendered(text, operator);
    }

    private static String operand(Operator operator, Rendered arg) {
        if (arg.top() != null && arg.top().precedence < operator.precedence) {
            return "(" + arg.text() + ")";
        }
        return arg.text();
    }

    /**
     * Single characters that would read as operators are escaped with a backslash.
     */
    public static String escape(String literal) {
        if (literal.codePointCount(0, literal.length()) == 1) {
            int cp = literal.codePointAt(0);
            if (cp == '\\' || Operator.forSymbol(cp) != null) {
                return "\\" + literal;
            }
        }
        return literal;
    }
}
