package RTK.Elimination;

import RTK.Model.Label;
import RTK.Model.Operator;
import RTK.Model.Token;
import RTK.Parsing.RegexParser;

import java.util.List;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Default combiners over labels holding regex text. Labels are read as regex syntax, so they are grouped with
 * parentheses whenever their top-level operator binds looser than the operator applied to them.
 */
public final class RegexCombiners {

    private RegexCombiners() {}

    public static RipCombiner<String> rip() {
        return RegexCombiners::combineRip;
    }

    public static UnionCombiner<String> union() {
        return RegexCombiners::combineUnion;
    }

    static Label<String> combineRip(Label<String> pre, Set<String> selfLoops, Label<String> post) {
        final String first = pre.isEpsilon() ? "" : pre.symbol();
        final String last = post.isEpsilon() ? "" : post.symbol();
        final String repeat = String.join("|", selfLoops);
        final boolean loopPre = first.equals(repeat);
        final boolean loopPost = last.equals(repeat);

        String combined;
        if (repeat.isEmpty()) {
            combined = group(first, Operator.CONCATENATION) + group(last, Operator.CONCATENATION);
        } else if (loopPre && loopPost) {
            combined = group(repeat, Operator.CONCATENATION) + quantify(repeat, Operator.PLUS);
        } else if (loopPre) {
            combined = quantify(repeat, Operator.PLUS) + group(last, Operator.CONCATENATION);
        } else if (loopPost) {
            combined = group(first, Operator.CONCATENATION) + quantify(repeat, Operator.PLUS);
        } else {
            combined = group(first, Operator.CONCATENATION) + quantify(repeat, Operator.STAR)
                + group(last, Operator.CONCATENATION);
        }
        return combined.isEmpty() ? Label.epsilon() : Label.of(combined);
    }

    static Label<String> combineUnion(Set<Label<String>> labels) {
        StringJoiner options = new StringJoiner("|");
        boolean optional = false;
        for (Label<String> label : labels) {
            if (label.isEpsilon() || label.symbol().isEmpty()) {
                optional = true;
            } else {
                options.add(label.symbol());
            }
        }
        String union = options.toString();
        if (union.isEmpty()) {
            return Label.epsilon();
        }
        return Label.of(optional ? quantify(union, Operator.OPTIONAL) : union);
    }

    /**
     * Apply a quantifier to text, merging it with a quantifier already at the top level, see
     * {@link Operator#collapse(Operator, Operator)}.
     */
    static String quantify(String text, Operator quantifier) {
        Operator collapsed = Operator.collapse(topOperator(text), quantifier);
        if (collapsed != null) {
            return text.substring(0, text.length() - 1) + collapsed.text();
        }
        return group(text, quantifier) + quantifier.text();
    }

    /**
     * Parenthesize text if its top-level operator binds looser than context.
     */
    static String group(String text, Operator context) {
        Operator top = topOperator(text);
        if (top != null && top.precedence < context.precedence) {
            return "(" + text + ")";
        }
        return text;
    }

    private static Operator topOperator(String text) {
        if (text.isEmpty()) {
            return null;
        }
        List<Token<String>> postfix = RegexParser.parse(text);
        return postfix.isEmpty() ? null : postfix.get(postfix.size() - 1).operator();
    }
}
