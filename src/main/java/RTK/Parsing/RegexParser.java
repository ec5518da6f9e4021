package RTK.Parsing;

import RTK.Model.Operator;
import RTK.Model.Token;
import RTK.Nfa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Shunting-yard parser from infix regex text to a postfix program.
 * <p>
 * Supported syntax: literals, backslash escapes, {@code |}, {@code *}, {@code +}, {@code ?}, parentheses and
 * implicit concatenation. Group modifiers such as {@code (?:...)} or {@code (?<name>...)} are skipped; the group
 * behaves like a plain one. Literal symbols are single code points, as strings.
 */
public final class RegexParser {

    private RegexParser() {}

    /**
     * @param regex - infix regex
     * @return postfix program
     * @throws RegexSyntaxException on unbalanced parentheses, a dangling escape or an unterminated group name
     */
    public static List<Token<String>> parse(String regex) {
        Deque<Operator> stack = new ArrayDeque<>();
        List<Token<String>> postfix = new ArrayList<>();
        boolean concatenateNext = false;
        int pos = 0;
        while (pos < regex.length()) {
            int cp = regex.codePointAt(pos);
            int width = Character.charCount(cp);
            boolean escape = cp == '\\';
            if (escape) {
                if (pos + 1 >= regex.length()) {
                    throw new RegexSyntaxException("Dangling escape character", regex, pos);
                }
                cp = regex.codePointAt(pos + 1);
                width = 1 + Character.charCount(cp);
            }

            Operator op = escape ? null : Operator.forSymbol(cp);
            if (concatenateNext && (op == null || op == Operator.GROUP_OPEN)) {
                // the current character is read again on the next pass
                op = Operator.CONCATENATION;
            } else {
                pos += width;
            }

            if (op == null) {
                postfix.add(Token.literal(new String(Character.toChars(cp))));
                concatenateNext = true;
            } else if (op == Operator.GROUP_OPEN) {
                stack.push(op);
                pos = skipGroupModifier(regex, pos);
                concatenateNext = false;
            } else if (op == Operator.GROUP_CLOSE) {
                while (!stack.isEmpty() && stack.peek() != Operator.GROUP_OPEN) {
                    postfix.add(Token.operator(stack.pop()));
                }
                if (stack.isEmpty()) {
                    throw new RegexSyntaxException("Unbalanced parenthesis", regex, pos - 1);
                }
                stack.pop();
                concatenateNext = true;
            } else {
                while (!stack.isEmpty() && stack.peek().precedence > op.precedence) {
                    postfix.add(Token.operator(stack.pop()));
                }
                if (op.suffix) {
                    postfix.add(Token.operator(op));
                    concatenateNext = true;
                } else {
                    stack.push(op);
                    concatenateNext = false;
                }
            }
        }

        while (!stack.isEmpty()) {
            Operator op = stack.pop();
            if (op == Operator.GROUP_OPEN) {
                throw new RegexSyntaxException("Unclosed group", regex, regex.length());
            }
            postfix.add(Token.operator(op));
        }
        return postfix;
    }

    /**
     * @param pos - index just after an opening parenthesis
     * @return index of the first character of the group body
     */
    private static int skipGroupModifier(String regex, int pos) {
        if (pos >= regex.length() || regex.charAt(pos) != '?') {
            return pos;
        }
        if (pos + 1 >= regex.length()) {
            throw new RegexSyntaxException("Incomplete group modifier", regex, pos);
        }
        if (regex.charAt(pos + 1) == '<') {
            if (pos + 2 < regex.length() && (regex.charAt(pos + 2) == '=' || regex.charAt(pos + 2) == '!')) {
                return pos + 3;
            }
            int close = regex.indexOf('>', pos + 2);
            if (close < 0) {
                throw new RegexSyntaxException("Unterminated group name", regex, pos);
            }
            return close + 1;
        }
        return pos + 2;
    }

    /**
     * Split plain text into the single code point symbols the parser produces for literals.
     */
    public static List<String> symbols(String text) {
        List<String> symbols = new ArrayList<>(text.length());
        text.codePoints().forEach(cp -> symbols.add(new String(Character.toChars(cp))));
        return symbols;
    }

    public static String parseToString(String regex) {
        return PostfixCompiler.toRegexString(parse(regex));
    }

    public static Nfa<String> parseToNfa(String regex) {
        return PostfixCompiler.toNfa(parse(regex));
    }
}
