package RTK.Parsing;

import RTK.Model.Operator;
import RTK.Model.Token;
import RTK.Nfa;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class PostfixCompilerTest {

  private static Token<String> lit(String symbol) {
    return Token.literal(symbol);
  }

  private static Token<String> op(Operator operator) {
    return Token.operator(operator);
  }

  @Test
  void testRegexString() {
    Assertions.assertEquals("(a|b)c",
        PostfixCompiler.toRegexString(List.of(lit("a"), lit("b"), op(Operator.ALTERNATION), lit("c"),
            op(Operator.CONCATENATION))));
    Assertions.assertEquals("a|b|c",
        PostfixCompiler.toRegexString(List.of(lit("a"), lit("b"), lit("c"), op(Operator.ALTERNATION),
            op(Operator.ALTERNATION))));
    Assertions.assertEquals("(ab)+",
        PostfixCompiler.toRegexString(List.of(lit("a"), lit("b"), op(Operator.CONCATENATION), op(Operator.PLUS))));
    Assertions.assertEquals("a*",
        PostfixCompiler.toRegexString(List.of(lit("a"), op(Operator.STAR), op(Operator.OPTIONAL))));
    Assertions.assertEquals("a*",
        PostfixCompiler.toRegexString(List.of(lit("a"), op(Operator.PLUS), op(Operator.OPTIONAL))));
    Assertions.assertEquals("(ab)+",
        PostfixCompiler.toRegexString(List.of(lit("a"), lit("b"), op(Operator.CONCATENATION), op(Operator.PLUS),
            op(Operator.PLUS))));
    Assertions.assertEquals("c(a|b)*",
        PostfixCompiler.toRegexString(List.of(lit("c"), lit("a"), lit("b"), op(Operator.ALTERNATION),
            op(Operator.OPTIONAL), op(Operator.STAR), op(Operator.CONCATENATION))));
    Assertions.assertEquals("\\|\\\\", PostfixCompiler.toRegexString(List.of(lit("|"), lit("\\"),
        op(Operator.CONCATENATION))));
    Assertions.assertEquals("", PostfixCompiler.toRegexString(List.<Token<String>>of()));
  }

  @Test
  void testNfa() {
    Nfa<String> nfa = PostfixCompiler.toNfa(List.of(lit("a"), lit("b"), op(Operator.ALTERNATION), op(Operator.STAR),
        lit("c"), op(Operator.CONCATENATION)));
    Assertions.assertTrue(nfa.accept(List.of("a", "b", "c")));
    Assertions.assertTrue(nfa.accept(List.of("c")));
    Assertions.assertFalse(nfa.accept(List.of("a", "b")));

    Nfa<String> empty = PostfixCompiler.toNfa(List.<Token<String>>of());
    Assertions.assertTrue(empty.accept(List.of()));
    Assertions.assertFalse(empty.accept(List.of("a")));
  }

  @Test
  void testMalformedPrograms() {
    Assertions.assertThrows(RegexSyntaxException.class,
        () -> PostfixCompiler.toNfa(List.of(lit("a"), op(Operator.ALTERNATION))));
    Assertions.assertThrows(RegexSyntaxException.class,
        () -> PostfixCompiler.toNfa(List.of(lit("a"), lit("b"))));
    Assertions.assertThrows(RegexSyntaxException.class,
        () -> PostfixCompiler.toRegexString(List.of(lit("a"), op(Operator.GROUP_OPEN))));
    Assertions.assertThrows(RegexSyntaxException.class,
        () -> PostfixCompiler.toNfa(List.of(op(Operator.STAR))));
  }

  @Test
  void testRoundTripThroughText() {
    for (String regex : List.of("a(b|c)*d", "(ab|c)?e+", "\\**", "((a|b)(c|d))*")) {
      List<Token<String>> postfix = RegexParser.parse(regex);
      Assertions.assertEquals(postfix, RegexParser.parse(PostfixCompiler.toRegexString(postfix)), regex);
    }
  }

  @Test
  void testCustomAlgebra() {
    // counts literals
    PostfixAlgebra<String, Integer> size = new PostfixAlgebra<>() {
      @Override
      public Integer empty() {
        return 0;
      }

      @Override
      public Integer literal(String symbol) {
        return 1;
      }

      @Override
      public Integer apply(Operator operator, List<Integer> args) {
        return args.stream().mapToInt(Integer::intValue).sum();
      }
    };
    Assertions.assertEquals(4, PostfixCompiler.evaluate(RegexParser.parse("(ab|c)*d"), size));
  }
}
