package RTK.Elimination;

import RTK.Model.Expression;
import RTK.Model.Label;
import RTK.Model.Operator;
import RTK.Model.Token;
import RTK.Model.Transition;
import RTK.Nfa;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class CombinersTest {

  private static Token<String> lit(String symbol) {
    return Token.literal(symbol);
  }

  private static Token<String> op(Operator operator) {
    return Token.operator(operator);
  }

  private static Label<Expression<String>> expr(String symbol) {
    return Label.of(Expression.literal(symbol));
  }

  private static String text(Label<Expression<String>> label) {
    return label.isEpsilon() ? "" : label.symbol().toString();
  }

  @Test
  void testRegexRip() {
    Assertions.assertEquals(Label.of("ac*b"), RegexCombiners.rip().combine(Label.of("a"), Set.of("c"), Label.of("b")));
    Assertions.assertEquals(Label.of("(a|b)c"),
        RegexCombiners.rip().combine(Label.of("a|b"), Set.of(), Label.of("c")));
    Assertions.assertEquals(Label.of("a+"), RegexCombiners.rip().combine(Label.of("a"), Set.of("a"), Label.epsilon()));
    Assertions.assertEquals(Label.of("aa+"), RegexCombiners.rip().combine(Label.of("a"), Set.of("a"), Label.of("a")));
    Assertions.assertEquals(Label.of("(a|b)(a|b)+"),
        RegexCombiners.rip().combine(Label.of("a|b"), Set.of("a|b"), Label.of("a|b")));
    Assertions.assertEquals(Label.of("(ab)+c"),
        RegexCombiners.rip().combine(Label.of("ab"), Set.of("ab"), Label.of("c")));
    Assertions.assertEquals(Label.of("(a|b)*"),
        RegexCombiners.rip().combine(Label.epsilon(), new LinkedHashSet<>(List.of("a", "b")), Label.epsilon()));
    Assertions.assertEquals(Label.epsilon(),
        RegexCombiners.rip().combine(Label.epsilon(), Set.of(), Label.epsilon()));
  }

  @Test
  void testRegexUnion() {
    Assertions.assertEquals(Label.of("a?"),
        RegexCombiners.union().combine(new LinkedHashSet<>(List.of(Label.of("a"), Label.epsilon()))));
    Assertions.assertEquals(Label.of("(ab)?"),
        RegexCombiners.union().combine(new LinkedHashSet<>(List.of(Label.epsilon(), Label.of("ab")))));
    Assertions.assertEquals(Label.epsilon(), RegexCombiners.union().combine(Set.of(Label.epsilon())));
    Assertions.assertEquals(Label.of("x"), RegexCombiners.union().combine(Set.of(Label.of("x"))));
  }

  @Test
  void testOperandHandling() {
    Assertions.assertEquals(List.of(lit("a"), lit("b"), lit("c"), op(Operator.CONCATENATION), op(Operator.CONCATENATION)),
        ExpressionCombiners.opIfNonEmpty(Operator.CONCATENATION, List.of(lit("a")), List.of(),
            List.of(lit("b")), List.of(lit("c"))));
    // commutative operands are ordered by length
    Assertions.assertEquals(List.of(lit("c"), lit("a"), lit("b"), op(Operator.CONCATENATION), op(Operator.ALTERNATION)),
        ExpressionCombiners.opIfNonEmpty(Operator.ALTERNATION,
            List.of(lit("a"), lit("b"), op(Operator.CONCATENATION)), List.of(lit("c"))));
    Assertions.assertEquals(List.of(lit("a"), op(Operator.STAR)),
        ExpressionCombiners.opIfNonEmpty(Operator.PLUS, List.of(lit("a"), op(Operator.OPTIONAL))));
    Assertions.assertEquals(List.of(lit("a"), op(Operator.PLUS)),
        ExpressionCombiners.opIfNonEmpty(Operator.PLUS, List.of(lit("a"), op(Operator.PLUS))));
    Assertions.assertEquals(List.of(),
        ExpressionCombiners.opIfNonEmpty(Operator.CONCATENATION, List.<Token<String>>of(), List.of()));
    Assertions.assertEquals(List.of(lit("a")),
        ExpressionCombiners.opIfNonEmpty(Operator.CONCATENATION, List.of(lit("a")), List.of()));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> ExpressionCombiners.opIfNonEmpty(Operator.STAR, List.of(lit("a")), List.of(lit("b"))));
  }

  @Test
  void testExpressionRip() {
    RipCombiner<Expression<String>> rip = ExpressionCombiners.rip();
    Assertions.assertEquals("ac*b", text(rip.combine(expr("a"), Set.of(Expression.literal("c")), expr("b"))));
    Assertions.assertEquals("a+b", text(rip.combine(expr("a"), Set.of(Expression.literal("a")), expr("b"))));
    Assertions.assertEquals("ba+", text(rip.combine(expr("b"), Set.of(Expression.literal("a")), expr("a"))));
    Assertions.assertEquals("aa+", text(rip.combine(expr("a"), Set.of(Expression.literal("a")), expr("a"))));
    Assertions.assertEquals("ab", text(rip.combine(expr("a"), Set.of(), expr("b"))));
    Assertions.assertTrue(rip.combine(Label.epsilon(), Set.of(), Label.epsilon()).isEpsilon());

    Set<Expression<String>> loops = new LinkedHashSet<>(List.of(Expression.literal("a"), Expression.literal("b")));
    Assertions.assertEquals("(b|a)*", text(rip.combine(Label.epsilon(), loops, Label.epsilon())));
  }

  @Test
  void testExpressionUnion() {
    UnionCombiner<Expression<String>> union = ExpressionCombiners.union();
    Assertions.assertEquals("a|b", text(union.combine(new LinkedHashSet<>(List.of(expr("a"), expr("b"))))));
    Assertions.assertEquals("a?", text(union.combine(new LinkedHashSet<>(List.of(expr("a"), Label.epsilon())))));
    Assertions.assertTrue(union.combine(Set.of(Label.epsilon())).isEpsilon());

    Label<Expression<String>> aStar = Label.of(Expression.of(List.of(lit("a"), op(Operator.STAR))));
    Assertions.assertEquals("a*", text(union.combine(new LinkedHashSet<>(List.of(aStar, Label.epsilon())))));

    Assertions.assertEquals("ε", ExpressionCombiners.edgeLabel(List.of(Label.<Expression<String>>epsilon())));
    Assertions.assertEquals("a|b", ExpressionCombiners.edgeLabel(List.of(expr("a"), expr("b"))));
  }

  @Test
  void testLabelWeightHeuristic() {
    Nfa<String> nfa = new Nfa<>(List.of(0, 1, 2), List.of(),
        List.of(Transition.of(0, "a", 1), Transition.of(1, "c", 1), Transition.of(1, "bb", 2)), 0, 2);
    EliminationHeuristic<String> heuristic = EliminationHeuristic.labelWeight(String::length);
    // incoming a (1) x 2 outgoing + outgoing bb (2) x 2 incoming
    Assertions.assertEquals(6, heuristic.cost(1, nfa.inOutSets(1)));

    Nfa<String> epsilons = new Nfa<>(List.of(0, 1, 2), List.of(),
        List.of(Transition.epsilon(0, 1), Transition.epsilon(1, 2)), 0, 2);
    Assertions.assertEquals(0, heuristic.cost(1, epsilons.inOutSets(1)));
    Assertions.assertEquals(7, EliminationHeuristic.<String>lowestState().cost(7, epsilons.inOutSets(1)));
  }
}
