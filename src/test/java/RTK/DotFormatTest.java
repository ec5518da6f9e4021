package RTK;

import RTK.Elimination.ExpressionCombiners;
import RTK.Elimination.StateElimination;
import RTK.Model.Expression;
import RTK.Model.Label;
import RTK.Parsing.RegexParser;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class DotFormatTest {
  @Test
  void testDefaultEdgeLabel() {
    Assertions.assertEquals("a,b,ε",
        DotFormat.defaultEdgeLabel(List.of(Label.of("b"), Label.<String>epsilon(), Label.of("a"))));
  }

  @Test
  void testNfa() {
    String dot = DotFormat.toDot(Nfa.literal("a"));
    Assertions.assertTrue(dot.startsWith("digraph automaton {"), dot);
    Assertions.assertTrue(dot.contains("rankdir=LR;"), dot);
    Assertions.assertTrue(dot.contains("__start -> 0;"), dot);
    Assertions.assertTrue(dot.contains("0 [shape=circle];"), dot);
    Assertions.assertTrue(dot.contains("1 [shape=doublecircle];"), dot);
    Assertions.assertTrue(dot.contains("0 -> 1 [label=\"a\"];"), dot);
  }

  @Test
  void testDfaAndCustomLabels() {
    Dfa<String> dfa = RegexParser.parseToNfa("a|b").toDfa(false).minimize();
    String dot = DotFormat.toDot(dfa);
    Assertions.assertTrue(dot.contains("0 -> 1 [label=\"a,b\"];") || dot.contains("1 -> 0 [label=\"a,b\"];"), dot);

    String custom = DotFormat.toDot(dfa, labels -> labels.size() + " symbols");
    Assertions.assertTrue(custom.contains("[label=\"2 symbols\"]"), custom);

    Nfa<String> quoted = Nfa.literal("\"");
    Assertions.assertTrue(DotFormat.toDot(quoted).contains("[label=\"\\\"\"]"));
  }

  @Test
  void testEliminationSnapshot() {
    Nfa<String> nfa = RegexParser.parseToNfa("ab");
    Nfa<Expression<String>> symbolic = nfa.relabel(Expression::literal);
    String dot = DotFormat.toDot(symbolic, ExpressionCombiners::edgeLabel);
    Assertions.assertTrue(dot.contains("[label=\"a\"]"), dot);
    Assertions.assertTrue(StateElimination.toRegex(nfa).isPresent());
  }
}
