package RTK;

import RTK.Model.Transition;
import RTK.Parsing.RegexParser;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class DfaTest {

  private static boolean accepts(Dfa<String> dfa, String input) {
    return dfa.accept(RegexParser.symbols(input));
  }

  /**
   * Size of the minimal trimmed DFA, derived from AutomataLib's minimization of the complete DFA: a partial result
   * lacks exactly the dead state.
   */
  static int expectedMinimalSize(Nfa<String> nfa, Dfa<String> minimized) {
    CompactDFA<String> reference = nfa.toDfa(true).toCompactDFA();
    CompactDFA<String> hopcroft = HopcroftMinimizer.minimizeDFA(reference, reference.getInputAlphabet());
    return minimized.isComplete() ? hopcroft.size() : hopcroft.size() - 1;
  }

  @Test
  void testMinimize() {
    Nfa<String> nfa = RegexParser.parseToNfa("a(aa)*b*");
    Dfa<String> dfa = nfa.toDfa(false).minimize();
    Assertions.assertEquals(3, dfa.size());
    Assertions.assertTrue(accepts(dfa, "a"));
    Assertions.assertTrue(accepts(dfa, "aaab"));
    Assertions.assertTrue(accepts(dfa, "abbb"));
    Assertions.assertFalse(accepts(dfa, "aab"));
    Assertions.assertFalse(accepts(dfa, "b"));
    Assertions.assertFalse(accepts(dfa, ""));
    Assertions.assertFalse(accepts(dfa, "aba"));
    Assertions.assertEquals(expectedMinimalSize(nfa, dfa), dfa.size());

    // the explicit reject state of a complete DFA is trimmed as well
    Assertions.assertEquals(3, nfa.toDfa(true).minimize().size());

    dfa.minimize();
    Assertions.assertEquals(3, dfa.size());
  }

  @Test
  void testMinimizeAgainstAutomataLib() {
    for (String regex : List.of("(a|b)*abb", "(a|b)*", "ab|ac", "(ab)*(ba)*", "a?b?c?", "(a*b*)*c")) {
      Nfa<String> nfa = RegexParser.parseToNfa(regex);
      Dfa<String> dfa = nfa.toDfa(false).minimize();
      Assertions.assertEquals(expectedMinimalSize(nfa, dfa), dfa.size(), regex);

      CompactDFA<String> reference = nfa.toDfa(true).toCompactDFA();
      Alphabet<String> alphabet = reference.getInputAlphabet();
      Assertions.assertTrue(Automata.testEquivalence(reference, dfa.complete().toCompactDFA(), alphabet), regex);
    }
  }

  @Test
  void testMinimizeDropsUnreachableAndDeadStates() {
    // 0 -a-> 1 (final), 0 -b-> 2 -a-> 2 (dead), 5 unreachable
    Dfa<String> dfa = new Dfa<>(List.of(0, 1, 2, 5), List.of("a", "b"),
        List.of(Transition.of(0, "a", 1), Transition.of(0, "b", 2), Transition.of(2, "a", 2),
            Transition.of(5, "a", 1)), 0, List.of(1));
    dfa.minimize();
    Assertions.assertEquals(2, dfa.size());
    Assertions.assertEquals(1, dfa.transitions().size());
    Assertions.assertTrue(accepts(dfa, "a"));
    Assertions.assertFalse(accepts(dfa, "ba"));
  }

  @Test
  void testEmptyLanguage() {
    Dfa<String> dfa = new Dfa<>(List.of(0, 1), List.of("a"), List.of(Transition.of(0, "a", 1)), 0, List.of());
    dfa.minimize();
    Assertions.assertEquals(1, dfa.size());
    Assertions.assertTrue(dfa.transitions().isEmpty());
    Assertions.assertTrue(dfa.getFinalStates().isEmpty());
    Assertions.assertFalse(accepts(dfa, ""));
    Assertions.assertFalse(accepts(dfa, "a"));
  }

  @Test
  void testValidation() {
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new Dfa<>(List.of(0, 1), List.of("a"),
            List.of(Transition.of(0, "a", 1), Transition.of(0, "a", 0)), 0, List.of(1)));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new Dfa<>(List.of(0, 1), List.of("a"), List.of(Transition.<String>epsilon(0, 1)), 0, List.of(1)));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new Dfa<String>(List.of(0, 1), List.of("a"), List.of(), 2, List.of(1)));
    Assertions.assertThrows(IllegalArgumentException.class,
        () -> new Dfa<String>(List.of(0, 1), List.of("a"), List.of(), 0, List.of(3)));

    Dfa<String> dfa = new Dfa<>(List.of(0), List.of("a"), List.of(), 0, List.of(0));
    Assertions.assertEquals(Dfa.MISSING_STATE, dfa.getTransition(0, "a"));
    Assertions.assertThrows(IllegalArgumentException.class, () -> dfa.setTransition(0, "a", 4));
  }

  @Test
  void testComplete() {
    Dfa<String> dfa = RegexParser.parseToNfa("ab").toDfa(false);
    Assertions.assertFalse(dfa.isComplete());
    int before = dfa.size();
    dfa.complete();
    Assertions.assertTrue(dfa.isComplete());
    Assertions.assertEquals(before + 1, dfa.size());
    Assertions.assertTrue(accepts(dfa, "ab"));
    Assertions.assertFalse(accepts(dfa, "ba"));
    dfa.complete();
    Assertions.assertEquals(before + 1, dfa.size());
  }

  @Test
  void testToNfa() {
    Dfa<String> dfa = RegexParser.parseToNfa("(ab)*|c").toDfa(false).minimize();
    Nfa<String> nfa = dfa.toNfa();
    Assertions.assertEquals(dfa.size() + 1, nfa.size());
    Assertions.assertFalse(dfa.getStates().contains(nfa.getFinalState()));
    for (String s : List.of("", "ab", "abab", "c", "abc", "a", "cc")) {
      Assertions.assertEquals(accepts(dfa, s), nfa.accept(RegexParser.symbols(s)), s);
    }
  }

  @Test
  void testAutomataLibRoundTrip() {
    Dfa<String> dfa = RegexParser.parseToNfa("a(b|c)*").toDfa(true);
    CompactDFA<String> compact = dfa.toCompactDFA();
    Dfa<String> back = Dfa.fromDFA(compact, compact.getInputAlphabet());
    Assertions.assertEquals(dfa.size(), back.size());
    for (String s : List.of("a", "abcb", "", "b", "acca")) {
      Assertions.assertEquals(accepts(dfa, s), accepts(back, s), s);
    }
  }
}
