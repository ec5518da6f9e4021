package RTK;

import RTK.Distance.Correction;
import RTK.Distance.WagnerCorrection;
import RTK.Elimination.StateElimination;
import RTK.Parsing.RegexParser;
import net.automatalib.alphabet.Alphabet;
import net.automatalib.automaton.fsa.impl.CompactDFA;
import net.automatalib.util.automaton.Automata;
import net.automatalib.util.automaton.minimizer.HopcroftMinimizer;

import java.util.ArrayList;
import java.util.List;

public class RTKCommandLine {
  public static void main(String[] args) {
    boolean dot = false;
    boolean complete = false;
    List<String> positional = new ArrayList<>();

    for (String arg : args) {
      if ("--debug".equalsIgnoreCase(arg)) {
        // must happen before the first logger is created
        System.setProperty("org.slf4j.simpleLogger.defaultLogLevel", "debug");
      } else if ("--dot".equalsIgnoreCase(arg)) {
        dot = true;
      } else if ("--complete".equalsIgnoreCase(arg)) {
        complete = true;
      } else if (arg.startsWith("--")) {
        // Unknown flag
        printUsageAndExit();
      } else {
        positional.add(arg);
      }
    }

    if (positional.size() < 2) {
      printUsageAndExit();
    }
    String command = positional.get(0).toLowerCase();
    String regex = positional.get(1);
    List<String> inputs = positional.subList(2, positional.size());
    boolean validInvocation = switch (command) {
      case "accept" -> true;
      case "correct" -> inputs.size() == 1;
      default -> inputs.isEmpty();
    };
    if (!validInvocation) {
      printUsageAndExit();
    }

    long before = System.currentTimeMillis();
    run(command, regex, inputs, dot, complete);
    long after = System.currentTimeMillis();
    System.out.println(command + " duration: " + ((after - before) / 1000f) + "s");
  }

  private static void printUsageAndExit() {
    System.out.println("RTK [--debug] [--dot] [--complete] <command> <regex> [<string>...]");
    System.out.println("[--debug] : Log engine diagnostics (elimination order, partition sizes, correction tables)");
    System.out.println("[--dot] : Print the resulting automaton in Graphviz DOT format");
    System.out.println("[--complete] : Keep the reject state explicit in subset construction");
    System.out.println();
    System.out.println("<command> : one of the choices below:");
    System.out.println("  accept <regex> <string>... : Test each string against the regex.");
    System.out.println("  dfa <regex> : Subset construction and minimization, cross-checked with AutomataLib.");
    System.out.println("  regex <regex> : Rebuild a regex from the minimized DFA by state elimination.");
    System.out.println("  correct <regex> <string> : Correction distance, and the automaton extended to accept it.");
    System.exit(0);
  }

  /**
   * Choose command to run.
   * @param command - command passed in from command-line, lower case
   * @param regex - regex the automaton is built from
   * @param inputs - strings passed after the regex
   * @param dot - whether to print the resulting automaton as DOT text
   * @param complete - whether subset construction keeps the reject state
   */
  static void run(String command, String regex, List<String> inputs, boolean dot, boolean complete) {
    System.out.println("Invoking command:" + command);
    switch (command) {
      case "accept" -> {
        List<Boolean> results = accept(regex, inputs);
        for (int i = 0; i < inputs.size(); i++) {
          System.out.println("\"" + inputs.get(i) + "\": " + (results.get(i) ? "accepted" : "rejected"));
        }
      }
      case "dfa" -> {
        Dfa<String> dfa = minimizedDfa(regex, complete);
        System.out.println("Minimized DFA size: " + dfa.size());
        if (dot) {
          System.out.println(DotFormat.toDot(dfa));
        }
      }
      case "regex" -> {
        String rebuilt = rebuildRegex(regex);
        System.out.println("Regex: " + (rebuilt == null ? "(empty language)" : rebuilt));
      }
      case "correct" -> {
        Correction<String> correction = correct(regex, inputs.get(0));
        System.out.println("Distance: " + correction.distance());
        System.out.println("Added path: " + correction.path());
        if (dot) {
          System.out.println(DotFormat.toDot(correction.automaton()));
        }
      }
      default -> throw new IllegalStateException("Unexpected command choice: " + command);
    }
  }

  /**
   * Run each input through both the NFA and the minimized DFA of regex.
   * @return acceptance per input
   * @throws IllegalStateException if the two automata disagree
   */
  static List<Boolean> accept(String regex, List<String> inputs) {
    final Nfa<String> nfa = RegexParser.parseToNfa(regex);
    final Dfa<String> dfa = nfa.toDfa(false).minimize();
    List<Boolean> results = new ArrayList<>(inputs.size());
    for (String input : inputs) {
      List<String> symbols = RegexParser.symbols(input);
      boolean accepted = nfa.accept(symbols);
      if (accepted != dfa.accept(symbols)) {
        throw new IllegalStateException("NFA and DFA disagree on: " + input);
      }
      results.add(accepted);
    }
    return results;
  }

  /**
   * Determinize and minimize the automaton of regex, checking the result against AutomataLib's Hopcroft
   * minimization.
   * @return minimized DFA
   */
  static Dfa<String> minimizedDfa(String regex, boolean complete) {
    final Nfa<String> nfa = RegexParser.parseToNfa(regex);
    System.out.println("NFA size: " + nfa.size());
    System.out.println("Alphabet size:" + nfa.getAlphabet().size());

    final Dfa<String> dfa = nfa.toDfa(complete);
    System.out.println("Unminimized SC DFA size: " + dfa.size());
    dfa.minimize();

    final CompactDFA<String> reference = nfa.toDfa(true).toCompactDFA();
    final Alphabet<String> alphabet = reference.getInputAlphabet();
    final CompactDFA<String> minimized = HopcroftMinimizer.minimizeDFA(reference, alphabet);
    System.out.println("AutomataLib minimized DFA size: " + minimized.size());
    final Dfa<String> total = nfa.toDfa(true).minimize().complete();
    if (!Automata.testEquivalence(minimized, total.toCompactDFA(), alphabet)) {
      throw new IllegalStateException("Minimized DFA is not equivalent to AutomataLib's");
    }
    return dfa;
  }

  /**
   * Minimize the automaton of regex and eliminate its states back to a regex.
   * @return regex text, or null for the empty language
   */
  static String rebuildRegex(String regex) {
    final Nfa<String> nfa = RegexParser.parseToNfa(regex).toDfa(false).minimize().toNfa();
    return StateElimination.toRegex(nfa).orElse(null);
  }

  static Correction<String> correct(String regex, String input) {
    return WagnerCorrection.correct(RegexParser.parseToNfa(regex), RegexParser.symbols(input));
  }
}
