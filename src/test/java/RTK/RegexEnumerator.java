package RTK;

import RTK.Model.Operator;
import RTK.Model.Token;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Enumerates every postfix program of a given token count over an alphabet, using concatenation, alternation and
 * star.
 */
public class RegexEnumerator {
  private static final List<Operator> OPERATORS =
      List.of(Operator.CONCATENATION, Operator.ALTERNATION, Operator.STAR);

  private final List<String> alphabet;
  private final Map<Integer, List<List<Token<String>>>> memo = new HashMap<>();

  public RegexEnumerator(List<String> alphabet) {
    this.alphabet = alphabet;
  }

  /**
   * @param length - number of tokens
   * @return all programs with exactly length tokens
   */
  public List<List<Token<String>>> enumerate(int length) {
    List<List<Token<String>>> cached = memo.get(length);
    if (cached != null) {
      return cached;
    }
    List<List<Token<String>>> result = new ArrayList<>();
    if (length == 1) {
      for (String sym : alphabet) {
        result.add(List.of(Token.literal(sym)));
      }
    }
    for (Operator op : OPERATORS) {
      if (op.numArgs == 1 && length >= 2) {
        for (List<Token<String>> operand : enumerate(length - 1)) {
          result.add(append(op, operand));
        }
      } else if (op.numArgs == 2) {
        // split the length - 1 operand tokens into two non-empty programs
        for (int split = 1; split < length - 1; split++) {
          for (List<Token<String>> left : enumerate(split)) {
            for (List<Token<String>> right : enumerate(length - 1 - split)) {
              result.add(append(op, left, right));
            }
          }
        }
      }
    }
    memo.put(length, result);
    return result;
  }

  /**
   * @return all programs with 1 to maxLength tokens
   */
  public List<List<Token<String>>> enumerateUpTo(int maxLength) {
    List<List<Token<String>>> result = new ArrayList<>();
    for (int length = 1; length <= maxLength; length++) {
      result.addAll(enumerate(length));
    }
    return result;
  }

  @SafeVarargs
  private static List<Token<String>> append(Operator op, List<Token<String>>... operands) {
    List<Token<String>> program = new ArrayList<>();
    for (List<Token<String>> operand : operands) {
      program.addAll(operand);
    }
    program.add(Token.operator(op));
    return List.copyOf(program);
  }
}
