package prover.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * Scanner for the bracketed placeholder tokens embedded in atom text.
 *
 * <p>A span {@code <...>} whose content is only lowercase ASCII letters is a token: one letter is
 * a bindable variable, two or more letters a constant already in play. Any other bracketed span is
 * plain predicate text.
 */
public final class Placeholders {
  private Placeholders() {}

  public static List<String> variables(String text) {
    return tokens(text, true);
  }

  public static List<String> names(String text) {
    return tokens(text, false);
  }

  /** Replaces every {@code <variable>} with {@code <name>}. */
  public static String substitute(String text, String variable, String name) {
    return text.replace(bracket(variable), bracket(name));
  }

  public static String bracket(String token) {
    return "<" + token + ">";
  }

  /** True for exactly {@code <c>} with {@code c} one lowercase letter. */
  public static boolean isVariableToken(String token) {
    return token.length() == 3
        && token.charAt(0) == '<'
        && token.charAt(2) == '>'
        && isLowerLetter(token.charAt(1));
  }

  public static boolean isName(String candidate) {
    return candidate.length() >= 2 && isLowerLetters(candidate);
  }

  private static List<String> tokens(String text, boolean variables) {
    List<String> found = new ArrayList<>();
    int i = 0;
    while (i < text.length()) {
      int open = text.indexOf('<', i);
      if (open < 0) {
        break;
      }
      int close = text.indexOf('>', open + 1);
      if (close < 0) {
        break;
      }
      String content = text.substring(open + 1, close);
      if (!content.isEmpty() && isLowerLetters(content)) {
        boolean single = content.length() == 1;
        if (single == variables) {
          found.add(content);
        }
        i = close + 1;
      } else {
        // the span may still start at a later '<', e.g. "<<ab>"
        i = open + 1;
      }
    }
    return found;
  }

  private static boolean isLowerLetters(String content) {
    for (int i = 0; i < content.length(); i++) {
      if (!isLowerLetter(content.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isLowerLetter(char c) {
    return c >= 'a' && c <= 'z';
  }
}
