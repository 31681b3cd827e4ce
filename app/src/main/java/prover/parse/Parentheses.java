package prover.parse;

import com.google.common.base.CharMatcher;

/** Parenthesis helpers shared by the formula and sequent parsers. */
public final class Parentheses {
  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();

  private Parentheses() {}

  /**
   * Removes outer parentheses for as long as they form one connected pair. {@code "((A))"} becomes
   * {@code "A"}, while {@code "(A) & (B)"} is returned unchanged because its first group closes
   * before the last character. Surrounding whitespace, Unicode spaces included, is trimmed.
   * Applying this twice is the same as applying it once.
   */
  public static String strip(String text) {
    String current = WHITESPACE.trimFrom(text);
    while (isSingleGroup(current)) {
      current = WHITESPACE.trimFrom(current.substring(1, current.length() - 1));
    }
    return current;
  }

  /** True if {@code text} starts with {@code (} whose matching {@code )} is the last character. */
  public static boolean isSingleGroup(String text) {
    if (text.length() < 2 || text.charAt(0) != '(' || text.charAt(text.length() - 1) != ')') {
      return false;
    }
    int depth = 0;
    for (int i = 0; i < text.length(); i++) {
      depth += delta(text.charAt(i));
      if (depth <= 0 && i + 1 < text.length()) {
        return false;
      }
    }
    return depth == 0;
  }

  /** Net nesting change contributed by {@code token}. */
  public static int depthChange(String token) {
    int change = 0;
    for (int i = 0; i < token.length(); i++) {
      change += delta(token.charAt(i));
    }
    return change;
  }

  private static int delta(char c) {
    if (c == '(') {
      return 1;
    }
    return c == ')' ? -1 : 0;
  }
}
