package prover.parse;

import java.util.Locale;
import java.util.Objects;

/** A formula could not be read. Always carries the fragment of text that failed. */
public class FormulaParseException extends Exception {
  private static final long serialVersionUID = 1L;

  /** Enumerates the ways formula text can be rejected. */
  public enum Kind {
    /** Nothing left to parse once parentheses and whitespace are removed. */
    EMPTY_STRING,
    /** A connective or quantifier is missing an operand or has a bad variable. */
    MALFORMED_STRING,
    /** A token looks like a connective but cannot be built into one. */
    INVALID_CONNECTIVE
  }

  private final Kind kind;
  private final String offendingText;

  public FormulaParseException(Kind kind, String offendingText) {
    super(message(kind, offendingText));
    this.kind = Objects.requireNonNull(kind, "kind");
    this.offendingText = Objects.requireNonNull(offendingText, "offendingText");
  }

  public Kind kind() {
    return kind;
  }

  public String offendingText() {
    return offendingText;
  }

  private static String message(Kind kind, String offendingText) {
    String label = kind.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    return label + ": '" + offendingText + "'";
  }
}
