package prover.parse;

import java.util.Locale;
import java.util.Objects;

/** Sequent text could not be read. Carries the fragment that failed. */
public class SequentParseException extends Exception {
  private static final long serialVersionUID = 1L;

  public enum Kind {
    /** The text does not contain exactly one turnstile. */
    TURNSTILE_COUNT,
    /** One of the comma-separated members is not a formula; the cause says why. */
    FORMULA
  }

  private final Kind kind;
  private final String offendingText;

  public SequentParseException(Kind kind, String offendingText) {
    this(kind, offendingText, null);
  }

  public SequentParseException(Kind kind, String offendingText, FormulaParseException cause) {
    super(message(kind, offendingText, cause), cause);
    this.kind = Objects.requireNonNull(kind, "kind");
    this.offendingText = Objects.requireNonNull(offendingText, "offendingText");
  }

  public Kind kind() {
    return kind;
  }

  public String offendingText() {
    return offendingText;
  }

  private static String message(Kind kind, String offendingText, FormulaParseException cause) {
    String label = kind.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    String base = label + ": '" + offendingText + "'";
    return cause == null ? base : base + " (" + cause.getMessage() + ")";
  }
}
