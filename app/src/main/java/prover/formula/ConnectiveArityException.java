package prover.formula;

import java.util.Locale;

/** Raised when a connective is built from the wrong number of sub-formulas. */
public final class ConnectiveArityException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  private final Connective connective;
  private final int supplied;

  public ConnectiveArityException(Connective connective, int supplied) {
    this(connective, supplied, null);
  }

  public ConnectiveArityException(Connective connective, int supplied, String detail) {
    super(message(connective, supplied, detail));
    this.connective = connective;
    this.supplied = supplied;
  }

  public Connective connective() {
    return connective;
  }

  public int supplied() {
    return supplied;
  }

  private static String message(Connective connective, int supplied, String detail) {
    String base =
        connective.name().charAt(0)
            + connective.name().substring(1).toLowerCase(Locale.ROOT)
            + " requires "
            + connective.arity()
            + " subformula"
            + (connective.arity() == 1 ? "" : "s")
            + ", not "
            + supplied;
    return detail == null ? base : base + " (" + detail + ")";
  }
}
