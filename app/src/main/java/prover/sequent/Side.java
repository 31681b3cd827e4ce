package prover.sequent;

/** The two halves of a sequent, in the order the decomposition engine scans them. */
public enum Side {
  /** Formulas assumed true. */
  ANTECEDENT,
  /** Formulas of which at least one is to be shown. */
  CONSEQUENT;

  public Side opposite() {
    return this == ANTECEDENT ? CONSEQUENT : ANTECEDENT;
  }
}
