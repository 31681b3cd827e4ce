package prover.search;

/** Outcome of searching one node of the proof tree. */
public enum Verdict {
  PROVED,
  /** Every alternative was explored and none closed. */
  UNPROVED,
  /** A search bound was hit before the node was settled. */
  UNDECIDED;

  /** Conjunction over the parents of one leaf. */
  Verdict and(Verdict other) {
    if (this == UNPROVED || other == UNPROVED) {
      return UNPROVED;
    }
    return this == PROVED && other == PROVED ? PROVED : UNDECIDED;
  }

  /** Disjunction over the alternatives of one branch. */
  Verdict or(Verdict other) {
    if (this == PROVED || other == PROVED) {
      return PROVED;
    }
    return this == UNDECIDED || other == UNDECIDED ? UNDECIDED : UNPROVED;
  }
}
