package prover.search;

import prover.formula.Formula;
import prover.sequent.Sequent;

/** Decides whether a sequent that cannot be decomposed further is already proved. */
@FunctionalInterface
public interface ClosureChecker {

  boolean isClosed(Sequent sequent);

  /** Closed when some formula occurs, structurally equal, on both sides. */
  static ClosureChecker sharedFormula() {
    return sequent -> {
      for (Formula assumed : sequent.antecedent()) {
        if (sequent.consequent().contains(assumed)) {
          return true;
        }
      }
      return false;
    };
  }
}
