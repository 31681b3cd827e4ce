package prover.decompose;

import java.util.List;
import java.util.Objects;
import prover.formula.Formula;
import prover.sequent.Position;

/**
 * Result of one decomposition step. The decomposed sequent is provable iff at least one of the
 * alternatives has all of its parents provable.
 */
public record Branch(Rule rule, Formula principal, Position position, List<Leaf> alternatives) {

  public Branch {
    Objects.requireNonNull(rule, "rule");
    Objects.requireNonNull(principal, "principal");
    Objects.requireNonNull(position, "position");
    alternatives = List.copyOf(Objects.requireNonNull(alternatives, "alternatives"));
    if (alternatives.isEmpty()) {
      throw new IllegalArgumentException("a branch needs at least one alternative");
    }
  }

  /** The only alternative of a deterministic rule. */
  public Leaf single() {
    if (alternatives.size() != 1) {
      throw new IllegalStateException(rule + " produced " + alternatives.size() + " alternatives");
    }
    return alternatives.get(0);
  }
}
