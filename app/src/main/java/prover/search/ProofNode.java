package prover.search;

import java.util.List;
import java.util.Objects;
import prover.decompose.Rule;
import prover.formula.Formula;
import prover.sequent.Sequent;

/**
 * A visited sequent and how it was settled. Atomic sequents and nodes cut off by a bound have no
 * rule and no attempts.
 */
public record ProofNode(
    Sequent sequent, Verdict verdict, Rule rule, Formula principal, List<Attempt> attempts) {

  public ProofNode {
    Objects.requireNonNull(sequent, "sequent");
    Objects.requireNonNull(verdict, "verdict");
    attempts = attempts == null ? List.of() : List.copyOf(attempts);
  }

  static ProofNode terminal(Sequent sequent, Verdict verdict) {
    return new ProofNode(sequent, verdict, null, null, List.of());
  }

  public boolean isTerminal() {
    return rule == null;
  }

  /**
   * One alternative of a rule application: the premises that were searched (remaining ones are
   * skipped once the outcome is known).
   */
  public record Attempt(String witness, List<ProofNode> premises, Verdict verdict) {

    public Attempt {
      premises = List.copyOf(Objects.requireNonNull(premises, "premises"));
      Objects.requireNonNull(verdict, "verdict");
    }
  }
}
