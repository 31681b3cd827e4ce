package prover.search;

import java.util.Objects;
import prover.sequent.Sequent;

/** Summary of a finished search. {@code terminationReason} is null unless a bound was hit. */
public record ProofResult(
    Sequent goal,
    Verdict verdict,
    ProofNode root,
    int nodesVisited,
    int maxDepthReached,
    long elapsedMillis,
    String terminationReason) {

  public ProofResult {
    Objects.requireNonNull(goal, "goal");
    Objects.requireNonNull(verdict, "verdict");
    Objects.requireNonNull(root, "root");
  }

  public boolean isProved() {
    return verdict == Verdict.PROVED;
  }
}
