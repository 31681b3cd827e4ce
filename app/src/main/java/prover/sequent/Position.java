package prover.sequent;

import java.util.Objects;

/** Coordinates of one member of a sequent. */
public record Position(Side side, int index) {

  public Position {
    Objects.requireNonNull(side, "side");
    if (index < 0) {
      throw new IllegalArgumentException("index must be non-negative");
    }
  }
}
