package prover.decompose;

import java.util.List;
import java.util.Objects;
import prover.sequent.Sequent;

/**
 * One way of deriving the decomposed sequent: it follows once every parent is proved.
 *
 * @param parents premises, all of which must be provable
 * @param witness the name a quantifier rule instantiated with, or {@code null} for connective rules
 */
public record Leaf(List<Sequent> parents, String witness) {

  public Leaf {
    parents = List.copyOf(Objects.requireNonNull(parents, "parents"));
    if (parents.isEmpty()) {
      throw new IllegalArgumentException("a leaf needs at least one parent");
    }
  }

  public static Leaf of(Sequent... parents) {
    return new Leaf(List.of(parents), null);
  }

  public static Leaf instantiated(Sequent parent, String witness) {
    return new Leaf(List.of(parent), Objects.requireNonNull(witness, "witness"));
  }

  public boolean isInstantiation() {
    return witness != null;
  }
}
