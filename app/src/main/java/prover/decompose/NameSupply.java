package prover.decompose;

import java.util.Collection;

/**
 * Source of fresh constants for quantifier instantiation. Implementations must return a name of
 * two or more lowercase letters that is not in {@code avoid} and that they have never returned
 * before.
 */
@FunctionalInterface
public interface NameSupply {
  String fresh(Collection<String> avoid);
}
