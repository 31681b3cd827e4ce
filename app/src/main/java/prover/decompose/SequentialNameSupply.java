package prover.decompose;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Issues {@code aa, ab, ..., zz, aaa, ...} in order, skipping names to avoid and names already
 * issued. Not thread-safe: one instance belongs to one search.
 */
public final class SequentialNameSupply implements NameSupply {
  private static final int ALPHABET = 26;
  private static final int MIN_LENGTH = 2;

  private final Set<String> issued = new HashSet<>();
  private long next;

  @Override
  public String fresh(Collection<String> avoid) {
    while (true) {
      String candidate = nameAt(next++);
      if (!avoid.contains(candidate) && issued.add(candidate)) {
        return candidate;
      }
    }
  }

  public Set<String> issued() {
    return Set.copyOf(issued);
  }

  static String nameAt(long index) {
    int length = MIN_LENGTH;
    long block = (long) ALPHABET * ALPHABET;
    long remaining = index;
    while (remaining >= block) {
      remaining -= block;
      length++;
      block *= ALPHABET;
    }
    char[] letters = new char[length];
    for (int i = length - 1; i >= 0; i--) {
      letters[i] = (char) ('a' + remaining % ALPHABET);
      remaining /= ALPHABET;
    }
    return new String(letters);
  }
}
