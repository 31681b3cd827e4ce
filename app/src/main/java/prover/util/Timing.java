package prover.util;

/** Lightweight wall-clock timer for searches. */
public final class Timing {
  private final long startedAt;

  private Timing(long startedAt) {
    this.startedAt = startedAt;
  }

  public static Timing start() {
    return new Timing(System.nanoTime());
  }

  public long elapsedMillis() {
    return (System.nanoTime() - startedAt) / 1_000_000L;
  }

  /** True once more than {@code budgetMs} has passed; a budget of 0 or less never expires. */
  public boolean isOver(long budgetMs) {
    return budgetMs > 0 && elapsedMillis() > budgetMs;
  }
}
