package prover.search;

/**
 * Bounds for a proof search.
 *
 * @param maxDepth decomposition steps allowed along one path
 * @param maxNodes sequents the whole search may visit
 * @param timeBudgetMs wall-clock budget, {@code 0} for none
 */
public record SearchOptions(int maxDepth, int maxNodes, long timeBudgetMs) {
  static final String MAX_DEPTH_PROPERTY = "prover.maxDepth";
  static final String MAX_NODES_PROPERTY = "prover.maxNodes";
  private static final int DEFAULT_MAX_DEPTH = 64;
  private static final int DEFAULT_MAX_NODES = 100_000;

  /**
   * Defaults, overridable via the system properties {@code prover.maxDepth} and {@code
   * prover.maxNodes}.
   */
  public static SearchOptions defaults() {
    return new SearchOptions(
        intProperty(MAX_DEPTH_PROPERTY, DEFAULT_MAX_DEPTH),
        intProperty(MAX_NODES_PROPERTY, DEFAULT_MAX_NODES),
        0L);
  }

  public static SearchOptions normalize(SearchOptions options) {
    if (options == null) {
      return defaults();
    }
    SearchOptions defaults = defaults();
    int maxDepth = options.maxDepth() > 0 ? options.maxDepth() : defaults.maxDepth();
    int maxNodes = options.maxNodes() > 0 ? options.maxNodes() : defaults.maxNodes();
    long timeBudgetMs = Math.max(0L, options.timeBudgetMs());
    return new SearchOptions(maxDepth, maxNodes, timeBudgetMs);
  }

  public SearchOptions withMaxDepth(int maxDepth) {
    return new SearchOptions(maxDepth, maxNodes, timeBudgetMs);
  }

  public SearchOptions withMaxNodes(int maxNodes) {
    return new SearchOptions(maxDepth, maxNodes, timeBudgetMs);
  }

  public SearchOptions withTimeBudgetMs(long timeBudgetMs) {
    return new SearchOptions(maxDepth, maxNodes, timeBudgetMs);
  }

  private static int intProperty(String name, int defaultValue) {
    String raw = System.getProperty(name);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    try {
      int value = Integer.parseInt(raw.trim());
      return value > 0 ? value : defaultValue;
    } catch (NumberFormatException ignored) {
      return defaultValue;
    }
  }
}
