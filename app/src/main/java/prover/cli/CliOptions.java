package prover.cli;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import prover.search.SearchOptions;

record CliOptions(
    List<String> goals,
    Path goalFile,
    int maxDepth,
    int maxNodes,
    long timeBudgetMs,
    boolean json,
    boolean tree) {

  CliOptions {
    goals = goals == null ? List.of() : List.copyOf(goals);
    if (maxDepth < 0) {
      throw new IllegalArgumentException("max depth must be non-negative");
    }
    if (maxNodes < 0) {
      throw new IllegalArgumentException("max nodes must be non-negative");
    }
    if (timeBudgetMs < 0) {
      throw new IllegalArgumentException("time budget must be non-negative");
    }
  }

  boolean hasGoalFile() {
    return goalFile != null;
  }

  SearchOptions searchOptions() {
    return SearchOptions.normalize(
        SearchOptions.defaults()
            .withMaxDepth(maxDepth)
            .withMaxNodes(maxNodes)
            .withTimeBudgetMs(timeBudgetMs));
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private final List<String> goals = new ArrayList<>();
    private Path goalFile;
    private int maxDepth = SearchOptions.defaults().maxDepth();
    private int maxNodes = SearchOptions.defaults().maxNodes();
    private long timeBudgetMs = SearchOptions.defaults().timeBudgetMs();
    private boolean json;
    private boolean tree;

    Builder goal(String goal) {
      goals.add(goal);
      return this;
    }

    Builder goalFile(Path goalFile) {
      this.goalFile = goalFile;
      return this;
    }

    Builder maxDepth(int maxDepth) {
      this.maxDepth = maxDepth;
      return this;
    }

    Builder maxNodes(int maxNodes) {
      this.maxNodes = maxNodes;
      return this;
    }

    Builder timeBudgetMs(long timeBudgetMs) {
      this.timeBudgetMs = timeBudgetMs;
      return this;
    }

    Builder json(boolean json) {
      this.json = json;
      return this;
    }

    Builder tree(boolean tree) {
      this.tree = tree;
      return this;
    }

    CliOptions build() {
      return new CliOptions(goals, goalFile, maxDepth, maxNodes, timeBudgetMs, json, tree);
    }
  }
}
