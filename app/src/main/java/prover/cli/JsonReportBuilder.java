package prover.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import prover.search.ProofNode;
import prover.search.ProofNode.Attempt;
import prover.search.ProofResult;
import prover.search.SearchOptions;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

  String build(List<ProofResult> results, SearchOptions options, boolean includeTrees) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(results, options));
    List<Map<String, Object>> entries = new ArrayList<>();
    for (ProofResult result : results) {
      entries.add(result(result, includeTrees));
    }
    root.put("results", entries);
    return gson.toJson(root);
  }

  private Map<String, Object> meta(List<ProofResult> results, SearchOptions options) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("goal_count", results.size());
    meta.put("max_depth", options.maxDepth());
    meta.put("max_nodes", options.maxNodes());
    if (options.timeBudgetMs() > 0) {
      meta.put("time_budget_ms", options.timeBudgetMs());
    }
    return meta;
  }

  private Map<String, Object> result(ProofResult result, boolean includeTree) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("goal", result.goal().toString());
    map.put("verdict", lower(result.verdict()));
    map.put("nodes_visited", result.nodesVisited());
    map.put("max_depth_reached", result.maxDepthReached());
    map.put("time_ms", result.elapsedMillis());
    if (result.terminationReason() != null) {
      map.put("termination_reason", result.terminationReason());
    }
    if (includeTree) {
      map.put("tree", node(result.root()));
    }
    return map;
  }

  private Map<String, Object> node(ProofNode node) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("sequent", node.sequent().toString());
    map.put("verdict", lower(node.verdict()));
    if (!node.isTerminal()) {
      map.put("rule", lower(node.rule()));
      map.put("principal", node.principal().render());
      List<Map<String, Object>> attempts = new ArrayList<>();
      for (Attempt attempt : node.attempts()) {
        attempts.add(attempt(attempt));
      }
      map.put("alternatives", attempts);
    }
    return map;
  }

  private Map<String, Object> attempt(Attempt attempt) {
    Map<String, Object> map = new LinkedHashMap<>();
    if (attempt.witness() != null) {
      map.put("witness", attempt.witness());
    }
    map.put("verdict", lower(attempt.verdict()));
    List<Map<String, Object>> premises = new ArrayList<>();
    for (ProofNode premise : attempt.premises()) {
      premises.add(node(premise));
    }
    map.put("premises", premises);
    return map;
  }

  private static String lower(Enum<?> value) {
    return value.name().toLowerCase(Locale.ROOT);
  }
}
