package prover.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import prover.decompose.Branch;
import prover.decompose.DecompositionEngine;
import prover.decompose.Leaf;
import prover.decompose.NameSupply;
import prover.decompose.SequentialNameSupply;
import prover.sequent.Sequent;
import prover.util.Timing;

/**
 * Drives the decomposition engine to a verdict.
 *
 * <p>Depth first, alternatives and premises in the order the engine produces them. A leaf's
 * premises are combined with AND and a branch's alternatives with OR; both short-circuit, so the
 * recorded tree only contains what was actually searched. Atomic sequents are settled by the {@link
 * ClosureChecker}.
 */
public final class ProofSearch {
  private static final Logger LOG = LoggerFactory.getLogger(ProofSearch.class);

  static final String DEPTH_LIMIT = "depth_limit_reached";
  static final String NODE_LIMIT = "node_limit_reached";
  static final String TIME_BUDGET = "time_budget_exceeded";

  private final SearchOptions options;
  private final ClosureChecker closure;
  private final Supplier<NameSupply> nameSupplies;

  public ProofSearch() {
    this(SearchOptions.defaults());
  }

  public ProofSearch(SearchOptions options) {
    this(options, ClosureChecker.sharedFormula(), SequentialNameSupply::new);
  }

  public ProofSearch(
      SearchOptions options, ClosureChecker closure, Supplier<NameSupply> nameSupplies) {
    this.options = SearchOptions.normalize(options);
    this.closure = Objects.requireNonNull(closure, "closure");
    this.nameSupplies = Objects.requireNonNull(nameSupplies, "nameSupplies");
  }

  public SearchOptions options() {
    return options;
  }

  public ProofResult prove(Sequent goal) {
    Objects.requireNonNull(goal, "goal");
    LOG.info(
        "Searching {} (max depth {}, max nodes {})",
        goal,
        options.maxDepth(),
        options.maxNodes());
    Run run = new Run(new DecompositionEngine(nameSupplies.get()), Timing.start());
    ProofNode root = run.search(goal, 0);
    ProofResult result =
        new ProofResult(
            goal,
            root.verdict(),
            root,
            run.nodes,
            run.deepest,
            run.timer.elapsedMillis(),
            run.termination);
    LOG.info(
        "{} after {} node(s), depth {}, {} ms",
        result.verdict(),
        result.nodesVisited(),
        result.maxDepthReached(),
        result.elapsedMillis());
    if (result.terminationReason() != null) {
      LOG.warn("Search stopped early: {}", result.terminationReason());
    }
    return result;
  }

  /** Mutable bookkeeping for a single {@link #prove} call. */
  private final class Run {
    private final DecompositionEngine engine;
    private final Timing timer;
    private int nodes;
    private int deepest;
    private String termination;

    private Run(DecompositionEngine engine, Timing timer) {
      this.engine = engine;
      this.timer = timer;
    }

    private ProofNode search(Sequent sequent, int depth) {
      nodes++;
      deepest = Math.max(deepest, depth);
      if (nodes > options.maxNodes()) {
        return cutOff(sequent, NODE_LIMIT);
      }
      if (timer.isOver(options.timeBudgetMs())) {
        return cutOff(sequent, TIME_BUDGET);
      }

      Optional<Branch> decomposed = engine.decompose(sequent);
      if (decomposed.isEmpty()) {
        boolean closed = closure.isClosed(sequent);
        LOG.trace("{} at depth {}: {}", sequent, depth, closed ? "closed" : "open");
        return ProofNode.terminal(sequent, closed ? Verdict.PROVED : Verdict.UNPROVED);
      }
      if (depth >= options.maxDepth()) {
        return cutOff(sequent, DEPTH_LIMIT);
      }

      Branch branch = decomposed.get();
      List<ProofNode.Attempt> attempts = new ArrayList<>();
      Verdict verdict = Verdict.UNPROVED;
      for (Leaf leaf : branch.alternatives()) {
        ProofNode.Attempt attempt = attempt(leaf, depth + 1);
        attempts.add(attempt);
        verdict = verdict.or(attempt.verdict());
        if (verdict == Verdict.PROVED) {
          break;
        }
      }
      return new ProofNode(sequent, verdict, branch.rule(), branch.principal(), attempts);
    }

    private ProofNode.Attempt attempt(Leaf leaf, int depth) {
      List<ProofNode> premises = new ArrayList<>(leaf.parents().size());
      Verdict verdict = Verdict.PROVED;
      for (Sequent parent : leaf.parents()) {
        ProofNode premise = search(parent, depth);
        premises.add(premise);
        verdict = verdict.and(premise.verdict());
        if (verdict == Verdict.UNPROVED) {
          break;
        }
      }
      return new ProofNode.Attempt(leaf.witness(), premises, verdict);
    }

    private ProofNode cutOff(Sequent sequent, String reason) {
      if (termination == null) {
        termination = reason;
      }
      return ProofNode.terminal(sequent, Verdict.UNDECIDED);
    }
  }
}
