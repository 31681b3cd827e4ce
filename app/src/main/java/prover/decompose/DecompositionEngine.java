package prover.decompose;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import prover.formula.Conditional;
import prover.formula.Conjunction;
import prover.formula.Connective;
import prover.formula.Disjunction;
import prover.formula.Existential;
import prover.formula.Formula;
import prover.formula.Negation;
import prover.formula.Universal;
import prover.sequent.Position;
import prover.sequent.Sequent;
import prover.sequent.Side;

/**
 * Reduces a sequent by one sequent-calculus step.
 *
 * <p>The principal formula is always the first complex member found by {@link
 * Sequent#firstComplexPosition()}. The input sequent is never mutated; every parent handed out is
 * an independent copy.
 *
 * <p>Reusable quantifier rules ({@link Rule.Kind#REUSABLE}) are instantiated against the names
 * visible at this step only. Names introduced deeper in the tree do not trigger another expansion,
 * so a search built on this engine is not complete for every first-order goal.
 */
public final class DecompositionEngine {
  private static final Logger LOG = LoggerFactory.getLogger(DecompositionEngine.class);

  private final NameSupply names;

  public DecompositionEngine() {
    this(new SequentialNameSupply());
  }

  public DecompositionEngine(NameSupply names) {
    this.names = Objects.requireNonNull(names, "names");
  }

  /**
   * Decomposes the first complex member of {@code sequent}.
   *
   * @return the alternatives for proving {@code sequent}, or empty if the sequent is atomic and
   *     only the closure check can settle it
   */
  public Optional<Branch> decompose(Sequent sequent) {
    Objects.requireNonNull(sequent, "sequent");
    Optional<Position> first = sequent.firstComplexPosition();
    if (first.isEmpty()) {
      return Optional.empty();
    }
    Position position = first.get();
    Sequent remaining = sequent.copy();
    Formula principal = remaining.removeAt(position);
    Connective connective =
        Connective.of(principal)
            .orElseThrow(() -> new IllegalStateException("Atom selected as complex: " + principal));
    Rule rule = Rule.of(connective, position.side());

    List<Leaf> alternatives = apply(rule, principal, remaining);
    LOG.debug(
        "{} on {} -> {} alternative(s) for {}", rule, principal, alternatives.size(), sequent);
    return Optional.of(new Branch(rule, principal, position, alternatives));
  }

  private List<Leaf> apply(Rule rule, Formula principal, Sequent remaining) {
    return switch (rule) {
      case NEGATION_ANTECEDENT -> {
        remaining.pushRight(((Negation) principal).negatum());
        yield List.of(Leaf.of(remaining));
      }
      case NEGATION_CONSEQUENT -> {
        remaining.pushLeft(((Negation) principal).negatum());
        yield List.of(Leaf.of(remaining));
      }
      case CONDITIONAL_ANTECEDENT -> {
        Conditional conditional = (Conditional) principal;
        Sequent showLeft = remaining.copy();
        showLeft.pushRight(conditional.left());
        remaining.pushLeft(conditional.right());
        yield List.of(Leaf.of(showLeft, remaining));
      }
      case CONDITIONAL_CONSEQUENT -> {
        Conditional conditional = (Conditional) principal;
        remaining.pushLeft(conditional.left());
        remaining.pushRight(conditional.right());
        yield List.of(Leaf.of(remaining));
      }
      case CONJUNCTION_ANTECEDENT -> {
        Conjunction conjunction = (Conjunction) principal;
        remaining.pushLeft(conjunction.left());
        remaining.pushLeft(conjunction.right());
        yield List.of(Leaf.of(remaining));
      }
      case CONJUNCTION_CONSEQUENT -> {
        Conjunction conjunction = (Conjunction) principal;
        Sequent showLeft = remaining.copy();
        showLeft.pushRight(conjunction.left());
        remaining.pushRight(conjunction.right());
        yield List.of(Leaf.of(showLeft, remaining));
      }
      case DISJUNCTION_ANTECEDENT -> {
        Disjunction disjunction = (Disjunction) principal;
        Sequent assumeLeft = remaining.copy();
        assumeLeft.pushLeft(disjunction.left());
        remaining.pushLeft(disjunction.right());
        yield List.of(Leaf.of(assumeLeft, remaining));
      }
      case DISJUNCTION_CONSEQUENT -> {
        Disjunction disjunction = (Disjunction) principal;
        remaining.pushRight(disjunction.left());
        remaining.pushRight(disjunction.right());
        yield List.of(Leaf.of(remaining));
      }
      case EXISTENTIAL_CONSEQUENT -> {
        Existential existential = (Existential) principal;
        yield reusable(
            existential.variable(), existential.predicate(), Side.CONSEQUENT, remaining);
      }
      case UNIVERSAL_ANTECEDENT -> {
        Universal universal = (Universal) principal;
        yield reusable(universal.variable(), universal.predicate(), Side.ANTECEDENT, remaining);
      }
      case EXISTENTIAL_ANTECEDENT -> {
        Existential existential = (Existential) principal;
        yield eigenvariable(
            existential.variable(), existential.predicate(), Side.ANTECEDENT, remaining);
      }
      case UNIVERSAL_CONSEQUENT -> {
        Universal universal = (Universal) principal;
        yield eigenvariable(
            universal.variable(), universal.predicate(), Side.CONSEQUENT, remaining);
      }
    };
  }

  /** One alternative per distinct visible name; the predicate's own names come first. */
  private List<Leaf> reusable(String variable, Formula predicate, Side side, Sequent remaining) {
    warnIfShadowed(variable, predicate);
    Set<String> candidates = new LinkedHashSet<>(predicate.names());
    candidates.addAll(remaining.names());
    if (candidates.isEmpty()) {
      candidates.add(names.fresh(List.of()));
    }

    List<Leaf> alternatives = new ArrayList<>(candidates.size());
    for (String name : candidates) {
      Sequent parent = remaining.copy();
      parent.push(side, predicate.instantiate(variable, name));
      alternatives.add(Leaf.instantiated(parent, name));
    }
    return alternatives;
  }

  private List<Leaf> eigenvariable(
      String variable, Formula predicate, Side side, Sequent remaining) {
    warnIfShadowed(variable, predicate);
    List<String> avoid = new ArrayList<>(predicate.names());
    avoid.addAll(remaining.names());
    String fresh = names.fresh(avoid);
    remaining.push(side, predicate.instantiate(variable, fresh));
    return List.of(Leaf.instantiated(remaining, fresh));
  }

  private static void warnIfShadowed(String variable, Formula predicate) {
    if (predicate.binds(variable)) {
      LOG.warn(
          "Instantiating <{}> in {} also rewrites a nested quantifier over the same variable",
          variable,
          predicate);
    }
  }
}
