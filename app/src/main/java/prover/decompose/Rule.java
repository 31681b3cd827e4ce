package prover.decompose;

import prover.formula.Connective;
import prover.sequent.Side;

/**
 * The sequent-calculus rules, one per (connective, side) pair.
 *
 * <ul>
 *   <li>Branching rules need two independently provable parents in their single leaf.
 *   <li>Reusable quantifier rules produce one alternative leaf per visible name.
 *   <li>Eigenvariable rules instantiate exactly once with a fresh name.
 * </ul>
 */
public enum Rule {
  NEGATION_ANTECEDENT(Connective.NEGATION, Side.ANTECEDENT, Kind.LINEAR),
  NEGATION_CONSEQUENT(Connective.NEGATION, Side.CONSEQUENT, Kind.LINEAR),
  CONDITIONAL_ANTECEDENT(Connective.CONDITIONAL, Side.ANTECEDENT, Kind.BRANCHING),
  CONDITIONAL_CONSEQUENT(Connective.CONDITIONAL, Side.CONSEQUENT, Kind.LINEAR),
  CONJUNCTION_ANTECEDENT(Connective.CONJUNCTION, Side.ANTECEDENT, Kind.LINEAR),
  CONJUNCTION_CONSEQUENT(Connective.CONJUNCTION, Side.CONSEQUENT, Kind.BRANCHING),
  DISJUNCTION_ANTECEDENT(Connective.DISJUNCTION, Side.ANTECEDENT, Kind.BRANCHING),
  DISJUNCTION_CONSEQUENT(Connective.DISJUNCTION, Side.CONSEQUENT, Kind.LINEAR),
  EXISTENTIAL_ANTECEDENT(Connective.EXISTENTIAL, Side.ANTECEDENT, Kind.EIGENVARIABLE),
  EXISTENTIAL_CONSEQUENT(Connective.EXISTENTIAL, Side.CONSEQUENT, Kind.REUSABLE),
  UNIVERSAL_ANTECEDENT(Connective.UNIVERSAL, Side.ANTECEDENT, Kind.REUSABLE),
  UNIVERSAL_CONSEQUENT(Connective.UNIVERSAL, Side.CONSEQUENT, Kind.EIGENVARIABLE);

  /** How a rule shapes the branch it produces. */
  public enum Kind {
    LINEAR,
    BRANCHING,
    REUSABLE,
    EIGENVARIABLE
  }

  private final Connective connective;
  private final Side side;
  private final Kind kind;

  Rule(Connective connective, Side side, Kind kind) {
    this.connective = connective;
    this.side = side;
    this.kind = kind;
  }

  public Connective connective() {
    return connective;
  }

  public Side side() {
    return side;
  }

  public Kind kind() {
    return kind;
  }

  public static Rule of(Connective connective, Side side) {
    for (Rule rule : values()) {
      if (rule.connective == connective && rule.side == side) {
        return rule;
      }
    }
    throw new IllegalArgumentException("No rule for " + connective + " on " + side);
  }
}
