package prover.formula;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Formula-forming operators together with their surface syntax. Every connective has a symbol and
 * a word form; either is accepted by the parser, only the symbol is rendered.
 */
public enum Connective {
  NEGATION("~", "not", 1),
  CONJUNCTION("&", "and", 2),
  DISJUNCTION("v", "or", 2),
  CONDITIONAL(">", "implies", 2),
  EXISTENTIAL("∃", "exists", 1),
  UNIVERSAL("∀", "forall", 1);

  private final String symbol;
  private final String word;
  private final int arity;

  Connective(String symbol, String word, int arity) {
    this.symbol = symbol;
    this.word = word;
    this.arity = arity;
  }

  public String symbol() {
    return symbol;
  }

  public String word() {
    return word;
  }

  public int arity() {
    return arity;
  }

  public boolean isQuantifier() {
    return this == EXISTENTIAL || this == UNIVERSAL;
  }

  public boolean isBinary() {
    return arity == 2;
  }

  public boolean matches(String token) {
    return symbol.equals(token) || word.equals(token);
  }

  /** Resolves a whole whitespace-separated token to its connective. */
  public static Optional<Connective> fromKeyword(String token) {
    for (Connective connective : values()) {
      if (connective.matches(token)) {
        return Optional.of(connective);
      }
    }
    return Optional.empty();
  }

  /** The principal connective of {@code formula}, or empty for an atom. */
  public static Optional<Connective> of(Formula formula) {
    if (formula instanceof Negation) {
      return Optional.of(NEGATION);
    }
    if (formula instanceof Conjunction) {
      return Optional.of(CONJUNCTION);
    }
    if (formula instanceof Disjunction) {
      return Optional.of(DISJUNCTION);
    }
    if (formula instanceof Conditional) {
      return Optional.of(CONDITIONAL);
    }
    if (formula instanceof Existential) {
      return Optional.of(EXISTENTIAL);
    }
    if (formula instanceof Universal) {
      return Optional.of(UNIVERSAL);
    }
    return Optional.empty();
  }

  /**
   * Builds a negation or binary formula from its children.
   *
   * @throws ConnectiveArityException if the number of children does not match the arity, or if
   *     this is a quantifier (use {@link #bind})
   */
  public Formula build(List<Formula> children) {
    Objects.requireNonNull(children, "children");
    if (isQuantifier()) {
      throw new ConnectiveArityException(this, children.size(), "quantifiers bind a variable");
    }
    if (children.size() != arity) {
      throw new ConnectiveArityException(this, children.size());
    }
    return switch (this) {
      case NEGATION -> new Negation(children.get(0));
      case CONJUNCTION -> new Conjunction(children.get(0), children.get(1));
      case DISJUNCTION -> new Disjunction(children.get(0), children.get(1));
      case CONDITIONAL -> new Conditional(children.get(0), children.get(1));
      default -> throw new IllegalStateException("Unhandled connective " + this);
    };
  }

  /**
   * Builds a quantified formula.
   *
   * @throws ConnectiveArityException if this is not a quantifier
   */
  public Formula bind(String variable, Formula predicate) {
    Objects.requireNonNull(variable, "variable");
    Objects.requireNonNull(predicate, "predicate");
    return switch (this) {
      case EXISTENTIAL -> new Existential(variable, predicate);
      case UNIVERSAL -> new Universal(variable, predicate);
      default -> throw new ConnectiveArityException(this, 1, "only quantifiers bind a variable");
    };
  }
}
