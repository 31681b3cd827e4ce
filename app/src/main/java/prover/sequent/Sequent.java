package prover.sequent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import prover.formula.Formula;

/**
 * One proof goal: the conjunction of the antecedent entails the disjunction of the consequent.
 *
 * <p>Member order carries no logical meaning but is preserved, because it fixes which member the
 * decomposition engine attacks next and therefore the exact shape of the proof tree.
 *
 * <p>Sequents are mutable; only the decomposition engine mutates them, and it copies first whenever
 * a rule needs independent parents.
 */
public final class Sequent {
  public static final String TURNSTILE = "|~";

  private final List<Formula> antecedent;
  private final List<Formula> consequent;

  public Sequent(List<Formula> antecedent, List<Formula> consequent) {
    this.antecedent = new ArrayList<>(Objects.requireNonNull(antecedent, "antecedent"));
    this.consequent = new ArrayList<>(Objects.requireNonNull(consequent, "consequent"));
    this.antecedent.forEach(f -> Objects.requireNonNull(f, "antecedent member"));
    this.consequent.forEach(f -> Objects.requireNonNull(f, "consequent member"));
  }

  public static Sequent empty() {
    return new Sequent(List.of(), List.of());
  }

  public static Sequent of(List<Formula> antecedent, List<Formula> consequent) {
    return new Sequent(antecedent, consequent);
  }

  public List<Formula> antecedent() {
    return Collections.unmodifiableList(antecedent);
  }

  public List<Formula> consequent() {
    return Collections.unmodifiableList(consequent);
  }

  public List<Formula> side(Side side) {
    return side == Side.ANTECEDENT ? antecedent() : consequent();
  }

  /** Sum of member complexities over both sides. */
  public int complexity() {
    int total = 0;
    for (Formula formula : antecedent) {
      total += formula.complexity();
    }
    for (Formula formula : consequent) {
      total += formula.complexity();
    }
    return total;
  }

  /** True when no member has anything left to decompose. */
  public boolean isAtomic() {
    return firstComplexPosition().isEmpty();
  }

  /**
   * Locates the first member with complexity above zero, scanning the antecedent left to right and
   * then the consequent left to right.
   */
  public Optional<Position> firstComplexPosition() {
    for (Side side : Side.values()) {
      List<Formula> members = members(side);
      for (int i = 0; i < members.size(); i++) {
        if (!members.get(i).isFinished()) {
          return Optional.of(new Position(side, i));
        }
      }
    }
    return Optional.empty();
  }

  public Formula get(Position position) {
    return members(position.side()).get(position.index());
  }

  /**
   * Detaches and returns the member at {@code position}.
   *
   * @throws IndexOutOfBoundsException if there is no such member
   */
  public Formula removeAt(Position position) {
    return removeAt(position.side(), position.index());
  }

  public Formula removeAt(Side side, int index) {
    return members(side).remove(index);
  }

  public void pushLeft(Formula formula) {
    antecedent.add(Objects.requireNonNull(formula, "formula"));
  }

  public void pushRight(Formula formula) {
    consequent.add(Objects.requireNonNull(formula, "formula"));
  }

  public void push(Side side, Formula formula) {
    if (side == Side.ANTECEDENT) {
      pushLeft(formula);
    } else {
      pushRight(formula);
    }
  }

  /** Appends the members of {@code other}, side by side. */
  public void mix(Sequent other) {
    other.antecedent.forEach(this::pushLeft);
    other.consequent.forEach(this::pushRight);
  }

  /** Constants mentioned anywhere in the sequent, antecedent first, duplicates kept. */
  public List<String> names() {
    List<String> names = new ArrayList<>();
    antecedent.forEach(f -> names.addAll(f.names()));
    consequent.forEach(f -> names.addAll(f.names()));
    return names;
  }

  public Sequent copy() {
    List<Formula> ant = new ArrayList<>(antecedent.size());
    antecedent.forEach(f -> ant.add(f.copy()));
    List<Formula> con = new ArrayList<>(consequent.size());
    consequent.forEach(f -> con.add(f.copy()));
    return new Sequent(ant, con);
  }

  private List<Formula> members(Side side) {
    return side == Side.ANTECEDENT ? antecedent : consequent;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Sequent other)) {
      return false;
    }
    return antecedent.equals(other.antecedent) && consequent.equals(other.consequent);
  }

  @Override
  public int hashCode() {
    return Objects.hash(antecedent, consequent);
  }

  @Override
  public String toString() {
    String ant = antecedent.stream().map(Formula::render).collect(Collectors.joining(", "));
    String con = consequent.stream().map(Formula::render).collect(Collectors.joining(", "));
    if (ant.isEmpty()) {
      return con.isEmpty() ? TURNSTILE : TURNSTILE + " " + con;
    }
    return con.isEmpty() ? ant + " " + TURNSTILE : ant + " " + TURNSTILE + " " + con;
  }
}
