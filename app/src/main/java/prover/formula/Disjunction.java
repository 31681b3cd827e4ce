package prover.formula;

import java.util.List;
import java.util.Objects;

/** At least one side holds. */
public record Disjunction(Formula left, Formula right) implements Formula {

  public Disjunction {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }

  @Override
  public int complexity() {
    return 1 + Math.max(left.complexity(), right.complexity());
  }

  @Override
  public List<Formula> children() {
    return List.of(left, right);
  }

  @Override
  public Disjunction instantiate(String variable, String name) {
    return new Disjunction(left.instantiate(variable, name), right.instantiate(variable, name));
  }

  @Override
  public String render() {
    return FormulaStringBuilder.binary(left.render(), Connective.DISJUNCTION, right.render());
  }

  @Override
  public String toString() {
    return render();
  }
}
