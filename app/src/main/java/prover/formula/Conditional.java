package prover.formula;

import java.util.List;
import java.util.Objects;

/** If the left side holds, so does the right side. */
public record Conditional(Formula left, Formula right) implements Formula {

  public Conditional {
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
  public Conditional instantiate(String variable, String name) {
    return new Conditional(left.instantiate(variable, name), right.instantiate(variable, name));
  }

  @Override
  public String render() {
    return FormulaStringBuilder.binary(left.render(), Connective.CONDITIONAL, right.render());
  }

  @Override
  public String toString() {
    return render();
  }
}
