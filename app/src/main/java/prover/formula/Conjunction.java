package prover.formula;

import java.util.List;
import java.util.Objects;

/** Both sides hold. */
public record Conjunction(Formula left, Formula right) implements Formula {

  public Conjunction {
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
  public Conjunction instantiate(String variable, String name) {
    return new Conjunction(left.instantiate(variable, name), right.instantiate(variable, name));
  }

  @Override
  public String render() {
    return FormulaStringBuilder.binary(left.render(), Connective.CONJUNCTION, right.render());
  }

  @Override
  public String toString() {
    return render();
  }
}
