package prover.formula;

import java.util.List;
import java.util.Objects;

public record Negation(Formula negatum) implements Formula {

  public Negation {
    Objects.requireNonNull(negatum, "negatum");
  }

  @Override
  public int complexity() {
    return 1 + negatum.complexity();
  }

  @Override
  public List<Formula> children() {
    return List.of(negatum);
  }

  @Override
  public Negation instantiate(String variable, String name) {
    return new Negation(negatum.instantiate(variable, name));
  }

  @Override
  public String render() {
    return FormulaStringBuilder.negation(negatum.render());
  }

  @Override
  public String toString() {
    return render();
  }
}
