package prover.formula;

import java.util.List;
import java.util.Objects;

public record Universal(String variable, Formula predicate) implements Formula {

  public Universal {
    Objects.requireNonNull(variable, "variable");
    Objects.requireNonNull(predicate, "predicate");
  }

  @Override
  public int complexity() {
    return 1 + predicate.complexity();
  }

  @Override
  public List<Formula> children() {
    return List.of(predicate);
  }

  @Override
  public Universal instantiate(String variable, String name) {
    return new Universal(this.variable, predicate.instantiate(variable, name));
  }

  @Override
  public String render() {
    return FormulaStringBuilder.quantifier(Connective.UNIVERSAL, variable, predicate.render());
  }

  @Override
  public String toString() {
    return render();
  }
}
