package prover.formula;

import java.util.List;
import java.util.Objects;

public record Existential(String variable, Formula predicate) implements Formula {

  public Existential {
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
  public Existential instantiate(String variable, String name) {
    return new Existential(this.variable, predicate.instantiate(variable, name));
  }

  @Override
  public String render() {
    return FormulaStringBuilder.quantifier(Connective.EXISTENTIAL, variable, predicate.render());
  }

  @Override
  public String toString() {
    return render();
  }
}
