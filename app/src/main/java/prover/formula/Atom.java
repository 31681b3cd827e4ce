package prover.formula;

import java.util.List;
import java.util.Objects;

/** Opaque predicate text, possibly embedding {@code <x>} variables and {@code <name>} constants. */
public record Atom(String text) implements Formula {

  public Atom {
    Objects.requireNonNull(text, "text");
  }

  @Override
  public int complexity() {
    return 0;
  }

  @Override
  public List<Formula> children() {
    return List.of(this);
  }

  @Override
  public Atom instantiate(String variable, String name) {
    return new Atom(Placeholders.substitute(text, variable, name));
  }

  @Override
  public String render() {
    return FormulaStringBuilder.atom(text);
  }

  @Override
  public String toString() {
    return render();
  }
}
