package prover.formula;

import java.util.ArrayList;
import java.util.List;

/**
 * A first-order formula. The variant set is closed: every formula is an {@link Atom}, a {@link
 * Negation}, one of the binary connectives ({@link Conjunction}, {@link Disjunction}, {@link
 * Conditional}) or one of the quantifiers ({@link Universal}, {@link Existential}).
 *
 * <p>Design invariants:
 *
 * <ul>
 *   <li>Trees are owned top-down; no node is shared between two parents and there are no cycles.
 *   <li>Every variant is an immutable record, so a formula handed to two sibling branches can never
 *       observe the other branch's substitutions.
 *   <li>{@link #complexity()} is the length of the longest chain of connectives and quantifiers,
 *       not the number of nodes.
 * </ul>
 */
public sealed interface Formula
    permits Atom, Negation, Conjunction, Disjunction, Conditional, Universal, Existential {

  /** Longest path of connectives/quantifiers from this node down to an atom. Atoms are 0. */
  int complexity();

  /** True when no connective or quantifier is left to decompose. */
  default boolean isFinished() {
    return complexity() == 0;
  }

  /** Direct sub-formulas, left to right. An atom's content is the atom itself. */
  List<Formula> children();

  /**
   * Returns a copy in which every {@code <variable>} inside atom text is replaced by {@code
   * <name>}. Nested quantifiers that bind the same variable are not skipped.
   */
  Formula instantiate(String variable, String name);

  /** Canonical, re-parseable rendering. */
  String render();

  /** Constants (two or more lowercase letters in brackets) in order of appearance. */
  default List<String> names() {
    List<String> names = new ArrayList<>();
    collectAtoms(this).forEach(atom -> names.addAll(Placeholders.names(atom.text())));
    return names;
  }

  /** Variables (one lowercase letter in brackets) in order of appearance. */
  default List<String> variables() {
    List<String> variables = new ArrayList<>();
    collectAtoms(this).forEach(atom -> variables.addAll(Placeholders.variables(atom.text())));
    return variables;
  }

  /** Structurally equal, freshly allocated tree. */
  default Formula copy() {
    if (this instanceof Atom atom) {
      return new Atom(atom.text());
    }
    if (this instanceof Negation negation) {
      return new Negation(negation.negatum().copy());
    }
    if (this instanceof Conjunction conjunction) {
      return new Conjunction(conjunction.left().copy(), conjunction.right().copy());
    }
    if (this instanceof Disjunction disjunction) {
      return new Disjunction(disjunction.left().copy(), disjunction.right().copy());
    }
    if (this instanceof Conditional conditional) {
      return new Conditional(conditional.left().copy(), conditional.right().copy());
    }
    if (this instanceof Universal universal) {
      return new Universal(universal.variable(), universal.predicate().copy());
    }
    Existential existential = (Existential) this;
    return new Existential(existential.variable(), existential.predicate().copy());
  }

  /** True if this node or some quantifier below it binds {@code variable}. */
  default boolean binds(String variable) {
    if (this instanceof Universal universal && universal.variable().equals(variable)) {
      return true;
    }
    if (this instanceof Existential existential && existential.variable().equals(variable)) {
      return true;
    }
    for (Formula child : children()) {
      if (child != this && child.binds(variable)) {
        return true;
      }
    }
    return false;
  }

  private static List<Atom> collectAtoms(Formula formula) {
    List<Atom> atoms = new ArrayList<>();
    List<Formula> pending = new ArrayList<>();
    pending.add(formula);
    while (!pending.isEmpty()) {
      Formula current = pending.remove(pending.size() - 1);
      if (current instanceof Atom atom) {
        atoms.add(atom);
        continue;
      }
      List<Formula> children = current.children();
      for (int i = children.size() - 1; i >= 0; i--) {
        pending.add(children.get(i));
      }
    }
    return atoms;
  }
}
