package prover.search;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;
import prover.formula.Atom;
import prover.formula.Conjunction;
import prover.sequent.Sequent;

final class ClosureCheckerTest {

  private final ClosureChecker closure = ClosureChecker.sharedFormula();

  @Test
  void closesOnSharedFormula() {
    Atom a = new Atom("A");
    Atom b = new Atom("B");
    assertTrue(closure.isClosed(Sequent.of(List.of(a), List.of(a))));
    assertTrue(closure.isClosed(Sequent.of(List.of(a, b), List.of(new Atom("C"), b))));
    assertTrue(
        closure.isClosed(
            Sequent.of(List.of(new Conjunction(a, b)), List.of(new Conjunction(a, b)))));
  }

  @Test
  void staysOpenOtherwise() {
    assertFalse(closure.isClosed(Sequent.of(List.of(new Atom("A")), List.of(new Atom("B")))));
    assertFalse(closure.isClosed(Sequent.empty()));
  }
}
