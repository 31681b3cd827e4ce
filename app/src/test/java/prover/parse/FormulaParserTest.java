package prover.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import prover.formula.Atom;
import prover.formula.Conditional;
import prover.formula.Conjunction;
import prover.formula.Disjunction;
import prover.formula.Existential;
import prover.formula.Formula;
import prover.formula.Negation;
import prover.formula.Universal;
import prover.parse.FormulaParseException.Kind;

final class FormulaParserTest {

  private static final Atom A = new Atom("A");
  private static final Atom B = new Atom("B");
  private static final Atom C = new Atom("C");

  @Test
  void plainTextIsAnAtom() throws FormulaParseException {
    Formula formula = FormulaParser.parse("the cat is on the mat");
    assertEquals(new Atom("the cat is on the mat"), formula);
    assertEquals(0, formula.complexity());
  }

  @Test
  void parsesSpacedNegations() throws FormulaParseException {
    Atom cat = new Atom("the cat is on the mat");
    Formula negation = FormulaParser.parse("~ (the cat is on the mat)");
    assertEquals(new Negation(cat), negation);
    assertEquals(1, negation.complexity());
    assertEquals(
        new Negation(new Negation(cat)), FormulaParser.parse("~ (~ (the cat is on the mat))"));
    assertEquals(new Negation(A), FormulaParser.parse("not A"));
  }

  @Test
  void leadingNegationTakesTheRest() throws FormulaParseException {
    assertEquals(new Negation(new Conjunction(A, B)), FormulaParser.parse("~ A & B"));
  }

  @Test
  void parsesBinaryConnectivesInBothForms() throws FormulaParseException {
    assertEquals(new Conjunction(A, B), FormulaParser.parse("A & B"));
    assertEquals(new Conjunction(A, B), FormulaParser.parse("A and B"));
    assertEquals(new Disjunction(A, B), FormulaParser.parse("A v B"));
    assertEquals(new Disjunction(A, B), FormulaParser.parse("A or B"));
    assertEquals(new Conditional(A, B), FormulaParser.parse("A > B"));
    assertEquals(new Conditional(A, B), FormulaParser.parse("A implies B"));
    assertEquals(
        new Conjunction(new Atom("the cat is on the mat"), new Atom("the hat is on the rat")),
        FormulaParser.parse("the cat is on the mat & the hat is on the rat"));
  }

  @Test
  void firstConnectiveOutsideParenthesesSplits() throws FormulaParseException {
    assertEquals(new Conjunction(A, new Disjunction(B, C)), FormulaParser.parse("A & B v C"));
    assertEquals(new Disjunction(new Conjunction(A, B), C), FormulaParser.parse("(A & B) v C"));
    assertEquals(
        new Conditional(new Disjunction(A, B), new Negation(C)),
        FormulaParser.parse("((A v B)) > ~ C"));
  }

  @Test
  void connectiveLettersInsideWordsAreText() throws FormulaParseException {
    assertEquals(new Atom("love over andromeda"), FormulaParser.parse("love over andromeda"));
  }

  @Test
  void parsesQuantifiers() throws FormulaParseException {
    Formula formula = FormulaParser.parse("∃ <a> (<a> is on the mat)");
    assertEquals(new Existential("a", new Atom("<a> is on the mat")), formula);
    assertEquals(List.of(), formula.names());
    assertEquals(List.of("a"), formula.variables());

    assertEquals(
        new Universal(
            "x", new Conditional(new Atom("<x> is a man"), new Atom("<x> is mortal"))),
        FormulaParser.parse("forall <x> (<x> is a man > <x> is mortal)"));
    assertEquals(
        new Existential("y", new Atom("<y> is blue")),
        FormulaParser.parse("exists <y> <y> is blue"));
  }

  @Test
  void parsesAttachedExistentialWithBracketedVariable() throws FormulaParseException {
    Formula formula = FormulaParser.parse("∃<a>(<a> is on the mat)");
    assertEquals(new Existential("a", new Atom("<a> is on the mat")), formula);

    Formula predicate = ((Existential) formula).predicate();
    assertEquals(List.of(), predicate.names());
    assertEquals(List.of("a"), predicate.variables());
  }

  @Test
  void acceptsAttachedForms() throws FormulaParseException {
    assertEquals(new Negation(A), FormulaParser.parse("~(A)"));
    assertEquals(
        new Universal("x", new Atom("<x> is a cat")), FormulaParser.parse("∀<x> <x> is a cat"));
    assertEquals(
        new Existential("a", new Atom("<a> is red")), FormulaParser.parse("∃a(<a> is red)"));
    assertEquals(
        new Conjunction(new Existential("y", new Atom("<y> is blue")), new Atom("sky")),
        FormulaParser.parse("∃y(<y> is blue) & sky"));
    assertEquals(new Conjunction(new Negation(A), B), FormulaParser.parse("~(A) & B"));
  }

  @Test
  void rejectsEmptyText() {
    FormulaParseException empty =
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse(""));
    assertEquals(Kind.EMPTY_STRING, empty.kind());

    FormulaParseException blankGroup =
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("( )"));
    assertEquals(Kind.EMPTY_STRING, blankGroup.kind());

    FormulaParseException bareNegation =
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("~"));
    assertEquals(Kind.EMPTY_STRING, bareNegation.kind());
    assertEquals("~", bareNegation.offendingText());

    assertThrows(FormulaParseException.class, () -> FormulaParser.parse(null));
  }

  @Test
  void unicodeWhitespaceIsEmptyText() {
    FormulaParseException nbsp =
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("\u00a0"));
    assertEquals(Kind.EMPTY_STRING, nbsp.kind());

    FormulaParseException emSpaceGroup =
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("(\u2003)"));
    assertEquals(Kind.EMPTY_STRING, emSpaceGroup.kind());

    FormulaParseException negatedBlank =
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("~ (\u00a0)"));
    assertEquals(Kind.EMPTY_STRING, negatedBlank.kind());
  }

  @Test
  void rejectsMissingOperands() {
    FormulaParseException trailing =
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("A &"));
    assertEquals(Kind.MALFORMED_STRING, trailing.kind());
    assertEquals("A &", trailing.offendingText());

    FormulaParseException leading =
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("& B"));
    assertEquals(Kind.MALFORMED_STRING, leading.kind());
  }

  @Test
  void nestedFailureFailsTheWholeParse() {
    FormulaParseException e =
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("A & (B v )"));
    assertEquals(Kind.MALFORMED_STRING, e.kind());
    assertEquals("B v", e.offendingText());
  }

  @Test
  void rejectsQuantifierWithoutVariable() {
    FormulaParseException spaced =
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("∀ x (P)"));
    assertEquals(Kind.MALFORMED_STRING, spaced.kind());

    FormulaParseException longVariable =
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("exists <ab> P"));
    assertEquals(Kind.MALFORMED_STRING, longVariable.kind());

    FormulaParseException attached =
        assertThrows(FormulaParseException.class, () -> FormulaParser.parse("∀(P)"));
    assertEquals(Kind.INVALID_CONNECTIVE, attached.kind());
    assertEquals("∀(P)", attached.offendingText());
  }

  @Test
  void parsingIsDeterministic() throws FormulaParseException {
    String text = "forall <x> ((<x> is a man) > (<x> is mortal v <x> is a god))";
    assertEquals(FormulaParser.parse(text), FormulaParser.parse(text));
  }

  static Stream<Formula> renderedFormulas() {
    Atom man = new Atom("<x> is a man");
    Atom mortal = new Atom("<x> is mortal");
    Atom sky = new Atom("the sky is blue");
    return Stream.of(
        sky,
        new Negation(new Negation(sky)),
        new Negation(new Disjunction(sky, mortal)),
        new Conjunction(sky, new Negation(man)),
        new Conditional(new Conjunction(man, sky), new Disjunction(mortal, new Negation(sky))),
        new Universal("x", new Conditional(man, mortal)),
        new Conjunction(new Existential("y", new Atom("<y> is blue")), sky),
        new Negation(new Universal("x", new Existential("y", new Atom("<x> sees <y>")))));
  }

  @ParameterizedTest
  @MethodSource("renderedFormulas")
  void renderingParsesBack(Formula formula) throws FormulaParseException {
    assertEquals(formula, FormulaParser.parse(formula.render()));
  }
}
