package prover.formula;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

final class PlaceholdersTest {

  @Test
  void classifiesTokensByLength() {
    String text = "<a> loves <bob> and <c> knows <alice>";
    assertEquals(List.of("a", "c"), Placeholders.variables(text));
    assertEquals(List.of("bob", "alice"), Placeholders.names(text));
  }

  @Test
  void ignoresSpansThatAreNotLowercaseLetters() {
    assertEquals(List.of(), Placeholders.variables("<A> and <a1> and <> and <x y>"));
    assertEquals(List.of(), Placeholders.names("<Bob> and <bob smith>"));
  }

  @Test
  void rescansFromTheNextBracket() {
    assertEquals(List.of("ab"), Placeholders.names("<<ab>"));
    assertEquals(List.of("x"), Placeholders.variables("a < b <x>"));
  }

  @Test
  void unterminatedBracketEndsTheScan() {
    assertEquals(List.of(), Placeholders.variables("<x"));
  }

  @Test
  void substitutesEveryOccurrence() {
    assertEquals(
        "<mat> is on <mat>", Placeholders.substitute("<b> is on <b>", "b", "mat"));
    assertEquals("<bb> stays", Placeholders.substitute("<bb> stays", "b", "zz"));
  }

  @Test
  void recognisesVariableTokens() {
    assertTrue(Placeholders.isVariableToken("<x>"));
    assertFalse(Placeholders.isVariableToken("<xy>"));
    assertFalse(Placeholders.isVariableToken("<X>"));
    assertFalse(Placeholders.isVariableToken("x"));
    assertTrue(Placeholders.isName("bob"));
    assertFalse(Placeholders.isName("b"));
  }
}
