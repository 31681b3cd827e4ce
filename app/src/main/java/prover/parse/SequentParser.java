package prover.parse;

import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import prover.formula.Formula;
import prover.parse.SequentParseException.Kind;
import prover.sequent.Sequent;

/**
 * Reads {@code A, B |~ C, D}: two comma-separated formula lists around exactly one turnstile.
 * Either list may be empty.
 */
public final class SequentParser {
  private static final Splitter TURNSTILE = Splitter.on(Sequent.TURNSTILE);
  private static final Splitter MEMBERS = Splitter.on(',').trimResults().omitEmptyStrings();

  private SequentParser() {}

  public static Sequent parse(String text) throws SequentParseException {
    if (text == null) {
      throw new SequentParseException(Kind.TURNSTILE_COUNT, "");
    }
    List<String> sides = TURNSTILE.splitToList(text);
    if (sides.size() != 2) {
      throw new SequentParseException(Kind.TURNSTILE_COUNT, text.trim());
    }
    return Sequent.of(members(sides.get(0)), members(sides.get(1)));
  }

  private static List<Formula> members(String side) throws SequentParseException {
    List<Formula> formulas = new ArrayList<>();
    for (String member : MEMBERS.split(side)) {
      try {
        formulas.add(FormulaParser.parse(member));
      } catch (FormulaParseException e) {
        throw new SequentParseException(Kind.FORMULA, member, e);
      }
    }
    return formulas;
  }
}
