package prover.formula;

/** Helper for composing formula renderings with consistent parenthesization. */
public final class FormulaStringBuilder {
  private FormulaStringBuilder() {}

  public static String atom(String text) {
    return text;
  }

  public static String negation(String negatum) {
    return Connective.NEGATION.symbol() + "(" + negatum + ")";
  }

  public static String binary(String left, Connective connective, String right) {
    return "(" + left + " " + connective.symbol() + " " + right + ")";
  }

  public static String quantifier(Connective quantifier, String variable, String predicate) {
    return quantifier.symbol() + variable + "(" + predicate + ")";
  }
}
