package prover.parse;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import java.util.List;
import java.util.Optional;
import prover.formula.Atom;
import prover.formula.Connective;
import prover.formula.Formula;
import prover.formula.Negation;
import prover.formula.Placeholders;
import prover.parse.FormulaParseException.Kind;

/**
 * Reads formula text into a {@link Formula}.
 *
 * <p>Grammar, by precedence of the checks applied to each (deparenthesized) fragment:
 *
 * <ol>
 *   <li>a leading negation keyword ({@code ~} or {@code not}) negates everything after it;
 *   <li>a leading quantifier keyword ({@code ∃}/{@code exists}, {@code ∀}/{@code forall}) must be
 *       followed by a variable token {@code <x>} and quantifies everything after it;
 *   <li>otherwise the first binary keyword ({@code &}/{@code and}, {@code v}/{@code or}, {@code
 *       >}/{@code implies}) outside parentheses splits the fragment in two. There is no precedence
 *       table: {@code A & B v C} reads as {@code A & (B v C)};
 *   <li>anything else is an atom.
 * </ol>
 *
 * <p>The canonical rendering's attached forms {@code ~(A)} and {@code ∃x(A)} are accepted as well;
 * they bind only the parenthesized group that follows them.
 */
public final class FormulaParser {
  private static final CharMatcher WHITESPACE = CharMatcher.whitespace();
  private static final Splitter TOKENS = Splitter.on(WHITESPACE).omitEmptyStrings();

  private FormulaParser() {}

  public static Formula parse(String text) throws FormulaParseException {
    if (text == null) {
      throw new FormulaParseException(Kind.EMPTY_STRING, "");
    }
    return parse(text, text);
  }

  private static Formula parse(String text, String enclosing) throws FormulaParseException {
    String body = Parentheses.strip(text);
    if (body.isEmpty()) {
      throw new FormulaParseException(Kind.EMPTY_STRING, WHITESPACE.trimFrom(enclosing));
    }

    Optional<Formula> attached = parseAttachedPrefix(body);
    if (attached.isPresent()) {
      return attached.get();
    }

    List<String> tokens = TOKENS.splitToList(body);
    Optional<Connective> leading = Connective.fromKeyword(tokens.get(0));
    if (leading.isPresent() && leading.get() == Connective.NEGATION) {
      return new Negation(parse(join(tokens, 1, tokens.size()), body));
    }
    if (leading.isPresent() && leading.get().isQuantifier()) {
      if (tokens.size() < 2 || !Placeholders.isVariableToken(tokens.get(1))) {
        throw new FormulaParseException(Kind.MALFORMED_STRING, body);
      }
      String variable = tokens.get(1).substring(1, 2);
      Formula predicate = parse(join(tokens, 2, tokens.size()), body);
      return leading.get().bind(variable, predicate);
    }

    int depth = 0;
    for (int i = 0; i < tokens.size(); i++) {
      String token = tokens.get(i);
      depth += Parentheses.depthChange(token);
      if (depth != 0) {
        continue;
      }
      Optional<Connective> binary = Connective.fromKeyword(token).filter(Connective::isBinary);
      if (binary.isPresent()) {
        if (i == 0 || i == tokens.size() - 1) {
          throw new FormulaParseException(Kind.MALFORMED_STRING, body);
        }
        Formula left = parse(join(tokens, 0, i), body);
        Formula right = parse(join(tokens, i + 1, tokens.size()), body);
        return binary.get().build(List.of(left, right));
      }
    }
    return new Atom(body);
  }

  /**
   * Handles {@code ~(A)}, {@code ∃x(A)} and {@code ∀<x>(A)}: a symbol glued to what follows it.
   * Returns empty when the fragment does not start with such a form, or when the group closes
   * before the end of the fragment (then the binary scan decides).
   */
  private static Optional<Formula> parseAttachedPrefix(String body) throws FormulaParseException {
    if (body.length() < 2 || WHITESPACE.matches(body.charAt(1))) {
      return Optional.empty();
    }
    String head = body.substring(0, 1);
    String rest = body.substring(1);
    if (Connective.NEGATION.symbol().equals(head)) {
      if (Parentheses.isSingleGroup(rest)) {
        return Optional.of(new Negation(parse(rest, body)));
      }
      return Optional.empty();
    }

    Connective quantifier;
    if (Connective.EXISTENTIAL.symbol().equals(head)) {
      quantifier = Connective.EXISTENTIAL;
    } else if (Connective.UNIVERSAL.symbol().equals(head)) {
      quantifier = Connective.UNIVERSAL;
    } else {
      return Optional.empty();
    }

    String variable;
    String after;
    if (rest.charAt(0) == '<') {
      if (rest.length() < 3 || !Placeholders.isVariableToken(rest.substring(0, 3))) {
        throw new FormulaParseException(Kind.MALFORMED_STRING, body);
      }
      variable = rest.substring(1, 2);
      after = rest.substring(3);
    } else if (rest.length() > 1
        && rest.charAt(0) >= 'a'
        && rest.charAt(0) <= 'z'
        && (rest.charAt(1) == '(' || WHITESPACE.matches(rest.charAt(1)))) {
      variable = rest.substring(0, 1);
      after = rest.substring(1);
    } else {
      throw new FormulaParseException(Kind.INVALID_CONNECTIVE, firstToken(body));
    }

    if (WHITESPACE.matchesAllOf(after)) {
      throw new FormulaParseException(Kind.EMPTY_STRING, body);
    }
    if (Parentheses.isSingleGroup(after)) {
      return Optional.of(quantifier.bind(variable, parse(after, body)));
    }
    if (WHITESPACE.matches(after.charAt(0))) {
      return Optional.of(quantifier.bind(variable, parse(after, body)));
    }
    if (after.charAt(0) == '(') {
      return Optional.empty();
    }
    throw new FormulaParseException(Kind.INVALID_CONNECTIVE, firstToken(body));
  }

  private static String firstToken(String body) {
    return TOKENS.splitToList(body).get(0);
  }

  private static String join(List<String> tokens, int from, int to) {
    return String.join(" ", tokens.subList(from, to));
  }
}
