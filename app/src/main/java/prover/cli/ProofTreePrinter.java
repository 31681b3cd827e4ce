package prover.cli;

import java.util.List;
import prover.search.ProofNode;
import prover.search.ProofNode.Attempt;

/** Indented text rendering of a searched proof tree. */
final class ProofTreePrinter {
  private static final String INDENT = "  ";

  String print(ProofNode root) {
    StringBuilder out = new StringBuilder();
    node(root, 0, out);
    return out.toString();
  }

  private void node(ProofNode node, int depth, StringBuilder out) {
    indent(depth, out);
    out.append(node.sequent()).append("  [").append(node.verdict());
    if (!node.isTerminal()) {
      out.append(", ").append(node.rule()).append(" on ").append(node.principal());
    }
    out.append(']').append(System.lineSeparator());

    List<Attempt> attempts = node.attempts();
    for (int i = 0; i < attempts.size(); i++) {
      Attempt attempt = attempts.get(i);
      boolean labelled = attempts.size() > 1 || attempt.witness() != null;
      int premiseDepth = depth + 1;
      if (labelled) {
        indent(depth + 1, out);
        out.append("alternative ").append(i + 1);
        if (attempt.witness() != null) {
          out.append(" with <").append(attempt.witness()).append('>');
        }
        out.append(": ").append(attempt.verdict()).append(System.lineSeparator());
        premiseDepth++;
      }
      for (ProofNode premise : attempt.premises()) {
        node(premise, premiseDepth, out);
      }
    }
  }

  private static void indent(int depth, StringBuilder out) {
    out.append(INDENT.repeat(depth));
  }
}
