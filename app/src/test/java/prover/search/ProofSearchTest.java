package prover.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import prover.decompose.Rule;
import prover.decompose.SequentialNameSupply;
import prover.parse.SequentParseException;
import prover.parse.SequentParser;

final class ProofSearchTest {

  private final ProofSearch search = new ProofSearch();

  @ParameterizedTest
  @ValueSource(
      strings = {
        "A & B |~ B & A",
        "|~ A v ~ A",
        "A, A > B |~ B",
        "A v B |~ B v A",
        "~ ~ A |~ A",
        "A > B, B > C |~ A > C",
        "forall <x> (<x> is a man > <x> is mortal), <socrates> is a man |~ <socrates> is mortal",
        "<rex> is a dog |~ exists <x> (<x> is a dog)",
        "|~ forall <y> (<y> is red > <y> is red)"
      })
  void provesValidSequents(String goal) throws SequentParseException {
    ProofResult result = search.prove(SequentParser.parse(goal));
    assertEquals(Verdict.PROVED, result.verdict(), goal);
    assertTrue(result.isProved());
    assertNull(result.terminationReason());
  }

  @ParameterizedTest
  @ValueSource(
      strings = {
        "A |~ B",
        "A v B |~ A",
        "|~ forall <x> (<x> is red)",
        "exists <x> (<x> is red) |~ <bob> is red"
      })
  void leavesInvalidSequentsUnproved(String goal) throws SequentParseException {
    ProofResult result = search.prove(SequentParser.parse(goal));
    assertEquals(Verdict.UNPROVED, result.verdict(), goal);
    assertFalse(result.isProved());
  }

  @Test
  void recordsTheSearchedTree() throws SequentParseException {
    ProofResult result = search.prove(SequentParser.parse("A & B |~ B & A"));
    ProofNode root = result.root();

    assertEquals(Rule.CONJUNCTION_ANTECEDENT, root.rule());
    assertEquals(1, root.attempts().size());
    ProofNode next = root.attempts().get(0).premises().get(0);
    assertEquals(Rule.CONJUNCTION_CONSEQUENT, next.rule());
    assertEquals(2, next.attempts().get(0).premises().size());
    assertTrue(next.attempts().get(0).premises().stream().allMatch(ProofNode::isTerminal));
    assertEquals(4, result.nodesVisited());
    assertEquals(2, result.maxDepthReached());
  }

  @Test
  void stopsAtFirstProvedAlternative() throws SequentParseException {
    ProofResult result =
        search.prove(
            SequentParser.parse(
                "forall <x> (<x> is here), <ann> is there, <bob> is there |~ <ann> is here"));
    assertEquals(Verdict.PROVED, result.verdict());
    assertEquals(1, result.root().attempts().size());
    assertEquals("ann", result.root().attempts().get(0).witness());
  }

  @Test
  void depthBoundLeavesGoalUndecided() throws SequentParseException {
    ProofSearch shallow = new ProofSearch(SearchOptions.defaults().withMaxDepth(1));
    ProofResult result = shallow.prove(SequentParser.parse("A & B |~ B & A"));

    assertEquals(Verdict.UNDECIDED, result.verdict());
    assertEquals(ProofSearch.DEPTH_LIMIT, result.terminationReason());
    assertEquals(2, result.nodesVisited());
  }

  @Test
  void nodeBoundLeavesGoalUndecided() throws SequentParseException {
    ProofSearch tiny = new ProofSearch(SearchOptions.defaults().withMaxNodes(1));
    ProofResult result = tiny.prove(SequentParser.parse("A & B |~ B & A"));

    assertEquals(Verdict.UNDECIDED, result.verdict());
    assertEquals(ProofSearch.NODE_LIMIT, result.terminationReason());
  }

  @Test
  void closureCheckerIsPluggable() throws SequentParseException {
    ProofSearch lenient =
        new ProofSearch(SearchOptions.defaults(), sequent -> true, SequentialNameSupply::new);
    assertEquals(Verdict.PROVED, lenient.prove(SequentParser.parse("A |~ B")).verdict());
  }

  @Test
  void generousTimeBudgetDoesNotCutTheSearch() throws SequentParseException {
    SearchOptions options = SearchOptions.defaults().withTimeBudgetMs(60_000L);
    ProofSearch budgeted = new ProofSearch(options);
    assertEquals(60_000L, budgeted.options().timeBudgetMs());

    ProofResult result = budgeted.prove(SequentParser.parse("A > B, B > C |~ A > C"));
    assertEquals(Verdict.PROVED, result.verdict());
    assertNull(result.terminationReason());
  }

  @Test
  void nonPositiveBoundsFallBackToDefaults() {
    SearchOptions normalized = SearchOptions.normalize(new SearchOptions(0, -5, -1));
    assertEquals(SearchOptions.defaults().maxDepth(), normalized.maxDepth());
    assertEquals(SearchOptions.defaults().maxNodes(), normalized.maxNodes());
    assertEquals(0L, normalized.timeBudgetMs());
    assertEquals(SearchOptions.defaults(), SearchOptions.normalize(null));
  }
}
