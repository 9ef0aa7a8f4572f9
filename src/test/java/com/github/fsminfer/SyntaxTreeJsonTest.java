package com.github.fsminfer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

public class SyntaxTreeJsonTest {

  @Test
  public void testTokensAndInnerNodes() throws FsmException {
    final SyntaxNode tree = SyntaxTreeJson.fromJson("{\"kind\": \"DataDeclaration\","
        + " \"text\": \"ignored\", \"children\": ["
        + "{\"kind\": \"Identifier\", \"text\": \"state_t\"},"
        + "{\"kind\": \"Identifier\", \"text\": \"state\", \"children\": []},"
        + "{\"kind\": \"EmptyArgument\"},"
        + "{\"kind\": \"Semicolon\", \"text\": \";\"}]}");
    assertEquals("DataDeclaration", tree.kind());
    assertFalse(tree.text().isPresent());
    assertEquals(4, tree.children().size());
    assertEquals("state", tree.children().get(1).text().get());
    assertFalse(tree.children().get(2).text().isPresent());
    assertEquals("state_t state;", SyntaxTrees.inlineText(tree));
  }

  @Test
  public void testDumpedTreeExtractsLikeTheOriginal() throws FsmException {
    final SyntaxNode parsed = SvFixtureParser.parse(SvFixtures.TWO_MACHINES);
    final SyntaxNode transported = SyntaxTreeJson.fromJson(SyntaxTreeJson.toJson(parsed));
    assertEquals(SyntaxTrees.preOrder(parsed).size(), SyntaxTrees.preOrder(transported).size());

    final FsmEngine engine = FsmEngine.FsmEngineBuilder.newBuilder().build();
    final List<FsmGraph> expected = engine.extractFsmGraphs(parsed);
    assertEquals(2, expected.size());
    assertEquals(expected, engine.extractFsmGraphs(transported));
  }

  @Test
  public void testMalformedTrees() {
    assertMalformed(null);
    assertMalformed("{]");
    assertMalformed("[]");
    assertMalformed("{\"text\": \"x\"}");
    assertMalformed("{\"kind\": \"Module\", \"children\": {}}");
    assertMalformed("{\"kind\": \"Module\", \"children\": [42]}");
    assertMalformed("{\"kind\": \"Identifier\", \"text\": [\"x\"]}");
  }

  private static void assertMalformed(final String json) {
    try {
      SyntaxTreeJson.fromJson(json);
      fail("Expected a malformed tree: " + json);
    } catch (FsmException problem) {
      assertEquals(FsmException.Code.MALFORMED_TREE_RECORD, problem.getCode());
      assertTrue(problem.getMessage().length() > 0);
    }
  }

}
