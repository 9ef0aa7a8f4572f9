package com.github.fsminfer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.junit.Test;

import com.github.fsminfer.FsmEngine.FsmEngineBuilder;
import com.github.fsminfer.FsmEngineConfiguration.FsmEngineConfigurationBuilder;

/**
 * Tests to maintain the sanity and correctness of fsm extraction, end to end from SystemVerilog
 * source.
 */
public class FsmEngineTest {
  static {
    System.setProperty("log4j.configurationFile", "log4j2-test.properties");
  }

  @Test
  public void testRequestGrantMachine() throws FsmException {
    final FsmEngine engine = FsmEngineBuilder.newBuilder().build();
    final List<FsmGraph> graphs =
        engine.extractFsmGraphs(SvFixtureParser.parse(SvFixtures.REQUEST_GRANT));
    assertEquals(1, graphs.size());

    final FsmGraph graph = graphs.get(0);
    assertEquals("module arbiter", graph.getScope());
    assertEquals("state", graph.getStateVar());
    assertEquals("next_state", graph.getNextStateVar().get());
    assertEquals("state_t", graph.getEnumName());
    assertEquals(Arrays.asList("IDLE", "REQ", "WAIT", "GNT"), graph.getStates());
    assertEquals("IDLE", graph.getResetState().get());
    assertEquals(edges("IDLE->REQ:req", "REQ->WAIT:1", "WAIT->GNT:gnt", "GNT->IDLE:1"),
        edgesOf(graph));
    assertEquals(4, graph.getNumStates());
    assertEquals(4, graph.getNumTransitions());
    assertEquals(FsmGraph.Style.TWO_PROCESS, graph.getStyle());
  }

  @Test
  public void testEnumTypedefInPackage() throws FsmException {
    final FsmGraph graph = single(SvFixtures.PACKAGE_TYPEDEF);
    assertEquals("module fsm_example", graph.getScope());
    assertEquals("state_t", graph.getEnumName());
    assertEquals("state", graph.getStateVar());
    assertEquals(Arrays.asList("IDLE", "REQ", "WAIT", "GNT"), graph.getStates());
    assertEquals(edges("IDLE->REQ:req", "REQ->WAIT:1", "WAIT->GNT:gnt", "GNT->IDLE:1"),
        edgesOf(graph));
  }

  @Test
  public void testInlineEnumBoundToVariables() throws FsmException {
    final FsmGraph graph = single(SvFixtures.INLINE_ENUM);
    assertEquals("module inline_enum_fsm", graph.getScope());
    assertEquals("anonymous_enum_S0_1", graph.getEnumName());
    assertEquals("state", graph.getStateVar());
    assertEquals("next_state", graph.getNextStateVar().get());
    assertEquals(Arrays.asList("S0", "S1", "S2"), graph.getStates());
    assertEquals("S0", graph.getResetState().get());
    assertEquals(edges("S0->S1:a", "S1->S2:b", "S2->S0:1"), edgesOf(graph));
  }

  @Test
  public void testSingleRegisterMachine() throws FsmException {
    final FsmGraph graph = single(SvFixtures.SINGLE_REGISTER);
    assertEquals("state", graph.getStateVar());
    assertFalse(graph.getNextStateVar().isPresent());
    assertEquals(FsmGraph.Style.SINGLE_PROCESS, graph.getStyle());
    assertEquals("A", graph.getResetState().get());
    assertEquals(edges("A->B:x", "B->C:1", "C->A:1"), edgesOf(graph));
  }

  @Test
  public void testTwoMachinesInOneModuleStayApart() throws FsmException {
    final FsmEngine engine = FsmEngineBuilder.newBuilder().build();
    final List<FsmGraph> graphs =
        engine.extractFsmGraphs(SvFixtureParser.parse(SvFixtures.TWO_MACHINES));
    assertEquals(2, graphs.size());

    final FsmGraph control = graphs.get(0);
    assertEquals("ctrl_t", control.getEnumName());
    assertEquals("ctrl_state", control.getStateVar());
    assertEquals("ctrl_next", control.getNextStateVar().get());
    assertEquals(Arrays.asList("IDLE", "RUN"), control.getStates());
    assertEquals("IDLE", control.getResetState().get());
    assertEquals(edges("IDLE->RUN:start", "RUN->IDLE:done"), edgesOf(control));

    final FsmGraph status = graphs.get(1);
    assertEquals("status_t", status.getEnumName());
    assertEquals("stat_state", status.getStateVar());
    assertEquals("stat_next", status.getNextStateVar().get());
    assertEquals(Arrays.asList("OK", "FAIL"), status.getStates());
    assertEquals("OK", status.getResetState().get());
    assertEquals(edges("OK->FAIL:err", "FAIL->OK:!err"), edgesOf(status));
  }

  @Test
  public void testDataEnumIsGatedOut() throws FsmException {
    final FsmGraph graph = single(SvFixtures.DATA_ENUM);
    assertEquals("state_t", graph.getEnumName());
    assertEquals(edges("S0->S1:req", "S1->S0:gnt"), edgesOf(graph));
  }

  @Test
  public void testDataEnumKeptWithoutGate() throws FsmException {
    final FsmEngineConfiguration config =
        FsmEngineConfigurationBuilder.newBuilder().candidateGate(CandidateGate.NONE).build();
    final FsmEngine engine = FsmEngineBuilder.newBuilder().config(config).build();
    final List<FsmGraph> graphs =
        engine.extractFsmGraphs(SvFixtureParser.parse(SvFixtures.DATA_ENUM));
    assertEquals(2, graphs.size());
    assertEquals("state_t", graphs.get(0).getEnumName());
    assertEquals("tr_type_t", graphs.get(1).getEnumName());
    assertEquals("tr_type", graphs.get(1).getStateVar());
    assertTrue(graphs.get(1).getTransitions().isEmpty());
  }

  @Test
  public void testElseIfChainKeepsNearestGuard() throws FsmException {
    final FsmGraph graph = single(SvFixtures.ELSE_IF_CHAIN);
    assertEquals(edges("IDLE->RUN:start", "IDLE->ERR:fault", "RUN->ERR:fault",
        "ERR->IDLE:clear"), edgesOf(graph));
  }

  @Test
  public void testPriorityCaseWithPrefixedStates() throws FsmException {
    final FsmGraph graph = single(SvFixtures.PRIORITY_CASE);
    assertEquals(Arrays.asList("S_IDLE", "S_BUSY"), graph.getStates());
    assertEquals("S_IDLE", graph.getResetState().get());
    assertEquals(edges("S_IDLE->S_BUSY:start", "S_BUSY->S_IDLE:done"), edgesOf(graph));
  }

  @Test
  public void testInlineEnumUsedThroughAlias() throws FsmException {
    final FsmGraph graph = single(SvFixtures.SEQUENCE_DETECTOR);
    assertEquals("anonymous_enum_IDLE_1", graph.getEnumName());
    assertEquals("state", graph.getStateVar());
    assertEquals("next_state", graph.getNextStateVar().get());
    assertEquals(Arrays.asList("IDLE", "F1", "F0", "S1", "S0"), graph.getStates());
    assertEquals("IDLE", graph.getResetState().get());
    assertEquals(edges("IDLE->F1:a", "F1->F0:~a", "F0->S1:a", "F0->IDLE:1", "S1->S0:~a",
        "S1->F1:1", "S0->S1:a", "S0->IDLE:1"), edgesOf(graph));
  }

  @Test
  public void testStarSensitivityAndCasez() throws FsmException {
    final FsmGraph graph = single(SvFixtures.CASEZ_STAR);
    assertEquals("st_t", graph.getEnumName());
    assertEquals("next_state", graph.getNextStateVar().get());
    assertEquals("S0", graph.getResetState().get());
    assertEquals(edges("S0->S1:en", "S1->S0:!en"), edgesOf(graph));
  }

  @Test
  public void testSplitDeclarations() throws FsmException {
    final FsmGraph graph = single(SvFixtures.SPLIT_DECLARATIONS);
    assertEquals("state", graph.getStateVar());
    assertEquals("next_state", graph.getNextStateVar().get());
    assertEquals(edges("S0->S1:a", "S1->S0:1"), edgesOf(graph));
  }

  @Test
  public void testNoisyModuleIsIgnoredByCaseGate() throws FsmException {
    final FsmGraph graph = single(SvFixtures.NOISY_MODULES, CandidateGate.CASE_ON_REGISTER);
    assertEquals("module real_fsm", graph.getScope());
    assertEquals(edges("IDLE->BUSY:go", "BUSY->IDLE:done"), edgesOf(graph));
  }

  @Test
  public void testClockedEnumRegisterIsACandidate() throws FsmException {
    final FsmEngine engine = FsmEngineBuilder.newBuilder().build();
    final List<FsmGraph> graphs =
        engine.extractFsmGraphs(SvFixtureParser.parse(SvFixtures.NOISY_MODULES));
    assertEquals(2, graphs.size());
    assertEquals("module noisy_enum_module", graphs.get(0).getScope());
    assertEquals("mode", graphs.get(0).getStateVar());
    assertEquals("X0", graphs.get(0).getResetState().get());
    assertTrue(graphs.get(0).getTransitions().isEmpty());
    assertEquals("module real_fsm", graphs.get(1).getScope());
  }

  @Test
  public void testIfElseRegisterMachine() throws FsmException {
    final FsmGraph graph = single(SvFixtures.IF_ELSE_REGISTER);
    assertEquals("module busy_flag", graph.getScope());
    assertEquals("state", graph.getStateVar());
    assertFalse(graph.getNextStateVar().isPresent());
    assertEquals(FsmGraph.Style.SINGLE_PROCESS, graph.getStyle());
    assertEquals(Arrays.asList("IDLE", "BUSY"), graph.getStates());
    assertEquals("IDLE", graph.getResetState().get());
    assertTrue(graph.getTransitions().isEmpty());

    final FsmEngineConfiguration strict = FsmEngineConfigurationBuilder.newBuilder()
        .candidateGate(CandidateGate.CASE_ON_REGISTER).build();
    assertTrue(FsmEngineBuilder.newBuilder().config(strict).build()
        .extractFsmGraphs(SvFixtureParser.parse(SvFixtures.IF_ELSE_REGISTER)).isEmpty());
  }

  @Test
  public void testModuleWithoutEnumYieldsNothing() throws FsmException {
    final FsmEngine engine = FsmEngineBuilder.newBuilder().build();
    final ExtractionReport report = engine.extract(SvFixtureParser.parse(SvFixtures.NO_ENUM));
    assertTrue(report.getGraphs().isEmpty());
    assertEquals(0, report.getStatistics().getEnumsIndexed());
    assertEquals(0, report.getStatistics().getGroupsConsidered());
    assertTrue(engine.extractFsmGraphs(null).isEmpty());
  }

  @Test
  public void testIdenticalTransitionsCollapse() throws FsmException {
    final String source = String.join("\n",
        "module dup (input logic clk, input logic go);",
        "  typedef enum logic {IDLE, BUSY} state_t;",
        "  state_t state, next_state;",
        "  always_ff @(posedge clk) state <= next_state;",
        "  always_comb begin",
        "    next_state = state;",
        "    case (state)",
        "      IDLE: if (go) next_state = BUSY;",
        "      BUSY: next_state = IDLE;",
        "    endcase",
        "  end",
        "  always @(*) begin",
        "    case (state)",
        "      IDLE: if (go) next_state = BUSY;",
        "    endcase",
        "  end",
        "endmodule");
    final FsmEngine engine = FsmEngineBuilder.newBuilder().build();
    final ExtractionReport report = engine.extract(SvFixtureParser.parse(source));
    assertEquals(1, report.getGraphs().size());
    final FsmGraph graph = report.getGraphs().get(0);
    assertEquals(edges("IDLE->BUSY:go", "BUSY->IDLE:1"), edgesOf(graph));
    assertEquals(2, graph.getNumTransitions());
    assertEquals(1, report.getStatistics().getDuplicateEdges());
    assertFalse(graph.getResetState().isPresent());
  }

  @Test
  public void testStatistics() throws FsmException {
    final FsmEngine engine = FsmEngineBuilder.newBuilder().build();
    final ExtractionReport report = engine.extract(SvFixtureParser.parse(SvFixtures.DATA_ENUM));
    final ExtractionStatistics statistics = report.getStatistics();
    assertEquals(2, statistics.getEnumsIndexed());
    assertEquals(0, statistics.getAnonymousEnums());
    assertEquals(3, statistics.getEnumVariables());
    assertEquals(2, statistics.getGroupsConsidered());
    assertEquals(1, statistics.getGroupsSkipped());
    assertEquals(1, statistics.getGraphsBuilt());
    assertTrue(statistics.getNodesVisited() > 0);
    assertTrue(statistics.getPassId().startsWith(engine.getId()));
  }

  @Test
  public void testPassesAreIndependent() throws FsmException {
    final FsmEngine engine = FsmEngineBuilder.newBuilder().build();
    final SyntaxNode tree = SvFixtureParser.parse(SvFixtures.SEQUENCE_DETECTOR);
    final ExtractionReport first = engine.extract(tree);
    final ExtractionReport second = engine.extract(tree);
    assertEquals(first.getGraphs(), second.getGraphs());
    assertEquals("anonymous_enum_IDLE_1", second.getGraphs().get(0).getEnumName());
    assertNotEquals(first.getStatistics().getPassId(), second.getStatistics().getPassId());
  }

  @Test
  public void testRegeneratedSourceExtractsToSameGraph() throws FsmException {
    final FsmEngine engine = FsmEngineBuilder.newBuilder().build();
    for (final String source : Arrays.asList(SvFixtures.REQUEST_GRANT, SvFixtures.SINGLE_REGISTER,
        SvFixtures.SEQUENCE_DETECTOR, SvFixtures.ELSE_IF_CHAIN, SvFixtures.CASEZ_STAR)) {
      final FsmGraph original = single(source);
      final String regenerated = engine.generateSource(original, null, source);
      final List<FsmGraph> reextracted =
          engine.extractFsmGraphs(SvFixtureParser.parse(regenerated));
      assertEquals(regenerated, 1, reextracted.size());
      assertEquals(new LinkedHashSet<>(original.getStates()),
          new LinkedHashSet<>(reextracted.get(0).getStates()));
      assertEquals(regenerated, edgesOf(original), edgesOf(reextracted.get(0)));
      assertEquals(original.getResetState(), reextracted.get(0).getResetState());
    }
  }

  @Test
  public void testEditedGraphRoundTrips() throws FsmException {
    final FsmEngine engine = FsmEngineBuilder.newBuilder().build();
    final FsmGraph original = single(SvFixtures.REQUEST_GRANT);
    final FsmGraph edited = original.toBuilder().state("ERROR")
        .transition("WAIT", "ERROR", "timeout && !gnt").transition("WAIT", "IDLE", "abort")
        .removeTransition(new TransitionEdge("GNT", "IDLE", "1")).build();
    final String regenerated = engine.generateSource(edited, "arbiter_v2");
    assertTrue(regenerated.contains("module arbiter_v2 ("));
    assertTrue(regenerated.contains("typedef enum logic [2:0] {"));

    final FsmGraph reextracted =
        engine.extractFsmGraphs(SvFixtureParser.parse(regenerated)).get(0);
    assertEquals("module arbiter_v2", reextracted.getScope());
    assertEquals(edited.getStates(), reextracted.getStates());
    assertEquals(edgesOf(edited), edgesOf(reextracted));
    // the original is untouched
    assertEquals(4, original.getNumStates());
    assertEquals(4, original.getNumTransitions());
  }

  @Test
  public void testEnumIndex() throws FsmException {
    final FsmEngine engine = FsmEngineBuilder.newBuilder().build();
    final EnumIndex enums = engine.indexEnums(SvFixtureParser.parse(SvFixtures.TWO_MACHINES));
    assertEquals(2, enums.size());
    assertEquals(Arrays.asList("IDLE", "RUN"), enums.resolveAlias("ctrl_t").get().getMembers());
    assertEquals(Arrays.asList("OK", "FAIL"), enums.resolveAlias("status_t").get().getMembers());
    assertFalse(enums.resolveAlias("missing_t").isPresent());
    assertTrue(engine.indexEnums(null).isEmpty());
  }

  private static FsmGraph single(final String source) throws FsmException {
    return single(source, CandidateGate.FSM_CANDIDATE);
  }

  private static FsmGraph single(final String source, final CandidateGate gate)
      throws FsmException {
    final FsmEngineConfiguration config =
        FsmEngineConfigurationBuilder.newBuilder().candidateGate(gate).build();
    final FsmEngine engine = FsmEngineBuilder.newBuilder().config(config).build();
    final List<FsmGraph> graphs = engine.extractFsmGraphs(SvFixtureParser.parse(source));
    assertEquals(1, graphs.size());
    return graphs.get(0);
  }

  static Set<String> edgesOf(final FsmGraph graph) {
    final Set<String> edges = new LinkedHashSet<>();
    for (final TransitionEdge edge : graph.getTransitions()) {
      edges.add(edge.getFrom() + "->" + edge.getTo() + ":" + edge.normalizedGuard());
    }
    return edges;
  }

  static Set<String> edges(final String... edges) {
    return new LinkedHashSet<>(Arrays.asList(edges));
  }

}
