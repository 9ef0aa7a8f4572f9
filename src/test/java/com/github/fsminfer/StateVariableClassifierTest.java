package com.github.fsminfer;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import com.github.fsminfer.ScoringTable.Condition;
import com.github.fsminfer.StateVariable.Role;
import com.github.fsminfer.StateVariableClassifier.Classification;

public class StateVariableClassifierTest {
  private static final EnumType STATE_T =
      new EnumType(1, "state_t", false, Arrays.asList("IDLE", "BUSY"), "module m");

  private final StateVariableClassifier classifier =
      new StateVariableClassifier(ScoringTable.defaults());

  @Test
  public void testDefaultScores() {
    final ScoringTable table = ScoringTable.defaults();
    assertEquals(5, table.scorePrimary("state"));
    assertEquals(5, table.scorePrimary("STATE"));
    assertEquals(2, table.scorePrimary("cur_state"));
    assertEquals(0, table.scorePrimary("next_state"));
    assertEquals(0, table.scorePrimary("mode"));
    assertEquals(4, table.scoreNext("next_state", "state"));
    assertEquals(3, table.scoreNext("state_d", "state_q"));
    assertEquals(2, table.scoreNext("fsm_ns", "fsm"));
    assertEquals(1, table.scoreNext("state", "cur_state"));
    assertEquals(-2, table.scoreNext("state", "state"));
  }

  @Test
  public void testCustomTable() {
    final ScoringTable table = ScoringTable.newBuilder()
        .primaryRule(4, Condition.suffix("_q"))
        .nextRule(4, Condition.suffix("_d"))
        .build();
    assertEquals(4, table.scorePrimary("ctrl_q"));
    assertEquals(0, table.scorePrimary("state"));
    assertEquals(4, table.scoreNext("ctrl_d", "ctrl_q"));
    assertEquals(1, table.getPrimaryRules().size());
    assertEquals(1, table.getNextRules().size());
  }

  @Test
  public void testTwoProcessRoles() {
    final Classification classification =
        classifier.classify(group("state", "next_state"), blocks(SvFixtures.REQUEST_GRANT)).get();
    assertEquals("state", classification.getPrimary().getName());
    assertEquals(Role.PRIMARY, classification.getPrimary().getRole());
    assertEquals("next_state", classification.getNext().get().getName());
    assertEquals(Role.NEXT, classification.getNext().get().getRole());
    assertEquals(2, classification.getVariables().size());
  }

  @Test
  public void testSingleRegisterHasNoNext() {
    final Classification classification =
        classifier.classify(group("state"), blocks(SvFixtures.SINGLE_REGISTER)).get();
    assertEquals("state", classification.getPrimary().getName());
    assertFalse(classification.getNext().isPresent());
  }

  @Test
  public void testWholeGroupCompetesWhenNothingIsClocked() {
    final String source = String.join("\n",
        "module m;",
        "  always_comb begin",
        "    next_state = state;",
        "  end",
        "endmodule");
    final Classification classification =
        classifier.classify(group("next_state", "state", "spare"), blocks(source)).get();
    assertEquals("state", classification.getPrimary().getName());
    assertEquals("next_state", classification.getNext().get().getName());
    assertEquals(Role.UNCLASSIFIED, classification.getVariables().get(2).getRole());
  }

  @Test
  public void testTiesGoToTheFirstDeclared() {
    final Classification classification =
        classifier.classify(group("a", "b"), Collections.<ProceduralBlock>emptyList()).get();
    assertEquals("a", classification.getPrimary().getName());
    assertFalse(classification.getNext().isPresent());
  }

  @Test
  public void testEmptyGroup() {
    assertFalse(classifier.classify(Collections.<StateVariable>emptyList(),
        Collections.<ProceduralBlock>emptyList()).isPresent());
    assertFalse(classifier.classify(null, Collections.<ProceduralBlock>emptyList()).isPresent());
  }

  @Test
  public void testVariableWrittenInBothBlockKinds() {
    final String source = String.join("\n",
        "module m;",
        "  always_ff @(posedge clk) state <= next_state;",
        "  always_comb begin",
        "    state = IDLE;",
        "    next_state = BUSY;",
        "  end",
        "endmodule");
    final Classification classification =
        classifier.classify(group("state", "next_state"), blocks(source)).get();
    assertEquals("state", classification.getPrimary().getName());
    assertTrue(classification.getNext().isPresent());
    assertEquals("next_state", classification.getNext().get().getName());
  }

  private static List<StateVariable> group(final String... names) {
    final List<StateVariable> group = new ArrayList<>();
    for (final String name : names) {
      group.add(new StateVariable(name, STATE_T, "module m"));
    }
    return group;
  }

  static List<ProceduralBlock> blocks(final String source) {
    final NodeArena arena = NodeArena.of(SvFixtureParser.parse(source));
    return ProceduralBlock.collect(arena, Collections.singletonList(0));
  }

}
