package com.github.fsminfer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.github.fsminfer.ProceduralBlock.Trigger;

/**
 * Keeps the enum typed variables that look like fsm state. A variable qualifies on any one of:<br>
 * 1. its name or its enum name contains "state"<br>
 * 2. a case construct of the scope mentions it<br>
 * 3. a clocked block of the scope assigns it<br>
 */
final class CandidateFilter {
  private static final String STATE_TOKEN = "state";

  private CandidateFilter() {}

  static List<StateVariable> candidates(final NodeArena arena, final List<Integer> scopeNodeIds,
      final List<StateVariable> group, final List<ProceduralBlock> blocks) {
    final List<String> caseTexts = new ArrayList<>();
    for (final int scopeId : scopeNodeIds) {
      for (final int id : arena.subtree(scopeId)) {
        if (TransitionGraphBuilder.isCaseKind(arena.node(id).kind())) {
          caseTexts.add(SyntaxTrees.inlineText(arena.node(id)));
        }
      }
    }
    final List<ProceduralBlock> clocked = ProceduralBlock.filter(blocks, Trigger.CLOCKED);

    final List<StateVariable> candidates = new ArrayList<>();
    for (final StateVariable variable : group) {
      if (nameBased(variable) || usedInCase(variable.getName(), caseTexts)
          || assignedInClocked(variable.getName(), clocked)) {
        candidates.add(variable);
      }
    }
    return candidates;
  }

  static boolean nameBased(final StateVariable variable) {
    return variable.getName().toLowerCase(Locale.ROOT).contains(STATE_TOKEN)
        || variable.getEnumType().getName().toLowerCase(Locale.ROOT).contains(STATE_TOKEN);
  }

  private static boolean usedInCase(final String name, final List<String> caseTexts) {
    for (final String text : caseTexts) {
      if (SyntaxTrees.containsWord(text, name)) {
        return true;
      }
    }
    return false;
  }

  private static boolean assignedInClocked(final String name,
      final List<ProceduralBlock> clocked) {
    for (final ProceduralBlock block : clocked) {
      if (block.writes(name)) {
        return true;
      }
    }
    return false;
  }

}
