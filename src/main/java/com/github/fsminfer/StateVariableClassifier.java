package com.github.fsminfer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.github.fsminfer.ProceduralBlock.Trigger;
import com.github.fsminfer.StateVariable.Role;

/**
 * Decides, within one group of same-enum variables of one scope, which variable is the clocked
 * state register and which (if any) is the combinational next-state signal.
 * 
 * A variable written in a clocked block is a primary candidate, one written in a combinational
 * block a next-state candidate; a variable may be both. When nothing of the group is written in a
 * clocked block the whole group competes for primary, which keeps single-register and
 * combinational-only designs analyzable. Ties go to the first variable declared.
 */
final class StateVariableClassifier {
  private final ScoringTable scoringTable;

  StateVariableClassifier(final ScoringTable scoringTable) {
    this.scoringTable = scoringTable;
  }

  Optional<Classification> classify(final List<StateVariable> group,
      final List<ProceduralBlock> blocks) {
    if (group == null || group.isEmpty()) {
      return Optional.empty();
    }
    final List<ProceduralBlock> clocked = ProceduralBlock.filter(blocks, Trigger.CLOCKED);
    final List<ProceduralBlock> combinational =
        ProceduralBlock.filter(blocks, Trigger.COMBINATIONAL);

    List<StateVariable> primaryCandidates = writtenIn(group, clocked);
    final List<StateVariable> nextCandidates = writtenIn(group, combinational);
    if (primaryCandidates.isEmpty()) {
      primaryCandidates = group;
    }

    StateVariable primary = null;
    int bestPrimaryScore = Integer.MIN_VALUE;
    for (final StateVariable candidate : primaryCandidates) {
      final int score = scoringTable.scorePrimary(candidate.getName());
      if (score > bestPrimaryScore) {
        bestPrimaryScore = score;
        primary = candidate;
      }
    }

    StateVariable next = null;
    int bestNextScore = Integer.MIN_VALUE;
    for (final StateVariable candidate : nextCandidates) {
      final int score = scoringTable.scoreNext(candidate.getName(), primary.getName());
      if (score > bestNextScore) {
        bestNextScore = score;
        next = candidate;
      }
    }
    // a register cannot be its own next-state signal
    if (next != null && next.getName().equals(primary.getName())) {
      next = null;
    }

    final List<StateVariable> classified = new ArrayList<>(group.size());
    StateVariable classifiedPrimary = null;
    StateVariable classifiedNext = null;
    for (final StateVariable variable : group) {
      if (variable == primary) {
        classifiedPrimary = variable.withRole(Role.PRIMARY);
        classified.add(classifiedPrimary);
      } else if (variable == next) {
        classifiedNext = variable.withRole(Role.NEXT);
        classified.add(classifiedNext);
      } else {
        classified.add(variable);
      }
    }
    return Optional.of(new Classification(classifiedPrimary, classifiedNext, classified));
  }

  private static List<StateVariable> writtenIn(final List<StateVariable> group,
      final List<ProceduralBlock> blocks) {
    final List<StateVariable> written = new ArrayList<>();
    for (final StateVariable variable : group) {
      for (final ProceduralBlock block : blocks) {
        if (block.writes(variable.getName())) {
          written.add(variable);
          break;
        }
      }
    }
    return written;
  }

  /**
   * Outcome of classifying one group.
   */
  static final class Classification {
    private final StateVariable primary;
    private final StateVariable next;
    private final List<StateVariable> variables;

    Classification(final StateVariable primary, final StateVariable next,
        final List<StateVariable> variables) {
      this.primary = primary;
      this.next = next;
      this.variables = Collections.unmodifiableList(variables);
    }

    StateVariable getPrimary() {
      return primary;
    }

    Optional<StateVariable> getNext() {
      return Optional.ofNullable(next);
    }

    /**
     * The whole group with roles assigned, declaration order.
     */
    List<StateVariable> getVariables() {
      return variables;
    }

    @Override
    public String toString() {
      return "Classification [primary=" + primary.getName() + ", next="
          + (next == null ? null : next.getName()) + "]";
    }
  }

}
