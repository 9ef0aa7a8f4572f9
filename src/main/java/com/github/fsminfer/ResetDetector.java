package com.github.fsminfer;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the reset state: the first enum member directly assigned to the state register inside a
 * clocked block. A reset branch cannot be told apart from any other constant clocked assignment, so
 * the textually first one wins.
 */
final class ResetDetector {

  private ResetDetector() {}

  static Optional<String> detect(final List<ProceduralBlock> clockedBlocks,
      final String stateVariable, final List<String> members) {
    final Pattern assignment = Pattern.compile("(?<![\\w$.])" + Pattern.quote(stateVariable)
        + "\\s*<?=\\s*([A-Za-z_][\\w$]*)(?![\\w$])");
    for (final ProceduralBlock block : clockedBlocks) {
      if (!SyntaxTrees.containsWord(block.getText(), stateVariable)) {
        continue;
      }
      final Matcher matcher = assignment.matcher(block.getText());
      while (matcher.find()) {
        if (members.contains(matcher.group(1))) {
          return Optional.of(matcher.group(1));
        }
      }
    }
    return Optional.empty();
  }

}
