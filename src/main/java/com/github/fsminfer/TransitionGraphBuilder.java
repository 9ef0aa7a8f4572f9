package com.github.fsminfer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Rebuilds the transition edges of one FSM from the case constructs that switch on its state
 * register.
 * 
 * Per branch of such a case:<br>
 * 1. the source state is the first enum member appearing in the branch<br>
 * 2. every "target = MEMBER;" in the branch is an edge, target being the next-state variable if
 * there is one, else the state register itself<br>
 * 3. the guard is the condition of the nearest "if (...)" preceding the assignment in the same
 * branch; an assignment directly under a bare else, or with no if before it, is unconditional<br>
 * 
 * Guards are positional, conditions of chained else-if branches are not composed.
 */
final class TransitionGraphBuilder {
  private static final Logger logger =
      LogManager.getLogger(TransitionGraphBuilder.class.getSimpleName());

  static final Set<String> CASE_KEYWORDS = new LinkedHashSet<>();
  static {
    CASE_KEYWORDS.add("case");
    CASE_KEYWORDS.add("casex");
    CASE_KEYWORDS.add("casez");
  }
  static final String DEFAULT_CASE_ITEM = "DefaultCaseItem";

  private static final Pattern IF_PATTERN = Pattern.compile("(?<![\\w$])if\\s*\\(");
  private static final Pattern TRAILING_BEGIN = Pattern.compile("(?:\\bbegin\\s*)+$");
  private static final Pattern TRAILING_ELSE = Pattern.compile("(?<![\\w$])else\\s*$");

  private TransitionGraphBuilder() {}

  static boolean isCaseKind(final String kind) {
    return kind.startsWith("Case") && kind.endsWith("Statement");
  }

  /**
   * Case constructs inside the scope nodes whose switch expression is exactly the variable.
   */
  static List<SyntaxNode> casesOn(final NodeArena arena, final List<Integer> scopeNodeIds,
      final String variable) {
    final List<SyntaxNode> cases = new ArrayList<>();
    for (final int scopeId : scopeNodeIds) {
      for (final int id : arena.subtree(scopeId)) {
        final SyntaxNode node = arena.node(id);
        if (isCaseKind(node.kind())) {
          final Optional<String> switched = switchExpression(node);
          if (switched.isPresent() && switched.get().equals(variable)) {
            cases.add(node);
          }
        }
      }
    }
    return cases;
  }

  /**
   * Whitespace free text between the parentheses following case/casex/casez.
   */
  static Optional<String> switchExpression(final SyntaxNode caseNode) {
    final List<String> tokens = SyntaxTrees.leafTexts(caseNode);
    for (int iter = 0; iter < tokens.size(); iter++) {
      if (!CASE_KEYWORDS.contains(tokens.get(iter))) {
        continue;
      }
      if (iter + 1 >= tokens.size() || !"(".equals(tokens.get(iter + 1))) {
        return Optional.empty();
      }
      final List<String> expression = new ArrayList<>();
      int depth = 0;
      for (int next = iter + 1; next < tokens.size(); next++) {
        final String token = tokens.get(next);
        if ("(".equals(token)) {
          depth++;
          if (depth == 1) {
            continue;
          }
        } else if (")".equals(token)) {
          depth--;
          if (depth == 0) {
            return Optional.of(SyntaxTrees.compact(SyntaxTrees.join(expression)));
          }
        }
        expression.add(token);
      }
      return Optional.empty();
    }
    return Optional.empty();
  }

  /**
   * Edges of all given case constructs, deduplicated on (from, to, guard) in discovery order.
   */
  static List<TransitionEdge> build(final List<SyntaxNode> caseNodes, final String stateVariable,
      final Optional<String> nextStateVariable, final List<String> members,
      final ExtractionStatistics statistics) {
    final String target = nextStateVariable.orElse(stateVariable);
    final Pattern assignment = Pattern.compile("(?<![\\w$.])" + Pattern.quote(target)
        + "\\s*<?=\\s*([A-Za-z_][\\w$]*)\\s*(?=;|$)");
    final Set<TransitionEdge> edges = new LinkedHashSet<>();
    for (final SyntaxNode caseNode : caseNodes) {
      for (final SyntaxNode item : caseItems(caseNode)) {
        if (DEFAULT_CASE_ITEM.equals(item.kind())) {
          continue;
        }
        final String text = SyntaxTrees.inlineText(item);
        final Optional<String> from = firstMember(text, members);
        if (!from.isPresent()) {
          if (logger.isDebugEnabled()) {
            logger.debug("Skipping case branch without a state label: " + text);
          }
          continue;
        }
        final Matcher matcher = assignment.matcher(text);
        while (matcher.find()) {
          final String to = matcher.group(1);
          if (!members.contains(to)) {
            continue;
          }
          final TransitionEdge edge =
              new TransitionEdge(from.get(), to, guardBefore(text, matcher.start()));
          if (!edges.add(edge) && statistics != null) {
            statistics.duplicateEdges++;
          }
        }
      }
    }
    return new ArrayList<>(edges);
  }

  /**
   * Case items of one case construct; nested case constructs stay inside their enclosing item.
   */
  static List<SyntaxNode> caseItems(final SyntaxNode caseNode) {
    final List<SyntaxNode> items = new ArrayList<>();
    final Deque<SyntaxNode> stack = new ArrayDeque<>();
    final List<SyntaxNode> children = caseNode.children();
    for (int iter = children.size() - 1; iter >= 0; iter--) {
      stack.push(children.get(iter));
    }
    while (!stack.isEmpty()) {
      final SyntaxNode node = stack.pop();
      if (node.kind().contains("CaseItem")) {
        items.add(node);
        continue;
      }
      final List<SyntaxNode> grandChildren = node.children();
      for (int iter = grandChildren.size() - 1; iter >= 0; iter--) {
        stack.push(grandChildren.get(iter));
      }
    }
    return items;
  }

  /**
   * The member whose first word-bounded occurrence comes first in the text.
   */
  static Optional<String> firstMember(final String text, final List<String> members) {
    String best = null;
    int bestIndex = Integer.MAX_VALUE;
    for (final String member : members) {
      final int index = SyntaxTrees.indexOfWord(text, member, 0);
      if (index >= 0 && index < bestIndex) {
        bestIndex = index;
        best = member;
      }
    }
    return Optional.ofNullable(best);
  }

  /**
   * Condition of the nearest if preceding offset, "1" when there is none or when the assignment
   * sits directly under a bare else.
   */
  static String guardBefore(final String text, final int offset) {
    final String preceding =
        TRAILING_BEGIN.matcher(text.substring(0, offset).trim()).replaceAll("");
    if (TRAILING_ELSE.matcher(preceding.trim()).find()) {
      return TransitionEdge.UNCONDITIONAL;
    }
    String guard = TransitionEdge.UNCONDITIONAL;
    final Matcher matcher = IF_PATTERN.matcher(text);
    while (matcher.find() && matcher.start() < offset) {
      final int open = matcher.end() - 1;
      final int close = matchingParen(text, open);
      if (close < 0 || close > offset) {
        continue;
      }
      final String condition = text.substring(open + 1, close).trim();
      guard = condition.isEmpty() ? TransitionEdge.UNCONDITIONAL : condition;
    }
    return guard;
  }

  static int matchingParen(final String text, final int open) {
    int depth = 0;
    for (int iter = open; iter < text.length(); iter++) {
      final char ch = text.charAt(iter);
      if (ch == '(') {
        depth++;
      } else if (ch == ')') {
        depth--;
        if (depth == 0) {
          return iter;
        }
      }
    }
    return -1;
  }

}
