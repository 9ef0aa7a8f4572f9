package com.github.fsminfer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Traversal and text helpers over {@link SyntaxNode} trees. All walks use an explicit stack so that
 * deeply nested generated code cannot overflow the call stack.
 */
public final class SyntaxTrees {
  public static final String IDENTIFIER = "Identifier";

  private SyntaxTrees() {}

  /**
   * Pre-order walk of the whole subtree, root included.
   */
  public static List<SyntaxNode> preOrder(final SyntaxNode root) {
    final List<SyntaxNode> visited = new ArrayList<>();
    if (root == null) {
      return visited;
    }
    final Deque<SyntaxNode> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      final SyntaxNode node = stack.pop();
      visited.add(node);
      final List<SyntaxNode> children = node.children();
      for (int iter = children.size() - 1; iter >= 0; iter--) {
        final SyntaxNode child = children.get(iter);
        if (child != null) {
          stack.push(child);
        }
      }
    }
    return visited;
  }

  public static Optional<SyntaxNode> findFirst(final SyntaxNode root, final String kind) {
    for (final SyntaxNode node : preOrder(root)) {
      if (kind.equals(node.kind())) {
        return Optional.of(node);
      }
    }
    return Optional.empty();
  }

  public static List<SyntaxNode> findAll(final SyntaxNode root, final String kind) {
    final List<SyntaxNode> found = new ArrayList<>();
    for (final SyntaxNode node : preOrder(root)) {
      if (kind.equals(node.kind())) {
        found.add(node);
      }
    }
    return found;
  }

  /**
   * Leaf tokens in source order. Leaves without text are dropped.
   */
  public static List<SyntaxNode> leaves(final SyntaxNode root) {
    final List<SyntaxNode> leaves = new ArrayList<>();
    for (final SyntaxNode node : preOrder(root)) {
      if (node.children().isEmpty() && node.text().isPresent() && !node.text().get().isEmpty()) {
        leaves.add(node);
      }
    }
    return leaves;
  }

  public static List<String> leafTexts(final SyntaxNode root) {
    final List<String> texts = new ArrayList<>();
    for (final SyntaxNode leaf : leaves(root)) {
      texts.add(leaf.text().get());
    }
    return texts;
  }

  /**
   * Texts of the Identifier leaves in source order, duplicates kept.
   */
  public static List<String> identifierTexts(final SyntaxNode root) {
    final List<String> identifiers = new ArrayList<>();
    for (final SyntaxNode leaf : leaves(root)) {
      if (IDENTIFIER.equals(leaf.kind())) {
        identifiers.add(leaf.text().get());
      }
    }
    return identifiers;
  }

  public static Optional<String> firstIdentifierText(final SyntaxNode root) {
    final Optional<SyntaxNode> identifier = findFirst(root, IDENTIFIER);
    return identifier.isPresent() ? identifier.get().text() : Optional.<String>empty();
  }

  /**
   * Leaf texts joined into one line. A single space is inserted only where two word-like tokens
   * would otherwise fuse, eg. "unique case(state)" or "if(req)next_state=REQ;".
   */
  public static String inlineText(final SyntaxNode root) {
    return join(leafTexts(root));
  }

  static String join(final List<String> tokens) {
    final StringBuilder builder = new StringBuilder();
    for (final String token : tokens) {
      if (builder.length() > 0 && isWordChar(builder.charAt(builder.length() - 1))
          && isWordChar(token.charAt(0))) {
        builder.append(' ');
      }
      builder.append(token);
    }
    return builder.toString();
  }

  /**
   * Strip all whitespace.
   */
  public static String compact(final String text) {
    return text == null ? "" : text.replaceAll("\\s+", "");
  }

  static boolean isWordChar(final char ch) {
    return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$';
  }

  /**
   * Offset of the first occurrence of word at or after fromIndex that is not glued to other
   * identifier characters, or -1.
   */
  public static int indexOfWord(final String text, final String word, final int fromIndex) {
    if (word == null || word.isEmpty()) {
      return -1;
    }
    int index = text.indexOf(word, Math.max(0, fromIndex));
    while (index >= 0) {
      final int end = index + word.length();
      final boolean leftClear = index == 0 || !isWordChar(text.charAt(index - 1));
      final boolean rightClear = end >= text.length() || !isWordChar(text.charAt(end));
      if (leftClear && rightClear) {
        return index;
      }
      index = text.indexOf(word, index + 1);
    }
    return -1;
  }

  public static boolean containsWord(final String text, final String word) {
    return indexOfWord(text, word, 0) >= 0;
  }

}
