package com.github.fsminfer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Immutable general purpose {@link SyntaxNode}. Used by front ends that hand their trees over as
 * plain data (see {@link SyntaxTreeJson}) and by tests.
 */
public final class TreeNode implements SyntaxNode {
  private final String kind;
  private final String text;
  private final List<SyntaxNode> children;

  private TreeNode(final String kind, final String text, final List<SyntaxNode> children) {
    this.kind = kind;
    this.text = text;
    this.children = children;
  }

  public static TreeNode token(final String kind, final String text) {
    return new TreeNode(kind, text, Collections.<SyntaxNode>emptyList());
  }

  public static TreeNode node(final String kind, final List<? extends SyntaxNode> children) {
    final List<SyntaxNode> copy = new ArrayList<>(children.size());
    for (final SyntaxNode child : children) {
      if (child != null) {
        copy.add(child);
      }
    }
    return new TreeNode(kind, null, Collections.unmodifiableList(copy));
  }

  public static TreeNode node(final String kind, final SyntaxNode... children) {
    return node(kind, Arrays.asList(children));
  }

  @Override
  public String kind() {
    return kind;
  }

  @Override
  public List<SyntaxNode> children() {
    return children;
  }

  @Override
  public Optional<String> text() {
    return Optional.ofNullable(text);
  }

  @Override
  public String toString() {
    return text == null ? "TreeNode [kind=" + kind + ", children=" + children.size() + "]"
        : "TreeNode [kind=" + kind + ", text=" + text + "]";
  }
}
