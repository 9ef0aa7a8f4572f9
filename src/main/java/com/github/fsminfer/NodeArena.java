package com.github.fsminfer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Numbers every node of one tree snapshot in pre-order, so that per-pass indexes can be keyed by a
 * plain int instead of by object identity. Ids are dense, start at 0 (the root) and are only
 * meaningful within the pass that built the arena.
 */
final class NodeArena {
  static final int NO_PARENT = -1;

  private final List<SyntaxNode> nodes = new ArrayList<>();
  private final List<Integer> parents = new ArrayList<>();
  private final Map<SyntaxNode, Integer> ids = new IdentityHashMap<>();
  // last id of the subtree rooted at each id
  private int[] subtreeEnds = new int[0];

  private NodeArena() {}

  static NodeArena of(final SyntaxNode root) {
    final NodeArena arena = new NodeArena();
    if (root == null) {
      return arena;
    }
    final Deque<int[]> pendingParents = new ArrayDeque<>();
    final Deque<SyntaxNode> stack = new ArrayDeque<>();
    stack.push(root);
    pendingParents.push(new int[] {NO_PARENT});
    while (!stack.isEmpty()) {
      final SyntaxNode node = stack.pop();
      final int parentId = pendingParents.pop()[0];
      final int id = arena.nodes.size();
      arena.nodes.add(node);
      arena.parents.add(parentId);
      arena.ids.put(node, id);
      final List<SyntaxNode> children = node.children();
      for (int iter = children.size() - 1; iter >= 0; iter--) {
        final SyntaxNode child = children.get(iter);
        if (child != null) {
          stack.push(child);
          pendingParents.push(new int[] {id});
        }
      }
    }
    final int size = arena.nodes.size();
    arena.subtreeEnds = new int[size];
    for (int id = size - 1; id >= 0; id--) {
      arena.subtreeEnds[id] = Math.max(arena.subtreeEnds[id], id);
      final int parentId = arena.parents.get(id);
      if (parentId != NO_PARENT) {
        arena.subtreeEnds[parentId] =
            Math.max(arena.subtreeEnds[parentId], arena.subtreeEnds[id]);
      }
    }
    return arena;
  }

  int size() {
    return nodes.size();
  }

  SyntaxNode node(final int id) {
    return nodes.get(id);
  }

  int parentOf(final int id) {
    return parents.get(id);
  }

  /**
   * Id of a node of this snapshot, or -1 for a foreign node.
   */
  int idOf(final SyntaxNode node) {
    final Integer id = ids.get(node);
    return id == null ? -1 : id;
  }

  /**
   * Ids of the subtree rooted at id, in pre-order, root included. Pre-order numbering makes a
   * subtree a contiguous id range.
   */
  List<Integer> subtree(final int id) {
    final List<Integer> subtree = new ArrayList<>(subtreeEnds[id] - id + 1);
    for (int next = id; next <= subtreeEnds[id]; next++) {
      subtree.add(next);
    }
    return subtree;
  }

  boolean isAncestor(final int ancestorId, final int id) {
    return ancestorId < id && id <= subtreeEnds[ancestorId];
  }

}
