package com.github.fsminfer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Labels every node of an arena with the innermost declaration scope enclosing it. Pre-order
 * numbering guarantees a parent is labelled before its children, so a single forward sweep stands
 * in for the push/pop walk.
 */
final class ScopeIndexer {
  static final Map<String, String> SCOPE_KINDS;
  static {
    final Map<String, String> kinds = new LinkedHashMap<>();
    kinds.put("ModuleDeclaration", "module");
    kinds.put("InterfaceDeclaration", "interface");
    kinds.put("PackageDeclaration", "package");
    kinds.put("ClassDeclaration", "class");
    kinds.put("ProgramDeclaration", "program");
    kinds.put("CheckerDeclaration", "checker");
    kinds.put("ConfigDeclaration", "config");
    SCOPE_KINDS = Collections.unmodifiableMap(kinds);
  }

  private ScopeIndexer() {}

  static boolean isScopeKind(final String kind) {
    return SCOPE_KINDS.containsKey(kind);
  }

  static ScopeIndex index(final NodeArena arena) {
    final Scope[] scopes = new Scope[arena.size()];
    final Map<String, List<Integer>> scopeNodes = new LinkedHashMap<>();
    for (int id = 0; id < arena.size(); id++) {
      final SyntaxNode node = arena.node(id);
      final int parentId = arena.parentOf(id);
      final Scope enclosing = parentId == NodeArena.NO_PARENT ? null : scopes[parentId];
      final String scopeKind = SCOPE_KINDS.get(node.kind());
      if (scopeKind != null) {
        final String name = SyntaxTrees.firstIdentifierText(node).orElse("");
        final Scope scope = new Scope(scopeKind, name, enclosing);
        scopes[id] = scope;
        List<Integer> ids = scopeNodes.get(scope.label());
        if (ids == null) {
          ids = new ArrayList<>();
          scopeNodes.put(scope.label(), ids);
        }
        ids.add(id);
      } else {
        scopes[id] = enclosing;
      }
    }
    return new ScopeIndex(scopes, scopeNodes);
  }

  /**
   * Result of one indexing sweep.
   */
  static final class ScopeIndex {
    private final Scope[] scopes;
    private final Map<String, List<Integer>> scopeNodes;

    private ScopeIndex(final Scope[] scopes, final Map<String, List<Integer>> scopeNodes) {
      this.scopes = scopes;
      this.scopeNodes = scopeNodes;
    }

    /**
     * Label of the innermost scope at node id, "" outside any scope.
     */
    String labelOf(final int id) {
      final Scope scope = scopes[id];
      return scope == null ? "" : scope.label();
    }

    Scope scopeOf(final int id) {
      return scopes[id];
    }

    /**
     * Ids of every scope node carrying this label; more than one when sibling scopes collide.
     */
    List<Integer> scopeNodeIds(final String label) {
      final List<Integer> ids = scopeNodes.get(label);
      return ids == null ? Collections.<Integer>emptyList() : Collections.unmodifiableList(ids);
    }

    int scopeCount() {
      return scopeNodes.size();
    }
  }

}
