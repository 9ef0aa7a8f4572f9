package com.github.fsminfer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsminfer.ScopeIndexer.ScopeIndex;

/**
 * Finds enumerated types and the variables declared with them.
 * 
 * Two declaration shapes name an enum:<br>
 * 1. {@code typedef enum {...} NAME;} the first foreign identifier of the typedef is the name<br>
 * 2. {@code enum {...} v1, v2;} the trailing identifiers become aliases usable as type names later
 * on; the enum itself stays anonymous and receives a synthesized name<br>
 * 
 * A later declaration is bound to an enum either through its own nested enum or, failing that, by
 * the first known alias occurring anywhere in its text. The substring match is permissive and may
 * bind unrelated declarations; no type information is available from surface syntax.
 */
final class EnumResolver {
  private static final Logger logger = LogManager.getLogger(EnumResolver.class.getSimpleName());

  static final String ENUM_TYPE = "EnumType";
  static final String ENUMERATOR = "Enumerator";

  private final FsmEngineConfiguration config;

  EnumResolver(final FsmEngineConfiguration config) {
    this.config = config;
  }

  /**
   * Index every enum of the snapshot. Never throws for trees without enums, the index is simply
   * empty.
   */
  EnumIndex index(final NodeArena arena, final ScopeIndex scopes, final AnonymousEnumNamer namer) {
    final EnumIndex index = new EnumIndex();
    final Map<Integer, String> declaredNames = new LinkedHashMap<>();
    final Map<Integer, List<String>> membersById = new LinkedHashMap<>();

    for (int id = 0; id < arena.size(); id++) {
      if (!ENUM_TYPE.equals(arena.node(id).kind())) {
        continue;
      }
      final List<String> members = members(arena.node(id));
      membersById.put(id, members);
      String name = "";
      final int parentId = arena.parentOf(id);
      if (parentId != NodeArena.NO_PARENT) {
        final Set<String> parentTokens =
            new HashSet<>(SyntaxTrees.leafTexts(arena.node(parentId)));
        final List<String> foreign = foreignIdentifiers(arena, parentId, id, members);
        if (parentTokens.contains("typedef") && parentTokens.contains("enum")) {
          if (!foreign.isEmpty()) {
            name = foreign.get(0);
          }
        } else if (parentTokens.contains("enum")) {
          // inline enum bound to variables, the variables double as type aliases
          for (final String alias : foreign) {
            index.alias(alias, id);
          }
        }
      }
      declaredNames.put(id, name);
      if (!name.isEmpty()) {
        index.alias(name, id);
      }
    }

    for (final Map.Entry<Integer, String> declared : declaredNames.entrySet()) {
      final int id = declared.getKey();
      final List<String> members = membersById.get(id);
      final boolean anonymous = declared.getValue().isEmpty();
      final String name = anonymous ? namer.next(members) : declared.getValue();
      index.add(new EnumType(id, name, anonymous, members, scopes.labelOf(id)));
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Indexed " + index.size() + " enum types, aliases: " + index.aliases());
    }
    return index;
  }

  /**
   * Every variable declared with an indexed enum, in declaration order, deduplicated per scope.
   */
  List<StateVariable> collectVariables(final NodeArena arena, final ScopeIndex scopes,
      final EnumIndex index) {
    final List<StateVariable> variables = new ArrayList<>();
    if (index.isEmpty()) {
      return variables;
    }
    final Set<String> seen = new HashSet<>();
    for (int id = 0; id < arena.size(); id++) {
      final String kind = arena.node(id).kind();
      if (!isVariableDeclarationKind(kind)) {
        continue;
      }
      final Optional<Resolution> resolution = resolveDeclaration(arena, id, scopes, index);
      if (!resolution.isPresent()) {
        continue;
      }
      final EnumType enumType = resolution.get().enumType;
      final List<String> names = declaredVariables(arena, id, resolution.get());
      final List<String> tokens = SyntaxTrees.leafTexts(arena.node(id));
      if (tokens.contains("typedef")) {
        // typedef of an enum type name: more aliases, no variables
        if (!tokens.contains("enum")) {
          for (final String alias : names) {
            index.alias(alias, enumType.getId());
          }
        }
        continue;
      }
      final String scope = scopes.labelOf(id);
      for (final String name : names) {
        if (seen.add(scope + "\u0000" + name + "\u0000" + enumType.getId())) {
          variables.add(new StateVariable(name, enumType, scope));
        }
      }
    }
    if (logger.isDebugEnabled()) {
      logger.debug("Found " + variables.size() + " enum typed variables: " + variables);
    }
    return variables;
  }

  /**
   * Bind one declaration to an enum, if it has one.
   */
  Optional<Resolution> resolveDeclaration(final NodeArena arena, final int declarationId,
      final ScopeIndex scopes, final EnumIndex index) {
    final SyntaxNode declaration = arena.node(declarationId);
    final List<String> tokens = SyntaxTrees.leafTexts(declaration);
    if (tokens.contains("enum")) {
      for (final int id : arena.subtree(declarationId)) {
        if (ENUM_TYPE.equals(arena.node(id).kind())) {
          final Optional<EnumType> local = index.byId(id);
          return local.isPresent() ? Optional.of(new Resolution(local.get(), id, null))
              : Optional.<Resolution>empty();
        }
      }
      return Optional.empty();
    }
    final String text = SyntaxTrees.inlineText(declaration);
    for (final String alias : index.aliases()) {
      if (!alias.isEmpty() && text.contains(alias)) {
        final Optional<EnumType> aliased =
            index.resolveAlias(alias, enclosingScopes(scopes.scopeOf(declarationId)));
        if (aliased.isPresent()) {
          return Optional.of(new Resolution(aliased.get(), -1, alias));
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Identifiers a declaration introduces: every identifier leaf minus reserved words, enum members,
   * the resolved alias and enum name, package prefixes, dimension expressions and initializers.
   */
  List<String> declaredVariables(final NodeArena arena, final int declarationId,
      final Resolution resolution) {
    final Set<Integer> enumSubtree = new HashSet<>();
    if (resolution.enumNodeId >= 0) {
      enumSubtree.addAll(arena.subtree(resolution.enumNodeId));
    }
    final EnumType enumType = resolution.enumType;
    final Set<String> skip = new HashSet<>(config.getReservedWords());
    skip.addAll(enumType.getMembers());
    skip.add(enumType.getName());
    if (resolution.alias != null) {
      skip.add(resolution.alias);
    }

    final List<Integer> leafIds = new ArrayList<>();
    for (final int id : arena.subtree(declarationId)) {
      final SyntaxNode node = arena.node(id);
      if (node.children().isEmpty() && node.text().isPresent() && !enumSubtree.contains(id)) {
        leafIds.add(id);
      }
    }
    final Set<String> names = new LinkedHashSet<>();
    int nesting = 0;
    boolean initializer = false;
    for (int iter = 0; iter < leafIds.size(); iter++) {
      final SyntaxNode leaf = arena.node(leafIds.get(iter));
      final String text = leaf.text().get();
      switch (text) {
        case "[":
        case "(":
        case "{":
          nesting++;
          continue;
        case "]":
        case ")":
        case "}":
          nesting = Math.max(0, nesting - 1);
          continue;
        case "=":
          if (nesting == 0) {
            initializer = true;
          }
          continue;
        case ",":
        case ";":
          if (nesting == 0) {
            initializer = false;
          }
          continue;
        default:
          break;
      }
      if (!SyntaxTrees.IDENTIFIER.equals(leaf.kind()) || nesting > 0 || initializer) {
        continue;
      }
      final boolean packagePrefix = iter + 1 < leafIds.size()
          && "::".equals(arena.node(leafIds.get(iter + 1)).text().orElse(""));
      if (packagePrefix || skip.contains(text)) {
        continue;
      }
      names.add(text);
    }
    return new ArrayList<>(names);
  }

  /**
   * Member names of an EnumType node in declaration order.
   */
  static List<String> members(final SyntaxNode enumNode) {
    final List<String> members = new ArrayList<>();
    final List<SyntaxNode> enumerators = SyntaxTrees.findAll(enumNode, ENUMERATOR);
    if (!enumerators.isEmpty()) {
      for (final SyntaxNode enumerator : enumerators) {
        final Optional<String> name = SyntaxTrees.firstIdentifierText(enumerator);
        if (name.isPresent()) {
          members.add(name.get());
        } else if (enumerator.text().isPresent()) {
          members.add(enumerator.text().get());
        }
      }
      return members;
    }
    // no Enumerator nodes, recover the list from the braces
    final String text = SyntaxTrees.inlineText(enumNode);
    final int open = text.indexOf('{');
    final int close = text.lastIndexOf('}');
    if (open < 0 || close <= open) {
      return members;
    }
    for (final String part : text.substring(open + 1, close).split(",")) {
      final String name = part.split("=", 2)[0].trim();
      if (!name.isEmpty()) {
        members.add(name);
      }
    }
    return members;
  }

  private List<String> foreignIdentifiers(final NodeArena arena, final int parentId,
      final int enumId, final List<String> members) {
    final Set<Integer> enumSubtree = new HashSet<>(arena.subtree(enumId));
    final List<String> identifiers = new ArrayList<>();
    for (final int id : arena.subtree(parentId)) {
      if (enumSubtree.contains(id)) {
        continue;
      }
      final SyntaxNode node = arena.node(id);
      if (!SyntaxTrees.IDENTIFIER.equals(node.kind()) || !node.text().isPresent()) {
        continue;
      }
      final String name = node.text().get();
      if (name.isEmpty() || config.getReservedWords().contains(name) || members.contains(name)) {
        continue;
      }
      identifiers.add(name);
    }
    return identifiers;
  }

  private boolean isVariableDeclarationKind(final String kind) {
    return kind.endsWith("Declaration") && !ScopeIndexer.isScopeKind(kind)
        && !config.getExcludedDeclarationKinds().contains(kind);
  }

  private static List<String> enclosingScopes(final Scope scope) {
    final List<String> labels = new ArrayList<>();
    Scope current = scope;
    while (current != null) {
      labels.add(current.label());
      current = current.getParent().orElse(null);
    }
    labels.add("");
    return labels;
  }

  /**
   * Binding of one declaration: the enum, the EnumType node nested in the declaration (-1 when
   * bound through an alias) and the alias used (null when nested).
   */
  static final class Resolution {
    final EnumType enumType;
    final int enumNodeId;
    final String alias;

    Resolution(final EnumType enumType, final int enumNodeId, final String alias) {
      this.enumType = enumType;
      this.enumNodeId = enumNodeId;
      this.alias = alias;
    }
  }

}
