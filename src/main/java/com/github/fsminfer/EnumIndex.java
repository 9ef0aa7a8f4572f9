package com.github.fsminfer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Enum types of one pass keyed by arena id, plus the type names (typedef names and inline aliases)
 * that refer to them. Aliases keep first-declared order.
 */
public final class EnumIndex {
  private final Map<Integer, EnumType> enumsById = new LinkedHashMap<>();
  private final Map<String, List<Integer>> aliasToEnum = new LinkedHashMap<>();

  EnumIndex() {}

  void add(final EnumType enumType) {
    enumsById.put(enumType.getId(), enumType);
  }

  void alias(final String alias, final int enumId) {
    List<Integer> ids = aliasToEnum.get(alias);
    if (ids == null) {
      ids = new ArrayList<>();
      aliasToEnum.put(alias, ids);
    }
    if (!ids.contains(enumId)) {
      ids.add(enumId);
    }
  }

  public boolean isEmpty() {
    return enumsById.isEmpty();
  }

  public int size() {
    return enumsById.size();
  }

  public Optional<EnumType> byId(final int id) {
    return Optional.ofNullable(enumsById.get(id));
  }

  public Collection<EnumType> enums() {
    return Collections.unmodifiableCollection(enumsById.values());
  }

  public Set<String> aliases() {
    return Collections.unmodifiableSet(aliasToEnum.keySet());
  }

  /**
   * The enum an alias refers to. When the same name was declared in several scopes, the one
   * declared in the first matching preferred scope wins, else the first declared.
   */
  public Optional<EnumType> resolveAlias(final String alias,
      final Collection<String> preferredScopes) {
    final List<Integer> ids = aliasToEnum.get(alias);
    if (ids == null || ids.isEmpty()) {
      return Optional.empty();
    }
    for (final String scope : preferredScopes) {
      for (final Integer id : ids) {
        final EnumType candidate = enumsById.get(id);
        if (candidate != null && candidate.getScope().equals(scope)) {
          return Optional.of(candidate);
        }
      }
    }
    return Optional.ofNullable(enumsById.get(ids.get(0)));
  }

  public Optional<EnumType> resolveAlias(final String alias) {
    return resolveAlias(alias, Collections.<String>emptyList());
  }

  @Override
  public String toString() {
    return "EnumIndex [enums=" + enumsById.values() + ", aliases=" + aliasToEnum.keySet() + "]";
  }
}
