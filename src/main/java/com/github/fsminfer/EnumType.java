package com.github.fsminfer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An enumerated type found in one tree snapshot. Identity is the arena id of its EnumType node and
 * is only meaningful within the pass that found it.
 */
public final class EnumType {
  private final int id;
  private final String name;
  private final boolean anonymous;
  private final List<String> members;
  private final String scope;

  EnumType(final int id, final String name, final boolean anonymous, final List<String> members,
      final String scope) {
    this.id = id;
    this.name = name;
    this.anonymous = anonymous;
    this.members = Collections.unmodifiableList(new ArrayList<>(members));
    this.scope = scope;
  }

  public int getId() {
    return id;
  }

  /**
   * Declared typedef name, or the synthesized stand-in for an anonymous enum.
   */
  public String getName() {
    return name;
  }

  public boolean isAnonymous() {
    return anonymous;
  }

  /**
   * Member names in declaration order.
   */
  public List<String> getMembers() {
    return members;
  }

  /**
   * Label of the scope the enum was declared in.
   */
  public String getScope() {
    return scope;
  }

  @Override
  public String toString() {
    return "EnumType [id=" + id + ", name=" + name + ", members=" + members + ", scope=" + scope
        + "]";
  }
}
