package com.github.fsminfer;

import java.util.Optional;

/**
 * A declaration scope (module, class, package, ...). Holds a back-reference to its parent only; a
 * scope never owns its children.
 */
public final class Scope {
  private final String kind;
  private final String name;
  private final Scope parent;

  Scope(final String kind, final String name, final Scope parent) {
    this.kind = kind;
    this.name = name;
    this.parent = parent;
  }

  public String getKind() {
    return kind;
  }

  public String getName() {
    return name;
  }

  public Optional<Scope> getParent() {
    return Optional.ofNullable(parent);
  }

  /**
   * Path label, eg. "module fsm_example". Identically named sibling scopes share a label.
   */
  public String label() {
    return (kind + " " + name).trim();
  }

  @Override
  public String toString() {
    return "Scope [" + label() + "]";
  }
}
