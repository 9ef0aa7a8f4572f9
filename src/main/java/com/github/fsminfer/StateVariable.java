package com.github.fsminfer;

/**
 * A variable declared with an enumerated type.
 */
public final class StateVariable {
  private final String name;
  private final EnumType enumType;
  private final String scope;
  private final Role role;

  public static enum Role {
    // the clocked register holding the current state
    PRIMARY,
    // the combinational signal latched into the primary on the next edge
    NEXT,
    UNCLASSIFIED;
  }

  StateVariable(final String name, final EnumType enumType, final String scope) {
    this(name, enumType, scope, Role.UNCLASSIFIED);
  }

  private StateVariable(final String name, final EnumType enumType, final String scope,
      final Role role) {
    this.name = name;
    this.enumType = enumType;
    this.scope = scope;
    this.role = role;
  }

  StateVariable withRole(final Role role) {
    return new StateVariable(name, enumType, scope, role);
  }

  public String getName() {
    return name;
  }

  public EnumType getEnumType() {
    return enumType;
  }

  public String getScope() {
    return scope;
  }

  public Role getRole() {
    return role;
  }

  @Override
  public String toString() {
    return "StateVariable [name=" + name + ", enum=" + enumType.getName() + ", scope=" + scope
        + ", role=" + role + "]";
  }
}
