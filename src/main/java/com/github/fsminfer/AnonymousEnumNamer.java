package com.github.fsminfer;

import java.util.List;

/**
 * Pass-scoped sequence that names anonymous enums "<prefix>_<first member>_<n>". A fresh namer is
 * created for every pass, so re-running on an unmodified tree yields the same names.
 */
final class AnonymousEnumNamer {
  private final String prefix;
  private int counter;

  AnonymousEnumNamer(final String prefix) {
    this.prefix = prefix;
  }

  String next(final List<String> members) {
    counter++;
    final String suffix = members.isEmpty() ? String.valueOf(counter) : members.get(0);
    return prefix + "_" + suffix + "_" + counter;
  }

  int issued() {
    return counter;
  }
}
