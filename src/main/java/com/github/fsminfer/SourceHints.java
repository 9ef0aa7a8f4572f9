package com.github.fsminfer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Clock and reset naming recovered from the source a graph was extracted from, so regenerated
 * source keeps the original port names and reset polarity.
 */
public final class SourceHints {
  private static final Pattern CLOCKED_HEADER =
      Pattern.compile("always(?:_ff)?\\s*@\\s*\\(([^)]*)\\)");
  private static final Pattern EDGE_EVENT =
      Pattern.compile("(posedge|negedge)\\s+([A-Za-z_][\\w$]*)");

  private final String clockSignal;
  private final String resetSignal;
  private final boolean resetActiveLow;

  private SourceHints(final String clockSignal, final String resetSignal,
      final boolean resetActiveLow) {
    this.clockSignal = clockSignal;
    this.resetSignal = resetSignal;
    this.resetActiveLow = resetActiveLow;
  }

  public static SourceHints of(final String clockSignal, final String resetSignal,
      final boolean resetActiveLow) {
    return new SourceHints(clockSignal, resetSignal, resetActiveLow);
  }

  /**
   * clk and rst, reset active-high.
   */
  public static SourceHints defaults() {
    return new SourceHints("clk", "rst", false);
  }

  public static SourceHints fromSource(final String source) {
    return fromSource(source, defaults());
  }

  /**
   * Reads the first edge-triggered always header of the source: its first edge event names the
   * clock, the following one names the reset and gives its polarity. Whatever the header does not
   * name falls back to the given defaults.
   */
  public static SourceHints fromSource(final String source, final SourceHints fallback) {
    if (source == null || source.isEmpty()) {
      return fallback;
    }
    final Matcher header = CLOCKED_HEADER.matcher(source);
    while (header.find()) {
      final Matcher event = EDGE_EVENT.matcher(header.group(1));
      if (!event.find()) {
        continue;
      }
      final String clock = event.group(2);
      if (!event.find()) {
        return new SourceHints(clock, fallback.resetSignal, fallback.resetActiveLow);
      }
      return new SourceHints(clock, event.group(2), "negedge".equals(event.group(1)));
    }
    return fallback;
  }

  public String getClockSignal() {
    return clockSignal;
  }

  public String getResetSignal() {
    return resetSignal;
  }

  public boolean isResetActiveLow() {
    return resetActiveLow;
  }

  @Override
  public String toString() {
    return "SourceHints [clockSignal=" + clockSignal + ", resetSignal=" + resetSignal
        + ", resetActiveLow=" + resetActiveLow + "]";
  }
}
