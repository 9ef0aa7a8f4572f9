package com.github.fsminfer;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Name scores used to tell the state register from the next-state signal. Each rule adds its
 * weight once when any of its conditions matches the lower-cased variable name.
 */
public final class ScoringTable {
  private final List<Rule> primaryRules;
  private final List<Rule> nextRules;
  private final int sameAsPrimaryPenalty;

  private ScoringTable(final List<Rule> primaryRules, final List<Rule> nextRules,
      final int sameAsPrimaryPenalty) {
    this.primaryRules = Collections.unmodifiableList(new ArrayList<>(primaryRules));
    this.nextRules = Collections.unmodifiableList(new ArrayList<>(nextRules));
    this.sameAsPrimaryPenalty = sameAsPrimaryPenalty;
  }

  /**
   * +3 exact "state", +2 contains "state", -2 looks like a next-state name.<br>
   * next: +3 contains next/nxt, +2 ends in _d/_ns, +1 contains "state", -3 if it is the primary.
   */
  public static ScoringTable defaults() {
    return newBuilder()
        .primaryRule(3, Condition.exact("state"))
        .primaryRule(2, Condition.contains("state"))
        .primaryRule(-2, Condition.contains("next"), Condition.contains("nxt"),
            Condition.suffix("_d"), Condition.suffix("_ns"))
        .nextRule(3, Condition.contains("next"), Condition.contains("nxt"))
        .nextRule(2, Condition.suffix("_d"), Condition.suffix("_ns"))
        .nextRule(1, Condition.contains("state"))
        .sameAsPrimaryPenalty(-3).build();
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public int scorePrimary(final String name) {
    return score(primaryRules, name);
  }

  public int scoreNext(final String name, final String primaryName) {
    int score = score(nextRules, name);
    if (name.equals(primaryName)) {
      score += sameAsPrimaryPenalty;
    }
    return score;
  }

  public List<Rule> getPrimaryRules() {
    return primaryRules;
  }

  public List<Rule> getNextRules() {
    return nextRules;
  }

  private static int score(final List<Rule> rules, final String name) {
    final String lowered = name.toLowerCase(Locale.ROOT);
    int score = 0;
    for (final Rule rule : rules) {
      if (rule.matches(lowered)) {
        score += rule.getWeight();
      }
    }
    return score;
  }

  @Override
  public String toString() {
    return "ScoringTable [primaryRules=" + primaryRules + ", nextRules=" + nextRules
        + ", sameAsPrimaryPenalty=" + sameAsPrimaryPenalty + "]";
  }

  public static final class Rule {
    private final int weight;
    private final List<Condition> conditions;

    private Rule(final int weight, final List<Condition> conditions) {
      this.weight = weight;
      this.conditions = Collections.unmodifiableList(new ArrayList<>(conditions));
    }

    public int getWeight() {
      return weight;
    }

    public List<Condition> getConditions() {
      return conditions;
    }

    boolean matches(final String loweredName) {
      for (final Condition condition : conditions) {
        if (condition.matches(loweredName)) {
          return true;
        }
      }
      return false;
    }

    @Override
    public String toString() {
      return weight + ":" + conditions;
    }
  }

  public static final class Condition {
    private final Match match;
    private final String token;

    public static enum Match {
      EXACT, CONTAINS, SUFFIX;
    }

    private Condition(final Match match, final String token) {
      this.match = match;
      this.token = token.toLowerCase(Locale.ROOT);
    }

    public static Condition exact(final String token) {
      return new Condition(Match.EXACT, token);
    }

    public static Condition contains(final String token) {
      return new Condition(Match.CONTAINS, token);
    }

    public static Condition suffix(final String token) {
      return new Condition(Match.SUFFIX, token);
    }

    boolean matches(final String loweredName) {
      switch (match) {
        case EXACT:
          return loweredName.equals(token);
        case CONTAINS:
          return loweredName.contains(token);
        case SUFFIX:
          return loweredName.endsWith(token);
        default:
          return false;
      }
    }

    @Override
    public String toString() {
      return match + "(" + token + ")";
    }
  }

  public final static class Builder {
    private final List<Rule> primaryRules = new ArrayList<>();
    private final List<Rule> nextRules = new ArrayList<>();
    private int sameAsPrimaryPenalty;

    public Builder primaryRule(final int weight, final Condition... conditions) {
      primaryRules.add(new Rule(weight, Arrays.asList(conditions)));
      return this;
    }

    public Builder nextRule(final int weight, final Condition... conditions) {
      nextRules.add(new Rule(weight, Arrays.asList(conditions)));
      return this;
    }

    public Builder sameAsPrimaryPenalty(final int sameAsPrimaryPenalty) {
      this.sameAsPrimaryPenalty = sameAsPrimaryPenalty;
      return this;
    }

    public ScoringTable build() {
      return new ScoringTable(primaryRules, nextRules, sameAsPrimaryPenalty);
    }

    private Builder() {}
  }
}
