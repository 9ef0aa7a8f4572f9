package com.github.fsminfer;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * This class encapsulates all the configuration parameters of the FsmEngine. Use the
 * {@code FsmEngineConfigurationBuilder} to build it.
 * 
 * Notes:<br>
 * 1. any knob left unset falls back to its default, so {@code newBuilder().build()} is a complete
 * configuration<br>
 * 2. reservedWords are dropped wherever identifiers are harvested from declarations; slang emits
 * keywords as keyword tokens anyway, the set guards front ends that do not<br>
 * 3. candidateGate decides which groups of enum variables become graphs, see {@link CandidateGate}
 * <br>
 */
public final class FsmEngineConfiguration {
  public static final Set<String> DEFAULT_RESERVED_WORDS =
      Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList("typedef", "enum", "logic",
          "reg", "wire", "bit", "byte", "shortint", "int", "longint", "signed", "unsigned",
          "integer", "time", "real", "realtime", "var", "input", "output", "inout", "const",
          "static", "automatic")));

  public static final Set<String> DEFAULT_EXCLUDED_DECLARATION_KINDS =
      Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList("FunctionDeclaration",
          "TaskDeclaration", "ClassMethodDeclaration", "ConstraintDeclaration",
          "CovergroupDeclaration", "ModportDeclaration")));

  private final ScoringTable scoringTable;
  private final Set<String> reservedWords;
  private final Set<String> excludedDeclarationKinds;
  private final String anonymousEnumPrefix;
  private final CandidateGate candidateGate;
  private final String defaultClockSignal;
  private final String defaultResetSignal;

  public ScoringTable getScoringTable() {
    return scoringTable;
  }

  public Set<String> getReservedWords() {
    return reservedWords;
  }

  public Set<String> getExcludedDeclarationKinds() {
    return excludedDeclarationKinds;
  }

  public String getAnonymousEnumPrefix() {
    return anonymousEnumPrefix;
  }

  public CandidateGate getCandidateGate() {
    return candidateGate;
  }

  public String getDefaultClockSignal() {
    return defaultClockSignal;
  }

  public String getDefaultResetSignal() {
    return defaultResetSignal;
  }

  public static FsmEngineConfiguration defaults() {
    try {
      return FsmEngineConfigurationBuilder.newBuilder().build();
    } catch (FsmException unexpected) {
      throw new IllegalStateException("Default engine configuration failed validation",
          unexpected);
    }
  }

  public final static class FsmEngineConfigurationBuilder {
    private ScoringTable scoringTable;
    private Set<String> reservedWords;
    private Set<String> excludedDeclarationKinds;
    private String anonymousEnumPrefix = "anonymous_enum";
    private CandidateGate candidateGate = CandidateGate.FSM_CANDIDATE;
    private String defaultClockSignal = "clk";
    private String defaultResetSignal = "rst";

    public static FsmEngineConfigurationBuilder newBuilder() {
      return new FsmEngineConfigurationBuilder();
    }

    public FsmEngineConfigurationBuilder scoringTable(final ScoringTable scoringTable) {
      this.scoringTable = scoringTable;
      return this;
    }

    public FsmEngineConfigurationBuilder reservedWords(final Set<String> reservedWords) {
      this.reservedWords = reservedWords;
      return this;
    }

    public FsmEngineConfigurationBuilder excludedDeclarationKinds(
        final Set<String> excludedDeclarationKinds) {
      this.excludedDeclarationKinds = excludedDeclarationKinds;
      return this;
    }

    public FsmEngineConfigurationBuilder anonymousEnumPrefix(final String anonymousEnumPrefix) {
      this.anonymousEnumPrefix = anonymousEnumPrefix;
      return this;
    }

    public FsmEngineConfigurationBuilder candidateGate(final CandidateGate candidateGate) {
      this.candidateGate = candidateGate;
      return this;
    }

    public FsmEngineConfigurationBuilder defaultClockSignal(final String defaultClockSignal) {
      this.defaultClockSignal = defaultClockSignal;
      return this;
    }

    public FsmEngineConfigurationBuilder defaultResetSignal(final String defaultResetSignal) {
      this.defaultResetSignal = defaultResetSignal;
      return this;
    }

    public FsmEngineConfiguration build() throws FsmException {
      final FsmEngineConfiguration config = new FsmEngineConfiguration(
          scoringTable == null ? ScoringTable.defaults() : scoringTable,
          reservedWords == null ? DEFAULT_RESERVED_WORDS : reservedWords,
          excludedDeclarationKinds == null ? DEFAULT_EXCLUDED_DECLARATION_KINDS
              : excludedDeclarationKinds,
          anonymousEnumPrefix, candidateGate, defaultClockSignal,
          defaultResetSignal);
      config.validate();
      return config;
    }

    private FsmEngineConfigurationBuilder() {}
  }

  private void validate() throws FsmException {
    StringBuilder messages = new StringBuilder();
    if (!isIdentifier(anonymousEnumPrefix)) {
      messages.append("anonymousEnumPrefix must be a plain identifier. ");
    }
    if (candidateGate == null) {
      messages.append("candidateGate is required. ");
    }
    if (!isIdentifier(defaultClockSignal)) {
      messages.append("defaultClockSignal must be a plain identifier. ");
    }
    if (!isIdentifier(defaultResetSignal)) {
      messages.append("defaultResetSignal must be a plain identifier. ");
    }
    if (messages.length() > 0) {
      throw new FsmException(FsmException.Code.INVALID_ENGINE_CONFIG, messages.toString().trim());
    }
  }

  static boolean isIdentifier(final String name) {
    return name != null && name.matches("[A-Za-z_][A-Za-z0-9_$]*");
  }

  @Override
  public String toString() {
    return "FsmEngineConfiguration [scoringTable=" + scoringTable + ", anonymousEnumPrefix="
        + anonymousEnumPrefix + ", candidateGate=" + candidateGate
        + ", defaultClockSignal=" + defaultClockSignal + ", defaultResetSignal="
        + defaultResetSignal + "]";
  }

  private FsmEngineConfiguration(final ScoringTable scoringTable, final Set<String> reservedWords,
      final Set<String> excludedDeclarationKinds, final String anonymousEnumPrefix,
      final CandidateGate candidateGate, final String defaultClockSignal,
      final String defaultResetSignal) {
    this.scoringTable = scoringTable;
    this.reservedWords = Collections.unmodifiableSet(new LinkedHashSet<>(reservedWords));
    this.excludedDeclarationKinds =
        Collections.unmodifiableSet(new LinkedHashSet<>(excludedDeclarationKinds));
    this.anonymousEnumPrefix = anonymousEnumPrefix;
    this.candidateGate = candidateGate;
    this.defaultClockSignal = defaultClockSignal;
    this.defaultResetSignal = defaultResetSignal;
  }

}
