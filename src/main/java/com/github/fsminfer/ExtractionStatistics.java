package com.github.fsminfer;

/**
 * Counters gathered during one extraction pass. Fields are bumped by the pipeline stages of the
 * pass that owns this instance and are read-only to callers.
 */
public final class ExtractionStatistics {
  private final String passId;
  private final long startTstampMillis = System.currentTimeMillis();
  private long elapsedMillis;

  int nodesVisited;
  int scopesIndexed;
  int enumsIndexed;
  int anonymousEnums;
  int enumVariables;
  int groupsConsidered;
  int groupsSkipped;
  int graphsBuilt;
  int duplicateEdges;

  ExtractionStatistics(final String passId) {
    this.passId = passId;
  }

  void finish() {
    elapsedMillis = System.currentTimeMillis() - startTstampMillis;
  }

  public String getPassId() {
    return passId;
  }

  public long getStartTimeMillis() {
    return startTstampMillis;
  }

  public long getElapsedMillis() {
    return elapsedMillis;
  }

  public int getNodesVisited() {
    return nodesVisited;
  }

  public int getScopesIndexed() {
    return scopesIndexed;
  }

  public int getEnumsIndexed() {
    return enumsIndexed;
  }

  public int getAnonymousEnums() {
    return anonymousEnums;
  }

  public int getEnumVariables() {
    return enumVariables;
  }

  /**
   * Number of (scope, enum) variable groups examined.
   */
  public int getGroupsConsidered() {
    return groupsConsidered;
  }

  /**
   * Groups that produced no graph: rejected by the candidate gate or without a state register.
   */
  public int getGroupsSkipped() {
    return groupsSkipped;
  }

  public int getGraphsBuilt() {
    return graphsBuilt;
  }

  public int getDuplicateEdges() {
    return duplicateEdges;
  }

  @Override
  public String toString() {
    return "ExtractionStatistics [passId=" + passId + ", elapsedMillis=" + elapsedMillis
        + ", nodesVisited=" + nodesVisited + ", scopesIndexed=" + scopesIndexed
        + ", enumsIndexed=" + enumsIndexed + ", anonymousEnums=" + anonymousEnums
        + ", enumVariables=" + enumVariables + ", groupsConsidered=" + groupsConsidered
        + ", groupsSkipped=" + groupsSkipped + ", graphsBuilt=" + graphsBuilt
        + ", duplicateEdges=" + duplicateEdges + "]";
  }

}
