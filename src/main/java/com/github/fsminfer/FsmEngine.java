package com.github.fsminfer;

import java.util.List;

/**
 * Infers finite state machines from parsed SystemVerilog syntax trees and turns (possibly edited)
 * FSM graphs back into source.
 * 
 * Notes for users:<br>
 * 1. an engine holds no state across passes besides its configuration, one instance can be shared
 * by any number of threads<br>
 * 
 * 2. every pass runs to completion over one tree snapshot; the tree is never mutated and the graphs
 * handed out are immutable, edit a {@code toBuilder()} copy and pass it to generateSource<br>
 * 
 * 3. "no FSM here" is an expected outcome and is reported as an empty list, never as an
 * exception. Constructs the engine does not recognize are skipped, so a partial graph is preferred
 * over a failed pass<br>
 * 
 * 4. extraction is a surface-syntax approximation: guards are taken from the nearest preceding if,
 * enum aliases are matched textually and the reset state is the first constant clocked
 * assignment of the state register<br>
 */
public interface FsmEngine {

  /**
   * Extract every FSM found in the tree, in scope and declaration order. A null tree yields an
   * empty list.
   */
  List<FsmGraph> extractFsmGraphs(final SyntaxNode tree);

  /**
   * Same as {@link #extractFsmGraphs(SyntaxNode)}, with the counters of the pass.
   */
  ExtractionReport extract(final SyntaxNode tree);

  /**
   * Index the enum types of the tree and the aliases they are reachable through.
   */
  EnumIndex indexEnums(final SyntaxNode tree);

  /**
   * Generate a module for the graph, clock and reset named per the configured defaults. A null
   * targetName derives the module name from the graph scope.
   */
  String generateSource(final FsmGraph graph, final String targetName) throws ValidationFailure;

  /**
   * Generate a module for the graph, clock and reset naming recovered from the source the graph was
   * extracted from.
   */
  String generateSource(final FsmGraph graph, final String targetName,
      final String originalSource) throws ValidationFailure;

  String generateSource(final FsmGraph graph, final String targetName, final SourceHints hints)
      throws ValidationFailure;

  /**
   * Reports the id of this engine instance, used to tag its log lines.
   */
  String getId();

  /**
   * Returns the config that this engine is wired with.
   */
  FsmEngineConfiguration getConfiguration();

  /**
   * A simple builder to let users use fluent APIs to build engines.
   */
  public final static class FsmEngineBuilder {
    private FsmEngineConfiguration config;

    public static FsmEngineBuilder newBuilder() {
      return new FsmEngineBuilder();
    }

    public FsmEngineBuilder config(final FsmEngineConfiguration config) {
      this.config = config;
      return this;
    }

    public FsmEngine build() throws FsmException {
      return new FsmEngineImpl(config == null ? FsmEngineConfiguration.defaults() : config);
    }

    private FsmEngineBuilder() {}
  }

}
