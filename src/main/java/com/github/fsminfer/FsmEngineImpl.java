package com.github.fsminfer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.github.fsminfer.FsmGraph.FsmGraphBuilder;
import com.github.fsminfer.ProceduralBlock.Trigger;
import com.github.fsminfer.ScopeIndexer.ScopeIndex;
import com.github.fsminfer.StateVariableClassifier.Classification;

/**
 * Default engine. One extraction pass:<br>
 * 1. number every node of the snapshot (arena) and index the scopes<br>
 * 2. index the enum types and collect the variables declared with them<br>
 * 3. group the variables by (scope, enum) in first-seen order<br>
 * 4. per group: drop what the candidate gate rejects, classify the state register and next-state
 * variable, rebuild the edges from the case constructs switching on the register and detect the
 * reset state<br>
 * 
 * All per-pass state (arena, enum namer, statistics) lives on the stack of the pass, the instance
 * only keeps its configuration and a pass counter.
 */
final class FsmEngineImpl implements FsmEngine {
  private static final Logger logger = LogManager.getLogger(FsmEngineImpl.class.getSimpleName());

  private final String engineId = UUID.randomUUID().toString();
  private final AtomicLong passCounter = new AtomicLong();

  private final FsmEngineConfiguration config;
  private final EnumResolver enumResolver;
  private final StateVariableClassifier classifier;

  FsmEngineImpl(final FsmEngineConfiguration config) throws FsmException {
    if (config == null) {
      throw new FsmException(FsmException.Code.INVALID_ENGINE_CONFIG,
          "Engine configuration is required");
    }
    this.config = config;
    this.enumResolver = new EnumResolver(config);
    this.classifier = new StateVariableClassifier(config.getScoringTable());
    logger.info("Fired up fsm engine " + engineId + " with " + config);
  }

  @Override
  public List<FsmGraph> extractFsmGraphs(final SyntaxNode tree) {
    return extract(tree).getGraphs();
  }

  @Override
  public ExtractionReport extract(final SyntaxNode tree) {
    final String passId = engineId + ":" + passCounter.incrementAndGet();
    final ExtractionStatistics statistics = new ExtractionStatistics(passId);
    if (tree == null) {
      logDebug(passId, "Nothing to extract from a null tree");
      statistics.finish();
      return new ExtractionReport(Collections.<FsmGraph>emptyList(), statistics);
    }

    final NodeArena arena = NodeArena.of(tree);
    statistics.nodesVisited = arena.size();
    final ScopeIndex scopes = ScopeIndexer.index(arena);
    statistics.scopesIndexed = scopes.scopeCount();

    final AnonymousEnumNamer namer = new AnonymousEnumNamer(config.getAnonymousEnumPrefix());
    final EnumIndex enums = enumResolver.index(arena, scopes, namer);
    statistics.enumsIndexed = enums.size();
    statistics.anonymousEnums = namer.issued();
    logDebug(passId, "Indexed " + enums.size() + " enum types across " + scopes.scopeCount()
        + " scopes");

    final List<StateVariable> variables = enumResolver.collectVariables(arena, scopes, enums);
    statistics.enumVariables = variables.size();

    final List<FsmGraph> graphs = new ArrayList<>();
    for (final List<StateVariable> group : groupByScopeAndEnum(variables).values()) {
      statistics.groupsConsidered++;
      final Optional<FsmGraph> graph = buildGraph(passId, arena, scopes, group, statistics);
      if (graph.isPresent()) {
        graphs.add(graph.get());
        statistics.graphsBuilt++;
      } else {
        statistics.groupsSkipped++;
      }
    }
    statistics.finish();
    logInfo(passId, "Extracted " + graphs.size() + " fsm graphs from " + arena.size()
        + " nodes in " + statistics.getElapsedMillis() + " millis");
    logDebug(passId, statistics.toString());
    return new ExtractionReport(graphs, statistics);
  }

  @Override
  public EnumIndex indexEnums(final SyntaxNode tree) {
    if (tree == null) {
      return new EnumIndex();
    }
    final NodeArena arena = NodeArena.of(tree);
    final ScopeIndex scopes = ScopeIndexer.index(arena);
    final EnumIndex enums =
        enumResolver.index(arena, scopes, new AnonymousEnumNamer(config.getAnonymousEnumPrefix()));
    // typedefs of enum type names register further aliases
    enumResolver.collectVariables(arena, scopes, enums);
    return enums;
  }

  @Override
  public String generateSource(final FsmGraph graph, final String targetName)
      throws ValidationFailure {
    return generateSource(graph, targetName, defaultHints());
  }

  @Override
  public String generateSource(final FsmGraph graph, final String targetName,
      final String originalSource) throws ValidationFailure {
    return generateSource(graph, targetName,
        SourceHints.fromSource(originalSource, defaultHints()));
  }

  @Override
  public String generateSource(final FsmGraph graph, final String targetName,
      final SourceHints hints) throws ValidationFailure {
    try {
      return FsmCodeGenerator.generate(graph, targetName, hints == null ? defaultHints() : hints);
    } catch (ValidationFailure failure) {
      if (logger.isDebugEnabled()) {
        logger.debug("[e:" + engineId + "] Refused to generate source: " + failure.getMessage());
      }
      throw failure;
    }
  }

  @Override
  public String getId() {
    return engineId;
  }

  @Override
  public FsmEngineConfiguration getConfiguration() {
    return config;
  }

  private Optional<FsmGraph> buildGraph(final String passId, final NodeArena arena,
      final ScopeIndex scopes, final List<StateVariable> group,
      final ExtractionStatistics statistics) {
    final String scope = group.get(0).getScope();
    final EnumType enumType = group.get(0).getEnumType();
    final List<Integer> scopeNodeIds =
        scope.isEmpty() ? Collections.singletonList(0) : scopes.scopeNodeIds(scope);
    final List<ProceduralBlock> blocks = ProceduralBlock.collect(arena, scopeNodeIds);

    List<StateVariable> candidates = group;
    if (config.getCandidateGate() == CandidateGate.FSM_CANDIDATE) {
      candidates = CandidateFilter.candidates(arena, scopeNodeIds, group, blocks);
      if (candidates.isEmpty()) {
        logDebug(passId, "Nothing among " + group + " in '" + scope + "' looks like fsm state");
        return Optional.empty();
      }
    }

    final Optional<Classification> classification = classifier.classify(candidates, blocks);
    if (!classification.isPresent()) {
      logDebug(passId, "No state register among " + group + " in '" + scope + "'");
      return Optional.empty();
    }
    final String primary = classification.get().getPrimary().getName();
    final Optional<String> next = classification.get().getNext().isPresent()
        ? Optional.of(classification.get().getNext().get().getName()) : Optional.<String>empty();
    logDebug(passId, "Classified '" + scope + "' enum " + enumType.getName() + ": "
        + classification.get());

    final List<SyntaxNode> cases = TransitionGraphBuilder.casesOn(arena, scopeNodeIds, primary);
    if (cases.isEmpty() && config.getCandidateGate() == CandidateGate.CASE_ON_REGISTER) {
      logDebug(passId, "No case construct switches on " + primary + " in '" + scope
          + "', not an fsm");
      return Optional.empty();
    }
    final List<String> members = enumType.getMembers();
    final List<TransitionEdge> edges =
        TransitionGraphBuilder.build(cases, primary, next, members, statistics);
    final Optional<String> reset =
        ResetDetector.detect(ProceduralBlock.filter(blocks, Trigger.CLOCKED), primary, members);

    final FsmGraph graph = FsmGraphBuilder.newBuilder().scope(scope).stateVar(primary)
        .nextStateVar(next.orElse(null)).enumName(enumType.getName()).states(members)
        .resetState(reset.orElse(null)).transitions(edges).build();
    logDebug(passId, "Built " + graph);
    return Optional.of(graph);
  }

  private static Map<String, List<StateVariable>> groupByScopeAndEnum(
      final List<StateVariable> variables) {
    final Map<String, List<StateVariable>> groups = new LinkedHashMap<>();
    for (final StateVariable variable : variables) {
      final String key = variable.getScope() + "\u0000" + variable.getEnumType().getId();
      List<StateVariable> group = groups.get(key);
      if (group == null) {
        group = new ArrayList<>();
        groups.put(key, group);
      }
      group.add(variable);
    }
    return groups;
  }

  private SourceHints defaultHints() {
    return SourceHints.of(config.getDefaultClockSignal(), config.getDefaultResetSignal(), false);
  }

  private static void logInfo(final String passId, final String message) {
    logger.info(new StringBuilder().append("[p:").append(passId).append("] ").append(message)
        .toString());
  }

  private static void logDebug(final String passId, final String message) {
    if (logger.isDebugEnabled()) {
      logger.debug(new StringBuilder().append("[p:").append(passId).append("] ").append(message)
          .toString());
    }
  }

}
