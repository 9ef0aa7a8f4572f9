package com.github.fsminfer;

import java.util.ArrayList;
import java.util.List;

import com.github.fsminfer.FsmGraph.FsmGraphBuilder;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Plain-record form of {@link FsmGraph}, the form callers persist, edit and resubmit:
 * 
 * <pre>
 * {"scope": "module top", "state_var": "state", "next_state_var": "next_state",
 *  "enum_name": "state_t", "states": ["IDLE", "BUSY"], "reset_state": "IDLE",
 *  "transitions": [{"from": "IDLE", "to": "BUSY", "cond": "go"}],
 *  "metadata": {"num_states": 2, "num_transitions": 1}}
 * </pre>
 * 
 * Absent optionals are written as null. On read, metadata is ignored since it is derived, a missing
 * cond means unconditional and a missing transitions array means no edges.
 */
public final class FsmGraphJson {
  private static final Gson gson =
      new GsonBuilder().disableHtmlEscaping().serializeNulls().create();
  private static final Gson prettyGson =
      new GsonBuilder().disableHtmlEscaping().serializeNulls().setPrettyPrinting().create();

  private FsmGraphJson() {}

  public static String toJson(final FsmGraph graph) {
    return gson.toJson(toRecord(graph));
  }

  public static String toPrettyJson(final FsmGraph graph) {
    return prettyGson.toJson(toRecord(graph));
  }

  public static String toJson(final List<FsmGraph> graphs) {
    final JsonArray records = new JsonArray();
    for (final FsmGraph graph : graphs) {
      records.add(toRecord(graph));
    }
    return gson.toJson(records);
  }

  public static JsonObject toRecord(final FsmGraph graph) {
    final JsonObject record = new JsonObject();
    record.addProperty("scope", graph.getScope());
    record.addProperty("state_var", graph.getStateVar());
    record.addProperty("next_state_var", graph.getNextStateVar().orElse(null));
    record.addProperty("enum_name", graph.getEnumName());
    final JsonArray states = new JsonArray();
    for (final String state : graph.getStates()) {
      states.add(state);
    }
    record.add("states", states);
    record.addProperty("reset_state", graph.getResetState().orElse(null));
    final JsonArray transitions = new JsonArray();
    for (final TransitionEdge edge : graph.getTransitions()) {
      final JsonObject transition = new JsonObject();
      transition.addProperty("from", edge.getFrom());
      transition.addProperty("to", edge.getTo());
      transition.addProperty("cond", edge.getGuard());
      transitions.add(transition);
    }
    record.add("transitions", transitions);
    final JsonObject metadata = new JsonObject();
    metadata.addProperty("num_states", graph.getNumStates());
    metadata.addProperty("num_transitions", graph.getNumTransitions());
    record.add("metadata", metadata);
    return record;
  }

  public static FsmGraph fromJson(final String json) throws FsmException {
    final JsonElement element = parse(json);
    if (!element.isJsonObject()) {
      throw malformed("Graph record must be a json object");
    }
    return fromRecord(element.getAsJsonObject());
  }

  public static List<FsmGraph> listFromJson(final String json) throws FsmException {
    final JsonElement element = parse(json);
    if (!element.isJsonArray()) {
      throw malformed("Graph list must be a json array");
    }
    final List<FsmGraph> graphs = new ArrayList<>();
    int index = 0;
    for (final JsonElement record : element.getAsJsonArray()) {
      if (!record.isJsonObject()) {
        throw malformed("Graph record at index " + index + " must be a json object");
      }
      graphs.add(fromRecord(record.getAsJsonObject()));
      index++;
    }
    return graphs;
  }

  public static FsmGraph fromRecord(final JsonObject record) throws FsmException {
    final FsmGraphBuilder builder = FsmGraphBuilder.newBuilder()
        .scope(optionalString(record, "scope")).stateVar(requiredString(record, "state_var"))
        .nextStateVar(optionalString(record, "next_state_var"))
        .enumName(requiredString(record, "enum_name"))
        .resetState(optionalString(record, "reset_state"));
    final JsonElement states = record.get("states");
    if (states == null || !states.isJsonArray()) {
      throw malformed("Graph record misses the states array");
    }
    for (final JsonElement state : states.getAsJsonArray()) {
      builder.state(asString(state, "states"));
    }
    final JsonElement transitions = record.get("transitions");
    if (transitions != null && !transitions.isJsonNull()) {
      if (!transitions.isJsonArray()) {
        throw malformed("transitions must be a json array");
      }
      int index = 0;
      for (final JsonElement transition : transitions.getAsJsonArray()) {
        final String field = "transitions[" + index + "]";
        if (!transition.isJsonObject()) {
          throw malformed(field + " must be a json object");
        }
        final JsonObject edge = transition.getAsJsonObject();
        builder.transition(requiredString(edge, "from", field + ".from"),
            requiredString(edge, "to", field + ".to"), optionalString(edge, "cond"));
        index++;
      }
    }
    return builder.build();
  }

  private static JsonElement parse(final String json) throws FsmException {
    if (json == null || json.trim().isEmpty()) {
      throw malformed("Graph record is empty");
    }
    try {
      return JsonParser.parseString(json);
    } catch (JsonParseException problem) {
      throw new FsmException(FsmException.Code.MALFORMED_GRAPH_RECORD,
          "Graph record is not valid json: " + problem.getMessage(), problem);
    }
  }

  private static String requiredString(final JsonObject record, final String name)
      throws FsmException {
    return requiredString(record, name, name);
  }

  private static String requiredString(final JsonObject record, final String name,
      final String field) throws FsmException {
    final JsonElement value = record.get(name);
    if (value == null || value.isJsonNull()) {
      throw malformed("Graph record misses required field " + field);
    }
    return asString(value, field);
  }

  private static String optionalString(final JsonObject record, final String name)
      throws FsmException {
    final JsonElement value = record.get(name);
    if (value == null || value.isJsonNull()) {
      return null;
    }
    return asString(value, name);
  }

  private static String asString(final JsonElement value, final String field)
      throws FsmException {
    if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isString()) {
      throw malformed(field + " must be a string");
    }
    return value.getAsString();
  }

  private static FsmException malformed(final String message) {
    return new FsmException(FsmException.Code.MALFORMED_GRAPH_RECORD, message);
  }
}
