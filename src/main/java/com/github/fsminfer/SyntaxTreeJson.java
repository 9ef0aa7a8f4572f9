package com.github.fsminfer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * Syntax trees dumped as json by an external parser:
 * {@code {"kind": "Identifier", "text": "state", "children": []}}. A node without children becomes
 * a token when it has text; inner nodes drop their text. Both directions walk with an explicit
 * stack so deeply nested generated code does not exhaust the call stack.
 */
public final class SyntaxTreeJson {
  private static final Gson gson = new GsonBuilder().disableHtmlEscaping().create();

  private SyntaxTreeJson() {}

  public static SyntaxNode fromJson(final String json) throws FsmException {
    if (json == null || json.trim().isEmpty()) {
      throw malformed("Tree record is empty");
    }
    final JsonElement root;
    try {
      root = JsonParser.parseString(json);
    } catch (JsonParseException problem) {
      throw new FsmException(FsmException.Code.MALFORMED_TREE_RECORD,
          "Tree record is not valid json: " + problem.getMessage(), problem);
    }
    return fromRecord(root);
  }

  /**
   * Rebuilds the tree bottom-up: a record is built once all of its children are.
   */
  public static SyntaxNode fromRecord(final JsonElement root) throws FsmException {
    final Map<JsonObject, SyntaxNode> built = new IdentityHashMap<>();
    final Deque<JsonObject> stack = new ArrayDeque<>();
    stack.push(checkRecord(root));
    while (!stack.isEmpty()) {
      final JsonObject record = stack.peek();
      final List<JsonObject> children = childRecords(record);
      boolean ready = true;
      for (int iter = children.size() - 1; iter >= 0; iter--) {
        if (!built.containsKey(children.get(iter))) {
          stack.push(children.get(iter));
          ready = false;
        }
      }
      if (!ready) {
        continue;
      }
      stack.pop();
      final String kind = kindOf(record);
      if (children.isEmpty()) {
        final String text = textOf(record);
        built.put(record, text == null ? TreeNode.node(kind, new ArrayList<SyntaxNode>())
            : TreeNode.token(kind, text));
      } else {
        final List<SyntaxNode> nodes = new ArrayList<>(children.size());
        for (final JsonObject child : children) {
          nodes.add(built.remove(child));
        }
        built.put(record, TreeNode.node(kind, nodes));
      }
    }
    return built.get(root.getAsJsonObject());
  }

  public static String toJson(final SyntaxNode root) {
    return gson.toJson(toRecord(root));
  }

  public static JsonObject toRecord(final SyntaxNode root) {
    final Map<SyntaxNode, JsonObject> records = new IdentityHashMap<>();
    for (final SyntaxNode node : SyntaxTrees.preOrder(root)) {
      final JsonObject record = new JsonObject();
      record.addProperty("kind", node.kind());
      if (node.text().isPresent()) {
        record.addProperty("text", node.text().get());
      }
      record.add("children", new JsonArray());
      records.put(node, record);
    }
    for (final SyntaxNode node : SyntaxTrees.preOrder(root)) {
      final JsonArray children = records.get(node).getAsJsonArray("children");
      for (final SyntaxNode child : node.children()) {
        children.add(records.get(child));
      }
    }
    return records.get(root);
  }

  private static List<JsonObject> childRecords(final JsonObject record) throws FsmException {
    final JsonElement children = record.get("children");
    final List<JsonObject> records = new ArrayList<>();
    if (children == null || children.isJsonNull()) {
      return records;
    }
    if (!children.isJsonArray()) {
      throw malformed("children of a " + kindOf(record) + " record must be a json array");
    }
    for (final JsonElement child : children.getAsJsonArray()) {
      records.add(checkRecord(child));
    }
    return records;
  }

  private static JsonObject checkRecord(final JsonElement element) throws FsmException {
    if (element == null || !element.isJsonObject()) {
      throw malformed("Tree node record must be a json object");
    }
    kindOf(element.getAsJsonObject());
    return element.getAsJsonObject();
  }

  private static String kindOf(final JsonObject record) throws FsmException {
    final JsonElement kind = record.get("kind");
    if (kind == null || !kind.isJsonPrimitive() || kind.getAsString().isEmpty()) {
      throw malformed("Tree node record misses its kind");
    }
    return kind.getAsString();
  }

  private static String textOf(final JsonObject record) throws FsmException {
    final JsonElement text = record.get("text");
    if (text == null || text.isJsonNull()) {
      return null;
    }
    if (!text.isJsonPrimitive()) {
      throw malformed("text of a " + kindOf(record) + " record must be a string");
    }
    return text.getAsString();
  }

  private static FsmException malformed(final String message) {
    return new FsmException(FsmException.Code.MALFORMED_TREE_RECORD, message);
  }
}
