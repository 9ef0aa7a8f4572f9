package com.github.fsminfer;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * An always-construct of one scope, classified by its trigger.
 */
final class ProceduralBlock {
  private final int id;
  private final Trigger trigger;
  private final String text;

  static enum Trigger {
    // edge triggered: always_ff or @(posedge/negedge ...)
    CLOCKED,
    // always_comb, @* or @(*)
    COMBINATIONAL,
    // level sensitivity lists, always_latch, anything else
    OTHER;
  }

  private ProceduralBlock(final int id, final Trigger trigger, final String text) {
    this.id = id;
    this.trigger = trigger;
    this.text = text;
  }

  static ProceduralBlock of(final int id, final SyntaxNode node) {
    final List<String> tokens = SyntaxTrees.leafTexts(node);
    return new ProceduralBlock(id, classify(tokens), SyntaxTrees.join(tokens));
  }

  static boolean isProceduralKind(final String kind) {
    return kind.contains("Always") && !kind.endsWith("Keyword");
  }

  /**
   * Every always-construct inside the given scope nodes, in source order.
   */
  static List<ProceduralBlock> collect(final NodeArena arena, final List<Integer> scopeNodeIds) {
    final List<ProceduralBlock> blocks = new ArrayList<>();
    for (final int scopeId : scopeNodeIds) {
      for (final int id : arena.subtree(scopeId)) {
        if (isProceduralKind(arena.node(id).kind())) {
          blocks.add(of(id, arena.node(id)));
        }
      }
    }
    return blocks;
  }

  static List<ProceduralBlock> filter(final List<ProceduralBlock> blocks, final Trigger trigger) {
    final List<ProceduralBlock> filtered = new ArrayList<>();
    for (final ProceduralBlock block : blocks) {
      if (block.trigger == trigger) {
        filtered.add(block);
      }
    }
    return filtered;
  }

  static Trigger classify(final List<String> tokens) {
    if (tokens.isEmpty()) {
      return Trigger.OTHER;
    }
    final String keyword = tokens.get(0);
    if ("always_comb".equals(keyword)) {
      return Trigger.COMBINATIONAL;
    }
    if ("always_latch".equals(keyword)) {
      return Trigger.OTHER;
    }
    final int at = indexOfEventControl(tokens);
    if (at < 0) {
      return Trigger.OTHER;
    }
    if ("@*".equals(tokens.get(at))) {
      return Trigger.COMBINATIONAL;
    }
    // lexers disagree on "(*" and "(*)", split them back into single characters
    final List<String> control = new ArrayList<>();
    for (int iter = at + 1; iter < tokens.size(); iter++) {
      final String token = tokens.get(iter);
      if ("(*".equals(token) || "(*)".equals(token)) {
        for (final char ch : token.toCharArray()) {
          control.add(String.valueOf(ch));
        }
      } else {
        control.add(token);
      }
    }
    if (control.isEmpty()) {
      return Trigger.OTHER;
    }
    if ("*".equals(control.get(0))) {
      return Trigger.COMBINATIONAL;
    }
    if (!"(".equals(control.get(0))) {
      return Trigger.OTHER;
    }
    final List<String> sensitivity = new ArrayList<>();
    int depth = 0;
    for (final String token : control) {
      if ("(".equals(token)) {
        depth++;
      } else if (")".equals(token)) {
        depth--;
        if (depth == 0) {
          break;
        }
      }
      if (depth > 0 && !(depth == 1 && "(".equals(token))) {
        sensitivity.add(token);
      }
    }
    if (sensitivity.size() == 1 && "*".equals(sensitivity.get(0))) {
      return Trigger.COMBINATIONAL;
    }
    if (sensitivity.contains("posedge") || sensitivity.contains("negedge")) {
      return Trigger.CLOCKED;
    }
    return Trigger.OTHER;
  }

  private static int indexOfEventControl(final List<String> tokens) {
    for (int iter = 0; iter < tokens.size(); iter++) {
      if ("@".equals(tokens.get(iter)) || "@*".equals(tokens.get(iter))) {
        return iter;
      }
    }
    return -1;
  }

  /**
   * True iff the block contains "name = ..." or "name <= ...". Comparisons are not writes.
   */
  boolean writes(final String name) {
    return writePattern(name).matcher(text).find();
  }

  static Pattern writePattern(final String name) {
    return Pattern.compile("(?<![\\w$.])" + Pattern.quote(name) + "\\s*<?=(?!=)");
  }

  int getId() {
    return id;
  }

  Trigger getTrigger() {
    return trigger;
  }

  String getText() {
    return text;
  }

  @Override
  public String toString() {
    return "ProceduralBlock [id=" + id + ", trigger=" + trigger + "]";
  }
}
