package com.github.fsminfer;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of one node of a parsed hardware-description syntax tree. Parser front ends adapt
 * their own tree types to this interface; the engine never mutates a node.
 * 
 * Notes for implementors:<br>
 * 1. leaves (tokens) have no children and carry their source text<br>
 * 2. inner nodes may or may not carry text, the engine only reads leaf text<br>
 * 3. children must be returned in source order<br>
 */
public interface SyntaxNode {

  /**
   * Node kind in slang naming, eg. ModuleDeclaration, EnumType, Identifier.
   */
  String kind();

  /**
   * Ordered children, never null.
   */
  List<SyntaxNode> children();

  /**
   * Source text of a token, empty for nodes that carry none.
   */
  Optional<String> text();

}
