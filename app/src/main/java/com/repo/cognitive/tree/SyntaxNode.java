package com.repo.cognitive.tree;

import java.util.List;

/**
 * A node of a parsed source file, as seen by the complexity engine.
 * Front ends adapt their own parser output to this model.
 * Nodes are compared by identity: two equal-looking nodes at different
 * places in a file are different nodes.
 */
public interface SyntaxNode {

    NodeKind kind();

    /**
     * Structural children in source order.
     */
    List<SyntaxNode> children();
}
