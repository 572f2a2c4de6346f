package com.repo.cognitive.tree;

import java.util.List;

/**
 * Any construct the engine does not score directly (blocks, calls, declarations...).
 *
 * @param type parser-specific type name, kept for debugging
 */
public record OtherNode(String type, List<SyntaxNode> children) implements SyntaxNode {

    public OtherNode {
        children = List.copyOf(children);
    }

    public static OtherNode leaf(String type) {
        return new OtherNode(type, List.of());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OTHER;
    }
}
