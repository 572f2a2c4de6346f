package com.repo.cognitive.tree;

import java.util.List;

/**
 * Ternary {@code test ? consequent : alternate}.
 */
public record ConditionalNode(SyntaxNode test, SyntaxNode consequent, SyntaxNode alternate) implements SyntaxNode {

    @Override
    public NodeKind kind() {
        return NodeKind.CONDITIONAL;
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of(test, consequent, alternate);
    }
}
