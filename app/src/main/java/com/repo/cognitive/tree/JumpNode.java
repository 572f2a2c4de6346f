package com.repo.cognitive.tree;

import java.util.List;
import java.util.Optional;

/**
 * {@code break} or {@code continue}, with an optional target label.
 */
public record JumpNode(JumpKind jumpKind, String label) implements SyntaxNode {

    public enum JumpKind {
        BREAK,
        CONTINUE
    }

    public Optional<String> targetLabel() {
        return Optional.ofNullable(label);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.JUMP;
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of();
    }
}
