package com.repo.cognitive.tree;

import java.util.List;

/**
 * Short-circuit boolean operation {@code left && right} or {@code left || right}.
 */
public record LogicalNode(Operator operator, SyntaxNode left, SyntaxNode right) implements SyntaxNode {

    public enum Operator {
        AND("&&"),
        OR("||");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LOGICAL;
    }

    @Override
    public List<SyntaxNode> children() {
        return List.of(left, right);
    }
}
