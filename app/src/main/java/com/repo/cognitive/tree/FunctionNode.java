package com.repo.cognitive.tree;

import java.util.List;

/**
 * Any function-like construct: method, constructor, lambda, function expression.
 *
 * @param name display name, e.g. the method name or {@code "lambda"}
 * @param body parameters and body, in source order
 */
public record FunctionNode(String name, List<SyntaxNode> body) implements SyntaxNode {

    public FunctionNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION;
    }

    @Override
    public List<SyntaxNode> children() {
        return body;
    }
}
