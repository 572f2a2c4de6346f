package com.repo.cognitive.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * One {@code case}/{@code default} clause. An empty label list means {@code default}.
 */
public record SwitchCaseNode(List<SyntaxNode> labels, List<SyntaxNode> consequent) implements SyntaxNode {

    public SwitchCaseNode {
        labels = List.copyOf(labels);
        consequent = List.copyOf(consequent);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SWITCH_CASE;
    }

    @Override
    public List<SyntaxNode> children() {
        List<SyntaxNode> children = new ArrayList<>(labels.size() + consequent.size());
        children.addAll(labels);
        children.addAll(consequent);
        return children;
    }
}
