package com.repo.cognitive.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code if (test) consequent else alternate}. The alternate is null when
 * there is no else branch, and is itself an {@code IfNode} for {@code else if}.
 */
public record IfNode(SyntaxNode test, SyntaxNode consequent, SyntaxNode alternate) implements SyntaxNode {

    @Override
    public NodeKind kind() {
        return NodeKind.IF;
    }

    @Override
    public List<SyntaxNode> children() {
        List<SyntaxNode> children = new ArrayList<>(3);
        children.add(test);
        children.add(consequent);
        if (alternate != null) {
            children.add(alternate);
        }
        return children;
    }
}
