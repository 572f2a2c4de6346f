package com.repo.cognitive.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code catch (param) body}; the parameter may be null for languages that allow omitting it.
 */
public record CatchNode(SyntaxNode param, SyntaxNode body) implements SyntaxNode {

    @Override
    public NodeKind kind() {
        return NodeKind.CATCH;
    }

    @Override
    public List<SyntaxNode> children() {
        List<SyntaxNode> children = new ArrayList<>(2);
        if (param != null) {
            children.add(param);
        }
        children.add(body);
        return children;
    }
}
