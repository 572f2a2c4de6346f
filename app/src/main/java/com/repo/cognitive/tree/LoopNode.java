package com.repo.cognitive.tree;

import java.util.ArrayList;
import java.util.List;

/**
 * Loop statement. The header holds init/test/update or the iterated
 * variable and expression; for {@code do-while} it is visited after the body.
 */
public record LoopNode(LoopKind loopKind, List<SyntaxNode> header, SyntaxNode body) implements SyntaxNode {

    public enum LoopKind {
        FOR,
        FOR_IN,
        FOR_OF,
        WHILE,
        DO_WHILE
    }

    public LoopNode {
        header = List.copyOf(header);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LOOP;
    }

    @Override
    public List<SyntaxNode> children() {
        List<SyntaxNode> children = new ArrayList<>(header.size() + 1);
        if (loopKind == LoopKind.DO_WHILE) {
            children.add(body);
            children.addAll(header);
        } else {
            children.addAll(header);
            children.add(body);
        }
        return children;
    }
}
