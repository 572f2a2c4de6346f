package com.repo.cognitive.tree;

import java.util.List;

/**
 * Root of one source file.
 */
public record FileNode(String path, List<SyntaxNode> body) implements SyntaxNode {

    public FileNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FILE;
    }

    @Override
    public List<SyntaxNode> children() {
        return body;
    }
}
