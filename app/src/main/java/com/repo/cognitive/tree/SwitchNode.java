package com.repo.cognitive.tree;

import java.util.ArrayList;
import java.util.List;

public record SwitchNode(SyntaxNode discriminant, List<SwitchCaseNode> cases) implements SyntaxNode {

    public SwitchNode {
        cases = List.copyOf(cases);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SWITCH;
    }

    @Override
    public List<SyntaxNode> children() {
        List<SyntaxNode> children = new ArrayList<>(cases.size() + 1);
        children.add(discriminant);
        children.addAll(cases);
        return children;
    }
}
