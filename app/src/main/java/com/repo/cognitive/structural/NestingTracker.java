package com.repo.cognitive.structural;

import com.repo.cognitive.tree.SyntaxNode;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Current nesting depth of the walk: the number of open nesting-increasing
 * ancestors (branch bodies, loop bodies, case clauses, catch bodies, ternary
 * branches, deeply nested functions).
 */
final class NestingTracker {

    private int depth;

    void enter() {
        depth++;
    }

    void exit() {
        if (depth == 0) {
            throw new IllegalStateException("Nesting depth cannot go below zero");
        }
        depth--;
    }

    int depth() {
        return depth;
    }

    /**
     * Node set keyed by identity, for marking the children of one construct.
     */
    static Set<SyntaxNode> newNodeSet() {
        return Collections.newSetFromMap(new IdentityHashMap<>());
    }
}
