package com.repo.cognitive.tree;

import java.util.Optional;

/**
 * Maps tree nodes back to positions in the source text.
 * Supplied by the front end that produced the tree.
 */
public interface LocationResolver {

    /**
     * Position of the first token of the node, e.g. the {@code if} keyword.
     */
    Optional<SourcePosition> firstToken(SyntaxNode node);

    /**
     * Position of the first code token following the node, skipping closing
     * parentheses. Used to locate {@code else}, {@code ?} and boolean operators.
     */
    Optional<SourcePosition> tokenAfter(SyntaxNode node);

    /**
     * Position a finding for the function is reported on, e.g. its name.
     */
    Optional<SourcePosition> functionToken(FunctionNode function);
}
