package com.repo.cognitive.analyzers;

import com.github.javaparser.JavaToken;
import com.github.javaparser.Range;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithSimpleName;
import com.repo.cognitive.tree.FunctionNode;
import com.repo.cognitive.tree.LocationResolver;
import com.repo.cognitive.tree.SourcePosition;
import com.repo.cognitive.tree.SyntaxNode;

import java.util.Map;
import java.util.Optional;

/**
 * Resolves positions through the JavaParser token list of the source file.
 */
class JavaTokenLocationResolver implements LocationResolver {

    private static final String LAMBDA_ARROW = "->";
    private static final String CLOSING_PARENTHESIS = ")";

    private final Map<SyntaxNode, Node> origins;

    JavaTokenLocationResolver(Map<SyntaxNode, Node> origins) {
        this.origins = origins;
    }

    @Override
    public Optional<SourcePosition> firstToken(SyntaxNode node) {
        return tokenRange(node)
                .map(TokenRange::getBegin)
                .flatMap(JavaTokenLocationResolver::position);
    }

    @Override
    public Optional<SourcePosition> tokenAfter(SyntaxNode node) {
        Optional<JavaToken> next = tokenRange(node)
                .map(TokenRange::getEnd)
                .flatMap(JavaToken::getNextToken);
        while (next.isPresent() && isSkipped(next.get())) {
            next = next.get().getNextToken();
        }
        return next.flatMap(JavaTokenLocationResolver::position);
    }

    @Override
    public Optional<SourcePosition> functionToken(FunctionNode function) {
        Node origin = origins.get(function);
        if (origin instanceof LambdaExpr lambda) {
            return lambda.getTokenRange().flatMap(JavaTokenLocationResolver::findArrow);
        }
        if (origin instanceof NodeWithSimpleName<?> named) {
            return named.getName().getTokenRange()
                    .map(TokenRange::getBegin)
                    .flatMap(JavaTokenLocationResolver::position);
        }
        return firstToken(function);
    }

    private Optional<TokenRange> tokenRange(SyntaxNode node) {
        return Optional.ofNullable(origins.get(node)).flatMap(Node::getTokenRange);
    }

    private static Optional<SourcePosition> findArrow(TokenRange range) {
        for (JavaToken token : range) {
            if (LAMBDA_ARROW.equals(token.getText())) {
                return position(token);
            }
        }
        return Optional.empty();
    }

    private static boolean isSkipped(JavaToken token) {
        return token.getCategory().isWhitespaceOrComment() || CLOSING_PARENTHESIS.equals(token.getText());
    }

    private static Optional<SourcePosition> position(JavaToken token) {
        return token.getRange().map(JavaTokenLocationResolver::position);
    }

    private static SourcePosition position(Range range) {
        return new SourcePosition(range.begin.line, range.begin.column, range.end.line, range.end.column);
    }
}
