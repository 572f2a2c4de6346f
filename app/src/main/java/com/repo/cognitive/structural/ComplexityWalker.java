package com.repo.cognitive.structural;

import com.repo.cognitive.rules.ThresholdReporter;
import com.repo.cognitive.tree.CatchNode;
import com.repo.cognitive.tree.ConditionalNode;
import com.repo.cognitive.tree.FunctionNode;
import com.repo.cognitive.tree.IfNode;
import com.repo.cognitive.tree.JumpNode;
import com.repo.cognitive.tree.LocationResolver;
import com.repo.cognitive.tree.LogicalNode;
import com.repo.cognitive.tree.LoopNode;
import com.repo.cognitive.tree.NodeKind;
import com.repo.cognitive.tree.SourcePosition;
import com.repo.cognitive.tree.SwitchNode;
import com.repo.cognitive.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Single depth-first pass over one file's tree.
 *
 * <p>Each scoring construct is handled once, when the walk enters it. The
 * handler records its points and returns the children that open a new
 * nesting level; the walk raises the nesting depth while it is inside one
 * of them. Not reusable: create one walker per file.</p>
 */
final class ComplexityWalker {

    private final LocationResolver resolver;
    private final NestingTracker nesting = new NestingTracker();
    private final FunctionScopeAccumulator scopes;
    private final Set<SyntaxNode> consideredLogicalExpressions = NestingTracker.newNodeSet();

    ComplexityWalker(ThresholdReporter reporter, LocationResolver resolver) {
        this.resolver = resolver;
        this.scopes = new FunctionScopeAccumulator(reporter, this::functionLocation);
    }

    FunctionScopeAccumulator walk(SyntaxNode root) {
        visit(root, null, false);
        return scopes;
    }

    private void visit(SyntaxNode node, SyntaxNode parent, boolean increasesNesting) {
        FunctionNode function = node instanceof FunctionNode fn ? fn : null;
        boolean nests = increasesNesting;
        if (function != null && scopes.enterFunction(function)) {
            nests = true;
        }
        if (nests) {
            nesting.enter();
        }

        Set<SyntaxNode> nestingChildren = handle(node, parent);
        for (SyntaxNode child : node.children()) {
            visit(child, node, nestingChildren.contains(child));
        }

        if (nests) {
            nesting.exit();
        }
        if (function != null) {
            scopes.exitFunction(function);
        }
    }

    private Set<SyntaxNode> handle(SyntaxNode node, SyntaxNode parent) {
        return switch (node.kind()) {
            case IF -> visitIf((IfNode) node, parent);
            case LOOP -> visitLoop((LoopNode) node);
            case SWITCH -> visitSwitch((SwitchNode) node);
            case JUMP -> visitJump((JumpNode) node);
            case CATCH -> visitCatch((CatchNode) node);
            case CONDITIONAL -> visitConditional((ConditionalNode) node);
            case LOGICAL -> visitLogical((LogicalNode) node);
            default -> Set.of();
        };
    }

    private Set<SyntaxNode> visitIf(IfNode ifNode, SyntaxNode parent) {
        SourcePosition ifToken = require(resolver.firstToken(ifNode), "if", ifNode);
        // else-if: the chain already pays for nesting
        if (parent instanceof IfNode parentIf && parentIf.alternate() == ifNode) {
            scopes.addFlat(ifToken);
        } else {
            scopes.addStructural(nesting.depth(), ifToken);
        }

        Set<SyntaxNode> nested = NestingTracker.newNodeSet();
        nested.add(ifNode.consequent());

        SyntaxNode alternate = ifNode.alternate();
        if (alternate != null && alternate.kind() != NodeKind.IF) {
            nested.add(alternate);
            scopes.addFlat(require(resolver.tokenAfter(ifNode.consequent()), "else", ifNode));
        }
        return nested;
    }

    private Set<SyntaxNode> visitLoop(LoopNode loop) {
        scopes.addStructural(nesting.depth(), require(resolver.firstToken(loop), "loop", loop));
        return nestingSetOf(loop.body());
    }

    private Set<SyntaxNode> visitSwitch(SwitchNode switchNode) {
        scopes.addStructural(nesting.depth(), require(resolver.firstToken(switchNode), "switch", switchNode));
        Set<SyntaxNode> nested = NestingTracker.newNodeSet();
        nested.addAll(switchNode.cases());
        return nested;
    }

    private Set<SyntaxNode> visitJump(JumpNode jump) {
        if (jump.targetLabel().isPresent()) {
            scopes.addFlat(require(resolver.firstToken(jump), jump.jumpKind().name().toLowerCase(), jump));
        }
        return Set.of();
    }

    private Set<SyntaxNode> visitCatch(CatchNode catchNode) {
        scopes.addStructural(nesting.depth(), require(resolver.firstToken(catchNode), "catch", catchNode));
        return nestingSetOf(catchNode.body());
    }

    private Set<SyntaxNode> visitConditional(ConditionalNode conditional) {
        SourcePosition questionToken = require(resolver.tokenAfter(conditional.test()), "?", conditional);
        scopes.addStructural(nesting.depth(), questionToken);
        return nestingSetOf(conditional.consequent(), conditional.alternate());
    }

    private Set<SyntaxNode> visitLogical(LogicalNode logical) {
        if (consideredLogicalExpressions.contains(logical)) {
            return Set.of();
        }
        LogicalNode previous = null;
        for (LogicalNode current : flatten(logical, new ArrayList<>())) {
            if (previous == null || previous.operator() != current.operator()) {
                SourcePosition operatorToken =
                        require(resolver.tokenAfter(current.left()), current.operator().symbol(), current);
                scopes.addFlat(operatorToken);
            }
            previous = current;
        }
        return Set.of();
    }

    /**
     * In-order list of the logical operations forming one chain, e.g.
     * {@code a && b && c || d} gives {@code [&&, &&, ||]}.
     */
    private List<LogicalNode> flatten(SyntaxNode node, List<LogicalNode> chain) {
        if (node instanceof LogicalNode logical) {
            consideredLogicalExpressions.add(logical);
            flatten(logical.left(), chain);
            chain.add(logical);
            flatten(logical.right(), chain);
        }
        return chain;
    }

    private SourcePosition functionLocation(FunctionNode function) {
        return require(resolver.functionToken(function), function.name(), function);
    }

    private static Set<SyntaxNode> nestingSetOf(SyntaxNode... nodes) {
        Set<SyntaxNode> nested = NestingTracker.newNodeSet();
        for (SyntaxNode node : nodes) {
            nested.add(node);
        }
        return nested;
    }

    private static SourcePosition require(Optional<SourcePosition> position, String token, SyntaxNode node) {
        return position.orElseThrow(() -> new IllegalStateException(
                "No source position for '" + token + "' of " + node.kind() + " node"));
    }
}
