package com.repo.cognitive.analyzers;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.CompactConstructorDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.SimpleName;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.repo.cognitive.tree.CatchNode;
import com.repo.cognitive.tree.ConditionalNode;
import com.repo.cognitive.tree.FileNode;
import com.repo.cognitive.tree.FunctionNode;
import com.repo.cognitive.tree.IfNode;
import com.repo.cognitive.tree.JumpNode;
import com.repo.cognitive.tree.LogicalNode;
import com.repo.cognitive.tree.LoopNode;
import com.repo.cognitive.tree.OtherNode;
import com.repo.cognitive.tree.SwitchCaseNode;
import com.repo.cognitive.tree.SwitchNode;
import com.repo.cognitive.tree.SyntaxNode;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adapts a JavaParser compilation unit to the generic syntax tree.
 *
 * <p>Methods, constructors and lambdas become functions; methods of
 * anonymous and local classes are therefore nested in the enclosing
 * function. Parentheses are dropped so that {@code a && (b && c)} forms a
 * single chain. Every produced node remembers the JavaParser node it came
 * from, for the token-based location resolver.</p>
 */
public class JavaSyntaxTreeBuilder {

    private static final String LAMBDA_NAME = "lambda";

    private final Map<SyntaxNode, Node> origins = new IdentityHashMap<>();

    private JavaSyntaxTreeBuilder() {
    }

    /**
     * Convert a parsed file.
     *
     * @param path path reported for the file
     * @param unit parsed compilation unit (tokens must have been stored)
     */
    public static JavaSyntaxTree build(String path, CompilationUnit unit) {
        JavaSyntaxTreeBuilder builder = new JavaSyntaxTreeBuilder();
        FileNode root = new FileNode(path, builder.convertChildren(unit));
        builder.origins.put(root, unit);
        return new JavaSyntaxTree(root, new JavaTokenLocationResolver(builder.origins));
    }

    private SyntaxNode convert(Node node) {
        if (node instanceof EnclosedExpr enclosed) {
            return convert(enclosed.getInner());
        }
        SyntaxNode converted = convertNode(node);
        origins.put(converted, node);
        return converted;
    }

    private SyntaxNode convertNode(Node node) {
        if (node instanceof MethodDeclaration method) {
            return function(method.getNameAsString(), method);
        }
        if (node instanceof ConstructorDeclaration constructor) {
            return function(constructor.getNameAsString(), constructor);
        }
        if (node instanceof CompactConstructorDeclaration constructor) {
            return function(constructor.getNameAsString(), constructor);
        }
        if (node instanceof LambdaExpr lambda) {
            return function(LAMBDA_NAME, lambda);
        }
        if (node instanceof IfStmt ifStmt) {
            return new IfNode(
                    convert(ifStmt.getCondition()),
                    convert(ifStmt.getThenStmt()),
                    ifStmt.getElseStmt().map(this::convert).orElse(null));
        }
        if (node instanceof ForStmt forStmt) {
            List<SyntaxNode> header = new ArrayList<>();
            forStmt.getInitialization().forEach(init -> header.add(convert(init)));
            forStmt.getCompare().ifPresent(compare -> header.add(convert(compare)));
            forStmt.getUpdate().forEach(update -> header.add(convert(update)));
            return new LoopNode(LoopNode.LoopKind.FOR, header, convert(forStmt.getBody()));
        }
        if (node instanceof ForEachStmt forEach) {
            return new LoopNode(LoopNode.LoopKind.FOR_OF,
                    List.of(convert(forEach.getVariable()), convert(forEach.getIterable())),
                    convert(forEach.getBody()));
        }
        if (node instanceof WhileStmt whileStmt) {
            return new LoopNode(LoopNode.LoopKind.WHILE,
                    List.of(convert(whileStmt.getCondition())), convert(whileStmt.getBody()));
        }
        if (node instanceof DoStmt doStmt) {
            SyntaxNode body = convert(doStmt.getBody());
            return new LoopNode(LoopNode.LoopKind.DO_WHILE, List.of(convert(doStmt.getCondition())), body);
        }
        if (node instanceof SwitchStmt switchStmt) {
            return new SwitchNode(convert(switchStmt.getSelector()), cases(switchStmt.getEntries()));
        }
        if (node instanceof SwitchExpr switchExpr) {
            return new SwitchNode(convert(switchExpr.getSelector()), cases(switchExpr.getEntries()));
        }
        if (node instanceof CatchClause catchClause) {
            return new CatchNode(convert(catchClause.getParameter()), convert(catchClause.getBody()));
        }
        if (node instanceof BinaryExpr binary && isLogical(binary.getOperator())) {
            LogicalNode.Operator operator = binary.getOperator() == BinaryExpr.Operator.AND
                    ? LogicalNode.Operator.AND
                    : LogicalNode.Operator.OR;
            return new LogicalNode(operator, convert(binary.getLeft()), convert(binary.getRight()));
        }
        if (node instanceof ConditionalExpr conditional) {
            return new ConditionalNode(
                    convert(conditional.getCondition()),
                    convert(conditional.getThenExpr()),
                    convert(conditional.getElseExpr()));
        }
        if (node instanceof BreakStmt breakStmt) {
            return new JumpNode(JumpNode.JumpKind.BREAK,
                    breakStmt.getLabel().map(SimpleName::asString).orElse(null));
        }
        if (node instanceof ContinueStmt continueStmt) {
            return new JumpNode(JumpNode.JumpKind.CONTINUE,
                    continueStmt.getLabel().map(SimpleName::asString).orElse(null));
        }
        return new OtherNode(node.getClass().getSimpleName(), convertChildren(node));
    }

    private FunctionNode function(String name, Node node) {
        return new FunctionNode(name, convertChildren(node));
    }

    private List<SwitchCaseNode> cases(List<SwitchEntry> entries) {
        List<SwitchCaseNode> cases = new ArrayList<>(entries.size());
        for (SwitchEntry entry : entries) {
            SwitchCaseNode switchCase = new SwitchCaseNode(
                    entry.getLabels().stream().map(this::convert).toList(),
                    entry.getStatements().stream().map(this::convert).toList());
            origins.put(switchCase, entry);
            cases.add(switchCase);
        }
        return cases;
    }

    private List<SyntaxNode> convertChildren(Node node) {
        List<Node> children = new ArrayList<>(node.getChildNodes());
        children.removeIf(Comment.class::isInstance);
        children.sort(Node.NODE_BY_BEGIN_POSITION);
        return children.stream().map(this::convert).toList();
    }

    private static boolean isLogical(BinaryExpr.Operator operator) {
        return operator == BinaryExpr.Operator.AND || operator == BinaryExpr.Operator.OR;
    }
}
