package com.repo.cognitive.structural;

import com.repo.cognitive.rules.Finding;
import com.repo.cognitive.rules.ThresholdReporter;
import com.repo.cognitive.tree.FunctionNode;
import com.repo.cognitive.tree.SourcePosition;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;

/**
 * Routes complexity points to the function they are charged to.
 *
 * <p>Three scopes are told apart: code outside any function, top-level
 * functions and functions nested directly in a top-level one. Anything
 * deeper is folded into its second-level ancestor.</p>
 *
 * <p>A second-level function keeps two versions of its points: as-is, for
 * when it is judged on its own, and one nesting level deeper, for when it is
 * folded into its parent. The choice is made when the top-level function
 * ends: if the parent has structural complexity of its own, the folded
 * points are added to the parent and only the parent is checked; otherwise
 * the parent and each child are checked separately.</p>
 */
final class FunctionScopeAccumulator {

    private final ThresholdReporter reporter;
    private final Function<FunctionNode, SourcePosition> functionLocator;
    private final Deque<ScopeFrame> frames = new ArrayDeque<>();
    private final List<Finding> findings = new ArrayList<>();
    private int functionDepth;
    private int functionCount;

    FunctionScopeAccumulator(ThresholdReporter reporter, Function<FunctionNode, SourcePosition> functionLocator) {
        this.reporter = reporter;
        this.functionLocator = functionLocator;
        this.frames.push(new FileFrame());
    }

    /**
     * @return true if the function body counts as one more nesting level
     */
    boolean enterFunction(FunctionNode function) {
        functionCount++;
        int depth = functionDepth++;
        if (depth == 0) {
            frames.push(new TopFrame());
            return false;
        }
        if (depth == 1) {
            frames.push(new ChildFrame());
            return false;
        }
        return true;
    }

    void exitFunction(FunctionNode function) {
        if (functionDepth == 0) {
            throw new IllegalStateException("Exiting function '" + function.name() + "' that was never entered");
        }
        int depth = --functionDepth;
        if (depth == 0) {
            TopFrame top = (TopFrame) frames.pop();
            finish(top, function.name(), functionLocator.apply(function));
        } else if (depth == 1) {
            ChildFrame child = (ChildFrame) frames.pop();
            TopFrame parent = (TopFrame) frames.peek();
            parent.children.add(new ChildRecord(
                    function.name(), functionLocator.apply(function), child.standalone, child.nestedFold));
        }
        // deeper functions have no frame of their own
    }

    void addStructural(int nesting, SourcePosition location) {
        frames.peek().record(ComplexityPoint.structural(nesting, location), true);
    }

    void addFlat(SourcePosition location) {
        frames.peek().record(ComplexityPoint.flat(location), false);
    }

    List<Finding> getFindings() {
        return Collections.unmodifiableList(findings);
    }

    int getFunctionCount() {
        return functionCount;
    }

    private void finish(TopFrame top, String name, SourcePosition location) {
        if (top.hasStructuralComplexity) {
            List<ComplexityPoint> total = new ArrayList<>(top.own);
            for (ChildRecord child : top.children) {
                total.addAll(child.nestedFold());
            }
            check(name, location, total);
        } else {
            check(name, location, top.own);
            for (ChildRecord child : top.children) {
                check(child.name(), child.location(), child.standalone());
            }
        }
    }

    private void check(String name, SourcePosition location, List<ComplexityPoint> points) {
        reporter.evaluate(name, location, points).ifPresent(findings::add);
    }

    private interface ScopeFrame {
        void record(ComplexityPoint point, boolean structural);
    }

    private final class FileFrame implements ScopeFrame {
        @Override
        public void record(ComplexityPoint point, boolean structural) {
            reporter.addFileScopeComplexity(point.amount());
        }
    }

    private static final class TopFrame implements ScopeFrame {
        private boolean hasStructuralComplexity;
        private final List<ComplexityPoint> own = new ArrayList<>();
        private final List<ChildRecord> children = new ArrayList<>();

        @Override
        public void record(ComplexityPoint point, boolean structural) {
            if (structural) {
                hasStructuralComplexity = true;
            }
            own.add(point);
        }
    }

    private static final class ChildFrame implements ScopeFrame {
        private final List<ComplexityPoint> standalone = new ArrayList<>();
        private final List<ComplexityPoint> nestedFold = new ArrayList<>();

        @Override
        public void record(ComplexityPoint point, boolean structural) {
            standalone.add(point);
            nestedFold.add(structural ? point.nestedOnce() : point);
        }
    }

    private record ChildRecord(
            String name,
            SourcePosition location,
            List<ComplexityPoint> standalone,
            List<ComplexityPoint> nestedFold) {
    }
}
