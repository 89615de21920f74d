package com.complexity.analyzer.recurrence;

import com.complexity.analyzer.model.ComplexityMeasure;
import com.complexity.analyzer.model.Recurrence;
import com.complexity.analyzer.model.RecursionLevel;
import com.complexity.analyzer.model.RecursionTree;
import com.complexity.analyzer.model.RecursionTreeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Builds a small illustration of how {@code T(n) = a·T(n/b) + f(n)} unfolds.
 */
public class RecursionTreeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(RecursionTreeBuilder.class);

    public static final int DEFAULT_DEPTH = 5;
    public static final int NODE_BUDGET = 4096;

    /**
     * Builds the complete a-ary tree down to {@code depthCap}, or less if it would exceed
     * {@link #NODE_BUDGET} nodes.
     *
     * @throws IllegalArgumentException if {@code a < 1} or {@code b < 2}
     */
    public RecursionTree build(int a, int b, ComplexityMeasure f, int depthCap) {
        if (a < 1 || b < 2) {
            throw new IllegalArgumentException("Need a >= 1 and b >= 2, got a=" + a + ", b=" + b);
        }
        int depth = Math.max(0, depthCap);
        while (depth > 0 && nodesUpTo(a, depth) > NODE_BUDGET) {
            depth--;
        }

        List<RecursionLevel> levels = new ArrayList<>();
        for (int level = 0; level <= depth; level++) {
            long nodes = power(a, level);
            String size = subproblem(b, level);
            String perNode = GrowthFormat.at(f, size);
            String total = level == 0 ? perNode : nodes + " * " + perNode;
            levels.add(new RecursionLevel(level, nodes, size, total));
        }

        RecursionTreeNode root = node(a, b, f, 0, depth);
        String totalCost = totalCost(a, b, f);
        return new RecursionTree(root, depth, totalCost, describe(a, b, f), levels);
    }

    public RecursionTree build(int a, int b, ComplexityMeasure f) {
        return build(a, b, f, DEFAULT_DEPTH);
    }

    /**
     * @return the tree for a dividing recurrence, empty for any other shape
     */
    public Optional<RecursionTree> buildFor(Recurrence recurrence, int depthCap) {
        if (!recurrence.isDividing() || recurrence.getLocalCost().isExponential()) {
            return Optional.empty();
        }
        int a;
        try {
            a = recurrence.totalCoefficient();
        } catch (ArithmeticException e) {
            logger.debug("No tree for {}: {}", recurrence, e.getMessage());
            return Optional.empty();
        }
        return Optional.of(build(a, recurrence.divisor(), recurrence.getLocalCost(), depthCap));
    }

    public Optional<RecursionTree> buildFor(Recurrence recurrence) {
        return buildFor(recurrence, DEFAULT_DEPTH);
    }

    private RecursionTreeNode node(int a, int b, ComplexityMeasure f, int level, int depth) {
        String size = subproblem(b, level);
        List<RecursionTreeNode> children = Collections.emptyList();
        if (level < depth) {
            children = new ArrayList<>();
            for (int i = 0; i < a; i++) {
                children.add(node(a, b, f, level + 1, depth));
            }
        }
        return new RecursionTreeNode("T(" + size + ")", level, GrowthFormat.at(f, size), children);
    }

    static String totalCost(int a, int b, ComplexityMeasure f) {
        double c = GrowthFormat.criticalExponent(a, b);
        int d = f.getDegree();
        if (Math.abs(d - c) < GrowthFormat.EPSILON) {
            return GrowthFormat.theta(ComplexityMeasure.of(d, f.getLogPower() + 1).toExpression());
        }
        if (c > d) {
            return GrowthFormat.theta(GrowthFormat.power(c));
        }
        return GrowthFormat.theta(f.toExpression());
    }

    private static String describe(int a, int b, ComplexityMeasure f) {
        double c = GrowthFormat.criticalExponent(a, b);
        int d = f.getDegree();
        String shape = a + " subproblems of size n/" + b + " per call, about log_" + b + " n levels. ";
        if (Math.abs(d - c) < GrowthFormat.EPSILON) {
            return shape + "Every level costs about the same, so the total is the level cost times the depth.";
        }
        if (c > d) {
            return shape + "Level costs grow geometrically; the leaves dominate.";
        }
        return shape + "Level costs shrink geometrically; the root dominates.";
    }

    private static String subproblem(int b, int level) {
        if (level == 0) {
            return "n";
        }
        long divisor = power(b, level);
        return divisor < 0 ? "n/" + b + "^" + level : "n/" + divisor;
    }

    /**
     * @return {@code base^exponent}, or -1 if it does not fit a long
     */
    static long power(int base, int exponent) {
        long result = 1;
        try {
            for (int i = 0; i < exponent; i++) {
                result = Math.multiplyExact(result, base);
            }
        } catch (ArithmeticException e) {
            return -1;
        }
        return result;
    }

    private static long nodesUpTo(int a, int depth) {
        long total = 0;
        long levelNodes = 1;
        for (int level = 0; level <= depth; level++) {
            total += levelNodes;
            if (total > NODE_BUDGET) {
                return total;
            }
            levelNodes *= a;
        }
        return total;
    }
}
