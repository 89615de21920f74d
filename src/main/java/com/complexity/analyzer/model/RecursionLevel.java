package com.complexity.analyzer.model;

/**
 * Summary of one depth of a recursion tree.
 */
public class RecursionLevel {

    private final int level;
    private final long nodeCount;
    private final String subproblem;
    private final String totalCost;

    public RecursionLevel(int level, long nodeCount, String subproblem, String totalCost) {
        this.level = level;
        this.nodeCount = nodeCount;
        this.subproblem = subproblem;
        this.totalCost = totalCost;
    }

    public int getLevel() {
        return level;
    }

    public long getNodeCount() {
        return nodeCount;
    }

    public String getSubproblem() {
        return subproblem;
    }

    public String getTotalCost() {
        return totalCost;
    }
}
