package com.complexity.analyzer.model;

import java.util.List;

/**
 * A depth-capped illustration of how a dividing recurrence unfolds.
 */
public class RecursionTree {

    private final RecursionTreeNode root;
    private final int maxLevel;
    private final String totalCost;
    private final String description;
    private final List<RecursionLevel> levels;

    public RecursionTree(RecursionTreeNode root, int maxLevel, String totalCost, String description,
                         List<RecursionLevel> levels) {
        this.root = root;
        this.maxLevel = maxLevel;
        this.totalCost = totalCost;
        this.description = description;
        this.levels = List.copyOf(levels);
    }

    public RecursionTreeNode getRoot() {
        return root;
    }

    public int getMaxLevel() {
        return maxLevel;
    }

    public String getTotalCost() {
        return totalCost;
    }

    public String getDescription() {
        return description;
    }

    public List<RecursionLevel> getLevels() {
        return levels;
    }
}
