package com.complexity.analyzer.model;

import java.util.List;

public class RecursionTreeNode {

    private final String label;
    private final int level;
    private final String cost;
    private final List<RecursionTreeNode> children;

    public RecursionTreeNode(String label, int level, String cost, List<RecursionTreeNode> children) {
        this.label = label;
        this.level = level;
        this.cost = cost;
        this.children = List.copyOf(children);
    }

    public String getLabel() {
        return label;
    }

    public int getLevel() {
        return level;
    }

    public String getCost() {
        return cost;
    }

    public List<RecursionTreeNode> getChildren() {
        return children;
    }

    public int size() {
        int total = 1;
        for (RecursionTreeNode child : children) {
            total += child.size();
        }
        return total;
    }
}
