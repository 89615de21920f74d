package com.complexity.analyzer.model;

/**
 * Shape facts gathered while extracting a recurrence from one procedure.
 */
public class LoopStatistics {

    private final int maxLoopDepth;
    private final int maxLogDepth;
    private final int recursiveCalls;
    private final int dividingCalls;
    private final int subtractingCalls;
    private final int shiftLoops;
    private final ComplexityMeasure localCost;

    public LoopStatistics(int maxLoopDepth, int maxLogDepth, int recursiveCalls, int dividingCalls,
                          int subtractingCalls, int shiftLoops, ComplexityMeasure localCost) {
        this.maxLoopDepth = maxLoopDepth;
        this.maxLogDepth = maxLogDepth;
        this.recursiveCalls = recursiveCalls;
        this.dividingCalls = dividingCalls;
        this.subtractingCalls = subtractingCalls;
        this.shiftLoops = shiftLoops;
        this.localCost = localCost;
    }

    public int getMaxLoopDepth() {
        return maxLoopDepth;
    }

    public int getMaxLogDepth() {
        return maxLogDepth;
    }

    public int getRecursiveCalls() {
        return recursiveCalls;
    }

    public int getDividingCalls() {
        return dividingCalls;
    }

    public int getSubtractingCalls() {
        return subtractingCalls;
    }

    /**
     * @return inner loops recognized as array shifts and treated as free
     */
    public int getShiftLoops() {
        return shiftLoops;
    }

    public ComplexityMeasure getLocalCost() {
        return localCost;
    }

    @Override
    public String toString() {
        return String.format("loops=%d, logLoops=%d, recursiveCalls=%d (divide=%d, subtract=%d), shiftLoops=%d, f(n)=%s",
                maxLoopDepth, maxLogDepth, recursiveCalls, dividingCalls, subtractingCalls, shiftLoops,
                localCost.toExpression());
    }
}
