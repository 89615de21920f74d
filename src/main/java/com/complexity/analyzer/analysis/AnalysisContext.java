package com.complexity.analyzer.analysis;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Immutable state threaded down the tree during structural analysis.
 */
public final class AnalysisContext {

    private static final AnalysisContext EMPTY = new AnalysisContext(Collections.emptySet(), 0);

    private final Set<String> loopIterators;
    private final int loopDepth;

    private AnalysisContext(Set<String> loopIterators, int loopDepth) {
        this.loopIterators = loopIterators;
        this.loopDepth = loopDepth;
    }

    public static AnalysisContext empty() {
        return EMPTY;
    }

    /**
     * @return a context one loop deeper that also knows {@code iterator} as a loop variable
     */
    public AnalysisContext withIterator(String iterator) {
        Set<String> iterators = new HashSet<>(loopIterators);
        iterators.add(iterator);
        return new AnalysisContext(Collections.unmodifiableSet(iterators), loopDepth + 1);
    }

    public AnalysisContext enterLoop() {
        return new AnalysisContext(loopIterators, loopDepth + 1);
    }

    public boolean isLoopIterator(String name) {
        return loopIterators.contains(name);
    }

    public int getLoopDepth() {
        return loopDepth;
    }
}
