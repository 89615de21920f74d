package com.complexity.analyzer.analysis;

/**
 * Receives trace events from the analysis passes. The default listener discards them.
 */
@FunctionalInterface
public interface AnalysisListener {

    AnalysisListener NONE = event -> {
    };

    void onEvent(TraceEvent event);
}
