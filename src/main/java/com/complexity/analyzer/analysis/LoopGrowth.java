package com.complexity.analyzer.analysis;

import com.complexity.analyzer.model.CaseComplexity;
import com.complexity.analyzer.model.ComplexityMeasure;

/**
 * How the number of iterations of a loop grows with the input.
 */
public enum LoopGrowth {

    /** Bounds do not depend on the input. */
    CONSTANT,

    /** Iterations grow linearly with the input. */
    LINEAR,

    /** The controlling variable is scaled geometrically or the search range halves. */
    LOGARITHMIC;

    /**
     * Scales the cost of one pass through the body by the number of passes.
     */
    public CaseComplexity scale(CaseComplexity body) {
        switch (this) {
            case LINEAR:
                return body.scaleByDegree(1);
            case LOGARITHMIC:
                return body.scaleByLog(1);
            default:
                return body;
        }
    }

    public ComplexityMeasure scale(ComplexityMeasure body) {
        switch (this) {
            case LINEAR:
                return body.addDegree(1);
            case LOGARITHMIC:
                return body.addLog(1);
            default:
                return body;
        }
    }
}
