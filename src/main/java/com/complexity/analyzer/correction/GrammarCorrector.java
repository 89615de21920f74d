package com.complexity.analyzer.correction;

/**
 * Proposes a corrected version of pseudocode that failed to parse.
 *
 * Implementations typically call an external assistant; none ships with the analyzer.
 */
public interface GrammarCorrector {

    /**
     * @param source the source that failed to parse
     * @param errorMessage the parser's message, including line and column
     * @return the proposed correction with a confidence in [0, 1]
     * @throws CorrectionException if no correction could be produced
     */
    CorrectionResult correct(String source, String errorMessage);

    class CorrectionException extends RuntimeException {
        public CorrectionException(String message) { super(message); }
        public CorrectionException(String message, Throwable cause) { super(message, cause); }
    }
}
