package com.complexity.analyzer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of the structural complexity analysis of a whole program.
 */
public class ComplexityResult {

    private final CaseComplexity measures;
    private final String bestCase;
    private final String worstCase;
    private final String averageCase;
    private final Map<String, String> annotations;
    private final IdiomMatch idiom;

    public ComplexityResult(CaseComplexity measures, Map<String, String> annotations, IdiomMatch idiom) {
        this.measures = measures;
        this.bestCase = measures.bestNotation();
        this.worstCase = measures.worstNotation();
        this.averageCase = measures.averageNotation();
        this.annotations = Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
        this.idiom = idiom;
    }

    public CaseComplexity getMeasures() {
        return measures;
    }

    public String getBestCase() {
        return bestCase;
    }

    public String getWorstCase() {
        return worstCase;
    }

    public String getAverageCase() {
        return averageCase;
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    /**
     * @return the matched recursive idiom, or null when the program has no recursion
     */
    public IdiomMatch getIdiom() {
        return idiom;
    }
}
