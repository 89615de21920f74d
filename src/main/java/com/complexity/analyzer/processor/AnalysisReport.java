package com.complexity.analyzer.processor;

import com.complexity.analyzer.model.IdiomMatch;
import com.complexity.analyzer.model.RecurrenceRelation;
import com.complexity.analyzer.model.RecurrenceSolution;
import com.complexity.analyzer.model.RecursionTree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the pipeline learned about one program. Serialized as-is by {@link ReportWriter}.
 */
public class AnalysisReport {

    public static final String BEST_CASE = "best_case";
    public static final String WORST_CASE = "worst_case";
    public static final String AVERAGE_CASE = "average_case";

    private final Map<String, String> summary;
    private final Map<String, String> annotations;
    private final RecurrenceRelation relation;
    private final RecurrenceSolution solution;
    private final RecursionTree recursionTree;
    private final IdiomMatch idiom;
    private final List<String> warnings;

    public AnalysisReport(String bestCase, String worstCase, String averageCase, Map<String, String> annotations,
                          RecurrenceRelation relation, RecurrenceSolution solution, RecursionTree recursionTree,
                          IdiomMatch idiom, List<String> warnings) {
        Map<String, String> cases = new LinkedHashMap<>();
        cases.put(BEST_CASE, bestCase);
        cases.put(WORST_CASE, worstCase);
        cases.put(AVERAGE_CASE, averageCase);
        this.summary = Collections.unmodifiableMap(cases);
        this.annotations = Collections.unmodifiableMap(new LinkedHashMap<>(annotations));
        this.relation = relation;
        this.solution = solution;
        this.recursionTree = recursionTree;
        this.idiom = idiom;
        this.warnings = List.copyOf(warnings);
    }

    public Map<String, String> getSummary() {
        return summary;
    }

    public String getBestCase() {
        return summary.get(BEST_CASE);
    }

    public String getWorstCase() {
        return summary.get(WORST_CASE);
    }

    public String getAverageCase() {
        return summary.get(AVERAGE_CASE);
    }

    public Map<String, String> getAnnotations() {
        return annotations;
    }

    public RecurrenceRelation getRelation() {
        return relation;
    }

    public RecurrenceSolution getSolution() {
        return solution;
    }

    /**
     * @return the recursion tree, or null when the recurrence does not divide its input
     */
    public RecursionTree getRecursionTree() {
        return recursionTree;
    }

    /**
     * @return the matched recursive idiom, or null
     */
    public IdiomMatch getIdiom() {
        return idiom;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
