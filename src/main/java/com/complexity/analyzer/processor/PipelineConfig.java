package com.complexity.analyzer.processor;

import com.complexity.analyzer.recurrence.RecursionTreeBuilder;
import com.google.gson.annotations.SerializedName;

/**
 * Pipeline settings. Every field is optional in the JSON form; absent fields take the defaults.
 */
public class PipelineConfig {

    @SerializedName("enable_validations")
    private Boolean enableValidations;

    @SerializedName("enable_grammar_correction")
    private Boolean enableGrammarCorrection;

    /** Report the solver's bounds instead of the structural ones for loop-free recursion. */
    @SerializedName("prefer_solver_for_pure_recursion")
    private Boolean preferSolverForPureRecursion;

    @SerializedName("recursion_tree_depth")
    private Integer recursionTreeDepth;

    public static PipelineConfig defaults() {
        return new PipelineConfig();
    }

    public boolean isEnableValidations()            { return enableValidations == null || enableValidations; }
    public boolean isEnableGrammarCorrection()      { return enableGrammarCorrection == null || enableGrammarCorrection; }
    public boolean isPreferSolverForPureRecursion() { return preferSolverForPureRecursion != null && preferSolverForPureRecursion; }
    public int getRecursionTreeDepth() {
        return recursionTreeDepth != null ? recursionTreeDepth : RecursionTreeBuilder.DEFAULT_DEPTH;
    }

    public PipelineConfig setEnableValidations(boolean enableValidations) {
        this.enableValidations = enableValidations;
        return this;
    }

    public PipelineConfig setEnableGrammarCorrection(boolean enableGrammarCorrection) {
        this.enableGrammarCorrection = enableGrammarCorrection;
        return this;
    }

    public PipelineConfig setPreferSolverForPureRecursion(boolean preferSolverForPureRecursion) {
        this.preferSolverForPureRecursion = preferSolverForPureRecursion;
        return this;
    }

    public PipelineConfig setRecursionTreeDepth(int recursionTreeDepth) {
        this.recursionTreeDepth = recursionTreeDepth;
        return this;
    }
}
