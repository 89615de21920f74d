package com.complexity.analyzer.processor;

import com.complexity.analyzer.analysis.AnalysisListener;
import com.complexity.analyzer.analysis.ComplexityAnalyzer;
import com.complexity.analyzer.analysis.LoopGrowthClassifier;
import com.complexity.analyzer.analysis.RecurrenceExtractor;
import com.complexity.analyzer.analysis.RecursivePatternClassifier;
import com.complexity.analyzer.ast.AstWalker;
import com.complexity.analyzer.ast.Procedure;
import com.complexity.analyzer.ast.Program;
import com.complexity.analyzer.correction.CorrectionResult;
import com.complexity.analyzer.correction.GrammarCorrector;
import com.complexity.analyzer.model.ComplexityResult;
import com.complexity.analyzer.model.LoopStatistics;
import com.complexity.analyzer.model.RecurrenceRelation;
import com.complexity.analyzer.model.RecurrenceSolution;
import com.complexity.analyzer.model.RecursionTree;
import com.complexity.analyzer.model.RecursivePattern;
import com.complexity.analyzer.parser.Parser;
import com.complexity.analyzer.parser.SyntaxException;
import com.complexity.analyzer.recurrence.RecurrenceSolver;
import com.complexity.analyzer.recurrence.RecursionTreeBuilder;
import com.complexity.analyzer.validation.ValidatorSuite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Runs source text through parsing, validation, structural analysis, recurrence extraction,
 * solving and recursion-tree synthesis, and assembles the results into one report.
 *
 * A pipeline holds only immutable collaborators and may be shared between threads,
 * provided the configured {@link GrammarCorrector} is thread-safe.
 */
public class AnalysisPipeline {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisPipeline.class);

    public static final String STATEMENT_COUNT = "statement_count";
    public static final String GRAMMAR_CORRECTION = "grammar_correction";
    public static final String CORRECTION_CONFIDENCE = "correction_confidence";
    public static final String RECURRENCE = "recurrence";
    public static final String RECURRENCE_SOLUTION = "recurrence_solution";
    public static final String SOLVER_METHOD = "solver_method";

    /** A correction is only tried when the corrector is more confident than this. */
    static final double MIN_CORRECTION_CONFIDENCE = 0.5;

    private final PipelineConfig config;
    private final GrammarCorrector corrector;
    private final ComplexityAnalyzer analyzer;
    private final RecurrenceExtractor extractor;
    private final RecurrenceSolver solver;
    private final RecursionTreeBuilder treeBuilder;
    private final ValidatorSuite validators;

    public AnalysisPipeline() {
        this(PipelineConfig.defaults(), null);
    }

    public AnalysisPipeline(PipelineConfig config, GrammarCorrector corrector) {
        this(config, corrector, AnalysisListener.NONE);
    }

    public AnalysisPipeline(PipelineConfig config, GrammarCorrector corrector, AnalysisListener listener) {
        this.config = config;
        this.corrector = corrector;
        LoopGrowthClassifier loopClassifier = new LoopGrowthClassifier();
        this.analyzer = new ComplexityAnalyzer(loopClassifier, new RecursivePatternClassifier(), listener);
        this.extractor = new RecurrenceExtractor(analyzer, loopClassifier, listener);
        this.solver = new RecurrenceSolver();
        this.treeBuilder = new RecursionTreeBuilder();
        this.validators = new ValidatorSuite();
    }

    /**
     * Analyzes one pseudocode program.
     *
     * @param source the pseudocode
     * @return the assembled report
     * @throws SyntaxException if the source does not parse, even after a correction attempt
     */
    public AnalysisReport run(String source) throws SyntaxException {
        Map<String, String> annotations = new LinkedHashMap<>();
        Program program = parse(source, annotations);

        List<String> warnings = config.isEnableValidations()
                ? validators.validate(program) : Collections.emptyList();

        ComplexityResult result = analyzer.analyze(program);
        RecurrenceRelation relation = extractor.extract(program);
        RecursivePattern hint = result.getIdiom() != null ? result.getIdiom().getPattern() : null;
        RecurrenceSolution solution = solver.solve(relation.getRecurrence(), hint);
        RecursionTree tree = treeBuilder.buildFor(relation.getRecurrence(), config.getRecursionTreeDepth())
                .orElse(null);

        Map<String, String> merged = new LinkedHashMap<>(result.getAnnotations());
        merged.put(STATEMENT_COUNT, String.valueOf(countStatements(program)));
        merged.put(RECURRENCE, relation.getRecurrenceText());
        merged.put(RECURRENCE_SOLUTION, solution.getTheta());
        merged.put(SOLVER_METHOD, solution.getMethod());
        merged.putAll(annotations);

        String best = result.getBestCase();
        String worst = result.getWorstCase();
        String average = result.getAverageCase();
        if (config.isPreferSolverForPureRecursion() && solution.isConclusive() && isPureRecursion(relation)) {
            best = solution.getLower();
            worst = solution.getUpper();
            average = solution.getTheta();
            logger.debug("Using solver bounds for {}", relation.getIdentifier());
        }

        logger.debug("Analysis finished: best {}, worst {}, average {}", best, worst, average);
        return new AnalysisReport(best, worst, average, merged, relation, solution, tree, result.getIdiom(),
                warnings);
    }

    /**
     * Parses the source, retrying once with a proposed correction. Any failure along the
     * correction path rethrows the original error.
     */
    private Program parse(String source, Map<String, String> annotations) throws SyntaxException {
        try {
            return Parser.parse(source);
        } catch (SyntaxException original) {
            if (!config.isEnableGrammarCorrection() || corrector == null) {
                throw original;
            }

            CorrectionResult correction;
            try {
                correction = corrector.correct(source, original.getMessage());
            } catch (RuntimeException e) {
                logger.warn("Grammar correction failed: {}", e.getMessage());
                original.addSuppressed(e);
                throw original;
            }
            if (correction == null || correction.getConfidence() <= MIN_CORRECTION_CONFIDENCE) {
                logger.debug("Correction rejected, confidence too low");
                throw original;
            }

            try {
                Program program = Parser.parse(correction.getCorrectedCode());
                annotations.put(GRAMMAR_CORRECTION, correction.getExplanation());
                annotations.put(CORRECTION_CONFIDENCE,
                        String.format(Locale.ROOT, "%.2f", correction.getConfidence()));
                logger.info("Parsed after grammar correction: {}", correction.getExplanation());
                return program;
            } catch (SyntaxException retry) {
                original.addSuppressed(retry);
                throw original;
            }
        }
    }

    private static boolean isPureRecursion(RecurrenceRelation relation) {
        LoopStatistics statistics = relation.getStatistics();
        return statistics.getRecursiveCalls() > 0 && statistics.getMaxLoopDepth() == 0
                && statistics.getMaxLogDepth() == 0 && statistics.getShiftLoops() == 0;
    }

    private static int countStatements(Program program) {
        int count = AstWalker.countStatements(program.getBody());
        for (Procedure procedure : program.getProcedures()) {
            count += AstWalker.countStatements(procedure.getBody());
        }
        return count;
    }
}
