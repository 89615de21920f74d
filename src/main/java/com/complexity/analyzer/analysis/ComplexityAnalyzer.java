package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.Assignment;
import com.complexity.analyzer.ast.AstWalker;
import com.complexity.analyzer.ast.CallStatement;
import com.complexity.analyzer.ast.Expression;
import com.complexity.analyzer.ast.ForLoop;
import com.complexity.analyzer.ast.Identifier;
import com.complexity.analyzer.ast.IfStatement;
import com.complexity.analyzer.ast.NoOp;
import com.complexity.analyzer.ast.PrintStatement;
import com.complexity.analyzer.ast.Procedure;
import com.complexity.analyzer.ast.Program;
import com.complexity.analyzer.ast.RepeatUntilLoop;
import com.complexity.analyzer.ast.ReturnStatement;
import com.complexity.analyzer.ast.Statement;
import com.complexity.analyzer.ast.StatementVisitor;
import com.complexity.analyzer.ast.WhileLoop;
import com.complexity.analyzer.model.CaseComplexity;
import com.complexity.analyzer.model.ComplexityMeasure;
import com.complexity.analyzer.model.ComplexityResult;
import com.complexity.analyzer.model.IdiomMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Structural best/worst/average case analysis of a parsed program.
 *
 * The analysis folds over the tree: an immutable {@link AnalysisContext} goes down,
 * a {@link CaseComplexity} comes back up. Recursive procedures are then matched against
 * the known idioms and the idiom's fixed complexity can only raise the structural result.
 *
 * Instances hold no per-run state and may be shared between threads.
 */
public class ComplexityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(ComplexityAnalyzer.class);

    public static final String PATTERN_SUMMARY = "pattern_summary";
    public static final String HEURISTIC = "heuristic";
    public static final String NOTE = "note";
    public static final String MATCHED_IDIOM = "matched_idiom";
    public static final String IDIOM_CONFIDENCE = "idiom_confidence";
    public static final String RECURSIVE_PROCEDURE = "recursive_procedure";
    public static final String CASE_ORDER_WARNING = "case_order_warning";

    static final String STAGE = "analyzer";

    private final LoopGrowthClassifier loopClassifier;
    private final RecursivePatternClassifier patternClassifier;
    private final AnalysisListener listener;

    public ComplexityAnalyzer() {
        this(AnalysisListener.NONE);
    }

    public ComplexityAnalyzer(AnalysisListener listener) {
        this(new LoopGrowthClassifier(), new RecursivePatternClassifier(), listener);
    }

    public ComplexityAnalyzer(LoopGrowthClassifier loopClassifier, RecursivePatternClassifier patternClassifier,
                              AnalysisListener listener) {
        this.loopClassifier = loopClassifier;
        this.patternClassifier = patternClassifier;
        this.listener = listener;
    }

    /**
     * Analyzes the main body and every procedure, then applies the recursive idiom override.
     *
     * @param program the parsed program
     * @return best, worst and average case with explanatory annotations
     */
    public ComplexityResult analyze(Program program) {
        List<String> notes = new ArrayList<>();
        CaseFold fold = new CaseFold(notes);

        CaseComplexity measures = fold.block(program.getBody(), AnalysisContext.empty());
        for (Procedure procedure : program.getProcedures()) {
            CaseComplexity procedureCost = fold.block(procedure.getBody(), AnalysisContext.empty());
            logger.debug("Procedure {} costs {}", procedure.getName(), procedureCost);
            measures = measures.combineSequence(procedureCost);
        }

        Map<String, String> annotations = new LinkedHashMap<>();
        Optional<IdiomMatch> idiom = patternClassifier.classify(program);

        List<String> patterns = new ArrayList<>();
        if (AstWalker.containsLoop(program.getBody())
                || program.getProcedures().stream().anyMatch(p -> AstWalker.containsLoop(p.getBody()))) {
            patterns.add("The program contains iterative structures.");
        }
        if (idiom.isPresent()) {
            IdiomMatch match = idiom.get();
            patterns.add("Recursion detected in " + match.getProcedureName() + ".");
            measures = measures.maxWith(match.getPattern().getOverride());
            annotations.put(MATCHED_IDIOM, match.getPattern().getLabel());
            annotations.put(IDIOM_CONFIDENCE, match.getConfidence().name());
            annotations.put(RECURSIVE_PROCEDURE, match.getProcedureName());
            emit("Recursive idiom " + match.getPattern().getLabel() + " matched in " + match.getProcedureName(), 0);
        }
        annotations.put(PATTERN_SUMMARY, patterns.isEmpty()
                ? "No relevant patterns detected." : String.join(" ", patterns));

        String heuristic = String.format("Estimated polynomial degree -> best: %d, worst: %d, average: %d.",
                measures.getBest().getDegree(), measures.getWorst().getDegree(), measures.getAverage().getDegree());
        if (idiom.isPresent()) {
            heuristic += " Recursive heuristic applied. Pattern: " + idiom.get().getPattern().getLabel() + ".";
        }
        annotations.put(HEURISTIC, heuristic);

        notes.add(0, "Complexity estimated by structural analysis.");
        annotations.put(NOTE, String.join(" ", notes));

        if (!measures.isOrdered()) {
            annotations.put(CASE_ORDER_WARNING, "Cases are not ordered best <= average <= worst: " + measures);
        }

        logger.debug("Program {} analysed: {}", program.getName(), measures);
        return new ComplexityResult(measures, annotations, idiom.orElse(null));
    }

    /**
     * Folds a statement list with a fresh context.
     */
    public CaseComplexity analyzeBlock(List<Statement> statements) {
        return new CaseFold(new ArrayList<>()).block(statements, AnalysisContext.empty());
    }

    /**
     * Computes the structural cost of every procedure, for charging calls interprocedurally.
     */
    public ProcedureCostCache analyzeProcedures(Program program) {
        ProcedureCostCache cache = new ProcedureCostCache();
        for (Procedure procedure : program.getProcedures()) {
            cache.put(procedure.getName(), analyzeBlock(procedure.getBody()));
        }
        return cache;
    }

    private void emit(String message, int line) {
        listener.onEvent(new TraceEvent(STAGE, message, line));
    }

    /**
     * Statement fold. One instance per analysis run; it only collects notes.
     */
    private final class CaseFold implements StatementVisitor<CaseComplexity, AnalysisContext> {

        private final List<String> notes;

        CaseFold(List<String> notes) {
            this.notes = notes;
        }

        CaseComplexity block(List<Statement> statements, AnalysisContext context) {
            CaseComplexity result = CaseComplexity.constant();
            for (Statement statement : statements) {
                result = result.combineSequence(statement.accept(this, context));
            }
            return result;
        }

        @Override
        public CaseComplexity visitAssignment(Assignment statement, AnalysisContext context) {
            return CaseComplexity.constant();
        }

        @Override
        public CaseComplexity visitForLoop(ForLoop statement, AnalysisContext context) {
            CaseComplexity body = block(statement.getBody(), context.withIterator(statement.getIterator()));
            LoopGrowth growth = loopClassifier.classify(statement);
            emit("for " + statement.getIterator() + " at depth " + (context.getLoopDepth() + 1) + " grows " + growth,
                    statement.getLine());

            Set<String> outer = new TreeSet<>();
            for (Expression bound : List.of(statement.getStart(), statement.getStop())) {
                AstWalker.forEachExpression(bound, e -> {
                    if (e instanceof Identifier && context.isLoopIterator(((Identifier) e).getName())) {
                        outer.add(((Identifier) e).getName());
                    }
                });
            }
            if (!outer.isEmpty()) {
                notes.add("Loop at line " + statement.getLine() + " is bounded by outer iterator "
                        + String.join(", ", outer) + "; each pass is counted as a full pass.");
            }
            return growth.scale(body);
        }

        @Override
        public CaseComplexity visitWhileLoop(WhileLoop statement, AnalysisContext context) {
            CaseComplexity body = block(statement.getBody(), context.enterLoop());
            LoopGrowth growth = loopClassifier.classify(statement);
            CaseComplexity result = growth.scale(body);
            emit("while at depth " + (context.getLoopDepth() + 1) + " grows " + growth, statement.getLine());

            if (loopClassifier.hasEarlyExit(statement)) {
                notes.add("Loop at line " + statement.getLine() + " can exit early; best case is constant.");
                emit("early exit detected", statement.getLine());
                result = result.withBest(ComplexityMeasure.CONSTANT);
            }
            return result;
        }

        @Override
        public CaseComplexity visitRepeatUntilLoop(RepeatUntilLoop statement, AnalysisContext context) {
            CaseComplexity body = block(statement.getBody(), context.enterLoop());
            LoopGrowth growth = loopClassifier.classify(statement);
            emit("repeat at depth " + (context.getLoopDepth() + 1) + " grows " + growth, statement.getLine());
            return growth.scale(body);
        }

        @Override
        public CaseComplexity visitIfStatement(IfStatement statement, AnalysisContext context) {
            CaseComplexity thenCost = block(statement.getThenBranch(), context);
            CaseComplexity elseCost = block(statement.getElseBranch(), context);
            return thenCost.combineBranch(elseCost);
        }

        @Override
        public CaseComplexity visitCallStatement(CallStatement statement, AnalysisContext context) {
            return CaseComplexity.constant();
        }

        @Override
        public CaseComplexity visitReturnStatement(ReturnStatement statement, AnalysisContext context) {
            return CaseComplexity.constant();
        }

        @Override
        public CaseComplexity visitPrintStatement(PrintStatement statement, AnalysisContext context) {
            return CaseComplexity.constant();
        }

        @Override
        public CaseComplexity visitNoOp(NoOp statement, AnalysisContext context) {
            return CaseComplexity.constant();
        }
    }
}
