package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.ArrayAccess;
import com.complexity.analyzer.ast.Assignment;
import com.complexity.analyzer.ast.AstWalker;
import com.complexity.analyzer.ast.BinaryOperation;
import com.complexity.analyzer.ast.CallSite;
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
import com.complexity.analyzer.model.LoopStatistics;
import com.complexity.analyzer.model.Recurrence;
import com.complexity.analyzer.model.RecurrenceRelation;
import com.complexity.analyzer.model.RecursiveTerm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Derives a recurrence {@code T(n) = Σ a·T(reduced n) + f(n)} from the most plausible
 * recursive unit of a program.
 *
 * The result is an independent estimate and may disagree with {@link ComplexityAnalyzer}.
 */
public class RecurrenceExtractor {

    private static final Logger logger = LoggerFactory.getLogger(RecurrenceExtractor.class);

    static final String STAGE = "extractor";

    public static final String DIVIDE_BASE_CASE = "T(1) = 1";
    public static final String SUBTRACT_BASE_CASE = "T(0) = 1";
    public static final String NO_BASE_CASE = "-";

    /** Divisor assumed when calls do not agree on one. */
    static final int DEFAULT_DIVISOR = 2;

    private final ComplexityAnalyzer analyzer;
    private final LoopGrowthClassifier loopClassifier;
    private final AnalysisListener listener;

    public RecurrenceExtractor() {
        this(AnalysisListener.NONE);
    }

    public RecurrenceExtractor(AnalysisListener listener) {
        this(new ComplexityAnalyzer(), new LoopGrowthClassifier(), listener);
    }

    public RecurrenceExtractor(ComplexityAnalyzer analyzer, LoopGrowthClassifier loopClassifier,
                               AnalysisListener listener) {
        this.analyzer = analyzer;
        this.loopClassifier = loopClassifier;
        this.listener = listener;
    }

    public RecurrenceRelation extract(Program program) {
        ProgramUnit target = selectTarget(program);
        List<String> notes = new ArrayList<>();
        notes.add("Analysed unit: " + target.getName());

        ProcedureCostCache costs = analyzer.analyzeProcedures(program);
        CostWalker walker = new CostWalker(target, program, costs, notes);
        walker.block(target.getBody(), WalkContext.TOP);

        List<CallSite> recursiveCalls = IdiomSignatures.recursiveCallSites(target);
        Map<String, Integer> halvingVariables = IdiomSignatures.halvingVariables(target.getBody());
        List<CallReduction> reductions = new ArrayList<>();
        for (CallSite site : recursiveCalls) {
            CallReduction reduction = IdiomSignatures.reductionOf(site, halvingVariables);
            reductions.add(reduction);
            if (reduction.getKind() == CallReduction.Kind.UNKNOWN) {
                notes.add("Recursive call at line " + site.getLine() + " has no recognizable size reduction.");
            }
            emit("call at line " + site.getLine() + " reduces by " + reduction, site.getLine());
        }

        ComplexityMeasure localCost = walker.localCost;
        Recurrence recurrence = synthesize(reductions, localCost);
        String baseCase = baseCaseOf(recurrence);

        long dividing = reductions.stream().filter(r -> r.getKind() == CallReduction.Kind.DIVIDE).count();
        long subtracting = reductions.stream().filter(r -> r.getKind() == CallReduction.Kind.SUBTRACT).count();
        LoopStatistics statistics = new LoopStatistics(walker.maxLoopDepth, walker.maxLogDepth,
                recursiveCalls.size(), (int) dividing, (int) subtracting, walker.shiftLoops, localCost);

        logger.debug("Extracted {} from {} ({})", recurrence, target.getName(), statistics);
        return new RecurrenceRelation(target.getName(), recurrence, baseCase, notes, statistics);
    }

    /**
     * First recursive procedure, then a recursive main block, then a non-empty main block,
     * then the last procedure.
     */
    ProgramUnit selectTarget(Program program) {
        for (Procedure procedure : program.getProcedures()) {
            ProgramUnit unit = ProgramUnit.of(procedure);
            if (!IdiomSignatures.recursiveCallSites(unit).isEmpty()) {
                return unit;
            }
        }
        ProgramUnit main = ProgramUnit.mainBlock(program);
        if (!main.getBody().isEmpty() || program.getProcedures().isEmpty()) {
            return main;
        }
        return ProgramUnit.of(program.getProcedures().get(program.getProcedures().size() - 1));
    }

    Recurrence synthesize(List<CallReduction> reductions, ComplexityMeasure localCost) {
        if (reductions.isEmpty()) {
            return Recurrence.nonRecursive(localCost);
        }

        if (reductions.size() >= 2) {
            if (reductions.stream().allMatch(r -> r.getKind() == CallReduction.Kind.SUBTRACT)) {
                // Grouped by decrement: T(n-1) + T(n-2), or 2T(n-1)
                Map<Integer, Integer> byDecrement = new TreeMap<>();
                for (CallReduction reduction : reductions) {
                    byDecrement.merge(reduction.getAmount(), 1, Integer::sum);
                }
                List<RecursiveTerm> terms = new ArrayList<>();
                byDecrement.forEach((decrement, count) -> terms.add(RecursiveTerm.subtract(count, decrement)));
                return new Recurrence(terms, localCost);
            }
            Set<Integer> divisors = new LinkedHashSet<>();
            for (CallReduction reduction : reductions) {
                if (reduction.getKind() == CallReduction.Kind.DIVIDE) {
                    divisors.add(reduction.getAmount());
                }
            }
            int divisor = divisors.size() == 1 ? divisors.iterator().next() : DEFAULT_DIVISOR;
            return new Recurrence(List.of(RecursiveTerm.divide(reductions.size(), divisor)), localCost);
        }

        CallReduction only = reductions.get(0);
        if (only.getKind() == CallReduction.Kind.DIVIDE) {
            return new Recurrence(List.of(RecursiveTerm.divide(1, only.getAmount())), localCost);
        }
        // a lone call with constant work around it is taken as a halving search
        if (localCost.isConstant()) {
            return new Recurrence(List.of(RecursiveTerm.divide(1, DEFAULT_DIVISOR)), localCost);
        }
        int decrement = only.getKind() == CallReduction.Kind.SUBTRACT ? only.getAmount() : 1;
        return new Recurrence(List.of(RecursiveTerm.subtract(1, decrement)), localCost);
    }

    static String baseCaseOf(Recurrence recurrence) {
        if (recurrence.isDividing()) {
            return DIVIDE_BASE_CASE;
        }
        if (recurrence.isSubtractive()) {
            return SUBTRACT_BASE_CASE;
        }
        return NO_BASE_CASE;
    }

    /**
     * An inner loop that only moves array elements one slot and steps its index down, as in the
     * shifting step of insertion sort.
     */
    static boolean isArrayShift(List<Statement> body, boolean requireDecrement) {
        if (body.isEmpty()) {
            return false;
        }
        boolean moves = false;
        boolean decrements = false;
        for (Statement statement : body) {
            if (!(statement instanceof Assignment)) {
                return false;
            }
            Assignment assignment = (Assignment) statement;
            if (isOneSlotMove(assignment)) {
                moves = true;
            } else if (isDecrement(assignment)) {
                decrements = true;
            } else {
                return false;
            }
        }
        return moves && (decrements || !requireDecrement);
    }

    private static boolean isOneSlotMove(Assignment assignment) {
        if (!(assignment.getTarget() instanceof ArrayAccess) || !(assignment.getValue() instanceof ArrayAccess)) {
            return false;
        }
        IndexOffset target = IndexOffset.of(((ArrayAccess) assignment.getTarget()).getIndex());
        IndexOffset source = IndexOffset.of(((ArrayAccess) assignment.getValue()).getIndex());
        return target != null && source != null && target.variable.equals(source.variable)
                && Math.abs(target.offset - source.offset) == 1;
    }

    private static boolean isDecrement(Assignment assignment) {
        if (!(assignment.getTarget() instanceof Identifier) || !(assignment.getValue() instanceof BinaryOperation)) {
            return false;
        }
        String variable = ((Identifier) assignment.getTarget()).getName();
        BinaryOperation value = (BinaryOperation) assignment.getValue();
        return value.getOperator().equals("-") && IdiomSignatures.isIdentifier(value.getLeft(), variable)
                && IdiomSignatures.literalValue(value.getRight()) != null;
    }

    private void emit(String message, int line) {
        listener.onEvent(new TraceEvent(STAGE, message, line));
    }

    /**
     * An index of the form {@code i}, {@code i + k} or {@code i - k}.
     */
    private static final class IndexOffset {
        private final String variable;
        private final long offset;

        private IndexOffset(String variable, long offset) {
            this.variable = variable;
            this.offset = offset;
        }

        static IndexOffset of(Expression index) {
            if (index instanceof Identifier) {
                return new IndexOffset(((Identifier) index).getName(), 0);
            }
            if (!(index instanceof BinaryOperation)) {
                return null;
            }
            BinaryOperation operation = (BinaryOperation) index;
            Long literal = IdiomSignatures.literalValue(operation.getRight());
            if (!(operation.getLeft() instanceof Identifier) || literal == null) {
                return null;
            }
            String variable = ((Identifier) operation.getLeft()).getName();
            if (operation.getOperator().equals("+")) {
                return new IndexOffset(variable, literal);
            }
            if (operation.getOperator().equals("-")) {
                return new IndexOffset(variable, -literal);
            }
            return null;
        }
    }

    /**
     * Loop nesting along the current path.
     */
    private static final class WalkContext {
        static final WalkContext TOP = new WalkContext(0, 0);

        private final int loopDepth;
        private final int logDepth;

        private WalkContext(int loopDepth, int logDepth) {
            this.loopDepth = loopDepth;
            this.logDepth = logDepth;
        }

        WalkContext enter(LoopGrowth growth) {
            switch (growth) {
                case LINEAR:
                    return new WalkContext(loopDepth + 1, logDepth);
                case LOGARITHMIC:
                    return new WalkContext(loopDepth, logDepth + 1);
                default:
                    return this;
            }
        }

        boolean insideLoop() {
            return loopDepth > 0 || logDepth > 0;
        }

        ComplexityMeasure pathCost() {
            return ComplexityMeasure.of(loopDepth, logDepth);
        }
    }

    /**
     * Walks the target unit once, tracking the deepest loop path and the cost of each statement.
     */
    private final class CostWalker implements StatementVisitor<Void, WalkContext> {

        private final ProgramUnit unit;
        private final Program program;
        private final ProcedureCostCache costs;
        private final List<String> notes;

        private int maxLoopDepth;
        private int maxLogDepth;
        private int shiftLoops;
        private ComplexityMeasure localCost = ComplexityMeasure.CONSTANT;

        CostWalker(ProgramUnit unit, Program program, ProcedureCostCache costs, List<String> notes) {
            this.unit = unit;
            this.program = program;
            this.costs = costs;
            this.notes = notes;
        }

        void block(List<Statement> statements, WalkContext context) {
            for (Statement statement : statements) {
                record(statement, context);
                statement.accept(this, context);
            }
        }

        private void record(Statement statement, WalkContext context) {
            maxLoopDepth = Math.max(maxLoopDepth, context.loopDepth);
            maxLogDepth = Math.max(maxLogDepth, context.logDepth);
            localCost = localCost.maxWith(context.pathCost());

            for (CallSite site : AstWalker.callSitesOf(statement)) {
                if (IdiomSignatures.isRecursiveCall(site, unit.getName())) {
                    continue;
                }
                CaseComplexity callee = costs.get(site.getName());
                if (callee == null || program.findProcedure(site.getName()) == null) {
                    continue;
                }
                ComplexityMeasure charged = callee.getAverage().times(context.pathCost());
                if (!localCost.dominates(charged)) {
                    notes.add("Call to " + site.getName() + " at line " + site.getLine()
                            + " charged at " + charged.toExpression() + ".");
                }
                localCost = localCost.maxWith(charged);
            }
        }

        private void loop(Statement loop, LoopGrowth growth, List<Statement> body, WalkContext context) {
            WalkContext inner = context.enter(growth);
            emit(unit.getName() + ": loop grows " + growth, loop.getLine());
            maxLoopDepth = Math.max(maxLoopDepth, inner.loopDepth);
            maxLogDepth = Math.max(maxLogDepth, inner.logDepth);
            localCost = localCost.maxWith(inner.pathCost());
            block(body, inner);
        }

        @Override
        public Void visitAssignment(Assignment statement, WalkContext context) {
            return null;
        }

        @Override
        public Void visitForLoop(ForLoop statement, WalkContext context) {
            if (context.insideLoop() && statement.isDescending() && isArrayShift(statement.getBody(), false)) {
                shiftOnly(statement);
                return null;
            }
            loop(statement, loopClassifier.classify(statement), statement.getBody(), context);
            return null;
        }

        @Override
        public Void visitWhileLoop(WhileLoop statement, WalkContext context) {
            if (context.insideLoop() && isArrayShift(statement.getBody(), true)) {
                shiftOnly(statement);
                return null;
            }
            loop(statement, loopClassifier.classify(statement), statement.getBody(), context);
            return null;
        }

        @Override
        public Void visitRepeatUntilLoop(RepeatUntilLoop statement, WalkContext context) {
            loop(statement, loopClassifier.classify(statement), statement.getBody(), context);
            return null;
        }

        private void shiftOnly(Statement loop) {
            shiftLoops++;
            notes.add("Array shift loop at line " + loop.getLine() + " treated as constant cost.");
            emit(unit.getName() + ": array shift loop", loop.getLine());
        }

        @Override
        public Void visitIfStatement(IfStatement statement, WalkContext context) {
            block(statement.getThenBranch(), context);
            block(statement.getElseBranch(), context);
            return null;
        }

        @Override
        public Void visitCallStatement(CallStatement statement, WalkContext context) {
            return null;
        }

        @Override
        public Void visitReturnStatement(ReturnStatement statement, WalkContext context) {
            return null;
        }

        @Override
        public Void visitPrintStatement(PrintStatement statement, WalkContext context) {
            return null;
        }

        @Override
        public Void visitNoOp(NoOp statement, WalkContext context) {
            return null;
        }
    }
}
