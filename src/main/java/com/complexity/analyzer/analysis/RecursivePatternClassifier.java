package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.AstWalker;
import com.complexity.analyzer.ast.CallSite;
import com.complexity.analyzer.ast.Expression;
import com.complexity.analyzer.ast.Program;
import com.complexity.analyzer.ast.Statement;
import com.complexity.analyzer.model.IdiomMatch;
import com.complexity.analyzer.model.RecursivePattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Recognizes the shape of the first recursive unit in a program.
 */
public class RecursivePatternClassifier {

    private static final Logger logger = LoggerFactory.getLogger(RecursivePatternClassifier.class);

    /**
     * Classifies the first procedure (or the main block) that calls itself.
     *
     * @param program the parsed program
     * @return the matched idiom, or empty when nothing in the program recurses
     */
    public Optional<IdiomMatch> classify(Program program) {
        for (ProgramUnit unit : ProgramUnit.allOf(program)) {
            List<CallSite> recursiveCalls = IdiomSignatures.recursiveCallSites(unit);
            if (recursiveCalls.isEmpty()) {
                continue;
            }
            RecursivePattern pattern = classify(unit.getBody(), recursiveCalls);
            logger.debug("Unit {} has {} recursive calls, classified as {}",
                    unit.getName(), recursiveCalls.size(), pattern.getLabel());
            return Optional.of(new IdiomMatch(pattern, unit.getName(), recursiveCalls.size()));
        }
        return Optional.empty();
    }

    RecursivePattern classify(List<Statement> body, List<CallSite> recursiveCalls) {
        if (recursiveCalls.size() == 1) {
            return IdiomSignatures.hasMidpointAssignment(body) ? RecursivePattern.BINARY_SEARCH : RecursivePattern.LINEAR;
        }

        boolean partition = IdiomSignatures.hasPartitionIdiom(body);
        // a base case in front of halving calls is divide and conquer, not fibonacci
        boolean simple = !AstWalker.containsLoop(body) && !partition && !hasHalvingCall(body, recursiveCalls);

        if (simple && IdiomSignatures.hasEarlyReturn(body)) {
            return RecursivePattern.FIBONACCI;
        }
        if (simple && recursiveCalls.size() == 2 && recursiveCalls.stream().allMatch(this::passesDecrement)) {
            return RecursivePattern.HANOI;
        }
        return partition ? RecursivePattern.QUICKSORT : RecursivePattern.MERGESORT;
    }

    private boolean hasHalvingCall(List<Statement> body, List<CallSite> recursiveCalls) {
        Map<String, Integer> halvingVariables = IdiomSignatures.halvingVariables(body);
        for (CallSite site : recursiveCalls) {
            if (IdiomSignatures.reductionOf(site, halvingVariables).getKind() == CallReduction.Kind.DIVIDE) {
                return true;
            }
        }
        return false;
    }

    private boolean passesDecrement(CallSite site) {
        for (Expression argument : site.getArguments()) {
            if (IdiomSignatures.subtractedLiteral(argument) > 0) {
                return true;
            }
        }
        return false;
    }
}
