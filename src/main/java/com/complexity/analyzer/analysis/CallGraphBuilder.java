package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.AstWalker;
import com.complexity.analyzer.ast.CallSite;
import com.complexity.analyzer.ast.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds a {@link CallGraph} from every procedure and the main block of a program.
 */
public class CallGraphBuilder {

    private static final Logger logger = LoggerFactory.getLogger(CallGraphBuilder.class);

    public CallGraph build(Program program) {
        CallGraph callGraph = new CallGraph();

        for (ProgramUnit unit : ProgramUnit.allOf(program)) {
            if (unit.isMainBlock() && unit.getBody().isEmpty()) {
                continue;
            }
            callGraph.addUnit(unit.getName());
        }

        for (ProgramUnit unit : ProgramUnit.allOf(program)) {
            for (CallSite site : AstWalker.callSites(unit.getBody())) {
                callGraph.addCall(unit.getName(), site.getName());
                logger.trace("{} calls {} at line {}", unit.getName(), site.getName(), site.getLine());
            }
        }

        logger.debug("Call graph built: {}", callGraph.getStatistics());
        return callGraph;
    }
}
