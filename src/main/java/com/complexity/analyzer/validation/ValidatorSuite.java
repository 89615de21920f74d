package com.complexity.analyzer.validation;

import com.complexity.analyzer.analysis.CallGraph;
import com.complexity.analyzer.analysis.CallGraphBuilder;
import com.complexity.analyzer.ast.Program;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every registered validator over a program and collects their warnings in order.
 */
public class ValidatorSuite {

    private static final Logger logger = LoggerFactory.getLogger(ValidatorSuite.class);

    private final CallGraphBuilder callGraphBuilder;
    private final List<ProgramValidator> validators;

    public ValidatorSuite() {
        this(List.of(new EmptyProgramValidator(), new UndefinedCallValidator(), new MutualRecursionValidator()));
    }

    public ValidatorSuite(List<ProgramValidator> validators) {
        this.callGraphBuilder = new CallGraphBuilder();
        this.validators = List.copyOf(validators);
    }

    public List<String> validate(Program program) {
        CallGraph callGraph = callGraphBuilder.build(program);
        List<String> warnings = new ArrayList<>();
        for (ProgramValidator validator : validators) {
            warnings.addAll(validator.validate(program, callGraph));
        }
        if (!warnings.isEmpty()) {
            logger.debug("{} validation warnings: {}", warnings.size(), warnings);
        }
        return warnings;
    }
}
