package com.complexity.analyzer.validation;

import com.complexity.analyzer.analysis.CallGraph;
import com.complexity.analyzer.ast.Program;

import java.util.ArrayList;
import java.util.List;

/**
 * Warns about procedures that reach themselves only through other procedures. The extractor
 * follows direct self-calls, so such cycles are missing from the recurrence.
 */
public class MutualRecursionValidator implements ProgramValidator {

    @Override
    public List<String> validate(Program program, CallGraph callGraph) {
        List<String> warnings = new ArrayList<>();
        for (String unit : callGraph.getDefinedUnits()) {
            if (callGraph.isMutuallyRecursive(unit)) {
                warnings.add("Procedure " + unit + " is mutually recursive; the recurrence only follows direct self-calls.");
            }
        }
        return warnings;
    }
}
