package com.complexity.analyzer.validation;

import com.complexity.analyzer.analysis.CallGraph;
import com.complexity.analyzer.ast.Procedure;
import com.complexity.analyzer.ast.Program;

import java.util.ArrayList;
import java.util.List;

/**
 * Warns about programs and procedures without statements.
 */
public class EmptyProgramValidator implements ProgramValidator {

    @Override
    public List<String> validate(Program program, CallGraph callGraph) {
        List<String> warnings = new ArrayList<>();
        if (program.getBody().isEmpty() && program.getProcedures().isEmpty()) {
            warnings.add("Program has no statements; the result is trivially constant.");
        }
        for (Procedure procedure : program.getProcedures()) {
            if (procedure.getBody().isEmpty()) {
                warnings.add("Procedure " + procedure.getName() + " at line " + procedure.getLine()
                        + " has an empty body.");
            }
        }
        return warnings;
    }
}
