package com.complexity.analyzer.validation;

import com.complexity.analyzer.analysis.CallGraph;
import com.complexity.analyzer.ast.Program;

import java.util.List;

/**
 * A structural check that produces warnings. Validators never reject a program.
 */
public interface ProgramValidator {

    List<String> validate(Program program, CallGraph callGraph);
}
