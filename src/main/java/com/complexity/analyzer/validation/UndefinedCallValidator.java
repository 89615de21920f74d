package com.complexity.analyzer.validation;

import com.complexity.analyzer.analysis.CallGraph;
import com.complexity.analyzer.ast.Program;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Warns about calls to procedures the program does not define. Such calls are costed as
 * constant, which may understate the complexity.
 */
public class UndefinedCallValidator implements ProgramValidator {

    /** Names treated as primitive operations. */
    public static final Set<String> BUILTINS = Set.of("swap", "self", "min", "max", "abs", "floor", "ceil", "sqrt");

    @Override
    public List<String> validate(Program program, CallGraph callGraph) {
        List<String> warnings = new ArrayList<>();
        for (String callee : callGraph.getUndefinedCallees()) {
            // obj.method(...) calls cannot be resolved against procedures
            if (BUILTINS.contains(callee) || callee.contains(".")) {
                continue;
            }
            warnings.add("Call to undefined procedure '" + callee + "' is costed as constant.");
        }
        return warnings;
    }
}
