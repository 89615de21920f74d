package com.complexity.analyzer.analysis;

import com.complexity.analyzer.ast.Procedure;
import com.complexity.analyzer.ast.Program;
import com.complexity.analyzer.ast.Statement;

import java.util.ArrayList;
import java.util.List;

/**
 * A named body of statements: either a procedure or the program's main block.
 */
public final class ProgramUnit {

    public static final String DEFAULT_MAIN_NAME = "main";

    private final String name;
    private final List<Statement> body;
    private final boolean mainBlock;

    private ProgramUnit(String name, List<Statement> body, boolean mainBlock) {
        this.name = name;
        this.body = body;
        this.mainBlock = mainBlock;
    }

    public static ProgramUnit of(Procedure procedure) {
        return new ProgramUnit(procedure.getName(), procedure.getBody(), false);
    }

    /**
     * The main block, named after the {@code algorithm} header when there is one.
     */
    public static ProgramUnit mainBlock(Program program) {
        String name = program.getName() != null ? program.getName() : DEFAULT_MAIN_NAME;
        return new ProgramUnit(name, program.getBody(), true);
    }

    /**
     * @return every procedure in source order followed by the main block
     */
    public static List<ProgramUnit> allOf(Program program) {
        List<ProgramUnit> units = new ArrayList<>();
        for (Procedure procedure : program.getProcedures()) {
            units.add(of(procedure));
        }
        units.add(mainBlock(program));
        return units;
    }

    public String getName() {
        return name;
    }

    public List<Statement> getBody() {
        return body;
    }

    public boolean isMainBlock() {
        return mainBlock;
    }
}
