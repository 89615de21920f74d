package com.complexity.analyzer.ast;

import java.util.List;

/**
 * Root of a parsed pseudocode unit.
 */
public class Program extends Node {

    private final String name;
    private final List<ClassDefinition> classDefinitions;
    private final List<Declaration> declarations;
    private final List<Procedure> procedures;
    private final List<Statement> body;

    public Program(String name, List<ClassDefinition> classDefinitions, List<Declaration> declarations,
                   List<Procedure> procedures, List<Statement> body) {
        super(1, 1);
        this.name = name;
        this.classDefinitions = List.copyOf(classDefinitions);
        this.declarations = List.copyOf(declarations);
        this.procedures = List.copyOf(procedures);
        this.body = List.copyOf(body);
    }

    /**
     * @return the name from an {@code algorithm NAME} header, or null when the unit has none
     */
    public String getName() {
        return name;
    }

    public List<ClassDefinition> getClassDefinitions() {
        return classDefinitions;
    }

    public List<Declaration> getDeclarations() {
        return declarations;
    }

    public List<Procedure> getProcedures() {
        return procedures;
    }

    public List<Statement> getBody() {
        return body;
    }

    /**
     * Looks up a procedure by name, ignoring case.
     *
     * @param procedureName the name to look for
     * @return the procedure, or null if none is defined
     */
    public Procedure findProcedure(String procedureName) {
        for (Procedure procedure : procedures) {
            if (procedure.getName().equalsIgnoreCase(procedureName)) {
                return procedure;
            }
        }
        return null;
    }

    public boolean isProceduresOnly() {
        return body.isEmpty() && !procedures.isEmpty();
    }
}
