package com.complexity.analyzer.ast;

import java.util.List;

/**
 * A procedure call found in the tree, either a {@link CallStatement} or a {@link CallExpression}.
 */
public class CallSite {

    private final String name;
    private final List<Expression> arguments;
    private final int line;

    public CallSite(String name, List<Expression> arguments, int line) {
        this.name = name;
        this.arguments = List.copyOf(arguments);
        this.line = line;
    }

    public String getName() {
        return name;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public int getLine() {
        return line;
    }

    public boolean targets(String procedureName) {
        return name.equalsIgnoreCase(procedureName);
    }
}
