package com.complexity.analyzer.ast;

import java.util.List;

public class Procedure extends Node {

    private final String name;
    private final List<Parameter> parameters;
    private final List<Statement> body;

    public Procedure(String name, List<Parameter> parameters, List<Statement> body, int line, int column) {
        super(line, column);
        this.name = name;
        this.parameters = List.copyOf(parameters);
        this.body = List.copyOf(body);
    }

    public String getName() {
        return name;
    }

    public List<Parameter> getParameters() {
        return parameters;
    }

    public List<Statement> getBody() {
        return body;
    }
}
