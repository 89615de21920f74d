package com.complexity.analyzer.ast;

import java.util.List;

public class ClassDefinition extends Node {

    private final String name;
    private final List<String> attributes;

    public ClassDefinition(String name, List<String> attributes, int line, int column) {
        super(line, column);
        this.name = name;
        this.attributes = List.copyOf(attributes);
    }

    public String getName() {
        return name;
    }

    public List<String> getAttributes() {
        return attributes;
    }
}
