package com.complexity.analyzer.ast;

/**
 * A procedure parameter. The annotation keeps array shape hints such as {@code [1..n]}.
 */
public class Parameter extends Node {

    private final String name;
    private final String annotation;

    public Parameter(String name, String annotation, int line, int column) {
        super(line, column);
        this.name = name;
        this.annotation = annotation;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the raw array annotation, or null if the parameter had none
     */
    public String getAnnotation() {
        return annotation;
    }
}
