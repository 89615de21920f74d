package com.complexity.analyzer.parser;

public enum TokenKind {
    IDENTIFIER,
    NUMBER,
    KEYWORD,
    SYMBOL,
    STRING,
    EOF
}
