package com.complexity.analyzer.parser;

public class LexerException extends SyntaxException {

    public LexerException(String detail, int line, int column) {
        super(detail, line, column);
    }
}
