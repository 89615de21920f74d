package com.complexity.analyzer.parser;

public class ParserException extends SyntaxException {

    public ParserException(String detail, Token token) {
        super(detail + ", found " + describe(token), token.getLine(), token.getColumn());
    }

    public ParserException(String detail, int line, int column) {
        super(detail, line, column);
    }

    private static String describe(Token token) {
        if (token.getKind() == TokenKind.EOF) {
            return "end of input";
        }
        return "'" + token.getLexeme() + "'";
    }
}
