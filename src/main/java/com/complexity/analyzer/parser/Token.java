package com.complexity.analyzer.parser;

/**
 * A lexical token with the position of its first character.
 */
public class Token {

    /** Canonical assignment arrow every arrow variant is normalized to. */
    public static final String ASSIGN = "🡨";

    private final TokenKind kind;
    private final String lexeme;
    private final int line;
    private final int column;

    public Token(TokenKind kind, String lexeme, int line, int column) {
        this.kind = kind;
        this.lexeme = lexeme;
        this.line = line;
        this.column = column;
    }

    public TokenKind getKind() {
        return kind;
    }

    public String getLexeme() {
        return lexeme;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean is(TokenKind expectedKind, String expectedLexeme) {
        return kind == expectedKind && lexeme.equals(expectedLexeme);
    }

    public boolean isKeyword(String keyword) {
        return is(TokenKind.KEYWORD, keyword);
    }

    public boolean isSymbol(String symbol) {
        return is(TokenKind.SYMBOL, symbol);
    }

    @Override
    public String toString() {
        return kind + "('" + lexeme + "') at " + line + ":" + column;
    }
}
