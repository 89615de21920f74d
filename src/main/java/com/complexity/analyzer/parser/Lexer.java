package com.complexity.analyzer.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns pseudocode source into position-tagged tokens.
 *
 * The lexer never rejects a character: anything it does not recognize becomes a
 * one-character symbol and is left for the parser to judge. Operator glyph variants
 * (assignment arrows, ≤, ≥, ≠) are normalized here so the parser only ever sees
 * canonical lexemes.
 */
public class Lexer {

    private static final Logger logger = LoggerFactory.getLogger(Lexer.class);

    public static final Set<String> RESERVED_WORDS = Set.of(
            "algorithm", "algoritmo", "procedure", "procedimiento", "function", "funcion",
            "begin", "end", "for", "to", "downto", "while", "repeat", "until",
            "if", "then", "else", "do", "and", "or", "not", "call", "length", "null",
            "class", "mod", "div", "return", "print", "true", "false", "new", "array",
            "swap", "with", "let", "declare", "returns");

    private static final int COMMENT_MARKER = '►';
    private static final int INFINITY = '∞';

    // Checked in order, so longer lexemes that share a prefix must come first
    private static final Map<String, String> MULTI_CHAR_SYMBOLS = new LinkedHashMap<>();
    private static final Map<Integer, String> GLYPH_SYMBOLS = Map.of(
            (int) '←', Token.ASSIGN,
            (int) '↨', Token.ASSIGN,
            Token.ASSIGN.codePointAt(0), Token.ASSIGN,
            (int) '≤', "<=",
            (int) '≥', ">=",
            (int) '≠', "<>");

    static {
        MULTI_CHAR_SYMBOLS.put("<=", "<=");
        MULTI_CHAR_SYMBOLS.put(">=", ">=");
        MULTI_CHAR_SYMBOLS.put("<>", "<>");
        MULTI_CHAR_SYMBOLS.put("!=", "<>");
        MULTI_CHAR_SYMBOLS.put("<-", Token.ASSIGN);
        MULTI_CHAR_SYMBOLS.put(":=", Token.ASSIGN);
        MULTI_CHAR_SYMBOLS.put("..", "..");
    }

    private final String source;
    private int position = 0;
    private int line = 1;
    private int column = 1;

    public Lexer(String source) {
        this.source = source == null ? "" : source;
    }

    /**
     * Tokenizes the whole source. The returned list always ends with an EOF token.
     *
     * @return the token stream
     * @throws LexerException if a string literal is not terminated
     */
    public List<Token> tokenize() throws LexerException {
        List<Token> tokens = new ArrayList<>();

        while (!atEnd()) {
            int current = peek();

            if (Character.isWhitespace(current) || Character.isSpaceChar(current)) {
                advance();
            } else if (current == COMMENT_MARKER) {
                skipComment();
            } else if (current == '"') {
                tokens.add(readString());
            } else if (Character.isDigit(current)) {
                tokens.add(readNumber());
            } else if (current == INFINITY) {
                tokens.add(new Token(TokenKind.IDENTIFIER, "infinity", line, column));
                advance();
            } else if (Character.isLetter(current) || current == '_') {
                tokens.add(readWord());
            } else {
                tokens.add(readSymbol());
            }
        }

        tokens.add(new Token(TokenKind.EOF, "", line, column));
        logger.trace("Tokenized {} tokens over {} lines", tokens.size(), line);
        return tokens;
    }

    private Token readWord() {
        int startLine = line;
        int startColumn = column;
        StringBuilder word = new StringBuilder();
        int length = 0;

        while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
            word.appendCodePoint(advance());
            length++;
        }

        // Single letters keep their case so A and a remain distinct variables
        if (length == 1) {
            return new Token(TokenKind.IDENTIFIER, word.toString(), startLine, startColumn);
        }

        String lowered = word.toString().toLowerCase(Locale.ROOT);
        TokenKind kind = RESERVED_WORDS.contains(lowered) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER;
        return new Token(kind, lowered, startLine, startColumn);
    }

    private Token readNumber() {
        int startLine = line;
        int startColumn = column;
        StringBuilder digits = new StringBuilder();
        while (!atEnd() && Character.isDigit(peek())) {
            digits.appendCodePoint(advance());
        }
        return new Token(TokenKind.NUMBER, digits.toString(), startLine, startColumn);
    }

    private Token readString() throws LexerException {
        int startLine = line;
        int startColumn = column;
        advance(); // opening quote

        StringBuilder value = new StringBuilder();
        while (!atEnd() && peek() != '"') {
            value.appendCodePoint(advance());
        }
        if (atEnd()) {
            throw new LexerException("Unterminated string literal", startLine, startColumn);
        }
        advance(); // closing quote
        return new Token(TokenKind.STRING, value.toString(), startLine, startColumn);
    }

    private Token readSymbol() {
        int startLine = line;
        int startColumn = column;

        for (Map.Entry<String, String> entry : MULTI_CHAR_SYMBOLS.entrySet()) {
            if (source.startsWith(entry.getKey(), position)) {
                for (int i = 0; i < entry.getKey().length(); i++) {
                    advance();
                }
                return new Token(TokenKind.SYMBOL, entry.getValue(), startLine, startColumn);
            }
        }

        int codePoint = advance();
        String lexeme = GLYPH_SYMBOLS.getOrDefault(codePoint, new String(Character.toChars(codePoint)));
        return new Token(TokenKind.SYMBOL, lexeme, startLine, startColumn);
    }

    private void skipComment() {
        while (!atEnd() && peek() != '\n') {
            advance();
        }
    }

    private boolean atEnd() {
        return position >= source.length();
    }

    private int peek() {
        return source.codePointAt(position);
    }

    private int advance() {
        int codePoint = source.codePointAt(position);
        position += Character.charCount(codePoint);
        if (codePoint == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return codePoint;
    }
}
