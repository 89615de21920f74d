package com.complexity.analyzer.parser;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static List<Token> lex(String source) throws LexerException {
        return new Lexer(source).tokenize();
    }

    private static List<String> lexemes(String source) throws LexerException {
        return lex(source).stream().map(Token::getLexeme).collect(Collectors.toList());
    }

    @Test
    void emptySourceYieldsOnlyEof() throws Exception {
        List<Token> tokens = lex("");
        assertEquals(1, tokens.size());
        assertEquals(TokenKind.EOF, tokens.get(0).getKind());
    }

    @Test
    void everyAssignmentSpellingBecomesTheCanonicalArrow() throws Exception {
        for (String operator : List.of("🡨", "←", "<-", ":=")) {
            List<Token> tokens = lex("x " + operator + " 1");
            assertEquals(4, tokens.size(), "x, assign, 1, EOF for " + operator);
            assertEquals(TokenKind.SYMBOL, tokens.get(1).getKind());
            assertEquals(Token.ASSIGN, tokens.get(1).getLexeme(), operator);
        }
    }

    @Test
    void comparisonGlyphsAreNormalized() throws Exception {
        assertEquals(List.of("a", "<=", "b", ""), lexemes("a ≤ b"));
        assertEquals(List.of("a", ">=", "b", ""), lexemes("a ≥ b"));
        assertEquals(List.of("a", "<>", "b", ""), lexemes("a != b"));
        assertEquals(List.of("a", "<>", "b", ""), lexemes("a ≠ b"));
    }

    @Test
    void keywordsAreCaseInsensitive() throws Exception {
        List<Token> tokens = lex("BEGIN While End");
        assertEquals(TokenKind.KEYWORD, tokens.get(0).getKind());
        assertEquals("begin", tokens.get(0).getLexeme());
        assertEquals("while", tokens.get(1).getLexeme());
        assertEquals("end", tokens.get(2).getLexeme());
    }

    @Test
    void singleLetterIdentifiersKeepTheirCase() throws Exception {
        assertEquals(List.of("A", "a", "total", ""), lexemes("A a Total"));
    }

    @Test
    void commentsRunToEndOfLine() throws Exception {
        List<Token> tokens = lex("x 🡨 1 ► the counter\ny");
        assertEquals(List.of("x", Token.ASSIGN, "1", "y", ""),
                tokens.stream().map(Token::getLexeme).collect(Collectors.toList()));
        assertEquals(2, tokens.get(3).getLine());
        assertEquals(1, tokens.get(3).getColumn());
    }

    @Test
    void rangeOperatorIsOneToken() throws Exception {
        assertEquals(List.of("A", "[", "1", "..", "mid", "]", ""), lexemes("A[1..mid]"));
    }

    @Test
    void stringLiteralsDropTheirQuotes() throws Exception {
        List<Token> tokens = lex("print \"done\"");
        assertEquals(TokenKind.STRING, tokens.get(1).getKind());
        assertEquals("done", tokens.get(1).getLexeme());
    }

    @Test
    void unterminatedStringIsRejected() {
        LexerException e = assertThrows(LexerException.class, () -> lex("print \"oops"));
        assertEquals(1, e.getLine());
        assertEquals(7, e.getColumn());
    }
}
