package com.complexity.analyzer.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GrammarRulesTest {

    @Test
    void everyStatementKindHasAProduction() {
        for (String rule : new String[] {"for", "while", "repeat", "if", "call", "assignment", "return"}) {
            assertTrue(GrammarRules.productions().containsKey(rule), rule);
        }
    }

    @Test
    void reservedWordsAreSorted() {
        List<String> words = GrammarRules.reservedWords();
        assertEquals(Lexer.RESERVED_WORDS.size(), words.size());
        assertEquals("algorithm", words.get(0));
        assertEquals("algoritmo", words.get(1));
    }

    @Test
    void markdownListsAssignmentSpellings() {
        String markdown = GrammarRules.toMarkdown();
        assertTrue(markdown.startsWith("# Pseudocode grammar"));
        assertTrue(markdown.contains("`ASSIGN`: " + Token.ASSIGN));
        assertTrue(markdown.contains(":="));
    }
}
