package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.Token;
import com.asoaudit.combos.model.TokenSource;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class TokenizerTest {

    private static List<String> texts(List<Token> tokens) {
        return tokens.stream().map(Token::getText).collect(Collectors.toList());
    }

    @Test
    public void dropsStopwordsAndKeepsFilteredPositions() {
        List<Token> tokens = new Tokenizer().tokenize("Learn Spanish and French", TokenSource.SUBTITLE);
        assertEquals(List.of("learn", "spanish", "french"), texts(tokens));
        assertEquals(0, tokens.get(0).getPosition());
        assertEquals(1, tokens.get(1).getPosition());
        assertEquals(2, tokens.get(2).getPosition());
        assertTrue(tokens.stream().allMatch(t -> t.getSource() == TokenSource.SUBTITLE));
        assertTrue(tokens.stream().noneMatch(Token::isStopword));
    }

    @Test
    public void stripsPunctuationAndArticles() {
        List<Token> tokens = new Tokenizer().tokenize("The Best App: Learn a Language", TokenSource.TITLE);
        assertEquals(List.of("best", "app", "learn", "language"), texts(tokens));
    }

    @Test
    public void dropsSingleCharacterWords() {
        List<Token> tokens = new Tokenizer().tokenize("x y spanish", TokenSource.TITLE);
        assertEquals(List.of("spanish"), texts(tokens));
    }

    @Test
    public void emptyInputYieldsNoTokens() {
        Tokenizer tokenizer = new Tokenizer();
        assertTrue(tokenizer.tokenize(null, TokenSource.TITLE).isEmpty());
        assertTrue(tokenizer.tokenize("", TokenSource.TITLE).isEmpty());
        assertTrue(tokenizer.tokenize(" \u00A0 ", TokenSource.TITLE).isEmpty());
    }

    @Test
    public void customStopwordsReplaceDefaults() {
        Tokenizer tokenizer = new Tokenizer(List.of("Learn"));
        List<Token> tokens = tokenizer.tokenize("learn spanish and french", TokenSource.SUBTITLE);
        assertEquals(List.of("spanish", "and", "french"), texts(tokens));
    }

    @Test
    public void tokenizeAllFlagsStopwords() {
        List<Token> tokens = new Tokenizer().tokenizeAll("Learn the Spanish", TokenSource.TITLE);
        assertEquals(3, tokens.size());
        assertEquals(0, tokens.get(0).getPosition());
        assertTrue(tokens.get(1).isStopword());
        assertEquals(-1, tokens.get(1).getPosition());
        assertEquals("spanish", tokens.get(2).getText());
        assertEquals(1, tokens.get(2).getPosition());
    }

    @Test
    public void keywordFieldSplitsOnCommas() {
        List<Token> tokens = new Tokenizer().parseKeywordField("spanish,french lessons,,audio");
        assertEquals(List.of("spanish", "french", "lessons", "audio"), texts(tokens));
        assertTrue(tokens.stream().allMatch(t -> t.getSource() == TokenSource.KEYWORDS));
        assertTrue(new Tokenizer().parseKeywordField(null).isEmpty());
    }
}
