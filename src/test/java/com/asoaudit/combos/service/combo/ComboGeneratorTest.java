package com.asoaudit.combos.service.combo;

import com.asoaudit.combos.model.Token;
import com.asoaudit.combos.model.TokenSource;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ComboGeneratorTest {

    private final Tokenizer tokenizer = new Tokenizer();

    private List<Token> title(String text) { return tokenizer.tokenize(text, TokenSource.TITLE); }
    private List<Token> subtitle(String text) { return tokenizer.tokenize(text, TokenSource.SUBTITLE); }

    @Test
    public void enumeratesInUniverseOrder() {
        List<CandidateCombo> combos = new ComboGenerator(1500)
                .generateCombos(title("alpha beta gamma"), List.of(), List.of());
        List<String> texts = combos.stream().map(CandidateCombo::text).collect(Collectors.toList());
        assertEquals(List.of("alpha beta", "alpha gamma", "beta gamma", "alpha beta gamma"), texts);
    }

    @Test
    public void deduplicatesWordsAcrossElements() {
        List<String> universe = ComboGenerator.universe(
                title("learn spanish"), subtitle("spanish french"), List.of(), List.of());
        assertEquals(List.of("learn", "spanish", "french"), universe);
        List<CandidateCombo> combos = new ComboGenerator(1500)
                .generateCombos(title("learn spanish"), subtitle("spanish french"), List.of());
        assertEquals(4, combos.size());
    }

    @Test
    public void canonicalKeyIsSortedButKeywordsKeepOrder() {
        CandidateCombo c = CandidateCombo.of(List.of("spanish", "learn"));
        assertEquals("learn spanish", c.canonicalKey());
        assertEquals("spanish learn", c.text());
    }

    @Test
    public void producesUniqueCombosOfTwoToFourWords() {
        List<CandidateCombo> combos = new ComboGenerator(1500)
                .generateCombos(title("one two three"), subtitle("four five six"), List.of());
        assertEquals(15 + 20 + 15, combos.size());
        Set<String> texts = new HashSet<>();
        for (CandidateCombo c : combos) {
            assertTrue(c.length() >= 2 && c.length() <= 4);
            assertTrue(texts.add(c.text()), "duplicate " + c.text());
        }
    }

    @Test
    public void candidateCountMatchesBinomials() {
        assertEquals(0, ComboGenerator.candidateCount(0));
        assertEquals(0, ComboGenerator.candidateCount(1));
        assertEquals(1, ComboGenerator.candidateCount(2));
        assertEquals(11, ComboGenerator.candidateCount(4));
        assertEquals(25, ComboGenerator.candidateCount(5));
        assertEquals(45 + 120 + 210, ComboGenerator.candidateCount(10));
    }

    @Test
    public void rejectsUniverseAboveCeiling() {
        ComboGenerator generator = new ComboGenerator(10);
        ComboCapacityExceededException ex = assertThrows(ComboCapacityExceededException.class,
                () -> generator.generateCombos(title("one two three four"), List.of(), List.of()));
        assertEquals(11, ex.getRequested());
        assertEquals(10, ex.getLimit());
    }

    @Test
    public void ceilingIsInclusive() {
        assertEquals(11, new ComboGenerator(11)
                .generateCombos(title("one two three four"), List.of(), List.of()).size());
    }

    @Test
    public void seedWordsFollowTheElements() {
        List<Token> seeds = tokenizer.parseKeywordField("german, learn");
        List<String> universe = ComboGenerator.universe(title("learn spanish"), List.of(), List.of(), seeds);
        assertEquals(List.of("learn", "spanish", "german"), universe);
    }
}
