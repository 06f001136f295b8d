package com.asoaudit.combos.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TextUtilsTest {

    @Test
    public void lowercasesAndCollapsesSpaces() {
        assertEquals("pimsleur language learning", TextUtils.normalize("  Pimsleur   Language Learning "));
    }

    @Test
    public void keepsInnerHyphens() {
        assertEquals("step-by-step guide", TextUtils.normalize("Step-by-Step Guide!"));
    }

    @Test
    public void dropsDanglingHyphens() {
        assertEquals("learn spanish", TextUtils.normalize("- Learn - Spanish -"));
    }

    @Test
    public void dropsApostrophesInsideWords() {
        assertEquals("dont stop learning", TextUtils.normalize("Don't stop learning"));
    }

    @Test
    public void normalizesNonBreakingSpaces() {
        assertEquals("learn spanish", TextUtils.normalize("Learn\u00A0Spanish"));
    }

    @Test
    public void stripsPunctuation() {
        assertEquals("learn spanish french more", TextUtils.normalize("Learn: Spanish, French & More."));
    }

    @Test
    public void nullBecomesEmpty() {
        assertEquals("", TextUtils.normalize(null));
        assertEquals("", TextUtils.normalize("   "));
    }

    @Test
    public void blankDetection() {
        assertTrue(TextUtils.isBlank(null));
        assertTrue(TextUtils.isBlank(" \u00A0 "));
        assertFalse(TextUtils.isBlank(" a "));
    }

    @Test
    public void numericDetection() {
        assertTrue(TextUtils.isNumeric("2024"));
        assertFalse(TextUtils.isNumeric("v2"));
        assertFalse(TextUtils.isNumeric(""));
    }
}
