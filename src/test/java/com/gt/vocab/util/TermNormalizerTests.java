package com.gt.vocab.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class TermNormalizerTests {

    @Test
    public void testNormalize() {
        assertEquals("take off", TermNormalizer.normalize("  Take   Off "));
        assertEquals("hello", TermNormalizer.normalize("...Hello!!"));
        assertEquals("rock 'n' roll", TermNormalizer.normalize("Rock 'n' Roll"));
        assertEquals("well-known", TermNormalizer.normalize("\"Well-Known\""));
        assertEquals("café", TermNormalizer.normalize("Café"));
        assertEquals("a b", TermNormalizer.normalize("__a \t b__"));
    }

    @Test
    public void testNormalize_empty() {
        assertEquals("", TermNormalizer.normalize(null));
        assertEquals("", TermNormalizer.normalize("   "));
        assertEquals("", TermNormalizer.normalize("?!_"));
    }

    @Test
    public void testNormalize_idempotent() {
        String once = TermNormalizer.normalize(" -- Give  UP! ");

        assertEquals("give up", once);
        assertEquals(once, TermNormalizer.normalize(once));
    }
}
