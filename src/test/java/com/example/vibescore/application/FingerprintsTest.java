package com.example.vibescore.application;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class FingerprintsTest {

    @Test
    void collapsesWhitespaceAcrossLines() {
        String fingerprint = Fingerprints.of(List.of("  if (ready)  {", "\treturn   value;", "}  "));

        assertEquals("if (ready) { return value; }", fingerprint);
    }

    @Test
    void unicodeSpacesCollapseLikeAsciiSpaces() {
        String ascii = Fingerprints.of(List.of("int total = a + b;"));
        String wide = Fingerprints.of(List.of("int  total\u3000=\u3000a + b;\u3000"));
        String nonBreaking = Fingerprints.of(List.of("\u00A0int total\u00A0= a +\uFEFFb;"));

        assertEquals(ascii, wide);
        assertEquals(ascii, nonBreaking);
    }

    @Test
    void truncatesToTwoHundredCharacters() {
        String fingerprint = Fingerprints.of(List.of("x".repeat(500)));

        assertEquals(Fingerprints.MAX_LENGTH, fingerprint.length());
    }

    @Test
    void matchRatioIsMeasuredOverTheShorterFingerprint() {
        assertEquals(1.0, Fingerprints.positionalMatchRatio("abcd", "abcdefgh"));
        assertEquals(0.5, Fingerprints.positionalMatchRatio("abcd", "abXY"));
        assertEquals(0.0, Fingerprints.positionalMatchRatio("", "abc"));
    }
}
