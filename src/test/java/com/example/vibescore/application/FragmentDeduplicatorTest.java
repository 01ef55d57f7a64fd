package com.example.vibescore.application;

import com.example.vibescore.domain.CodeFragment;
import com.example.vibescore.domain.Fingerprinted;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FragmentDeduplicatorTest {

    private final FragmentDeduplicator deduplicator = new FragmentDeduplicator();

    @Test
    void identicalContentKeepsOneSurvivor() {
        List<String> lines = List.of("int a = load();", "int b = load();", "int c = a + b;", "store(c);");
        CodeFragment first = fragment("A.java", lines);
        CodeFragment second = fragment("B.java", lines);

        List<CodeFragment> result = deduplicator.deduplicate(List.of(first, second));

        assertThat(result).containsExactly(first);
    }

    @Test
    void whitespaceDifferencesCollapseToOne() {
        CodeFragment tight = fragment("A.java", List.of("int a = load();", "int b = load();", "int c = a + b;", "store(c);"));
        CodeFragment loose =
                fragment(
                        "B.java",
                        List.of("    int a  =  load();", "\tint b = load();", "int c = a + b;   ", "  store(c);"));

        assertEquals(1, deduplicator.deduplicate(List.of(tight, loose)).size());
    }

    @Test
    void exactlyEightyPercentIsKept() {
        assertFalse(deduplicator.isDuplicate("abcdefghij", "abcdefghXY"));
        assertTrue(deduplicator.isDuplicate("abcdefghij", "abcdefghiY"));
    }

    @Test
    void emptyFingerprintOnlyMatchesItself() {
        assertFalse(deduplicator.isDuplicate("", "abc"));
        assertTrue(deduplicator.isDuplicate("", ""));
    }

    @Test
    void firstOccurrenceWinsAndOrderIsPreserved() {
        List<Fingerprinted> fragments =
                List.of(() -> "alpha beta gamma", () -> "completely different", () -> "alpha beta gammA");

        List<Fingerprinted> result = deduplicator.deduplicate(fragments);

        assertThat(result).extracting(Fingerprinted::fingerprint).containsExactly("alpha beta gamma", "completely different");
    }

    @Test
    void deduplicationIsIdempotent() {
        List<Fingerprinted> fragments = List.of(() -> "one", () -> "one", () -> "two");

        List<Fingerprinted> once = deduplicator.deduplicate(fragments);

        assertEquals(once, deduplicator.deduplicate(once));
    }

    private static CodeFragment fragment(String path, List<String> lines) {
        return new CodeFragment(path, lines, "me|me@example.com", "abc1234", true, Fingerprints.of(lines));
    }
}
