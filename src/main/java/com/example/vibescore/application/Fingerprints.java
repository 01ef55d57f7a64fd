package com.example.vibescore.application;

import com.example.vibescore.domain.Whitespace;

import java.util.List;

/**
 * Normalized, truncated content digests used to spot repeated fragments.
 */
public final class Fingerprints {
    public static final int MAX_LENGTH = 200;

    private Fingerprints() {}

    public static String of(List<String> lines) {
        String collapsed = Whitespace.collapse(String.join("\n", lines));
        return collapsed.length() > MAX_LENGTH ? collapsed.substring(0, MAX_LENGTH) : collapsed;
    }

    /**
     * Share of positions, over the shorter fingerprint, holding the same character in both.
     * Returns 0 when either fingerprint is empty.
     */
    public static double positionalMatchRatio(String a, String b) {
        int minLength = Math.min(a.length(), b.length());
        if (minLength == 0) {
            return 0.0;
        }
        int same = 0;
        for (int i = 0; i < minLength; i++) {
            if (a.charAt(i) == b.charAt(i)) {
                same++;
            }
        }
        return (double) same / minLength;
    }
}
