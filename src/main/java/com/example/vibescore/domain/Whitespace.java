package com.example.vibescore.domain;

import java.util.regex.Pattern;

/**
 * Whitespace handling that also covers Unicode spaces such as U+00A0, U+3000 and U+FEFF.
 */
public final class Whitespace {
    private static final Pattern RUN = Pattern.compile("[\\s\\uFEFF]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern EDGES =
            Pattern.compile("^[\\s\\uFEFF]+|[\\s\\uFEFF]+$", Pattern.UNICODE_CHARACTER_CLASS);

    private Whitespace() {}

    public static String trim(String text) {
        return text == null ? "" : EDGES.matcher(text).replaceAll("");
    }

    /** Replaces every whitespace run with a single space, then trims. */
    public static String collapse(String text) {
        return text == null ? "" : RUN.matcher(text).replaceAll(" ").trim();
    }

    public static boolean isBlank(String text) {
        return trim(text).isEmpty();
    }
}
