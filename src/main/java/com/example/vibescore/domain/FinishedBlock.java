package com.example.vibescore.domain;

import java.util.List;
import java.util.Objects;

/**
 * A closed run of code or comment lines. Only comment blocks carry context lines.
 */
public record FinishedBlock(Kind kind, List<String> lines, List<String> context) {
    public FinishedBlock {
        Objects.requireNonNull(kind, "kind");
        lines = List.copyOf(lines);
        context = context != null ? List.copyOf(context) : List.of();
    }

    public static FinishedBlock code(List<String> lines) {
        return new FinishedBlock(Kind.CODE, lines, List.of());
    }

    public static FinishedBlock comment(List<String> lines, List<String> context) {
        return new FinishedBlock(Kind.COMMENT, lines, context);
    }

    public enum Kind {
        CODE,
        COMMENT
    }
}
