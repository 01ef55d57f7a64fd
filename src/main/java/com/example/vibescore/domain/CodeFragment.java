package com.example.vibescore.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * A windowed code snippet taken from one change.
 */
public record CodeFragment(
        String filePath,
        List<String> lines,
        String authorIdentity,
        String changeId,
        @JsonIgnore boolean selfAuthored,
        @JsonIgnore String fingerprint)
        implements Fingerprinted {
    public static final int MIN_LINES = 4;
    public static final int MAX_LINES = 12;

    public CodeFragment {
        Objects.requireNonNull(filePath, "filePath");
        lines = List.copyOf(lines);
        if (lines.size() < MIN_LINES || lines.size() > MAX_LINES) {
            throw new IllegalArgumentException(
                    "Code fragment must have between " + MIN_LINES + " and " + MAX_LINES
                            + " lines but had " + lines.size());
        }
    }
}
