package com.example.vibescore.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;
import java.util.Objects;

/**
 * A block of added comment prose together with the code lines that preceded it.
 */
public record CommentFragment(
        String filePath,
        List<String> commentLines,
        List<String> contextLines,
        String authorIdentity,
        @JsonIgnore boolean selfAuthored,
        @JsonIgnore String fingerprint)
        implements Fingerprinted {
    public static final int MIN_PROSE_LENGTH = 20;
    public static final int MAX_CONTEXT_LINES = 2;

    public CommentFragment {
        Objects.requireNonNull(filePath, "filePath");
        commentLines = List.copyOf(commentLines);
        contextLines = contextLines != null ? List.copyOf(contextLines) : List.of();
        if (!hasProse(commentLines)) {
            throw new IllegalArgumentException(
                    "Comment fragment needs a line longer than " + MIN_PROSE_LENGTH + " characters");
        }
        if (contextLines.size() > MAX_CONTEXT_LINES) {
            throw new IllegalArgumentException("At most " + MAX_CONTEXT_LINES + " context lines allowed");
        }
    }

    public static boolean hasProse(List<String> commentLines) {
        return commentLines.stream().anyMatch(line -> Whitespace.trim(line).length() > MIN_PROSE_LENGTH);
    }
}
