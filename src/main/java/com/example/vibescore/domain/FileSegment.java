package com.example.vibescore.domain;

import java.util.List;
import java.util.Objects;

/**
 * The retained lines of one file section of a unified diff.
 */
public record FileSegment(String path, List<DiffLine> lines) {
    public FileSegment {
        Objects.requireNonNull(path, "path");
        lines = List.copyOf(lines);
    }
}
