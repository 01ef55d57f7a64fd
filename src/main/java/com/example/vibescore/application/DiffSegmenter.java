package com.example.vibescore.application;

import com.example.vibescore.domain.DiffLine;
import com.example.vibescore.domain.FileSegment;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits the unified diff of one change into per-file sections and keeps, for each source file,
 * the added lines plus the markers that separate them.
 */
@Component
public class DiffSegmenter {
    private static final Pattern FILE_SPLIT = Pattern.compile("(?m)(?=^diff --git )");
    private static final Pattern FILE_HEADER = Pattern.compile("^diff --git a/.+ b/(.+)$", Pattern.MULTILINE);

    private final SourceFileFilter sourceFileFilter;

    public DiffSegmenter(SourceFileFilter sourceFileFilter) {
        this.sourceFileFilter = sourceFileFilter;
    }

    public List<FileSegment> segment(String diff) {
        if (diff == null || diff.isBlank()) {
            return List.of();
        }
        List<FileSegment> segments = new ArrayList<>();
        for (String section : FILE_SPLIT.split(diff)) {
            String path = extractNewPath(section);
            if (path == null || !sourceFileFilter.isSourceFile(path)) {
                continue;
            }
            segments.add(new FileSegment(path, scanSection(section)));
        }
        return segments;
    }

    private String extractNewPath(String section) {
        if (!section.startsWith("diff --git ")) {
            return null;
        }
        Matcher matcher = FILE_HEADER.matcher(section);
        return matcher.find() ? matcher.group(1).trim() : null;
    }

    private List<DiffLine> scanSection(String section) {
        List<DiffLine> lines = new ArrayList<>();
        boolean inHunk = false;
        for (String rawLine : section.split("\\r?\\n")) {
            if (rawLine.startsWith("@@")) {
                inHunk = true;
                lines.add(DiffLine.hunkHeader());
                continue;
            }
            if (!inHunk) {
                continue;
            }
            if (rawLine.startsWith("+")) {
                if (rawLine.startsWith("+++")) {
                    continue;
                }
                lines.add(DiffLine.added(rawLine.substring(1)));
            } else if (rawLine.startsWith("-")) {
                lines.add(DiffLine.removed());
            } else if (rawLine.startsWith(" ")) {
                lines.add(DiffLine.context());
            }
            // anything else ("\ No newline at end of file") carries no content
        }
        return lines;
    }
}
