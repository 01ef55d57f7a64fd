package com.example.vibescore.domain;

/**
 * One line of a file section that survived segmentation. Added lines carry their text with the
 * {@code +} marker stripped; the other kinds only mark boundaries.
 */
public record DiffLine(Kind kind, String text) {
    private static final DiffLine HUNK_HEADER = new DiffLine(Kind.HUNK_HEADER, "");
    private static final DiffLine CONTEXT = new DiffLine(Kind.CONTEXT, "");
    private static final DiffLine REMOVED = new DiffLine(Kind.REMOVED, "");

    public static DiffLine added(String text) {
        return new DiffLine(Kind.ADDED, text);
    }

    public static DiffLine hunkHeader() {
        return HUNK_HEADER;
    }

    public static DiffLine context() {
        return CONTEXT;
    }

    public static DiffLine removed() {
        return REMOVED;
    }

    public enum Kind {
        HUNK_HEADER,
        ADDED,
        CONTEXT,
        REMOVED
    }
}
