package com.example.vibescore.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * Metadata of one historical change as reported by the history provider.
 */
public record ChangeRecord(
        String changeId, String authorName, String authorEmail, Instant timestamp, String message) {
    public ChangeRecord {
        Objects.requireNonNull(changeId, "changeId");
        Objects.requireNonNull(timestamp, "timestamp");
        authorName = authorName != null ? authorName : "";
        authorEmail = authorEmail != null ? authorEmail : "";
        message = message != null ? message : "";
    }

    public String identityKey() {
        return Identity.keyOf(authorName, authorEmail);
    }

    public String shortId() {
        return changeId.length() > 7 ? changeId.substring(0, 7) : changeId;
    }
}
