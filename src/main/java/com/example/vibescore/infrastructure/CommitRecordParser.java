package com.example.vibescore.infrastructure;

import com.example.vibescore.domain.ChangeRecord;

import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;

/**
 * Parses {@code name|email|unixSeconds|subject} records; the subject may itself contain the
 * delimiter.
 */
final class CommitRecordParser {
    private static final String DELIMITER = "|";

    private CommitRecordParser() {}

    static ChangeRecord parse(String changeId, String record) throws IOException {
        if (record == null || record.isBlank()) {
            throw new IOException("Empty metadata for change " + changeId);
        }
        String[] parts = record.strip().split("\\|", -1);
        String name = parts[0];
        String email = parts.length > 1 ? parts[1] : "";
        String seconds = parts.length > 2 ? parts[2].trim() : "";
        String message = parts.length > 3 ? String.join(DELIMITER, Arrays.copyOfRange(parts, 3, parts.length)) : "";

        Instant timestamp;
        try {
            timestamp = seconds.isEmpty() ? Instant.EPOCH : Instant.ofEpochSecond(Long.parseLong(seconds));
        } catch (NumberFormatException e) {
            throw new IOException("Invalid timestamp '" + seconds + "' for change " + changeId, e);
        }
        return new ChangeRecord(changeId, name, email, timestamp, message);
    }
}
