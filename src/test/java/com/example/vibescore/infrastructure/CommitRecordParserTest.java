package com.example.vibescore.infrastructure;

import com.example.vibescore.domain.ChangeRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CommitRecordParserTest {

    @Test
    void subjectContainingDelimiterIsReassembled() throws IOException {
        ChangeRecord record =
                CommitRecordParser.parse("abc", "Ada Lovelace|ada@example.com|1700000000|Fix a|b parsing | again");

        assertEquals("Ada Lovelace", record.authorName());
        assertEquals("ada@example.com", record.authorEmail());
        assertEquals(Instant.ofEpochSecond(1_700_000_000L), record.timestamp());
        assertEquals("Fix a|b parsing | again", record.message());
        assertEquals("Ada Lovelace|ada@example.com", record.identityKey());
    }

    @Test
    void missingFieldsFallBackToDefaults() throws IOException {
        ChangeRecord record = CommitRecordParser.parse("abc", "Ada|ada@example.com|");

        assertEquals(Instant.EPOCH, record.timestamp());
        assertEquals("", record.message());
    }

    @Test
    void malformedTimestampIsAnIoFailure() {
        IOException e =
                assertThrows(IOException.class, () -> CommitRecordParser.parse("abc", "Ada|ada@x|yesterday|msg"));

        assertEquals(NumberFormatException.class, e.getCause().getClass());
    }

    @Test
    void blankRecordIsAnIoFailure() {
        assertThrows(IOException.class, () -> CommitRecordParser.parse("abc", "  "));
    }
}
