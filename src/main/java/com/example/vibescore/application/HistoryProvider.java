package com.example.vibescore.application;

import com.example.vibescore.domain.ChangeRecord;

import java.io.IOException;
import java.util.List;

/**
 * Read-only access to the version-control history the quiz is built from.
 */
public interface HistoryProvider {

    /**
     * @throws RepositoryUnavailableException if no repository exists at the working location
     */
    void verifyRepository();

    /** {@code name|email} of the author of each of the most recent changes, newest first. */
    List<String> listAuthorRecords(int maxChanges) throws IOException;

    /** Ids of the most recent changes, newest first. */
    List<String> listChangeIds(int maxChanges) throws IOException;

    ChangeRecord loadChange(String changeId) throws IOException;

    /** Unified diff of the files added or modified by the change. */
    String loadDiff(String changeId) throws IOException;
}
