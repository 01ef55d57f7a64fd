package com.example.vibescore.domain;

import java.util.Objects;

/**
 * Where a fragment came from: file, author, change and whether the author is one of the user's
 * identities.
 */
public record FragmentOrigin(String filePath, String authorIdentity, String changeId, boolean selfAuthored) {
    public FragmentOrigin {
        Objects.requireNonNull(filePath, "filePath");
        Objects.requireNonNull(authorIdentity, "authorIdentity");
        Objects.requireNonNull(changeId, "changeId");
    }
}
