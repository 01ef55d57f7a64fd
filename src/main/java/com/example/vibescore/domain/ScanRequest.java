package com.example.vibescore.domain;

import java.util.Objects;
import java.util.Set;

/**
 * Identities the user claims as their own, as {@code name|email} keys.
 */
public record ScanRequest(Set<String> selfIdentities) {
    public ScanRequest {
        Objects.requireNonNull(selfIdentities, "selfIdentities");
        if (selfIdentities.isEmpty()) {
            throw new IllegalArgumentException("At least one identity must be selected");
        }
        selfIdentities = Set.copyOf(selfIdentities);
    }

    public boolean isSelf(String identityKey) {
        return selfIdentities.contains(identityKey);
    }
}
