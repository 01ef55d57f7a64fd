package com.example.vibescore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Remember/Know style answer to "did you write this?".
 */
public enum ConfidenceLevel {
    /** Explicitly remembers writing it. */
    @JsonProperty("remember")
    REMEMBER,
    /** Looks familiar, probably theirs. */
    @JsonProperty("familiar")
    FAMILIAR,
    @JsonProperty("uncertain")
    UNCERTAIN,
    /** Sure somebody else wrote it. */
    @JsonProperty("foreign")
    FOREIGN;

    public boolean claimsOwnership() {
        return this == REMEMBER || this == FAMILIAR;
    }
}
