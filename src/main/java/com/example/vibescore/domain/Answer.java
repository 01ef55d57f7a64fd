package com.example.vibescore.domain;

import java.util.Objects;

public record Answer(ConfidenceLevel confidenceLevel, boolean selfAuthored) {
    public Answer {
        Objects.requireNonNull(confidenceLevel, "confidenceLevel");
    }
}
