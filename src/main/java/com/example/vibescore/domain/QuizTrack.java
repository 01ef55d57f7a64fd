package com.example.vibescore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum QuizTrack {
    @JsonProperty("code")
    CODE("code"),
    @JsonProperty("comment")
    COMMENT("comment");

    private final String label;

    QuizTrack(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
