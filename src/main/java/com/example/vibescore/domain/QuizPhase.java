package com.example.vibescore.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum QuizPhase {
    @JsonProperty("code")
    CODE,
    @JsonProperty("comment")
    COMMENT,
    @JsonProperty("finished")
    FINISHED
}
