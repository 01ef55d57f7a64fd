package com.example.vibescore.domain;

public enum LineCategory {
    BOILERPLATE,
    COMMENT,
    NOISE,
    SUBSTANTIVE
}
