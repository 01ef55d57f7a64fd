package com.example.vibescore.domain;

import com.fasterxml.jackson.annotation.JsonFormat;

@JsonFormat(shape = JsonFormat.Shape.OBJECT)
public enum VibeRating {
    CODE_ARTISAN(10, "Code Artisan", "Every line you wrote is still in your head."),
    TRADITIONAL_PROGRAMMER(25, "Traditional Programmer", "You remember variable names the old-fashioned way."),
    HYBRID_DEVELOPER(40, "Hybrid Developer", "A pragmatic balance between your own memory and assistance."),
    VIBE_CODER(55, "Vibe Coder", "Writing code like dreaming: you wake up remembering the gist."),
    AI_COLLABORATION_MASTER(70, "AI Collaboration Master", "You own the requirements, something else owns the implementation."),
    PROMPT_ENGINEER(85, "Prompt Engineer", "Code is a by-product of well-phrased questions."),
    HUMAN_COPILOT(99, "Human Copilot", "You can no longer tell which lines were yours."),
    AI_PUPPET(100, "AI Puppet", "Code just flows through your fingers.");

    private final int upperBound;
    private final String title;
    private final String description;

    VibeRating(int upperBound, String title, String description) {
        this.upperBound = upperBound;
        this.title = title;
        this.description = description;
    }

    public static VibeRating forScore(int score) {
        for (VibeRating rating : values()) {
            if (score <= rating.upperBound) {
                return rating;
            }
        }
        return AI_PUPPET;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }
}
