package com.example.vibescore.application;

import com.example.vibescore.domain.QuizTrack;

public class InsufficientMaterialException extends ScanAbortedException {
    private final QuizTrack track;
    private final int available;
    private final int required;

    public InsufficientMaterialException(QuizTrack track, int available, int required) {
        super(String.format(
                "Only %d %s question(s) could be assembled, at least %d are needed. "
                        + "More commit history is required to run the quiz.",
                available, track.label(), required));
        this.track = track;
        this.available = available;
        this.required = required;
    }

    public QuizTrack getTrack() {
        return track;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
