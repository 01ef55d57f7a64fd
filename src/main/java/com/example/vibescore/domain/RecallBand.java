package com.example.vibescore.domain;

/**
 * Coarse reading of a single track score.
 */
public enum RecallBand {
    SHARP,
    TYPICAL,
    FORGETFUL,
    DETACHED;

    public static RecallBand forScore(int score) {
        if (score < 20) {
            return SHARP;
        }
        if (score < 50) {
            return TYPICAL;
        }
        if (score < 80) {
            return FORGETFUL;
        }
        return DETACHED;
    }
}
