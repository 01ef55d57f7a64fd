package com.example.vibescore.domain;

/**
 * Tallies and score of one quiz track.
 */
public record TrackScore(
        int selfTotal,
        int otherTotal,
        int remembered,
        int familiar,
        int uncertain,
        int misidentifiedAsForeign,
        int correctlyRejected,
        int falseMemory,
        double forgetRate,
        double fuzzyRate,
        double falseMemoryRate,
        int score,
        RecallBand band) {}
