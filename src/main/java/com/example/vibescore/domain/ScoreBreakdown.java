package com.example.vibescore.domain;

/**
 * Final result of a finished quiz session.
 *
 * @param code the code track score
 * @param comment the comment track score
 * @param highOutputDays number of days retained by the velocity analysis
 * @param velocityBonus {@code min(highOutputDays * 3, 15)}
 * @param total weighted composite, clamped to 100
 * @param rating the rating band of {@code total}
 */
public record ScoreBreakdown(
        TrackScore code,
        TrackScore comment,
        int highOutputDays,
        int velocityBonus,
        int total,
        VibeRating rating) {}
