package com.example.vibescore.domain;

import java.time.LocalDate;

public record DailyStat(LocalDate date, int linesAdded, int commitCount, int avgLinesPerCommit) {
    public static DailyStat of(LocalDate date, int linesAdded, int commitCount) {
        return new DailyStat(
                date, linesAdded, commitCount, (int) Math.round((double) linesAdded / commitCount));
    }
}
