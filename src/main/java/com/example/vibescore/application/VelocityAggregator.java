package com.example.vibescore.application;

import com.example.vibescore.domain.DailyStat;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sums added lines and commits per UTC calendar day and reports the busiest days.
 */
public class VelocityAggregator {
    public static final int HIGH_OUTPUT_THRESHOLD = 500;
    public static final int MAX_DAYS = 10;

    private final Map<LocalDate, int[]> totals = new LinkedHashMap<>();

    public static int countAddedLines(String diff) {
        if (diff == null || diff.isEmpty()) {
            return 0;
        }
        int added = 0;
        for (String line : diff.split("\\r?\\n")) {
            if (line.startsWith("+") && !line.startsWith("+++")) {
                added++;
            }
        }
        return added;
    }

    public void record(Instant timestamp, String diff) {
        LocalDate day = timestamp.atZone(ZoneOffset.UTC).toLocalDate();
        int[] dayTotals = totals.computeIfAbsent(day, d -> new int[2]);
        dayTotals[0] += countAddedLines(diff);
        dayTotals[1]++;
    }

    public List<DailyStat> highOutputDays() {
        List<DailyStat> days = new ArrayList<>();
        totals.forEach((day, dayTotals) -> days.add(DailyStat.of(day, dayTotals[0], dayTotals[1])));
        return days.stream()
                .filter(stat -> stat.linesAdded() > HIGH_OUTPUT_THRESHOLD)
                .sorted(Comparator.comparingInt(DailyStat::linesAdded).reversed())
                .limit(MAX_DAYS)
                .toList();
    }
}
