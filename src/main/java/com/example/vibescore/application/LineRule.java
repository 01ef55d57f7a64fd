package com.example.vibescore.application;

import com.example.vibescore.domain.LineCategory;

import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Assigns {@code category} to every trimmed line accepted by {@code matcher}.
 */
public record LineRule(String name, Predicate<String> matcher, LineCategory category) {
    public LineRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(matcher, "matcher");
        Objects.requireNonNull(category, "category");
    }

    public static LineRule anyOf(String name, List<Pattern> patterns, LineCategory category) {
        List<Pattern> copy = List.copyOf(patterns);
        return new LineRule(name, line -> matchesAny(copy, line), category);
    }

    public static boolean matchesAny(List<Pattern> patterns, String line) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(line).find()) {
                return true;
            }
        }
        return false;
    }

    public boolean matches(String trimmedLine) {
        return matcher.test(trimmedLine);
    }
}
