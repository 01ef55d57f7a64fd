package com.example.vibescore.application;

import com.example.vibescore.domain.LineCategory;
import com.example.vibescore.domain.Whitespace;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Classifies an added line by the first matching rule; unmatched lines are substantive code.
 */
@Component
public class LineClassifier {
    private final List<LineRule> rules;

    public LineClassifier() {
        this(LineRules.defaults());
    }

    public LineClassifier(List<LineRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public LineCategory classify(String line) {
        String trimmed = Whitespace.trim(line);
        for (LineRule rule : rules) {
            if (rule.matches(trimmed)) {
                return rule.category();
            }
        }
        return LineCategory.SUBSTANTIVE;
    }
}
