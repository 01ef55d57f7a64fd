package com.example.vibescore.application;

import com.example.vibescore.domain.LineCategory;
import com.example.vibescore.domain.Whitespace;

import java.util.List;
import java.util.regex.Pattern;

/**
 * The default line rules, in evaluation order: boilerplate, comment, noise.
 */
public final class LineRules {
    public static final int MIN_COMMENT_LENGTH = 16;
    public static final int MIN_CODE_LENGTH = 8;

    static final List<Pattern> BOILERPLATE =
            patterns(
                    // JavaScript / TypeScript
                    "^import\\s+",
                    "^export\\s+(default\\s+)?(\\{|class|function|const|let|var|interface|type|enum)",
                    "^const\\s+\\w+\\s*=\\s*use[A-Z]\\w*\\(",
                    "^const\\s*\\[\\s*\\w+\\s*,\\s*set[A-Z]",
                    "^const\\s+\\{\\s*\\w+\\s*\\}\\s*=\\s*use\\w+",
                    "^module\\.exports",
                    "^require\\(",
                    // Python
                    "^from\\s+\\S+\\s+import",
                    "^def\\s+__\\w+__",
                    "^class\\s+\\w+\\s*(\\(|:)",
                    // Go
                    "^package\\s+",
                    "^import\\s*\\(",
                    "^func\\s+\\(\\w+\\s+\\*?\\w+\\)\\s+\\w+",
                    // Rust
                    "^use\\s+",
                    "^mod\\s+",
                    "^pub\\s+(fn|struct|enum|trait|impl|mod|use|const|static)",
                    // Java / Kotlin
                    "^public\\s+(class|interface|enum)",
                    "^private\\s+(class|interface|enum)",
                    // Ruby
                    "^require\\s+",
                    "^require_relative\\s+",
                    "^module\\s+",
                    // C / C++ / C#
                    "^#include\\s+",
                    "^#define\\s+",
                    "^#pragma\\s+",
                    "^using\\s+namespace",
                    // brackets only
                    "^[{}\\[\\]();,]+$");

    static final List<Pattern> COMMENT_START =
            patterns(
                    "^//",
                    "^/\\*",
                    "^\\*",
                    "^#(?!!)",
                    "^--",
                    "^\"\"\"",
                    "^'''",
                    "^;",
                    "^\\{-");

    private static final Pattern PUNCTUATION_ONLY =
            Pattern.compile("^[{}\\[\\]();,\\s\\uFEFF]+$", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern CLOSING_TOKEN = Pattern.compile("^(else|end|endif|fi|done|esac|\\}|\\);?)$");

    private LineRules() {}

    public static List<LineRule> defaults() {
        return List.of(
                new LineRule(
                        "boilerplate",
                        line -> Whitespace.isBlank(line) || LineRule.matchesAny(BOILERPLATE, line),
                        LineCategory.BOILERPLATE),
                new LineRule(
                        "comment",
                        line -> line.length() >= MIN_COMMENT_LENGTH && LineRule.matchesAny(COMMENT_START, line),
                        LineCategory.COMMENT),
                LineRule.anyOf("short-comment", COMMENT_START, LineCategory.NOISE),
                new LineRule("too-short", line -> line.length() < MIN_CODE_LENGTH, LineCategory.NOISE),
                new LineRule(
                        "punctuation",
                        line -> PUNCTUATION_ONLY.matcher(line).matches(),
                        LineCategory.NOISE),
                new LineRule(
                        "closing-token",
                        line -> CLOSING_TOKEN.matcher(line).matches(),
                        LineCategory.NOISE));
    }

    private static List<Pattern> patterns(String... regexes) {
        Pattern[] compiled = new Pattern[regexes.length];
        for (int i = 0; i < regexes.length; i++) {
            compiled[i] = Pattern.compile(regexes[i]);
        }
        return List.of(compiled);
    }
}
