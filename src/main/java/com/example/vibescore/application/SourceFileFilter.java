package com.example.vibescore.application;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Decides which paths of a diff are hand-written source files worth quizzing on.
 */
@Component
public class SourceFileFilter {
    private static final Set<String> SOURCE_EXTENSIONS =
            Set.of(
                    // JavaScript / TypeScript
                    "ts", "tsx", "js", "jsx", "mjs", "cjs", "vue", "svelte", "astro",
                    // Python
                    "py", "pyw", "pyx", "pxd", "pxi",
                    "go",
                    "rs",
                    // JVM
                    "java", "kt", "kts", "scala", "sc", "groovy", "gradle",
                    // C family
                    "c", "cpp", "cc", "cxx", "h", "hpp", "hxx", "m", "mm",
                    // .NET
                    "cs", "fs", "fsx",
                    "rb", "rake", "gemspec",
                    "php", "phtml",
                    "swift",
                    "dart",
                    "lua",
                    "sh", "bash", "zsh", "fish",
                    "pl", "pm",
                    "r",
                    "ex", "exs", "erl", "hrl",
                    "hs", "lhs",
                    "clj", "cljs", "cljc", "edn",
                    "zig",
                    "nim",
                    "v",
                    "ml", "mli",
                    "sql");

    private static final List<Pattern> IGNORED_PATHS =
            List.of(
                    Pattern.compile("\\.min\\."),
                    Pattern.compile("\\.bundle\\."),
                    Pattern.compile("\\.generated\\."),
                    Pattern.compile("node_modules"),
                    Pattern.compile("vendor/"),
                    Pattern.compile("dist/"),
                    Pattern.compile("build/"),
                    Pattern.compile("target/"),
                    Pattern.compile("\\.d\\.ts$"),
                    Pattern.compile("__pycache__"),
                    Pattern.compile("\\.pyc$"));

    public boolean isSourceFile(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        String normalized = path.replace('\\', '/');
        for (Pattern ignored : IGNORED_PATHS) {
            if (ignored.matcher(normalized).find()) {
                return false;
            }
        }
        return SOURCE_EXTENSIONS.contains(getExtension(normalized));
    }

    private String getExtension(String path) {
        int lastSeparator = path.lastIndexOf('/');
        int lastDot = path.lastIndexOf('.');
        if (lastDot > lastSeparator) {
            return path.substring(lastDot + 1).toLowerCase(Locale.ROOT);
        }
        return "";
    }
}
