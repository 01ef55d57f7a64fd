package com.example.vibescore.application;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceFileFilterTest {

    private final SourceFileFilter filter = new SourceFileFilter();

    @Test
    void acceptsKnownSourceExtensions() {
        assertTrue(filter.isSourceFile("src/main/java/App.java"));
        assertTrue(filter.isSourceFile("web/components/Button.TSX"));
        assertTrue(filter.isSourceFile("scripts/deploy.sh"));
        assertTrue(filter.isSourceFile("lib/core.ex"));
    }

    @Test
    void rejectsNonSourceAndGeneratedPaths() {
        assertFalse(filter.isSourceFile("README.md"));
        assertFalse(filter.isSourceFile("Makefile"));
        assertFalse(filter.isSourceFile("assets/app.min.js"));
        assertFalse(filter.isSourceFile("node_modules/left-pad/index.js"));
        assertFalse(filter.isSourceFile("types/global.d.ts"));
        assertFalse(filter.isSourceFile("build/generated/Foo.java"));
        assertFalse(filter.isSourceFile("pkg/__pycache__/mod.py"));
    }

    @Test
    void dotInDirectoryNameIsNotAnExtension() {
        assertFalse(filter.isSourceFile("config.d/settings"));
        assertFalse(filter.isSourceFile(""));
        assertFalse(filter.isSourceFile(null));
    }
}
