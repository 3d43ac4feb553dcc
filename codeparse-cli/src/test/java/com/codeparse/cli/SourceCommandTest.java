package com.codeparse.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Language detection from file names")
class SourceCommandTest {

    @Test
    @DisplayName("Should map known extensions to languages")
    void detectLanguage_knownExtensions() {
        assertThat(SourceCommand.detectLanguage(Path.of("src", "app.py"))).contains("python");
        assertThat(SourceCommand.detectLanguage(Path.of("App.TSX"))).contains("typescript");
        assertThat(SourceCommand.detectLanguage(Path.of("lib", "util.hpp"))).contains("cpp");
        assertThat(SourceCommand.detectLanguage(Path.of("Main.java"))).contains("java");
    }

    @Test
    @DisplayName("Should return empty without a usable extension")
    void detectLanguage_noExtension() {
        assertThat(SourceCommand.detectLanguage(Path.of("Makefile"))).isEmpty();
        assertThat(SourceCommand.detectLanguage(Path.of("trailing."))).isEmpty();
        assertThat(SourceCommand.detectLanguage(Path.of("notes.txt"))).isEmpty();
    }
}
