package com.codeparse;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

@DisplayName("CodeParse CLI")
class CodeParseCLITest {

    private static final String PYTHON_SOURCE = """
        class Service:
            def handle(self, request):
                return request


        def main():
            pass
        """;

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine commandLine = CodeParseCLI.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Test
    @DisplayName("Should print a hint without a subcommand")
    void noSubcommand_printsHint() {
        assertThat(run()).isZero();
        assertThat(out.toString()).contains("codeparse --help");
    }

    @Nested
    @DisplayName("parse")
    class Parse {

        @Test
        @DisplayName("Should print the tree as JSON by default")
        void parse_defaultFormat_printsJson() throws IOException {
            Path file = write("service.py", PYTHON_SOURCE);

            assertThat(run("parse", file.toString())).isZero();
            assertThat(out.toString())
                .startsWith("{")
                .contains("\"nodeType\"", "\"Module\"", "\"ClassDeclaration\"", "\"handle\"")
                .doesNotContain("endIndex");
        }

        @Test
        @DisplayName("Should print an outline with line ranges")
        void parse_treeFormat_printsOutline() throws IOException {
            Path file = write("service.py", PYTHON_SOURCE);

            assertThat(run("parse", file.toString(), "--format", "tree")).isZero();
            assertThat(out.toString())
                .startsWith("Module [1-")
                .contains("  ClassDeclaration Service [1-3]")
                .contains("FunctionDeclaration main [6-7]");
        }

        @Test
        @DisplayName("Should report warnings and unterminated constructs in the outline")
        void parse_brokenSource_printsWarnings() throws IOException {
            Path file = write("broken.js", "function f() {\n  return 1;\n");

            assertThat(run("parse", file.toString(), "-f", "TREE")).isZero();
            assertThat(out.toString()).contains("FunctionDeclaration f [1-2] (unterminated)").contains("! ");
        }

        @Test
        @DisplayName("Should honor --language for files without an extension")
        void parse_explicitLanguage() throws IOException {
            Path file = write("deploy", "def run():\n    pass\n");

            assertThat(run("parse", file.toString(), "-l", "py", "-f", "tree")).isZero();
            assertThat(out.toString()).contains("FunctionDeclaration run");
        }

        @Test
        @DisplayName("Should apply the configuration file")
        void parse_withConfig_includesTokenIndices() throws IOException {
            Path file = write("service.py", PYTHON_SOURCE);
            Path config = write("codeparse.yaml", "output:\n  includeTokenIndices: true\n");

            assertThat(run("parse", file.toString(), "--config", config.toString())).isZero();
            assertThat(out.toString()).contains("endIndex");
        }

        @Test
        @DisplayName("Should fail for an unreadable file")
        void parse_missingFile_fails() {
            assertThat(run("parse", tempDir.resolve("absent.py").toString())).isEqualTo(1);
            assertThat(err.toString()).contains("Cannot read file");
        }

        @Test
        @DisplayName("Should fail for an unsupported language")
        void parse_unsupportedLanguage_fails() throws IOException {
            Path file = write("report.cbl", "IDENTIFICATION DIVISION.\n");

            assertThat(run("parse", file.toString(), "-l", "cobol")).isEqualTo(1);
            assertThat(err.toString()).contains("Unsupported language: cobol").contains("python");
        }

        @Test
        @DisplayName("Should fail when the language cannot be derived")
        void parse_unknownExtension_fails() throws IOException {
            Path file = write("notes", "text\n");

            assertThat(run("parse", file.toString())).isEqualTo(1);
            assertThat(err.toString()).contains("Cannot determine language");
        }
    }

    @Nested
    @DisplayName("symbols")
    class Symbols {

        @Test
        @DisplayName("Should group symbols by scope")
        void symbols_groupedByScope() throws IOException {
            Path file = write("service.py", PYTHON_SOURCE);

            assertThat(run("symbols", file.toString())).isZero();
            assertThat(out.toString())
                .contains("module (parent: -)")
                .contains("module/class:Service (parent: module)")
                .contains("method       handle  2:9")
                .contains("function     main  6:5");
        }
    }

    @Nested
    @DisplayName("find")
    class Find {

        @Test
        @DisplayName("Should find a declaration by dotted name")
        void find_byName() throws IOException {
            Path file = write("service.py", PYTHON_SOURCE);

            assertThat(run("find", file.toString(), "--name", "Service.handle")).isZero();
            assertThat(out.toString()).contains("MethodDeclaration Service.handle [2-3]");
        }

        @Test
        @DisplayName("Should find the function enclosing a line")
        void find_byLine() throws IOException {
            Path file = write("service.py", PYTHON_SOURCE);

            assertThat(run("find", file.toString(), "--line", "3")).isZero();
            assertThat(out.toString()).contains("Service.handle");
        }

        @Test
        @DisplayName("Should exit with 2 when nothing matches")
        void find_noMatch() throws IOException {
            Path file = write("service.py", PYTHON_SOURCE);

            assertThat(run("find", file.toString(), "--line", "5")).isEqualTo(2);
            assertThat(err.toString()).contains("No match for line 5");
        }

        @Test
        @DisplayName("Should reject --name together with --line")
        void find_bothTargets_isUsageError() throws IOException {
            Path file = write("service.py", PYTHON_SOURCE);

            assertThat(run("find", file.toString(), "--name", "main", "--line", "6")).isEqualTo(2);
            assertThat(err.toString()).contains("mutually exclusive");
        }
    }

    @Nested
    @DisplayName("list")
    class ListLanguages {

        @Test
        @DisplayName("Should list languages with their aliases")
        void list_languages() {
            assertThat(run("list", "languages")).isZero();
            assertThat(out.toString())
                .contains("Supported Languages:")
                .contains("• python")
                .contains("Aliases: py")
                .contains("• cpp")
                .contains("• typescript")
                .contains("• rust");
        }

        @Test
        @DisplayName("Should default to languages")
        void list_default() {
            assertThat(run("list")).isZero();
            assertThat(out.toString()).contains("• java");
        }

        @Test
        @DisplayName("Should reject an unknown type")
        void list_unknownType() {
            assertThat(run("list", "widgets")).isEqualTo(1);
            assertThat(err.toString()).contains("Unknown type: widgets");
        }
    }
}
