package com.codeparse.cli;

import java.io.PrintWriter;

import com.codeparse.core.ast.AstJson;
import com.codeparse.core.ast.AstNode;
import com.codeparse.core.ast.ParseResult;
import com.codeparse.core.diagnostic.ParseWarning;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Command to print the structure tree of a source file.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Full tree as JSON
 * codeparse parse src/app.py
 *
 * # Indented outline with line ranges
 * codeparse parse src/app.ts --format tree
 *
 * # Force the language for an unusual extension
 * codeparse parse bin/deploy -l python
 * }</pre>
 */
@Command(
    name = "parse",
    description = "Parse a source file and print its structure tree",
    mixinStandardHelpOptions = true
)
public class ParseCommand extends SourceCommand {

    /**
     * Output format.
     */
    enum Format { JSON, TREE }

    @Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "json",
        converter = FormatConverter.class
    )
    private Format format;

    @Override
    protected int render(ParseResult result) {
        if (format == Format.TREE) {
            printTree(out(), result.root(), 0);
            for (ParseWarning warning : result.warnings()) {
                out().printf("! %d:%d %s%n", warning.line(), warning.column(), warning.message());
            }
        } else {
            out().println(AstJson.toJson(result.root()));
        }
        out().flush();
        return 0;
    }

    private static void printTree(PrintWriter out, AstNode node, int depth) {
        out.print("  ".repeat(depth));
        out.print(node.getNodeType());
        if (node.getName() != null) {
            out.print(" " + node.getName());
        }
        out.printf(" [%d-%d]", node.getLine(), node.getEndLine());
        if (node.isUnterminated()) {
            out.print(" (unterminated)");
        }
        out.println();
        for (AstNode child : node.getChildren()) {
            printTree(out, child, depth + 1);
        }
    }

    static class FormatConverter implements picocli.CommandLine.ITypeConverter<Format> {
        @Override
        public Format convert(String value) {
            return Format.valueOf(value.trim().toUpperCase());
        }
    }
}
