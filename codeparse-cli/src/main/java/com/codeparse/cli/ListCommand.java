package com.codeparse.cli;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeparse.core.parser.ParserFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Command to list the supported languages.
 *
 * <p>Languages are discovered through the Service Provider Interface, so parsers added on the
 * classpath show up here without code changes.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codeparse list languages
 * }</pre>
 */
@Command(
    name = "list",
    description = "List supported languages",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(
        index = "0",
        description = "Type to list: languages",
        defaultValue = "languages"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase()) {
            case "languages", "language" -> listLanguages();
            default -> {
                log.error("Unknown type: {}. Use: languages", type);
                spec.commandLine().getErr().println("✗ Unknown type: " + type + ". Use: languages");
                yield 1;
            }
        };
    }

    private int listLanguages() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Supported Languages:");
        out.println();

        Map<String, List<String>> aliases = new TreeMap<>();
        ParserFactory.getIdentifiers().forEach((identifier, language) -> {
            if (!identifier.equals(language)) {
                aliases.computeIfAbsent(language, key -> new ArrayList<>()).add(identifier);
            }
        });

        for (String language : ParserFactory.getSupportedLanguages()) {
            out.printf("  • %s%n", language);
            List<String> names = aliases.getOrDefault(language, List.of());
            if (!names.isEmpty()) {
                out.printf("    Aliases: %s%n", names.stream().sorted().collect(Collectors.joining(", ")));
            }
        }
        out.flush();
        return 0;
    }
}
