package com.codeparse;

import com.codeparse.cli.FindCommand;
import com.codeparse.cli.ListCommand;
import com.codeparse.cli.ParseCommand;
import com.codeparse.cli.SymbolsCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParseResult;
import picocli.CommandLine.Spec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for CodeParse.
 *
 * <p>CodeParse reads source files in several languages and reports their structure: the
 * declaration tree, the symbol table, and lookups by name or line.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code parse} - Print the structure tree of a file as JSON or as an outline</li>
 *   <li>{@code symbols} - Print the symbols declared in a file, grouped by scope</li>
 *   <li>{@code find} - Locate a declaration by name or the function enclosing a line</li>
 *   <li>{@code list} - List supported languages</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * codeparse parse src/app.py --format tree
 * codeparse find src/app.py --line 42
 * codeparse list languages
 * }</pre>
 */
@Command(
    name = "codeparse",
    mixinStandardHelpOptions = true,
    version = "CodeParse 1.0.0-SNAPSHOT",
    description = "Error-tolerant structure parser for Python, JavaScript, TypeScript, C, C++, Java and Rust",
    subcommands = {
        ParseCommand.class,
        SymbolsCommand.class,
        FindCommand.class,
        ListCommand.class
    }
)
public class CodeParseCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodeParseCLI.class);

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        configureLogging();

        if (quiet) {
            return;
        }

        spec.commandLine().getOut().println("CodeParse - Error-tolerant structure parser");
        spec.commandLine().getOut().println("Use 'codeparse --help' to see available commands");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.WARN);
        }
        log.debug("Logging configured (verbose={}, quiet={})", verbose, quiet);
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging applied before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        CodeParseCLI cli = new CodeParseCLI();
        CommandLine commandLine = new CommandLine(cli);
        CommandLine.IExecutionStrategy delegate = new CommandLine.RunLast();
        commandLine.setExecutionStrategy((ParseResult parseResult) -> {
            cli.configureLogging();
            return delegate.execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
