package com.codeparse.cli;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeparse.core.ast.ParseResult;
import com.codeparse.core.config.ConfigLoader;
import com.codeparse.core.config.ParserConfig;
import com.codeparse.core.parser.LanguageParser;
import com.codeparse.core.parser.ParserFactory;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

/**
 * Base class for commands that parse a single source file.
 *
 * <p>Resolves the language from {@code --language} or the file extension, loads the optional
 * configuration file and runs the parser. Subclasses only render the result.
 */
abstract class SourceCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SourceCommand.class);

    @Spec
    protected CommandSpec spec;

    @Parameters(index = "0", description = "Source file to parse")
    protected Path file;

    @Option(
        names = {"-l", "--language"},
        description = "Language identifier or alias (default: derived from the file extension)"
    )
    protected String language;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: codeparse.yaml when present)"
    )
    protected Path configPath;

    @Override
    public Integer call() {
        Optional<ParseResult> result = parseInput();
        if (result.isEmpty()) {
            return 1;
        }
        return render(result.get());
    }

    /**
     * Writes the parse result.
     *
     * @return process exit code
     */
    protected abstract int render(ParseResult result);

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    protected PrintWriter err() {
        return spec.commandLine().getErr();
    }

    private Optional<ParseResult> parseInput() {
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            err().println("✗ Cannot read file: " + file);
            return Optional.empty();
        }

        String identifier = language != null ? language : detectLanguage(file).orElse(null);
        if (identifier == null) {
            err().println("✗ Cannot determine language of " + file + "; use --language");
            return Optional.empty();
        }

        Optional<LanguageParser> parser = ParserFactory.createParser(identifier, loadConfiguration());
        if (parser.isEmpty()) {
            err().println("✗ Unsupported language: " + identifier
                + ". Supported: " + ParserFactory.getSupportedLanguages());
            return Optional.empty();
        }

        try {
            log.debug("Parsing {} as {}", file, parser.get().getLanguage());
            return Optional.of(parser.get().parseFile(file));
        } catch (LanguageParser.ParseException e) {
            log.error("Parse failed", e);
            err().println("✗ " + e.getMessage());
            return Optional.empty();
        }
    }

    private ParserConfig loadConfiguration() {
        if (configPath != null) {
            return ConfigLoader.load(configPath);
        }
        Path defaultPath = Path.of(ConfigLoader.DEFAULT_FILE_NAME);
        return Files.exists(defaultPath) ? ConfigLoader.load(defaultPath) : ParserConfig.defaults();
    }

    static Optional<String> detectLanguage(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) {
            return Optional.empty();
        }
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0 || dot == name.length() - 1) {
            return Optional.empty();
        }
        return ParserFactory.languageForExtension(name.substring(dot + 1));
    }
}
