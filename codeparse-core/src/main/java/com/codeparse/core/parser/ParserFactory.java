package com.codeparse.core.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeparse.core.config.ParserConfig;
import com.codeparse.core.util.Languages;

/**
 * Factory for creating language parsers by identifier.
 *
 * <p>The registry is built once, when the class is initialized, from the
 * {@link ServiceLoader} entries for {@link LanguageParser}. It maps every canonical identifier
 * and alias (case-insensitive) to a parser type and is never modified afterwards, so the factory
 * is safe to use from any thread.
 *
 * <p>Every call creates a new parser instance. Unknown, null or blank identifiers yield an empty
 * {@link Optional}; no exception leaves the factory.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * Optional<LanguageParser> parser = ParserFactory.createParser("ts");
 * if (parser.isEmpty()) {
 *     // fall back to plain text handling
 * }
 *
 * String language = ParserFactory.languageForExtension("py").orElse(null);
 * }</pre>
 *
 * @see LanguageParser
 * @since 1.0.0
 */
public final class ParserFactory {

    private static final Logger log = LoggerFactory.getLogger(ParserFactory.class);

    private static final Registry REGISTRY = Registry.load();

    private ParserFactory() {
        // Utility class - no instantiation
    }

    /**
     * Creates a parser with default configuration.
     *
     * @param language canonical identifier or alias, e.g. "python", "py", "TypeScript"
     * @return a new parser, or empty if the identifier is unknown
     */
    public static Optional<LanguageParser> createParser(String language) {
        return createParser(language, ParserConfig.defaults());
    }

    /**
     * Creates a parser with the given configuration.
     *
     * @param language canonical identifier or alias
     * @param config parser configuration
     * @return a new parser, or empty if the identifier is unknown
     */
    public static Optional<LanguageParser> createParser(String language, ParserConfig config) {
        String key = Languages.normalize(language);
        if (key == null) {
            return Optional.empty();
        }
        Class<? extends LanguageParser> type = REGISTRY.types().get(key);
        if (type == null) {
            log.debug("No parser registered for language: {}", language);
            return Optional.empty();
        }
        return instantiate(type, config != null ? config : ParserConfig.defaults());
    }

    /**
     * Helper method to create parser instances via reflection.
     */
    private static Optional<LanguageParser> instantiate(Class<? extends LanguageParser> type, ParserConfig config) {
        try {
            return Optional.of(type.getConstructor(ParserConfig.class).newInstance(config));
        } catch (NoSuchMethodException e) {
            log.debug("{} has no configurable constructor, using defaults", type.getSimpleName());
            try {
                return Optional.of(type.getConstructor().newInstance());
            } catch (ReflectiveOperationException inner) {
                log.error("{} failed to initialize", type.getSimpleName(), inner);
                return Optional.empty();
            }
        } catch (ReflectiveOperationException e) {
            log.error("{} failed to initialize", type.getSimpleName(), e);
            return Optional.empty();
        }
    }

    /**
     * Returns the canonical identifiers of all registered languages, sorted.
     */
    public static Set<String> getSupportedLanguages() {
        return REGISTRY.languages();
    }

    /**
     * Returns every accepted identifier (canonical names and aliases) mapped to its canonical name.
     */
    public static Map<String, String> getIdentifiers() {
        return REGISTRY.identifiers();
    }

    /**
     * Maps a file extension to a canonical language identifier.
     *
     * @param extension extension with or without the leading dot, e.g. "py" or ".tsx"
     * @return language identifier, or empty if no parser handles the extension
     */
    public static Optional<String> languageForExtension(String extension) {
        String key = Languages.normalize(extension);
        return key != null ? Optional.ofNullable(REGISTRY.extensions().get(key)) : Optional.empty();
    }

    /**
     * Checks if a parser for the given identifier is registered.
     */
    public static boolean isSupported(String language) {
        String key = Languages.normalize(language);
        return key != null && REGISTRY.types().containsKey(key);
    }

    private record Registry(
        Map<String, Class<? extends LanguageParser>> types,
        Map<String, String> identifiers,
        Map<String, String> extensions,
        Set<String> languages
    ) {
        static Registry load() {
            Map<String, Class<? extends LanguageParser>> types = new LinkedHashMap<>();
            Map<String, String> identifiers = new LinkedHashMap<>();
            Map<String, String> extensions = new LinkedHashMap<>();
            Set<String> languages = new TreeSet<>();

            ServiceLoader.load(LanguageParser.class, ParserFactory.class.getClassLoader())
                .stream()
                .forEach(provider -> {
                    LanguageParser probe = provider.get();
                    String language = Languages.normalize(probe.getLanguage());
                    languages.add(language);
                    register(types, identifiers, language, language, provider.type());
                    for (String alias : probe.getAliases()) {
                        register(types, identifiers, Languages.normalize(alias), language, provider.type());
                    }
                    for (String extension : probe.getFileExtensions()) {
                        extensions.putIfAbsent(Languages.normalize(extension), language);
                    }
                });

            log.info("Parser registry initialized with {} languages: {}", languages.size(), languages);
            return new Registry(
                Collections.unmodifiableMap(types),
                Collections.unmodifiableMap(identifiers),
                Collections.unmodifiableMap(extensions),
                Collections.unmodifiableSet(languages));
        }

        private static void register(
                Map<String, Class<? extends LanguageParser>> types,
                Map<String, String> identifiers,
                String identifier,
                String language,
                Class<? extends LanguageParser> type) {
            Class<? extends LanguageParser> existing = types.putIfAbsent(identifier, type);
            if (existing != null && existing != type) {
                log.warn("Identifier '{}' already registered by {}, ignoring {}",
                    identifier, existing.getSimpleName(), type.getSimpleName());
                return;
            }
            identifiers.put(identifier, language);
        }
    }
}
