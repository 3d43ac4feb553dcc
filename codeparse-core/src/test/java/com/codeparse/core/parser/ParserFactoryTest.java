package com.codeparse.core.parser;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.codeparse.core.config.ParserConfig;
import com.codeparse.core.parser.impl.cfamily.CppParser;
import com.codeparse.core.parser.impl.python.PythonParser;
import com.codeparse.core.parser.impl.typescript.TypeScriptParser;

/**
 * Tests for {@link ParserFactory}.
 */
class ParserFactoryTest {

    @Test
    void createParser_canonicalNames_areRegistered() {
        assertThat(ParserFactory.getSupportedLanguages())
            .containsExactly("c", "cpp", "java", "javascript", "python", "rust", "typescript");
    }

    @Test
    void createParser_aliasAndCase_areAccepted() {
        assertThat(ParserFactory.createParser("py")).containsInstanceOf(PythonParser.class);
        assertThat(ParserFactory.createParser("TypeScript")).containsInstanceOf(TypeScriptParser.class);
        assertThat(ParserFactory.createParser("  c++ ")).containsInstanceOf(CppParser.class);
        assertThat(ParserFactory.getIdentifiers()).containsEntry("js", "javascript");
    }

    @Test
    void createParser_unknownLanguage_isEmpty() {
        assertThat(ParserFactory.createParser("cobol")).isEmpty();
        assertThat(ParserFactory.createParser(null)).isEmpty();
        assertThat(ParserFactory.createParser(" ")).isEmpty();
        assertThat(ParserFactory.isSupported("cobol")).isFalse();
    }

    @Test
    void createParser_returnsFreshInstances() {
        Optional<LanguageParser> first = ParserFactory.createParser("python");
        Optional<LanguageParser> second = ParserFactory.createParser("python");

        assertThat(first).isPresent();
        assertThat(second).isPresent();
        assertThat(first.get()).isNotSameAs(second.get());
    }

    @Test
    void createParser_passesConfiguration() {
        ParserConfig config = ParserConfig.defaults().withTabWidth(4);

        LanguageParser parser = ParserFactory.createParser("python", config).orElseThrow();

        assertThat(parser).isInstanceOf(AbstractLanguageParser.class);
        assertThat(((AbstractLanguageParser) parser).getConfig().indentation().tabWidth()).isEqualTo(4);
    }

    @Test
    void languageForExtension_mapsKnownExtensions() {
        assertThat(ParserFactory.languageForExtension("py")).contains("python");
        assertThat(ParserFactory.languageForExtension(".tsx")).contains("typescript");
        assertThat(ParserFactory.languageForExtension("MJS")).contains("javascript");
        assertThat(ParserFactory.languageForExtension("h")).contains("c");
        assertThat(ParserFactory.languageForExtension("hpp")).contains("cpp");
        assertThat(ParserFactory.languageForExtension("java")).contains("java");
        assertThat(ParserFactory.languageForExtension("rs")).contains("rust");
        assertThat(ParserFactory.languageForExtension("md")).isEmpty();
    }

    @Test
    void parse_nullSource_isTreatedAsEmpty() {
        LanguageParser parser = ParserFactory.createParser("javascript").orElseThrow();

        assertThat(parser.parse(null).root().getChildren()).isEmpty();
        assertThat(parser.parse("").hasWarnings()).isFalse();
    }
}
