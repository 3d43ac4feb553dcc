package com.codeparse.core.parser.impl.rust;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.codeparse.core.diagnostic.ParseWarning;
import com.codeparse.core.diagnostic.WarningKind;
import com.codeparse.core.lexical.LexResult;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Tests for {@link RustLexer}.
 */
class RustLexerTest {

    private static List<Token> tokens(String source) {
        return new RustLexer(source).tokenize().tokens();
    }

    private static List<Token> significant(String source) {
        return tokens(source).stream()
            .filter(token -> !token.type().isTrivia() && !token.is(TokenType.NEWLINE))
            .toList();
    }

    @Test
    void tokenize_lifetimeIsIdentifier() {
        List<Token> tokens = significant("fn f<'a>(x: &'a str) -> &'static str");

        assertThat(tokens).filteredOn(token -> token.text().startsWith("'"))
            .extracting(Token::text, Token::type)
            .containsExactly(
                tuple("'a", TokenType.IDENTIFIER),
                tuple("'a", TokenType.IDENTIFIER),
                tuple("'static", TokenType.IDENTIFIER));
        assertThat(tokens).noneMatch(token -> token.is(TokenType.STRING));
    }

    @ParameterizedTest
    @ValueSource(strings = {"'a'", "'\\n'", "'\\''", "'{'", "b'x'", "'\\u{1F600}'", "'é'"})
    void tokenize_characterLiteralIsOneString(String literal) {
        List<Token> tokens = significant("let c = " + literal + ";");

        assertThat(tokens).filteredOn(token -> token.is(TokenType.STRING))
            .singleElement()
            .satisfies(token -> {
                assertThat(token.text()).isEqualTo(literal);
                assertThat(token.metadata()).containsEntry(Token.DELIMITER, "'");
            });
        assertThat(tokens).noneMatch(token -> token.is(TokenType.OPEN_BRACE));
    }

    @Test
    void tokenize_rawStringKeepsQuotesAndBraces() {
        List<Token> tokens = significant("let s = r#\"say \"hi\" { }\"#; let t = br\"x\";");

        assertThat(tokens).filteredOn(token -> token.is(TokenType.STRING))
            .extracting(Token::text)
            .containsExactly("r#\"say \"hi\" { }\"#", "br\"x\"");
        assertThat(tokens).noneMatch(token -> token.is(TokenType.OPEN_BRACE));
    }

    @Test
    void tokenize_rawIdentifier() {
        List<Token> tokens = significant("let r#type = 1;");

        assertThat(tokens.get(1).text()).isEqualTo("r#type");
        assertThat(tokens.get(1).is(TokenType.IDENTIFIER)).isTrue();
    }

    @Test
    void tokenize_nestedBlockComment() {
        List<Token> tokens = tokens("/* outer /* inner */ still comment { */ fn");

        assertThat(tokens.get(0).is(TokenType.COMMENT)).isTrue();
        assertThat(tokens.get(0).text()).endsWith("{ */");
        assertThat(tokens).filteredOn(token -> token.is(TokenType.KEYWORD)).extracting(Token::text).containsExactly("fn");
    }

    @Test
    void tokenize_unterminatedRawString_warns() {
        LexResult result = new RustLexer("let s = r##\"never closed\"#;\nfn f() {}").tokenize();

        assertThat(result.warnings()).extracting(ParseWarning::kind)
            .containsExactly(WarningKind.LEXICAL_UNTERMINATED);
        assertThat(result.tokens()).filteredOn(token -> token.is(TokenType.STRING))
            .singleElement()
            .satisfies(token -> assertThat(token.metadata()).containsEntry(Token.TERMINATED, false));
    }

    @Test
    void tokenize_rustPunctuation() {
        List<Token> tokens = significant("std::mem::swap; match x { 0..=9 => 1 }");

        assertThat(tokens).anyMatch(token -> token.isOperator("::"));
        assertThat(tokens).anyMatch(token -> token.isOperator("..="));
        assertThat(tokens).anyMatch(token -> token.is(TokenType.FAT_ARROW));
    }

    @Test
    void tokenize_contextualWordsStayIdentifiers() {
        assertThat(significant("union")).singleElement().satisfies(token -> assertThat(token.is(TokenType.IDENTIFIER)).isTrue());
        assertThat(significant("macro_rules")).singleElement().satisfies(token -> assertThat(token.is(TokenType.IDENTIFIER)).isTrue());
        assertThat(significant("impl")).singleElement().satisfies(token -> assertThat(token.is(TokenType.KEYWORD)).isTrue());
    }
}
