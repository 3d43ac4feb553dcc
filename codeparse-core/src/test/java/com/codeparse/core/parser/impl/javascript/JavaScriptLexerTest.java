package com.codeparse.core.parser.impl.javascript;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.codeparse.core.diagnostic.WarningKind;
import com.codeparse.core.lexical.LexResult;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Tests for {@link JavaScriptLexer}.
 */
class JavaScriptLexerTest {

    private static List<Token> significant(String source) {
        return new JavaScriptLexer(source).tokenize().tokens().stream()
            .filter(token -> !token.type().isTrivia() && !token.is(TokenType.NEWLINE))
            .toList();
    }

    @Test
    void tokenize_regexAfterOperator_isOneLiteral() {
        List<Token> tokens = significant("const re = /[{}]+/g;");

        assertThat(tokens).extracting(Token::type).containsExactly(
            TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.EQUALS, TokenType.REGEX, TokenType.SEMICOLON);
        assertThat(tokens.get(3).text()).isEqualTo("/[{}]+/g");
    }

    @Test
    void tokenize_slashAfterIdentifier_isDivision() {
        List<Token> tokens = significant("a / b / c");

        assertThat(tokens).extracting(Token::type).doesNotContain(TokenType.REGEX);
        assertThat(tokens).filteredOn(token -> token.isOperator("/")).hasSize(2);
    }

    @Test
    void tokenize_templateLiteral_keepsBracesInside() {
        List<Token> tokens = significant("let s = `x ${ {a: 1}.a } }`;");

        assertThat(tokens).extracting(Token::type).containsOnlyOnce(TokenType.TEMPLATE);
        assertThat(tokens).extracting(Token::type).doesNotContain(TokenType.OPEN_BRACE, TokenType.CLOSE_BRACE);
    }

    @Test
    void tokenize_arrowAndPrivateName() {
        List<Token> tokens = significant("this.#count = () => 1");

        assertThat(tokens).extracting(Token::text).contains("#count", "=>");
        assertThat(tokens).filteredOn(token -> token.is(TokenType.FAT_ARROW)).hasSize(1);
    }

    @Test
    void tokenize_unterminatedString_reportsLexicalWarning() {
        LexResult result = new JavaScriptLexer("let s = 'unclosed").tokenize();

        assertThat(result.warnings()).extracting(warning -> warning.kind())
            .containsExactly(WarningKind.LEXICAL_UNTERMINATED);
        Token last = result.tokens().get(result.tokens().size() - 1);
        assertThat(last.is(TokenType.STRING)).isTrue();
        assertThat(last.isTerminated()).isFalse();
    }

    @Test
    void tokenize_tracksLinesAndColumns() {
        List<Token> tokens = significant("a\n  b");

        assertThat(tokens.get(1).line()).isEqualTo(2);
        assertThat(tokens.get(1).column()).isEqualTo(3);
    }

    @Test
    void tokenize_strayHash_isOneTokenAndLexingContinues() {
        List<Token> tokens = significant("a # b ## c");

        assertThat(tokens).extracting(Token::text).containsExactly("a", "#", "b", "#", "#", "c");
        assertThat(tokens).extracting(Token::type).containsOnly(TokenType.IDENTIFIER);
    }

    @Test
    void tokenize_hashbangOnlyAtStart() {
        List<Token> tokens = new JavaScriptLexer("#!/usr/bin/env node\nx #!y").tokenize().tokens();

        assertThat(tokens.get(0).is(TokenType.COMMENT)).isTrue();
        assertThat(tokens.get(0).text()).isEqualTo("#!/usr/bin/env node");
        assertThat(tokens).filteredOn(token -> token.is(TokenType.COMMENT)).hasSize(1);
    }
}
