package com.codeparse.core.parser.impl.cfamily;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.codeparse.core.parser.impl.cfamily.CFamilyLexer.Dialect;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Tests for {@link CFamilyLexer}.
 */
class CFamilyLexerTest {

    private static List<Token> tokens(String source, Dialect dialect) {
        return new CFamilyLexer(source, dialect).tokenize().tokens();
    }

    @Test
    void tokenize_directiveWithContinuation_isSingleToken() {
        List<Token> tokens = tokens("#define BLOCK { \\\n  x; }\nint y;", Dialect.C);

        Token directive = tokens.get(0);
        assertThat(directive.is(TokenType.COMMENT)).isTrue();
        assertThat(directive.metadata()).containsEntry(Token.DELIMITER, CFamilyLexer.DIRECTIVE_DELIMITER);
        assertThat(directive.text()).isEqualTo("#define BLOCK { \\\n  x; }");
        assertThat(tokens).extracting(Token::type).doesNotContain(TokenType.OPEN_BRACE);
    }

    @Test
    void tokenize_hashInsideLine_isNotDirective() {
        List<Token> tokens = tokens("int a; # not a directive", Dialect.C);

        assertThat(tokens).noneMatch(token -> CFamilyLexer.DIRECTIVE_DELIMITER.equals(token.metadata().get(Token.DELIMITER)));
    }

    @Test
    void tokenize_cppScopeOperator() {
        List<Token> tokens = tokens("std::vector<int> v;", Dialect.CPP);

        assertThat(tokens).anyMatch(token -> token.isOperator("::"));
        assertThat(tokens).filteredOn(token -> token.text().equals("std")).allMatch(token -> token.is(TokenType.IDENTIFIER));
    }

    @Test
    void tokenize_javaTextBlock_isOneString() {
        List<Token> tokens = tokens("String s = \"\"\"\n  { json }\n  \"\"\";", Dialect.JAVA);

        assertThat(tokens).filteredOn(token -> token.is(TokenType.STRING)).hasSize(1);
        assertThat(tokens).extracting(Token::type).doesNotContain(TokenType.OPEN_BRACE);
    }

    @Test
    void tokenize_dialectKeywords() {
        assertThat(tokens("class", Dialect.CPP).get(0).is(TokenType.KEYWORD)).isTrue();
        assertThat(tokens("class", Dialect.C).get(0).is(TokenType.IDENTIFIER)).isTrue();
        assertThat(tokens("record", Dialect.JAVA).get(0).is(TokenType.IDENTIFIER)).isTrue();
        assertThat(tokens("$value", Dialect.JAVA)).hasSize(1);
    }
}
