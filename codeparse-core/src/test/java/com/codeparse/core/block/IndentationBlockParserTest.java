package com.codeparse.core.block;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import com.codeparse.core.diagnostic.ParseWarning;
import com.codeparse.core.diagnostic.WarningKind;
import com.codeparse.core.parser.impl.python.PythonLexer;
import com.codeparse.core.state.ContextType;
import com.codeparse.core.state.ParserState;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Tests for {@link IndentationBlockParser}.
 */
class IndentationBlockParserTest {

    private final IndentationBlockParser parser = new IndentationBlockParser();

    private static List<Token> python(String source) {
        return new PythonLexer(source).tokenize().tokens();
    }

    private static int afterColon(List<Token> tokens, int occurrence) {
        int seen = 0;
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).is(TokenType.COLON) && ++seen == occurrence) {
                return i + 1;
            }
        }
        throw new AssertionError("no colon #" + occurrence);
    }

    private static List<String> memberWords(List<Token> tokens, BlockResult result) {
        return result.memberIndices().stream()
            .map(tokens::get)
            .filter(token -> token.is(TokenType.IDENTIFIER, TokenType.KEYWORD))
            .map(Token::text)
            .toList();
    }

    private BlockResult parse(List<Token> tokens, int start) {
        return parser.parseBlock(tokens, start, new ParserState(), ContextType.FUNCTION, null);
    }

    @Test
    void parseBlock_dedentToBaseline_endsBlock() {
        List<Token> tokens = python("def f():\n    a = 1\n    b = 2\nx = 3\n");

        BlockResult result = parse(tokens, afterColon(tokens, 1));

        assertThat(result.terminated()).isTrue();
        assertThat(memberWords(tokens, result)).containsExactly("a", "b");
        assertThat(tokens.get(result.nextIndex()).text()).isEqualTo("x");
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void parseBlock_blankAndCommentLines_doNotEndBlock() {
        List<Token> tokens = python("def f():\n    a = 1\n\n# note at column zero\n        \n    b = 2\nx = 3\n");

        BlockResult result = parse(tokens, afterColon(tokens, 1));

        assertThat(memberWords(tokens, result)).containsExactly("a", "b");
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void parseBlock_inlineSuite_endsWithHeaderLine() {
        List<Token> tokens = python("if ready: start()\nstop()\n");

        BlockResult result = parse(tokens, afterColon(tokens, 1));

        assertThat(memberWords(tokens, result)).containsExactly("start");
        assertThat(tokens.get(result.nextIndex()).text()).isEqualTo("stop");
    }

    @Test
    void parseBlock_continuationLines_areNotMeasured() {
        List<Token> tokens = python("def f():\n    x = (1,\n2)\n    y = x\nz = 0\n");

        BlockResult result = parse(tokens, afterColon(tokens, 1));

        assertThat(memberWords(tokens, result)).containsExactly("x", "y", "x");
        assertThat(tokens.get(result.nextIndex()).text()).isEqualTo("z");
    }

    @Test
    void parseBlock_nestedHeader_usesItsOwnBaseline() {
        List<Token> tokens = python("class A:\n    def f(self):\n        return 1\n    def g(self):\n        pass\n");

        BlockResult result = parse(tokens, afterColon(tokens, 2));

        assertThat(memberWords(tokens, result)).containsExactly("return");
        assertThat(tokens.get(result.nextIndex()).is(TokenType.WHITESPACE)).isTrue();
        assertThat(tokens.get(result.nextIndex() + 1).text()).isEqualTo("def");
    }

    @Test
    void parseBlock_tabIndentedBody() {
        List<Token> tokens = python("def f():\n\ta = 1\n\tb = 2\nc = 3\n");

        BlockResult result = parse(tokens, afterColon(tokens, 1));

        assertThat(memberWords(tokens, result)).containsExactly("a", "b");
        assertThat(result.diagnostics()).isEmpty();
    }

    @Test
    void parseBlock_mixedTabsAndSpaces_reportsAmbiguity() {
        List<Token> tokens = python("class A:\n    def f(self):\n\tpass\n");

        BlockResult result = parse(tokens, afterColon(tokens, 2));

        assertThat(memberWords(tokens, result)).containsExactly("pass");
        assertThat(result.diagnostics()).extracting(ParseWarning::kind)
            .containsExactly(WarningKind.AMBIGUOUS_INDENTATION);
    }

    @Test
    void parseBlock_inconsistentDedent_reportsAmbiguity() {
        List<Token> tokens = python("def f():\n        a = 1\n    b = 2\nc = 3\n");

        BlockResult result = parse(tokens, afterColon(tokens, 1));

        assertThat(memberWords(tokens, result)).containsExactly("a", "b");
        assertThat(result.diagnostics()).extracting(ParseWarning::kind)
            .containsExactly(WarningKind.AMBIGUOUS_INDENTATION);
    }

    @Test
    void parseBlock_missingBody_reportsUnexpectedToken() {
        List<Token> tokens = python("def f():\nx = 1\n");

        BlockResult result = parse(tokens, afterColon(tokens, 1));

        assertThat(memberWords(tokens, result)).isEmpty();
        assertThat(result.diagnostics()).extracting(ParseWarning::kind)
            .containsExactly(WarningKind.UNEXPECTED_TOKEN);
    }

    @Test
    void parseBlock_bodyMissingAtEndOfInput_isUnterminated() {
        List<Token> tokens = python("def f():\n");

        BlockResult result = parse(tokens, afterColon(tokens, 1));

        assertThat(result.terminated()).isFalse();
        assertThat(result.nextIndex()).isEqualTo(tokens.size());
    }

    @Test
    void parseBlock_restoresContextStack() {
        List<Token> tokens = python("def f():\n    pass\n");
        ParserState state = new ParserState();

        parser.parseBlock(tokens, afterColon(tokens, 1), state, ContextType.FUNCTION, null);

        assertThat(state.depth()).isEqualTo(1);
    }

    @Test
    void logicalLineEnd_unclosedBracket_endsBeforeIntroducer() {
        List<Token> tokens = python("x = foo(\ndef g():\n    pass\n");

        int end = IndentationBlockParser.logicalLineEnd(tokens, 0, Set.of("def", "class"), 8);

        assertThat(tokens.get(end).text()).isEqualTo("def");
        assertThat(IndentationBlockParser.logicalLineEnd(tokens, 0)).isEqualTo(tokens.size());
    }

    @Test
    void logicalLineEnd_closedBracket_spansLines() {
        List<Token> tokens = python("x = foo(\n    class_name,\n    default,\n)\ny = 1\n");

        int end = IndentationBlockParser.logicalLineEnd(tokens, 0, Set.of("def", "class"), 8);

        assertThat(tokens.get(end).text()).isEqualTo("y");
    }

    @Test
    void parseBlock_unclosedBracketInBody_stopsAtNestedDefinition() {
        IndentationBlockParser recovering = new IndentationBlockParser(8, Set.of("def", "class"));
        List<Token> tokens = python("class A:\n    x = foo(\n    def g(self):\n        pass\nz = 1\n");

        BlockResult result = recovering.parseBlock(tokens, afterColon(tokens, 1), new ParserState(), ContextType.CLASS, null);

        assertThat(memberWords(tokens, result)).containsExactly("x", "foo", "def", "g", "self", "pass");
        assertThat(tokens.get(result.nextIndex()).text()).isEqualTo("z");
    }

    @Test
    void parseBlock_notAfterColon_throws() {
        List<Token> tokens = python("x = 1\n");

        assertThatThrownBy(() -> parse(tokens, 1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_nonPositiveTabWidth_throws() {
        assertThatThrownBy(() -> new IndentationBlockParser(0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void measure_expandsTabsToNextStop() {
        assertThat(IndentationWidth.measure("\t", 8)).isEqualTo(8);
        assertThat(IndentationWidth.measure("  \t", 4)).isEqualTo(4);
        assertThat(IndentationWidth.measure("    \t ", 4)).isEqualTo(9);
        assertThat(IndentationWidth.measure(" \f  ", 8)).isEqualTo(2);
    }
}
