package com.codeparse.core.block;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.codeparse.core.parser.impl.cfamily.CFamilyLexer;
import com.codeparse.core.parser.impl.cfamily.CFamilyLexer.Dialect;
import com.codeparse.core.state.ContextType;
import com.codeparse.core.state.ParserState;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Tests for {@link KeywordBlockParser}.
 */
class KeywordBlockParserTest {

    private final KeywordBlockParser pascal = new KeywordBlockParser(Set.of("begin", "case"), "end", true);

    private static List<Token> lex(String source) {
        return new CFamilyLexer(source, Dialect.C).tokenize().tokens();
    }

    private static int indexOf(List<Token> tokens, String word) {
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).text().equals(word)) {
                return i;
            }
        }
        throw new AssertionError("no " + word);
    }

    private static String significant(List<Token> tokens, List<Integer> indices) {
        return indices.stream()
            .map(tokens::get)
            .filter(token -> !token.type().isTrivia() && !token.is(TokenType.NEWLINE))
            .map(Token::text)
            .collect(Collectors.joining(" "));
    }

    @Nested
    @DisplayName("block boundaries")
    class Boundaries {

        @Test
        void parseBlock_nestedOpeners_closeInnermostFirst() {
            List<Token> tokens = lex("begin\n  a;\n  case x of 1: b; end;\n  c;\nend tail");
            ParserState state = new ParserState();

            BlockResult result = pascal.parseBlock(tokens, indexOf(tokens, "begin"), state, ContextType.BLOCK, null);

            assertThat(result.terminated()).isTrue();
            assertThat(significant(tokens, result.memberIndices())).isEqualTo("a ; case x of 1 : b ; end ; c ;");
            assertThat(tokens.get(result.nextIndex() - 1).text()).isEqualTo("end");
            assertThat(tokens.subList(result.nextIndex(), tokens.size()))
                .filteredOn(token -> token.is(TokenType.IDENTIFIER))
                .extracting(Token::text)
                .containsExactly("tail");
        }

        @Test
        void parseBlock_notNested_firstCloserEnds() {
            KeywordBlockParser flat = new KeywordBlockParser(Set.of("begin"), "end", false);
            List<Token> tokens = lex("begin begin x end y end");

            BlockResult result = flat.parseBlock(tokens, 0, new ParserState(), ContextType.BLOCK, null);

            assertThat(result.terminated()).isTrue();
            assertThat(significant(tokens, result.memberIndices())).isEqualTo("begin x");
        }

        @Test
        void parseBlock_singleOpenerConstructor() {
            KeywordBlockParser shell = new KeywordBlockParser("do", "done");
            List<Token> tokens = lex("do echo; do x; done; done");

            BlockResult result = shell.parseBlock(tokens, 0, new ParserState(), ContextType.BLOCK, null);

            assertThat(result.terminated()).isTrue();
            assertThat(result.nextIndex()).isEqualTo(tokens.size());
        }

        @Test
        void parseBlock_memberAccessAndLiteralsAreNotKeywords() {
            List<Token> tokens = lex("begin obj.end(); s = \"end\"; /* end */ end");

            BlockResult result = pascal.parseBlock(tokens, 0, new ParserState(), ContextType.BLOCK, null);

            assertThat(result.terminated()).isTrue();
            assertThat(significant(tokens, result.memberIndices())).isEqualTo("obj . end ( ) ; s = \"end\" ;");
            assertThat(result.nextIndex()).isEqualTo(tokens.size());
        }
    }

    @Nested
    @DisplayName("recovery and contract")
    class Contract {

        @Test
        void parseBlock_missingCloser_reachesEndOfInput() {
            List<Token> tokens = lex("begin x; begin y; end");

            BlockResult result = pascal.parseBlock(tokens, 0, new ParserState(), ContextType.BLOCK, null);

            assertThat(result.terminated()).isFalse();
            assertThat(result.nextIndex()).isEqualTo(tokens.size());
            assertThat(significant(tokens, result.memberIndices())).isEqualTo("x ; begin y ; end");
        }

        @Test
        void parseBlock_popsItsFrameOnEveryPath() {
            ParserState state = new ParserState();
            int depth = state.depth();

            pascal.parseBlock(lex("begin x end"), 0, state, ContextType.BLOCK, null);
            assertThat(state.depth()).isEqualTo(depth);

            pascal.parseBlock(lex("begin x"), 0, state, ContextType.BLOCK, null);
            assertThat(state.depth()).isEqualTo(depth);
            assertThat(state.currentType()).isEqualTo(ContextType.MODULE);
        }

        @Test
        void parseBlock_startMustBeOpener() {
            List<Token> tokens = lex("x begin end");

            assertThatThrownBy(() -> pascal.parseBlock(tokens, 0, new ParserState(), ContextType.BLOCK, null))
                .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> pascal.parseBlock(tokens, tokens.size(), new ParserState(), ContextType.BLOCK, null))
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        void constructor_requiresOpener() {
            assertThatThrownBy(() -> new KeywordBlockParser(Set.of(), "end", true))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
