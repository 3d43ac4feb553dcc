package com.codeparse.core.block;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.codeparse.core.state.ContextFrame;
import com.codeparse.core.state.ContextType;
import com.codeparse.core.state.ParserState;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Block scanner for keyword-delimited blocks such as {@code begin ... end} or
 * {@code case ... esac}.
 *
 * <p>{@code startIndex} must point at one of the opener words. When the parser is nested, every
 * further opener raises the depth and every closer lowers it; otherwise the first closer ends the
 * block. Words inside literals and words used as member names ({@code obj.end}) are ignored.
 *
 * <pre>{@code
 * BlockParser pascal = new KeywordBlockParser(Set.of("begin", "case", "record"), "end", true);
 * BlockResult block = pascal.parseBlock(tokens, beginIndex, state, ContextType.BLOCK, null);
 * }</pre>
 *
 * @since 1.0.0
 */
public class KeywordBlockParser implements BlockParser {

    private final Set<String> openers;
    private final Set<String> closer;
    private final boolean nested;

    public KeywordBlockParser(String opener, String closer) {
        this(Set.of(opener), closer, true);
    }

    /**
     * @param openers words that open a block closed by {@code closer}
     * @param closer word that closes the innermost open block
     * @param nested whether openers inside the block open nested blocks
     */
    public KeywordBlockParser(Set<String> openers, String closer, boolean nested) {
        if (openers.isEmpty()) {
            throw new IllegalArgumentException("At least one opener keyword is required");
        }
        this.openers = Set.copyOf(openers);
        this.closer = Set.of(Objects.requireNonNull(closer, "closer must not be null"));
        this.nested = nested;
    }

    @Override
    public BlockResult parseBlock(
            List<Token> tokens,
            int startIndex,
            ParserState state,
            ContextType contextType,
            Map<String, Object> metadata) {
        if (startIndex < 0 || startIndex >= tokens.size() || !isKeyword(tokens, startIndex, openers)) {
            throw new IllegalArgumentException("Keyword block must start at one of " + openers
                + ", got index " + startIndex);
        }

        ContextFrame frame = state.push(contextType, metadata, startIndex);
        try {
            List<Integer> members = new ArrayList<>();
            int depth = 1;
            for (int index = startIndex + 1; index < tokens.size(); index++) {
                if (isKeyword(tokens, index, closer)) {
                    depth--;
                    if (depth == 0) {
                        return new BlockResult(members, index + 1, true, List.of());
                    }
                } else if (nested && isKeyword(tokens, index, openers)) {
                    depth++;
                }
                members.add(index);
            }
            return new BlockResult(members, tokens.size(), false, List.of());
        } finally {
            state.popTo(frame);
        }
    }

    private static boolean isKeyword(List<Token> tokens, int index, Set<String> words) {
        Token token = tokens.get(index);
        if (!token.is(TokenType.KEYWORD, TokenType.IDENTIFIER) || !words.contains(token.text())) {
            return false;
        }
        for (int i = index - 1; i >= 0; i--) {
            Token previous = tokens.get(i);
            if (previous.type().isTrivia() || previous.is(TokenType.NEWLINE)) {
                continue;
            }
            return !previous.is(TokenType.DOT);
        }
        return true;
    }
}
