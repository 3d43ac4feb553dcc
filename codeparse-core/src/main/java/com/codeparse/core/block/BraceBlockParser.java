package com.codeparse.core.block;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.codeparse.core.state.ContextFrame;
import com.codeparse.core.state.ContextType;
import com.codeparse.core.state.ParserState;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Brace-balancing block scanner.
 *
 * <p>Only nesting depth matters, so every brace placement style (K&amp;R, Allman, Whitesmiths,
 * GNU) yields the same members for equivalent code. Brace characters inside string, template,
 * comment and regex literals are never counted.
 *
 * <p>{@code startIndex} must point at an {@link TokenType#OPEN_BRACE} token.
 *
 * @since 1.0.0
 */
public class BraceBlockParser implements BlockParser {

    @Override
    public BlockResult parseBlock(
            List<Token> tokens,
            int startIndex,
            ParserState state,
            ContextType contextType,
            Map<String, Object> metadata) {
        if (startIndex < 0 || startIndex >= tokens.size() || !tokens.get(startIndex).is(TokenType.OPEN_BRACE)) {
            throw new IllegalArgumentException("Brace block must start at an opening brace, got index "
                + startIndex + (startIndex >= 0 && startIndex < tokens.size() ? " " + tokens.get(startIndex) : ""));
        }

        ContextFrame frame = state.push(contextType, metadata, startIndex);
        try {
            List<Integer> members = new ArrayList<>();
            int depth = 1;
            for (int index = startIndex + 1; index < tokens.size(); index++) {
                Token token = tokens.get(index);
                // literal tokens are exclusion zones; their text may contain braces
                if (!token.type().isLiteral()) {
                    if (token.is(TokenType.OPEN_BRACE)) {
                        depth++;
                    } else if (token.is(TokenType.CLOSE_BRACE)) {
                        depth--;
                        if (depth == 0) {
                            return new BlockResult(members, index + 1, true, List.of());
                        }
                    }
                }
                members.add(index);
            }
            return new BlockResult(members, tokens.size(), false, List.of());
        } finally {
            state.popTo(frame);
        }
    }
}
