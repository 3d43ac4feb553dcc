package com.codeparse.core.block;

import java.util.List;
import java.util.Map;

import com.codeparse.core.state.ContextType;
import com.codeparse.core.state.ParserState;
import com.codeparse.core.token.Token;

/**
 * Language-agnostic "find the end of the block that starts here" algorithm.
 *
 * <p>Implementations push a frame of {@code contextType} onto {@code state} before scanning and pop
 * it again on every return path. Reaching end of input is not an error; the result then reports
 * {@code terminated == false} and {@code nextIndex == tokens.size()}.
 *
 * <p>Calling a block parser with a {@code startIndex} that does not point at a block opener is a
 * programming error and is rejected with {@link IllegalArgumentException}.
 *
 * @see BraceBlockParser
 * @see IndentationBlockParser
 * @since 1.0.0
 */
public interface BlockParser {

    /**
     * Scans the block that starts at {@code startIndex}.
     *
     * @param tokens full token sequence
     * @param startIndex index of the block opener (see implementations for the exact contract)
     * @param state context stack of the current parse
     * @param contextType type of the frame to push while scanning
     * @param metadata metadata of the pushed frame (may be null)
     * @return block members and the index just past the block
     * @throws IllegalArgumentException if {@code startIndex} does not point at a block opener
     */
    BlockResult parseBlock(
        List<Token> tokens,
        int startIndex,
        ParserState state,
        ContextType contextType,
        Map<String, Object> metadata
    );
}
