package com.codeparse.core.token;

import java.util.Map;
import java.util.Objects;

/**
 * A lexical unit of source text.
 *
 * <p>Tokens are immutable and produced in strict source order. Line and column numbers are
 * 1-based; {@code offset} is the 0-based character index of the first character.
 *
 * <p><b>Metadata keys:</b></p>
 * <ul>
 *   <li>{@link #DELIMITER} - opening delimiter of a literal token (e.g. {@code """}, {@code //})</li>
 *   <li>{@link #TERMINATED} - whether a literal token found its closing delimiter</li>
 *   <li>{@link #INTERPOLATIONS} - {@code List<TextSpan>} of absolute spans of the
 *       {@code ${...}} expressions inside a template literal</li>
 *   <li>{@link #LINE_START} - whether a whitespace token is the indentation of its line</li>
 * </ul>
 *
 * @param type token category
 * @param text exact source text of the token
 * @param offset character offset in the source (0-based)
 * @param line line number (1-based)
 * @param column column number (1-based)
 * @param metadata additional lexer information (never null)
 * @since 1.0.0
 */
public record Token(
    TokenType type,
    String text,
    int offset,
    int line,
    int column,
    Map<String, Object> metadata
) {
    public static final String DELIMITER = "delimiter";
    public static final String TERMINATED = "terminated";
    public static final String INTERPOLATIONS = "interpolations";
    public static final String LINE_START = "lineStart";

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public Token(TokenType type, String text, int offset, int line, int column) {
        this(type, text, offset, line, column, Map.of());
    }

    /**
     * Check if the token is of any of the given types.
     */
    public boolean is(TokenType... types) {
        for (TokenType candidate : types) {
            if (type == candidate) {
                return true;
            }
        }
        return false;
    }

    /**
     * Check if the token is a keyword or identifier with one of the given spellings.
     *
     * <p>Soft keywords such as Python's {@code match} are lexed as identifiers, so both
     * categories are accepted.
     */
    public boolean isWord(String... words) {
        if (type != TokenType.KEYWORD && type != TokenType.IDENTIFIER) {
            return false;
        }
        for (String word : words) {
            if (text.equals(word)) {
                return true;
            }
        }
        return false;
    }

    public boolean isOperator(String operator) {
        return type == TokenType.OPERATOR && text.equals(operator);
    }

    /**
     * Returns the character offset just past this token.
     */
    public int endOffset() {
        return offset + text.length();
    }

    /**
     * Returns whether this literal token was closed by its delimiter.
     * Non-literal tokens are always considered terminated.
     */
    public boolean isTerminated() {
        Object terminated = metadata.get(TERMINATED);
        return !(terminated instanceof Boolean flag) || flag;
    }

    @Override
    public String toString() {
        return type + "('" + text + "' @" + line + ":" + column + ")";
    }
}
