package com.codeparse.core.parser;

import java.util.ArrayList;
import java.util.List;

import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Navigation helpers over token lists shared by the language parsers.
 *
 * <p>All ranges are half-open {@code [from, to)}. "Significant" tokens are everything except
 * whitespace, comments and line breaks. Literal tokens are single tokens, so brackets inside
 * strings, comments and regex literals never affect the bracket depth computed here.
 */
public final class TokenRanges {

    private TokenRanges() {
        // Utility class
    }

    public static boolean isSignificant(Token token) {
        return !token.type().isTrivia() && !token.is(TokenType.NEWLINE);
    }

    /**
     * Returns the index of the first significant token in {@code [from, to)}, or {@code to}.
     */
    public static int nextSignificant(List<Token> tokens, int from, int to) {
        int i = from;
        while (i < to && !isSignificant(tokens.get(i))) {
            i++;
        }
        return i;
    }

    /**
     * Returns the index of the last significant token before {@code before} and not below
     * {@code floor}, or -1.
     */
    public static int previousSignificant(List<Token> tokens, int before, int floor) {
        for (int i = before - 1; i >= floor; i--) {
            if (isSignificant(tokens.get(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Returns whether a line break occurs in {@code [from, to)}.
     */
    public static boolean hasNewline(List<Token> tokens, int from, int to) {
        for (int i = from; i < to; i++) {
            if (tokens.get(i).is(TokenType.NEWLINE)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Finds the bracket closing the one at {@code openIndex}, counting all three bracket kinds.
     *
     * @return index of the closing bracket, or -1 if it does not occur before {@code to}
     */
    public static int matchingClose(List<Token> tokens, int openIndex, int to) {
        int depth = 0;
        for (int i = openIndex; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type().isOpening()) {
                depth++;
            } else if (token.type().isClosing()) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Finds the {@code >} closing a generic parameter list opened by the {@code <} at
     * {@code openIndex}. Shift operators count as several angle brackets.
     *
     * @return index of the token holding the closing angle bracket, or -1
     */
    public static int matchingAngle(List<Token> tokens, int openIndex, int to) {
        int angles = 0;
        int brackets = 0;
        for (int i = openIndex; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type().isOpening()) {
                brackets++;
            } else if (token.type().isClosing()) {
                if (brackets == 0) {
                    return -1;
                }
                brackets--;
            } else if (brackets == 0 && token.is(TokenType.SEMICOLON)) {
                return -1;
            } else if (brackets == 0 && isAngles(token, '<')) {
                angles += token.text().length();
            } else if (brackets == 0 && isAngles(token, '>')) {
                angles -= token.text().length();
                if (angles <= 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    static boolean isAngles(Token token, char angle) {
        return token.is(TokenType.OPERATOR) && token.text().chars().allMatch(c -> c == angle);
    }

    /**
     * Finds the first token at bracket depth 0 within {@code [from, to)} of one of the types.
     *
     * @return index or -1
     */
    public static int findTopLevel(List<Token> tokens, int from, int to, TokenType... types) {
        int depth = 0;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (depth == 0 && token.is(types)) {
                return i;
            }
            if (token.type().isOpening()) {
                depth++;
            } else if (token.type().isClosing()) {
                depth = Math.max(0, depth - 1);
            }
        }
        return -1;
    }

    /**
     * Splits {@code [from, to)} at bracket-depth-0 separators. Empty segments are kept.
     *
     * @return list of {@code [start, end)} pairs
     */
    public static List<int[]> splitTopLevel(List<Token> tokens, int from, int to, TokenType separator) {
        List<int[]> segments = new ArrayList<>();
        int depth = 0;
        int start = from;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type().isOpening()) {
                depth++;
            } else if (token.type().isClosing()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.is(separator)) {
                segments.add(new int[] {start, i});
                start = i + 1;
            }
        }
        segments.add(new int[] {start, to});
        return segments;
    }

    /**
     * Splits {@code [from, to)} at top-level commas like {@link #splitTopLevel}, but also keeps
     * generic argument lists together: a {@code <} directly after an identifier opens an angle
     * group when a matching {@code >} follows, so {@code Map<K, V> a, b} yields two segments.
     *
     * @return list of {@code [start, end)} pairs
     */
    public static List<int[]> splitTypeAware(List<Token> tokens, int from, int to) {
        List<int[]> segments = new ArrayList<>();
        int depth = 0;
        int angles = 0;
        int start = from;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type().isOpening()) {
                depth++;
            } else if (token.type().isClosing()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.isOperator("<") && isIdentifier(tokens, previousSignificant(tokens, i, from))
                    && matchingAngle(tokens, i, to) >= 0) {
                angles++;
            } else if (depth == 0 && angles > 0 && isAngles(token, '>')) {
                angles = Math.max(0, angles - token.text().length());
            } else if (depth == 0 && angles == 0 && token.is(TokenType.COMMA)) {
                segments.add(new int[] {start, i});
                start = i + 1;
            }
        }
        segments.add(new int[] {start, to});
        return segments;
    }

    private static boolean isIdentifier(List<Token> tokens, int index) {
        return index >= 0 && tokens.get(index).is(TokenType.IDENTIFIER);
    }

    /**
     * Returns whether {@code [from, to)} holds no significant token.
     */
    public static boolean isBlank(List<Token> tokens, int from, int to) {
        return nextSignificant(tokens, from, to) >= to;
    }
}
