package com.codeparse.core.block;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.codeparse.core.diagnostic.ParseWarning;
import com.codeparse.core.diagnostic.WarningKind;
import com.codeparse.core.state.ContextFrame;
import com.codeparse.core.state.ContextType;
import com.codeparse.core.state.ParserState;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Indentation-tracking block scanner for off-side rule languages.
 *
 * <p>{@code startIndex} must be the token immediately following the block-introducing
 * {@link TokenType#COLON} or {@link TokenType#NEWLINE}. The indentation of the logical line holding
 * that opener is the block's baseline:
 * <ul>
 *   <li>if the opener line continues with code after the colon, the block is that inline suite;</li>
 *   <li>otherwise every following line indented strictly deeper than the baseline belongs to the
 *       block, and the first line at or below the baseline ends it;</li>
 *   <li>blank and comment-only lines never end the block and never set its indentation;</li>
 *   <li>lines inside open parentheses, brackets or braces are continuation lines and are not
 *       measured.</li>
 * </ul>
 *
 * <p>A bracket left open ends its logical line early at the first following line that starts
 * with one of the configured construct introducers (such as {@code def} or {@code @}) at or
 * below the indentation of the line holding the bracket. Without introducers an unclosed
 * bracket runs to end of input.
 *
 * <p>Tabs are expanded to the configured tab width. A line whose relation to the baseline would
 * change if tabs counted as one column is classified by the configured width and reported as
 * {@link WarningKind#AMBIGUOUS_INDENTATION}; so is a dedent that lands between the baseline and
 * the body's indentation.
 *
 * @since 1.0.0
 */
public class IndentationBlockParser implements BlockParser {

    private final int tabWidth;
    private final Set<String> introducers;

    public IndentationBlockParser() {
        this(IndentationWidth.DEFAULT_TAB_WIDTH);
    }

    public IndentationBlockParser(int tabWidth) {
        this(tabWidth, Set.of());
    }

    /**
     * @param tabWidth tab stop width, must be positive
     * @param introducers words (or {@code "@"}) that start a construct at the beginning of a line;
     *                    such a line ends a logical line whose bracket was never closed
     */
    public IndentationBlockParser(int tabWidth, Set<String> introducers) {
        if (tabWidth < 1) {
            throw new IllegalArgumentException("tabWidth must be positive: " + tabWidth);
        }
        this.tabWidth = tabWidth;
        this.introducers = Set.copyOf(introducers);
    }

    public int tabWidth() {
        return tabWidth;
    }

    /**
     * Returns the end of the logical line starting at {@code from} under this parser's tab width
     * and construct introducers.
     */
    public int lineEnd(List<Token> tokens, int from) {
        return logicalLineEnd(tokens, from, introducers, tabWidth);
    }

    @Override
    public BlockResult parseBlock(
            List<Token> tokens,
            int startIndex,
            ParserState state,
            ContextType contextType,
            Map<String, Object> metadata) {
        if (startIndex < 1 || startIndex > tokens.size()
                || !tokens.get(startIndex - 1).is(TokenType.COLON, TokenType.NEWLINE)) {
            throw new IllegalArgumentException(
                "Indentation block must start right after a colon or line break, got index " + startIndex);
        }

        ContextFrame frame = state.push(contextType, metadata, startIndex);
        try {
            return scan(tokens, startIndex);
        } finally {
            state.popTo(frame);
        }
    }

    private BlockResult scan(List<Token> tokens, int startIndex) {
        Token opener = tokens.get(startIndex - 1);
        int headerLineStart = logicalLineStart(tokens, opener.is(TokenType.NEWLINE) ? startIndex - 2 : startIndex - 1);
        String headerWhitespace = leadingWhitespace(tokens, headerLineStart);
        int baseline = IndentationWidth.measure(headerWhitespace, tabWidth);
        int baselineNarrow = IndentationWidth.measure(headerWhitespace, 1);

        List<Integer> members = new ArrayList<>();
        List<ParseWarning> diagnostics = new ArrayList<>();
        int index = startIndex;

        if (opener.is(TokenType.COLON)) {
            int headerEnd = lineEnd(tokens, startIndex);
            if (!isTrivial(tokens, startIndex, headerEnd)) {
                addRange(members, startIndex, headerEnd);
                return new BlockResult(members, headerEnd, true, diagnostics);
            }
            addRange(members, startIndex, headerEnd);
            index = headerEnd;
        }

        int bodyIndent = -1;
        while (index < tokens.size()) {
            int lineEnd = lineEnd(tokens, index);
            if (isTrivial(tokens, index, lineEnd)) {
                addRange(members, index, lineEnd);
                index = lineEnd;
                continue;
            }
            String whitespace = leadingWhitespace(tokens, index);
            int width = IndentationWidth.measure(whitespace, tabWidth);
            int narrow = IndentationWidth.measure(whitespace, 1);
            Token first = tokens.get(index);
            if ((width > baseline) != (narrow > baselineNarrow)) {
                diagnostics.add(new ParseWarning(WarningKind.AMBIGUOUS_INDENTATION,
                    "Indentation is ambiguous with mixed tabs and spaces (tab width " + tabWidth + ")",
                    first.line(), first.column()));
            }
            if (width <= baseline) {
                break;
            }
            if (bodyIndent < 0) {
                bodyIndent = width;
            } else if (width < bodyIndent) {
                diagnostics.add(new ParseWarning(WarningKind.AMBIGUOUS_INDENTATION,
                    "Dedent to width " + width + " does not match the block indentation " + bodyIndent,
                    first.line(), first.column()));
            }
            addRange(members, index, lineEnd);
            index = lineEnd;
        }

        if (bodyIndent < 0) {
            boolean atEnd = index >= tokens.size();
            if (!atEnd) {
                Token next = tokens.get(index);
                diagnostics.add(new ParseWarning(WarningKind.UNEXPECTED_TOKEN,
                    "Expected an indented block", next.line(), next.column()));
            }
            return new BlockResult(members, index, !atEnd, diagnostics);
        }
        return new BlockResult(members, index, true, diagnostics);
    }

    /**
     * Returns the index just past the line break that ends the logical line starting at
     * {@code from}, or the token count. Line breaks inside open brackets do not end the line.
     */
    public static int logicalLineEnd(List<Token> tokens, int from) {
        return logicalLineEnd(tokens, from, Set.of(), IndentationWidth.DEFAULT_TAB_WIDTH);
    }

    /**
     * Like {@link #logicalLineEnd(List, int)}, but a line break inside an open bracket also ends
     * the line when the next line starts with one of {@code introducers} at or below the
     * indentation of the line holding {@code from}.
     */
    public static int logicalLineEnd(List<Token> tokens, int from, Set<String> introducers, int tabWidth) {
        int depth = 0;
        int indent = -1;
        for (int i = from; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type().isOpening()) {
                depth++;
            } else if (token.type().isClosing()) {
                depth = Math.max(0, depth - 1);
            } else if (token.is(TokenType.NEWLINE)) {
                if (depth == 0) {
                    return i + 1;
                }
                if (!introducers.isEmpty() && startsConstruct(tokens, i + 1, introducers)) {
                    if (indent < 0) {
                        indent = IndentationWidth.measure(leadingWhitespace(tokens, physicalLineStart(tokens, from)), tabWidth);
                    }
                    if (IndentationWidth.measure(leadingWhitespace(tokens, i + 1), tabWidth) <= indent) {
                        return i + 1;
                    }
                }
            }
        }
        return tokens.size();
    }

    private static boolean startsConstruct(List<Token> tokens, int lineStart, Set<String> introducers) {
        int i = lineStart;
        while (i < tokens.size() && tokens.get(i).is(TokenType.WHITESPACE)) {
            i++;
        }
        if (i >= tokens.size()) {
            return false;
        }
        Token token = tokens.get(i);
        if (token.is(TokenType.AT)) {
            return introducers.contains("@");
        }
        if (!token.is(TokenType.KEYWORD, TokenType.IDENTIFIER) || !introducers.contains(token.text())) {
            return false;
        }
        if (token.isWord("async")) {
            int next = i + 1;
            while (next < tokens.size() && tokens.get(next).is(TokenType.WHITESPACE)) {
                next++;
            }
            return next < tokens.size() && !tokens.get(next).isWord("async") && introducers.contains(tokens.get(next).text());
        }
        return true;
    }

    private static int physicalLineStart(List<Token> tokens, int index) {
        for (int i = Math.min(index, tokens.size()) - 1; i >= 0; i--) {
            if (tokens.get(i).is(TokenType.NEWLINE)) {
                return i + 1;
            }
        }
        return 0;
    }

    /**
     * Returns the index of the first token of the logical line containing {@code index}.
     */
    public static int logicalLineStart(List<Token> tokens, int index) {
        int depth = 0;
        for (int i = Math.min(index, tokens.size() - 1); i >= 0; i--) {
            Token token = tokens.get(i);
            if (token.type().isClosing()) {
                depth++;
            } else if (token.type().isOpening()) {
                depth = Math.max(0, depth - 1);
            } else if (token.is(TokenType.NEWLINE) && depth == 0) {
                return i + 1;
            }
        }
        return 0;
    }

    private static String leadingWhitespace(List<Token> tokens, int lineStart) {
        if (lineStart < tokens.size() && tokens.get(lineStart).is(TokenType.WHITESPACE)) {
            return tokens.get(lineStart).text();
        }
        return "";
    }

    private static boolean isTrivial(List<Token> tokens, int from, int to) {
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (!token.type().isTrivia() && !token.is(TokenType.NEWLINE)) {
                return false;
            }
        }
        return true;
    }

    private static void addRange(List<Integer> members, int from, int to) {
        for (int i = from; i < to; i++) {
            members.add(i);
        }
    }
}
