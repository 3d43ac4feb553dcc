package com.codeparse.core.lexical;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import com.codeparse.core.diagnostic.ParseWarning;
import com.codeparse.core.diagnostic.WarningKind;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Shared character scanner for all languages.
 *
 * <p>Subclasses provide the keyword set, the punctuation table and the {@link LexicalRules}
 * describing their literals. The base class handles position tracking, line breaks, whitespace,
 * numbers, Unicode identifiers and delegates every literal to an {@link ExclusionScanner}.
 *
 * <p>A lexer instance tokenizes exactly one source string and must not be reused.
 *
 * @since 1.0.0
 */
public abstract class Lexer {

    private static final int MAX_PUNCTUATION_LENGTH = 4;

    private static final Map<String, TokenType> COMMON_PUNCTUATION = Map.ofEntries(
        Map.entry("{", TokenType.OPEN_BRACE),
        Map.entry("}", TokenType.CLOSE_BRACE),
        Map.entry("(", TokenType.OPEN_PAREN),
        Map.entry(")", TokenType.CLOSE_PAREN),
        Map.entry("[", TokenType.OPEN_BRACKET),
        Map.entry("]", TokenType.CLOSE_BRACKET),
        Map.entry(":", TokenType.COLON),
        Map.entry(";", TokenType.SEMICOLON),
        Map.entry(",", TokenType.COMMA),
        Map.entry(".", TokenType.DOT),
        Map.entry("@", TokenType.AT),
        Map.entry("=", TokenType.EQUALS),
        Map.entry("->", TokenType.ARROW)
    );

    private static final String COMMON_OPERATORS =
        "+ - * / % < > ! ~ ^ & | ? == != <= >= && || ++ -- += -= *= /= %= &= |= ^= << >> <<= >>=";

    protected final String source;
    protected final ExclusionScanner exclusions;

    private final Map<String, TokenType> punctuation = new HashMap<>();
    private final List<Token> tokens = new ArrayList<>();
    private final List<ParseWarning> warnings = new ArrayList<>();

    private int pos;
    private int line = 1;
    private int column = 1;
    private boolean consumed;

    protected Lexer(String source, LexicalRules rules) {
        this.source = source != null ? source : "";
        this.exclusions = new ExclusionScanner(rules);
        punctuation.putAll(COMMON_PUNCTUATION);
        for (String operator : COMMON_OPERATORS.split(" ")) {
            punctuation.put(operator, TokenType.OPERATOR);
        }
        punctuation.putAll(extraPunctuation());
    }

    /**
     * Reserved words of the language. Soft keywords are lexed as identifiers.
     */
    protected abstract Set<String> keywords();

    /**
     * Additional punctuation and operators beyond the common C-like set.
     */
    protected Map<String, TokenType> extraPunctuation() {
        return Map.of();
    }

    /**
     * Decides whether a slash at the current position starts a regex literal.
     * Only consulted when the rules enable regex literals.
     *
     * @param previous previous significant token, or null at start of input
     */
    protected boolean regexAllowedAfter(Token previous) {
        return false;
    }

    /**
     * Hook for language-specific constructs checked before the generic rules.
     *
     * @return true if the hook consumed input
     */
    protected boolean scanSpecial() {
        return false;
    }

    protected boolean isIdentifierStart(int codePoint) {
        return codePoint == '_' || Character.isUnicodeIdentifierStart(codePoint);
    }

    protected boolean isIdentifierPart(int codePoint) {
        return codePoint == '_' || Character.isUnicodeIdentifierPart(codePoint) && !Character.isIdentifierIgnorable(codePoint);
    }

    /**
     * Tokenizes the whole source.
     *
     * @return tokens and lexical warnings
     */
    public LexResult tokenize() {
        if (consumed) {
            throw new IllegalStateException("Lexer instances tokenize a single source once");
        }
        consumed = true;
        while (pos < source.length()) {
            int before = pos;
            scanToken();
            if (pos == before) {
                emit(TokenType.UNKNOWN, Character.charCount(source.codePointAt(pos)), Map.of());
            }
        }
        return new LexResult(tokens, warnings);
    }

    private void scanToken() {
        char c = source.charAt(pos);
        if (c == '\n' || c == '\r') {
            int length = c == '\r' && peek(1) == '\n' ? 2 : 1;
            emit(TokenType.NEWLINE, length, Map.of());
            return;
        }
        if (c == ' ' || c == '\t' || c == '\f') {
            int end = pos;
            while (end < source.length() && isInlineSpace(source.charAt(end))) {
                end++;
            }
            emit(TokenType.WHITESPACE, end - pos, Map.of(Token.LINE_START, column == 1));
            return;
        }
        if (scanSpecial()) {
            return;
        }
        Optional<ExclusionScanner.Opener> opener = exclusions.openerAt(source, pos);
        if (opener.isPresent()) {
            emitLiteral(exclusions.scan(source, pos, opener.get()));
            return;
        }
        if (c == '/' && exclusions.rules().regexLiterals() && regexAllowedAfter(lastSignificant())) {
            emitLiteral(exclusions.scanRegex(source, pos));
            return;
        }
        if (Character.isDigit(c) || c == '.' && Character.isDigit(peek(1))) {
            emit(TokenType.NUMBER, numberLength(), Map.of());
            return;
        }
        int codePoint = source.codePointAt(pos);
        if (isIdentifierStart(codePoint)) {
            int end = pos + Character.charCount(codePoint);
            while (end < source.length() && isIdentifierPart(source.codePointAt(end))) {
                end += Character.charCount(source.codePointAt(end));
            }
            String word = source.substring(pos, end);
            emit(keywords().contains(word) ? TokenType.KEYWORD : TokenType.IDENTIFIER, end - pos, Map.of());
            return;
        }
        for (int length = Math.min(MAX_PUNCTUATION_LENGTH, source.length() - pos); length > 0; length--) {
            TokenType type = punctuation.get(source.substring(pos, pos + length));
            if (type != null) {
                emit(type, length, Map.of());
                return;
            }
        }
        emit(TokenType.UNKNOWN, Character.charCount(codePoint), Map.of());
    }

    private static boolean isInlineSpace(char c) {
        return c == ' ' || c == '\t' || c == '\f';
    }

    private int numberLength() {
        int end = pos;
        while (end < source.length()) {
            char c = source.charAt(end);
            if (Character.isLetterOrDigit(c) || c == '_') {
                end++;
            } else if (c == '.' && end + 1 < source.length() && Character.isDigit(source.charAt(end + 1))) {
                end++;
            } else if ((c == '+' || c == '-') && end > pos
                    && (source.charAt(end - 1) == 'e' || source.charAt(end - 1) == 'E')
                    && !source.startsWith("0x", pos) && !source.startsWith("0X", pos)) {
                end++;
            } else {
                break;
            }
        }
        return end - pos;
    }

    /**
     * Emits a scanned literal at the current position, warning when it is unterminated.
     */
    protected void emitLiteral(LiteralScan scan) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put(Token.DELIMITER, scan.delimiter());
        metadata.put(Token.TERMINATED, scan.terminated());
        if (scan.kind() == ExclusionKind.TEMPLATE) {
            metadata.put(Token.INTERPOLATIONS, scan.interpolations());
        }
        if (!scan.terminated()) {
            warnings.add(new ParseWarning(
                WarningKind.LEXICAL_UNTERMINATED,
                "Unterminated " + describe(scan.kind()) + " opened by " + scan.delimiter(),
                line, column));
        }
        emit(scan.kind().tokenType(), scan.end() - scan.start(), metadata);
    }

    private static String describe(ExclusionKind kind) {
        return switch (kind) {
            case STRING -> "string literal";
            case TEMPLATE -> "template literal";
            case LINE_COMMENT, BLOCK_COMMENT -> "comment";
            case REGEX -> "regex literal";
        };
    }

    /**
     * Appends a token starting at the current position and advances past it. A non-positive
     * length is widened to the current code point so every token consumes input.
     */
    protected void emit(TokenType type, int length, Map<String, Object> metadata) {
        if (length <= 0) {
            length = Character.charCount(source.codePointAt(pos));
        }
        String text = source.substring(pos, pos + length);
        tokens.add(new Token(type, text, pos, line, column, metadata));
        advance(length);
    }

    private void advance(int length) {
        int end = pos + length;
        while (pos < end) {
            char c = source.charAt(pos);
            if (c == '\n' || c == '\r' && (pos + 1 >= source.length() || source.charAt(pos + 1) != '\n')) {
                line++;
                column = 1;
            } else if (c != '\r') {
                column++;
            }
            pos++;
        }
    }

    protected char peek(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    protected int position() {
        return pos;
    }

    /**
     * Returns the last token that is neither whitespace, comment nor line break.
     */
    protected Token lastSignificant() {
        for (int i = tokens.size() - 1; i >= 0; i--) {
            Token token = tokens.get(i);
            if (!token.type().isTrivia() && token.type() != TokenType.NEWLINE) {
                return token;
            }
        }
        return null;
    }
}
