package com.codeparse.core.parser.impl.rust;

import java.util.Map;
import java.util.Set;

import com.codeparse.core.lexical.ExclusionKind;
import com.codeparse.core.lexical.Lexer;
import com.codeparse.core.lexical.LexicalRules;
import com.codeparse.core.lexical.LiteralScan;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Tokenizer for Rust.
 *
 * <p>On top of the shared rules it handles the three uses of the apostrophe: character literals
 * ({@code 'a'}, {@code '\n'}, {@code b'x'}) become {@link TokenType#STRING} tokens, while
 * lifetimes and loop labels ({@code 'a}, {@code 'static}) become {@link TokenType#IDENTIFIER}
 * tokens whose text keeps the leading apostrophe. Raw strings ({@code r#"..."#}) and raw
 * identifiers ({@code r#type}) are single tokens. Block comments nest.
 */
public class RustLexer extends Lexer {

    /** Prefix of lifetime and label identifiers. */
    public static final String LIFETIME_PREFIX = "'";

    private static final Set<String> KEYWORDS = Set.of(
        "as", "async", "await", "break", "const", "continue", "crate", "dyn", "else", "enum",
        "extern", "false", "fn", "for", "if", "impl", "in", "let", "loop", "match", "mod", "move",
        "mut", "pub", "ref", "return", "self", "Self", "static", "struct", "super", "trait", "true",
        "type", "unsafe", "use", "where", "while");

    private static final LexicalRules RULES = LexicalRules.builder()
        .lineComments("//")
        .blockComment("/*", "*/")
        .nestedBlockComments(true)
        .stringDelimiters("\"")
        .stringPrefixes("b", "c")
        .singleLineStrings(false)
        .build();

    private static final Map<String, TokenType> PUNCTUATION = Map.of(
        "::", TokenType.OPERATOR,
        "=>", TokenType.FAT_ARROW,
        "..", TokenType.OPERATOR,
        "..=", TokenType.OPERATOR,
        "...", TokenType.OPERATOR,
        "#", TokenType.OPERATOR,
        "$", TokenType.OPERATOR);

    public RustLexer(String source) {
        super(source, RULES);
    }

    @Override
    protected Set<String> keywords() {
        return KEYWORDS;
    }

    @Override
    protected Map<String, TokenType> extraPunctuation() {
        return PUNCTUATION;
    }

    @Override
    protected boolean scanSpecial() {
        char c = peek(0);
        if (c == '\'') {
            return scanApostrophe(0);
        }
        if (c == 'b' && peek(1) == '\'') {
            return scanApostrophe(1);
        }
        if (c == 'r' && (peek(1) == '"' || peek(1) == '#')) {
            return scanRaw(1);
        }
        if ((c == 'b' || c == 'c') && peek(1) == 'r' && (peek(2) == '"' || peek(2) == '#')) {
            return scanRaw(2);
        }
        return false;
    }

    /**
     * Scans a character literal or a lifetime starting {@code prefix} characters ahead.
     */
    private boolean scanApostrophe(int prefix) {
        int quote = prefix;
        char first = peek(quote + 1);
        if (first == '\\') {
            int i = quote + 3;
            while (peek(i) != '\'' && peek(i) != '\n' && peek(i) != '\0') {
                i++;
            }
            if (peek(i) != '\'') {
                return false;
            }
            emit(TokenType.STRING, i + 1, Map.of(Token.DELIMITER, "'", Token.TERMINATED, true));
            return true;
        }
        if (first == '\0' || first == '\n' || first == '\r') {
            return false;
        }
        int start = position() + quote + 1;
        int codePoint = source.codePointAt(start);
        int width = Character.charCount(codePoint);
        if (peek(quote + 1 + width) == '\'') {
            emit(TokenType.STRING, quote + width + 2, Map.of(Token.DELIMITER, "'", Token.TERMINATED, true));
            return true;
        }
        if (prefix == 0 && isIdentifierStart(codePoint)) {
            int end = start + width;
            while (end < source.length() && isIdentifierPart(source.codePointAt(end))) {
                end += Character.charCount(source.codePointAt(end));
            }
            emit(TokenType.IDENTIFIER, end - position(), Map.of());
            return true;
        }
        return false;
    }

    /**
     * Scans {@code r"..."}, {@code r#"..."#} and their byte and C-string forms, or a raw
     * identifier {@code r#name}. {@code prefix} is the offset of the {@code #} or quote.
     */
    private boolean scanRaw(int prefix) {
        int hashes = 0;
        while (peek(prefix + hashes) == '#') {
            hashes++;
        }
        if (peek(prefix + hashes) != '"') {
            if (prefix == 1 && hashes == 1 && isIdentifierStart(peek(2))) {
                int end = position() + 2;
                while (end < source.length() && isIdentifierPart(source.codePointAt(end))) {
                    end += Character.charCount(source.codePointAt(end));
                }
                emit(TokenType.IDENTIFIER, end - position(), Map.of());
                return true;
            }
            return false;
        }
        String closer = "\"" + "#".repeat(hashes);
        int bodyStart = position() + prefix + hashes + 1;
        int close = source.indexOf(closer, bodyStart);
        boolean terminated = close >= 0;
        int end = terminated ? close + closer.length() : source.length();
        String delimiter = "#".repeat(hashes) + "\"";
        emitLiteral(new LiteralScan(ExclusionKind.STRING, delimiter, position(), end, terminated, null));
        return true;
    }
}
