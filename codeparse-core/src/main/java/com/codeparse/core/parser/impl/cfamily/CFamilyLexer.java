package com.codeparse.core.parser.impl.cfamily;

import java.util.Map;
import java.util.Set;

import com.codeparse.core.lexical.Lexer;
import com.codeparse.core.lexical.LexicalRules;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Tokenizer shared by C, C++ and Java.
 *
 * <p>For C and C++ a {@code #} that opens a line starts a preprocessor directive. The directive,
 * including backslash-continued lines, becomes a single {@link TokenType#COMMENT} token whose
 * {@link Token#DELIMITER} is {@link #DIRECTIVE_DELIMITER}, so braces inside macros never reach the
 * block parser.
 */
public class CFamilyLexer extends Lexer {

    public static final String DIRECTIVE_DELIMITER = "#";

    /**
     * Language variant recognized by the lexer.
     */
    public enum Dialect {
        C, CPP, JAVA
    }

    private static final Set<String> C_KEYWORDS = Set.of(
        "auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else",
        "enum", "extern", "float", "for", "goto", "if", "inline", "int", "long", "register",
        "restrict", "return", "short", "signed", "sizeof", "static", "struct", "switch", "typedef",
        "union", "unsigned", "void", "volatile", "while", "_Bool", "_Static_assert");

    private static final Set<String> CPP_KEYWORDS = Set.of(
        "auto", "bool", "break", "case", "catch", "char", "class", "const", "constexpr",
        "const_cast", "continue", "decltype", "default", "delete", "do", "double", "dynamic_cast",
        "else", "enum", "explicit", "export", "extern", "false", "float", "for", "friend", "goto",
        "if", "inline", "int", "long", "mutable", "namespace", "new", "noexcept", "nullptr",
        "operator", "private", "protected", "public", "register", "reinterpret_cast", "return",
        "short", "signed", "sizeof", "static", "static_assert", "static_cast", "struct", "switch",
        "template", "this", "throw", "true", "try", "typedef", "typename", "union", "unsigned",
        "using", "virtual", "void", "volatile", "while");

    private static final Set<String> JAVA_KEYWORDS = Set.of(
        "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class",
        "const", "continue", "default", "do", "double", "else", "enum", "extends", "final",
        "finally", "float", "for", "goto", "if", "implements", "import", "instanceof", "int",
        "interface", "long", "native", "new", "package", "private", "protected", "public",
        "return", "short", "static", "strictfp", "super", "switch", "synchronized", "this",
        "throw", "throws", "transient", "try", "void", "volatile", "while", "true", "false",
        "null");

    private static final LexicalRules C_RULES = LexicalRules.builder()
        .lineComments("//")
        .blockComment("/*", "*/")
        .stringDelimiters("\"", "'")
        .stringPrefixes("L", "u8", "u", "U")
        .singleLineStrings(true)
        .build();

    private static final LexicalRules JAVA_RULES = LexicalRules.builder()
        .lineComments("//")
        .blockComment("/*", "*/")
        .stringDelimiters("\"\"\"", "\"", "'")
        .singleLineStrings(true)
        .build();

    private static final Map<String, TokenType> PUNCTUATION = Map.of(
        "::", TokenType.OPERATOR,
        "...", TokenType.OPERATOR,
        "<=>", TokenType.OPERATOR,
        ">>>", TokenType.OPERATOR,
        ">>>=", TokenType.OPERATOR);

    private final Dialect dialect;

    public CFamilyLexer(String source, Dialect dialect) {
        super(source, dialect == Dialect.JAVA ? JAVA_RULES : C_RULES);
        this.dialect = dialect;
    }

    public Dialect dialect() {
        return dialect;
    }

    @Override
    protected Set<String> keywords() {
        return switch (dialect) {
            case C -> C_KEYWORDS;
            case CPP -> CPP_KEYWORDS;
            case JAVA -> JAVA_KEYWORDS;
        };
    }

    @Override
    protected Map<String, TokenType> extraPunctuation() {
        return PUNCTUATION;
    }

    @Override
    protected boolean isIdentifierStart(int codePoint) {
        return dialect == Dialect.JAVA && codePoint == '$' || super.isIdentifierStart(codePoint);
    }

    @Override
    protected boolean isIdentifierPart(int codePoint) {
        return dialect == Dialect.JAVA && codePoint == '$' || super.isIdentifierPart(codePoint);
    }

    @Override
    protected boolean scanSpecial() {
        if (dialect == Dialect.JAVA || peek(0) != '#' || !atLineStart()) {
            return false;
        }
        int length = 0;
        while (true) {
            char c = peek(length);
            if (c == '\0') {
                break;
            }
            if (c == '\\' && (peek(length + 1) == '\n' || peek(length + 1) == '\r')) {
                length += peek(length + 1) == '\r' && peek(length + 2) == '\n' ? 3 : 2;
                continue;
            }
            if (c == '\n' || c == '\r') {
                break;
            }
            length++;
        }
        emit(TokenType.COMMENT, length, Map.of(Token.DELIMITER, DIRECTIVE_DELIMITER, Token.TERMINATED, true));
        return true;
    }

    private boolean atLineStart() {
        for (int i = position() - 1; i >= 0; i--) {
            char c = source.charAt(i);
            if (c == '\n' || c == '\r') {
                return true;
            }
            if (c != ' ' && c != '\t') {
                return false;
            }
        }
        return true;
    }
}
