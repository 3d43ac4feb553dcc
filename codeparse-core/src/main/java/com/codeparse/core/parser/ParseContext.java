package com.codeparse.core.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.codeparse.core.ast.AstNode;
import com.codeparse.core.ast.NodeProperties;
import com.codeparse.core.ast.NodeTypes;
import com.codeparse.core.config.ParserConfig;
import com.codeparse.core.diagnostic.ParseWarning;
import com.codeparse.core.diagnostic.WarningKind;
import com.codeparse.core.state.ParserState;
import com.codeparse.core.symbol.SymbolTable;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Mutable state of a single parse call.
 *
 * <p>Created fresh by {@link AbstractLanguageParser#parse(String)} and discarded after the
 * {@link com.codeparse.core.ast.ParseResult} has been built, so parser instances stay free of
 * per-call state.
 */
public final class ParseContext {

    private final String source;
    private final List<Token> tokens;
    private final ParserConfig config;
    private final ParserState state = new ParserState();
    private final SymbolTable symbolTable = new SymbolTable();
    private final List<ParseWarning> warnings = new ArrayList<>();
    private final AstNode root;

    public ParseContext(String source, List<Token> tokens, ParserConfig config, String language) {
        this.source = Objects.requireNonNull(source, "source must not be null");
        this.tokens = List.copyOf(tokens);
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.root = new AstNode(NodeTypes.MODULE);
        root.setProperty(NodeProperties.LANGUAGE, language);
        root.setProperty(NodeProperties.LINE, 1);
        root.setProperty(NodeProperties.SCOPE_ID, ParserState.MODULE_SCOPE);
        symbolTable.declareScope(ParserState.MODULE_SCOPE, null);
    }

    public String source() {
        return source;
    }

    public List<Token> tokens() {
        return tokens;
    }

    public Token token(int index) {
        return tokens.get(index);
    }

    public int size() {
        return tokens.size();
    }

    public ParserConfig config() {
        return config;
    }

    public ParserState state() {
        return state;
    }

    public SymbolTable symbolTable() {
        return symbolTable;
    }

    public AstNode root() {
        return root;
    }

    public List<ParseWarning> warnings() {
        return warnings;
    }

    public void warn(ParseWarning warning) {
        warnings.add(warning);
    }

    public void warn(WarningKind kind, String message, Token at) {
        warnings.add(new ParseWarning(kind, message, at != null ? at.line() : 1, at != null ? at.column() : 1));
    }

    /**
     * Returns the source text covered by the significant tokens of {@code [from, to)}, or an empty
     * string if there are none.
     */
    public String text(int from, int to) {
        int first = TokenRanges.nextSignificant(tokens, from, Math.min(to, tokens.size()));
        int last = TokenRanges.previousSignificant(tokens, Math.min(to, tokens.size()), from);
        if (first >= to || last < first) {
            return "";
        }
        return source.substring(tokens.get(first).offset(), tokens.get(last).endOffset());
    }

    /**
     * Returns the raw source text of {@code [from, to)} including trivia, trimmed.
     */
    public String rawText(int from, int to) {
        if (from >= to || from >= tokens.size()) {
            return "";
        }
        int end = Math.min(to, tokens.size());
        return source.substring(tokens.get(from).offset(), tokens.get(end - 1).endOffset()).strip();
    }

    /**
     * Returns the comma-separated arguments between the angle brackets at {@code open} and
     * {@code close}. When {@code close} is a {@code >>} that also ends a nested argument list,
     * the last argument gets its missing brackets back.
     */
    public List<String> angleArguments(int open, int close) {
        List<String> arguments = new ArrayList<>();
        int depth = 0;
        int start = open + 1;
        for (int i = open + 1; i < close; i++) {
            Token token = tokens.get(i);
            if (token.type().isOpening()) {
                depth++;
            } else if (TokenRanges.isAngles(token, '<')) {
                depth += token.text().length();
            } else if (token.type().isClosing()) {
                depth = Math.max(0, depth - 1);
            } else if (TokenRanges.isAngles(token, '>')) {
                depth = Math.max(0, depth - token.text().length());
            } else if (depth == 0 && token.is(TokenType.COMMA)) {
                addArgument(arguments, text(start, i));
                start = i + 1;
            }
        }
        addArgument(arguments, depth > 0 ? text(start, close) + ">".repeat(depth) : text(start, close));
        return arguments;
    }

    private static void addArgument(List<String> arguments, String text) {
        if (!text.isEmpty()) {
            arguments.add(text);
        }
    }
}
