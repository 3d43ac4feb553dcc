package com.codeparse.core.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeparse.core.ast.AstNode;
import com.codeparse.core.ast.NodeProperties;
import com.codeparse.core.ast.NodeTypes;
import com.codeparse.core.ast.ParseResult;
import com.codeparse.core.block.BlockResult;
import com.codeparse.core.config.ParserConfig;
import com.codeparse.core.diagnostic.ParseWarning;
import com.codeparse.core.diagnostic.WarningKind;
import com.codeparse.core.lexical.LexResult;
import com.codeparse.core.lexical.Lexer;
import com.codeparse.core.state.ContextFrame;
import com.codeparse.core.state.ContextType;
import com.codeparse.core.symbol.Symbol;
import com.codeparse.core.symbol.SymbolKind;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Abstract base class for language parsers providing the parse pipeline and shared helpers.
 *
 * <p>{@link #parse(String)} is a template method:
 * <ol>
 *   <li>tokenize with the language's {@link Lexer} ({@link #createLexer(String)})</li>
 *   <li>create a fresh {@link ParseContext}</li>
 *   <li>walk the tokens ({@link #parseModule(ParseContext)})</li>
 *   <li>attach warnings to the root and copy scope parentage into the symbol table</li>
 * </ol>
 *
 * <p>Subclasses get helpers for building nodes, registering symbols, entering and leaving
 * scopes, and recording error nodes and unterminated constructs:
 * <ul>
 *   <li>{@link #node(ParseContext, String, int)} - node positioned at a token</li>
 *   <li>{@link #declare(ParseContext, String, SymbolKind, Token)} - symbol in the current scope</li>
 *   <li>{@link #enterScope(ParseContext, ContextType, String, int)} / {@link #exitScope(ParseContext, ContextFrame)}</li>
 *   <li>{@link #errorNode(ParseContext, AstNode, int, int, String)} - recovery placeholder</li>
 * </ul>
 *
 * @see LanguageParser
 * @since 1.0.0
 */
public abstract class AbstractLanguageParser implements LanguageParser {

    /**
     * Logger instance for this parser.
     * Automatically initialized with the concrete parser class name.
     */
    protected final Logger log;

    protected final ParserConfig config;

    protected AbstractLanguageParser(ParserConfig config) {
        this.log = LoggerFactory.getLogger(getClass());
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public ParserConfig getConfig() {
        return config;
    }

    @Override
    public final ParseResult parse(String source) {
        String text = source != null ? source : "";
        LexResult lexed = createLexer(text).tokenize();
        ParseContext ctx = new ParseContext(text, lexed.tokens(), config, getLanguage());
        lexed.warnings().forEach(ctx::warn);

        parseModule(ctx);

        AstNode root = ctx.root();
        if (!ctx.tokens().isEmpty()) {
            root.setProperty(NodeProperties.END_LINE, ctx.token(ctx.size() - 1).line());
        }
        List<Map<String, Object>> warningMaps = new ArrayList<>();
        for (ParseWarning warning : ctx.warnings()) {
            warningMaps.add(warning.toMap());
        }
        root.setProperty(NodeProperties.WARNINGS, warningMaps);
        ctx.state().scopeParents().forEach(ctx.symbolTable()::declareScope);

        log.debug("Parsed {} source: {} tokens, {} symbols, {} warnings",
            getLanguage(), ctx.size(), ctx.symbolTable().size(), ctx.warnings().size());
        return new ParseResult(root, ctx.symbolTable(), ctx.warnings());
    }

    /**
     * Creates a lexer for one source string.
     */
    protected abstract Lexer createLexer(String source);

    /**
     * Walks all tokens and attaches the recognized constructs to {@code ctx.root()}.
     */
    protected abstract void parseModule(ParseContext ctx);

    // ==================== Node Helpers ====================

    /**
     * Creates a node positioned at the token at {@code index}.
     */
    protected AstNode node(ParseContext ctx, String type, int index) {
        AstNode node = new AstNode(type);
        if (index < ctx.size()) {
            Token token = ctx.token(index);
            node.setProperty(NodeProperties.LINE, token.line());
            node.setProperty(NodeProperties.COLUMN, token.column());
        } else if (ctx.size() > 0) {
            node.setProperty(NodeProperties.LINE, ctx.token(ctx.size() - 1).line());
            node.setProperty(NodeProperties.COLUMN, ctx.token(ctx.size() - 1).column());
        } else {
            node.setProperty(NodeProperties.LINE, 1);
            node.setProperty(NodeProperties.COLUMN, 1);
        }
        if (ctx.config().output().includeTokenIndices()) {
            node.setProperty(NodeProperties.START_INDEX, index);
        }
        return node;
    }

    /**
     * Records the extent of a finished construct: end line and, when configured, end index.
     *
     * @param end index just past the construct's last token
     */
    protected void finish(ParseContext ctx, AstNode node, int start, int end) {
        int last = TokenRanges.previousSignificant(ctx.tokens(), Math.min(end, ctx.size()), start);
        if (last >= 0) {
            node.setProperty(NodeProperties.END_LINE, ctx.token(last).line());
        }
        if (ctx.config().output().includeTokenIndices()) {
            node.setProperty(NodeProperties.END_INDEX, end);
        }
    }

    /**
     * Creates a {@link NodeTypes#BLOCK} node for a block parser result.
     */
    protected AstNode blockNode(ParseContext ctx, int openerIndex, BlockResult block) {
        AstNode node = node(ctx, NodeTypes.BLOCK, openerIndex);
        if (ctx.config().output().includeTokenIndices()) {
            node.setProperty(NodeProperties.MEMBER_INDICES, block.memberIndices());
        }
        block.diagnostics().forEach(ctx::warn);
        finish(ctx, node, openerIndex, block.nextIndex());
        return node;
    }

    /**
     * Flags {@code node} as unterminated and reports it.
     */
    protected void markUnterminated(ParseContext ctx, AstNode node, int openerIndex, String what) {
        node.setProperty(NodeProperties.UNTERMINATED, true);
        Token opener = openerIndex < ctx.size() ? ctx.token(openerIndex) : null;
        ctx.warn(WarningKind.STRUCTURAL_UNTERMINATED, "Unterminated " + what + " reaches end of input", opener);
    }

    /**
     * Records the tokens of {@code [from, to)} as an error placeholder and reports them.
     */
    protected AstNode errorNode(ParseContext ctx, AstNode parent, int from, int to, String message) {
        AstNode error = node(ctx, NodeTypes.ERROR_NODE, from);
        error.setProperty(NodeProperties.TEXT, ctx.rawText(from, to));
        error.setProperty(NodeProperties.MESSAGE, message);
        finish(ctx, error, from, to);
        parent.addChild(error);
        ctx.warn(WarningKind.UNEXPECTED_TOKEN, message, from < ctx.size() ? ctx.token(from) : null);
        log.debug("{}: error node at line {}: {}", getLanguage(), error.getLine(), message);
        return error;
    }

    // ==================== Symbol and Scope Helpers ====================

    /**
     * Registers a symbol in the current scope.
     */
    protected Symbol declare(ParseContext ctx, String name, SymbolKind kind, Token at) {
        Symbol symbol = new Symbol(name, kind, at.line(), at.column(), ctx.state().currentScopeId());
        ctx.symbolTable().register(symbol);
        return symbol;
    }

    /**
     * Pushes a frame for a construct.
     *
     * @param name declared name, or null for anonymous constructs
     */
    protected ContextFrame enterScope(ParseContext ctx, ContextType type, String name, int startIndex) {
        Map<String, Object> metadata = new HashMap<>();
        if (name != null) {
            metadata.put(ContextFrame.NAME, name);
        }
        ContextFrame frame = ctx.state().push(type, metadata, startIndex);
        if (type.introducesScope()) {
            ctx.symbolTable().declareScope(frame.scopeId(), ctx.state().parentScopeOf(frame.scopeId()).orElse(null));
        }
        return frame;
    }

    /**
     * Pushes a non-scope frame for a keyword-introduced block such as {@code if}.
     */
    protected ContextFrame enterBlock(ParseContext ctx, ContextType type, String keyword, int startIndex) {
        Map<String, Object> metadata = new HashMap<>();
        if (keyword != null) {
            metadata.put(ContextFrame.KEYWORD, keyword);
        }
        return ctx.state().push(type, metadata, startIndex);
    }

    /**
     * Pops {@code frame} and anything left above it.
     */
    protected void exitScope(ParseContext ctx, ContextFrame frame) {
        int popped = ctx.state().popTo(frame);
        if (popped > 1) {
            log.debug("Recovered {} unclosed frames while leaving {}", popped - 1, frame.type().label());
        }
    }

    /**
     * Returns a copy of {@code values} in the configured decorator order.
     */
    protected List<String> orderDecorators(List<String> values) {
        List<String> ordered = new ArrayList<>(values);
        if (config.decorators().order() == ParserConfig.DecoratorOrder.APPLICATION) {
            Collections.reverse(ordered);
        }
        return ordered;
    }

    /**
     * Returns whether the token is a word usable as a declared name.
     */
    protected static boolean isName(Token token) {
        return token.is(TokenType.IDENTIFIER);
    }
}
