package com.codeparse.core.parser.impl.javascript;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.codeparse.core.ast.AstNode;
import com.codeparse.core.ast.NodeProperties;
import com.codeparse.core.ast.NodeTypes;
import com.codeparse.core.block.BlockResult;
import com.codeparse.core.block.BraceBlockParser;
import com.codeparse.core.config.ParserConfig;
import com.codeparse.core.diagnostic.WarningKind;
import com.codeparse.core.lexical.Lexer;
import com.codeparse.core.parser.AbstractLanguageParser;
import com.codeparse.core.parser.ParseContext;
import com.codeparse.core.parser.TokenRanges;
import com.codeparse.core.state.ContextFrame;
import com.codeparse.core.state.ContextType;
import com.codeparse.core.symbol.SymbolKind;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;
import com.codeparse.core.util.Languages;

/**
 * Structure parser for JavaScript.
 *
 * <p>Statements are delimited by semicolons or by line breaks that cannot continue the
 * expression, in the spirit of automatic semicolon insertion. Every braced body goes through a
 * {@link BraceBlockParser}. Function and arrow expressions found inside expressions get their
 * own scope and node, so nested callbacks are part of the tree.
 *
 * <p>A closing bracket that no construct opened is recorded as an error node, one per token,
 * and parsing continues with the next token.
 *
 * <p>{@code TypeScriptParser} extends this class; the protected hooks
 * {@link #typeSyntax()} and {@link #parseTypeDeclaration(ParseContext, int, int, AstNode, Modifiers)}
 * switch on the type layer.
 *
 * @since 1.0.0
 */
public class JavaScriptParser extends AbstractLanguageParser {

    private static final Set<String> MEMBER_MODIFIERS = Set.of(
        "static", "async", "get", "set", "public", "private", "protected", "readonly",
        "abstract", "declare", "override", "accessor");

    private static final Set<String> CONTINUATION_KEYWORDS = Set.of(
        "instanceof", "in", "of", "new", "typeof", "void", "delete", "extends", "as", "satisfies");

    /** Line starters that end a statement whose bracket was left open. */
    private static final Set<String> CONSTRUCT_INTRODUCERS = Set.of(
        "function", "class", "interface", "enum", "namespace", "declare", "abstract", "export", "import",
        "const", "let", "var");

    private static final Set<String> TYPE_PREFIXES = Set.of(
        "keyof", "typeof", "readonly", "unique", "infer", "new", "asserts", "abstract");

    protected final BraceBlockParser blockParser = new BraceBlockParser();

    public JavaScriptParser() {
        this(ParserConfig.defaults());
    }

    public JavaScriptParser(ParserConfig config) {
        super(config);
    }

    @Override
    public String getLanguage() {
        return Languages.JAVASCRIPT;
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("js", "jsx", "mjs", "cjs", "node");
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of("js", "jsx", "mjs", "cjs");
    }

    @Override
    protected Lexer createLexer(String source) {
        return new JavaScriptLexer(source);
    }

    @Override
    protected void parseModule(ParseContext ctx) {
        parseStatements(ctx, 0, ctx.size(), ctx.root());
    }

    /**
     * Whether annotations, generics and other type syntax are recognized.
     */
    protected boolean typeSyntax() {
        return false;
    }

    /**
     * Hook for declarations outside plain JavaScript.
     *
     * @return index after the declaration, or -1 if the tokens at {@code index} are not one
     */
    protected int parseTypeDeclaration(ParseContext ctx, int index, int to, AstNode parent, Modifiers modifiers) {
        return -1;
    }

    /**
     * Decorators and modifier keywords collected in front of a declaration.
     *
     * @param keywords modifier words such as {@code export}, {@code default}, {@code declare}
     * @param decorators decorator expressions without the {@code @}
     */
    protected record Modifiers(List<String> keywords, List<String> decorators) {

        public static final Modifiers NONE = new Modifiers(List.of(), List.of());

        public Modifiers {
            keywords = List.copyOf(keywords);
            decorators = List.copyOf(decorators);
        }

        public Modifiers with(String keyword) {
            List<String> merged = new ArrayList<>(keywords);
            merged.add(keyword);
            return new Modifiers(merged, decorators);
        }

        public Modifiers withDecorators(List<String> more) {
            List<String> merged = new ArrayList<>(decorators);
            merged.addAll(more);
            return new Modifiers(keywords, merged);
        }

        public boolean has(String keyword) {
            return keywords.contains(keyword);
        }
    }

    // ==================== Statements ====================

    protected void parseStatements(ParseContext ctx, int from, int to, AstNode parent) {
        int i = from;
        while (i < to) {
            i = TokenRanges.nextSignificant(ctx.tokens(), i, to);
            if (i >= to) {
                break;
            }
            int next = parseStatement(ctx, i, to, parent, Modifiers.NONE);
            i = Math.max(next, i + 1);
        }
    }

    protected int parseStatement(ParseContext ctx, int i, int to, AstNode parent, Modifiers modifiers) {
        List<Token> tokens = ctx.tokens();
        Token token = tokens.get(i);

        if (token.is(TokenType.SEMICOLON)) {
            return i + 1;
        }
        if (token.type().isClosing()) {
            errorNode(ctx, parent, i, i + 1, "Unexpected '" + token.text() + "'");
            return i + 1;
        }
        if (token.is(TokenType.AT)) {
            List<String> decorators = new ArrayList<>();
            int j = i;
            while (j < to && tokens.get(j).is(TokenType.AT)) {
                int end = decoratorEnd(tokens, j + 1, to);
                decorators.add(ctx.text(j + 1, end));
                j = TokenRanges.nextSignificant(tokens, end, to);
            }
            if (j >= to) {
                errorNode(ctx, parent, i, to, "Decorator is not followed by a declaration");
                return to;
            }
            return parseStatement(ctx, j, to, parent, modifiers.withDecorators(decorators));
        }
        if (token.isWord("export")) {
            return parseExport(ctx, i, to, parent, modifiers);
        }

        int typeDeclaration = parseTypeDeclaration(ctx, i, to, parent, modifiers);
        if (typeDeclaration >= 0) {
            return typeDeclaration;
        }

        if (token.isWord("function")) {
            return parseFunctionDeclaration(ctx, i, i, to, parent, modifiers, false);
        }
        if (token.isWord("async")) {
            int next = TokenRanges.nextSignificant(tokens, i + 1, to);
            if (next < to && tokens.get(next).isWord("function") && !TokenRanges.hasNewline(tokens, i, next)) {
                return parseFunctionDeclaration(ctx, i, next, to, parent, modifiers, true);
            }
        }
        if (token.isWord("class")) {
            return parseClass(ctx, i, to, parent, modifiers, false);
        }
        if (token.isWord("var", "let", "const")) {
            return parseVariables(ctx, i, to, parent, modifiers);
        }
        if (token.isWord("import") && !isImportExpression(tokens, i, to)) {
            return parseImport(ctx, i, to, parent);
        }
        if (token.is(TokenType.KEYWORD)) {
            switch (token.text()) {
                case "if":
                    return parseIf(ctx, i, to, parent);
                case "for":
                case "while":
                    return parseLoop(ctx, i, to, parent);
                case "do":
                    return parseDoWhile(ctx, i, to, parent);
                case "switch":
                    return parseSwitch(ctx, i, to, parent);
                case "try":
                    return parseTry(ctx, i, to, parent);
                case "return":
                    return parseReturn(ctx, i, to, parent);
                default:
                    break;
            }
        }
        if (token.is(TokenType.OPEN_BRACE)) {
            return parseBody(ctx, parent, i, "block");
        }
        if (token.is(TokenType.IDENTIFIER)) {
            int next = TokenRanges.nextSignificant(tokens, i + 1, to);
            if (next < to && tokens.get(next).is(TokenType.COLON)) {
                int labeled = TokenRanges.nextSignificant(tokens, next + 1, to);
                return labeled < to ? parseStatement(ctx, labeled, to, parent, modifiers) : labeled;
            }
        }
        return parseExpressionStatement(ctx, i, to, parent);
    }

    private static boolean isImportExpression(List<Token> tokens, int i, int to) {
        int next = TokenRanges.nextSignificant(tokens, i + 1, to);
        return next < to && tokens.get(next).is(TokenType.OPEN_PAREN, TokenType.DOT);
    }

    protected int parseExpressionStatement(ParseContext ctx, int i, int to, AstNode parent) {
        int end = statementEnd(ctx.tokens(), i, to, false);
        AstNode statement = node(ctx, NodeTypes.EXPRESSION_STATEMENT, i);
        statement.setProperty(NodeProperties.TEXT, ctx.text(i, contentEnd(ctx.tokens(), end)));
        parent.addChild(statement);
        scanExpression(ctx, i, contentEnd(ctx.tokens(), end), statement, null);
        finish(ctx, statement, i, end);
        return end;
    }

    private int parseReturn(ParseContext ctx, int i, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int end = statementEnd(tokens, i, to, false);
        int valueEnd = contentEnd(tokens, end);
        AstNode statement = node(ctx, NodeTypes.RETURN_STATEMENT, i);
        String value = ctx.text(i + 1, valueEnd);
        if (!value.isEmpty()) {
            statement.setProperty(NodeProperties.VALUE, value);
        }
        parent.addChild(statement);
        scanExpression(ctx, i + 1, valueEnd, statement, null);
        finish(ctx, statement, i, end);
        return end;
    }

    /**
     * Returns the index just past the statement starting at {@code from}: past a top-level
     * semicolon, at a line break that cannot continue the statement, or at an unmatched closing
     * bracket.
     *
     * <p>A bracket that never closes ends the statement at the first line break followed by a
     * construct introducer ({@code function}, {@code class}, {@code const} ...) in a column at or
     * left of the statement's first token.
     *
     * @param commaEnds whether a top-level comma also ends the statement (type members, enums)
     */
    protected static int statementEnd(List<Token> tokens, int from, int to, boolean commaEnds) {
        int depth = 0;
        int outerOpen = -1;
        Boolean unclosed = null;
        int first = TokenRanges.nextSignificant(tokens, from, to);
        int column = first < to ? tokens.get(first).column() : 1;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type().isOpening()) {
                if (depth == 0) {
                    outerOpen = i;
                    unclosed = null;
                }
                depth++;
            } else if (token.type().isClosing()) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            } else if (depth == 0 && (token.is(TokenType.SEMICOLON) || commaEnds && token.is(TokenType.COMMA))) {
                return i + 1;
            } else if (depth == 0 && token.is(TokenType.NEWLINE)) {
                int previous = TokenRanges.previousSignificant(tokens, i, from);
                int next = TokenRanges.nextSignificant(tokens, i + 1, to);
                if (previous < 0) {
                    continue;
                }
                if (next >= to || !continuesAcrossLine(tokens.get(previous), tokens.get(next))) {
                    return i;
                }
            } else if (depth > 0 && token.is(TokenType.NEWLINE) && startsConstruct(tokens, i + 1, to, column)) {
                if (unclosed == null) {
                    unclosed = TokenRanges.matchingClose(tokens, outerOpen, to) < 0;
                }
                if (unclosed) {
                    return i;
                }
            }
        }
        return to;
    }

    /**
     * Returns whether the line starting at {@code lineStart} begins with a declaration keyword in
     * a column at or left of {@code column}.
     */
    private static boolean startsConstruct(List<Token> tokens, int lineStart, int to, int column) {
        int i = TokenRanges.nextSignificant(tokens, lineStart, to);
        if (i >= to || tokens.get(i).column() > column || tokens.get(i).line() != tokens.get(lineStart).line()) {
            return false;
        }
        Token token = tokens.get(i);
        if (token.isWord("async")) {
            int next = TokenRanges.nextSignificant(tokens, i + 1, to);
            return next < to && tokens.get(next).isWord("function");
        }
        return token.is(TokenType.KEYWORD, TokenType.IDENTIFIER) && CONSTRUCT_INTRODUCERS.contains(token.text());
    }

    private static boolean continuesAcrossLine(Token previous, Token next) {
        if (previous.is(TokenType.EQUALS, TokenType.COMMA, TokenType.DOT, TokenType.FAT_ARROW, TokenType.COLON)
                || previous.is(TokenType.OPERATOR) && !previous.isOperator("++") && !previous.isOperator("--")
                || previous.is(TokenType.KEYWORD, TokenType.IDENTIFIER) && CONTINUATION_KEYWORDS.contains(previous.text())) {
            return true;
        }
        return next.is(TokenType.DOT, TokenType.EQUALS, TokenType.COMMA, TokenType.FAT_ARROW)
            || next.is(TokenType.OPERATOR) && !next.isOperator("++") && !next.isOperator("--")
                && !next.isOperator("!") && !next.isOperator("~")
            || next.is(TokenType.KEYWORD, TokenType.IDENTIFIER) && Set.of("instanceof", "in", "as", "satisfies").contains(next.text());
    }

    /**
     * Returns the end of a statement's content, excluding its terminating semicolon.
     */
    protected static int contentEnd(List<Token> tokens, int end) {
        return end > 0 && tokens.get(end - 1).is(TokenType.SEMICOLON) ? end - 1 : end;
    }

    private static int decoratorEnd(List<Token> tokens, int from, int to) {
        int i = TokenRanges.nextSignificant(tokens, from, to);
        if (i < to && tokens.get(i).is(TokenType.OPEN_PAREN)) {
            int close = TokenRanges.matchingClose(tokens, i, to);
            return close >= 0 ? close + 1 : to;
        }
        if (i >= to || !tokens.get(i).is(TokenType.IDENTIFIER, TokenType.KEYWORD)) {
            return Math.min(i + 1, to);
        }
        i++;
        while (i + 1 < to && tokens.get(i).is(TokenType.DOT) && tokens.get(i + 1).is(TokenType.IDENTIFIER, TokenType.KEYWORD)) {
            i += 2;
        }
        if (i < to && tokens.get(i).is(TokenType.OPEN_PAREN)) {
            int close = TokenRanges.matchingClose(tokens, i, to);
            return close >= 0 ? close + 1 : to;
        }
        return i;
    }

    // ==================== Modules ====================

    private int parseExport(ParseContext ctx, int i, int to, AstNode parent, Modifiers modifiers) {
        List<Token> tokens = ctx.tokens();
        int next = TokenRanges.nextSignificant(tokens, i + 1, to);
        if (next >= to) {
            errorNode(ctx, parent, i, to, "Incomplete export");
            return to;
        }
        Token token = tokens.get(next);
        if (token.isWord("default")) {
            int target = TokenRanges.nextSignificant(tokens, next + 1, to);
            if (target < to && isDeclarationStart(tokens, target, to)) {
                return parseStatement(ctx, target, to, parent, modifiers.with("export").with("default"));
            }
            int end = statementEnd(tokens, next + 1, to, false);
            AstNode export = node(ctx, NodeTypes.EXPORT_DECLARATION, i);
            export.setProperty(NodeProperties.DEFAULT, true);
            export.setProperty(NodeProperties.VALUE, ctx.text(next + 1, contentEnd(tokens, end)));
            parent.addChild(export);
            scanExpression(ctx, next + 1, contentEnd(tokens, end), export, "default");
            finish(ctx, export, i, end);
            return end;
        }
        if (token.is(TokenType.OPEN_BRACE) || token.isOperator("*") || token.is(TokenType.EQUALS)
                || token.isWord("type") && isTypeExportList(tokens, next, to)) {
            int end = statementEnd(tokens, next, to, false);
            AstNode export = node(ctx, NodeTypes.EXPORT_DECLARATION, i);
            int braceStart = token.isWord("type") ? TokenRanges.nextSignificant(tokens, next + 1, to) : next;
            if (tokens.get(braceStart).is(TokenType.OPEN_BRACE)) {
                int close = TokenRanges.matchingClose(tokens, braceStart, end);
                export.setProperty(NodeProperties.NAMES, specifiers(ctx, braceStart + 1, close >= 0 ? close : end));
            } else {
                export.setProperty(NodeProperties.VALUE, ctx.text(next, contentEnd(tokens, end)));
            }
            String source = moduleSource(tokens, next, end);
            if (source != null) {
                export.setProperty(NodeProperties.SOURCE, source);
            }
            parent.addChild(export);
            finish(ctx, export, i, end);
            return end;
        }
        return parseStatement(ctx, next, to, parent, modifiers.with("export"));
    }

    private static boolean isTypeExportList(List<Token> tokens, int typeIndex, int to) {
        int next = TokenRanges.nextSignificant(tokens, typeIndex + 1, to);
        return next < to && tokens.get(next).is(TokenType.OPEN_BRACE);
    }

    private boolean isDeclarationStart(List<Token> tokens, int i, int to) {
        Token token = tokens.get(i);
        if (token.isWord("function", "class") || token.is(TokenType.AT)) {
            return true;
        }
        if (token.isWord("async")) {
            int next = TokenRanges.nextSignificant(tokens, i + 1, to);
            return next < to && tokens.get(next).isWord("function");
        }
        return typeSyntax() && token.isWord("abstract", "interface");
    }

    private int parseImport(ParseContext ctx, int i, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int end = statementEnd(tokens, i, to, false);
        int content = contentEnd(tokens, end);
        AstNode node = node(ctx, NodeTypes.IMPORT_DECLARATION, i);
        List<Map<String, Object>> names = new ArrayList<>();

        int j = TokenRanges.nextSignificant(tokens, i + 1, content);
        if (j < content && tokens.get(j).isWord("type")) {
            int after = TokenRanges.nextSignificant(tokens, j + 1, content);
            if (after < content && !tokens.get(after).isWord("from") && !tokens.get(after).is(TokenType.EQUALS)) {
                node.setProperty(NodeProperties.MODIFIERS, List.of("type"));
                j = after;
            }
        }
        while (j < content && !tokens.get(j).is(TokenType.STRING) && !tokens.get(j).isWord("from")) {
            Token token = tokens.get(j);
            if (token.is(TokenType.IDENTIFIER)) {
                int after = TokenRanges.nextSignificant(tokens, j + 1, content);
                if (after < content && tokens.get(after).is(TokenType.EQUALS)) {
                    names.add(specifier("require", token.text()));
                    declare(ctx, token.text(), SymbolKind.IMPORT, token);
                    node.setProperty(NodeProperties.MODULE, requireSource(ctx, after + 1, content));
                    j = content;
                    break;
                }
                names.add(specifier("default", token.text()));
                declare(ctx, token.text(), SymbolKind.IMPORT, token);
                j = after;
            } else if (token.isOperator("*")) {
                int as = TokenRanges.nextSignificant(tokens, j + 1, content);
                int alias = TokenRanges.nextSignificant(tokens, as + 1, content);
                if (alias < content && tokens.get(alias).is(TokenType.IDENTIFIER)) {
                    names.add(specifier("*", tokens.get(alias).text()));
                    declare(ctx, tokens.get(alias).text(), SymbolKind.IMPORT, tokens.get(alias));
                }
                j = TokenRanges.nextSignificant(tokens, alias + 1, content);
            } else if (token.is(TokenType.OPEN_BRACE)) {
                int close = TokenRanges.matchingClose(tokens, j, content);
                int listEnd = close >= 0 ? close : content;
                for (Map<String, Object> entry : specifiers(ctx, j + 1, listEnd)) {
                    names.add(entry);
                }
                declareSpecifiers(ctx, j + 1, listEnd);
                j = TokenRanges.nextSignificant(tokens, listEnd + 1, content);
            } else {
                j = TokenRanges.nextSignificant(tokens, j + 1, content);
            }
        }
        if (!node.hasProperty(NodeProperties.MODULE)) {
            String source = moduleSource(tokens, i, content);
            if (source != null) {
                node.setProperty(NodeProperties.MODULE, source);
            }
        }
        node.setProperty(NodeProperties.NAMES, names);
        parent.addChild(node);
        finish(ctx, node, i, end);
        return end;
    }

    private static Map<String, Object> specifier(String name, String alias) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put(NodeProperties.NAME, name);
        entry.put(NodeProperties.ALIAS, alias);
        return entry;
    }

    private List<Map<String, Object>> specifiers(ParseContext ctx, int from, int to) {
        List<Token> tokens = ctx.tokens();
        List<Map<String, Object>> entries = new ArrayList<>();
        for (int[] segment : TokenRanges.splitTopLevel(tokens, from, to, TokenType.COMMA)) {
            int first = TokenRanges.nextSignificant(tokens, segment[0], segment[1]);
            if (first >= segment[1]) {
                continue;
            }
            if (tokens.get(first).isWord("type") && TokenRanges.nextSignificant(tokens, first + 1, segment[1]) < segment[1]) {
                first = TokenRanges.nextSignificant(tokens, first + 1, segment[1]);
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(NodeProperties.NAME, unquote(tokens.get(first).text()));
            int as = findWord(tokens, first + 1, segment[1], "as");
            if (as >= 0) {
                int alias = TokenRanges.nextSignificant(tokens, as + 1, segment[1]);
                if (alias < segment[1]) {
                    entry.put(NodeProperties.ALIAS, unquote(tokens.get(alias).text()));
                }
            }
            entries.add(entry);
        }
        return entries;
    }

    private void declareSpecifiers(ParseContext ctx, int from, int to) {
        List<Token> tokens = ctx.tokens();
        for (int[] segment : TokenRanges.splitTopLevel(tokens, from, to, TokenType.COMMA)) {
            int last = TokenRanges.previousSignificant(tokens, segment[1], segment[0]);
            if (last >= 0 && tokens.get(last).is(TokenType.IDENTIFIER)) {
                declare(ctx, tokens.get(last).text(), SymbolKind.IMPORT, tokens.get(last));
            }
        }
    }

    private static String moduleSource(List<Token> tokens, int from, int to) {
        for (int i = from; i < to; i++) {
            if (tokens.get(i).is(TokenType.STRING)
                    && (i == from + 1 || tokens.get(TokenRanges.previousSignificant(tokens, i, from)).isWord("from", "import"))) {
                return unquote(tokens.get(i).text());
            }
        }
        return null;
    }

    private String requireSource(ParseContext ctx, int from, int to) {
        List<Token> tokens = ctx.tokens();
        for (int i = from; i < to; i++) {
            if (tokens.get(i).is(TokenType.STRING)) {
                return unquote(tokens.get(i).text());
            }
        }
        return ctx.text(from, to);
    }

    protected static String unquote(String text) {
        if (text.length() >= 2 && (text.startsWith("'") || text.startsWith("\"")) && text.endsWith(text.substring(0, 1))) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    protected static int findWord(List<Token> tokens, int from, int to, String word) {
        int depth = 0;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type().isOpening()) {
                depth++;
            } else if (token.type().isClosing()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.isWord(word)) {
                return i;
            }
        }
        return -1;
    }

    // ==================== Declarations ====================

    private int parseFunctionDeclaration(ParseContext ctx, int start, int keyword, int to, AstNode parent,
                                         Modifiers modifiers, boolean async) {
        List<Token> tokens = ctx.tokens();
        int i = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        boolean generator = false;
        if (i < to && tokens.get(i).isOperator("*")) {
            generator = true;
            i = TokenRanges.nextSignificant(tokens, i + 1, to);
        }
        String name = null;
        Token nameToken = null;
        if (i < to && tokens.get(i).is(TokenType.IDENTIFIER)) {
            nameToken = tokens.get(i);
            name = nameToken.text();
            i = TokenRanges.nextSignificant(tokens, i + 1, to);
        } else if (!modifiers.has("default")) {
            int end = statementEnd(tokens, start, to, false);
            errorNode(ctx, parent, start, Math.max(end, keyword + 1), "Expected a function name");
            return Math.max(end, keyword + 1);
        }
        AstNode function = node(ctx, NodeTypes.FUNCTION_DECLARATION, start);
        if (name != null) {
            function.setProperty(NodeProperties.NAME, name);
        }
        applyModifiers(function, modifiers);
        if (async) {
            function.setProperty(NodeProperties.ASYNC, true);
        }
        if (generator) {
            function.setProperty(NodeProperties.GENERATOR, true);
        }
        if (!isCallableSignature(tokens, i, to)) {
            int end = statementEnd(tokens, start, to, false);
            if (nameToken != null && i < to && tokens.get(i).is(TokenType.OPEN_PAREN)
                    && TokenRanges.matchingClose(tokens, i, to) < 0) {
                function.setProperty(NodeProperties.UNTERMINATED, true);
                ctx.warn(WarningKind.STRUCTURAL_UNTERMINATED,
                    "Unclosed parameter list of function '" + name + "'", tokens.get(i));
                declare(ctx, name, SymbolKind.FUNCTION, nameToken);
                parent.addChild(function);
                finish(ctx, function, start, end);
                return Math.max(end, i + 1);
            }
            errorNode(ctx, parent, start, Math.max(end, i), "Malformed function signature");
            return Math.max(end, i);
        }
        if (nameToken != null) {
            declare(ctx, name, SymbolKind.FUNCTION, nameToken);
        }
        parent.addChild(function);
        return parseCallableRest(ctx, function, name, i, to, start);
    }

    /**
     * Returns whether a parameter list (optionally preceded by type parameters) starts at {@code i}.
     */
    protected boolean isCallableSignature(List<Token> tokens, int i, int to) {
        if (i >= to) {
            return false;
        }
        if (typeSyntax() && tokens.get(i).isOperator("<")) {
            int close = TokenRanges.matchingAngle(tokens, i, to);
            if (close < 0) {
                return false;
            }
            i = TokenRanges.nextSignificant(tokens, close + 1, to);
        }
        return i < to && tokens.get(i).is(TokenType.OPEN_PAREN) && TokenRanges.matchingClose(tokens, i, to) >= 0;
    }

    /**
     * Parses a callable from its type parameters or parameter list through its body and attaches
     * parameters, return type and body to {@code function}. The caller has checked
     * {@link #isCallableSignature(List, int, int)}.
     *
     * @return index after the callable
     */
    protected int parseCallableRest(ParseContext ctx, AstNode function, String scopeName, int i, int to, int start) {
        List<Token> tokens = ctx.tokens();
        if (tokens.get(i).isOperator("<")) {
            int close = TokenRanges.matchingAngle(tokens, i, to);
            function.setProperty(NodeProperties.TYPE_PARAMETERS, ctx.angleArguments(i, close));
            i = TokenRanges.nextSignificant(tokens, close + 1, to);
        }
        int open = i;
        int close = TokenRanges.matchingClose(tokens, open, to);
        int j = TokenRanges.nextSignificant(tokens, close + 1, to);
        if (typeSyntax() && j < to && tokens.get(j).is(TokenType.COLON)) {
            int typeEnd = skipType(tokens, j + 1, to, true);
            function.setProperty(NodeProperties.RETURN_TYPE, ctx.text(j + 1, typeEnd));
            j = TokenRanges.nextSignificant(tokens, typeEnd, to);
        }

        ContextFrame frame = enterScope(ctx, ContextType.FUNCTION, scopeName, start);
        try {
            function.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            function.setProperty(NodeProperties.PARAMETERS, parseParameters(ctx, open + 1, close));
            int end;
            if (j < to && tokens.get(j).is(TokenType.OPEN_BRACE)) {
                end = parseBody(ctx, function, j, describe(function));
            } else {
                end = statementEnd(tokens, close + 1, to, false);
                if (!typeSyntax()) {
                    ctx.warn(WarningKind.UNEXPECTED_TOKEN,
                        "Expected '{' to open the body of " + describe(function), j < to ? tokens.get(j) : null);
                }
            }
            finish(ctx, function, start, end);
            return end;
        } finally {
            exitScope(ctx, frame);
        }
    }

    private static String describe(AstNode function) {
        String name = function.getName();
        return name != null ? "'" + name + "'" : "anonymous function";
    }

    protected List<Map<String, Object>> parseParameters(ParseContext ctx, int from, int to) {
        List<Token> tokens = ctx.tokens();
        List<Map<String, Object>> parameters = new ArrayList<>();
        for (int[] segment : splitList(tokens, from, to)) {
            int first = TokenRanges.nextSignificant(tokens, segment[0], segment[1]);
            while (first < segment[1] && tokens.get(first).is(TokenType.AT)) {
                first = TokenRanges.nextSignificant(tokens, decoratorEnd(tokens, first + 1, segment[1]), segment[1]);
            }
            while (typeSyntax() && first < segment[1] && tokens.get(first).isWord("public", "private", "protected", "readonly", "override")
                    && TokenRanges.nextSignificant(tokens, first + 1, segment[1]) < segment[1]
                    && !tokens.get(TokenRanges.nextSignificant(tokens, first + 1, segment[1])).is(TokenType.COLON, TokenType.EQUALS, TokenType.COMMA)) {
                first = TokenRanges.nextSignificant(tokens, first + 1, segment[1]);
            }
            if (first >= segment[1]) {
                continue;
            }
            Map<String, Object> parameter = new LinkedHashMap<>();
            String kind = "positional";
            if (tokens.get(first).isOperator("...")) {
                kind = "rest";
                first = TokenRanges.nextSignificant(tokens, first + 1, segment[1]);
                if (first >= segment[1]) {
                    continue;
                }
            }
            int patternEnd = first + 1;
            Token head = tokens.get(first);
            if (head.is(TokenType.OPEN_BRACE, TokenType.OPEN_BRACKET)) {
                int close = TokenRanges.matchingClose(tokens, first, segment[1]);
                patternEnd = close >= 0 ? close + 1 : segment[1];
                if (kind.equals("positional")) {
                    kind = "pattern";
                }
            }
            parameter.put(NodeProperties.PARAM_NAME, ctx.text(first, patternEnd));
            parameter.put(NodeProperties.PARAM_KIND, kind);
            int cursor = TokenRanges.nextSignificant(tokens, patternEnd, segment[1]);
            if (cursor < segment[1] && tokens.get(cursor).isOperator("?")) {
                parameter.put(NodeProperties.OPTIONAL, true);
                cursor = TokenRanges.nextSignificant(tokens, cursor + 1, segment[1]);
            }
            int equals = TokenRanges.findTopLevel(tokens, cursor, segment[1], TokenType.EQUALS);
            if (cursor < segment[1] && tokens.get(cursor).is(TokenType.COLON)) {
                parameter.put(NodeProperties.PARAM_ANNOTATION, ctx.text(cursor + 1, equals >= 0 ? equals : segment[1]));
            }
            if (equals >= 0) {
                parameter.put(NodeProperties.PARAM_DEFAULT, ctx.text(equals + 1, segment[1]));
            }
            parameters.add(parameter);

            List<Token> names = new ArrayList<>();
            collectBindingNames(tokens, first, patternEnd, names);
            for (Token name : names) {
                declare(ctx, name.text(), SymbolKind.PARAMETER, name);
            }
        }
        return parameters;
    }

    /**
     * Collects the identifiers bound by a binding pattern: a plain name, an object pattern or an
     * array pattern, with defaults, renames and rest elements.
     */
    protected static void collectBindingNames(List<Token> tokens, int from, int to, List<Token> names) {
        int first = TokenRanges.nextSignificant(tokens, from, to);
        if (first >= to) {
            return;
        }
        Token head = tokens.get(first);
        if (head.is(TokenType.IDENTIFIER)) {
            names.add(head);
            return;
        }
        if (!head.is(TokenType.OPEN_BRACE, TokenType.OPEN_BRACKET)) {
            return;
        }
        boolean object = head.is(TokenType.OPEN_BRACE);
        int close = TokenRanges.matchingClose(tokens, first, to);
        int end = close >= 0 ? close : to;
        for (int[] element : TokenRanges.splitTopLevel(tokens, first + 1, end, TokenType.COMMA)) {
            int start = TokenRanges.nextSignificant(tokens, element[0], element[1]);
            if (start >= element[1]) {
                continue;
            }
            int limit = TokenRanges.findTopLevel(tokens, start, element[1], TokenType.EQUALS);
            limit = limit >= 0 ? limit : element[1];
            if (tokens.get(start).isOperator("...")) {
                collectBindingNames(tokens, start + 1, limit, names);
                continue;
            }
            int colon = object ? TokenRanges.findTopLevel(tokens, start, limit, TokenType.COLON) : -1;
            if (colon >= 0) {
                collectBindingNames(tokens, colon + 1, limit, names);
            } else {
                collectBindingNames(tokens, start, limit, names);
            }
        }
    }

    private int parseVariables(ParseContext ctx, int keyword, int to, AstNode parent, Modifiers modifiers) {
        List<Token> tokens = ctx.tokens();
        int end = statementEnd(tokens, keyword + 1, to, false);
        int content = contentEnd(tokens, end);
        AstNode declaration = node(ctx, NodeTypes.VARIABLE_DECLARATION, keyword);
        declaration.setProperty(NodeProperties.KIND, tokens.get(keyword).text());
        applyModifiers(declaration, modifiers);
        parent.addChild(declaration);

        List<String> declared = new ArrayList<>();
        List<int[]> declarators = splitList(tokens, keyword + 1, content);
        for (int[] declarator : declarators) {
            int first = TokenRanges.nextSignificant(tokens, declarator[0], declarator[1]);
            if (first >= declarator[1]) {
                continue;
            }
            int equals = TokenRanges.findTopLevel(tokens, first, declarator[1], TokenType.EQUALS);
            int targetEnd = equals >= 0 ? equals : declarator[1];
            int colon = TokenRanges.findTopLevel(tokens, first, targetEnd, TokenType.COLON);
            if (typeSyntax() && colon >= 0) {
                declaration.setProperty(NodeProperties.TYPE, ctx.text(colon + 1, targetEnd));
                targetEnd = colon;
            }
            List<Token> names = new ArrayList<>();
            collectBindingNames(tokens, first, targetEnd, names);
            for (Token name : names) {
                declared.add(name.text());
                declare(ctx, name.text(), SymbolKind.VARIABLE, name);
            }
            if (equals >= 0) {
                if (declarators.size() == 1) {
                    declaration.setProperty(NodeProperties.VALUE, ctx.text(equals + 1, declarator[1]));
                }
                String hint = names.size() == 1 && tokens.get(first).is(TokenType.IDENTIFIER) ? names.get(0).text() : null;
                scanExpression(ctx, equals + 1, declarator[1], declaration, hint);
            }
        }
        declaration.setProperty(NodeProperties.NAMES, declared);
        finish(ctx, declaration, keyword, end);
        return end;
    }

    protected int parseClass(ParseContext ctx, int keyword, int to, AstNode parent, Modifiers modifiers, boolean expression) {
        List<Token> tokens = ctx.tokens();
        int i = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        Token nameToken = null;
        if (i < to && tokens.get(i).is(TokenType.IDENTIFIER) && !tokens.get(i).isWord("implements")) {
            nameToken = tokens.get(i);
            i = TokenRanges.nextSignificant(tokens, i + 1, to);
        }
        int brace = TokenRanges.findTopLevel(tokens, i, to, TokenType.OPEN_BRACE);
        int stop = statementEnd(tokens, keyword, to, false);
        if (brace < 0 || nameToken == null && !expression && !modifiers.has("default")) {
            int end = Math.max(stop, keyword + 1);
            errorNode(ctx, parent, keyword, end, nameToken == null ? "Expected a class name" : "Expected '{' after class header");
            return end;
        }

        AstNode cls = node(ctx, NodeTypes.CLASS_DECLARATION, keyword);
        String name = nameToken != null ? nameToken.text() : null;
        if (name != null) {
            cls.setProperty(NodeProperties.NAME, name);
        }
        applyModifiers(cls, modifiers);
        if (typeSyntax() && i < brace && tokens.get(i).isOperator("<")) {
            int close = TokenRanges.matchingAngle(tokens, i, brace);
            if (close >= 0) {
                cls.setProperty(NodeProperties.TYPE_PARAMETERS, ctx.angleArguments(i, close));
                i = TokenRanges.nextSignificant(tokens, close + 1, brace);
            }
        }
        int extendsIndex = findWord(tokens, i, brace, "extends");
        int implementsIndex = findWord(tokens, i, brace, "implements");
        if (extendsIndex >= 0) {
            int extendsEnd = implementsIndex > extendsIndex ? implementsIndex : brace;
            cls.setProperty(NodeProperties.EXTENDS, ctx.text(extendsIndex + 1, extendsEnd));
        }
        if (implementsIndex >= 0) {
            cls.setProperty(NodeProperties.IMPLEMENTS, segmentTexts(ctx, implementsIndex + 1, brace));
        }
        if (nameToken != null && !expression) {
            declare(ctx, name, SymbolKind.CLASS, nameToken);
        }
        parent.addChild(cls);

        ContextFrame frame = enterScope(ctx, ContextType.CLASS, name, keyword);
        try {
            cls.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            BlockResult block = blockParser.parseBlock(tokens, brace, ctx.state(), ContextType.BLOCK,
                Map.of(ContextFrame.KEYWORD, "class"));
            AstNode body = blockNode(ctx, brace, block);
            cls.addChild(body);
            if (!block.terminated()) {
                markUnterminated(ctx, cls, brace, name != null ? "class '" + name + "'" : "class");
            }
            parseClassMembers(ctx, block.firstMember(), block.memberEnd(), body);
            finish(ctx, cls, keyword, block.nextIndex());
            return block.nextIndex();
        } finally {
            exitScope(ctx, frame);
        }
    }

    private void parseClassMembers(ParseContext ctx, int from, int to, AstNode body) {
        List<Token> tokens = ctx.tokens();
        int i = from;
        while (i < to) {
            i = TokenRanges.nextSignificant(tokens, i, to);
            if (i >= to) {
                break;
            }
            int next = parseClassMember(ctx, i, to, body);
            i = Math.max(next, i + 1);
        }
    }

    private int parseClassMember(ParseContext ctx, int start, int to, AstNode body) {
        List<Token> tokens = ctx.tokens();
        Token first = tokens.get(start);
        if (first.is(TokenType.SEMICOLON)) {
            return start + 1;
        }
        if (first.type().isClosing()) {
            errorNode(ctx, body, start, start + 1, "Unexpected '" + first.text() + "'");
            return start + 1;
        }

        List<String> decorators = new ArrayList<>();
        int i = start;
        while (i < to && tokens.get(i).is(TokenType.AT)) {
            int end = decoratorEnd(tokens, i + 1, to);
            decorators.add(ctx.text(i + 1, end));
            i = TokenRanges.nextSignificant(tokens, end, to);
        }
        List<String> modifiers = new ArrayList<>();
        while (i < to && tokens.get(i).is(TokenType.IDENTIFIER, TokenType.KEYWORD)
                && MEMBER_MODIFIERS.contains(tokens.get(i).text())) {
            int next = TokenRanges.nextSignificant(tokens, i + 1, to);
            if (next >= to || !isMemberName(tokens.get(next)) && !tokens.get(next).isOperator("*")) {
                break;
            }
            if (tokens.get(i).isWord("static") && tokens.get(next).is(TokenType.OPEN_BRACE)) {
                break;
            }
            modifiers.add(tokens.get(i).text());
            i = next;
        }
        if (i < to && tokens.get(i).isWord("static")) {
            int next = TokenRanges.nextSignificant(tokens, i + 1, to);
            if (next < to && tokens.get(next).is(TokenType.OPEN_BRACE)) {
                AstNode init = node(ctx, NodeTypes.BLOCK_STATEMENT, i);
                init.setProperty(NodeProperties.KEYWORD, "static");
                body.addChild(init);
                int end = parseBody(ctx, init, next, "static block");
                finish(ctx, init, i, end);
                return end;
            }
        }
        boolean generator = false;
        if (i < to && tokens.get(i).isOperator("*")) {
            generator = true;
            i = TokenRanges.nextSignificant(tokens, i + 1, to);
        }
        if (i >= to || !isMemberName(tokens.get(i))) {
            int end = statementEnd(tokens, start, to, false);
            end = Math.max(end, start + 1);
            errorNode(ctx, body, start, end, "Expected a class member");
            return end;
        }

        Token nameToken = tokens.get(i);
        int nameEnd = i + 1;
        String name = unquote(nameToken.text());
        if (nameToken.is(TokenType.OPEN_BRACKET)) {
            int close = TokenRanges.matchingClose(tokens, i, to);
            nameEnd = close >= 0 ? close + 1 : to;
            name = ctx.text(i, nameEnd);
        }
        int cursor = TokenRanges.nextSignificant(tokens, nameEnd, to);
        boolean optional = false;
        if (cursor < to && (tokens.get(cursor).isOperator("?") || tokens.get(cursor).isOperator("!"))) {
            optional = tokens.get(cursor).isOperator("?");
            cursor = TokenRanges.nextSignificant(tokens, cursor + 1, to);
        }

        if (isCallableSignature(tokens, cursor, to)) {
            AstNode method = node(ctx, NodeTypes.METHOD_DECLARATION, start);
            method.setProperty(NodeProperties.NAME, name);
            if (!modifiers.isEmpty()) {
                method.setProperty(NodeProperties.MODIFIERS, modifiers);
            }
            if (!decorators.isEmpty()) {
                method.setProperty(NodeProperties.DECORATORS, orderDecorators(decorators));
            }
            if (modifiers.contains("async")) {
                method.setProperty(NodeProperties.ASYNC, true);
            }
            if (generator) {
                method.setProperty(NodeProperties.GENERATOR, true);
            }
            if (optional) {
                method.setProperty(NodeProperties.OPTIONAL, true);
            }
            declare(ctx, name, SymbolKind.METHOD, nameToken);
            body.addChild(method);
            return parseCallableRest(ctx, method, name, cursor, to, start);
        }

        int end = statementEnd(tokens, cursor, to, false);
        int content = contentEnd(tokens, end);
        AstNode field = node(ctx, NodeTypes.FIELD_DECLARATION, start);
        field.setProperty(NodeProperties.NAME, name);
        if (!modifiers.isEmpty()) {
            field.setProperty(NodeProperties.MODIFIERS, modifiers);
        }
        if (!decorators.isEmpty()) {
            field.setProperty(NodeProperties.DECORATORS, orderDecorators(decorators));
        }
        int equals = TokenRanges.findTopLevel(tokens, cursor, content, TokenType.EQUALS);
        if (cursor < content && tokens.get(cursor).is(TokenType.COLON)) {
            field.setProperty(NodeProperties.TYPE, ctx.text(cursor + 1, equals >= 0 ? equals : content));
        }
        if (equals >= 0) {
            field.setProperty(NodeProperties.VALUE, ctx.text(equals + 1, content));
        }
        declare(ctx, name, SymbolKind.VARIABLE, nameToken);
        body.addChild(field);
        if (equals >= 0) {
            scanExpression(ctx, equals + 1, content, field, name);
        }
        finish(ctx, field, start, end);
        return Math.max(end, nameEnd);
    }

    private static boolean isMemberName(Token token) {
        return token.is(TokenType.IDENTIFIER, TokenType.KEYWORD, TokenType.STRING, TokenType.NUMBER, TokenType.OPEN_BRACKET);
    }

    protected void applyModifiers(AstNode node, Modifiers modifiers) {
        if (!modifiers.keywords().isEmpty()) {
            node.setProperty(NodeProperties.MODIFIERS, modifiers.keywords());
        }
        if (!modifiers.decorators().isEmpty()) {
            node.setProperty(NodeProperties.DECORATORS, orderDecorators(modifiers.decorators()));
        }
    }

    /**
     * Splits a comma-separated list. With type syntax, generic arguments such as
     * {@code Map<string, number>} stay in one segment.
     */
    protected List<int[]> splitList(List<Token> tokens, int from, int to) {
        return typeSyntax()
            ? TokenRanges.splitTypeAware(tokens, from, to)
            : TokenRanges.splitTopLevel(tokens, from, to, TokenType.COMMA);
    }

    protected List<String> segmentTexts(ParseContext ctx, int from, int to) {
        List<String> texts = new ArrayList<>();
        for (int[] segment : splitList(ctx.tokens(), from, to)) {
            String text = ctx.text(segment[0], segment[1]);
            if (!text.isEmpty()) {
                texts.add(text);
            }
        }
        return texts;
    }

    // ==================== Control Flow ====================

    private int parseIf(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int open = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        int close = open < to && tokens.get(open).is(TokenType.OPEN_PAREN) ? TokenRanges.matchingClose(tokens, open, to) : -1;
        if (close < 0) {
            int end = Math.max(statementEnd(tokens, keyword, to, false), keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected '(' after 'if'");
            return end;
        }
        AstNode statement = node(ctx, NodeTypes.IF_STATEMENT, keyword);
        statement.setProperty(NodeProperties.KEYWORD, "if");
        statement.setProperty(NodeProperties.CONDITION, ctx.text(open + 1, close));
        parent.addChild(statement);
        scanExpression(ctx, open + 1, close, statement, null);
        int end = parseClause(ctx, statement, "if", keyword, close + 1, to);
        finish(ctx, statement, keyword, end);

        int next = TokenRanges.nextSignificant(tokens, end, to);
        if (next < to && tokens.get(next).isWord("else")) {
            AstNode otherwise = node(ctx, NodeTypes.BLOCK_STATEMENT, next);
            otherwise.setProperty(NodeProperties.KEYWORD, "else");
            parent.addChild(otherwise);
            end = parseClause(ctx, otherwise, "else", next, next + 1, to);
            finish(ctx, otherwise, next, end);
        }
        return end;
    }

    private int parseLoop(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        String word = tokens.get(keyword).text();
        int open = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        if (open < to && tokens.get(open).isWord("await")) {
            open = TokenRanges.nextSignificant(tokens, open + 1, to);
        }
        int close = open < to && tokens.get(open).is(TokenType.OPEN_PAREN) ? TokenRanges.matchingClose(tokens, open, to) : -1;
        if (close < 0) {
            int end = Math.max(statementEnd(tokens, keyword, to, false), keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected '(' after '" + word + "'");
            return end;
        }
        AstNode loop = node(ctx, NodeTypes.LOOP_STATEMENT, keyword);
        loop.setProperty(NodeProperties.KEYWORD, word);
        loop.setProperty(NodeProperties.CONDITION, ctx.text(open + 1, close));
        parent.addChild(loop);

        int head = TokenRanges.nextSignificant(tokens, open + 1, close);
        if ("for".equals(word) && head < close && tokens.get(head).isWord("var", "let", "const")) {
            int targetEnd = close;
            int semicolon = TokenRanges.findTopLevel(tokens, head + 1, close, TokenType.SEMICOLON);
            int of = findWord(tokens, head + 1, close, "of");
            int in = findWord(tokens, head + 1, close, "in");
            for (int limit : new int[] {semicolon, of, in}) {
                if (limit >= 0 && limit < targetEnd) {
                    targetEnd = limit;
                }
            }
            for (int[] declarator : TokenRanges.splitTopLevel(tokens, head + 1, targetEnd, TokenType.COMMA)) {
                int equals = TokenRanges.findTopLevel(tokens, declarator[0], declarator[1], TokenType.EQUALS);
                List<Token> names = new ArrayList<>();
                collectBindingNames(tokens, declarator[0], equals >= 0 ? equals : declarator[1], names);
                for (Token name : names) {
                    declare(ctx, name.text(), SymbolKind.VARIABLE, name);
                }
            }
        }
        scanExpression(ctx, open + 1, close, loop, null);
        int end = parseClause(ctx, loop, word, keyword, close + 1, to);
        finish(ctx, loop, keyword, end);
        return end;
    }

    private int parseDoWhile(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        AstNode loop = node(ctx, NodeTypes.LOOP_STATEMENT, keyword);
        loop.setProperty(NodeProperties.KEYWORD, "do");
        parent.addChild(loop);
        int end = parseClause(ctx, loop, "do", keyword, keyword + 1, to);
        int next = TokenRanges.nextSignificant(tokens, end, to);
        if (next < to && tokens.get(next).isWord("while")) {
            int open = TokenRanges.nextSignificant(tokens, next + 1, to);
            if (open < to && tokens.get(open).is(TokenType.OPEN_PAREN)) {
                int close = TokenRanges.matchingClose(tokens, open, to);
                if (close >= 0) {
                    loop.setProperty(NodeProperties.CONDITION, ctx.text(open + 1, close));
                    end = close + 1;
                    int semicolon = TokenRanges.nextSignificant(tokens, end, to);
                    if (semicolon < to && tokens.get(semicolon).is(TokenType.SEMICOLON)) {
                        end = semicolon + 1;
                    }
                }
            }
        }
        finish(ctx, loop, keyword, end);
        return end;
    }

    private int parseSwitch(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int open = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        int close = open < to && tokens.get(open).is(TokenType.OPEN_PAREN) ? TokenRanges.matchingClose(tokens, open, to) : -1;
        int brace = close >= 0 ? TokenRanges.nextSignificant(tokens, close + 1, to) : -1;
        if (brace < 0 || brace >= to || !tokens.get(brace).is(TokenType.OPEN_BRACE)) {
            int end = Math.max(statementEnd(tokens, keyword, to, false), keyword + 1);
            errorNode(ctx, parent, keyword, end, "Malformed 'switch' statement");
            return end;
        }
        AstNode statement = node(ctx, NodeTypes.BLOCK_STATEMENT, keyword);
        statement.setProperty(NodeProperties.KEYWORD, "switch");
        statement.setProperty(NodeProperties.CONDITION, ctx.text(open + 1, close));
        parent.addChild(statement);

        ContextFrame frame = enterBlock(ctx, ContextType.MATCH, "switch", keyword);
        try {
            BlockResult block = blockParser.parseBlock(tokens, brace, ctx.state(), ContextType.BLOCK,
                Map.of(ContextFrame.KEYWORD, "switch"));
            AstNode body = blockNode(ctx, brace, block);
            statement.addChild(body);
            if (!block.terminated()) {
                markUnterminated(ctx, statement, brace, "'switch' block");
            }
            parseSwitchBody(ctx, block.firstMember(), block.memberEnd(), body);
            finish(ctx, statement, keyword, block.nextIndex());
            return block.nextIndex();
        } finally {
            exitScope(ctx, frame);
        }
    }

    private void parseSwitchBody(ParseContext ctx, int from, int to, AstNode body) {
        List<Token> tokens = ctx.tokens();
        int i = TokenRanges.nextSignificant(tokens, from, to);
        while (i < to) {
            if (!tokens.get(i).isWord("case", "default")) {
                i = TokenRanges.nextSignificant(tokens, Math.max(parseStatement(ctx, i, to, body, Modifiers.NONE), i + 1), to);
                continue;
            }
            int colon = TokenRanges.findTopLevel(tokens, i + 1, to, TokenType.COLON);
            int clauseStart = i;
            AstNode clause = node(ctx, NodeTypes.CASE_CLAUSE, i);
            clause.setProperty(NodeProperties.PATTERN,
                tokens.get(i).isWord("default") ? "default" : ctx.text(i + 1, colon >= 0 ? colon : to));
            body.addChild(clause);
            ContextFrame frame = enterBlock(ctx, ContextType.CASE, tokens.get(i).text(), i);
            try {
                int j = TokenRanges.nextSignificant(tokens, colon >= 0 ? colon + 1 : to, to);
                while (j < to && !tokens.get(j).isWord("case", "default")) {
                    j = TokenRanges.nextSignificant(tokens, Math.max(parseStatement(ctx, j, to, clause, Modifiers.NONE), j + 1), to);
                }
                finish(ctx, clause, clauseStart, j);
                i = j;
            } finally {
                exitScope(ctx, frame);
            }
        }
    }

    private int parseTry(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        AstNode attempt = node(ctx, NodeTypes.TRY_STATEMENT, keyword);
        attempt.setProperty(NodeProperties.KEYWORD, "try");
        parent.addChild(attempt);
        int end = parseClause(ctx, attempt, "try", keyword, keyword + 1, to);
        finish(ctx, attempt, keyword, end);

        int next = TokenRanges.nextSignificant(tokens, end, to);
        while (next < to && tokens.get(next).isWord("catch", "finally")) {
            String word = tokens.get(next).text();
            AstNode handler = node(ctx, NodeTypes.TRY_STATEMENT, next);
            handler.setProperty(NodeProperties.KEYWORD, word);
            parent.addChild(handler);
            int bodyStart = next + 1;
            int open = TokenRanges.nextSignificant(tokens, next + 1, to);
            if ("catch".equals(word) && open < to && tokens.get(open).is(TokenType.OPEN_PAREN)) {
                int close = TokenRanges.matchingClose(tokens, open, to);
                if (close >= 0) {
                    handler.setProperty(NodeProperties.CONDITION, ctx.text(open + 1, close));
                    int colon = TokenRanges.findTopLevel(tokens, open + 1, close, TokenType.COLON);
                    List<Token> names = new ArrayList<>();
                    collectBindingNames(tokens, open + 1, colon >= 0 ? colon : close, names);
                    for (Token name : names) {
                        declare(ctx, name.text(), SymbolKind.VARIABLE, name);
                    }
                    bodyStart = close + 1;
                }
            }
            end = parseClause(ctx, handler, word, next, bodyStart, to);
            finish(ctx, handler, next, end);
            next = TokenRanges.nextSignificant(tokens, end, to);
        }
        return end;
    }

    /**
     * Parses the body of a control statement: a braced block or a single statement.
     */
    private int parseClause(ParseContext ctx, AstNode owner, String keyword, int keywordIndex, int from, int to) {
        List<Token> tokens = ctx.tokens();
        int i = TokenRanges.nextSignificant(tokens, from, to);
        ContextFrame frame = enterBlock(ctx, ContextType.BLOCK, keyword, keywordIndex);
        try {
            if (i >= to) {
                if (i >= ctx.size()) {
                    markUnterminated(ctx, owner, keywordIndex, "'" + keyword + "' statement");
                }
                return i;
            }
            if (tokens.get(i).is(TokenType.OPEN_BRACE)) {
                return parseBody(ctx, owner, i, "'" + keyword + "' block");
            }
            return parseStatement(ctx, i, to, owner, Modifiers.NONE);
        } finally {
            exitScope(ctx, frame);
        }
    }

    /**
     * Scans the braced block at {@code brace}, attaches it to {@code owner} and parses its
     * statements.
     *
     * @return index after the closing brace
     */
    protected int parseBody(ParseContext ctx, AstNode owner, int brace, String what) {
        BlockResult block = blockParser.parseBlock(ctx.tokens(), brace, ctx.state(), ContextType.BLOCK,
            Map.of(ContextFrame.KEYWORD, owner.getNodeType()));
        AstNode body = blockNode(ctx, brace, block);
        owner.addChild(body);
        if (!block.terminated()) {
            markUnterminated(ctx, owner == ctx.root() ? body : owner, brace, what);
        }
        parseStatements(ctx, block.firstMember(), block.memberEnd(), body);
        return block.nextIndex();
    }

    // ==================== Expressions ====================

    /**
     * Finds function expressions, arrow functions and class expressions inside an expression
     * and parses each with its own scope.
     *
     * @param nameHint name to give a function that forms the whole expression, as in
     *                 {@code const f = () => 1}
     */
    protected void scanExpression(ParseContext ctx, int from, int to, AstNode owner, String nameHint) {
        List<Token> tokens = ctx.tokens();
        int head = TokenRanges.nextSignificant(tokens, from, to);
        int i = head;
        while (i < to) {
            Token token = tokens.get(i);
            String hint = i == head ? nameHint : null;
            if (token.isWord("function")) {
                i = parseFunctionExpression(ctx, i, i, to, owner, false, hint);
                continue;
            }
            if (token.isWord("async")) {
                int next = TokenRanges.nextSignificant(tokens, i + 1, to);
                if (next < to && tokens.get(next).isWord("function")) {
                    i = parseFunctionExpression(ctx, i, next, to, owner, true, hint);
                    continue;
                }
                int arrow = next < to ? arrowAt(tokens, next, to) : -1;
                if (arrow >= 0) {
                    i = parseArrow(ctx, i, next, arrow, to, owner, true, hint);
                    continue;
                }
            }
            if (token.isWord("class")) {
                i = Math.max(parseClass(ctx, i, to, owner, Modifiers.NONE, true), i + 1);
                continue;
            }
            int arrow = arrowAt(tokens, i, to);
            if (arrow >= 0) {
                i = parseArrow(ctx, i, i, arrow, to, owner, false, hint);
                continue;
            }
            i++;
        }
    }

    /**
     * Returns the index of the {@code =>} if an arrow function's parameters start at {@code i}.
     */
    private int arrowAt(List<Token> tokens, int i, int to) {
        Token token = tokens.get(i);
        if (token.is(TokenType.IDENTIFIER)) {
            int next = TokenRanges.nextSignificant(tokens, i + 1, to);
            return next < to && tokens.get(next).is(TokenType.FAT_ARROW) ? next : -1;
        }
        int open = i;
        if (typeSyntax() && token.isOperator("<")) {
            int close = TokenRanges.matchingAngle(tokens, i, to);
            if (close < 0) {
                return -1;
            }
            open = TokenRanges.nextSignificant(tokens, close + 1, to);
        }
        if (open >= to || !tokens.get(open).is(TokenType.OPEN_PAREN)) {
            return -1;
        }
        int close = TokenRanges.matchingClose(tokens, open, to);
        if (close < 0) {
            return -1;
        }
        int next = TokenRanges.nextSignificant(tokens, close + 1, to);
        if (next < to && typeSyntax() && tokens.get(next).is(TokenType.COLON)) {
            next = TokenRanges.nextSignificant(tokens, skipType(tokens, next + 1, to, false), to);
        }
        return next < to && tokens.get(next).is(TokenType.FAT_ARROW) ? next : -1;
    }

    private int parseFunctionExpression(ParseContext ctx, int start, int keyword, int to, AstNode owner,
                                        boolean async, String nameHint) {
        List<Token> tokens = ctx.tokens();
        int i = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        boolean generator = false;
        if (i < to && tokens.get(i).isOperator("*")) {
            generator = true;
            i = TokenRanges.nextSignificant(tokens, i + 1, to);
        }
        String name = nameHint;
        if (i < to && tokens.get(i).is(TokenType.IDENTIFIER)) {
            name = tokens.get(i).text();
            i = TokenRanges.nextSignificant(tokens, i + 1, to);
        }
        if (!isCallableSignature(tokens, i, to)) {
            return keyword + 1;
        }
        AstNode function = node(ctx, NodeTypes.FUNCTION_EXPRESSION, start);
        if (name != null) {
            function.setProperty(NodeProperties.NAME, name);
        }
        if (async) {
            function.setProperty(NodeProperties.ASYNC, true);
        }
        if (generator) {
            function.setProperty(NodeProperties.GENERATOR, true);
        }
        owner.addChild(function);
        return parseCallableRest(ctx, function, name, i, to, start);
    }

    private int parseArrow(ParseContext ctx, int start, int params, int arrow, int to, AstNode owner,
                           boolean async, String nameHint) {
        List<Token> tokens = ctx.tokens();
        AstNode function = node(ctx, NodeTypes.ARROW_FUNCTION, start);
        if (nameHint != null) {
            function.setProperty(NodeProperties.NAME, nameHint);
        }
        if (async) {
            function.setProperty(NodeProperties.ASYNC, true);
        }
        owner.addChild(function);

        ContextFrame frame = enterScope(ctx, ContextType.FUNCTION, nameHint, start);
        try {
            function.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            Token head = tokens.get(params);
            if (head.is(TokenType.IDENTIFIER)) {
                Map<String, Object> parameter = new LinkedHashMap<>();
                parameter.put(NodeProperties.PARAM_NAME, head.text());
                parameter.put(NodeProperties.PARAM_KIND, "positional");
                function.setProperty(NodeProperties.PARAMETERS, List.of(parameter));
                declare(ctx, head.text(), SymbolKind.PARAMETER, head);
            } else {
                int open = params;
                if (head.isOperator("<")) {
                    int close = TokenRanges.matchingAngle(tokens, params, arrow);
                    function.setProperty(NodeProperties.TYPE_PARAMETERS, ctx.angleArguments(params, close));
                    open = TokenRanges.nextSignificant(tokens, close + 1, arrow);
                }
                int close = TokenRanges.matchingClose(tokens, open, arrow);
                function.setProperty(NodeProperties.PARAMETERS, parseParameters(ctx, open + 1, close));
                int colon = TokenRanges.nextSignificant(tokens, close + 1, arrow);
                if (colon < arrow && tokens.get(colon).is(TokenType.COLON)) {
                    function.setProperty(NodeProperties.RETURN_TYPE, ctx.text(colon + 1, arrow));
                }
            }

            int body = TokenRanges.nextSignificant(tokens, arrow + 1, to);
            int end;
            if (body < to && tokens.get(body).is(TokenType.OPEN_BRACE)) {
                end = parseBody(ctx, function, body, "arrow function");
            } else {
                end = arrowBodyEnd(tokens, body, to);
                function.setProperty(NodeProperties.VALUE, ctx.text(body, end));
                scanExpression(ctx, body, end, function, null);
            }
            finish(ctx, function, start, end);
            return Math.max(end, arrow + 1);
        } finally {
            exitScope(ctx, frame);
        }
    }

    private static int arrowBodyEnd(List<Token> tokens, int from, int to) {
        int depth = 0;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type().isOpening()) {
                depth++;
            } else if (token.type().isClosing()) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            } else if (depth == 0 && token.is(TokenType.COMMA, TokenType.SEMICOLON)) {
                return i;
            } else if (depth == 0 && token.is(TokenType.NEWLINE)) {
                int previous = TokenRanges.previousSignificant(tokens, i, from);
                int next = TokenRanges.nextSignificant(tokens, i + 1, to);
                if (previous >= 0 && (next >= to || !continuesAcrossLine(tokens.get(previous), tokens.get(next)))) {
                    return i;
                }
            }
        }
        return to;
    }

    // ==================== Types ====================

    /**
     * Skips a type expression starting at {@code from}.
     *
     * @param allowFunctionTypes whether {@code =>} may continue the type; false where an arrow
     *                           function's body follows the return type
     * @return index just past the type's last token
     */
    protected int skipType(List<Token> tokens, int from, int to, boolean allowFunctionTypes) {
        int i = TokenRanges.nextSignificant(tokens, from, to);
        boolean conditional = false;
        while (i < to) {
            Token token = tokens.get(i);
            if (token.is(TokenType.IDENTIFIER, TokenType.KEYWORD) && TYPE_PREFIXES.contains(token.text())) {
                int next = TokenRanges.nextSignificant(tokens, i + 1, to);
                if (next < to && !tokens.get(next).is(TokenType.DOT, TokenType.COMMA, TokenType.SEMICOLON,
                        TokenType.CLOSE_PAREN, TokenType.CLOSE_BRACKET, TokenType.CLOSE_BRACE, TokenType.EQUALS)) {
                    i = next;
                    continue;
                }
            }
            if (token.isOperator("|") || token.isOperator("&") || token.isOperator("-")) {
                i = TokenRanges.nextSignificant(tokens, i + 1, to);
                continue;
            }
            if (token.is(TokenType.OPEN_BRACE, TokenType.OPEN_PAREN, TokenType.OPEN_BRACKET)) {
                int close = TokenRanges.matchingClose(tokens, i, to);
                if (close < 0) {
                    return to;
                }
                i = close + 1;
            } else if (token.is(TokenType.IDENTIFIER, TokenType.KEYWORD, TokenType.STRING, TokenType.NUMBER, TokenType.TEMPLATE)) {
                i++;
            } else if (token.isOperator("<")) {
                int close = TokenRanges.matchingAngle(tokens, i, to);
                if (close < 0) {
                    return i;
                }
                i = close + 1;
                continue;
            } else {
                return i;
            }

            while (true) {
                int next = TokenRanges.nextSignificant(tokens, i, to);
                if (next >= to) {
                    return i;
                }
                Token postfix = tokens.get(next);
                if (postfix.is(TokenType.DOT)) {
                    int member = TokenRanges.nextSignificant(tokens, next + 1, to);
                    if (member < to && tokens.get(member).is(TokenType.IDENTIFIER, TokenType.KEYWORD)) {
                        i = member + 1;
                        continue;
                    }
                } else if (postfix.isOperator("<") && !TokenRanges.hasNewline(tokens, i, next)) {
                    int close = TokenRanges.matchingAngle(tokens, next, to);
                    if (close >= 0) {
                        i = close + 1;
                        continue;
                    }
                } else if (postfix.is(TokenType.OPEN_BRACKET) && !TokenRanges.hasNewline(tokens, i, next)) {
                    int close = TokenRanges.matchingClose(tokens, next, to);
                    if (close >= 0) {
                        i = close + 1;
                        continue;
                    }
                }
                break;
            }

            int next = TokenRanges.nextSignificant(tokens, i, to);
            if (next >= to) {
                return i;
            }
            Token joiner = tokens.get(next);
            if (joiner.isOperator("|") || joiner.isOperator("&")
                    || allowFunctionTypes && joiner.is(TokenType.FAT_ARROW)
                    || joiner.isWord("is")) {
                i = TokenRanges.nextSignificant(tokens, next + 1, to);
            } else if (joiner.isWord("extends")) {
                conditional = true;
                i = TokenRanges.nextSignificant(tokens, next + 1, to);
            } else if (conditional && (joiner.isOperator("?") || joiner.is(TokenType.COLON))) {
                i = TokenRanges.nextSignificant(tokens, next + 1, to);
            } else {
                return i;
            }
        }
        return i;
    }
}
