package com.codeparse.core.parser.impl.python;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.codeparse.core.ast.AstNode;
import com.codeparse.core.ast.NodeProperties;
import com.codeparse.core.ast.NodeTypes;
import com.codeparse.core.block.BlockResult;
import com.codeparse.core.block.IndentationBlockParser;
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
 * Structure parser for Python.
 *
 * <p>Walks the source one logical line at a time and delegates every suite to an
 * {@link IndentationBlockParser}. Recognized constructs:
 * <ul>
 *   <li>{@code def} and {@code async def}, as methods when directly inside a class body</li>
 *   <li>{@code class} with bases, keyword arguments and {@code metaclass}</li>
 *   <li>stacked decorators on functions, methods and classes</li>
 *   <li>{@code import} and {@code from ... import}</li>
 *   <li>assignments, annotated assignments and walrus bindings</li>
 *   <li>{@code if/elif/else}, loops, {@code try/except/finally}, {@code with}, {@code match/case}</li>
 * </ul>
 *
 * <p>Decorator handling follows {@link ParserConfig#decorators()}: the listing order and whether a
 * blank line may separate a decorator from its definition. A decorator that reaches no definition
 * becomes an error node.
 *
 * @since 1.0.0
 */
public class PythonParser extends AbstractLanguageParser {

    private static final Set<String> IF_KEYWORDS = Set.of("if", "elif");
    private static final Set<String> LOOP_KEYWORDS = Set.of("for", "while");
    private static final Set<String> TRY_KEYWORDS = Set.of("try", "except", "finally");
    private static final Set<String> COMPOUND_KEYWORDS = Set.of(
        "if", "elif", "else", "for", "while", "try", "except", "finally", "with");
    /** Line starters that end a statement whose bracket was left open. */
    private static final Set<String> CONSTRUCT_INTRODUCERS = Set.of("def", "class", "async", "@");

    private final IndentationBlockParser blockParser;

    public PythonParser() {
        this(ParserConfig.defaults());
    }

    public PythonParser(ParserConfig config) {
        super(config);
        this.blockParser = new IndentationBlockParser(config.indentation().tabWidth(), CONSTRUCT_INTRODUCERS);
    }

    @Override
    public String getLanguage() {
        return Languages.PYTHON;
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("py");
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of("py", "pyi", "pyw");
    }

    @Override
    protected Lexer createLexer(String source) {
        return new PythonLexer(source);
    }

    @Override
    protected void parseModule(ParseContext ctx) {
        parseSuite(ctx, 0, ctx.size(), ctx.root());
    }

    /**
     * A decorator line waiting for its definition.
     */
    private record Decorator(String expression, int start, int end) {
    }

    private void parseSuite(ParseContext ctx, int from, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        List<Decorator> pending = new ArrayList<>();
        boolean blankAfterDecorator = false;
        int i = from;
        while (i < to) {
            int lineEnd = Math.min(blockParser.lineEnd(tokens, i), to);
            int first = TokenRanges.nextSignificant(tokens, i, lineEnd);
            if (first >= lineEnd) {
                if (!pending.isEmpty() && !hasComment(tokens, i, lineEnd)) {
                    blankAfterDecorator = true;
                }
                i = lineEnd;
                continue;
            }
            reportUnclosedBracket(ctx, first, lineEnd);
            if (!pending.isEmpty() && blankAfterDecorator && !config.decorators().allowBlankLines()) {
                danglingDecorators(ctx, parent, pending);
            }
            blankAfterDecorator = false;

            if (tokens.get(first).is(TokenType.AT)) {
                pending.add(new Decorator(ctx.text(first + 1, lineEnd), first, lineEnd));
                i = lineEnd;
                continue;
            }
            int next = parseStatement(ctx, first, lineEnd, parent, pending);
            if (!pending.isEmpty()) {
                danglingDecorators(ctx, parent, pending);
            }
            i = Math.max(lineEnd, Math.min(next, to));
        }
        if (!pending.isEmpty()) {
            danglingDecorators(ctx, parent, pending);
        }
    }

    private static boolean hasComment(List<Token> tokens, int from, int to) {
        for (int i = from; i < to; i++) {
            if (tokens.get(i).is(TokenType.COMMENT)) {
                return true;
            }
        }
        return false;
    }

    private void reportUnclosedBracket(ParseContext ctx, int from, int to) {
        List<Token> tokens = ctx.tokens();
        List<Integer> open = new ArrayList<>();
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type().isOpening()) {
                open.add(i);
            } else if (token.type().isClosing() && !open.isEmpty()) {
                open.remove(open.size() - 1);
            }
        }
        if (!open.isEmpty()) {
            Token opener = tokens.get(open.get(0));
            ctx.warn(WarningKind.STRUCTURAL_UNTERMINATED,
                "Unclosed '" + opener.text() + "'" + (to >= ctx.size() ? " reaches end of input" : ""), opener);
        }
    }

    private void danglingDecorators(ParseContext ctx, AstNode parent, List<Decorator> pending) {
        for (Decorator decorator : pending) {
            errorNode(ctx, parent, decorator.start(), decorator.end(),
                "Decorator '@" + decorator.expression() + "' is not followed by a definition");
        }
        pending.clear();
    }

    private List<String> takeDecorators(List<Decorator> pending) {
        List<String> expressions = new ArrayList<>();
        for (Decorator decorator : pending) {
            expressions.add(decorator.expression());
        }
        pending.clear();
        return orderDecorators(expressions);
    }

    // ==================== Statements ====================

    private int parseStatement(ParseContext ctx, int first, int lineEnd, AstNode parent, List<Decorator> pending) {
        List<Token> tokens = ctx.tokens();
        boolean async = false;
        int keyword = first;
        if (tokens.get(first).isWord("async")) {
            int after = TokenRanges.nextSignificant(tokens, first + 1, lineEnd);
            if (after < lineEnd && tokens.get(after).isWord("def", "for", "with")) {
                async = true;
                keyword = after;
            }
        }
        Token token = tokens.get(keyword);
        if (token.isWord("def")) {
            return parseFunction(ctx, first, keyword, lineEnd, parent, takeDecorators(pending), async);
        }
        if (token.isWord("class")) {
            return parseClass(ctx, first, keyword, lineEnd, parent, takeDecorators(pending));
        }
        if (token.is(TokenType.KEYWORD) && COMPOUND_KEYWORDS.contains(token.text())) {
            return parseCompound(ctx, first, keyword, lineEnd, parent, async);
        }
        if (token.isWord("match") && isSoftKeywordHeader(ctx, keyword, lineEnd)) {
            return parseMatch(ctx, keyword, lineEnd, parent);
        }
        if (token.isWord("case") && ctx.state().currentType() == ContextType.MATCH
                && isSoftKeywordHeader(ctx, keyword, lineEnd)) {
            return parseCase(ctx, keyword, lineEnd, parent);
        }
        for (int[] segment : TokenRanges.splitTopLevel(tokens, first, lineEnd, TokenType.SEMICOLON)) {
            int start = TokenRanges.nextSignificant(tokens, segment[0], segment[1]);
            if (start < segment[1]) {
                parseSimpleStatement(ctx, start, segment[1], parent);
            }
        }
        return lineEnd;
    }

    private void parseSimpleStatement(ParseContext ctx, int start, int end, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        Token token = tokens.get(start);
        if (token.isWord("import")) {
            parseImport(ctx, start, end, parent);
        } else if (token.isWord("from")) {
            parseFromImport(ctx, start, end, parent);
        } else if (token.isWord("return")) {
            AstNode statement = node(ctx, NodeTypes.RETURN_STATEMENT, start);
            String value = ctx.text(start + 1, end);
            if (!value.isEmpty()) {
                statement.setProperty(NodeProperties.VALUE, value);
            }
            finish(ctx, statement, start, end);
            parent.addChild(statement);
            scanNamedExpressions(ctx, start + 1, end, statement);
        } else if (token.type().isClosing()) {
            errorNode(ctx, parent, start, end, "Unexpected '" + token.text() + "'");
        } else if (token.isWord("def", "class")) {
            errorNode(ctx, parent, start, end, "Incomplete '" + token.text() + "' statement");
        } else {
            parseAssignmentOrExpression(ctx, start, end, parent);
        }
    }

    private void parseAssignmentOrExpression(ParseContext ctx, int start, int end, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int lambda = findWord(tokens, start, end, "lambda");
        int limit = lambda >= 0 ? lambda : end;
        List<int[]> parts = TokenRanges.splitTopLevel(tokens, start, limit, TokenType.EQUALS);
        int annotationColon = TokenRanges.findTopLevel(tokens, start, parts.get(0)[1], TokenType.COLON);

        AstNode statement;
        if (parts.size() > 1 || annotationColon >= 0) {
            List<Token> names = new ArrayList<>();
            String annotation = null;
            if (annotationColon >= 0) {
                collectTargets(tokens, start, annotationColon, names);
                annotation = ctx.text(annotationColon + 1, parts.get(0)[1]);
            } else {
                for (int p = 0; p < parts.size() - 1; p++) {
                    collectTargets(tokens, parts.get(p)[0], parts.get(p)[1], names);
                }
            }
            if (names.isEmpty()) {
                statement = expressionStatement(ctx, start, end);
            } else {
                statement = node(ctx, NodeTypes.VARIABLE_DECLARATION, start);
                statement.setProperty(NodeProperties.KIND, "assignment");
                statement.setProperty(NodeProperties.NAMES, names.stream().map(Token::text).toList());
                if (annotation != null && !annotation.isEmpty()) {
                    statement.setProperty(NodeProperties.TYPE, annotation);
                }
                if (parts.size() > 1) {
                    int[] last = parts.get(parts.size() - 1);
                    statement.setProperty(NodeProperties.VALUE, ctx.text(last[0], end));
                }
                for (Token name : names) {
                    declare(ctx, name.text(), SymbolKind.VARIABLE, name);
                }
            }
        } else {
            statement = expressionStatement(ctx, start, end);
        }
        finish(ctx, statement, start, end);
        parent.addChild(statement);
        scanNamedExpressions(ctx, start, end, statement);
    }

    private AstNode expressionStatement(ParseContext ctx, int start, int end) {
        AstNode statement = node(ctx, NodeTypes.EXPRESSION_STATEMENT, start);
        statement.setProperty(NodeProperties.TEXT, ctx.text(start, end));
        return statement;
    }

    /**
     * Collects plain-name binding targets, unpacking tuples, lists and starred names. Attribute
     * and subscript targets bind nothing new and are skipped.
     */
    private static void collectTargets(List<Token> tokens, int from, int to, List<Token> names) {
        for (int[] segment : TokenRanges.splitTopLevel(tokens, from, to, TokenType.COMMA)) {
            int first = TokenRanges.nextSignificant(tokens, segment[0], segment[1]);
            if (first >= segment[1]) {
                continue;
            }
            if (tokens.get(first).isOperator("*")) {
                first = TokenRanges.nextSignificant(tokens, first + 1, segment[1]);
                if (first >= segment[1]) {
                    continue;
                }
            }
            int last = TokenRanges.previousSignificant(tokens, segment[1], first);
            Token head = tokens.get(first);
            if (head.is(TokenType.OPEN_PAREN, TokenType.OPEN_BRACKET)
                    && TokenRanges.matchingClose(tokens, first, segment[1]) == last) {
                collectTargets(tokens, first + 1, last, names);
            } else if (first == last && head.is(TokenType.IDENTIFIER)) {
                names.add(head);
            }
        }
    }

    /**
     * Registers every {@code name := value} in {@code [from, to)} as a variable of the current
     * scope and records it as a child of {@code owner}.
     */
    private void scanNamedExpressions(ParseContext ctx, int from, int to, AstNode owner) {
        List<Token> tokens = ctx.tokens();
        for (int i = from; i < to; i++) {
            if (!tokens.get(i).isOperator(":=")) {
                continue;
            }
            int nameIndex = TokenRanges.previousSignificant(tokens, i, from);
            if (nameIndex < 0 || !tokens.get(nameIndex).is(TokenType.IDENTIFIER)) {
                continue;
            }
            Token name = tokens.get(nameIndex);
            int valueEnd = expressionEnd(tokens, i + 1, to);
            AstNode named = node(ctx, NodeTypes.NAMED_EXPRESSION, nameIndex);
            named.setProperty(NodeProperties.NAME, name.text());
            named.setProperty(NodeProperties.VALUE, ctx.text(i + 1, valueEnd));
            finish(ctx, named, nameIndex, valueEnd);
            owner.addChild(named);
            declare(ctx, name.text(), SymbolKind.VARIABLE, name);
        }
    }

    /**
     * Returns the end of the expression starting at {@code from}: the first top-level comma,
     * unmatched closing bracket or {@code to}.
     */
    private static int expressionEnd(List<Token> tokens, int from, int to) {
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
            } else if (depth == 0 && token.is(TokenType.COMMA, TokenType.COLON)) {
                return i;
            }
        }
        return to;
    }

    // ==================== Imports ====================

    private void parseImport(ParseContext ctx, int start, int end, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        AstNode node = node(ctx, NodeTypes.IMPORT_DECLARATION, start);
        List<Map<String, Object>> names = new ArrayList<>();
        for (int[] item : TokenRanges.splitTopLevel(tokens, start + 1, end, TokenType.COMMA)) {
            int as = findWord(tokens, item[0], item[1], "as");
            String module = ctx.text(item[0], as >= 0 ? as : item[1]);
            if (module.isEmpty()) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(NodeProperties.NAME, module);
            int bindingIndex;
            if (as >= 0) {
                bindingIndex = TokenRanges.nextSignificant(tokens, as + 1, item[1]);
                if (bindingIndex < item[1]) {
                    entry.put(NodeProperties.ALIAS, tokens.get(bindingIndex).text());
                }
            } else {
                bindingIndex = TokenRanges.nextSignificant(tokens, item[0], item[1]);
            }
            names.add(entry);
            if (bindingIndex < item[1] && tokens.get(bindingIndex).is(TokenType.IDENTIFIER)) {
                declare(ctx, tokens.get(bindingIndex).text(), SymbolKind.IMPORT, tokens.get(bindingIndex));
            }
        }
        node.setProperty(NodeProperties.NAMES, names);
        finish(ctx, node, start, end);
        parent.addChild(node);
    }

    private void parseFromImport(ParseContext ctx, int start, int end, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int importIndex = findWord(tokens, start + 1, end, "import");
        if (importIndex < 0) {
            errorNode(ctx, parent, start, end, "Expected 'import' in from-import statement");
            return;
        }
        AstNode node = node(ctx, NodeTypes.IMPORT_DECLARATION, start);
        node.setProperty(NodeProperties.MODULE, ctx.text(start + 1, importIndex));

        int from = TokenRanges.nextSignificant(tokens, importIndex + 1, end);
        int to = end;
        if (from < end && tokens.get(from).is(TokenType.OPEN_PAREN)) {
            int close = TokenRanges.matchingClose(tokens, from, end);
            to = close >= 0 ? close : end;
            from++;
        }
        List<Map<String, Object>> names = new ArrayList<>();
        for (int[] item : TokenRanges.splitTopLevel(tokens, from, to, TokenType.COMMA)) {
            int nameIndex = TokenRanges.nextSignificant(tokens, item[0], item[1]);
            if (nameIndex >= item[1]) {
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(NodeProperties.NAME, tokens.get(nameIndex).text());
            int bindingIndex = nameIndex;
            int as = findWord(tokens, nameIndex + 1, item[1], "as");
            if (as >= 0) {
                bindingIndex = TokenRanges.nextSignificant(tokens, as + 1, item[1]);
                if (bindingIndex < item[1]) {
                    entry.put(NodeProperties.ALIAS, tokens.get(bindingIndex).text());
                }
            }
            names.add(entry);
            if (bindingIndex < item[1] && tokens.get(bindingIndex).is(TokenType.IDENTIFIER)) {
                declare(ctx, tokens.get(bindingIndex).text(), SymbolKind.IMPORT, tokens.get(bindingIndex));
            }
        }
        node.setProperty(NodeProperties.NAMES, names);
        finish(ctx, node, start, end);
        parent.addChild(node);
    }

    private static int findWord(List<Token> tokens, int from, int to, String word) {
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

    // ==================== Definitions ====================

    private int parseFunction(ParseContext ctx, int first, int keyword, int lineEnd, AstNode parent,
                              List<String> decorators, boolean async) {
        List<Token> tokens = ctx.tokens();
        int nameIndex = TokenRanges.nextSignificant(tokens, keyword + 1, lineEnd);
        if (nameIndex >= lineEnd || !isName(tokens.get(nameIndex))) {
            errorNode(ctx, parent, first, lineEnd, "Expected a function name after 'def'");
            return lineEnd;
        }
        int open = TokenRanges.nextSignificant(tokens, nameIndex + 1, lineEnd);
        List<String> typeParameters = List.of();
        if (open < lineEnd && tokens.get(open).is(TokenType.OPEN_BRACKET)) {
            int close = TokenRanges.matchingClose(tokens, open, lineEnd);
            if (close >= 0) {
                typeParameters = segmentTexts(ctx, open + 1, close);
                open = TokenRanges.nextSignificant(tokens, close + 1, lineEnd);
            }
        }
        if (open >= lineEnd || !tokens.get(open).is(TokenType.OPEN_PAREN)) {
            errorNode(ctx, parent, first, lineEnd, "Expected '(' after function name");
            return lineEnd;
        }
        int close = TokenRanges.matchingClose(tokens, open, lineEnd);
        if (close < 0) {
            return unclosedFunction(ctx, keyword, tokens.get(nameIndex), lineEnd, parent, decorators, async);
        }
        int colon = findHeaderColon(tokens, close + 1, lineEnd);
        if (colon < 0) {
            errorNode(ctx, parent, first, lineEnd, "Expected ':' after function signature");
            return lineEnd;
        }

        Token name = tokens.get(nameIndex);
        boolean method = ctx.state().currentType() == ContextType.CLASS;
        AstNode function = node(ctx, method ? NodeTypes.METHOD_DECLARATION : NodeTypes.FUNCTION_DECLARATION, keyword);
        function.setProperty(NodeProperties.NAME, name.text());
        if (!decorators.isEmpty()) {
            function.setProperty(NodeProperties.DECORATORS, decorators);
        }
        if (async) {
            function.setProperty(NodeProperties.ASYNC, true);
        }
        if (!typeParameters.isEmpty()) {
            function.setProperty(NodeProperties.TYPE_PARAMETERS, typeParameters);
        }
        int arrow = TokenRanges.findTopLevel(tokens, close + 1, colon, TokenType.ARROW);
        if (arrow >= 0) {
            function.setProperty(NodeProperties.RETURN_TYPE, ctx.text(arrow + 1, colon));
        }
        declare(ctx, name.text(), method ? SymbolKind.METHOD : SymbolKind.FUNCTION, name);
        parent.addChild(function);

        ContextFrame frame = enterScope(ctx, ContextType.FUNCTION, name.text(), keyword);
        try {
            function.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            function.setProperty(NodeProperties.PARAMETERS, parseParameters(ctx, open + 1, close));
            int next = parseBody(ctx, function, colon, "function '" + name.text() + "'");
            finish(ctx, function, keyword, next);
            return next;
        } finally {
            exitScope(ctx, frame);
        }
    }

    /**
     * Keeps a definition whose parameter list never closes: the node is marked unterminated and
     * its name is still declared. The open bracket itself was reported for the whole line.
     */
    private int unclosedFunction(ParseContext ctx, int keyword, Token name, int lineEnd, AstNode parent,
                                 List<String> decorators, boolean async) {
        boolean method = ctx.state().currentType() == ContextType.CLASS;
        AstNode function = node(ctx, method ? NodeTypes.METHOD_DECLARATION : NodeTypes.FUNCTION_DECLARATION, keyword);
        function.setProperty(NodeProperties.NAME, name.text());
        if (!decorators.isEmpty()) {
            function.setProperty(NodeProperties.DECORATORS, decorators);
        }
        if (async) {
            function.setProperty(NodeProperties.ASYNC, true);
        }
        function.setProperty(NodeProperties.UNTERMINATED, true);
        declare(ctx, name.text(), method ? SymbolKind.METHOD : SymbolKind.FUNCTION, name);
        parent.addChild(function);
        finish(ctx, function, keyword, lineEnd);
        return lineEnd;
    }

    private List<Map<String, Object>> parseParameters(ParseContext ctx, int from, int to) {
        List<Token> tokens = ctx.tokens();
        List<Map<String, Object>> parameters = new ArrayList<>();
        for (int[] segment : TokenRanges.splitTopLevel(tokens, from, to, TokenType.COMMA)) {
            int first = TokenRanges.nextSignificant(tokens, segment[0], segment[1]);
            if (first >= segment[1]) {
                continue;
            }
            Map<String, Object> parameter = new LinkedHashMap<>();
            String kind = "positional";
            Token head = tokens.get(first);
            if (head.isOperator("*") || head.isOperator("**") || head.isOperator("/")) {
                int next = TokenRanges.nextSignificant(tokens, first + 1, segment[1]);
                if (next >= segment[1]) {
                    parameter.put(NodeProperties.PARAM_NAME, head.text());
                    parameter.put(NodeProperties.PARAM_KIND, "separator");
                    parameters.add(parameter);
                    continue;
                }
                kind = head.isOperator("**") ? "kwargs" : "varargs";
                first = next;
            }
            Token name = tokens.get(first);
            int colon = TokenRanges.findTopLevel(tokens, first, segment[1], TokenType.COLON);
            int equals = TokenRanges.findTopLevel(tokens, first, segment[1], TokenType.EQUALS);
            parameter.put(NodeProperties.PARAM_NAME, name.text());
            parameter.put(NodeProperties.PARAM_KIND, kind);
            if (colon >= 0) {
                parameter.put(NodeProperties.PARAM_ANNOTATION, ctx.text(colon + 1, equals >= 0 ? equals : segment[1]));
            }
            if (equals >= 0) {
                parameter.put(NodeProperties.PARAM_DEFAULT, ctx.text(equals + 1, segment[1]));
            }
            parameters.add(parameter);
            if (name.is(TokenType.IDENTIFIER)) {
                declare(ctx, name.text(), SymbolKind.PARAMETER, name);
            }
        }
        return parameters;
    }

    private int parseClass(ParseContext ctx, int first, int keyword, int lineEnd, AstNode parent,
                           List<String> decorators) {
        List<Token> tokens = ctx.tokens();
        int nameIndex = TokenRanges.nextSignificant(tokens, keyword + 1, lineEnd);
        if (nameIndex >= lineEnd || !isName(tokens.get(nameIndex))) {
            errorNode(ctx, parent, first, lineEnd, "Expected a class name after 'class'");
            return lineEnd;
        }
        int colon = findHeaderColon(tokens, nameIndex + 1, lineEnd);
        if (colon < 0) {
            errorNode(ctx, parent, first, lineEnd, "Expected ':' after class header");
            return lineEnd;
        }

        Token name = tokens.get(nameIndex);
        AstNode cls = node(ctx, NodeTypes.CLASS_DECLARATION, keyword);
        cls.setProperty(NodeProperties.NAME, name.text());
        if (!decorators.isEmpty()) {
            cls.setProperty(NodeProperties.DECORATORS, decorators);
        }

        int cursor = TokenRanges.nextSignificant(tokens, nameIndex + 1, colon);
        if (cursor < colon && tokens.get(cursor).is(TokenType.OPEN_BRACKET)) {
            int close = TokenRanges.matchingClose(tokens, cursor, colon);
            if (close >= 0) {
                cls.setProperty(NodeProperties.TYPE_PARAMETERS, segmentTexts(ctx, cursor + 1, close));
                cursor = TokenRanges.nextSignificant(tokens, close + 1, colon);
            }
        }
        List<String> bases = new ArrayList<>();
        Map<String, Object> keywords = new LinkedHashMap<>();
        if (cursor < colon && tokens.get(cursor).is(TokenType.OPEN_PAREN)) {
            int close = TokenRanges.matchingClose(tokens, cursor, colon);
            int argumentsEnd = close >= 0 ? close : colon;
            for (int[] argument : TokenRanges.splitTopLevel(tokens, cursor + 1, argumentsEnd, TokenType.COMMA)) {
                int argStart = TokenRanges.nextSignificant(tokens, argument[0], argument[1]);
                if (argStart >= argument[1]) {
                    continue;
                }
                int equals = TokenRanges.findTopLevel(tokens, argStart, argument[1], TokenType.EQUALS);
                if (equals >= 0 && tokens.get(argStart).is(TokenType.IDENTIFIER)) {
                    String key = tokens.get(argStart).text();
                    String value = ctx.text(equals + 1, argument[1]);
                    if ("metaclass".equals(key)) {
                        cls.setProperty(NodeProperties.METACLASS, value);
                    } else {
                        keywords.put(key, value);
                    }
                } else {
                    bases.add(ctx.text(argStart, argument[1]));
                }
            }
        }
        cls.setProperty(NodeProperties.BASES, bases);
        if (!keywords.isEmpty()) {
            cls.setProperty(NodeProperties.KEYWORDS, keywords);
        }
        declare(ctx, name.text(), SymbolKind.CLASS, name);
        parent.addChild(cls);

        ContextFrame frame = enterScope(ctx, ContextType.CLASS, name.text(), keyword);
        try {
            cls.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            int next = parseBody(ctx, cls, colon, "class '" + name.text() + "'");
            finish(ctx, cls, keyword, next);
            return next;
        } finally {
            exitScope(ctx, frame);
        }
    }

    private List<String> segmentTexts(ParseContext ctx, int from, int to) {
        List<String> texts = new ArrayList<>();
        for (int[] segment : TokenRanges.splitTopLevel(ctx.tokens(), from, to, TokenType.COMMA)) {
            String text = ctx.text(segment[0], segment[1]);
            if (!text.isEmpty()) {
                texts.add(text);
            }
        }
        return texts;
    }

    // ==================== Compound Statements ====================

    private int parseCompound(ParseContext ctx, int first, int keyword, int lineEnd, AstNode parent, boolean async) {
        List<Token> tokens = ctx.tokens();
        String word = tokens.get(keyword).text();
        int colon = findHeaderColon(tokens, keyword + 1, lineEnd);
        if (colon < 0) {
            errorNode(ctx, parent, first, lineEnd, "Expected ':' after '" + word + "'");
            return lineEnd;
        }
        String type;
        if (IF_KEYWORDS.contains(word)) {
            type = NodeTypes.IF_STATEMENT;
        } else if (LOOP_KEYWORDS.contains(word)) {
            type = NodeTypes.LOOP_STATEMENT;
        } else if (TRY_KEYWORDS.contains(word)) {
            type = NodeTypes.TRY_STATEMENT;
        } else if ("with".equals(word)) {
            type = NodeTypes.WITH_STATEMENT;
        } else {
            type = NodeTypes.BLOCK_STATEMENT;
        }
        AstNode statement = node(ctx, type, keyword);
        statement.setProperty(NodeProperties.KEYWORD, word);
        String condition = ctx.text(keyword + 1, colon);
        if (!condition.isEmpty()) {
            statement.setProperty(NodeProperties.CONDITION, condition);
        }
        if (async) {
            statement.setProperty(NodeProperties.ASYNC, true);
        }
        parent.addChild(statement);
        bindHeaderTargets(ctx, word, keyword + 1, colon);
        scanNamedExpressions(ctx, keyword + 1, colon, statement);

        ContextFrame frame = enterBlock(ctx, ContextType.BLOCK, word, keyword);
        try {
            int next = parseBody(ctx, statement, colon, "'" + word + "' block");
            finish(ctx, statement, keyword, next);
            return next;
        } finally {
            exitScope(ctx, frame);
        }
    }

    /**
     * Registers the names bound by a {@code for} target, {@code with ... as} or
     * {@code except ... as} clause.
     */
    private void bindHeaderTargets(ParseContext ctx, String keyword, int from, int to) {
        List<Token> tokens = ctx.tokens();
        List<Token> names = new ArrayList<>();
        switch (keyword) {
            case "for" -> {
                int in = findWord(tokens, from, to, "in");
                if (in >= 0) {
                    collectTargets(tokens, from, in, names);
                }
            }
            case "with", "except" -> {
                int start = TokenRanges.nextSignificant(tokens, from, to);
                int end = to;
                if (start < to && tokens.get(start).is(TokenType.OPEN_PAREN)
                        && TokenRanges.matchingClose(tokens, start, to) == TokenRanges.previousSignificant(tokens, to, start)) {
                    end = TokenRanges.matchingClose(tokens, start, to);
                    start++;
                }
                for (int[] item : TokenRanges.splitTopLevel(tokens, start, end, TokenType.COMMA)) {
                    int as = findWord(tokens, item[0], item[1], "as");
                    if (as >= 0) {
                        collectTargets(tokens, as + 1, item[1], names);
                    }
                }
            }
            default -> {
                return;
            }
        }
        for (Token name : names) {
            declare(ctx, name.text(), SymbolKind.VARIABLE, name);
        }
    }

    private int parseMatch(ParseContext ctx, int keyword, int lineEnd, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int colon = findHeaderColon(tokens, keyword + 1, lineEnd);
        AstNode match = node(ctx, NodeTypes.MATCH_STATEMENT, keyword);
        match.setProperty(NodeProperties.SUBJECT, ctx.text(keyword + 1, colon));
        parent.addChild(match);
        scanNamedExpressions(ctx, keyword + 1, colon, match);

        ContextFrame frame = enterBlock(ctx, ContextType.MATCH, "match", keyword);
        try {
            int next = parseBody(ctx, match, colon, "'match' block");
            finish(ctx, match, keyword, next);
            return next;
        } finally {
            exitScope(ctx, frame);
        }
    }

    private int parseCase(ParseContext ctx, int keyword, int lineEnd, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int colon = findHeaderColon(tokens, keyword + 1, lineEnd);
        AstNode arm = node(ctx, NodeTypes.CASE_CLAUSE, keyword);
        arm.setProperty(NodeProperties.PATTERN, ctx.text(keyword + 1, colon));
        parent.addChild(arm);

        ContextFrame frame = enterBlock(ctx, ContextType.CASE, "case", keyword);
        try {
            int next = parseBody(ctx, arm, colon, "'case' block");
            finish(ctx, arm, keyword, next);
            return next;
        } finally {
            exitScope(ctx, frame);
        }
    }

    /**
     * Decides whether a soft keyword ({@code match}, {@code case}) starts a block header rather
     * than being used as a plain name, as in {@code match = re.match(p, s)}.
     */
    private static boolean isSoftKeywordHeader(ParseContext ctx, int keyword, int lineEnd) {
        List<Token> tokens = ctx.tokens();
        int next = TokenRanges.nextSignificant(tokens, keyword + 1, lineEnd);
        if (next >= lineEnd) {
            return false;
        }
        Token token = tokens.get(next);
        if (token.is(TokenType.EQUALS, TokenType.DOT, TokenType.COMMA, TokenType.COLON, TokenType.CLOSE_PAREN,
                TokenType.CLOSE_BRACKET, TokenType.CLOSE_BRACE)
                || token.is(TokenType.OPERATOR) && !token.isOperator("*") && !token.isOperator("-")) {
            return false;
        }
        int colon = findHeaderColon(tokens, next, lineEnd);
        return colon >= 0 && TokenRanges.isBlank(tokens, colon + 1, lineEnd);
    }

    /**
     * Finds the colon ending a block header: the first colon at bracket depth 0 that does not
     * belong to a lambda.
     */
    private static int findHeaderColon(List<Token> tokens, int from, int to) {
        int depth = 0;
        int lambdas = 0;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type().isOpening()) {
                depth++;
            } else if (token.type().isClosing()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.isWord("lambda")) {
                lambdas++;
            } else if (depth == 0 && token.is(TokenType.COLON)) {
                if (lambdas == 0) {
                    return i;
                }
                lambdas--;
            }
        }
        return -1;
    }

    /**
     * Scans the suite following the header colon, attaches it to {@code owner} as a block and
     * parses its statements.
     *
     * @return index of the first token after the suite
     */
    private int parseBody(ParseContext ctx, AstNode owner, int colon, String what) {
        BlockResult block = blockParser.parseBlock(ctx.tokens(), colon + 1, ctx.state(), ContextType.BLOCK,
            Map.of(ContextFrame.KEYWORD, owner.getNodeType()));
        AstNode body = blockNode(ctx, colon, block);
        owner.addChild(body);
        if (!block.terminated()) {
            markUnterminated(ctx, owner, colon, what);
        }
        parseSuite(ctx, block.firstMember(), block.memberEnd(), body);
        return block.nextIndex();
    }
}
