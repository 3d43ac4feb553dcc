package com.codeparse.core.parser.impl.rust;

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
 * Structure parser for Rust.
 *
 * <p>Recognizes items (functions, structs, unions, enums, traits, impl blocks, modules,
 * {@code use} declarations, type aliases, constants, statics, extern blocks and
 * {@code macro_rules!} definitions) and, inside bodies, {@code let} bindings, control flow,
 * {@code match} arms and closures. Outer attributes become decorators of the item they precede;
 * inner attributes ({@code #![...]}) are recorded on the enclosing node. Lifetime parameters are
 * reported apart from type parameters.
 *
 * <p>An impl block is reported as a {@link NodeTypes#CLASS_DECLARATION} of kind {@code impl}
 * named after the implementing type. It opens a scope for its methods but declares no symbol.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * ParseResult result = new RustParser().parse("impl<T> Stack<T> { fn push(&mut self, v: T) {} }");
 * AstNode impl = result.root().firstChild(NodeTypes.CLASS_DECLARATION).orElseThrow();
 * }</pre>
 *
 * @since 1.0.0
 */
public class RustParser extends AbstractLanguageParser {

    private static final Set<String> ITEM_STARTS = Set.of(
        "struct", "enum", "trait", "mod", "use", "pub", "let", "static", "macro_rules");

    protected final BraceBlockParser blockParser = new BraceBlockParser();

    public RustParser() {
        this(ParserConfig.defaults());
    }

    public RustParser(ParserConfig config) {
        super(config);
    }

    @Override
    public String getLanguage() {
        return Languages.RUST;
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("rs");
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of("rs");
    }

    @Override
    protected Lexer createLexer(String source) {
        return new RustLexer(source);
    }

    @Override
    protected void parseModule(ParseContext ctx) {
        parseStatements(ctx, 0, ctx.size(), ctx.root());
    }

    /**
     * Attributes and qualifiers collected in front of an item.
     */
    private record Prefix(List<String> attributes, List<String> modifiers) {

        static final Prefix NONE = new Prefix(List.of(), List.of());

        Prefix withAttribute(String attribute) {
            List<String> merged = new ArrayList<>(attributes);
            merged.add(attribute);
            return new Prefix(merged, modifiers);
        }

        Prefix withModifier(String modifier) {
            List<String> merged = new ArrayList<>(modifiers);
            merged.add(modifier);
            return new Prefix(attributes, merged);
        }
    }

    // ==================== Statements ====================

    protected void parseStatements(ParseContext ctx, int from, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int i = from;
        while (i < to) {
            if (!TokenRanges.isSignificant(tokens.get(i))) {
                i++;
                continue;
            }
            int next = parseStatement(ctx, i, to, parent, Prefix.NONE);
            i = Math.max(next, i + 1);
        }
    }

    private int parseStatement(ParseContext ctx, int i, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        Token token = tokens.get(i);
        int next = TokenRanges.nextSignificant(tokens, i + 1, to);
        Token following = next < to ? tokens.get(next) : null;

        if (token.is(TokenType.SEMICOLON)) {
            return i + 1;
        }
        if (token.type().isClosing()) {
            errorNode(ctx, parent, i, i + 1, "Unexpected '" + token.text() + "'");
            return i + 1;
        }
        if (token.is(TokenType.OPEN_BRACE)) {
            return parseBody(ctx, parent, i, "block");
        }
        if (token.isOperator("#")) {
            return parseAttribute(ctx, i, to, parent, prefix);
        }
        if (following == null) {
            return parseExpressionStatement(ctx, i, to, parent);
        }
        if (token.isWord("pub")) {
            String visibility = "pub";
            int after = next;
            if (following.is(TokenType.OPEN_PAREN)) {
                int close = TokenRanges.matchingClose(tokens, next, to);
                if (close >= 0) {
                    visibility = ctx.text(i, close + 1).replace(" ", "");
                    after = TokenRanges.nextSignificant(tokens, close + 1, to);
                }
            }
            return after < to ? parseStatement(ctx, after, to, parent, prefix.withModifier(visibility)) : after;
        }
        if (isQualifier(token, following)) {
            return parseStatement(ctx, next, to, parent, prefix.withModifier(token.text()));
        }
        if (token.isWord("extern")) {
            return parseExtern(ctx, i, to, parent, prefix);
        }
        if (token.isWord("unsafe") && following.is(TokenType.OPEN_BRACE)) {
            AstNode block = node(ctx, NodeTypes.BLOCK_STATEMENT, i);
            block.setProperty(NodeProperties.KEYWORD, "unsafe");
            parent.addChild(block);
            int end = parseBody(ctx, block, next, "unsafe block");
            finish(ctx, block, i, end);
            return end;
        }
        if (token.is(TokenType.IDENTIFIER) && token.text().startsWith(RustLexer.LIFETIME_PREFIX)
                && following.is(TokenType.COLON)) {
            int labeled = TokenRanges.nextSignificant(tokens, next + 1, to);
            return labeled < to ? parseStatement(ctx, labeled, to, parent, prefix) : labeled;
        }
        if (token.isWord("macro_rules") && following.isOperator("!")) {
            return parseMacroRules(ctx, i, next, to, parent, prefix);
        }
        if (token.isWord("union") && following.is(TokenType.IDENTIFIER)) {
            return parseStruct(ctx, i, to, parent, prefix);
        }
        if (token.is(TokenType.KEYWORD)) {
            switch (token.text()) {
                case "fn":
                    return parseFunction(ctx, i, to, parent, prefix);
                case "struct":
                    return parseStruct(ctx, i, to, parent, prefix);
                case "enum":
                    return parseEnum(ctx, i, to, parent, prefix);
                case "trait":
                    return parseTrait(ctx, i, to, parent, prefix);
                case "impl":
                    return parseImpl(ctx, i, to, parent, prefix);
                case "mod":
                    return parseMod(ctx, i, to, parent, prefix);
                case "use":
                    return parseUse(ctx, i, to, parent, prefix);
                case "type":
                    return parseTypeAlias(ctx, i, to, parent, prefix);
                case "const":
                case "static":
                    if (following.is(TokenType.IDENTIFIER) || following.isWord("mut")) {
                        return parseConstant(ctx, i, to, parent, prefix);
                    }
                    break;
                case "let":
                    return parseLet(ctx, i, to, parent);
                case "if":
                    return parseIf(ctx, i, to, parent);
                case "while":
                case "for":
                case "loop":
                    return parseLoop(ctx, i, to, parent);
                case "match":
                    return parseMatch(ctx, i, to, parent);
                case "return":
                    return parseReturn(ctx, i, to, parent);
                default:
                    break;
            }
        }
        return parseExpressionStatement(ctx, i, to, parent);
    }

    /**
     * Returns whether {@code token} qualifies a following item, as {@code unsafe} does in
     * {@code unsafe fn} but not in {@code unsafe { ... }}.
     */
    private static boolean isQualifier(Token token, Token following) {
        if (token.isWord("async", "const", "unsafe")) {
            return following.isWord("fn", "unsafe", "async", "extern", "impl", "trait");
        }
        return token.isWord("default") && following.isWord("fn", "type", "const", "unsafe", "async");
    }

    private int parseAttribute(ParseContext ctx, int hash, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        int open = TokenRanges.nextSignificant(tokens, hash + 1, to);
        boolean inner = open < to && tokens.get(open).isOperator("!");
        if (inner) {
            open = TokenRanges.nextSignificant(tokens, open + 1, to);
        }
        if (open >= to || !tokens.get(open).is(TokenType.OPEN_BRACKET)) {
            errorNode(ctx, parent, hash, hash + 1, "Expected '[' after '#'");
            return hash + 1;
        }
        int close = TokenRanges.matchingClose(tokens, open, to);
        if (close < 0) {
            int end = statementEnd(tokens, open, to);
            errorNode(ctx, parent, hash, end, "Unclosed attribute");
            return end;
        }
        String attribute = ctx.text(open + 1, close);
        if (inner) {
            List<String> attributes = new ArrayList<>();
            if (parent.getProperty(NodeProperties.DECORATORS) instanceof List<?> existing) {
                existing.forEach(value -> attributes.add(String.valueOf(value)));
            }
            attributes.add(attribute);
            parent.setProperty(NodeProperties.DECORATORS, attributes);
            return close + 1;
        }
        int target = TokenRanges.nextSignificant(tokens, close + 1, to);
        if (target >= to) {
            errorNode(ctx, parent, hash, close + 1, "Attribute is not followed by an item");
            return close + 1;
        }
        return parseStatement(ctx, target, to, parent, prefix.withAttribute(attribute));
    }

    private void applyPrefix(AstNode node, Prefix prefix) {
        if (!prefix.modifiers().isEmpty()) {
            node.setProperty(NodeProperties.MODIFIERS, prefix.modifiers());
        }
        if (!prefix.attributes().isEmpty()) {
            node.setProperty(NodeProperties.DECORATORS, orderDecorators(prefix.attributes()));
        }
    }

    /**
     * Returns the index just past a simple statement: past a top-level semicolon, at an
     * unmatched closing bracket, or at the line break before a line that starts a new item.
     * Inside a bracket that never closes, an item starting no further right than the statement
     * also ends it.
     */
    protected static int statementEnd(List<Token> tokens, int from, int to) {
        int column = lineColumn(tokens, from);
        int depth = 0;
        int outerOpen = -1;
        Boolean unclosed = null;
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
            } else if (depth == 0 && token.is(TokenType.SEMICOLON)) {
                return i + 1;
            } else if (token.is(TokenType.NEWLINE)) {
                int next = TokenRanges.nextSignificant(tokens, i + 1, to);
                if (next >= to || !startsItem(tokens, next, to)) {
                    continue;
                }
                if (depth == 0) {
                    return i;
                }
                if (tokens.get(next).column() <= column) {
                    if (unclosed == null) {
                        unclosed = TokenRanges.matchingClose(tokens, outerOpen, to) < 0;
                    }
                    if (unclosed) {
                        return i;
                    }
                }
            }
        }
        return to;
    }

    /**
     * Returns whether the token at {@code i} can only begin an item or a {@code let} binding.
     * {@code fn} and {@code impl} also start types, so they count only in their item forms.
     */
    private static boolean startsItem(List<Token> tokens, int i, int to) {
        Token token = tokens.get(i);
        int next = TokenRanges.nextSignificant(tokens, i + 1, to);
        Token following = next < to ? tokens.get(next) : null;
        if (token.isOperator("#")) {
            return following != null && (following.is(TokenType.OPEN_BRACKET) || following.isOperator("!"));
        }
        if (token.isWord("fn")) {
            return following != null && following.is(TokenType.IDENTIFIER);
        }
        if (token.isWord("impl")) {
            return following != null && following.isOperator("<");
        }
        return token.is(TokenType.KEYWORD, TokenType.IDENTIFIER) && ITEM_STARTS.contains(token.text());
    }

    /**
     * Returns the column of the first significant token on the line holding {@code index}.
     */
    private static int lineColumn(List<Token> tokens, int index) {
        int i = Math.min(index, tokens.size());
        while (i > 0 && !tokens.get(i - 1).is(TokenType.NEWLINE)) {
            i--;
        }
        int first = TokenRanges.nextSignificant(tokens, i, tokens.size());
        return first < tokens.size() ? tokens.get(first).column() : 1;
    }

    /**
     * Returns the index of the {@code {} or {@code ;} ending an item header, or the statement
     * end when the header has neither.
     */
    private static int headerEnd(List<Token> tokens, int from, int to) {
        int end = statementEnd(tokens, from, to);
        int found = TokenRanges.findTopLevel(tokens, from, Math.min(end + 1, to), TokenType.OPEN_BRACE, TokenType.SEMICOLON);
        return found >= 0 ? found : end;
    }

    private static int contentEnd(List<Token> tokens, int end) {
        return end > 0 && tokens.get(end - 1).is(TokenType.SEMICOLON) ? end - 1 : end;
    }

    private static boolean isOpenBrace(List<Token> tokens, int index, int to) {
        return index < to && tokens.get(index).is(TokenType.OPEN_BRACE);
    }

    private boolean inTypeBody(ParseContext ctx) {
        ContextType type = ctx.state().currentType();
        return type == ContextType.CLASS || type == ContextType.INTERFACE;
    }

    // ==================== Functions ====================

    private int parseFunction(ParseContext ctx, int keyword, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        int nameIndex = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        if (nameIndex >= to || !isName(tokens.get(nameIndex))) {
            int end = Math.max(statementEnd(tokens, keyword + 1, to), keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected a name after 'fn'");
            return end;
        }
        Token nameToken = tokens.get(nameIndex);
        String name = nameToken.text();
        boolean method = inTypeBody(ctx);
        AstNode function = node(ctx, method ? NodeTypes.METHOD_DECLARATION : NodeTypes.FUNCTION_DECLARATION, keyword);
        function.setProperty(NodeProperties.NAME, name);
        applyPrefix(function, prefix);
        if (prefix.modifiers().contains("async")) {
            function.setProperty(NodeProperties.ASYNC, true);
        }

        int open = TokenRanges.nextSignificant(tokens, nameIndex + 1, to);
        if (open < to && tokens.get(open).isOperator("<")) {
            int angle = TokenRanges.matchingAngle(tokens, open, to);
            if (angle >= 0) {
                applyGenerics(ctx, function, open, angle);
                open = TokenRanges.nextSignificant(tokens, angle + 1, to);
            }
        }
        if (open >= to || !tokens.get(open).is(TokenType.OPEN_PAREN)) {
            int end = Math.max(statementEnd(tokens, nameIndex + 1, to), nameIndex + 1);
            errorNode(ctx, parent, keyword, end, "Malformed signature of function '" + name + "'");
            return end;
        }
        declare(ctx, name, method ? SymbolKind.METHOD : SymbolKind.FUNCTION, nameToken);
        parent.addChild(function);

        int close = TokenRanges.matchingClose(tokens, open, to);
        ContextFrame frame = enterScope(ctx, ContextType.FUNCTION, name, keyword);
        try {
            function.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            if (close < 0) {
                return parseUnclosedFunction(ctx, function, keyword, open, to);
            }
            function.setProperty(NodeProperties.PARAMETERS, parseParameters(ctx, open + 1, close));
            int body = headerEnd(tokens, close + 1, to);
            readReturnAndWhere(ctx, function, close + 1, body);
            int next;
            if (isOpenBrace(tokens, body, to)) {
                next = parseBody(ctx, function, body, "function '" + name + "'");
            } else {
                function.setProperty(NodeProperties.KIND, "prototype");
                next = body < to && tokens.get(body).is(TokenType.SEMICOLON) ? body + 1 : body;
            }
            finish(ctx, function, keyword, next);
            return Math.max(next, nameIndex + 1);
        } finally {
            exitScope(ctx, frame);
        }
    }

    /**
     * Keeps a function whose parameter list never closes, ending it before the next item that
     * starts no further right. A well-formed body inside that range is still parsed.
     */
    private int parseUnclosedFunction(ParseContext ctx, AstNode function, int keyword, int open, int to) {
        List<Token> tokens = ctx.tokens();
        int end = Math.max(statementEnd(tokens, open, to), open + 1);
        function.setProperty(NodeProperties.UNTERMINATED, true);
        ctx.warn(WarningKind.STRUCTURAL_UNTERMINATED,
            "Unclosed parameter list of function '" + function.getName() + "'", tokens.get(open));
        int brace = TokenRanges.findTopLevel(tokens, open + 1, end, TokenType.OPEN_BRACE);
        function.setProperty(NodeProperties.PARAMETERS, parseParameters(ctx, open + 1, brace >= 0 ? brace : end));
        if (brace >= 0 && TokenRanges.matchingClose(tokens, brace, end) >= 0) {
            parseBody(ctx, function, brace, "function '" + function.getName() + "'");
        }
        finish(ctx, function, keyword, end);
        return end;
    }

    private void readReturnAndWhere(ParseContext ctx, AstNode node, int from, int to) {
        List<Token> tokens = ctx.tokens();
        int where = topLevelWord(tokens, from, to, "where");
        int arrow = TokenRanges.findTopLevel(tokens, from, where >= 0 ? where : to, TokenType.ARROW);
        if (arrow >= 0) {
            node.setProperty(NodeProperties.RETURN_TYPE, ctx.text(arrow + 1, where >= 0 ? where : to));
        }
        if (where >= 0) {
            node.setProperty(NodeProperties.WHERE, ctx.text(where + 1, to));
        }
    }

    /**
     * Records the generic parameters between {@code open} and {@code close}, lifetimes apart.
     */
    private void applyGenerics(ParseContext ctx, AstNode node, int open, int close) {
        List<String> lifetimes = new ArrayList<>();
        List<String> types = new ArrayList<>();
        for (String argument : ctx.angleArguments(open, close)) {
            (argument.startsWith(RustLexer.LIFETIME_PREFIX) ? lifetimes : types).add(argument);
        }
        if (!types.isEmpty()) {
            node.setProperty(NodeProperties.TYPE_PARAMETERS, types);
        }
        if (!lifetimes.isEmpty()) {
            node.setProperty(NodeProperties.LIFETIMES, lifetimes);
        }
    }

    /**
     * Reads a function or closure parameter list. Receivers ({@code &mut self}) get kind
     * {@code self}; pattern parameters declare every binding they introduce.
     */
    private List<Map<String, Object>> parseParameters(ParseContext ctx, int from, int to) {
        List<Token> tokens = ctx.tokens();
        List<Map<String, Object>> parameters = new ArrayList<>();
        for (int[] segment : TokenRanges.splitTypeAware(tokens, from, to)) {
            int first = TokenRanges.nextSignificant(tokens, segment[0], segment[1]);
            while (first < segment[1] && tokens.get(first).isOperator("#")) {
                int open = TokenRanges.nextSignificant(tokens, first + 1, segment[1]);
                int close = open < segment[1] ? TokenRanges.matchingClose(tokens, open, segment[1]) : -1;
                first = close >= 0 ? TokenRanges.nextSignificant(tokens, close + 1, segment[1]) : segment[1];
            }
            if (first >= segment[1]) {
                continue;
            }
            Map<String, Object> parameter = new LinkedHashMap<>();
            if (tokens.get(first).isOperator("...")) {
                parameter.put(NodeProperties.PARAM_KIND, "varargs");
                parameters.add(parameter);
                continue;
            }
            int colon = TokenRanges.findTopLevel(tokens, first, segment[1], TokenType.COLON);
            int patternEnd = colon >= 0 ? colon : segment[1];
            int last = TokenRanges.previousSignificant(tokens, patternEnd, first);
            if (last >= 0 && tokens.get(last).isWord("self")) {
                parameter.put(NodeProperties.PARAM_NAME, "self");
                parameter.put(NodeProperties.PARAM_KIND, "self");
                String receiver = colon >= 0 ? ctx.text(colon + 1, segment[1]) : ctx.text(first, patternEnd);
                if (!"self".equals(receiver)) {
                    parameter.put(NodeProperties.PARAM_ANNOTATION, receiver);
                }
                parameters.add(parameter);
                continue;
            }
            int nameIndex = tokens.get(first).isWord("mut") ? TokenRanges.nextSignificant(tokens, first + 1, patternEnd) : first;
            parameter.put(NodeProperties.PARAM_KIND, "positional");
            if (nameIndex == last && isName(tokens.get(nameIndex))) {
                parameter.put(NodeProperties.PARAM_NAME, tokens.get(nameIndex).text());
                if (!"_".equals(tokens.get(nameIndex).text())) {
                    declare(ctx, tokens.get(nameIndex).text(), SymbolKind.PARAMETER, tokens.get(nameIndex));
                }
            } else {
                parameter.put(NodeProperties.PARAM_NAME, ctx.text(first, patternEnd));
                declarePattern(ctx, first, patternEnd, SymbolKind.PARAMETER);
            }
            if (colon >= 0) {
                parameter.put(NodeProperties.PARAM_ANNOTATION, ctx.text(colon + 1, segment[1]));
            }
            parameters.add(parameter);
        }
        return parameters;
    }

    /**
     * Declares the bindings of a pattern: lowercase identifiers that are not paths, field
     * names, calls or struct and variant names.
     *
     * @return the declared names in source order
     */
    private List<String> declarePattern(ParseContext ctx, int from, int to, SymbolKind kind) {
        List<Token> tokens = ctx.tokens();
        List<String> names = new ArrayList<>();
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            String text = token.text();
            if (!token.is(TokenType.IDENTIFIER) || "_".equals(text) || text.startsWith(RustLexer.LIFETIME_PREFIX)
                    || Character.isUpperCase(text.codePointAt(0))) {
                continue;
            }
            int previous = TokenRanges.previousSignificant(tokens, i, from);
            if (previous >= 0 && (tokens.get(previous).is(TokenType.DOT) || tokens.get(previous).isOperator("::"))) {
                continue;
            }
            int next = TokenRanges.nextSignificant(tokens, i + 1, to);
            if (next < to && (tokens.get(next).is(TokenType.OPEN_PAREN, TokenType.OPEN_BRACE, TokenType.COLON)
                    || tokens.get(next).isOperator("::") || tokens.get(next).isOperator("!"))) {
                continue;
            }
            names.add(text);
            declare(ctx, text, kind, token);
        }
        return names;
    }

    // ==================== Types ====================

    /**
     * Parses a struct or union: unit ({@code struct Marker;}), tuple ({@code struct Id(u32);})
     * or with named fields.
     */
    private int parseStruct(ParseContext ctx, int keyword, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        String kind = tokens.get(keyword).text();
        int nameIndex = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        if (nameIndex >= to || !isName(tokens.get(nameIndex))) {
            int end = Math.max(statementEnd(tokens, keyword + 1, to), keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected a name after '" + kind + "'");
            return end;
        }
        Token nameToken = tokens.get(nameIndex);
        String name = nameToken.text();
        AstNode declaration = node(ctx, NodeTypes.CLASS_DECLARATION, keyword);
        declaration.setProperty(NodeProperties.NAME, name);
        declaration.setProperty(NodeProperties.KIND, kind);
        applyPrefix(declaration, prefix);
        int j = TokenRanges.nextSignificant(tokens, nameIndex + 1, to);
        if (j < to && tokens.get(j).isOperator("<")) {
            int angle = TokenRanges.matchingAngle(tokens, j, to);
            if (angle >= 0) {
                applyGenerics(ctx, declaration, j, angle);
                j = TokenRanges.nextSignificant(tokens, angle + 1, to);
            }
        }
        declare(ctx, name, SymbolKind.CLASS, nameToken);
        parent.addChild(declaration);

        if (j < to && tokens.get(j).is(TokenType.OPEN_PAREN)) {
            int close = TokenRanges.matchingClose(tokens, j, to);
            int end;
            if (close < 0) {
                end = Math.max(statementEnd(tokens, j, to), j + 1);
                declaration.setProperty(NodeProperties.MEMBERS, tupleFields(ctx, j + 1, end));
                markUnterminated(ctx, declaration, j, "tuple struct '" + name + "'");
            } else {
                end = statementEnd(tokens, close + 1, to);
                declaration.setProperty(NodeProperties.MEMBERS, tupleFields(ctx, j + 1, close));
                readReturnAndWhere(ctx, declaration, close + 1, contentEnd(tokens, end));
            }
            finish(ctx, declaration, keyword, end);
            return Math.max(end, j + 1);
        }

        int brace = headerEnd(tokens, j, to);
        readReturnAndWhere(ctx, declaration, j, brace);
        if (!isOpenBrace(tokens, brace, to)) {
            int end = brace < to && tokens.get(brace).is(TokenType.SEMICOLON) ? brace + 1 : brace;
            declaration.setProperty(NodeProperties.MEMBERS, List.of());
            finish(ctx, declaration, keyword, end);
            return Math.max(end, nameIndex + 1);
        }
        ContextFrame frame = enterScope(ctx, ContextType.CLASS, name, keyword);
        try {
            declaration.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            BlockResult block = blockParser.parseBlock(tokens, brace, ctx.state(), ContextType.BLOCK,
                Map.of(ContextFrame.KEYWORD, kind));
            AstNode body = declaration.addChild(blockNode(ctx, brace, block));
            if (!block.terminated()) {
                markUnterminated(ctx, declaration, brace, kind + " '" + name + "'");
            }
            parseFields(ctx, block.firstMember(), block.memberEnd(), body);
            finish(ctx, declaration, keyword, block.nextIndex());
            return block.nextIndex();
        } finally {
            exitScope(ctx, frame);
        }
    }

    private List<Map<String, Object>> tupleFields(ParseContext ctx, int from, int to) {
        List<Token> tokens = ctx.tokens();
        List<Map<String, Object>> fields = new ArrayList<>();
        for (int[] segment : TokenRanges.splitTypeAware(tokens, from, to)) {
            int first = skipVisibility(tokens, TokenRanges.nextSignificant(tokens, segment[0], segment[1]), segment[1]);
            if (first >= segment[1]) {
                continue;
            }
            Map<String, Object> field = new LinkedHashMap<>();
            field.put(NodeProperties.NAME, String.valueOf(fields.size()));
            field.put(NodeProperties.TYPE, ctx.text(first, segment[1]));
            fields.add(field);
        }
        return fields;
    }

    private static int skipVisibility(List<Token> tokens, int first, int to) {
        if (first >= to || !tokens.get(first).isWord("pub")) {
            return first;
        }
        int next = TokenRanges.nextSignificant(tokens, first + 1, to);
        if (next < to && tokens.get(next).is(TokenType.OPEN_PAREN)) {
            int close = TokenRanges.matchingClose(tokens, next, to);
            return close >= 0 ? TokenRanges.nextSignificant(tokens, close + 1, to) : to;
        }
        return next;
    }

    private void parseFields(ParseContext ctx, int from, int to, AstNode body) {
        List<Token> tokens = ctx.tokens();
        for (int[] segment : TokenRanges.splitTypeAware(tokens, from, to)) {
            int first = TokenRanges.nextSignificant(tokens, segment[0], segment[1]);
            List<String> attributes = new ArrayList<>();
            while (first < segment[1] && tokens.get(first).isOperator("#")) {
                int open = TokenRanges.nextSignificant(tokens, first + 1, segment[1]);
                int close = open < segment[1] ? TokenRanges.matchingClose(tokens, open, segment[1]) : -1;
                if (close < 0) {
                    break;
                }
                attributes.add(ctx.text(open + 1, close));
                first = TokenRanges.nextSignificant(tokens, close + 1, segment[1]);
            }
            if (first >= segment[1]) {
                continue;
            }
            int nameIndex = skipVisibility(tokens, first, segment[1]);
            int colon = TokenRanges.findTopLevel(tokens, nameIndex, segment[1], TokenType.COLON);
            if (nameIndex >= segment[1] || colon < 0 || !isName(tokens.get(nameIndex))) {
                errorNode(ctx, body, first, segment[1], "Expected a field declaration");
                continue;
            }
            Token nameToken = tokens.get(nameIndex);
            AstNode field = node(ctx, NodeTypes.FIELD_DECLARATION, nameIndex);
            field.setProperty(NodeProperties.NAME, nameToken.text());
            field.setProperty(NodeProperties.TYPE, ctx.text(colon + 1, segment[1]));
            if (nameIndex > first) {
                field.setProperty(NodeProperties.MODIFIERS, List.of(ctx.text(first, nameIndex).replace(" ", "")));
            }
            if (!attributes.isEmpty()) {
                field.setProperty(NodeProperties.DECORATORS, orderDecorators(attributes));
            }
            declare(ctx, nameToken.text(), SymbolKind.VARIABLE, nameToken);
            body.addChild(field);
            finish(ctx, field, first, segment[1]);
        }
    }

    private int parseEnum(ParseContext ctx, int keyword, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        int nameIndex = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        if (nameIndex >= to || !isName(tokens.get(nameIndex))) {
            int end = Math.max(statementEnd(tokens, keyword + 1, to), keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected a name after 'enum'");
            return end;
        }
        Token nameToken = tokens.get(nameIndex);
        String name = nameToken.text();
        AstNode declaration = node(ctx, NodeTypes.ENUM_DECLARATION, keyword);
        declaration.setProperty(NodeProperties.NAME, name);
        declaration.setProperty(NodeProperties.KIND, "enum");
        applyPrefix(declaration, prefix);
        int j = TokenRanges.nextSignificant(tokens, nameIndex + 1, to);
        if (j < to && tokens.get(j).isOperator("<")) {
            int angle = TokenRanges.matchingAngle(tokens, j, to);
            if (angle >= 0) {
                applyGenerics(ctx, declaration, j, angle);
                j = TokenRanges.nextSignificant(tokens, angle + 1, to);
            }
        }
        int brace = headerEnd(tokens, j, to);
        if (!isOpenBrace(tokens, brace, to)) {
            int end = Math.max(brace < to && tokens.get(brace).is(TokenType.SEMICOLON) ? brace + 1 : brace, nameIndex + 1);
            errorNode(ctx, parent, keyword, end, "Expected '{' after enum '" + name + "'");
            return end;
        }
        readReturnAndWhere(ctx, declaration, j, brace);
        declare(ctx, name, SymbolKind.ENUM, nameToken);
        parent.addChild(declaration);

        ContextFrame frame = enterScope(ctx, ContextType.ENUM, name, keyword);
        try {
            declaration.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            BlockResult block = blockParser.parseBlock(tokens, brace, ctx.state(), ContextType.BLOCK,
                Map.of(ContextFrame.KEYWORD, "enum"));
            AstNode body = declaration.addChild(blockNode(ctx, brace, block));
            if (!block.terminated()) {
                markUnterminated(ctx, declaration, brace, "enum '" + name + "'");
            }
            declaration.setProperty(NodeProperties.MEMBERS, parseVariants(ctx, block.firstMember(), block.memberEnd(), body));
            finish(ctx, declaration, keyword, block.nextIndex());
            return block.nextIndex();
        } finally {
            exitScope(ctx, frame);
        }
    }

    private List<Map<String, Object>> parseVariants(ParseContext ctx, int from, int to, AstNode body) {
        List<Token> tokens = ctx.tokens();
        List<Map<String, Object>> variants = new ArrayList<>();
        for (int[] segment : TokenRanges.splitTopLevel(tokens, from, to, TokenType.COMMA)) {
            int first = TokenRanges.nextSignificant(tokens, segment[0], segment[1]);
            while (first < segment[1] && tokens.get(first).isOperator("#")) {
                int open = TokenRanges.nextSignificant(tokens, first + 1, segment[1]);
                int close = open < segment[1] ? TokenRanges.matchingClose(tokens, open, segment[1]) : -1;
                first = close >= 0 ? TokenRanges.nextSignificant(tokens, close + 1, segment[1]) : segment[1];
            }
            if (first >= segment[1]) {
                continue;
            }
            Token variant = tokens.get(first);
            if (!isName(variant)) {
                errorNode(ctx, body, first, segment[1], "Expected an enum variant");
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(NodeProperties.NAME, variant.text());
            int next = TokenRanges.nextSignificant(tokens, first + 1, segment[1]);
            if (next < segment[1] && tokens.get(next).is(TokenType.OPEN_PAREN, TokenType.OPEN_BRACE)) {
                int close = TokenRanges.matchingClose(tokens, next, segment[1]);
                entry.put(NodeProperties.KIND, tokens.get(next).is(TokenType.OPEN_PAREN) ? "tuple" : "struct");
                entry.put(NodeProperties.TYPE, ctx.text(next + 1, close >= 0 ? close : segment[1]));
            } else if (next < segment[1] && tokens.get(next).is(TokenType.EQUALS)) {
                entry.put(NodeProperties.VALUE, ctx.text(next + 1, segment[1]));
            }
            variants.add(entry);
            declare(ctx, variant.text(), SymbolKind.ENUM_MEMBER, variant);
        }
        return variants;
    }

    private int parseTrait(ParseContext ctx, int keyword, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        int nameIndex = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        if (nameIndex >= to || !isName(tokens.get(nameIndex))) {
            int end = Math.max(statementEnd(tokens, keyword + 1, to), keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected a name after 'trait'");
            return end;
        }
        Token nameToken = tokens.get(nameIndex);
        String name = nameToken.text();
        AstNode declaration = node(ctx, NodeTypes.INTERFACE_DECLARATION, keyword);
        declaration.setProperty(NodeProperties.NAME, name);
        declaration.setProperty(NodeProperties.KIND, "trait");
        applyPrefix(declaration, prefix);
        int j = TokenRanges.nextSignificant(tokens, nameIndex + 1, to);
        if (j < to && tokens.get(j).isOperator("<")) {
            int angle = TokenRanges.matchingAngle(tokens, j, to);
            if (angle >= 0) {
                applyGenerics(ctx, declaration, j, angle);
                j = TokenRanges.nextSignificant(tokens, angle + 1, to);
            }
        }
        int brace = headerEnd(tokens, j, to);
        if (!isOpenBrace(tokens, brace, to)) {
            int end = Math.max(brace < to && tokens.get(brace).is(TokenType.SEMICOLON) ? brace + 1 : brace, nameIndex + 1);
            errorNode(ctx, parent, keyword, end, "Expected '{' after trait '" + name + "'");
            return end;
        }
        int where = topLevelWord(tokens, j, brace, "where");
        if (j < brace && tokens.get(j).is(TokenType.COLON)) {
            declaration.setProperty(NodeProperties.EXTENDS, bounds(ctx, j + 1, where >= 0 ? where : brace));
        }
        if (where >= 0) {
            declaration.setProperty(NodeProperties.WHERE, ctx.text(where + 1, brace));
        }
        declare(ctx, name, SymbolKind.INTERFACE, nameToken);
        parent.addChild(declaration);

        ContextFrame frame = enterScope(ctx, ContextType.INTERFACE, name, keyword);
        try {
            declaration.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            int end = parseBody(ctx, declaration, brace, "trait '" + name + "'");
            finish(ctx, declaration, keyword, end);
            return end;
        } finally {
            exitScope(ctx, frame);
        }
    }

    /**
     * Parses {@code impl<T> Trait for Type where ... { ... }} and inherent impls.
     */
    private int parseImpl(ParseContext ctx, int keyword, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        AstNode impl = node(ctx, NodeTypes.CLASS_DECLARATION, keyword);
        impl.setProperty(NodeProperties.KIND, "impl");
        applyPrefix(impl, prefix);
        int j = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        if (j < to && tokens.get(j).isOperator("<")) {
            int angle = TokenRanges.matchingAngle(tokens, j, to);
            if (angle >= 0) {
                applyGenerics(ctx, impl, j, angle);
                j = TokenRanges.nextSignificant(tokens, angle + 1, to);
            }
        }
        int brace = headerEnd(tokens, j, to);
        if (!isOpenBrace(tokens, brace, to) || TokenRanges.isBlank(tokens, j, brace)) {
            int end = Math.max(brace < to && tokens.get(brace).is(TokenType.SEMICOLON) ? brace + 1 : brace, keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected a type and '{' after 'impl'");
            return end;
        }
        int where = topLevelWord(tokens, j, brace, "where");
        int typeEnd = where >= 0 ? where : brace;
        int forIndex = topLevelWord(tokens, j, typeEnd, "for");
        int selfStart = j;
        if (forIndex >= 0) {
            impl.setProperty(NodeProperties.IMPLEMENTS, List.of(ctx.text(j, forIndex)));
            selfStart = forIndex + 1;
        }
        String selfType = ctx.text(selfStart, typeEnd);
        impl.setProperty(NodeProperties.NAME, selfType);
        if (where >= 0) {
            impl.setProperty(NodeProperties.WHERE, ctx.text(where + 1, brace));
        }
        parent.addChild(impl);

        ContextFrame frame = enterScope(ctx, ContextType.CLASS, baseName(tokens, selfStart, typeEnd, selfType), keyword);
        try {
            impl.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            int end = parseBody(ctx, impl, brace, "impl of '" + selfType + "'");
            finish(ctx, impl, keyword, end);
            return end;
        } finally {
            exitScope(ctx, frame);
        }
    }

    /**
     * Returns the last path segment of a type before its generic arguments: {@code Vec} for
     * {@code &'a mut std::vec::Vec<T>}.
     */
    private static String baseName(List<Token> tokens, int from, int to, String fallback) {
        String name = fallback;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.isOperator("<")) {
                break;
            }
            if (isName(token) && !token.text().startsWith(RustLexer.LIFETIME_PREFIX)) {
                name = token.text();
            }
        }
        return name;
    }

    private List<String> bounds(ParseContext ctx, int from, int to) {
        List<Token> tokens = ctx.tokens();
        List<String> bounds = new ArrayList<>();
        int depth = 0;
        int start = from;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type().isOpening() || token.isOperator("<")) {
                depth++;
            } else if (token.type().isClosing() || token.isOperator(">")) {
                depth = Math.max(0, depth - 1);
            } else if (token.isOperator(">>")) {
                depth = Math.max(0, depth - 2);
            } else if (depth == 0 && token.isOperator("+")) {
                addText(bounds, ctx.text(start, i));
                start = i + 1;
            }
        }
        addText(bounds, ctx.text(start, to));
        return bounds;
    }

    private static void addText(List<String> values, String text) {
        if (!text.isEmpty()) {
            values.add(text);
        }
    }

    /**
     * Finds {@code word} outside brackets and generic argument lists.
     *
     * @return index or -1
     */
    private static int topLevelWord(List<Token> tokens, int from, int to, String word) {
        int depth = 0;
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (token.type().isOpening()) {
                depth++;
            } else if (token.type().isClosing()) {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0 && token.isOperator("<")) {
                int close = TokenRanges.matchingAngle(tokens, i, to);
                if (close >= 0) {
                    i = close;
                }
            } else if (depth == 0 && token.isWord(word)) {
                return i;
            }
        }
        return -1;
    }

    private int parseTypeAlias(ParseContext ctx, int keyword, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        int end = Math.max(statementEnd(tokens, keyword, to), keyword + 1);
        int content = contentEnd(tokens, end);
        int nameIndex = TokenRanges.nextSignificant(tokens, keyword + 1, content);
        if (nameIndex >= content || !isName(tokens.get(nameIndex))) {
            errorNode(ctx, parent, keyword, end, "Expected a name after 'type'");
            return end;
        }
        Token nameToken = tokens.get(nameIndex);
        AstNode alias = node(ctx, NodeTypes.TYPE_ALIAS_DECLARATION, keyword);
        alias.setProperty(NodeProperties.NAME, nameToken.text());
        alias.setProperty(NodeProperties.KEYWORD, "type");
        applyPrefix(alias, prefix);
        int j = TokenRanges.nextSignificant(tokens, nameIndex + 1, content);
        if (j < content && tokens.get(j).isOperator("<")) {
            int angle = TokenRanges.matchingAngle(tokens, j, content);
            if (angle >= 0) {
                applyGenerics(ctx, alias, j, angle);
                j = TokenRanges.nextSignificant(tokens, angle + 1, content);
            }
        }
        int equals = TokenRanges.findTopLevel(tokens, j, content, TokenType.EQUALS);
        if (j < content && tokens.get(j).is(TokenType.COLON)) {
            alias.setProperty(NodeProperties.EXTENDS, bounds(ctx, j + 1, equals >= 0 ? equals : content));
        }
        if (equals >= 0) {
            alias.setProperty(NodeProperties.VALUE, ctx.text(equals + 1, content));
        }
        declare(ctx, nameToken.text(), SymbolKind.TYPE_ALIAS, nameToken);
        parent.addChild(alias);
        finish(ctx, alias, keyword, end);
        return end;
    }

    // ==================== Modules and Imports ====================

    private int parseMod(ParseContext ctx, int keyword, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        int nameIndex = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        int after = nameIndex < to ? TokenRanges.nextSignificant(tokens, nameIndex + 1, to) : to;
        if (nameIndex >= to || !isName(tokens.get(nameIndex))
                || after >= to || !tokens.get(after).is(TokenType.OPEN_BRACE, TokenType.SEMICOLON)) {
            int end = Math.max(statementEnd(tokens, keyword + 1, to), keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected a module name followed by '{' or ';'");
            return end;
        }
        Token nameToken = tokens.get(nameIndex);
        String name = nameToken.text();
        AstNode module = node(ctx, NodeTypes.NAMESPACE_DECLARATION, keyword);
        module.setProperty(NodeProperties.NAME, name);
        module.setProperty(NodeProperties.KEYWORD, "mod");
        applyPrefix(module, prefix);
        declare(ctx, name, SymbolKind.NAMESPACE, nameToken);
        parent.addChild(module);
        if (tokens.get(after).is(TokenType.SEMICOLON)) {
            module.setProperty(NodeProperties.FORWARD, true);
            finish(ctx, module, keyword, after + 1);
            return after + 1;
        }
        ContextFrame frame = enterScope(ctx, ContextType.NAMESPACE, name, keyword);
        try {
            module.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            int end = parseBody(ctx, module, after, "module '" + name + "'");
            finish(ctx, module, keyword, end);
            return end;
        } finally {
            exitScope(ctx, frame);
        }
    }

    /**
     * Parses a {@code use} declaration. Every leaf of the use tree becomes one entry of
     * {@code names} with its full path as {@code source}.
     */
    private int parseUse(ParseContext ctx, int keyword, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        int end = Math.max(statementEnd(tokens, keyword, to), keyword + 1);
        int content = contentEnd(tokens, end);
        AstNode node = node(ctx, NodeTypes.IMPORT_DECLARATION, keyword);
        node.setProperty(NodeProperties.MODULE, ctx.text(keyword + 1, content));
        applyPrefix(node, prefix);
        List<Map<String, Object>> names = new ArrayList<>();
        collectUseTree(ctx, keyword + 1, content, "", names);
        node.setProperty(NodeProperties.NAMES, names);
        parent.addChild(node);
        finish(ctx, node, keyword, end);
        return end;
    }

    private void collectUseTree(ParseContext ctx, int from, int to, String base, List<Map<String, Object>> names) {
        List<Token> tokens = ctx.tokens();
        StringBuilder path = new StringBuilder(base);
        Token last = null;
        int alias = -1;
        int i = TokenRanges.nextSignificant(tokens, from, to);
        while (i < to) {
            Token token = tokens.get(i);
            if (token.is(TokenType.OPEN_BRACE)) {
                int close = TokenRanges.matchingClose(tokens, i, to);
                for (int[] segment : TokenRanges.splitTopLevel(tokens, i + 1, close >= 0 ? close : to, TokenType.COMMA)) {
                    collectUseTree(ctx, segment[0], segment[1], path.toString(), names);
                }
                return;
            }
            if (token.isOperator("*")) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put(NodeProperties.NAME, "*");
                entry.put(NodeProperties.SOURCE, path + "*");
                entry.put(NodeProperties.KIND, "glob");
                names.add(entry);
                return;
            }
            if (token.isWord("as")) {
                alias = TokenRanges.nextSignificant(tokens, i + 1, to);
                break;
            }
            if (token.isOperator("::")) {
                path.append("::");
            } else if (token.is(TokenType.IDENTIFIER, TokenType.KEYWORD)) {
                path.append(token.text());
                last = token;
            }
            i = TokenRanges.nextSignificant(tokens, i + 1, to);
        }
        if (last == null) {
            return;
        }
        String source = path.toString();
        String name = last.text();
        if ("self".equals(name)) {
            source = source.endsWith("::self") ? source.substring(0, source.length() - "::self".length()) : source;
            name = source.substring(source.lastIndexOf(':') + 1);
        }
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put(NodeProperties.NAME, name);
        entry.put(NodeProperties.SOURCE, source);
        Token binding = last;
        if (alias >= 0 && alias < to && isName(tokens.get(alias))) {
            binding = tokens.get(alias);
            entry.put(NodeProperties.ALIAS, binding.text());
        }
        names.add(entry);
        String bound = binding == last ? name : binding.text();
        if (!"_".equals(bound) && !name.isEmpty()) {
            declare(ctx, bound, SymbolKind.IMPORT, binding);
        }
    }

    /**
     * Parses {@code extern crate}, extern blocks and {@code extern "C" fn}.
     */
    private int parseExtern(ParseContext ctx, int keyword, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        int next = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        if (next < to && tokens.get(next).isWord("crate")) {
            return parseExternCrate(ctx, keyword, next, to, parent, prefix);
        }
        String abi = null;
        int after = next;
        if (next < to && tokens.get(next).is(TokenType.STRING)) {
            abi = tokens.get(next).text();
            after = TokenRanges.nextSignificant(tokens, next + 1, to);
        }
        if (isOpenBrace(tokens, after, to)) {
            AstNode block = node(ctx, NodeTypes.BLOCK_STATEMENT, keyword);
            block.setProperty(NodeProperties.KEYWORD, "extern");
            if (abi != null) {
                block.setProperty(NodeProperties.VALUE, abi.substring(1, abi.length() - 1));
            }
            applyPrefix(block, prefix);
            parent.addChild(block);
            int end = parseBody(ctx, block, after, "extern block");
            finish(ctx, block, keyword, end);
            return end;
        }
        if (after < to) {
            return parseStatement(ctx, after, to, parent, prefix.withModifier(abi != null ? "extern " + abi : "extern"));
        }
        errorNode(ctx, parent, keyword, to, "Incomplete 'extern' item");
        return to;
    }

    private int parseExternCrate(ParseContext ctx, int keyword, int crate, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        int end = Math.max(statementEnd(tokens, crate, to), crate + 1);
        int content = contentEnd(tokens, end);
        int nameIndex = TokenRanges.nextSignificant(tokens, crate + 1, content);
        if (nameIndex >= content || !tokens.get(nameIndex).is(TokenType.IDENTIFIER, TokenType.KEYWORD)) {
            errorNode(ctx, parent, keyword, end, "Expected a crate name");
            return end;
        }
        Token nameToken = tokens.get(nameIndex);
        AstNode node = node(ctx, NodeTypes.IMPORT_DECLARATION, keyword);
        node.setProperty(NodeProperties.KIND, "crate");
        node.setProperty(NodeProperties.MODULE, nameToken.text());
        applyPrefix(node, prefix);
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put(NodeProperties.NAME, nameToken.text());
        Token binding = nameToken;
        int as = TokenRanges.nextSignificant(tokens, nameIndex + 1, content);
        if (as < content && tokens.get(as).isWord("as")) {
            int alias = TokenRanges.nextSignificant(tokens, as + 1, content);
            if (alias < content && isName(tokens.get(alias))) {
                binding = tokens.get(alias);
                entry.put(NodeProperties.ALIAS, binding.text());
            }
        }
        node.setProperty(NodeProperties.NAMES, List.of(entry));
        if (!"_".equals(binding.text())) {
            declare(ctx, binding.text(), SymbolKind.IMPORT, binding);
        }
        parent.addChild(node);
        finish(ctx, node, keyword, end);
        return end;
    }

    private int parseMacroRules(ParseContext ctx, int start, int bang, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        int nameIndex = TokenRanges.nextSignificant(tokens, bang + 1, to);
        int open = nameIndex < to ? TokenRanges.nextSignificant(tokens, nameIndex + 1, to) : to;
        if (nameIndex >= to || !isName(tokens.get(nameIndex)) || open >= to || !tokens.get(open).type().isOpening()) {
            int end = Math.max(statementEnd(tokens, start, to), start + 1);
            errorNode(ctx, parent, start, end, "Malformed 'macro_rules!' definition");
            return end;
        }
        Token nameToken = tokens.get(nameIndex);
        AstNode macro = node(ctx, NodeTypes.FUNCTION_DECLARATION, start);
        macro.setProperty(NodeProperties.NAME, nameToken.text());
        macro.setProperty(NodeProperties.KIND, "macro");
        applyPrefix(macro, prefix);
        declare(ctx, nameToken.text(), SymbolKind.FUNCTION, nameToken);
        parent.addChild(macro);
        int close = TokenRanges.matchingClose(tokens, open, to);
        int end;
        if (close < 0) {
            markUnterminated(ctx, macro, open, "macro '" + nameToken.text() + "'");
            end = to;
        } else {
            end = close + 1;
            int semicolon = TokenRanges.nextSignificant(tokens, end, to);
            if (semicolon < to && tokens.get(semicolon).is(TokenType.SEMICOLON)) {
                end = semicolon + 1;
            }
        }
        finish(ctx, macro, start, end);
        return end;
    }

    // ==================== Bindings ====================

    private int parseConstant(ParseContext ctx, int keyword, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        String word = tokens.get(keyword).text();
        int end = Math.max(statementEnd(tokens, keyword, to), keyword + 1);
        int content = contentEnd(tokens, end);
        Prefix effective = prefix;
        int nameIndex = TokenRanges.nextSignificant(tokens, keyword + 1, content);
        if (nameIndex < content && tokens.get(nameIndex).isWord("mut")) {
            effective = prefix.withModifier("mut");
            nameIndex = TokenRanges.nextSignificant(tokens, nameIndex + 1, content);
        }
        if (nameIndex >= content || !isName(tokens.get(nameIndex))) {
            errorNode(ctx, parent, keyword, end, "Expected a name after '" + word + "'");
            return end;
        }
        Token nameToken = tokens.get(nameIndex);
        AstNode variable = node(ctx, NodeTypes.VARIABLE_DECLARATION, keyword);
        variable.setProperty(NodeProperties.KEYWORD, word);
        variable.setProperty(NodeProperties.NAMES, List.of(nameToken.text()));
        applyPrefix(variable, effective);
        int equals = TokenRanges.findTopLevel(tokens, nameIndex, content, TokenType.EQUALS);
        int colon = TokenRanges.findTopLevel(tokens, nameIndex, equals >= 0 ? equals : content, TokenType.COLON);
        if (colon >= 0) {
            variable.setProperty(NodeProperties.TYPE, ctx.text(colon + 1, equals >= 0 ? equals : content));
        }
        if (!"_".equals(nameToken.text())) {
            declare(ctx, nameToken.text(), SymbolKind.VARIABLE, nameToken);
        }
        parent.addChild(variable);
        if (equals >= 0) {
            variable.setProperty(NodeProperties.VALUE, ctx.text(equals + 1, content));
            scanExpression(ctx, equals + 1, content, variable);
        }
        finish(ctx, variable, keyword, end);
        return end;
    }

    /**
     * Parses {@code let pattern: Type = value;} including {@code let ... else { ... };}.
     */
    private int parseLet(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int end = Math.max(statementEnd(tokens, keyword, to), keyword + 1);
        int content = contentEnd(tokens, end);
        AstNode variable = node(ctx, NodeTypes.VARIABLE_DECLARATION, keyword);
        variable.setProperty(NodeProperties.KEYWORD, "let");
        int equals = TokenRanges.findTopLevel(tokens, keyword + 1, content, TokenType.EQUALS);
        int colon = TokenRanges.findTopLevel(tokens, keyword + 1, equals >= 0 ? equals : content, TokenType.COLON);
        int patternEnd = colon >= 0 ? colon : equals >= 0 ? equals : content;
        int first = TokenRanges.nextSignificant(tokens, keyword + 1, patternEnd);
        if (first < patternEnd && tokens.get(first).isWord("mut")) {
            variable.setProperty(NodeProperties.MODIFIERS, List.of("mut"));
        }
        variable.setProperty(NodeProperties.NAMES, declarePattern(ctx, keyword + 1, patternEnd, SymbolKind.VARIABLE));
        if (colon >= 0) {
            variable.setProperty(NodeProperties.TYPE, ctx.text(colon + 1, equals >= 0 ? equals : content));
        }
        parent.addChild(variable);
        if (equals >= 0) {
            int otherwise = topLevelWord(tokens, equals + 1, content, "else");
            int valueEnd = otherwise >= 0 ? otherwise : content;
            variable.setProperty(NodeProperties.VALUE, ctx.text(equals + 1, valueEnd));
            scanExpression(ctx, equals + 1, valueEnd, variable);
            int brace = otherwise >= 0 ? TokenRanges.nextSignificant(tokens, otherwise + 1, content) : content;
            if (isOpenBrace(tokens, brace, content)) {
                AstNode diverge = node(ctx, NodeTypes.BLOCK_STATEMENT, otherwise);
                diverge.setProperty(NodeProperties.KEYWORD, "else");
                variable.addChild(diverge);
                int blockEnd = parseBody(ctx, diverge, brace, "'let ... else' block");
                finish(ctx, diverge, otherwise, blockEnd);
            }
        }
        finish(ctx, variable, keyword, end);
        return end;
    }

    // ==================== Control Flow ====================

    private int parseIf(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int brace = headerEnd(tokens, keyword + 1, to);
        if (!isOpenBrace(tokens, brace, to)) {
            int end = Math.max(brace, keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected '{' after 'if' condition");
            return end;
        }
        AstNode statement = node(ctx, NodeTypes.IF_STATEMENT, keyword);
        statement.setProperty(NodeProperties.KEYWORD, "if");
        statement.setProperty(NodeProperties.CONDITION, ctx.text(keyword + 1, brace));
        parent.addChild(statement);
        int end;
        ContextFrame frame = enterBlock(ctx, ContextType.BLOCK, "if", keyword);
        try {
            declareLetPattern(ctx, keyword + 1, brace);
            scanExpression(ctx, keyword + 1, brace, statement);
            end = parseBody(ctx, statement, brace, "'if' block");
        } finally {
            exitScope(ctx, frame);
        }
        finish(ctx, statement, keyword, end);

        int next = TokenRanges.nextSignificant(tokens, end, to);
        if (next < to && tokens.get(next).isWord("else")) {
            AstNode otherwise = node(ctx, NodeTypes.BLOCK_STATEMENT, next);
            otherwise.setProperty(NodeProperties.KEYWORD, "else");
            parent.addChild(otherwise);
            int branch = TokenRanges.nextSignificant(tokens, next + 1, to);
            if (branch < to && tokens.get(branch).isWord("if")) {
                end = parseIf(ctx, branch, to, otherwise);
            } else if (isOpenBrace(tokens, branch, to)) {
                end = parseBody(ctx, otherwise, branch, "'else' block");
            } else {
                end = Math.max(branch, next + 1);
                errorNode(ctx, otherwise, next, end, "Expected '{' or 'if' after 'else'");
            }
            finish(ctx, otherwise, next, end);
        }
        return end;
    }

    /**
     * Declares the bindings of {@code if let} and {@code while let} conditions.
     */
    private void declareLetPattern(ParseContext ctx, int from, int to) {
        List<Token> tokens = ctx.tokens();
        int first = TokenRanges.nextSignificant(tokens, from, to);
        if (first >= to || !tokens.get(first).isWord("let")) {
            return;
        }
        int equals = TokenRanges.findTopLevel(tokens, first + 1, to, TokenType.EQUALS);
        declarePattern(ctx, first + 1, equals >= 0 ? equals : to, SymbolKind.VARIABLE);
    }

    private int parseLoop(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        String word = tokens.get(keyword).text();
        int brace = "loop".equals(word) ? TokenRanges.nextSignificant(tokens, keyword + 1, to) : headerEnd(tokens, keyword + 1, to);
        if (!isOpenBrace(tokens, brace, to)) {
            int end = Math.max(brace, keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected '{' after '" + word + "'");
            return end;
        }
        AstNode loop = node(ctx, NodeTypes.LOOP_STATEMENT, keyword);
        loop.setProperty(NodeProperties.KEYWORD, word);
        if (!"loop".equals(word)) {
            loop.setProperty(NodeProperties.CONDITION, ctx.text(keyword + 1, brace));
        }
        parent.addChild(loop);
        ContextFrame frame = enterBlock(ctx, ContextType.BLOCK, word, keyword);
        try {
            if ("for".equals(word)) {
                int in = topLevelWord(tokens, keyword + 1, brace, "in");
                declarePattern(ctx, keyword + 1, in >= 0 ? in : brace, SymbolKind.VARIABLE);
                scanExpression(ctx, in >= 0 ? in + 1 : brace, brace, loop);
            } else if ("while".equals(word)) {
                declareLetPattern(ctx, keyword + 1, brace);
                scanExpression(ctx, keyword + 1, brace, loop);
            }
            int end = parseBody(ctx, loop, brace, "'" + word + "' loop");
            finish(ctx, loop, keyword, end);
            return end;
        } finally {
            exitScope(ctx, frame);
        }
    }

    private int parseMatch(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int brace = headerEnd(tokens, keyword + 1, to);
        if (!isOpenBrace(tokens, brace, to)) {
            int end = Math.max(brace, keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected '{' after 'match' subject");
            return end;
        }
        AstNode statement = node(ctx, NodeTypes.MATCH_STATEMENT, keyword);
        statement.setProperty(NodeProperties.SUBJECT, ctx.text(keyword + 1, brace));
        parent.addChild(statement);

        ContextFrame frame = enterBlock(ctx, ContextType.MATCH, "match", keyword);
        try {
            BlockResult block = blockParser.parseBlock(tokens, brace, ctx.state(), ContextType.BLOCK,
                Map.of(ContextFrame.KEYWORD, "match"));
            AstNode body = statement.addChild(blockNode(ctx, brace, block));
            if (!block.terminated()) {
                markUnterminated(ctx, statement, brace, "'match' block");
            }
            parseArms(ctx, block.firstMember(), block.memberEnd(), body);
            finish(ctx, statement, keyword, block.nextIndex());
            return block.nextIndex();
        } finally {
            exitScope(ctx, frame);
        }
    }

    /**
     * Parses {@code pattern if guard => body} arms. A braced arm body needs no comma.
     */
    private void parseArms(ParseContext ctx, int from, int to, AstNode body) {
        List<Token> tokens = ctx.tokens();
        int i = TokenRanges.nextSignificant(tokens, from, to);
        while (i < to) {
            int arrow = TokenRanges.findTopLevel(tokens, i, to, TokenType.FAT_ARROW);
            if (arrow < 0) {
                errorNode(ctx, body, i, to, "Expected '=>' in match arm");
                return;
            }
            int guard = topLevelWord(tokens, i, arrow, "if");
            AstNode clause = node(ctx, NodeTypes.CASE_CLAUSE, i);
            clause.setProperty(NodeProperties.PATTERN, ctx.text(i, guard >= 0 ? guard : arrow));
            if (guard >= 0) {
                clause.setProperty(NodeProperties.CONDITION, ctx.text(guard + 1, arrow));
            }
            body.addChild(clause);
            int end;
            ContextFrame frame = enterBlock(ctx, ContextType.CASE, "case", i);
            try {
                declarePattern(ctx, i, guard >= 0 ? guard : arrow, SymbolKind.VARIABLE);
                int value = TokenRanges.nextSignificant(tokens, arrow + 1, to);
                if (isOpenBrace(tokens, value, to)) {
                    end = parseBody(ctx, clause, value, "match arm");
                    int comma = TokenRanges.nextSignificant(tokens, end, to);
                    if (comma < to && tokens.get(comma).is(TokenType.COMMA)) {
                        end = comma + 1;
                    }
                } else {
                    int comma = TokenRanges.findTopLevel(tokens, value, to, TokenType.COMMA);
                    int valueEnd = comma >= 0 ? comma : to;
                    clause.setProperty(NodeProperties.VALUE, ctx.text(value, valueEnd));
                    scanExpression(ctx, value, valueEnd, clause);
                    end = comma >= 0 ? comma + 1 : to;
                }
            } finally {
                exitScope(ctx, frame);
            }
            finish(ctx, clause, i, end);
            i = TokenRanges.nextSignificant(tokens, Math.max(end, arrow + 1), to);
        }
    }

    private int parseReturn(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int end = statementEnd(tokens, keyword, to);
        int valueEnd = contentEnd(tokens, end);
        AstNode statement = node(ctx, NodeTypes.RETURN_STATEMENT, keyword);
        String value = ctx.text(keyword + 1, valueEnd);
        if (!value.isEmpty()) {
            statement.setProperty(NodeProperties.VALUE, value);
        }
        parent.addChild(statement);
        scanExpression(ctx, keyword + 1, valueEnd, statement);
        finish(ctx, statement, keyword, end);
        return Math.max(end, keyword + 1);
    }

    private int parseExpressionStatement(ParseContext ctx, int i, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int bang = TokenRanges.nextSignificant(tokens, i + 1, to);
        if (tokens.get(i).is(TokenType.IDENTIFIER) && bang < to && tokens.get(bang).isOperator("!")) {
            int open = TokenRanges.nextSignificant(tokens, bang + 1, to);
            if (isOpenBrace(tokens, open, to)) {
                return parseBraceMacro(ctx, i, open, to, parent);
            }
        }
        int end = Math.max(statementEnd(tokens, i, to), i + 1);
        int content = contentEnd(tokens, end);
        AstNode statement = node(ctx, NodeTypes.EXPRESSION_STATEMENT, i);
        statement.setProperty(NodeProperties.TEXT, ctx.text(i, content));
        parent.addChild(statement);
        scanExpression(ctx, i, content, statement);
        finish(ctx, statement, i, end);
        return end;
    }

    /**
     * Keeps a braced macro invocation such as {@code thread_local! { ... }} as one opaque
     * statement.
     */
    private int parseBraceMacro(ParseContext ctx, int start, int open, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        AstNode statement = node(ctx, NodeTypes.EXPRESSION_STATEMENT, start);
        statement.setProperty(NodeProperties.KIND, "macro");
        statement.setProperty(NodeProperties.NAME, tokens.get(start).text());
        parent.addChild(statement);
        int close = TokenRanges.matchingClose(tokens, open, to);
        int end = close >= 0 ? close + 1 : to;
        if (close < 0) {
            markUnterminated(ctx, statement, open, "macro invocation '" + tokens.get(start).text() + "!'");
        }
        statement.setProperty(NodeProperties.TEXT, ctx.text(start, end));
        finish(ctx, statement, start, end);
        return end;
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
        AstNode body = owner.addChild(blockNode(ctx, brace, block));
        if (!block.terminated()) {
            markUnterminated(ctx, owner == ctx.root() ? body : owner, brace, what);
        }
        parseStatements(ctx, block.firstMember(), block.memberEnd(), body);
        return block.nextIndex();
    }

    // ==================== Closures ====================

    /**
     * Finds closures ({@code |x| x + 1}, {@code move || { ... }}) inside an expression and
     * parses each with its own scope.
     */
    private void scanExpression(ParseContext ctx, int from, int to, AstNode owner) {
        List<Token> tokens = ctx.tokens();
        int i = from;
        while (i < to) {
            Token token = tokens.get(i);
            if ((token.isOperator("|") || token.isOperator("||")) && closureAllowed(tokens, i, from)) {
                int next = parseClosure(ctx, from, i, to, owner);
                i = Math.max(next, i + 1);
                continue;
            }
            i++;
        }
    }

    /**
     * Returns whether a pipe at {@code pipe} opens a closure rather than being a binary or.
     */
    private static boolean closureAllowed(List<Token> tokens, int pipe, int floor) {
        int previous = TokenRanges.previousSignificant(tokens, pipe, floor);
        if (previous < 0) {
            return true;
        }
        Token token = tokens.get(previous);
        if (token.isWord("self", "Self", "true", "false")) {
            return false;
        }
        return !token.is(TokenType.IDENTIFIER, TokenType.NUMBER, TokenType.STRING,
            TokenType.CLOSE_PAREN, TokenType.CLOSE_BRACKET, TokenType.CLOSE_BRACE);
    }

    private int parseClosure(ParseContext ctx, int floor, int pipe, int to, AstNode owner) {
        List<Token> tokens = ctx.tokens();
        int close = pipe;
        if (tokens.get(pipe).isOperator("|")) {
            close = -1;
            int depth = 0;
            for (int i = pipe + 1; i < to; i++) {
                Token token = tokens.get(i);
                if (token.type().isOpening()) {
                    depth++;
                } else if (token.type().isClosing()) {
                    if (depth == 0) {
                        break;
                    }
                    depth--;
                } else if (depth == 0 && token.isOperator("|")) {
                    close = i;
                    break;
                }
            }
            if (close < 0) {
                return pipe + 1;
            }
        }
        int start = pipe;
        int previous = TokenRanges.previousSignificant(tokens, pipe, floor);
        if (previous >= 0 && tokens.get(previous).isWord("move")) {
            start = previous;
        }
        AstNode closure = node(ctx, NodeTypes.ARROW_FUNCTION, start);
        closure.setProperty(NodeProperties.KIND, "closure");
        owner.addChild(closure);
        ContextFrame frame = enterScope(ctx, ContextType.FUNCTION, null, start);
        try {
            closure.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            closure.setProperty(NodeProperties.PARAMETERS, close > pipe ? parseParameters(ctx, pipe + 1, close) : List.of());
            int body = TokenRanges.nextSignificant(tokens, close + 1, to);
            if (body < to && tokens.get(body).is(TokenType.ARROW)) {
                int brace = TokenRanges.findTopLevel(tokens, body + 1, to, TokenType.OPEN_BRACE);
                if (brace >= 0) {
                    closure.setProperty(NodeProperties.RETURN_TYPE, ctx.text(body + 1, brace));
                    body = brace;
                }
            }
            int end;
            if (isOpenBrace(tokens, body, to)) {
                end = parseBody(ctx, closure, body, "closure");
            } else {
                end = expressionEnd(tokens, body, to);
                closure.setProperty(NodeProperties.VALUE, ctx.text(body, end));
                scanExpression(ctx, body, end, closure);
            }
            finish(ctx, closure, start, end);
            return end;
        } finally {
            exitScope(ctx, frame);
        }
    }

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
            } else if (depth == 0 && token.is(TokenType.COMMA, TokenType.SEMICOLON)) {
                return i;
            }
        }
        return to;
    }
}
