package com.codeparse.core.parser.impl.cfamily;

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
import com.codeparse.core.lexical.Lexer;
import com.codeparse.core.parser.AbstractLanguageParser;
import com.codeparse.core.parser.ParseContext;
import com.codeparse.core.parser.TokenRanges;
import com.codeparse.core.parser.impl.cfamily.CFamilyLexer.Dialect;
import com.codeparse.core.state.ContextFrame;
import com.codeparse.core.state.ContextType;
import com.codeparse.core.symbol.SymbolKind;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;

/**
 * Generic brace-language parser shared by C, C++ and Java.
 *
 * <p>Declarations are told apart from expressions by shape rather than by grammar: a statement
 * whose leading words form a type followed by a name is a declaration, and a name followed by a
 * parameter list and a brace body is a function definition. Anything else is kept as an
 * expression statement. Unknown macros and types are accepted; genuinely ambiguous C++ may be
 * misread.
 *
 * <p>Preprocessor lines arrive from {@link CFamilyLexer} as directive tokens and become
 * {@link NodeTypes#PREPROCESSOR_DIRECTIVE} nodes in source order. Conditional compilation is
 * not evaluated.
 *
 * @since 1.0.0
 */
public abstract class CFamilyParser extends AbstractLanguageParser {

    private static final Set<String> NON_TYPE_KEYWORDS = Set.of(
        "return", "delete", "throw", "goto", "break", "continue", "case", "default", "new",
        "sizeof", "else", "do", "this", "true", "false", "null", "nullptr", "super", "assert",
        "static_assert", "_Static_assert", "instanceof", "co_return", "co_await", "co_yield",
        "if", "for", "while", "switch", "try", "catch", "finally", "using", "namespace", "typedef",
        "template", "operator", "import", "package");

    private static final Set<String> DECLARATION_MODIFIERS = Set.of(
        "public", "private", "protected", "static", "final", "abstract", "native", "synchronized",
        "transient", "volatile", "strictfp", "default", "sealed", "inline", "extern", "virtual",
        "explicit", "friend", "constexpr", "consteval", "constinit", "mutable", "register",
        "thread_local", "export");

    private static final Set<String> TYPE_KEYWORDS = Set.of("class", "struct", "union", "enum", "interface");

    private static final Set<String> TYPE_OPERATORS = Set.of("*", "&", "&&", "::", "<", ">", ">>", "?", "~", "...");

    private static final Set<String> PREFIX_GROUP_WORDS = Set.of(
        "decltype", "alignas", "__attribute__", "__declspec", "_Alignas");

    protected final BraceBlockParser blockParser = new BraceBlockParser();

    protected CFamilyParser(ParserConfig config) {
        super(config);
    }

    /**
     * Returns the language variant this parser reads.
     */
    protected abstract Dialect dialect();

    @Override
    protected Lexer createLexer(String source) {
        return new CFamilyLexer(source, dialect());
    }

    @Override
    protected void parseModule(ParseContext ctx) {
        parseStatements(ctx, 0, ctx.size(), ctx.root());
    }

    /**
     * Annotations, modifiers and template parameters collected in front of a declaration.
     */
    protected record Prefix(List<String> annotations, List<String> modifiers, List<String> typeParameters) {

        static final Prefix NONE = new Prefix(List.of(), List.of(), List.of());

        protected Prefix {
            annotations = List.copyOf(annotations);
            modifiers = List.copyOf(modifiers);
            typeParameters = List.copyOf(typeParameters);
        }

        Prefix withAnnotation(String annotation) {
            List<String> merged = new ArrayList<>(annotations);
            merged.add(annotation);
            return new Prefix(merged, modifiers, typeParameters);
        }

        Prefix withModifier(String modifier) {
            List<String> merged = new ArrayList<>(modifiers);
            merged.add(modifier);
            return new Prefix(annotations, merged, typeParameters);
        }

        Prefix withTypeParameters(List<String> parameters) {
            return new Prefix(annotations, modifiers, parameters);
        }
    }

    /**
     * Name of a callable found in front of its parameter list.
     *
     * @param start index of the first token of the (possibly qualified) name
     * @param token token that carries the name
     * @param name simple name, {@code ~Foo} for destructors, {@code operator==} for operators
     * @param qualifier owner prefix of an out-of-line definition, or null
     * @param paramOpen index of the parameter list's opening parenthesis
     */
    private record CallableName(int start, Token token, String name, String qualifier, int paramOpen) {
    }

    // ==================== Statements ====================

    protected void parseStatements(ParseContext ctx, int from, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int i = from;
        while (i < to) {
            Token token = tokens.get(i);
            if (isDirective(token)) {
                parseDirective(ctx, i, parent);
                i++;
                continue;
            }
            if (!TokenRanges.isSignificant(token)) {
                i++;
                continue;
            }
            int next = parseStatement(ctx, i, to, parent, Prefix.NONE);
            i = Math.max(next, i + 1);
        }
    }

    private static boolean isDirective(Token token) {
        return token.is(TokenType.COMMENT) && CFamilyLexer.DIRECTIVE_DELIMITER.equals(token.metadata().get(Token.DELIMITER));
    }

    private void parseDirective(ParseContext ctx, int index, AstNode parent) {
        Token token = ctx.token(index);
        String text = token.text().replaceAll("\\\\\\r?\\n", " ").trim();
        String body = text.substring(1).trim();
        int wordEnd = 0;
        while (wordEnd < body.length() && Character.isLetter(body.charAt(wordEnd))) {
            wordEnd++;
        }
        String directive = body.substring(0, wordEnd);
        String argument = body.substring(wordEnd).trim();

        AstNode node = node(ctx, NodeTypes.PREPROCESSOR_DIRECTIVE, index);
        node.setProperty(NodeProperties.DIRECTIVE, directive);
        node.setProperty(NodeProperties.TEXT, text);
        if (("include".equals(directive) || "import".equals(directive)) && argument.length() >= 2) {
            node.setProperty(NodeProperties.MODULE, argument.substring(1, argument.length() - 1));
        } else if (("define".equals(directive) || "undef".equals(directive)) && !argument.isEmpty()) {
            int nameEnd = 0;
            while (nameEnd < argument.length()
                    && (Character.isLetterOrDigit(argument.charAt(nameEnd)) || argument.charAt(nameEnd) == '_')) {
                nameEnd++;
            }
            node.setProperty(NodeProperties.NAME, argument.substring(0, nameEnd));
        } else if (!argument.isEmpty()) {
            node.setProperty(NodeProperties.CONDITION, argument);
        }
        node.setProperty(NodeProperties.END_LINE, token.line() + (int) token.text().chars().filter(c -> c == '\n').count());
        parent.addChild(node);
    }

    protected int parseStatement(ParseContext ctx, int i, int to, AstNode parent, Prefix prefix) {
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
        if (token.is(TokenType.AT)) {
            if (following != null && following.isWord("interface")) {
                return parseTypeDeclaration(ctx, i, next, to, parent, prefix, false, null);
            }
            int end = annotationEnd(tokens, i + 1, to);
            int target = TokenRanges.nextSignificant(tokens, end, to);
            if (target >= to) {
                errorNode(ctx, parent, i, to, "Annotation is not followed by a declaration");
                return to;
            }
            return parseStatement(ctx, target, to, parent, prefix.withAnnotation(ctx.text(i + 1, end)));
        }
        if (token.is(TokenType.OPEN_BRACKET) && following != null && following.is(TokenType.OPEN_BRACKET)) {
            int close = TokenRanges.matchingClose(tokens, i, to);
            if (close >= 0) {
                int target = TokenRanges.nextSignificant(tokens, close + 1, to);
                return target < to ? parseStatement(ctx, target, to, parent, prefix.withAnnotation(ctx.text(next + 1, close - 1))) : target;
            }
        }
        if (following == null) {
            return parseDeclarationOrExpression(ctx, i, to, parent, prefix);
        }

        if (token.isWord("template") && dialect() == Dialect.CPP && following.isOperator("<")) {
            int close = TokenRanges.matchingAngle(tokens, next, to);
            if (close >= 0) {
                int target = TokenRanges.nextSignificant(tokens, close + 1, to);
                if (target < to) {
                    return parseStatement(ctx, target, to, parent, prefix.withTypeParameters(ctx.angleArguments(next, close)));
                }
            }
        }
        if (dialect() == Dialect.JAVA && token.isWord("package")) {
            return parsePackage(ctx, i, to, parent);
        }
        if (dialect() == Dialect.JAVA && token.isWord("import")) {
            return parseJavaImport(ctx, i, to, parent);
        }
        if (dialect() == Dialect.CPP && token.isWord("using")) {
            return parseUsing(ctx, i, to, parent);
        }
        if (dialect() == Dialect.CPP && token.isWord("namespace")) {
            return parseNamespace(ctx, i, to, parent, prefix);
        }
        if (token.isWord("extern") && following.is(TokenType.STRING)) {
            int brace = TokenRanges.nextSignificant(tokens, next + 1, to);
            if (brace < to && tokens.get(brace).is(TokenType.OPEN_BRACE)) {
                AstNode linkage = node(ctx, NodeTypes.BLOCK_STATEMENT, i);
                linkage.setProperty(NodeProperties.KEYWORD, "extern");
                linkage.setProperty(NodeProperties.VALUE, unquote(following.text()));
                parent.addChild(linkage);
                int end = parseBody(ctx, linkage, brace, "extern block");
                finish(ctx, linkage, i, end);
                return end;
            }
            return brace < to ? parseStatement(ctx, brace, to, parent, prefix.withModifier("extern " + following.text())) : brace;
        }
        if (token.isWord("typedef")) {
            return parseTypedef(ctx, i, to, parent);
        }
        if (token.isWord("static") && following.is(TokenType.OPEN_BRACE)) {
            AstNode init = node(ctx, NodeTypes.BLOCK_STATEMENT, i);
            init.setProperty(NodeProperties.KEYWORD, "static");
            parent.addChild(init);
            int end = parseBody(ctx, init, next, "static initializer");
            finish(ctx, init, i, end);
            return end;
        }
        if (dialect() == Dialect.CPP && token.isWord("public", "private", "protected") && following.is(TokenType.COLON)) {
            return next + 1;
        }
        if (isModifier(token, following)) {
            return parseStatement(ctx, next, to, parent, prefix.withModifier(token.text()));
        }
        if (isTypeDeclarationStart(tokens, i, next, to)) {
            return parseTypeDeclaration(ctx, i, i, to, parent, prefix, false, null);
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
                case "synchronized":
                    return parseGuarded(ctx, i, to, parent);
                case "return":
                    return parseReturn(ctx, i, to, parent);
                default:
                    break;
            }
        }
        if (token.is(TokenType.IDENTIFIER) && following.is(TokenType.COLON) && !ctx.state().isIn(ContextType.CLASS)) {
            int labeled = TokenRanges.nextSignificant(tokens, next + 1, to);
            return labeled < to ? parseStatement(ctx, labeled, to, parent, prefix) : labeled;
        }
        return parseDeclarationOrExpression(ctx, i, to, parent, prefix);
    }

    private boolean isModifier(Token token, Token following) {
        if (!token.is(TokenType.KEYWORD, TokenType.IDENTIFIER) || !DECLARATION_MODIFIERS.contains(token.text())) {
            return false;
        }
        if (token.is(TokenType.IDENTIFIER)
                && !(dialect() == Dialect.JAVA && token.isWord("sealed") || dialect() != Dialect.JAVA && token.isWord("thread_local", "consteval", "constinit"))) {
            return false;
        }
        return !following.is(TokenType.OPEN_PAREN, TokenType.COLON, TokenType.EQUALS, TokenType.SEMICOLON,
            TokenType.DOT, TokenType.ARROW, TokenType.COMMA, TokenType.CLOSE_PAREN);
    }

    /**
     * Returns whether a class, struct, union, enum, interface or record declaration with a body
     * or a forward declaration starts at {@code i}. {@code struct Point p;} is a variable.
     */
    private boolean isTypeDeclarationStart(List<Token> tokens, int i, int next, int to) {
        Token token = tokens.get(i);
        boolean record = dialect() == Dialect.JAVA && token.isWord("record");
        if (!token.is(TokenType.KEYWORD) && !record || !record && !TYPE_KEYWORDS.contains(token.text())) {
            return false;
        }
        int j = next;
        if (token.isWord("enum") && j < to && tokens.get(j).isWord("class", "struct")) {
            j = TokenRanges.nextSignificant(tokens, j + 1, to);
        }
        if (j >= to) {
            return false;
        }
        if (tokens.get(j).is(TokenType.OPEN_BRACE)) {
            return !record;
        }
        if (!tokens.get(j).is(TokenType.IDENTIFIER)) {
            return false;
        }
        int after = TokenRanges.nextSignificant(tokens, j + 1, to);
        if (after >= to) {
            return false;
        }
        Token header = tokens.get(after);
        if (record) {
            return header.is(TokenType.OPEN_PAREN) || header.isOperator("<");
        }
        return header.is(TokenType.OPEN_BRACE, TokenType.COLON, TokenType.SEMICOLON)
            || header.isOperator("<")
            || header.isWord("extends", "implements", "permits", "final");
    }

    private static int annotationEnd(List<Token> tokens, int from, int to) {
        int i = TokenRanges.nextSignificant(tokens, from, to);
        if (i >= to || !tokens.get(i).is(TokenType.IDENTIFIER, TokenType.KEYWORD)) {
            return Math.min(i + 1, to);
        }
        i++;
        while (i + 1 < to && tokens.get(i).is(TokenType.DOT) && tokens.get(i + 1).is(TokenType.IDENTIFIER, TokenType.KEYWORD)) {
            i += 2;
        }
        int open = TokenRanges.nextSignificant(tokens, i, to);
        if (open < to && tokens.get(open).is(TokenType.OPEN_PAREN)) {
            int close = TokenRanges.matchingClose(tokens, open, to);
            return close >= 0 ? close + 1 : to;
        }
        return i;
    }

    /**
     * Returns the index just past a simple statement: past a top-level semicolon or at an
     * unmatched closing bracket.
     */
    protected static int statementEnd(List<Token> tokens, int from, int to) {
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
            } else if (depth == 0 && token.is(TokenType.SEMICOLON)) {
                return i + 1;
            }
        }
        return to;
    }

    private static int contentEnd(List<Token> tokens, int end) {
        return end > 0 && tokens.get(end - 1).is(TokenType.SEMICOLON) ? end - 1 : end;
    }

    protected static String unquote(String text) {
        return text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"") ? text.substring(1, text.length() - 1) : text;
    }

    private boolean inMemberContext(ParseContext ctx) {
        ContextType type = ctx.state().currentType();
        return type == ContextType.CLASS || type == ContextType.INTERFACE || type == ContextType.ENUM;
    }

    // ==================== Declarations and Expressions ====================

    private int parseDeclarationOrExpression(ParseContext ctx, int i, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        int depth = 0;
        int firstParen = -1;
        boolean equalsBeforeParen = false;
        int end = to;
        int bodyBrace = -1;
        for (int j = i; j < to; j++) {
            Token token = tokens.get(j);
            if (!TokenRanges.isSignificant(token)) {
                continue;
            }
            if (depth == 0) {
                if (token.is(TokenType.SEMICOLON)) {
                    end = j + 1;
                    break;
                }
                if (token.is(TokenType.EQUALS) && firstParen < 0) {
                    equalsBeforeParen = true;
                }
                if (token.is(TokenType.OPEN_BRACE)) {
                    if (!equalsBeforeParen && firstParen >= 0 && bodyBrace < 0) {
                        int close = TokenRanges.matchingClose(tokens, firstParen, j);
                        if (close >= 0 && isFunctionTail(tokens, close + 1, j, true)) {
                            bodyBrace = j;
                            end = j;
                            break;
                        }
                    }
                    int close = TokenRanges.matchingClose(tokens, j, to);
                    if (close < 0) {
                        end = to;
                        break;
                    }
                    j = close;
                    continue;
                }
                if (token.is(TokenType.OPEN_PAREN) && firstParen < 0) {
                    firstParen = j;
                }
            }
            if (token.type().isOpening()) {
                depth++;
            } else if (token.type().isClosing()) {
                if (depth == 0) {
                    end = j;
                    break;
                }
                depth--;
            }
        }

        if (firstParen >= 0 && !equalsBeforeParen) {
            CallableName name = callableName(tokens, i, firstParen, to);
            if (name != null) {
                boolean constructor = isConstructorName(ctx, name);
                boolean prefixOk = isDeclarationPrefix(tokens, i, name.start(), bodyBrace >= 0 || constructor);
                if (prefixOk && bodyBrace >= 0) {
                    return parseFunction(ctx, i, name, bodyBrace, bodyBrace, to, parent, prefix);
                }
                int close = TokenRanges.matchingClose(tokens, name.paramOpen(), to);
                if (prefixOk && bodyBrace < 0 && close >= 0 && close < end
                        && isFunctionTail(tokens, close + 1, contentEnd(tokens, end), false)) {
                    return parseFunction(ctx, i, name, -1, end, to, parent, prefix);
                }
            }
        }
        if (bodyBrace >= 0) {
            end = statementEnd(tokens, i, to);
            if (end < bodyBrace) {
                end = bodyBrace;
            }
        }
        if (end <= i) {
            end = i + 1;
        }

        int declarator = bodyBrace < 0 ? declaratorName(tokens, i, contentEnd(tokens, end)) : -1;
        if (declarator >= 0) {
            return parseVariables(ctx, i, declarator, end, parent, prefix);
        }
        AstNode statement = node(ctx, NodeTypes.EXPRESSION_STATEMENT, i);
        statement.setProperty(NodeProperties.TEXT, ctx.text(i, contentEnd(tokens, end)));
        parent.addChild(statement);
        scanExpression(ctx, i, contentEnd(tokens, end), statement);
        finish(ctx, statement, i, end);
        return end;
    }

    private boolean isConstructorName(ParseContext ctx, CallableName name) {
        if (!inMemberContext(ctx)) {
            return false;
        }
        if (name.name().startsWith("~")) {
            return true;
        }
        String owner = ctx.state().current().name();
        return name.name().equals(owner);
    }

    /**
     * Returns whether the tokens between a parameter list and a body (or the terminating
     * semicolon of a prototype) are qualifiers a function header may carry: {@code const},
     * {@code noexcept}, {@code throws X}, trailing return types, constructor initializer lists
     * and, for prototypes, {@code = 0}, {@code = default} or {@code = delete}.
     */
    private static boolean isFunctionTail(List<Token> tokens, int from, int to, boolean beforeBody) {
        boolean initializers = false;
        int i = TokenRanges.nextSignificant(tokens, from, to);
        while (i < to) {
            Token token = tokens.get(i);
            if (token.is(TokenType.COLON) && beforeBody) {
                initializers = true;
                i = TokenRanges.nextSignificant(tokens, i + 1, to);
                continue;
            }
            if (token.is(TokenType.OPEN_PAREN, TokenType.OPEN_BRACKET) || initializers && token.is(TokenType.OPEN_BRACE)) {
                int close = TokenRanges.matchingClose(tokens, i, to);
                if (close < 0) {
                    return false;
                }
                i = TokenRanges.nextSignificant(tokens, close + 1, to);
                continue;
            }
            if (token.is(TokenType.EQUALS) && !beforeBody) {
                int value = TokenRanges.nextSignificant(tokens, i + 1, to);
                return value < to && (tokens.get(value).isWord("default", "delete") || "0".equals(tokens.get(value).text()))
                    && TokenRanges.nextSignificant(tokens, value + 1, to) >= to;
            }
            if (token.is(TokenType.IDENTIFIER, TokenType.KEYWORD, TokenType.DOT, TokenType.COMMA, TokenType.ARROW, TokenType.NUMBER)
                    || token.is(TokenType.OPERATOR) && TYPE_OPERATORS.contains(token.text())) {
                i = TokenRanges.nextSignificant(tokens, i + 1, to);
                continue;
            }
            return false;
        }
        if (initializers && beforeBody) {
            // a member initialized with braces, as in ": value{0}", is not the body
            int last = TokenRanges.previousSignificant(tokens, to, from);
            return last < 0 || !tokens.get(last).is(TokenType.IDENTIFIER) && !tokens.get(last).isOperator(">");
        }
        return true;
    }

    /**
     * Finds the name of a callable whose parameter list opens at {@code paren}.
     */
    private CallableName callableName(List<Token> tokens, int from, int paren, int to) {
        int k = TokenRanges.previousSignificant(tokens, paren, from);
        if (k < 0) {
            return null;
        }
        Token token = tokens.get(k);
        if (dialect() == Dialect.CPP) {
            if (token.isWord("operator")) {
                // operator() declares its own empty parentheses first
                int close = TokenRanges.nextSignificant(tokens, paren + 1, to);
                int params = close < to ? TokenRanges.nextSignificant(tokens, close + 1, to) : to;
                if (close < to && tokens.get(close).is(TokenType.CLOSE_PAREN) && params < to && tokens.get(params).is(TokenType.OPEN_PAREN)) {
                    return qualified(tokens, from, k, token, "operator()", params);
                }
                return null;
            }
            int operator = k;
            StringBuilder symbol = new StringBuilder();
            while (operator >= from && (tokens.get(operator).is(TokenType.OPERATOR, TokenType.EQUALS)
                    || tokens.get(operator).is(TokenType.OPEN_BRACKET, TokenType.CLOSE_BRACKET))) {
                symbol.insert(0, tokens.get(operator).text());
                operator = TokenRanges.previousSignificant(tokens, operator, from);
                if (operator < 0) {
                    break;
                }
            }
            if (operator >= 0 && operator != k && tokens.get(operator).isWord("operator")) {
                return qualified(tokens, from, operator, tokens.get(operator), "operator" + symbol, paren);
            }
        }
        if (!token.is(TokenType.IDENTIFIER)) {
            return null;
        }
        int start = k;
        String name = token.text();
        int previous = TokenRanges.previousSignificant(tokens, k, from);
        if (previous >= 0 && tokens.get(previous).isOperator("~")) {
            name = "~" + name;
            start = previous;
        }
        return qualified(tokens, from, start, token, name, paren);
    }

    private static CallableName qualified(List<Token> tokens, int from, int start, Token token, String name, int paren) {
        List<String> owners = new ArrayList<>();
        int i = start;
        while (true) {
            int separator = TokenRanges.previousSignificant(tokens, i, from);
            if (separator < 0 || !tokens.get(separator).isOperator("::")) {
                break;
            }
            int owner = TokenRanges.previousSignificant(tokens, separator, from);
            if (owner >= 0 && tokens.get(owner).isOperator(">")) {
                int open = owner;
                int depth = 0;
                while (open >= from) {
                    if (tokens.get(open).isOperator(">")) {
                        depth++;
                    } else if (tokens.get(open).isOperator("<") && --depth == 0) {
                        break;
                    }
                    open--;
                }
                owner = open >= from ? TokenRanges.previousSignificant(tokens, open, from) : -1;
            }
            if (owner < 0 || !tokens.get(owner).is(TokenType.IDENTIFIER)) {
                break;
            }
            owners.add(0, tokens.get(owner).text());
            i = owner;
        }
        return new CallableName(i, token, name, owners.isEmpty() ? null : String.join("::", owners), paren);
    }

    /**
     * Returns whether {@code [from, to)} reads as the return type and qualifiers of a
     * declaration: type words, pointer and reference marks, template arguments and array
     * brackets, but no assignment, member access or expression keyword.
     */
    private static boolean isDeclarationPrefix(List<Token> tokens, int from, int to, boolean allowEmpty) {
        int last = TokenRanges.previousSignificant(tokens, to, from);
        if (last < 0) {
            return allowEmpty;
        }
        Token lastToken = tokens.get(last);
        if (!lastToken.is(TokenType.IDENTIFIER, TokenType.KEYWORD, TokenType.CLOSE_BRACKET, TokenType.CLOSE_PAREN)
                && !lastToken.isOperator("*") && !lastToken.isOperator("&") && !lastToken.isOperator("&&")
                && !lastToken.isOperator(">") && !lastToken.isOperator(">>")) {
            return false;
        }
        for (int i = from; i < to; i++) {
            Token token = tokens.get(i);
            if (!TokenRanges.isSignificant(token)) {
                continue;
            }
            if (token.is(TokenType.IDENTIFIER, TokenType.COMMA, TokenType.DOT, TokenType.OPEN_BRACKET, TokenType.CLOSE_BRACKET)) {
                continue;
            }
            if (token.is(TokenType.KEYWORD) && !NON_TYPE_KEYWORDS.contains(token.text())) {
                if (PREFIX_GROUP_WORDS.contains(token.text())) {
                    int open = TokenRanges.nextSignificant(tokens, i + 1, to);
                    if (open < to && tokens.get(open).is(TokenType.OPEN_PAREN)) {
                        int close = TokenRanges.matchingClose(tokens, open, to);
                        if (close < 0) {
                            return false;
                        }
                        i = close;
                    }
                }
                continue;
            }
            if (token.is(TokenType.OPERATOR) && TYPE_OPERATORS.contains(token.text())) {
                continue;
            }
            int previous = TokenRanges.previousSignificant(tokens, i, from);
            if (token.is(TokenType.OPEN_PAREN) && previous >= 0 && PREFIX_GROUP_WORDS.contains(tokens.get(previous).text())) {
                int close = TokenRanges.matchingClose(tokens, i, to);
                if (close < 0) {
                    return false;
                }
                i = close;
                continue;
            }
            return false;
        }
        return true;
    }

    /**
     * Returns the index of the first declared name if {@code [from, to)} reads as a variable
     * declaration, or -1. At least one type word must precede the name.
     */
    private int declaratorName(List<Token> tokens, int from, int to) {
        int j = TokenRanges.nextSignificant(tokens, from, to);
        int units = 0;
        int lastWord = -1;
        while (j < to) {
            Token token = tokens.get(j);
            if (token.is(TokenType.IDENTIFIER) || token.is(TokenType.KEYWORD) && !NON_TYPE_KEYWORDS.contains(token.text())) {
                units++;
                lastWord = j;
                j = TokenRanges.nextSignificant(tokens, j + 1, to);
                while (j < to && (tokens.get(j).is(TokenType.DOT) || tokens.get(j).isOperator("::"))) {
                    int member = TokenRanges.nextSignificant(tokens, j + 1, to);
                    if (member >= to || !tokens.get(member).is(TokenType.IDENTIFIER, TokenType.KEYWORD)) {
                        return -1;
                    }
                    lastWord = member;
                    j = TokenRanges.nextSignificant(tokens, member + 1, to);
                }
                continue;
            }
            if (units > 0 && token.isOperator("<")) {
                int close = TokenRanges.matchingAngle(tokens, j, to);
                if (close < 0) {
                    return -1;
                }
                j = TokenRanges.nextSignificant(tokens, close + 1, to);
                continue;
            }
            if (units > 0 && (token.isOperator("*") || token.isOperator("&") || token.isOperator("&&"))) {
                j = TokenRanges.nextSignificant(tokens, j + 1, to);
                continue;
            }
            if (units > 0 && token.is(TokenType.OPEN_BRACKET)) {
                int close = TokenRanges.nextSignificant(tokens, j + 1, to);
                if (close < to && tokens.get(close).is(TokenType.CLOSE_BRACKET)) {
                    j = TokenRanges.nextSignificant(tokens, close + 1, to);
                    continue;
                }
            }
            break;
        }
        if (units < 2 || lastWord < 0 || !tokens.get(lastWord).is(TokenType.IDENTIFIER)) {
            return -1;
        }
        if (j < to && !tokens.get(j).is(TokenType.EQUALS, TokenType.COMMA, TokenType.OPEN_BRACKET,
                TokenType.OPEN_BRACE, TokenType.COLON, TokenType.SEMICOLON)) {
            return -1;
        }
        return lastWord;
    }

    private int parseVariables(ParseContext ctx, int start, int firstName, int end, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        int content = contentEnd(tokens, end);
        boolean field = inMemberContext(ctx);
        AstNode declaration = node(ctx, field ? NodeTypes.FIELD_DECLARATION : NodeTypes.VARIABLE_DECLARATION, start);
        if (field) {
            declaration.setProperty(NodeProperties.NAME, tokens.get(firstName).text());
        }
        declaration.setProperty(NodeProperties.TYPE, ctx.text(start, firstName));
        applyPrefix(declaration, prefix);
        parent.addChild(declaration);

        List<String> names = new ArrayList<>();
        List<int[]> declarators = TokenRanges.splitTypeAware(tokens, firstName, content);
        for (int d = 0; d < declarators.size(); d++) {
            int[] range = declarators.get(d);
            int nameIndex = d == 0 ? firstName : TokenRanges.nextSignificant(tokens, range[0], range[1]);
            while (nameIndex < range[1] && (tokens.get(nameIndex).isOperator("*") || tokens.get(nameIndex).isOperator("&"))) {
                nameIndex = TokenRanges.nextSignificant(tokens, nameIndex + 1, range[1]);
            }
            if (nameIndex >= range[1] || !tokens.get(nameIndex).is(TokenType.IDENTIFIER)) {
                continue;
            }
            Token name = tokens.get(nameIndex);
            names.add(name.text());
            declare(ctx, name.text(), SymbolKind.VARIABLE, name);
            int equals = TokenRanges.findTopLevel(tokens, nameIndex, range[1], TokenType.EQUALS);
            int braceInit = TokenRanges.nextSignificant(tokens, nameIndex + 1, range[1]);
            int valueStart = equals >= 0 ? equals + 1
                : braceInit < range[1] && tokens.get(braceInit).is(TokenType.OPEN_BRACE) ? braceInit : -1;
            if (valueStart >= 0) {
                if (declarators.size() == 1) {
                    declaration.setProperty(NodeProperties.VALUE, ctx.text(valueStart, range[1]));
                }
                scanExpression(ctx, valueStart, range[1], declaration);
            }
        }
        declaration.setProperty(NodeProperties.NAMES, names);
        finish(ctx, declaration, start, end);
        return end;
    }

    /**
     * Splits at top-level commas, treating template argument lists as nested.
     */
    private int parseFunction(ParseContext ctx, int start, CallableName name, int bodyBrace, int end, int to,
                              AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        int open = name.paramOpen();
        int close = TokenRanges.matchingClose(tokens, open, to);
        boolean method = inMemberContext(ctx) || name.qualifier() != null;
        AstNode function = node(ctx, method ? NodeTypes.METHOD_DECLARATION : NodeTypes.FUNCTION_DECLARATION, start);
        function.setProperty(NodeProperties.NAME, name.name());
        if (name.qualifier() != null) {
            function.setProperty(NodeProperties.QUALIFIER, name.qualifier());
        }
        int typeStart = TokenRanges.nextSignificant(tokens, start, name.start());
        Prefix effective = prefix;
        if (typeStart < name.start() && tokens.get(typeStart).isOperator("<")) {
            int angle = TokenRanges.matchingAngle(tokens, typeStart, name.start());
            if (angle >= 0) {
                effective = prefix.withTypeParameters(ctx.angleArguments(typeStart, angle));
                typeStart = angle + 1;
            }
        }
        String returnType = ctx.text(typeStart, name.start());
        if (!returnType.isEmpty()) {
            function.setProperty(NodeProperties.RETURN_TYPE, returnType);
        }
        applyPrefix(function, effective);
        if (bodyBrace < 0) {
            function.setProperty(NodeProperties.KIND, "prototype");
        }
        declare(ctx, name.name(), method ? SymbolKind.METHOD : SymbolKind.FUNCTION, name.token());
        parent.addChild(function);

        ContextFrame frame = enterScope(ctx, ContextType.FUNCTION, name.name(), start);
        try {
            function.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            function.setProperty(NodeProperties.PARAMETERS, parseParameters(ctx, open + 1, close, SymbolKind.PARAMETER, false));
            int next = bodyBrace >= 0 ? parseBody(ctx, function, bodyBrace, "function '" + name.name() + "'") : end;
            finish(ctx, function, start, next);
            return next;
        } finally {
            exitScope(ctx, frame);
        }
    }

    /**
     * Reads a parameter list.
     *
     * @param untyped whether a lone word is a parameter name rather than an unnamed type, as in
     *                Java lambda parameters
     */
    private List<Map<String, Object>> parseParameters(ParseContext ctx, int from, int to, SymbolKind kind, boolean untyped) {
        List<Token> tokens = ctx.tokens();
        List<Map<String, Object>> parameters = new ArrayList<>();
        for (int[] segment : TokenRanges.splitTypeAware(tokens, from, to)) {
            int first = TokenRanges.nextSignificant(tokens, segment[0], segment[1]);
            while (first < segment[1] && tokens.get(first).is(TokenType.AT)) {
                first = TokenRanges.nextSignificant(tokens, annotationEnd(tokens, first + 1, segment[1]), segment[1]);
            }
            while (first < segment[1] && tokens.get(first).isWord("final")) {
                first = TokenRanges.nextSignificant(tokens, first + 1, segment[1]);
            }
            if (first >= segment[1]) {
                continue;
            }
            int last = TokenRanges.previousSignificant(tokens, segment[1], first);
            if (first == last && tokens.get(first).isWord("void")) {
                continue;
            }
            Map<String, Object> parameter = new LinkedHashMap<>();
            int equals = TokenRanges.findTopLevel(tokens, first, segment[1], TokenType.EQUALS);
            int limit = equals >= 0 ? equals : segment[1];
            int varargs = -1;
            for (int i = first; i < limit; i++) {
                if (tokens.get(i).isOperator("...")) {
                    varargs = i;
                }
            }
            parameter.put(NodeProperties.PARAM_KIND, varargs >= 0 ? "varargs" : "positional");

            Token nameToken = parameterName(tokens, first, limit, untyped);
            if (nameToken != null) {
                parameter.put(NodeProperties.PARAM_NAME, nameToken.text());
                String type = ctx.text(first, indexOf(tokens, nameToken, first, limit));
                if (!type.isEmpty()) {
                    parameter.put(NodeProperties.PARAM_ANNOTATION, type);
                }
                declare(ctx, nameToken.text(), kind, nameToken);
            } else {
                parameter.put(NodeProperties.PARAM_ANNOTATION, ctx.text(first, limit));
            }
            if (equals >= 0) {
                parameter.put(NodeProperties.PARAM_DEFAULT, ctx.text(equals + 1, segment[1]));
            }
            parameters.add(parameter);
        }
        return parameters;
    }

    private static int indexOf(List<Token> tokens, Token token, int from, int to) {
        for (int i = from; i < to; i++) {
            if (tokens.get(i) == token) {
                return i;
            }
        }
        return to;
    }

    private static Token parameterName(List<Token> tokens, int from, int to, boolean untyped) {
        // function pointer: int (*callback)(int)
        for (int i = from; i < to; i++) {
            if (tokens.get(i).is(TokenType.OPEN_PAREN)) {
                int inner = TokenRanges.nextSignificant(tokens, i + 1, to);
                if (inner < to && (tokens.get(inner).isOperator("*") || tokens.get(inner).isOperator("^") || tokens.get(inner).isOperator("&"))) {
                    int name = TokenRanges.nextSignificant(tokens, inner + 1, to);
                    return name < to && tokens.get(name).is(TokenType.IDENTIFIER) ? tokens.get(name) : null;
                }
                break;
            }
        }
        int last = TokenRanges.previousSignificant(tokens, to, from);
        while (last >= from && tokens.get(last).is(TokenType.CLOSE_BRACKET)) {
            int open = last;
            while (open >= from && !tokens.get(open).is(TokenType.OPEN_BRACKET)) {
                open--;
            }
            last = TokenRanges.previousSignificant(tokens, open, from);
        }
        if (last < from || !tokens.get(last).is(TokenType.IDENTIFIER)) {
            return null;
        }
        int before = TokenRanges.previousSignificant(tokens, last, from);
        if (before < 0) {
            return untyped ? tokens.get(last) : null;
        }
        if (tokens.get(before).is(TokenType.DOT) || tokens.get(before).isOperator("::")) {
            return null;
        }
        return tokens.get(last);
    }

    protected void applyPrefix(AstNode node, Prefix prefix) {
        if (!prefix.modifiers().isEmpty()) {
            node.setProperty(NodeProperties.MODIFIERS, prefix.modifiers());
        }
        if (!prefix.annotations().isEmpty()) {
            node.setProperty(NodeProperties.DECORATORS, orderDecorators(prefix.annotations()));
        }
        if (!prefix.typeParameters().isEmpty()) {
            node.setProperty(NodeProperties.TYPE_PARAMETERS, prefix.typeParameters());
        }
    }

    private List<String> segmentTexts(ParseContext ctx, int from, int to) {
        List<String> texts = new ArrayList<>();
        for (int[] segment : TokenRanges.splitTypeAware(ctx.tokens(), from, to)) {
            String text = ctx.text(segment[0], segment[1]);
            if (!text.isEmpty()) {
                texts.add(text);
            }
        }
        return texts;
    }

    // ==================== Types ====================

    /**
     * Parses a class, struct, union, enum, interface, annotation type or record.
     *
     * @param start index of the first token, the {@code @} of an annotation type
     * @param keyword index of the type keyword
     * @param embedded whether the declaration is part of a {@code typedef}; trailing declarators
     *                 are then left to the caller
     * @param nameHint name for an anonymous type, or null
     * @return index after the declaration
     */
    private int parseTypeDeclaration(ParseContext ctx, int start, int keyword, int to, AstNode parent, Prefix prefix,
                                     boolean embedded, String nameHint) {
        List<Token> tokens = ctx.tokens();
        String kind = tokens.get(start).is(TokenType.AT) ? "annotation" : tokens.get(keyword).text();
        int j = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        if ("enum".equals(kind) && j < to && tokens.get(j).isWord("class", "struct")) {
            j = TokenRanges.nextSignificant(tokens, j + 1, to);
        }
        Token nameToken = null;
        if (j < to && tokens.get(j).is(TokenType.IDENTIFIER)) {
            nameToken = tokens.get(j);
            j = TokenRanges.nextSignificant(tokens, j + 1, to);
        }
        int brace = TokenRanges.findTopLevel(tokens, j, to, TokenType.OPEN_BRACE, TokenType.SEMICOLON);

        boolean isEnum = "enum".equals(kind);
        boolean isInterface = "interface".equals(kind) || "annotation".equals(kind);
        String nodeType = isEnum ? NodeTypes.ENUM_DECLARATION
            : isInterface ? NodeTypes.INTERFACE_DECLARATION : NodeTypes.CLASS_DECLARATION;
        String name = nameToken != null ? nameToken.text() : nameHint;

        AstNode declaration = node(ctx, nodeType, start);
        if (name != null) {
            declaration.setProperty(NodeProperties.NAME, name);
        }
        declaration.setProperty(NodeProperties.KIND, kind);
        applyPrefix(declaration, prefix);

        if (brace < 0 || tokens.get(brace).is(TokenType.SEMICOLON)) {
            int end = brace < 0 ? to : brace + 1;
            if (nameToken == null) {
                errorNode(ctx, parent, start, end, "Expected '{' after '" + kind + "'");
                return end;
            }
            declaration.setProperty(NodeProperties.FORWARD, true);
            parent.addChild(declaration);
            finish(ctx, declaration, start, end);
            return end;
        }

        readTypeHeader(ctx, declaration, kind, j, brace);
        if (nameToken != null) {
            declare(ctx, name, isEnum ? SymbolKind.ENUM : isInterface ? SymbolKind.INTERFACE : SymbolKind.CLASS, nameToken);
        }
        parent.addChild(declaration);

        ContextType scopeType = isEnum ? ContextType.ENUM : isInterface ? ContextType.INTERFACE : ContextType.CLASS;
        ContextFrame frame = enterScope(ctx, scopeType, name, start);
        int next;
        try {
            declaration.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            if ("record".equals(kind)) {
                int open = TokenRanges.findTopLevel(tokens, j, brace, TokenType.OPEN_PAREN);
                if (open >= 0) {
                    int close = TokenRanges.matchingClose(tokens, open, brace);
                    declaration.setProperty(NodeProperties.PARAMETERS,
                        parseParameters(ctx, open + 1, close >= 0 ? close : brace, SymbolKind.VARIABLE, false));
                }
            }
            BlockResult block = blockParser.parseBlock(tokens, brace, ctx.state(), ContextType.BLOCK,
                Map.of(ContextFrame.KEYWORD, kind));
            AstNode body = declaration.addChild(blockNode(ctx, brace, block));
            if (!block.terminated()) {
                markUnterminated(ctx, declaration, brace, kind + (name != null ? " '" + name + "'" : ""));
            }
            if (isEnum) {
                parseEnumBody(ctx, block.firstMember(), block.memberEnd(), body, declaration);
            } else {
                parseStatements(ctx, block.firstMember(), block.memberEnd(), body);
            }
            finish(ctx, declaration, start, block.nextIndex());
            next = block.nextIndex();
        } finally {
            exitScope(ctx, frame);
        }

        if (embedded || dialect() == Dialect.JAVA) {
            return next;
        }
        int after = TokenRanges.nextSignificant(tokens, next, to);
        if (after < to && tokens.get(after).is(TokenType.SEMICOLON)) {
            return after + 1;
        }
        if (after < to && (tokens.get(after).is(TokenType.IDENTIFIER) || tokens.get(after).isOperator("*"))) {
            int end = statementEnd(tokens, after, to);
            AstNode variables = node(ctx, NodeTypes.VARIABLE_DECLARATION, after);
            variables.setProperty(NodeProperties.TYPE, name != null ? kind + " " + name : kind);
            List<String> names = new ArrayList<>();
            for (int[] range : TokenRanges.splitTypeAware(tokens, after, contentEnd(tokens, end))) {
                int n = TokenRanges.nextSignificant(tokens, range[0], range[1]);
                while (n < range[1] && tokens.get(n).isOperator("*")) {
                    n = TokenRanges.nextSignificant(tokens, n + 1, range[1]);
                }
                if (n < range[1] && tokens.get(n).is(TokenType.IDENTIFIER)) {
                    names.add(tokens.get(n).text());
                    declare(ctx, tokens.get(n).text(), SymbolKind.VARIABLE, tokens.get(n));
                }
            }
            variables.setProperty(NodeProperties.NAMES, names);
            parent.addChild(variables);
            finish(ctx, variables, after, end);
            return end;
        }
        return next;
    }

    private void readTypeHeader(ParseContext ctx, AstNode declaration, String kind, int from, int brace) {
        List<Token> tokens = ctx.tokens();
        int i = TokenRanges.nextSignificant(tokens, from, brace);
        if (i < brace && tokens.get(i).isOperator("<")) {
            int close = TokenRanges.matchingAngle(tokens, i, brace);
            if (close >= 0) {
                declaration.setProperty(NodeProperties.TYPE_PARAMETERS, ctx.angleArguments(i, close));
                i = TokenRanges.nextSignificant(tokens, close + 1, brace);
            }
        }
        if (dialect() == Dialect.JAVA) {
            int extendsIndex = wordAt(tokens, i, brace, "extends");
            int implementsIndex = wordAt(tokens, i, brace, "implements");
            int permitsIndex = wordAt(tokens, i, brace, "permits");
            if (extendsIndex >= 0) {
                int extendsEnd = firstAfter(extendsIndex, brace, implementsIndex, permitsIndex);
                if ("interface".equals(kind)) {
                    declaration.setProperty(NodeProperties.EXTENDS, segmentTexts(ctx, extendsIndex + 1, extendsEnd));
                } else {
                    declaration.setProperty(NodeProperties.EXTENDS, ctx.text(extendsIndex + 1, extendsEnd));
                }
            }
            if (implementsIndex >= 0) {
                int implementsEnd = firstAfter(implementsIndex, brace, extendsIndex, permitsIndex);
                declaration.setProperty(NodeProperties.IMPLEMENTS, segmentTexts(ctx, implementsIndex + 1, implementsEnd));
            }
            return;
        }
        int colon = TokenRanges.findTopLevel(tokens, i, brace, TokenType.COLON);
        if (colon < 0) {
            return;
        }
        if ("enum".equals(kind)) {
            declaration.setProperty(NodeProperties.TYPE, ctx.text(colon + 1, brace));
            return;
        }
        List<String> bases = new ArrayList<>();
        for (int[] segment : TokenRanges.splitTypeAware(tokens, colon + 1, brace)) {
            int first = TokenRanges.nextSignificant(tokens, segment[0], segment[1]);
            while (first < segment[1] && tokens.get(first).isWord("public", "private", "protected", "virtual")) {
                first = TokenRanges.nextSignificant(tokens, first + 1, segment[1]);
            }
            String base = ctx.text(first, segment[1]);
            if (!base.isEmpty()) {
                bases.add(base);
            }
        }
        declaration.setProperty(NodeProperties.BASES, bases);
    }

    private static int wordAt(List<Token> tokens, int from, int to, String word) {
        for (int i = from; i < to; i++) {
            if (tokens.get(i).isWord(word)) {
                return i;
            }
        }
        return -1;
    }

    private static int firstAfter(int index, int limit, int... candidates) {
        int end = limit;
        for (int candidate : candidates) {
            if (candidate > index && candidate < end) {
                end = candidate;
            }
        }
        return end;
    }

    private void parseEnumBody(ParseContext ctx, int from, int to, AstNode body, AstNode declaration) {
        List<Token> tokens = ctx.tokens();
        int constantsEnd = to;
        if (dialect() == Dialect.JAVA) {
            int semicolon = TokenRanges.findTopLevel(tokens, from, to, TokenType.SEMICOLON);
            if (semicolon >= 0) {
                constantsEnd = semicolon;
            }
        }
        List<Map<String, Object>> members = new ArrayList<>();
        for (int[] segment : TokenRanges.splitTopLevel(tokens, from, constantsEnd, TokenType.COMMA)) {
            int first = TokenRanges.nextSignificant(tokens, segment[0], segment[1]);
            while (first < segment[1] && tokens.get(first).is(TokenType.AT)) {
                first = TokenRanges.nextSignificant(tokens, annotationEnd(tokens, first + 1, segment[1]), segment[1]);
            }
            if (first >= segment[1]) {
                continue;
            }
            Token member = tokens.get(first);
            if (!member.is(TokenType.IDENTIFIER)) {
                errorNode(ctx, body, first, segment[1], "Expected an enum constant");
                continue;
            }
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(NodeProperties.NAME, member.text());
            int next = TokenRanges.nextSignificant(tokens, first + 1, segment[1]);
            if (next < segment[1] && tokens.get(next).is(TokenType.EQUALS)) {
                entry.put(NodeProperties.VALUE, ctx.text(next + 1, segment[1]));
            } else if (next < segment[1] && tokens.get(next).is(TokenType.OPEN_PAREN)) {
                int close = TokenRanges.matchingClose(tokens, next, segment[1]);
                entry.put(NodeProperties.VALUE, ctx.text(next + 1, close >= 0 ? close : segment[1]));
            }
            members.add(entry);
            declare(ctx, member.text(), SymbolKind.ENUM_MEMBER, member);
        }
        declaration.setProperty(NodeProperties.MEMBERS, members);
        if (constantsEnd < to) {
            parseStatements(ctx, constantsEnd + 1, to, body);
        }
    }

    private int parseTypedef(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int j = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        int end = statementEnd(tokens, keyword, to);
        int content = contentEnd(tokens, end);
        if (j < to && tokens.get(j).isWord("struct", "union", "enum", "class")) {
            int brace = TokenRanges.findTopLevel(tokens, j, to, TokenType.OPEN_BRACE, TokenType.SEMICOLON);
            if (brace >= 0 && tokens.get(brace).is(TokenType.OPEN_BRACE)) {
                int close = TokenRanges.matchingClose(tokens, brace, to);
                int aliasEnd = close >= 0 ? statementEnd(tokens, close + 1, to) : to;
                List<Token> aliases = aliasNames(tokens, close >= 0 ? close + 1 : to, contentEnd(tokens, aliasEnd));
                String hint = aliases.isEmpty() ? null : aliases.get(0).text();
                int next = parseTypeDeclaration(ctx, j, j, to, parent, Prefix.NONE, true, hint);
                AstNode type = parent.getChildren().get(parent.getChildren().size() - 1);
                String target = type.getName() != null ? tokens.get(j).text() + " " + type.getName() : tokens.get(j).text();
                for (Token alias : aliases) {
                    addAlias(ctx, parent, keyword, alias, target, Math.max(aliasEnd, next));
                }
                return Math.max(aliasEnd, next);
            }
        }
        List<Token> aliases = aliasNames(tokens, j, content);
        if (aliases.isEmpty()) {
            int stop = Math.max(end, keyword + 1);
            errorNode(ctx, parent, keyword, stop, "Expected a type name in typedef");
            return stop;
        }
        Token alias = aliases.get(aliases.size() - 1);
        int aliasIndex = indexOf(tokens, alias, j, content);
        // a function pointer alias keeps its whole declarator as the target
        boolean trailing = TokenRanges.nextSignificant(tokens, aliasIndex + 1, content) >= content;
        addAlias(ctx, parent, keyword, alias, ctx.text(j, trailing ? aliasIndex : content), end);
        return end;
    }

    /**
     * Collects the names a typedef introduces: top-level identifiers directly before a comma or
     * the end, or the name inside a function pointer declarator.
     */
    private static List<Token> aliasNames(List<Token> tokens, int from, int to) {
        List<Token> names = new ArrayList<>();
        for (int i = from; i < to; i++) {
            if (tokens.get(i).is(TokenType.OPEN_PAREN)) {
                int inner = TokenRanges.nextSignificant(tokens, i + 1, to);
                if (inner < to && tokens.get(inner).isOperator("*")) {
                    int name = TokenRanges.nextSignificant(tokens, inner + 1, to);
                    if (name < to && tokens.get(name).is(TokenType.IDENTIFIER)) {
                        names.add(tokens.get(name));
                        return names;
                    }
                }
                break;
            }
        }
        for (int[] segment : TokenRanges.splitTopLevel(tokens, from, to, TokenType.COMMA)) {
            int last = TokenRanges.previousSignificant(tokens, segment[1], segment[0]);
            while (last >= segment[0] && tokens.get(last).is(TokenType.CLOSE_BRACKET)) {
                int open = last;
                while (open > segment[0] && !tokens.get(open).is(TokenType.OPEN_BRACKET)) {
                    open--;
                }
                last = TokenRanges.previousSignificant(tokens, open, segment[0]);
            }
            if (last >= segment[0] && tokens.get(last).is(TokenType.IDENTIFIER)) {
                names.add(tokens.get(last));
            }
        }
        return names;
    }

    private void addAlias(ParseContext ctx, AstNode parent, int keyword, Token alias, String target, int end) {
        AstNode node = node(ctx, NodeTypes.TYPE_ALIAS_DECLARATION, keyword);
        node.setProperty(NodeProperties.NAME, alias.text());
        node.setProperty(NodeProperties.VALUE, target);
        node.setProperty(NodeProperties.KEYWORD, "typedef");
        declare(ctx, alias.text(), SymbolKind.TYPE_ALIAS, alias);
        parent.addChild(node);
        finish(ctx, node, keyword, end);
    }

    // ==================== Packages, Imports and Namespaces ====================

    private int parsePackage(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int end = statementEnd(tokens, keyword, to);
        String name = ctx.text(keyword + 1, contentEnd(tokens, end)).replace(" ", "");
        AstNode node = node(ctx, NodeTypes.NAMESPACE_DECLARATION, keyword);
        node.setProperty(NodeProperties.NAME, name);
        node.setProperty(NodeProperties.KEYWORD, "package");
        int nameIndex = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        if (!name.isEmpty() && nameIndex < to) {
            declare(ctx, name, SymbolKind.NAMESPACE, tokens.get(nameIndex));
        }
        parent.addChild(node);
        finish(ctx, node, keyword, end);
        return Math.max(end, keyword + 1);
    }

    private int parseJavaImport(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int end = statementEnd(tokens, keyword, to);
        int content = contentEnd(tokens, end);
        AstNode node = node(ctx, NodeTypes.IMPORT_DECLARATION, keyword);
        int i = TokenRanges.nextSignificant(tokens, keyword + 1, content);
        if (i < content && tokens.get(i).isWord("static")) {
            node.setProperty(NodeProperties.MODIFIERS, List.of("static"));
            i = TokenRanges.nextSignificant(tokens, i + 1, content);
        }
        String module = ctx.text(i, content).replace(" ", "");
        node.setProperty(NodeProperties.MODULE, module);
        List<Map<String, Object>> names = new ArrayList<>();
        int last = TokenRanges.previousSignificant(tokens, content, i);
        if (last >= 0 && tokens.get(last).is(TokenType.IDENTIFIER)) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put(NodeProperties.NAME, tokens.get(last).text());
            names.add(entry);
            declare(ctx, tokens.get(last).text(), SymbolKind.IMPORT, tokens.get(last));
        }
        node.setProperty(NodeProperties.NAMES, names);
        parent.addChild(node);
        finish(ctx, node, keyword, end);
        return Math.max(end, keyword + 1);
    }

    private int parseUsing(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int end = statementEnd(tokens, keyword, to);
        int content = contentEnd(tokens, end);
        int i = TokenRanges.nextSignificant(tokens, keyword + 1, content);
        if (i >= content) {
            int stop = Math.max(end, keyword + 1);
            errorNode(ctx, parent, keyword, stop, "Incomplete 'using' declaration");
            return stop;
        }
        int equals = TokenRanges.findTopLevel(tokens, i, content, TokenType.EQUALS);
        if (equals >= 0 && tokens.get(i).is(TokenType.IDENTIFIER)) {
            AstNode alias = node(ctx, NodeTypes.TYPE_ALIAS_DECLARATION, keyword);
            alias.setProperty(NodeProperties.NAME, tokens.get(i).text());
            alias.setProperty(NodeProperties.VALUE, ctx.text(equals + 1, content));
            alias.setProperty(NodeProperties.KEYWORD, "using");
            declare(ctx, tokens.get(i).text(), SymbolKind.TYPE_ALIAS, tokens.get(i));
            parent.addChild(alias);
            finish(ctx, alias, keyword, end);
            return end;
        }
        AstNode node = node(ctx, NodeTypes.IMPORT_DECLARATION, keyword);
        List<Map<String, Object>> names = new ArrayList<>();
        if (tokens.get(i).isWord("namespace")) {
            node.setProperty(NodeProperties.KIND, "namespace");
            node.setProperty(NodeProperties.MODULE, ctx.text(i + 1, content).replace(" ", ""));
        } else {
            node.setProperty(NodeProperties.MODULE, ctx.text(i, content).replace(" ", ""));
            int last = TokenRanges.previousSignificant(tokens, content, i);
            if (last >= 0 && tokens.get(last).is(TokenType.IDENTIFIER)) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put(NodeProperties.NAME, tokens.get(last).text());
                names.add(entry);
                declare(ctx, tokens.get(last).text(), SymbolKind.IMPORT, tokens.get(last));
            }
        }
        node.setProperty(NodeProperties.NAMES, names);
        parent.addChild(node);
        finish(ctx, node, keyword, end);
        return end;
    }

    private int parseNamespace(ParseContext ctx, int keyword, int to, AstNode parent, Prefix prefix) {
        List<Token> tokens = ctx.tokens();
        int i = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        StringBuilder name = new StringBuilder();
        Token nameToken = null;
        while (i < to && (tokens.get(i).is(TokenType.IDENTIFIER) || tokens.get(i).isOperator("::"))) {
            if (nameToken == null && tokens.get(i).is(TokenType.IDENTIFIER)) {
                nameToken = tokens.get(i);
            }
            name.append(tokens.get(i).text());
            i = TokenRanges.nextSignificant(tokens, i + 1, to);
        }
        AstNode namespace = node(ctx, NodeTypes.NAMESPACE_DECLARATION, keyword);
        if (name.length() > 0) {
            namespace.setProperty(NodeProperties.NAME, name.toString());
        }
        namespace.setProperty(NodeProperties.KEYWORD, "namespace");
        applyPrefix(namespace, prefix);

        if (i < to && tokens.get(i).is(TokenType.EQUALS)) {
            int end = statementEnd(tokens, i, to);
            namespace.setProperty(NodeProperties.VALUE, ctx.text(i + 1, contentEnd(tokens, end)));
            if (nameToken != null) {
                declare(ctx, name.toString(), SymbolKind.NAMESPACE, nameToken);
            }
            parent.addChild(namespace);
            finish(ctx, namespace, keyword, end);
            return end;
        }
        if (i >= to || !tokens.get(i).is(TokenType.OPEN_BRACE)) {
            int end = Math.max(statementEnd(tokens, keyword, to), keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected '{' after namespace");
            return end;
        }
        if (nameToken != null) {
            declare(ctx, name.toString(), SymbolKind.NAMESPACE, nameToken);
        }
        parent.addChild(namespace);
        ContextFrame frame = enterScope(ctx, ContextType.NAMESPACE, name.length() > 0 ? name.toString() : null, keyword);
        try {
            namespace.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            int end = parseBody(ctx, namespace, i, "namespace" + (name.length() > 0 ? " '" + name + "'" : ""));
            finish(ctx, namespace, keyword, end);
            return end;
        } finally {
            exitScope(ctx, frame);
        }
    }

    // ==================== Control Flow ====================

    private int parseIf(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int open = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        if (open < to && tokens.get(open).isWord("constexpr")) {
            open = TokenRanges.nextSignificant(tokens, open + 1, to);
        }
        int close = open < to && tokens.get(open).is(TokenType.OPEN_PAREN) ? TokenRanges.matchingClose(tokens, open, to) : -1;
        if (close < 0) {
            int end = Math.max(statementEnd(tokens, keyword, to), keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected '(' after 'if'");
            return end;
        }
        AstNode statement = node(ctx, NodeTypes.IF_STATEMENT, keyword);
        statement.setProperty(NodeProperties.KEYWORD, "if");
        statement.setProperty(NodeProperties.CONDITION, ctx.text(open + 1, close));
        parent.addChild(statement);
        scanExpression(ctx, open + 1, close, statement);
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
        int close = open < to && tokens.get(open).is(TokenType.OPEN_PAREN) ? TokenRanges.matchingClose(tokens, open, to) : -1;
        if (close < 0) {
            int end = Math.max(statementEnd(tokens, keyword, to), keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected '(' after '" + word + "'");
            return end;
        }
        AstNode loop = node(ctx, NodeTypes.LOOP_STATEMENT, keyword);
        loop.setProperty(NodeProperties.KEYWORD, word);
        loop.setProperty(NodeProperties.CONDITION, ctx.text(open + 1, close));
        parent.addChild(loop);
        if ("for".equals(word)) {
            int headEnd = TokenRanges.findTopLevel(tokens, open + 1, close, TokenType.SEMICOLON, TokenType.COLON);
            declareLocals(ctx, open + 1, headEnd >= 0 ? headEnd : close);
        }
        scanExpression(ctx, open + 1, close, loop);
        int end = parseClause(ctx, loop, word, keyword, close + 1, to);
        finish(ctx, loop, keyword, end);
        return end;
    }

    /**
     * Declares the variables of a declaration in a loop or resource header, if the range holds one.
     */
    private void declareLocals(ParseContext ctx, int from, int to) {
        List<Token> tokens = ctx.tokens();
        int first = declaratorName(tokens, from, to);
        if (first < 0) {
            return;
        }
        declare(ctx, tokens.get(first).text(), SymbolKind.VARIABLE, tokens.get(first));
        List<int[]> declarators = TokenRanges.splitTypeAware(tokens, first, to);
        for (int d = 1; d < declarators.size(); d++) {
            int name = TokenRanges.nextSignificant(tokens, declarators.get(d)[0], declarators.get(d)[1]);
            while (name < declarators.get(d)[1] && tokens.get(name).isOperator("*")) {
                name = TokenRanges.nextSignificant(tokens, name + 1, declarators.get(d)[1]);
            }
            if (name < declarators.get(d)[1] && tokens.get(name).is(TokenType.IDENTIFIER)) {
                declare(ctx, tokens.get(name).text(), SymbolKind.VARIABLE, tokens.get(name));
            }
        }
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
            int end = Math.max(statementEnd(tokens, keyword, to), keyword + 1);
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
            AstNode body = statement.addChild(blockNode(ctx, brace, block));
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
        int i = from;
        AstNode clause = null;
        ContextFrame frame = null;
        try {
            while (i < to) {
                Token token = tokens.get(i);
                if (isDirective(token)) {
                    parseDirective(ctx, i, clause != null ? clause : body);
                    i++;
                    continue;
                }
                if (!TokenRanges.isSignificant(token)) {
                    i++;
                    continue;
                }
                if (token.isWord("case", "default") && isCaseLabel(tokens, i, to)) {
                    if (frame != null) {
                        finish(ctx, clause, frame.startIndex(), i);
                        exitScope(ctx, frame);
                    }
                    int label = caseLabelEnd(tokens, i + 1, to);
                    clause = node(ctx, NodeTypes.CASE_CLAUSE, i);
                    clause.setProperty(NodeProperties.PATTERN, token.isWord("default") ? "default" : ctx.text(i + 1, label));
                    body.addChild(clause);
                    frame = enterBlock(ctx, ContextType.CASE, token.text(), i);
                    i = label < to ? label + 1 : to;
                    continue;
                }
                int next = parseStatement(ctx, i, to, clause != null ? clause : body, Prefix.NONE);
                i = Math.max(next, i + 1);
            }
            if (frame != null) {
                finish(ctx, clause, frame.startIndex(), to);
            }
        } finally {
            if (frame != null) {
                exitScope(ctx, frame);
            }
        }
    }

    private boolean isCaseLabel(List<Token> tokens, int i, int to) {
        if (tokens.get(i).isWord("case")) {
            return true;
        }
        int next = TokenRanges.nextSignificant(tokens, i + 1, to);
        return next < to && (tokens.get(next).is(TokenType.COLON) || dialect() == Dialect.JAVA && tokens.get(next).is(TokenType.ARROW));
    }

    private int caseLabelEnd(List<Token> tokens, int from, int to) {
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
            } else if (depth == 0 && (token.is(TokenType.COLON) || dialect() == Dialect.JAVA && token.is(TokenType.ARROW))) {
                return i;
            }
        }
        return to;
    }

    private int parseTry(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        AstNode attempt = node(ctx, NodeTypes.TRY_STATEMENT, keyword);
        attempt.setProperty(NodeProperties.KEYWORD, "try");
        parent.addChild(attempt);
        int bodyStart = keyword + 1;
        int open = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        if (open < to && tokens.get(open).is(TokenType.OPEN_PAREN)) {
            int close = TokenRanges.matchingClose(tokens, open, to);
            if (close >= 0) {
                attempt.setProperty(NodeProperties.CONDITION, ctx.text(open + 1, close));
                for (int[] resource : TokenRanges.splitTopLevel(tokens, open + 1, close, TokenType.SEMICOLON)) {
                    declareLocals(ctx, resource[0], resource[1]);
                }
                bodyStart = close + 1;
            }
        }
        int end = parseClause(ctx, attempt, "try", keyword, bodyStart, to);
        finish(ctx, attempt, keyword, end);

        int next = TokenRanges.nextSignificant(tokens, end, to);
        while (next < to && tokens.get(next).isWord("catch", "finally")) {
            String word = tokens.get(next).text();
            AstNode handler = node(ctx, NodeTypes.TRY_STATEMENT, next);
            handler.setProperty(NodeProperties.KEYWORD, word);
            parent.addChild(handler);
            int handlerBody = next + 1;
            int paren = TokenRanges.nextSignificant(tokens, next + 1, to);
            if ("catch".equals(word) && paren < to && tokens.get(paren).is(TokenType.OPEN_PAREN)) {
                int close = TokenRanges.matchingClose(tokens, paren, to);
                if (close >= 0) {
                    handler.setProperty(NodeProperties.CONDITION, ctx.text(paren + 1, close));
                    int last = TokenRanges.previousSignificant(tokens, close, paren + 1);
                    int before = last >= 0 ? TokenRanges.previousSignificant(tokens, last, paren + 1) : -1;
                    if (last >= 0 && before >= 0 && tokens.get(last).is(TokenType.IDENTIFIER)) {
                        declare(ctx, tokens.get(last).text(), SymbolKind.VARIABLE, tokens.get(last));
                    }
                    handlerBody = close + 1;
                }
            }
            end = parseClause(ctx, handler, word, next, handlerBody, to);
            finish(ctx, handler, next, end);
            next = TokenRanges.nextSignificant(tokens, end, to);
        }
        return end;
    }

    private int parseGuarded(ParseContext ctx, int keyword, int to, AstNode parent) {
        List<Token> tokens = ctx.tokens();
        int open = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        int close = open < to && tokens.get(open).is(TokenType.OPEN_PAREN) ? TokenRanges.matchingClose(tokens, open, to) : -1;
        if (close < 0) {
            return parseDeclarationOrExpression(ctx, keyword, to, parent, Prefix.NONE);
        }
        AstNode statement = node(ctx, NodeTypes.BLOCK_STATEMENT, keyword);
        statement.setProperty(NodeProperties.KEYWORD, tokens.get(keyword).text());
        statement.setProperty(NodeProperties.CONDITION, ctx.text(open + 1, close));
        parent.addChild(statement);
        int end = parseClause(ctx, statement, tokens.get(keyword).text(), keyword, close + 1, to);
        finish(ctx, statement, keyword, end);
        return end;
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
            return parseStatement(ctx, i, to, owner, Prefix.NONE);
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
        AstNode body = owner.addChild(blockNode(ctx, brace, block));
        if (!block.terminated()) {
            markUnterminated(ctx, owner == ctx.root() ? body : owner, brace, what);
        }
        parseStatements(ctx, block.firstMember(), block.memberEnd(), body);
        return block.nextIndex();
    }

    // ==================== Expressions ====================

    /**
     * Finds lambdas and anonymous classes inside an expression and parses each with its own
     * scope: Java {@code x -> ...} and {@code new T() { ... }}, C++ {@code [captures](params) { ... }}.
     */
    private void scanExpression(ParseContext ctx, int from, int to, AstNode owner) {
        List<Token> tokens = ctx.tokens();
        int i = from;
        while (i < to) {
            Token token = tokens.get(i);
            if (dialect() == Dialect.JAVA && token.is(TokenType.ARROW)) {
                int next = parseJavaLambda(ctx, from, i, to, owner);
                i = Math.max(next, i + 1);
                continue;
            }
            if (dialect() == Dialect.JAVA && token.isWord("new")) {
                int next = parseAnonymousClass(ctx, i, to, owner);
                i = Math.max(next, i + 1);
                continue;
            }
            if (dialect() == Dialect.CPP && token.is(TokenType.OPEN_BRACKET)) {
                int next = parseCppLambda(ctx, from, i, to, owner);
                i = Math.max(next, i + 1);
                continue;
            }
            i++;
        }
    }

    private int parseJavaLambda(ParseContext ctx, int floor, int arrow, int to, AstNode owner) {
        List<Token> tokens = ctx.tokens();
        int previous = TokenRanges.previousSignificant(tokens, arrow, floor);
        if (previous < 0) {
            return arrow + 1;
        }
        int start;
        if (tokens.get(previous).is(TokenType.IDENTIFIER)) {
            start = previous;
        } else if (tokens.get(previous).is(TokenType.CLOSE_PAREN)) {
            start = matchingOpen(tokens, previous, floor);
            if (start < 0) {
                return arrow + 1;
            }
        } else {
            return arrow + 1;
        }
        AstNode lambda = node(ctx, NodeTypes.ARROW_FUNCTION, start);
        owner.addChild(lambda);
        ContextFrame frame = enterScope(ctx, ContextType.FUNCTION, null, start);
        try {
            lambda.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            if (start == previous) {
                Map<String, Object> parameter = new LinkedHashMap<>();
                parameter.put(NodeProperties.PARAM_NAME, tokens.get(start).text());
                parameter.put(NodeProperties.PARAM_KIND, "positional");
                lambda.setProperty(NodeProperties.PARAMETERS, List.of(parameter));
                declare(ctx, tokens.get(start).text(), SymbolKind.PARAMETER, tokens.get(start));
            } else {
                lambda.setProperty(NodeProperties.PARAMETERS, parseParameters(ctx, start + 1, previous, SymbolKind.PARAMETER, true));
            }
            int body = TokenRanges.nextSignificant(tokens, arrow + 1, to);
            int end;
            if (body < to && tokens.get(body).is(TokenType.OPEN_BRACE)) {
                end = parseBody(ctx, lambda, body, "lambda");
            } else {
                end = expressionEnd(tokens, body, to);
                lambda.setProperty(NodeProperties.VALUE, ctx.text(body, end));
                scanExpression(ctx, body, end, lambda);
            }
            finish(ctx, lambda, start, end);
            return end;
        } finally {
            exitScope(ctx, frame);
        }
    }

    private int parseCppLambda(ParseContext ctx, int floor, int bracket, int to, AstNode owner) {
        List<Token> tokens = ctx.tokens();
        int previous = TokenRanges.previousSignificant(tokens, bracket, floor);
        if (previous >= 0 && (tokens.get(previous).is(TokenType.IDENTIFIER, TokenType.CLOSE_BRACKET, TokenType.CLOSE_PAREN,
                TokenType.STRING, TokenType.OPEN_BRACKET) || tokens.get(previous).isWord("operator", "this"))) {
            return bracket + 1;
        }
        int captureEnd = TokenRanges.matchingClose(tokens, bracket, to);
        if (captureEnd < 0) {
            return bracket + 1;
        }
        int i = TokenRanges.nextSignificant(tokens, captureEnd + 1, to);
        int paramOpen = -1;
        int paramClose = -1;
        if (i < to && tokens.get(i).is(TokenType.OPEN_PAREN)) {
            paramOpen = i;
            paramClose = TokenRanges.matchingClose(tokens, i, to);
            if (paramClose < 0) {
                return bracket + 1;
            }
            i = TokenRanges.nextSignificant(tokens, paramClose + 1, to);
        }
        int returnType = -1;
        while (i < to && !tokens.get(i).is(TokenType.OPEN_BRACE)) {
            Token token = tokens.get(i);
            if (token.is(TokenType.ARROW)) {
                returnType = i;
            } else if (!token.is(TokenType.IDENTIFIER, TokenType.KEYWORD) && !(returnType >= 0 && token.is(TokenType.OPERATOR))) {
                return captureEnd + 1;
            }
            i = TokenRanges.nextSignificant(tokens, i + 1, to);
        }
        if (i >= to) {
            return captureEnd + 1;
        }
        AstNode lambda = node(ctx, NodeTypes.ARROW_FUNCTION, bracket);
        lambda.setProperty(NodeProperties.CAPTURES, ctx.text(bracket + 1, captureEnd));
        if (returnType >= 0) {
            lambda.setProperty(NodeProperties.RETURN_TYPE, ctx.text(returnType + 1, i));
        }
        owner.addChild(lambda);
        ContextFrame frame = enterScope(ctx, ContextType.FUNCTION, null, bracket);
        try {
            lambda.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            lambda.setProperty(NodeProperties.PARAMETERS, paramOpen >= 0
                ? parseParameters(ctx, paramOpen + 1, paramClose, SymbolKind.PARAMETER, false) : List.of());
            int end = parseBody(ctx, lambda, i, "lambda");
            finish(ctx, lambda, bracket, end);
            return end;
        } finally {
            exitScope(ctx, frame);
        }
    }

    private int parseAnonymousClass(ParseContext ctx, int keyword, int to, AstNode owner) {
        List<Token> tokens = ctx.tokens();
        int i = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        int typeStart = i;
        while (i < to && (tokens.get(i).is(TokenType.IDENTIFIER, TokenType.DOT))) {
            i = TokenRanges.nextSignificant(tokens, i + 1, to);
        }
        if (i == typeStart) {
            return keyword + 1;
        }
        int typeEnd = i;
        if (i < to && tokens.get(i).isOperator("<")) {
            int close = TokenRanges.matchingAngle(tokens, i, to);
            if (close < 0) {
                return keyword + 1;
            }
            typeEnd = close + 1;
            i = TokenRanges.nextSignificant(tokens, close + 1, to);
        }
        if (i >= to || !tokens.get(i).is(TokenType.OPEN_PAREN)) {
            return keyword + 1;
        }
        int close = TokenRanges.matchingClose(tokens, i, to);
        int brace = close >= 0 ? TokenRanges.nextSignificant(tokens, close + 1, to) : to;
        if (brace >= to || !tokens.get(brace).is(TokenType.OPEN_BRACE)) {
            return keyword + 1;
        }
        scanExpression(ctx, i + 1, close, owner);
        AstNode cls = node(ctx, NodeTypes.CLASS_DECLARATION, keyword);
        cls.setProperty(NodeProperties.KIND, "anonymous");
        cls.setProperty(NodeProperties.EXTENDS, ctx.text(typeStart, typeEnd));
        owner.addChild(cls);
        ContextFrame frame = enterScope(ctx, ContextType.CLASS, null, keyword);
        try {
            cls.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            BlockResult block = blockParser.parseBlock(tokens, brace, ctx.state(), ContextType.BLOCK,
                Map.of(ContextFrame.KEYWORD, "class"));
            AstNode body = cls.addChild(blockNode(ctx, brace, block));
            if (!block.terminated()) {
                markUnterminated(ctx, cls, brace, "anonymous class");
            }
            parseStatements(ctx, block.firstMember(), block.memberEnd(), body);
            finish(ctx, cls, keyword, block.nextIndex());
            return block.nextIndex();
        } finally {
            exitScope(ctx, frame);
        }
    }

    private static int matchingOpen(List<Token> tokens, int close, int floor) {
        int depth = 0;
        for (int i = close; i >= floor; i--) {
            Token token = tokens.get(i);
            if (token.type().isClosing()) {
                depth++;
            } else if (token.type().isOpening() && --depth == 0) {
                return i;
            }
        }
        return -1;
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
