package com.codeparse.core.parser.impl.typescript;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.codeparse.core.ast.AstNode;
import com.codeparse.core.ast.NodeProperties;
import com.codeparse.core.ast.NodeTypes;
import com.codeparse.core.block.BlockResult;
import com.codeparse.core.config.ParserConfig;
import com.codeparse.core.lexical.Lexer;
import com.codeparse.core.parser.ParseContext;
import com.codeparse.core.parser.TokenRanges;
import com.codeparse.core.parser.impl.javascript.JavaScriptParser;
import com.codeparse.core.state.ContextFrame;
import com.codeparse.core.state.ContextType;
import com.codeparse.core.symbol.SymbolKind;
import com.codeparse.core.token.Token;
import com.codeparse.core.token.TokenType;
import com.codeparse.core.util.Languages;

/**
 * Structure parser for TypeScript.
 *
 * <p>Extends the JavaScript parser with type annotations, generics, interfaces, type aliases,
 * enums and namespaces. Type expressions are skipped structurally and kept as text; they are
 * never interpreted.
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * ParseResult result = new TypeScriptParser().parse("interface Point { x: number; y: number }");
 * AstNode point = result.root().firstChild(NodeTypes.INTERFACE_DECLARATION).orElseThrow();
 * }</pre>
 *
 * @since 1.0.0
 */
public class TypeScriptParser extends JavaScriptParser {

    private static final Set<String> DECLARATION_MODIFIERS = Set.of("declare", "abstract");

    public TypeScriptParser() {
        this(ParserConfig.defaults());
    }

    public TypeScriptParser(ParserConfig config) {
        super(config);
    }

    @Override
    public String getLanguage() {
        return Languages.TYPESCRIPT;
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("ts", "tsx");
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of("ts", "tsx", "mts", "cts");
    }

    @Override
    protected Lexer createLexer(String source) {
        return new TypeScriptLexer(source);
    }

    @Override
    protected boolean typeSyntax() {
        return true;
    }

    @Override
    protected int parseTypeDeclaration(ParseContext ctx, int index, int to, AstNode parent, Modifiers modifiers) {
        List<Token> tokens = ctx.tokens();
        Token token = tokens.get(index);
        int next = TokenRanges.nextSignificant(tokens, index + 1, to);
        if (next >= to || TokenRanges.hasNewline(tokens, index, next) && !token.isWord("interface", "enum")) {
            return -1;
        }
        Token following = tokens.get(next);

        if (token.is(TokenType.IDENTIFIER, TokenType.KEYWORD) && DECLARATION_MODIFIERS.contains(token.text())
                && (following.is(TokenType.KEYWORD) || following.is(TokenType.IDENTIFIER)
                    && following.isWord("namespace", "module", "global", "abstract", "type", "async", "const"))) {
            if (token.isWord("declare") && following.isWord("global")) {
                return parseNamespace(ctx, index, next, to, parent, modifiers);
            }
            return parseStatement(ctx, next, to, parent, modifiers.with(token.text()));
        }
        if (token.isWord("interface") && following.is(TokenType.IDENTIFIER)) {
            return parseInterface(ctx, index, to, parent, modifiers);
        }
        if (token.isWord("type") && following.is(TokenType.IDENTIFIER)) {
            return parseTypeAlias(ctx, index, next, to, parent, modifiers);
        }
        if (token.isWord("enum") && following.is(TokenType.IDENTIFIER)) {
            return parseEnum(ctx, index, index, to, parent, modifiers);
        }
        if (token.isWord("const") && following.isWord("enum")) {
            return parseEnum(ctx, index, next, to, parent, modifiers.with("const"));
        }
        if (token.isWord("namespace", "module") && following.is(TokenType.IDENTIFIER, TokenType.STRING)) {
            return parseNamespace(ctx, index, next, to, parent, modifiers);
        }
        if (token.isWord("abstract") && following.isWord("class")) {
            return parseClass(ctx, next, to, parent, modifiers.with("abstract"), false);
        }
        return -1;
    }

    // ==================== Interfaces ====================

    private int parseInterface(ParseContext ctx, int keyword, int to, AstNode parent, Modifiers modifiers) {
        List<Token> tokens = ctx.tokens();
        int nameIndex = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        Token nameToken = tokens.get(nameIndex);
        int brace = TokenRanges.findTopLevel(tokens, nameIndex + 1, to, TokenType.OPEN_BRACE);
        if (brace < 0) {
            int end = Math.max(statementEnd(tokens, keyword, to, false), keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected '{' after interface header");
            return end;
        }

        AstNode declaration = node(ctx, NodeTypes.INTERFACE_DECLARATION, keyword);
        declaration.setProperty(NodeProperties.NAME, nameToken.text());
        applyModifiers(declaration, modifiers);
        int i = TokenRanges.nextSignificant(tokens, nameIndex + 1, brace);
        if (i < brace && tokens.get(i).isOperator("<")) {
            int close = TokenRanges.matchingAngle(tokens, i, brace);
            if (close >= 0) {
                declaration.setProperty(NodeProperties.TYPE_PARAMETERS, ctx.angleArguments(i, close));
                i = close + 1;
            }
        }
        int extendsIndex = findWord(tokens, i, brace, "extends");
        if (extendsIndex >= 0) {
            declaration.setProperty(NodeProperties.EXTENDS, segmentTexts(ctx, extendsIndex + 1, brace));
        }
        declare(ctx, nameToken.text(), SymbolKind.INTERFACE, nameToken);
        parent.addChild(declaration);

        ContextFrame frame = enterScope(ctx, ContextType.INTERFACE, nameToken.text(), keyword);
        try {
            declaration.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            BlockResult block = blockParser.parseBlock(tokens, brace, ctx.state(), ContextType.BLOCK,
                Map.of(ContextFrame.KEYWORD, "interface"));
            AstNode body = declaration.addChild(blockNode(ctx, brace, block));
            if (!block.terminated()) {
                markUnterminated(ctx, declaration, brace, "interface '" + nameToken.text() + "'");
            }
            declaration.setProperty(NodeProperties.MEMBERS, typeMembers(ctx, block.firstMember(), block.memberEnd(), body));
            finish(ctx, declaration, keyword, block.nextIndex());
            return block.nextIndex();
        } finally {
            exitScope(ctx, frame);
        }
    }

    /**
     * Reads the members of an object type body. Each member declares a symbol in the current
     * scope: methods as {@link SymbolKind#METHOD}, properties as {@link SymbolKind#VARIABLE}.
     */
    private List<Map<String, Object>> typeMembers(ParseContext ctx, int from, int to, AstNode body) {
        List<Token> tokens = ctx.tokens();
        List<Map<String, Object>> members = new ArrayList<>();
        int i = TokenRanges.nextSignificant(tokens, from, to);
        while (i < to) {
            int end = Math.max(statementEnd(tokens, i, to, true), i + 1);
            int content = end;
            if (tokens.get(end - 1).is(TokenType.SEMICOLON, TokenType.COMMA)) {
                content = end - 1;
            }
            Map<String, Object> member = typeMember(ctx, i, content);
            if (member != null) {
                members.add(member);
            } else if (tokens.get(i).type().isClosing()) {
                errorNode(ctx, body, i, i + 1, "Unexpected '" + tokens.get(i).text() + "'");
            }
            i = TokenRanges.nextSignificant(tokens, end, to);
        }
        return members;
    }

    private Map<String, Object> typeMember(ParseContext ctx, int from, int to) {
        List<Token> tokens = ctx.tokens();
        int i = TokenRanges.nextSignificant(tokens, from, to);
        List<String> modifiers = new ArrayList<>();
        while (i < to && tokens.get(i).isWord("readonly", "static")) {
            int next = TokenRanges.nextSignificant(tokens, i + 1, to);
            if (next >= to || tokens.get(next).is(TokenType.COLON, TokenType.OPEN_PAREN) || tokens.get(next).isOperator("?")) {
                break;
            }
            modifiers.add(tokens.get(i).text());
            i = next;
        }
        if (i >= to) {
            return null;
        }
        Token head = tokens.get(i);
        Map<String, Object> member = new LinkedHashMap<>();
        int nameEnd;
        if (head.is(TokenType.OPEN_BRACKET)) {
            int close = TokenRanges.matchingClose(tokens, i, to);
            nameEnd = close >= 0 ? close + 1 : to;
            member.put(NodeProperties.NAME, ctx.text(i, nameEnd));
            member.put(NodeProperties.KIND, "index");
        } else if (head.is(TokenType.OPEN_PAREN) || head.isOperator("<")) {
            member.put(NodeProperties.NAME, "()");
            member.put(NodeProperties.KIND, "call");
            member.put(NodeProperties.TYPE, ctx.text(i, to));
            return member;
        } else if (head.isWord("new")) {
            member.put(NodeProperties.NAME, "new");
            member.put(NodeProperties.KIND, "construct");
            member.put(NodeProperties.TYPE, ctx.text(TokenRanges.nextSignificant(tokens, i + 1, to), to));
            return member;
        } else if (head.is(TokenType.IDENTIFIER, TokenType.KEYWORD, TokenType.STRING, TokenType.NUMBER)) {
            nameEnd = i + 1;
            member.put(NodeProperties.NAME, unquote(head.text()));
        } else {
            return null;
        }

        int cursor = TokenRanges.nextSignificant(tokens, nameEnd, to);
        if (cursor < to && tokens.get(cursor).isOperator("?")) {
            member.put(NodeProperties.OPTIONAL, true);
            cursor = TokenRanges.nextSignificant(tokens, cursor + 1, to);
        }
        String name = member.get(NodeProperties.NAME).toString();
        if (cursor < to && (tokens.get(cursor).is(TokenType.OPEN_PAREN) || tokens.get(cursor).isOperator("<"))) {
            member.putIfAbsent(NodeProperties.KIND, "method");
            member.put(NodeProperties.TYPE, ctx.text(cursor, to));
            declare(ctx, name, SymbolKind.METHOD, head);
        } else {
            member.putIfAbsent(NodeProperties.KIND, "property");
            if (cursor < to && tokens.get(cursor).is(TokenType.COLON)) {
                member.put(NodeProperties.TYPE, ctx.text(cursor + 1, to));
            }
            if (!"index".equals(member.get(NodeProperties.KIND))) {
                declare(ctx, name, SymbolKind.VARIABLE, head);
            }
        }
        if (!modifiers.isEmpty()) {
            member.put(NodeProperties.MODIFIERS, modifiers);
        }
        return member;
    }

    // ==================== Type Aliases ====================

    private int parseTypeAlias(ParseContext ctx, int keyword, int nameIndex, int to, AstNode parent, Modifiers modifiers) {
        List<Token> tokens = ctx.tokens();
        Token nameToken = tokens.get(nameIndex);
        int i = TokenRanges.nextSignificant(tokens, nameIndex + 1, to);
        AstNode alias = node(ctx, NodeTypes.TYPE_ALIAS_DECLARATION, keyword);
        alias.setProperty(NodeProperties.NAME, nameToken.text());
        applyModifiers(alias, modifiers);
        if (i < to && tokens.get(i).isOperator("<")) {
            int close = TokenRanges.matchingAngle(tokens, i, to);
            if (close >= 0) {
                alias.setProperty(NodeProperties.TYPE_PARAMETERS, ctx.angleArguments(i, close));
                i = TokenRanges.nextSignificant(tokens, close + 1, to);
            }
        }
        if (i >= to || !tokens.get(i).is(TokenType.EQUALS)) {
            int end = Math.max(statementEnd(tokens, keyword, to, false), keyword + 1);
            errorNode(ctx, parent, keyword, end, "Expected '=' in type alias '" + nameToken.text() + "'");
            return end;
        }
        int typeEnd = skipType(tokens, i + 1, to, true);
        int end = typeEnd;
        int semicolon = TokenRanges.nextSignificant(tokens, typeEnd, to);
        if (semicolon < to && tokens.get(semicolon).is(TokenType.SEMICOLON)) {
            end = semicolon + 1;
        }
        alias.setProperty(NodeProperties.VALUE, ctx.text(i + 1, typeEnd));
        declare(ctx, nameToken.text(), SymbolKind.TYPE_ALIAS, nameToken);
        parent.addChild(alias);
        finish(ctx, alias, keyword, end);
        return Math.max(end, i + 1);
    }

    // ==================== Enums ====================

    private int parseEnum(ParseContext ctx, int start, int keyword, int to, AstNode parent, Modifiers modifiers) {
        List<Token> tokens = ctx.tokens();
        int nameIndex = TokenRanges.nextSignificant(tokens, keyword + 1, to);
        if (nameIndex >= to || !tokens.get(nameIndex).is(TokenType.IDENTIFIER)) {
            int end = Math.max(statementEnd(tokens, start, to, false), keyword + 1);
            errorNode(ctx, parent, start, end, "Expected an enum name");
            return end;
        }
        Token nameToken = tokens.get(nameIndex);
        int brace = TokenRanges.nextSignificant(tokens, nameIndex + 1, to);
        if (brace >= to || !tokens.get(brace).is(TokenType.OPEN_BRACE)) {
            int end = Math.max(statementEnd(tokens, start, to, false), nameIndex + 1);
            errorNode(ctx, parent, start, end, "Expected '{' after enum '" + nameToken.text() + "'");
            return end;
        }

        AstNode declaration = node(ctx, NodeTypes.ENUM_DECLARATION, start);
        declaration.setProperty(NodeProperties.NAME, nameToken.text());
        applyModifiers(declaration, modifiers);
        declare(ctx, nameToken.text(), SymbolKind.ENUM, nameToken);
        parent.addChild(declaration);

        ContextFrame frame = enterScope(ctx, ContextType.ENUM, nameToken.text(), start);
        try {
            declaration.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            BlockResult block = blockParser.parseBlock(tokens, brace, ctx.state(), ContextType.BLOCK,
                Map.of(ContextFrame.KEYWORD, "enum"));
            declaration.addChild(blockNode(ctx, brace, block));
            if (!block.terminated()) {
                markUnterminated(ctx, declaration, brace, "enum '" + nameToken.text() + "'");
            }
            List<Map<String, Object>> members = new ArrayList<>();
            for (int[] segment : TokenRanges.splitTopLevel(tokens, block.firstMember(), block.memberEnd(), TokenType.COMMA)) {
                int first = TokenRanges.nextSignificant(tokens, segment[0], segment[1]);
                if (first >= segment[1]) {
                    continue;
                }
                Token member = tokens.get(first);
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put(NodeProperties.NAME, unquote(member.text()));
                int equals = TokenRanges.findTopLevel(tokens, first, segment[1], TokenType.EQUALS);
                if (equals >= 0) {
                    entry.put(NodeProperties.VALUE, ctx.text(equals + 1, segment[1]));
                }
                members.add(entry);
                declare(ctx, unquote(member.text()), SymbolKind.ENUM_MEMBER, member);
            }
            declaration.setProperty(NodeProperties.MEMBERS, members);
            finish(ctx, declaration, start, block.nextIndex());
            return block.nextIndex();
        } finally {
            exitScope(ctx, frame);
        }
    }

    // ==================== Namespaces ====================

    private int parseNamespace(ParseContext ctx, int start, int nameIndex, int to, AstNode parent, Modifiers modifiers) {
        List<Token> tokens = ctx.tokens();
        Token keyword = tokens.get(start);
        int i = nameIndex;
        String name;
        if (tokens.get(nameIndex).isWord("global")) {
            name = "global";
            i = nameIndex + 1;
        } else {
            if (!keyword.isWord("namespace", "module")) {
                i = TokenRanges.nextSignificant(tokens, nameIndex, to);
            }
            Token nameToken = tokens.get(i);
            StringBuilder qualified = new StringBuilder(unquote(nameToken.text()));
            i++;
            while (i + 1 < to && tokens.get(i).is(TokenType.DOT) && tokens.get(i + 1).is(TokenType.IDENTIFIER)) {
                qualified.append('.').append(tokens.get(i + 1).text());
                i += 2;
            }
            name = qualified.toString();
        }
        int brace = TokenRanges.nextSignificant(tokens, i, to);

        AstNode namespace = node(ctx, NodeTypes.NAMESPACE_DECLARATION, start);
        namespace.setProperty(NodeProperties.NAME, name);
        namespace.setProperty(NodeProperties.KEYWORD, keyword.isWord("declare") ? "declare global" : keyword.text());
        applyModifiers(namespace, modifiers);
        declare(ctx, name, SymbolKind.NAMESPACE, tokens.get(nameIndex));
        parent.addChild(namespace);

        if (brace >= to || !tokens.get(brace).is(TokenType.OPEN_BRACE)) {
            // ambient shorthand: declare module 'x';
            int end = statementEnd(tokens, i, to, false);
            finish(ctx, namespace, start, end);
            return Math.max(end, i);
        }
        ContextFrame frame = enterScope(ctx, ContextType.NAMESPACE, name, start);
        try {
            namespace.setProperty(NodeProperties.SCOPE_ID, frame.scopeId());
            int end = parseBody(ctx, namespace, brace, "namespace '" + name + "'");
            finish(ctx, namespace, start, end);
            return end;
        } finally {
            exitScope(ctx, frame);
        }
    }
}
