package com.codeparse.core.ast;

import java.util.Set;

/**
 * Node type names produced by the language parsers.
 *
 * <p>Every parser uses the same vocabulary so consumers can query trees without caring which
 * language produced them. Language-specific detail goes into properties, never into new types.
 *
 * @since 1.0.0
 */
public final class NodeTypes {

    /** Root of every tree. Properties: language, warnings. */
    public static final String MODULE = "Module";

    /** Properties: name, parameters, decorators, modifiers, returnType, typeParameters, async, generator. */
    public static final String FUNCTION_DECLARATION = "FunctionDeclaration";

    /** A function declared directly inside a class body. Same properties as a function. */
    public static final String METHOD_DECLARATION = "MethodDeclaration";

    /** Properties: name, bases, keywords, metaclass, decorators, modifiers, typeParameters. */
    public static final String CLASS_DECLARATION = "ClassDeclaration";

    /** Properties: name, extends, typeParameters, modifiers. */
    public static final String INTERFACE_DECLARATION = "InterfaceDeclaration";

    /** Properties: name, value, typeParameters, modifiers. */
    public static final String TYPE_ALIAS_DECLARATION = "TypeAliasDeclaration";

    /** Properties: name, members, modifiers. */
    public static final String ENUM_DECLARATION = "EnumDeclaration";

    /** Properties: name, modifiers. */
    public static final String NAMESPACE_DECLARATION = "NamespaceDeclaration";

    /** Class field or property declared in a class body. Properties: name, modifiers, value. */
    public static final String FIELD_DECLARATION = "FieldDeclaration";

    /** Properties: kind (let/const/var or assignment), names, value. */
    public static final String VARIABLE_DECLARATION = "VariableDeclaration";

    /** Assignment expression inside another expression, e.g. {@code (n := len(a))}. Properties: name, value. */
    public static final String NAMED_EXPRESSION = "NamedExpression";

    /** Properties: module, names, default, namespace. */
    public static final String IMPORT_DECLARATION = "ImportDeclaration";

    /** Properties: names, source, default. */
    public static final String EXPORT_DECLARATION = "ExportDeclaration";

    /** A braced or indented body. Properties: startLine, endLine, memberIndices (optional). */
    public static final String BLOCK = "Block";

    /** Properties: keyword (if, elif, else), condition. */
    public static final String IF_STATEMENT = "IfStatement";

    /** Properties: keyword (for, while, do), condition. */
    public static final String LOOP_STATEMENT = "LoopStatement";

    /** Properties: keyword (try, except, catch, finally), condition. */
    public static final String TRY_STATEMENT = "TryStatement";

    /** Python {@code with}. Properties: keyword, condition. */
    public static final String WITH_STATEMENT = "WithStatement";

    /** Any other keyword-introduced block (switch, match, else...). Properties: keyword, condition. */
    public static final String BLOCK_STATEMENT = "BlockStatement";

    /** Python {@code match}. Properties: subject. */
    public static final String MATCH_STATEMENT = "MatchStatement";

    /** One {@code case} arm of a match or switch. Properties: pattern. */
    public static final String CASE_CLAUSE = "CaseClause";

    /** Properties: value. */
    public static final String RETURN_STATEMENT = "ReturnStatement";

    /** Any statement no rule gave a more specific shape. Properties: text. */
    public static final String EXPRESSION_STATEMENT = "ExpressionStatement";

    /** Properties: parameters, async. */
    public static final String ARROW_FUNCTION = "ArrowFunction";

    /** Properties: name (optional), parameters, async, generator. */
    public static final String FUNCTION_EXPRESSION = "FunctionExpression";

    /** C-family {@code #include}, {@code #define} and similar. Properties: directive, text. */
    public static final String PREPROCESSOR_DIRECTIVE = "PreprocessorDirective";

    /** Placeholder for text no rule could place. Properties: text, message. */
    public static final String ERROR_NODE = "ErrorNode";

    /** Node types that declare callables. */
    public static final Set<String> FUNCTION_TYPES = Set.of(
        FUNCTION_DECLARATION, METHOD_DECLARATION, ARROW_FUNCTION, FUNCTION_EXPRESSION);

    /** Node types that declare a named top-level entity. */
    public static final Set<String> DECLARATION_TYPES = Set.of(
        FUNCTION_DECLARATION, METHOD_DECLARATION, CLASS_DECLARATION, INTERFACE_DECLARATION,
        TYPE_ALIAS_DECLARATION, ENUM_DECLARATION, NAMESPACE_DECLARATION, VARIABLE_DECLARATION,
        IMPORT_DECLARATION);

    private NodeTypes() {
        // Utility class
    }
}
