package com.codeparse.core.ast;

/**
 * Recognized property keys of {@link AstNode}.
 *
 * <p>Values are always JSON-compatible: strings, numbers, booleans, lists and maps of those.
 * Parameter descriptors are maps with the {@code PARAM_*} keys.
 *
 * @since 1.0.0
 */
public final class NodeProperties {

    // Common
    public static final String NAME = "name";
    public static final String LINE = "line";
    public static final String COLUMN = "column";
    public static final String END_LINE = "endLine";
    public static final String UNTERMINATED = "unterminated";
    public static final String SCOPE_ID = "scopeId";
    public static final String TEXT = "text";
    public static final String MESSAGE = "message";
    public static final String START_INDEX = "startIndex";
    public static final String END_INDEX = "endIndex";
    public static final String MEMBER_INDICES = "memberIndices";

    // Module
    public static final String LANGUAGE = "language";
    public static final String WARNINGS = "warnings";

    // Declarations
    public static final String PARAMETERS = "parameters";
    public static final String DECORATORS = "decorators";
    public static final String MODIFIERS = "modifiers";
    public static final String RETURN_TYPE = "returnType";
    public static final String TYPE_PARAMETERS = "typeParameters";
    public static final String ASYNC = "async";
    public static final String GENERATOR = "generator";
    public static final String BASES = "bases";
    public static final String KEYWORDS = "keywords";
    public static final String METACLASS = "metaclass";
    public static final String EXTENDS = "extends";
    public static final String IMPLEMENTS = "implements";
    public static final String MEMBERS = "members";
    public static final String TYPE = "type";
    public static final String OPTIONAL = "optional";
    /** Owner prefix of an out-of-line definition, such as {@code Foo} in {@code Foo::bar}. */
    public static final String QUALIFIER = "qualifier";
    /** Set on a type declared without a body ({@code class Foo;}). */
    public static final String FORWARD = "forward";
    /** Lifetime parameters of a Rust item, such as {@code 'a}; kept apart from {@link #TYPE_PARAMETERS}. */
    public static final String LIFETIMES = "lifetimes";
    /** Text of a {@code where} clause. */
    public static final String WHERE = "where";
    /** Capture list of a C++ lambda. */
    public static final String CAPTURES = "captures";

    // Statements
    public static final String KEYWORD = "keyword";
    public static final String CONDITION = "condition";
    public static final String VALUE = "value";
    public static final String KIND = "kind";
    public static final String NAMES = "names";
    public static final String MODULE = "module";
    public static final String SOURCE = "source";
    public static final String DEFAULT = "default";
    public static final String SUBJECT = "subject";
    public static final String PATTERN = "pattern";
    public static final String DIRECTIVE = "directive";
    /** Local binding of an imported or exported name, in entries of {@link #NAMES}. */
    public static final String ALIAS = "alias";

    // Parameter descriptors
    public static final String PARAM_NAME = "name";
    public static final String PARAM_DEFAULT = "default";
    public static final String PARAM_ANNOTATION = "annotation";
    /** One of {@code positional}, {@code varargs}, {@code kwargs}, {@code rest}, {@code separator}. */
    public static final String PARAM_KIND = "kind";

    private NodeProperties() {
        // Utility class
    }
}
