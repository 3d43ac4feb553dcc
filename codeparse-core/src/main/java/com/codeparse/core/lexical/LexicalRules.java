package com.codeparse.core.lexical;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Per-language description of the literals that form exclusion zones.
 *
 * <p><b>Example (JavaScript):</b></p>
 * <pre>{@code
 * LexicalRules rules = LexicalRules.builder()
 *     .lineComments("//")
 *     .stringDelimiters("'", "\"")
 *     .template("`", "${")
 *     .regexLiterals(true)
 *     .build();
 * }</pre>
 *
 * @param lineComments line comment openers (e.g. {@code #}, {@code //})
 * @param blockCommentOpen block comment opener, or null if the language has none
 * @param blockCommentClose block comment closer, or null
 * @param nestedBlockComments whether block comments nest
 * @param stringDelimiters string delimiters, longest first (e.g. {@code """} before {@code "})
 * @param stringPrefixes prefixes that may precede a string delimiter (e.g. {@code rb}), case-insensitive
 * @param templateDelimiter template literal delimiter, or null
 * @param interpolationOpen interpolation opener inside templates (e.g. {@code ${}), or null
 * @param regexLiterals whether {@code /.../} regex literals exist
 * @param singleLineStrings whether single-delimiter strings end at an unescaped line break
 */
public record LexicalRules(
    List<String> lineComments,
    String blockCommentOpen,
    String blockCommentClose,
    boolean nestedBlockComments,
    List<String> stringDelimiters,
    List<String> stringPrefixes,
    String templateDelimiter,
    String interpolationOpen,
    boolean regexLiterals,
    boolean singleLineStrings
) {
    public LexicalRules {
        lineComments = lineComments != null ? List.copyOf(lineComments) : List.of();
        stringDelimiters = sortLongestFirst(stringDelimiters);
        stringPrefixes = sortLongestFirst(stringPrefixes);
        if ((blockCommentOpen == null) != (blockCommentClose == null)) {
            throw new IllegalArgumentException("Block comment needs both an opener and a closer");
        }
        if (interpolationOpen != null) {
            Objects.requireNonNull(templateDelimiter, "interpolation requires a template delimiter");
        }
    }

    private static List<String> sortLongestFirst(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .sorted(Comparator.comparingInt(String::length).reversed())
            .toList();
    }

    /**
     * Returns whether a delimiter allows its string to span lines.
     */
    public boolean isMultiLine(String delimiter) {
        return !singleLineStrings || delimiter.length() >= 3;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link LexicalRules}.
     */
    public static final class Builder {
        private List<String> lineComments = List.of();
        private String blockCommentOpen;
        private String blockCommentClose;
        private boolean nestedBlockComments;
        private List<String> stringDelimiters = List.of();
        private List<String> stringPrefixes = List.of();
        private String templateDelimiter;
        private String interpolationOpen;
        private boolean regexLiterals;
        private boolean singleLineStrings = true;

        private Builder() {
        }

        public Builder lineComments(String... openers) {
            this.lineComments = List.of(openers);
            return this;
        }

        public Builder blockComment(String open, String close) {
            this.blockCommentOpen = open;
            this.blockCommentClose = close;
            return this;
        }

        public Builder nestedBlockComments(boolean nested) {
            this.nestedBlockComments = nested;
            return this;
        }

        public Builder stringDelimiters(String... delimiters) {
            this.stringDelimiters = List.of(delimiters);
            return this;
        }

        public Builder stringPrefixes(String... prefixes) {
            this.stringPrefixes = List.of(prefixes);
            return this;
        }

        public Builder template(String delimiter, String interpolation) {
            this.templateDelimiter = delimiter;
            this.interpolationOpen = interpolation;
            return this;
        }

        public Builder regexLiterals(boolean enabled) {
            this.regexLiterals = enabled;
            return this;
        }

        public Builder singleLineStrings(boolean singleLine) {
            this.singleLineStrings = singleLine;
            return this;
        }

        public LexicalRules build() {
            return new LexicalRules(lineComments, blockCommentOpen, blockCommentClose, nestedBlockComments,
                stringDelimiters, stringPrefixes, templateDelimiter, interpolationOpen, regexLiterals,
                singleLineStrings);
        }
    }
}
