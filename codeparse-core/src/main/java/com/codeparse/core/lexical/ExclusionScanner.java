package com.codeparse.core.lexical;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.codeparse.core.token.TextSpan;

/**
 * Recognizes and skips string, template, comment and regex literals.
 *
 * <p>Once a literal has been entered, structural characters such as braces and indentation are
 * inert until the literal's closing delimiter or end of input. Escape sequences are honored in
 * strings, templates and regex literals, so an escaped delimiter never closes the literal.
 *
 * <p>Template interpolations ({@code `a ${ {x: 1}.x } b`}) are scanned as a sub-scan seeded at the
 * interpolation boundary: the sub-scan counts its own braces and recurses into nested literals, so
 * an interpolated object literal cannot close the enclosing template early.
 *
 * <p>Instances are not thread-safe; each lexer owns one.
 *
 * @since 1.0.0
 */
public class ExclusionScanner {

    private final LexicalRules rules;
    private final ExclusionZone zone = new ExclusionZone();

    /**
     * An exclusion zone opener found at a source position.
     *
     * @param kind literal kind
     * @param delimiter opening delimiter
     * @param prefixLength length of a string prefix (e.g. 1 for {@code r"..."})
     */
    public record Opener(ExclusionKind kind, String delimiter, int prefixLength) {
    }

    public ExclusionScanner(LexicalRules rules) {
        this.rules = rules;
    }

    public LexicalRules rules() {
        return rules;
    }

    /**
     * Finds a comment, string or template opener starting at {@code pos}.
     *
     * <p>Regex literals are not detected here because recognizing them depends on the preceding
     * token; lexers call {@link #scanRegex(String, int)} directly.
     *
     * @param source source text
     * @param pos position to test
     * @return the opener, or empty if no literal starts here
     */
    public Optional<Opener> openerAt(String source, int pos) {
        if (rules.blockCommentOpen() != null && source.startsWith(rules.blockCommentOpen(), pos)) {
            return Optional.of(new Opener(ExclusionKind.BLOCK_COMMENT, rules.blockCommentOpen(), 0));
        }
        for (String lineComment : rules.lineComments()) {
            if (source.startsWith(lineComment, pos)) {
                return Optional.of(new Opener(ExclusionKind.LINE_COMMENT, lineComment, 0));
            }
        }
        if (rules.templateDelimiter() != null && source.startsWith(rules.templateDelimiter(), pos)) {
            return Optional.of(new Opener(ExclusionKind.TEMPLATE, rules.templateDelimiter(), 0));
        }
        for (String prefix : rules.stringPrefixes()) {
            if (source.regionMatches(true, pos, prefix, 0, prefix.length())) {
                Optional<String> delimiter = stringDelimiterAt(source, pos + prefix.length());
                if (delimiter.isPresent()) {
                    return Optional.of(new Opener(ExclusionKind.STRING, delimiter.get(), prefix.length()));
                }
            }
        }
        return stringDelimiterAt(source, pos).map(d -> new Opener(ExclusionKind.STRING, d, 0));
    }

    private Optional<String> stringDelimiterAt(String source, int pos) {
        for (String delimiter : rules.stringDelimiters()) {
            if (source.startsWith(delimiter, pos)) {
                return Optional.of(delimiter);
            }
        }
        return Optional.empty();
    }

    /**
     * Scans the literal introduced by {@code opener} at {@code pos}.
     *
     * <p>A literal still open at end of input is implicitly closed there and reported with
     * {@code terminated == false}.
     *
     * @param source source text
     * @param pos position of the opener (including any string prefix)
     * @param opener opener returned by {@link #openerAt(String, int)}
     * @return the scanned literal
     */
    public LiteralScan scan(String source, int pos, Opener opener) {
        zone.enter(opener.kind(), opener.delimiter());
        try {
            return scanLiteral(source, pos, opener);
        } finally {
            zone.exit();
        }
    }

    /**
     * Scans a regex literal whose opening slash is at {@code pos}, including trailing flags.
     *
     * @param source source text
     * @param pos position of the opening slash
     * @return the scanned literal
     */
    public LiteralScan scanRegex(String source, int pos) {
        zone.enter(ExclusionKind.REGEX, "/");
        try {
            return scanRegexBody(source, pos);
        } finally {
            zone.exit();
        }
    }

    /**
     * Returns whether a zone is currently open. Only true while a scan is in progress.
     */
    public boolean inExclusionZone() {
        return zone.isActive();
    }

    private LiteralScan scanLiteral(String source, int pos, Opener opener) {
        return switch (opener.kind()) {
            case LINE_COMMENT -> scanLineComment(source, pos, opener);
            case BLOCK_COMMENT -> scanBlockComment(source, pos, opener);
            case STRING -> scanString(source, pos, opener);
            case TEMPLATE -> scanTemplate(source, pos, opener);
            case REGEX -> scanRegexBody(source, pos);
        };
    }

    private LiteralScan scanRegexBody(String source, int pos) {
        int i = pos + 1;
        boolean inClass = false;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '\n' || c == '\r') {
                return new LiteralScan(ExclusionKind.REGEX, "/", pos, i, false, List.of());
            } else if (c == '[') {
                inClass = true;
                i++;
            } else if (c == ']') {
                inClass = false;
                i++;
            } else if (c == '/' && !inClass) {
                i++;
                while (i < source.length() && Character.isLetter(source.charAt(i))) {
                    i++;
                }
                return new LiteralScan(ExclusionKind.REGEX, "/", pos, i, true, List.of());
            } else {
                i++;
            }
        }
        return new LiteralScan(ExclusionKind.REGEX, "/", pos, source.length(), false, List.of());
    }

    private LiteralScan scanLineComment(String source, int pos, Opener opener) {
        int i = pos + opener.delimiter().length();
        while (i < source.length() && source.charAt(i) != '\n' && source.charAt(i) != '\r') {
            i++;
        }
        return new LiteralScan(opener.kind(), opener.delimiter(), pos, i, true, List.of());
    }

    private LiteralScan scanBlockComment(String source, int pos, Opener opener) {
        String open = rules.blockCommentOpen();
        String close = rules.blockCommentClose();
        int depth = 1;
        int i = pos + open.length();
        while (i < source.length()) {
            if (rules.nestedBlockComments() && source.startsWith(open, i)) {
                depth++;
                i += open.length();
            } else if (source.startsWith(close, i)) {
                depth--;
                i += close.length();
                if (depth == 0) {
                    return new LiteralScan(opener.kind(), open, pos, i, true, List.of());
                }
            } else {
                i++;
            }
        }
        return new LiteralScan(opener.kind(), open, pos, source.length(), false, List.of());
    }

    private LiteralScan scanString(String source, int pos, Opener opener) {
        String delimiter = opener.delimiter();
        boolean multiLine = rules.isMultiLine(delimiter);
        int i = pos + opener.prefixLength() + delimiter.length();
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (source.startsWith(delimiter, i)) {
                return new LiteralScan(ExclusionKind.STRING, delimiter, pos, i + delimiter.length(), true, List.of());
            } else if (!multiLine && (c == '\n' || c == '\r')) {
                return new LiteralScan(ExclusionKind.STRING, delimiter, pos, i, false, List.of());
            } else {
                i++;
            }
        }
        return new LiteralScan(ExclusionKind.STRING, delimiter, pos, source.length(), false, List.of());
    }

    private LiteralScan scanTemplate(String source, int pos, Opener opener) {
        String delimiter = opener.delimiter();
        String interpolation = rules.interpolationOpen();
        List<TextSpan> interpolations = new ArrayList<>();
        int i = pos + delimiter.length();
        while (i < source.length()) {
            char c = source.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (source.startsWith(delimiter, i)) {
                return new LiteralScan(ExclusionKind.TEMPLATE, delimiter, pos, i + delimiter.length(), true,
                    interpolations);
            } else if (interpolation != null && source.startsWith(interpolation, i)) {
                int exprStart = i + interpolation.length();
                int exprEnd = scanInterpolation(source, exprStart);
                if (exprEnd < 0) {
                    interpolations.add(new TextSpan(exprStart, source.length()));
                    return new LiteralScan(ExclusionKind.TEMPLATE, delimiter, pos, source.length(), false,
                        interpolations);
                }
                interpolations.add(new TextSpan(exprStart, exprEnd));
                i = exprEnd + 1;
            } else {
                i++;
            }
        }
        return new LiteralScan(ExclusionKind.TEMPLATE, delimiter, pos, source.length(), false, interpolations);
    }

    /**
     * Sub-scan of one interpolated expression, starting just after the interpolation opener.
     *
     * @return offset of the closing brace, or -1 if input ends first
     */
    private int scanInterpolation(String source, int start) {
        int depth = 1;
        int i = start;
        while (i < source.length()) {
            Optional<Opener> nested = openerAt(source, i);
            if (nested.isPresent()) {
                LiteralScan inner = scanLiteral(source, i, nested.get());
                if (!inner.terminated()) {
                    return -1;
                }
                i = inner.end();
                continue;
            }
            char c = source.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        return -1;
    }
}
