package com.codeparse.core.lexical;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.codeparse.core.token.TextSpan;

/**
 * Tests for {@link ExclusionScanner}.
 */
class ExclusionScannerTest {

    private static final LexicalRules C_LIKE = LexicalRules.builder()
        .lineComments("//")
        .blockComment("/*", "*/")
        .stringDelimiters("\"", "'")
        .template("`", "${")
        .singleLineStrings(true)
        .build();

    private final ExclusionScanner scanner = new ExclusionScanner(C_LIKE);

    @Test
    void openerAt_recognizesEachLiteralKind() {
        assertThat(scanner.openerAt("// x", 0)).map(ExclusionScanner.Opener::kind).contains(ExclusionKind.LINE_COMMENT);
        assertThat(scanner.openerAt("/* x */", 0)).map(ExclusionScanner.Opener::kind).contains(ExclusionKind.BLOCK_COMMENT);
        assertThat(scanner.openerAt("\"x\"", 0)).map(ExclusionScanner.Opener::kind).contains(ExclusionKind.STRING);
        assertThat(scanner.openerAt("`x`", 0)).map(ExclusionScanner.Opener::kind).contains(ExclusionKind.TEMPLATE);
        assertThat(scanner.openerAt("x = 1", 0)).isEmpty();
    }

    @Test
    void scan_stringWithBraces_endsAtClosingQuote() {
        String source = "\"{ not a block }\" + 1";
        ExclusionScanner.Opener opener = scanner.openerAt(source, 0).orElseThrow();

        LiteralScan scan = scanner.scan(source, 0, opener);

        assertThat(scan.terminated()).isTrue();
        assertThat(source.substring(scan.start(), scan.end())).isEqualTo("\"{ not a block }\"");
    }

    @Test
    void scan_escapedQuote_doesNotCloseString() {
        String source = "'it\\'s {' rest";
        LiteralScan scan = scanner.scan(source, 0, scanner.openerAt(source, 0).orElseThrow());

        assertThat(source.substring(scan.start(), scan.end())).isEqualTo("'it\\'s {'");
    }

    @Test
    void scan_unterminatedString_closesAtEndOfInputAndReportsIt() {
        String source = "'unclosed";
        LiteralScan scan = scanner.scan(source, 0, scanner.openerAt(source, 0).orElseThrow());

        assertThat(scan.terminated()).isFalse();
        assertThat(scan.end()).isEqualTo(source.length());
    }

    @Test
    void scan_blockComment_spansLines() {
        String source = "/* {\n } */ x";
        LiteralScan scan = scanner.scan(source, 0, scanner.openerAt(source, 0).orElseThrow());

        assertThat(scan.kind()).isEqualTo(ExclusionKind.BLOCK_COMMENT);
        assertThat(source.substring(scan.start(), scan.end())).isEqualTo("/* {\n } */");
    }

    @Test
    void scan_template_recordsInterpolationsWithNestedBraces() {
        String source = "`a ${ {b: 1}.b } c`";
        LiteralScan scan = scanner.scan(source, 0, scanner.openerAt(source, 0).orElseThrow());

        assertThat(scan.terminated()).isTrue();
        assertThat(scan.end()).isEqualTo(source.length());
        assertThat(scan.interpolations()).hasSize(1);
        TextSpan span = scan.interpolations().get(0);
        assertThat(source.substring(span.start(), span.end())).contains("{b: 1}.b");
    }

    @Test
    void inExclusionZone_isOnlyTrueDuringScan() {
        String source = "\"x\"";
        Optional<ExclusionScanner.Opener> opener = scanner.openerAt(source, 0);

        scanner.scan(source, 0, opener.orElseThrow());

        assertThat(scanner.inExclusionZone()).isFalse();
    }
}
