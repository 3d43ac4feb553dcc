package com.codeparse.core.parser;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import com.codeparse.core.ast.ParseResult;
import com.codeparse.core.diagnostic.ParseWarning;
import com.codeparse.core.diagnostic.WarningKind;

/**
 * Common interface for language-specific structure parsers.
 *
 * <p>Every parser turns a complete source string into a {@link ParseResult}: a tree with one
 * node per recognized construct, a scope-indexed symbol table and the warnings collected on the
 * way. Parsing is error tolerant: malformed input produces warnings and error nodes, never an
 * exception.
 *
 * <p><b>Supported Languages:</b></p>
 * <ul>
 *   <li>Python: indentation blocks</li>
 *   <li>JavaScript and TypeScript: brace blocks, TypeScript adds type-only constructs</li>
 *   <li>C, C++ and Java: brace blocks</li>
 * </ul>
 *
 * <p>Implementations are registered in
 * {@code META-INF/services/com.codeparse.core.parser.LanguageParser} and must provide a public
 * no-argument constructor plus a constructor taking a
 * {@link com.codeparse.core.config.ParserConfig}.
 *
 * <p><b>Usage Example:</b></p>
 * <pre>{@code
 * LanguageParser parser = ParserFactory.createParser("python").orElseThrow();
 * ParseResult result = parser.parse("def f(a, b=10):\n    return a*b\n");
 *
 * for (AstNode function : AstQueries.getFunctions(result.root())) {
 *     System.out.println(function.getName() + " at line " + function.getLine());
 * }
 * }</pre>
 *
 * @see ParserFactory
 * @see AbstractLanguageParser
 * @since 1.0.0
 */
public interface LanguageParser {

    /**
     * Gets the canonical language identifier (e.g. "python", "typescript").
     */
    String getLanguage();

    /**
     * Gets alternative identifiers accepted by the factory (e.g. "py").
     */
    default Set<String> getAliases() {
        return Set.of();
    }

    /**
     * Gets file extensions, without the dot, handled by this parser.
     */
    Set<String> getFileExtensions();

    /**
     * Parses a complete source string.
     *
     * @param source source code, null is treated as empty
     * @return tree, symbols and warnings of this call
     */
    ParseResult parse(String source);

    /**
     * Reads a UTF-8 file and parses its content.
     *
     * <p>Byte sequences that are not valid UTF-8 are replaced with U+FFFD and reported as a
     * {@link WarningKind#MALFORMED_ENCODING} warning at the first replaced character.
     *
     * @param filePath path to the source file
     * @return parse result
     * @throws ParseException if the file cannot be read
     */
    default ParseResult parseFile(Path filePath) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(filePath);
        } catch (IOException e) {
            throw new ParseException("Failed to read " + filePath, e);
        }
        try {
            return parse(decoder(CodingErrorAction.REPORT).decode(ByteBuffer.wrap(bytes)).toString());
        } catch (CharacterCodingException e) {
            String text = decodeReplacing(bytes, filePath);
            int offset = Math.max(text.indexOf('\uFFFD'), 0);
            int line = 1;
            int lineStart = 0;
            for (int i = 0; i < offset; i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                    lineStart = i + 1;
                }
            }
            return parse(text).withLeadingWarning(new ParseWarning(WarningKind.MALFORMED_ENCODING,
                filePath.getFileName() + " is not valid UTF-8; malformed bytes were replaced",
                line, offset - lineStart + 1));
        }
    }

    private static String decodeReplacing(byte[] bytes, Path filePath) {
        try {
            CharBuffer chars = decoder(CodingErrorAction.REPLACE).decode(ByteBuffer.wrap(bytes));
            return chars.toString();
        } catch (CharacterCodingException e) {
            throw new ParseException("Failed to decode " + filePath, e);
        }
    }

    private static CharsetDecoder decoder(CodingErrorAction action) {
        return StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(action)
            .onUnmappableCharacter(action);
    }

    /**
     * Exception thrown when a parser cannot obtain its input.
     *
     * <p>Malformed source never raises this; it is reserved for I/O failures.
     */
    class ParseException extends RuntimeException {
        public ParseException(String message, Throwable cause) {
            super(message, cause);
        }

        public ParseException(String message) {
            super(message);
        }
    }
}
