package com.codeparse.core.lexical;

import java.util.List;

import com.codeparse.core.diagnostic.ParseWarning;
import com.codeparse.core.token.Token;

/**
 * Token sequence produced by a {@link Lexer} plus the lexical warnings found on the way.
 *
 * @param tokens tokens in source order
 * @param warnings lexical warnings (e.g. unterminated literals)
 */
public record LexResult(List<Token> tokens, List<ParseWarning> warnings) {

    public LexResult {
        tokens = tokens != null ? List.copyOf(tokens) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
