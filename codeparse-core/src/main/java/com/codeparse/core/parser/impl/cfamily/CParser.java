package com.codeparse.core.parser.impl.cfamily;

import java.util.Set;

import com.codeparse.core.config.ParserConfig;
import com.codeparse.core.parser.impl.cfamily.CFamilyLexer.Dialect;
import com.codeparse.core.util.Languages;

/**
 * Structure parser for C sources and headers.
 *
 * @since 1.0.0
 */
public class CParser extends CFamilyParser {

    public CParser() {
        this(ParserConfig.defaults());
    }

    public CParser(ParserConfig config) {
        super(config);
    }

    @Override
    public String getLanguage() {
        return Languages.C;
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of("c", "h");
    }

    @Override
    protected Dialect dialect() {
        return Dialect.C;
    }
}
