package com.codeparse.core.parser.impl.cfamily;

import java.util.Set;

import com.codeparse.core.config.ParserConfig;
import com.codeparse.core.parser.impl.cfamily.CFamilyLexer.Dialect;
import com.codeparse.core.util.Languages;

/**
 * Structure parser for Java source files: packages, imports, classes, interfaces, enums,
 * records, annotation types, methods, fields, lambdas and anonymous classes.
 *
 * @since 1.0.0
 */
public class JavaSourceParser extends CFamilyParser {

    public JavaSourceParser() {
        this(ParserConfig.defaults());
    }

    public JavaSourceParser(ParserConfig config) {
        super(config);
    }

    @Override
    public String getLanguage() {
        return Languages.JAVA;
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of("java");
    }

    @Override
    protected Dialect dialect() {
        return Dialect.JAVA;
    }
}
