package com.codeparse.core.parser.impl.cfamily;

import java.util.Set;

import com.codeparse.core.config.ParserConfig;
import com.codeparse.core.parser.impl.cfamily.CFamilyLexer.Dialect;
import com.codeparse.core.util.Languages;

/**
 * Structure parser for C++.
 *
 * <p>Adds namespaces, templates, {@code using} declarations, access specifiers, out-of-line
 * member definitions ({@code Foo::bar}) and lambdas to the C grammar.
 *
 * @since 1.0.0
 */
public class CppParser extends CFamilyParser {

    public CppParser() {
        this(ParserConfig.defaults());
    }

    public CppParser(ParserConfig config) {
        super(config);
    }

    @Override
    public String getLanguage() {
        return Languages.CPP;
    }

    @Override
    public Set<String> getAliases() {
        return Set.of("c++", "cxx", "cc");
    }

    @Override
    public Set<String> getFileExtensions() {
        return Set.of("cpp", "cc", "cxx", "hpp", "hh", "hxx");
    }

    @Override
    protected Dialect dialect() {
        return Dialect.CPP;
    }
}
