package com.codeparse.cli;

import java.util.List;
import java.util.Map;

import com.codeparse.core.ast.ParseResult;
import com.codeparse.core.symbol.Symbol;
import picocli.CommandLine.Command;

/**
 * Command to print the symbols a source file declares, grouped by scope.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codeparse symbols src/app.py
 * }</pre>
 */
@Command(
    name = "symbols",
    description = "Print the symbol table of a source file",
    mixinStandardHelpOptions = true
)
public class SymbolsCommand extends SourceCommand {

    @Override
    protected int render(ParseResult result) {
        Map<String, List<Symbol>> byScope = result.symbolTable().getSymbolsByScope();
        for (Map.Entry<String, List<Symbol>> scope : byScope.entrySet()) {
            String parent = result.symbolTable().parentOf(scope.getKey()).orElse("-");
            out().printf("%s (parent: %s)%n", scope.getKey(), parent);
            for (Symbol symbol : scope.getValue()) {
                out().printf("  %-12s %s  %d:%d%n",
                    symbol.kind().name().toLowerCase(), symbol.name(), symbol.line(), symbol.column());
            }
        }
        out().flush();
        return 0;
    }
}
