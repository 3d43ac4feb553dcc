package com.codeparse.cli;

import java.util.Optional;

import com.codeparse.core.ast.AstNode;
import com.codeparse.core.ast.ParseResult;
import com.codeparse.core.query.AstQueries;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Command to locate a declaration by name, or the function that encloses a line.
 *
 * <p>Exits with 0 when something was found and 2 when the file parsed but nothing matched.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codeparse find src/app.py --name Service.handle
 * codeparse find src/app.py --line 42
 * }</pre>
 */
@Command(
    name = "find",
    description = "Find a declaration by name or the function enclosing a line",
    mixinStandardHelpOptions = true
)
public class FindCommand extends SourceCommand {

    static final int NOT_FOUND = 2;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private Target target;

    static class Target {
        @Option(names = {"-n", "--name"}, description = "Declaration name, optionally dotted (Outer.method)")
        String name;

        @Option(names = "--line", description = "1-based line number")
        Integer line;
    }

    @Override
    protected int render(ParseResult result) {
        Optional<AstNode> match = target.name != null
            ? AstQueries.findByName(result.root(), target.name)
            : AstQueries.findFunctionAtLine(result.root(), target.line);

        if (match.isEmpty()) {
            err().println("✗ No match for " + (target.name != null ? "'" + target.name + "'" : "line " + target.line));
            return NOT_FOUND;
        }
        AstNode node = match.get();
        out().printf("%s %s [%d-%d]%n", node.getNodeType(), AstQueries.fullName(node), node.getLine(), node.getEndLine());
        out().flush();
        return 0;
    }
}
