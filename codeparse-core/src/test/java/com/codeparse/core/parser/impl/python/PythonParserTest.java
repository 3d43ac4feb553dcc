package com.codeparse.core.parser.impl.python;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.codeparse.core.ast.AstNode;
import com.codeparse.core.ast.NodeProperties;
import com.codeparse.core.ast.NodeTypes;
import com.codeparse.core.ast.ParseResult;
import com.codeparse.core.config.ParserConfig;
import com.codeparse.core.config.ParserConfig.DecoratorOrder;
import com.codeparse.core.diagnostic.ParseWarning;
import com.codeparse.core.diagnostic.WarningKind;
import com.codeparse.core.symbol.Symbol;
import com.codeparse.core.symbol.SymbolKind;

/**
 * Tests for {@link PythonParser}.
 */
class PythonParserTest {

    private final PythonParser parser = new PythonParser();

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> parameters(AstNode function) {
        return (List<Map<String, Object>>) function.getProperty(NodeProperties.PARAMETERS);
    }

    @Test
    void parse_functionWithDefault_recordsParametersBodyAndSymbol() {
        ParseResult result = parser.parse("def f(a, b=10):\n    return a*b\n");

        AstNode root = result.root();
        assertThat(root.getChildren()).hasSize(1);
        AstNode function = root.getChildren().get(0);
        assertThat(function.getNodeType()).isEqualTo(NodeTypes.FUNCTION_DECLARATION);
        assertThat(function.getName()).isEqualTo("f");
        assertThat(function.getLine()).isEqualTo(1);
        assertThat(function.getEndLine()).isEqualTo(2);
        assertThat(parameters(function)).extracting(p -> p.get(NodeProperties.PARAM_NAME)).containsExactly("a", "b");
        assertThat(parameters(function).get(0)).doesNotContainKey(NodeProperties.PARAM_DEFAULT);
        assertThat(parameters(function).get(1)).containsEntry(NodeProperties.PARAM_DEFAULT, "10");

        AstNode body = function.firstChild(NodeTypes.BLOCK).orElseThrow();
        assertThat(body.getChildren()).hasSize(1);
        AstNode statement = body.getChildren().get(0);
        assertThat(statement.getNodeType()).isEqualTo(NodeTypes.RETURN_STATEMENT);
        assertThat(statement.getLine()).isEqualTo(2);
        assertThat(statement.getProperty(NodeProperties.VALUE)).isEqualTo("a*b");

        assertThat(result.symbolTable().getSymbols("module"))
            .extracting(Symbol::name, Symbol::kind)
            .containsExactly(tuple("f", SymbolKind.FUNCTION));
        assertThat(result.symbolTable().getSymbols("module/function:f"))
            .extracting(Symbol::name).containsExactly("a", "b");
        assertThat(result.hasWarnings()).isFalse();
    }

    @Test
    void parse_unterminatedString_warnsWithoutFailing() {
        ParseResult result = parser.parse("x = 1\ny = 'unclosed");

        assertThat(result.warningsOfKind(WarningKind.LEXICAL_UNTERMINATED)).hasSize(1);
        assertThat(result.root().getProperty(NodeProperties.WARNINGS)).asInstanceOf(InstanceOfAssertFactories.LIST).hasSize(1);
        assertThat(result.symbolTable().getSymbols("module")).extracting(Symbol::name).containsExactly("x", "y");
    }

    @Test
    void parse_classWithMethods_marksMethodsAndScopes() {
        ParseResult result = parser.parse("""
            class Greeter(Base, metaclass=Meta):
                greeting = "hi"

                def greet(self, name: str = 'x') -> str:
                    return self.greeting + name

                async def close(self):
                    pass
            """);

        AstNode cls = result.root().getChildren().get(0);
        assertThat(cls.getNodeType()).isEqualTo(NodeTypes.CLASS_DECLARATION);
        assertThat(cls.getProperty(NodeProperties.BASES)).isEqualTo(List.of("Base"));
        assertThat(cls.getProperty(NodeProperties.METACLASS)).isEqualTo("Meta");

        List<AstNode> methods = cls.findAll(NodeTypes.METHOD_DECLARATION);
        assertThat(methods).extracting(AstNode::getName).containsExactly("greet", "close");
        AstNode greet = methods.get(0);
        assertThat(greet.getProperty(NodeProperties.RETURN_TYPE)).isEqualTo("str");
        assertThat(parameters(greet).get(1))
            .containsEntry(NodeProperties.PARAM_ANNOTATION, "str")
            .containsEntry(NodeProperties.PARAM_DEFAULT, "'x'");
        assertThat(methods.get(1).getProperty(NodeProperties.ASYNC)).isEqualTo(true);

        assertThat(result.symbolTable().getSymbols("module/class:Greeter"))
            .extracting(Symbol::name, Symbol::kind)
            .containsExactly(
                tuple("greeting", SymbolKind.VARIABLE),
                tuple("greet", SymbolKind.METHOD),
                tuple("close", SymbolKind.METHOD));
        assertThat(result.symbolTable().parentOf("module/class:Greeter/function:greet"))
            .contains("module/class:Greeter");
    }

    @Test
    void parse_stackedDecorators_keepSourceOrderByDefault() {
        String source = "@app.route('/x')\n@login_required\ndef view():\n    pass\n";

        AstNode view = parser.parse(source).root().getChildren().get(0);

        assertThat(view.getProperty(NodeProperties.DECORATORS))
            .isEqualTo(List.of("app.route('/x')", "login_required"));
    }

    @Test
    void parse_stackedDecorators_applicationOrder() {
        PythonParser configured = new PythonParser(
            ParserConfig.defaults().withDecorators(DecoratorOrder.APPLICATION, true));

        AstNode view = configured.parse("@outer\n@inner\ndef view():\n    pass\n").root().getChildren().get(0);

        assertThat(view.getProperty(NodeProperties.DECORATORS)).isEqualTo(List.of("inner", "outer"));
    }

    @Test
    void parse_blankLineAfterDecorator_dependsOnConfiguration() {
        String source = "@cached\n\ndef load():\n    pass\n";

        AstNode lenient = parser.parse(source).root().getChildren().get(0);
        assertThat(lenient.getProperty(NodeProperties.DECORATORS)).isEqualTo(List.of("cached"));

        ParseResult strict = new PythonParser(ParserConfig.defaults().withDecorators(DecoratorOrder.SOURCE, false))
            .parse(source);
        assertThat(strict.root().getChildren()).extracting(AstNode::getNodeType)
            .containsExactly(NodeTypes.ERROR_NODE, NodeTypes.FUNCTION_DECLARATION);
        assertThat(strict.root().getChildren().get(1).hasProperty(NodeProperties.DECORATORS)).isFalse();
        assertThat(strict.warningsOfKind(WarningKind.UNEXPECTED_TOKEN)).hasSize(1);
    }

    @Test
    void parse_danglingDecoratorAtEnd_becomesErrorNode() {
        ParseResult result = parser.parse("x = 1\n@orphan\n");

        assertThat(result.root().getChildren()).extracting(AstNode::getNodeType)
            .containsExactly(NodeTypes.VARIABLE_DECLARATION, NodeTypes.ERROR_NODE);
    }

    @Test
    void parse_imports_registerBindings() {
        ParseResult result = parser.parse("import os.path as p, sys\nfrom .models import (User as U,\n    Group)\n");

        List<AstNode> imports = result.root().findAll(NodeTypes.IMPORT_DECLARATION);
        assertThat(imports).hasSize(2);
        assertThat(imports.get(1).getProperty(NodeProperties.MODULE)).isEqualTo(".models");
        assertThat(result.symbolTable().getSymbols("module"))
            .extracting(Symbol::name).containsExactly("p", "sys", "U", "Group");
        assertThat(result.symbolTable().getSymbols("module"))
            .allMatch(symbol -> symbol.kind() == SymbolKind.IMPORT);
    }

    @Test
    void parse_compoundStatements_nestAsSiblingsAndChildren() {
        ParseResult result = parser.parse("""
            def check(items):
                for i, item in enumerate(items):
                    if item:
                        continue
                    elif i > 3:
                        break
                    else:
                        pass
                try:
                    run()
                except ValueError as error:
                    log(error)
            """);

        AstNode body = result.root().getChildren().get(0).firstChild(NodeTypes.BLOCK).orElseThrow();
        assertThat(body.getChildren()).extracting(AstNode::getNodeType)
            .containsExactly(NodeTypes.LOOP_STATEMENT, NodeTypes.TRY_STATEMENT, NodeTypes.TRY_STATEMENT);
        AstNode loopBody = body.getChildren().get(0).firstChild(NodeTypes.BLOCK).orElseThrow();
        assertThat(loopBody.getChildren()).extracting(AstNode::getNodeType)
            .containsExactly(NodeTypes.IF_STATEMENT, NodeTypes.IF_STATEMENT, NodeTypes.BLOCK_STATEMENT);
        assertThat(result.symbolTable().getSymbols("module/function:check"))
            .extracting(Symbol::name).containsExactly("items", "i", "item", "error");
    }

    @Test
    void parse_matchStatement_softKeywords() {
        ParseResult result = parser.parse("""
            match = pattern.match(text)
            match command:
                case "go":
                    go()
                case _:
                    stop()
            """);

        List<AstNode> children = result.root().getChildren();
        assertThat(children).extracting(AstNode::getNodeType)
            .containsExactly(NodeTypes.VARIABLE_DECLARATION, NodeTypes.MATCH_STATEMENT);
        AstNode match = children.get(1);
        assertThat(match.getProperty(NodeProperties.SUBJECT)).isEqualTo("command");
        assertThat(match.findAll(NodeTypes.CASE_CLAUSE))
            .extracting(arm -> arm.getProperty(NodeProperties.PATTERN))
            .containsExactly("\"go\"", "_");
    }

    @Test
    void parse_walrus_declaresVariable() {
        ParseResult result = parser.parse("if (n := len(a)) > 10:\n    print(n)\n");

        AstNode statement = result.root().getChildren().get(0);
        assertThat(statement.firstChild(NodeTypes.NAMED_EXPRESSION)).isPresent();
        assertThat(result.symbolTable().getSymbols("module")).extracting(Symbol::name).containsExactly("n");
    }

    @Test
    void parse_unterminatedFunction_isFlagged() {
        ParseResult result = parser.parse("def broken():\n");

        AstNode function = result.root().getChildren().get(0);
        assertThat(function.isUnterminated()).isTrue();
        assertThat(result.warningsOfKind(WarningKind.STRUCTURAL_UNTERMINATED)).hasSize(1);
    }

    @Test
    void parse_unclosedBracket_isReported() {
        ParseResult result = parser.parse("values = compute(1,\n    2,\n");

        assertThat(result.warningsOfKind(WarningKind.STRUCTURAL_UNTERMINATED))
            .extracting(ParseWarning::line).containsExactly(1);
    }

    @Test
    void parse_malformedHeaders_recoverOnNextLine() {
        ParseResult result = parser.parse("def (x):\n    pass\nclass\ndef ok():\n    return 1\n");

        assertThat(result.root().findAll(NodeTypes.ERROR_NODE)).hasSizeGreaterThanOrEqualTo(2);
        assertThat(result.root().findAll(NodeTypes.FUNCTION_DECLARATION)).extracting(AstNode::getName)
            .containsExactly("ok");
    }

    @Test
    void parse_tabWidth_changesBlockMembership() {
        String source = "class A:\n    def f(self):\n\tpass\n";

        ParseResult wide = parser.parse(source);
        ParseResult narrow = new PythonParser(ParserConfig.defaults().withTabWidth(4)).parse(source);

        assertThat(wide.warningsOfKind(WarningKind.AMBIGUOUS_INDENTATION)).isNotEmpty();
        assertThat(narrow.warningsOfKind(WarningKind.UNEXPECTED_TOKEN)).isNotEmpty();
    }

    @Test
    void parse_manyTopLevelFunctions_allReachSymbolTable() {
        StringBuilder source = new StringBuilder();
        for (int i = 0; i < 50; i++) {
            source.append("def f").append(i).append("():\n    return ").append(i).append("\n\n");
        }

        ParseResult result = parser.parse(source.toString());

        assertThat(result.root().getChildren()).hasSize(50);
        assertThat(result.symbolTable().getSymbols("module")).hasSize(50)
            .allMatch(symbol -> symbol.kind() == SymbolKind.FUNCTION);
    }

    @Test
    void parse_tokenIndices_onlyWhenConfigured() {
        String source = "def f():\n    pass\n";

        AstNode plain = parser.parse(source).root().getChildren().get(0);
        AstNode indexed = new PythonParser(ParserConfig.defaults().withTokenIndices(true))
            .parse(source).root().getChildren().get(0);

        assertThat(plain.hasProperty(NodeProperties.START_INDEX)).isFalse();
        assertThat(indexed.getProperty(NodeProperties.START_INDEX)).isEqualTo(0);
        assertThat(indexed.hasProperty(NodeProperties.END_INDEX)).isTrue();
    }

    @Test
    void parseFile_readsUtf8(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("greet.py");
        Files.writeString(file, "def grüße():\n    return 'ö'\n");

        ParseResult result = parser.parseFile(file);

        assertThat(result.root().getChildren().get(0).getName()).isEqualTo("grüße");
    }

    @Test
    void parseFile_invalidUtf8_warnsAndKeepsDefinitions(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("latin1.py");
        byte[] head = "def first():\n    pass\n# caf".getBytes(StandardCharsets.UTF_8);
        byte[] tail = "\ndef second():\n    pass\n".getBytes(StandardCharsets.UTF_8);
        byte[] bytes = new byte[head.length + 1 + tail.length];
        System.arraycopy(head, 0, bytes, 0, head.length);
        bytes[head.length] = (byte) 0xE9;
        System.arraycopy(tail, 0, bytes, head.length + 1, tail.length);
        Files.write(file, bytes);

        ParseResult result = parser.parseFile(file);

        assertThat(result.warningsOfKind(WarningKind.MALFORMED_ENCODING)).singleElement().satisfies(warning -> {
            assertThat(warning.message()).contains("latin1.py is not valid UTF-8");
            assertThat(warning.line()).isEqualTo(3);
            assertThat(warning.column()).isEqualTo(6);
        });
        assertThat(result.root().getChildren()).extracting(AstNode::getName).containsExactly("first", "second");
    }

    @Nested
    @DisplayName("unclosed brackets")
    class UnclosedBrackets {

        @Test
        void parse_unclosedParameterList_keepsLaterDefinitions() {
            ParseResult result = parser.parse("def f(:\n    pass\n\nclass C:\n    pass\n\ndef g():\n    pass\n");

            assertThat(result.root().getChildren()).extracting(AstNode::getName).containsExactly("f", "C", "g");
            assertThat(result.root().getChildren()).extracting(AstNode::isUnterminated).containsExactly(true, false, false);
            assertThat(result.symbolTable().getSymbols("module"))
                .extracting(Symbol::name, Symbol::kind)
                .containsExactly(tuple("f", SymbolKind.FUNCTION), tuple("C", SymbolKind.CLASS), tuple("g", SymbolKind.FUNCTION));
            assertThat(result.warningsOfKind(WarningKind.STRUCTURAL_UNTERMINATED))
                .extracting(ParseWarning::message, ParseWarning::line)
                .containsExactly(tuple("Unclosed '('", 1));
        }

        @Test
        void parse_unclosedCall_stopsAtNextDefinition() {
            ParseResult result = parser.parse("x = foo(\ndef g():\n    pass\n");

            assertThat(result.root().findAll(NodeTypes.FUNCTION_DECLARATION)).singleElement().satisfies(function -> {
                assertThat(function.getName()).isEqualTo("g");
                assertThat(function.getLine()).isEqualTo(2);
                assertThat(function.isUnterminated()).isFalse();
            });
            assertThat(result.symbolTable().getSymbols("module")).extracting(Symbol::name).contains("g");
        }

        @Test
        void parse_unclosedBracketInMethod_keepsSiblingMethod() {
            ParseResult result = parser.parse("""
                class Service:
                    def load(self):
                        items = [
                    def save(self):
                        pass
                """);

            AstNode service = result.root().getChildren().get(0);
            assertThat(service.findAll(NodeTypes.METHOD_DECLARATION)).extracting(AstNode::getName)
                .containsExactly("load", "save");
            assertThat(result.warningsOfKind(WarningKind.STRUCTURAL_UNTERMINATED)).extracting(ParseWarning::message)
                .containsExactly("Unclosed '['");
        }

        @Test
        void parse_closedMultiLineBracket_isOneStatement() {
            ParseResult result = parser.parse("values = [\n    1,\n    2,\n]\n\ndef g():\n    pass\n");

            assertThat(result.warnings()).isEmpty();
            assertThat(result.root().getChildren()).hasSize(2);
            assertThat(result.root().getChildren().get(1).getName()).isEqualTo("g");
        }
    }
}
