package com.codeparse.core.parser.impl.javascript;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.codeparse.core.ast.AstNode;
import com.codeparse.core.ast.NodeProperties;
import com.codeparse.core.ast.NodeTypes;
import com.codeparse.core.ast.ParseResult;
import com.codeparse.core.block.BlockResult;
import com.codeparse.core.block.BraceBlockParser;
import com.codeparse.core.diagnostic.WarningKind;
import com.codeparse.core.state.ContextType;
import com.codeparse.core.state.ParserState;
import com.codeparse.core.symbol.Symbol;
import com.codeparse.core.symbol.SymbolKind;
import com.codeparse.core.token.Token;

/**
 * Tests for {@link JavaScriptParser}.
 */
class JavaScriptParserTest {

    private final JavaScriptParser parser = new JavaScriptParser();

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> list(AstNode node, String key) {
        return (List<Map<String, Object>>) node.getProperty(key);
    }

    private static List<String> childTypes(AstNode node) {
        return node.getChildren().stream().map(AstNode::getNodeType).toList();
    }

    @Test
    void parse_functionWithNestedIf_buildsNestedBlocks() {
        String source = "function f() {\n  if (x) {\n    return 1;\n  }\n}";

        ParseResult result = parser.parse(source);

        assertThat(result.root().getChildren()).hasSize(1);
        AstNode function = result.root().getChildren().get(0);
        assertThat(function.getNodeType()).isEqualTo(NodeTypes.FUNCTION_DECLARATION);
        assertThat(function.getName()).isEqualTo("f");
        assertThat(function.getEndLine()).isEqualTo(5);
        AstNode body = function.firstChild(NodeTypes.BLOCK).orElseThrow();
        assertThat(childTypes(body)).containsExactly(NodeTypes.IF_STATEMENT);
        AstNode ifStatement = body.getChildren().get(0);
        assertThat(ifStatement.getProperty(NodeProperties.CONDITION)).isEqualTo("x");
        assertThat(ifStatement.firstChild(NodeTypes.BLOCK).orElseThrow().getChildren())
            .extracting(AstNode::getNodeType).containsExactly(NodeTypes.RETURN_STATEMENT);
        assertThat(result.hasWarnings()).isFalse();

        List<Token> tokens = new JavaScriptLexer(source).tokenize().tokens();
        int brace = 0;
        while (!tokens.get(brace).text().equals("{")) {
            brace++;
        }
        BlockResult block = new BraceBlockParser().parseBlock(tokens, brace, new ParserState(), ContextType.FUNCTION, null);
        assertThat(block.nextIndex()).isEqualTo(tokens.size());
        assertThat(block.terminated()).isTrue();
    }

    @Test
    void parse_extraClosingBraces_becomeErrorNodes() {
        ParseResult result = parser.parse("function f() {\n  return 1;\n}}}\nconst y = 2;\n");

        List<AstNode> children = result.root().getChildren();
        assertThat(childTypes(result.root())).containsExactly(
            NodeTypes.FUNCTION_DECLARATION, NodeTypes.ERROR_NODE, NodeTypes.ERROR_NODE, NodeTypes.VARIABLE_DECLARATION);
        assertThat(children.get(0).isUnterminated()).isFalse();
        assertThat(children.get(0).getEndLine()).isEqualTo(3);
        assertThat(children.get(1).getProperty(NodeProperties.TEXT)).isEqualTo("}");
        assertThat(result.warningsOfKind(WarningKind.UNEXPECTED_TOKEN)).hasSize(2);
        assertThat(result.symbolTable().getSymbols("module")).extracting(Symbol::name).containsExactly("f", "y");
    }

    @Test
    void parse_unterminatedString_warnsWithoutFailing() {
        ParseResult result = parser.parse("const a = 1;\nconst s = 'unclosed");

        assertThat(result.warningsOfKind(WarningKind.LEXICAL_UNTERMINATED)).hasSize(1);
        assertThat(result.symbolTable().getSymbols("module")).extracting(Symbol::name).containsExactly("a", "s");
    }

    @Test
    void parse_unclosedFunction_isMarkedUnterminated() {
        ParseResult result = parser.parse("function f() {\n  if (x) {\n    g();\n");

        AstNode function = result.root().getChildren().get(0);
        assertThat(function.isUnterminated()).isTrue();
        assertThat(result.warningsOfKind(WarningKind.STRUCTURAL_UNTERMINATED)).isNotEmpty();
        assertThat(function.findAll(NodeTypes.EXPRESSION_STATEMENT)).hasSize(1);
    }

    @Test
    void parse_arrowFunction_takesNameFromBinding() {
        ParseResult result = parser.parse("const add = (a, b = 1) => a + b;\n");

        AstNode declaration = result.root().getChildren().get(0);
        assertThat(declaration.getProperty(NodeProperties.KIND)).isEqualTo("const");
        AstNode arrow = declaration.firstChild(NodeTypes.ARROW_FUNCTION).orElseThrow();
        assertThat(arrow.getName()).isEqualTo("add");
        assertThat(arrow.getProperty(NodeProperties.VALUE)).isEqualTo("a + b");
        assertThat(list(arrow, NodeProperties.PARAMETERS).get(1)).containsEntry(NodeProperties.PARAM_DEFAULT, "1");
        assertThat(result.symbolTable().getSymbols("module/function:add"))
            .extracting(Symbol::name, Symbol::kind)
            .containsExactly(tuple("a", SymbolKind.PARAMETER), tuple("b", SymbolKind.PARAMETER));
    }

    @Test
    void parse_callbackArguments_becomeFunctionNodes() {
        ParseResult result = parser.parse("""
            items.forEach(function (item) {
              console.log(item);
            });
            button.on('click', async event => handle(event));
            """);

        assertThat(result.root().findAll(NodeTypes.FUNCTION_EXPRESSION)).hasSize(1);
        AstNode arrow = result.root().findAll(NodeTypes.ARROW_FUNCTION).get(0);
        assertThat(arrow.getProperty(NodeProperties.ASYNC)).isEqualTo(true);
        assertThat(result.symbolTable().allSymbols())
            .extracting(Symbol::name).containsExactly("item", "event");
    }

    @Test
    void parse_destructuring_bindsEveryName() {
        ParseResult result = parser.parse("const { a, b: renamed, ...rest } = obj, [x, , y = 2] = list;\n");

        assertThat(result.root().getChildren().get(0).getProperty(NodeProperties.NAMES))
            .isEqualTo(List.of("a", "renamed", "rest", "x", "y"));
    }

    @Test
    void parse_classMembers() {
        ParseResult result = parser.parse("""
            class Dog extends Animal {
              #name = 'rex';
              static create() { return new Dog(); }
              get name() { return this.#name; }
              async *stream() {}
            }
            """);

        AstNode cls = result.root().getChildren().get(0);
        assertThat(cls.getName()).isEqualTo("Dog");
        assertThat(cls.getProperty(NodeProperties.EXTENDS)).isEqualTo("Animal");
        AstNode body = cls.firstChild(NodeTypes.BLOCK).orElseThrow();
        assertThat(childTypes(body)).containsExactly(NodeTypes.FIELD_DECLARATION,
            NodeTypes.METHOD_DECLARATION, NodeTypes.METHOD_DECLARATION, NodeTypes.METHOD_DECLARATION);
        assertThat(body.getChildren().get(1).getProperty(NodeProperties.MODIFIERS)).isEqualTo(List.of("static"));
        assertThat(body.getChildren().get(2).getProperty(NodeProperties.MODIFIERS)).isEqualTo(List.of("get"));
        AstNode stream = body.getChildren().get(3);
        assertThat(stream.getProperty(NodeProperties.GENERATOR)).isEqualTo(true);
        assertThat(stream.getProperty(NodeProperties.ASYNC)).isEqualTo(true);
        assertThat(result.symbolTable().getSymbols("module/class:Dog"))
            .extracting(Symbol::name).containsExactly("#name", "create", "name", "stream");
    }

    @Test
    void parse_imports() {
        ParseResult result = parser.parse("""
            import React, { useState as useS, useEffect } from 'react';
            import * as path from "path";
            const fs = require('fs');
            """);

        List<AstNode> imports = result.root().findAll(NodeTypes.IMPORT_DECLARATION);
        assertThat(imports).extracting(node -> node.getProperty(NodeProperties.MODULE)).containsExactly("react", "path");
        assertThat(list(imports.get(0), NodeProperties.NAMES)).extracting(entry -> entry.get(NodeProperties.ALIAS))
            .containsExactly("React", "useS", null);
        assertThat(result.symbolTable().getSymbols("module"))
            .extracting(Symbol::name, Symbol::kind)
            .containsExactly(
                tuple("React", SymbolKind.IMPORT),
                tuple("useS", SymbolKind.IMPORT),
                tuple("useEffect", SymbolKind.IMPORT),
                tuple("path", SymbolKind.IMPORT),
                tuple("fs", SymbolKind.VARIABLE));
    }

    @Test
    void parse_exports() {
        ParseResult result = parser.parse("""
            export default function () {}
            export const limit = 10;
            export { a as b } from './m';
            """);

        List<AstNode> children = result.root().getChildren();
        assertThat(childTypes(result.root())).containsExactly(
            NodeTypes.FUNCTION_DECLARATION, NodeTypes.VARIABLE_DECLARATION, NodeTypes.EXPORT_DECLARATION);
        assertThat(children.get(0).getProperty(NodeProperties.MODIFIERS)).isEqualTo(List.of("export", "default"));
        assertThat(children.get(0).getName()).isNull();
        assertThat(children.get(1).getProperty(NodeProperties.MODIFIERS)).isEqualTo(List.of("export"));
        assertThat(children.get(2).getProperty(NodeProperties.SOURCE)).isEqualTo("./m");
        assertThat(list(children.get(2), NodeProperties.NAMES).get(0))
            .containsEntry(NodeProperties.NAME, "a").containsEntry(NodeProperties.ALIAS, "b");
    }

    @Test
    void parse_switchAndTry() {
        ParseResult result = parser.parse("""
            switch (kind) {
              case 'a':
                run();
                break;
              default:
                stop();
            }
            try { risky(); } catch ({ message }) { log(message); } finally { done(); }
            """);

        AstNode statement = result.root().getChildren().get(0);
        assertThat(statement.getProperty(NodeProperties.KEYWORD)).isEqualTo("switch");
        assertThat(statement.findAll(NodeTypes.CASE_CLAUSE))
            .extracting(clause -> clause.getProperty(NodeProperties.PATTERN)).containsExactly("'a'", "default");
        assertThat(result.root().getChildren()).filteredOn(node -> node.isType(NodeTypes.TRY_STATEMENT))
            .extracting(node -> node.getProperty(NodeProperties.KEYWORD)).containsExactly("try", "catch", "finally");
        assertThat(result.symbolTable().getSymbols("module")).extracting(Symbol::name).containsExactly("message");
    }

    @Test
    void parse_lineBreaks_endStatementsUnlessExpressionContinues() {
        ParseResult result = parser.parse("let a = 1\nlet b = a\n  + 2\nfoo()\n");

        assertThat(childTypes(result.root())).containsExactly(
            NodeTypes.VARIABLE_DECLARATION, NodeTypes.VARIABLE_DECLARATION, NodeTypes.EXPRESSION_STATEMENT);
        assertThat(result.root().getChildren().get(1).getProperty(NodeProperties.VALUE)).isEqualTo("a\n  + 2");
    }

    @Test
    void parse_bracesInsideLiterals_doNotAffectStructure() {
        ParseResult result = parser.parse("""
            const re = /}/g;
            const t = `${ {a: 1}.a } }`;
            // }
            /* { */
            function after() {}
            """);

        assertThat(result.root().findAll(NodeTypes.ERROR_NODE)).isEmpty();
        assertThat(result.root().findAll(NodeTypes.FUNCTION_DECLARATION)).extracting(AstNode::getName)
            .containsExactly("after");
    }

    @Test
    void parse_missingFunctionName_isRecovered() {
        ParseResult result = parser.parse("function (x) {}\nfunction ok() {}\n");

        assertThat(childTypes(result.root())).containsExactly(NodeTypes.ERROR_NODE, NodeTypes.FUNCTION_DECLARATION);
        assertThat(result.root().getChildren().get(1).getName()).isEqualTo("ok");
    }

    @Nested
    @DisplayName("recovery from malformed input")
    class Recovery {

        @Test
        void parse_strayHash_keepsFollowingFunction() {
            ParseResult result = parser.parse("#\nfunction g() {}\n");

            assertThat(result.root().findAll(NodeTypes.FUNCTION_DECLARATION)).extracting(AstNode::getName)
                .containsExactly("g");
            assertThat(result.symbolTable().getSymbols("module")).extracting(Symbol::name).containsExactly("g");
        }

        @Test
        void parse_privateMembers() {
            ParseResult result = parser.parse("""
                class Counter {
                  #count = 0;
                  static #instances = 1;
                  #inc() { this.#count++; }
                }
                """);

            AstNode body = result.root().getChildren().get(0).firstChild(NodeTypes.BLOCK).orElseThrow();
            assertThat(body.getChildren()).extracting(AstNode::getNodeType, AstNode::getName).containsExactly(
                tuple(NodeTypes.FIELD_DECLARATION, "#count"),
                tuple(NodeTypes.FIELD_DECLARATION, "#instances"),
                tuple(NodeTypes.METHOD_DECLARATION, "#inc"));
            assertThat(body.getChildren().get(0).getProperty(NodeProperties.VALUE)).isEqualTo("0");
            assertThat(body.getChildren().get(1).getProperty(NodeProperties.MODIFIERS)).isEqualTo(List.of("static"));
            assertThat(result.symbolTable().getSymbols("module/class:Counter"))
                .extracting(Symbol::name).containsExactly("#count", "#instances", "#inc");
        }

        @Test
        void parse_unclosedParameterList_keepsLaterFunction() {
            ParseResult result = parser.parse("function f( {\n  return 1;\n}\nfunction g() {}\n");

            List<AstNode> functions = result.root().findAll(NodeTypes.FUNCTION_DECLARATION);
            assertThat(functions).extracting(AstNode::getName).containsExactly("f", "g");
            assertThat(functions).extracting(AstNode::isUnterminated).containsExactly(true, false);
            assertThat(functions.get(1).getLine()).isEqualTo(4);
            assertThat(result.symbolTable().getSymbols("module"))
                .extracting(Symbol::name, Symbol::kind)
                .containsExactly(tuple("f", SymbolKind.FUNCTION), tuple("g", SymbolKind.FUNCTION));
            assertThat(result.warningsOfKind(WarningKind.STRUCTURAL_UNTERMINATED))
                .extracting(warning -> warning.message())
                .contains("Unclosed parameter list of function 'f'");
        }

        @Test
        void parse_unclosedCall_stopsAtNextDeclaration() {
            ParseResult result = parser.parse("const x = foo(\nfunction g() {}\nclass K {}\n");

            assertThat(result.root().findAll(NodeTypes.FUNCTION_DECLARATION)).extracting(AstNode::getName)
                .containsExactly("g");
            assertThat(result.root().findAll(NodeTypes.CLASS_DECLARATION)).extracting(AstNode::getName)
                .containsExactly("K");
        }

        @Test
        void parse_multiLineCall_isNotSplitAtNestedFunction() {
            ParseResult result = parser.parse("app.use(\n  function handler() {}\n);\nfunction after() {}\n");

            assertThat(result.root().getChildren()).hasSize(2);
            assertThat(result.root().getChildren().get(1).getName()).isEqualTo("after");
            assertThat(result.warningsOfKind(WarningKind.STRUCTURAL_UNTERMINATED)).isEmpty();
        }
    }
}
