package com.codeparse.core.parser.impl.cfamily;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.codeparse.core.ast.AstNode;
import com.codeparse.core.ast.NodeProperties;
import com.codeparse.core.ast.NodeTypes;
import com.codeparse.core.ast.ParseResult;
import com.codeparse.core.diagnostic.WarningKind;
import com.codeparse.core.symbol.Symbol;
import com.codeparse.core.symbol.SymbolKind;

/**
 * Tests for the C, C++ and Java parsers built on {@link CFamilyParser}.
 */
class CFamilyParserTest {

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> list(AstNode node, String key) {
        return (List<Map<String, Object>>) node.getProperty(key);
    }

    private static List<String> childTypes(AstNode node) {
        return node.getChildren().stream().map(AstNode::getNodeType).toList();
    }

    private static String scopeOf(AstNode node) {
        return (String) node.getProperty(NodeProperties.SCOPE_ID);
    }

    @Nested
    class C {

        private final CParser parser = new CParser();

        @Test
        void parse_translationUnit() {
            ParseResult result = parser.parse("""
                #include <stdio.h>
                #define MAX(a, b) \\
                    ((a) > (b) ? (a) : (b))

                typedef struct {
                    int x;
                    int y;
                } Point;

                struct Node {
                    int value;
                    struct Node *next;
                };

                static int add(int a, int b) {
                    return a + b;
                }

                int main(void) {
                    Point p = {1, 2};
                    for (int i = 0; i < MAX(1, 2); i++) {
                        p.x += add(i, p.y);
                    }
                    return 0;
                }
                """);

            assertThat(childTypes(result.root())).containsExactly(
                NodeTypes.PREPROCESSOR_DIRECTIVE, NodeTypes.PREPROCESSOR_DIRECTIVE,
                NodeTypes.CLASS_DECLARATION, NodeTypes.TYPE_ALIAS_DECLARATION,
                NodeTypes.CLASS_DECLARATION, NodeTypes.FUNCTION_DECLARATION, NodeTypes.FUNCTION_DECLARATION);
            List<AstNode> children = result.root().getChildren();

            assertThat(children.get(0).getProperty(NodeProperties.MODULE)).isEqualTo("stdio.h");
            assertThat(children.get(1).getName()).isEqualTo("MAX");
            assertThat(children.get(1).getEndLine()).isEqualTo(3);

            AstNode point = children.get(2);
            assertThat(point.getName()).isEqualTo("Point");
            assertThat(point.getProperty(NodeProperties.KIND)).isEqualTo("struct");
            assertThat(point.findAll(NodeTypes.FIELD_DECLARATION)).extracting(AstNode::getName).containsExactly("x", "y");
            assertThat(children.get(3).getProperty(NodeProperties.VALUE)).isEqualTo("struct Point");

            AstNode next = children.get(4).findAll(NodeTypes.FIELD_DECLARATION).get(1);
            assertThat(next.getName()).isEqualTo("next");
            assertThat(next.getProperty(NodeProperties.TYPE)).isEqualTo("struct Node *");

            AstNode add = children.get(5);
            assertThat(add.getName()).isEqualTo("add");
            assertThat(add.getProperty(NodeProperties.RETURN_TYPE)).isEqualTo("int");
            assertThat(add.getProperty(NodeProperties.MODIFIERS)).isEqualTo(List.of("static"));
            assertThat(list(add, NodeProperties.PARAMETERS))
                .extracting(p -> p.get(NodeProperties.PARAM_NAME), p -> p.get(NodeProperties.PARAM_ANNOTATION))
                .containsExactly(tuple("a", "int"), tuple("b", "int"));

            AstNode main = children.get(6);
            assertThat(list(main, NodeProperties.PARAMETERS)).isEmpty();
            assertThat(main.findAll(NodeTypes.LOOP_STATEMENT)).hasSize(1);
            assertThat(main.findAll(NodeTypes.RETURN_STATEMENT)).extracting(n -> n.getProperty(NodeProperties.VALUE))
                .containsExactly("0");

            assertThat(result.symbolTable().getSymbols("module"))
                .extracting(Symbol::name, Symbol::kind)
                .containsExactly(tuple("Point", SymbolKind.TYPE_ALIAS), tuple("Node", SymbolKind.CLASS),
                    tuple("add", SymbolKind.FUNCTION), tuple("main", SymbolKind.FUNCTION));
            assertThat(result.symbolTable().getSymbols(scopeOf(main))).extracting(Symbol::name).containsExactly("p", "i");
            assertThat(result.hasWarnings()).isFalse();
        }

        @Test
        void parse_prototypeAndUnclosedFunction() {
            ParseResult result = parser.parse("int compute(int x);\nvoid broken(void) {\n  if (x) {\n    compute(1);\n");

            List<AstNode> functions = result.root().getChildren();
            assertThat(functions).extracting(AstNode::getName).containsExactly("compute", "broken");
            assertThat(functions.get(0).getProperty(NodeProperties.KIND)).isEqualTo("prototype");
            assertThat(functions.get(1).isUnterminated()).isTrue();
            assertThat(result.warningsOfKind(WarningKind.STRUCTURAL_UNTERMINATED)).isNotEmpty();
        }
    }

    @Nested
    class Cpp {

        private final CppParser parser = new CppParser();

        @Test
        void parse_namespaceWithTemplateClassAndOutOfLineMethod() {
            ParseResult result = parser.parse("""
                #include <vector>
                namespace geo::shapes {

                template <typename T>
                class Shape : public Base, private Drawable {
                public:
                    Shape(int sides) : sides_(sides) {}
                    virtual ~Shape() = default;
                    virtual double area() const = 0;
                private:
                    int sides_;
                };

                double Circle::area() const {
                    auto scale = [&](double f) -> double { return f * 2; };
                    switch (kind) {
                    case 1:
                        return scale(r);
                    default:
                        break;
                    }
                    return 0;
                }

                }
                using Points = std::vector<int>;
                """);

            assertThat(childTypes(result.root())).containsExactly(NodeTypes.PREPROCESSOR_DIRECTIVE,
                NodeTypes.NAMESPACE_DECLARATION, NodeTypes.TYPE_ALIAS_DECLARATION);
            AstNode namespace = result.root().getChildren().get(1);
            assertThat(namespace.getName()).isEqualTo("geo::shapes");

            AstNode shape = namespace.findAll(NodeTypes.CLASS_DECLARATION).get(0);
            assertThat(shape.getProperty(NodeProperties.TYPE_PARAMETERS)).isEqualTo(List.of("typename T"));
            assertThat(shape.getProperty(NodeProperties.BASES)).isEqualTo(List.of("Base", "Drawable"));
            List<AstNode> members = shape.findAll(NodeTypes.METHOD_DECLARATION);
            assertThat(members).extracting(AstNode::getName).containsExactly("Shape", "~Shape", "area");
            assertThat(members.get(0).hasProperty(NodeProperties.RETURN_TYPE)).isFalse();
            assertThat(members.get(1).getProperty(NodeProperties.KIND)).isEqualTo("prototype");
            assertThat(members.get(1).getProperty(NodeProperties.MODIFIERS)).isEqualTo(List.of("virtual"));
            assertThat(members.get(2).getProperty(NodeProperties.RETURN_TYPE)).isEqualTo("double");
            assertThat(result.symbolTable().getSymbols(scopeOf(shape))).extracting(Symbol::name, Symbol::kind)
                .containsExactly(tuple("Shape", SymbolKind.METHOD), tuple("~Shape", SymbolKind.METHOD),
                    tuple("area", SymbolKind.METHOD), tuple("sides_", SymbolKind.VARIABLE));

            AstNode area = namespace.getChildren().get(0).getChildren().stream()
                .filter(node -> node.isType(NodeTypes.METHOD_DECLARATION))
                .findFirst().orElseThrow();
            assertThat(area.getProperty(NodeProperties.QUALIFIER)).isEqualTo("Circle");
            AstNode lambda = area.findAll(NodeTypes.ARROW_FUNCTION).get(0);
            assertThat(lambda.getProperty(NodeProperties.CAPTURES)).isEqualTo("&");
            assertThat(lambda.getProperty(NodeProperties.RETURN_TYPE)).isEqualTo("double");
            assertThat(area.findAll(NodeTypes.CASE_CLAUSE)).extracting(n -> n.getProperty(NodeProperties.PATTERN))
                .containsExactly("1", "default");

            AstNode points = result.root().getChildren().get(2);
            assertThat(points.getName()).isEqualTo("Points");
            assertThat(points.getProperty(NodeProperties.VALUE)).isEqualTo("std::vector<int>");
            assertThat(result.symbolTable().getSymbols("module")).extracting(Symbol::name, Symbol::kind)
                .containsExactly(tuple("geo::shapes", SymbolKind.NAMESPACE), tuple("Points", SymbolKind.TYPE_ALIAS));
            assertThat(result.symbolTable().getSymbols(scopeOf(namespace))).extracting(Symbol::name)
                .containsExactly("Shape", "area");
            assertThat(result.hasWarnings()).isFalse();
        }
    }

    @Nested
    class Java {

        private final JavaSourceParser parser = new JavaSourceParser();

        @Test
        void parse_classWithMembersLambdasAndAnonymousClass() {
            ParseResult result = parser.parse("""
                package com.example.app;

                import java.util.List;
                import static java.util.Objects.requireNonNull;

                @Service
                public class OrderService extends BaseService implements Closeable, Runnable {

                    private final List<String> names = new ArrayList<>();
                    private int count;

                    public OrderService(Repository repository) {
                        super(repository);
                    }

                    @Override
                    public <T extends Comparable<T>> T max(List<T> items) {
                        items.forEach(item -> count++);
                        return items.get(0);
                    }

                    public void run() {
                        Runnable task = new Runnable() {
                            @Override
                            public void run() {
                            }
                        };
                    }
                }
                """);

            List<AstNode> children = result.root().getChildren();
            assertThat(childTypes(result.root())).containsExactly(NodeTypes.NAMESPACE_DECLARATION,
                NodeTypes.IMPORT_DECLARATION, NodeTypes.IMPORT_DECLARATION, NodeTypes.CLASS_DECLARATION);
            assertThat(children.get(0).getName()).isEqualTo("com.example.app");
            assertThat(children.get(2).getProperty(NodeProperties.MODIFIERS)).isEqualTo(List.of("static"));
            assertThat(children.get(2).getProperty(NodeProperties.MODULE)).isEqualTo("java.util.Objects.requireNonNull");

            AstNode service = children.get(3);
            assertThat(service.getProperty(NodeProperties.DECORATORS)).isEqualTo(List.of("Service"));
            assertThat(service.getProperty(NodeProperties.MODIFIERS)).isEqualTo(List.of("public"));
            assertThat(service.getProperty(NodeProperties.EXTENDS)).isEqualTo("BaseService");
            assertThat(service.getProperty(NodeProperties.IMPLEMENTS)).isEqualTo(List.of("Closeable", "Runnable"));

            List<AstNode> fields = service.findAll(NodeTypes.FIELD_DECLARATION);
            assertThat(fields).extracting(AstNode::getName).containsExactly("names", "count");
            assertThat(fields.get(0).getProperty(NodeProperties.TYPE)).isEqualTo("List<String>");
            assertThat(fields.get(0).getProperty(NodeProperties.MODIFIERS)).isEqualTo(List.of("private", "final"));

            List<AstNode> methods = service.findAll(NodeTypes.METHOD_DECLARATION);
            assertThat(methods).extracting(AstNode::getName).containsExactly("OrderService", "max", "run", "run");
            AstNode max = methods.get(1);
            assertThat(max.getProperty(NodeProperties.TYPE_PARAMETERS)).isEqualTo(List.of("T extends Comparable<T>"));
            assertThat(max.getProperty(NodeProperties.RETURN_TYPE)).isEqualTo("T");
            assertThat(max.getProperty(NodeProperties.DECORATORS)).isEqualTo(List.of("Override"));
            AstNode lambda = max.findAll(NodeTypes.ARROW_FUNCTION).get(0);
            assertThat(lambda.getProperty(NodeProperties.VALUE)).isEqualTo("count++");
            assertThat(result.symbolTable().getSymbols(scopeOf(lambda))).extracting(Symbol::name).containsExactly("item");

            AstNode anonymous = methods.get(2).findAll(NodeTypes.CLASS_DECLARATION).get(0);
            assertThat(anonymous.getProperty(NodeProperties.KIND)).isEqualTo("anonymous");
            assertThat(anonymous.getProperty(NodeProperties.EXTENDS)).isEqualTo("Runnable");

            assertThat(result.symbolTable().getSymbols("module")).extracting(Symbol::name, Symbol::kind)
                .containsExactly(tuple("com.example.app", SymbolKind.NAMESPACE), tuple("List", SymbolKind.IMPORT),
                    tuple("requireNonNull", SymbolKind.IMPORT), tuple("OrderService", SymbolKind.CLASS));
            assertThat(result.symbolTable().getSymbols(scopeOf(service))).extracting(Symbol::name)
                .containsExactly("names", "count", "OrderService", "max", "run");
            assertThat(result.hasWarnings()).isFalse();
        }

        @Test
        void parse_enumRecordAndInterface() {
            ParseResult result = parser.parse("""
                public enum Level {
                    LOW("l"), HIGH("h");

                    private final String code;

                    Level(String code) {
                        this.code = code;
                    }
                }

                record Pair<A, B>(A first, B second) implements Serializable {
                    public A left() {
                        return first;
                    }
                }

                @FunctionalInterface
                interface Mapper<T> extends Function<T, T>, Marker {
                    T apply(T value);

                    default Mapper<T> andThen() {
                        return value -> apply(value);
                    }
                }
                """);

            List<AstNode> types = result.root().getChildren();
            assertThat(types).extracting(AstNode::getNodeType).containsExactly(NodeTypes.ENUM_DECLARATION,
                NodeTypes.CLASS_DECLARATION, NodeTypes.INTERFACE_DECLARATION);

            AstNode level = types.get(0);
            assertThat(list(level, NodeProperties.MEMBERS))
                .extracting(m -> m.get(NodeProperties.NAME), m -> m.get(NodeProperties.VALUE))
                .containsExactly(tuple("LOW", "\"l\""), tuple("HIGH", "\"h\""));
            assertThat(result.symbolTable().getSymbols(scopeOf(level))).extracting(Symbol::name, Symbol::kind)
                .containsExactly(tuple("LOW", SymbolKind.ENUM_MEMBER), tuple("HIGH", SymbolKind.ENUM_MEMBER),
                    tuple("code", SymbolKind.VARIABLE), tuple("Level", SymbolKind.METHOD));

            AstNode pair = types.get(1);
            assertThat(pair.getProperty(NodeProperties.KIND)).isEqualTo("record");
            assertThat(pair.getProperty(NodeProperties.TYPE_PARAMETERS)).isEqualTo(List.of("A", "B"));
            assertThat(pair.getProperty(NodeProperties.IMPLEMENTS)).isEqualTo(List.of("Serializable"));
            assertThat(list(pair, NodeProperties.PARAMETERS)).extracting(p -> p.get(NodeProperties.PARAM_NAME))
                .containsExactly("first", "second");

            AstNode mapper = types.get(2);
            assertThat(mapper.getProperty(NodeProperties.DECORATORS)).isEqualTo(List.of("FunctionalInterface"));
            assertThat(mapper.getProperty(NodeProperties.EXTENDS)).isEqualTo(List.of("Function<T, T>", "Marker"));
            List<AstNode> methods = mapper.findAll(NodeTypes.METHOD_DECLARATION);
            assertThat(methods).extracting(AstNode::getName).containsExactly("apply", "andThen");
            assertThat(methods.get(0).getProperty(NodeProperties.KIND)).isEqualTo("prototype");
            assertThat(methods.get(1).getProperty(NodeProperties.MODIFIERS)).isEqualTo(List.of("default"));
            assertThat(methods.get(1).getProperty(NodeProperties.RETURN_TYPE)).isEqualTo("Mapper<T>");
            assertThat(methods.get(1).findAll(NodeTypes.ARROW_FUNCTION)).hasSize(1);
            assertThat(result.hasWarnings()).isFalse();
        }

        @Test
        void parse_strayClosingBrace_recoversAtNextClass() {
            ParseResult result = parser.parse("class A {\n  void f() {\n  }\n}\n}\nclass B {}\n");

            assertThat(childTypes(result.root())).containsExactly(NodeTypes.CLASS_DECLARATION,
                NodeTypes.ERROR_NODE, NodeTypes.CLASS_DECLARATION);
            assertThat(result.root().getChildren().get(2).getName()).isEqualTo("B");
            assertThat(result.warningsOfKind(WarningKind.UNEXPECTED_TOKEN)).hasSize(1);
        }
    }
}
