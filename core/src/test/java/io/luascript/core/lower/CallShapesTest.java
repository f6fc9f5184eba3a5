package io.luascript.core.lower;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import io.luascript.core.normalize.AstNormalizer;
import io.luascript.core.parse.SourceParser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CallShapes")
class CallShapesTest {

    private static JsonNode program(String source) {
        JsonNode raw = new SourceParser("test.js").parse(source);
        return new AstNormalizer("test.js").normalizeProgram(raw, source);
    }

    /** The callee of the call expression in the program's last statement. */
    private static JsonNode lastCallee(JsonNode program) {
        JsonNode body = program.path("body");
        return body.get(body.size() - 1).path("expression").path("callee");
    }

    private static boolean passesReceiver(String source) {
        JsonNode program = program(source);
        return CallShapes.scan(program).passesReceiver(lastCallee(program));
    }

    @Nested
    @DisplayName("classes")
    class Classes {

        @Test
        @DisplayName("static methods are called without a receiver")
        void staticMethod() {
            assertThat(passesReceiver("class C { static make(x) { return x; } }\nC.make(1);")).isFalse();
        }

        @Test
        @DisplayName("static function-valued fields are called without a receiver")
        void staticField() {
            assertThat(passesReceiver("class C { static build = (x) => x; }\nC.build(1);")).isFalse();
        }

        @Test
        @DisplayName("inherited statics resolve through extends")
        void inheritedStatic() {
            assertThat(passesReceiver("""
                    class A { static make() { return 1; } }
                    class B extends A {}
                    B.make();
                    """)).isFalse();
        }

        @Test
        @DisplayName("instance methods keep their receiver")
        void instanceMethod() {
            assertThat(passesReceiver("class C { greet() { return 1; } }\nc.greet();")).isTrue();
        }

        @Test
        @DisplayName("a self-referential extends chain terminates")
        void cyclicChain() {
            assertThat(passesReceiver("class A extends B {}\nclass B extends A {}\nA.run();")).isTrue();
        }
    }

    @Nested
    @DisplayName("function properties")
    class FunctionProperties {

        @Test
        @DisplayName("a function that never uses this is called without a receiver")
        void plainFunction() {
            assertThat(passesReceiver("M.add = function (a, b) { return a + b; };\nM.add(1, 2);")).isFalse();
        }

        @Test
        @DisplayName("arrows never take a receiver")
        void arrow() {
            assertThat(passesReceiver("M.twice = (a) => a * 2;\nM.twice(2);")).isFalse();
        }

        @Test
        @DisplayName("a function that uses this keeps its receiver")
        void usesThis() {
            assertThat(passesReceiver("M.count = function () { return this.n; };\nM.count();")).isTrue();
        }

        @Test
        @DisplayName("dotted owners are matched by their full path")
        void dottedOwner() {
            assertThat(passesReceiver("a.b.f = function () { return 1; };\na.b.f();")).isFalse();
            assertThat(passesReceiver("a.b.f = function () { return 1; };\nb.f();")).isTrue();
        }

        @Test
        @DisplayName("this inside a nested function does not count")
        void nestedThis() {
            JsonNode fn = program("f = function () { return function () { return this; }; };")
                    .path("body").get(0).path("expression").path("right");

            assertThat(CallShapes.usesThis(fn.path("body"))).isFalse();
        }
    }

    @Nested
    @DisplayName("other callees")
    class OtherCallees {

        @Test
        @DisplayName("builtin namespaces and plain functions take no receiver")
        void builtins() {
            assertThat(passesReceiver("Math.max(1, 2);")).isFalse();
            assertThat(passesReceiver("f(1);")).isFalse();
        }

        @Test
        @DisplayName("unknown members keep their receiver")
        void unknown() {
            assertThat(passesReceiver("obj.greet();")).isTrue();
            assertThat(CallShapes.empty().passesReceiver(lastCallee(program("M.add(1);")))).isTrue();
        }

        @Test
        @DisplayName("qualified names cover identifier chains only")
        void qualifiedName() {
            assertThat(CallShapes.qualifiedName(lastCallee(program("a.b.c();")))).isEqualTo("a.b.c");
            assertThat(CallShapes.qualifiedName(lastCallee(program("a[0].c();")))).isNull();
        }
    }
}
