package io.luascript.core.emit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.luascript.core.error.EmissionException;
import io.luascript.core.ir.FunctionOptions;
import io.luascript.core.ir.IrBuilder;
import io.luascript.core.ir.IrDocument;
import io.luascript.core.ir.NodeId;
import io.luascript.core.lower.IrLowerer;
import io.luascript.core.normalize.AstNormalizer;
import io.luascript.core.parse.SourceParser;
import io.luascript.core.validate.IrValidator;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("LuaEmitter")
class LuaEmitterTest {

    private static final IrValidator VALIDATOR = new IrValidator();

    private final LuaEmitter emitter = new LuaEmitter();

    /** Lowers {@code source} and checks the IR against the validator, as the pipeline does before emitting. */
    private static IrDocument lower(String source) {
        JsonNode raw = new SourceParser("test.js").parse(source);
        JsonNode canonical = new AstNormalizer("test.js").normalizeProgram(raw, source);
        IrBuilder.BuildResult built = new IrLowerer(new IrBuilder(), "test.js").lowerProgram(canonical).build(VALIDATOR);
        assertThat(built.validation().errors()).as("IR validation errors").isEmpty();
        return built.document();
    }

    private static IrDocument valid(IrDocument document) {
        assertThat(VALIDATOR.validate(document).errors()).as("IR validation errors").isEmpty();
        return document;
    }

    private String transpile(String source) {
        return emitter.emit(lower(source));
    }

    @Nested
    @DisplayName("from source")
    class FromSource {

        @Test
        @DisplayName("function declaration")
        void function() {
            assertThat(transpile("function add(a, b) { return a + b; }"))
                    .isEqualTo("local function add(a, b)\n  return a + b\nend\n");
        }

        @Test
        @DisplayName("string concatenation uses ..")
        void concatenation() {
            assertThat(transpile("const greeting = \"Hello, \" + name + \"!\";"))
                    .isEqualTo("local greeting = \"Hello, \" .. name .. \"!\"\n");
        }

        @Test
        @DisplayName("postfix increment as a value snapshots the old value")
        void postfixIncrement() {
            assertThat(transpile("let y = i++;"))
                    .isEqualTo("local y = (function()\n  local _t = i\n  i = i + 1\n  return _t\nend)()\n");
        }

        @Test
        @DisplayName("try/catch/finally runs the finalizer after the protected call")
        void tryCatchFinally() {
            String lua = transpile("try { a(); } catch (e) { b(); } finally { c(); }");

            assertThat(lua).contains("pcall(__try_1)").contains("if not __ok_1 then");
            assertThat(lua.indexOf("pcall(")).isLessThan(lua.indexOf("c()"));
            assertThat(lua.indexOf("b()")).isLessThan(lua.indexOf("c()"));
            assertThat(LuaBlocks.balanced(lua)).isTrue();
        }

        @Test
        @DisplayName("a function definition is followed by a blank line")
        void blankLineAfterFunction() {
            assertThat(transpile("function f() {}\nf();")).isEqualTo("local function f()\nend\n\nf()\n");
        }

        @Test
        @DisplayName("derived classes chain their metatable")
        void derivedClass() {
            String lua = transpile("class Dog extends Animal { speak() { return \"woof\"; } }");

            assertThat(lua)
                    .startsWith("local Dog = {}\nDog.__index = Dog\nsetmetatable(Dog, { __index = Animal })\n")
                    .contains("function Dog.new(")
                    .contains("local self = setmetatable({}, Dog)")
                    .contains("return self")
                    .contains("Dog.speak = function(");
            assertThat(LuaBlocks.balanced(lua)).isTrue();
        }

        @Test
        @DisplayName("control flow stays balanced")
        void controlFlow() {
            String lua = transpile("""
                    for (let i = 0; i < 10; i++) {
                      if (i % 2 === 0) { continue; } else if (i > 7) { break; }
                      do { i += 1; } while (i < 3);
                    }
                    switch (k) { case 1: case 2: one(); break; default: other(); }
                    """);

            assertThat(lua).contains("while i < 10 do").contains("repeat").contains("until not (i < 3)");
            assertThat(LuaBlocks.balanced(lua)).isTrue();
        }

        @Test
        @DisplayName("object rest skips computed keys taken earlier in the pattern")
        void objectRestComputedKeys() {
            String lua = transpile("const {[f()]: a, b, ...rest} = obj;");

            assertThat(lua)
                    .contains("local __key_1 = f()\n")
                    .contains("local a = __destructure_1[__key_1]\n")
                    .contains("local rest = {}\n")
                    .contains("pairs(__destructure_1)")
                    .contains("__k ~= \"b\" and __k ~= __key_1");
            assertThat(lua.split("f\\(\\)", -1)).hasSize(2);
            assertThat(LuaBlocks.balanced(lua)).isTrue();
        }

        @Test
        @DisplayName("a recovered destructuring declaration reads its dotted source as a member chain")
        void recoveredDottedSource() {
            String source = "const [a, b] = obj.items.list;";
            ObjectNode raw = JsonNodeFactory.instance.objectNode().put("type", "Program");
            raw.putArray("body").addObject().put("type", "Error").put("message", "unsupported syntax");
            JsonNode canonical = new AstNormalizer("test.js").normalizeProgram(raw, source);
            IrBuilder.BuildResult built = new IrLowerer(new IrBuilder(), "test.js").lowerProgram(canonical).build(VALIDATOR);

            assertThat(built.validation().errors()).isEmpty();
            assertThat(emitter.emit(built.document()))
                    .contains("local __destructure_1 = obj.items.list\n")
                    .contains("local a = __destructure_1[1]\n")
                    .contains("local b = __destructure_1[2]\n")
                    .doesNotContain("_2e_");
        }

        @Test
        @DisplayName("unsigned right shift works on the low 32 bits")
        void unsignedShift() {
            assertThat(transpile("let x = a >>> 2;"))
                    .isEqualTo("local x = (a & 0xFFFFFFFF) >> (2 & 31)\n");
            assertThat(transpile("h >>>= n | 1;"))
                    .isEqualTo("h = (h & 0xFFFFFFFF) >> ((n | 1) & 31)\n");
            assertThat(transpile("let y = (a >>> b) + 1;"))
                    .isEqualTo("local y = ((a & 0xFFFFFFFF) >> (b & 31)) + 1\n");
        }

        @Test
        @DisplayName("signed right shift keeps the Lua operator")
        void signedShift() {
            assertThat(transpile("let x = a >> 2;")).isEqualTo("local x = a >> 2\n");
        }

        @Test
        @DisplayName("indentation follows the options")
        void indent() {
            String lua = new LuaEmitter(new EmitterOptions(4)).emit(lower("function add(a, b) { return a + b; }"));

            assertThat(lua).isEqualTo("local function add(a, b)\n    return a + b\nend\n");
        }
    }

    @Nested
    @DisplayName("from IR")
    class FromIr {

        private IrBuilder builder;

        @BeforeEach
        void setUp() {
            builder = new IrBuilder();
        }

        private String emitLocal(String name, NodeId init) {
            builder.pushToBody(builder.variableDeclaration(List.of(builder.variableDeclarator(builder.identifier(name), init))));
            return emitter.emit(valid(builder.build()));
        }

        @Test
        @DisplayName("array holes become nil")
        void holes() {
            NodeId array = builder.arrayExpression(Arrays.asList(builder.literal(1), null, builder.literal(3)));

            assertThat(emitLocal("t", array)).isEqualTo("local t = {1, nil, 3}\n");
        }

        @Test
        @DisplayName("numeric indexes shift to one-based")
        void oneBased() {
            NodeId element = builder.memberExpression(builder.identifier("xs"), builder.literal(0), true);

            assertThat(emitLocal("first", element)).isEqualTo("local first = xs[1]\n");
        }

        @Test
        @DisplayName(".length becomes the length operator")
        void length() {
            NodeId length = builder.memberExpression(builder.identifier("xs"), builder.identifier("length"), false);

            assertThat(emitLocal("n", length)).isEqualTo("local n = #xs\n");
        }

        @Test
        @DisplayName("method calls use colon syntax and console.log becomes print")
        void calls() {
            NodeId greet = builder.callExpression(
                    builder.memberExpression(builder.identifier("obj"), builder.identifier("greet"), false),
                    List.of(builder.literal("x")), true);
            NodeId log = builder.callExpression(
                    builder.memberExpression(builder.identifier("console"), builder.identifier("log"), false),
                    List.of(builder.literal("hi")), true);
            builder.pushToBody(builder.expressionStatement(greet));
            builder.pushToBody(builder.expressionStatement(log));

            assertThat(emitter.emit(builder.build())).isEqualTo("obj:greet(\"x\")\nprint(\"hi\")\n");
        }

        @Test
        @DisplayName("built-in errors become tables; other constructors call new")
        void construction() {
            NodeId error = builder.newExpression(builder.identifier("Error"), List.of(builder.literal("boom")));
            NodeId point = builder.newExpression(builder.identifier("Point"), List.of(builder.literal(1)));
            builder.pushToBody(builder.variableDeclaration(List.of(
                    builder.variableDeclarator(builder.identifier("e"), error),
                    builder.variableDeclarator(builder.identifier("p"), point))));

            assertThat(emitter.emit(builder.build()))
                    .isEqualTo("local e = { name = \"Error\", message = \"boom\" }\nlocal p = Point.new(1)\n");
        }

        @Test
        @DisplayName("a statement starting with a parenthesis is guarded")
        void leadingParenthesis() {
            NodeId fn = builder.functionExpression(List.of(), builder.blockStatement(List.of()), FunctionOptions.none());
            builder.pushToBody(builder.expressionStatement(builder.callExpression(fn, List.of(), false)));

            assertThat(emitter.emit(builder.build())).isEqualTo(";(function()\nend)()\n");
        }

        @Test
        @DisplayName("a ternary with a truthy branch uses and/or")
        void ternaryAndOr() {
            NodeId ternary = builder.conditionalExpression(
                    builder.identifier("ok"), builder.literal("yes"), builder.literal("no"));

            assertThat(emitLocal("r", ternary)).isEqualTo("local r = (ok and \"yes\" or \"no\")\n");
        }

        @Test
        @DisplayName("a ternary with a falsy branch uses an inline function")
        void ternaryFunction() {
            NodeId ternary = builder.conditionalExpression(
                    builder.identifier("ok"), builder.literal(false), builder.literal(1));

            assertThat(emitLocal("r", ternary))
                    .isEqualTo("local r = (function() if ok then return false else return 1 end end)()\n");
        }

        @Test
        @DisplayName("negating a negative literal does not start a comment")
        void doubleMinus() {
            NodeId negated = builder.unaryExpression("-", builder.literal(-1));

            assertThat(emitLocal("x", negated)).isEqualTo("local x = -(-1)\n");
        }

        @Test
        @DisplayName("precedence is kept with minimal parentheses")
        void precedence() {
            NodeId sum = builder.binaryExpression(builder.identifier("a"), "+", builder.identifier("b"));
            NodeId product = builder.binaryExpression(sum, "*", builder.identifier("c"));

            assertThat(emitLocal("x", product)).isEqualTo("local x = (a + b) * c\n");
        }

        @Test
        @DisplayName("an early return is wrapped in do ... end")
        void earlyReturn() {
            NodeId body = builder.blockStatement(List.of(
                    builder.returnStatement(null),
                    builder.expressionStatement(builder.callExpression(builder.identifier("g"), List.of(), false))));
            builder.pushToBody(builder.functionDeclaration("f", List.of(), body, FunctionOptions.none()));

            assertThat(emitter.emit(builder.build())).isEqualTo("local function f()\n  do return end\n  g()\nend\n");
        }

        @Test
        @DisplayName("directives are written as comments")
        void directives() {
            builder.directive("use strict");
            builder.pushToBody(builder.expressionStatement(builder.callExpression(builder.identifier("x"), List.of(), false)));

            assertThat(emitter.emit(builder.build())).isEqualTo("-- use strict\n\nx()\n");
        }

        @Test
        @DisplayName("an assignment used as a value has no rendering")
        void assignmentAsValue() {
            NodeId assignment = builder.assignmentExpression(builder.identifier("a"), builder.identifier("b"));
            builder.pushToBody(builder.variableDeclaration(List.of(
                    builder.variableDeclarator(builder.identifier("x"), assignment))));
            IrDocument document = builder.build();

            assertThatThrownBy(() -> emitter.emit(document))
                    .isInstanceOfSatisfying(EmissionException.class, e -> {
                        assertThat(e.nodeKind()).isEqualTo("AssignmentExpression");
                        assertThat(e.getMessage()).contains("Assignments cannot be used as values");
                    });
        }

        @Test
        @DisplayName("rest parameters on generators are rejected")
        void generatorRest() {
            var meta = IrBuilder.newMeta().put("generator", true);
            NodeId rest = builder.identifier("args");
            builder.pushToBody(builder.functionDeclaration(
                    "gen", List.of(), builder.blockStatement(List.of()), new FunctionOptions(rest, meta)));
            IrDocument document = builder.build();

            assertThatThrownBy(() -> emitter.emit(document))
                    .isInstanceOf(EmissionException.class)
                    .hasMessageContaining("Rest parameters are not supported");
        }
    }

    @Nested
    @DisplayName("lexical helpers")
    class Lexical {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({"end, end_", "local, local_", "$x, _24_x", "plain_name, plain_name", "a.b, a_2e_b"})
        void luaName(String input, String expected) {
            assertThat(LuaEmitter.luaName(input)).isEqualTo(expected);
        }

        @Test
        @DisplayName("quote escapes control characters")
        void quote() {
            assertThat(LuaEmitter.quote("a\"b\\c\n\u0001")).isEqualTo("\"a\\\"b\\\\c\\n\\001\"");
        }

        @Test
        @DisplayName("special numbers have Lua spellings")
        void numbers() {
            assertThat(LuaEmitter.number(Double.NaN)).isEqualTo("(0/0)");
            assertThat(LuaEmitter.number(Double.POSITIVE_INFINITY)).isEqualTo("math.huge");
            assertThat(LuaEmitter.number(Double.NEGATIVE_INFINITY)).isEqualTo("-math.huge");
            assertThat(LuaEmitter.number(3.0)).isEqualTo("3");
            assertThat(LuaEmitter.number(1.5)).isEqualTo("1.5");
        }

        @Test
        @DisplayName("the balance check sees through strings and comments")
        void balanceHelper() {
            assertThat(LuaBlocks.balanced("local s = \"end\"\n-- function\nif x then y() end\n")).isTrue();
            assertThat(LuaBlocks.balanced("if x then\n")).isFalse();
        }

        @Test
        @DisplayName("indent outside 0..8 is rejected")
        void indentRange() {
            assertThatThrownBy(() -> new EmitterOptions(9)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
