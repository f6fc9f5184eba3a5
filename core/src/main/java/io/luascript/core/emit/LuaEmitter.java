package io.luascript.core.emit;

import com.fasterxml.jackson.databind.JsonNode;
import io.luascript.core.error.EmissionException;
import io.luascript.core.ir.IrDocument;
import io.luascript.core.ir.IrNode;
import io.luascript.core.ir.NodeId;
import io.luascript.core.ir.NodeKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders a validated IR document as Lua source.
 *
 * <p>One rendering rule per {@link NodeKind}. Statements are written line by line at the current
 * indentation depth; expressions are rendered to strings with their Lua binding strength so that
 * parentheses appear only where Lua precedence requires them.
 *
 * <p>Instances are stateless and thread-safe; each {@link #emit} call gets its own rendering.
 */
public final class LuaEmitter {

    private static final Logger LOG = LoggerFactory.getLogger(LuaEmitter.class);

    private static final Set<String> ERROR_CONSTRUCTORS = Set.of("Error", "TypeError", "RangeError");
    private static final Set<String> STRING_PRODUCERS = Set.of("tostring", "String", "concat", "toString");

    private final EmitterOptions options;

    public LuaEmitter() {
        this(EmitterOptions.defaults());
    }

    public LuaEmitter(EmitterOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    /**
     * Emits Lua for {@code document}. The document must have passed validation.
     *
     * @throws EmissionException for IR shapes that have no Lua rendering
     */
    public String emit(IrDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        long start = System.nanoTime();
        String lua = new Rendering(document).module();
        LOG.debug(
                "Emitted Lua: source={}, chars={}, durationMs={}",
                document.sourcePath(),
                lua.length(),
                (System.nanoTime() - start) / 1_000_000);
        return lua;
    }

    /**
     * A rendered expression.
     *
     * @param text       Lua text
     * @param precedence binding strength, {@link LuaOperators#PRIMARY} for atoms
     * @param prefix     whether Lua accepts it before {@code .}, {@code [}, {@code :} or {@code (}
     */
    private record Rendered(String text, int precedence, boolean prefix) {

        static Rendered atom(String text) {
            return new Rendered(text, LuaOperators.PRIMARY, false);
        }

        static Rendered prefixed(String text) {
            return new Rendered(text, LuaOperators.PRIMARY, true);
        }
    }

    private final class Rendering {

        private final IrDocument document;
        private StringBuilder out = new StringBuilder();
        private int depth;

        Rendering(IrDocument document) {
            this.document = document;
        }

        String module() {
            List<String> directives = document.directives();
            directives.forEach(d -> line("-- " + d));
            List<NodeId> body = document.body();
            if (!directives.isEmpty() && !body.isEmpty()) {
                out.append('\n');
            }
            for (int i = 0; i < body.size(); i++) {
                statement(body.get(i), i == body.size() - 1);
                if (i < body.size() - 1 && definesFunction(body.get(i))) {
                    out.append('\n');
                }
            }
            return out.toString();
        }

        // --- Statements ---

        private void statements(List<NodeId> ids, boolean trailerFollows) {
            for (int i = 0; i < ids.size(); i++) {
                statement(ids.get(i), i == ids.size() - 1 && !trailerFollows);
            }
        }

        /** The statements of a block, or the single statement, one level deeper. */
        private void nested(NodeId id) {
            depth++;
            IrNode node = document.node(id);
            if (node.kind() == NodeKind.BLOCK_STATEMENT) {
                statements(node.refs("statements"), false);
            } else {
                statement(id, true);
            }
            depth--;
        }

        private void statement(NodeId id, boolean lastInBlock) {
            IrNode node = document.node(id);
            switch (node.kind()) {
                case VARIABLE_DECLARATION -> {
                    for (NodeId declaratorId : node.refs("declarations")) {
                        IrNode declarator = document.node(declaratorId);
                        String target = expr(declarator.ref("target"));
                        NodeId init = declarator.ref("init");
                        line(init == null ? "local " + target : "local " + target + " = " + expr(init));
                    }
                }
                case MULTI_VARIABLE_DECLARATION -> {
                    List<String> targets = new ArrayList<>();
                    node.refs("targets").forEach(t -> targets.add(expr(t)));
                    line("local " + String.join(", ", targets) + " = " + expr(node.ref("init")));
                }
                case FUNCTION_DECLARATION -> {
                    if (node.metaFlag("classLike")) {
                        classDefinition(node);
                    } else {
                        line("local function " + luaName(node.string("name")) + "(" + parameters(node) + ")");
                        functionBody(node);
                        line("end");
                    }
                }
                case EXPRESSION_STATEMENT -> expressionStatement(node);
                case RETURN_STATEMENT -> {
                    NodeId argument = node.ref("argument");
                    String text = argument == null ? "return" : "return " + expr(argument);
                    line(lastInBlock ? text : "do " + text + " end");
                }
                case IF_STATEMENT -> ifStatement(node);
                case WHILE_STATEMENT -> {
                    line("while " + expr(node.ref("test")) + " do");
                    nested(node.ref("body"));
                    line("end");
                }
                case REPEAT_STATEMENT -> {
                    line("repeat");
                    nested(node.ref("body"));
                    line("until " + expr(node.ref("test")));
                }
                case FOR_IN_STATEMENT -> {
                    NodeId key = node.ref("key");
                    NodeId value = node.ref("value");
                    String names = (key == null ? "_" : expr(key)) + (value == null ? "" : ", " + expr(value));
                    line("for " + names + " in " + expr(node.ref("iterable")) + " do");
                    nested(node.ref("body"));
                    line("end");
                }
                case BREAK_STATEMENT -> line("break");
                case GOTO_STATEMENT -> line("goto " + node.string("label"));
                case LABEL_STATEMENT -> line("::" + node.string("label") + "::");
                case BLOCK_STATEMENT -> {
                    line("do");
                    nested(id);
                    line("end");
                }
                default -> throw failure(node, node.kind() + " cannot be used as a statement");
            }
        }

        private void expressionStatement(IrNode node) {
            IrNode expression = document.node(node.ref("expression"));
            String text;
            if (expression.kind() == NodeKind.CALL_EXPRESSION) {
                text = render(expression).text();
            } else if (expression.kind() == NodeKind.ASSIGNMENT_EXPRESSION) {
                text = expr(expression.ref("left")) + " = " + expr(expression.ref("right"));
            } else {
                text = "local _ = " + expr(expression.id());
            }
            // a statement starting with '(' would continue the previous line's expression
            line(text.startsWith("(") ? ";" + text : text);
        }

        private void ifStatement(IrNode node) {
            line("if " + expr(node.ref("test")) + " then");
            nested(node.ref("consequent"));
            NodeId alternate = node.ref("alternate");
            while (alternate != null) {
                IrNode next = document.node(alternate);
                if (next.kind() == NodeKind.IF_STATEMENT) {
                    line("elseif " + expr(next.ref("test")) + " then");
                    nested(next.ref("consequent"));
                    alternate = next.ref("alternate");
                } else {
                    line("else");
                    nested(alternate);
                    alternate = null;
                }
            }
            line("end");
        }

        // --- Functions and classes ---

        private void classDefinition(IrNode node) {
            String name = luaName(node.string("name"));
            line("local " + name + " = {}");
            line(name + ".__index = " + name);
            String superClass = node.metaText("superClass");
            if (superClass != null) {
                line("setmetatable(" + name + ", { __index = " + superClass + " })");
            }
            line("function " + name + ".new(" + parameters(node) + ")");
            depth++;
            line("local self = setmetatable({}, " + name + ")");
            statements(bodyStatements(node), true);
            line("return self");
            depth--;
            line("end");
        }

        private String parameters(IrNode fn) {
            List<String> params = new ArrayList<>();
            fn.refs("params").forEach(p -> params.add(expr(p)));
            if (fn.has("restParam")) {
                params.add("...");
            }
            return String.join(", ", params);
        }

        private List<NodeId> bodyStatements(IrNode fn) {
            IrNode body = document.node(fn.ref("body"));
            return body.kind() == NodeKind.BLOCK_STATEMENT ? body.refs("statements") : List.of(body.id());
        }

        /** Writes the body one level deeper; generators and async functions run inside a coroutine. */
        private void functionBody(IrNode fn) {
            String coroutine = null;
            if (fn.metaFlag("generator")) {
                coroutine = "coroutine.wrap";
            } else if (fn.metaFlag("async")) {
                coroutine = "coroutine.create";
            }
            depth++;
            if (coroutine == null) {
                statements(bodyStatements(fn), false);
            } else {
                if (fn.has("restParam")) {
                    throw failure(fn, "Rest parameters are not supported on generator or async functions");
                }
                line("return " + coroutine + "(function()");
                depth++;
                statements(bodyStatements(fn), false);
                depth--;
                line("end)");
            }
            depth--;
        }

        private String functionExpression(IrNode fn) {
            StringBuilder saved = out;
            out = new StringBuilder();
            String body;
            try {
                functionBody(fn);
                body = out.toString();
            } finally {
                out = saved;
            }
            return "function(" + parameters(fn) + ")\n" + body + indentation() + "end";
        }

        // --- Expressions ---

        private String expr(NodeId id) {
            return render(document.node(id)).text();
        }

        /** Renders {@code id}, parenthesized when it binds looser than {@code minPrecedence}. */
        private String operand(NodeId id, int minPrecedence) {
            Rendered rendered = render(document.node(id));
            return rendered.precedence() < minPrecedence ? "(" + rendered.text() + ")" : rendered.text();
        }

        /** Renders {@code id} so that it can be indexed or called. */
        private String prefix(NodeId id) {
            IrNode node = document.node(id);
            if (node.kind() == NodeKind.IDENTIFIER && "Math".equals(node.string("name"))) {
                return "math";
            }
            Rendered rendered = render(node);
            return rendered.prefix() ? rendered.text() : "(" + rendered.text() + ")";
        }

        private Rendered render(IrNode node) {
            return switch (node.kind()) {
                case IDENTIFIER -> Rendered.prefixed(luaName(node.string("name")));
                case LITERAL -> literal(node);
                case VARARG_EXPRESSION -> Rendered.atom("...");
                case BINARY_EXPRESSION, LOGICAL_EXPRESSION -> binary(node);
                case UNARY_EXPRESSION -> unary(node);
                case CALL_EXPRESSION -> call(node);
                case NEW_EXPRESSION -> construct(node);
                case MEMBER_EXPRESSION -> member(node);
                case CONDITIONAL_EXPRESSION -> conditional(node);
                case ARRAY_EXPRESSION -> {
                    List<String> elements = new ArrayList<>();
                    node.refs("elements").forEach(e -> elements.add(e == null ? "nil" : expr(e)));
                    yield Rendered.atom("{" + String.join(", ", elements) + "}");
                }
                case OBJECT_EXPRESSION -> {
                    List<String> properties = new ArrayList<>();
                    node.refs("properties").forEach(p -> properties.add(property(document.node(p))));
                    yield Rendered.atom(properties.isEmpty() ? "{}" : "{ " + String.join(", ", properties) + " }");
                }
                case FUNCTION_EXPRESSION -> Rendered.atom(functionExpression(node));
                case ASSIGNMENT_EXPRESSION -> throw failure(node, "Assignments cannot be used as values");
                default -> throw failure(node, node.kind() + " cannot be used as an expression");
            };
        }

        private Rendered binary(IrNode node) {
            String operator = node.string("operator");
            NodeId left = node.ref("left");
            NodeId right = node.ref("right");
            if (LuaOperators.UNSIGNED_SHIFT.equals(operator)) {
                return unsignedShift(left, right);
            }
            String lua;
            if ("+".equals(operator) && (stringLike(left) || stringLike(right))) {
                lua = "..";
            } else {
                lua = LuaOperators.binary(operator)
                        .orElseThrow(() -> failure(node, "Operator '" + operator + "' has no Lua equivalent"));
            }
            int precedence = LuaOperators.precedence(lua);
            int leftMin;
            int rightMin;
            if ("..".equals(lua)) {
                // concatenation is associative; chains read flat
                leftMin = precedence;
                rightMin = precedence;
            } else if (LuaOperators.rightAssociative(lua)) {
                leftMin = precedence + 1;
                rightMin = precedence;
            } else {
                leftMin = precedence;
                rightMin = precedence + 1;
            }
            String text = operand(left, leftMin) + " " + lua + " " + operand(right, rightMin);
            return new Rendered(text, precedence, false);
        }

        /** {@code a >>> b} as {@code (a & 0xFFFFFFFF) >> (b & 31)}. */
        private Rendered unsignedShift(NodeId left, NodeId right) {
            int and = LuaOperators.precedence("&");
            String value = "(" + operand(left, and) + " & " + LuaOperators.UINT32_MASK + ")";
            String count = "(" + operand(right, and) + " & " + LuaOperators.SHIFT_COUNT_MASK + ")";
            return new Rendered(value + " >> " + count, LuaOperators.precedence(">>"), false);
        }

        private Rendered unary(IrNode node) {
            String operator = node.string("operator");
            NodeId argument = node.ref("argument");
            if ("typeof".equals(operator)) {
                return Rendered.prefixed("type(" + expr(argument) + ")");
            }
            String lua = LuaOperators.unary(operator)
                    .orElseThrow(() -> failure(node, "Unary operator '" + operator + "' has no Lua equivalent"));
            String operandText = operand(argument, LuaOperators.UNARY);
            if (lua.equals("-") && operandText.startsWith("-")) {
                // "--" starts a Lua comment
                operandText = "(" + operandText + ")";
            }
            return new Rendered(lua + operandText, LuaOperators.UNARY, false);
        }

        private Rendered call(IrNode node) {
            IrNode callee = document.node(node.ref("callee"));
            String args = arguments(node);
            if (isConsoleLog(callee)) {
                return Rendered.prefixed("print(" + args + ")");
            }
            if (node.bool("methodCall") && callee.kind() == NodeKind.MEMBER_EXPRESSION && !callee.bool("computed")) {
                String object = prefix(callee.ref("object"));
                String method = document.node(callee.ref("property")).string("name");
                if (LuaOperators.isLuaName(method)) {
                    return Rendered.prefixed(object + ":" + method + "(" + args + ")");
                }
                String self = args.isEmpty() ? object : object + ", " + args;
                return Rendered.prefixed(object + "[" + quote(method) + "](" + self + ")");
            }
            return Rendered.prefixed(prefix(callee.id()) + "(" + args + ")");
        }

        private String arguments(IrNode call) {
            List<String> args = new ArrayList<>();
            call.refs("arguments").forEach(a -> args.add(expr(a)));
            return String.join(", ", args);
        }

        private boolean isConsoleLog(IrNode callee) {
            if (callee.kind() != NodeKind.MEMBER_EXPRESSION || callee.bool("computed")) {
                return false;
            }
            IrNode object = document.node(callee.ref("object"));
            IrNode property = document.node(callee.ref("property"));
            return object.kind() == NodeKind.IDENTIFIER
                    && "console".equals(object.string("name"))
                    && "log".equals(property.string("name"));
        }

        /** {@code new C(x)} is {@code C.new(x)}; built-in error types become plain tables. */
        private Rendered construct(IrNode node) {
            IrNode callee = document.node(node.ref("callee"));
            List<NodeId> args = node.refs("arguments");
            if (callee.kind() == NodeKind.IDENTIFIER && ERROR_CONSTRUCTORS.contains(callee.string("name"))) {
                String message = args.isEmpty() ? "nil" : expr(args.get(0));
                return Rendered.atom("{ name = " + quote(callee.string("name")) + ", message = " + message + " }");
            }
            return Rendered.prefixed(prefix(callee.id()) + ".new(" + arguments(node) + ")");
        }

        private Rendered member(IrNode node) {
            NodeId objectId = node.ref("object");
            IrNode property = document.node(node.ref("property"));
            if (node.bool("computed")) {
                return Rendered.prefixed(prefix(objectId) + "[" + index(property) + "]");
            }
            String name = property.string("name");
            if ("length".equals(name)) {
                return new Rendered("#" + operand(objectId, LuaOperators.UNARY), LuaOperators.UNARY, false);
            }
            String object = prefix(objectId);
            return Rendered.prefixed(
                    LuaOperators.isLuaName(name) ? object + "." + name : object + "[" + quote(name) + "]");
        }

        private Rendered conditional(IrNode node) {
            IrNode consequent = document.node(node.ref("consequent"));
            if (isTruthyLiteral(consequent)) {
                String text = operand(node.ref("test"), 2) + " and " + operand(consequent.id(), 3) + " or "
                        + operand(node.ref("alternate"), 2);
                return Rendered.prefixed("(" + text + ")");
            }
            return Rendered.prefixed("(function() if " + expr(node.ref("test")) + " then return "
                    + expr(consequent.id()) + " else return " + expr(node.ref("alternate")) + " end end)()");
        }

        private boolean isTruthyLiteral(IrNode node) {
            if (node.kind() != NodeKind.LITERAL) {
                return false;
            }
            String literalKind = node.string("literalKind");
            return "string".equals(literalKind)
                    || "number".equals(literalKind)
                    || ("boolean".equals(literalKind) && node.scalar("value").asBoolean());
        }

        private String property(IrNode property) {
            IrNode key = document.node(property.ref("key"));
            String value = expr(property.ref("value"));
            if (!property.bool("computed") && key.kind() == NodeKind.IDENTIFIER) {
                String name = key.string("name");
                return (LuaOperators.isLuaName(name) ? name : "[" + quote(name) + "]") + " = " + value;
            }
            return "[" + index(key) + "] = " + value;
        }

        /** A table key; numeric literals shift from 0-based to 1-based. */
        private String index(IrNode key) {
            if (key.kind() == NodeKind.LITERAL && "number".equals(key.string("literalKind"))) {
                JsonNode value = key.scalar("value");
                if (value.canConvertToLong() && value.isIntegralNumber()) {
                    return Long.toString(value.asLong() + 1);
                }
                return number(value.asDouble() + 1);
            }
            return expr(key.id());
        }

        private boolean stringLike(NodeId id) {
            IrNode node = document.node(id);
            return switch (node.kind()) {
                case LITERAL -> "string".equals(node.string("literalKind"));
                case BINARY_EXPRESSION -> "+".equals(node.string("operator"))
                        && (stringLike(node.ref("left")) || stringLike(node.ref("right")));
                case CALL_EXPRESSION -> {
                    IrNode callee = document.node(node.ref("callee"));
                    if (callee.kind() == NodeKind.IDENTIFIER) {
                        yield STRING_PRODUCERS.contains(callee.string("name"));
                    }
                    yield callee.kind() == NodeKind.MEMBER_EXPRESSION
                            && !callee.bool("computed")
                            && STRING_PRODUCERS.contains(document.node(callee.ref("property")).string("name"));
                }
                default -> false;
            };
        }

        private Rendered literal(IrNode node) {
            JsonNode value = node.scalar("value");
            String literalKind = node.string("literalKind");
            if ("string".equals(literalKind)) {
                return Rendered.atom(quote(value.asText()));
            }
            if ("boolean".equals(literalKind)) {
                return Rendered.atom(value.asBoolean() ? "true" : "false");
            }
            if ("number".equals(literalKind)) {
                String text = value.isIntegralNumber() ? value.asText() : number(value.asDouble());
                return text.startsWith("-") ? new Rendered(text, LuaOperators.UNARY, false) : Rendered.atom(text);
            }
            return Rendered.atom("nil");
        }

        // --- Output ---

        private void line(String text) {
            out.append(indentation()).append(text).append('\n');
        }

        private String indentation() {
            return " ".repeat(depth * options.indent());
        }

        private boolean definesFunction(NodeId id) {
            IrNode node = document.node(id);
            return switch (node.kind()) {
                case FUNCTION_DECLARATION -> true;
                case EXPRESSION_STATEMENT -> {
                    IrNode expression = document.node(node.ref("expression"));
                    yield expression.kind() == NodeKind.ASSIGNMENT_EXPRESSION
                            && document.node(expression.ref("right")).kind() == NodeKind.FUNCTION_EXPRESSION;
                }
                case VARIABLE_DECLARATION -> {
                    List<NodeId> declarators = node.refs("declarations");
                    if (declarators.isEmpty()) {
                        yield false;
                    }
                    NodeId init = document.node(declarators.get(declarators.size() - 1)).ref("init");
                    yield init != null && document.node(init).kind() == NodeKind.FUNCTION_EXPRESSION;
                }
                default -> false;
            };
        }

        private EmissionException failure(IrNode node, String message) {
            return new EmissionException(
                    message + " (node " + node.id() + ")", document.sourcePath(), node.kind().wireName());
        }
    }

    // --- Lexical helpers ---

    /** A Lua-safe spelling of a source identifier. */
    static String luaName(String name) {
        if (LuaOperators.KEYWORDS.contains(name)) {
            return name + "_";
        }
        StringBuilder safe = new StringBuilder(name.length());
        name.codePoints().forEach(cp -> {
            if (cp < 128 && (Character.isLetterOrDigit(cp) || cp == '_')) {
                safe.appendCodePoint(cp);
            } else {
                safe.append('_').append(Integer.toHexString(cp)).append('_');
            }
        });
        return safe.toString();
    }

    /** A double-quoted Lua string literal. */
    static String quote(String value) {
        StringBuilder quoted = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> quoted.append("\\\"");
                case '\\' -> quoted.append("\\\\");
                case '\n' -> quoted.append("\\n");
                case '\r' -> quoted.append("\\r");
                case '\t' -> quoted.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        quoted.append(String.format("\\%03d", (int) c));
                    } else {
                        quoted.append(c);
                    }
                }
            }
        }
        return quoted.append('"').toString();
    }

    static String number(double value) {
        if (Double.isNaN(value)) {
            return "(0/0)";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "math.huge" : "-math.huge";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
