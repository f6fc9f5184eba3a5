package io.luascript.core.lower;

import com.fasterxml.jackson.databind.JsonNode;
import io.luascript.core.normalize.AstType;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Decides whether a member call passes its receiver ({@code obj:m()}) or not ({@code obj.m()}).
 *
 * <p>A scan of the program records every member function it can name statically:
 * <ul>
 * <li>static methods and static function-valued fields of a class are receiverless;</li>
 * <li>{@code a.b.f = function () {...}} is receiverless unless its body uses {@code this};</li>
 * <li>{@code a.b.f = () => ...} is always receiverless.</li>
 * </ul>
 * Lookups follow the {@code extends} chain of class names. A member the scan never saw defined is
 * assumed to be an instance method and keeps its receiver.
 */
final class CallShapes {

    /** Globals whose member calls never take an implicit receiver. */
    static final Set<String> BUILTIN_NAMESPACES = Set.of(
            "console", "Math", "JSON", "Object", "Array", "String", "Number",
            "table", "string", "math", "coroutine", "os", "io");

    private final Set<String> receiverless = new HashSet<>();
    private final Set<String> withReceiver = new HashSet<>();
    private final Map<String, String> superClasses = new HashMap<>();

    private CallShapes() {}

    /** Shapes for a program that was not scanned: every member call keeps its receiver. */
    static CallShapes empty() {
        return new CallShapes();
    }

    static CallShapes scan(JsonNode program) {
        CallShapes shapes = new CallShapes();
        shapes.visit(program);
        return shapes;
    }

    /** Whether a call through {@code callee} passes the callee's object as the first argument. */
    boolean passesReceiver(JsonNode callee) {
        if (!is(callee, AstType.MEMBER_EXPRESSION) || callee.path("computed").asBoolean(false)) {
            return false;
        }
        JsonNode object = callee.path("object");
        if (is(object, AstType.SUPER)) {
            return false;
        }
        if (is(object, AstType.IDENTIFIER) && BUILTIN_NAMESPACES.contains(object.path("name").asText())) {
            return false;
        }
        String owner = qualifiedName(object);
        String property = callee.path("property").path("name").asText();
        Set<String> seen = new HashSet<>();
        while (owner != null && seen.add(owner)) {
            String key = owner + "." + property;
            if (withReceiver.contains(key)) {
                return true;
            }
            if (receiverless.contains(key)) {
                return false;
            }
            owner = superClasses.get(owner);
        }
        return true;
    }

    /**
     * Whether a function assigned to the member {@code target} is lowered without a receiver.
     * Only named owners qualify; a function stored through a computed or call-valued path keeps
     * {@code self} because its calls cannot be resolved.
     */
    static boolean isReceiverlessAssignment(JsonNode target, JsonNode fn) {
        if (!is(target, AstType.MEMBER_EXPRESSION)
                || target.path("computed").asBoolean(false)
                || qualifiedName(target.path("object")) == null) {
            return false;
        }
        return is(fn, AstType.ARROW_FUNCTION_EXPRESSION) || !usesThis(fn.path("body"));
    }

    /** {@code a} or {@code a.b.c} for identifier chains; {@code null} for anything else. */
    static String qualifiedName(JsonNode expr) {
        if (is(expr, AstType.IDENTIFIER)) {
            return expr.path("name").asText();
        }
        if (is(expr, AstType.MEMBER_EXPRESSION) && !expr.path("computed").asBoolean(false)) {
            String owner = qualifiedName(expr.path("object"));
            return owner == null ? null : owner + "." + expr.path("property").path("name").asText();
        }
        return null;
    }

    /** {@code this} anywhere in {@code node}, looking into arrows but not into nested functions or classes. */
    static boolean usesThis(JsonNode node) {
        if (node == null) {
            return false;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                if (usesThis(child)) {
                    return true;
                }
            }
            return false;
        }
        if (!node.isObject()) {
            return false;
        }
        if (is(node, AstType.THIS_EXPRESSION)) {
            return true;
        }
        if (is(node, AstType.FUNCTION_EXPRESSION)
                || is(node, AstType.FUNCTION_DECLARATION)
                || is(node, AstType.CLASS_DECLARATION)) {
            return false;
        }
        for (JsonNode child : node) {
            if (usesThis(child)) {
                return true;
            }
        }
        return false;
    }

    // --- Scan ---

    private void visit(JsonNode node) {
        if (node == null || !(node.isObject() || node.isArray())) {
            return;
        }
        if (is(node, AstType.CLASS_DECLARATION)) {
            recordClass(node);
        } else if (is(node, AstType.ASSIGNMENT_EXPRESSION) && "=".equals(node.path("operator").asText("="))) {
            recordAssignment(node.path("left"), node.path("right"));
        }
        for (JsonNode child : node) {
            visit(child);
        }
    }

    private void recordClass(JsonNode declaration) {
        String className = declaration.path("id").path("name").asText(null);
        if (className == null) {
            return;
        }
        String superClass = qualifiedName(declaration.path("superClass"));
        if (superClass != null) {
            superClasses.put(className, superClass);
        }
        JsonNode body = declaration.path("body");
        if (body.isObject()) {
            body = body.path("body");
        }
        for (JsonNode member : body) {
            if (member.path("computed").asBoolean(false) || !member.path("static").asBoolean(false)) {
                continue;
            }
            JsonNode value = member.path("value");
            boolean function = is(member, AstType.METHOD_DEFINITION)
                    || is(value, AstType.FUNCTION_EXPRESSION)
                    || is(value, AstType.ARROW_FUNCTION_EXPRESSION);
            String name = member.path("key").path("name").asText(null);
            if (function && name != null) {
                receiverless.add(className + "." + name);
            }
        }
    }

    private void recordAssignment(JsonNode target, JsonNode value) {
        if (!is(value, AstType.FUNCTION_EXPRESSION) && !is(value, AstType.ARROW_FUNCTION_EXPRESSION)) {
            return;
        }
        if (!is(target, AstType.MEMBER_EXPRESSION) || target.path("computed").asBoolean(false)) {
            return;
        }
        String owner = qualifiedName(target.path("object"));
        if (owner == null) {
            return;
        }
        String key = owner + "." + target.path("property").path("name").asText();
        if (isReceiverlessAssignment(target, value)) {
            receiverless.add(key);
        } else {
            withReceiver.add(key);
        }
    }

    private static boolean is(JsonNode node, AstType type) {
        return node != null && type.typeName().equals(node.path("type").asText());
    }
}
