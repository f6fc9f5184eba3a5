package io.luascript.core.lower;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.luascript.core.normalize.AstType;

/**
 * Canonical AST fragments the lowerer synthesizes and then lowers like source code. Fragments
 * copy the location of the node they stand in for, so errors still point at the source.
 */
final class SyntheticAst {

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private SyntheticAst() {
        // utility class
    }

    /**
     * {@code <kind> <target> = <local>} when {@code kind} is non-null, otherwise the assignment
     * {@code <target> = <local>}.
     */
    static JsonNode bindFromLocal(JsonNode target, String local, String kind) {
        if (kind != null) {
            ObjectNode declarator = node(AstType.VARIABLE_DECLARATOR, target);
            declarator.set("id", target.deepCopy());
            declarator.set("init", identifier(local, target));
            ObjectNode declaration = node(AstType.VARIABLE_DECLARATION, target);
            declaration.put("kind", kind);
            declaration.putArray("declarations").add(declarator);
            return declaration;
        }
        return expressionStatement(assignment(target.deepCopy(), identifier(local, target), target), target);
    }

    static ObjectNode identifier(String name, JsonNode at) {
        ObjectNode id = node(AstType.IDENTIFIER, at);
        id.put("name", name);
        return id;
    }

    static ObjectNode thisMember(JsonNode key, boolean computed, JsonNode at) {
        ObjectNode member = node(AstType.MEMBER_EXPRESSION, at);
        member.set("object", node(AstType.THIS_EXPRESSION, at));
        member.set("property", key.deepCopy());
        member.put("computed", computed);
        member.put("optional", false);
        return member;
    }

    static ObjectNode assignment(JsonNode left, JsonNode right, JsonNode at) {
        ObjectNode assign = node(AstType.ASSIGNMENT_EXPRESSION, at);
        assign.put("operator", "=");
        assign.set("left", left);
        assign.set("right", right);
        return assign;
    }

    static ObjectNode expressionStatement(JsonNode expression, JsonNode at) {
        ObjectNode statement = node(AstType.EXPRESSION_STATEMENT, at);
        statement.set("expression", expression);
        return statement;
    }

    /** {@code constructor(...args) { super(...args); }}. */
    static ObjectNode forwardingConstructor(JsonNode at) {
        ObjectNode rest = node(AstType.REST_ELEMENT, at);
        rest.set("argument", identifier("args", at));
        ObjectNode spread = node(AstType.SPREAD_ELEMENT, at);
        spread.set("argument", identifier("args", at));
        ObjectNode call = node(AstType.CALL_EXPRESSION, at);
        call.set("callee", node(AstType.SUPER, at));
        call.putArray("arguments").add(spread);
        call.put("optional", false);
        ObjectNode body = node(AstType.BLOCK_STATEMENT, at);
        body.putArray("body").add(expressionStatement(call, at));
        ObjectNode fn = emptyFunction(at);
        ((ArrayNode) fn.get("params")).add(rest);
        fn.set("body", body);
        return fn;
    }

    /** {@code function() {}}. */
    static ObjectNode emptyFunction(JsonNode at) {
        ObjectNode fn = node(AstType.FUNCTION_EXPRESSION, at);
        fn.putNull("id");
        fn.putArray("params");
        ObjectNode body = node(AstType.BLOCK_STATEMENT, at);
        body.putArray("body");
        fn.set("body", body);
        fn.put("async", false);
        fn.put("generator", false);
        return fn;
    }

    private static ObjectNode node(AstType type, JsonNode at) {
        ObjectNode node = JSON.objectNode();
        node.put("type", type.typeName());
        JsonNode loc = at == null ? null : at.get("loc");
        if (loc != null && loc.isObject()) {
            node.set("loc", loc.deepCopy());
        }
        return node;
    }
}
