package io.luascript.core.ir;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Closed set of IR node kinds together with the fields each kind requires.
 *
 * <p>Adding a constant is a MINOR schema change and must be mirrored in the archived JSON schema of
 * the new version. The field table drives the structural checks in the validator.
 */
public enum NodeKind {
    IDENTIFIER("Identifier", f("name", FieldType.STRING)),
    LITERAL(
            "Literal",
            f("value", FieldType.SCALAR),
            f("raw", FieldType.STRING),
            f("literalKind", FieldType.STRING)),
    VARARG_EXPRESSION("VarargExpression"),
    BINARY_EXPRESSION(
            "BinaryExpression", f("left", FieldType.REF), f("operator", FieldType.STRING), f("right", FieldType.REF)),
    LOGICAL_EXPRESSION(
            "LogicalExpression", f("left", FieldType.REF), f("operator", FieldType.STRING), f("right", FieldType.REF)),
    UNARY_EXPRESSION("UnaryExpression", f("operator", FieldType.STRING), f("argument", FieldType.REF)),
    ASSIGNMENT_EXPRESSION(
            "AssignmentExpression",
            f("left", FieldType.REF),
            f("operator", FieldType.STRING),
            f("right", FieldType.REF)),
    CALL_EXPRESSION(
            "CallExpression",
            f("callee", FieldType.REF),
            f("arguments", FieldType.REF_LIST),
            f("methodCall", FieldType.BOOLEAN)),
    NEW_EXPRESSION("NewExpression", f("callee", FieldType.REF), f("arguments", FieldType.REF_LIST)),
    MEMBER_EXPRESSION(
            "MemberExpression",
            f("object", FieldType.REF),
            f("property", FieldType.REF),
            f("computed", FieldType.BOOLEAN)),
    CONDITIONAL_EXPRESSION(
            "ConditionalExpression",
            f("test", FieldType.REF),
            f("consequent", FieldType.REF),
            f("alternate", FieldType.REF)),
    ARRAY_EXPRESSION("ArrayExpression", f("elements", FieldType.HOLEY_REF_LIST)),
    OBJECT_EXPRESSION("ObjectExpression", f("properties", FieldType.REF_LIST)),
    PROPERTY("Property", f("key", FieldType.REF), f("value", FieldType.REF), f("computed", FieldType.BOOLEAN)),
    FUNCTION_EXPRESSION(
            "FunctionExpression",
            f("params", FieldType.REF_LIST),
            f("body", FieldType.REF),
            f("restParam", FieldType.OPTIONAL_REF)),
    VARIABLE_DECLARATION(
            "VariableDeclaration", f("declarationKind", FieldType.STRING), f("declarations", FieldType.REF_LIST)),
    VARIABLE_DECLARATOR("VariableDeclarator", f("target", FieldType.REF), f("init", FieldType.OPTIONAL_REF)),
    MULTI_VARIABLE_DECLARATION(
            "MultiVariableDeclaration", f("targets", FieldType.REF_LIST), f("init", FieldType.REF)),
    EXPRESSION_STATEMENT("ExpressionStatement", f("expression", FieldType.REF)),
    RETURN_STATEMENT("ReturnStatement", f("argument", FieldType.OPTIONAL_REF)),
    IF_STATEMENT(
            "IfStatement",
            f("test", FieldType.REF),
            f("consequent", FieldType.REF),
            f("alternate", FieldType.OPTIONAL_REF)),
    WHILE_STATEMENT("WhileStatement", f("test", FieldType.REF), f("body", FieldType.REF)),
    REPEAT_STATEMENT("RepeatStatement", f("body", FieldType.REF), f("test", FieldType.REF)),
    FOR_IN_STATEMENT(
            "ForInStatement",
            f("iterator", FieldType.STRING),
            f("key", FieldType.OPTIONAL_REF),
            f("value", FieldType.OPTIONAL_REF),
            f("iterable", FieldType.REF),
            f("body", FieldType.REF)),
    BREAK_STATEMENT("BreakStatement"),
    GOTO_STATEMENT("GotoStatement", f("label", FieldType.STRING)),
    LABEL_STATEMENT("LabelStatement", f("label", FieldType.STRING)),
    BLOCK_STATEMENT("BlockStatement", f("statements", FieldType.REF_LIST)),
    FUNCTION_DECLARATION(
            "FunctionDeclaration",
            f("name", FieldType.STRING),
            f("params", FieldType.REF_LIST),
            f("body", FieldType.REF),
            f("restParam", FieldType.OPTIONAL_REF));

    private static final Map<String, NodeKind> BY_WIRE_NAME = new LinkedHashMap<>();

    static {
        for (NodeKind kind : values()) {
            BY_WIRE_NAME.put(kind.wireName, kind);
        }
    }

    private final String wireName;
    private final Map<String, FieldType> fields;

    NodeKind(String wireName, Field... fields) {
        this.wireName = wireName;
        Map<String, FieldType> map = new LinkedHashMap<>();
        Arrays.stream(fields).forEach(field -> map.put(field.name, field.type));
        this.fields = Collections.unmodifiableMap(map);
    }

    /** The {@code kind} discriminant as it appears in IR JSON. */
    public String wireName() {
        return wireName;
    }

    /** Kind-specific fields in declaration order. {@code OPTIONAL_REF} fields may be absent. */
    public Map<String, FieldType> fields() {
        return fields;
    }

    /** Looks up a kind by its JSON discriminant. */
    public static Optional<NodeKind> fromWireName(String wireName) {
        return Optional.ofNullable(BY_WIRE_NAME.get(wireName));
    }

    @Override
    public String toString() {
        return wireName;
    }

    private static Field f(String name, FieldType type) {
        return new Field(name, type);
    }

    private record Field(String name, FieldType type) {}
}
