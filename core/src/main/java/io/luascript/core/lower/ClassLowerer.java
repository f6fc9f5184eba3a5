package io.luascript.core.lower;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.luascript.core.ir.IrBuilder;
import io.luascript.core.ir.NodeId;
import io.luascript.core.lower.IrLowerer.ClassContext;
import io.luascript.core.lower.IrLowerer.FunctionShape;
import io.luascript.core.normalize.AstType;
import java.util.ArrayList;
import java.util.List;

/**
 * Class declarations.
 *
 * <p>The constructor becomes a {@code FunctionDeclaration} named after the class and tagged
 * {@code meta.classLike}; the emitter turns it into the class table plus {@code C.new}. Methods and
 * static fields follow as assignments on the class table, in declaration order. Instance field
 * initializers run in the constructor right after {@code super(...)}, or first when the class has
 * no base.
 */
final class ClassLowerer {

    private final IrLowerer lowerer;

    ClassLowerer(IrLowerer lowerer) {
        this.lowerer = lowerer;
    }

    NodeId lowerClass(JsonNode declaration, List<NodeId> sink) {
        IrBuilder builder = lowerer.builder();
        JsonNode id = declaration.path("id");
        if (!id.isObject()) {
            throw lowerer.fail(declaration, "Class declarations need a name");
        }
        String className = id.path("name").asText();
        JsonNode superClass = declaration.path("superClass");
        boolean derived = superClass.isObject();
        ClassContext context = new ClassContext(className, derived ? superClass : null);

        JsonNode constructor = null;
        List<JsonNode> instanceFields = new ArrayList<>();
        List<JsonNode> members = new ArrayList<>();
        for (JsonNode member : declaration.path("body")) {
            String type = member.path("type").asText();
            if (AstType.METHOD_DEFINITION.typeName().equals(type)) {
                String kind = member.path("kind").asText("method");
                if ("constructor".equals(kind)) {
                    if (constructor != null) {
                        throw lowerer.fail(member, "A class may only have one constructor");
                    }
                    constructor = member.get("value");
                } else if ("get".equals(kind) || "set".equals(kind)) {
                    throw lowerer.fail(member, "Getters and setters are not supported");
                } else {
                    members.add(member);
                }
            } else if (AstType.PROPERTY_DEFINITION.typeName().equals(type)) {
                if (member.path("static").asBoolean(false)) {
                    members.add(member);
                } else {
                    instanceFields.add(member);
                }
            } else {
                throw lowerer.fail(member, "Unsupported class member '" + type + "'");
            }
        }

        JsonNode constructorFn = constructor != null
                ? constructor
                : derived ? SyntheticAst.forwardingConstructor(declaration) : SyntheticAst.emptyFunction(declaration);
        constructorFn = withFieldInitializers(constructorFn, instanceFields);

        ObjectNode meta = IrBuilder.newMeta();
        meta.put("classLike", true);
        if (derived) {
            meta.put("superClass", qualifiedName(superClass));
        }
        NodeId constructorId = lowerer.lowerFunction(
                constructorFn, className, new FunctionShape(null, true, context), meta);
        sink.add(constructorId);

        for (JsonNode member : members) {
            boolean isStatic = member.path("static").asBoolean(false);
            NodeId target = classSlot(className, member);
            NodeId value;
            if (AstType.METHOD_DEFINITION.typeName().equals(member.path("type").asText())) {
                FunctionShape shape = new FunctionShape(isStatic ? null : "self", false, context);
                value = lowerer.lowerFunction(member.get("value"), null, shape, null);
            } else {
                JsonNode init = member.path("value");
                value = init.isObject() ? lowerer.lowerExpression(init) : builder.undefinedLiteral();
            }
            sink.add(builder.expressionStatement(builder.assignmentExpression(target, value)));
        }
        return constructorId;
    }

    /** {@code ClassName.key} or {@code ClassName[key]}. */
    private NodeId classSlot(String className, JsonNode member) {
        IrBuilder builder = lowerer.builder();
        JsonNode key = member.get("key");
        NodeId table = builder.identifier(className);
        if (member.path("computed").asBoolean(false)) {
            return builder.memberExpression(table, lowerer.lowerExpression(key), true);
        }
        if (AstType.IDENTIFIER.typeName().equals(key.path("type").asText())) {
            return builder.memberExpression(table, builder.identifier(key.path("name").asText()), false);
        }
        return builder.memberExpression(table, lowerer.lowerExpression(key), true);
    }

    /** A copy of {@code constructorFn} that assigns the instance fields before its own statements. */
    private JsonNode withFieldInitializers(JsonNode constructorFn, List<JsonNode> fields) {
        if (fields.isEmpty()) {
            return constructorFn;
        }
        ObjectNode copy = constructorFn.deepCopy();
        ArrayNode body = (ArrayNode) copy.path("body").path("body");
        int insertAt = 0;
        for (int i = 0; i < body.size(); i++) {
            if (isSuperCall(body.get(i))) {
                insertAt = i + 1;
                break;
            }
        }
        for (JsonNode field : fields) {
            JsonNode key = field.get("key");
            boolean computed = field.path("computed").asBoolean(false)
                    || !AstType.IDENTIFIER.typeName().equals(key.path("type").asText());
            JsonNode value = field.path("value").isObject()
                    ? field.get("value")
                    : SyntheticAst.identifier("undefined", field);
            ObjectNode assign = SyntheticAst.assignment(
                    SyntheticAst.thisMember(key, computed, field), value.deepCopy(), field);
            body.insert(insertAt++, SyntheticAst.expressionStatement(assign, field));
        }
        return copy;
    }

    private static boolean isSuperCall(JsonNode statement) {
        JsonNode expression = statement.path("expression");
        return AstType.EXPRESSION_STATEMENT.typeName().equals(statement.path("type").asText())
                && AstType.CALL_EXPRESSION.typeName().equals(expression.path("type").asText())
                && AstType.SUPER.typeName().equals(expression.path("callee").path("type").asText());
    }

    /** Dotted source text of an {@code extends} clause; only names and member chains are accepted. */
    private String qualifiedName(JsonNode expression) {
        String type = expression.path("type").asText();
        if (AstType.IDENTIFIER.typeName().equals(type)) {
            return expression.path("name").asText();
        }
        if (AstType.MEMBER_EXPRESSION.typeName().equals(type) && !expression.path("computed").asBoolean(false)) {
            return qualifiedName(expression.get("object")) + "." + expression.path("property").path("name").asText();
        }
        throw lowerer.fail(expression, "A class can only extend a name or a dotted path");
    }
}
