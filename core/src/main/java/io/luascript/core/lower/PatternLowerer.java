package io.luascript.core.lower;

import com.fasterxml.jackson.databind.JsonNode;
import io.luascript.core.ir.IrBuilder;
import io.luascript.core.ir.NodeId;
import io.luascript.core.normalize.AstType;
import java.util.ArrayList;
import java.util.List;

/**
 * Destructuring patterns in declarations, assignments, parameters and loop heads.
 *
 * <p>The source value is evaluated once into a {@code __destructure_N} local; each element is
 * then bound left to right with its own statement. Array elements are read with JS indices and
 * rebased by the emitter. Nested patterns recurse through fresh temporaries.
 */
final class PatternLowerer {

    /** Whether bindings introduce locals or assign existing targets. */
    enum Mode {
        DECLARE,
        ASSIGN
    }

    private static final String REST_KEY = "__k";
    private static final String REST_VALUE = "__v";

    private final IrLowerer lowerer;

    PatternLowerer(IrLowerer lowerer) {
        this.lowerer = lowerer;
    }

    static boolean isPattern(JsonNode node) {
        String type = node == null ? "" : node.path("type").asText();
        return AstType.ARRAY_PATTERN.typeName().equals(type) || AstType.OBJECT_PATTERN.typeName().equals(type);
    }

    /** {@code let <pattern> = init}. */
    void declare(JsonNode pattern, JsonNode init, String kind, List<NodeId> sink) {
        String temp = lowerer.names().fresh(ScratchNames.DESTRUCTURE);
        sink.add(lowerer.declareLocal(temp, lowerer.lowerExpression(init)));
        bindFrom(pattern, temp, Mode.DECLARE, kind, sink);
    }

    /** {@code <pattern> = right} on existing bindings. */
    void assign(JsonNode pattern, JsonNode right, List<NodeId> sink) {
        String temp = lowerer.names().fresh(ScratchNames.DESTRUCTURE);
        sink.add(lowerer.declareLocal(temp, lowerer.lowerExpression(right)));
        bindFrom(pattern, temp, Mode.ASSIGN, null, sink);
    }

    /** Binds every element of {@code pattern} from the local named {@code source}. */
    void bindFrom(JsonNode pattern, String source, Mode mode, String kind, List<NodeId> sink) {
        if (AstType.ARRAY_PATTERN.typeName().equals(pattern.path("type").asText())) {
            bindArray(pattern, source, mode, kind, sink);
        } else if (AstType.OBJECT_PATTERN.typeName().equals(pattern.path("type").asText())) {
            bindObject(pattern, source, mode, kind, sink);
        } else {
            throw lowerer.fail(pattern, "Malformed destructuring pattern");
        }
    }

    private void bindArray(JsonNode pattern, String source, Mode mode, String kind, List<NodeId> sink) {
        IrBuilder builder = lowerer.builder();
        JsonNode elements = pattern.path("elements");
        for (int i = 0; i < elements.size(); i++) {
            JsonNode element = elements.get(i);
            if (element == null || element.isNull()) {
                continue;
            }
            if (AstType.REST_ELEMENT.typeName().equals(element.path("type").asText())) {
                if (i != elements.size() - 1) {
                    throw lowerer.fail(element, "Rest element must be last in an array pattern");
                }
                // table.unpack takes a 1-based start index
                NodeId rest = builder.arrayExpression(
                        List.of(lowerer.tableUnpack(List.of(builder.identifier(source), builder.literal(i + 1)))));
                bindTarget(element.get("argument"), rest, mode, kind, sink);
            } else {
                NodeId value = builder.memberExpression(builder.identifier(source), builder.literal(i), true);
                bindTarget(element, value, mode, kind, sink);
            }
        }
    }

    private void bindObject(JsonNode pattern, String source, Mode mode, String kind, List<NodeId> sink) {
        IrBuilder builder = lowerer.builder();
        List<String> named = new ArrayList<>();
        List<String> computedKeys = new ArrayList<>();
        JsonNode properties = pattern.path("properties");
        boolean hasRest = properties.size() > 0
                && AstType.REST_ELEMENT.typeName().equals(properties.get(properties.size() - 1).path("type").asText());
        for (int i = 0; i < properties.size(); i++) {
            JsonNode property = properties.get(i);
            if (AstType.REST_ELEMENT.typeName().equals(property.path("type").asText())) {
                if (i != properties.size() - 1) {
                    throw lowerer.fail(property, "Rest element must be last in an object pattern");
                }
                bindObjectRest(property.get("argument"), source, named, computedKeys, mode, kind, sink);
                continue;
            }
            JsonNode key = property.get("key");
            String keyType = key.path("type").asText();
            NodeId access;
            if (property.path("computed").asBoolean(false) && hasRest) {
                // the rest copy compares against the same key value
                String keyLocal = lowerer.names().fresh(ScratchNames.KEY);
                sink.add(lowerer.declareLocal(keyLocal, lowerer.lowerExpression(key)));
                computedKeys.add(keyLocal);
                access = builder.memberExpression(builder.identifier(source), builder.identifier(keyLocal), true);
            } else if (property.path("computed").asBoolean(false)) {
                access = builder.memberExpression(builder.identifier(source), lowerer.lowerExpression(key), true);
            } else if (AstType.IDENTIFIER.typeName().equals(keyType)) {
                String name = key.path("name").asText();
                named.add(name);
                access = builder.memberExpression(builder.identifier(source), builder.identifier(name), false);
            } else if (AstType.LITERAL.typeName().equals(keyType)) {
                named.add(key.path("value").asText());
                access = builder.memberExpression(
                        builder.identifier(source), builder.literal(key.get("value"), key.path("raw").asText(null)), true);
            } else {
                throw lowerer.fail(key, "Unsupported key in object pattern");
            }
            bindTarget(property.get("value"), access, mode, kind, sink);
        }
    }

    /**
     * {@code ...rest}: a {@code pairs} copy of every key not taken earlier in the pattern, whether it
     * was written as a name or computed into one of {@code computedKeys}.
     */
    private void bindObjectRest(JsonNode target, String source, List<String> named, List<String> computedKeys,
            Mode mode, String kind, List<NodeId> sink) {
        if (!AstType.IDENTIFIER.typeName().equals(target.path("type").asText())) {
            throw lowerer.fail(target, "Object rest target must be an identifier");
        }
        IrBuilder builder = lowerer.builder();
        String restName = target.path("name").asText();
        bindIdentifier(restName, builder.objectExpression(List.of()), mode, kind, sink);

        NodeId slot = builder.memberExpression(builder.identifier(restName), builder.identifier(REST_KEY), true);
        NodeId copy = builder.expressionStatement(builder.assignmentExpression(slot, builder.identifier(REST_VALUE)));
        NodeId loopBody;
        if (named.isEmpty() && computedKeys.isEmpty()) {
            loopBody = builder.blockStatement(List.of(copy));
        } else {
            NodeId test = null;
            for (String name : named) {
                NodeId differs = builder.binaryExpression(builder.identifier(REST_KEY), "!==", builder.literal(name));
                test = test == null ? differs : builder.logicalExpression(test, "&&", differs);
            }
            for (String keyLocal : computedKeys) {
                NodeId differs = builder.binaryExpression(
                        builder.identifier(REST_KEY), "!==", builder.identifier(keyLocal));
                test = test == null ? differs : builder.logicalExpression(test, "&&", differs);
            }
            loopBody = builder.blockStatement(List.of(builder.ifStatement(test, builder.blockStatement(List.of(copy)), null)));
        }
        sink.add(builder.forInStatement(
                "pairs", builder.identifier(REST_KEY), builder.identifier(REST_VALUE), builder.identifier(source), loopBody));
    }

    private void bindTarget(JsonNode target, NodeId value, Mode mode, String kind, List<NodeId> sink) {
        JsonNode defaultValue = null;
        JsonNode actual = target;
        if (AstType.ASSIGNMENT_PATTERN.typeName().equals(target.path("type").asText())) {
            defaultValue = target.get("right");
            actual = target.get("left");
        }
        String type = actual.path("type").asText();
        if (AstType.IDENTIFIER.typeName().equals(type)) {
            String name = actual.path("name").asText();
            bindIdentifier(name, value, mode, kind, sink);
            if (defaultValue != null) {
                sink.add(lowerer.defaultValueCheck(name, defaultValue));
            }
        } else if (isPattern(actual)) {
            String temp = lowerer.names().fresh(ScratchNames.DESTRUCTURE);
            sink.add(lowerer.declareLocal(temp, value));
            if (defaultValue != null) {
                sink.add(lowerer.defaultValueCheck(temp, defaultValue));
            }
            bindFrom(actual, temp, mode, kind, sink);
        } else if (AstType.MEMBER_EXPRESSION.typeName().equals(type) && mode == Mode.ASSIGN) {
            IrBuilder builder = lowerer.builder();
            if (defaultValue == null) {
                sink.add(builder.expressionStatement(
                        builder.assignmentExpression(lowerer.lowerExpression(actual), value)));
            } else {
                String temp = lowerer.names().fresh(ScratchNames.DESTRUCTURE);
                sink.add(lowerer.declareLocal(temp, value));
                sink.add(lowerer.defaultValueCheck(temp, defaultValue));
                sink.add(builder.expressionStatement(
                        builder.assignmentExpression(lowerer.lowerExpression(actual), builder.identifier(temp))));
            }
        } else {
            throw lowerer.fail(actual, "Unsupported destructuring target '" + type + "'");
        }
    }

    private void bindIdentifier(String name, NodeId value, Mode mode, String kind, List<NodeId> sink) {
        IrBuilder builder = lowerer.builder();
        if (mode == Mode.DECLARE) {
            NodeId declarator = builder.variableDeclarator(builder.identifier(name), value);
            sink.add(builder.variableDeclaration(kind == null ? "let" : kind, List.of(declarator)));
        } else {
            sink.add(builder.expressionStatement(builder.assignmentExpression(builder.identifier(name), value)));
        }
    }
}
