package io.luascript.core.lower;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.luascript.core.error.LoweringException;
import io.luascript.core.ir.ControlFlowGraph;
import io.luascript.core.ir.FunctionOptions;
import io.luascript.core.ir.IrBuilder;
import io.luascript.core.ir.NodeId;
import io.luascript.core.normalize.AstType;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers a canonical AST into IR through an {@link IrBuilder}.
 *
 * <p>Statements go through the closed {@link StatementDispatch} table; expressions through an
 * exhaustive switch over {@link AstType}. Constructs Lua lacks are desugared here: compound and
 * chained assignments, updates and assignments used as values, optional chains and {@code ??}
 * become nullary wrapper calls; switch, try, class and loop forms are delegated to their
 * dedicated lowerers. Every function body gets a control-flow graph.
 *
 * <p>Anything outside the supported subset raises a {@link LoweringException} naming the node
 * type and its position. Nothing is skipped silently.
 */
public final class IrLowerer {

    private static final Logger LOG = LoggerFactory.getLogger(IrLowerer.class);

    /** Tag attached to every function's {@code meta.auditTags}. */
    public static final String AUDIT_TAG = "knuth:awaiting-proof";

    private static final Map<String, String> COMPOUND_OPERATORS = Map.ofEntries(
            Map.entry("+=", "+"), Map.entry("-=", "-"), Map.entry("*=", "*"), Map.entry("/=", "/"),
            Map.entry("%=", "%"), Map.entry("**=", "**"), Map.entry("<<=", "<<"), Map.entry(">>=", ">>"),
            Map.entry(">>>=", ">>>"), Map.entry("&=", "&"), Map.entry("|=", "|"), Map.entry("^=", "^"),
            Map.entry("&&=", "&&"), Map.entry("||=", "||"));

    private final IrBuilder builder;
    private final String sourcePath;
    private final ScratchNames names = new ScratchNames();
    private final ControlFlowGraphBuilder graphs;
    private final PatternLowerer patterns;
    private final StatementDispatch dispatch;
    private final Deque<FunctionScope> scopes = new ArrayDeque<>();
    private CallShapes callShapes = CallShapes.empty();

    public IrLowerer(IrBuilder builder, String sourcePath) {
        this.builder = Objects.requireNonNull(builder, "builder must not be null");
        this.sourcePath = sourcePath;
        this.graphs = new ControlFlowGraphBuilder(builder);
        this.patterns = new PatternLowerer(this);
        this.dispatch = StatementDispatch.create(
                this, new LoopLowerer(this), new SwitchLowerer(this), new TryLowerer(this), new ClassLowerer(this));
        scopes.push(new FunctionScope(null, false));
    }

    // --- Entry points ---

    /**
     * Lowers a canonical {@code Program}: its directives and every top-level statement, in order,
     * into the module body.
     *
     * @return the builder, ready to {@link IrBuilder#build()}
     */
    public IrBuilder lowerProgram(JsonNode program) {
        if (!AstType.PROGRAM.typeName().equals(program.path("type").asText())) {
            throw fail(program, "Expected a Program node");
        }
        callShapes = CallShapes.scan(program);
        program.path("directives").forEach(d -> builder.directive(d.asText()));
        List<NodeId> body = lowerStatementList(program.path("body"));
        body.forEach(builder::pushToBody);
        LOG.debug("Lowered {} top-level statements into {} nodes", body.size(), builder.nodeCount());
        return builder;
    }

    /**
     * Lowers one statement.
     *
     * @param pushToBody when true, whatever the statement's placement policy places is appended to
     *                   the module body; blocks are never placed and are only returned
     * @return the primary IR node, or {@code null} for statements that produce nothing
     */
    public NodeId lowerStatement(JsonNode statement, boolean pushToBody) {
        StatementDispatch.Entry entry = entryFor(statement);
        List<NodeId> placed = new ArrayList<>();
        NodeId result = entry.handler().lower(statement, placed);
        if (entry.pushToBody() && result != null) {
            placed.add(result);
        }
        if (pushToBody) {
            placed.forEach(builder::pushToBody);
        }
        return result;
    }

    /** Lowers an expression and returns its node id. */
    public NodeId lowerExpression(JsonNode expr) {
        AstType type = AstType.fromTypeName(expr.path("type").asText())
                .orElseThrow(() -> fail(expr, "Unsupported expression type '" + expr.path("type").asText() + "'"));
        return switch (type) {
            case IDENTIFIER -> lowerIdentifier(expr);
            case LITERAL -> lowerLiteral(expr);
            case TEMPLATE_LITERAL -> lowerTemplate(expr);
            case THIS_EXPRESSION -> builder.identifier("self");
            case ARRAY_EXPRESSION -> builder.arrayExpression(lowerElements(expr.path("elements"), true));
            case OBJECT_EXPRESSION -> lowerObject(expr);
            case FUNCTION_EXPRESSION, ARROW_FUNCTION_EXPRESSION -> lowerFunction(expr, null, FunctionShape.PLAIN, null);
            case UNARY_EXPRESSION -> lowerUnary(expr);
            case UPDATE_EXPRESSION -> lowerUpdateValue(expr);
            case BINARY_EXPRESSION -> lowerBinary(expr);
            case LOGICAL_EXPRESSION -> lowerLogical(expr);
            case ASSIGNMENT_EXPRESSION -> lowerAssignmentValue(expr);
            case CONDITIONAL_EXPRESSION -> {
                NodeId test = lowerExpression(expr.get("test"));
                NodeId consequent = lowerExpression(expr.get("consequent"));
                NodeId alternate = lowerExpression(expr.get("alternate"));
                yield builder.conditionalExpression(test, consequent, alternate);
            }
            case CALL_EXPRESSION -> lowerCall(expr);
            case NEW_EXPRESSION -> {
                NodeId callee = lowerExpression(expr.get("callee"));
                yield builder.newExpression(callee, lowerElements(expr.path("arguments"), false));
            }
            case MEMBER_EXPRESSION -> lowerMember(expr);
            case CHAIN_EXPRESSION -> lowerChain(expr);
            case SEQUENCE_EXPRESSION -> lowerSequence(expr);
            case YIELD_EXPRESSION -> {
                if (expr.path("delegate").asBoolean(false)) {
                    throw fail(expr, "Delegating yield (yield*) is not supported");
                }
                yield coroutineYield(expr.get("argument"));
            }
            case AWAIT_EXPRESSION -> coroutineYield(expr.get("argument"));
            case SUPER -> throw fail(expr, "'super' is only supported as super(...) or super.method(...)");
            case CLASS_EXPRESSION -> throw fail(expr, "Class expressions are not supported; use a class declaration");
            case SPREAD_ELEMENT -> throw fail(expr, "Spread is only supported as the last call argument or array element");
            default -> throw fail(expr, "Unsupported expression type '" + type.typeName() + "'");
        };
    }

    // --- Statement plumbing ---

    private StatementDispatch.Entry entryFor(JsonNode statement) {
        String typeName = statement.path("type").asText();
        return AstType.fromTypeName(typeName)
                .filter(t -> t.category() == AstType.Category.STATEMENT)
                .flatMap(dispatch::lookup)
                .orElseThrow(() -> fail(statement, "Unsupported statement type '" + typeName + "'"));
    }

    /** Lowers {@code statement} into {@code sink}, honoring its placement policy. */
    void lowerStatementInto(JsonNode statement, List<NodeId> sink) {
        StatementDispatch.Entry entry = entryFor(statement);
        NodeId result = entry.handler().lower(statement, sink);
        if (entry.placement() != StatementDispatch.Placement.SELF && result != null) {
            sink.add(result);
        }
    }

    List<NodeId> lowerStatementList(JsonNode statements) {
        List<NodeId> out = new ArrayList<>();
        for (JsonNode statement : statements) {
            lowerStatementInto(statement, out);
        }
        return out;
    }

    /** Statements of a block body, or of a single non-block statement. */
    List<NodeId> lowerBody(JsonNode statement) {
        if (AstType.BLOCK_STATEMENT.typeName().equals(statement.path("type").asText())) {
            return lowerStatementList(statement.path("body"));
        }
        List<NodeId> out = new ArrayList<>();
        lowerStatementInto(statement, out);
        return out;
    }

    NodeId lowerBlock(JsonNode statement) {
        return builder.blockStatement(lowerBody(statement));
    }

    // --- Statement handlers ---

    NodeId lowerExpressionStatement(JsonNode statement) {
        List<NodeId> out = new ArrayList<>();
        lowerExpressionAsStatements(statement.get("expression"), out);
        if (out.isEmpty()) {
            return null;
        }
        return out.size() == 1 ? out.get(0) : builder.blockStatement(out);
    }

    /** Lowers an expression evaluated only for its effects. */
    void lowerExpressionAsStatements(JsonNode expr, List<NodeId> sink) {
        String type = expr.path("type").asText();
        switch (type) {
            case "AssignmentExpression" -> lowerAssignmentInto(expr, sink);
            case "UpdateExpression" -> updateInto(expr, sink);
            case "SequenceExpression" -> expr.path("expressions").forEach(e -> lowerExpressionAsStatements(e, sink));
            case "CallExpression" -> {
                if (AstType.SUPER.typeName().equals(expr.path("callee").path("type").asText())) {
                    sink.add(superConstructorCall(expr));
                } else {
                    sink.add(builder.expressionStatement(lowerCall(expr)));
                }
            }
            case "UnaryExpression" -> {
                if ("delete".equals(expr.path("operator").asText())) {
                    sink.add(deleteStatement(expr));
                } else {
                    sink.add(builder.expressionStatement(lowerExpression(expr)));
                }
            }
            default -> sink.add(builder.expressionStatement(lowerExpression(expr)));
        }
    }

    NodeId lowerVariableDeclaration(JsonNode declaration, List<NodeId> sink) {
        String kind = declaration.path("kind").asText("var");
        int start = sink.size();
        List<NodeId> pending = new ArrayList<>();
        for (JsonNode declarator : declaration.path("declarations")) {
            JsonNode target = declarator.get("id");
            JsonNode init = declarator.path("init");
            String targetType = target.path("type").asText();
            if (AstType.IDENTIFIER.typeName().equals(targetType)) {
                String initType = init.path("type").asText();
                if (AstType.FUNCTION_EXPRESSION.typeName().equals(initType)
                        || AstType.ARROW_FUNCTION_EXPRESSION.typeName().equals(initType)) {
                    flushDeclarators(kind, pending, sink);
                    sink.add(lowerFunction(init, target.path("name").asText(), FunctionShape.PLAIN, null));
                } else {
                    NodeId id = builder.identifier(target.path("name").asText());
                    NodeId value = init.isNull() || init.isMissingNode() ? null : lowerExpression(init);
                    pending.add(builder.variableDeclarator(id, value));
                }
            } else if (PatternLowerer.isPattern(target)) {
                flushDeclarators(kind, pending, sink);
                if (init.isNull() || init.isMissingNode()) {
                    throw fail(declarator, "Destructuring declaration requires an initializer");
                }
                patterns.declare(target, init, kind, sink);
            } else {
                throw fail(target, "Unsupported declaration target '" + targetType + "'");
            }
        }
        flushDeclarators(kind, pending, sink);
        return sink.size() > start ? sink.get(start) : null;
    }

    private void flushDeclarators(String kind, List<NodeId> pending, List<NodeId> sink) {
        if (!pending.isEmpty()) {
            sink.add(builder.variableDeclaration(kind, List.copyOf(pending)));
            pending.clear();
        }
    }

    NodeId lowerFunctionDeclaration(JsonNode fn, List<NodeId> sink) {
        NodeId id = lowerFunction(fn, fn.path("id").path("name").asText(), FunctionShape.PLAIN, null);
        sink.add(id);
        return id;
    }

    NodeId lowerReturn(JsonNode statement) {
        JsonNode argument = statement.path("argument");
        if (argument.isNull() || argument.isMissingNode()) {
            return builder.returnStatement(scope().constructor ? builder.identifier("self") : null);
        }
        return builder.returnStatement(lowerExpression(argument));
    }

    NodeId lowerIf(JsonNode statement) {
        NodeId test = lowerExpression(statement.get("test"));
        NodeId consequent = lowerBlock(statement.get("consequent"));
        JsonNode alternate = statement.path("alternate");
        NodeId alternateId = null;
        if (AstType.IF_STATEMENT.typeName().equals(alternate.path("type").asText())) {
            alternateId = lowerIf(alternate);
        } else if (alternate.isObject()) {
            alternateId = lowerBlock(alternate);
        }
        return builder.ifStatement(test, consequent, alternateId);
    }

    NodeId lowerThrow(JsonNode statement) {
        NodeId value = lowerExpression(statement.get("argument"));
        return builder.expressionStatement(callGlobal("error", List.of(value, builder.literal(0))));
    }

    NodeId rejectLabeled(JsonNode statement) {
        throw fail(statement, "Labeled statements are not supported");
    }

    // --- Assignments and updates ---

    void lowerAssignmentInto(JsonNode assign, List<NodeId> sink) {
        assign(assign, sink, false);
    }

    /**
     * Lowers an assignment into {@code sink}.
     *
     * @param readBack also pin the target so the caller can read the assigned value
     * @return the target location, or {@code null} for destructuring
     */
    private Place assign(JsonNode assign, List<NodeId> sink, boolean readBack) {
        String operator = assign.path("operator").asText("=");
        JsonNode left = assign.get("left");
        JsonNode right = assign.get("right");
        if (PatternLowerer.isPattern(left)) {
            if (!"=".equals(operator)) {
                throw fail(assign, "Destructuring requires plain '=' assignment");
            }
            patterns.assign(left, right, sink);
            return null;
        }
        requireAssignable(left);
        if ("=".equals(operator)) {
            Place place = readBack ? place(left, sink) : Place.direct(left);
            NodeId target = place.node(this);
            sink.add(builder.expressionStatement(builder.assignmentExpression(target, assignedValue(left, right))));
            return place;
        }
        Place place = place(left, sink);
        if ("??=".equals(operator)) {
            NodeId test = isNil(place.node(this));
            NodeId assignment = builder.expressionStatement(
                    builder.assignmentExpression(place.node(this), lowerExpression(right)));
            sink.add(builder.ifStatement(test, builder.blockStatement(List.of(assignment)), null));
            return place;
        }
        String binary = COMPOUND_OPERATORS.get(operator);
        if (binary == null) {
            throw fail(assign, "Unsupported assignment operator '" + operator + "'");
        }
        NodeId target = place.node(this);
        NodeId current = place.node(this);
        NodeId operand = lowerExpression(right);
        NodeId value = "&&".equals(binary) || "||".equals(binary)
                ? builder.logicalExpression(current, binary, operand)
                : builder.binaryExpression(current, binary, operand);
        sink.add(builder.expressionStatement(builder.assignmentExpression(target, value)));
        return place;
    }

    /** Functions stored into a member get a receiver exactly when their calls will pass one. */
    private NodeId assignedValue(JsonNode left, JsonNode right) {
        boolean memberTarget = AstType.MEMBER_EXPRESSION.typeName().equals(left.path("type").asText());
        String valueType = right.path("type").asText();
        if (memberTarget && AstType.FUNCTION_EXPRESSION.typeName().equals(valueType)) {
            FunctionShape shape = CallShapes.isReceiverlessAssignment(left, right) ? FunctionShape.PLAIN : FunctionShape.METHOD;
            return lowerFunction(right, null, shape, null);
        }
        if (memberTarget
                && AstType.ARROW_FUNCTION_EXPRESSION.typeName().equals(valueType)
                && !CallShapes.isReceiverlessAssignment(left, right)) {
            return lowerFunction(right, null, FunctionShape.IGNORED_RECEIVER, null);
        }
        return lowerExpression(right);
    }

    private void requireAssignable(JsonNode target) {
        String type = target.path("type").asText();
        if (!AstType.IDENTIFIER.typeName().equals(type) && !AstType.MEMBER_EXPRESSION.typeName().equals(type)) {
            throw fail(target, "Invalid assignment target '" + type + "'");
        }
    }

    /** Assignment used as a value: a wrapper performs it and returns the assigned target. */
    private NodeId lowerAssignmentValue(JsonNode assign) {
        JsonNode left = assign.get("left");
        if (PatternLowerer.isPattern(left)) {
            throw fail(assign, "Destructuring assignment cannot be used as a value");
        }
        List<NodeId> statements = new ArrayList<>();
        Place place = assign(assign, statements, true);
        statements.add(builder.returnStatement(place.node(this)));
        return invokeWrapped(statements);
    }

    private void updateInto(JsonNode update, List<NodeId> sink) {
        JsonNode argument = update.get("argument");
        requireAssignable(argument);
        increment(place(argument, sink), update, sink);
    }

    private void increment(Place place, JsonNode update, List<NodeId> sink) {
        NodeId target = place.node(this);
        NodeId value = builder.binaryExpression(
                place.node(this), "++".equals(update.path("operator").asText()) ? "+" : "-", builder.literal(1));
        sink.add(builder.expressionStatement(builder.assignmentExpression(target, value)));
    }

    /**
     * {@code ++i} as a value returns the new value; {@code i++} snapshots the old value in
     * {@code _t} and returns it.
     */
    private NodeId lowerUpdateValue(JsonNode update) {
        JsonNode argument = update.get("argument");
        requireAssignable(argument);
        List<NodeId> statements = new ArrayList<>();
        Place place = place(argument, statements);
        if (update.path("prefix").asBoolean(false)) {
            increment(place, update, statements);
            statements.add(builder.returnStatement(place.node(this)));
        } else {
            NodeId snapshot = builder.variableDeclarator(
                    builder.identifier(ScratchNames.UPDATE_SNAPSHOT), place.node(this));
            statements.add(builder.variableDeclaration("let", List.of(snapshot)));
            increment(place, update, statements);
            statements.add(builder.returnStatement(builder.identifier(ScratchNames.UPDATE_SNAPSHOT)));
        }
        return invokeWrapped(statements);
    }

    /**
     * Pins a read-modify-write target: a member's object and computed key are evaluated once into
     * {@code __place_N} locals appended to {@code sink}, unless reading them has no effects.
     */
    private Place place(JsonNode target, List<NodeId> sink) {
        if (!AstType.MEMBER_EXPRESSION.typeName().equals(target.path("type").asText())) {
            return Place.direct(target);
        }
        JsonNode object = target.get("object");
        String objectLocal = null;
        if (!isPure(object)) {
            objectLocal = names.fresh(ScratchNames.PLACE);
            sink.add(declareLocal(objectLocal, lowerExpression(object)));
        }
        String keyLocal = null;
        if (target.path("computed").asBoolean(false) && !isPure(target.get("property"))) {
            keyLocal = names.fresh(ScratchNames.PLACE);
            sink.add(declareLocal(keyLocal, lowerExpression(target.get("property"))));
        }
        return new Place(target, objectLocal, keyLocal);
    }

    /** Identifiers, literals, {@code this}, {@code super} and static member chains over them. */
    private static boolean isPure(JsonNode expr) {
        String type = expr.path("type").asText();
        if (AstType.IDENTIFIER.typeName().equals(type)
                || AstType.LITERAL.typeName().equals(type)
                || AstType.THIS_EXPRESSION.typeName().equals(type)
                || AstType.SUPER.typeName().equals(type)) {
            return true;
        }
        if (AstType.MEMBER_EXPRESSION.typeName().equals(type)) {
            return isPure(expr.get("object"))
                    && (!expr.path("computed").asBoolean(false) || isPure(expr.get("property")));
        }
        return false;
    }

    /**
     * An assignable location. Each {@link #node} call builds fresh IR for it.
     *
     * @param target      the source expression
     * @param objectLocal local holding the member's object, or {@code null} to re-lower it
     * @param keyLocal    local holding the computed key, or {@code null} to re-lower it
     */
    private record Place(JsonNode target, String objectLocal, String keyLocal) {

        static Place direct(JsonNode target) {
            return new Place(target, null, null);
        }

        NodeId node(IrLowerer lowerer) {
            if (objectLocal == null && keyLocal == null) {
                return lowerer.lowerExpression(target);
            }
            IrBuilder builder = lowerer.builder;
            NodeId object = objectLocal != null ? builder.identifier(objectLocal) : lowerer.memberObject(target);
            if (keyLocal != null) {
                return builder.memberExpression(object, builder.identifier(keyLocal), true);
            }
            return lowerer.memberOf(object, target);
        }
    }

    private NodeId deleteStatement(JsonNode unary) {
        JsonNode argument = unary.get("argument");
        if (!AstType.MEMBER_EXPRESSION.typeName().equals(argument.path("type").asText())) {
            throw fail(unary, "delete is only supported on member expressions");
        }
        NodeId target = lowerExpression(argument);
        return builder.expressionStatement(builder.assignmentExpression(target, builder.literal((Object) null)));
    }

    // --- Expressions ---

    private NodeId lowerIdentifier(JsonNode expr) {
        String name = expr.path("name").asText();
        return switch (name) {
            case "undefined" -> builder.undefinedLiteral();
            case "NaN" -> builder.binaryExpression(builder.literal(0), "/", builder.literal(0));
            case "Infinity" -> member(builder.identifier("math"), "huge");
            default -> builder.identifier(name);
        };
    }

    private NodeId lowerLiteral(JsonNode expr) {
        if (expr.has("regex")) {
            throw fail(expr, "Regular expression literals are not supported");
        }
        JsonNode value = expr.path("value");
        if (value.isMissingNode() || value.isContainerNode()) {
            throw fail(expr, "Literal value must be a scalar");
        }
        return builder.literal(value, expr.path("raw").asText(null));
    }

    /** Template literal: a {@code +} chain of string pieces and {@code tostring(expr)} calls. */
    private NodeId lowerTemplate(JsonNode expr) {
        JsonNode quasis = expr.path("quasis");
        JsonNode expressions = expr.path("expressions");
        NodeId result = null;
        for (int i = 0; i < quasis.size(); i++) {
            String text = quasis.get(i).path("value").path("cooked").asText("");
            if (!text.isEmpty()) {
                result = concat(result, builder.literal(text));
            }
            if (i < expressions.size()) {
                NodeId value = lowerExpression(expressions.get(i));
                result = concat(result, callGlobal("tostring", List.of(value)));
            }
        }
        return result == null ? builder.literal("") : result;
    }

    private NodeId concat(NodeId left, NodeId right) {
        return left == null ? right : builder.binaryExpression(left, "+", right);
    }

    private NodeId lowerObject(JsonNode expr) {
        List<NodeId> properties = new ArrayList<>();
        for (JsonNode property : expr.path("properties")) {
            if (AstType.SPREAD_ELEMENT.typeName().equals(property.path("type").asText())) {
                throw fail(property, "Object spread is not supported");
            }
            String kind = property.path("kind").asText("init");
            if (!"init".equals(kind)) {
                throw fail(property, "Getters and setters are not supported");
            }
            boolean computed = property.path("computed").asBoolean(false);
            JsonNode key = property.get("key");
            NodeId keyId = computed || !AstType.IDENTIFIER.typeName().equals(key.path("type").asText())
                    ? lowerExpression(key)
                    : builder.identifier(key.path("name").asText());
            JsonNode value = property.get("value");
            String valueType = value.path("type").asText();
            NodeId valueId;
            if (AstType.FUNCTION_EXPRESSION.typeName().equals(valueType)) {
                valueId = lowerFunction(value, null, FunctionShape.METHOD, null);
            } else if (AstType.ARROW_FUNCTION_EXPRESSION.typeName().equals(valueType)) {
                valueId = lowerFunction(value, null, FunctionShape.IGNORED_RECEIVER, null);
            } else {
                valueId = lowerExpression(value);
            }
            properties.add(builder.property(keyId, valueId, computed));
        }
        return builder.objectExpression(properties);
    }

    private NodeId lowerUnary(JsonNode expr) {
        String operator = expr.path("operator").asText();
        JsonNode argument = expr.get("argument");
        switch (operator) {
            case "delete" -> {
                List<NodeId> statements = new ArrayList<>();
                statements.add(deleteStatement(expr));
                statements.add(builder.returnStatement(builder.literal(true)));
                return invokeWrapped(statements);
            }
            case "void" -> {
                if (AstType.LITERAL.typeName().equals(argument.path("type").asText())) {
                    return builder.undefinedLiteral();
                }
                List<NodeId> statements = new ArrayList<>();
                lowerExpressionAsStatements(argument, statements);
                statements.add(builder.returnStatement(builder.undefinedLiteral()));
                return invokeWrapped(statements);
            }
            case "+" -> {
                return callGlobal("tonumber", List.of(lowerExpression(argument)));
            }
            case "-", "!", "~", "typeof" -> {
                return builder.unaryExpression(operator, lowerExpression(argument));
            }
            default -> throw fail(expr, "Unsupported unary operator '" + operator + "'");
        }
    }

    private NodeId lowerBinary(JsonNode expr) {
        String operator = expr.path("operator").asText();
        NodeId left = lowerExpression(expr.get("left"));
        NodeId right = lowerExpression(expr.get("right"));
        return switch (operator) {
            case "in" -> builder.binaryExpression(builder.memberExpression(right, left, true), "!==",
                    builder.literal((Object) null));
            case "instanceof" -> builder.binaryExpression(callGlobal("getmetatable", List.of(left)), "===", right);
            default -> builder.binaryExpression(left, operator, right);
        };
    }

    private NodeId lowerLogical(JsonNode expr) {
        String operator = expr.path("operator").asText();
        if ("??".equals(operator)) {
            return lowerNullish(expr);
        }
        if (!"&&".equals(operator) && !"||".equals(operator)) {
            throw fail(expr, "Unsupported logical operator '" + operator + "'");
        }
        NodeId left = lowerExpression(expr.get("left"));
        NodeId right = lowerExpression(expr.get("right"));
        return builder.logicalExpression(left, operator, right);
    }

    /** {@code a ?? b}: keeps {@code a} unless it is nil. */
    private NodeId lowerNullish(JsonNode expr) {
        String temp = names.fresh(ScratchNames.NULLISH);
        List<NodeId> statements = new ArrayList<>();
        NodeId left = lowerExpression(expr.get("left"));
        statements.add(declareLocal(temp, left));
        NodeId test = isNil(builder.identifier(temp));
        NodeId fallback = builder.expressionStatement(
                builder.assignmentExpression(builder.identifier(temp), lowerExpression(expr.get("right"))));
        statements.add(builder.ifStatement(test, builder.blockStatement(List.of(fallback)), null));
        statements.add(builder.returnStatement(builder.identifier(temp)));
        return invokeWrapped(statements);
    }

    private NodeId lowerSequence(JsonNode expr) {
        JsonNode expressions = expr.path("expressions");
        if (expressions.size() == 1) {
            return lowerExpression(expressions.get(0));
        }
        List<NodeId> statements = new ArrayList<>();
        for (int i = 0; i < expressions.size() - 1; i++) {
            lowerExpressionAsStatements(expressions.get(i), statements);
        }
        statements.add(builder.returnStatement(lowerExpression(expressions.get(expressions.size() - 1))));
        return invokeWrapped(statements);
    }

    private NodeId coroutineYield(JsonNode argument) {
        List<NodeId> args = argument == null || argument.isNull() ? List.of() : List.of(lowerExpression(argument));
        return builder.callExpression(member(builder.identifier("coroutine"), "yield"), args, false);
    }

    // --- Calls and members ---

    private NodeId lowerCall(JsonNode call) {
        JsonNode callee = call.get("callee");
        String calleeType = callee.path("type").asText();
        if (AstType.SUPER.typeName().equals(calleeType)) {
            throw fail(call, "super(...) is only supported as a statement inside a constructor");
        }
        if (AstType.MEMBER_EXPRESSION.typeName().equals(calleeType)
                && AstType.SUPER.typeName().equals(callee.path("object").path("type").asText())) {
            return superMethodCall(call);
        }
        NodeId calleeId = lowerExpression(callee);
        List<NodeId> args = lowerElements(call.path("arguments"), false);
        return builder.callExpression(calleeId, args, isMethodCall(callee));
    }

    /** Whether the call passes its receiver; see {@link CallShapes}. */
    boolean isMethodCall(JsonNode callee) {
        return callShapes.passesReceiver(callee);
    }

    private NodeId lowerMember(JsonNode expr) {
        return memberOf(memberObject(expr), expr);
    }

    private NodeId memberObject(JsonNode member) {
        JsonNode object = member.get("object");
        return AstType.SUPER.typeName().equals(object.path("type").asText())
                ? superClassReference(member)
                : lowerExpression(object);
    }

    private NodeId memberOf(NodeId objectId, JsonNode member) {
        boolean computed = member.path("computed").asBoolean(false);
        JsonNode property = member.get("property");
        NodeId propertyId = computed ? lowerExpression(property) : builder.identifier(property.path("name").asText());
        return builder.memberExpression(objectId, propertyId, computed);
    }

    /**
     * Optional chain: every optional link stores the value so far in a {@code __opt_N} local and
     * returns nil from the wrapper when it is nil.
     */
    private NodeId lowerChain(JsonNode chain) {
        List<JsonNode> links = new ArrayList<>();
        JsonNode current = chain.get("expression");
        while (true) {
            String type = current.path("type").asText();
            if (AstType.MEMBER_EXPRESSION.typeName().equals(type)) {
                links.add(0, current);
                current = current.get("object");
            } else if (AstType.CALL_EXPRESSION.typeName().equals(type)) {
                links.add(0, current);
                current = current.get("callee");
            } else {
                break;
            }
        }
        List<NodeId> statements = new ArrayList<>();
        NodeId value = lowerExpression(current);
        for (JsonNode link : links) {
            boolean optional = link.path("optional").asBoolean(false);
            if (optional) {
                String temp = names.fresh(ScratchNames.OPTIONAL);
                statements.add(declareLocal(temp, value));
                NodeId bail = builder.returnStatement(builder.literal((Object) null));
                statements.add(builder.ifStatement(isNil(builder.identifier(temp)), builder.blockStatement(List.of(bail)),
                        null));
                value = builder.identifier(temp);
            }
            if (AstType.MEMBER_EXPRESSION.typeName().equals(link.path("type").asText())) {
                value = memberOf(value, link);
            } else {
                boolean methodCall = !optional && isMethodCall(link.get("callee"));
                value = builder.callExpression(value, lowerElements(link.path("arguments"), false), methodCall);
            }
        }
        statements.add(builder.returnStatement(value));
        return invokeWrapped(statements);
    }

    /** Call arguments or array elements; spread only in last position, holes only for arrays. */
    private List<NodeId> lowerElements(JsonNode elements, boolean holesAllowed) {
        List<NodeId> out = new ArrayList<>();
        for (int i = 0; i < elements.size(); i++) {
            JsonNode element = elements.get(i);
            if (element.isNull()) {
                if (!holesAllowed) {
                    throw new LoweringException("Holes are only allowed in array literals", sourcePath, "null", -1, -1);
                }
                out.add(null);
            } else if (AstType.SPREAD_ELEMENT.typeName().equals(element.path("type").asText())) {
                if (i != elements.size() - 1) {
                    throw fail(element, "Spread is only supported in the last position");
                }
                out.add(tableUnpack(List.of(lowerExpression(element.get("argument")))));
            } else {
                out.add(lowerExpression(element));
            }
        }
        return out;
    }

    // --- super ---

    private NodeId superClassReference(JsonNode at) {
        ClassContext cls = scope().classContext;
        if (cls == null || cls.superClass() == null || cls.superClass().isNull()) {
            throw fail(at, "'super' used outside a derived class");
        }
        return lowerExpression(cls.superClass());
    }

    /** {@code super(args)}: {@code self = setmetatable(Base.new(args), Class)}. */
    private NodeId superConstructorCall(JsonNode call) {
        if (!scope().constructor) {
            throw fail(call, "super(...) is only supported inside a constructor");
        }
        NodeId base = superClassReference(call);
        NodeId created = builder.callExpression(member(base, "new"), lowerElements(call.path("arguments"), false), false);
        NodeId value = callGlobal("setmetatable", List.of(created, builder.identifier(scope().classContext.className())));
        return builder.expressionStatement(builder.assignmentExpression(builder.identifier("self"), value));
    }

    /** {@code super.m(args)}: {@code Base.m(self, args)}. */
    private NodeId superMethodCall(JsonNode call) {
        NodeId callee = lowerMember(call.get("callee"));
        List<NodeId> args = new ArrayList<>();
        args.add(builder.identifier("self"));
        args.addAll(lowerElements(call.path("arguments"), false));
        return builder.callExpression(callee, args, false);
    }

    // --- Functions ---

    /**
     * Lowers a function declaration, expression or arrow.
     *
     * @param declarationName name for a {@code FunctionDeclaration}, or {@code null} for an expression
     * @param shape           receiver and constructor handling
     * @param extraMeta       annotations merged into the node's {@code meta}, or {@code null}
     */
    NodeId lowerFunction(JsonNode fn, String declarationName, FunctionShape shape, ObjectNode extraMeta) {
        FunctionScope parent = scope();
        ClassContext cls = shape.classContext() != null ? shape.classContext() : parent.classContext;
        scopes.push(new FunctionScope(cls, shape.constructor()));
        try {
            List<NodeId> params = new ArrayList<>();
            List<NodeId> prelude = new ArrayList<>();
            NodeId restParam = null;
            if (shape.receiver() != null) {
                params.add(builder.identifier(shape.receiver()));
            }
            JsonNode rawParams = fn.path("params");
            for (int i = 0; i < rawParams.size(); i++) {
                JsonNode param = rawParams.get(i);
                String type = param.path("type").asText();
                if (AstType.IDENTIFIER.typeName().equals(type)) {
                    params.add(builder.identifier(param.path("name").asText()));
                } else if (AstType.ASSIGNMENT_PATTERN.typeName().equals(type)) {
                    JsonNode left = param.get("left");
                    String name = AstType.IDENTIFIER.typeName().equals(left.path("type").asText())
                            ? left.path("name").asText()
                            : names.fresh(ScratchNames.DESTRUCTURE);
                    params.add(builder.identifier(name));
                    prelude.add(defaultValueCheck(name, param.get("right")));
                    if (PatternLowerer.isPattern(left)) {
                        patterns.bindFrom(left, name, PatternLowerer.Mode.DECLARE, "let", prelude);
                    }
                } else if (PatternLowerer.isPattern(param)) {
                    String temp = names.fresh(ScratchNames.DESTRUCTURE);
                    params.add(builder.identifier(temp));
                    patterns.bindFrom(param, temp, PatternLowerer.Mode.DECLARE, "let", prelude);
                } else if (AstType.REST_ELEMENT.typeName().equals(type)) {
                    JsonNode argument = param.get("argument");
                    if (i != rawParams.size() - 1 || !AstType.IDENTIFIER.typeName().equals(argument.path("type").asText())) {
                        throw fail(param, "Rest parameter must be a trailing identifier");
                    }
                    String name = argument.path("name").asText();
                    restParam = builder.identifier(name);
                    NodeId packed = builder.arrayExpression(List.of(builder.varargExpression()));
                    prelude.add(declareLocal(name, packed));
                } else {
                    throw fail(param, "Unsupported parameter '" + type + "'");
                }
            }
            List<NodeId> statements = new ArrayList<>(prelude);
            JsonNode body = fn.path("body");
            if (AstType.BLOCK_STATEMENT.typeName().equals(body.path("type").asText())) {
                statements.addAll(lowerStatementList(body.path("body")));
            } else {
                statements.add(builder.returnStatement(lowerExpression(body)));
            }

            ObjectNode meta = IrBuilder.newMeta();
            if (extraMeta != null) {
                meta.setAll(extraMeta);
            }
            if (fn.path("generator").asBoolean(false)) {
                meta.put("generator", true);
            }
            if (fn.path("async").asBoolean(false)) {
                meta.put("async", true);
            }
            return finishFunction(declarationName, params, statements, new FunctionOptions(restParam, meta));
        } finally {
            scopes.pop();
        }
    }

    private NodeId finishFunction(String name, List<NodeId> params, List<NodeId> statements, FunctionOptions options) {
        ControlFlowGraph graph = graphs.build(statements);
        ObjectNode meta = options.meta() == null ? IrBuilder.newMeta() : options.meta();
        ObjectNode cfg = meta.putObject("cfg");
        cfg.put("id", graph.id());
        cfg.put("entry", graph.entry().id());
        cfg.put("exit", graph.exit().id());
        ArrayNode tags = meta.putArray("auditTags");
        tags.add(AUDIT_TAG);
        NodeId body = builder.blockStatement(statements);
        FunctionOptions withGraph = options.withMeta(meta);
        return name == null
                ? builder.functionExpression(params, body, withGraph)
                : builder.functionDeclaration(name, params, body, withGraph);
    }

    /** A parameterless function expression over already-lowered statements. */
    NodeId syntheticFunction(List<NodeId> statements) {
        return finishFunction(null, List.of(), statements, FunctionOptions.none());
    }

    /** {@code (function() <statements> end)()}. */
    NodeId invokeWrapped(List<NodeId> statements) {
        return builder.callExpression(syntheticFunction(statements), List.of(), false);
    }

    /** Runs {@code body} in a fresh function scope so jumps cannot cross into the enclosing one. */
    <T> T inIsolatedScope(Supplier<T> body) {
        scopes.push(new FunctionScope(scope().classContext, false));
        try {
            return body.get();
        } finally {
            scopes.pop();
        }
    }

    /** {@code if name == nil then name = <default> end}. */
    NodeId defaultValueCheck(String name, JsonNode defaultValue) {
        NodeId test = isNil(builder.identifier(name));
        NodeId assign = builder.expressionStatement(
                builder.assignmentExpression(builder.identifier(name), lowerExpression(defaultValue)));
        return builder.ifStatement(test, builder.blockStatement(List.of(assign)), null);
    }

    // --- Shared helpers ---

    IrBuilder builder() {
        return builder;
    }

    ScratchNames names() {
        return names;
    }

    PatternLowerer patterns() {
        return patterns;
    }

    StatementDispatch dispatch() {
        return dispatch;
    }

    FunctionScope scope() {
        return scopes.peek();
    }

    NodeId declareLocal(String name, NodeId value) {
        return builder.variableDeclaration("let", List.of(builder.variableDeclarator(builder.identifier(name), value)));
    }

    NodeId isNil(NodeId value) {
        return builder.binaryExpression(value, "===", builder.literal((Object) null));
    }

    NodeId member(NodeId object, String property) {
        return builder.memberExpression(object, builder.identifier(property), false);
    }

    NodeId callGlobal(String function, List<NodeId> args) {
        return builder.callExpression(builder.identifier(function), args, false);
    }

    NodeId tableUnpack(List<NodeId> args) {
        return builder.callExpression(member(builder.identifier("table"), "unpack"), args, false);
    }

    LoweringException fail(JsonNode node, String message) {
        JsonNode start = node == null ? null : node.path("loc").path("start");
        return new LoweringException(
                message,
                sourcePath,
                node == null ? "<missing>" : node.path("type").asText("<missing>"),
                start == null ? -1 : start.path("line").asInt(-1),
                start == null ? -1 : start.path("column").asInt(-1));
    }

    // --- Scope types ---

    /**
     * Class a function body belongs to.
     *
     * @param className  the Lua table name of the class
     * @param superClass the {@code extends} expression, or JSON null
     */
    record ClassContext(String className, JsonNode superClass) {}

    /**
     * How a function is lowered.
     *
     * @param receiver     implicit first parameter, or {@code null}
     * @param constructor  bare {@code return} yields {@code self}
     * @param classContext class whose {@code super} is visible, or {@code null} to inherit
     */
    record FunctionShape(String receiver, boolean constructor, ClassContext classContext) {
        static final FunctionShape PLAIN = new FunctionShape(null, false, null);
        static final FunctionShape METHOD = new FunctionShape("self", false, null);
        static final FunctionShape IGNORED_RECEIVER = new FunctionShape("_", false, null);
    }

    /** Per-function lowering state. */
    static final class FunctionScope {
        final Deque<JumpTarget> jumps = new ArrayDeque<>();
        final ClassContext classContext;
        final boolean constructor;

        FunctionScope(ClassContext classContext, boolean constructor) {
            this.classContext = classContext;
            this.constructor = constructor;
        }
    }
}
