package io.luascript.core.ir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Append-only author of one IR document.
 *
 * <p>Owns the node table (an arena keyed by {@link NodeId}), the ordered module body and the
 * registered control-flow graphs. Every node constructor allocates exactly one fresh id from this
 * builder's {@link IdGenerator} and never touches nodes created earlier. References passed to a
 * constructor must already belong to this builder.
 *
 * <p>A builder is used by one compilation on one thread and discarded after {@link #build()}.
 */
public final class IrBuilder {

    /** Prefix of node ids. */
    public static final String NODE_PREFIX = "id";

    private static final JsonNodeFactory JSON = JsonNodeFactory.instance;

    private final String schemaVersion;
    private final IdGenerator ids;
    private final Map<NodeId, ObjectNode> nodes = new LinkedHashMap<>();
    private final List<NodeId> body = new ArrayList<>();
    private final Map<String, ControlFlowGraph> graphs = new LinkedHashMap<>();
    private final List<String> directives = new ArrayList<>();
    private final ObjectNode metadata = JSON.objectNode();
    private String sourcePath = "<anonymous>";
    private String sourceHash = "";
    private boolean built;

    public IrBuilder() {
        this(IrDocument.CURRENT_SCHEMA_VERSION, new IdGenerator());
    }

    public IrBuilder(String schemaVersion, IdGenerator ids) {
        this.schemaVersion = Objects.requireNonNull(schemaVersion, "schemaVersion must not be null");
        this.ids = Objects.requireNonNull(ids, "ids must not be null");
    }

    /** Creates an empty {@code meta} bag for use with {@link FunctionOptions}. */
    public static ObjectNode newMeta() {
        return JSON.objectNode();
    }

    // --- Module descriptor ---

    public IrBuilder source(String path, String hash) {
        ensureOpen();
        this.sourcePath = path;
        this.sourceHash = hash;
        return this;
    }

    public IrBuilder directive(String directive) {
        ensureOpen();
        directives.add(Objects.requireNonNull(directive, "directive must not be null"));
        return this;
    }

    public IrBuilder metadata(String key, JsonNode value) {
        ensureOpen();
        metadata.set(key, value == null ? JSON.nullNode() : value.deepCopy());
        return this;
    }

    public IrBuilder metadata(String key, String value) {
        return metadata(key, JSON.textNode(value));
    }

    // --- Ids, body and graphs ---

    /** Allocates an id with a caller-chosen prefix, e.g. {@code cfg} or {@code bb}. */
    public String nextId(String prefix) {
        ensureOpen();
        return ids.next(prefix);
    }

    /** Appends a top-level statement to the module body. */
    public void pushToBody(NodeId id) {
        ensureOpen();
        requireKnown(id, "body entry");
        body.add(id);
    }

    public void registerControlFlowGraph(String id, ControlFlowGraph graph) {
        ensureOpen();
        Objects.requireNonNull(graph, "graph must not be null");
        if (!id.equals(graph.id())) {
            throw new IllegalArgumentException("Graph id mismatch: " + id + " vs " + graph.id());
        }
        if (graphs.containsKey(id)) {
            throw new IllegalStateException("Control-flow graph already registered: " + id);
        }
        graphs.put(id, graph);
    }

    public int nodeCount() {
        return nodes.size();
    }

    /** Read-only view of a node created by this builder. */
    public IrNode node(NodeId id) {
        requireKnown(id, "lookup");
        return new IrNode(nodes.get(id));
    }

    // --- Expressions ---

    public NodeId identifier(String name) {
        ObjectNode n = JSON.objectNode();
        n.put("name", requireText(name, "name"));
        return register(NodeKind.IDENTIFIER, n);
    }

    /**
     * Creates a literal from a Java scalar: {@code String}, {@code Number}, {@code Boolean} or
     * {@code null}.
     */
    public NodeId literal(Object value) {
        JsonNode json;
        String raw;
        if (value == null) {
            json = JSON.nullNode();
            raw = "null";
        } else if (value instanceof String s) {
            json = JSON.textNode(s);
            raw = json.toString();
        } else if (value instanceof Boolean b) {
            json = JSON.booleanNode(b);
            raw = b.toString();
        } else if (value instanceof Integer || value instanceof Long) {
            json = JSON.numberNode(((Number) value).longValue());
            raw = value.toString();
        } else if (value instanceof Number num) {
            json = JSON.numberNode(num.doubleValue());
            raw = json.asText();
        } else {
            throw new IllegalArgumentException("Unsupported literal value type: " + value.getClass().getName());
        }
        return literal(json, raw);
    }

    /** Creates a literal from a JSON scalar, keeping the source spelling in {@code raw}. */
    public NodeId literal(JsonNode value, String raw) {
        Objects.requireNonNull(value, "value must not be null");
        if (value.isContainerNode() || value.isMissingNode()) {
            throw new IllegalArgumentException("Literal value must be a JSON scalar, got " + value.getNodeType());
        }
        String literalKind;
        if (value.isTextual()) {
            literalKind = "string";
        } else if (value.isNumber()) {
            literalKind = "number";
        } else if (value.isBoolean()) {
            literalKind = "boolean";
        } else {
            literalKind = "null";
        }
        ObjectNode n = JSON.objectNode();
        n.set("value", value.deepCopy());
        n.put("raw", raw == null ? value.toString() : raw);
        n.put("literalKind", literalKind);
        return register(NodeKind.LITERAL, n);
    }

    public NodeId undefinedLiteral() {
        ObjectNode n = JSON.objectNode();
        n.putNull("value");
        n.put("raw", "undefined");
        n.put("literalKind", "undefined");
        return register(NodeKind.LITERAL, n);
    }

    public NodeId varargExpression() {
        return register(NodeKind.VARARG_EXPRESSION, JSON.objectNode());
    }

    public NodeId binaryExpression(NodeId left, String operator, NodeId right) {
        ObjectNode n = JSON.objectNode();
        putRef(n, "left", left);
        n.put("operator", requireText(operator, "operator"));
        putRef(n, "right", right);
        return register(NodeKind.BINARY_EXPRESSION, n);
    }

    public NodeId logicalExpression(NodeId left, String operator, NodeId right) {
        if (!"&&".equals(operator) && !"||".equals(operator)) {
            throw new IllegalArgumentException("Logical operator must be && or ||, got " + operator);
        }
        ObjectNode n = JSON.objectNode();
        putRef(n, "left", left);
        n.put("operator", operator);
        putRef(n, "right", right);
        return register(NodeKind.LOGICAL_EXPRESSION, n);
    }

    public NodeId unaryExpression(String operator, NodeId argument) {
        ObjectNode n = JSON.objectNode();
        n.put("operator", requireText(operator, "operator"));
        putRef(n, "argument", argument);
        return register(NodeKind.UNARY_EXPRESSION, n);
    }

    /** Plain assignment; compound operators are desugared before reaching the builder. */
    public NodeId assignmentExpression(NodeId left, NodeId right) {
        ObjectNode n = JSON.objectNode();
        putRef(n, "left", left);
        n.put("operator", "=");
        putRef(n, "right", right);
        return register(NodeKind.ASSIGNMENT_EXPRESSION, n);
    }

    public NodeId callExpression(NodeId callee, List<NodeId> arguments, boolean methodCall) {
        ObjectNode n = JSON.objectNode();
        putRef(n, "callee", callee);
        putRefs(n, "arguments", arguments, false);
        n.put("methodCall", methodCall);
        return register(NodeKind.CALL_EXPRESSION, n);
    }

    public NodeId newExpression(NodeId callee, List<NodeId> arguments) {
        ObjectNode n = JSON.objectNode();
        putRef(n, "callee", callee);
        putRefs(n, "arguments", arguments, false);
        return register(NodeKind.NEW_EXPRESSION, n);
    }

    public NodeId memberExpression(NodeId object, NodeId property, boolean computed) {
        ObjectNode n = JSON.objectNode();
        putRef(n, "object", object);
        putRef(n, "property", property);
        n.put("computed", computed);
        return register(NodeKind.MEMBER_EXPRESSION, n);
    }

    public NodeId conditionalExpression(NodeId test, NodeId consequent, NodeId alternate) {
        ObjectNode n = JSON.objectNode();
        putRef(n, "test", test);
        putRef(n, "consequent", consequent);
        putRef(n, "alternate", alternate);
        return register(NodeKind.CONDITIONAL_EXPRESSION, n);
    }

    /** Array literal; {@code null} elements are holes. */
    public NodeId arrayExpression(List<NodeId> elements) {
        ObjectNode n = JSON.objectNode();
        putRefs(n, "elements", elements, true);
        return register(NodeKind.ARRAY_EXPRESSION, n);
    }

    public NodeId objectExpression(List<NodeId> properties) {
        ObjectNode n = JSON.objectNode();
        putRefs(n, "properties", properties, false);
        return register(NodeKind.OBJECT_EXPRESSION, n);
    }

    public NodeId property(NodeId key, NodeId value, boolean computed) {
        ObjectNode n = JSON.objectNode();
        putRef(n, "key", key);
        putRef(n, "value", value);
        n.put("computed", computed);
        return register(NodeKind.PROPERTY, n);
    }

    public NodeId functionExpression(List<NodeId> params, NodeId body, FunctionOptions options) {
        ObjectNode n = JSON.objectNode();
        putFunctionParts(n, params, body, options);
        return register(NodeKind.FUNCTION_EXPRESSION, n);
    }

    // --- Statements ---

    /** Declaration with the {@code let} binding kind. */
    public NodeId variableDeclaration(List<NodeId> declarators) {
        return variableDeclaration("let", declarators);
    }

    public NodeId variableDeclaration(String declarationKind, List<NodeId> declarators) {
        if (declarators.isEmpty()) {
            throw new IllegalArgumentException("A declaration needs at least one declarator");
        }
        ObjectNode n = JSON.objectNode();
        n.put("declarationKind", requireText(declarationKind, "declarationKind"));
        putRefs(n, "declarations", declarators, false);
        return register(NodeKind.VARIABLE_DECLARATION, n);
    }

    public NodeId variableDeclarator(NodeId target, NodeId init) {
        ObjectNode n = JSON.objectNode();
        putRef(n, "target", target);
        putOptionalRef(n, "init", init);
        return register(NodeKind.VARIABLE_DECLARATOR, n);
    }

    /** {@code local a, b = init}: binds every value returned by {@code init}. */
    public NodeId multiVariableDeclaration(List<NodeId> targets, NodeId init) {
        ObjectNode n = JSON.objectNode();
        putRefs(n, "targets", targets, false);
        putRef(n, "init", init);
        return register(NodeKind.MULTI_VARIABLE_DECLARATION, n);
    }

    public NodeId expressionStatement(NodeId expression) {
        ObjectNode n = JSON.objectNode();
        putRef(n, "expression", expression);
        return register(NodeKind.EXPRESSION_STATEMENT, n);
    }

    public NodeId returnStatement(NodeId argument) {
        ObjectNode n = JSON.objectNode();
        putOptionalRef(n, "argument", argument);
        return register(NodeKind.RETURN_STATEMENT, n);
    }

    public NodeId ifStatement(NodeId test, NodeId consequent, NodeId alternate) {
        ObjectNode n = JSON.objectNode();
        putRef(n, "test", test);
        putRef(n, "consequent", consequent);
        putOptionalRef(n, "alternate", alternate);
        return register(NodeKind.IF_STATEMENT, n);
    }

    public NodeId whileStatement(NodeId test, NodeId body) {
        ObjectNode n = JSON.objectNode();
        putRef(n, "test", test);
        putRef(n, "body", body);
        return register(NodeKind.WHILE_STATEMENT, n);
    }

    /** Post-tested loop: runs {@code body} until {@code test} holds. */
    public NodeId repeatStatement(NodeId body, NodeId test) {
        ObjectNode n = JSON.objectNode();
        putRef(n, "body", body);
        putRef(n, "test", test);
        return register(NodeKind.REPEAT_STATEMENT, n);
    }

    /**
     * Generic-for over {@code pairs} or {@code ipairs}.
     *
     * @param iterator {@code "pairs"} or {@code "ipairs"}
     * @param key      key/index binding, or {@code null} for a discard
     * @param value    value binding, or {@code null} when only keys are iterated
     */
    public NodeId forInStatement(String iterator, NodeId key, NodeId value, NodeId iterable, NodeId body) {
        if (!"pairs".equals(iterator) && !"ipairs".equals(iterator)) {
            throw new IllegalArgumentException("Iterator must be pairs or ipairs, got " + iterator);
        }
        ObjectNode n = JSON.objectNode();
        n.put("iterator", iterator);
        putOptionalRef(n, "key", key);
        putOptionalRef(n, "value", value);
        putRef(n, "iterable", iterable);
        putRef(n, "body", body);
        return register(NodeKind.FOR_IN_STATEMENT, n);
    }

    public NodeId breakStatement() {
        return register(NodeKind.BREAK_STATEMENT, JSON.objectNode());
    }

    public NodeId gotoStatement(String label) {
        ObjectNode n = JSON.objectNode();
        n.put("label", requireText(label, "label"));
        return register(NodeKind.GOTO_STATEMENT, n);
    }

    public NodeId labelStatement(String label) {
        ObjectNode n = JSON.objectNode();
        n.put("label", requireText(label, "label"));
        return register(NodeKind.LABEL_STATEMENT, n);
    }

    public NodeId blockStatement(List<NodeId> statements) {
        ObjectNode n = JSON.objectNode();
        putRefs(n, "statements", statements, false);
        return register(NodeKind.BLOCK_STATEMENT, n);
    }

    public NodeId functionDeclaration(String name, List<NodeId> params, NodeId body, FunctionOptions options) {
        ObjectNode n = JSON.objectNode();
        n.put("name", requireText(name, "name"));
        putFunctionParts(n, params, body, options);
        return register(NodeKind.FUNCTION_DECLARATION, n);
    }

    // --- Snapshot ---

    /**
     * Snapshots the builder into an immutable document. The builder cannot be used afterwards.
     *
     * @throws IllegalStateException on a second call
     */
    public IrDocument build() {
        ensureOpen();
        built = true;

        ObjectNode root = JSON.objectNode();
        root.put("schemaVersion", schemaVersion);

        ObjectNode module = root.putObject("module");
        ArrayNode bodyJson = module.putArray("body");
        body.forEach(id -> bodyJson.add(id.value()));
        module.set("metadata", metadata.deepCopy());
        ArrayNode directivesJson = module.putArray("directives");
        directives.forEach(directivesJson::add);
        ObjectNode source = module.putObject("source");
        source.put("path", sourcePath == null ? "" : sourcePath);
        source.put("hash", sourceHash == null ? "" : sourceHash);

        ObjectNode nodesJson = root.putObject("nodes");
        nodes.forEach((id, node) -> nodesJson.set(id.value(), node.deepCopy()));

        ObjectNode graphsJson = root.putObject("controlFlowGraphs");
        graphs.forEach((id, graph) -> graphsJson.set(id, IrDocument.writeGraph(graph)));

        return IrDocument.adopt(root);
    }

    /**
     * Snapshots the builder and runs {@code validator} over the result. Validation problems are
     * reported in the result, never thrown.
     */
    public BuildResult build(DocumentValidator validator) {
        IrDocument document = build();
        return new BuildResult(document, validator.validate(document));
    }

    /**
     * A built document together with its validation outcome.
     *
     * @param document   the snapshot
     * @param validation checks run at build time
     */
    public record BuildResult(IrDocument document, ValidationResult validation) {}

    // --- internals ---

    private NodeId register(NodeKind kind, ObjectNode fields) {
        ensureOpen();
        if (fields.has("id") || fields.has("kind")) {
            throw new IllegalStateException(kind.wireName() + " fields must not shadow the node's id or kind");
        }
        NodeId id = NodeId.of(ids.next(NODE_PREFIX));
        ObjectNode node = JSON.objectNode();
        node.put("id", id.value());
        node.put("kind", kind.wireName());
        node.setAll(fields);
        nodes.put(id, node);
        return id;
    }

    private void putFunctionParts(ObjectNode n, List<NodeId> params, NodeId body, FunctionOptions options) {
        FunctionOptions opts = options == null ? FunctionOptions.none() : options;
        putRefs(n, "params", params, false);
        putRef(n, "body", body);
        putOptionalRef(n, "restParam", opts.restParam());
        if (opts.meta() != null && opts.meta().size() > 0) {
            n.set("meta", opts.meta().deepCopy());
        }
    }

    private void putRef(ObjectNode n, String field, NodeId id) {
        Objects.requireNonNull(id, () -> field + " must not be null");
        requireKnown(id, field);
        n.put(field, id.value());
    }

    private void putOptionalRef(ObjectNode n, String field, NodeId id) {
        if (id != null) {
            requireKnown(id, field);
            n.put(field, id.value());
        }
    }

    private void putRefs(ObjectNode n, String field, List<NodeId> refs, boolean holesAllowed) {
        Objects.requireNonNull(refs, () -> field + " must not be null");
        ArrayNode array = n.putArray(field);
        for (NodeId id : refs) {
            if (id == null) {
                if (!holesAllowed) {
                    throw new IllegalArgumentException(field + " must not contain null entries");
                }
                array.addNull();
            } else {
                requireKnown(id, field);
                array.add(id.value());
            }
        }
    }

    private void requireKnown(NodeId id, String role) {
        if (!nodes.containsKey(id)) {
            throw new IllegalArgumentException("Unknown node " + id + " used as " + role);
        }
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(field + " must not be empty");
        }
        return value;
    }

    private void ensureOpen() {
        if (built) {
            throw new IllegalStateException("IrBuilder has already been built; create a new builder per compilation");
        }
    }
}
