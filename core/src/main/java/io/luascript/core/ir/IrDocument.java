package io.luascript.core.ir;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable IR snapshot: {@code {schemaVersion, module, nodes, controlFlowGraphs}}.
 *
 * <p>Produced once by {@link IrBuilder#build()} or read back with {@link #fromJson(JsonNode)}.
 * Documents read from JSON are not checked here; run them through the validator before emitting.
 */
public final class IrDocument {

    /** Schema version written by this toolchain. */
    public static final String CURRENT_SCHEMA_VERSION = "1.0.0";

    /** Module metadata keys whose values differ between otherwise identical compilations. */
    public static final List<String> VOLATILE_METADATA = List.of("createdAt", "metaPerf");

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final ObjectNode root;

    private IrDocument(ObjectNode root) {
        this.root = root;
    }

    static IrDocument adopt(ObjectNode root) {
        return new IrDocument(root);
    }

    /**
     * Wraps a JSON tree as a document. The tree is copied.
     *
     * @throws IllegalArgumentException if {@code json} is not an object
     */
    public static IrDocument fromJson(JsonNode json) {
        Objects.requireNonNull(json, "json must not be null");
        if (!json.isObject()) {
            throw new IllegalArgumentException("IR document must be a JSON object, got " + json.getNodeType());
        }
        return new IrDocument(((ObjectNode) json).deepCopy());
    }

    public String schemaVersion() {
        return root.path("schemaVersion").asText(null);
    }

    /** Top-level statements in execution order. */
    public List<NodeId> body() {
        List<NodeId> body = new ArrayList<>();
        for (JsonNode id : root.path("module").path("body")) {
            body.add(NodeId.of(id.asText()));
        }
        return Collections.unmodifiableList(body);
    }

    public List<String> directives() {
        List<String> directives = new ArrayList<>();
        root.path("module").path("directives").forEach(d -> directives.add(d.asText()));
        return Collections.unmodifiableList(directives);
    }

    public String sourcePath() {
        return root.path("module").path("source").path("path").asText(null);
    }

    public String sourceHash() {
        return root.path("module").path("source").path("hash").asText(null);
    }

    /** Module metadata (detached copy). */
    public ObjectNode metadata() {
        JsonNode metadata = root.path("module").path("metadata");
        return metadata.isObject() ? ((ObjectNode) metadata).deepCopy() : MAPPER.createObjectNode();
    }

    /**
     * Looks up a node.
     *
     * @throws IllegalArgumentException if the id is not in the node table
     */
    public IrNode node(NodeId id) {
        return findNode(id).orElseThrow(() -> new IllegalArgumentException("No node with id " + id));
    }

    public Optional<IrNode> findNode(NodeId id) {
        JsonNode node = root.path("nodes").get(id.value());
        return node instanceof ObjectNode object ? Optional.of(new IrNode(object)) : Optional.empty();
    }

    /** Node ids in table order, which is allocation order for built documents. */
    public List<NodeId> nodeIds() {
        List<NodeId> ids = new ArrayList<>();
        root.path("nodes").fieldNames().forEachRemaining(name -> ids.add(NodeId.of(name)));
        return Collections.unmodifiableList(ids);
    }

    public int nodeCount() {
        return root.path("nodes").size();
    }

    public Optional<ControlFlowGraph> controlFlowGraph(String id) {
        JsonNode cfg = root.path("controlFlowGraphs").get(id);
        return cfg == null ? Optional.empty() : Optional.of(readGraph(id, cfg));
    }

    public Map<String, ControlFlowGraph> controlFlowGraphs() {
        Map<String, ControlFlowGraph> graphs = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = root.path("controlFlowGraphs").fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            graphs.put(entry.getKey(), readGraph(entry.getKey(), entry.getValue()));
        }
        return Collections.unmodifiableMap(graphs);
    }

    /** Returns a copy of this document with one module metadata entry added or replaced. */
    public IrDocument withMetadata(String key, JsonNode value) {
        ObjectNode copy = root.deepCopy();
        ObjectNode module = copy.get("module") instanceof ObjectNode m ? m : copy.putObject("module");
        ObjectNode metadata = module.get("metadata") instanceof ObjectNode md ? md : module.putObject("metadata");
        metadata.set(key, value.deepCopy());
        return new IrDocument(copy);
    }

    /** Returns a copy without the {@link #VOLATILE_METADATA} entries, for equality comparisons. */
    public IrDocument withoutVolatileMetadata() {
        ObjectNode copy = root.deepCopy();
        JsonNode metadata = copy.path("module").path("metadata");
        if (metadata instanceof ObjectNode object) {
            object.remove(VOLATILE_METADATA);
        }
        return new IrDocument(copy);
    }

    /** The document as a detached JSON tree. */
    public ObjectNode toJson() {
        return root.deepCopy();
    }

    /** Pretty-printed JSON. */
    public String toJsonString() {
        try {
            return MAPPER.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("IR document could not be serialized", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof IrDocument other && root.equals(other.root);
    }

    @Override
    public int hashCode() {
        return root.hashCode();
    }

    @Override
    public String toString() {
        return "IrDocument[schemaVersion=" + schemaVersion() + ", nodes=" + nodeCount() + "]";
    }

    static ObjectNode writeGraph(ControlFlowGraph graph) {
        ObjectNode json = MAPPER.createObjectNode();
        json.put("id", graph.id());
        var blocks = json.putArray("blocks");
        for (ControlFlowGraph.BasicBlock block : graph.blocks()) {
            ObjectNode b = blocks.addObject();
            b.put("id", block.id());
            b.put("kind", block.kind().wireName());
            var statements = b.putArray("statements");
            block.statements().forEach(s -> statements.add(s.value()));
        }
        json.set("successors", writeEdges(graph.successors()));
        json.set("predecessors", writeEdges(graph.predecessors()));
        return json;
    }

    private static ObjectNode writeEdges(Map<String, List<String>> edges) {
        ObjectNode json = MAPPER.createObjectNode();
        edges.forEach((from, targets) -> {
            var array = json.putArray(from);
            targets.forEach(array::add);
        });
        return json;
    }

    private static ControlFlowGraph readGraph(String id, JsonNode json) {
        List<ControlFlowGraph.BasicBlock> blocks = new ArrayList<>();
        for (JsonNode b : json.path("blocks")) {
            List<NodeId> statements = new ArrayList<>();
            b.path("statements").forEach(s -> statements.add(NodeId.of(s.asText())));
            blocks.add(new ControlFlowGraph.BasicBlock(
                    b.path("id").asText(), ControlFlowGraph.BlockKind.fromWireName(b.path("kind").asText()), statements));
        }
        return new ControlFlowGraph(id, blocks, readEdges(json.path("successors")), readEdges(json.path("predecessors")));
    }

    private static Map<String, List<String>> readEdges(JsonNode json) {
        Map<String, List<String>> edges = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = json.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            List<String> targets = new ArrayList<>();
            entry.getValue().forEach(t -> targets.add(t.asText()));
            edges.put(entry.getKey(), targets);
        }
        return edges;
    }
}
