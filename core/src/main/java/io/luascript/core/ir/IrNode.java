package io.luascript.core.ir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only view of one node-table entry. Accessors return copies or immutable values; the
 * underlying JSON stays owned by its {@link IrDocument}.
 */
public final class IrNode {

    private final ObjectNode json;

    IrNode(ObjectNode json) {
        this.json = json;
    }

    public NodeId id() {
        return NodeId.of(json.path("id").asText());
    }

    /**
     * The node's kind.
     *
     * @throws IllegalStateException if the discriminant is not a known kind
     */
    public NodeKind kind() {
        String wire = json.path("kind").asText(null);
        return NodeKind.fromWireName(wire)
                .orElseThrow(() -> new IllegalStateException("Node " + json.path("id").asText() + " has unknown kind '"
                        + wire + "'"));
    }

    public boolean has(String field) {
        JsonNode value = json.get(field);
        return value != null && !value.isNull();
    }

    /** A single reference field, or {@code null} when absent. */
    public NodeId ref(String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? null : NodeId.of(value.asText());
    }

    /** A reference list; holes are returned as {@code null} entries. */
    public List<NodeId> refs(String field) {
        JsonNode array = json.path(field);
        List<NodeId> ids = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            ids.add(element.isNull() ? null : NodeId.of(element.asText()));
        }
        return Collections.unmodifiableList(ids);
    }

    public String string(String field) {
        JsonNode value = json.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    public boolean bool(String field) {
        return json.path(field).asBoolean(false);
    }

    /** A scalar field as a detached JSON value. */
    public JsonNode scalar(String field) {
        JsonNode value = json.get(field);
        return value == null ? MissingNode.getInstance() : value.deepCopy();
    }

    /** The {@code meta} bag (detached copy), or a missing node. */
    public JsonNode meta() {
        JsonNode meta = json.get("meta");
        return meta == null ? MissingNode.getInstance() : meta.deepCopy();
    }

    public boolean metaFlag(String name) {
        return json.path("meta").path(name).asBoolean(false);
    }

    public String metaText(String name) {
        JsonNode value = json.path("meta").get(name);
        return value == null || value.isNull() ? null : value.asText();
    }

    @Override
    public String toString() {
        return json.toString();
    }
}
