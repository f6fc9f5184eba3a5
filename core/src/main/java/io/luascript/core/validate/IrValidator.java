package io.luascript.core.validate;

import com.fasterxml.jackson.databind.JsonNode;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.ValidationMessage;
import io.luascript.core.ir.DocumentValidator;
import io.luascript.core.ir.FieldType;
import io.luascript.core.ir.IrDocument;
import io.luascript.core.ir.NodeId;
import io.luascript.core.ir.NodeKind;
import io.luascript.core.ir.ValidationResult;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural checks over an IR document.
 *
 * <p>Runs the node-table rules derived from {@link NodeKind#fields()}, reference resolution,
 * control-flow-graph consistency and the archived JSON Schema of the document's version. Every
 * violation is collected; malformed input is reported, never thrown.
 *
 * <p>Thread-safe: the only state is the schema cache of the registry.
 */
public final class IrValidator implements DocumentValidator {

    private static final Logger LOG = LoggerFactory.getLogger(IrValidator.class);

    private final IrSchemaRegistry schemas;

    public IrValidator() {
        this(new IrSchemaRegistry());
    }

    public IrValidator(IrSchemaRegistry schemas) {
        this.schemas = Objects.requireNonNull(schemas, "schemas must not be null");
    }

    @Override
    public ValidationResult validate(IrDocument document) {
        Objects.requireNonNull(document, "document must not be null");
        return validate(document.toJson());
    }

    /**
     * Validates a raw IR JSON tree.
     *
     * @throws IllegalArgumentException if {@code ir} is {@code null} or not a JSON object
     */
    public ValidationResult validate(JsonNode ir) {
        if (ir == null || !ir.isObject()) {
            throw new IllegalArgumentException(
                    "IR document must be a JSON object, got " + (ir == null ? "null" : ir.getNodeType()));
        }
        List<String> errors = new ArrayList<>();
        String version = ir.path("schemaVersion").isTextual() ? ir.get("schemaVersion").asText() : null;
        if (!schemas.isKnown(version)) {
            errors.add("Unrecognized schemaVersion '" + ir.path("schemaVersion").asText("<missing>") + "'");
        }

        JsonNode nodes = ir.path("nodes");
        if (!nodes.isObject()) {
            errors.add("nodes must be an object");
        }
        JsonNode graphs = ir.path("controlFlowGraphs");
        if (!graphs.isMissingNode() && !graphs.isObject()) {
            errors.add("controlFlowGraphs must be an object");
        }

        checkModule(ir.path("module"), nodes, errors);
        if (nodes.isObject()) {
            checkNodes(nodes, graphs, errors);
        }
        if (graphs.isObject()) {
            checkGraphs(graphs, nodes, errors);
        }
        if (version != null) {
            checkSchema(version, ir, errors);
        }

        LOG.debug("IR validation finished: nodes={}, errors={}", nodes.size(), errors.size());
        return ValidationResult.of(errors);
    }

    // --- Module ---

    private void checkModule(JsonNode module, JsonNode nodes, List<String> errors) {
        if (!module.isObject()) {
            errors.add("module is missing");
            return;
        }
        JsonNode body = module.path("body");
        if (!body.isArray()) {
            errors.add("module.body must be an array");
        } else {
            for (int i = 0; i < body.size(); i++) {
                checkReference("module.body[" + i + "]", body.get(i), nodes, errors);
            }
        }
        JsonNode perf = module.path("metadata").path("metaPerf");
        if (!perf.isMissingNode()) {
            checkPerf(perf, errors);
        }
    }

    private static void checkPerf(JsonNode perf, List<String> errors) {
        if (!perf.isObject()) {
            errors.add("module.metadata.metaPerf must be an object");
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = perf.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.isNumber() || value.asDouble() < 0) {
                errors.add("module.metadata.metaPerf." + field.getKey() + " must be a non-negative number");
            }
        }
    }

    // --- Nodes ---

    private void checkNodes(JsonNode nodes, JsonNode graphs, List<String> errors) {
        Iterator<Map.Entry<String, JsonNode>> entries = nodes.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String key = entry.getKey();
            JsonNode node = entry.getValue();
            String where = "nodes." + key;
            if (!NodeId.isWellFormed(key)) {
                errors.add(where + ": malformed node id");
            }
            if (!node.isObject()) {
                errors.add(where + ": node must be an object");
                continue;
            }
            if (!key.equals(node.path("id").asText(null))) {
                errors.add(where + ": id '" + node.path("id").asText("<missing>") + "' does not match its key");
            }
            Optional<NodeKind> kind = NodeKind.fromWireName(node.path("kind").asText(null));
            if (kind.isEmpty()) {
                errors.add(where + ": unknown kind '" + node.path("kind").asText("<missing>") + "'");
                continue;
            }
            for (Map.Entry<String, FieldType> field : kind.get().fields().entrySet()) {
                checkField(where + "." + field.getKey(), node.get(field.getKey()), field.getValue(), nodes, errors);
            }
            JsonNode cfg = node.path("meta").path("cfg");
            if (!cfg.isMissingNode()) {
                checkCfgReference(where + ".meta.cfg", cfg, graphs, errors);
            }
        }
    }

    private void checkField(String where, JsonNode value, FieldType type, JsonNode nodes, List<String> errors) {
        switch (type) {
            case REF -> checkReference(where, value, nodes, errors);
            case OPTIONAL_REF -> {
                if (value != null && !value.isNull()) {
                    checkReference(where, value, nodes, errors);
                }
            }
            case REF_LIST, HOLEY_REF_LIST -> {
                if (value == null || !value.isArray()) {
                    errors.add(where + ": required array of node ids");
                    return;
                }
                for (int i = 0; i < value.size(); i++) {
                    JsonNode element = value.get(i);
                    if (element.isNull() && type == FieldType.HOLEY_REF_LIST) {
                        continue;
                    }
                    checkReference(where + "[" + i + "]", element, nodes, errors);
                }
            }
            case STRING -> {
                if (value == null || !value.isTextual()) {
                    errors.add(where + ": required string");
                }
            }
            case BOOLEAN -> {
                if (value == null || !value.isBoolean()) {
                    errors.add(where + ": required boolean");
                }
            }
            case SCALAR -> {
                if (value == null || value.isContainerNode()) {
                    errors.add(where + ": required scalar");
                }
            }
        }
    }

    private static void checkReference(String where, JsonNode value, JsonNode nodes, List<String> errors) {
        if (value == null || !value.isTextual()) {
            errors.add(where + ": required node id");
            return;
        }
        if (!nodes.has(value.asText())) {
            errors.add(where + ": dangling reference '" + value.asText() + "'");
        }
    }

    private static void checkCfgReference(String where, JsonNode cfg, JsonNode graphs, List<String> errors) {
        String graphId = cfg.path("id").asText(null);
        JsonNode graph = graphId == null ? null : graphs.get(graphId);
        if (graph == null || !graph.isObject()) {
            errors.add(where + ": unknown control-flow graph '" + cfg.path("id").asText("<missing>") + "'");
            return;
        }
        Set<String> blockIds = blockIds(graph);
        for (String end : List.of("entry", "exit")) {
            String blockId = cfg.path(end).asText(null);
            if (blockId == null || !blockIds.contains(blockId)) {
                errors.add(where + "." + end + ": '" + cfg.path(end).asText("<missing>") + "' is not a block of "
                        + graphId);
            }
        }
    }

    // --- Control-flow graphs ---

    private void checkGraphs(JsonNode graphs, JsonNode nodes, List<String> errors) {
        Iterator<Map.Entry<String, JsonNode>> entries = graphs.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String graphId = entry.getKey();
            JsonNode graph = entry.getValue();
            String where = "controlFlowGraphs." + graphId;
            if (!graph.isObject()) {
                errors.add(where + ": graph must be an object");
                continue;
            }
            if (!graphId.equals(graph.path("id").asText(null))) {
                errors.add(where + ": id does not match its key");
            }
            Set<String> blockIds = blockIds(graph);
            JsonNode blocks = graph.path("blocks");
            for (int i = 0; i < blocks.size(); i++) {
                JsonNode statements = blocks.get(i).path("statements");
                for (int s = 0; s < statements.size(); s++) {
                    String stmtWhere = where + ".blocks[" + i + "].statements[" + s + "]";
                    JsonNode statement = statements.get(s);
                    if (nodes.isObject()) {
                        checkReference(stmtWhere, statement, nodes, errors);
                    }
                }
            }
            JsonNode successors = graph.path("successors");
            JsonNode predecessors = graph.path("predecessors");
            checkEdges(where + ".successors", successors, blockIds, errors);
            checkEdges(where + ".predecessors", predecessors, blockIds, errors);
            checkMirror(where, successors, predecessors, errors);
        }
    }

    private static Set<String> blockIds(JsonNode graph) {
        Set<String> ids = new HashSet<>();
        for (JsonNode block : graph.path("blocks")) {
            String id = block.path("id").asText(null);
            if (id != null) {
                ids.add(id);
            }
        }
        return ids;
    }

    private static void checkEdges(String where, JsonNode edges, Set<String> blockIds, List<String> errors) {
        if (!edges.isObject()) {
            errors.add(where + ": must be an object");
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> entries = edges.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            if (!blockIds.contains(entry.getKey())) {
                errors.add(where + ": '" + entry.getKey() + "' is not a block");
            }
            for (JsonNode target : entry.getValue()) {
                if (!blockIds.contains(target.asText())) {
                    errors.add(where + "." + entry.getKey() + ": target '" + target.asText() + "' is not a block");
                }
            }
        }
    }

    /** {@code b ∈ successors[a]} iff {@code a ∈ predecessors[b]}. */
    private static void checkMirror(String where, JsonNode successors, JsonNode predecessors, List<String> errors) {
        if (!successors.isObject() || !predecessors.isObject()) {
            return;
        }
        Iterator<Map.Entry<String, JsonNode>> forward = successors.fields();
        while (forward.hasNext()) {
            Map.Entry<String, JsonNode> entry = forward.next();
            for (JsonNode target : entry.getValue()) {
                if (!containsText(predecessors.path(target.asText()), entry.getKey())) {
                    errors.add(where + ": edge " + entry.getKey() + " -> " + target.asText()
                            + " has no matching predecessor entry");
                }
            }
        }
        Iterator<Map.Entry<String, JsonNode>> backward = predecessors.fields();
        while (backward.hasNext()) {
            Map.Entry<String, JsonNode> entry = backward.next();
            for (JsonNode source : entry.getValue()) {
                if (!containsText(successors.path(source.asText()), entry.getKey())) {
                    errors.add(where + ": predecessor " + source.asText() + " of " + entry.getKey()
                            + " has no matching successor entry");
                }
            }
        }
    }

    private static boolean containsText(JsonNode array, String value) {
        for (JsonNode element : array) {
            if (value.equals(element.asText())) {
                return true;
            }
        }
        return false;
    }

    // --- JSON Schema ---

    private void checkSchema(String version, JsonNode ir, List<String> errors) {
        Optional<JsonSchema> schema = schemas.schema(version);
        if (schema.isEmpty()) {
            return;
        }
        Set<ValidationMessage> messages = schema.get().validate(ir);
        messages.stream().map(m -> "schema: " + m.getMessage()).sorted().forEach(errors::add);
    }
}
