package io.luascript.core.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Basic blocks of one function body plus the edges between them.
 *
 * <p>{@code successors} and {@code predecessors} are keyed by block id and must mirror each other:
 * {@code b ∈ successors[a]} iff {@code a ∈ predecessors[b]}. Instances are immutable.
 *
 * @param id           graph identifier, allocated from the builder's generator
 * @param blocks       blocks in allocation order; exactly one has kind {@link BlockKind#ENTRY}
 * @param successors   outgoing edges per block
 * @param predecessors incoming edges per block
 */
public record ControlFlowGraph(
        String id,
        List<BasicBlock> blocks,
        Map<String, List<String>> successors,
        Map<String, List<String>> predecessors) {

    /** Role of a basic block within its graph. */
    public enum BlockKind {
        ENTRY("entry"),
        NORMAL("normal"),
        EXIT("exit");

        private final String wireName;

        BlockKind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static BlockKind fromWireName(String wireName) {
            for (BlockKind kind : values()) {
                if (kind.wireName.equals(wireName)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Unknown block kind: '" + wireName + "'");
        }
    }

    /**
     * A straight-line run of statements.
     *
     * @param id         block identifier
     * @param kind       entry, normal or exit
     * @param statements statement node ids in execution order
     */
    public record BasicBlock(String id, BlockKind kind, List<NodeId> statements) {
        public BasicBlock {
            Objects.requireNonNull(id, "id must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
            statements = List.copyOf(statements);
        }
    }

    public ControlFlowGraph {
        Objects.requireNonNull(id, "id must not be null");
        blocks = List.copyOf(blocks);
        successors = copyEdges(successors);
        predecessors = copyEdges(predecessors);
    }

    /**
     * Creates a graph from its blocks and successor edges, deriving predecessors so the two maps are
     * consistent by construction.
     */
    public static ControlFlowGraph withDerivedPredecessors(
            String id, List<BasicBlock> blocks, Map<String, List<String>> successors) {
        Map<String, List<String>> predecessors = new LinkedHashMap<>();
        for (BasicBlock block : blocks) {
            predecessors.put(block.id(), new ArrayList<>());
        }
        for (BasicBlock block : blocks) {
            for (String target : successors.getOrDefault(block.id(), List.of())) {
                predecessors.computeIfAbsent(target, k -> new ArrayList<>()).add(block.id());
            }
        }
        Map<String, List<String>> completeSuccessors = new LinkedHashMap<>();
        for (BasicBlock block : blocks) {
            completeSuccessors.put(block.id(), successors.getOrDefault(block.id(), List.of()));
        }
        return new ControlFlowGraph(id, blocks, completeSuccessors, predecessors);
    }

    /** The entry block. */
    public BasicBlock entry() {
        return firstOfKind(BlockKind.ENTRY);
    }

    /** The exit block. */
    public BasicBlock exit() {
        return firstOfKind(BlockKind.EXIT);
    }

    private BasicBlock firstOfKind(BlockKind kind) {
        return blocks.stream()
                .filter(b -> b.kind() == kind)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Graph " + id + " has no " + kind.wireName() + " block"));
    }

    private static Map<String, List<String>> copyEdges(Map<String, List<String>> edges) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        edges.forEach((k, v) -> copy.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(copy);
    }
}
