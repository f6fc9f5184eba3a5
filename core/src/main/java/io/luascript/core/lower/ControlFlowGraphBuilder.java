package io.luascript.core.lower;

import io.luascript.core.ir.ControlFlowGraph;
import io.luascript.core.ir.ControlFlowGraph.BasicBlock;
import io.luascript.core.ir.ControlFlowGraph.BlockKind;
import io.luascript.core.ir.IrBuilder;
import io.luascript.core.ir.NodeId;
import io.luascript.core.ir.NodeKind;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Splits a function body into basic blocks.
 *
 * <p>The graph is statement-granular: a block ends after every control statement (if, loops,
 * nested blocks) and after every {@code return}. Returns edge to the exit block; every other block
 * falls through to the next one, and the last block to exit. The graph is registered with the
 * builder under a {@code cfg_} id; block ids use the {@code bb} prefix.
 */
final class ControlFlowGraphBuilder {

    static final String GRAPH_PREFIX = "cfg";
    static final String BLOCK_PREFIX = "bb";

    private static final Set<NodeKind> SPLITTING = EnumSet.of(
            NodeKind.IF_STATEMENT,
            NodeKind.WHILE_STATEMENT,
            NodeKind.REPEAT_STATEMENT,
            NodeKind.FOR_IN_STATEMENT,
            NodeKind.BLOCK_STATEMENT,
            NodeKind.RETURN_STATEMENT);

    private final IrBuilder builder;

    ControlFlowGraphBuilder(IrBuilder builder) {
        this.builder = builder;
    }

    /** Builds and registers the graph for {@code statements}; returns it. */
    ControlFlowGraph build(List<NodeId> statements) {
        String graphId = builder.nextId(GRAPH_PREFIX);
        String entryId = builder.nextId(BLOCK_PREFIX);
        String exitId = builder.nextId(BLOCK_PREFIX);

        List<List<NodeId>> segments = new ArrayList<>();
        List<Boolean> endsWithReturn = new ArrayList<>();
        List<NodeId> current = new ArrayList<>();
        for (NodeId statement : statements) {
            current.add(statement);
            NodeKind kind = builder.node(statement).kind();
            if (SPLITTING.contains(kind)) {
                segments.add(current);
                endsWithReturn.add(kind == NodeKind.RETURN_STATEMENT);
                current = new ArrayList<>();
            }
        }
        if (!current.isEmpty()) {
            segments.add(current);
            endsWithReturn.add(false);
        }

        List<BasicBlock> blocks = new ArrayList<>();
        Map<String, List<String>> successors = new LinkedHashMap<>();
        blocks.add(new BasicBlock(entryId, BlockKind.ENTRY, List.of()));

        List<String> segmentIds = new ArrayList<>();
        for (List<NodeId> segment : segments) {
            String blockId = builder.nextId(BLOCK_PREFIX);
            segmentIds.add(blockId);
            blocks.add(new BasicBlock(blockId, BlockKind.NORMAL, segment));
        }
        blocks.add(new BasicBlock(exitId, BlockKind.EXIT, List.of()));

        successors.put(entryId, List.of(segmentIds.isEmpty() ? exitId : segmentIds.get(0)));
        for (int i = 0; i < segmentIds.size(); i++) {
            boolean last = i == segmentIds.size() - 1;
            String next = endsWithReturn.get(i) || last ? exitId : segmentIds.get(i + 1);
            successors.put(segmentIds.get(i), List.of(next));
        }
        successors.put(exitId, List.of());

        ControlFlowGraph graph = ControlFlowGraph.withDerivedPredecessors(graphId, blocks, successors);
        builder.registerControlFlowGraph(graphId, graph);
        return graph;
    }
}
