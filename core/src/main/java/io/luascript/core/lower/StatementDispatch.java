package io.luascript.core.lower;

import com.fasterxml.jackson.databind.JsonNode;
import io.luascript.core.ir.NodeId;
import io.luascript.core.normalize.AstType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Closed statement dispatch table: one entry per canonical statement type.
 *
 * <p>Each entry pairs a handler with its placement policy. Handlers never place their result in
 * the module body themselves unless their policy is {@link Placement#SELF}.
 */
final class StatementDispatch {

    /** Where the lowered statement ends up. */
    enum Placement {
        /** The dispatcher appends the returned node to the current statement list. */
        AUTO,
        /** The handler appends one or more statements itself (declarations, classes, functions). */
        SELF,
        /** The caller decides; in a statement list the block becomes {@code do ... end}. */
        CALLER
    }

    /** Lowers one canonical statement; may append to {@code sink} when self-placing. */
    @FunctionalInterface
    interface Handler {
        NodeId lower(JsonNode statement, List<NodeId> sink);
    }

    /** Handler that only returns its node; used for {@link Placement#AUTO} entries. */
    @FunctionalInterface
    interface SingleHandler {
        NodeId lower(JsonNode statement);
    }

    /**
     * A dispatch entry.
     *
     * @param handler   the lowering function
     * @param placement who places the result
     */
    record Entry(Handler handler, Placement placement) {

        /** Whether the dispatcher pushes the handler's result into the enclosing list. */
        boolean pushToBody() {
            return placement == Placement.AUTO;
        }
    }

    private final Map<AstType, Entry> entries;

    private StatementDispatch(Map<AstType, Entry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    static StatementDispatch create(IrLowerer lowerer, LoopLowerer loops, SwitchLowerer switches,
            TryLowerer tries, ClassLowerer classes) {
        Map<AstType, Entry> table = new EnumMap<>(AstType.class);
        table.put(AstType.EXPRESSION_STATEMENT, auto(lowerer::lowerExpressionStatement));
        table.put(AstType.VARIABLE_DECLARATION, self(lowerer::lowerVariableDeclaration));
        table.put(AstType.FUNCTION_DECLARATION, self(lowerer::lowerFunctionDeclaration));
        table.put(AstType.CLASS_DECLARATION, self(classes::lowerClass));
        table.put(AstType.RETURN_STATEMENT, auto(lowerer::lowerReturn));
        table.put(AstType.IF_STATEMENT, auto(lowerer::lowerIf));
        table.put(AstType.BLOCK_STATEMENT, new Entry((node, sink) -> lowerer.lowerBlock(node), Placement.CALLER));
        table.put(AstType.WHILE_STATEMENT, auto(loops::lowerWhile));
        table.put(AstType.DO_WHILE_STATEMENT, auto(loops::lowerDoWhile));
        table.put(AstType.FOR_STATEMENT, auto(loops::lowerFor));
        table.put(AstType.FOR_IN_STATEMENT, auto(loops::lowerForIn));
        table.put(AstType.FOR_OF_STATEMENT, auto(loops::lowerForOf));
        table.put(AstType.BREAK_STATEMENT, auto(loops::lowerBreak));
        table.put(AstType.CONTINUE_STATEMENT, auto(loops::lowerContinue));
        table.put(AstType.THROW_STATEMENT, auto(lowerer::lowerThrow));
        table.put(AstType.TRY_STATEMENT, auto(tries::lowerTry));
        table.put(AstType.SWITCH_STATEMENT, auto(switches::lowerSwitch));
        table.put(AstType.EMPTY_STATEMENT, auto(node -> null));
        table.put(AstType.LABELED_STATEMENT, auto(lowerer::rejectLabeled));
        return new StatementDispatch(table);
    }

    private static Entry auto(SingleHandler handler) {
        return new Entry((node, sink) -> handler.lower(node), Placement.AUTO);
    }

    private static Entry self(Handler handler) {
        return new Entry(handler, Placement.SELF);
    }

    Optional<Entry> lookup(AstType type) {
        return Optional.ofNullable(entries.get(type));
    }

    /** Statement types that have a handler. */
    Set<AstType> coveredTypes() {
        return entries.keySet();
    }
}
