package io.luascript.core.lower;

import com.fasterxml.jackson.databind.JsonNode;
import io.luascript.core.ir.IrBuilder;
import io.luascript.core.ir.NodeId;
import io.luascript.core.normalize.AstType;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Loops and the jumps out of them.
 *
 * <p>{@code continue} becomes {@code goto} a label placed after the loop body; the body is then
 * wrapped in its own {@code do ... end} so the jump never enters the scope of a body local.
 */
final class LoopLowerer {

    private final IrLowerer lowerer;

    LoopLowerer(IrLowerer lowerer) {
        this.lowerer = lowerer;
    }

    NodeId lowerWhile(JsonNode statement) {
        IrBuilder builder = lowerer.builder();
        NodeId test = lowerer.lowerExpression(statement.get("test"));
        JumpTarget target = JumpTarget.loop(lowerer.names());
        List<NodeId> body = loopBody(statement.get("body"), target, List.of());
        return builder.whileStatement(test, builder.blockStatement(body));
    }

    /** {@code do body while (test)} as {@code repeat body until not (test)}. */
    NodeId lowerDoWhile(JsonNode statement) {
        IrBuilder builder = lowerer.builder();
        JumpTarget target = JumpTarget.loop(lowerer.names());
        List<NodeId> body = loopBody(statement.get("body"), target, List.of());
        NodeId test = builder.unaryExpression("!", lowerer.lowerExpression(statement.get("test")));
        return builder.repeatStatement(builder.blockStatement(body), test);
    }

    /** {@code for (init; test; update)}: init, then {@code while test do body update end}. */
    NodeId lowerFor(JsonNode statement) {
        IrBuilder builder = lowerer.builder();
        List<NodeId> outer = new ArrayList<>();
        JsonNode init = statement.path("init");
        if (init.isObject()) {
            if (AstType.VARIABLE_DECLARATION.typeName().equals(init.path("type").asText())) {
                lowerer.lowerStatementInto(init, outer);
            } else {
                lowerer.lowerExpressionAsStatements(init, outer);
            }
        }
        JsonNode testNode = statement.path("test");
        NodeId test = testNode.isObject() ? lowerer.lowerExpression(testNode) : builder.literal(true);

        JumpTarget target = JumpTarget.loop(lowerer.names());
        List<NodeId> body = loopBody(statement.get("body"), target, List.of());
        JsonNode update = statement.path("update");
        if (update.isObject()) {
            lowerer.lowerExpressionAsStatements(update, body);
        }
        NodeId loop = builder.whileStatement(test, builder.blockStatement(body));
        if (outer.isEmpty()) {
            return loop;
        }
        outer.add(loop);
        return builder.blockStatement(outer);
    }

    /** {@code for (k in obj)} as {@code for k in pairs(obj)}. */
    NodeId lowerForIn(JsonNode statement) {
        IrBuilder builder = lowerer.builder();
        NodeId iterable = lowerer.callGlobal("pairs", List.of(lowerer.lowerExpression(statement.get("right"))));
        LoopVariable variable = loopVariable(statement.get("left"));
        if (variable.pattern() != null) {
            throw lowerer.fail(statement.get("left"), "Destructuring is not supported in for-in heads");
        }
        JumpTarget target = JumpTarget.loop(lowerer.names());
        List<NodeId> body = loopBody(statement.get("body"), target, variable.prelude());
        return builder.forInStatement(
                "pairs", builder.identifier(variable.name()), null, iterable, builder.blockStatement(body));
    }

    /** {@code for (v of xs)} as {@code for _, v in ipairs(xs)}; an array literal is iterated in place. */
    NodeId lowerForOf(JsonNode statement) {
        IrBuilder builder = lowerer.builder();
        NodeId iterable = lowerer.callGlobal("ipairs", List.of(lowerer.lowerExpression(statement.get("right"))));
        LoopVariable variable = loopVariable(statement.get("left"));
        JumpTarget target = JumpTarget.loop(lowerer.names());
        List<NodeId> body = loopBody(statement.get("body"), target, variable.prelude());
        return builder.forInStatement(
                "ipairs", null, builder.identifier(variable.name()), iterable, builder.blockStatement(body));
    }

    NodeId lowerBreak(JsonNode statement) {
        rejectLabel(statement);
        JumpTarget target = lowerer.scope().jumps.peek();
        if (target == null) {
            throw lowerer.fail(statement, "'break' outside of a loop or switch");
        }
        if (target.kind() == JumpTarget.Kind.SWITCH) {
            return lowerer.builder().gotoStatement(target.useLabel());
        }
        return lowerer.builder().breakStatement();
    }

    NodeId lowerContinue(JsonNode statement) {
        rejectLabel(statement);
        Iterator<JumpTarget> targets = lowerer.scope().jumps.iterator();
        while (targets.hasNext()) {
            JumpTarget target = targets.next();
            if (target.kind() == JumpTarget.Kind.LOOP) {
                return lowerer.builder().gotoStatement(target.useLabel());
            }
        }
        throw lowerer.fail(statement, "'continue' outside of a loop");
    }

    private void rejectLabel(JsonNode statement) {
        if (statement.path("label").isObject()) {
            throw lowerer.fail(statement, "Labeled jumps are not supported");
        }
    }

    /**
     * Lowers a loop body under {@code target}. Returns the statements of the loop's block, with the
     * continue label appended when used.
     */
    private List<NodeId> loopBody(JsonNode body, JumpTarget target, List<JsonNode> preludeStatements) {
        IrBuilder builder = lowerer.builder();
        lowerer.scope().jumps.push(target);
        List<NodeId> statements = new ArrayList<>();
        try {
            for (JsonNode prelude : preludeStatements) {
                lowerer.lowerStatementInto(prelude, statements);
            }
            statements.addAll(lowerer.lowerBody(body));
        } finally {
            lowerer.scope().jumps.pop();
        }
        if (!target.labelUsed()) {
            return statements;
        }
        List<NodeId> wrapped = new ArrayList<>();
        wrapped.add(builder.blockStatement(statements));
        wrapped.add(builder.labelStatement(target.label()));
        return wrapped;
    }

    private LoopVariable loopVariable(JsonNode left) {
        String type = left.path("type").asText();
        if (AstType.VARIABLE_DECLARATION.typeName().equals(type)) {
            JsonNode declarations = left.path("declarations");
            if (declarations.size() != 1) {
                throw lowerer.fail(left, "Loop heads declare exactly one variable");
            }
            JsonNode id = declarations.get(0).get("id");
            String kind = left.path("kind").asText("let");
            if (AstType.IDENTIFIER.typeName().equals(id.path("type").asText())) {
                return new LoopVariable(id.path("name").asText(), null, null, kind);
            }
            if (PatternLowerer.isPattern(id)) {
                return new LoopVariable(lowerer.names().fresh(ScratchNames.DESTRUCTURE), id, null, kind);
            }
            throw lowerer.fail(id, "Unsupported loop variable '" + id.path("type").asText() + "'");
        }
        if (AstType.IDENTIFIER.typeName().equals(type) || AstType.MEMBER_EXPRESSION.typeName().equals(type)) {
            return new LoopVariable(lowerer.names().fresh(ScratchNames.KEY), null, left, null);
        }
        if (PatternLowerer.isPattern(left)) {
            return new LoopVariable(lowerer.names().fresh(ScratchNames.DESTRUCTURE), left, null, null);
        }
        throw lowerer.fail(left, "Unsupported loop head '" + type + "'");
    }

    /**
     * The Lua loop variable and how the JS binding is derived from it.
     *
     * @param name           the Lua loop variable
     * @param pattern        destructuring pattern bound from {@code name}, or {@code null}
     * @param existingTarget outer variable or member assigned from {@code name}, or {@code null}
     * @param kind           declaration kind for pattern bindings, or {@code null} to assign
     */
    private record LoopVariable(String name, JsonNode pattern, JsonNode existingTarget, String kind) {

        /** Synthetic statements that bind the JS variable at the top of the body. */
        List<JsonNode> prelude() {
            if (pattern == null && existingTarget == null) {
                return List.of();
            }
            return List.of(SyntheticAst.bindFromLocal(pattern != null ? pattern : existingTarget, name, kind));
        }
    }
}
