package io.luascript.core.lower;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.luascript.core.ir.IrBuilder;
import io.luascript.core.ir.NodeId;
import io.luascript.core.normalize.AstType;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@code switch} as a chain of {@code if ... elseif ... else}.
 *
 * <p>Consecutive empty cases share one arm whose test is the {@code ||} of their comparisons. An
 * arm that does not end in a jump falls through: the statements of the following arms are
 * appended until one does. The default arm always becomes the final {@code else}, wherever it
 * appears in the source. A trailing {@code break} is dropped; any other {@code break} jumps to a
 * label placed after the chain.
 */
final class SwitchLowerer {

    private static final Set<String> TERMINATORS = Set.of(
            AstType.BREAK_STATEMENT.typeName(),
            AstType.CONTINUE_STATEMENT.typeName(),
            AstType.RETURN_STATEMENT.typeName(),
            AstType.THROW_STATEMENT.typeName());

    private final IrLowerer lowerer;

    SwitchLowerer(IrLowerer lowerer) {
        this.lowerer = lowerer;
    }

    NodeId lowerSwitch(JsonNode statement) {
        IrBuilder builder = lowerer.builder();
        List<NodeId> out = new ArrayList<>();
        JsonNode discriminant = statement.get("discriminant");
        Supplier<NodeId> subject;
        if (AstType.IDENTIFIER.typeName().equals(discriminant.path("type").asText())) {
            subject = () -> lowerer.lowerExpression(discriminant);
        } else {
            String temp = lowerer.names().fresh(ScratchNames.SWITCH);
            out.add(lowerer.declareLocal(temp, lowerer.lowerExpression(discriminant)));
            subject = () -> builder.identifier(temp);
        }

        JsonNode cases = statement.path("cases");
        JumpTarget end = JumpTarget.switchEnd(lowerer.names());
        List<Arm> arms = new ArrayList<>();
        Arm defaultArm = null;
        lowerer.scope().jumps.push(end);
        try {
            List<JsonNode> pendingTests = new ArrayList<>();
            boolean pendingDefault = false;
            for (int i = 0; i < cases.size(); i++) {
                JsonNode switchCase = cases.get(i);
                JsonNode test = switchCase.path("test");
                if (test.isObject()) {
                    pendingTests.add(test);
                } else {
                    pendingDefault = true;
                }
                boolean last = i == cases.size() - 1;
                if (switchCase.path("consequent").isEmpty() && !last) {
                    continue;
                }
                Arm arm = lowerArm(cases, i, pendingDefault ? List.of() : pendingTests, subject);
                if (pendingDefault) {
                    defaultArm = arm;
                } else {
                    arms.add(arm);
                }
                pendingTests = new ArrayList<>();
                pendingDefault = false;
            }
        } finally {
            lowerer.scope().jumps.pop();
        }

        NodeId chain = defaultArm == null ? null : defaultArm.body();
        for (int i = arms.size() - 1; i >= 0; i--) {
            chain = builder.ifStatement(arms.get(i).test(), arms.get(i).body(), chain);
        }
        if (chain == null) {
            return out.isEmpty() ? null : builder.blockStatement(out);
        }
        if (out.isEmpty() && !end.labelUsed()) {
            return chain;
        }
        out.add(chain);
        if (end.labelUsed()) {
            out.add(builder.labelStatement(end.label()));
        }
        return builder.blockStatement(out);
    }

    private Arm lowerArm(JsonNode cases, int start, List<JsonNode> tests, Supplier<NodeId> subject) {
        IrBuilder builder = lowerer.builder();
        NodeId test = null;
        for (JsonNode caseTest : tests) {
            NodeId matches = builder.binaryExpression(subject.get(), "===", lowerer.lowerExpression(caseTest));
            test = test == null ? matches : builder.logicalExpression(test, "||", matches);
        }
        List<NodeId> body = new ArrayList<>();
        for (JsonNode statement : armStatements(cases, start)) {
            lowerer.lowerStatementInto(statement, body);
        }
        return new Arm(test, builder.blockStatement(body));
    }

    /** The statements an arm starting at {@code start} executes, fall-through included. */
    private List<JsonNode> armStatements(JsonNode cases, int start) {
        List<JsonNode> statements = new ArrayList<>();
        for (int i = start; i < cases.size(); i++) {
            JsonNode consequent = cases.get(i).path("consequent");
            consequent.forEach(statements::add);
            if (!consequent.isEmpty() && endsWithJump(consequent.get(consequent.size() - 1))) {
                break;
            }
        }
        if (!statements.isEmpty()) {
            int lastIndex = statements.size() - 1;
            JsonNode trimmed = withoutTrailingBreak(statements.get(lastIndex));
            if (trimmed == null) {
                statements.remove(lastIndex);
            } else {
                statements.set(lastIndex, trimmed);
            }
        }
        return statements;
    }

    private static boolean endsWithJump(JsonNode statement) {
        String type = statement.path("type").asText();
        if (AstType.BLOCK_STATEMENT.typeName().equals(type)) {
            JsonNode body = statement.path("body");
            return !body.isEmpty() && endsWithJump(body.get(body.size() - 1));
        }
        return TERMINATORS.contains(type);
    }

    /** {@code statement} minus a final unlabeled break; {@code null} when nothing remains. */
    private static JsonNode withoutTrailingBreak(JsonNode statement) {
        String type = statement.path("type").asText();
        if (AstType.BREAK_STATEMENT.typeName().equals(type)) {
            return statement.path("label").isObject() ? statement : null;
        }
        if (AstType.BLOCK_STATEMENT.typeName().equals(type)) {
            JsonNode body = statement.path("body");
            if (body.isEmpty()) {
                return statement;
            }
            JsonNode inner = withoutTrailingBreak(body.get(body.size() - 1));
            if (inner == body.get(body.size() - 1)) {
                return statement;
            }
            ObjectNode copy = statement.deepCopy();
            ArrayNode copiedBody = (ArrayNode) copy.get("body");
            copiedBody.remove(copiedBody.size() - 1);
            if (inner != null) {
                copiedBody.add(inner);
            }
            return copy;
        }
        return statement;
    }

    private record Arm(NodeId test, NodeId body) {}
}
