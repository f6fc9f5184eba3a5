package io.luascript.core.lower;

import com.fasterxml.jackson.databind.JsonNode;
import io.luascript.core.ir.IrBuilder;
import io.luascript.core.ir.NodeId;
import io.luascript.core.normalize.AstType;
import java.util.ArrayList;
import java.util.List;

/**
 * {@code try/catch/finally} over {@code pcall}.
 *
 * <pre>
 * do
 *   local __try_1 = function() ... end
 *   local __ok_1, __err_1 = pcall(__try_1)
 *   if not __ok_1 then local e = __err_1 ... end
 *   -- finalizer
 * end
 * </pre>
 *
 * The protected block is a function of its own, so a {@code return} inside it leaves only the
 * wrapper, and {@code break}/{@code continue} cannot target loops outside it.
 */
final class TryLowerer {

    static final String OK = "ok";
    static final String ERROR = "err";

    private final IrLowerer lowerer;

    TryLowerer(IrLowerer lowerer) {
        this.lowerer = lowerer;
    }

    NodeId lowerTry(JsonNode statement) {
        IrBuilder builder = lowerer.builder();
        int ordinal = lowerer.names().next(ScratchNames.TRY);
        String tryName = ScratchNames.name(ScratchNames.TRY, ordinal);
        String okName = ScratchNames.name(OK, ordinal);
        String errName = ScratchNames.name(ERROR, ordinal);

        List<NodeId> out = new ArrayList<>();
        JsonNode block = statement.get("block");
        NodeId protectedBody = lowerer.inIsolatedScope(() -> lowerer.syntheticFunction(lowerer.lowerBody(block)));
        out.add(lowerer.declareLocal(tryName, protectedBody));

        NodeId call = lowerer.callGlobal("pcall", List.of(builder.identifier(tryName)));
        out.add(builder.multiVariableDeclaration(
                List.of(builder.identifier(okName), builder.identifier(errName)), call));

        JsonNode handler = statement.path("handler");
        JsonNode finalizer = statement.path("finalizer");
        if (!handler.isObject() && !finalizer.isObject()) {
            throw lowerer.fail(statement, "try requires a catch or finally clause");
        }
        if (handler.isObject()) {
            out.add(builder.ifStatement(failed(okName), handlerBlock(handler, errName), null));
        }
        if (finalizer.isObject()) {
            out.addAll(lowerer.lowerBody(finalizer));
        }
        if (!handler.isObject()) {
            NodeId rethrow = builder.expressionStatement(
                    lowerer.callGlobal("error", List.of(builder.identifier(errName), builder.literal(0))));
            out.add(builder.ifStatement(failed(okName), builder.blockStatement(List.of(rethrow)), null));
        }
        return builder.blockStatement(out);
    }

    private NodeId failed(String okName) {
        return lowerer.builder().unaryExpression("!", lowerer.builder().identifier(okName));
    }

    private NodeId handlerBlock(JsonNode handler, String errName) {
        List<NodeId> statements = new ArrayList<>();
        JsonNode param = handler.path("param");
        if (param.isObject()) {
            if (AstType.IDENTIFIER.typeName().equals(param.path("type").asText())) {
                statements.add(lowerer.declareLocal(
                        param.path("name").asText(), lowerer.builder().identifier(errName)));
            } else if (PatternLowerer.isPattern(param)) {
                lowerer.patterns().bindFrom(param, errName, PatternLowerer.Mode.DECLARE, "let", statements);
            } else {
                throw lowerer.fail(param, "Unsupported catch parameter '" + param.path("type").asText() + "'");
            }
        }
        statements.addAll(lowerer.lowerBody(handler.get("body")));
        return lowerer.builder().blockStatement(statements);
    }
}
