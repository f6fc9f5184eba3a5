package io.luascript.core.ir;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Optional parts of a function node.
 *
 * @param restParam identifier bound to trailing arguments, or {@code null}
 * @param meta      auxiliary annotations ({@code classLike}, {@code cfg}, ...), or {@code null}
 */
public record FunctionOptions(NodeId restParam, ObjectNode meta) {

    public static FunctionOptions none() {
        return new FunctionOptions(null, null);
    }

    public FunctionOptions withRestParam(NodeId rest) {
        return new FunctionOptions(rest, meta);
    }

    public FunctionOptions withMeta(ObjectNode newMeta) {
        return new FunctionOptions(restParam, newMeta);
    }
}
