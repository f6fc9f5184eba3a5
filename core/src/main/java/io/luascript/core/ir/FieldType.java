package io.luascript.core.ir;

/** JSON shape of a kind-specific IR node field. */
public enum FieldType {
    /** Node id string; must resolve in the node table. */
    REF,
    /** Node id string or {@code null}; omitted when absent. */
    OPTIONAL_REF,
    /** Array of node id strings. */
    REF_LIST,
    /** Array of node id strings where {@code null} marks a hole. */
    HOLEY_REF_LIST,
    /** String value. */
    STRING,
    /** Boolean value. */
    BOOLEAN,
    /** Any JSON scalar, {@code null} included. */
    SCALAR
}
