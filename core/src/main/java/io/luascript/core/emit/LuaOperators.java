package io.luascript.core.emit;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Source operators mapped to Lua, with Lua binding strength. */
final class LuaOperators {

    /** Binding strength of a primary expression; never parenthesized. */
    static final int PRIMARY = 100;

    static final int UNARY = 12;

    private static final int POWER = 13;
    private static final int CONCAT = 9;

    private static final Map<String, String> BINARY = Map.ofEntries(
            Map.entry("+", "+"),
            Map.entry("-", "-"),
            Map.entry("*", "*"),
            Map.entry("/", "/"),
            Map.entry("%", "%"),
            Map.entry("**", "^"),
            Map.entry("===", "=="),
            Map.entry("==", "=="),
            Map.entry("!==", "~="),
            Map.entry("!=", "~="),
            Map.entry("<", "<"),
            Map.entry("<=", "<="),
            Map.entry(">", ">"),
            Map.entry(">=", ">="),
            Map.entry("&", "&"),
            Map.entry("|", "|"),
            Map.entry("^", "~"),
            Map.entry("<<", "<<"),
            Map.entry(">>", ">>"),
            Map.entry("&&", "and"),
            Map.entry("||", "or"),
            Map.entry("..", ".."));

    private static final Map<String, Integer> PRECEDENCE = Map.ofEntries(
            Map.entry("or", 1),
            Map.entry("and", 2),
            Map.entry("<", 3),
            Map.entry(">", 3),
            Map.entry("<=", 3),
            Map.entry(">=", 3),
            Map.entry("~=", 3),
            Map.entry("==", 3),
            Map.entry("|", 4),
            Map.entry("~", 5),
            Map.entry("&", 6),
            Map.entry("<<", 7),
            Map.entry(">>", 7),
            Map.entry("..", CONCAT),
            Map.entry("+", 10),
            Map.entry("-", 10),
            Map.entry("*", 11),
            Map.entry("/", 11),
            Map.entry("%", 11),
            Map.entry("^", POWER));

    /** Lua's {@code >>} is already logical; {@code >>>} only needs its operands cut to 32 bits. */
    static final String UNSIGNED_SHIFT = ">>>";
    static final String UINT32_MASK = "0xFFFFFFFF";
    static final String SHIFT_COUNT_MASK = "31";

    private static final Set<String> RIGHT_ASSOCIATIVE = Set.of("..", "^");

    /** Lua keywords; an identifier spelled like one is renamed. */
    static final Set<String> KEYWORDS = Set.of(
            "and", "break", "do", "else", "elseif", "end", "false", "for", "function", "goto", "if", "in",
            "local", "nil", "not", "or", "repeat", "return", "then", "true", "until", "while");

    private LuaOperators() {
        // utility class
    }

    /** The Lua spelling of a source binary or logical operator. */
    static Optional<String> binary(String sourceOperator) {
        return Optional.ofNullable(BINARY.get(sourceOperator));
    }

    static int precedence(String luaOperator) {
        Integer value = PRECEDENCE.get(luaOperator);
        if (value == null) {
            throw new IllegalArgumentException("Not a Lua binary operator: " + luaOperator);
        }
        return value;
    }

    static boolean rightAssociative(String luaOperator) {
        return RIGHT_ASSOCIATIVE.contains(luaOperator);
    }

    /** The Lua prefix spelling of a unary operator; {@code typeof} is a call and has none. */
    static Optional<String> unary(String sourceOperator) {
        return switch (sourceOperator) {
            case "!" -> Optional.of("not ");
            case "-" -> Optional.of("-");
            case "~" -> Optional.of("~");
            default -> Optional.empty();
        };
    }

    /** Whether {@code name} can be written as a bare Lua name. */
    static boolean isLuaName(String name) {
        return name.matches("[A-Za-z_][A-Za-z0-9_]*") && !KEYWORDS.contains(name);
    }
}
