package io.luascript.core.emit;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Keyword-level block balance check for emitted Lua. */
public final class LuaBlocks {

    private static final Pattern STRING = Pattern.compile("\"(?:\\\\.|[^\"\\\\])*\"");
    private static final Pattern COMMENT = Pattern.compile("--[^\\n]*");
    private static final Pattern WORD = Pattern.compile("\\b(function|if|do|end|repeat|until)\\b");

    private LuaBlocks() {
        // utility class
    }

    /**
     * Whether every {@code function}, {@code if} and {@code do} has its {@code end}, and every
     * {@code repeat} its {@code until}, in properly nested order.
     */
    public static boolean balanced(String lua) {
        String code = COMMENT.matcher(STRING.matcher(lua).replaceAll("\"\"")).replaceAll("");
        int ends = 0;
        int untils = 0;
        Matcher m = WORD.matcher(code);
        while (m.find()) {
            switch (m.group(1)) {
                case "function", "if", "do" -> ends++;
                case "repeat" -> untils++;
                case "end" -> {
                    if (--ends < 0) {
                        return false;
                    }
                }
                default -> {
                    if (--untils < 0) {
                        return false;
                    }
                }
            }
        }
        return ends == 0 && untils == 0;
    }
}
