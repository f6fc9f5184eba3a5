package io.luascript.core.parse;

import java.util.List;

/**
 * One lexical token.
 *
 * @param type          token category
 * @param text          source spelling; for strings and templates the full quoted form
 * @param value         decoded value: {@code String} for strings, {@code Double} for numbers,
 *                      {@link TemplateParts} for templates, otherwise {@code null}
 * @param line          1-based line of the first character
 * @param column        0-based column of the first character
 * @param start         offset of the first character
 * @param end           offset after the last character
 * @param newlineBefore whether a line terminator separates this token from the previous one
 */
public record Token(
        Token.Type type,
        String text,
        Object value,
        int line,
        int column,
        int start,
        int end,
        boolean newlineBefore) {

    public enum Type {
        IDENTIFIER("an identifier"),
        KEYWORD("a keyword"),
        NUMBER("a number"),
        STRING("a string"),
        TEMPLATE("a template literal"),
        PUNCTUATOR("a punctuator"),
        EOF("the end of the input");

        private final String description;

        Type(String description) {
            this.description = description;
        }

        public String description() {
            return description;
        }
    }

    /**
     * Pieces of a template literal. {@code cooked.size() == expressions.size() + 1}.
     *
     * @param cooked      quasi strings with escapes resolved
     * @param raw         quasi strings as written
     * @param expressions offsets of each {@code ${...}} body within the source
     */
    public record TemplateParts(List<String> cooked, List<String> raw, List<Span> expressions) {}

    /** Half-open source range with the position of its first character. */
    public record Span(int start, int end, int line, int column) {}

    public boolean is(Type expected, String expectedText) {
        return type == expected && text.equals(expectedText);
    }

    public boolean isPunctuator(String punctuator) {
        return is(Type.PUNCTUATOR, punctuator);
    }

    public boolean isKeyword(String keyword) {
        return is(Type.KEYWORD, keyword);
    }

    /** Identifier with the given name; used for contextual keywords such as {@code of} or {@code async}. */
    public boolean isIdentifier(String name) {
        return is(Type.IDENTIFIER, name);
    }

    /** Describes the token for error messages. */
    public String describe() {
        return type == Type.EOF ? type.description() : "'" + text + "'";
    }
}
