package io.luascript.core.parse;

import io.luascript.core.error.SourceParseException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Hand-written tokenizer for the source language.
 *
 * <p>Produces the whole token list up front so the parser can look ahead freely (arrow-function
 * detection needs to scan to a closing parenthesis). Every token records whether a line terminator
 * precedes it, which drives automatic semicolon insertion.
 *
 * <p>A {@code /} is always a division operator; regular-expression literals are not recognized.
 */
public final class Lexer {

    static final Set<String> KEYWORDS = Set.of(
            "var", "let", "const", "function", "return", "if", "else", "while", "do", "for", "in", "break",
            "continue", "switch", "case", "default", "try", "catch", "finally", "throw", "new", "this", "super",
            "class", "extends", "null", "true", "false", "typeof", "instanceof", "void", "delete", "import",
            "export", "debugger", "with");

    // Longest first so that greedy matching picks e.g. ">>>=" over ">>".
    private static final String[] PUNCTUATORS = {
        ">>>=", "...", "===", "!==", "**=", "<<=", ">>=", ">>>", "&&=", "||=", "??=", "=>", "==", "!=", "<=", ">=",
        "&&", "||", "??", "?.", "++", "--", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "**", "<<", ">>", "{",
        "}", "(", ")", "[", "]", ";", ",", "<", ">", "+", "-", "*", "/", "%", "&", "|", "^", "!", "~", "?", ":",
        "=", ".", "@", "#"
    };

    private final String sourcePath;
    private final String source;
    private final int limit;

    private int pos;
    private int line;
    private int lineStart;

    public Lexer(String sourcePath, String source) {
        this(sourcePath, source, new Token.Span(0, source.length(), 1, 0));
    }

    /** Tokenizes only {@code bounds} of {@code source}; used for template substitutions. */
    public Lexer(String sourcePath, String source, Token.Span bounds) {
        this.sourcePath = sourcePath;
        this.source = source;
        this.limit = bounds.end();
        this.pos = bounds.start();
        this.line = bounds.line();
        this.lineStart = bounds.start() - bounds.column();
    }

    /**
     * Tokenizes the input. The last token is always {@link Token.Type#EOF}.
     *
     * @throws SourceParseException on an unterminated string, comment or template, or an unknown
     *     character
     */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            boolean newline = skipTrivia();
            if (pos >= limit) {
                tokens.add(new Token(Token.Type.EOF, "", null, line, pos - lineStart, pos, pos, newline));
                return tokens;
            }
            tokens.add(scanToken(newline));
        }
    }

    // --- Trivia ---

    /** Skips whitespace and comments; returns whether a line terminator was crossed. */
    private boolean skipTrivia() {
        boolean newline = false;
        while (pos < limit) {
            char c = source.charAt(pos);
            if (c == '\n') {
                newline = true;
                advanceLine();
            } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f' || c == '\u000B' || c == '\u00A0'
                    || c == '\uFEFF') {
                pos++;
            } else if (c == '/' && peek(1) == '/') {
                while (pos < limit && source.charAt(pos) != '\n') {
                    pos++;
                }
            } else if (c == '/' && peek(1) == '*') {
                int startLine = line;
                int startColumn = pos - lineStart;
                pos += 2;
                while (true) {
                    if (pos >= limit) {
                        throw error("Unterminated block comment", startLine, startColumn);
                    }
                    if (source.charAt(pos) == '*' && peek(1) == '/') {
                        pos += 2;
                        break;
                    }
                    if (source.charAt(pos) == '\n') {
                        newline = true;
                        advanceLine();
                    } else {
                        pos++;
                    }
                }
            } else {
                break;
            }
        }
        return newline;
    }

    private void advanceLine() {
        pos++;
        line++;
        lineStart = pos;
    }

    // --- Tokens ---

    private Token scanToken(boolean newline) {
        char c = source.charAt(pos);
        int start = pos;
        int column = pos - lineStart;
        if (isIdentifierStart(c)) {
            while (pos < limit && isIdentifierPart(source.charAt(pos))) {
                pos++;
            }
            String word = source.substring(start, pos);
            Token.Type type = KEYWORDS.contains(word) ? Token.Type.KEYWORD : Token.Type.IDENTIFIER;
            return new Token(type, word, null, line, column, start, pos, newline);
        }
        if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
            return scanNumber(start, column, newline);
        }
        if (c == '"' || c == '\'') {
            return scanString(c, start, column, newline);
        }
        if (c == '`') {
            return scanTemplate(start, column, newline);
        }
        for (String punctuator : PUNCTUATORS) {
            if (source.startsWith(punctuator, pos) && pos + punctuator.length() <= limit) {
                // "?." followed by a digit is a conditional operator and a number: a?.5:b
                if (punctuator.equals("?.") && isDigit(peek(2))) {
                    continue;
                }
                pos += punctuator.length();
                return new Token(Token.Type.PUNCTUATOR, punctuator, null, line, column, start, pos, newline);
            }
        }
        throw error("Unexpected character '" + c + "'", line, column);
    }

    private Token scanNumber(int start, int column, boolean newline) {
        double value;
        if (source.charAt(pos) == '0' && (peek(1) == 'x' || peek(1) == 'X' || peek(1) == 'o' || peek(1) == 'O'
                || peek(1) == 'b' || peek(1) == 'B')) {
            char radixChar = Character.toLowerCase(peek(1));
            int radix = radixChar == 'x' ? 16 : radixChar == 'o' ? 8 : 2;
            pos += 2;
            int digitsStart = pos;
            while (pos < limit && (Character.digit(source.charAt(pos), radix) >= 0 || source.charAt(pos) == '_')) {
                pos++;
            }
            String digits = source.substring(digitsStart, pos).replace("_", "");
            if (digits.isEmpty()) {
                throw error("Missing digits after radix prefix", line, column);
            }
            value = new BigInteger(digits, radix).doubleValue();
        } else {
            while (pos < limit && (isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                pos++;
            }
            if (pos < limit && source.charAt(pos) == '.') {
                pos++;
                while (pos < limit && (isDigit(source.charAt(pos)) || source.charAt(pos) == '_')) {
                    pos++;
                }
            }
            if (pos < limit && (source.charAt(pos) == 'e' || source.charAt(pos) == 'E')) {
                int save = pos;
                pos++;
                if (pos < limit && (source.charAt(pos) == '+' || source.charAt(pos) == '-')) {
                    pos++;
                }
                if (pos < limit && isDigit(source.charAt(pos))) {
                    while (pos < limit && isDigit(source.charAt(pos))) {
                        pos++;
                    }
                } else {
                    pos = save;
                }
            }
            value = Double.parseDouble(source.substring(start, pos).replace("_", ""));
        }
        if (pos < limit && source.charAt(pos) == 'n') {
            throw error("BigInt literals are not supported", line, column);
        }
        if (pos < limit && isIdentifierStart(source.charAt(pos))) {
            throw error("Identifier starts immediately after numeric literal", line, pos - lineStart);
        }
        return new Token(Token.Type.NUMBER, source.substring(start, pos), value, line, column, start, pos, newline);
    }

    private Token scanString(char quote, int start, int column, boolean newline) {
        int startLine = line;
        pos++;
        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= limit || source.charAt(pos) == '\n') {
                throw error("Unterminated string literal", startLine, column);
            }
            char c = source.charAt(pos);
            if (c == quote) {
                pos++;
                break;
            }
            if (c == '\\') {
                readEscape(value);
            } else {
                value.append(c);
                pos++;
            }
        }
        return new Token(
                Token.Type.STRING, source.substring(start, pos), value.toString(), startLine, column, start, pos, newline);
    }

    private Token scanTemplate(int start, int column, boolean newline) {
        int startLine = line;
        pos++;
        List<String> cooked = new ArrayList<>();
        List<String> raw = new ArrayList<>();
        List<Token.Span> expressions = new ArrayList<>();
        StringBuilder cookedPart = new StringBuilder();
        int rawStart = pos;
        while (true) {
            if (pos >= limit) {
                throw error("Unterminated template literal", startLine, column);
            }
            char c = source.charAt(pos);
            if (c == '`') {
                cooked.add(cookedPart.toString());
                raw.add(source.substring(rawStart, pos));
                pos++;
                break;
            }
            if (c == '$' && peek(1) == '{') {
                cooked.add(cookedPart.toString());
                raw.add(source.substring(rawStart, pos));
                cookedPart.setLength(0);
                pos += 2;
                int exprStart = pos;
                int exprLine = line;
                int exprColumn = pos - lineStart;
                int exprEnd = skipSubstitution(startLine, column);
                expressions.add(new Token.Span(exprStart, exprEnd, exprLine, exprColumn));
                pos = exprEnd + 1;
                rawStart = pos;
                continue;
            }
            if (c == '\\') {
                readEscape(cookedPart);
            } else if (c == '\n') {
                cookedPart.append(c);
                advanceLine();
            } else {
                cookedPart.append(c);
                pos++;
            }
        }
        Token.TemplateParts parts = new Token.TemplateParts(List.copyOf(cooked), List.copyOf(raw), List.copyOf(expressions));
        return new Token(Token.Type.TEMPLATE, source.substring(start, pos), parts, startLine, column, start, pos, newline);
    }

    /** Advances over a {@code ${...}} body; returns the offset of its closing brace. */
    private int skipSubstitution(int templateLine, int templateColumn) {
        int depth = 0;
        while (pos < limit) {
            char c = source.charAt(pos);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                if (depth == 0) {
                    return pos;
                }
                depth--;
            } else if (c == '"' || c == '\'') {
                scanString(c, pos, pos - lineStart, false);
                continue;
            } else if (c == '`') {
                scanTemplate(pos, pos - lineStart, false);
                continue;
            } else if (c == '\n') {
                advanceLine();
                continue;
            }
            pos++;
        }
        throw error("Unterminated template substitution", templateLine, templateColumn);
    }

    private void readEscape(StringBuilder out) {
        int escapeColumn = pos - lineStart;
        pos++;
        if (pos >= limit) {
            throw error("Unterminated escape sequence", line, escapeColumn);
        }
        char c = source.charAt(pos);
        pos++;
        switch (c) {
            case 'n' -> out.append('\n');
            case 't' -> out.append('\t');
            case 'r' -> out.append('\r');
            case 'b' -> out.append('\b');
            case 'f' -> out.append('\f');
            case 'v' -> out.append('\u000B');
            case '0' -> out.append('\0');
            case 'x' -> out.append((char) readHex(2, escapeColumn));
            case 'u' -> {
                if (pos < limit && source.charAt(pos) == '{') {
                    int close = source.indexOf('}', pos);
                    if (close < 0 || close > limit) {
                        throw error("Unterminated unicode escape", line, escapeColumn);
                    }
                    int codePoint = Integer.parseInt(source.substring(pos + 1, close), 16);
                    out.appendCodePoint(codePoint);
                    pos = close + 1;
                } else {
                    out.append((char) readHex(4, escapeColumn));
                }
            }
            case '\r' -> {
                if (pos < limit && source.charAt(pos) == '\n') {
                    advanceLine();
                }
            }
            case '\n' -> {
                line++;
                lineStart = pos;
            }
            default -> out.append(c);
        }
    }

    private int readHex(int digits, int escapeColumn) {
        if (pos + digits > limit) {
            throw error("Incomplete hexadecimal escape", line, escapeColumn);
        }
        try {
            int value = Integer.parseInt(source.substring(pos, pos + digits), 16);
            pos += digits;
            return value;
        } catch (NumberFormatException e) {
            throw error("Invalid hexadecimal escape", line, escapeColumn);
        }
    }

    // --- Character classes ---

    static boolean isIdentifierStart(char c) {
        return Character.isLetter(c) || c == '$' || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '$' || c == '_';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < limit ? source.charAt(index) : '\0';
    }

    private SourceParseException error(String message, int atLine, int atColumn) {
        return new SourceParseException(message, sourcePath, atLine, atColumn);
    }
}
