package com.snailc;

import com.snailc.ast.Conversion;
import com.snailc.ast.Expression;
import com.snailc.ast.FStringPart;
import com.snailc.ast.InterpolationPart;
import com.snailc.ast.TextPart;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Scanning and decoding of template bodies: interpolated strings, regex literals,
 * subprocess commands and format specs all share the {@code {expr!c:spec}} syntax.
 */
final class Templates {

    /** Parses the expression text in {@code [start, end)} of the enclosing source. */
    @FunctionalInterface
    interface ExpressionParser {
        Expression parse(int start, int end);
    }

    private Templates() {
    }

    /**
     * Splits {@code source[contentStart, contentEnd)} into text and interpolation parts.
     * Text parts have {@code {{}} and {@code }}} collapsed and are then passed through {@code unescape}.
     */
    static List<FStringPart> parseParts(String source, int contentStart, int contentEnd,
                                        ExpressionParser parser, UnaryOperator<String> unescape,
                                        LineIndex lineIndex) {
        List<FStringPart> parts = new ArrayList<>();
        int textStart = contentStart;
        int i = contentStart;
        while (i < contentEnd) {
            char c = source.charAt(i);
            if (c == '{') {
                if (i + 1 < contentEnd && source.charAt(i + 1) == '{') {
                    i += 2;
                    continue;
                }
                addText(parts, source.substring(textStart, i), unescape);
                int close = findExpressionEnd(source, i + 1, contentEnd);
                if (close < 0) {
                    throw new SnailSyntaxException("unterminated f-string expression", lineIndex.span(i, i + 1));
                }
                if (source.substring(i + 1, close).isBlank()) {
                    throw new SnailSyntaxException("empty f-string expression", lineIndex.span(i, close + 1));
                }
                parts.add(parseInterpolation(source, i, close, parser, unescape, lineIndex));
                i = close + 1;
                textStart = i;
            } else if (c == '}') {
                if (i + 1 < contentEnd && source.charAt(i + 1) == '}') {
                    i += 2;
                    continue;
                }
                throw new SnailSyntaxException("unmatched '}' in f-string", lineIndex.span(i, i + 1));
            } else {
                i++;
            }
        }
        addText(parts, source.substring(textStart, contentEnd), unescape);
        return parts;
    }

    private static void addText(List<FStringPart> parts, String raw, UnaryOperator<String> unescape) {
        if (raw.isEmpty()) {
            return;
        }
        parts.add(new TextPart(unescape.apply(raw.replace("{{", "{").replace("}}", "}"))));
    }

    // open and close index the braces
    private static InterpolationPart parseInterpolation(String source, int open, int close,
                                                        ExpressionParser parser, UnaryOperator<String> unescape,
                                                        LineIndex lineIndex) {
        int exprStart = open + 1;
        int exprEnd = close;
        int specStart = -1;
        Conversion conversion = Conversion.NONE;
        int paren = 0;
        int bracket = 0;
        int brace = 0;
        int i = exprStart;
        while (i < close) {
            char c = source.charAt(i);
            int stringEnd = stringLiteralAt(source, i, close);
            if (stringEnd != -1) {
                if (stringEnd == -2) {
                    throw new SnailSyntaxException("unterminated string in f-string expression", lineIndex.span(i, i + 1));
                }
                i = stringEnd;
                continue;
            }
            boolean topLevel = paren == 0 && bracket == 0 && brace == 0;
            switch (c) {
                case '(' -> paren++;
                case ')' -> paren = Math.max(0, paren - 1);
                case '[' -> bracket++;
                case ']' -> bracket = Math.max(0, bracket - 1);
                case '{' -> brace++;
                case '}' -> brace = Math.max(0, brace - 1);
                default -> {
                }
            }
            if (topLevel && c == '!') {
                if (i + 1 < close && source.charAt(i + 1) == '=') {
                    i += 2;
                    continue;
                }
                conversion = conversionFor(i + 1 < close ? source.charAt(i + 1) : '\0');
                if (conversion == null) {
                    throw new SnailSyntaxException("invalid f-string conversion (expected !r, !s, or !a)",
                        lineIndex.span(i, Math.min(i + 1, close)));
                }
                exprEnd = i;
                int tail = i + 2;
                while (tail < close && Character.isWhitespace(source.charAt(tail))) {
                    tail++;
                }
                if (tail < close) {
                    if (source.charAt(tail) != ':') {
                        throw new SnailSyntaxException("unexpected characters after f-string conversion",
                            lineIndex.span(tail, close));
                    }
                    specStart = tail + 1;
                }
                break;
            }
            if (topLevel && c == ':') {
                exprEnd = i;
                specStart = i + 1;
                break;
            }
            i++;
        }

        int trimmedStart = exprStart;
        int trimmedEnd = exprEnd;
        while (trimmedStart < trimmedEnd && Character.isWhitespace(source.charAt(trimmedStart))) {
            trimmedStart++;
        }
        while (trimmedEnd > trimmedStart && Character.isWhitespace(source.charAt(trimmedEnd - 1))) {
            trimmedEnd--;
        }
        if (trimmedStart == trimmedEnd) {
            throw new SnailSyntaxException("empty f-string expression", lineIndex.span(exprStart, close));
        }
        Expression expression = parser.parse(trimmedStart, trimmedEnd);
        List<FStringPart> formatSpec = specStart < 0
            ? null
            : parseParts(source, specStart, close, parser, unescape, lineIndex);
        return new InterpolationPart(lineIndex.span(open, close + 1), expression, conversion, formatSpec);
    }

    private static Conversion conversionFor(char c) {
        return switch (c) {
            case 'r' -> Conversion.REPR;
            case 's' -> Conversion.STR;
            case 'a' -> Conversion.ASCII;
            default -> null;
        };
    }

    /**
     * Index of the {@code }} closing an interpolation whose body starts at {@code start}, or -1.
     * Nested brackets and string literals inside the expression are skipped.
     */
    static int findExpressionEnd(String source, int start, int limit) {
        int paren = 0;
        int bracket = 0;
        int brace = 1;
        int i = start;
        while (i < limit) {
            int stringEnd = stringLiteralAt(source, i, limit);
            if (stringEnd == -2) {
                return -1;
            }
            if (stringEnd != -1) {
                i = stringEnd;
                continue;
            }
            switch (source.charAt(i)) {
                case '(' -> paren++;
                case ')' -> paren = Math.max(0, paren - 1);
                case '[' -> bracket++;
                case ']' -> bracket = Math.max(0, bracket - 1);
                case '{' -> brace++;
                case '}' -> {
                    if (paren == 0 && bracket == 0 && brace == 1) {
                        return i;
                    }
                    brace = Math.max(0, brace - 1);
                }
                default -> {
                }
            }
            i++;
        }
        return -1;
    }

    /**
     * When a string literal (optionally prefixed) starts at i, returns the index after it,
     * or -2 when it is unterminated. Returns -1 when no literal starts at i.
     */
    private static int stringLiteralAt(String source, int i, int limit) {
        int j = i;
        boolean raw = false;
        char c = source.charAt(j);
        if (c == 'r' || c == 'b') {
            if (j > 0 && Preprocessor.isIdentifierPart(source.charAt(j - 1))) {
                return -1;
            }
            char next = j + 1 < limit ? source.charAt(j + 1) : '\0';
            if (next == '"' || next == '\'') {
                raw = c == 'r';
                j += 1;
            } else if ((next == 'r' || next == 'b') && next != c && j + 2 < limit
                && (source.charAt(j + 2) == '"' || source.charAt(j + 2) == '\'')) {
                raw = true;
                j += 2;
            } else {
                return -1;
            }
        } else if (c != '"' && c != '\'') {
            return -1;
        }
        char quote = source.charAt(j);
        boolean triple = j + 2 < limit && source.charAt(j + 1) == quote && source.charAt(j + 2) == quote;
        int delimiter = triple ? 3 : 1;
        j += delimiter;
        while (j < limit) {
            if (source.startsWith(triple ? String.valueOf(quote).repeat(3) : String.valueOf(quote), j)) {
                return j + delimiter;
            }
            if (!raw && source.charAt(j) == '\\') {
                j = Math.min(j + 2, limit);
                continue;
            }
            j++;
        }
        return -2;
    }

    // ========================================================================
    // Escape handling
    // ========================================================================

    static String joinText(List<FStringPart> parts) {
        StringBuilder sb = new StringBuilder();
        for (FStringPart part : parts) {
            if (part instanceof TextPart text) {
                sb.append(text.text());
            }
        }
        return sb.toString();
    }

    /**
     * Only the delimiter escape is processed; every other backslash belongs to the pattern.
     */
    static String unescapeRegex(String text) {
        return text.replace("\\/", "/");
    }

    static String decodeStringEscapes(String text) {
        return decodeEscapes(text, false);
    }

    static String decodeBytesEscapes(String text) {
        return decodeEscapes(text, true);
    }

    /**
     * Decodes backslash escapes with Python's rules. Unknown or malformed escapes keep their backslash.
     * In byte mode the unicode escapes are not recognized.
     */
    static String decodeEscapes(String text, boolean bytes) {
        if (text.indexOf('\\') < 0) {
            return text;
        }
        StringBuilder out = new StringBuilder(text.length());
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c != '\\' || i + 1 >= n) {
                out.append(c);
                i++;
                continue;
            }
            char e = text.charAt(i + 1);
            switch (e) {
                case '\n' -> i += 2;
                case '\\' -> append(out, '\\', i += 2);
                case '\'' -> append(out, '\'', i += 2);
                case '"' -> append(out, '"', i += 2);
                case 'a' -> append(out, '\u0007', i += 2);
                case 'b' -> append(out, '\b', i += 2);
                case 'f' -> append(out, '\f', i += 2);
                case 'n' -> append(out, '\n', i += 2);
                case 'r' -> append(out, '\r', i += 2);
                case 't' -> append(out, '\t', i += 2);
                case 'v' -> append(out, '\u000b', i += 2);
                case '0', '1', '2', '3', '4', '5', '6', '7' -> {
                    int j = i + 1;
                    int value = 0;
                    while (j < n && j < i + 4 && text.charAt(j) >= '0' && text.charAt(j) <= '7') {
                        value = value * 8 + (text.charAt(j) - '0');
                        j++;
                    }
                    out.appendCodePoint(value);
                    i = j;
                }
                case 'x' -> i = appendHex(text, i, 2, out);
                case 'u' -> i = bytes ? appendLiteral(text, i, out) : appendHex(text, i, 4, out);
                case 'U' -> i = bytes ? appendLiteral(text, i, out) : appendHex(text, i, 8, out);
                case 'N' -> i = bytes ? appendLiteral(text, i, out) : appendNamed(text, i, out);
                default -> i = appendLiteral(text, i, out);
            }
        }
        return out.toString();
    }

    private static void append(StringBuilder out, char c, int ignored) {
        out.append(c);
    }

    private static int appendLiteral(String text, int i, StringBuilder out) {
        out.append('\\').append(text.charAt(i + 1));
        return i + 2;
    }

    private static int appendHex(String text, int i, int digits, StringBuilder out) {
        int start = i + 2;
        int stop = start + digits;
        if (stop > text.length()) {
            return appendLiteral(text, i, out);
        }
        try {
            int codePoint = Integer.parseInt(text.substring(start, stop), 16);
            if (!Character.isValidCodePoint(codePoint)) {
                return appendLiteral(text, i, out);
            }
            out.appendCodePoint(codePoint);
            return stop;
        } catch (NumberFormatException ex) {
            return appendLiteral(text, i, out);
        }
    }

    private static int appendNamed(String text, int i, StringBuilder out) {
        int open = i + 2;
        int close = text.indexOf('}', open);
        if (open >= text.length() || text.charAt(open) != '{' || close < 0) {
            return appendLiteral(text, i, out);
        }
        try {
            out.appendCodePoint(Character.codePointOf(text.substring(open + 1, close)));
            return close + 1;
        } catch (IllegalArgumentException ex) {
            return appendLiteral(text, i, out);
        }
    }
}
