package com.snailc;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Newline-to-separator pass. Replaces every newline that ends a statement with {@link #RS},
 * leaving all other characters in place so offsets stay valid.
 */
public final class Preprocessor {
    /** ASCII record separator, the statement separator seen by the lexer. */
    public static final char RS = '\u001e';

    private enum Frame {
        BLOCK,
        PAREN,
        BRACKET,
        SET_LITERAL,
        DICT_LITERAL
    }

    private enum LastToken {
        ENDER,
        CONTINUATION,
        NONE
    }

    private final String source;
    private final char[] out;
    private final int length;
    private final Deque<Frame> stack = new ArrayDeque<>();
    private LastToken lastToken = LastToken.NONE;
    private boolean inHeader = false;
    // True at start of input, after a block `{`, after `;` and after an injected separator
    private boolean atStatementStart = true;
    private char previousSignificant = 0;

    private Preprocessor(String source) {
        this.source = source;
        this.out = source.toCharArray();
        this.length = source.length();
    }

    /**
     * Returns {@code source} with statement-ending newlines replaced by {@link #RS}.
     *
     * @throws SnailSyntaxException on a backslash at statement level that is not a line continuation
     */
    public static String preprocess(String source) {
        return new Preprocessor(source).run();
    }

    private String run() {
        int i = 0;
        while (i < length) {
            char c = source.charAt(i);

            // Strings
            int quote = stringQuoteIndex(i);
            if (quote >= 0) {
                i = skipStringBody(quote);
                markEnder(source.charAt(i - 1));
                continue;
            }

            // Comments are transparent: the token before them decides injection
            if (c == '#' && !(i + 1 < length && source.charAt(i + 1) == '{')) {
                while (i < length && source.charAt(i) != '\n' && source.charAt(i) != RS) {
                    i++;
                }
                continue;
            }

            if (c == '\n') {
                if (shouldInject(i)) {
                    out[i] = RS;
                    atStatementStart = true;
                }
                i++;
                continue;
            }
            if (c == RS) {
                // Already separated by an earlier pass
                atStatementStart = true;
                i++;
                continue;
            }
            if (c == ' ' || c == '\t' || c == '\r') {
                i++;
                continue;
            }

            switch (c) {
                case '(' -> {
                    open(Frame.PAREN, c);
                    i++;
                    continue;
                }
                case '[' -> {
                    open(Frame.BRACKET, c);
                    i++;
                    continue;
                }
                case '{' -> {
                    Frame frame = previousSignificant == '#' ? Frame.SET_LITERAL
                        : previousSignificant == '%' ? Frame.DICT_LITERAL
                        : Frame.BLOCK;
                    open(frame, c);
                    if (frame == Frame.BLOCK) {
                        inHeader = false;
                        atStatementStart = true;
                    }
                    i++;
                    continue;
                }
                case ')' -> {
                    close(Frame.PAREN);
                    markEnder(c);
                    i++;
                    continue;
                }
                case ']' -> {
                    close(Frame.BRACKET);
                    markEnder(c);
                    i++;
                    continue;
                }
                case '}' -> {
                    close(Frame.BLOCK);
                    markEnder(c);
                    i++;
                    continue;
                }
                default -> {
                }
            }

            // Regex literal: only where an operand may start
            if (c == '/' && lastToken != LastToken.ENDER) {
                int end = skipRegex(i);
                if (end > i + 1) {
                    i = end;
                    markEnder(source.charAt(i - 1));
                    continue;
                }
            }

            int punct = punctuationLength(i);
            if (punct > 0) {
                lastToken = punctuationEnds(i, punct) ? LastToken.ENDER : LastToken.CONTINUATION;
                atStatementStart = c == ';';
                previousSignificant = source.charAt(i + punct - 1);
                i += punct;
                continue;
            }

            if (isIdentifierStart(c)) {
                int start = i;
                while (i < length && isIdentifierPart(source.charAt(i))) {
                    i++;
                }
                String word = source.substring(start, i);
                lastToken = classifyWord(word);
                if (isHeaderKeyword(word) && atStatementLevel() && atStatementStart) {
                    inHeader = true;
                }
                atStatementStart = false;
                previousSignificant = source.charAt(i - 1);
                continue;
            }

            if (isDigit(c)) {
                while (i < length && (isDigit(source.charAt(i)) || source.charAt(i) == '.')) {
                    i++;
                }
                markEnder(source.charAt(i - 1));
                continue;
            }

            if (c == '$') {
                i++;
                // $( and $[ open a subprocess or accessor body
                if (i < length && (source.charAt(i) == '(' || source.charAt(i) == '[')) {
                    lastToken = LastToken.CONTINUATION;
                    atStatementStart = false;
                    previousSignificant = c;
                    continue;
                }
                while (i < length && isIdentifierPart(source.charAt(i))) {
                    i++;
                }
                markEnder(source.charAt(i - 1));
                continue;
            }

            // Backslash continuation is only recognized at statement level
            if (c == '\\' && atStatementLevel()) {
                int j = i + 1;
                while (j < length && (source.charAt(j) == ' ' || source.charAt(j) == '\t')) {
                    j++;
                }
                if (j + 1 < length && source.charAt(j) == '\r' && source.charAt(j + 1) == '\n') {
                    j++;
                }
                if (j < length && source.charAt(j) == '\n') {
                    for (int k = i; k <= j; k++) {
                        out[k] = ' ';
                    }
                    i = j + 1;
                    continue;
                }
                throw new SnailSyntaxException(
                    "stray '\\' (backslash line continuation must be followed by a newline)",
                    LineIndex.of(source).span(i, i + 1));
            }

            previousSignificant = c;
            i++;
        }
        return new String(out);
    }

    private void markEnder(char last) {
        lastToken = LastToken.ENDER;
        atStatementStart = false;
        previousSignificant = last;
    }

    private void open(Frame frame, char c) {
        stack.push(frame);
        lastToken = LastToken.CONTINUATION;
        atStatementStart = false;
        previousSignificant = c;
    }

    private void close(Frame expected) {
        Frame top = stack.peek();
        if (top == null) {
            return;
        }
        boolean matches = top == expected
            || (expected == Frame.BLOCK && (top == Frame.SET_LITERAL || top == Frame.DICT_LITERAL));
        if (matches) {
            stack.pop();
        }
    }

    private boolean atStatementLevel() {
        return stack.isEmpty() || stack.peek() == Frame.BLOCK;
    }

    private boolean shouldInject(int newline) {
        if (!atStatementLevel() || inHeader || lastToken != LastToken.ENDER) {
            return false;
        }
        return nextSignificant(newline + 1) != '}';
    }

    private char nextSignificant(int from) {
        int i = from;
        while (i < length) {
            char c = source.charAt(i);
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                i++;
                continue;
            }
            if (c == '#' && !(i + 1 < length && source.charAt(i + 1) == '{')) {
                while (i < length && source.charAt(i) != '\n' && source.charAt(i) != RS) {
                    i++;
                }
                continue;
            }
            return c;
        }
        return 0;
    }

    // ========================================================================
    // Strings and regex literals
    // ========================================================================

    /** Index of the opening quote when a string literal (with optional prefix) starts at i, else -1. */
    private int stringQuoteIndex(int i) {
        char c = source.charAt(i);
        if (c == '\'' || c == '"') {
            return i;
        }
        if (c != 'r' && c != 'b') {
            return -1;
        }
        // Prefix letters belong to an identifier when preceded by one
        if (i > 0 && isIdentifierPart(source.charAt(i - 1))) {
            return -1;
        }
        if (i + 1 < length && isQuote(source.charAt(i + 1))) {
            return i + 1;
        }
        if (i + 2 < length && isQuote(source.charAt(i + 2))) {
            char second = source.charAt(i + 1);
            if ((c == 'r' && second == 'b') || (c == 'b' && second == 'r')) {
                return i + 2;
            }
        }
        return -1;
    }

    // A backslash always protects the next character from closing the literal, raw or not
    private int skipStringBody(int quoteIndex) {
        char quote = source.charAt(quoteIndex);
        boolean triple = quoteIndex + 2 < length
            && source.charAt(quoteIndex + 1) == quote
            && source.charAt(quoteIndex + 2) == quote;
        int j = quoteIndex + (triple ? 3 : 1);
        while (j < length) {
            char c = source.charAt(j);
            if (c == '\\') {
                j += 2;
                continue;
            }
            if (c == quote) {
                if (!triple) {
                    return j + 1;
                }
                if (j + 2 < length && source.charAt(j + 1) == quote && source.charAt(j + 2) == quote) {
                    return j + 3;
                }
            }
            j++;
        }
        return length;
    }

    private int skipRegex(int i) {
        if (i + 1 < length && source.charAt(i + 1) == '/') {
            return i;
        }
        int j = i + 1;
        while (j < length) {
            char c = source.charAt(j);
            if (c == '/') {
                return j + 1;
            }
            if (c == '\n' || c == RS) {
                return i;
            }
            j += c == '\\' ? 2 : 1;
        }
        return i;
    }

    // ========================================================================
    // Token classification
    // ========================================================================

    private int punctuationLength(int i) {
        char c = source.charAt(i);
        char next = i + 1 < length ? source.charAt(i + 1) : 0;
        char third = i + 2 < length ? source.charAt(i + 2) : 0;
        return switch (c) {
            case '?', ',', '.', ':', ';', '@', '|' -> 1;
            case '%', '!' -> next == '=' ? 2 : 1;
            case '+' -> next == '+' || next == '=' ? 2 : 1;
            case '-' -> next == '-' || next == '=' ? 2 : 1;
            case '*' -> next == '*' && third == '=' ? 3 : (next == '*' || next == '=' ? 2 : 1);
            case '/' -> next == '/' && third == '=' ? 3 : (next == '/' || next == '=' ? 2 : 0);
            case '=', '<', '>' -> next == '=' ? 2 : 1;
            default -> 0;
        };
    }

    private boolean punctuationEnds(int i, int len) {
        char c = source.charAt(i);
        if (c == '?') {
            return true;
        }
        return len == 2 && (c == '+' || c == '-') && source.charAt(i + 1) == c;
    }

    private static LastToken classifyWord(String word) {
        return switch (word) {
            case "if", "elif", "else", "while", "for", "def", "class", "try", "except", "finally", "with",
                 "lines", "files",
                 "in", "and", "or", "not", "as", "from", "import", "del", "assert", "let" -> LastToken.CONTINUATION;
            default -> LastToken.ENDER;
        };
    }

    private static boolean isHeaderKeyword(String word) {
        return switch (word) {
            case "if", "elif", "else", "while", "for", "def", "class", "try", "except", "finally", "with",
                 "lines", "files" -> true;
            default -> false;
        };
    }

    private static boolean isQuote(char c) {
        return c == '\'' || c == '"';
    }

    static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }
}
