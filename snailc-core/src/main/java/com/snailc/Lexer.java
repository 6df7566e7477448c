package com.snailc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tokenizer for preprocessed Snail source. Can scan a window of the text so that
 * interpolated expressions keep offsets into the enclosing file.
 */
public class Lexer {
    private static final Map<String, TokenType> KEYWORDS = Map.ofEntries(
        Map.entry("if", TokenType.IF),
        Map.entry("elif", TokenType.ELIF),
        Map.entry("else", TokenType.ELSE),
        Map.entry("while", TokenType.WHILE),
        Map.entry("for", TokenType.FOR),
        Map.entry("in", TokenType.IN),
        Map.entry("def", TokenType.DEF),
        Map.entry("class", TokenType.CLASS),
        Map.entry("return", TokenType.RETURN),
        Map.entry("break", TokenType.BREAK),
        Map.entry("continue", TokenType.CONTINUE),
        Map.entry("pass", TokenType.PASS),
        Map.entry("try", TokenType.TRY),
        Map.entry("except", TokenType.EXCEPT),
        Map.entry("finally", TokenType.FINALLY),
        Map.entry("raise", TokenType.RAISE),
        Map.entry("from", TokenType.FROM),
        Map.entry("with", TokenType.WITH),
        Map.entry("as", TokenType.AS),
        Map.entry("assert", TokenType.ASSERT),
        Map.entry("del", TokenType.DEL),
        Map.entry("import", TokenType.IMPORT),
        Map.entry("yield", TokenType.YIELD),
        Map.entry("let", TokenType.LET),
        Map.entry("and", TokenType.AND),
        Map.entry("or", TokenType.OR),
        Map.entry("not", TokenType.NOT),
        Map.entry("is", TokenType.IS),
        Map.entry("True", TokenType.TRUE),
        Map.entry("False", TokenType.FALSE),
        Map.entry("None", TokenType.NONE)
    );

    /** Names accepted after {@code $}. Mode gating happens in the validator. */
    static final Set<String> DOLLAR_NAMES = Set.of("e", "n", "fn", "p", "m", "f", "src", "fd", "text");

    private final String source;
    private final int end;
    private final LineIndex lineIndex;
    private final List<Token> tokens = new ArrayList<>();
    private int position;
    private int tokenStart;

    public Lexer(String source) {
        this(source, 0, source.length(), LineIndex.of(source));
    }

    Lexer(String source, int start, int end, LineIndex lineIndex) {
        this.source = source;
        this.position = start;
        this.end = end;
        this.lineIndex = lineIndex;
    }

    public List<Token> tokenize() {
        while (true) {
            skipWhitespaceAndComments();
            tokenStart = position;
            if (position >= end) {
                add(TokenType.EOF, null);
                return tokens;
            }
            scanToken();
        }
    }

    private void skipWhitespaceAndComments() {
        while (position < end) {
            char c = source.charAt(position);
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f') {
                position++;
            } else if (c == '#' && peekNext() != '{') {
                while (position < end && source.charAt(position) != '\n' && source.charAt(position) != Preprocessor.RS) {
                    position++;
                }
            } else if (c == '\\' && isLineContinuation()) {
                // Continuations inside brackets survive preprocessing
                position++;
            } else {
                return;
            }
        }
    }

    private boolean isLineContinuation() {
        int j = position + 1;
        while (j < end && (source.charAt(j) == ' ' || source.charAt(j) == '\t' || source.charAt(j) == '\r')) {
            j++;
        }
        return j < end && source.charAt(j) == '\n';
    }

    private void scanToken() {
        char c = source.charAt(position);

        if (c == Preprocessor.RS) {
            position++;
            add(TokenType.NEWLINE, null);
            return;
        }
        if (Preprocessor.isDigit(c)) {
            scanNumber();
            return;
        }
        if (Preprocessor.isIdentifierStart(c)) {
            scanIdentifierOrString();
            return;
        }
        if (c == '"' || c == '\'') {
            scanString(position, false, false);
            return;
        }

        position++;
        switch (c) {
            case '(' -> add(TokenType.LPAREN, null);
            case ')' -> add(TokenType.RPAREN, null);
            case '[' -> add(TokenType.LBRACKET, null);
            case ']' -> add(TokenType.RBRACKET, null);
            case '{' -> add(TokenType.LBRACE, null);
            case '}' -> add(TokenType.RBRACE, null);
            case ',' -> add(TokenType.COMMA, null);
            case '.' -> add(TokenType.DOT, null);
            case ':' -> add(TokenType.COLON, null);
            case ';' -> add(TokenType.SEMICOLON, null);
            case '?' -> add(TokenType.QUESTION, null);
            case '|' -> add(TokenType.PIPE, null);
            case '#' -> {
                position++; // {
                add(TokenType.SET_LBRACE, null);
            }
            case '%' -> {
                if (match('{')) {
                    add(TokenType.DICT_LBRACE, null);
                } else {
                    add(match('=') ? TokenType.PERCENT_ASSIGN : TokenType.PERCENT, null);
                }
            }
            case '+' -> add(match('+') ? TokenType.INCREMENT : match('=') ? TokenType.PLUS_ASSIGN : TokenType.PLUS, null);
            case '-' -> add(match('-') ? TokenType.DECREMENT : match('=') ? TokenType.MINUS_ASSIGN : TokenType.MINUS, null);
            case '*' -> {
                if (match('*')) {
                    add(match('=') ? TokenType.STAR_STAR_ASSIGN : TokenType.STAR_STAR, null);
                } else {
                    add(match('=') ? TokenType.STAR_ASSIGN : TokenType.STAR, null);
                }
            }
            case '/' -> scanSlash();
            case '=' -> add(match('=') ? TokenType.EQ : TokenType.ASSIGN, null);
            case '!' -> {
                if (!match('=')) {
                    throw error("unexpected character '!'");
                }
                add(TokenType.NE, null);
            }
            case '<' -> add(match('=') ? TokenType.LE : TokenType.LT, null);
            case '>' -> add(match('=') ? TokenType.GE : TokenType.GT, null);
            case '$' -> scanDollar();
            case '@' -> {
                if (!match('(')) {
                    throw error("unexpected character '@'");
                }
                scanSubprocess(TokenType.SUBPROCESS_STATUS);
            }
            default -> throw error("unexpected character '" + c + "'");
        }
    }

    private void scanNumber() {
        while (position < end && Preprocessor.isDigit(source.charAt(position))) {
            position++;
        }
        // After `.` only an integer can follow, so `t.0.1` is two field accesses
        boolean afterDot = !tokens.isEmpty() && tokens.get(tokens.size() - 1).type() == TokenType.DOT;
        if (!afterDot && position + 1 < end && source.charAt(position) == '.'
            && Preprocessor.isDigit(source.charAt(position + 1))) {
            position++;
            while (position < end && Preprocessor.isDigit(source.charAt(position))) {
                position++;
            }
        }
        add(TokenType.NUMBER, null);
    }

    private void scanIdentifierOrString() {
        while (position < end && Preprocessor.isIdentifierPart(source.charAt(position))) {
            position++;
        }
        String word = source.substring(tokenStart, position);
        if (position < end && (source.charAt(position) == '"' || source.charAt(position) == '\'')) {
            switch (word) {
                case "r" -> {
                    scanString(position, true, false);
                    return;
                }
                case "b" -> {
                    scanString(position, false, true);
                    return;
                }
                case "rb", "br" -> {
                    scanString(position, true, true);
                    return;
                }
                default -> {
                }
            }
        }
        add(KEYWORDS.getOrDefault(word, TokenType.IDENTIFIER), null);
    }

    private void scanString(int quoteIndex, boolean raw, boolean bytes) {
        char quote = source.charAt(quoteIndex);
        boolean triple = quoteIndex + 2 < end
            && source.charAt(quoteIndex + 1) == quote
            && source.charAt(quoteIndex + 2) == quote;
        int delimiter = triple ? 3 : 1;
        int contentStart = quoteIndex + delimiter;
        int j = contentStart;
        while (true) {
            if (j >= end) {
                position = end;
                throw new SnailSyntaxException("unterminated string literal", lineIndex.span(tokenStart, tokenStart + 1));
            }
            char c = source.charAt(j);
            if (c == '\\') {
                j += 2;
                continue;
            }
            if (!triple && (c == '\n' || c == Preprocessor.RS)) {
                throw new SnailSyntaxException("unterminated string literal", lineIndex.span(tokenStart, tokenStart + 1));
            }
            if (c == quote && (!triple || (j + 2 < end && source.charAt(j + 1) == quote && source.charAt(j + 2) == quote))) {
                break;
            }
            j++;
        }
        position = j + delimiter;
        add(TokenType.STRING, new Token.StringToken(source.substring(contentStart, j), raw, bytes, contentStart));
    }

    private void scanSlash() {
        if (regexAllowed() && peek() != '/') {
            scanRegex();
            return;
        }
        if (match('/')) {
            add(match('=') ? TokenType.SLASH_SLASH_ASSIGN : TokenType.SLASH_SLASH, null);
        } else {
            add(match('=') ? TokenType.SLASH_ASSIGN : TokenType.SLASH, null);
        }
    }

    private boolean regexAllowed() {
        if (tokens.isEmpty()) {
            return true;
        }
        return switch (tokens.get(tokens.size() - 1).type()) {
            case IDENTIFIER, NUMBER, STRING, REGEX, DOLLAR_NAME, FIELD,
                 SUBPROCESS_CAPTURE, SUBPROCESS_STATUS, ACCESSOR,
                 RPAREN, RBRACKET, RBRACE, TRUE, FALSE, NONE,
                 INCREMENT, DECREMENT, QUESTION -> false;
            default -> true;
        };
    }

    private void scanRegex() {
        int contentStart = position;
        while (true) {
            if (position >= end || source.charAt(position) == '\n' || source.charAt(position) == Preprocessor.RS) {
                throw new SnailSyntaxException("unterminated regex literal", lineIndex.span(tokenStart, tokenStart + 1));
            }
            char c = source.charAt(position);
            if (c == '\\') {
                position += 2;
                continue;
            }
            if (c == '/') {
                break;
            }
            position++;
        }
        String content = source.substring(contentStart, position);
        position++;
        add(TokenType.REGEX, new Token.BodyToken(content, contentStart));
    }

    private void scanDollar() {
        if (match('(')) {
            scanSubprocess(TokenType.SUBPROCESS_CAPTURE);
            return;
        }
        if (match('[')) {
            scanAccessor();
            return;
        }
        char c = peek();
        if (Preprocessor.isDigit(c)) {
            while (position < end && Preprocessor.isDigit(source.charAt(position))) {
                position++;
            }
            add(TokenType.FIELD, null);
            return;
        }
        if (Preprocessor.isIdentifierStart(c)) {
            int nameStart = position;
            while (position < end && Preprocessor.isIdentifierPart(source.charAt(position))) {
                position++;
            }
            String name = source.substring(nameStart, position);
            if (!DOLLAR_NAMES.contains(name)) {
                throw error("unknown special variable '$" + name + "'");
            }
            add(TokenType.DOLLAR_NAME, null);
            return;
        }
        throw error("unexpected character '$'");
    }

    // Body runs to the first `)` outside an interpolation
    private void scanSubprocess(TokenType type) {
        int contentStart = position;
        while (true) {
            if (position >= end) {
                throw new SnailSyntaxException("unterminated subprocess expression", lineIndex.span(tokenStart, tokenStart + 2));
            }
            char c = source.charAt(position);
            if ((c == '{' || c == '}') && peekNext() == c) {
                position += 2;
                continue;
            }
            if (c == '{') {
                int close = Templates.findExpressionEnd(source, position + 1, end);
                if (close < 0) {
                    throw new SnailSyntaxException("unterminated f-string expression", lineIndex.span(position, position + 1));
                }
                position = close + 1;
                continue;
            }
            if (c == ')') {
                break;
            }
            position++;
        }
        String content = source.substring(contentStart, position);
        position++;
        add(type, new Token.BodyToken(content, contentStart));
    }

    private void scanAccessor() {
        int contentStart = position;
        int depth = 1;
        while (true) {
            if (position >= end) {
                throw new SnailSyntaxException("unterminated structured accessor", lineIndex.span(tokenStart, tokenStart + 2));
            }
            char c = source.charAt(position);
            if (c == '[') {
                depth++;
            } else if (c == ']' && --depth == 0) {
                break;
            }
            position++;
        }
        String content = source.substring(contentStart, position);
        position++;
        add(TokenType.ACCESSOR, new Token.BodyToken(content, contentStart));
    }

    // Helper methods

    private boolean match(char expected) {
        if (position < end && source.charAt(position) == expected) {
            position++;
            return true;
        }
        return false;
    }

    private char peek() {
        return position < end ? source.charAt(position) : '\0';
    }

    private char peekNext() {
        return position + 1 < end ? source.charAt(position + 1) : '\0';
    }

    private void add(TokenType type, Object literal) {
        var start = lineIndex.position(tokenStart);
        var stop = lineIndex.position(position);
        tokens.add(new Token(type, source.substring(tokenStart, position), literal,
            start.line(), start.column(), stop.line(), stop.column(), tokenStart, position));
    }

    private SnailSyntaxException error(String message) {
        return new SnailSyntaxException(message, lineIndex.span(tokenStart, Math.max(position, tokenStart + 1)));
    }
}
