package com.snailc;

import com.snailc.ast.SourceLocation;
import com.snailc.ast.SourceSpan;

/**
 * A lexed token. Positions are character offsets into the preprocessed source;
 * lines are 1-based and columns 0-based.
 *
 * @param literal token-specific payload: {@link StringToken} for strings,
 *                {@link BodyToken} for regex, subprocess and accessor tokens, null otherwise
 */
public record Token(
    TokenType type,
    String lexeme,
    Object literal,
    int line,
    int column,
    int endLine,
    int endColumn,
    int position,
    int endPosition
) {
    public SourceSpan span() {
        return new SourceSpan(position, endPosition, new SourceLocation(
            new SourceLocation.Position(line, column),
            new SourceLocation.Position(endLine, endColumn)));
    }

    /**
     * Body of a string literal with its prefix flags.
     *
     * @param contentStart offset of the first character after the opening quote
     */
    public record StringToken(String content, boolean raw, boolean bytes, int contentStart) {
    }

    /**
     * Body of a regex, subprocess or accessor token.
     */
    public record BodyToken(String content, int contentStart) {
    }
}
