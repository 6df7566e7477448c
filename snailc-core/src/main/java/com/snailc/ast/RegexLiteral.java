package com.snailc.ast;

import java.util.List;

/**
 * {@code /pattern/}. The body is a template: text parts carry the pattern with {@code \/} already unescaped.
 */
public record RegexLiteral(
    SourceSpan span,
    List<FStringPart> parts
) implements Expression {
    @Override
    public String type() {
        return "RegexLiteral";
    }

    public boolean isInterpolated() {
        return parts.stream().anyMatch(p -> p instanceof InterpolationPart);
    }

    /**
     * Concatenated text of a pattern without interpolations.
     */
    public String literalText() {
        StringBuilder sb = new StringBuilder();
        for (FStringPart part : parts) {
            if (part instanceof TextPart text) {
                sb.append(text.text());
            }
        }
        return sb.toString();
    }
}
