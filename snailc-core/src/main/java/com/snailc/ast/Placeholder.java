package com.snailc.ast;

/**
 * The {@code _} marker. Inside a pipelined call's arguments it receives the piped value; elsewhere it is the name {@code _}.
 */
public record Placeholder(
    SourceSpan span
) implements Expression {
    @Override
    public String type() {
        return "Placeholder";
    }
}
