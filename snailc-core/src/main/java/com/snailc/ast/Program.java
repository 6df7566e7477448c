package com.snailc.ast;

import java.util.List;

public record Program(SourceSpan span, List<Statement> body) implements Node {
    @Override
    public String type() {
        return "Program";
    }
}
