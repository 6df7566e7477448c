package com.snailc.py;

import com.snailc.ast.SourceSpan;

/**
 * Keyword argument; a null {@code arg} is a {@code **mapping} splat.
 */
public record PyKeyword(SourceSpan span, String arg, PyExpr value) implements PyNode {
    @Override
    public String type() {
        return "keyword";
    }
}
