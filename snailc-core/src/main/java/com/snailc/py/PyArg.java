package com.snailc.py;

import com.snailc.ast.SourceSpan;

public record PyArg(SourceSpan span, String arg) implements PyNode {
    @Override
    public String type() {
        return "arg";
    }
}
