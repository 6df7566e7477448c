package com.snailc.ast;

public enum ArgumentKind {
    POSITIONAL,
    KEYWORD,
    STAR,
    KWSTAR
}
