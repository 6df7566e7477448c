package com.snailc.ast;

public enum ParameterKind {
    REGULAR,
    VAR_ARGS,
    KW_ARGS
}
