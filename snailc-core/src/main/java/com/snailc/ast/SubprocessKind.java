package com.snailc.ast;

public enum SubprocessKind {
    /** {@code $(cmd)}: evaluates to the command's output. */
    CAPTURE,
    /** {@code @(cmd)}: evaluates to the command's exit status. */
    STATUS
}
