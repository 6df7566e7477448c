package com.snailc;

/**
 * Pipeline stage that rejected the input.
 */
public enum ErrorKind {
    SYNTAX,
    VALIDATION,
    LOWERING
}
