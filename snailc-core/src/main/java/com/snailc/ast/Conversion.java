package com.snailc.ast;

/**
 * Conversion flag of an interpolation. Codes follow Python's {@code FormattedValue.conversion}.
 */
public enum Conversion {
    NONE(-1),
    STR('s'),
    REPR('r'),
    ASCII('a');

    private final int code;

    Conversion(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
