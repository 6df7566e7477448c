package com.snailc;

/**
 * How the top-level program is framed.
 */
public enum CompileMode {
    /** Plain Snail program. */
    SNAIL,
    /** The program body runs once per input line, as if wrapped in {@code lines { }}. */
    AWK,
    /** The program body runs once per input file, as if wrapped in {@code files { }}. */
    MAP
}
