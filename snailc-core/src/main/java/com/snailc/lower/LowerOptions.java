package com.snailc.lower;

/**
 * @param autoPrint print the value of a trailing top-level expression statement
 */
public record LowerOptions(boolean autoPrint) {
    public static final LowerOptions DEFAULT = new LowerOptions(false);
}
