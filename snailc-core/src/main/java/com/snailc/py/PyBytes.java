package com.snailc.py;

/**
 * A {@code bytes} constant. Each char of {@code latin1} holds one byte value.
 */
public record PyBytes(String latin1) {
}
