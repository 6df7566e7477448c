package com.snailc.ast;

/**
 * Line/column region of a node. Lines are 1-based, columns are 0-based.
 */
public record SourceLocation(Position start, Position end) {

    public record Position(int line, int column) {
    }
}
