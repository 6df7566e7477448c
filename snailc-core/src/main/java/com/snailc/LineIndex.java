package com.snailc;

import com.snailc.ast.SourceLocation;
import com.snailc.ast.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps character offsets to 1-based lines and 0-based columns.
 * Built from the original text: preprocessing keeps offsets but blanks the newline of a backslash continuation.
 */
final class LineIndex {
    private final int[] lineOffsets;
    private final int length;

    private LineIndex(int[] lineOffsets, int length) {
        this.lineOffsets = lineOffsets;
        this.length = length;
    }

    // Build line offset index once (O(n) operation)
    static LineIndex of(String text) {
        List<Integer> offsets = new ArrayList<>();
        offsets.add(0); // Line 1 starts at offset 0
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (ch == '\n' || ch == Preprocessor.RS) {
                offsets.add(i + 1);
            }
        }
        return new LineIndex(offsets.stream().mapToInt(Integer::intValue).toArray(), text.length());
    }

    // Binary search for the line containing offset (O(log n) operation)
    SourceLocation.Position position(int offset) {
        offset = Math.max(0, Math.min(offset, length));
        int low = 0;
        int high = lineOffsets.length - 1;
        int line = 1;
        while (low <= high) {
            int mid = (low + high) / 2;
            if (lineOffsets[mid] <= offset) {
                line = mid + 1;
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }
        return new SourceLocation.Position(line, offset - lineOffsets[line - 1]);
    }

    SourceSpan span(int start, int end) {
        return new SourceSpan(start, end, new SourceLocation(position(start), position(end)));
    }
}
