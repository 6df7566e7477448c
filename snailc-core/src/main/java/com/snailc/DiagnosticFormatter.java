package com.snailc;

import com.snailc.ast.SourceSpan;

/**
 * Renders a compiler error with the offending source line and a caret under the start column.
 * <pre>
 * error: unexpected token
 * --> script.snail:3:5
 *      |
 *    3 | x = = 1
 *      |     ^
 * </pre>
 */
public final class DiagnosticFormatter {
    private static final String GUTTER = "     ";

    private DiagnosticFormatter() {
    }

    public static String format(SnailException e, String source, String filename) {
        StringBuilder sb = new StringBuilder();
        sb.append("error: ").append(e.getMessage()).append('\n');
        SourceSpan span = e.span();
        if (span == null || span.startLine() <= 0) {
            sb.append("--> ").append(filename).append('\n');
            return sb.toString();
        }
        int line = span.startLine();
        int column = span.startCol();
        sb.append("--> ").append(filename).append(':').append(line).append(':').append(column + 1).append('\n');
        String text = sourceLine(source, line);
        if (text == null) {
            return sb.toString();
        }
        sb.append(GUTTER).append("|\n");
        sb.append(String.format("%4d | ", line)).append(text).append('\n');
        sb.append(GUTTER).append("| ").append(" ".repeat(Math.min(column, text.length()))).append('^').append('\n');
        return sb.toString();
    }

    private static String sourceLine(String source, int line) {
        if (source == null) {
            return null;
        }
        String[] lines = source.split("\r?\n|\u001e", -1);
        if (line > lines.length) {
            return null;
        }
        return lines[line - 1].replace('\t', ' ');
    }
}
