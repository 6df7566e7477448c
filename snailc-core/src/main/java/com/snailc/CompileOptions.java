package com.snailc;

import java.util.List;
import java.util.Objects;

/**
 * Settings for one compilation.
 *
 * @param mode            program framing
 * @param autoPrint       print the value of a trailing top-level expression
 * @param filename        name shown in diagnostics
 * @param maxNestingDepth parser recursion limit
 * @param beginCode       sources run once before the iteration wrapper (awk and map modes)
 * @param endCode         sources run once after the iteration wrapper (awk and map modes)
 */
public record CompileOptions(
    CompileMode mode,
    boolean autoPrint,
    String filename,
    int maxNestingDepth,
    List<String> beginCode,
    List<String> endCode
) {
    public static final int DEFAULT_MAX_NESTING_DEPTH = 200;
    public static final String DEFAULT_FILENAME = "<snail>";

    public CompileOptions {
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(filename, "filename");
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive: " + maxNestingDepth);
        }
        beginCode = List.copyOf(beginCode);
        endCode = List.copyOf(endCode);
        if (mode == CompileMode.SNAIL && (!beginCode.isEmpty() || !endCode.isEmpty())) {
            throw new IllegalArgumentException("begin and end code require awk or map mode");
        }
    }

    public static CompileOptions defaults() {
        return builder().build();
    }

    public static CompileOptions of(CompileMode mode) {
        return builder().mode(mode).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .mode(mode)
            .autoPrint(autoPrint)
            .filename(filename)
            .maxNestingDepth(maxNestingDepth)
            .beginCode(beginCode)
            .endCode(endCode);
    }

    public static final class Builder {
        private CompileMode mode = CompileMode.SNAIL;
        private boolean autoPrint = false;
        private String filename = DEFAULT_FILENAME;
        private int maxNestingDepth = DEFAULT_MAX_NESTING_DEPTH;
        private List<String> beginCode = List.of();
        private List<String> endCode = List.of();

        private Builder() {
        }

        public Builder mode(CompileMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder autoPrint(boolean autoPrint) {
            this.autoPrint = autoPrint;
            return this;
        }

        public Builder filename(String filename) {
            this.filename = filename;
            return this;
        }

        public Builder maxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder beginCode(List<String> beginCode) {
            this.beginCode = beginCode;
            return this;
        }

        public Builder endCode(List<String> endCode) {
            this.endCode = endCode;
            return this;
        }

        public CompileOptions build() {
            return new CompileOptions(mode, autoPrint, filename, maxNestingDepth, beginCode, endCode);
        }
    }
}
