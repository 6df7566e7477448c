package com.snailc.validate;

import com.snailc.CompileMode;

import java.util.Set;

/**
 * Which reserved {@code $} names a scope may use. {@code $e} is legal everywhere.
 */
public enum ValidationMode {
    SNAIL(Set.of(), false),
    AWK(Set.of("$n", "$fn", "$p", "$m", "$f"), true),
    MAP(Set.of("$src", "$fd", "$text"), false);

    private final Set<String> names;
    private final boolean fieldIndices;

    ValidationMode(Set<String> names, boolean fieldIndices) {
        this.names = names;
        this.fieldIndices = fieldIndices;
    }

    public boolean allows(String reservedName) {
        return reservedName.equals("$e") || names.contains(reservedName);
    }

    public boolean allowsFieldIndices() {
        return fieldIndices;
    }

    public static ValidationMode of(CompileMode mode) {
        return switch (mode) {
            case SNAIL -> SNAIL;
            case AWK -> AWK;
            case MAP -> MAP;
        };
    }
}
