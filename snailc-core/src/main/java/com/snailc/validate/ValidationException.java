package com.snailc.validate;

import com.snailc.ErrorKind;
import com.snailc.SnailException;
import com.snailc.ast.SourceSpan;

/**
 * A reserved name or generator keyword used where the active mode does not allow it.
 */
public class ValidationException extends SnailException {
    private final String name;
    private final ValidationMode requiredMode;

    /**
     * @param name         offending token text, e.g. {@code $n} or {@code yield}
     * @param requiredMode mode that would accept the name, or null when no mode does
     */
    public ValidationException(String name, SourceSpan span, ValidationMode requiredMode, String message) {
        super(ErrorKind.VALIDATION, message, span);
        this.name = name;
        this.requiredMode = requiredMode;
    }

    public String name() {
        return name;
    }

    public ValidationMode requiredMode() {
        return requiredMode;
    }
}
