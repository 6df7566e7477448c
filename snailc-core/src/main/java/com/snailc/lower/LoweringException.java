package com.snailc.lower;

import com.snailc.ErrorKind;
import com.snailc.SnailException;
import com.snailc.ast.SourceSpan;

/**
 * Thrown when a well-formed Snail tree has no Python translation.
 */
public class LoweringException extends SnailException {
    public LoweringException(String message, SourceSpan span) {
        super(ErrorKind.LOWERING, message, span);
    }
}
