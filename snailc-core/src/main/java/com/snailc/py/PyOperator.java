package com.snailc.py;

/**
 * Operator and context singletons. In the Python {@code ast} module these are field-less node classes.
 */
public interface PyOperator {
    /** Name of the matching {@code ast} class. */
    String type();

    /** Source spelling. */
    String symbol();
}
