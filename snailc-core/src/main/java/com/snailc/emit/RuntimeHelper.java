package com.snailc.emit;

import com.snailc.lower.RuntimeNames;

import java.util.HashMap;
import java.util.Map;

/**
 * Names the generated module imports from the Python runtime library.
 */
public enum RuntimeHelper {
    COMPACT_TRY(RuntimeNames.COMPACT_TRY),
    SUBPROCESS_CAPTURE(RuntimeNames.SUBPROCESS_CAPTURE),
    SUBPROCESS_STATUS(RuntimeNames.SUBPROCESS_STATUS),
    REGEX_SEARCH(RuntimeNames.REGEX_SEARCH),
    REGEX_COMPILE(RuntimeNames.REGEX_COMPILE),
    JMESPATH_QUERY(RuntimeNames.JMESPATH_QUERY),
    CONTAINS(RuntimeNames.CONTAINS),
    CONTAINS_NOT(RuntimeNames.CONTAINS_NOT),
    INCR_ATTR(RuntimeNames.INCR_ATTR),
    INCR_INDEX(RuntimeNames.INCR_INDEX),
    AUG_ATTR(RuntimeNames.AUG_ATTR),
    AUG_INDEX(RuntimeNames.AUG_INDEX),
    AWK_SPLIT(RuntimeNames.AWK_SPLIT),
    AWK_FIELD_SEPARATORS(RuntimeNames.AWK_FIELD_SEPARATORS),
    AWK_INCLUDE_WHITESPACE(RuntimeNames.AWK_INCLUDE_WHITESPACE),
    OPEN_LINES_SOURCE(RuntimeNames.OPEN_LINES_SOURCE),
    NORMALIZE_SOURCES(RuntimeNames.NORMALIZE_SOURCES),
    LAZY_FILE(RuntimeNames.LAZY_FILE),
    LAZY_TEXT(RuntimeNames.LAZY_TEXT);

    public static final String RUNTIME_MODULE = "snail.runtime";

    private static final Map<String, RuntimeHelper> BY_NAME = new HashMap<>();

    static {
        for (RuntimeHelper helper : values()) {
            BY_NAME.put(helper.pythonName, helper);
        }
    }

    private final String pythonName;

    RuntimeHelper(String pythonName) {
        this.pythonName = pythonName;
    }

    public String pythonName() {
        return pythonName;
    }

    /** Helper bound to a Python name, or null when the name is not a runtime helper. */
    public static RuntimeHelper forName(String name) {
        return BY_NAME.get(name);
    }
}
