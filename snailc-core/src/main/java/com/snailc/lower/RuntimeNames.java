package com.snailc.lower;

import java.util.Map;

/**
 * Names the generated code shares with the Python runtime library.
 */
public final class RuntimeNames {
    // Runtime helpers
    public static final String COMPACT_TRY = "__snail_compact_try";
    public static final String SUBPROCESS_CAPTURE = "__SnailSubprocessCapture";
    public static final String SUBPROCESS_STATUS = "__SnailSubprocessStatus";
    public static final String REGEX_SEARCH = "__snail_regex_search";
    public static final String REGEX_COMPILE = "__snail_regex_compile";
    public static final String JMESPATH_QUERY = "__snail_jmespath_query";
    public static final String CONTAINS = "__snail_contains__";
    public static final String CONTAINS_NOT = "__snail_contains_not__";
    public static final String INCR_ATTR = "__snail_incr_attr";
    public static final String INCR_INDEX = "__snail_incr_index";
    public static final String AUG_ATTR = "__snail_aug_attr";
    public static final String AUG_INDEX = "__snail_aug_index";
    public static final String AWK_SPLIT = "__snail_awk_split";
    public static final String OPEN_LINES_SOURCE = "__snail_open_lines_source";
    public static final String NORMALIZE_SOURCES = "__snail_normalize_sources";
    public static final String LAZY_FILE = "__SnailLazyFile";
    public static final String LAZY_TEXT = "__SnailLazyText";

    // Globals the runtime injects before running awk programs
    public static final String AWK_FIELD_SEPARATORS = "__snail_awk_field_separators";
    public static final String AWK_INCLUDE_WHITESPACE = "__snail_awk_include_whitespace";

    // Compiler temporaries
    public static final String COMPACT_EXCEPTION = "__snail_compact_exc";
    public static final String COMPARE_LEFT = "__snail_compare_left";
    public static final String COMPARE_RIGHT = "__snail_compare_right";
    public static final String INCR_TMP = "__snail_incr_tmp";
    public static final String LET_VALUE = "__snail_let_value";
    public static final String LET_OK = "__snail_let_ok";
    public static final String LET_KEEP = "__snail_let_keep";
    public static final String LAST_RESULT = "__snail_last_result";
    public static final String LAMBDA_PREFIX = "__snail_lambda_";

    // Loop state of lines and files blocks
    public static final String NR = "__snail_nr";
    public static final String FNR = "__snail_fnr";
    public static final String SOURCE_ITEM = "__snail_source_item";
    public static final String FILE = "__snail_file";
    public static final String PATH = "__snail_path";
    public static final String RAW_LINE = "__snail_raw";
    public static final String LINE = "__snail_line";
    public static final String FIELDS = "__snail_fields";
    public static final String NR_USER = "__snail_nr_user";
    public static final String FNR_USER = "__snail_fnr_user";
    public static final String PATH_USER = "__snail_path_user";
    public static final String MATCH = "__snail_match";
    public static final String PATHS = "__snail_paths";
    public static final String SRC = "__snail_src";
    public static final String FD = "__snail_fd";
    public static final String TEXT = "__snail_text";

    private static final Map<String, String> SPECIAL_VARIABLES = Map.of(
        "$n", NR_USER,
        "$fn", FNR_USER,
        "$p", PATH_USER,
        "$m", MATCH,
        "$f", FIELDS,
        "$src", SRC,
        "$fd", FD,
        "$text", TEXT
    );

    private RuntimeNames() {
    }

    /**
     * Python variable backing a {@code $name} special variable, or null when there is none.
     * {@code $e} is not listed: it resolves to the enclosing fallback's parameter.
     */
    public static String specialVariable(String name) {
        return SPECIAL_VARIABLES.get(name);
    }
}
