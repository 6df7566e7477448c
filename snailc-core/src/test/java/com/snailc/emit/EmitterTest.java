package com.snailc.emit;

import com.snailc.CompileMode;
import com.snailc.Parser;
import com.snailc.lower.Lowerer;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class EmitterTest {

    private static Emission emit(String source, CompileMode mode) {
        return Emitter.emit(Lowerer.lower(Parser.parse(source, mode)));
    }

    private static Emission emit(String source) {
        return emit(source, CompileMode.SNAIL);
    }

    @Test
    void testPlainProgramNeedsNoHelpers() {
        Emission emission = emit("print(1)");
        assertTrue(emission.helpers().isEmpty());
        assertEquals("", emission.preamble());
    }

    @Test
    void testCompactTryImportsHelper() {
        Emission emission = emit("x = risky()?");
        assertEquals(Set.of(RuntimeHelper.COMPACT_TRY), emission.helpers());
        assertEquals("from snail.runtime import __snail_compact_try\n", emission.preamble());
    }

    @Test
    void testPreambleFollowsDeclarationOrder() {
        Emission emission = emit("r = /x/\nv = risky()?\nok = a in b");
        assertEquals("from snail.runtime import __snail_compact_try\n"
                + "from snail.runtime import __snail_regex_compile\n"
                + "from snail.runtime import __snail_contains__\n",
            emission.preamble());
    }

    @Test
    void testHelpersInsideNestedBodiesAreFound() {
        Emission emission = emit("def f() {\n  if x {\n    return $(ls)\n  }\n}");
        assertEquals(Set.of(RuntimeHelper.SUBPROCESS_CAPTURE), emission.helpers());
    }

    @Test
    void testAwkProgramHelpers() {
        Emission emission = emit("{ print($1) }", CompileMode.AWK);
        assertEquals(EnumSet.of(RuntimeHelper.AWK_SPLIT, RuntimeHelper.AWK_FIELD_SEPARATORS,
            RuntimeHelper.AWK_INCLUDE_WHITESPACE, RuntimeHelper.OPEN_LINES_SOURCE), emission.helpers());
    }

    @Test
    void testMapProgramHelpers() {
        Emission emission = emit("print($src)", CompileMode.MAP);
        assertEquals(EnumSet.of(RuntimeHelper.LAZY_FILE, RuntimeHelper.LAZY_TEXT), emission.helpers());
    }

    @Test
    void testHelpersAreUnmodifiable() {
        Emission emission = emit("x = risky()?");
        assertThrows(UnsupportedOperationException.class, () -> emission.helpers().add(RuntimeHelper.CONTAINS));
    }

    @Test
    void testForName() {
        assertEquals(RuntimeHelper.REGEX_SEARCH, RuntimeHelper.forName("__snail_regex_search"));
        assertNull(RuntimeHelper.forName("print"));
    }
}
