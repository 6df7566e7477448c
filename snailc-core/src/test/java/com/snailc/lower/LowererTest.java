package com.snailc.lower;

import com.snailc.CompileMode;
import com.snailc.Parser;
import com.snailc.emit.PythonSourceWriter;
import com.snailc.py.PyModule;
import com.snailc.py.PyStmt;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LowererTest {

    private static String lower(String source) {
        return PythonSourceWriter.write(Lowerer.lower(Parser.parse(source)));
    }

    private static String lower(String source, CompileMode mode) {
        return PythonSourceWriter.write(Lowerer.lower(Parser.parse(source, mode)));
    }

    // ==================== Pipelines ====================

    @Test
    void testPipelineSubstitutesPlaceholder() {
        assertEquals("greet(\"World\", \"!\")\n", lower("\"World\" | greet(_, \"!\")"));
    }

    @Test
    void testPipelineWithoutPlaceholderCallsRightSide() {
        assertEquals("f(x)\n", lower("x | f"));
        assertEquals("f(1)(x)\n", lower("x | f(1)"));
    }

    @Test
    void testPipelinePlaceholderInsideNestedCall() {
        assertEquals("f(g(x))\n", lower("x | f(g(_))"));
    }

    @Test
    void testPipelineRejectsTwoPlaceholders() {
        LoweringException e = assertThrows(LoweringException.class, () -> lower("x | f(_, _)"));
        assertEquals("pipeline calls may include at most one placeholder", e.getMessage());
    }

    @Test
    void testPipelineIntoSubprocessFeedsStdin() {
        assertEquals("__SnailSubprocessCapture(f\"wc -l\")(x)\n", lower("x | $(wc -l)"));
    }

    // ==================== Snail-only expressions ====================

    @Test
    void testSubprocessCaptureInterpolates() {
        assertEquals("out = __SnailSubprocessCapture(f\"echo {name}\")()\n", lower("out = $(echo {name})"));
    }

    @Test
    void testRegexLiteralCompiles() {
        assertEquals("r = __snail_regex_compile(\"a+b\")\n", lower("r = /a+b/"));
    }

    @Test
    void testRegexMatchSearches() {
        assertEquals("m = __snail_regex_search(\"abc\", \"b\")\n", lower("m = \"abc\" in /b/"));
    }

    @Test
    void testMembershipGoesThroughContainsHelper() {
        assertEquals("ok = __snail_contains__(\"x\", xs)\n", lower("ok = \"x\" in xs"));
        assertEquals("ok = __snail_contains_not__(\"x\", xs)\n", lower("ok = \"x\" not in xs"));
    }

    @Test
    void testStructuredAccessorQueries() {
        assertEquals("q = __snail_jmespath_query(\"items[0].name\")\n", lower("q = $[items[0].name]"));
    }

    @Test
    @DisplayName("Comparison chains evaluate each operand once")
    void testCompareChainUsesTemporaries() {
        assertEquals("ok = (__snail_compare_left := a) < (__snail_compare_right := b)"
                + " and (__snail_compare_left := __snail_compare_right) < (__snail_compare_right := c)\n",
            lower("ok = a < b < c"));
    }

    @Test
    void testCompoundExpressionYieldsLastValue() {
        assertEquals("v = (a, b)[-1]\n", lower("v = (a; b)"));
    }

    // ==================== Compact try ====================

    @Test
    void testCompactTryWithoutFallback() {
        assertEquals("v = __snail_compact_try(lambda: risky())\n", lower("v = risky()?"));
    }

    @Test
    void testCompactTryFallbackBindsException() {
        assertEquals("v = __snail_compact_try(lambda: risky(), lambda __snail_compact_exc: __snail_compact_exc)\n",
            lower("v = risky():$e?"));
    }

    @Test
    void testExceptionNameOutsideFallbackFails() {
        LoweringException e = assertThrows(LoweringException.class, () -> lower("print($e)"));
        assertEquals("`$e` is only available in compact exception fallbacks", e.getMessage());
    }

    // ==================== Updates ====================

    @Test
    void testAugmentedAssignmentOnName() {
        assertEquals("(x := x + 2)\n", lower("x += 2"));
    }

    @Test
    void testPrefixIncrement() {
        assertEquals("(x := x + 1)\n", lower("++x"));
    }

    @Test
    void testPostfixIncrementReturnsOldValue() {
        assertEquals("((__snail_incr_tmp := x), (x := __snail_incr_tmp + 1), __snail_incr_tmp)[-1]\n",
            lower("x++"));
    }

    @Test
    void testAttributeAndIndexUpdatesUseHelpers() {
        assertEquals("__snail_aug_attr(o, \"count\", 1, \"+\")\n", lower("o.count += 1"));
        assertEquals("__snail_incr_index(o, k, 1, False)\n", lower("o[k]++"));
        assertEquals("__snail_incr_attr(o, \"n\", -1, True)\n", lower("--o.n"));
    }

    // ==================== Statements ====================

    @Test
    void testDefReturnsFinalExpression() {
        assertEquals("def f(x):\n    return x + 1\n", lower("def f(x) {\n  x + 1\n}"));
    }

    @Test
    void testSemicolonSuppressesImplicitReturn() {
        assertEquals("def f(x):\n    x + 1\n", lower("def f(x) {\n  x + 1;\n}"));
    }

    @Test
    void testEmptyBlockBecomesPass() {
        assertEquals("if x:\n    pass\n", lower("if x {\n}"));
    }

    @Test
    void testIfLetDestructures() {
        String expected = """
            __snail_let_value = pair
            try:
                [a, b] = __snail_let_value
                __snail_let_ok = True
            except (TypeError, ValueError):
                __snail_let_ok = False
            if __snail_let_ok:
                print(a)
            """;
        assertEquals(expected, lower("if let [a, b] = pair {\n  print(a)\n}"));
    }

    @Test
    void testExpressionLambdaStaysLambda() {
        assertEquals("f = lambda x: x * 2\n", lower("f = def (x) { x * 2 }"));
    }

    @Test
    void testNumberLiterals() {
        assertEquals("n = 31\n", lower("n = 0x1F"));
        assertEquals("n = 1000.5\n", lower("n = 1_000.5"));
        assertEquals("n = 2.0j\n", lower("n = 2j"));
    }

    // ==================== Auto-print ====================

    @Test
    void testAutoPrintWrapsTrailingExpression() {
        String expected = """
            __snail_last_result = 1 + 2
            if isinstance(__snail_last_result, str):
                print(__snail_last_result)
            elif __snail_last_result is not None:
                import pprint
                pprint.pprint(__snail_last_result)
            """;
        PyModule module = Lowerer.lower(Parser.parse("1 + 2"), new LowerOptions(true));
        assertEquals(expected, PythonSourceWriter.write(module));
    }

    @Test
    void testAutoPrintSkipsSemicolonTerminatedExpression() {
        PyModule module = Lowerer.lower(Parser.parse("1 + 2;"), new LowerOptions(true));
        assertEquals("1 + 2\n", PythonSourceWriter.write(module));
    }

    @Test
    void testAutoPrintOffByDefault() {
        assertEquals("1 + 2\n", lower("1 + 2"));
    }

    // ==================== Modes ====================

    @Test
    void testAwkProgramWrapsLineLoop() {
        String expected = """
            import sys
            __snail_nr = 0
            for __snail_source_item in sys.argv[1:] or ["-"]:
                __snail_fnr = 0
                with __snail_open_lines_source(__snail_source_item) as (__snail_file, __snail_path):
                    for __snail_raw in __snail_file:
                        __snail_nr = __snail_nr + 1
                        __snail_fnr = __snail_fnr + 1
                        __snail_line = __snail_raw.rstrip("\\n")
                        __snail_fields = __snail_awk_split(__snail_line, __snail_awk_field_separators, __snail_awk_include_whitespace)
                        __snail_nr_user = __snail_nr
                        __snail_fnr_user = __snail_fnr
                        __snail_path_user = __snail_path
                        __snail_src = __snail_path
                        print(__snail_fields[0])
            """;
        assertEquals(expected, lower("{ print($1) }", CompileMode.AWK));
    }

    @Test
    void testRegexPatternBindsMatch() {
        PyModule module = Lowerer.lower(Parser.parse("/foo/ { print($m) }", CompileMode.AWK));
        String python = PythonSourceWriter.write(module);
        assertTrue(python.contains("__snail_match = __snail_regex_search(__snail_line, \"foo\")\n"), python);
        assertTrue(python.contains("if __snail_match:\n"), python);
    }

    @Test
    void testBarePatternPrintsLine() {
        String python = lower("$2 == \"x\"", CompileMode.AWK);
        assertTrue(python.contains("if __snail_fields[1] == \"x\":\n"), python);
        assertTrue(python.contains("print(__snail_line)\n"), python);
    }

    @Test
    void testFieldZeroIsWholeLine() {
        String python = lower("{ print($0) }", CompileMode.AWK);
        assertTrue(python.endsWith("print(__snail_line)\n"), python);
    }

    @Test
    @DisplayName("Pattern-only, action-only and pattern+action rules in one program")
    void testRuleShapesDispatch() {
        String expected = """
                        __snail_src = __snail_path
                        __snail_match = __snail_regex_search(__snail_line, "err")
                        if __snail_match:
                            print(__snail_line)
                        print(__snail_fields[0])
                        if __snail_fields[0] == "x":
                            print(__snail_fields[1])
            """;
        String python = lower("/err/\n{ print($1) }\n$1 == \"x\" { print($2) }", CompileMode.AWK);
        assertTrue(python.endsWith(expected), python);
    }

    // ==================== Auto-print in loop modes ====================

    private static String autoPrinted(String source, CompileMode mode) {
        return PythonSourceWriter.write(Lowerer.lower(Parser.parse(source, mode), new LowerOptions(true)));
    }

    @Test
    void testMapAutoPrintsPerFileResult() {
        String python = autoPrinted("len($text)", CompileMode.MAP);
        assertTrue(python.contains("        __snail_text = __SnailLazyText(__snail_fd)\n"
            + "        __snail_last_result = len(__snail_text)\n"
            + "        if isinstance(__snail_last_result, str):\n"), python);
        assertTrue(python.endsWith("            pprint.pprint(__snail_last_result)\n"), python);
    }

    @Test
    void testAwkAutoPrintsEachRuleAction() {
        String python = autoPrinted("/foo/ { $1 }\n{ $2 }\n/bar/", CompileMode.AWK);
        assertTrue(python.contains("            if __snail_match:\n"
            + "                __snail_last_result = __snail_fields[0]\n"), python);
        assertTrue(python.contains("            __snail_last_result = __snail_fields[1]\n"), python);
        // a rule without an action still prints the record
        assertTrue(python.contains("                print(__snail_line)\n"), python);
    }

    @Test
    void testLoopModesWithoutAutoPrint() {
        assertFalse(lower("len($text)", CompileMode.MAP).contains("__snail_last_result"));
        assertFalse(lower("{ $1 }", CompileMode.AWK).contains("__snail_last_result"));
    }

    @Test
    void testMapProgramWrapsFileLoop() {
        String expected = """
            import sys
            __snail_paths = sys.argv[1:]
            __snail_src = None
            __snail_fd = None
            __snail_text = None
            for __snail_src in __snail_paths:
                with __SnailLazyFile(__snail_src, "r") as __snail_fd:
                    __snail_text = __SnailLazyText(__snail_fd)
                    print(__snail_src)
            """;
        assertEquals(expected, lower("print($src)", CompileMode.MAP));
    }

    @Test
    void testLinesWithSingleSourceNormalizes() {
        String python = lower("lines paths {\n  print($0)\n}");
        assertTrue(python.contains("for __snail_source_item in __snail_normalize_sources(paths):\n"), python);
    }

    @Test
    void testModuleBodyStatementsAreLowered() {
        PyModule module = Lowerer.lower(Parser.parse("import os\nx = 1"));
        assertEquals(2, module.body().size());
        assertInstanceOf(PyStmt.Import.class, module.body().get(0));
        assertInstanceOf(PyStmt.Assign.class, module.body().get(1));
    }
}
