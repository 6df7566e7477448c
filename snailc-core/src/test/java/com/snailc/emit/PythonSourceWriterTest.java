package com.snailc.emit;

import com.snailc.Parser;
import com.snailc.ast.SourceSpan;
import com.snailc.lower.Lowerer;
import com.snailc.py.*;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PythonSourceWriterTest {

    private static final SourceSpan NONE = SourceSpan.NONE;

    private static String python(String snail) {
        return PythonSourceWriter.write(Lowerer.lower(Parser.parse(snail)));
    }

    // ==================== Precedence ====================

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "x = (a + b) * c       | x = (a + b) * c",
        "x = a - (b - c)       | x = a - (b - c)",
        "x = a - b - c         | x = a - b - c",
        "x = 2 ** 3 ** 2       | x = 2 ** 3 ** 2",
        "x = (2 ** 3) ** 2     | x = (2 ** 3) ** 2",
        "x = -2 ** 2           | x = -2 ** 2",
        "x = (-2) ** 2         | x = (-2) ** 2",
        "x = not (a and b)     | x = not (a and b)",
        "x = not a and b       | x = not a and b",
        "x = (a or b) and c    | x = (a or b) and c",
        "x = (a if c else b) + 1 | x = (a if c else b) + 1",
        "x = a.b(c)[d]         | x = a.b(c)[d]",
    })
    void testParenthesesFollowPrecedence(String snail, String expected) {
        assertEquals(expected + "\n", python(snail));
    }

    @Test
    void testSingleElementTuple() {
        assertEquals("x = (1,)\n", python("x = (1,)"));
    }

    @Test
    void testSlices() {
        assertEquals("y = items[1:]\n", python("y = items[1:]"));
        assertEquals("y = items[:-1]\n", python("y = items[:-1]"));
    }

    // ==================== Statements ====================

    @Test
    void testElifChain() {
        String expected = """
            if a:
                x
            elif b:
                y
            else:
                z
            """;
        assertEquals(expected, python("if a {\n  x\n} elif b {\n  y\n} else {\n  z\n}"));
    }

    @Test
    void testNestedIndentation() {
        String expected = """
            def f(n, *rest, **opts):
                for i in range(n):
                    if i:
                        return i
            """;
        assertEquals(expected, python("def f(n, *rest, **opts) {\n  for i in range(n) {\n    if i {\n      return i\n    }\n  }\n}"));
    }

    @Test
    void testEmptyModuleRendersPass() {
        assertEquals("pass\n", PythonSourceWriter.write(new PyModule(NONE, List.of())));
    }

    // ==================== Strings ====================

    @Test
    void testStringEscapes() {
        assertEquals("s = \"tab\\there\"\n", python("s = \"tab\\there\""));
        assertEquals("\"a\\\"b\\\\c\"", PythonSourceWriter.write(Py.str(NONE, "a\"b\\c")));
        assertEquals("\"\\x01\"", PythonSourceWriter.write(Py.str(NONE, "\u0001")));
    }

    @Test
    void testFormattedStringConversion() {
        assertEquals("s = f\"hi {name!r}\"\n", python("s = \"hi {name!r}\""));
    }

    @Test
    void testFormattedStringDoublesLiteralBraces() {
        PyExpr joined = new PyExpr.JoinedStr(NONE, List.of(
            Py.str(NONE, "{a} "),
            new PyExpr.FormattedValue(NONE, Py.load(NONE, "x"), -1, null)));
        assertEquals("f\"{{a}} {x}\"", PythonSourceWriter.write(joined));
    }

    @Test
    void testFormattedValueStartingWithBraceIsSpaced() {
        PyExpr set = new PyExpr.Set(NONE, List.of(Py.integer(NONE, 1)));
        PyExpr joined = new PyExpr.JoinedStr(NONE, List.of(new PyExpr.FormattedValue(NONE, set, -1, null)));
        assertEquals("f\"{ {1}}\"", PythonSourceWriter.write(joined));
    }

    @Test
    void testFormatSpec() {
        PyExpr spec = new PyExpr.JoinedStr(NONE, List.of(
            Py.str(NONE, ">"),
            new PyExpr.FormattedValue(NONE, Py.load(NONE, "w"), -1, null)));
        PyExpr joined = new PyExpr.JoinedStr(NONE, List.of(
            new PyExpr.FormattedValue(NONE, Py.load(NONE, "x"), -1, spec)));
        assertEquals("f\"{x:>{w}}\"", PythonSourceWriter.write(joined));
    }

    // ==================== Constants ====================

    @Test
    void testConstants() {
        assertEquals("None", PythonSourceWriter.constant(null));
        assertEquals("True", PythonSourceWriter.constant(true));
        assertEquals("12345678901234567890", PythonSourceWriter.constant(new BigInteger("12345678901234567890")));
        assertEquals("1.5", PythonSourceWriter.constant(1.5));
        assertEquals("2.0j", PythonSourceWriter.constant(new PyComplex(2.0)));
    }

    @Test
    void testNonFiniteFloats() {
        assertEquals("float(\"nan\")", PythonSourceWriter.constant(Double.NaN));
        assertEquals("1e999", PythonSourceWriter.constant(Double.POSITIVE_INFINITY));
        assertEquals("-1e999", PythonSourceWriter.constant(Double.NEGATIVE_INFINITY));
    }

    @Test
    void testBytes() {
        assertEquals("b\"a\\xff\\\"\"", PythonSourceWriter.constant(new PyBytes("a\u00ff\"")));
    }

    @Test
    void testNegativeConstantIsParenthesizedUnderPower() {
        PyExpr pow = new PyExpr.BinOp(NONE, Py.constant(NONE, BigInteger.valueOf(-2)), Operator.POW, Py.integer(NONE, 2));
        assertEquals("(-2) ** 2", PythonSourceWriter.write(pow));
    }

    @Test
    void testLambdaWithoutParameters() {
        assertEquals("lambda: 1", PythonSourceWriter.write(Py.lambda(NONE, Py.integer(NONE, 1))));
        assertEquals("lambda a, b: a", PythonSourceWriter.write(Py.lambda(NONE, Py.load(NONE, "a"), "a", "b")));
    }
}
