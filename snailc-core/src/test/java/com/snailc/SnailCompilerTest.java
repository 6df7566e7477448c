package com.snailc;

import com.snailc.ast.SourceSpan;
import com.snailc.emit.RuntimeHelper;
import com.snailc.py.PyStmt;
import com.snailc.validate.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class SnailCompilerTest {

    @Test
    void testCompileProducesRunnablePython() {
        CompilationResult result = SnailCompiler.compile("x = risky()?\nprint(x)");
        assertEquals("from snail.runtime import __snail_compact_try\n"
                + "x = __snail_compact_try(lambda: risky())\n"
                + "print(x)\n",
            result.pythonSource());
        assertEquals(2, result.program().body().size());
        assertTrue(result.helpers().contains(RuntimeHelper.COMPACT_TRY));
    }

    @Test
    void testAutoPrintOption() {
        CompileOptions options = CompileOptions.builder().autoPrint(true).build();
        CompilationResult result = SnailCompiler.compile("\"hi\"", options);
        assertTrue(result.pythonSource().startsWith("__snail_last_result = \"hi\"\n"), result.pythonSource());
    }

    @Test
    void testValidationRunsBeforeLowering() {
        ValidationException e = assertThrows(ValidationException.class, () -> SnailCompiler.compile("print($n)"));
        assertEquals(ErrorKind.VALIDATION, e.kind());
    }

    @Test
    void testLoweringErrorsCarryKind() {
        SnailException e = assertThrows(SnailException.class, () -> SnailCompiler.compile("x | f(_, _)"));
        assertEquals(ErrorKind.LOWERING, e.kind());
    }

    @Test
    void testSyntaxErrorsCarryKind() {
        SnailException e = assertThrows(SnailException.class, () -> SnailCompiler.compile("x = "));
        assertEquals(ErrorKind.SYNTAX, e.kind());
    }

    @Test
    void testLongChainIsRejectedNotOverflowed() {
        SnailException e = assertThrows(SnailException.class,
            () -> SnailCompiler.compile("x = 1" + " * 2".repeat(20000)));
        assertEquals(ErrorKind.SYNTAX, e.kind());
    }

    // ==================== Begin and end code ====================

    @Test
    @DisplayName("Begin and end code wrap the awk loop")
    void testBeginAndEndCodeAreSpliced() {
        CompileOptions options = CompileOptions.builder()
            .mode(CompileMode.AWK)
            .beginCode(List.of("total = 0"))
            .endCode(List.of("print(total)"))
            .build();
        CompilationResult result = SnailCompiler.compile("{ total += 1 }", options);

        List<PyStmt> body = result.module().body();
        assertInstanceOf(PyStmt.Assign.class, body.get(0));
        assertInstanceOf(PyStmt.Import.class, body.get(1));
        assertInstanceOf(PyStmt.For.class, body.get(body.size() - 2));
        assertInstanceOf(PyStmt.Expr.class, body.get(body.size() - 1));
        assertTrue(result.pythonSource().endsWith("print(total)\n"), result.pythonSource());
    }

    @Test
    void testAutoPrintReachesEverySection() {
        CompileOptions options = CompileOptions.builder()
            .mode(CompileMode.MAP)
            .autoPrint(true)
            .beginCode(List.of("\"start\""))
            .endCode(List.of("\"done\""))
            .build();
        String python = SnailCompiler.compile("len($text)", options).pythonSource();
        assertTrue(python.contains("\n__snail_last_result = \"start\"\n"), python);
        assertTrue(python.contains("        __snail_last_result = len(__snail_text)\n"), python);
        assertTrue(python.contains("\n__snail_last_result = \"done\"\n"), python);
        assertTrue(python.indexOf("\"start\"") < python.indexOf("len(__snail_text)"));
        assertTrue(python.indexOf("len(__snail_text)") < python.indexOf("\"done\""));
    }

    @Test
    void testBeginCodeCannotUseAwkNames() {
        CompileOptions options = CompileOptions.builder()
            .mode(CompileMode.AWK)
            .beginCode(List.of("print($n)"))
            .build();
        assertThrows(ValidationException.class, () -> SnailCompiler.compile("{ print($0) }", options));
    }

    @Test
    void testBeginCodeRequiresLoopMode() {
        assertThrows(IllegalArgumentException.class,
            () -> CompileOptions.builder().beginCode(List.of("x = 1")).build());
    }

    // ==================== Diagnostics ====================

    @Test
    void testDiagnosticPointsAtColumn() {
        SnailException e = new SnailSyntaxException("unexpected token", new SourceSpan(10, 11, 2, 4, 2, 5));
        String expected = """
            error: unexpected token
            --> test.snail:2:5
                 |
               2 | y = = 2
                 |     ^
            """;
        assertEquals(expected, DiagnosticFormatter.format(e, "x = 1\ny = = 2", "test.snail"));
    }

    @Test
    void testDiagnosticFromParser() {
        String source = "x = 1\ny = = 2";
        SnailException e = assertThrows(SnailException.class, () -> SnailCompiler.compile(source));
        String rendered = DiagnosticFormatter.format(e, source, "test.snail");
        assertTrue(rendered.contains("--> test.snail:2:"), rendered);
        assertTrue(rendered.contains("   2 | y = = 2\n"), rendered);
    }

    @Test
    void testDiagnosticWithoutPosition() {
        SnailException e = new SnailSyntaxException("empty", SourceSpan.NONE);
        assertEquals("error: empty\n--> <snail>\n", DiagnosticFormatter.format(e, "", "<snail>"));
    }
}
