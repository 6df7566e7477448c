package com.snailc.validate;

import com.snailc.CompileMode;
import com.snailc.ErrorKind;
import com.snailc.Parser;
import com.snailc.ast.Program;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class ValidatorTest {

    private static final String AWK_MESSAGE = "awk variables are only valid in awk mode; use --awk";
    private static final String MAP_MESSAGE = "map variables are only valid in map mode; use --map";

    private static ValidationException rejectSnail(String source) {
        Program program = Parser.parse(source);
        return assertThrows(ValidationException.class, () -> Validator.validate(program, ValidationMode.SNAIL));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "print($n)",
        "print(f\"line {$n}\")",
        "print(f\"{x:{$fn}}\")",
        "ys = [x for x in xs if x > $n]",
        "f(key=$fn)",
        "f(*$p)",
        "tail = items[$n:]",
        "d = %{\"k\": $m}",
        "x = risky():$f?",
        "print($1)"
    })
    void testAwkNamesRejectedOutsideLines(String source) {
        ValidationException e = rejectSnail(source);
        assertEquals("`" + e.name() + "`: " + AWK_MESSAGE, e.getMessage());
        assertEquals(ValidationMode.AWK, e.requiredMode());
        assertEquals(ErrorKind.VALIDATION, e.kind());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "print($src)",
        "print(f\"{$text}\")",
        "g = def () { $fd }"
    })
    void testMapNamesRejectedOutsideFiles(String source) {
        ValidationException e = rejectSnail(source);
        assertEquals("`" + e.name() + "`: " + MAP_MESSAGE, e.getMessage());
        assertEquals(ValidationMode.MAP, e.requiredMode());
    }

    @Test
    void testMessageNamesRejectedVariable() {
        assertEquals("`$n`: awk variables are only valid in awk mode; use --awk", rejectSnail("print($n)").getMessage());
        assertEquals("`$3`: awk variables are only valid in awk mode; use --awk", rejectSnail("print($3)").getMessage());
        assertEquals("`$text`: map variables are only valid in map mode; use --map", rejectSnail("print($text)").getMessage());
    }

    @Test
    void testLinesBlockAllowsAwkNames() {
        Program program = Parser.parse("lines {\n  print($n, $1, $0)\n}");
        assertDoesNotThrow(() -> Validator.validate(program, ValidationMode.SNAIL));
    }

    @Test
    void testFilesBlockAllowsMapNames() {
        Program program = Parser.parse("files {\n  print($src, $text)\n}");
        assertDoesNotThrow(() -> Validator.validate(program, ValidationMode.SNAIL));
    }

    @Test
    void testLinesSourcesUseOuterMode() {
        ValidationException e = rejectSnail("lines $n {\n  print($0)\n}");
        assertEquals("$n", e.name());
    }

    @Test
    void testModeProgramsAllowTheirNames() {
        Program awk = Parser.parse("print($n, $fn, $1)", CompileMode.AWK);
        assertDoesNotThrow(() -> Validator.validate(awk, ValidationMode.AWK));
        Program map = Parser.parse("print($src)", CompileMode.MAP);
        assertDoesNotThrow(() -> Validator.validate(map, ValidationMode.MAP));
    }

    @Test
    void testMapNamesRejectedInAwkMode() {
        Program program = Parser.parse("print($src)", CompileMode.AWK);
        ValidationException e = assertThrows(ValidationException.class,
            () -> Validator.validate(program, ValidationMode.AWK));
        assertEquals("`$src`: " + MAP_MESSAGE, e.getMessage());
    }

    @Test
    void testExceptionNameLegalEverywhere() {
        Program program = Parser.parse("x = risky():$e?");
        assertDoesNotThrow(() -> Validator.validate(program, ValidationMode.SNAIL));
    }

    @Test
    void testFirstViolationInSourceOrder() {
        ValidationException e = rejectSnail("print($src, $n)");
        assertEquals("$src", e.name());
    }

    @Test
    void testYieldOnlyInsideFunctions() {
        ValidationException e = rejectSnail("yield 1");
        assertEquals("yield expressions are only allowed inside function bodies", e.getMessage());

        Program inDef = Parser.parse("def gen() {\n  yield 1\n}");
        assertDoesNotThrow(() -> Validator.validate(inDef, ValidationMode.SNAIL));
    }

    @Test
    void testYieldInParameterDefaultRejected() {
        rejectSnail("def gen(x = (yield 1)) {\n  pass\n}");
    }
}
