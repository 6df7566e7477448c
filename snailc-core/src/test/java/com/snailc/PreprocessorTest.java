package com.snailc;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class PreprocessorTest {

    private static final String RS = String.valueOf(Preprocessor.RS);

    @Test
    void testNewlineAfterOperandEndsStatement() {
        assertEquals("x = 1" + RS + "y = 2", Preprocessor.preprocess("x = 1\ny = 2"));
    }

    @Test
    void testNewlineInsideParensIsKept() {
        assertEquals("f(a\n)", Preprocessor.preprocess("f(a\n)"));
    }

    @Test
    void testNewlineAfterOperatorContinues() {
        assertEquals("a = b +\nc", Preprocessor.preprocess("a = b +\nc"));
    }

    @Test
    void testHeaderAndClosingBrace() {
        // no separator after the header's '{' or before '}', one after the block
        assertEquals("if x {\n  y\n}" + RS + "z", Preprocessor.preprocess("if x {\n  y\n}\nz"));
    }

    @Test
    void testNewlineInTripleQuotedStringIsKept() {
        String source = "s = \"\"\"a\nb\"\"\"\nt";
        assertEquals("s = \"\"\"a\nb\"\"\"" + RS + "t", Preprocessor.preprocess(source));
    }

    @Test
    void testCommentDoesNotChangeLastToken() {
        assertEquals("x = 1 # note" + RS + "y", Preprocessor.preprocess("x = 1 # note\ny"));
    }

    @Test
    void testCrLfReplacesLineFeedOnly() {
        assertEquals("x = 1\r" + RS + "y", Preprocessor.preprocess("x = 1\r\ny"));
    }

    @Test
    void testBackslashContinuationBecomesBlanks() {
        assertEquals("x = 1 +   2", Preprocessor.preprocess("x = 1 + \\\n2"));
    }

    @Test
    void testStrayBackslashIsSyntaxError() {
        SnailSyntaxException e = assertThrows(SnailSyntaxException.class,
            () -> Preprocessor.preprocess("x = \\ y"));
        assertEquals("stray '\\' (backslash line continuation must be followed by a newline)", e.getMessage());
        assertEquals(ErrorKind.SYNTAX, e.kind());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "x = 1\ny = 2\n",
        "if x {\n  print(x)\n} else {\n  pass\n}\n",
        "def f(a,\n      b) {\n  return a + b\n}\nf(1, 2)",
        "items = [1,\n  2,\n  3]\nprint(items)",
        "d = %{\"a\": 1,\n  \"b\": 2}\ns = #{1,\n 2}",
        "text = \"\"\"one\ntwo\"\"\"\nprint(text)",
        "x = risky():0?\ny = x | str\n",
        "lines {\n  /foo/ { print($0) }\n}\n",
        "out = $(echo hi)\ncount = @(true)\n",
        "x = 1 # note\nf(\n  a\n)\ny = 2\n",
        "if x { # open\n  y # body\n}\n# trailing\nz"
    })
    void testPreprocessIsIdempotent(String source) {
        String once = Preprocessor.preprocess(source);
        assertEquals(once, Preprocessor.preprocess(once));
        assertEquals(source.length(), once.length());
    }

    @Test
    void testCommentEndsAtInsertedSeparator() {
        String once = Preprocessor.preprocess("x = 1 # note\nf(\n  a\n)\ny = 2\n");
        assertEquals("x = 1 # note" + RS + "f(\n  a\n)" + RS + "y = 2" + RS, once);
        assertEquals(once, Preprocessor.preprocess(once));
    }
}
