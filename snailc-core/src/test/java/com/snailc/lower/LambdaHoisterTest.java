package com.snailc.lower;

import com.snailc.Parser;
import com.snailc.ast.*;
import com.snailc.emit.PythonSourceWriter;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class LambdaHoisterTest {

    private static Program hoist(String source) {
        return new LambdaHoister(new LambdaNames()).hoist(Parser.parse(source));
    }

    @Test
    void testExpressionLambdaIsLeftInPlace() {
        Program program = hoist("f = def (x) { x * 2 }");
        assertEquals(1, program.body().size());
        AssignStatement assign = assertInstanceOf(AssignStatement.class, program.body().get(0));
        assertInstanceOf(LambdaExpression.class, assign.value());
    }

    @Test
    void testStatementLambdaBecomesNamedDef() {
        Program program = hoist("f = def (x) { y = x + 1; y }");
        assertEquals(2, program.body().size());

        DefStatement def = assertInstanceOf(DefStatement.class, program.body().get(0));
        assertEquals("__snail_lambda_1", def.name());
        assertEquals(1, def.params().size());
        assertInstanceOf(ReturnStatement.class, def.body().get(def.body().size() - 1));

        AssignStatement assign = assertInstanceOf(AssignStatement.class, program.body().get(1));
        Identifier ref = assertInstanceOf(Identifier.class, assign.value());
        assertEquals("__snail_lambda_1", ref.name());
    }

    @Test
    void testHoistedLambdaLowersToDef() {
        String python = PythonSourceWriter.write(Lowerer.lower(Parser.parse("f = def (x) { y = x + 1; y }")));
        assertEquals("def __snail_lambda_1(x):\n    y = x + 1\n    return y\nf = __snail_lambda_1\n", python);
    }

    @Test
    void testNamesAreNumberedInOrder() {
        Program program = hoist("a = def () { x = 1; x }\nb = def () { y = 2; y }");
        assertEquals("__snail_lambda_1", ((DefStatement) program.body().get(0)).name());
        assertEquals("__snail_lambda_2", ((DefStatement) program.body().get(2)).name());
    }

    @Test
    void testOuterLambdaHoistedWhenInnerNeedsDef() {
        Program program = hoist("f = def () { def () { x = 1; x } }");
        // inner def is emitted inside the outer def's body
        DefStatement outer = assertInstanceOf(DefStatement.class, program.body().get(0));
        assertInstanceOf(DefStatement.class, outer.body().get(0));
        assertInstanceOf(ReturnStatement.class, outer.body().get(1));
    }

    @Test
    void testHoistInsideFunctionBodyStaysLocal() {
        Program program = hoist("def outer() {\n  g = def () { z = 1; z }\n  g\n}");
        assertEquals(1, program.body().size());
        DefStatement outer = assertInstanceOf(DefStatement.class, program.body().get(0));
        assertInstanceOf(DefStatement.class, outer.body().get(0));
    }

    @Test
    void testSemicolonTerminatedTailIsNotReturned() {
        Program program = hoist("f = def () { x = 1; x; }");
        DefStatement def = assertInstanceOf(DefStatement.class, program.body().get(0));
        assertInstanceOf(ExpressionStatement.class, def.body().get(def.body().size() - 1));
    }
}
