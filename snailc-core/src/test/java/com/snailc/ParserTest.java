package com.snailc;

import com.snailc.ast.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    @Test
    @DisplayName("** groups to the right")
    void testPowerIsRightAssociative() {
        BinaryExpression outer = assertInstanceOf(BinaryExpression.class, Parser.parseExpression("2**3**2"));
        assertEquals(BinaryOperator.POW, outer.operator());
        assertEquals("2", assertInstanceOf(NumberLiteral.class, outer.left()).raw());
        BinaryExpression inner = assertInstanceOf(BinaryExpression.class, outer.right());
        assertEquals(BinaryOperator.POW, inner.operator());
        assertEquals("3", assertInstanceOf(NumberLiteral.class, inner.left()).raw());
        assertEquals("2", assertInstanceOf(NumberLiteral.class, inner.right()).raw());
    }

    @Test
    void testUnaryMinusBindsLooserThanPower() {
        UnaryExpression neg = assertInstanceOf(UnaryExpression.class, Parser.parseExpression("-2**2"));
        assertEquals(UnaryOperator.MINUS, neg.operator());
        assertEquals(BinaryOperator.POW, assertInstanceOf(BinaryExpression.class, neg.operand()).operator());
    }

    @Test
    void testMultiplicationBindsTighterThanAddition() {
        BinaryExpression sum = assertInstanceOf(BinaryExpression.class, Parser.parseExpression("1 + 2 * 3"));
        assertEquals(BinaryOperator.ADD, sum.operator());
        assertEquals(BinaryOperator.MUL, assertInstanceOf(BinaryExpression.class, sum.right()).operator());
    }

    @Test
    void testPipelineBindsLooserThanComparison() {
        BinaryExpression pipe = assertInstanceOf(BinaryExpression.class, Parser.parseExpression("a == b | f"));
        assertEquals(BinaryOperator.PIPELINE, pipe.operator());
        assertInstanceOf(CompareExpression.class, pipe.left());
    }

    @Test
    @DisplayName("a + risky():5? is a + (risky():5?)")
    void testCompactTryAttachesToPostfixChain() {
        Expression bare = Parser.parseExpression("a + risky():5?");
        Expression grouped = Parser.parseExpression("a + (risky():5?)");
        assertEquals(TestObjectMapper.shape(grouped), TestObjectMapper.shape(bare));

        BinaryExpression sum = assertInstanceOf(BinaryExpression.class, bare);
        TryExpression attempt = assertInstanceOf(TryExpression.class, sum.right());
        assertInstanceOf(CallExpression.class, attempt.body());
        assertEquals("5", assertInstanceOf(NumberLiteral.class, attempt.fallback()).raw());
    }

    @Test
    void testAccessorAfterCompactTry() {
        AttributeExpression attr = assertInstanceOf(AttributeExpression.class, Parser.parseExpression("f()?.x"));
        assertEquals("x", attr.attribute());
        TryExpression attempt = assertInstanceOf(TryExpression.class, attr.object());
        assertNull(attempt.fallback());
    }

    @Test
    void testCompareChain() {
        CompareExpression compare = assertInstanceOf(CompareExpression.class, Parser.parseExpression("a < b <= c"));
        assertEquals(List.of(CompareOperator.LT, CompareOperator.LT_EQ), compare.operators());
        assertEquals(2, compare.comparators().size());
    }

    @Test
    void testMembershipInRegexIsRegexMatch() {
        RegexMatchExpression match = assertInstanceOf(RegexMatchExpression.class, Parser.parseExpression("x in /ab+c/"));
        assertEquals("ab+c", match.pattern().literalText());

        UnaryExpression negated = assertInstanceOf(UnaryExpression.class, Parser.parseExpression("x not in /a/"));
        assertEquals(UnaryOperator.NOT, negated.operator());
        assertInstanceOf(RegexMatchExpression.class, negated.operand());
    }

    @Test
    void testPlaceholderAndReservedNames() {
        CallExpression call = assertInstanceOf(CallExpression.class, Parser.parseExpression("greet(_, $e)"));
        assertInstanceOf(Placeholder.class, call.arguments().get(0).value());
        assertEquals("$e", assertInstanceOf(Identifier.class, call.arguments().get(1).value()).name());
        assertEquals("3", assertInstanceOf(FieldIndex.class, Parser.parseExpression("$3")).digits());
    }

    @Test
    void testCompoundExpression() {
        CompoundExpression compound = assertInstanceOf(CompoundExpression.class, Parser.parseExpression("(a; b; c)"));
        assertEquals(3, compound.expressions().size());
    }

    @Test
    void testStatementsAndSemicolonFlag() {
        Program program = Parser.parse("x = y = 1\nprint(x);\nprint(y)");
        assertEquals(3, program.body().size());
        AssignStatement assign = assertInstanceOf(AssignStatement.class, program.body().get(0));
        assertEquals(2, assign.targets().size());
        assertTrue(assertInstanceOf(ExpressionStatement.class, program.body().get(1)).semicolonTerminated());
        assertFalse(assertInstanceOf(ExpressionStatement.class, program.body().get(2)).semicolonTerminated());
    }

    @Test
    void testIfLetCondition() {
        Program program = Parser.parse("if let [a, b] = pair; a > 0 {\n  print(a)\n}");
        IfStatement stmt = assertInstanceOf(IfStatement.class, program.body().get(0));
        LetCondition let = assertInstanceOf(LetCondition.class, stmt.condition());
        assertInstanceOf(ListTarget.class, let.target());
        assertInstanceOf(CompareExpression.class, let.guard());
    }

    @Test
    void testAwkModeWrapsBodyInLines() {
        Program program = Parser.parse("/foo/\n$1 == \"x\" { print($2) }", CompileMode.AWK);
        LinesStatement lines = assertInstanceOf(LinesStatement.class, program.body().get(0));
        assertTrue(lines.sources().isEmpty());
        PatternActionStatement first = assertInstanceOf(PatternActionStatement.class, lines.body().get(0));
        assertInstanceOf(RegexLiteral.class, first.pattern());
        assertNull(first.action());
        PatternActionStatement second = assertInstanceOf(PatternActionStatement.class, lines.body().get(1));
        assertInstanceOf(CompareExpression.class, second.pattern());
        assertEquals(1, second.action().size());
    }

    @Test
    void testMapModeWrapsBodyInFiles() {
        Program program = Parser.parse("print($src)", CompileMode.MAP);
        assertInstanceOf(FilesStatement.class, program.body().get(0));
    }

    @Test
    void testSpansUseOneBasedLinesAndZeroBasedColumns() {
        Program program = Parser.parse("x = 1\n  y = 2");
        SourceSpan span = program.body().get(1).span();
        assertEquals(2, span.startLine());
        assertEquals(2, span.startCol());
    }

    @Test
    void testBareBlockOutsideLinesIsSyntaxError() {
        SnailSyntaxException e = assertThrows(SnailSyntaxException.class, () -> Parser.parse("{ print(1) }"));
        assertTrue(e.getMessage().contains("pattern/action"), e.getMessage());
    }

    @Test
    void testMissingOperandIsSyntaxError() {
        assertThrows(SnailSyntaxException.class, () -> Parser.parse("x = "));
    }

    @Test
    void testNestingDepthLimit() {
        String deep = "(".repeat(300) + "1" + ")".repeat(300);
        SnailSyntaxException e = assertThrows(SnailSyntaxException.class, () -> Parser.parse(deep));
        assertTrue(e.getMessage().contains("maximum nesting depth"), e.getMessage());

        CompileOptions generous = CompileOptions.builder().maxNestingDepth(2000).build();
        assertDoesNotThrow(() -> Parser.parse(deep, generous));
    }

    @Test
    void testLongOperatorChainCountsTowardDepth() {
        String chain = "x = 1" + " + 1".repeat(20000);
        SnailSyntaxException e = assertThrows(SnailSyntaxException.class, () -> Parser.parse(chain));
        assertTrue(e.getMessage().contains("maximum nesting depth"), e.getMessage());

        assertDoesNotThrow(() -> Parser.parse("x = 1" + " + 1".repeat(150)));
    }
}
