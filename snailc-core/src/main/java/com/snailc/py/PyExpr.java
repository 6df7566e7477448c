package com.snailc.py;

import com.snailc.ast.SourceSpan;

/**
 * Python expressions, one record per {@code ast} expression class the lowering produces.
 */
public sealed interface PyExpr extends PyNode {

    record BoolOp(SourceSpan span, BoolOpKind op, java.util.List<PyExpr> values) implements PyExpr {
    }

    record NamedExpr(SourceSpan span, PyExpr target, PyExpr value) implements PyExpr {
    }

    record BinOp(SourceSpan span, PyExpr left, Operator op, PyExpr right) implements PyExpr {
    }

    record UnaryOp(SourceSpan span, UnaryOpKind op, PyExpr operand) implements PyExpr {
    }

    record Lambda(SourceSpan span, PyArguments args, PyExpr body) implements PyExpr {
    }

    record IfExp(SourceSpan span, PyExpr test, PyExpr body, PyExpr orelse) implements PyExpr {
    }

    record Dict(SourceSpan span, java.util.List<PyExpr> keys, java.util.List<PyExpr> values) implements PyExpr {
    }

    record Set(SourceSpan span, java.util.List<PyExpr> elts) implements PyExpr {
    }

    record ListComp(SourceSpan span, PyExpr elt, java.util.List<PyComprehension> generators) implements PyExpr {
    }

    record DictComp(SourceSpan span, PyExpr key, PyExpr value, java.util.List<PyComprehension> generators)
        implements PyExpr {
    }

    record Yield(SourceSpan span, PyExpr value) implements PyExpr {
    }

    record YieldFrom(SourceSpan span, PyExpr value) implements PyExpr {
    }

    record Compare(SourceSpan span, PyExpr left, java.util.List<CmpOp> ops, java.util.List<PyExpr> comparators) implements PyExpr {
    }

    record Call(SourceSpan span, PyExpr func, java.util.List<PyExpr> args, java.util.List<PyKeyword> keywords) implements PyExpr {
    }

    /**
     * @param conversion -1 for none, otherwise the code point of {@code s}, {@code r} or {@code a}
     * @param formatSpec a {@link JoinedStr}, or null
     */
    record FormattedValue(SourceSpan span, PyExpr value, int conversion, PyExpr formatSpec) implements PyExpr {
    }

    /**
     * Values are {@link Constant} string pieces and {@link FormattedValue}s.
     */
    record JoinedStr(SourceSpan span, java.util.List<PyExpr> values) implements PyExpr {
    }

    /**
     * @param value a {@code String}, {@code Boolean}, {@code BigInteger}, {@code Double},
     *              {@link PyBytes}, {@link PyComplex}, or null for {@code None}
     */
    record Constant(SourceSpan span, Object value) implements PyExpr {
    }

    record Attribute(SourceSpan span, PyExpr value, String attr, ExprContext ctx) implements PyExpr {
    }

    record Subscript(SourceSpan span, PyExpr value, PyExpr slice, ExprContext ctx) implements PyExpr {
    }

    record Starred(SourceSpan span, PyExpr value, ExprContext ctx) implements PyExpr {
    }

    record Name(SourceSpan span, String id, ExprContext ctx) implements PyExpr {
    }

    record List(SourceSpan span, java.util.List<PyExpr> elts, ExprContext ctx) implements PyExpr {
    }

    record Tuple(SourceSpan span, java.util.List<PyExpr> elts, ExprContext ctx) implements PyExpr {
    }

    record Slice(SourceSpan span, PyExpr lower, PyExpr upper, PyExpr step) implements PyExpr {
    }
}
