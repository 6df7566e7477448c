package com.snailc.py;

import com.snailc.ast.SourceSpan;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Shorthand constructors for the node shapes lowering builds most often.
 */
public final class Py {

    private Py() {
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    public static PyExpr.Name load(SourceSpan span, String id) {
        return new PyExpr.Name(span, id, ExprContext.LOAD);
    }

    public static PyExpr.Name store(SourceSpan span, String id) {
        return new PyExpr.Name(span, id, ExprContext.STORE);
    }

    public static PyExpr.Constant constant(SourceSpan span, Object value) {
        return new PyExpr.Constant(span, value);
    }

    public static PyExpr.Constant none(SourceSpan span) {
        return new PyExpr.Constant(span, null);
    }

    public static PyExpr.Constant str(SourceSpan span, String value) {
        return new PyExpr.Constant(span, value);
    }

    public static PyExpr.Constant integer(SourceSpan span, long value) {
        return new PyExpr.Constant(span, BigInteger.valueOf(value));
    }

    public static PyExpr.Constant bool(SourceSpan span, boolean value) {
        return new PyExpr.Constant(span, value);
    }

    public static PyExpr.Call call(SourceSpan span, PyExpr func, List<PyExpr> args) {
        return new PyExpr.Call(span, func, args, List.of());
    }

    public static PyExpr.Call call(SourceSpan span, PyExpr func, PyExpr... args) {
        return new PyExpr.Call(span, func, List.of(args), List.of());
    }

    /** Call of a global function or runtime helper by name. */
    public static PyExpr.Call call(SourceSpan span, String func, PyExpr... args) {
        return call(span, load(span, func), args);
    }

    public static PyExpr.Attribute attribute(SourceSpan span, PyExpr value, String attr) {
        return new PyExpr.Attribute(span, value, attr, ExprContext.LOAD);
    }

    public static PyExpr.Subscript subscript(SourceSpan span, PyExpr value, PyExpr slice) {
        return new PyExpr.Subscript(span, value, slice, ExprContext.LOAD);
    }

    public static PyExpr.Tuple tuple(SourceSpan span, List<PyExpr> elts) {
        return new PyExpr.Tuple(span, elts, ExprContext.LOAD);
    }

    public static PyExpr.List list(SourceSpan span, List<PyExpr> elts) {
        return new PyExpr.List(span, elts, ExprContext.LOAD);
    }

    /** {@code (target := value)} */
    public static PyExpr.NamedExpr walrus(SourceSpan span, String target, PyExpr value) {
        return new PyExpr.NamedExpr(span, store(span, target), value);
    }

    /** {@code (e0, e1, ..., en)[-1]}: evaluates every element and yields the last. */
    public static PyExpr.Subscript lastOf(SourceSpan span, List<PyExpr> elts) {
        return subscript(span, tuple(span, elts),
            new PyExpr.UnaryOp(span, UnaryOpKind.USUB, integer(span, 1)));
    }

    public static PyExpr.BoolOp and(SourceSpan span, List<PyExpr> values) {
        return new PyExpr.BoolOp(span, BoolOpKind.AND, values);
    }

    public static PyExpr.UnaryOp not(SourceSpan span, PyExpr operand) {
        return new PyExpr.UnaryOp(span, UnaryOpKind.NOT, operand);
    }

    public static PyExpr.Lambda lambda(SourceSpan span, PyExpr body, String... params) {
        List<PyArg> args = new ArrayList<>();
        for (String param : params) {
            args.add(new PyArg(span, param));
        }
        return new PyExpr.Lambda(span, new PyArguments(span, args, null, null, List.of()), body);
    }

    // ========================================================================
    // Statements
    // ========================================================================

    public static PyStmt.Assign assign(SourceSpan span, String target, PyExpr value) {
        return new PyStmt.Assign(span, List.of(store(span, target)), value);
    }

    public static PyStmt.Expr expr(PyExpr value) {
        return new PyStmt.Expr(value.span(), value);
    }

    public static PyStmt.If ifStmt(SourceSpan span, PyExpr test, List<PyStmt> body, List<PyStmt> orelse) {
        return new PyStmt.If(span, test, body, orelse);
    }

    public static PyStmt.Import importModule(SourceSpan span, String module) {
        return new PyStmt.Import(span, List.of(new PyAlias(span, module, null)));
    }

    public static PyStmt.Pass pass(SourceSpan span) {
        return new PyStmt.Pass(span);
    }
}
