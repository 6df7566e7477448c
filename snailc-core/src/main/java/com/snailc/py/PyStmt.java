package com.snailc.py;

import com.snailc.ast.SourceSpan;

import java.util.List;

/**
 * Python statements, one record per {@code ast} statement class the lowering produces.
 */
public sealed interface PyStmt extends PyNode {

    record FunctionDef(SourceSpan span, String name, PyArguments args, List<PyStmt> body) implements PyStmt {
    }

    record ClassDef(SourceSpan span, String name, List<PyStmt> body) implements PyStmt {
    }

    record Return(SourceSpan span, PyExpr value) implements PyStmt {
    }

    record Delete(SourceSpan span, List<PyExpr> targets) implements PyStmt {
    }

    record Assign(SourceSpan span, List<PyExpr> targets, PyExpr value) implements PyStmt {
    }

    record For(SourceSpan span, PyExpr target, PyExpr iter, List<PyStmt> body, List<PyStmt> orelse)
        implements PyStmt {
    }

    record While(SourceSpan span, PyExpr test, List<PyStmt> body, List<PyStmt> orelse) implements PyStmt {
    }

    record If(SourceSpan span, PyExpr test, List<PyStmt> body, List<PyStmt> orelse) implements PyStmt {
    }

    record With(SourceSpan span, List<PyWithItem> items, List<PyStmt> body) implements PyStmt {
    }

    record Raise(SourceSpan span, PyExpr exc, PyExpr cause) implements PyStmt {
    }

    record Try(SourceSpan span, List<PyStmt> body, List<PyExceptHandler> handlers,
               List<PyStmt> orelse, List<PyStmt> finalbody) implements PyStmt {
    }

    record Assert(SourceSpan span, PyExpr test, PyExpr msg) implements PyStmt {
    }

    record Import(SourceSpan span, List<PyAlias> names) implements PyStmt {
    }

    record ImportFrom(SourceSpan span, String module, List<PyAlias> names, int level) implements PyStmt {
    }

    record Expr(SourceSpan span, PyExpr value) implements PyStmt {
    }

    record Pass(SourceSpan span) implements PyStmt {
    }

    record Break(SourceSpan span) implements PyStmt {
    }

    record Continue(SourceSpan span) implements PyStmt {
    }
}
