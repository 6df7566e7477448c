package com.snailc.emit;

import com.snailc.py.*;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a whole module and records every runtime helper referenced by name.
 */
public final class HelperUsageScanner {
    private final Set<RuntimeHelper> found = EnumSet.noneOf(RuntimeHelper.class);

    private HelperUsageScanner() {
    }

    public static Set<RuntimeHelper> scan(PyModule module) {
        HelperUsageScanner scanner = new HelperUsageScanner();
        scanner.statements(module.body());
        return scanner.found;
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private void statements(List<PyStmt> body) {
        for (PyStmt stmt : body) {
            statement(stmt);
        }
    }

    private void statement(PyStmt stmt) {
        if (stmt instanceof PyStmt.FunctionDef s) {
            arguments(s.args());
            statements(s.body());
        } else if (stmt instanceof PyStmt.ClassDef s) {
            statements(s.body());
        } else if (stmt instanceof PyStmt.Return s) {
            expr(s.value());
        } else if (stmt instanceof PyStmt.Delete s) {
            exprs(s.targets());
        } else if (stmt instanceof PyStmt.Assign s) {
            exprs(s.targets());
            expr(s.value());
        } else if (stmt instanceof PyStmt.For s) {
            expr(s.target());
            expr(s.iter());
            statements(s.body());
            statements(s.orelse());
        } else if (stmt instanceof PyStmt.While s) {
            expr(s.test());
            statements(s.body());
            statements(s.orelse());
        } else if (stmt instanceof PyStmt.If s) {
            expr(s.test());
            statements(s.body());
            statements(s.orelse());
        } else if (stmt instanceof PyStmt.With s) {
            for (PyWithItem item : s.items()) {
                expr(item.contextExpr());
                expr(item.optionalVars());
            }
            statements(s.body());
        } else if (stmt instanceof PyStmt.Raise s) {
            expr(s.exc());
            expr(s.cause());
        } else if (stmt instanceof PyStmt.Try s) {
            statements(s.body());
            for (PyExceptHandler handler : s.handlers()) {
                expr(handler.exceptionType());
                statements(handler.body());
            }
            statements(s.orelse());
            statements(s.finalbody());
        } else if (stmt instanceof PyStmt.Assert s) {
            expr(s.test());
            expr(s.msg());
        } else if (stmt instanceof PyStmt.Expr s) {
            expr(s.value());
        }
        // imports, pass, break and continue reference no names
    }

    private void arguments(PyArguments args) {
        exprs(args.defaults());
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private void exprs(List<PyExpr> list) {
        for (PyExpr expr : list) {
            expr(expr);
        }
    }

    private void expr(PyExpr expr) {
        if (expr == null) {
            return;
        }
        if (expr instanceof PyExpr.Name e) {
            RuntimeHelper helper = RuntimeHelper.forName(e.id());
            if (helper != null) {
                found.add(helper);
            }
        } else if (expr instanceof PyExpr.BoolOp e) {
            exprs(e.values());
        } else if (expr instanceof PyExpr.NamedExpr e) {
            expr(e.target());
            expr(e.value());
        } else if (expr instanceof PyExpr.BinOp e) {
            expr(e.left());
            expr(e.right());
        } else if (expr instanceof PyExpr.UnaryOp e) {
            expr(e.operand());
        } else if (expr instanceof PyExpr.Lambda e) {
            arguments(e.args());
            expr(e.body());
        } else if (expr instanceof PyExpr.IfExp e) {
            expr(e.test());
            expr(e.body());
            expr(e.orelse());
        } else if (expr instanceof PyExpr.Dict e) {
            exprs(e.keys());
            exprs(e.values());
        } else if (expr instanceof PyExpr.Set e) {
            exprs(e.elts());
        } else if (expr instanceof PyExpr.ListComp e) {
            expr(e.elt());
            generators(e.generators());
        } else if (expr instanceof PyExpr.DictComp e) {
            expr(e.key());
            expr(e.value());
            generators(e.generators());
        } else if (expr instanceof PyExpr.Yield e) {
            expr(e.value());
        } else if (expr instanceof PyExpr.YieldFrom e) {
            expr(e.value());
        } else if (expr instanceof PyExpr.Compare e) {
            expr(e.left());
            exprs(e.comparators());
        } else if (expr instanceof PyExpr.Call e) {
            expr(e.func());
            exprs(e.args());
            for (PyKeyword keyword : e.keywords()) {
                expr(keyword.value());
            }
        } else if (expr instanceof PyExpr.FormattedValue e) {
            expr(e.value());
            expr(e.formatSpec());
        } else if (expr instanceof PyExpr.JoinedStr e) {
            exprs(e.values());
        } else if (expr instanceof PyExpr.Attribute e) {
            expr(e.value());
        } else if (expr instanceof PyExpr.Subscript e) {
            expr(e.value());
            expr(e.slice());
        } else if (expr instanceof PyExpr.Starred e) {
            expr(e.value());
        } else if (expr instanceof PyExpr.List e) {
            exprs(e.elts());
        } else if (expr instanceof PyExpr.Tuple e) {
            exprs(e.elts());
        } else if (expr instanceof PyExpr.Slice e) {
            expr(e.lower());
            expr(e.upper());
            expr(e.step());
        }
    }

    private void generators(List<PyComprehension> generators) {
        for (PyComprehension generator : generators) {
            expr(generator.target());
            expr(generator.iter());
            exprs(generator.ifs());
        }
    }
}
