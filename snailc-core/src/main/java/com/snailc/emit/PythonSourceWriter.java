package com.snailc.emit;

import com.snailc.py.*;

import java.math.BigInteger;
import java.util.List;

/**
 * Renders a module as Python source for inspection. Output is valid Python for the trees the
 * lowering produces; layout is fixed (four-space indent, one statement per line).
 */
public final class PythonSourceWriter {

    // ========================================================================
    // Precedence levels, low to high
    // ========================================================================
    private static final int PREC_TUPLE = 0;       // bare tuples, yield
    private static final int PREC_NAMED = 1;       // :=
    private static final int PREC_LAMBDA = 2;      // lambda
    private static final int PREC_IF_EXP = 3;      // x if c else y
    private static final int PREC_OR = 4;          // or
    private static final int PREC_AND = 5;         // and
    private static final int PREC_NOT = 6;         // not x
    private static final int PREC_COMPARE = 7;     // == < in is ...
    private static final int PREC_ARITH = 8;       // + -
    private static final int PREC_TERM = 9;        // * / // %
    private static final int PREC_FACTOR = 10;     // unary + -
    private static final int PREC_POWER = 11;      // **
    private static final int PREC_ATOM = 12;       // calls, subscripts, literals

    private static final String INDENT = "    ";

    private final StringBuilder out = new StringBuilder();
    private int indent;

    private PythonSourceWriter() {
    }

    public static String write(PyModule module) {
        PythonSourceWriter writer = new PythonSourceWriter();
        writer.statements(module.body());
        return writer.out.toString();
    }

    /** Renders a single expression, for diagnostics and tests. */
    public static String write(PyExpr expr) {
        return new PythonSourceWriter().expr(expr, PREC_TUPLE);
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private void statements(List<PyStmt> body) {
        if (body.isEmpty()) {
            line("pass");
            return;
        }
        for (PyStmt stmt : body) {
            statement(stmt);
        }
    }

    private void suite(String header, List<PyStmt> body) {
        line(header + ":");
        indent++;
        statements(body);
        indent--;
    }

    private void statement(PyStmt stmt) {
        if (stmt instanceof PyStmt.FunctionDef s) {
            suite("def " + s.name() + "(" + arguments(s.args()) + ")", s.body());
        } else if (stmt instanceof PyStmt.ClassDef s) {
            suite("class " + s.name(), s.body());
        } else if (stmt instanceof PyStmt.Return s) {
            line(s.value() == null ? "return" : "return " + statementExpr(s.value()));
        } else if (stmt instanceof PyStmt.Delete s) {
            line("del " + join(s.targets(), PREC_LAMBDA));
        } else if (stmt instanceof PyStmt.Assign s) {
            StringBuilder sb = new StringBuilder();
            for (PyExpr target : s.targets()) {
                sb.append(target(target)).append(" = ");
            }
            line(sb.append(statementExpr(s.value())).toString());
        } else if (stmt instanceof PyStmt.For s) {
            suite("for " + target(s.target()) + " in " + statementExpr(s.iter()), s.body());
            orElse(s.orelse());
        } else if (stmt instanceof PyStmt.While s) {
            suite("while " + expr(s.test(), PREC_NAMED), s.body());
            orElse(s.orelse());
        } else if (stmt instanceof PyStmt.If s) {
            ifChain("if", s);
        } else if (stmt instanceof PyStmt.With s) {
            StringBuilder sb = new StringBuilder("with ");
            for (int i = 0; i < s.items().size(); i++) {
                PyWithItem item = s.items().get(i);
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(expr(item.contextExpr(), PREC_LAMBDA));
                if (item.optionalVars() != null) {
                    sb.append(" as ").append(expr(item.optionalVars(), PREC_ATOM));
                }
            }
            suite(sb.toString(), s.body());
        } else if (stmt instanceof PyStmt.Raise s) {
            StringBuilder sb = new StringBuilder("raise");
            if (s.exc() != null) {
                sb.append(' ').append(expr(s.exc(), PREC_LAMBDA));
            }
            if (s.cause() != null) {
                sb.append(" from ").append(expr(s.cause(), PREC_LAMBDA));
            }
            line(sb.toString());
        } else if (stmt instanceof PyStmt.Try s) {
            suite("try", s.body());
            for (PyExceptHandler handler : s.handlers()) {
                StringBuilder sb = new StringBuilder("except");
                if (handler.exceptionType() != null) {
                    sb.append(' ').append(expr(handler.exceptionType(), PREC_LAMBDA));
                }
                if (handler.name() != null) {
                    sb.append(" as ").append(handler.name());
                }
                suite(sb.toString(), handler.body());
            }
            orElse(s.orelse());
            if (!s.finalbody().isEmpty()) {
                suite("finally", s.finalbody());
            }
        } else if (stmt instanceof PyStmt.Assert s) {
            String msg = s.msg() == null ? "" : ", " + expr(s.msg(), PREC_LAMBDA);
            line("assert " + expr(s.test(), PREC_LAMBDA) + msg);
        } else if (stmt instanceof PyStmt.Import s) {
            line("import " + aliases(s.names()));
        } else if (stmt instanceof PyStmt.ImportFrom s) {
            String module = ".".repeat(s.level()) + (s.module() == null ? "" : s.module());
            line("from " + module + " import " + aliases(s.names()));
        } else if (stmt instanceof PyStmt.Expr s) {
            line(statementExpr(s.value()));
        } else if (stmt instanceof PyStmt.Pass) {
            line("pass");
        } else if (stmt instanceof PyStmt.Break) {
            line("break");
        } else if (stmt instanceof PyStmt.Continue) {
            line("continue");
        }
    }

    // An else branch holding just another if renders as elif
    private void ifChain(String keyword, PyStmt.If s) {
        suite(keyword + " " + expr(s.test(), PREC_NAMED), s.body());
        if (s.orelse().size() == 1 && s.orelse().get(0) instanceof PyStmt.If nested) {
            ifChain("elif", nested);
        } else {
            orElse(s.orelse());
        }
    }

    private void orElse(List<PyStmt> orelse) {
        if (!orelse.isEmpty()) {
            suite("else", orelse);
        }
    }

    private String statementExpr(PyExpr value) {
        return expr(value, PREC_LAMBDA);
    }

    private String target(PyExpr target) {
        if (target instanceof PyExpr.Tuple t && !t.elts().isEmpty()) {
            return join(t.elts(), PREC_LAMBDA) + (t.elts().size() == 1 ? "," : "");
        }
        return expr(target, PREC_LAMBDA);
    }

    private static String aliases(List<PyAlias> names) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < names.size(); i++) {
            PyAlias alias = names.get(i);
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(alias.name());
            if (alias.asname() != null) {
                sb.append(" as ").append(alias.asname());
            }
        }
        return sb.toString();
    }

    private String arguments(PyArguments args) {
        StringBuilder sb = new StringBuilder();
        int firstDefault = args.args().size() - args.defaults().size();
        for (int i = 0; i < args.args().size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(args.args().get(i).arg());
            if (i >= firstDefault) {
                sb.append('=').append(expr(args.defaults().get(i - firstDefault), PREC_LAMBDA));
            }
        }
        if (args.vararg() != null) {
            separate(sb).append('*').append(args.vararg().arg());
        }
        if (args.kwarg() != null) {
            separate(sb).append("**").append(args.kwarg().arg());
        }
        return sb.toString();
    }

    private static StringBuilder separate(StringBuilder sb) {
        return sb.length() == 0 ? sb : sb.append(", ");
    }

    private void line(String text) {
        out.append(INDENT.repeat(indent)).append(text).append('\n');
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private String join(List<PyExpr> items, int prec) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(expr(items.get(i), prec));
        }
        return sb.toString();
    }

    private String expr(PyExpr expr, int minPrec) {
        int prec = precedence(expr);
        String text = render(expr);
        return prec < minPrec ? "(" + text + ")" : text;
    }

    private static int precedence(PyExpr expr) {
        if (expr instanceof PyExpr.Yield || expr instanceof PyExpr.YieldFrom) {
            return PREC_TUPLE;
        } else if (expr instanceof PyExpr.NamedExpr) {
            return PREC_NAMED;
        } else if (expr instanceof PyExpr.Lambda) {
            return PREC_LAMBDA;
        } else if (expr instanceof PyExpr.IfExp) {
            return PREC_IF_EXP;
        } else if (expr instanceof PyExpr.BoolOp e) {
            return e.op() == BoolOpKind.OR ? PREC_OR : PREC_AND;
        } else if (expr instanceof PyExpr.UnaryOp e) {
            return e.op() == UnaryOpKind.NOT ? PREC_NOT : PREC_FACTOR;
        } else if (expr instanceof PyExpr.Compare) {
            return PREC_COMPARE;
        } else if (expr instanceof PyExpr.BinOp e) {
            return binaryPrecedence(e.op());
        } else if (expr instanceof PyExpr.Starred) {
            return PREC_ARITH;
        } else if (expr instanceof PyExpr.Constant e && e.value() instanceof Number number && isNegative(number)) {
            return PREC_FACTOR;
        }
        return PREC_ATOM;
    }

    private static int binaryPrecedence(Operator op) {
        return switch (op) {
            case ADD, SUB -> PREC_ARITH;
            case MULT, DIV, FLOOR_DIV, MOD -> PREC_TERM;
            case POW -> PREC_POWER;
        };
    }

    private static boolean isNegative(Number number) {
        if (number instanceof BigInteger big) {
            return big.signum() < 0;
        }
        return number.doubleValue() < 0;
    }

    private String render(PyExpr expr) {
        if (expr instanceof PyExpr.Name e) {
            return e.id();
        } else if (expr instanceof PyExpr.Constant e) {
            return constant(e.value());
        } else if (expr instanceof PyExpr.BoolOp e) {
            int prec = precedence(e);
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < e.values().size(); i++) {
                if (i > 0) {
                    sb.append(' ').append(e.op().symbol()).append(' ');
                }
                sb.append(expr(e.values().get(i), prec + 1));
            }
            return sb.toString();
        } else if (expr instanceof PyExpr.NamedExpr e) {
            return expr(e.target(), PREC_ATOM) + " := " + expr(e.value(), PREC_LAMBDA);
        } else if (expr instanceof PyExpr.BinOp e) {
            int prec = binaryPrecedence(e.op());
            // ** groups to the right, everything else to the left
            boolean right = e.op() == Operator.POW;
            return expr(e.left(), right ? prec + 1 : prec) + " " + e.op().symbol() + " "
                + expr(e.right(), right ? prec : prec + 1);
        } else if (expr instanceof PyExpr.UnaryOp e) {
            if (e.op() == UnaryOpKind.NOT) {
                return "not " + expr(e.operand(), PREC_NOT);
            }
            return e.op().symbol() + expr(e.operand(), PREC_FACTOR);
        } else if (expr instanceof PyExpr.Lambda e) {
            String params = arguments(e.args());
            return (params.isEmpty() ? "lambda" : "lambda " + params) + ": " + expr(e.body(), PREC_LAMBDA);
        } else if (expr instanceof PyExpr.IfExp e) {
            return expr(e.body(), PREC_OR) + " if " + expr(e.test(), PREC_OR) + " else " + expr(e.orelse(), PREC_IF_EXP);
        } else if (expr instanceof PyExpr.Dict e) {
            StringBuilder sb = new StringBuilder("{");
            for (int i = 0; i < e.keys().size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(expr(e.keys().get(i), PREC_LAMBDA)).append(": ").append(expr(e.values().get(i), PREC_LAMBDA));
            }
            return sb.append('}').toString();
        } else if (expr instanceof PyExpr.Set e) {
            return e.elts().isEmpty() ? "set()" : "{" + join(e.elts(), PREC_LAMBDA) + "}";
        } else if (expr instanceof PyExpr.ListComp e) {
            return "[" + expr(e.elt(), PREC_LAMBDA) + generators(e.generators()) + "]";
        } else if (expr instanceof PyExpr.DictComp e) {
            return "{" + expr(e.key(), PREC_LAMBDA) + ": " + expr(e.value(), PREC_LAMBDA) + generators(e.generators()) + "}";
        } else if (expr instanceof PyExpr.Yield e) {
            return e.value() == null ? "yield" : "yield " + expr(e.value(), PREC_LAMBDA);
        } else if (expr instanceof PyExpr.YieldFrom e) {
            return "yield from " + expr(e.value(), PREC_LAMBDA);
        } else if (expr instanceof PyExpr.Compare e) {
            StringBuilder sb = new StringBuilder(expr(e.left(), PREC_COMPARE + 1));
            for (int i = 0; i < e.ops().size(); i++) {
                sb.append(' ').append(e.ops().get(i).symbol()).append(' ')
                    .append(expr(e.comparators().get(i), PREC_COMPARE + 1));
            }
            return sb.toString();
        } else if (expr instanceof PyExpr.Call e) {
            StringBuilder sb = new StringBuilder(expr(e.func(), PREC_ATOM)).append('(');
            sb.append(join(e.args(), PREC_LAMBDA));
            for (PyKeyword keyword : e.keywords()) {
                separateArgs(sb);
                sb.append(keyword.arg() == null ? "**" : keyword.arg() + "=").append(expr(keyword.value(), PREC_LAMBDA));
            }
            return sb.append(')').toString();
        } else if (expr instanceof PyExpr.JoinedStr e) {
            return "f\"" + formatBody(e.values()) + "\"";
        } else if (expr instanceof PyExpr.FormattedValue e) {
            return "f\"" + formatBody(List.of(e)) + "\"";
        } else if (expr instanceof PyExpr.Attribute e) {
            return expr(e.value(), PREC_ATOM) + "." + e.attr();
        } else if (expr instanceof PyExpr.Subscript e) {
            return expr(e.value(), PREC_ATOM) + "[" + subscript(e.slice()) + "]";
        } else if (expr instanceof PyExpr.Starred e) {
            return "*" + expr(e.value(), PREC_FACTOR);
        } else if (expr instanceof PyExpr.List e) {
            return "[" + join(e.elts(), PREC_LAMBDA) + "]";
        } else if (expr instanceof PyExpr.Tuple e) {
            if (e.elts().size() == 1) {
                return "(" + expr(e.elts().get(0), PREC_LAMBDA) + ",)";
            }
            return "(" + join(e.elts(), PREC_LAMBDA) + ")";
        } else if (expr instanceof PyExpr.Slice e) {
            return slice(e);
        }
        throw new IllegalArgumentException("Unknown expression: " + expr.type());
    }

    private static void separateArgs(StringBuilder sb) {
        if (sb.charAt(sb.length() - 1) != '(') {
            sb.append(", ");
        }
    }

    private String generators(List<PyComprehension> generators) {
        StringBuilder sb = new StringBuilder();
        for (PyComprehension generator : generators) {
            sb.append(" for ").append(target(generator.target()))
                .append(" in ").append(expr(generator.iter(), PREC_OR));
            for (PyExpr condition : generator.ifs()) {
                sb.append(" if ").append(expr(condition, PREC_OR));
            }
        }
        return sb.toString();
    }

    private String subscript(PyExpr slice) {
        if (slice instanceof PyExpr.Tuple t && !t.elts().isEmpty()) {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < t.elts().size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                sb.append(subscript(t.elts().get(i)));
            }
            return t.elts().size() == 1 ? sb.append(',').toString() : sb.toString();
        }
        if (slice instanceof PyExpr.Slice s) {
            return slice(s);
        }
        return expr(slice, PREC_LAMBDA);
    }

    private String slice(PyExpr.Slice s) {
        StringBuilder sb = new StringBuilder();
        if (s.lower() != null) {
            sb.append(expr(s.lower(), PREC_LAMBDA));
        }
        sb.append(':');
        if (s.upper() != null) {
            sb.append(expr(s.upper(), PREC_LAMBDA));
        }
        if (s.step() != null) {
            sb.append(':').append(expr(s.step(), PREC_LAMBDA));
        }
        return sb.toString();
    }

    private String formatBody(List<PyExpr> values) {
        StringBuilder sb = new StringBuilder();
        for (PyExpr value : values) {
            if (value instanceof PyExpr.Constant c && c.value() instanceof String text) {
                sb.append(escape(text, '"').replace("{", "{{").replace("}", "}}"));
            } else if (value instanceof PyExpr.FormattedValue f) {
                String inner = expr(f.value(), PREC_LAMBDA);
                sb.append('{').append(inner.startsWith("{") ? " " + inner : inner);
                if (f.conversion() >= 0) {
                    sb.append('!').append((char) f.conversion());
                }
                if (f.formatSpec() instanceof PyExpr.JoinedStr spec) {
                    sb.append(':').append(formatBody(spec.values()));
                }
                sb.append('}');
            }
        }
        return sb.toString();
    }

    // ========================================================================
    // Constants
    // ========================================================================

    static String constant(Object value) {
        if (value == null) {
            return "None";
        } else if (value instanceof Boolean b) {
            return b ? "True" : "False";
        } else if (value instanceof String s) {
            return "\"" + escape(s, '"') + "\"";
        } else if (value instanceof PyBytes b) {
            return "b\"" + escapeBytes(b.latin1()) + "\"";
        } else if (value instanceof BigInteger i) {
            return i.toString();
        } else if (value instanceof Double d) {
            return floatLiteral(d);
        } else if (value instanceof PyComplex c) {
            return floatLiteral(c.imag()) + "j";
        }
        throw new IllegalArgumentException("Unsupported constant: " + value.getClass().getName());
    }

    private static String floatLiteral(double d) {
        if (Double.isNaN(d)) {
            return "float(\"nan\")";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "1e999" : "-1e999";
        }
        return Double.toString(d);
    }

    static String escape(String text, char quote) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == quote) {
                        sb.append('\\').append(c);
                    } else if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }

    private static String escapeBytes(String latin1) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < latin1.length(); i++) {
            char c = latin1.charAt(i);
            if (c == '\\' || c == '"') {
                sb.append('\\').append(c);
            } else if (c >= 0x20 && c < 0x7f) {
                sb.append(c);
            } else {
                sb.append(String.format("\\x%02x", (int) (c & 0xff)));
            }
        }
        return sb.toString();
    }
}
