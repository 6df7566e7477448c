package com.snailc.lower;

import com.snailc.ast.*;
import com.snailc.py.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

/**
 * Translates a validated Snail program into the Python target tree.
 *
 * <p>Lambdas that need statements are hoisted first (see {@link LambdaHoister}); everything else
 * is a single recursive walk. Snail-only constructs become calls into the runtime library whose
 * names are listed in {@link RuntimeNames}.
 */
public final class Lowerer {
    private static final Logger LOG = LoggerFactory.getLogger(Lowerer.class);

    private static final String EXCEPTION_NAME_MESSAGE = "`$e` is only available in compact exception fallbacks";
    private static final String PLACEHOLDER_MESSAGE = "pipeline calls may include at most one placeholder";

    private enum Tail {
        NONE,
        AUTO_PRINT,
        IMPLICIT_RETURN
    }

    /**
     * Lexical context threaded through expression lowering.
     *
     * @param exceptionName parameter holding the caught exception in the innermost fallback, or null
     * @param placeholder   value substituted for {@code _} inside a pipeline call, or null
     */
    private record Scope(String exceptionName, PyExpr placeholder) {
        static final Scope ROOT = new Scope(null, null);

        Scope withException(String name) {
            return new Scope(name, placeholder);
        }

        Scope withPlaceholder(PyExpr value) {
            return new Scope(exceptionName, value);
        }
    }

    private final LowerOptions options;

    private Lowerer(LowerOptions options) {
        this.options = options;
    }

    public static PyModule lower(Program program) {
        return lower(program, LowerOptions.DEFAULT);
    }

    public static PyModule lower(Program program, LowerOptions options) {
        return lower(List.of(program), program.span(), options);
    }

    /**
     * Lowers consecutive sections (begin code, the main program, end code) into one module.
     * Lambda names are numbered across all sections; auto-print applies to the tail of each section.
     */
    public static PyModule lower(List<Program> sections, SourceSpan span, LowerOptions options) {
        LambdaNames names = new LambdaNames();
        LambdaHoister hoister = new LambdaHoister(names);
        Lowerer lowerer = new Lowerer(options);
        Tail tail = options.autoPrint() ? Tail.AUTO_PRINT : Tail.NONE;
        List<PyStmt> body = new ArrayList<>();
        for (Program section : sections) {
            Program hoisted = hoister.hoist(section);
            if (!hoisted.body().isEmpty()) {
                body.addAll(lowerer.block(hoisted.body(), tail, hoisted.span()));
            }
        }
        if (names.issued() > 0) {
            LOG.trace("Hoisted {} lambda(s) into named functions", names.issued());
        }
        return new PyModule(span, body);
    }

    // ========================================================================
    // Blocks and statements
    // ========================================================================

    private List<PyStmt> block(List<Statement> body, Tail tail, SourceSpan span) {
        List<PyStmt> out = new ArrayList<>();
        if (body != null) {
            for (int i = 0; i < body.size(); i++) {
                Statement stmt = body.get(i);
                boolean last = i == body.size() - 1;
                if (tail == Tail.AUTO_PRINT && stmt instanceof PatternActionStatement rule) {
                    // every rule action prints its own result
                    out.addAll(patternAction(rule, tail));
                    continue;
                }
                if (last && tail == Tail.AUTO_PRINT && stmt instanceof LinesStatement s) {
                    out.addAll(linesLoop(s, tail));
                    continue;
                }
                if (last && tail == Tail.AUTO_PRINT && stmt instanceof FilesStatement s) {
                    out.addAll(filesLoop(s, tail));
                    continue;
                }
                if (last && tail != Tail.NONE && stmt instanceof ExpressionStatement s && !s.semicolonTerminated()) {
                    PyExpr value = expr(s.expression(), Scope.ROOT);
                    if (tail == Tail.IMPLICIT_RETURN) {
                        out.add(new PyStmt.Return(s.span(), value));
                    } else {
                        out.addAll(autoPrint(value, s.span()));
                    }
                    continue;
                }
                out.addAll(statement(stmt));
            }
        }
        if (out.isEmpty()) {
            out.add(Py.pass(span));
        }
        return out;
    }

    private List<PyStmt> block(List<Statement> body, SourceSpan span) {
        return block(body, Tail.NONE, span);
    }

    /** Lowers an optional else/finally body; absent stays empty. */
    private List<PyStmt> optionalBlock(List<Statement> body, SourceSpan span) {
        return body == null ? List.of() : block(body, span);
    }

    private List<PyStmt> statement(Statement stmt) {
        SourceSpan span = stmt.span();
        if (stmt instanceof ExpressionStatement s) {
            return List.of(Py.expr(expr(s.expression(), Scope.ROOT)));
        } else if (stmt instanceof AssignStatement s) {
            List<PyExpr> targets = new ArrayList<>();
            for (AssignTarget target : s.targets()) {
                targets.add(target(target, ExprContext.STORE, Scope.ROOT));
            }
            return List.of(new PyStmt.Assign(span, targets, expr(s.value(), Scope.ROOT)));
        } else if (stmt instanceof IfStatement s) {
            return ifChain(s.condition(), s.body(), s.elifs(), s.elseBody(), span);
        } else if (stmt instanceof WhileStatement s) {
            return whileLoop(s, span);
        } else if (stmt instanceof ForStatement s) {
            return List.of(new PyStmt.For(span, target(s.target(), ExprContext.STORE, Scope.ROOT),
                expr(s.iter(), Scope.ROOT), block(s.body(), span), optionalBlock(s.elseBody(), span)));
        } else if (stmt instanceof DefStatement s) {
            return List.of(new PyStmt.FunctionDef(span, s.name(), parameters(s.params(), Scope.ROOT, span),
                block(s.body(), Tail.IMPLICIT_RETURN, span)));
        } else if (stmt instanceof ClassStatement s) {
            return List.of(new PyStmt.ClassDef(span, s.name(), block(s.body(), span)));
        } else if (stmt instanceof TryStatement s) {
            List<PyExceptHandler> handlers = new ArrayList<>();
            for (ExceptHandler handler : s.handlers()) {
                handlers.add(new PyExceptHandler(handler.span(), optionalExpr(handler.exceptionType(), Scope.ROOT),
                    handler.name(), block(handler.body(), handler.span())));
            }
            return List.of(new PyStmt.Try(span, block(s.body(), span), handlers,
                optionalBlock(s.elseBody(), span), optionalBlock(s.finallyBody(), span)));
        } else if (stmt instanceof WithStatement s) {
            List<PyWithItem> items = new ArrayList<>();
            for (WithItem item : s.items()) {
                PyExpr vars = item.target() == null ? null : target(item.target(), ExprContext.STORE, Scope.ROOT);
                items.add(new PyWithItem(item.span(), expr(item.context(), Scope.ROOT), vars));
            }
            return List.of(new PyStmt.With(span, items, block(s.body(), span)));
        } else if (stmt instanceof ReturnStatement s) {
            return List.of(new PyStmt.Return(span, optionalExpr(s.value(), Scope.ROOT)));
        } else if (stmt instanceof RaiseStatement s) {
            return List.of(new PyStmt.Raise(span, optionalExpr(s.value(), Scope.ROOT), optionalExpr(s.cause(), Scope.ROOT)));
        } else if (stmt instanceof AssertStatement s) {
            return List.of(new PyStmt.Assert(span, expr(s.test(), Scope.ROOT), optionalExpr(s.message(), Scope.ROOT)));
        } else if (stmt instanceof DeleteStatement s) {
            List<PyExpr> targets = new ArrayList<>();
            for (AssignTarget target : s.targets()) {
                targets.add(target(target, ExprContext.DEL, Scope.ROOT));
            }
            return List.of(new PyStmt.Delete(span, targets));
        } else if (stmt instanceof BreakStatement) {
            return List.of(new PyStmt.Break(span));
        } else if (stmt instanceof ContinueStatement) {
            return List.of(new PyStmt.Continue(span));
        } else if (stmt instanceof PassStatement) {
            return List.of(Py.pass(span));
        } else if (stmt instanceof ImportStatement s) {
            return List.of(new PyStmt.Import(span, aliases(s.items())));
        } else if (stmt instanceof ImportFromStatement s) {
            List<PyAlias> names = s.star() ? List.of(new PyAlias(span, "*", null)) : aliases(s.items());
            return List.of(new PyStmt.ImportFrom(span, s.module(), names, s.level()));
        } else if (stmt instanceof LinesStatement s) {
            return linesLoop(s, Tail.NONE);
        } else if (stmt instanceof FilesStatement s) {
            return filesLoop(s, Tail.NONE);
        } else if (stmt instanceof PatternActionStatement s) {
            return patternAction(s, Tail.NONE);
        }
        throw new LoweringException("unsupported statement: " + stmt.type(), span);
    }

    private static List<PyAlias> aliases(List<ImportItem> items) {
        List<PyAlias> out = new ArrayList<>();
        for (ImportItem item : items) {
            out.add(new PyAlias(item.span(), item.name(), item.alias()));
        }
        return out;
    }

    /**
     * <pre>
     * __snail_last_result = value
     * if isinstance(__snail_last_result, str): print(__snail_last_result)
     * elif __snail_last_result is not None: import pprint; pprint.pprint(__snail_last_result)
     * </pre>
     */
    private static List<PyStmt> autoPrint(PyExpr value, SourceSpan span) {
        PyExpr result = Py.load(span, RuntimeNames.LAST_RESULT);
        PyExpr isString = Py.call(span, "isinstance", result, Py.load(span, "str"));
        PyExpr notNone = new PyExpr.Compare(span, result, List.of(CmpOp.IS_NOT), List.of(Py.none(span)));
        List<PyStmt> pretty = List.of(
            Py.importModule(span, "pprint"),
            Py.expr(Py.call(span, Py.attribute(span, Py.load(span, "pprint"), "pprint"), result)));
        PyStmt print = Py.expr(Py.call(span, "print", result));
        return List.of(
            Py.assign(span, RuntimeNames.LAST_RESULT, value),
            Py.ifStmt(span, isString, List.of(print), List.of(Py.ifStmt(span, notNone, pretty, List.of()))));
    }

    // ========================================================================
    // Conditions: if, while, and their let forms
    // ========================================================================

    private List<PyStmt> ifChain(Condition condition, List<Statement> body, List<ElifClause> elifs,
                                 List<Statement> elseBody, SourceSpan span) {
        List<PyStmt> orelse;
        if (!elifs.isEmpty()) {
            ElifClause next = elifs.get(0);
            orelse = ifChain(next.condition(), next.body(), elifs.subList(1, elifs.size()), elseBody, next.span());
        } else {
            orelse = optionalBlock(elseBody, span);
        }
        List<PyStmt> then = block(body, span);
        if (condition instanceof LetCondition let) {
            List<PyStmt> out = new ArrayList<>();
            out.add(Py.assign(let.span(), RuntimeNames.LET_VALUE, expr(let.value(), Scope.ROOT)));
            out.add(destructure(let));
            out.add(Py.ifStmt(span, letTest(let), then, orelse));
            return out;
        }
        PyExpr test = expr(((ExpressionCondition) condition).expression(), Scope.ROOT);
        return List.of(Py.ifStmt(span, test, then, orelse));
    }

    private List<PyStmt> whileLoop(WhileStatement s, SourceSpan span) {
        if (!(s.condition() instanceof LetCondition let)) {
            PyExpr test = expr(((ExpressionCondition) s.condition()).expression(), Scope.ROOT);
            return List.of(new PyStmt.While(span, test, block(s.body(), span), optionalBlock(s.elseBody(), span)));
        }
        SourceSpan letSpan = let.span();
        List<PyStmt> loop = new ArrayList<>();
        loop.add(Py.assign(letSpan, RuntimeNames.LET_VALUE, expr(let.value(), Scope.ROOT)));
        loop.add(Py.assign(letSpan, RuntimeNames.LET_OK, Py.bool(letSpan, false)));
        loop.add(destructure(let));
        loop.add(Py.ifStmt(span, letTest(let), block(s.body(), span),
            List.of(Py.assign(letSpan, RuntimeNames.LET_KEEP, Py.bool(letSpan, false)))));
        return List.of(
            Py.assign(letSpan, RuntimeNames.LET_KEEP, Py.bool(letSpan, true)),
            new PyStmt.While(span, Py.load(letSpan, RuntimeNames.LET_KEEP), loop, optionalBlock(s.elseBody(), span)));
    }

    /**
     * <pre>
     * try:
     *     target = __snail_let_value
     *     __snail_let_ok = True
     * except (TypeError, ValueError):
     *     __snail_let_ok = False
     * </pre>
     */
    private PyStmt destructure(LetCondition let) {
        SourceSpan span = let.span();
        PyStmt bind = new PyStmt.Assign(span, List.of(target(let.target(), ExprContext.STORE, Scope.ROOT)),
            Py.load(span, RuntimeNames.LET_VALUE));
        PyExpr errors = Py.tuple(span, List.of(Py.load(span, "TypeError"), Py.load(span, "ValueError")));
        PyExceptHandler handler = new PyExceptHandler(span, errors, null,
            List.of(Py.assign(span, RuntimeNames.LET_OK, Py.bool(span, false))));
        return new PyStmt.Try(span,
            List.of(bind, Py.assign(span, RuntimeNames.LET_OK, Py.bool(span, true))),
            List.of(handler), List.of(), List.of());
    }

    private PyExpr letTest(LetCondition let) {
        PyExpr ok = Py.load(let.span(), RuntimeNames.LET_OK);
        if (let.guard() == null) {
            return ok;
        }
        return Py.and(let.span(), List.of(ok, expr(let.guard(), Scope.ROOT)));
    }

    // ========================================================================
    // lines, files and pattern/action
    // ========================================================================

    /**
     * <pre>
     * import sys
     * __snail_nr = 0
     * for __snail_source_item in sources:
     *     __snail_fnr = 0
     *     with __snail_open_lines_source(__snail_source_item) as (__snail_file, __snail_path):
     *         for __snail_raw in __snail_file:
     *             ... counters, record, fields, user-visible copies ...
     *             body
     * </pre>
     */
    private List<PyStmt> linesLoop(LinesStatement s, Tail tail) {
        SourceSpan span = s.span();
        PyExpr sources = s.sources().isEmpty()
            ? new PyExpr.BoolOp(span, BoolOpKind.OR, List.of(
                argvTail(span), Py.list(span, List.of(Py.str(span, "-")))))
            : sourceList(s.sources(), span);

        List<PyStmt> perLine = new ArrayList<>();
        perLine.add(increment(span, RuntimeNames.NR));
        perLine.add(increment(span, RuntimeNames.FNR));
        perLine.add(Py.assign(span, RuntimeNames.LINE,
            Py.call(span, Py.attribute(span, Py.load(span, RuntimeNames.RAW_LINE), "rstrip"), Py.str(span, "\n"))));
        perLine.add(Py.assign(span, RuntimeNames.FIELDS, Py.call(span, RuntimeNames.AWK_SPLIT,
            Py.load(span, RuntimeNames.LINE),
            Py.load(span, RuntimeNames.AWK_FIELD_SEPARATORS),
            Py.load(span, RuntimeNames.AWK_INCLUDE_WHITESPACE))));
        perLine.add(Py.assign(span, RuntimeNames.NR_USER, Py.load(span, RuntimeNames.NR)));
        perLine.add(Py.assign(span, RuntimeNames.FNR_USER, Py.load(span, RuntimeNames.FNR)));
        perLine.add(Py.assign(span, RuntimeNames.PATH_USER, Py.load(span, RuntimeNames.PATH)));
        perLine.add(Py.assign(span, RuntimeNames.SRC, Py.load(span, RuntimeNames.PATH)));
        perLine.addAll(block(s.body(), tail, span));

        PyStmt lineLoop = new PyStmt.For(span, Py.store(span, RuntimeNames.RAW_LINE),
            Py.load(span, RuntimeNames.FILE), perLine, List.of());
        PyExpr fileAndPath = new PyExpr.Tuple(span,
            List.of(Py.store(span, RuntimeNames.FILE), Py.store(span, RuntimeNames.PATH)), ExprContext.STORE);
        PyWithItem open = new PyWithItem(span,
            Py.call(span, RuntimeNames.OPEN_LINES_SOURCE, Py.load(span, RuntimeNames.SOURCE_ITEM)), fileAndPath);
        List<PyStmt> perSource = List.of(
            Py.assign(span, RuntimeNames.FNR, Py.integer(span, 0)),
            new PyStmt.With(span, List.of(open), List.of(lineLoop)));

        return List.of(
            Py.importModule(span, "sys"),
            Py.assign(span, RuntimeNames.NR, Py.integer(span, 0)),
            new PyStmt.For(span, Py.store(span, RuntimeNames.SOURCE_ITEM), sources, perSource, List.of()));
    }

    /**
     * <pre>
     * import sys
     * __snail_paths = sources
     * __snail_src = __snail_fd = __snail_text = None
     * for __snail_src in __snail_paths:
     *     with __SnailLazyFile(__snail_src, "r") as __snail_fd:
     *         __snail_text = __SnailLazyText(__snail_fd)
     *         body
     * </pre>
     */
    private List<PyStmt> filesLoop(FilesStatement s, Tail tail) {
        SourceSpan span = s.span();
        PyExpr sources = s.sources().isEmpty() ? argvTail(span) : sourceList(s.sources(), span);

        List<PyStmt> perFile = new ArrayList<>();
        perFile.add(Py.assign(span, RuntimeNames.TEXT,
            Py.call(span, RuntimeNames.LAZY_TEXT, Py.load(span, RuntimeNames.FD))));
        perFile.addAll(block(s.body(), tail, span));
        PyWithItem open = new PyWithItem(span,
            Py.call(span, RuntimeNames.LAZY_FILE, Py.load(span, RuntimeNames.SRC), Py.str(span, "r")),
            Py.store(span, RuntimeNames.FD));

        return List.of(
            Py.importModule(span, "sys"),
            Py.assign(span, RuntimeNames.PATHS, sources),
            Py.assign(span, RuntimeNames.SRC, Py.none(span)),
            Py.assign(span, RuntimeNames.FD, Py.none(span)),
            Py.assign(span, RuntimeNames.TEXT, Py.none(span)),
            new PyStmt.For(span, Py.store(span, RuntimeNames.SRC), Py.load(span, RuntimeNames.PATHS),
                List.of(new PyStmt.With(span, List.of(open), perFile)), List.of()));
    }

    /** {@code sys.argv[1:]} */
    private static PyExpr argvTail(SourceSpan span) {
        return Py.subscript(span, Py.attribute(span, Py.load(span, "sys"), "argv"),
            new PyExpr.Slice(span, Py.integer(span, 1), null, null));
    }

    /** A single source may itself be a collection, so it goes through the runtime's normalisation. */
    private PyExpr sourceList(List<Expression> sources, SourceSpan span) {
        if (sources.size() == 1) {
            return Py.call(span, RuntimeNames.NORMALIZE_SOURCES, expr(sources.get(0), Scope.ROOT));
        }
        return Py.list(span, exprs(sources, Scope.ROOT));
    }

    private static PyStmt increment(SourceSpan span, String name) {
        return Py.assign(span, name, new PyExpr.BinOp(span, Py.load(span, name), Operator.ADD, Py.integer(span, 1)));
    }

    private List<PyStmt> patternAction(PatternActionStatement s, Tail tail) {
        SourceSpan span = s.span();
        List<PyStmt> action = s.action() == null
            ? List.of(Py.expr(Py.call(span, "print", Py.load(span, RuntimeNames.LINE))))
            : block(s.action(), tail, span);
        Expression pattern = s.pattern();
        if (pattern == null) {
            return action;
        }
        if (pattern instanceof RegexLiteral || pattern instanceof RegexMatchExpression) {
            PyExpr search;
            SourceSpan patternSpan = pattern.span();
            if (pattern instanceof RegexMatchExpression match) {
                search = regexSearch(expr(match.value(), Scope.ROOT), match.pattern(), patternSpan, Scope.ROOT);
            } else {
                search = regexSearch(Py.load(patternSpan, RuntimeNames.LINE), (RegexLiteral) pattern, patternSpan, Scope.ROOT);
            }
            return List.of(
                Py.assign(patternSpan, RuntimeNames.MATCH, search),
                Py.ifStmt(span, Py.load(patternSpan, RuntimeNames.MATCH), action, List.of()));
        }
        return List.of(Py.ifStmt(span, expr(pattern, Scope.ROOT), action, List.of()));
    }

    // ========================================================================
    // Targets and parameters
    // ========================================================================

    private PyExpr target(AssignTarget target, ExprContext ctx, Scope scope) {
        SourceSpan span = target.span();
        if (target instanceof NameTarget t) {
            return new PyExpr.Name(span, t.name(), ctx);
        } else if (target instanceof AttributeTarget t) {
            return new PyExpr.Attribute(span, expr(t.object(), scope), t.attribute(), ctx);
        } else if (target instanceof IndexTarget t) {
            return new PyExpr.Subscript(span, expr(t.object(), scope), expr(t.index(), scope), ctx);
        } else if (target instanceof StarredTarget t) {
            return new PyExpr.Starred(span, target(t.target(), ctx, scope), ctx);
        } else if (target instanceof TupleTarget t) {
            return new PyExpr.Tuple(span, targets(t.elements(), ctx, scope), ctx);
        } else if (target instanceof ListTarget t) {
            return new PyExpr.List(span, targets(t.elements(), ctx, scope), ctx);
        }
        throw new LoweringException("unsupported assignment target: " + target.type(), span);
    }

    private List<PyExpr> targets(List<AssignTarget> targets, ExprContext ctx, Scope scope) {
        List<PyExpr> out = new ArrayList<>();
        for (AssignTarget target : targets) {
            out.add(target(target, ctx, scope));
        }
        return out;
    }

    private PyArguments parameters(List<Parameter> params, Scope scope, SourceSpan span) {
        List<PyArg> args = new ArrayList<>();
        List<PyExpr> defaults = new ArrayList<>();
        PyArg vararg = null;
        PyArg kwarg = null;
        for (Parameter param : params) {
            PyArg arg = new PyArg(param.span(), param.name());
            switch (param.kind()) {
                case REGULAR -> {
                    args.add(arg);
                    if (param.defaultValue() != null) {
                        defaults.add(expr(param.defaultValue(), scope));
                    }
                }
                case VAR_ARGS -> vararg = arg;
                case KW_ARGS -> kwarg = arg;
            }
        }
        return new PyArguments(span, args, vararg, kwarg, defaults);
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private PyExpr optionalExpr(Expression expr, Scope scope) {
        return expr == null ? null : expr(expr, scope);
    }

    private List<PyExpr> exprs(List<Expression> list, Scope scope) {
        List<PyExpr> out = new ArrayList<>();
        for (Expression expr : list) {
            out.add(expr(expr, scope));
        }
        return out;
    }

    private PyExpr expr(Expression expr, Scope scope) {
        SourceSpan span = expr.span();
        if (expr instanceof Identifier e) {
            return identifier(e, scope);
        } else if (expr instanceof Placeholder) {
            return scope.placeholder() != null ? scope.placeholder() : Py.load(span, "_");
        } else if (expr instanceof FieldIndex e) {
            return field(e);
        } else if (expr instanceof NumberLiteral e) {
            return Py.constant(span, number(e));
        } else if (expr instanceof StringLiteral e) {
            return Py.constant(span, e.bytes() ? new PyBytes(e.value()) : e.value());
        } else if (expr instanceof FormattedString e) {
            PyExpr joined = new PyExpr.JoinedStr(span, parts(e.parts(), scope));
            return e.bytes() ? Py.call(span, Py.attribute(span, joined, "encode")) : joined;
        } else if (expr instanceof BooleanLiteral e) {
            return Py.bool(span, e.value());
        } else if (expr instanceof NoneLiteral) {
            return Py.none(span);
        } else if (expr instanceof UnaryExpression e) {
            return new PyExpr.UnaryOp(span, UnaryOpKind.of(e.operator()), expr(e.operand(), scope));
        } else if (expr instanceof BinaryExpression e) {
            return binary(e, scope);
        } else if (expr instanceof CompareExpression e) {
            return compare(e, scope);
        } else if (expr instanceof ConditionalExpression e) {
            return new PyExpr.IfExp(span, expr(e.test(), scope), expr(e.body(), scope), expr(e.orElse(), scope));
        } else if (expr instanceof CallExpression e) {
            return call(expr(e.callee(), scope), e.arguments(), span, scope);
        } else if (expr instanceof AttributeExpression e) {
            return Py.attribute(span, expr(e.object(), scope), e.attribute());
        } else if (expr instanceof IndexExpression e) {
            return Py.subscript(span, expr(e.object(), scope), expr(e.index(), scope));
        } else if (expr instanceof SliceExpression e) {
            return new PyExpr.Slice(span, optionalExpr(e.lower(), scope), optionalExpr(e.upper(), scope), null);
        } else if (expr instanceof ListExpression e) {
            return Py.list(span, exprs(e.elements(), scope));
        } else if (expr instanceof TupleExpression e) {
            return Py.tuple(span, exprs(e.elements(), scope));
        } else if (expr instanceof SetExpression e) {
            return new PyExpr.Set(span, exprs(e.elements(), scope));
        } else if (expr instanceof DictExpression e) {
            List<PyExpr> keys = new ArrayList<>();
            List<PyExpr> values = new ArrayList<>();
            for (DictEntry entry : e.entries()) {
                keys.add(expr(entry.key(), scope));
                values.add(expr(entry.value(), scope));
            }
            return new PyExpr.Dict(span, keys, values);
        } else if (expr instanceof ListComprehension e) {
            return new PyExpr.ListComp(span, expr(e.element(), scope),
                List.of(comprehension(e.target(), e.iter(), e.conditions(), span, scope)));
        } else if (expr instanceof DictComprehension e) {
            return new PyExpr.DictComp(span, expr(e.key(), scope), expr(e.value(), scope),
                List.of(comprehension(e.target(), e.iter(), e.conditions(), span, scope)));
        } else if (expr instanceof LambdaExpression e) {
            return lambda(e, scope);
        } else if (expr instanceof YieldExpression e) {
            return new PyExpr.Yield(span, optionalExpr(e.value(), scope));
        } else if (expr instanceof YieldFromExpression e) {
            return new PyExpr.YieldFrom(span, expr(e.value(), scope));
        } else if (expr instanceof TryExpression e) {
            return compactTry(e, scope);
        } else if (expr instanceof SubprocessExpression e) {
            return Py.call(span, subprocess(e, scope));
        } else if (expr instanceof RegexLiteral e) {
            return Py.call(span, RuntimeNames.REGEX_COMPILE, regexPattern(e, scope));
        } else if (expr instanceof RegexMatchExpression e) {
            return regexSearch(expr(e.value(), scope), e.pattern(), span, scope);
        } else if (expr instanceof StructuredAccessor e) {
            return Py.call(span, RuntimeNames.JMESPATH_QUERY, Py.str(span, e.query()));
        } else if (expr instanceof CompoundExpression e) {
            return Py.lastOf(span, exprs(e.expressions(), scope));
        } else if (expr instanceof AugAssignExpression e) {
            return augAssign(e, scope);
        } else if (expr instanceof UpdateExpression e) {
            return update(e, scope);
        }
        throw new LoweringException("unsupported expression: " + expr.type(), span);
    }

    private static PyExpr identifier(Identifier id, Scope scope) {
        String name = id.name();
        if (name.equals("$e")) {
            if (scope.exceptionName() == null) {
                throw new LoweringException(EXCEPTION_NAME_MESSAGE, id.span());
            }
            return Py.load(id.span(), scope.exceptionName());
        }
        String special = RuntimeNames.specialVariable(name);
        return Py.load(id.span(), special != null ? special : name);
    }

    /** {@code $0} is the whole record, {@code $N} the N-th field. */
    private static PyExpr field(FieldIndex field) {
        SourceSpan span = field.span();
        BigInteger index = new BigInteger(field.digits());
        if (index.signum() == 0) {
            return Py.load(span, RuntimeNames.LINE);
        }
        return Py.subscript(span, Py.load(span, RuntimeNames.FIELDS), Py.constant(span, index.subtract(BigInteger.ONE)));
    }

    /**
     * Numeric value of a literal: {@code BigInteger} for integers in any base, {@code Double} for floats,
     * {@link PyComplex} for imaginary literals.
     */
    static Object number(NumberLiteral literal) {
        String text = literal.raw().replace("_", "");
        String lower = text.toLowerCase();
        try {
            if (lower.endsWith("j")) {
                return new PyComplex(Double.parseDouble(text.substring(0, text.length() - 1)));
            }
            if (lower.startsWith("0x")) {
                return new BigInteger(text.substring(2), 16);
            }
            if (lower.startsWith("0o")) {
                return new BigInteger(text.substring(2), 8);
            }
            if (lower.startsWith("0b")) {
                return new BigInteger(text.substring(2), 2);
            }
            if (lower.contains(".") || lower.contains("e")) {
                return Double.parseDouble(text);
            }
            return new BigInteger(text);
        } catch (NumberFormatException ex) {
            throw new LoweringException("invalid number literal: " + literal.raw(), literal.span());
        }
    }

    private List<PyExpr> parts(List<FStringPart> parts, Scope scope) {
        List<PyExpr> values = new ArrayList<>();
        for (FStringPart part : parts) {
            if (part instanceof TextPart text) {
                values.add(Py.str(SourceSpan.NONE, text.text()));
            } else {
                InterpolationPart interpolation = (InterpolationPart) part;
                PyExpr spec = interpolation.formatSpec() == null
                    ? null
                    : new PyExpr.JoinedStr(interpolation.span(), parts(interpolation.formatSpec(), scope));
                values.add(new PyExpr.FormattedValue(interpolation.span(), expr(interpolation.expression(), scope),
                    interpolation.conversion().code(), spec));
            }
        }
        return values;
    }

    private PyExpr binary(BinaryExpression e, Scope scope) {
        SourceSpan span = e.span();
        switch (e.operator()) {
            case OR, AND -> {
                BoolOpKind kind = e.operator() == BinaryOperator.OR ? BoolOpKind.OR : BoolOpKind.AND;
                List<PyExpr> values = new ArrayList<>();
                flattenBoolean(e, e.operator(), values, scope);
                return new PyExpr.BoolOp(span, kind, values);
            }
            case PIPELINE -> {
                return pipeline(e, scope);
            }
            default -> {
                return new PyExpr.BinOp(span, expr(e.left(), scope), Operator.of(e.operator()), expr(e.right(), scope));
            }
        }
    }

    // a or b or c is one BoolOp with three values
    private void flattenBoolean(Expression expr, BinaryOperator op, List<PyExpr> values, Scope scope) {
        if (expr instanceof BinaryExpression b && b.operator() == op) {
            flattenBoolean(b.left(), op, values, scope);
            flattenBoolean(b.right(), op, values, scope);
        } else {
            values.add(expr(expr, scope));
        }
    }

    /**
     * {@code x | f(a, _)} substitutes {@code x} for the placeholder; {@code x | f(a)} and any
     * non-call right side become {@code rhs(x)}; {@code x | $(cmd)} feeds {@code x} to the command's stdin.
     */
    private PyExpr pipeline(BinaryExpression e, Scope scope) {
        SourceSpan span = e.span();
        Expression right = e.right();
        if (right instanceof CallExpression call) {
            List<Placeholder> placeholders = new ArrayList<>();
            for (Argument argument : call.arguments()) {
                Expressions.collectPlaceholders(argument.value(), placeholders);
            }
            if (placeholders.size() > 1) {
                throw new LoweringException(PLACEHOLDER_MESSAGE, placeholders.get(0).span());
            }
            if (placeholders.size() == 1) {
                PyExpr left = expr(e.left(), scope);
                return call(expr(call.callee(), scope), call.arguments(), call.span(), scope.withPlaceholder(left));
            }
        }
        PyExpr left = expr(e.left(), scope);
        PyExpr callee = right instanceof SubprocessExpression subprocess
            ? subprocess(subprocess, scope)
            : expr(right, scope);
        return Py.call(span, callee, left);
    }

    private PyExpr call(PyExpr func, List<Argument> arguments, SourceSpan span, Scope scope) {
        List<PyExpr> args = new ArrayList<>();
        List<PyKeyword> keywords = new ArrayList<>();
        for (Argument argument : arguments) {
            PyExpr value = expr(argument.value(), scope);
            switch (argument.kind()) {
                case POSITIONAL -> args.add(value);
                case STAR -> args.add(new PyExpr.Starred(argument.span(), value, ExprContext.LOAD));
                case KEYWORD -> keywords.add(new PyKeyword(argument.span(), argument.name(), value));
                case KWSTAR -> keywords.add(new PyKeyword(argument.span(), null, value));
            }
        }
        return new PyExpr.Call(span, func, args, keywords);
    }

    /**
     * A single comparison maps directly. A chain binds each operand to a walrus temporary so it is
     * evaluated once, and joins the pairwise tests with {@code and}.
     */
    private PyExpr compare(CompareExpression e, Scope scope) {
        SourceSpan span = e.span();
        List<CompareOperator> ops = e.operators();
        if (ops.size() == 1) {
            return comparePair(expr(e.left(), scope), ops.get(0), expr(e.comparators().get(0), scope), span);
        }
        List<PyExpr> tests = new ArrayList<>();
        PyExpr left = Py.walrus(span, RuntimeNames.COMPARE_LEFT, expr(e.left(), scope));
        for (int i = 0; i < ops.size(); i++) {
            if (i > 0) {
                left = Py.walrus(span, RuntimeNames.COMPARE_LEFT, Py.load(span, RuntimeNames.COMPARE_RIGHT));
            }
            PyExpr right = Py.walrus(span, RuntimeNames.COMPARE_RIGHT, expr(e.comparators().get(i), scope));
            tests.add(comparePair(left, ops.get(i), right, span));
        }
        return Py.and(span, tests);
    }

    private static PyExpr comparePair(PyExpr left, CompareOperator op, PyExpr right, SourceSpan span) {
        return switch (op) {
            case IN -> Py.call(span, RuntimeNames.CONTAINS, left, right);
            case NOT_IN -> Py.call(span, RuntimeNames.CONTAINS_NOT, left, right);
            default -> new PyExpr.Compare(span, left, List.of(CmpOp.of(op)), List.of(right));
        };
    }

    private PyComprehension comprehension(AssignTarget target, Expression iter, List<Expression> conditions,
                                          SourceSpan span, Scope scope) {
        return new PyComprehension(span, target(target, ExprContext.STORE, scope), expr(iter, scope),
            exprs(conditions, scope));
    }

    /**
     * Expression-only bodies: one expression is the lambda body, several become
     * {@code (e1, ..., en)[-1]}, none is {@code None}.
     */
    private PyExpr lambda(LambdaExpression e, Scope scope) {
        SourceSpan span = e.span();
        List<PyExpr> values = new ArrayList<>();
        for (Statement stmt : e.body()) {
            if (!(stmt instanceof ExpressionStatement s)) {
                throw new LoweringException("def expression bodies must contain only expression statements", stmt.span());
            }
            values.add(expr(s.expression(), scope));
        }
        PyExpr body;
        if (values.isEmpty()) {
            body = Py.none(span);
        } else if (values.size() == 1) {
            body = values.get(0);
        } else {
            body = Py.lastOf(span, values);
        }
        return new PyExpr.Lambda(span, parameters(e.params(), scope, span), body);
    }

    /**
     * {@code expr?} is {@code __snail_compact_try(lambda: expr)}; a fallback adds
     * {@code lambda __snail_compact_exc: fallback}, inside which {@code $e} names the exception.
     */
    private PyExpr compactTry(TryExpression e, Scope scope) {
        SourceSpan span = e.span();
        PyExpr body = Py.lambda(span, expr(e.body(), scope));
        if (e.fallback() == null) {
            return Py.call(span, RuntimeNames.COMPACT_TRY, body);
        }
        PyExpr fallback = expr(e.fallback(), scope.withException(RuntimeNames.COMPACT_EXCEPTION));
        return Py.call(span, RuntimeNames.COMPACT_TRY, body,
            Py.lambda(e.fallback().span(), fallback, RuntimeNames.COMPACT_EXCEPTION));
    }

    /** The command object, {@code __SnailSubprocessCapture(f"...")}, not yet called. */
    private PyExpr subprocess(SubprocessExpression e, Scope scope) {
        String helper = e.kind() == SubprocessKind.CAPTURE
            ? RuntimeNames.SUBPROCESS_CAPTURE
            : RuntimeNames.SUBPROCESS_STATUS;
        return Py.call(e.span(), helper, new PyExpr.JoinedStr(e.span(), parts(e.parts(), scope)));
    }

    private PyExpr regexPattern(RegexLiteral regex, Scope scope) {
        if (!regex.isInterpolated()) {
            return Py.str(regex.span(), regex.literalText());
        }
        return new PyExpr.JoinedStr(regex.span(), parts(regex.parts(), scope));
    }

    private PyExpr regexSearch(PyExpr value, RegexLiteral pattern, SourceSpan span, Scope scope) {
        return Py.call(span, RuntimeNames.REGEX_SEARCH, value, regexPattern(pattern, scope));
    }

    /**
     * Names become {@code (x := x op v)}; attributes and indexes go through runtime helpers that
     * receive the operator symbol.
     */
    private PyExpr augAssign(AugAssignExpression e, Scope scope) {
        SourceSpan span = e.span();
        AssignTarget target = e.target();
        PyExpr value = expr(e.value(), scope);
        String symbol = e.operator().binary().symbol();
        if (target instanceof NameTarget t) {
            PyExpr combined = new PyExpr.BinOp(span, Py.load(t.span(), t.name()),
                Operator.of(e.operator().binary()), value);
            return Py.walrus(span, t.name(), combined);
        } else if (target instanceof AttributeTarget t) {
            return Py.call(span, RuntimeNames.AUG_ATTR, expr(t.object(), scope), Py.str(span, t.attribute()),
                value, Py.str(span, symbol));
        } else if (target instanceof IndexTarget t) {
            return Py.call(span, RuntimeNames.AUG_INDEX, expr(t.object(), scope), expr(t.index(), scope),
                value, Py.str(span, symbol));
        }
        throw new LoweringException("augmented assignment target must be a name, attribute, or index", span);
    }

    private PyExpr update(UpdateExpression e, Scope scope) {
        SourceSpan span = e.span();
        AssignTarget target = e.target();
        boolean increment = e.operator().equals("++");
        if (target instanceof NameTarget t) {
            PyExpr updated = Py.walrus(span, t.name(), new PyExpr.BinOp(span, Py.load(span, t.name()),
                increment ? Operator.ADD : Operator.SUB, Py.integer(span, 1)));
            if (e.prefix()) {
                return updated;
            }
            // ((tmp := x), (x := tmp + 1), tmp)[-1]
            PyExpr saved = Py.walrus(span, RuntimeNames.INCR_TMP, Py.load(span, t.name()));
            PyExpr fromSaved = Py.walrus(span, t.name(), new PyExpr.BinOp(span, Py.load(span, RuntimeNames.INCR_TMP),
                increment ? Operator.ADD : Operator.SUB, Py.integer(span, 1)));
            return Py.lastOf(span, List.of(saved, fromSaved, Py.load(span, RuntimeNames.INCR_TMP)));
        }
        PyExpr delta = Py.integer(span, increment ? 1 : -1);
        PyExpr pre = Py.bool(span, e.prefix());
        if (target instanceof AttributeTarget t) {
            return Py.call(span, RuntimeNames.INCR_ATTR, expr(t.object(), scope), Py.str(span, t.attribute()), delta, pre);
        } else if (target instanceof IndexTarget t) {
            return Py.call(span, RuntimeNames.INCR_INDEX, expr(t.object(), scope), expr(t.index(), scope), delta, pre);
        }
        throw new LoweringException("increment/decrement target must be a name, attribute, or index", span);
    }
}
