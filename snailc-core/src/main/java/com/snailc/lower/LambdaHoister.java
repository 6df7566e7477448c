package com.snailc.lower;

import com.snailc.ast.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites lambdas that Python's {@code lambda} cannot express into named functions.
 * Each such lambda becomes {@code def __snail_lambda_N(params): body} (with an implicit return of
 * its final expression), inserted just before the statement that used it, and the lambda itself
 * is replaced by the function name. Every other node is copied unchanged.
 */
public final class LambdaHoister {
    private static final Logger LOG = LoggerFactory.getLogger(LambdaHoister.class);

    private final LambdaNames names;

    public LambdaHoister(LambdaNames names) {
        this.names = names;
    }

    public Program hoist(Program program) {
        return new Program(program.span(), block(program.body()));
    }

    public List<Statement> block(List<Statement> body) {
        if (body == null) {
            return null;
        }
        List<Statement> out = new ArrayList<>();
        for (Statement stmt : body) {
            List<Statement> prelude = new ArrayList<>();
            Statement rewritten = statement(stmt, prelude);
            out.addAll(prelude);
            out.add(rewritten);
        }
        return out;
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private Statement statement(Statement stmt, List<Statement> prelude) {
        if (stmt instanceof ExpressionStatement s) {
            return new ExpressionStatement(s.span(), expr(s.expression(), prelude), s.semicolonTerminated());
        } else if (stmt instanceof AssignStatement s) {
            List<AssignTarget> targets = new ArrayList<>();
            for (AssignTarget target : s.targets()) {
                targets.add(target(target, prelude));
            }
            return new AssignStatement(s.span(), targets, expr(s.value(), prelude));
        } else if (stmt instanceof IfStatement s) {
            Condition condition = condition(s.condition(), prelude);
            List<Statement> body = block(s.body());
            List<ElifClause> elifs = new ArrayList<>();
            for (ElifClause elif : s.elifs()) {
                elifs.add(new ElifClause(elif.span(), condition(elif.condition(), prelude), block(elif.body())));
            }
            return new IfStatement(s.span(), condition, body, elifs, block(s.elseBody()));
        } else if (stmt instanceof WhileStatement s) {
            return new WhileStatement(s.span(), condition(s.condition(), prelude), block(s.body()), block(s.elseBody()));
        } else if (stmt instanceof ForStatement s) {
            return new ForStatement(s.span(), target(s.target(), prelude), expr(s.iter(), prelude),
                block(s.body()), block(s.elseBody()));
        } else if (stmt instanceof DefStatement s) {
            return new DefStatement(s.span(), s.name(), params(s.params(), prelude), block(s.body()));
        } else if (stmt instanceof ClassStatement s) {
            return new ClassStatement(s.span(), s.name(), block(s.body()));
        } else if (stmt instanceof TryStatement s) {
            List<ExceptHandler> handlers = new ArrayList<>();
            for (ExceptHandler handler : s.handlers()) {
                handlers.add(new ExceptHandler(handler.span(), expr(handler.exceptionType(), prelude),
                    handler.name(), block(handler.body())));
            }
            return new TryStatement(s.span(), block(s.body()), handlers, block(s.elseBody()), block(s.finallyBody()));
        } else if (stmt instanceof WithStatement s) {
            List<WithItem> items = new ArrayList<>();
            for (WithItem item : s.items()) {
                items.add(new WithItem(item.span(), expr(item.context(), prelude), target(item.target(), prelude)));
            }
            return new WithStatement(s.span(), items, block(s.body()));
        } else if (stmt instanceof ReturnStatement s) {
            return new ReturnStatement(s.span(), expr(s.value(), prelude));
        } else if (stmt instanceof RaiseStatement s) {
            return new RaiseStatement(s.span(), expr(s.value(), prelude), expr(s.cause(), prelude));
        } else if (stmt instanceof AssertStatement s) {
            return new AssertStatement(s.span(), expr(s.test(), prelude), expr(s.message(), prelude));
        } else if (stmt instanceof DeleteStatement s) {
            List<AssignTarget> targets = new ArrayList<>();
            for (AssignTarget target : s.targets()) {
                targets.add(target(target, prelude));
            }
            return new DeleteStatement(s.span(), targets);
        } else if (stmt instanceof LinesStatement s) {
            return new LinesStatement(s.span(), exprs(s.sources(), prelude), block(s.body()));
        } else if (stmt instanceof FilesStatement s) {
            return new FilesStatement(s.span(), exprs(s.sources(), prelude), block(s.body()));
        } else if (stmt instanceof PatternActionStatement s) {
            return new PatternActionStatement(s.span(), expr(s.pattern(), prelude), block(s.action()));
        }
        // break, continue, pass and imports
        return stmt;
    }

    private Condition condition(Condition condition, List<Statement> prelude) {
        if (condition instanceof LetCondition c) {
            return new LetCondition(c.span(), target(c.target(), prelude), expr(c.value(), prelude),
                expr(c.guard(), prelude));
        }
        ExpressionCondition c = (ExpressionCondition) condition;
        return new ExpressionCondition(c.span(), expr(c.expression(), prelude));
    }

    private List<Parameter> params(List<Parameter> params, List<Statement> prelude) {
        List<Parameter> out = new ArrayList<>();
        for (Parameter param : params) {
            out.add(new Parameter(param.span(), param.kind(), param.name(), expr(param.defaultValue(), prelude)));
        }
        return out;
    }

    private AssignTarget target(AssignTarget target, List<Statement> prelude) {
        if (target instanceof AttributeTarget t) {
            return new AttributeTarget(t.span(), expr(t.object(), prelude), t.attribute());
        } else if (target instanceof IndexTarget t) {
            return new IndexTarget(t.span(), expr(t.object(), prelude), expr(t.index(), prelude));
        } else if (target instanceof StarredTarget t) {
            return new StarredTarget(t.span(), target(t.target(), prelude));
        } else if (target instanceof TupleTarget t) {
            return new TupleTarget(t.span(), targets(t.elements(), prelude));
        } else if (target instanceof ListTarget t) {
            return new ListTarget(t.span(), targets(t.elements(), prelude));
        }
        return target;
    }

    private List<AssignTarget> targets(List<AssignTarget> targets, List<Statement> prelude) {
        List<AssignTarget> out = new ArrayList<>();
        for (AssignTarget target : targets) {
            out.add(target(target, prelude));
        }
        return out;
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private List<Expression> exprs(List<Expression> list, List<Statement> prelude) {
        List<Expression> out = new ArrayList<>();
        for (Expression expr : list) {
            out.add(expr(expr, prelude));
        }
        return out;
    }

    private Expression expr(Expression expr, List<Statement> prelude) {
        if (expr == null || !Expressions.containsComplexLambda(expr)) {
            return expr;
        }
        if (expr instanceof LambdaExpression e) {
            return hoistLambda(e, prelude);
        } else if (expr instanceof FormattedString e) {
            return new FormattedString(e.span(), parts(e.parts(), prelude), e.bytes());
        } else if (expr instanceof RegexLiteral e) {
            return regex(e, prelude);
        } else if (expr instanceof SubprocessExpression e) {
            return new SubprocessExpression(e.span(), e.kind(), parts(e.parts(), prelude));
        } else if (expr instanceof UnaryExpression e) {
            return new UnaryExpression(e.span(), e.operator(), expr(e.operand(), prelude));
        } else if (expr instanceof BinaryExpression e) {
            return new BinaryExpression(e.span(), expr(e.left(), prelude), e.operator(), expr(e.right(), prelude));
        } else if (expr instanceof CompareExpression e) {
            return new CompareExpression(e.span(), expr(e.left(), prelude), e.operators(), exprs(e.comparators(), prelude));
        } else if (expr instanceof ConditionalExpression e) {
            return new ConditionalExpression(e.span(), expr(e.body(), prelude), expr(e.test(), prelude),
                expr(e.orElse(), prelude));
        } else if (expr instanceof CallExpression e) {
            List<Argument> arguments = new ArrayList<>();
            for (Argument argument : e.arguments()) {
                arguments.add(new Argument(argument.span(), argument.kind(), argument.name(),
                    expr(argument.value(), prelude)));
            }
            return new CallExpression(e.span(), expr(e.callee(), prelude), arguments);
        } else if (expr instanceof AttributeExpression e) {
            return new AttributeExpression(e.span(), expr(e.object(), prelude), e.attribute());
        } else if (expr instanceof IndexExpression e) {
            return new IndexExpression(e.span(), expr(e.object(), prelude), expr(e.index(), prelude));
        } else if (expr instanceof SliceExpression e) {
            return new SliceExpression(e.span(), expr(e.lower(), prelude), expr(e.upper(), prelude));
        } else if (expr instanceof ListExpression e) {
            return new ListExpression(e.span(), exprs(e.elements(), prelude));
        } else if (expr instanceof TupleExpression e) {
            return new TupleExpression(e.span(), exprs(e.elements(), prelude));
        } else if (expr instanceof SetExpression e) {
            return new SetExpression(e.span(), exprs(e.elements(), prelude));
        } else if (expr instanceof DictExpression e) {
            List<DictEntry> entries = new ArrayList<>();
            for (DictEntry entry : e.entries()) {
                entries.add(new DictEntry(entry.span(), expr(entry.key(), prelude), expr(entry.value(), prelude)));
            }
            return new DictExpression(e.span(), entries);
        } else if (expr instanceof ListComprehension e) {
            return new ListComprehension(e.span(), expr(e.element(), prelude), target(e.target(), prelude),
                expr(e.iter(), prelude), exprs(e.conditions(), prelude));
        } else if (expr instanceof DictComprehension e) {
            return new DictComprehension(e.span(), expr(e.key(), prelude), expr(e.value(), prelude),
                target(e.target(), prelude), expr(e.iter(), prelude), exprs(e.conditions(), prelude));
        } else if (expr instanceof YieldExpression e) {
            return new YieldExpression(e.span(), expr(e.value(), prelude));
        } else if (expr instanceof YieldFromExpression e) {
            return new YieldFromExpression(e.span(), expr(e.value(), prelude));
        } else if (expr instanceof TryExpression e) {
            return new TryExpression(e.span(), expr(e.body(), prelude), expr(e.fallback(), prelude));
        } else if (expr instanceof RegexMatchExpression e) {
            return new RegexMatchExpression(e.span(), expr(e.value(), prelude), regex(e.pattern(), prelude));
        } else if (expr instanceof CompoundExpression e) {
            return new CompoundExpression(e.span(), exprs(e.expressions(), prelude));
        } else if (expr instanceof AugAssignExpression e) {
            return new AugAssignExpression(e.span(), target(e.target(), prelude), e.operator(), expr(e.value(), prelude));
        } else if (expr instanceof UpdateExpression e) {
            return new UpdateExpression(e.span(), e.operator(), e.prefix(), target(e.target(), prelude));
        }
        return expr;
    }

    private RegexLiteral regex(RegexLiteral regex, List<Statement> prelude) {
        return new RegexLiteral(regex.span(), parts(regex.parts(), prelude));
    }

    private List<FStringPart> parts(List<FStringPart> parts, List<Statement> prelude) {
        if (parts == null) {
            return null;
        }
        List<FStringPart> out = new ArrayList<>();
        for (FStringPart part : parts) {
            if (part instanceof InterpolationPart p) {
                out.add(new InterpolationPart(p.span(), expr(p.expression(), prelude), p.conversion(),
                    parts(p.formatSpec(), prelude)));
            } else {
                out.add(part);
            }
        }
        return out;
    }

    private Expression hoistLambda(LambdaExpression lambda, List<Statement> prelude) {
        if (!Expressions.requiresDef(lambda)) {
            return lambda;
        }
        List<Parameter> params = params(lambda.params(), prelude);
        List<Statement> body = withImplicitReturn(block(lambda.body()));
        String name = names.next();
        LOG.trace("Hoisting lambda at offset {} into {}", lambda.start(), name);
        prelude.add(new DefStatement(lambda.span(), name, params, body));
        return new Identifier(lambda.span(), name);
    }

    private static List<Statement> withImplicitReturn(List<Statement> body) {
        if (body.isEmpty()) {
            return body;
        }
        Statement last = body.get(body.size() - 1);
        if (last instanceof ExpressionStatement s && !s.semicolonTerminated()) {
            body.set(body.size() - 1, new ReturnStatement(s.span(), s.expression()));
        }
        return body;
    }
}
