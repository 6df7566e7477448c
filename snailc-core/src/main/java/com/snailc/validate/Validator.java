package com.snailc.validate;

import com.snailc.ast.*;

import java.util.List;

/**
 * Checks reserved-name use and generator placement. The active mode and function context
 * are passed down explicitly; {@code lines} and {@code files} bodies re-scope the mode.
 * The first violation in source order is reported.
 */
public final class Validator {
    private static final String AWK_MESSAGE = "awk variables are only valid in awk mode; use --awk";
    private static final String MAP_MESSAGE = "map variables are only valid in map mode; use --map";
    private static final String YIELD_MESSAGE = "yield expressions are only allowed inside function bodies";

    /**
     * @param mode        reserved names in scope
     * @param inFunction  directly inside a def or lambda body
     */
    private record Scope(ValidationMode mode, boolean inFunction) {
        Scope withMode(ValidationMode newMode) {
            return new Scope(newMode, inFunction);
        }

        Scope withFunction(boolean function) {
            return new Scope(mode, function);
        }
    }

    private Validator() {
    }

    public static void validate(Program program, ValidationMode mode) {
        statements(program.body(), new Scope(mode, false));
    }

    // ========================================================================
    // Statements
    // ========================================================================

    private static void statements(List<Statement> body, Scope scope) {
        if (body == null) {
            return;
        }
        for (Statement statement : body) {
            statement(statement, scope);
        }
    }

    private static void statement(Statement stmt, Scope scope) {
        if (stmt instanceof ExpressionStatement s) {
            expression(s.expression(), scope);
        } else if (stmt instanceof AssignStatement s) {
            for (AssignTarget target : s.targets()) {
                target(target, scope);
            }
            expression(s.value(), scope);
        } else if (stmt instanceof IfStatement s) {
            condition(s.condition(), scope);
            statements(s.body(), scope);
            for (ElifClause elif : s.elifs()) {
                condition(elif.condition(), scope);
                statements(elif.body(), scope);
            }
            statements(s.elseBody(), scope);
        } else if (stmt instanceof WhileStatement s) {
            condition(s.condition(), scope);
            statements(s.body(), scope);
            statements(s.elseBody(), scope);
        } else if (stmt instanceof ForStatement s) {
            target(s.target(), scope);
            expression(s.iter(), scope);
            statements(s.body(), scope);
            statements(s.elseBody(), scope);
        } else if (stmt instanceof DefStatement s) {
            parameters(s.params(), scope);
            statements(s.body(), scope.withFunction(true));
        } else if (stmt instanceof ClassStatement s) {
            statements(s.body(), scope.withFunction(false));
        } else if (stmt instanceof TryStatement s) {
            statements(s.body(), scope);
            for (ExceptHandler handler : s.handlers()) {
                expression(handler.exceptionType(), scope);
                statements(handler.body(), scope);
            }
            statements(s.elseBody(), scope);
            statements(s.finallyBody(), scope);
        } else if (stmt instanceof WithStatement s) {
            for (WithItem item : s.items()) {
                expression(item.context(), scope);
                target(item.target(), scope);
            }
            statements(s.body(), scope);
        } else if (stmt instanceof ReturnStatement s) {
            expression(s.value(), scope);
        } else if (stmt instanceof RaiseStatement s) {
            expression(s.value(), scope);
            expression(s.cause(), scope);
        } else if (stmt instanceof AssertStatement s) {
            expression(s.test(), scope);
            expression(s.message(), scope);
        } else if (stmt instanceof DeleteStatement s) {
            for (AssignTarget target : s.targets()) {
                target(target, scope);
            }
        } else if (stmt instanceof LinesStatement s) {
            expressions(s.sources(), scope);
            statements(s.body(), scope.withMode(ValidationMode.AWK));
        } else if (stmt instanceof FilesStatement s) {
            expressions(s.sources(), scope);
            statements(s.body(), scope.withMode(ValidationMode.MAP));
        } else if (stmt instanceof PatternActionStatement s) {
            expression(s.pattern(), scope);
            statements(s.action(), scope);
        }
        // break, continue, pass and imports hold no expressions
    }

    private static void condition(Condition condition, Scope scope) {
        if (condition instanceof ExpressionCondition c) {
            expression(c.expression(), scope);
        } else if (condition instanceof LetCondition c) {
            target(c.target(), scope);
            expression(c.value(), scope);
            expression(c.guard(), scope);
        }
    }

    private static void target(AssignTarget target, Scope scope) {
        if (target == null) {
            return;
        }
        if (target instanceof AttributeTarget t) {
            expression(t.object(), scope);
        } else if (target instanceof IndexTarget t) {
            expression(t.object(), scope);
            expression(t.index(), scope);
        } else if (target instanceof StarredTarget t) {
            target(t.target(), scope);
        } else if (target instanceof TupleTarget t) {
            t.elements().forEach(element -> target(element, scope));
        } else if (target instanceof ListTarget t) {
            t.elements().forEach(element -> target(element, scope));
        }
    }

    // Defaults are evaluated in the enclosing scope
    private static void parameters(List<Parameter> params, Scope scope) {
        for (Parameter param : params) {
            expression(param.defaultValue(), scope);
        }
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private static void expressions(List<Expression> list, Scope scope) {
        for (Expression expr : list) {
            expression(expr, scope);
        }
    }

    private static void expression(Expression expr, Scope scope) {
        if (expr == null) {
            return;
        }
        if (expr instanceof Identifier e) {
            reservedName(e.name(), e.span(), scope);
        } else if (expr instanceof FieldIndex e) {
            if (!scope.mode().allowsFieldIndices()) {
                String name = "$" + e.digits();
                throw new ValidationException(name, e.span(), ValidationMode.AWK, named(name, AWK_MESSAGE));
            }
        } else if (expr instanceof FormattedString e) {
            parts(e.parts(), scope);
        } else if (expr instanceof RegexLiteral e) {
            parts(e.parts(), scope);
        } else if (expr instanceof SubprocessExpression e) {
            parts(e.parts(), scope);
        } else if (expr instanceof UnaryExpression e) {
            expression(e.operand(), scope);
        } else if (expr instanceof BinaryExpression e) {
            expression(e.left(), scope);
            expression(e.right(), scope);
        } else if (expr instanceof CompareExpression e) {
            expression(e.left(), scope);
            expressions(e.comparators(), scope);
        } else if (expr instanceof ConditionalExpression e) {
            expression(e.body(), scope);
            expression(e.test(), scope);
            expression(e.orElse(), scope);
        } else if (expr instanceof CallExpression e) {
            expression(e.callee(), scope);
            for (Argument argument : e.arguments()) {
                expression(argument.value(), scope);
            }
        } else if (expr instanceof AttributeExpression e) {
            expression(e.object(), scope);
        } else if (expr instanceof IndexExpression e) {
            expression(e.object(), scope);
            expression(e.index(), scope);
        } else if (expr instanceof SliceExpression e) {
            expression(e.lower(), scope);
            expression(e.upper(), scope);
        } else if (expr instanceof ListExpression e) {
            expressions(e.elements(), scope);
        } else if (expr instanceof TupleExpression e) {
            expressions(e.elements(), scope);
        } else if (expr instanceof SetExpression e) {
            expressions(e.elements(), scope);
        } else if (expr instanceof DictExpression e) {
            for (DictEntry entry : e.entries()) {
                expression(entry.key(), scope);
                expression(entry.value(), scope);
            }
        } else if (expr instanceof ListComprehension e) {
            expression(e.element(), scope);
            target(e.target(), scope);
            expression(e.iter(), scope);
            expressions(e.conditions(), scope);
        } else if (expr instanceof DictComprehension e) {
            expression(e.key(), scope);
            expression(e.value(), scope);
            target(e.target(), scope);
            expression(e.iter(), scope);
            expressions(e.conditions(), scope);
        } else if (expr instanceof LambdaExpression e) {
            parameters(e.params(), scope);
            statements(e.body(), scope.withFunction(true));
        } else if (expr instanceof YieldExpression e) {
            requireFunction(e.span(), "yield", scope);
            expression(e.value(), scope);
        } else if (expr instanceof YieldFromExpression e) {
            requireFunction(e.span(), "yield from", scope);
            expression(e.value(), scope);
        } else if (expr instanceof TryExpression e) {
            expression(e.body(), scope);
            expression(e.fallback(), scope);
        } else if (expr instanceof RegexMatchExpression e) {
            expression(e.value(), scope);
            expression(e.pattern(), scope);
        } else if (expr instanceof CompoundExpression e) {
            expressions(e.expressions(), scope);
        } else if (expr instanceof AugAssignExpression e) {
            target(e.target(), scope);
            expression(e.value(), scope);
        } else if (expr instanceof UpdateExpression e) {
            target(e.target(), scope);
        }
        // Literals, placeholders and accessors carry no names
    }

    private static void parts(List<FStringPart> parts, Scope scope) {
        if (parts == null) {
            return;
        }
        for (FStringPart part : parts) {
            if (part instanceof InterpolationPart interpolation) {
                expression(interpolation.expression(), scope);
                parts(interpolation.formatSpec(), scope);
            }
        }
    }

    private static void reservedName(String name, SourceSpan span, Scope scope) {
        if (!name.startsWith("$") || scope.mode().allows(name)) {
            return;
        }
        if (ValidationMode.AWK.allows(name)) {
            throw new ValidationException(name, span, ValidationMode.AWK, named(name, AWK_MESSAGE));
        }
        if (ValidationMode.MAP.allows(name)) {
            throw new ValidationException(name, span, ValidationMode.MAP, named(name, MAP_MESSAGE));
        }
        throw new ValidationException(name, span, null, "unknown special variable '" + name + "'");
    }

    private static String named(String name, String message) {
        return "`" + name + "`: " + message;
    }

    private static void requireFunction(SourceSpan span, String keyword, Scope scope) {
        if (!scope.inFunction()) {
            throw new ValidationException(keyword, span, null, YIELD_MESSAGE);
        }
    }
}
