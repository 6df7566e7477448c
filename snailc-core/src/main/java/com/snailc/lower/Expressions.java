package com.snailc.lower;

import com.snailc.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Structural queries over Snail expressions.
 */
final class Expressions {

    private Expressions() {
    }

    /**
     * Direct sub-expressions, in source order. Lambdas contribute their parameter defaults and
     * the values of their expression statements; other statements inside a lambda are not visited.
     */
    static List<Expression> children(Expression expr) {
        List<Expression> out = new ArrayList<>();
        if (expr instanceof FormattedString e) {
            addParts(out, e.parts());
        } else if (expr instanceof RegexLiteral e) {
            addParts(out, e.parts());
        } else if (expr instanceof SubprocessExpression e) {
            addParts(out, e.parts());
        } else if (expr instanceof UnaryExpression e) {
            out.add(e.operand());
        } else if (expr instanceof BinaryExpression e) {
            out.add(e.left());
            out.add(e.right());
        } else if (expr instanceof CompareExpression e) {
            out.add(e.left());
            out.addAll(e.comparators());
        } else if (expr instanceof ConditionalExpression e) {
            out.add(e.body());
            out.add(e.test());
            out.add(e.orElse());
        } else if (expr instanceof CallExpression e) {
            out.add(e.callee());
            for (Argument argument : e.arguments()) {
                out.add(argument.value());
            }
        } else if (expr instanceof AttributeExpression e) {
            out.add(e.object());
        } else if (expr instanceof IndexExpression e) {
            out.add(e.object());
            out.add(e.index());
        } else if (expr instanceof SliceExpression e) {
            addIfPresent(out, e.lower());
            addIfPresent(out, e.upper());
        } else if (expr instanceof ListExpression e) {
            out.addAll(e.elements());
        } else if (expr instanceof TupleExpression e) {
            out.addAll(e.elements());
        } else if (expr instanceof SetExpression e) {
            out.addAll(e.elements());
        } else if (expr instanceof DictExpression e) {
            for (DictEntry entry : e.entries()) {
                out.add(entry.key());
                out.add(entry.value());
            }
        } else if (expr instanceof ListComprehension e) {
            out.add(e.element());
            addTarget(out, e.target());
            out.add(e.iter());
            out.addAll(e.conditions());
        } else if (expr instanceof DictComprehension e) {
            out.add(e.key());
            out.add(e.value());
            addTarget(out, e.target());
            out.add(e.iter());
            out.addAll(e.conditions());
        } else if (expr instanceof LambdaExpression e) {
            for (Parameter param : e.params()) {
                addIfPresent(out, param.defaultValue());
            }
            for (Statement stmt : e.body()) {
                if (stmt instanceof ExpressionStatement s) {
                    out.add(s.expression());
                }
            }
        } else if (expr instanceof YieldExpression e) {
            addIfPresent(out, e.value());
        } else if (expr instanceof YieldFromExpression e) {
            out.add(e.value());
        } else if (expr instanceof TryExpression e) {
            out.add(e.body());
            addIfPresent(out, e.fallback());
        } else if (expr instanceof RegexMatchExpression e) {
            out.add(e.value());
            out.add(e.pattern());
        } else if (expr instanceof CompoundExpression e) {
            out.addAll(e.expressions());
        } else if (expr instanceof AugAssignExpression e) {
            addTarget(out, e.target());
            out.add(e.value());
        } else if (expr instanceof UpdateExpression e) {
            addTarget(out, e.target());
        }
        return out;
    }

    static void addTarget(List<Expression> out, AssignTarget target) {
        if (target instanceof AttributeTarget t) {
            out.add(t.object());
        } else if (target instanceof IndexTarget t) {
            out.add(t.object());
            out.add(t.index());
        } else if (target instanceof StarredTarget t) {
            addTarget(out, t.target());
        } else if (target instanceof TupleTarget t) {
            t.elements().forEach(element -> addTarget(out, element));
        } else if (target instanceof ListTarget t) {
            t.elements().forEach(element -> addTarget(out, element));
        }
    }

    private static void addParts(List<Expression> out, List<FStringPart> parts) {
        if (parts == null) {
            return;
        }
        for (FStringPart part : parts) {
            if (part instanceof InterpolationPart interpolation) {
                out.add(interpolation.expression());
                addParts(out, interpolation.formatSpec());
            }
        }
    }

    private static void addIfPresent(List<Expression> out, Expression expr) {
        if (expr != null) {
            out.add(expr);
        }
    }

    /** Placeholders anywhere below {@code expr}, in source order. */
    static void collectPlaceholders(Expression expr, List<Placeholder> out) {
        if (expr instanceof Placeholder placeholder) {
            out.add(placeholder);
            return;
        }
        for (Expression child : children(expr)) {
            collectPlaceholders(child, out);
        }
    }

    /**
     * True when a lambda cannot be written as a Python {@code lambda}: its body holds a statement
     * other than an expression, or a nested lambda needs hoisting itself.
     */
    static boolean requiresDef(LambdaExpression lambda) {
        for (Statement stmt : lambda.body()) {
            if (!(stmt instanceof ExpressionStatement)) {
                return true;
            }
        }
        for (Expression child : children(lambda)) {
            if (containsComplexLambda(child)) {
                return true;
            }
        }
        return false;
    }

    static boolean containsComplexLambda(Expression expr) {
        if (expr instanceof LambdaExpression lambda) {
            return requiresDef(lambda);
        }
        for (Expression child : children(expr)) {
            if (containsComplexLambda(child)) {
                return true;
            }
        }
        return false;
    }
}
