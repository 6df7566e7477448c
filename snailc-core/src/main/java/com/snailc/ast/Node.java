package com.snailc.ast;

/**
 * Base interface for all Snail AST nodes
 */
public sealed interface Node permits
    Program,
    Statement,
    Expression,
    AssignTarget,
    Condition,
    ElifClause,
    ExceptHandler,
    WithItem,
    ImportItem,
    Argument,
    Parameter,
    DictEntry,
    InterpolationPart {

    String type();

    SourceSpan span();

    default int start() {
        return span().start();
    }

    default int end() {
        return span().end();
    }

    default SourceLocation loc() {
        return span().loc();
    }
}
