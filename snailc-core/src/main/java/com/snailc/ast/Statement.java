package com.snailc.ast;

public sealed interface Statement extends Node permits
    IfStatement,
    WhileStatement,
    ForStatement,
    DefStatement,
    ClassStatement,
    TryStatement,
    WithStatement,
    ReturnStatement,
    RaiseStatement,
    AssertStatement,
    DeleteStatement,
    BreakStatement,
    ContinueStatement,
    PassStatement,
    ImportStatement,
    ImportFromStatement,
    AssignStatement,
    ExpressionStatement,
    LinesStatement,
    FilesStatement,
    PatternActionStatement {
}
