package com.snailc.ast;

public sealed interface Expression extends Node permits
    Identifier,
    Placeholder,
    NumberLiteral,
    StringLiteral,
    FormattedString,
    BooleanLiteral,
    NoneLiteral,
    UnaryExpression,
    BinaryExpression,
    CompareExpression,
    ConditionalExpression,
    CallExpression,
    AttributeExpression,
    IndexExpression,
    SliceExpression,
    ListExpression,
    TupleExpression,
    SetExpression,
    DictExpression,
    ListComprehension,
    DictComprehension,
    LambdaExpression,
    YieldExpression,
    YieldFromExpression,
    TryExpression,
    SubprocessExpression,
    RegexLiteral,
    RegexMatchExpression,
    StructuredAccessor,
    CompoundExpression,
    AugAssignExpression,
    UpdateExpression,
    FieldIndex {
}
