package com.snailc.py;

import com.snailc.ast.CompareOperator;

public enum CmpOp implements PyOperator {
    EQ("Eq", "=="),
    NOT_EQ("NotEq", "!="),
    LT("Lt", "<"),
    LT_E("LtE", "<="),
    GT("Gt", ">"),
    GT_E("GtE", ">="),
    IS("Is", "is"),
    IS_NOT("IsNot", "is not"),
    IN("In", "in"),
    NOT_IN("NotIn", "not in");

    private final String type;
    private final String symbol;

    CmpOp(String type, String symbol) {
        this.type = type;
        this.symbol = symbol;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    public static CmpOp of(CompareOperator op) {
        return switch (op) {
            case EQ -> EQ;
            case NOT_EQ -> NOT_EQ;
            case LT -> LT;
            case LT_EQ -> LT_E;
            case GT -> GT;
            case GT_EQ -> GT_E;
            case IS -> IS;
            case IS_NOT -> IS_NOT;
            case IN -> IN;
            case NOT_IN -> NOT_IN;
        };
    }
}
