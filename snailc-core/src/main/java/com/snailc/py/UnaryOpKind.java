package com.snailc.py;

import com.snailc.ast.UnaryOperator;

public enum UnaryOpKind implements PyOperator {
    UADD("UAdd", "+"),
    USUB("USub", "-"),
    NOT("Not", "not");

    private final String type;
    private final String symbol;

    UnaryOpKind(String type, String symbol) {
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

    public static UnaryOpKind of(UnaryOperator op) {
        return switch (op) {
            case PLUS -> UADD;
            case MINUS -> USUB;
            case NOT -> NOT;
        };
    }
}
