package com.snailc.py;

public enum BoolOpKind implements PyOperator {
    AND("And", "and"),
    OR("Or", "or");

    private final String type;
    private final String symbol;

    BoolOpKind(String type, String symbol) {
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
}
