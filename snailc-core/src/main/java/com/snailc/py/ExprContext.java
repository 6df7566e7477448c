package com.snailc.py;

public enum ExprContext implements PyOperator {
    LOAD("Load"),
    STORE("Store"),
    DEL("Del");

    private final String type;

    ExprContext(String type) {
        this.type = type;
    }

    @Override
    public String type() {
        return type;
    }

    @Override
    public String symbol() {
        return "";
    }
}
