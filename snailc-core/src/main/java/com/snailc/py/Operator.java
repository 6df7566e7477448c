package com.snailc.py;

import com.snailc.ast.BinaryOperator;

public enum Operator implements PyOperator {
    ADD("Add", "+"),
    SUB("Sub", "-"),
    MULT("Mult", "*"),
    DIV("Div", "/"),
    FLOOR_DIV("FloorDiv", "//"),
    MOD("Mod", "%"),
    POW("Pow", "**");

    private final String type;
    private final String symbol;

    Operator(String type, String symbol) {
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

    /**
     * Arithmetic counterpart of a Snail operator. Boolean operators and the pipeline have none.
     */
    public static Operator of(BinaryOperator op) {
        return switch (op) {
            case ADD -> ADD;
            case SUB -> SUB;
            case MUL -> MULT;
            case DIV -> DIV;
            case FLOOR_DIV -> FLOOR_DIV;
            case MOD -> MOD;
            case POW -> POW;
            case OR, AND, PIPELINE -> throw new IllegalArgumentException("Not an arithmetic operator: " + op);
        };
    }
}
