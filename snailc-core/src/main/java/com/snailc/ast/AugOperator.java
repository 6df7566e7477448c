package com.snailc.ast;

public enum AugOperator {
    ADD("+=", BinaryOperator.ADD),
    SUB("-=", BinaryOperator.SUB),
    MUL("*=", BinaryOperator.MUL),
    DIV("/=", BinaryOperator.DIV),
    FLOOR_DIV("//=", BinaryOperator.FLOOR_DIV),
    MOD("%=", BinaryOperator.MOD),
    POW("**=", BinaryOperator.POW);

    private final String symbol;
    private final BinaryOperator binary;

    AugOperator(String symbol, BinaryOperator binary) {
        this.symbol = symbol;
        this.binary = binary;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * The plain operator applied by this assignment, e.g. {@code +} for {@code +=}.
     */
    public BinaryOperator binary() {
        return binary;
    }

    public static AugOperator fromSymbol(String symbol) {
        for (AugOperator op : values()) {
            if (op.symbol.equals(symbol)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown augmented operator: " + symbol);
    }
}
