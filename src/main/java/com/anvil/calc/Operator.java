package com.anvil.calc;

import java.util.function.IntBinaryOperator;

/**
 * Binary integer operators with the symbol used in operation records.
 */
public enum Operator {
    ADD("+", (a, b) -> a + b),
    SUBTRACT("-", (a, b) -> a - b),
    MULTIPLY("*", (a, b) -> a * b),
    // int division truncates toward zero and throws ArithmeticException on a zero divisor
    DIVIDE("/", (a, b) -> a / b);

    private final String symbol;
    private final IntBinaryOperator function;

    Operator(String symbol, IntBinaryOperator function) {
        this.symbol = symbol;
        this.function = function;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Applies the operator with Java {@code int} semantics, so overflow wraps around.
     */
    public int apply(int a, int b) {
        return function.applyAsInt(a, b);
    }

    /**
     * Formats an operation record: {@code "<a> <symbol> <b> = <result>"}.
     */
    public String format(int a, int b, int result) {
        return a + " " + symbol + " " + b + " = " + result;
    }
}
