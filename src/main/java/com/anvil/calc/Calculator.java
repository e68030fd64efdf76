package com.anvil.calc;

import com.anvil.calc.history.History;

/**
 * Integer calculator that records every successful operation into a {@link History}.
 */
public interface Calculator {

    int add(int a, int b);

    int subtract(int a, int b);

    int multiply(int a, int b);

    /**
     * Divides {@code a} by {@code b}, truncating toward zero.
     *
     * @throws ArithmeticException if {@code b} is zero; nothing is recorded in that case
     */
    int divide(int a, int b);

    /**
     * Binds the history that receives records of subsequent operations.
     * Records already written to the previous history stay where they are.
     */
    void setHistory(History history);
}
