package com.anvil.calc;

import java.util.Objects;

import org.apache.commons.logging.Log;
import org.apache.commons.logging.LogFactory;
import org.springframework.stereotype.Service;

import com.anvil.calc.history.History;

/**
 * Calculator Service - records each computation into the bound history
 *
 * The history is shared by reference: this service never owns or clears it,
 * and rebinding leaves records already written in the previous history.
 */
@Service
public class SimpleCalculator implements Calculator {

    private static final Log logger = LogFactory.getLog(SimpleCalculator.class);

    private History history;

    /**
     * Creates a calculator bound to the given history.
     *
     * @param history initial history receiving operation records
     */
    public SimpleCalculator(History history) {
        this.history = Objects.requireNonNull(history, "history");
    }

    @Override
    public void setHistory(History history) {
        this.history = Objects.requireNonNull(history, "history");
        logger.info("Calculator rebound to " + history);
    }

    @Override
    public int add(int a, int b) {
        return perform(Operator.ADD, a, b);
    }

    @Override
    public int subtract(int a, int b) {
        return perform(Operator.SUBTRACT, a, b);
    }

    @Override
    public int multiply(int a, int b) {
        return perform(Operator.MULTIPLY, a, b);
    }

    /**
     * Division by zero is a programming error: the ArithmeticException
     * propagates to the caller untouched.
     */
    @Override
    public int divide(int a, int b) {
        return perform(Operator.DIVIDE, a, b);
    }

    /**
     * Computes first, so a failing operation leaves the history unchanged.
     */
    private int perform(Operator operator, int a, int b) {
        int result = operator.apply(a, b);
        String record = operator.format(a, b, result);
        history.addEntry(record);
        if (logger.isDebugEnabled()) {
            logger.debug("Recorded " + record);
        }
        return result;
    }
}
