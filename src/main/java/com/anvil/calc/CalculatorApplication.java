package com.anvil.calc;

import java.io.PrintStream;
import java.util.List;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.stereotype.Component;

import com.anvil.calc.config.CalculatorConfiguration;
import com.anvil.calc.history.History;

/**
 * Runs a fixed sequence of operations and prints the most recent history.
 */
@Component
public class CalculatorApplication {

    private final Calculator calculator;
    private final History history;
    private final int recentCount;

    public CalculatorApplication(Calculator calculator, History history,
            @Value("${calculator.history.recent:5}") int recentCount) {
        this.calculator = calculator;
        this.history = history;
        this.recentCount = recentCount;
    }

    /**
     * Performs the demonstration operations, printing each result.
     *
     * @param out destination of the report
     */
    public void run(PrintStream out) {
        int num1 = 100;
        int num2 = 50;

        out.println("SUM: " + calculator.add(num1, num2));
        out.println("DIFFERENCE: " + calculator.subtract(num1, num2));
        out.println("PRODUCT: " + calculator.multiply(num1, num2));
        out.println("QUOTIENT: " + calculator.divide(num1, num2));

        List<String> recent = history.getLastOperations(recentCount);
        out.println("LAST " + recent.size() + " OPERATIONS:");
        for (String operation : recent) {
            out.println("  " + operation);
        }
    }

    public static void main(String[] args) {
        try (AnnotationConfigApplicationContext context =
                new AnnotationConfigApplicationContext(CalculatorConfiguration.class)) {
            context.getBean(CalculatorApplication.class).run(System.out);
        }
    }
}
