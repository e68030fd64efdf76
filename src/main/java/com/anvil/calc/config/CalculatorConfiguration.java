package com.anvil.calc.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import com.anvil.calc.history.History;
import com.anvil.calc.history.InMemoryHistory;

/**
 * Composition root: one in-memory history shared with the calculator service.
 */
@Configuration
@ComponentScan(basePackages = "com.anvil.calc")
@PropertySource("classpath:calculator.properties")
public class CalculatorConfiguration {

    @Bean
    public History history() {
        return new InMemoryHistory();
    }
}
