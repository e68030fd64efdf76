package com.anvil.calc.history;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * History kept in process memory. Grows without bound and is not thread-safe.
 */
public class InMemoryHistory implements History {

    private final List<String> operations = new ArrayList<>();

    @Override
    public void addEntry(String operation) {
        operations.add(operation);
    }

    @Override
    public List<String> getLastOperations(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        int end = operations.size();
        int start = end - Math.min(count, end);
        return Collections.unmodifiableList(new ArrayList<>(operations.subList(start, end)));
    }

    public int size() {
        return operations.size();
    }

    @Override
    public String toString() {
        return "InMemoryHistory(size: " + operations.size() + ")";
    }
}
