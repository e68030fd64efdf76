package com.anvil.calc.history;

import java.util.List;

/**
 * Ordered, append-only log of operation records.
 */
public interface History {

    /**
     * Appends a record to the end of the history.
     *
     * @param operation formatted operation record, stored as given
     */
    void addEntry(String operation);

    /**
     * Returns the most recent records, oldest first.
     *
     * @param count maximum number of records to return, must not be negative
     * @return the last {@code min(count, size)} records in insertion order
     */
    List<String> getLastOperations(int count);
}
