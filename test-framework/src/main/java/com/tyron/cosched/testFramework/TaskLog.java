package com.tyron.cosched.testFramework;

import org.junit.jupiter.api.Assertions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Ordered record of what tasks did, checked and cleared with {@link #assertLog(String...)}.
 */
public final class TaskLog {

    private final List<String> entries = new ArrayList<>();

    public void add(String entry) {
        entries.add(entry);
    }

    public List<String> entries() {
        return List.copyOf(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * Asserts the log holds exactly {@code expected}, in order, then clears it.
     */
    public void assertLog(String... expected) {
        List<String> actual = List.copyOf(entries);
        entries.clear();
        Assertions.assertEquals(Arrays.asList(expected), actual, "task log");
    }

    public void clear() {
        entries.clear();
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
