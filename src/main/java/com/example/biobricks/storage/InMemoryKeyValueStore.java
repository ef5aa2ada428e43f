package com.example.biobricks.storage;

import java.util.*;

public class InMemoryKeyValueStore implements KeyValueStore {
    private final Map<String, Double> entries = new LinkedHashMap<>();

    @Override public OptionalDouble getDouble(String key) {
        Double v = entries.get(key);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    @Override public void putDouble(String key, double value) { entries.put(key, value); }

    public Map<String, Double> snapshot() { return new LinkedHashMap<>(entries); }

    public void remove(String key) { entries.remove(key); }
}
