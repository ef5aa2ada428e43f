package com.example.biobricks.model;

import java.util.*;

/**
 * Ordered label -> kg map whose key set is fixed when it is built.
 * Values only ever change through {@link #set}, which clamps negatives to zero.
 */
public class MaterialRegistry {
    private final Map<String, Double> values = new LinkedHashMap<>();

    public MaterialRegistry(Map<String, Double> initial) {
        if (initial == null || initial.isEmpty()) throw new IllegalArgumentException("Registry needs at least one label.");
        for (var e : initial.entrySet()) {
            if (e.getKey() == null) throw new IllegalArgumentException("Registry labels cannot be null.");
            values.put(e.getKey(), clamp(e.getValue() == null ? 0.0 : e.getValue()));
        }
    }

    public boolean contains(String label) { return label != null && values.containsKey(label); }

    /** Returns the quantity for a known label, or null. */
    public Double get(String label) { return label == null ? null : values.get(label); }

    /** Stores max(0, quantity); returns the value actually stored. */
    public double set(String label, double quantity) {
        if (!contains(label)) throw new IllegalArgumentException("Unknown material: " + label);
        double v = clamp(quantity);
        values.put(label, v);
        return v;
    }

    public List<String> labels() { return new ArrayList<>(values.keySet()); }

    public List<MaterialEntry> entries() {
        List<MaterialEntry> out = new ArrayList<>(values.size());
        for (var e : values.entrySet()) out.add(new MaterialEntry(e.getKey(), e.getValue()));
        return out;
    }

    public double total() {
        double sum = 0.0;
        for (double v : values.values()) sum += v;
        return sum;
    }

    public Map<String, Double> asMap() { return new LinkedHashMap<>(values); }

    public int size() { return values.size(); }

    static double clamp(double v) { return Math.max(0.0, v); }
}
