package com.example.biobricks.model;

import java.util.LinkedHashMap;
import java.util.Map;

/** Compiled-in first-run state; also what a reset goes back to. */
public final class CanonicalDefaults {
    private CanonicalDefaults() {}

    /** Fresh, mutable copy in canonical order (the order charts and lists render in). */
    public static Map<String, Double> quantities() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("Vegetable peels", 8.0);
        m.put("Sawdust", 5.0);
        m.put("Dry leaves", 4.0);
        m.put("Plastic shreds", 2.0);
        m.put("Straws / fibers", 1.0);
        m.put("E-waste", 0.2);
        m.put("Sand", 0.5);
        m.put("Other", 0.3);
        return m;
    }

    public static ConversionSettings settings() {
        return new ConversionSettings();
    }
}
