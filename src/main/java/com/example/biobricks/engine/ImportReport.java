package com.example.biobricks.engine;

import java.util.*;

/** What an import did: labels written, keys nothing matched, keys whose value was not a number. */
public class ImportReport {
    public final Map<String, Double> updated = new LinkedHashMap<>();
    public final List<String> unmatched = new ArrayList<>();
    public final List<String> malformed = new ArrayList<>();

    public boolean changedAnything() { return !updated.isEmpty(); }

    @Override public String toString() {
        return String.format("Updated %d material(s); %d key(s) unmatched; %d value(s) skipped",
            updated.size(), unmatched.size(), malformed.size());
    }
}
