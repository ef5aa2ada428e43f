package com.example.biobricks.services;

import java.util.OptionalDouble;

/** Best-effort numeric coercion for text fields and decoded JSON values. */
public final class NumberParsing {
    private NumberParsing() {}

    /** Parses trimmed text; empty for null, blank or non-numeric input. */
    public static OptionalDouble tryParse(String text) {
        if (text == null) return OptionalDouble.empty();
        String s = text.trim();
        if (s.isEmpty()) return OptionalDouble.empty();
        try {
            return OptionalDouble.of(Double.parseDouble(s));
        } catch (NumberFormatException ex) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Numbers are taken as-is, anything else goes through its text form.
     * Non-finite results count as nothing.
     */
    public static OptionalDouble coerce(Object value) {
        if (value == null) return OptionalDouble.empty();
        OptionalDouble d = (value instanceof Number)
            ? OptionalDouble.of(((Number) value).doubleValue())
            : tryParse(value.toString());
        if (d.isPresent() && !Double.isFinite(d.getAsDouble())) return OptionalDouble.empty();
        return d;
    }
}
