package com.example.biobricks.engine;

/** Outcome of a single mutation request. */
public enum UpdateResult {
    UPDATED,
    /** Quantity was negative and stored as 0. */
    CLAMPED,
    UNKNOWN_LABEL,
    UNKNOWN_SETTING,
    /** Value failed validation; previous value retained. */
    REJECTED;

    public boolean applied() { return this == UPDATED || this == CLAMPED; }
}
