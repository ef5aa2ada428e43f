package com.example.biobricks.model;

/** One (label, kg) pair as seen by consumers of the registry. */
public class MaterialEntry {
    public final String label;
    public final double quantity;

    public MaterialEntry(String label, double quantity) {
        this.label = label; this.quantity = quantity;
    }

    @Override public String toString() { return label + "=" + quantity; }
}
