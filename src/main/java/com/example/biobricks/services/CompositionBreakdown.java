package com.example.biobricks.services;

import com.example.biobricks.model.MaterialEntry;
import java.util.*;

/** Pie-chart slices: non-zero entries in registry order, each with its share of the total. */
public class CompositionBreakdown {
    public static final int PALETTE_SIZE = 7;

    public static class Slice {
        public final String label;
        public final double quantity;
        public final double percent;     // share of total, 0..100
        public final int colorIndex;     // stable position in the palette
        public Slice(String label, double quantity, double percent, int colorIndex) {
            this.label = label; this.quantity = quantity; this.percent = percent; this.colorIndex = colorIndex;
        }
        @Override public String toString() { return String.format("%s %.0f%%", label, percent); }
    }

    public List<Slice> compute(List<MaterialEntry> entries) {
        List<Slice> out = new ArrayList<>();
        if (entries == null) return out;
        double total = 0.0;
        for (MaterialEntry e : entries) total += e.quantity;
        int i = 0;
        for (MaterialEntry e : entries) {
            if (e.quantity <= 0) continue;
            double pct = total > 0 ? e.quantity / total * 100.0 : 0.0;
            out.add(new Slice(e.label, e.quantity, pct, i % PALETTE_SIZE));
            i++;
        }
        return out;
    }
}
