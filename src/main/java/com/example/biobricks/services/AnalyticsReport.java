package com.example.biobricks.services;

/** The derivation chain read in one go: total -> bricks -> volume -> area -> percent. */
public class AnalyticsReport {
    public final double totalWasteKg;
    public final long bricks;
    public final double volumeDivertedM3;
    public final double areaReducedM2;
    public final double percentReduced;   // 0..100

    public AnalyticsReport(double totalWasteKg, long bricks, double volumeDivertedM3, double areaReducedM2, double percentReduced) {
        this.totalWasteKg = totalWasteKg; this.bricks = bricks; this.volumeDivertedM3 = volumeDivertedM3;
        this.areaReducedM2 = areaReducedM2; this.percentReduced = percentReduced;
    }

    @Override public String toString() {
        return String.format(
            "Waste: %.2f kg  |  Bricks: %d  |  Volume: %.4f m³  |  Area: %.3f m²  =>  Landfill reduced: %.2f%%",
            totalWasteKg, bricks, volumeDivertedM3, areaReducedM2, percentReduced);
    }
}
