package com.example.biobricks.model;

public class ConversionSettings {
    public double brickMass = Setting.BRICK_MASS.defaultValue;        // kg per brick
    public double brickVolume = Setting.BRICK_VOLUME.defaultValue;    // m^3 per brick
    public double landfillArea = Setting.LANDFILL_AREA.defaultValue;  // m^2
    public double landfillDepth = Setting.LANDFILL_DEPTH.defaultValue; // m

    public ConversionSettings() {}

    public ConversionSettings(double brickMass, double brickVolume, double landfillArea, double landfillDepth) {
        this.brickMass = brickMass; this.brickVolume = brickVolume;
        this.landfillArea = landfillArea; this.landfillDepth = landfillDepth;
    }

    public double get(Setting s) {
        return switch (s) {
            case BRICK_MASS -> brickMass;
            case BRICK_VOLUME -> brickVolume;
            case LANDFILL_AREA -> landfillArea;
            case LANDFILL_DEPTH -> landfillDepth;
        };
    }

    public void set(Setting s, double value) {
        switch (s) {
            case BRICK_MASS -> brickMass = value;
            case BRICK_VOLUME -> brickVolume = value;
            case LANDFILL_AREA -> landfillArea = value;
            case LANDFILL_DEPTH -> landfillDepth = value;
        }
    }

    public ConversionSettings copy() {
        return new ConversionSettings(brickMass, brickVolume, landfillArea, landfillDepth);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConversionSettings)) return false;
        ConversionSettings c = (ConversionSettings) o;
        return Double.compare(brickMass, c.brickMass) == 0
            && Double.compare(brickVolume, c.brickVolume) == 0
            && Double.compare(landfillArea, c.landfillArea) == 0
            && Double.compare(landfillDepth, c.landfillDepth) == 0;
    }

    @Override public int hashCode() {
        return java.util.Objects.hash(brickMass, brickVolume, landfillArea, landfillDepth);
    }

    @Override public String toString() {
        return String.format("mass=%s kg, volume=%s m³, area=%s m², depth=%s m",
            brickMass, brickVolume, landfillArea, landfillDepth);
    }
}
