package com.example.biobricks.model;

/** The four conversion parameters, keyed the way they are persisted. */
public enum Setting {
    BRICK_MASS("brickMass", "Brick mass (kg)", 2.0),
    BRICK_VOLUME("brickVolume", "Brick volume (m³)", 0.002),
    LANDFILL_AREA("landfillArea", "Landfill area (m²)", 1000.0),
    LANDFILL_DEPTH("landfillDepth", "Landfill depth (m)", 2.0);

    public final String key;
    public final String displayName;
    public final double defaultValue;

    Setting(String key, String displayName, double defaultValue) {
        this.key = key; this.displayName = displayName; this.defaultValue = defaultValue;
    }

    /** Looks a setting up by its persisted key; returns null when the name is not one of ours. */
    public static Setting fromKey(String key) {
        if (key == null) return null;
        for (Setting s : values()) if (s.key.equals(key.trim())) return s;
        return null;
    }
}
