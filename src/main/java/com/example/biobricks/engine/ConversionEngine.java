package com.example.biobricks.engine;

import com.example.biobricks.model.*;
import com.example.biobricks.services.AnalyticsReport;
import com.example.biobricks.services.LabelMatcher;
import com.example.biobricks.services.NumberParsing;
import com.example.biobricks.storage.InMemoryKeyValueStore;
import com.example.biobricks.storage.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * Owns the material quantities and conversion settings. Every derived figure is
 * computed from current state when it is read; nothing is cached.
 * Mutations validate, persist (best-effort) and then notify subscribers.
 * Not thread-safe: one owner issues calls serially.
 */
public class ConversionEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ConversionEngine.class);

    public static final String VALUE_KEY_PREFIX = "value:";

    private final MaterialRegistry registry = new MaterialRegistry(CanonicalDefaults.quantities());
    private ConversionSettings settings = CanonicalDefaults.settings();
    private final ChangeNotifier notifier = new ChangeNotifier();
    private final KeyValueStore store;
    private final LabelMatcher matcher;

    public ConversionEngine() { this(new InMemoryKeyValueStore()); }

    public ConversionEngine(KeyValueStore store) {
        if (store == null) throw new IllegalArgumentException("A key-value store is required.");
        this.store = store;
        this.matcher = new LabelMatcher(registry.labels());
    }

    public static String valueKey(String label) { return VALUE_KEY_PREFIX + label; }

    // ---------- queries ----------

    public double totalAvailableWaste() { return registry.total(); }

    /** floor(total / brickMass); saturates at Long.MAX_VALUE. */
    public long bricksProducible() {
        double mass = settings.brickMass;
        if (mass <= 0) return 0;
        return (long) Math.floor(totalAvailableWaste() / mass);
    }

    public double volumeDiverted() { return bricksProducible() * settings.brickVolume; }

    public double areaReduced() {
        if (settings.landfillDepth <= 0) return 0.0;
        return volumeDiverted() / settings.landfillDepth;
    }

    public double percentLandfillReduced() {
        if (settings.landfillArea <= 0) return 0.0;
        double pct = areaReduced() / settings.landfillArea * 100.0;
        return Math.max(0.0, Math.min(100.0, pct));
    }

    public AnalyticsReport report() {
        return new AnalyticsReport(totalAvailableWaste(), bricksProducible(), volumeDiverted(),
            areaReduced(), percentLandfillReduced());
    }

    /** Registry pairs in canonical order; index i is stable for the engine's lifetime. */
    public List<MaterialEntry> orderedEntries() { return registry.entries(); }

    public List<String> labels() { return registry.labels(); }

    /** Quantity for a known label, or null. */
    public Double valueOf(String label) { return registry.get(label); }

    public double getBrickMass() { return settings.brickMass; }
    public double getBrickVolume() { return settings.brickVolume; }
    public double getLandfillArea() { return settings.landfillArea; }
    public double getLandfillDepth() { return settings.landfillDepth; }
    public double getSetting(Setting s) { return settings.get(s); }

    public ConversionSettings settings() { return settings.copy(); }

    // ---------- mutations ----------

    public UpdateResult updateValue(String label, double newQuantity) {
        if (!registry.contains(label)) {
            log.debug("Ignoring update for unknown material '{}'", label);
            return UpdateResult.UNKNOWN_LABEL;
        }
        if (Double.isNaN(newQuantity) || Double.isInfinite(newQuantity)) return UpdateResult.REJECTED;
        double stored = registry.set(label, newQuantity);
        log.debug("{} -> {} kg", label, stored);
        persistQuietly();
        notifier.publish(this);
        return newQuantity < 0 ? UpdateResult.CLAMPED : UpdateResult.UPDATED;
    }

    public UpdateResult updateSetting(String name, double newValue) {
        Setting s = Setting.fromKey(name);
        if (s == null) {
            log.debug("Ignoring unknown setting '{}'", name);
            return UpdateResult.UNKNOWN_SETTING;
        }
        return updateSetting(s, newValue);
    }

    public UpdateResult updateSetting(Setting s, double newValue) {
        if (s == null) return UpdateResult.UNKNOWN_SETTING;
        if (!validSetting(newValue)) {
            log.debug("Rejected {}={} (must be > 0); keeping {}", s.key, newValue, settings.get(s));
            return UpdateResult.REJECTED;
        }
        settings.set(s, newValue);
        log.debug("{} -> {}", s.key, newValue);
        persistQuietly();
        notifier.publish(this);
        return UpdateResult.UPDATED;
    }

    /** Exact-label bulk assignment; unknown labels are skipped. Returns how many labels were written. */
    public int applyAll(Map<String, Double> newValues) {
        int written = 0;
        if (newValues != null) {
            for (var e : newValues.entrySet()) {
                Double v = e.getValue();
                if (!registry.contains(e.getKey()) || v == null || !Double.isFinite(v)) continue;
                registry.set(e.getKey(), v);
                written++;
            }
        }
        persistQuietly();
        notifier.publish(this);
        return written;
    }

    /** Back to the compiled-in quantities and settings, published as a single change. */
    public void resetToDefaults() {
        for (var e : CanonicalDefaults.quantities().entrySet()) registry.set(e.getKey(), e.getValue());
        settings = CanonicalDefaults.settings();
        log.info("Reset to defaults");
        notifier.publish(this);
        persistQuietly();
    }

    /**
     * Applies an external key -> value source through fuzzy label matching.
     * Values must be numbers or numeric strings (kg); anything else is skipped.
     */
    public ImportReport importQuantities(Map<String, ?> source) {
        ImportReport report = new ImportReport();
        if (source != null) {
            for (var e : source.entrySet()) {
                String key = e.getKey();
                if (key == null) continue;
                OptionalDouble v = NumberParsing.coerce(e.getValue());
                if (v.isEmpty()) {
                    report.malformed.add(key);
                    continue;
                }
                List<String> hits = matcher.match(key);
                if (hits.isEmpty()) {
                    report.unmatched.add(key);
                    continue;
                }
                for (String label : hits) report.updated.put(label, registry.set(label, v.getAsDouble()));
            }
        }
        log.info("Imported quantities: {}", report);
        persistQuietly();
        notifier.publish(this);
        return report;
    }

    // ---------- persistence ----------

    /** Writes each quantity and setting as its own entry, then flushes the store once. */
    public void save() throws IOException {
        for (MaterialEntry e : registry.entries()) store.putDouble(valueKey(e.label), e.quantity);
        for (Setting s : Setting.values()) store.putDouble(s.key, settings.get(s));
        store.flush();
    }

    /** Overlays whatever the store has on top of current state; missing entries keep their value. */
    public void load() throws IOException {
        int found = 0;
        for (String label : registry.labels()) {
            OptionalDouble v = store.getDouble(valueKey(label));
            if (v.isPresent() && Double.isFinite(v.getAsDouble())) {
                registry.set(label, v.getAsDouble());
                found++;
            }
        }
        for (Setting s : Setting.values()) {
            OptionalDouble v = store.getDouble(s.key);
            if (v.isPresent() && validSetting(v.getAsDouble())) {
                settings.set(s, v.getAsDouble());
                found++;
            }
        }
        log.info("Loaded {} stored field(s)", found);
        notifier.publish(this);
    }

    private void persistQuietly() {
        try {
            save();
        } catch (IOException ex) {
            log.warn("Could not persist state; keeping in-memory values", ex);
        }
    }

    private static boolean validSetting(double v) { return Double.isFinite(v) && v > 0; }

    // ---------- observers ----------

    public Runnable subscribe(EngineListener l) { return notifier.subscribe(l); }

    public int subscriberCount() { return notifier.size(); }

    /** Drops all subscribers. State stays readable. */
    @Override public void close() {
        notifier.clear();
        log.debug("Engine closed");
    }
}
