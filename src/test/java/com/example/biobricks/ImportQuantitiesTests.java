package com.example.biobricks;

import com.example.biobricks.engine.*;
import com.example.biobricks.model.MaterialEntry;
import com.example.biobricks.storage.JsonStorage;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.io.InputStream;
import java.util.*;

public class ImportQuantitiesTests {

    private static Map<String, Double> values(ConversionEngine engine) {
        Map<String, Double> m = new LinkedHashMap<>();
        for (MaterialEntry e : engine.orderedEntries()) m.put(e.label, e.quantity);
        return m;
    }

    @Test
    void underscored_key_updates_only_its_label() {
        ConversionEngine engine = new ConversionEngine();
        Map<String, Double> before = values(engine);

        ImportReport rep = engine.importQuantities(Map.of("plastic_shreds", 3.5));

        Map<String, Double> expected = new LinkedHashMap<>(before);
        expected.put("Plastic shreds", 3.5);
        assertEquals(expected, values(engine));
        assertEquals(Map.of("Plastic shreds", 3.5), rep.updated);
    }

    @Test
    void unknown_key_leaves_registry_unchanged() {
        ConversionEngine engine = new ConversionEngine();
        Map<String, Double> before = values(engine);
        ImportReport rep = engine.importQuantities(Map.of("unknown_material_xyz", 9.0));
        assertEquals(before, values(engine));
        assertEquals(List.of("unknown_material_xyz"), rep.unmatched);
        assertFalse(rep.changedAnything());
    }

    @Test
    void first_word_of_label_matches_longer_keys() {
        ConversionEngine engine = new ConversionEngine();
        engine.importQuantities(Map.of("Sawdust_kg", 6.0, "straws_and_fibres", "2.5"));
        assertEquals(6.0, engine.valueOf("Sawdust"), 0.0);
        assertEquals(2.5, engine.valueOf("Straws / fibers"), 0.0);
    }

    @Test
    void malformed_values_are_skipped_and_rest_applied() {
        ConversionEngine engine = new ConversionEngine();
        Map<String, Object> src = new LinkedHashMap<>();
        src.put("sand", "lots");
        src.put("sawdust", " 4.5 ");
        src.put("other", null);
        src.put("dry_leaves", true);
        src.put("e-waste", 1);

        ImportReport rep = engine.importQuantities(src);
        assertEquals(0.5, engine.valueOf("Sand"), 0.0);
        assertEquals(4.5, engine.valueOf("Sawdust"), 0.0);
        assertEquals(0.3, engine.valueOf("Other"), 0.0);
        assertEquals(4.0, engine.valueOf("Dry leaves"), 0.0);
        assertEquals(1.0, engine.valueOf("E-waste"), 0.0);
        assertEquals(List.of("sand", "other", "dry_leaves"), rep.malformed);
    }

    @Test
    void negative_imports_clamp_to_zero() {
        ConversionEngine engine = new ConversionEngine();
        engine.importQuantities(Map.of("sand", -7));
        assertEquals(0.0, engine.valueOf("Sand"), 0.0);
    }

    @Test
    void one_notification_per_import() {
        ConversionEngine engine = new ConversionEngine();
        int[] calls = {0};
        engine.subscribe(e -> calls[0]++);
        engine.importQuantities(Map.of("sand", 1, "sawdust", 2, "nothing_here", 3));
        assertEquals(1, calls[0]);
    }

    @Test
    void bundled_sample_data_imports_every_material() throws Exception {
        ConversionEngine engine = new ConversionEngine();
        try (InputStream in = getClass().getResourceAsStream("/sample-data/sample_data.json")) {
            ImportReport rep = engine.importQuantities(new JsonStorage().loadQuantities(in));
            assertEquals(8, rep.updated.size());
            assertTrue(rep.unmatched.isEmpty());
        }
        assertEquals(34.0, engine.totalAvailableWaste(), 1e-9);
        assertEquals(17, engine.bricksProducible());
        assertEquals(1.75, engine.valueOf("Straws / fibers"), 0.0);
    }
}
