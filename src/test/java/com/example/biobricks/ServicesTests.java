package com.example.biobricks;

import com.example.biobricks.engine.ConversionEngine;
import com.example.biobricks.model.MaterialEntry;
import com.example.biobricks.services.*;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.*;

public class ServicesTests {

    @Test
    void numberParsing_accepts_numbers_and_numeric_text() {
        assertEquals(3.5, NumberParsing.coerce(3.5).getAsDouble(), 0.0);
        assertEquals(7.0, NumberParsing.coerce(7).getAsDouble(), 0.0);
        assertEquals(0.25, NumberParsing.coerce(" 0.25 ").getAsDouble(), 0.0);
        assertTrue(NumberParsing.coerce("abc").isEmpty());
        assertTrue(NumberParsing.coerce(null).isEmpty());
        assertTrue(NumberParsing.coerce("NaN").isEmpty());
        assertTrue(NumberParsing.coerce(List.of(1)).isEmpty());
        assertTrue(NumberParsing.tryParse("   ").isEmpty());
    }

    @Test
    void composition_skips_zeroes_and_keeps_stable_palette_indices() {
        List<MaterialEntry> entries = List.of(
            new MaterialEntry("A", 2), new MaterialEntry("B", 0), new MaterialEntry("C", 6),
            new MaterialEntry("D", 1), new MaterialEntry("E", 1), new MaterialEntry("F", 1),
            new MaterialEntry("G", 1), new MaterialEntry("H", 1), new MaterialEntry("I", 1));
        var slices = new CompositionBreakdown().compute(entries);
        assertEquals(8, slices.size());
        assertEquals("C", slices.get(1).label);
        assertEquals(1, slices.get(1).colorIndex);
        assertEquals(0, slices.get(7).colorIndex); // wraps after 7 colours
        assertEquals(100.0, slices.stream().mapToDouble(s -> s.percent).sum(), 1e-9);
        assertEquals(2.0 / 14.0 * 100.0, slices.get(0).percent, 1e-9);
    }

    @Test
    void composition_of_empty_registry_is_empty() {
        ConversionEngine engine = new ConversionEngine();
        for (String l : engine.labels()) engine.updateValue(l, 0);
        assertTrue(new CompositionBreakdown().compute(engine.orderedEntries()).isEmpty());
        assertEquals(0, engine.bricksProducible());
        assertEquals(0.0, engine.percentLandfillReduced(), 0.0);
    }

    @Test
    void report_renders_one_line() {
        String s = new ConversionEngine().report().toString();
        assertTrue(s.contains("Bricks: 10"));
        assertFalse(s.contains("\n"));
    }

    @Test
    void listeners_can_unsubscribe_and_failures_do_not_stop_others() {
        ConversionEngine engine = new ConversionEngine();
        int[] good = {0};
        engine.subscribe(e -> { throw new IllegalStateException("boom"); });
        Runnable off = engine.subscribe(e -> good[0]++);
        engine.updateValue("Sand", 1);
        assertEquals(1, good[0]);
        off.run();
        engine.updateValue("Sand", 2);
        assertEquals(1, good[0]);

        engine.close();
        assertEquals(0, engine.subscriberCount());
        assertEquals(22.0, engine.totalAvailableWaste(), 1e-9);
    }
}
