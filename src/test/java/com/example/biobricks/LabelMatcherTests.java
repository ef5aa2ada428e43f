package com.example.biobricks;

import com.example.biobricks.model.CanonicalDefaults;
import com.example.biobricks.services.LabelMatcher;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

public class LabelMatcherTests {
    private final LabelMatcher m = new LabelMatcher(CanonicalDefaults.quantities().keySet());

    @Test
    void normalizes_case_and_underscores() {
        assertEquals("dry leaves", LabelMatcher.normalize("Dry_Leaves"));
        assertEquals(List.of("Dry leaves"), m.match("DRY_LEAVES"));
        assertEquals(List.of("Vegetable peels"), m.match("vegetable"));
    }

    @Test
    void key_containing_first_word_matches() {
        assertEquals(List.of("Plastic shreds"), m.match("plastic_bottles_total"));
        assertEquals(List.of("E-waste"), m.match("e-waste_bin"));
    }

    @Test
    void short_generic_key_can_hit_several_labels() {
        // "s" is contained in most labels; every one of them is a hit
        List<String> hits = m.match("s");
        assertTrue(hits.contains("Sawdust"));
        assertTrue(hits.contains("Sand"));
        assertTrue(hits.size() > 1);
    }

    @Test
    void unrelated_keys_do_not_match() {
        assertTrue(m.match("glass").isEmpty());
        assertTrue(m.match("e_waste").isEmpty());
        assertTrue(m.match(null).isEmpty());
    }
}
