package com.example.biobricks;

import com.example.biobricks.storage.JsonStorage;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.*;

public class JsonStorageTests {
    private static InputStream json(String s) { return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8)); }

    @Test
    void reads_object_keeping_order_and_raw_values() throws Exception {
        Map<String, Object> m = new JsonStorage().loadQuantities(json("{\"sand\": 2, \"sawdust\": \"4.5\", \"other\": null}"));
        assertEquals(List.of("sand", "sawdust", "other"), new ArrayList<>(m.keySet()));
        assertEquals(2, ((Number) m.get("sand")).intValue());
        assertEquals("4.5", m.get("sawdust"));
        assertNull(m.get("other"));
    }

    @Test
    void rejects_non_objects_and_broken_json() {
        JsonStorage s = new JsonStorage();
        assertThrows(IOException.class, () -> s.loadQuantities(json("[1, 2, 3]")));
        assertThrows(IOException.class, () -> s.loadQuantities(json("{\"sand\": ")));
        assertThrows(IOException.class, () -> s.loadQuantities((InputStream) null));
    }
}
