package com.example.biobricks.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import java.io.*;
import java.nio.file.*;
import java.util.*;

/**
 * Keeps every entry as a top-level number in one JSON object on disk.
 * Puts are staged in memory; {@link #flush()} replaces the file atomically
 * through a temp file in the same directory.
 * An unparseable file is reported once and then treated as empty, so the next flush overwrites it.
 */
public class JsonKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(JsonKeyValueStore.class);

    private final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private final Path file;
    private Map<String, Double> cache;
    private boolean dirty;

    public JsonKeyValueStore(Path file) { this.file = file; }

    /** {@code <biobricks.home>/state.json}, falling back to {@code ~/.smart-bio-bricks}. */
    public static Path defaultLocation() {
        String home = System.getProperty("biobricks.home");
        Path dir = (home != null && !home.isBlank())
            ? Path.of(home)
            : Path.of(System.getProperty("user.home"), ".smart-bio-bricks");
        return dir.resolve("state.json");
    }

    public Path file() { return file; }

    @Override public OptionalDouble getDouble(String key) throws IOException {
        Double v = entries().get(key);
        return v == null ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    @Override public void putDouble(String key, double value) throws IOException {
        entries().put(key, value);
        dirty = true;
    }

    @Override public void flush() throws IOException {
        if (!dirty) return;
        Path dir = file.toAbsolutePath().getParent();
        if (dir != null && !Files.exists(dir)) Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
        try {
            try (OutputStream out = Files.newOutputStream(tmp)) {
                mapper.writeValue(out, cache);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException ex) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            dirty = false;
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private Map<String, Double> entries() throws IOException {
        if (cache != null) return cache;
        Map<String, Double> loaded = new LinkedHashMap<>();
        if (Files.exists(file)) {
            Map<String, Object> raw;
            try (InputStream in = Files.newInputStream(file)) {
                raw = mapper.readValue(in, new TypeReference<LinkedHashMap<String, Object>>() {});
            } catch (JsonProcessingException ex) {
                log.warn("State file {} is corrupt; it will be replaced on the next save", file);
                cache = loaded;
                throw new IOException("Failed to read state file " + file + ". Expect a flat JSON object of numbers.", ex);
            }
            if (raw != null) {
                for (var e : raw.entrySet()) {
                    if (e.getValue() instanceof Number) loaded.put(e.getKey(), ((Number) e.getValue()).doubleValue());
                }
            }
        }
        cache = loaded;
        return cache;
    }
}
