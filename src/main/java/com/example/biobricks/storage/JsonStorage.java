package com.example.biobricks.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.*;
import java.util.*;

public class JsonStorage {
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Decodes a bulk import source: one JSON object of key -> number or numeric string.
     * Values are handed back untouched; coercion happens at import time.
     */
    public Map<String, Object> loadQuantities(InputStream in) throws IOException {
        if (in == null) throw new IOException("No quantities source to read.");
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (IOException ex) {
            throw new IOException("Failed to parse quantities JSON. Expect an object: material -> kg.", ex);
        }
        if (root == null || !root.isObject()) {
            throw new IOException("Quantities JSON must be an object such as {\"sawdust\": 5.0}.");
        }
        return mapper.convertValue(root, new TypeReference<LinkedHashMap<String, Object>>() {});
    }

    public Map<String, Object> loadQuantities(File f) throws IOException {
        try (InputStream in = new FileInputStream(f)) {
            return loadQuantities(in);
        }
    }
}
