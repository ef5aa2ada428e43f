package com.example.biobricks.storage;

import java.io.IOException;
import java.util.OptionalDouble;

/** Flat namespace of named numeric entries. Implementations report an unusable backend as IOException. */
public interface KeyValueStore {
    OptionalDouble getDouble(String key) throws IOException;
    void putDouble(String key, double value) throws IOException;

    /** Makes staged puts durable. Stores that write through on each put need not override it. */
    default void flush() throws IOException {}
}
