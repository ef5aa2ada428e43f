package com.example.biobricks.engine;

@FunctionalInterface
public interface EngineListener {
    void onEngineChanged(ConversionEngine engine);
}
