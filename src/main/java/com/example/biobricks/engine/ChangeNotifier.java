package com.example.biobricks.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/** Subscriber list for engine changes. Listeners may subscribe or unsubscribe while being notified. */
public class ChangeNotifier {
    private static final Logger log = LoggerFactory.getLogger(ChangeNotifier.class);

    private final List<EngineListener> listeners = new CopyOnWriteArrayList<>();

    /** Returns a handle that removes the listener again. */
    public Runnable subscribe(EngineListener l) {
        if (l == null) throw new IllegalArgumentException("Listener cannot be null.");
        listeners.add(l);
        return () -> listeners.remove(l);
    }

    public int size() { return listeners.size(); }

    void clear() { listeners.clear(); }

    void publish(ConversionEngine engine) {
        for (EngineListener l : listeners) {
            try {
                l.onEngineChanged(engine);
            } catch (RuntimeException ex) {
                log.warn("Listener {} failed while handling a change", l, ex);
            }
        }
    }
}
