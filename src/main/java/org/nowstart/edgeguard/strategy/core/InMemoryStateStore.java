package org.nowstart.edgeguard.strategy.core;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryStateStore implements StateStore {

    private final Map<String, Object> values = new ConcurrentHashMap<>();

    @Override
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, Object value) {
        if (value == null) {
            values.remove(key);
            return;
        }
        values.put(key, value);
    }

    @Override
    public void delete(String key) {
        values.remove(key);
    }

    @Override
    public Map<String, Object> snapshot() {
        return Map.copyOf(values);
    }
}
