package org.nowstart.edgeguard.strategy.core;

import java.util.Map;
import java.util.Optional;

/**
 * Small key-value store for state a strategy keeps across ticks, such as loss streaks.
 * One store is scoped to one strategy and symbol.
 */
public interface StateStore {

    Optional<Object> get(String key);

    void set(String key, Object value);

    void delete(String key);

    Map<String, Object> snapshot();

    default int getInt(String key, int defaultValue) {
        return get(key)
                .filter(Number.class::isInstance)
                .map(value -> ((Number) value).intValue())
                .orElse(defaultValue);
    }

    default double getDouble(String key, double defaultValue) {
        return get(key)
                .filter(Number.class::isInstance)
                .map(value -> ((Number) value).doubleValue())
                .orElse(defaultValue);
    }
}
