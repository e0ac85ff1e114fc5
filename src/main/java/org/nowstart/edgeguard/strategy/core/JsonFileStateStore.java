package org.nowstart.edgeguard.strategy.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * State store persisted as one JSON object per file. A missing or unreadable file starts empty.
 */
@Slf4j
public class JsonFileStateStore implements StateStore {

    private static final TypeReference<LinkedHashMap<String, Object>> STATE_TYPE = new TypeReference<>() {
    };

    private final Path file;
    private final ObjectMapper objectMapper;
    private final Map<String, Object> values;

    public JsonFileStateStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
        this.values = load();
    }

    @Override
    public synchronized Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public synchronized void set(String key, Object value) {
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
        save();
    }

    @Override
    public synchronized void delete(String key) {
        if (values.remove(key) != null) {
            save();
        }
    }

    @Override
    public synchronized Map<String, Object> snapshot() {
        return Map.copyOf(values);
    }

    private Map<String, Object> load() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, Object> loaded = objectMapper.readValue(file.toFile(), STATE_TYPE);
            return loaded != null ? loaded : new LinkedHashMap<>();
        } catch (IOException e) {
            log.warn("event=state_store_unreadable file={} message={}", file, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    private void save() {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), values);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save strategy state: " + file, e);
        }
    }
}
