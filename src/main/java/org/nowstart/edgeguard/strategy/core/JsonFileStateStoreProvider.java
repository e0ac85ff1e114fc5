package org.nowstart.edgeguard.strategy.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class JsonFileStateStoreProvider implements StateStoreProvider {

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Map<Path, StateStore> stores = new ConcurrentHashMap<>();

    public JsonFileStateStoreProvider(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public StateStore storeFor(String strategyId, String symbol) {
        Path file = directory.resolve(safe(strategyId) + "_" + safe(symbol) + ".json");
        return stores.computeIfAbsent(file, path -> new JsonFileStateStore(path, objectMapper));
    }

    private String safe(String value) {
        return value.replaceAll("[^A-Za-z0-9._-]", "_");
    }
}
