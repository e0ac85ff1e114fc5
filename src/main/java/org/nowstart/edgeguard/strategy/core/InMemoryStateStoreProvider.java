package org.nowstart.edgeguard.strategy.core;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryStateStoreProvider implements StateStoreProvider {

    private final Map<String, StateStore> stores = new ConcurrentHashMap<>();

    @Override
    public StateStore storeFor(String strategyId, String symbol) {
        return stores.computeIfAbsent(strategyId + "/" + symbol, ignored -> new InMemoryStateStore());
    }
}
