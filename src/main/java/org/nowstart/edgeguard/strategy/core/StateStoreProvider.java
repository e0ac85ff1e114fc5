package org.nowstart.edgeguard.strategy.core;

@FunctionalInterface
public interface StateStoreProvider {

    StateStore storeFor(String strategyId, String symbol);
}
