package org.nowstart.edgeguard.strategy.core;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class InMemoryStateStoreTest {

    @Test
    void set_nullRemovesKey() {
        StateStore store = new InMemoryStateStore();
        store.set("losses", 2);

        store.set("losses", null);

        assertThat(store.get("losses")).isEmpty();
    }

    @Test
    void getInt_fallsBackForNonNumericValue() {
        StateStore store = new InMemoryStateStore();
        store.set("losses", "three");

        assertThat(store.getInt("losses", 0)).isZero();
    }

    @Test
    void storeFor_scopesByStrategyAndSymbol() {
        StateStoreProvider provider = new InMemoryStateStoreProvider();
        provider.storeFor("rsi-reversal", "BTCUSDT").set("losses", 1);

        assertThat(provider.storeFor("rsi-reversal", "BTCUSDT").getInt("losses", 0)).isEqualTo(1);
        assertThat(provider.storeFor("rsi-reversal", "ETHUSDT").getInt("losses", 0)).isZero();
        assertThat(provider.storeFor("breakout", "BTCUSDT").snapshot()).isEmpty();
    }
}
