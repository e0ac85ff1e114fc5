package org.nowstart.edgeguard.strategy.core;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JsonFileStateStoreTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void set_persistsAcrossInstances() {
        Path file = tempDir.resolve("nested/rsi-reversal_BTCUSDT.json");
        new JsonFileStateStore(file, objectMapper).set("consecutiveLosses", 2);

        StateStore reopened = new JsonFileStateStore(file, objectMapper);

        assertThat(reopened.getInt("consecutiveLosses", 0)).isEqualTo(2);
    }

    @Test
    void delete_removesPersistedKey() {
        Path file = tempDir.resolve("state.json");
        StateStore store = new JsonFileStateStore(file, objectMapper);
        store.set("a", 1.5);
        store.set("b", "x");

        store.delete("a");

        StateStore reopened = new JsonFileStateStore(file, objectMapper);
        assertThat(reopened.get("a")).isEmpty();
        assertThat(reopened.snapshot()).containsEntry("b", "x");
    }

    @Test
    void constructor_startsEmptyForUnreadableFile() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{not json");

        StateStore store = new JsonFileStateStore(file, objectMapper);

        assertThat(store.snapshot()).isEmpty();
        assertThat(store.getDouble("missing", 7.0)).isEqualTo(7.0);
    }

    @Test
    void storeFor_sanitizesFileNameAndReusesStore() {
        JsonFileStateStoreProvider provider = new JsonFileStateStoreProvider(tempDir, objectMapper);

        StateStore store = provider.storeFor("rsi-reversal", "BTC/USDT");
        store.set("k", 1);

        assertThat(provider.storeFor("rsi-reversal", "BTC/USDT")).isSameAs(store);
        assertThat(tempDir.resolve("rsi-reversal_BTC_USDT.json")).exists();
    }
}
