package org.nowstart.edgeguard.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.nio.file.Path;
import org.nowstart.edgeguard.strategy.core.InMemoryStateStoreProvider;
import org.nowstart.edgeguard.strategy.core.JsonFileStateStoreProvider;
import org.nowstart.edgeguard.strategy.core.StateStoreProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class StateStoreConfig {

    @Bean
    @ConditionalOnProperty(prefix = "edgeguard.state", name = "directory")
    public StateStoreProvider jsonFileStateStoreProvider(
            @Value("${edgeguard.state.directory}") String directory,
            ObjectMapper objectMapper
    ) {
        return new JsonFileStateStoreProvider(Path.of(directory), objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean(StateStoreProvider.class)
    public StateStoreProvider inMemoryStateStoreProvider() {
        return new InMemoryStateStoreProvider();
    }
}
