package org.nowstart.edgeguard.strategy;

import jakarta.annotation.PostConstruct;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.edgeguard.data.exception.TradingConfigurationException;
import org.nowstart.edgeguard.data.property.EnsembleMemberProperties;
import org.nowstart.edgeguard.data.property.EnsembleProperties;
import org.nowstart.edgeguard.data.property.TradingProperties;
import org.nowstart.edgeguard.strategy.core.TradingStrategy;
import org.nowstart.edgeguard.strategy.plugin.EnsembleStrategy;
import org.nowstart.edgeguard.strategy.plugin.WeightedStrategy;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class StrategyRegistry {

    private final List<TradingStrategy> strategies;
    private Map<String, TradingStrategy> strategiesById = Map.of();
    private final Map<EnsembleProperties, EnsembleStrategy> ensembles = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        Map<String, TradingStrategy> byId = new HashMap<>();
        for (TradingStrategy strategy : strategies) {
            String id = normalize(strategy.id());
            if (EnsembleStrategy.ID.equals(id)) {
                throw new TradingConfigurationException(
                        TradingConfigurationException.DUPLICATE_STRATEGY,
                        "Strategy id is reserved: " + id
                );
            }
            TradingStrategy previous = byId.put(id, strategy);
            if (previous != null) {
                throw new TradingConfigurationException(
                        TradingConfigurationException.DUPLICATE_STRATEGY,
                        "Duplicate strategy registered for id=" + id
                );
            }
        }
        strategiesById = Map.copyOf(byId);
        log.info("event=strategy_registry_ready strategies={}", registeredIds());
    }

    public Optional<TradingStrategy> find(String strategyId) {
        if (strategyId == null || strategyId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(strategiesById.get(normalize(strategyId)));
    }

    public TradingStrategy getRequired(String strategyId) {
        return find(strategyId).orElseThrow(() -> new TradingConfigurationException(
                TradingConfigurationException.STRATEGY_NOT_FOUND,
                "No strategy registered for id=" + strategyId + ", registered=" + registeredIds()
        ));
    }

    /**
     * Strategy for the configured id. {@code ensemble} builds a weighted vote over the configured members.
     */
    public TradingStrategy resolve(TradingProperties config) {
        if (EnsembleStrategy.ID.equals(normalize(config.strategyId()))) {
            return ensemble(config.ensemble());
        }
        return getRequired(config.strategyId());
    }

    public EnsembleStrategy ensemble(EnsembleProperties properties) {
        return ensembles.computeIfAbsent(properties, this::buildEnsemble);
    }

    public Set<String> registeredIds() {
        return new TreeSet<>(strategiesById.keySet());
    }

    private EnsembleStrategy buildEnsemble(EnsembleProperties properties) {
        List<WeightedStrategy> members = new ArrayList<>();
        for (EnsembleMemberProperties member : properties.members()) {
            Optional<TradingStrategy> strategy = find(member.id());
            if (strategy.isEmpty()) {
                log.warn("event=ensemble_member_missing strategy={} registered={}", member.id(), registeredIds());
                continue;
            }
            members.add(new WeightedStrategy(strategy.get(), member.weight()));
        }
        return new EnsembleStrategy(members, properties.threshold(), properties.unanimous());
    }

    private String normalize(String strategyId) {
        if (strategyId == null || strategyId.isBlank()) {
            throw new IllegalArgumentException("strategyId is required");
        }
        return strategyId.trim().toLowerCase(Locale.ROOT);
    }
}
