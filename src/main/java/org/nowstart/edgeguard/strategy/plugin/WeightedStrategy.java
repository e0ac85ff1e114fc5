package org.nowstart.edgeguard.strategy.plugin;

import org.nowstart.edgeguard.strategy.core.TradingStrategy;

public record WeightedStrategy(TradingStrategy strategy, double weight) {
}
