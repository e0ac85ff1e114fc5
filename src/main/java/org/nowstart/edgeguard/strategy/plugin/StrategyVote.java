package org.nowstart.edgeguard.strategy.plugin;

import org.nowstart.edgeguard.data.type.SignalType;

public record StrategyVote(String strategyId, SignalType signal, double weight) {
}
