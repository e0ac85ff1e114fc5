package org.nowstart.edgeguard.strategy.core;

public record StrategyExit(String reason) {
}
