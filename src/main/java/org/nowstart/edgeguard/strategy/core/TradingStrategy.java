package org.nowstart.edgeguard.strategy.core;

import java.util.Map;
import java.util.Optional;
import org.nowstart.edgeguard.data.dto.Trade;
import org.nowstart.edgeguard.data.type.SignalType;

/**
 * Pluggable signal strategy resolved by id from the strategy registry.
 */
public interface TradingStrategy {

    /**
     * Returns the registry key (for example {@code rsi-reversal}).
     */
    String id();

    String name();

    default String description() {
        return "";
    }

    /**
     * Extra indicator values merged into the snapshot before {@link #populateSignal(StrategyContext)}.
     * Built-in indicator names are never overwritten.
     */
    default Map<String, Double> populateIndicators(StrategyContext context) {
        return Map.of();
    }

    /**
     * Decides the signal direction for the last candle of the context window.
     */
    SignalType populateSignal(StrategyContext context);

    /**
     * Optional custom exit evaluated after the built-in exit rules. Empty keeps the position open.
     */
    default Optional<StrategyExit> shouldExit(OpenPositionView position, StrategyContext context) {
        return Optional.empty();
    }

    default void onTradeClosed(Trade trade, StrategyContext context) {
    }
}
