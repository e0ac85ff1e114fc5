package org.nowstart.edgeguard.strategy.core;

import java.time.Instant;
import java.util.List;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.dto.IndicatorSnapshot;
import org.nowstart.edgeguard.data.property.TradingProperties;
import org.nowstart.edgeguard.data.type.PositionSide;

/**
 * Everything a strategy may read while evaluating one tick.
 *
 * @param currentSide held side for the symbol, {@code null} when flat
 */
public record StrategyContext(
        String symbol,
        List<Candle> candles,
        TradingProperties config,
        IndicatorSnapshot indicators,
        PositionSide currentSide,
        Instant timestamp,
        StateStore stateStore
) {

    public StrategyContext {
        candles = List.copyOf(candles);
        stateStore = stateStore != null ? stateStore : new InMemoryStateStore();
    }

    public StrategyContext withIndicators(IndicatorSnapshot updated) {
        return new StrategyContext(symbol, candles, config, updated, currentSide, timestamp, stateStore);
    }
}
