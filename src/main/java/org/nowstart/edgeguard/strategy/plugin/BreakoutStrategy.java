package org.nowstart.edgeguard.strategy.plugin;

import java.util.List;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.type.SignalType;
import org.nowstart.edgeguard.strategy.core.StrategyContext;
import org.nowstart.edgeguard.strategy.core.TradingStrategy;
import org.springframework.stereotype.Component;

/**
 * Close above the highest close of the previous {@value #LOOKBACK} bars with volume confirmation buys;
 * close below the lowest close sells.
 */
@Component
public class BreakoutStrategy implements TradingStrategy {

    public static final String ID = "breakout";
    static final int LOOKBACK = 20;
    static final double VOLUME_MULTIPLIER = 1.5;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Range breakout";
    }

    @Override
    public SignalType populateSignal(StrategyContext context) {
        List<Candle> candles = context.candles();
        if (candles.size() < LOOKBACK + 1) {
            return SignalType.NONE;
        }

        List<Candle> window = candles.subList(candles.size() - LOOKBACK - 1, candles.size() - 1);
        Candle current = candles.get(candles.size() - 1);

        double windowHigh = Double.NEGATIVE_INFINITY;
        double windowLow = Double.POSITIVE_INFINITY;
        double volumeSum = 0.0;
        for (Candle candle : window) {
            windowHigh = Math.max(windowHigh, candle.close());
            windowLow = Math.min(windowLow, candle.close());
            volumeSum += candle.volume();
        }
        double avgVolume = volumeSum / window.size();

        if (current.close() > windowHigh && avgVolume > 0 && current.volume() >= avgVolume * VOLUME_MULTIPLIER) {
            return SignalType.BUY;
        }
        if (current.close() < windowLow) {
            return SignalType.SELL;
        }
        return SignalType.NONE;
    }
}
