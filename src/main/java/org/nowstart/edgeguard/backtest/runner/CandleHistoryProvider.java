package org.nowstart.edgeguard.backtest.runner;

import java.util.List;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.type.Timeframe;

/**
 * Source of historical candles for a symbol, oldest first.
 */
public interface CandleHistoryProvider {

    List<Candle> load(String symbol, Timeframe timeframe);
}
