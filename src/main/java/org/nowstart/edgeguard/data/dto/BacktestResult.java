package org.nowstart.edgeguard.data.dto;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.nowstart.edgeguard.data.property.TradingProperties;

public record BacktestResult(
        TradingProperties config,
        List<String> symbols,
        Instant startTime,
        Instant endTime,
        List<Trade> trades,
        List<EquityPoint> equityCurve,
        BacktestMetrics metrics,
        Map<String, SymbolStats> symbolStats
) {

    public BacktestResult {
        symbols = List.copyOf(symbols);
        trades = List.copyOf(trades);
        equityCurve = List.copyOf(equityCurve);
        symbolStats = Map.copyOf(symbolStats);
    }
}
