package org.nowstart.edgeguard.data.dto;

import java.time.Instant;
import java.util.List;

/**
 * Closed trade as seen by the protection guards.
 *
 * @param pnlRatio realized return as a ratio (0.05 = +5%)
 */
public record TradeRecord(
        String symbol,
        Instant closedAt,
        double pnlRatio,
        boolean stopLoss
) {

    public static TradeRecord from(Trade trade) {
        return new TradeRecord(trade.symbol(), trade.exitTime(), trade.pnlRatio(), trade.exitReason().countsAsStopLoss());
    }

    public static List<TradeRecord> fromTrades(List<Trade> trades) {
        if (trades == null) {
            return List.of();
        }
        return trades.stream().map(TradeRecord::from).toList();
    }
}
