package org.nowstart.edgeguard.data.dto;

import java.util.Map;
import org.nowstart.edgeguard.data.type.ExitReason;

/**
 * Aggregate performance of one backtest run. Percent fields are in percent units (5.0 = 5%),
 * {@code winRate} is a ratio.
 *
 * @param profitFactor     gross profit over gross loss; {@code +Infinity} with wins and no losses,
 *                         {@code 0} when there are no wins
 * @param avgLossPercent   average losing trade return as a positive magnitude
 * @param maxDrawdownUsdt  absolute drawdown at the deepest percent drawdown point
 */
public record BacktestMetrics(
        int totalTrades,
        int wins,
        int losses,
        double winRate,
        double totalReturn,
        double totalReturnPercent,
        double finalEquity,
        double grossProfit,
        double grossLoss,
        double profitFactor,
        double avgWinPercent,
        double avgLossPercent,
        double winLossRatio,
        double maxDrawdownPercent,
        double maxDrawdownUsdt,
        double sharpeRatio,
        double sortinoRatio,
        double bestTradePercent,
        double worstTradePercent,
        double avgHoldingHours,
        Map<ExitReason, Integer> exitReasonCounts
) {

    public BacktestMetrics {
        exitReasonCounts = exitReasonCounts != null ? Map.copyOf(exitReasonCounts) : Map.of();
    }

    public int exitCount(ExitReason reason) {
        return exitReasonCounts.getOrDefault(reason, 0);
    }
}
