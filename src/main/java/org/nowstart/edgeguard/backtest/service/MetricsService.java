package org.nowstart.edgeguard.backtest.service;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.nowstart.edgeguard.data.dto.BacktestMetrics;
import org.nowstart.edgeguard.data.dto.EquityPoint;
import org.nowstart.edgeguard.data.dto.SymbolStats;
import org.nowstart.edgeguard.data.dto.Trade;
import org.nowstart.edgeguard.data.type.ExitReason;
import org.nowstart.edgeguard.util.NumericSafety;
import org.springframework.stereotype.Service;

/**
 * Pure reductions over a trade ledger and an equity curve. Every value is defined for empty input.
 */
@Service
public class MetricsService {

    public BacktestMetrics calculate(List<Trade> trades, double initialEquity, List<EquityPoint> equityCurve) {
        List<Trade> wins = trades.stream().filter(trade -> trade.pnl() > 0).toList();
        List<Trade> losses = trades.stream().filter(trade -> trade.pnl() <= 0).toList();

        double grossProfit = wins.stream().mapToDouble(Trade::pnl).sum();
        double grossLoss = Math.abs(losses.stream().mapToDouble(Trade::pnl).sum());

        Drawdown drawdown = maxDrawdown(initialEquity, equityCurve);
        double[] stepReturns = stepReturns(equityCurve);

        double avgWinPercent = wins.stream().mapToDouble(Trade::pnlPercent).average().orElse(0.0);
        double avgLossPercent = Math.abs(losses.stream().mapToDouble(Trade::pnlPercent).average().orElse(0.0));

        double finalEquity = equityCurve.isEmpty() ? initialEquity : equityCurve.get(equityCurve.size() - 1).equity();

        Map<ExitReason, Integer> exitCounts = new EnumMap<>(ExitReason.class);
        for (Trade trade : trades) {
            exitCounts.merge(trade.exitReason(), 1, Integer::sum);
        }

        return new BacktestMetrics(
                trades.size(),
                wins.size(),
                losses.size(),
                NumericSafety.safeRatio(wins.size(), trades.size()),
                finalEquity - initialEquity,
                NumericSafety.safePercent(finalEquity - initialEquity, initialEquity),
                finalEquity,
                grossProfit,
                grossLoss,
                profitFactor(grossProfit, grossLoss),
                avgWinPercent,
                avgLossPercent,
                NumericSafety.safeRatio(avgWinPercent, avgLossPercent),
                drawdown.percent(),
                drawdown.absolute(),
                sharpeRatio(stepReturns),
                sortinoRatio(stepReturns),
                trades.stream().mapToDouble(Trade::pnlPercent).max().orElse(0.0),
                trades.stream().mapToDouble(Trade::pnlPercent).min().orElse(0.0),
                trades.stream().mapToDouble(Trade::holdingHours).average().orElse(0.0),
                exitCounts
        );
    }

    public Map<String, SymbolStats> symbolStats(List<String> symbols, List<Trade> trades) {
        Map<String, SymbolStats> stats = new LinkedHashMap<>();
        for (String symbol : symbols) {
            List<Trade> symbolTrades = trades.stream().filter(trade -> trade.symbol().equals(symbol)).toList();
            int wins = (int) symbolTrades.stream().filter(trade -> trade.pnl() > 0).count();
            stats.put(symbol, new SymbolStats(
                    symbol,
                    symbolTrades.size(),
                    wins,
                    symbolTrades.size() - wins,
                    symbolTrades.stream().mapToDouble(Trade::pnl).sum(),
                    NumericSafety.safeRatio(wins, symbolTrades.size())
            ));
        }
        return stats;
    }

    /**
     * Profit factor with {@code +Infinity} for wins without losses and {@code 0} when nothing was won.
     */
    public double profitFactor(double grossProfit, double grossLoss) {
        if (grossLoss > 0) {
            return grossProfit / grossLoss;
        }
        return grossProfit > 0 ? Double.POSITIVE_INFINITY : 0.0;
    }

    Drawdown maxDrawdown(double initialEquity, List<EquityPoint> equityCurve) {
        double peak = initialEquity;
        double maxPercent = 0.0;
        double maxAbsolute = 0.0;
        for (EquityPoint point : equityCurve) {
            peak = Math.max(peak, point.equity());
            double drawdown = NumericSafety.safeRatio(peak - point.equity(), peak);
            if (drawdown > maxPercent) {
                maxPercent = drawdown;
                maxAbsolute = peak - point.equity();
            }
        }
        return new Drawdown(maxPercent * 100.0, maxAbsolute);
    }

    double sharpeRatio(double[] returns) {
        if (returns.length < 2) {
            return 0.0;
        }
        double mean = mean(returns);
        double variance = 0.0;
        for (double value : returns) {
            variance += (value - mean) * (value - mean);
        }
        double std = Math.sqrt(variance / (returns.length - 1));
        return std > 0 ? mean / std * Math.sqrt(returns.length) : 0.0;
    }

    double sortinoRatio(double[] returns) {
        double downsideSquares = 0.0;
        int downsideCount = 0;
        for (double value : returns) {
            if (value < 0) {
                downsideSquares += value * value;
                downsideCount++;
            }
        }
        if (downsideCount == 0) {
            return 0.0;
        }
        double downsideDeviation = Math.sqrt(downsideSquares / downsideCount);
        return downsideDeviation > 0 ? mean(returns) / downsideDeviation * Math.sqrt(returns.length) : 0.0;
    }

    private double[] stepReturns(List<EquityPoint> equityCurve) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < equityCurve.size(); i++) {
            double previous = equityCurve.get(i - 1).equity();
            if (previous > 0) {
                returns.add((equityCurve.get(i).equity() - previous) / previous);
            }
        }
        return returns.stream().mapToDouble(Double::doubleValue).toArray();
    }

    private double mean(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    record Drawdown(double percent, double absolute) {
    }
}
