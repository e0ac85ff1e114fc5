package org.nowstart.edgeguard.service.risk;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.edgeguard.data.dto.ProtectionResult;
import org.nowstart.edgeguard.data.dto.TradeRecord;
import org.nowstart.edgeguard.data.property.GuardProperties;
import org.nowstart.edgeguard.data.property.ProtectionProperties;
import org.nowstart.edgeguard.data.type.Timeframe;
import org.springframework.stereotype.Service;

/**
 * Entry circuit breakers driven by recently closed trades. Windows are measured in candles of the
 * configured timeframe. A guard blocks while its condition holds over the lookback ending now, and for
 * {@code stopDurationCandles} after the latest trade that made it hold. {@code now} is supplied by the
 * caller so that live ticks and backtest replays evaluate identically.
 */
@Slf4j
@Service
public class ProtectionManager {

    public static final String COOLDOWN = "cooldown";
    public static final String STOPLOSS_GUARD = "stoploss_guard";
    public static final String MAX_DRAWDOWN = "max_drawdown";
    public static final String LOW_PROFIT_PAIRS = "low_profit_pairs";

    public ProtectionResult check(
            String symbol,
            ProtectionProperties protections,
            List<TradeRecord> recentTrades,
            Timeframe timeframe,
            Instant now
    ) {
        if (recentTrades == null || recentTrades.isEmpty() || !protections.anyEnabled()) {
            return ProtectionResult.ALLOWED;
        }
        List<TradeRecord> closed = recentTrades.stream()
                .filter(trade -> trade.closedAt() != null && !trade.closedAt().isAfter(now))
                .sorted(Comparator.comparing(TradeRecord::closedAt))
                .toList();
        Duration candle = timeframe.interval();

        ProtectionResult result = cooldown(symbol, protections.cooldown(), closed, candle, now)
                .or(() -> stoplossGuard(symbol, protections.stoplossGuard(), closed, candle, now))
                .or(() -> maxDrawdown(protections.maxDrawdown(), closed, candle, now))
                .or(() -> lowProfitPairs(symbol, protections.lowProfitPairs(), closed, candle, now))
                .orElse(ProtectionResult.ALLOWED);

        if (!result.allowed()) {
            log.info("event=protection_block symbol={} protection={} blocked_until={} reason={}",
                    symbol, result.protection(), result.blockedUntil(), result.reason());
        }
        return result;
    }

    private Optional<ProtectionResult> cooldown(
            String symbol,
            GuardProperties guard,
            List<TradeRecord> trades,
            Duration candle,
            Instant now
    ) {
        if (!guard.enabled()) {
            return Optional.empty();
        }
        Duration stop = candle.multipliedBy(guard.stopDurationCandles());
        Instant windowStart = now.minus(stop);
        return latest(trades, trade -> trade.symbol().equals(symbol) && trade.stopLoss() && !trade.closedAt().isBefore(windowStart))
                .map(trade -> ProtectionResult.blocked(
                        COOLDOWN,
                        format("%s stop-loss within last %d candles", symbol, guard.stopDurationCandles()),
                        trade.closedAt().plus(stop)
                ));
    }

    private Optional<ProtectionResult> stoplossGuard(
            String symbol,
            GuardProperties guard,
            List<TradeRecord> trades,
            Duration candle,
            Instant now
    ) {
        if (!guard.enabled()) {
            return Optional.empty();
        }
        Predicate<TradeRecord> counted = trade -> trade.stopLoss() && (!guard.onlyPerPair() || trade.symbol().equals(symbol));
        WindowCheck check = (end) -> {
            long stopLosses = inWindow(trades, guard, candle, end).stream().filter(counted).count();
            return stopLosses >= guard.tradeLimit();
        };
        String scope = guard.onlyPerPair() ? symbol : "all symbols";
        return evaluate(STOPLOSS_GUARD, guard, trades, counted, candle, now, check,
                format("%d+ stop-losses on %s within %d candles", guard.tradeLimit(), scope, guard.lookbackPeriodCandles()));
    }

    private Optional<ProtectionResult> maxDrawdown(
            GuardProperties guard,
            List<TradeRecord> trades,
            Duration candle,
            Instant now
    ) {
        if (!guard.enabled()) {
            return Optional.empty();
        }
        double limit = -Math.abs(guard.maxAllowedDrawdown());
        WindowCheck check = (end) -> {
            List<TradeRecord> window = inWindow(trades, guard, candle, end);
            if (window.size() < guard.tradeLimit()) {
                return false;
            }
            return window.stream().mapToDouble(TradeRecord::pnlRatio).sum() <= limit;
        };
        return evaluate(MAX_DRAWDOWN, guard, trades, trade -> true, candle, now, check,
                format("summed pnl within %d candles <= %.1f%%", guard.lookbackPeriodCandles(), limit * 100));
    }

    private Optional<ProtectionResult> lowProfitPairs(
            String symbol,
            GuardProperties guard,
            List<TradeRecord> trades,
            Duration candle,
            Instant now
    ) {
        if (!guard.enabled()) {
            return Optional.empty();
        }
        Predicate<TradeRecord> pair = trade -> trade.symbol().equals(symbol);
        WindowCheck check = (end) -> {
            List<TradeRecord> window = inWindow(trades, guard, candle, end).stream().filter(pair).toList();
            if (window.isEmpty() || window.size() < guard.tradeLimit()) {
                return false;
            }
            double average = window.stream().mapToDouble(TradeRecord::pnlRatio).average().orElse(0.0);
            return average < guard.requiredProfit();
        };
        return evaluate(LOW_PROFIT_PAIRS, guard, trades, pair, candle, now, check,
                format("%s average pnl within %d candles < %.2f%%", symbol, guard.lookbackPeriodCandles(), guard.requiredProfit() * 100));
    }

    private Optional<ProtectionResult> evaluate(
            String protection,
            GuardProperties guard,
            List<TradeRecord> trades,
            Predicate<TradeRecord> relevant,
            Duration candle,
            Instant now,
            WindowCheck check,
            String reason
    ) {
        Optional<TradeRecord> anchor = latest(trades, relevant);
        if (anchor.isEmpty()) {
            return Optional.empty();
        }
        Instant blockedUntil = anchor.get().closedAt().plus(candle.multipliedBy(guard.stopDurationCandles()));

        if (check.triggered(now)) {
            Instant until = blockedUntil.isAfter(now) ? blockedUntil : now;
            return Optional.of(ProtectionResult.blocked(protection, reason, until));
        }
        if (now.isBefore(blockedUntil) && check.triggered(anchor.get().closedAt())) {
            return Optional.of(ProtectionResult.blocked(protection, reason, blockedUntil));
        }
        return Optional.empty();
    }

    private List<TradeRecord> inWindow(List<TradeRecord> trades, GuardProperties guard, Duration candle, Instant end) {
        Instant start = end.minus(candle.multipliedBy(guard.lookbackPeriodCandles()));
        return trades.stream()
                .filter(trade -> !trade.closedAt().isBefore(start) && !trade.closedAt().isAfter(end))
                .toList();
    }

    private Optional<TradeRecord> latest(List<TradeRecord> trades, Predicate<TradeRecord> filter) {
        return trades.stream().filter(filter).max(Comparator.comparing(TradeRecord::closedAt));
    }

    private String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    @FunctionalInterface
    private interface WindowCheck {
        boolean triggered(Instant windowEnd);
    }
}
