package org.nowstart.edgeguard.backtest.service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.edgeguard.data.dto.BacktestMetrics;
import org.nowstart.edgeguard.data.dto.BacktestResult;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.dto.ExternalContext;
import org.nowstart.edgeguard.data.dto.SignalEngineResult;
import org.nowstart.edgeguard.data.dto.Trade;
import org.nowstart.edgeguard.data.dto.TradeRecord;
import org.nowstart.edgeguard.data.property.RiskProperties;
import org.nowstart.edgeguard.data.property.TradingProperties;
import org.nowstart.edgeguard.data.type.ExitReason;
import org.nowstart.edgeguard.data.type.PositionSide;
import org.nowstart.edgeguard.data.type.SignalType;
import org.nowstart.edgeguard.service.position.ExitDecision;
import org.nowstart.edgeguard.service.position.Position;
import org.nowstart.edgeguard.service.position.PositionLifecycleService;
import org.nowstart.edgeguard.service.signal.SignalEngineService;
import org.nowstart.edgeguard.strategy.StrategyRegistry;
import org.nowstart.edgeguard.strategy.core.InMemoryStateStoreProvider;
import org.nowstart.edgeguard.strategy.core.StateStoreProvider;
import org.nowstart.edgeguard.strategy.core.StrategyContext;
import org.nowstart.edgeguard.strategy.core.StrategyExit;
import org.nowstart.edgeguard.strategy.core.TradingStrategy;
import org.nowstart.edgeguard.util.NumericSafety;
import org.springframework.stereotype.Service;

/**
 * Replays candle series in lockstep over the timestamps every symbol has.
 *
 * <p>Per tick: pending next-open orders, then exits of open positions, then new signals, then one
 * equity point. Positions still open after the last candle are closed at its close with
 * {@link ExitReason#FORCED}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestService {

    private final SignalEngineService signalEngineService;
    private final PositionLifecycleService positionLifecycleService;
    private final StrategyRegistry strategyRegistry;
    private final MetricsService metricsService;

    public BacktestResult run(String symbol, List<Candle> candles, TradingProperties config) {
        Map<String, List<Candle>> candlesBySymbol = new LinkedHashMap<>();
        candlesBySymbol.put(symbol, candles);
        return run(candlesBySymbol, config);
    }

    public BacktestResult run(Map<String, List<Candle>> candlesBySymbol, TradingProperties config) {
        if (candlesBySymbol == null || candlesBySymbol.isEmpty()) {
            throw new IllegalArgumentException("At least one symbol is required");
        }
        List<String> symbols = List.copyOf(candlesBySymbol.keySet());
        Map<String, Map<Instant, Candle>> index = indexByOpenTime(candlesBySymbol);
        List<Instant> clock = commonTimes(symbols, index);

        int warmup = config.backtestWarmupCandles();
        int windowCap = warmup * 2;
        double initialEquity = config.backtest().initialEquity();
        boolean nextOpen = config.backtest().signalToNextOpen();
        boolean intracandle = config.backtest().intracandle();

        TradingStrategy strategy = strategyRegistry.resolve(config);
        StateStoreProvider stateStores = new InMemoryStateStoreProvider();
        BacktestAccount account = new BacktestAccount(initialEquity, config.costs());
        Map<String, Deque<Candle>> windows = new HashMap<>();
        symbols.forEach(symbol -> windows.put(symbol, new ArrayDeque<>()));
        Map<String, PendingOrder> pending = new LinkedHashMap<>();

        for (Instant time : clock) {
            Map<String, Double> prices = new HashMap<>();
            for (String symbol : symbols) {
                Candle candle = index.get(symbol).get(time);
                Deque<Candle> window = windows.get(symbol);
                window.addLast(candle);
                if (window.size() > windowCap) {
                    window.removeFirst();
                }
                prices.put(symbol, candle.close());
            }
            if (windows.values().stream().allMatch(window -> window.size() < warmup)) {
                account.recordEquity(time, prices);
                continue;
            }

            for (Map.Entry<String, PendingOrder> order : pending.entrySet()) {
                Candle candle = index.get(order.getKey()).get(time);
                execute(account, order.getKey(), order.getValue(), candle.open(), time, prices, strategy, stateStores, windows, config);
            }
            pending.clear();

            for (String symbol : symbols) {
                Optional<Position> open = account.position(symbol);
                if (open.isEmpty()) {
                    continue;
                }
                Optional<ExitDecision> exit = positionLifecycleService.evaluateExit(
                        open.get(), index.get(symbol).get(time), config.risk(), intracandle, time
                );
                if (exit.isPresent()) {
                    closeAndNotify(account, symbol, exit.get().exitPrice(), time, exit.get().reason(), strategy, stateStores, windows, config);
                }
            }

            List<TradeRecord> recentTrades = config.protections().anyEnabled()
                    ? TradeRecord.fromTrades(account.trades())
                    : List.of();
            for (String symbol : symbols) {
                Deque<Candle> window = windows.get(symbol);
                if (window.size() < warmup) {
                    continue;
                }
                Candle candle = index.get(symbol).get(time);
                List<Candle> candles = List.copyOf(window);
                Position position = account.position(symbol).orElse(null);
                PositionSide side = position == null ? null : position.getSide();

                ExternalContext context = ExternalContext.forBacktest(
                        side,
                        heldCandles(symbol, account, windows, config),
                        stateStores.storeFor(strategy.id(), symbol)
                );
                SignalEngineResult result = signalEngineService.processSignal(symbol, candles, config, context, recentTrades);
                if (result.indicators() == null || result.rejected()) {
                    continue;
                }

                SignalType type = result.signal().type();
                if (type == SignalType.NONE && position != null) {
                    StrategyContext strategyContext = new StrategyContext(
                            symbol, candles, config, result.indicators(), side, time, context.stateStore()
                    );
                    Optional<StrategyExit> custom = strategy.shouldExit(position.view(candle.close(), time), strategyContext);
                    if (custom.isPresent()) {
                        log.debug("event=strategy_exit symbol={} reason={}", symbol, custom.get().reason());
                        type = side == PositionSide.LONG ? SignalType.SELL : SignalType.COVER;
                    }
                }
                if (type == SignalType.NONE) {
                    continue;
                }

                PendingOrder order = new PendingOrder(type, result.effectiveRisk(), result.effectivePositionRatio());
                if (nextOpen) {
                    pending.put(symbol, order);
                } else {
                    execute(account, symbol, order, candle.close(), time, prices, strategy, stateStores, windows, config);
                }
            }

            account.recordEquity(time, prices);
        }

        if (!clock.isEmpty()) {
            Instant last = clock.get(clock.size() - 1);
            for (String symbol : List.copyOf(account.positions().keySet())) {
                double close = index.get(symbol).get(last).close();
                closeAndNotify(account, symbol, close, last, ExitReason.FORCED, strategy, stateStores, windows, config);
            }
        }

        List<Trade> trades = List.copyOf(account.trades());
        BacktestMetrics metrics = metricsService.calculate(trades, initialEquity, account.equityCurve());
        log.info("event=backtest_done symbols={} candles={} trades={} return_pct={} max_drawdown_pct={} sharpe={}",
                symbols,
                clock.size(),
                metrics.totalTrades(),
                NumericSafety.sanitizeForLog(metrics.totalReturnPercent()),
                NumericSafety.sanitizeForLog(metrics.maxDrawdownPercent()),
                NumericSafety.sanitizeForLog(metrics.sharpeRatio()));

        return new BacktestResult(
                config,
                symbols,
                clock.isEmpty() ? null : clock.get(0),
                clock.isEmpty() ? null : clock.get(clock.size() - 1),
                trades,
                account.equityCurve(),
                metrics,
                metricsService.symbolStats(symbols, trades)
        );
    }

    private void execute(
            BacktestAccount account,
            String symbol,
            PendingOrder order,
            double price,
            Instant time,
            Map<String, Double> prices,
            TradingStrategy strategy,
            StateStoreProvider stateStores,
            Map<String, Deque<Candle>> windows,
            TradingProperties config
    ) {
        switch (order.type()) {
            case BUY, SHORT -> account.open(
                    symbol,
                    PositionSide.forOpening(order.type()),
                    price,
                    time,
                    order.risk(),
                    order.positionRatio(),
                    prices
            );
            case SELL, COVER -> closeAndNotify(account, symbol, price, time, ExitReason.SIGNAL, strategy, stateStores, windows, config);
            case NONE -> {
            }
        }
    }

    private void closeAndNotify(
            BacktestAccount account,
            String symbol,
            double price,
            Instant time,
            ExitReason reason,
            TradingStrategy strategy,
            StateStoreProvider stateStores,
            Map<String, Deque<Candle>> windows,
            TradingProperties config
    ) {
        account.close(symbol, price, time, reason).ifPresent(trade -> strategy.onTradeClosed(
                trade,
                new StrategyContext(
                        symbol,
                        List.copyOf(windows.get(symbol)),
                        config,
                        null,
                        null,
                        time,
                        stateStores.storeFor(strategy.id(), symbol)
                )
        ));
    }

    private Map<String, List<Candle>> heldCandles(
            String symbol,
            BacktestAccount account,
            Map<String, Deque<Candle>> windows,
            TradingProperties config
    ) {
        if (!config.risk().correlation().enabled()) {
            return Map.of();
        }
        Map<String, List<Candle>> held = new LinkedHashMap<>();
        for (String heldSymbol : account.positions().keySet()) {
            if (!heldSymbol.equals(symbol)) {
                held.put(heldSymbol, List.copyOf(windows.get(heldSymbol)));
            }
        }
        return held;
    }

    private Map<String, Map<Instant, Candle>> indexByOpenTime(Map<String, List<Candle>> candlesBySymbol) {
        Map<String, Map<Instant, Candle>> index = new HashMap<>();
        candlesBySymbol.forEach((symbol, candles) -> {
            Map<Instant, Candle> byTime = new HashMap<>();
            if (candles != null) {
                candles.forEach(candle -> byTime.put(candle.openTime(), candle));
            }
            index.put(symbol, byTime);
        });
        return index;
    }

    private List<Instant> commonTimes(List<String> symbols, Map<String, Map<Instant, Candle>> index) {
        Set<Instant> common = new TreeSet<>(index.get(symbols.get(0)).keySet());
        for (String symbol : symbols.subList(1, symbols.size())) {
            common.retainAll(index.get(symbol).keySet());
        }
        return new ArrayList<>(common);
    }

    private record PendingOrder(SignalType type, RiskProperties risk, double positionRatio) {
    }
}
