package org.nowstart.edgeguard.service.signal;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.dto.CorrelationResult;
import org.nowstart.edgeguard.data.dto.ExternalContext;
import org.nowstart.edgeguard.data.dto.IndicatorSnapshot;
import org.nowstart.edgeguard.data.dto.ProtectionResult;
import org.nowstart.edgeguard.data.dto.RegimeAnalysis;
import org.nowstart.edgeguard.data.dto.RiskRewardResult;
import org.nowstart.edgeguard.data.dto.Signal;
import org.nowstart.edgeguard.data.dto.SignalEngineResult;
import org.nowstart.edgeguard.data.dto.TradeRecord;
import org.nowstart.edgeguard.data.property.CorrelationProperties;
import org.nowstart.edgeguard.data.property.RegimeFilterProperties;
import org.nowstart.edgeguard.data.property.RiskProperties;
import org.nowstart.edgeguard.data.property.TradingProperties;
import org.nowstart.edgeguard.data.type.PositionSide;
import org.nowstart.edgeguard.data.type.SignalFilterMode;
import org.nowstart.edgeguard.data.type.SignalType;
import org.nowstart.edgeguard.service.indicator.IndicatorService;
import org.nowstart.edgeguard.service.regime.RegimeClassifier;
import org.nowstart.edgeguard.service.risk.CorrelationFilter;
import org.nowstart.edgeguard.service.risk.ProtectionManager;
import org.nowstart.edgeguard.service.risk.RiskRewardFilter;
import org.nowstart.edgeguard.strategy.StrategyRegistry;
import org.nowstart.edgeguard.strategy.core.StateStore;
import org.nowstart.edgeguard.strategy.core.StateStoreProvider;
import org.nowstart.edgeguard.strategy.core.StrategyContext;
import org.nowstart.edgeguard.strategy.core.TradingStrategy;
import org.springframework.stereotype.Service;

/**
 * Single tick entry point shared by live monitoring and the backtest runner.
 *
 * <p>Indicators, then signal detection, then the opening-signal gates in fixed order: regime,
 * risk-reward, correlation, protections. Closing signals and {@code none} are never filtered.
 * The result depends only on the arguments; the tick time is the close time of the last candle.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SignalEngineService {

    public static final String INSUFFICIENT_DATA = "insufficient data";
    static final String STRATEGY_REASON_PREFIX = "strategy:";
    static final double SIZE_REDUCTION = 0.5;

    private final IndicatorService indicatorService;
    private final RegimeClassifier regimeClassifier;
    private final RuleSignalDetector ruleSignalDetector;
    private final RiskRewardFilter riskRewardFilter;
    private final CorrelationFilter correlationFilter;
    private final ProtectionManager protectionManager;
    private final StrategyRegistry strategyRegistry;
    private final StateStoreProvider stateStoreProvider;

    public SignalEngineResult processSignal(
            String symbol,
            List<Candle> candles,
            TradingProperties config,
            ExternalContext external,
            List<TradeRecord> recentTrades
    ) {
        ExternalContext context = external != null ? external : ExternalContext.EMPTY;
        RiskProperties risk = config.risk();
        Instant timestamp = candles.isEmpty() ? null : candles.get(candles.size() - 1).closeTime();

        Optional<IndicatorSnapshot> calculated = indicatorService.calculate(candles, config.indicators());
        if (calculated.isEmpty()) {
            double lastClose = candles.isEmpty() ? 0.0 : candles.get(candles.size() - 1).close();
            return SignalEngineResult.rejected(
                    null,
                    Signal.none(symbol, lastClose, null, timestamp),
                    risk,
                    risk.positionRatio(),
                    INSUFFICIENT_DATA,
                    null
            );
        }
        IndicatorSnapshot indicators = calculated.get().withExternalContext(context);

        Signal signal = detect(symbol, candles, config, indicators, context, timestamp);
        if (!signal.type().isOpening()) {
            return SignalEngineResult.accepted(signal.indicators(), signal, risk, risk.positionRatio(), null);
        }
        return filterOpening(symbol, candles, config, context, recentTrades, signal, timestamp);
    }

    private Signal detect(
            String symbol,
            List<Candle> candles,
            TradingProperties config,
            IndicatorSnapshot indicators,
            ExternalContext context,
            Instant timestamp
    ) {
        if (TradingProperties.DEFAULT_STRATEGY_ID.equalsIgnoreCase(config.strategyId())) {
            return ruleSignalDetector.detect(symbol, indicators, config, context.currentSide(), timestamp);
        }

        TradingStrategy strategy = strategyRegistry.resolve(config);
        StateStore stateStore = context.stateStore() != null
                ? context.stateStore()
                : stateStoreProvider.storeFor(strategy.id(), symbol);
        StrategyContext strategyContext = new StrategyContext(
                symbol, candles, config, indicators, context.currentSide(), timestamp, stateStore
        );
        IndicatorSnapshot enriched = indicators.withExtra(strategy.populateIndicators(strategyContext));
        SignalType type = allowedFor(strategy.populateSignal(strategyContext.withIndicators(enriched)), context.currentSide());

        if (type == SignalType.NONE) {
            return Signal.none(symbol, enriched.price(), enriched, timestamp);
        }
        return new Signal(symbol, type, enriched.price(), enriched, List.of(STRATEGY_REASON_PREFIX + strategy.id()), timestamp);
    }

    /**
     * Plugin signals that do not fit the held side are dropped, the same way rule detection only looks
     * at the directions available for that side.
     */
    private SignalType allowedFor(SignalType type, PositionSide currentSide) {
        if (type == null) {
            return SignalType.NONE;
        }
        if (currentSide == PositionSide.LONG) {
            return type == SignalType.SELL ? type : SignalType.NONE;
        }
        if (currentSide == PositionSide.SHORT) {
            return type == SignalType.COVER ? type : SignalType.NONE;
        }
        return type.isOpening() ? type : SignalType.NONE;
    }

    private SignalEngineResult filterOpening(
            String symbol,
            List<Candle> candles,
            TradingProperties config,
            ExternalContext context,
            List<TradeRecord> recentTrades,
            Signal signal,
            Instant timestamp
    ) {
        RiskProperties effectiveRisk = config.risk();
        double basePositionRatio = effectiveRisk.positionRatio();
        double positionRatio = basePositionRatio;
        String regimeLabel = null;

        RegimeFilterProperties regimeFilter = config.risk().regimeFilter();
        if (regimeFilter.enabled()) {
            RegimeAnalysis regime = regimeClassifier.classify(candles);
            if (regime.confidence() >= regimeFilter.minConfidence()) {
                regimeLabel = regime.label();
                SignalFilterMode mode = regime.filterMode();

                if (mode == SignalFilterMode.BREAKOUT_WATCH) {
                    return reject(signal, effectiveRisk, positionRatio, "regime " + regimeLabel + " " + regime.detail(), regimeLabel);
                }
                if (!conditionsAllowed(signal, mode, regimeFilter)) {
                    return reject(signal, effectiveRisk, positionRatio,
                            "regime " + regimeLabel + " allows only " + mode.label() + " conditions", regimeLabel);
                }

                effectiveRisk = effectiveRisk.merge(config.risk().regimeOverrides().get(mode));
                basePositionRatio = effectiveRisk.positionRatio();
                positionRatio = basePositionRatio;
                if (mode == SignalFilterMode.REDUCED_SIZE) {
                    positionRatio = basePositionRatio * SIZE_REDUCTION;
                }
            }
        }

        if (effectiveRisk.minRr() > 0) {
            RiskRewardResult rr = riskRewardFilter.check(
                    candles,
                    signal.price(),
                    PositionSide.forOpening(signal.type()),
                    effectiveRisk.minRr(),
                    effectiveRisk.rrLookback(),
                    context.supportLevel(),
                    context.resistanceLevel()
            );
            if (!rr.passed()) {
                return reject(signal, effectiveRisk, positionRatio, "risk-reward " + rr.reason(), regimeLabel);
            }
        }

        CorrelationProperties correlation = config.risk().correlation();
        if (correlation.enabled() && !context.heldCandles().isEmpty()) {
            Map<String, List<Candle>> held = new LinkedHashMap<>(context.heldCandles());
            held.remove(symbol);
            CorrelationResult result = correlationFilter.check(
                    symbol, candles, held, correlation.threshold(), correlation.lookback()
            );
            if (result.correlated()) {
                positionRatio = Math.min(positionRatio, basePositionRatio * SIZE_REDUCTION);
                log.debug("event=correlation_size_reduced symbol={} correlated_with={} correlation={}",
                        symbol, result.correlatedWith(), result.maxCorrelation());
            }
        }

        if (recentTrades != null && !recentTrades.isEmpty() && timestamp != null) {
            ProtectionResult protection = protectionManager.check(
                    symbol, config.protections(), recentTrades, config.timeframe(), timestamp
            );
            if (!protection.allowed()) {
                return reject(signal, effectiveRisk, positionRatio,
                        "protection " + protection.protection() + " " + protection.reason(), regimeLabel);
            }
        }

        return SignalEngineResult.accepted(signal.indicators(), signal, effectiveRisk, positionRatio, regimeLabel);
    }

    private boolean conditionsAllowed(Signal signal, SignalFilterMode mode, RegimeFilterProperties regimeFilter) {
        Set<String> allowed;
        if (mode == SignalFilterMode.TREND_ONLY) {
            allowed = regimeFilter.resolvedTrendConditions();
        } else if (mode == SignalFilterMode.REVERSAL_ONLY) {
            allowed = regimeFilter.resolvedReversalConditions();
        } else {
            return true;
        }
        return signal.reasons().stream()
                .anyMatch(reason -> reason.startsWith(STRATEGY_REASON_PREFIX) || allowed.contains(reason));
    }

    private SignalEngineResult reject(
            Signal signal,
            RiskProperties effectiveRisk,
            double positionRatio,
            String reason,
            String regimeLabel
    ) {
        log.info("event=signal_rejected symbol={} signal={} reason={}", signal.symbol(), signal.type().label(), reason);
        return SignalEngineResult.rejected(signal.indicators(), signal, effectiveRisk, positionRatio, reason, regimeLabel);
    }
}
