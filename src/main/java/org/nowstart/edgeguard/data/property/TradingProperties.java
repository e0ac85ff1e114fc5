package org.nowstart.edgeguard.data.property;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import org.nowstart.edgeguard.data.type.Timeframe;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Resolved trading configuration shared by the live signal path and the backtest engine.
 *
 * <p>Every section normalizes missing values to defaults, so {@code TradingProperties.builder().build()}
 * is a complete configuration.
 */
@Validated
@Builder(toBuilder = true)
@ConfigurationProperties(prefix = "edgeguard.trading")
public record TradingProperties(
        // "default" 는 규칙 기반 감지기, 그 외는 전략 레지스트리 조회
        @NotBlank String strategyId,
        // 캔들 주기
        Timeframe timeframe,
        IndicatorProperties indicators,
        SignalProperties signals,
        RiskProperties risk,
        ProtectionProperties protections,
        CostProperties costs,
        BacktestProperties backtest,
        EnsembleProperties ensemble
) {

    public static final String DEFAULT_STRATEGY_ID = "default";

    public TradingProperties {
        strategyId = strategyId != null && !strategyId.isBlank() ? strategyId.trim() : DEFAULT_STRATEGY_ID;
        timeframe = timeframe != null ? timeframe : Timeframe.H1;
        indicators = indicators != null ? indicators : IndicatorProperties.defaults();
        signals = signals != null ? signals : SignalProperties.defaults();
        risk = risk != null ? risk : RiskProperties.defaults();
        protections = protections != null ? protections : ProtectionProperties.defaults();
        costs = costs != null ? costs : CostProperties.defaults();
        backtest = backtest != null ? backtest : BacktestProperties.defaults();
        ensemble = ensemble != null ? ensemble : EnsembleProperties.defaults();
    }

    public static TradingProperties defaults() {
        return builder().build();
    }

    /**
     * Bars to accumulate before the backtest starts asking for signals.
     */
    public int backtestWarmupCandles() {
        MacdProperties macd = indicators.macd();
        int macdBars = macd.enabled() ? macd.slow() + macd.signal() + 1 : 0;
        return Math.max(Math.max(indicators.maLong(), indicators.rsiPeriod()), macdBars) + 10;
    }
}
