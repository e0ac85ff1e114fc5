package org.nowstart.edgeguard.backtest.runner;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.edgeguard.backtest.service.BacktestService;
import org.nowstart.edgeguard.backtest.validation.MonteCarloService;
import org.nowstart.edgeguard.backtest.validation.SensitivityService;
import org.nowstart.edgeguard.backtest.validation.WalkForwardService;
import org.nowstart.edgeguard.data.dto.BacktestMetrics;
import org.nowstart.edgeguard.data.dto.BacktestResult;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.dto.MonteCarloResult;
import org.nowstart.edgeguard.data.dto.SensitivityPoint;
import org.nowstart.edgeguard.data.dto.SensitivityReport;
import org.nowstart.edgeguard.data.dto.WalkForwardFold;
import org.nowstart.edgeguard.data.dto.WalkForwardReport;
import org.nowstart.edgeguard.data.property.BacktestRunnerProperties;
import org.nowstart.edgeguard.data.property.TradingProperties;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "edgeguard.backtest.runner", name = "enabled", havingValue = "true")
public class BacktestRunner implements ApplicationRunner {

    private final BacktestRunnerProperties properties;
    private final TradingProperties tradingProperties;
    private final CandleHistoryProvider candleHistoryProvider;
    private final BacktestService backtestService;
    private final WalkForwardService walkForwardService;
    private final SensitivityService sensitivityService;
    private final MonteCarloService monteCarloService;

    @Override
    public void run(ApplicationArguments args) {
        logSection("BACKTEST START");
        log.info("[Overview] symbols={} strategy={} timeframe={} dataDirectory={}",
                properties.symbols(),
                tradingProperties.strategyId(),
                tradingProperties.timeframe(),
                properties.dataDirectory());

        Map<String, List<Candle>> candles = new LinkedHashMap<>();
        for (String symbol : properties.symbols()) {
            candles.put(symbol, candleHistoryProvider.load(symbol, tradingProperties.timeframe()));
        }

        logSection("SUMMARY");
        BacktestResult result = backtestService.run(candles, tradingProperties);
        logSummary(result);

        if (properties.walkForward()) {
            logSection("WALK FORWARD");
            candles.forEach((symbol, series) -> logWalkForward(symbol, walkForwardService.run(symbol, series, tradingProperties)));
        }

        if (properties.sensitivityRequested()) {
            logSection("SENSITIVITY");
            logSensitivity(sensitivityService.run(
                    candles, tradingProperties, properties.sensitivityParameter(), properties.sensitivityValues()
            ));
        }

        if (properties.monteCarlo()) {
            logSection("MONTE CARLO");
            logMonteCarlo(monteCarloService.simulateTrades(result.trades()));
        }
        logSection("BACKTEST END");
    }

    private void logSummary(BacktestResult result) {
        BacktestMetrics metrics = result.metrics();
        log.info("[Summary] range={} -> {} trades={} winRate={} return={} final={} mdd={} sharpe={} sortino={} profitFactor={}",
                result.startTime(),
                result.endTime(),
                metrics.totalTrades(),
                formatPercent(metrics.winRate() * 100.0),
                formatPercent(metrics.totalReturnPercent()),
                formatNumber(metrics.finalEquity()),
                formatPercent(metrics.maxDrawdownPercent()),
                formatNumber(metrics.sharpeRatio()),
                formatNumber(metrics.sortinoRatio()),
                formatNumber(metrics.profitFactor()));
        log.info("[Summary] exits={}", metrics.exitReasonCounts());
        result.symbolStats().values().forEach(stats -> log.info("[Symbol {}] trades={} wins={} losses={} pnl={} winRate={}",
                stats.symbol(),
                stats.trades(),
                stats.wins(),
                stats.losses(),
                formatNumber(stats.pnl()),
                formatPercent(stats.winRate() * 100.0)));
    }

    private void logWalkForward(String symbol, WalkForwardReport report) {
        for (WalkForwardFold fold : report.folds()) {
            log.info("[WalkForward {}][Fold {}] test={} -> {} inSample={} outOfSample={} trades={}",
                    symbol,
                    fold.index() + 1,
                    fold.testStart(),
                    fold.testEnd(),
                    formatPercent(fold.inSampleReturn()),
                    formatPercent(fold.outOfSampleReturn()),
                    fold.outOfSampleTrades());
        }
        log.info("[WalkForward {}] avgInSample={} avgOutOfSample={} consistency={} verdict={}",
                symbol,
                formatPercent(report.avgInSample()),
                formatPercent(report.avgOutOfSample()),
                formatPercent(report.consistency() * 100.0),
                report.verdict());
    }

    private void logSensitivity(SensitivityReport report) {
        for (SensitivityPoint point : report.points()) {
            log.info("[Sensitivity {}] value={} return={} sharpe={} mdd={} trades={}",
                    report.parameter(),
                    formatNumber(point.value()),
                    formatPercent(point.returnPercent()),
                    formatNumber(point.sharpe()),
                    formatPercent(point.maxDrawdownPercent()),
                    point.trades());
        }
        log.info("[Sensitivity {}] robust={}% best={} verdict={}",
                report.parameter(), report.robustPct(), report.bestValue(), report.verdict());
    }

    private void logMonteCarlo(MonteCarloResult result) {
        log.info("[MonteCarlo] iterations={} trades={} mean={} median={} p5={} p95={} p5MaxDrawdown={} verdict={}",
                result.iterations(),
                result.tradeCount(),
                formatPercent(result.meanReturn()),
                formatPercent(result.medianReturn()),
                formatPercent(result.p5Return()),
                formatPercent(result.p95Return()),
                formatPercent(result.p5MaxDrawdown()),
                result.verdict());
    }

    private void logSection(String title) {
        log.info("========== {} ==========", title);
    }

    // 입력은 이미 퍼센트 단위
    private String formatPercent(double value) {
        if (!Double.isFinite(value)) {
            return "NaN";
        }
        return String.format(Locale.US, "%.2f%%", value);
    }

    private String formatNumber(double value) {
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        if (Double.isNaN(value)) {
            return "NaN";
        }
        return String.format(Locale.US, "%.4f", value);
    }
}
