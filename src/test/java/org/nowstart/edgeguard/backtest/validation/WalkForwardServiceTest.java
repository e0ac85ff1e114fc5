package org.nowstart.edgeguard.backtest.validation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nowstart.edgeguard.CandleFixtures;
import org.nowstart.edgeguard.backtest.BacktestResults;
import org.nowstart.edgeguard.backtest.service.BacktestService;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.dto.WalkForwardFold;
import org.nowstart.edgeguard.data.dto.WalkForwardReport;
import org.nowstart.edgeguard.data.property.TradingProperties;
import org.nowstart.edgeguard.data.property.ValidationProperties;
import org.nowstart.edgeguard.data.type.WalkForwardVerdict;

@ExtendWith(MockitoExtension.class)
class WalkForwardServiceTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    @Mock
    private BacktestService backtestService;

    private final TradingProperties config = TradingProperties.defaults();

    @Test
    void run_givesEveryFoldItsOwnWindowWithDefaultSplit() {
        WalkForwardService service = new WalkForwardService(backtestService, ValidationProperties.defaults());
        List<Candle> candles = CandleFixtures.flat(1000, 100);
        when(backtestService.run(eq("BTCUSDT"), anyList(), eq(config))).thenAnswer(invocation -> {
            List<Candle> slice = invocation.getArgument(1);
            return slice.size() < 100
                    ? BacktestResults.of(config, 2.0, 0.8, 3)
                    : BacktestResults.of(config, 6.0, 1.5, 9);
        });

        WalkForwardReport report = service.run("BTCUSDT", candles, config);

        assertThat(report.folds()).hasSize(5);
        assertThat(report.folds()).extracting(WalkForwardFold::trainCandles).containsOnly(140);
        assertThat(report.folds()).extracting(WalkForwardFold::testCandles).containsOnly(60);
        WalkForwardFold first = report.folds().get(0);
        assertThat(first.trainStart()).isEqualTo(CandleFixtures.time(0));
        assertThat(first.testStart()).isEqualTo(CandleFixtures.time(140));
        WalkForwardFold last = report.folds().get(4);
        assertThat(last.trainStart()).isEqualTo(CandleFixtures.time(800));
        assertThat(last.testStart()).isEqualTo(CandleFixtures.time(940));
        assertThat(last.testEnd()).isEqualTo(CandleFixtures.time(999));
        assertThat(report.avgOutOfSample()).isCloseTo(2.0, within(1e-9));
        assertThat(report.avgInSample()).isCloseTo(6.0, within(1e-9));
        assertThat(report.consistency()).isEqualTo(1.0);
        assertThat(report.verdict()).isEqualTo(WalkForwardVerdict.ROBUST);
    }

    @Test
    void run_lastWindowTakesRemainderCandles() {
        WalkForwardService service = new WalkForwardService(backtestService, ValidationProperties.defaults());
        List<Candle> candles = CandleFixtures.flat(405, 100);
        when(backtestService.run(eq("BTCUSDT"), anyList(), eq(config)))
                .thenReturn(BacktestResults.of(config, 1.0, 0.5, 2));

        WalkForwardReport report = service.run("BTCUSDT", candles, config, 2, 0.7);

        assertThat(report.folds()).extracting(WalkForwardFold::trainCandles).containsExactly(141, 142);
        assertThat(report.folds()).extracting(WalkForwardFold::testCandles).containsExactly(61, 61);
        assertThat(report.folds().get(1).testEnd()).isEqualTo(CandleFixtures.time(404));
    }

    @Test
    void run_skipsFoldsWithTooLittleData() {
        WalkForwardService service = new WalkForwardService(backtestService, ValidationProperties.defaults());

        WalkForwardReport report = service.run("BTCUSDT", CandleFixtures.flat(50, 100), config, 5, 0.7);

        assertThat(report.folds()).isEmpty();
        assertThat(report.robust()).isFalse();
        assertThat(report.verdict()).isEqualTo(WalkForwardVerdict.OVERFIT);
        verifyNoInteractions(backtestService);
    }

    @Test
    void run_rejectsInvalidSplit() {
        WalkForwardService service = new WalkForwardService(backtestService, ValidationProperties.defaults());
        List<Candle> candles = CandleFixtures.flat(10, 100);

        assertThatThrownBy(() -> service.run("BTCUSDT", candles, config, 1, 0.7))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> service.run("BTCUSDT", candles, config, 5, 1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void summarize_marksAverageWhenSomeFoldsLoseMildly() {
        WalkForwardService service = new WalkForwardService(backtestService, ValidationProperties.defaults());

        WalkForwardReport report = service.summarize(List.of(fold(3.0), fold(-2.0), fold(-4.0), fold(1.0), fold(-2.0)));

        assertThat(report.consistency()).isCloseTo(0.4, within(1e-9));
        assertThat(report.avgOutOfSample()).isCloseTo(-0.8, within(1e-9));
        assertThat(report.robust()).isFalse();
        assertThat(report.verdict()).isEqualTo(WalkForwardVerdict.AVERAGE);
    }

    @Test
    void summarize_marksOverfitWhenOutOfSampleCollapses() {
        WalkForwardService service = new WalkForwardService(backtestService, ValidationProperties.defaults());

        WalkForwardReport report = service.summarize(List.of(fold(1.0), fold(-8.0), fold(-6.0)));

        assertThat(report.verdict()).isEqualTo(WalkForwardVerdict.OVERFIT);
    }

    @Test
    void summarize_positiveAverageNeedsConsistencyToBeRobust() {
        WalkForwardService service = new WalkForwardService(backtestService, ValidationProperties.defaults());

        WalkForwardReport report = service.summarize(List.of(fold(20.0), fold(-1.0), fold(-1.0)));

        assertThat(report.avgOutOfSample()).isPositive();
        assertThat(report.robust()).isFalse();
        assertThat(report.verdict()).isEqualTo(WalkForwardVerdict.OVERFIT);
    }

    @Test
    void summarize_notRobustWhenAverageNegativeDespiteConsistency() {
        WalkForwardService service = new WalkForwardService(backtestService, ValidationProperties.defaults());

        WalkForwardReport report = service.summarize(List.of(fold(1.0), fold(1.0), fold(1.0), fold(-10.0)));

        assertThat(report.consistency()).isCloseTo(0.75, within(1e-9));
        assertThat(report.avgOutOfSample()).isCloseTo(-1.75, within(1e-9));
        assertThat(report.robust()).isFalse();
        assertThat(report.verdict()).isEqualTo(WalkForwardVerdict.AVERAGE);
    }

    private WalkForwardFold fold(double outOfSampleReturn) {
        return new WalkForwardFold(0, T0, T0, T0, T0, 100, 20, 5.0, outOfSampleReturn, 1.0, 0.5, 4, 2);
    }
}
