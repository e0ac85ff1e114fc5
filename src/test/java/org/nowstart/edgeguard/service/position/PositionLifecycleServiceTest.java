package org.nowstart.edgeguard.service.position;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.nowstart.edgeguard.CandleFixtures;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.property.RiskProperties;
import org.nowstart.edgeguard.data.property.TrailingStopProperties;
import org.nowstart.edgeguard.data.type.ExitReason;
import org.nowstart.edgeguard.data.type.PositionSide;
import org.nowstart.edgeguard.data.type.TrailingState;

class PositionLifecycleServiceTest {

    private static final Instant ENTRY = CandleFixtures.START;

    private final PositionLifecycleService service = new PositionLifecycleService();

    @Test
    void evaluateExit_stopLossWinsWhenBothLevelsTouched() {
        RiskProperties risk = RiskProperties.defaults();
        Position position = position(PositionSide.LONG, risk);

        Optional<ExitDecision> exit = service.evaluateExit(position, bar(1, 111, 94, 100), risk, true, CandleFixtures.time(1));

        assertThat(exit).isPresent();
        assertThat(exit.get().reason()).isEqualTo(ExitReason.STOP_LOSS);
        assertThat(exit.get().exitPrice()).isCloseTo(95.0, within(1e-9));
    }

    @Test
    void evaluateExit_takeProfitFillsAtTarget() {
        RiskProperties risk = RiskProperties.defaults();
        Position position = position(PositionSide.LONG, risk);

        Optional<ExitDecision> exit = service.evaluateExit(position, bar(1, 111, 99, 108), risk, true, CandleFixtures.time(1));

        assertThat(exit).isPresent();
        assertThat(exit.get().reason()).isEqualTo(ExitReason.TAKE_PROFIT);
        assertThat(exit.get().exitPrice()).isCloseTo(110.0, within(1e-9));
    }

    @Test
    void evaluateExit_closeModeIgnoresWicks() {
        RiskProperties risk = RiskProperties.defaults();
        Position position = position(PositionSide.LONG, risk);

        assertThat(service.evaluateExit(position, bar(1, 111, 94, 100), risk, false, CandleFixtures.time(1))).isEmpty();
    }

    @Test
    void evaluateExit_shortStopLossIsAboveEntry() {
        RiskProperties risk = RiskProperties.defaults();
        Position position = position(PositionSide.SHORT, risk);

        Optional<ExitDecision> exit = service.evaluateExit(position, bar(1, 106, 99, 101), risk, true, CandleFixtures.time(1));

        assertThat(exit).isPresent();
        assertThat(exit.get().reason()).isEqualTo(ExitReason.STOP_LOSS);
        assertThat(exit.get().exitPrice()).isCloseTo(105.0, within(1e-9));
    }

    @Test
    void evaluateExit_roiTableExitsAtThresholdPriceCappedByClose() {
        RiskProperties risk = RiskProperties.builder().minimalRoi(Map.of(0, 0.08, 60, 0.04)).build();
        Position position = position(PositionSide.LONG, risk);

        Optional<ExitDecision> exit = service.evaluateExit(
                position, bar(1, 105, 101, 103), risk, true, ENTRY.plus(Duration.ofMinutes(90))
        );

        assertThat(exit).isPresent();
        assertThat(exit.get().reason()).isEqualTo(ExitReason.ROI_TABLE);
        assertThat(exit.get().exitPrice()).isCloseTo(103.0, within(1e-9));
    }

    @Test
    void evaluateExit_timeStopOnlyForLosingPositions() {
        RiskProperties risk = RiskProperties.builder().timeStopHours(4.0).build();
        Instant later = ENTRY.plus(Duration.ofHours(5));

        Optional<ExitDecision> losing = service.evaluateExit(position(PositionSide.LONG, risk), bar(5, 99.5, 98, 99), risk, true, later);
        Optional<ExitDecision> winning = service.evaluateExit(position(PositionSide.LONG, risk), bar(5, 102, 100.5, 101), risk, true, later);

        assertThat(losing).contains(new ExitDecision(99.0, ExitReason.TIME_STOP));
        assertThat(winning).isEmpty();
    }

    @Test
    void updateTrailing_stopOnlyMovesInFavorableDirection() {
        TrailingStopProperties trailing = TrailingStopProperties.builder()
                .enabled(true)
                .activationPercent(2.0)
                .callbackPercent(1.0)
                .build();
        RiskProperties risk = RiskProperties.builder().takeProfitPercent(50.0).trailingStop(trailing).build();
        Position position = position(PositionSide.LONG, risk);

        assertThat(service.updateTrailing(position, bar(1, 105, 104, 104.5), trailing)).isFalse();
        double firstStop = position.getTrailingStop().getStopPrice();
        assertThat(firstStop).isCloseTo(103.95, within(1e-9));
        assertThat(position.getTrailingStop().getState()).isEqualTo(TrailingState.ARMED);

        assertThat(service.updateTrailing(position, bar(2, 104.5, 104, 104.2), trailing)).isFalse();
        assertThat(position.getTrailingStop().getStopPrice()).isEqualTo(firstStop);

        service.updateTrailing(position, bar(3, 110, 109, 109.5), trailing);
        assertThat(position.getTrailingStop().getStopPrice()).isCloseTo(108.9, within(1e-9));
        assertThat(position.getTrailingStop().getWaterMark()).isEqualTo(110.0);

        Optional<ExitDecision> exit = service.evaluateExit(position, bar(4, 109, 108, 108.2), risk, true, CandleFixtures.time(4));
        assertThat(exit).isPresent();
        assertThat(exit.get().reason()).isEqualTo(ExitReason.TRAILING_STOP);
        assertThat(exit.get().exitPrice()).isCloseTo(108.9, within(1e-9));
    }

    @Test
    void updateTrailing_waitsForPositiveOffsetWhenConfigured() {
        TrailingStopProperties trailing = TrailingStopProperties.builder()
                .enabled(true)
                .activationPercent(1.0)
                .positive(0.01)
                .positiveOffset(0.05)
                .onlyOffsetIsReached(true)
                .build();
        Position position = position(PositionSide.LONG, RiskProperties.builder().trailingStop(trailing).build());

        assertThat(service.updateTrailing(position, bar(1, 103, 100.5, 101), trailing)).isFalse();
        assertThat(position.getTrailingStop().getState()).isEqualTo(TrailingState.ARMED);

        assertThat(service.updateTrailing(position, bar(2, 106, 105.5, 105.8), trailing)).isFalse();
        assertThat(position.getTrailingStop().getState()).isEqualTo(TrailingState.ACTIVE);
        assertThat(position.getTrailingStop().getStopPrice()).isCloseTo(104.94, within(1e-9));

        assertThat(service.updateTrailing(position, bar(3, 105, 104.5, 104.6), trailing)).isTrue();
    }

    @Test
    void updateTrailing_shortTracksLowWaterMark() {
        TrailingStopProperties trailing = TrailingStopProperties.builder()
                .enabled(true)
                .activationPercent(2.0)
                .callbackPercent(1.0)
                .build();
        Position position = position(PositionSide.SHORT, RiskProperties.builder().trailingStop(trailing).build());

        service.updateTrailing(position, bar(1, 96, 95, 95.5), trailing);

        assertThat(position.getTrailingStop().getWaterMark()).isEqualTo(95.0);
        assertThat(position.getTrailingStop().getStopPrice()).isCloseTo(95.95, within(1e-9));
    }

    @Test
    void updateTrailing_shortStopOnlyMovesDownAcrossTicks() {
        TrailingStopProperties trailing = TrailingStopProperties.builder()
                .enabled(true)
                .activationPercent(2.0)
                .callbackPercent(1.0)
                .build();
        RiskProperties risk = RiskProperties.builder().takeProfitPercent(50.0).trailingStop(trailing).build();
        Position position = position(PositionSide.SHORT, risk);

        assertThat(service.updateTrailing(position, bar(1, 95.5, 95, 95.2), trailing)).isFalse();
        double firstStop = position.getTrailingStop().getStopPrice();
        assertThat(firstStop).isCloseTo(95.95, within(1e-9));
        assertThat(position.getTrailingStop().getState()).isEqualTo(TrailingState.ARMED);

        assertThat(service.updateTrailing(position, bar(2, 95.8, 95.4, 95.6), trailing)).isFalse();
        assertThat(position.getTrailingStop().getStopPrice()).isEqualTo(firstStop);
        assertThat(position.getTrailingStop().getWaterMark()).isEqualTo(95.0);

        assertThat(service.updateTrailing(position, bar(3, 90.8, 90, 90.5), trailing)).isFalse();
        double lowered = position.getTrailingStop().getStopPrice();
        assertThat(lowered).isCloseTo(90.9, within(1e-9));
        assertThat(position.getTrailingStop().getWaterMark()).isEqualTo(90.0);

        assertThat(service.updateTrailing(position, bar(4, 90.6, 90.2, 90.4), trailing)).isFalse();
        assertThat(position.getTrailingStop().getStopPrice()).isEqualTo(lowered);

        Optional<ExitDecision> exit = service.evaluateExit(position, bar(5, 91.5, 90.5, 91.2), risk, true, CandleFixtures.time(5));
        assertThat(exit).isPresent();
        assertThat(exit.get().reason()).isEqualTo(ExitReason.TRAILING_STOP);
        assertThat(exit.get().exitPrice()).isCloseTo(90.9, within(1e-9));
    }

    @Test
    void updateTrailing_isNoOpWhenDisabled() {
        RiskProperties risk = RiskProperties.defaults();
        Position position = position(PositionSide.LONG, risk);

        assertThat(position.hasTrailingStop()).isFalse();
        assertThat(service.updateTrailing(position, bar(1, 120, 80, 100), risk.trailingStop())).isFalse();
    }

    private Position position(PositionSide side, RiskProperties risk) {
        return new Position("BTCUSDT", side, ENTRY, 100.0, 2.0, 200.0, side == PositionSide.SHORT ? 199.8 : 0.0, risk);
    }

    private Candle bar(int index, double high, double low, double close) {
        return CandleFixtures.candle(index, close, high, low, close, 100);
    }
}
