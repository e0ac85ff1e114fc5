package org.nowstart.edgeguard.service.indicator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.edgeguard.CandleFixtures;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.dto.IndicatorSnapshot;
import org.nowstart.edgeguard.data.dto.VwapBands;
import org.nowstart.edgeguard.data.property.IndicatorProperties;
import org.nowstart.edgeguard.data.property.MacdProperties;

class IndicatorServiceTest {

    private final IndicatorService indicatorService = new IndicatorService();

    @Test
    void simpleMovingAverage_usesTrailingWindow() {
        assertThat(indicatorService.simpleMovingAverage(new double[] {1, 2, 3, 4, 5}, 3)).isEqualTo(4.0);
        assertThat(indicatorService.simpleMovingAverage(new double[] {1, 2}, 3)).isNaN();
    }

    @Test
    void exponentialMovingAverage_isSeededWithSimpleAverage() {
        double[] ema = indicatorService.exponentialMovingAverage(new double[] {1, 2, 3, 4}, 2);

        assertThat(ema[0]).isNaN();
        assertThat(ema[1]).isCloseTo(1.5, within(1e-9));
        assertThat(ema[2]).isCloseTo(2.5, within(1e-9));
        assertThat(ema[3]).isCloseTo(3.5, within(1e-9));
    }

    @Test
    void relativeStrengthIndex_returnsHundredWithoutLosses() {
        assertThat(indicatorService.relativeStrengthIndex(new double[] {1, 2, 3, 4, 5}, 4)).isEqualTo(100.0);
    }

    @Test
    void relativeStrengthIndex_balancedMovesGiveFifty() {
        assertThat(indicatorService.relativeStrengthIndex(new double[] {1, 2, 1, 2, 1}, 4)).isCloseTo(50.0, within(1e-9));
    }

    @Test
    void calculate_returnsEmptyWhenWindowIsShorterThanRequired() {
        IndicatorProperties properties = IndicatorProperties.defaults();

        assertThat(indicatorService.calculate(CandleFixtures.flat(properties.requiredCandles() - 1, 100), properties)).isEmpty();
        assertThat(indicatorService.calculate(null, properties)).isEmpty();
    }

    @Test
    void calculate_fillsCurrentAndPreviousAverages() {
        IndicatorProperties properties = smallProperties();
        List<Candle> candles = CandleFixtures.series(10, 11, 12, 13);

        IndicatorSnapshot snapshot = indicatorService.calculate(candles, properties).orElseThrow();

        assertThat(snapshot.price()).isEqualTo(13.0);
        assertThat(snapshot.maShort()).isCloseTo(12.5, within(1e-9));
        assertThat(snapshot.maLong()).isCloseTo(12.0, within(1e-9));
        assertThat(snapshot.prevMaShort()).isCloseTo(11.5, within(1e-9));
        assertThat(snapshot.prevMaLong()).isCloseTo(11.0, within(1e-9));
        assertThat(snapshot.rsi()).isEqualTo(100.0);
        assertThat(snapshot.macd()).isNull();
        assertThat(snapshot.extra()).isEmpty();
    }

    @Test
    void calculate_includesMacdWhenEnabled() {
        IndicatorProperties properties = IndicatorProperties.defaults();
        List<Candle> candles = CandleFixtures.trend(properties.requiredCandles() + 5, 100, 1);

        IndicatorSnapshot snapshot = indicatorService.calculate(candles, properties).orElseThrow();

        assertThat(snapshot.macd()).isNotNull();
        assertThat(snapshot.macd().macd()).isPositive();
    }

    @Test
    void averageVolume_excludesCurrentCandle() {
        List<Candle> candles = List.of(
                CandleFixtures.candle(0, 10, 10, 10, 10, 100),
                CandleFixtures.candle(1, 10, 10, 10, 10, 300),
                CandleFixtures.candle(2, 10, 10, 10, 10, 5000)
        );

        assertThat(indicatorService.averageVolume(candles, 20)).isEqualTo(200.0);
        assertThat(indicatorService.averageVolume(candles.subList(0, 1), 20)).isZero();
    }

    @Test
    void vwap_weightsTypicalPriceOfCurrentSession() {
        List<Candle> candles = List.of(
                CandleFixtures.candle(0, 10, 12, 8, 10, 100),
                CandleFixtures.candle(1, 20, 22, 18, 20, 100)
        );

        VwapBands bands = indicatorService.vwap(candles);

        assertThat(bands.vwap()).isCloseTo(15.0, within(1e-9));
        assertThat(bands.upper1()).isCloseTo(20.0, within(1e-9));
        assertThat(bands.lower2()).isCloseTo(5.0, within(1e-9));
    }

    @Test
    void vwap_returnsNullWithoutVolume() {
        assertThat(indicatorService.vwap(List.of(CandleFixtures.candle(0, 10, 10, 10, 10, 0)))).isNull();
    }

    private IndicatorProperties smallProperties() {
        return IndicatorProperties.builder()
                .maShort(2)
                .maLong(3)
                .rsiPeriod(2)
                .macd(MacdProperties.builder().enabled(false).build())
                .build();
    }
}
