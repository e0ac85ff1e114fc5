package org.nowstart.edgeguard.service.risk;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.edgeguard.CandleFixtures;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.dto.CorrelationResult;

class CorrelationFilterTest {

    private final CorrelationFilter filter = new CorrelationFilter();

    @Test
    void check_flagsMovesInLockstep() {
        List<Candle> btc = zigzag(1.0);
        List<Candle> eth = zigzag(2.0);

        CorrelationResult result = filter.check("BTCUSDT", btc, Map.of("ETHUSDT", eth), 0.7, 30);

        assertThat(result.correlated()).isTrue();
        assertThat(result.correlatedWith()).isEqualTo("ETHUSDT");
        assertThat(result.maxCorrelation()).isGreaterThan(0.99);
    }

    @Test
    void check_negativeCorrelationIsNotFlagged() {
        List<Candle> btc = zigzag(1.0);
        List<Candle> inverse = zigzag(-1.0);

        CorrelationResult result = filter.check("BTCUSDT", btc, Map.of("SHORTY", inverse), 0.7, 30);

        assertThat(result.correlated()).isFalse();
        assertThat(result.maxCorrelation()).isLessThan(0);
    }

    @Test
    void check_ignoresOwnSymbolAndFlatSeries() {
        List<Candle> btc = zigzag(1.0);

        CorrelationResult result = filter.check(
                "BTCUSDT",
                btc,
                Map.of("BTCUSDT", btc, "STABLE", CandleFixtures.flat(40, 1.0)),
                0.7,
                30
        );

        assertThat(result).isEqualTo(CorrelationResult.NONE);
    }

    @Test
    void check_needsMinimumReturns() {
        List<Candle> shortSeries = CandleFixtures.series(100, 101, 102, 101, 100);

        assertThat(filter.check("BTCUSDT", shortSeries, Map.of("ETHUSDT", zigzag(1.0)), 0.7, 30))
                .isEqualTo(CorrelationResult.NONE);
        assertThat(filter.check("BTCUSDT", zigzag(1.0), Map.of(), 0.7, 30)).isEqualTo(CorrelationResult.NONE);
    }

    @Test
    void pearson_isUndefinedForConstantInput() {
        assertThat(CorrelationFilter.pearson(new double[] {1, 1, 1}, new double[] {1, 2, 3})).isNaN();
        assertThat(CorrelationFilter.pearson(new double[] {1, 2, 3}, new double[] {2, 4, 6})).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void logReturns_skipsNonPositivePrices() {
        double[] returns = CorrelationFilter.logReturns(CandleFixtures.series(100, 110, 0, 121));

        assertThat(returns).hasSize(1);
        assertThat(returns[0]).isCloseTo(Math.log(1.1), within(1e-12));
    }

    private List<Candle> zigzag(double amplitude) {
        double[] closes = new double[40];
        for (int i = 0; i < closes.length; i++) {
            closes[i] = 100 + amplitude * ((i % 3) - 1) * (1 + (i % 5) * 0.1);
        }
        return CandleFixtures.series(closes);
    }
}
