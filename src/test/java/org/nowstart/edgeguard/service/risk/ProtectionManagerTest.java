package org.nowstart.edgeguard.service.risk;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.edgeguard.data.dto.ProtectionResult;
import org.nowstart.edgeguard.data.dto.TradeRecord;
import org.nowstart.edgeguard.data.property.GuardProperties;
import org.nowstart.edgeguard.data.property.ProtectionProperties;
import org.nowstart.edgeguard.data.type.Timeframe;

class ProtectionManagerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final ProtectionManager manager = new ProtectionManager();

    @Test
    void check_allowsWithoutTrades() {
        ProtectionProperties protections = ProtectionProperties.builder().cooldown(enabled().build()).build();

        assertThat(manager.check("BTCUSDT", protections, List.of(), Timeframe.H1, NOW)).isEqualTo(ProtectionResult.ALLOWED);
    }

    @Test
    void check_cooldownBlocksAfterRecentStopLossOnSameSymbol() {
        ProtectionProperties protections = ProtectionProperties.builder()
                .cooldown(enabled().stopDurationCandles(4).build())
                .build();
        List<TradeRecord> trades = List.of(new TradeRecord("BTCUSDT", hoursAgo(2), -0.05, true));

        ProtectionResult result = manager.check("BTCUSDT", protections, trades, Timeframe.H1, NOW);

        assertThat(result.allowed()).isFalse();
        assertThat(result.protection()).isEqualTo(ProtectionManager.COOLDOWN);
        assertThat(result.blockedUntil()).isEqualTo(hoursAgo(2).plus(Duration.ofHours(4)));
    }

    @Test
    void check_cooldownExpiresAndIgnoresOtherSymbols() {
        ProtectionProperties protections = ProtectionProperties.builder()
                .cooldown(enabled().stopDurationCandles(4).build())
                .build();
        List<TradeRecord> trades = List.of(
                new TradeRecord("BTCUSDT", hoursAgo(5), -0.05, true),
                new TradeRecord("ETHUSDT", hoursAgo(1), -0.05, true)
        );

        assertThat(manager.check("BTCUSDT", protections, trades, Timeframe.H1, NOW).allowed()).isTrue();
    }

    @Test
    void check_stoplossGuardCountsAllSymbolsUnlessPerPair() {
        List<TradeRecord> trades = List.of(
                new TradeRecord("ETHUSDT", hoursAgo(3), -0.04, true),
                new TradeRecord("SOLUSDT", hoursAgo(2), -0.04, true)
        );
        ProtectionProperties global = ProtectionProperties.builder()
                .stoplossGuard(enabled().tradeLimit(2).lookbackPeriodCandles(24).build())
                .build();
        ProtectionProperties perPair = ProtectionProperties.builder()
                .stoplossGuard(enabled().tradeLimit(2).lookbackPeriodCandles(24).onlyPerPair(true).build())
                .build();

        ProtectionResult blocked = manager.check("BTCUSDT", global, trades, Timeframe.H1, NOW);

        assertThat(blocked.allowed()).isFalse();
        assertThat(blocked.protection()).isEqualTo(ProtectionManager.STOPLOSS_GUARD);
        assertThat(manager.check("BTCUSDT", perPair, trades, Timeframe.H1, NOW).allowed()).isTrue();
    }

    @Test
    void check_stoplossGuardKeepsBlockingForStopDurationAfterTrigger() {
        List<TradeRecord> trades = List.of(
                new TradeRecord("ETHUSDT", hoursAgo(4), -0.04, true),
                new TradeRecord("ETHUSDT", hoursAgo(3), -0.04, true)
        );
        ProtectionProperties protections = ProtectionProperties.builder()
                .stoplossGuard(enabled().tradeLimit(2).lookbackPeriodCandles(2).stopDurationCandles(4).build())
                .build();

        ProtectionResult result = manager.check("BTCUSDT", protections, trades, Timeframe.H1, NOW);

        assertThat(result.allowed()).isFalse();
        assertThat(result.blockedUntil()).isEqualTo(NOW.plus(Duration.ofHours(1)));
        assertThat(manager.check("BTCUSDT", protections, trades, Timeframe.H1, NOW.plus(Duration.ofHours(2))).allowed())
                .isTrue();
    }

    @Test
    void check_maxDrawdownSumsRatiosAndNeedsTradeLimit() {
        ProtectionProperties protections = ProtectionProperties.builder()
                .maxDrawdown(enabled().tradeLimit(2).maxAllowedDrawdown(0.1).build())
                .build();
        List<TradeRecord> twoLosses = List.of(
                new TradeRecord("ETHUSDT", hoursAgo(3), -0.06, false),
                new TradeRecord("SOLUSDT", hoursAgo(2), -0.05, false)
        );
        List<TradeRecord> oneLargeLoss = List.of(new TradeRecord("ETHUSDT", hoursAgo(3), -0.3, false));

        ProtectionResult result = manager.check("BTCUSDT", protections, twoLosses, Timeframe.H1, NOW);

        assertThat(result.allowed()).isFalse();
        assertThat(result.protection()).isEqualTo(ProtectionManager.MAX_DRAWDOWN);
        assertThat(manager.check("BTCUSDT", protections, oneLargeLoss, Timeframe.H1, NOW).allowed()).isTrue();
    }

    @Test
    void check_lowProfitPairsOnlyLooksAtSameSymbol() {
        ProtectionProperties protections = ProtectionProperties.builder()
                .lowProfitPairs(enabled().tradeLimit(2).requiredProfit(0.0).build())
                .build();
        List<TradeRecord> trades = List.of(
                new TradeRecord("BTCUSDT", hoursAgo(5), -0.01, false),
                new TradeRecord("BTCUSDT", hoursAgo(3), -0.02, false),
                new TradeRecord("ETHUSDT", hoursAgo(2), 0.5, false)
        );

        ProtectionResult btc = manager.check("BTCUSDT", protections, trades, Timeframe.H1, NOW);

        assertThat(btc.allowed()).isFalse();
        assertThat(btc.protection()).isEqualTo(ProtectionManager.LOW_PROFIT_PAIRS);
        assertThat(manager.check("ETHUSDT", protections, trades, Timeframe.H1, NOW).allowed()).isTrue();
    }

    @Test
    void check_ignoresTradesClosedAfterNow() {
        ProtectionProperties protections = ProtectionProperties.builder()
                .cooldown(enabled().stopDurationCandles(4).build())
                .build();
        List<TradeRecord> future = List.of(new TradeRecord("BTCUSDT", NOW.plus(Duration.ofHours(1)), -0.05, true));

        assertThat(manager.check("BTCUSDT", protections, future, Timeframe.H1, NOW).allowed()).isTrue();
    }

    private GuardProperties.GuardPropertiesBuilder enabled() {
        return GuardProperties.builder().enabled(true);
    }

    private Instant hoursAgo(int hours) {
        return NOW.minus(Duration.ofHours(hours));
    }
}
