package org.nowstart.edgeguard.strategy.plugin;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.edgeguard.data.dto.Trade;
import org.nowstart.edgeguard.data.property.TradingProperties;
import org.nowstart.edgeguard.data.type.ExitReason;
import org.nowstart.edgeguard.data.type.PositionSide;
import org.nowstart.edgeguard.data.type.SignalType;
import org.nowstart.edgeguard.strategy.FixedSignalStrategy;
import org.nowstart.edgeguard.strategy.core.StrategyContext;

class EnsembleStrategyTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void vote_withoutMembersAbstains() {
        EnsembleStrategy ensemble = new EnsembleStrategy(List.of(), 0.5, false);

        VoteResult result = ensemble.vote(context());

        assertThat(result).isEqualTo(VoteResult.EMPTY);
        assertThat(result.unanimous()).isTrue();
        assertThat(ensemble.populateSignal(context())).isEqualTo(SignalType.NONE);
    }

    @Test
    void vote_zeroWeightsNeverFire() {
        EnsembleStrategy ensemble = new EnsembleStrategy(List.of(
                weighted("a", SignalType.BUY, 0.0),
                weighted("b", SignalType.BUY, 0.0)
        ), 0.0, false);

        VoteResult result = ensemble.vote(context());

        assertThat(result.signal()).isEqualTo(SignalType.NONE);
        assertThat(result.buyScore()).isZero();
    }

    @Test
    void vote_weightedMajorityAboveThresholdWins() {
        EnsembleStrategy ensemble = new EnsembleStrategy(List.of(
                weighted("a", SignalType.BUY, 2.0),
                weighted("b", SignalType.SELL, 1.0)
        ), 0.5, false);

        VoteResult result = ensemble.vote(context());

        assertThat(result.signal()).isEqualTo(SignalType.BUY);
        assertThat(result.confidence()).isCloseTo(2.0 / 3.0, within(1e-9));
        assertThat(result.scoreFor(SignalType.SELL)).isCloseTo(1.0 / 3.0, within(1e-9));
        assertThat(result.unanimous()).isFalse();
        assertThat(result.votes()).extracting(StrategyVote::strategyId).containsExactly("a", "b");
    }

    @Test
    void vote_splitBelowThresholdAbstains() {
        EnsembleStrategy ensemble = new EnsembleStrategy(List.of(
                weighted("a", SignalType.BUY, 1.0),
                weighted("b", SignalType.SELL, 1.0),
                weighted("c", SignalType.NONE, 1.0)
        ), 0.5, false);

        VoteResult result = ensemble.vote(context());

        assertThat(result.signal()).isEqualTo(SignalType.NONE);
        assertThat(result.confidence()).isZero();
    }

    @Test
    void vote_unanimousModeRejectsDisagreement() {
        EnsembleStrategy ensemble = new EnsembleStrategy(List.of(
                weighted("a", SignalType.BUY, 3.0),
                weighted("b", SignalType.SELL, 1.0)
        ), 0.1, true);

        VoteResult result = ensemble.vote(context());

        assertThat(result.signal()).isEqualTo(SignalType.NONE);
        assertThat(result.unanimous()).isFalse();
    }

    @Test
    void vote_unanimousModeIgnoresAbstainers() {
        EnsembleStrategy ensemble = new EnsembleStrategy(List.of(
                weighted("a", SignalType.SHORT, 1.0),
                weighted("b", SignalType.NONE, 1.0)
        ), 0.5, true);

        VoteResult result = ensemble.vote(context());

        assertThat(result.signal()).isEqualTo(SignalType.SHORT);
        assertThat(result.unanimous()).isTrue();
        assertThat(result.shortScore()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    void onTradeClosed_forwardsToEveryMember() {
        FixedSignalStrategy first = new FixedSignalStrategy("a", SignalType.BUY);
        FixedSignalStrategy second = new FixedSignalStrategy("b", SignalType.NONE);
        EnsembleStrategy ensemble = new EnsembleStrategy(
                List.of(new WeightedStrategy(first, 1.0), new WeightedStrategy(second, 1.0)), 0.5, false
        );
        Trade trade = new Trade("BTCUSDT", PositionSide.LONG, NOW, NOW, 100, 90, 1, 100, 90, -10, ExitReason.STOP_LOSS);

        ensemble.onTradeClosed(trade, context());

        assertThat(first.closedTrades()).containsExactly(trade);
        assertThat(second.closedTrades()).containsExactly(trade);
    }

    private WeightedStrategy weighted(String id, SignalType signal, double weight) {
        return new WeightedStrategy(new FixedSignalStrategy(id, signal), weight);
    }

    private StrategyContext context() {
        return new StrategyContext("BTCUSDT", List.of(), TradingProperties.defaults(), null, null, NOW, null);
    }
}
