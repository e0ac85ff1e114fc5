package org.nowstart.edgeguard.strategy.plugin;

import lombok.extern.slf4j.Slf4j;
import org.nowstart.edgeguard.data.dto.Trade;
import org.nowstart.edgeguard.data.property.IndicatorProperties;
import org.nowstart.edgeguard.data.type.SignalType;
import org.nowstart.edgeguard.strategy.core.StateStore;
import org.nowstart.edgeguard.strategy.core.StrategyContext;
import org.nowstart.edgeguard.strategy.core.TradingStrategy;
import org.springframework.stereotype.Component;

/**
 * Mean reversion on RSI thresholds. Stops emitting signals after three consecutive losing trades until
 * a winning trade resets the streak.
 */
@Slf4j
@Component
public class RsiReversalStrategy implements TradingStrategy {

    public static final String ID = "rsi-reversal";
    static final String CONSECUTIVE_LOSSES = "consecutiveLosses";
    static final int MAX_CONSECUTIVE_LOSSES = 3;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "RSI reversal";
    }

    @Override
    public String description() {
        return "RSI below oversold buys, RSI above overbought sells; paused after "
                + MAX_CONSECUTIVE_LOSSES + " consecutive losses";
    }

    @Override
    public SignalType populateSignal(StrategyContext context) {
        if (context.stateStore().getInt(CONSECUTIVE_LOSSES, 0) >= MAX_CONSECUTIVE_LOSSES) {
            return SignalType.NONE;
        }
        IndicatorProperties indicators = context.config().indicators();
        double rsi = context.indicators().rsi();
        if (rsi < indicators.rsiOversold()) {
            return SignalType.BUY;
        }
        if (rsi > indicators.rsiOverbought()) {
            return SignalType.SELL;
        }
        return SignalType.NONE;
    }

    @Override
    public void onTradeClosed(Trade trade, StrategyContext context) {
        StateStore stateStore = context.stateStore();
        int losses = stateStore.getInt(CONSECUTIVE_LOSSES, 0);
        if (trade.pnl() < 0) {
            stateStore.set(CONSECUTIVE_LOSSES, losses + 1);
            if (losses + 1 == MAX_CONSECUTIVE_LOSSES) {
                log.info("event=strategy_paused strategy={} symbol={} consecutive_losses={}", ID, trade.symbol(), losses + 1);
            }
        } else {
            stateStore.set(CONSECUTIVE_LOSSES, 0);
        }
    }
}
