package org.nowstart.edgeguard.strategy.plugin;

import lombok.RequiredArgsConstructor;
import org.nowstart.edgeguard.data.type.SignalType;
import org.nowstart.edgeguard.service.signal.RuleSignalDetector;
import org.nowstart.edgeguard.strategy.core.StrategyContext;
import org.nowstart.edgeguard.strategy.core.TradingStrategy;
import org.springframework.stereotype.Component;

/**
 * Exposes the configured rule conditions as a strategy so the ensemble can vote with them.
 */
@Component
@RequiredArgsConstructor
public class DefaultRuleStrategy implements TradingStrategy {

    public static final String ID = "default";

    private final RuleSignalDetector ruleSignalDetector;

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String name() {
        return "Configured rule conditions";
    }

    @Override
    public SignalType populateSignal(StrategyContext context) {
        return ruleSignalDetector.detect(
                context.symbol(),
                context.indicators(),
                context.config(),
                context.currentSide(),
                context.timestamp()
        ).type();
    }
}
