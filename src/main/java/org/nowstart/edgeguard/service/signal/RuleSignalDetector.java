package org.nowstart.edgeguard.service.signal;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.nowstart.edgeguard.data.dto.IndicatorSnapshot;
import org.nowstart.edgeguard.data.dto.Signal;
import org.nowstart.edgeguard.data.property.IndicatorProperties;
import org.nowstart.edgeguard.data.property.SignalProperties;
import org.nowstart.edgeguard.data.property.TradingProperties;
import org.nowstart.edgeguard.data.type.PositionSide;
import org.nowstart.edgeguard.data.type.SignalType;
import org.springframework.stereotype.Service;

/**
 * Rule-based signal detection over configured condition lists.
 *
 * <p>A direction fires only when every configured condition holds; an empty list never fires.
 * Directions are checked according to the held side: flat checks buy then short, long checks sell,
 * short checks cover.
 */
@Service
public class RuleSignalDetector {

    public Signal detect(
            String symbol,
            IndicatorSnapshot indicators,
            TradingProperties properties,
            PositionSide currentSide,
            Instant timestamp
    ) {
        SignalProperties signals = properties.signals();
        IndicatorProperties indicatorProperties = properties.indicators();

        List<SignalType> candidates;
        if (currentSide == PositionSide.LONG) {
            candidates = List.of(SignalType.SELL);
        } else if (currentSide == PositionSide.SHORT) {
            candidates = List.of(SignalType.COVER);
        } else {
            candidates = List.of(SignalType.BUY, SignalType.SHORT);
        }

        for (SignalType candidate : candidates) {
            List<String> satisfied = allSatisfied(conditionsFor(candidate, signals), indicators, indicatorProperties);
            if (satisfied != null) {
                return new Signal(symbol, candidate, indicators.price(), indicators, satisfied, timestamp);
            }
        }
        return Signal.none(symbol, indicators.price(), indicators, timestamp);
    }

    /**
     * Returns the satisfied condition names when all of them hold, otherwise {@code null}.
     */
    private List<String> allSatisfied(
            List<String> conditions,
            IndicatorSnapshot indicators,
            IndicatorProperties indicatorProperties
    ) {
        if (conditions.isEmpty()) {
            return null;
        }
        List<String> satisfied = new ArrayList<>(conditions.size());
        for (String condition : conditions) {
            if (!SignalConditions.evaluate(condition, indicators, indicatorProperties)) {
                return null;
            }
            satisfied.add(condition);
        }
        return satisfied;
    }

    private List<String> conditionsFor(SignalType type, SignalProperties signals) {
        return switch (type) {
            case BUY -> signals.buy();
            case SELL -> signals.sell();
            case SHORT -> signals.shortEntry();
            case COVER -> signals.cover();
            case NONE -> List.of();
        };
    }
}
