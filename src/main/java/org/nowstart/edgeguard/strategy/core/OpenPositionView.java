package org.nowstart.edgeguard.strategy.core;

import java.time.Duration;
import org.nowstart.edgeguard.data.type.PositionSide;

public record OpenPositionView(
        String symbol,
        PositionSide side,
        double entryPrice,
        double currentPrice,
        Duration held
) {
}
