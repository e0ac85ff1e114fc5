package org.nowstart.edgeguard.data.dto;

import java.time.Duration;
import java.time.Instant;
import org.nowstart.edgeguard.data.type.ExitReason;
import org.nowstart.edgeguard.data.type.PositionSide;

/**
 * Closed position. {@code cost} is the cash committed at entry (fee included), {@code pnl} is net of both fees.
 */
public record Trade(
        String symbol,
        PositionSide side,
        Instant entryTime,
        Instant exitTime,
        double entryPrice,
        double exitPrice,
        double quantity,
        double cost,
        double proceeds,
        double pnl,
        ExitReason exitReason
) {

    public double pnlRatio() {
        return cost > 0 ? pnl / cost : 0.0;
    }

    public double pnlPercent() {
        return pnlRatio() * 100.0;
    }

    public double holdingHours() {
        return Duration.between(entryTime, exitTime).toMillis() / 3_600_000.0;
    }
}
