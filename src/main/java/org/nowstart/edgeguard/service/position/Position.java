package org.nowstart.edgeguard.service.position;

import java.time.Duration;
import java.time.Instant;
import lombok.Getter;
import org.nowstart.edgeguard.data.property.RiskProperties;
import org.nowstart.edgeguard.data.type.PositionSide;
import org.nowstart.edgeguard.strategy.core.OpenPositionView;

/**
 * Open position owned by a single backtest run.
 *
 * <p>{@code cost} is the cash taken from the account at entry. For shorts it is the locked margin and
 * {@code margin} is the part returned at cover before pnl.
 */
@Getter
public class Position {

    private final String symbol;
    private final PositionSide side;
    private final Instant entryTime;
    private final double entryPrice;
    private final double quantity;
    private final double cost;
    private final double margin;
    private final double stopLoss;
    private final double takeProfit;
    private final TrailingStop trailingStop;

    public Position(
            String symbol,
            PositionSide side,
            Instant entryTime,
            double entryPrice,
            double quantity,
            double cost,
            double margin,
            RiskProperties risk
    ) {
        this.symbol = symbol;
        this.side = side;
        this.entryTime = entryTime;
        this.entryPrice = entryPrice;
        this.quantity = quantity;
        this.cost = cost;
        this.margin = margin;

        double stopFactor = risk.stopLossPercent() / 100.0;
        double targetFactor = risk.takeProfitPercent() / 100.0;
        if (side == PositionSide.LONG) {
            this.stopLoss = entryPrice * (1 - stopFactor);
            this.takeProfit = entryPrice * (1 + targetFactor);
        } else {
            this.stopLoss = entryPrice * (1 + stopFactor);
            this.takeProfit = entryPrice * (1 - targetFactor);
        }
        this.trailingStop = risk.trailingStop().enabled() ? new TrailingStop(side, entryPrice) : null;
    }

    public boolean hasTrailingStop() {
        return trailingStop != null;
    }

    /**
     * Mark-to-market value of the position at {@code price}.
     */
    public double marketValue(double price) {
        if (side == PositionSide.SHORT) {
            return margin + (entryPrice - price) * quantity;
        }
        return quantity * price;
    }

    public Duration heldAt(Instant time) {
        return Duration.between(entryTime, time);
    }

    public OpenPositionView view(double currentPrice, Instant time) {
        return new OpenPositionView(symbol, side, entryPrice, currentPrice, heldAt(time));
    }
}
