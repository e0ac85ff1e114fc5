package org.nowstart.edgeguard.service.position;

import lombok.Getter;
import org.nowstart.edgeguard.data.type.PositionSide;
import org.nowstart.edgeguard.data.type.TrailingState;

/**
 * Trailing stop of one position. The water mark and the stop price only move in the favorable
 * direction of {@code side}; {@code stopPrice} is {@code 0} until the stop has been armed.
 */
@Getter
public class TrailingStop {

    private final PositionSide side;
    private TrailingState state = TrailingState.INACTIVE;
    private double waterMark;
    private double stopPrice;

    TrailingStop(PositionSide side, double entryPrice) {
        this.side = side;
        this.waterMark = entryPrice;
    }

    void updateWaterMark(double high, double low) {
        if (side == PositionSide.LONG) {
            waterMark = Math.max(waterMark, high);
        } else {
            waterMark = Math.min(waterMark, low);
        }
    }

    void arm() {
        if (state == TrailingState.INACTIVE) {
            state = TrailingState.ARMED;
        }
    }

    void activate() {
        state = TrailingState.ACTIVE;
    }

    void tighten(double candidate) {
        if (stopPrice == 0.0) {
            stopPrice = candidate;
        } else if (side == PositionSide.LONG) {
            stopPrice = Math.max(stopPrice, candidate);
        } else {
            stopPrice = Math.min(stopPrice, candidate);
        }
    }

    boolean hasStop() {
        return stopPrice > 0.0;
    }
}
