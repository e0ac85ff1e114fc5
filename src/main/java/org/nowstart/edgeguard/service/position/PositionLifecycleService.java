package org.nowstart.edgeguard.service.position;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.property.RiskProperties;
import org.nowstart.edgeguard.data.property.TrailingStopProperties;
import org.nowstart.edgeguard.data.type.ExitReason;
import org.nowstart.edgeguard.data.type.PositionSide;
import org.nowstart.edgeguard.data.type.TrailingState;
import org.springframework.stereotype.Service;

/**
 * Per tick exit state machine of an open position.
 *
 * <p>Priority when several exits hold on the same candle: stop-loss, take-profit, ROI table,
 * trailing stop, time stop.
 */
@Service
public class PositionLifecycleService {

    /**
     * Advances the trailing stop with the candle range and reports whether it was hit.
     */
    public boolean updateTrailing(Position position, Candle candle, TrailingStopProperties properties) {
        TrailingStop trailing = position.getTrailingStop();
        if (trailing == null || !properties.enabled()) {
            return false;
        }
        PositionSide side = position.getSide();
        double entry = position.getEntryPrice();

        trailing.updateWaterMark(candle.high(), candle.low());
        double gainPercent = RoiTable.profitRatio(side, entry, trailing.getWaterMark()) * 100.0;

        if (gainPercent >= properties.activationPercent()) {
            trailing.arm();
        }
        if (properties.positiveTrailingConfigured() && gainPercent >= properties.positiveOffset() * 100.0) {
            trailing.arm();
            trailing.activate();
        }
        if (trailing.getState() == TrailingState.INACTIVE) {
            return false;
        }

        boolean positiveActive = trailing.getState() == TrailingState.ACTIVE;
        double callbackPercent = positiveActive ? properties.positive() * 100.0 : properties.callbackPercent();
        double candidate = side == PositionSide.LONG
                ? trailing.getWaterMark() * (1 - callbackPercent / 100.0)
                : trailing.getWaterMark() * (1 + callbackPercent / 100.0);
        trailing.tighten(candidate);

        if (properties.onlyOffsetIsReached() && properties.positiveTrailingConfigured() && !positiveActive) {
            return false;
        }
        return side == PositionSide.LONG
                ? candle.low() <= trailing.getStopPrice()
                : candle.high() >= trailing.getStopPrice();
    }

    public Optional<ExitDecision> evaluateExit(
            Position position,
            Candle candle,
            RiskProperties risk,
            boolean intracandle,
            Instant time
    ) {
        boolean trailingHit = updateTrailing(position, candle, risk.trailingStop());

        double checkHigh = intracandle ? candle.high() : candle.close();
        double checkLow = intracandle ? candle.low() : candle.close();
        boolean isLong = position.getSide() == PositionSide.LONG;
        double adverse = isLong ? checkLow : checkHigh;
        double favorable = isLong ? checkHigh : checkLow;

        if (isLong ? adverse <= position.getStopLoss() : adverse >= position.getStopLoss()) {
            return Optional.of(new ExitDecision(position.getStopLoss(), ExitReason.STOP_LOSS));
        }
        if (isLong ? favorable >= position.getTakeProfit() : favorable <= position.getTakeProfit()) {
            return Optional.of(new ExitDecision(position.getTakeProfit(), ExitReason.TAKE_PROFIT));
        }

        Duration held = position.heldAt(time);
        Optional<Double> roi = RoiTable.threshold(risk.minimalRoi(), held);
        if (roi.isPresent()) {
            double entry = position.getEntryPrice();
            double roiPrice = isLong ? entry * (1 + roi.get()) : entry * (1 - roi.get());
            if (isLong ? favorable >= roiPrice : favorable <= roiPrice) {
                double exitPrice = isLong ? Math.min(roiPrice, candle.close()) : Math.max(roiPrice, candle.close());
                return Optional.of(new ExitDecision(exitPrice, ExitReason.ROI_TABLE));
            }
        }

        if (trailingHit && position.getTrailingStop().hasStop()) {
            return Optional.of(new ExitDecision(position.getTrailingStop().getStopPrice(), ExitReason.TRAILING_STOP));
        }

        if (risk.timeStopHours() != null && held.toMillis() >= risk.timeStopHours() * 3_600_000L) {
            double pnl = RoiTable.profitRatio(position.getSide(), position.getEntryPrice(), candle.close());
            if (pnl <= 0) {
                return Optional.of(new ExitDecision(candle.close(), ExitReason.TIME_STOP));
            }
        }
        return Optional.empty();
    }
}
