package org.nowstart.edgeguard.service.risk;

import java.util.List;
import java.util.Locale;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.dto.RiskRewardResult;
import org.nowstart.edgeguard.data.type.PositionSide;
import org.springframework.stereotype.Service;

/**
 * Rejects entries whose distance to resistance (long) or support (short) is too small compared with
 * the distance to the opposite level. Levels come from the supplied pivots, falling back to the recent
 * window low and high.
 */
@Service
public class RiskRewardFilter {

    static final int MIN_WINDOW = 5;
    private static final double FALLBACK_BAND = 0.05;

    public RiskRewardResult check(
            List<Candle> candles,
            double price,
            PositionSide side,
            double minRr,
            int lookback,
            Double pivotSupport,
            Double pivotResistance
    ) {
        if (minRr <= 0) {
            return new RiskRewardResult(
                    true,
                    Double.POSITIVE_INFINITY,
                    pivotSupport != null ? pivotSupport : price * (1 - FALLBACK_BAND),
                    pivotResistance != null ? pivotResistance : price * (1 + FALLBACK_BAND),
                    "risk-reward filter disabled"
            );
        }

        List<Candle> window = candles.subList(Math.max(0, candles.size() - lookback), candles.size());
        if (window.size() < MIN_WINDOW) {
            return new RiskRewardResult(
                    true,
                    Double.POSITIVE_INFINITY,
                    price * (1 - FALLBACK_BAND),
                    price * (1 + FALLBACK_BAND),
                    "not enough candles for risk-reward, skipped"
            );
        }

        double support = pivotSupport != null
                ? pivotSupport
                : window.stream().mapToDouble(Candle::low).min().orElse(price);
        double resistance = pivotResistance != null
                ? pivotResistance
                : window.stream().mapToDouble(Candle::high).max().orElse(price);

        double distanceUp = resistance - price;
        double distanceDown = price - support;
        if (distanceUp <= 0 || distanceDown <= 0) {
            return new RiskRewardResult(
                    false,
                    0.0,
                    support,
                    resistance,
                    format("price %.4f outside range support=%.4f resistance=%.4f", price, support, resistance)
            );
        }

        double ratio = side == PositionSide.LONG ? distanceUp / distanceDown : distanceDown / distanceUp;
        boolean passed = ratio >= minRr;
        String reason = passed
                ? format("rr=%.2f >= %.2f side=%s", ratio, minRr, side)
                : format("rr=%.2f < %.2f side=%s up=%.4f down=%.4f", ratio, minRr, side, distanceUp, distanceDown);
        return new RiskRewardResult(passed, ratio, support, resistance, reason);
    }

    private String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
