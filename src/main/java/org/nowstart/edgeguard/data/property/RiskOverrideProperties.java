package org.nowstart.edgeguard.data.property;

import lombok.Builder;

/**
 * Partial risk settings merged over {@link RiskProperties} while a confident regime is active.
 * A {@code null} component keeps the base value.
 */
@Builder(toBuilder = true)
public record RiskOverrideProperties(
        Double stopLossPercent,
        Double takeProfitPercent,
        Double positionRatio,
        Double minRr
) {
}
