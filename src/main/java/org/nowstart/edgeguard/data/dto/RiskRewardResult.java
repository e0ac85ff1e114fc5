package org.nowstart.edgeguard.data.dto;

/**
 * @param ratio reward distance over risk distance; {@code +Infinity} when the check was skipped
 */
public record RiskRewardResult(
        boolean passed,
        double ratio,
        double support,
        double resistance,
        String reason
) {
}
