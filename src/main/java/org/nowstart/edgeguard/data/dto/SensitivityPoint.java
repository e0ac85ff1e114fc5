package org.nowstart.edgeguard.data.dto;

public record SensitivityPoint(
        double value,
        double returnPercent,
        double sharpe,
        double maxDrawdownPercent,
        int trades
) {
}
