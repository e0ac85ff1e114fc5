package org.nowstart.edgeguard.data.dto;

import java.util.List;
import org.nowstart.edgeguard.data.type.SensitivityVerdict;

/**
 * @param robustPct share of tested values with a positive return, rounded percent (0..100)
 * @param bestValue value with the highest Sharpe ratio, {@code null} when nothing was tested
 */
public record SensitivityReport(
        String parameter,
        List<SensitivityPoint> points,
        int robustPct,
        Double bestValue,
        SensitivityVerdict verdict
) {

    public SensitivityReport {
        points = List.copyOf(points);
    }
}
