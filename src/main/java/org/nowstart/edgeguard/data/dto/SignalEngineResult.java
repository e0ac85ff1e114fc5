package org.nowstart.edgeguard.data.dto;

import org.nowstart.edgeguard.data.property.RiskProperties;

/**
 * Outcome of one pipeline tick for one symbol.
 *
 * @param indicators             {@code null} when the candle window is shorter than the warmup
 * @param effectiveRisk          risk settings after confident regime overrides
 * @param effectivePositionRatio position ratio after regime and correlation size reductions
 * @param regimeLabel            set only when a confident regime was applied to an opening signal
 */
public record SignalEngineResult(
        IndicatorSnapshot indicators,
        Signal signal,
        RiskProperties effectiveRisk,
        double effectivePositionRatio,
        boolean rejected,
        String rejectionReason,
        String regimeLabel
) {

    public static SignalEngineResult accepted(
            IndicatorSnapshot indicators,
            Signal signal,
            RiskProperties effectiveRisk,
            double effectivePositionRatio,
            String regimeLabel
    ) {
        return new SignalEngineResult(indicators, signal, effectiveRisk, effectivePositionRatio, false, null, regimeLabel);
    }

    public static SignalEngineResult rejected(
            IndicatorSnapshot indicators,
            Signal signal,
            RiskProperties effectiveRisk,
            double effectivePositionRatio,
            String rejectionReason,
            String regimeLabel
    ) {
        return new SignalEngineResult(indicators, signal, effectiveRisk, effectivePositionRatio, true, rejectionReason, regimeLabel);
    }
}
