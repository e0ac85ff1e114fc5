package org.nowstart.edgeguard.data.dto;

import org.nowstart.edgeguard.data.type.MarketRegime;
import org.nowstart.edgeguard.data.type.PriceStructure;
import org.nowstart.edgeguard.data.type.SignalFilterMode;

public record RegimeAnalysis(
        MarketRegime regime,
        int confidence,
        SignalFilterMode filterMode,
        double adx,
        double plusDi,
        double minusDi,
        double bbWidth,
        double bbWidthPercentile,
        PriceStructure structure,
        String detail
) {

    public static RegimeAnalysis unknown(String detail) {
        return new RegimeAnalysis(
                MarketRegime.UNKNOWN, 0, SignalFilterMode.ALL, 0, 0, 0, 0, 0, PriceStructure.FLAT, detail
        );
    }

    public String label() {
        return regime.label();
    }
}
