package org.nowstart.edgeguard.data.dto;

import java.time.Instant;
import java.util.List;
import org.nowstart.edgeguard.data.type.SignalType;

public record Signal(
        String symbol,
        SignalType type,
        double price,
        IndicatorSnapshot indicators,
        List<String> reasons,
        Instant timestamp
) {

    public Signal {
        reasons = reasons != null ? List.copyOf(reasons) : List.of();
    }

    public static Signal none(String symbol, double price, IndicatorSnapshot indicators, Instant timestamp) {
        return new Signal(symbol, SignalType.NONE, price, indicators, List.of(), timestamp);
    }
}
