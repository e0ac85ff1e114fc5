package org.nowstart.edgeguard.data.dto;

import java.time.Instant;

public record Candle(
        Instant openTime,
        Instant closeTime,
        double open,
        double high,
        double low,
        double close,
        double volume
) {

    public double typicalPrice() {
        return (high + low + close) / 3.0;
    }
}
