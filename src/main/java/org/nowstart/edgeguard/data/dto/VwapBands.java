package org.nowstart.edgeguard.data.dto;

public record VwapBands(
        double vwap,
        double upper1,
        double lower1,
        double upper2,
        double lower2
) {
}
