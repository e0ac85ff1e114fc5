package org.nowstart.edgeguard.data.dto;

public record CorrelationResult(
        boolean correlated,
        double maxCorrelation,
        String correlatedWith
) {

    public static final CorrelationResult NONE = new CorrelationResult(false, 0.0, null);
}
