package org.nowstart.edgeguard.data.property;

import lombok.Builder;

@Builder(toBuilder = true)
public record CorrelationProperties(
        Boolean enabled,
        // 이 값 이상이면 고상관으로 판단
        Double threshold,
        // 수익률 계열 길이(캔들 수)
        Integer lookback
) {

    public CorrelationProperties {
        enabled = enabled != null ? enabled : false;
        threshold = threshold != null ? threshold : 0.7;
        lookback = lookback != null ? lookback : 30;

        if (threshold <= 0 || threshold > 1) {
            throw new IllegalArgumentException("correlation.threshold must be in (0, 1]");
        }
        if (lookback < 2) {
            throw new IllegalArgumentException("correlation.lookback must be >= 2");
        }
    }

    public static CorrelationProperties defaults() {
        return builder().build();
    }
}
