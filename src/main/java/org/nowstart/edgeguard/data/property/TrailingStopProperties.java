package org.nowstart.edgeguard.data.property;

import lombok.Builder;

@Builder(toBuilder = true)
public record TrailingStopProperties(
        Boolean enabled,
        // 트레일링 시작 수익률(%)
        Double activationPercent,
        // 고점 대비 되돌림 허용폭(%)
        Double callbackPercent,
        // offset 도달 후 사용할 되돌림 비율(0.01 = 1%), null 이면 미사용
        Double positive,
        // positive 전환 수익 비율(0.02 = 2%)
        Double positiveOffset,
        // offset 도달 전에는 트레일링 청산을 하지 않음
        Boolean onlyOffsetIsReached
) {

    public TrailingStopProperties {
        enabled = enabled != null ? enabled : false;
        activationPercent = activationPercent != null ? activationPercent : 0.0;
        callbackPercent = callbackPercent != null ? callbackPercent : 2.0;
        positiveOffset = positiveOffset != null ? positiveOffset : 0.0;
        onlyOffsetIsReached = onlyOffsetIsReached != null ? onlyOffsetIsReached : false;

        if (activationPercent < 0 || callbackPercent <= 0) {
            throw new IllegalArgumentException("trailing-stop activation must be >= 0 and callback > 0");
        }
        if (positive != null && positive <= 0) {
            throw new IllegalArgumentException("trailing-stop.positive must be > 0");
        }
        if (positiveOffset < 0) {
            throw new IllegalArgumentException("trailing-stop.positive-offset must be >= 0");
        }
    }

    public static TrailingStopProperties defaults() {
        return builder().build();
    }

    public boolean positiveTrailingConfigured() {
        return positive != null;
    }
}
