package org.nowstart.edgeguard.data.property;

import lombok.Builder;

@Builder(toBuilder = true)
public record MacdProperties(
        // MACD 계산 여부
        Boolean enabled,
        // fast EMA 기간
        Integer fast,
        // slow EMA 기간
        Integer slow,
        // signal EMA 기간
        Integer signal
) {

    public MacdProperties {
        enabled = enabled != null ? enabled : true;
        fast = fast != null ? fast : 12;
        slow = slow != null ? slow : 26;
        signal = signal != null ? signal : 9;

        if (fast <= 0 || slow <= 0 || signal <= 0) {
            throw new IllegalArgumentException("macd periods must be > 0");
        }
        if (fast >= slow) {
            throw new IllegalArgumentException("macd.fast must be < macd.slow");
        }
    }

    public static MacdProperties defaults() {
        return builder().build();
    }
}
