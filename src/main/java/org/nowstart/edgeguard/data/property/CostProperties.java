package org.nowstart.edgeguard.data.property;

import lombok.Builder;

@Builder(toBuilder = true)
public record CostProperties(
        // 체결 금액 대비 수수료율(0.001 = 0.1%)
        Double feeRate,
        // 슬리피지(%)
        Double slippagePercent,
        // 호가 스프레드(bp), 체결가에 절반씩 반영
        Double spreadBps
) {

    public CostProperties {
        feeRate = feeRate != null ? feeRate : 0.001;
        slippagePercent = slippagePercent != null ? slippagePercent : 0.05;
        spreadBps = spreadBps != null ? spreadBps : 0.0;

        if (feeRate < 0 || slippagePercent < 0 || spreadBps < 0) {
            throw new IllegalArgumentException("fee-rate, slippage-percent and spread-bps must be >= 0");
        }
    }

    public static CostProperties defaults() {
        return builder().build();
    }
}
