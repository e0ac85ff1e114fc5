package org.nowstart.edgeguard.data.property;

import lombok.Builder;

/**
 * One protection guard. Windows are expressed in candles so they scale with the timeframe.
 */
@Builder(toBuilder = true)
public record GuardProperties(
        Boolean enabled,
        // 최근 거래 조회 범위(캔들 수)
        Integer lookbackPeriodCandles,
        // 발동에 필요한 거래 수
        Integer tradeLimit,
        // 진입 차단 기간(캔들 수)
        Integer stopDurationCandles,
        // true 이면 같은 심볼 거래만 집계
        Boolean onlyPerPair,
        // max-drawdown 가드의 허용 누적 손실 비율(0.1 = 10%)
        Double maxAllowedDrawdown,
        // low-profit 가드의 최소 평균 수익 비율
        Double requiredProfit
) {

    public GuardProperties {
        enabled = enabled != null ? enabled : false;
        lookbackPeriodCandles = lookbackPeriodCandles != null ? lookbackPeriodCandles : 24;
        tradeLimit = tradeLimit != null ? tradeLimit : 2;
        stopDurationCandles = stopDurationCandles != null ? stopDurationCandles : 4;
        onlyPerPair = onlyPerPair != null ? onlyPerPair : false;
        maxAllowedDrawdown = maxAllowedDrawdown != null ? maxAllowedDrawdown : 0.1;
        requiredProfit = requiredProfit != null ? requiredProfit : 0.0;

        if (lookbackPeriodCandles <= 0 || tradeLimit <= 0 || stopDurationCandles < 0) {
            throw new IllegalArgumentException("guard windows must be positive");
        }
    }

    public static GuardProperties disabled() {
        return builder().build();
    }
}
