package org.nowstart.edgeguard.data.property;

import lombok.Builder;

@Builder(toBuilder = true)
public record IndicatorProperties(
        // 단기 이동평균 기간
        Integer maShort,
        // 장기 이동평균 기간
        Integer maLong,
        // RSI 기간
        Integer rsiPeriod,
        // RSI 과매도 임계값
        Double rsiOversold,
        // RSI 과매수 임계값
        Double rsiOverbought,
        // 평균 거래량 계산 기간
        Integer volumeAvgPeriod,
        // 거래량 급증 배수
        Double volumeSurgeRatio,
        // 거래량 위축 배수
        Double volumeLowRatio,
        MacdProperties macd
) {

    public IndicatorProperties {
        maShort = maShort != null ? maShort : 20;
        maLong = maLong != null ? maLong : 60;
        rsiPeriod = rsiPeriod != null ? rsiPeriod : 14;
        rsiOversold = rsiOversold != null ? rsiOversold : 30.0;
        rsiOverbought = rsiOverbought != null ? rsiOverbought : 70.0;
        volumeAvgPeriod = volumeAvgPeriod != null ? volumeAvgPeriod : 20;
        volumeSurgeRatio = volumeSurgeRatio != null ? volumeSurgeRatio : 1.5;
        volumeLowRatio = volumeLowRatio != null ? volumeLowRatio : 0.5;
        macd = macd != null ? macd : MacdProperties.defaults();

        if (maShort <= 0 || maLong <= 0 || rsiPeriod <= 0 || volumeAvgPeriod <= 0) {
            throw new IllegalArgumentException("indicator periods must be > 0");
        }
        if (maShort >= maLong) {
            throw new IllegalArgumentException("ma-short must be < ma-long");
        }
        if (rsiOversold >= rsiOverbought) {
            throw new IllegalArgumentException("rsi-oversold must be < rsi-overbought");
        }
    }

    public static IndicatorProperties defaults() {
        return builder().build();
    }

    /**
     * Minimum candle count for a full indicator snapshot, including the previous-period values.
     */
    public int requiredCandles() {
        int macdBars = macd.enabled() ? macd.slow() + macd.signal() : 0;
        return Math.max(Math.max(maLong, rsiPeriod), macdBars) + 1;
    }
}
