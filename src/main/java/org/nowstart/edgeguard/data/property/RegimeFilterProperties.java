package org.nowstart.edgeguard.data.property;

import java.util.List;
import java.util.Set;
import lombok.Builder;

@Builder(toBuilder = true)
public record RegimeFilterProperties(
        Boolean enabled,
        // 이 신뢰도 미만의 레짐은 unknown 취급
        Integer minConfidence,
        // 추세형 조건 이름(비어 있으면 기본 테이블 사용)
        List<String> trendConditions,
        // 역추세형 조건 이름(비어 있으면 기본 테이블 사용)
        List<String> reversalConditions
) {

    public static final Set<String> DEFAULT_TREND_CONDITIONS = Set.of(
            "ma_golden_cross", "ma_death_cross", "ma_bullish", "ma_bearish",
            "macd_golden_cross", "macd_death_cross", "macd_bullish", "macd_bearish",
            "macd_histogram_expanding", "volume_surge", "price_above_vwap", "price_below_vwap"
    );
    public static final Set<String> DEFAULT_REVERSAL_CONDITIONS = Set.of(
            "rsi_oversold", "rsi_overbought", "rsi_not_oversold",
            "vwap_below_lower", "vwap_above_upper"
    );

    public RegimeFilterProperties {
        enabled = enabled != null ? enabled : true;
        minConfidence = minConfidence != null ? minConfidence : 60;
        trendConditions = trendConditions != null ? List.copyOf(trendConditions) : List.of();
        reversalConditions = reversalConditions != null ? List.copyOf(reversalConditions) : List.of();

        if (minConfidence < 0 || minConfidence > 100) {
            throw new IllegalArgumentException("regime-filter.min-confidence must be within 0..100");
        }
    }

    public static RegimeFilterProperties defaults() {
        return builder().build();
    }

    public Set<String> resolvedTrendConditions() {
        return trendConditions.isEmpty() ? DEFAULT_TREND_CONDITIONS : Set.copyOf(trendConditions);
    }

    public Set<String> resolvedReversalConditions() {
        return reversalConditions.isEmpty() ? DEFAULT_REVERSAL_CONDITIONS : Set.copyOf(reversalConditions);
    }
}
