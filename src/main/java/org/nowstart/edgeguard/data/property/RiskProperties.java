package org.nowstart.edgeguard.data.property;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;
import lombok.Builder;
import org.nowstart.edgeguard.data.type.SignalFilterMode;

@Builder(toBuilder = true)
public record RiskProperties(
        // 손절 비율(%)
        Double stopLossPercent,
        // 익절 비율(%)
        Double takeProfitPercent,
        // 진입 시 사용할 자산 비율(0~1)
        Double positionRatio,
        // 동시 보유 가능한 포지션 수
        Integer maxPositions,
        // 최소 주문 금액
        Double minOrderUsdt,
        // 일일 손실 한도(%), null 이면 미사용
        Double dailyLossLimitPercent,
        // 최소 손익비, 0 이하이면 미사용
        Double minRr,
        // 지지/저항 추정 캔들 수
        Integer rrLookback,
        // 보유 시간 초과 + 무수익 시 청산(시간), null 이면 미사용
        Double timeStopHours,
        // 보유 분 -> 최소 수익 비율
        Map<Integer, Double> minimalRoi,
        TrailingStopProperties trailingStop,
        CorrelationProperties correlation,
        RegimeFilterProperties regimeFilter,
        // 레짐 필터 모드별 리스크 덮어쓰기
        Map<SignalFilterMode, RiskOverrideProperties> regimeOverrides
) {

    public RiskProperties {
        stopLossPercent = stopLossPercent != null ? stopLossPercent : 5.0;
        takeProfitPercent = takeProfitPercent != null ? takeProfitPercent : 10.0;
        positionRatio = positionRatio != null ? positionRatio : 0.2;
        maxPositions = maxPositions != null ? maxPositions : 3;
        minOrderUsdt = minOrderUsdt != null ? minOrderUsdt : 10.0;
        minRr = minRr != null ? minRr : 0.0;
        rrLookback = rrLookback != null ? rrLookback : 20;
        minimalRoi = minimalRoi != null ? Collections.unmodifiableSortedMap(new TreeMap<>(minimalRoi)) : Map.of();
        trailingStop = trailingStop != null ? trailingStop : TrailingStopProperties.defaults();
        correlation = correlation != null ? correlation : CorrelationProperties.defaults();
        regimeFilter = regimeFilter != null ? regimeFilter : RegimeFilterProperties.defaults();
        regimeOverrides = regimeOverrides != null ? Map.copyOf(regimeOverrides) : Map.of();

        if (stopLossPercent <= 0 || takeProfitPercent <= 0) {
            throw new IllegalArgumentException("stop-loss-percent and take-profit-percent must be > 0");
        }
        if (positionRatio <= 0 || positionRatio > 1) {
            throw new IllegalArgumentException("position-ratio must be in (0, 1]");
        }
        if (maxPositions <= 0) {
            throw new IllegalArgumentException("max-positions must be > 0");
        }
        if (minOrderUsdt < 0) {
            throw new IllegalArgumentException("min-order-usdt must be >= 0");
        }
        if (rrLookback < 5) {
            throw new IllegalArgumentException("rr-lookback must be >= 5");
        }
        if (timeStopHours != null && timeStopHours <= 0) {
            throw new IllegalArgumentException("time-stop-hours must be > 0");
        }
    }

    public static RiskProperties defaults() {
        return builder().build();
    }

    public RiskProperties merge(RiskOverrideProperties override) {
        if (override == null) {
            return this;
        }
        return toBuilder()
                .stopLossPercent(override.stopLossPercent() != null ? override.stopLossPercent() : stopLossPercent)
                .takeProfitPercent(override.takeProfitPercent() != null ? override.takeProfitPercent() : takeProfitPercent)
                .positionRatio(override.positionRatio() != null ? override.positionRatio() : positionRatio)
                .minRr(override.minRr() != null ? override.minRr() : minRr)
                .build();
    }
}
