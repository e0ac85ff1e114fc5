package org.nowstart.edgeguard.data.property;

import lombok.Builder;

@Builder(toBuilder = true)
public record BacktestProperties(
        // 초기 자본(USDT)
        Double initialEquity,
        // true 이면 신호 캔들 다음 캔들 시가에 체결(look-ahead 제거)
        Boolean signalToNextOpen,
        // true 이면 손절/익절 판정에 고가/저가 사용
        Boolean intracandle
) {

    public BacktestProperties {
        initialEquity = initialEquity != null ? initialEquity : 1000.0;
        signalToNextOpen = signalToNextOpen != null ? signalToNextOpen : false;
        intracandle = intracandle != null ? intracandle : true;

        if (initialEquity <= 0) {
            throw new IllegalArgumentException("initial-equity must be > 0");
        }
    }

    public static BacktestProperties defaults() {
        return builder().build();
    }
}
