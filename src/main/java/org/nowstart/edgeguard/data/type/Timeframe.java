package org.nowstart.edgeguard.data.type;

import java.time.Duration;

public enum Timeframe {
    M1(Duration.ofMinutes(1)),
    M5(Duration.ofMinutes(5)),
    M15(Duration.ofMinutes(15)),
    H1(Duration.ofHours(1)),
    H4(Duration.ofHours(4)),
    D1(Duration.ofDays(1));

    private final Duration interval;

    Timeframe(Duration interval) {
        this.interval = interval;
    }

    public Duration interval() {
        return interval;
    }

    public long intervalMillis() {
        return interval.toMillis();
    }
}
