package org.nowstart.edgeguard.data.type;

import java.util.Locale;

public enum SignalFilterMode {
    ALL,
    TREND_ONLY,
    REVERSAL_ONLY,
    BREAKOUT_WATCH,
    REDUCED_SIZE;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
