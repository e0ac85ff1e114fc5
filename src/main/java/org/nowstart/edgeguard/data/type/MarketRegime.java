package org.nowstart.edgeguard.data.type;

import java.util.Locale;

public enum MarketRegime {
    TRENDING_UP,
    TRENDING_DOWN,
    RANGING_TIGHT,
    RANGING_WIDE,
    BREAKOUT_UP,
    BREAKOUT_DOWN,
    UNKNOWN;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
