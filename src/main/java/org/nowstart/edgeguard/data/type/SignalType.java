package org.nowstart.edgeguard.data.type;

import java.util.Locale;

public enum SignalType {
    BUY,
    SELL,
    SHORT,
    COVER,
    NONE;

    public boolean isOpening() {
        return this == BUY || this == SHORT;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
