package org.nowstart.edgeguard.data.type;

public enum MonteCarloVerdict {
    SAFE,
    CAUTION,
    DANGER,
    NO_TRADES
}
