package org.nowstart.edgeguard.data.type;

public enum PriceStructure {
    HIGHER_HIGHS,
    LOWER_LOWS,
    MIXED,
    FLAT
}
