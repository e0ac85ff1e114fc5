package org.nowstart.edgeguard.data.type;

public enum WalkForwardVerdict {
    ROBUST,
    AVERAGE,
    OVERFIT
}
