package org.nowstart.edgeguard.data.type;

public enum SensitivityVerdict {
    ROBUST,
    MODERATE,
    FRAGILE
}
