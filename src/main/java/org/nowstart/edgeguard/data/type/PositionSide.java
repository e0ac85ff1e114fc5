package org.nowstart.edgeguard.data.type;

public enum PositionSide {
    LONG,
    SHORT;

    public static PositionSide forOpening(SignalType signalType) {
        return switch (signalType) {
            case BUY -> LONG;
            case SHORT -> SHORT;
            default -> throw new IllegalArgumentException("not an opening signal: " + signalType);
        };
    }
}
