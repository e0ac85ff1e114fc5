package org.nowstart.edgeguard.data.type;

public enum ExitReason {
    SIGNAL("signal"),
    STOP_LOSS("stop_loss"),
    TAKE_PROFIT("take_profit"),
    ROI_TABLE("roi_table"),
    TRAILING_STOP("trailing_stop"),
    TIME_STOP("time_stop"),
    FORCED("forced");

    private final String code;

    ExitReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean countsAsStopLoss() {
        return this == STOP_LOSS || this == TRAILING_STOP;
    }
}
