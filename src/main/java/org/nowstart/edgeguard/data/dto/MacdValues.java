package org.nowstart.edgeguard.data.dto;

/**
 * MACD triple for the current bar plus the same triple one bar earlier, so crossover checks need no history.
 */
public record MacdValues(
        double macd,
        double signal,
        double histogram,
        double prevMacd,
        double prevSignal,
        double prevHistogram
) {
}
