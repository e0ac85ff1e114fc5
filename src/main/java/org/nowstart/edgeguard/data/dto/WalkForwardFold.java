package org.nowstart.edgeguard.data.dto;

import java.time.Instant;

/**
 * One train/test split. Returns are in percent units.
 */
public record WalkForwardFold(
        int index,
        Instant trainStart,
        Instant trainEnd,
        Instant testStart,
        Instant testEnd,
        int trainCandles,
        int testCandles,
        double inSampleReturn,
        double outOfSampleReturn,
        double inSampleSharpe,
        double outOfSampleSharpe,
        int inSampleTrades,
        int outOfSampleTrades
) {
}
