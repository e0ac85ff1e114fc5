package org.nowstart.edgeguard.data.dto;

import org.nowstart.edgeguard.data.type.MonteCarloVerdict;

/**
 * Distribution of compounded returns over reshuffled trade orders. All values are in percent units.
 *
 * @param p5MaxDrawdown max drawdown exceeded by only 5% of the shuffles
 */
public record MonteCarloResult(
        int iterations,
        int tradeCount,
        double meanReturn,
        double medianReturn,
        double p5Return,
        double p95Return,
        double p5MaxDrawdown,
        MonteCarloVerdict verdict
) {

    public static MonteCarloResult zero() {
        return new MonteCarloResult(0, 0, 0, 0, 0, 0, 0, MonteCarloVerdict.NO_TRADES);
    }
}
