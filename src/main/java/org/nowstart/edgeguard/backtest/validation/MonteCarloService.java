package org.nowstart.edgeguard.backtest.validation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.edgeguard.data.dto.MonteCarloResult;
import org.nowstart.edgeguard.data.dto.Trade;
import org.nowstart.edgeguard.data.property.ValidationProperties;
import org.nowstart.edgeguard.data.type.MonteCarloVerdict;
import org.springframework.stereotype.Service;

/**
 * Reshuffles per-trade percent returns and compounds each ordering from an equity of 100.
 * Absolute pnl is never used, so the result only reflects sequence risk.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MonteCarloService {

    private static final double START_EQUITY = 100.0;

    private final ValidationProperties validationProperties;

    public MonteCarloResult simulateTrades(List<Trade> trades) {
        return simulate(trades.stream().map(Trade::pnlPercent).toList());
    }

    public MonteCarloResult simulate(List<Double> returnPercents) {
        Long seed = validationProperties.monteCarloSeed();
        Random random = seed != null ? new Random(seed) : new Random();
        return simulate(returnPercents, validationProperties.monteCarloIterations(), random);
    }

    public MonteCarloResult simulate(List<Double> returnPercents, int iterations, Random random) {
        if (returnPercents == null || returnPercents.isEmpty() || iterations <= 0) {
            return MonteCarloResult.zero();
        }

        double[] finalReturns = new double[iterations];
        double[] maxDrawdowns = new double[iterations];
        List<Double> order = new ArrayList<>(returnPercents);
        for (int i = 0; i < iterations; i++) {
            Collections.shuffle(order, random);
            double equity = START_EQUITY;
            double peak = START_EQUITY;
            double maxDrawdown = 0.0;
            for (double returnPercent : order) {
                equity *= 1 + returnPercent / 100.0;
                peak = Math.max(peak, equity);
                maxDrawdown = Math.max(maxDrawdown, (peak - equity) / peak);
            }
            finalReturns[i] = equity - START_EQUITY;
            maxDrawdowns[i] = maxDrawdown * 100.0;
        }

        Arrays.sort(finalReturns);
        Arrays.sort(maxDrawdowns);
        double mean = Arrays.stream(finalReturns).average().orElse(0.0);
        double median = finalReturns[(int) Math.floor(iterations * 0.5)];
        double p5 = finalReturns[(int) Math.floor(iterations * 0.05)];
        double p95 = finalReturns[(int) Math.floor(iterations * 0.95)];
        // drawdowns descending: index floor(0.05n) from the worst end
        double p5Drawdown = maxDrawdowns[iterations - 1 - (int) Math.floor(iterations * 0.05)];

        MonteCarloVerdict verdict;
        if (p5 > -10 && p5Drawdown < 20) {
            verdict = MonteCarloVerdict.SAFE;
        } else if (p5 > -20) {
            verdict = MonteCarloVerdict.CAUTION;
        } else {
            verdict = MonteCarloVerdict.DANGER;
        }

        log.info("event=monte_carlo_done iterations={} trades={} median={} p5={} p95={} p5_drawdown={} verdict={}",
                iterations, returnPercents.size(), median, p5, p95, p5Drawdown, verdict);
        return new MonteCarloResult(iterations, returnPercents.size(), mean, median, p5, p95, p5Drawdown, verdict);
    }
}
