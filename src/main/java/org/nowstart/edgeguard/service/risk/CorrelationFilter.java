package org.nowstart.edgeguard.service.risk;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.dto.CorrelationResult;
import org.springframework.stereotype.Service;

/**
 * Pearson correlation of log returns between a candidate symbol and the symbols already held.
 * The caller shrinks the position size when the result is correlated; this filter never rejects.
 */
@Service
public class CorrelationFilter {

    static final int MIN_RETURNS = 10;

    public CorrelationResult check(
            String symbol,
            List<Candle> candles,
            Map<String, List<Candle>> heldCandles,
            double threshold,
            int lookback
    ) {
        if (heldCandles == null || heldCandles.isEmpty()) {
            return CorrelationResult.NONE;
        }

        double[] returns = logReturns(tail(candles, lookback + 1));
        if (returns.length < MIN_RETURNS) {
            return CorrelationResult.NONE;
        }

        double maxCorrelation = Double.NEGATIVE_INFINITY;
        String correlatedWith = null;
        for (Map.Entry<String, List<Candle>> held : heldCandles.entrySet()) {
            if (held.getKey().equals(symbol)) {
                continue;
            }
            double correlation = pearson(returns, logReturns(tail(held.getValue(), lookback + 1)));
            if (Double.isNaN(correlation)) {
                continue;
            }
            if (correlation > maxCorrelation) {
                maxCorrelation = correlation;
                correlatedWith = held.getKey();
            }
        }

        if (correlatedWith == null) {
            return CorrelationResult.NONE;
        }
        return new CorrelationResult(maxCorrelation >= threshold, maxCorrelation, correlatedWith);
    }

    static double[] logReturns(List<Candle> candles) {
        List<Double> returns = new ArrayList<>();
        for (int i = 1; i < candles.size(); i++) {
            double previous = candles.get(i - 1).close();
            double current = candles.get(i).close();
            if (previous > 0 && current > 0) {
                returns.add(Math.log(current / previous));
            }
        }
        return returns.stream().mapToDouble(Double::doubleValue).toArray();
    }

    /**
     * Correlation over the most recent common length of both series, {@code NaN} when undefined.
     */
    static double pearson(double[] a, double[] b) {
        int n = Math.min(a.length, b.length);
        if (n < 2) {
            return Double.NaN;
        }
        int offsetA = a.length - n;
        int offsetB = b.length - n;

        double meanA = 0.0;
        double meanB = 0.0;
        for (int i = 0; i < n; i++) {
            meanA += a[offsetA + i];
            meanB += b[offsetB + i];
        }
        meanA /= n;
        meanB /= n;

        double covariance = 0.0;
        double varianceA = 0.0;
        double varianceB = 0.0;
        for (int i = 0; i < n; i++) {
            double da = a[offsetA + i] - meanA;
            double db = b[offsetB + i] - meanB;
            covariance += da * db;
            varianceA += da * da;
            varianceB += db * db;
        }
        double denominator = Math.sqrt(varianceA * varianceB);
        return denominator == 0.0 ? Double.NaN : covariance / denominator;
    }

    private List<Candle> tail(List<Candle> candles, int size) {
        if (candles == null) {
            return List.of();
        }
        return candles.subList(Math.max(0, candles.size() - size), candles.size());
    }
}
