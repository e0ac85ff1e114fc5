package org.nowstart.edgeguard.service.regime;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.dto.RegimeAnalysis;
import org.nowstart.edgeguard.data.type.MarketRegime;
import org.nowstart.edgeguard.data.type.PriceStructure;
import org.nowstart.edgeguard.data.type.SignalFilterMode;
import org.springframework.stereotype.Service;

/**
 * Labels a candle window from three inputs: ADX(14) trend strength, Bollinger band width and its
 * percentile, and the higher-high / lower-low structure of the last 20 bars.
 */
@Service
public class RegimeClassifier {

    static final int ADX_PERIOD = 14;
    static final int BB_PERIOD = 20;
    static final double BB_STD_MULT = 2.0;
    static final int STRUCTURE_LOOKBACK = 10;
    static final int BREAKOUT_LOOKBACK = 10;
    static final double NARROW_WIDTH = 0.3;
    static final double EXPANSION_FACTOR = 1.3;

    public RegimeAnalysis classify(List<Candle> candles) {
        if (candles == null || candles.size() < ADX_PERIOD * 2 + 1) {
            return RegimeAnalysis.unknown("insufficient candles for ADX");
        }

        double[] closes = candles.stream().mapToDouble(Candle::close).toArray();
        AdxValues adx = averageDirectionalIndex(candles, ADX_PERIOD);
        double[] widths = bollingerWidths(closes, BB_PERIOD);
        double bbWidth = widths.length == 0 ? 0.0 : widths[widths.length - 1];
        double percentile = widthPercentile(widths, bbWidth);
        PriceStructure structure = priceStructure(candles, STRUCTURE_LOOKBACK);

        double firstRecentWidth = recentFirstWidth(closes);
        boolean wasNarrow = !Double.isNaN(firstRecentWidth) && firstRecentWidth < NARROW_WIDTH;
        boolean expanding = bbWidth > (Double.isNaN(firstRecentWidth) ? 0.0 : firstRecentWidth) * EXPANSION_FACTOR;

        MarketRegime regime;
        double confidence;
        SignalFilterMode filterMode;
        String detail;

        if (wasNarrow && expanding) {
            regime = adx.plusDi() > adx.minusDi() ? MarketRegime.BREAKOUT_UP : MarketRegime.BREAKOUT_DOWN;
            confidence = 55;
            filterMode = SignalFilterMode.BREAKOUT_WATCH;
            detail = format("bb width expanding from %.4f to %.4f", firstRecentWidth, bbWidth);
        } else if (adx.adx() > 25) {
            if (adx.plusDi() > adx.minusDi() && structure == PriceStructure.HIGHER_HIGHS) {
                regime = MarketRegime.TRENDING_UP;
                confidence = Math.min(95, 60 + (adx.adx() - 25) * 1.5);
            } else if (adx.minusDi() > adx.plusDi() && structure == PriceStructure.LOWER_LOWS) {
                regime = MarketRegime.TRENDING_DOWN;
                confidence = Math.min(95, 60 + (adx.adx() - 25) * 1.5);
            } else {
                regime = adx.plusDi() > adx.minusDi() ? MarketRegime.TRENDING_UP : MarketRegime.TRENDING_DOWN;
                confidence = 45;
            }
            filterMode = SignalFilterMode.TREND_ONLY;
            detail = format("adx=%.1f strong trend, di+=%.1f di-=%.1f", adx.adx(), adx.plusDi(), adx.minusDi());
        } else if (adx.adx() < 20) {
            if (percentile < 25) {
                regime = MarketRegime.RANGING_TIGHT;
                confidence = 75;
                filterMode = SignalFilterMode.BREAKOUT_WATCH;
                detail = format("adx=%.1f no trend, bb width at %.0fth percentile", adx.adx(), percentile);
            } else {
                regime = MarketRegime.RANGING_WIDE;
                confidence = 65;
                filterMode = SignalFilterMode.REVERSAL_ONLY;
                detail = format("adx=%.1f no trend, wide range", adx.adx());
            }
        } else {
            if (structure == PriceStructure.HIGHER_HIGHS && adx.plusDi() > adx.minusDi()) {
                regime = MarketRegime.TRENDING_UP;
                confidence = 50;
            } else if (structure == PriceStructure.LOWER_LOWS && adx.minusDi() > adx.plusDi()) {
                regime = MarketRegime.TRENDING_DOWN;
                confidence = 50;
            } else {
                regime = percentile < 40 ? MarketRegime.RANGING_TIGHT : MarketRegime.RANGING_WIDE;
                confidence = 45;
            }
            filterMode = SignalFilterMode.REDUCED_SIZE;
            detail = format("adx=%.1f transition zone", adx.adx());
        }

        if ((regime == MarketRegime.TRENDING_UP && structure == PriceStructure.LOWER_LOWS)
                || (regime == MarketRegime.TRENDING_DOWN && structure == PriceStructure.HIGHER_HIGHS)) {
            confidence = Math.max(30, confidence - 20);
        }

        return new RegimeAnalysis(
                regime,
                (int) Math.round(confidence),
                filterMode,
                adx.adx(),
                adx.plusDi(),
                adx.minusDi(),
                bbWidth,
                percentile,
                structure,
                detail
        );
    }

    AdxValues averageDirectionalIndex(List<Candle> candles, int period) {
        int n = candles.size();
        if (n < period * 2 + 1) {
            return new AdxValues(0, 0, 0);
        }

        double[] trueRange = new double[n - 1];
        double[] plusDm = new double[n - 1];
        double[] minusDm = new double[n - 1];
        for (int i = 1; i < n; i++) {
            Candle curr = candles.get(i);
            Candle prev = candles.get(i - 1);
            trueRange[i - 1] = Math.max(
                    curr.high() - curr.low(),
                    Math.max(Math.abs(curr.high() - prev.close()), Math.abs(curr.low() - prev.close()))
            );
            double upMove = curr.high() - prev.high();
            double downMove = prev.low() - curr.low();
            plusDm[i - 1] = upMove > downMove && upMove > 0 ? upMove : 0.0;
            minusDm[i - 1] = downMove > upMove && downMove > 0 ? downMove : 0.0;
        }

        double[] smoothTr = wilderSum(trueRange, period);
        double[] smoothPlus = wilderSum(plusDm, period);
        double[] smoothMinus = wilderSum(minusDm, period);

        double[] dx = new double[smoothTr.length];
        double lastPlusDi = 0.0;
        double lastMinusDi = 0.0;
        for (int i = 0; i < smoothTr.length; i++) {
            if (smoothTr[i] == 0.0) {
                dx[i] = 0.0;
                continue;
            }
            double plusDi = 100.0 * smoothPlus[i] / smoothTr[i];
            double minusDi = 100.0 * smoothMinus[i] / smoothTr[i];
            lastPlusDi = plusDi;
            lastMinusDi = minusDi;
            double diSum = plusDi + minusDi;
            dx[i] = diSum == 0.0 ? 0.0 : 100.0 * Math.abs(plusDi - minusDi) / diSum;
        }
        if (dx.length < period) {
            return new AdxValues(0, lastPlusDi, lastMinusDi);
        }

        double[] smoothDx = wilderSum(dx, period);
        double adx = smoothDx[smoothDx.length - 1] / period;
        return new AdxValues(adx, lastPlusDi, lastMinusDi);
    }

    /**
     * Relative band width {@code (upper - lower) / middle} for every full window of {@code period} closes.
     */
    double[] bollingerWidths(double[] closes, int period) {
        if (closes.length < period) {
            return new double[0];
        }
        double[] widths = new double[closes.length - period + 1];
        for (int end = period; end <= closes.length; end++) {
            widths[end - period] = bandWidth(closes, end - period, end);
        }
        return widths;
    }

    PriceStructure priceStructure(List<Candle> candles, int lookback) {
        int n = candles.size();
        if (n < lookback * 2) {
            return PriceStructure.FLAT;
        }
        List<Candle> recent = candles.subList(n - lookback, n);
        List<Candle> prior = candles.subList(n - lookback * 2, n - lookback);

        double recentHigh = recent.stream().mapToDouble(Candle::high).max().orElse(0);
        double recentLow = recent.stream().mapToDouble(Candle::low).min().orElse(0);
        double priorHigh = prior.stream().mapToDouble(Candle::high).max().orElse(0);
        double priorLow = prior.stream().mapToDouble(Candle::low).min().orElse(0);

        boolean higherHigh = recentHigh > priorHigh;
        boolean lowerLow = recentLow < priorLow;
        if (higherHigh && recentLow > priorLow) {
            return PriceStructure.HIGHER_HIGHS;
        }
        if (lowerLow && recentHigh < priorHigh) {
            return PriceStructure.LOWER_LOWS;
        }
        if (higherHigh || lowerLow) {
            return PriceStructure.MIXED;
        }
        return PriceStructure.FLAT;
    }

    private double widthPercentile(double[] widths, double current) {
        if (widths.length == 0) {
            return 50.0;
        }
        long rank = Arrays.stream(widths).filter(width -> width <= current).count();
        return Math.round((double) rank / widths.length * 100.0);
    }

    /**
     * Width of the oldest window among the last {@link #BREAKOUT_LOOKBACK} bars, or {@code NaN} without data.
     */
    private double recentFirstWidth(double[] closes) {
        List<Double> history = new ArrayList<>();
        for (int i = 0; i < BREAKOUT_LOOKBACK; i++) {
            int end = closes.length - i;
            if (end < BB_PERIOD) {
                break;
            }
            history.add(bandWidth(closes, end - BB_PERIOD, end));
        }
        return history.isEmpty() ? Double.NaN : history.get(history.size() - 1);
    }

    private double bandWidth(double[] closes, int from, int to) {
        int period = to - from;
        double mean = 0.0;
        for (int i = from; i < to; i++) {
            mean += closes[i];
        }
        mean /= period;
        double variance = 0.0;
        for (int i = from; i < to; i++) {
            variance += (closes[i] - mean) * (closes[i] - mean);
        }
        double stdDev = Math.sqrt(variance / period);
        return mean > 0 ? (2 * BB_STD_MULT * stdDev) / mean : 0.0;
    }

    private double[] wilderSum(double[] values, int period) {
        double[] smoothed = new double[values.length - period + 1];
        double sum = 0.0;
        for (int i = 0; i < period; i++) {
            sum += values[i];
        }
        smoothed[0] = sum;
        for (int i = period; i < values.length; i++) {
            sum = sum - sum / period + values[i];
            smoothed[i - period + 1] = sum;
        }
        return smoothed;
    }

    private String format(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }

    record AdxValues(double adx, double plusDi, double minusDi) {
    }
}
