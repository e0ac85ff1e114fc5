package org.nowstart.edgeguard.service.indicator;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.dto.IndicatorSnapshot;
import org.nowstart.edgeguard.data.dto.MacdValues;
import org.nowstart.edgeguard.data.dto.VwapBands;
import org.nowstart.edgeguard.data.property.IndicatorProperties;
import org.nowstart.edgeguard.data.property.MacdProperties;
import org.springframework.stereotype.Service;

/**
 * Derives one {@link IndicatorSnapshot} per candle window.
 *
 * <p>Previous-period moving averages and MACD values are computed in the same pass so crossover
 * conditions never depend on state kept between ticks.
 */
@Service
public class IndicatorService {

    public Optional<IndicatorSnapshot> calculate(List<Candle> candles, IndicatorProperties properties) {
        if (candles == null || candles.size() < properties.requiredCandles()) {
            return Optional.empty();
        }

        double[] closes = candles.stream().mapToDouble(Candle::close).toArray();
        double[] prevCloses = Arrays.copyOf(closes, closes.length - 1);

        double maShort = simpleMovingAverage(closes, properties.maShort());
        double maLong = simpleMovingAverage(closes, properties.maLong());
        double prevMaShort = simpleMovingAverage(prevCloses, properties.maShort());
        double prevMaLong = simpleMovingAverage(prevCloses, properties.maLong());
        double rsi = relativeStrengthIndex(closes, properties.rsiPeriod());
        if (Double.isNaN(maShort) || Double.isNaN(maLong) || Double.isNaN(rsi)) {
            return Optional.empty();
        }

        MacdValues macd = null;
        if (properties.macd().enabled()) {
            macd = macd(closes, properties.macd());
            if (macd == null) {
                return Optional.empty();
            }
        }

        Candle last = candles.get(candles.size() - 1);
        return Optional.of(new IndicatorSnapshot(
                last.close(),
                last.volume(),
                averageVolume(candles, properties.volumeAvgPeriod()),
                maShort,
                maLong,
                prevMaShort,
                prevMaLong,
                rsi,
                macd,
                vwap(candles),
                null,
                null,
                null,
                null,
                null
        ));
    }

    public double simpleMovingAverage(double[] values, int period) {
        if (period <= 0 || values.length < period) {
            return Double.NaN;
        }
        double sum = 0.0;
        for (int i = values.length - period; i < values.length; i++) {
            sum += values[i];
        }
        return sum / period;
    }

    /**
     * EMA series seeded with the SMA of the first {@code period} values; earlier slots are {@code NaN}.
     */
    public double[] exponentialMovingAverage(double[] values, int period) {
        int n = values.length;
        double[] ema = new double[n];
        Arrays.fill(ema, Double.NaN);
        if (period <= 0 || n < period) {
            return ema;
        }

        double seed = 0.0;
        for (int i = 0; i < period; i++) {
            seed += values[i];
        }
        ema[period - 1] = seed / period;

        double alpha = 2.0 / (period + 1.0);
        for (int i = period; i < n; i++) {
            ema[i] = (alpha * values[i]) + ((1.0 - alpha) * ema[i - 1]);
        }
        return ema;
    }

    /**
     * RSI from the simple average gain and loss of the last {@code period} close-to-close changes.
     * Returns 100 when there was no loss in the window.
     */
    public double relativeStrengthIndex(double[] closes, int period) {
        if (period <= 0 || closes.length < period + 1) {
            return Double.NaN;
        }
        double gains = 0.0;
        double losses = 0.0;
        for (int i = closes.length - period; i < closes.length; i++) {
            double change = closes[i] - closes[i - 1];
            if (change > 0) {
                gains += change;
            } else {
                losses -= change;
            }
        }
        double avgGain = gains / period;
        double avgLoss = losses / period;
        if (avgLoss == 0.0) {
            return 100.0;
        }
        double rs = avgGain / avgLoss;
        return 100.0 - 100.0 / (1.0 + rs);
    }

    /**
     * Returns {@code null} when there are not enough closes for the signal line and its previous value.
     */
    public MacdValues macd(double[] closes, MacdProperties properties) {
        int n = closes.length;
        if (n < properties.slow() + properties.signal()) {
            return null;
        }
        double[] fast = exponentialMovingAverage(closes, properties.fast());
        double[] slow = exponentialMovingAverage(closes, properties.slow());

        int start = properties.slow() - 1;
        double[] line = new double[n - start];
        for (int i = start; i < n; i++) {
            line[i - start] = fast[i] - slow[i];
        }
        double[] signal = exponentialMovingAverage(line, properties.signal());

        int last = line.length - 1;
        double macd = line[last];
        double signalValue = signal[last];
        double prevMacd = line[last - 1];
        double prevSignal = signal[last - 1];
        if (Double.isNaN(signalValue) || Double.isNaN(prevSignal)) {
            return null;
        }
        return new MacdValues(
                macd,
                signalValue,
                macd - signalValue,
                prevMacd,
                prevSignal,
                prevMacd - prevSignal
        );
    }

    /**
     * Session VWAP over the candles sharing the last candle's UTC date, with 1σ and 2σ bands from the
     * volume-weighted variance of the typical price. Returns {@code null} for an empty window or a session
     * without volume.
     */
    public VwapBands vwap(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return null;
        }
        LocalDate session = utcDate(candles.get(candles.size() - 1));

        double sumPv = 0.0;
        double sumV = 0.0;
        for (int i = candles.size() - 1; i >= 0; i--) {
            Candle candle = candles.get(i);
            if (!utcDate(candle).equals(session)) {
                break;
            }
            sumPv += candle.typicalPrice() * candle.volume();
            sumV += candle.volume();
        }
        if (sumV <= 0.0) {
            return null;
        }
        double vwap = sumPv / sumV;

        double weightedSquares = 0.0;
        for (int i = candles.size() - 1; i >= 0; i--) {
            Candle candle = candles.get(i);
            if (!utcDate(candle).equals(session)) {
                break;
            }
            double diff = candle.typicalPrice() - vwap;
            weightedSquares += candle.volume() * diff * diff;
        }
        double sd = Math.sqrt(weightedSquares / sumV);
        return new VwapBands(vwap, vwap + sd, vwap - sd, vwap + 2 * sd, vwap - 2 * sd);
    }

    /**
     * Mean volume of the {@code period} candles before the last one; {@code 0} when there is no history.
     */
    public double averageVolume(List<Candle> candles, int period) {
        int end = candles.size() - 1;
        int start = Math.max(0, end - period);
        if (end - start <= 0) {
            return 0.0;
        }
        double sum = 0.0;
        for (int i = start; i < end; i++) {
            sum += candles.get(i).volume();
        }
        return sum / (end - start);
    }

    private LocalDate utcDate(Candle candle) {
        return candle.openTime().atOffset(ZoneOffset.UTC).toLocalDate();
    }
}
