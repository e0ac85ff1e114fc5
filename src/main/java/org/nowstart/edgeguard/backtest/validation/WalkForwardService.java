package org.nowstart.edgeguard.backtest.validation;

import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.edgeguard.backtest.service.BacktestService;
import org.nowstart.edgeguard.data.dto.BacktestResult;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.dto.WalkForwardFold;
import org.nowstart.edgeguard.data.dto.WalkForwardReport;
import org.nowstart.edgeguard.data.property.TradingProperties;
import org.nowstart.edgeguard.data.property.ValidationProperties;
import org.nowstart.edgeguard.data.type.WalkForwardVerdict;
import org.nowstart.edgeguard.util.NumericSafety;
import org.springframework.stereotype.Service;

/**
 * Rolling walk-forward: the series is cut into {@code k} consecutive windows of {@code n / k} candles
 * and each window trains on its first {@code floor(window * trainRatio)} candles and tests on the rest.
 * The last window also takes the remainder of the division.
 *
 * <p>Folds with fewer than {@value #MIN_TRAIN_CANDLES} training or {@value #MIN_TEST_CANDLES} test
 * candles are skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WalkForwardService {

    static final int MIN_TRAIN_CANDLES = 60;
    static final int MIN_TEST_CANDLES = 10;
    static final double ROBUST_CONSISTENCY = 0.6;
    static final double AVERAGE_CONSISTENCY = 0.4;
    static final double AVERAGE_MIN_RETURN = -3.0;

    private final BacktestService backtestService;
    private final ValidationProperties validationProperties;

    public WalkForwardReport run(String symbol, List<Candle> candles, TradingProperties config) {
        return run(symbol, candles, config, validationProperties.walkForwardFolds(), validationProperties.trainRatio());
    }

    public WalkForwardReport run(
            String symbol,
            List<Candle> candles,
            TradingProperties config,
            int folds,
            double trainRatio
    ) {
        if (folds < 2) {
            throw new IllegalArgumentException("folds must be >= 2");
        }
        if (trainRatio <= 0.0 || trainRatio >= 1.0) {
            throw new IllegalArgumentException("trainRatio must be between 0 and 1");
        }

        int n = candles.size();
        int windowSize = n / folds;

        List<WalkForwardFold> results = new ArrayList<>();
        for (int i = 0; i < folds; i++) {
            int windowStart = i * windowSize;
            int windowEnd = i == folds - 1 ? n : windowStart + windowSize;
            int trainEnd = windowStart + (int) Math.floor((windowEnd - windowStart) * trainRatio);
            List<Candle> train = candles.subList(windowStart, trainEnd);
            List<Candle> test = candles.subList(trainEnd, windowEnd);
            if (train.size() < MIN_TRAIN_CANDLES || test.size() < MIN_TEST_CANDLES) {
                continue;
            }

            BacktestResult inSample = backtestService.run(symbol, train, config);
            BacktestResult outOfSample = backtestService.run(symbol, test, config);
            WalkForwardFold fold = new WalkForwardFold(
                    i,
                    train.get(0).openTime(),
                    train.get(train.size() - 1).openTime(),
                    test.get(0).openTime(),
                    test.get(test.size() - 1).openTime(),
                    train.size(),
                    test.size(),
                    inSample.metrics().totalReturnPercent(),
                    outOfSample.metrics().totalReturnPercent(),
                    inSample.metrics().sharpeRatio(),
                    outOfSample.metrics().sharpeRatio(),
                    inSample.metrics().totalTrades(),
                    outOfSample.metrics().totalTrades()
            );
            results.add(fold);
            log.info("event=walk_forward_fold symbol={} fold={} train={} test={} is_return={} oos_return={}",
                    symbol, i, train.size(), test.size(),
                    NumericSafety.sanitizeForLog(fold.inSampleReturn()),
                    NumericSafety.sanitizeForLog(fold.outOfSampleReturn()));
        }

        return summarize(results);
    }

    WalkForwardReport summarize(List<WalkForwardFold> folds) {
        double avgOutOfSample = folds.stream().mapToDouble(WalkForwardFold::outOfSampleReturn).average().orElse(0.0);
        double avgInSample = folds.stream().mapToDouble(WalkForwardFold::inSampleReturn).average().orElse(0.0);
        long positive = folds.stream().filter(fold -> fold.outOfSampleReturn() > 0).count();
        double consistency = NumericSafety.safeRatio(positive, folds.size());
        boolean robust = avgOutOfSample > 0 && consistency >= ROBUST_CONSISTENCY;
        return new WalkForwardReport(folds, avgInSample, avgOutOfSample, consistency, robust,
                verdict(robust, avgOutOfSample, consistency));
    }

    private WalkForwardVerdict verdict(boolean robust, double avgOutOfSample, double consistency) {
        if (robust) {
            return WalkForwardVerdict.ROBUST;
        }
        if (avgOutOfSample > AVERAGE_MIN_RETURN && consistency >= AVERAGE_CONSISTENCY) {
            return WalkForwardVerdict.AVERAGE;
        }
        return WalkForwardVerdict.OVERFIT;
    }
}
