package org.nowstart.edgeguard.backtest.validation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.edgeguard.backtest.service.BacktestService;
import org.nowstart.edgeguard.data.dto.BacktestMetrics;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.dto.SensitivityPoint;
import org.nowstart.edgeguard.data.dto.SensitivityReport;
import org.nowstart.edgeguard.data.exception.TradingConfigurationException;
import org.nowstart.edgeguard.data.property.TradingProperties;
import org.nowstart.edgeguard.data.property.ValidationProperties;
import org.nowstart.edgeguard.data.type.SensitivityVerdict;
import org.springframework.stereotype.Service;

/**
 * Re-runs the backtest with one configuration value varied over a list of candidates.
 *
 * <p>The parameter is addressed by a dotted path over the configuration tree, e.g. {@code indicators.maShort}
 * or {@code risk.stopLossPercent}. Candidates the configuration rejects are skipped.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SensitivityService {

    static final int ROBUST_PCT = 70;
    static final int MODERATE_PCT = 40;

    private final BacktestService backtestService;
    private final ObjectMapper objectMapper;
    private final ValidationProperties validationProperties;

    public SensitivityReport run(String symbol, List<Candle> candles, TradingProperties config, String path, List<Double> values) {
        Map<String, List<Candle>> candlesBySymbol = new LinkedHashMap<>();
        candlesBySymbol.put(symbol, candles);
        return run(candlesBySymbol, config, path, values);
    }

    public SensitivityReport run(
            Map<String, List<Candle>> candlesBySymbol,
            TradingProperties config,
            String path,
            List<Double> values
    ) {
        ObjectNode base = objectMapper.valueToTree(config);
        String[] segments = splitPath(path);
        JsonNode existing = resolveParent(base, path, segments).get(segments[segments.length - 1]);

        AtomicInteger processed = new AtomicInteger();
        List<SensitivityPoint> points = evaluateAll(values, value -> {
            Optional<SensitivityPoint> point = withValue(base, path, segments, existing, value)
                    .map(variant -> toPoint(value, backtestService.run(candlesBySymbol, variant).metrics()));
            log.info("event=sensitivity_progress parameter={} value={} done={} total={}",
                    path, value, processed.incrementAndGet(), values.size());
            return point;
        });

        return summarize(path, points);
    }

    SensitivityReport summarize(String path, List<SensitivityPoint> points) {
        long positive = points.stream().filter(point -> point.returnPercent() > 0).count();
        int robustPct = points.isEmpty() ? 0 : (int) Math.round(positive * 100.0 / points.size());
        Double bestValue = null;
        double bestSharpe = Double.NEGATIVE_INFINITY;
        for (SensitivityPoint point : points) {
            if (bestValue == null || point.sharpe() > bestSharpe) {
                bestValue = point.value();
                bestSharpe = point.sharpe();
            }
        }

        SensitivityVerdict verdict;
        if (robustPct >= ROBUST_PCT) {
            verdict = SensitivityVerdict.ROBUST;
        } else if (robustPct >= MODERATE_PCT) {
            verdict = SensitivityVerdict.MODERATE;
        } else {
            verdict = SensitivityVerdict.FRAGILE;
        }
        return new SensitivityReport(path, points, robustPct, bestValue, verdict);
    }

    private List<SensitivityPoint> evaluateAll(
            List<Double> values,
            Function<Double, Optional<SensitivityPoint>> evaluator
    ) {
        int parallelism = validationProperties.sensitivityParallelism();
        if (parallelism <= 1 || values.size() <= 1) {
            return values.stream().map(evaluator).flatMap(Optional::stream).toList();
        }

        ForkJoinPool pool = new ForkJoinPool(parallelism);
        try {
            return pool.submit(() -> values.parallelStream().map(evaluator).flatMap(Optional::stream).toList()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Sensitivity analysis interrupted", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Sensitivity analysis failed", e.getCause());
        } finally {
            pool.shutdown();
        }
    }

    private Optional<TradingProperties> withValue(
            ObjectNode base,
            String path,
            String[] segments,
            JsonNode existing,
            double value
    ) {
        ObjectNode copy = base.deepCopy();
        ObjectNode parent = resolveParent(copy, path, segments);
        boolean integral = existing != null && existing.isIntegralNumber();
        if (integral && value != Math.rint(value)) {
            log.warn("event=sensitivity_value_skipped parameter={} value={} reason=not_an_integer", path, value);
            return Optional.empty();
        }
        parent.set(segments[segments.length - 1], integral ? IntNode.valueOf((int) value) : DoubleNode.valueOf(value));
        try {
            return Optional.of(objectMapper.treeToValue(copy, TradingProperties.class));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("event=sensitivity_value_skipped parameter={} value={} reason={}", path, value, rootMessage(e));
            return Optional.empty();
        }
    }

    private ObjectNode resolveParent(ObjectNode root, String path, String[] segments) {
        ObjectNode node = root;
        for (int i = 0; i < segments.length - 1; i++) {
            JsonNode child = node.get(segments[i]);
            if (child == null || !child.isObject()) {
                throw invalidPath(path);
            }
            node = (ObjectNode) child;
        }
        JsonNode leaf = node.get(segments[segments.length - 1]);
        if (!node.has(segments[segments.length - 1]) || (leaf != null && !leaf.isNumber() && !leaf.isNull())) {
            throw invalidPath(path);
        }
        return node;
    }

    private String[] splitPath(String path) {
        if (path == null || path.isBlank()) {
            throw invalidPath(path);
        }
        return path.trim().split("\\.");
    }

    private TradingConfigurationException invalidPath(String path) {
        return new TradingConfigurationException(
                TradingConfigurationException.INVALID_PARAMETER_PATH,
                "Unknown numeric parameter path: " + path
        );
    }

    private SensitivityPoint toPoint(double value, BacktestMetrics metrics) {
        return new SensitivityPoint(
                value,
                metrics.totalReturnPercent(),
                metrics.sharpeRatio(),
                metrics.maxDrawdownPercent(),
                metrics.totalTrades()
        );
    }

    private String rootMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
