package org.nowstart.edgeguard.backtest.runner;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.edgeguard.data.dto.Candle;
import org.nowstart.edgeguard.data.property.BacktestRunnerProperties;
import org.nowstart.edgeguard.data.type.Timeframe;
import org.springframework.stereotype.Component;

/**
 * Reads {@code <dataDirectory>/<symbol>.csv} with the header {@code timestamp,open,high,low,close,volume}.
 * The timestamp is the candle open time, either ISO-8601 or epoch milliseconds.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CsvCandleHistoryProvider implements CandleHistoryProvider {

    private static final int COLUMNS = 6;

    private final BacktestRunnerProperties properties;

    @Override
    public List<Candle> load(String symbol, Timeframe timeframe) {
        String safeSymbol = symbol.replaceAll("[^A-Za-z0-9._-]", "_");
        Path path = Path.of(properties.dataDirectory(), safeSymbol + ".csv");
        List<Candle> candles = loadCsv(path, timeframe);
        log.info("event=candles_loaded symbol={} path={} rows={}", symbol, path.toAbsolutePath(), candles.size());
        return candles;
    }

    List<Candle> loadCsv(Path path, Timeframe timeframe) {
        try {
            List<String> lines = Files.readAllLines(path, StandardCharsets.UTF_8);
            if (lines.size() < 2) {
                throw new IllegalArgumentException("CSV has no rows: " + path);
            }

            long intervalMillis = timeframe.intervalMillis();
            Map<Instant, Candle> dedup = new LinkedHashMap<>();
            for (int i = 1; i < lines.size(); i++) {
                String line = lines.get(i).trim();
                if (line.isEmpty()) {
                    continue;
                }
                String[] parts = line.split(",", -1);
                if (parts.length < COLUMNS) {
                    log.warn("event=csv_row_skipped path={} line={} columns={}", path, i + 1, parts.length);
                    continue;
                }
                Instant openTime = parseTimestamp(parts[0]);
                dedup.put(openTime, new Candle(
                        openTime,
                        openTime.plusMillis(intervalMillis - 1),
                        parseDouble(parts[1]),
                        parseDouble(parts[2]),
                        parseDouble(parts[3]),
                        parseDouble(parts[4]),
                        parseDouble(parts[5])
                ));
            }

            List<Candle> out = new ArrayList<>(dedup.values());
            out.sort(Comparator.comparing(Candle::openTime));
            return out;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load CSV: " + path, e);
        }
    }

    private Instant parseTimestamp(String raw) {
        String ts = raw.trim();
        if (!ts.isEmpty() && ts.chars().allMatch(Character::isDigit)) {
            return Instant.ofEpochMilli(Long.parseLong(ts));
        }
        if (ts.endsWith("Z") || ts.endsWith("z")) {
            return Instant.parse(ts.toUpperCase(Locale.ROOT));
        }
        return Instant.parse(ts + "Z");
    }

    private double parseDouble(String raw) {
        return Double.parseDouble(raw.trim());
    }
}
