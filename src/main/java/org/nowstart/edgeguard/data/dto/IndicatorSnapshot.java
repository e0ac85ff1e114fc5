package org.nowstart.edgeguard.data.dto;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Indicator values derived from one candle window. Instances are never mutated; context injection and
 * plugin extras produce a new snapshot.
 *
 * @param macd  {@code null} when MACD is disabled
 * @param vwap  {@code null} when the current UTC session has no volume
 * @param extra plugin computed values keyed by name
 */
public record IndicatorSnapshot(
        double price,
        double volume,
        double avgVolume,
        double maShort,
        double maLong,
        double prevMaShort,
        double prevMaLong,
        double rsi,
        MacdValues macd,
        VwapBands vwap,
        Double cvd,
        Double fundingRate,
        Double btcDominance,
        Double btcDomChange,
        Map<String, Double> extra
) {

    private static final Set<String> BUILT_IN_NAMES = Set.of(
            "price", "volume", "avgVolume", "maShort", "maLong", "prevMaShort", "prevMaLong", "rsi",
            "macd", "vwap", "cvd", "fundingRate", "btcDominance", "btcDomChange"
    );

    public IndicatorSnapshot {
        extra = extra != null ? Map.copyOf(extra) : Map.of();
    }

    public IndicatorSnapshot withExternalContext(ExternalContext context) {
        if (context == null) {
            return this;
        }
        return new IndicatorSnapshot(
                price, volume, avgVolume, maShort, maLong, prevMaShort, prevMaLong, rsi, macd, vwap,
                context.cvd() != null ? context.cvd() : cvd,
                context.fundingRate() != null ? context.fundingRate() : fundingRate,
                context.btcDominance() != null ? context.btcDominance() : btcDominance,
                context.btcDomChange() != null ? context.btcDomChange() : btcDomChange,
                extra
        );
    }

    /**
     * Merges plugin values. Built-in names and keys already present are never overwritten.
     */
    public IndicatorSnapshot withExtra(Map<String, Double> values) {
        if (values == null || values.isEmpty()) {
            return this;
        }
        Map<String, Double> merged = new LinkedHashMap<>(extra);
        values.forEach((key, value) -> {
            if (value != null && !BUILT_IN_NAMES.contains(key)) {
                merged.putIfAbsent(key, value);
            }
        });
        return new IndicatorSnapshot(
                price, volume, avgVolume, maShort, maLong, prevMaShort, prevMaLong, rsi, macd, vwap,
                cvd, fundingRate, btcDominance, btcDomChange, merged
        );
    }
}
