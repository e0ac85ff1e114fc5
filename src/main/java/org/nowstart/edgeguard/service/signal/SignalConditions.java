package org.nowstart.edgeguard.service.signal;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiPredicate;
import org.nowstart.edgeguard.data.dto.IndicatorSnapshot;
import org.nowstart.edgeguard.data.dto.MacdValues;
import org.nowstart.edgeguard.data.dto.VwapBands;
import org.nowstart.edgeguard.data.property.IndicatorProperties;

/**
 * Closed table of named rule conditions. Each entry is a pure predicate over the snapshot and the
 * indicator settings; unknown names evaluate to {@code false}.
 */
public final class SignalConditions {

    private static final Map<String, BiPredicate<IndicatorSnapshot, IndicatorProperties>> CONDITIONS = build();

    private SignalConditions() {
    }

    public static boolean evaluate(String name, IndicatorSnapshot indicators, IndicatorProperties properties) {
        BiPredicate<IndicatorSnapshot, IndicatorProperties> condition = CONDITIONS.get(name);
        return condition != null && condition.test(indicators, properties);
    }

    public static boolean isKnown(String name) {
        return CONDITIONS.containsKey(name);
    }

    public static Set<String> names() {
        return CONDITIONS.keySet();
    }

    private static Map<String, BiPredicate<IndicatorSnapshot, IndicatorProperties>> build() {
        Map<String, BiPredicate<IndicatorSnapshot, IndicatorProperties>> conditions = new LinkedHashMap<>();

        conditions.put("ma_golden_cross", (ind, cfg) ->
                ind.prevMaShort() <= ind.prevMaLong() && ind.maShort() > ind.maLong());
        conditions.put("ma_death_cross", (ind, cfg) ->
                ind.prevMaShort() >= ind.prevMaLong() && ind.maShort() < ind.maLong());
        conditions.put("ma_bullish", (ind, cfg) -> ind.maShort() > ind.maLong());
        conditions.put("ma_bearish", (ind, cfg) -> ind.maShort() < ind.maLong());

        conditions.put("rsi_oversold", (ind, cfg) -> ind.rsi() < cfg.rsiOversold());
        conditions.put("rsi_overbought", (ind, cfg) -> ind.rsi() > cfg.rsiOverbought());
        conditions.put("rsi_not_oversold", (ind, cfg) -> ind.rsi() >= cfg.rsiOversold());

        conditions.put("macd_golden_cross", (ind, cfg) -> {
            MacdValues macd = ind.macd();
            return macd != null && macd.prevMacd() <= macd.prevSignal() && macd.macd() > macd.signal();
        });
        conditions.put("macd_death_cross", (ind, cfg) -> {
            MacdValues macd = ind.macd();
            return macd != null && macd.prevMacd() >= macd.prevSignal() && macd.macd() < macd.signal();
        });
        conditions.put("macd_bullish", (ind, cfg) -> {
            MacdValues macd = ind.macd();
            return macd != null && macd.macd() > macd.signal() && macd.histogram() > 0;
        });
        conditions.put("macd_bearish", (ind, cfg) -> {
            MacdValues macd = ind.macd();
            return macd != null && macd.macd() < macd.signal() && macd.histogram() < 0;
        });
        conditions.put("macd_histogram_expanding", (ind, cfg) -> {
            MacdValues macd = ind.macd();
            return macd != null && Math.abs(macd.histogram()) > Math.abs(macd.prevHistogram());
        });

        conditions.put("volume_surge", (ind, cfg) ->
                ind.avgVolume() > 0 && ind.volume() >= ind.avgVolume() * cfg.volumeSurgeRatio());
        conditions.put("volume_low", (ind, cfg) ->
                ind.avgVolume() > 0 && ind.volume() <= ind.avgVolume() * cfg.volumeLowRatio());

        conditions.put("price_above_vwap", (ind, cfg) -> {
            VwapBands vwap = ind.vwap();
            return vwap != null && ind.price() > vwap.vwap();
        });
        conditions.put("price_below_vwap", (ind, cfg) -> {
            VwapBands vwap = ind.vwap();
            return vwap != null && ind.price() < vwap.vwap();
        });
        conditions.put("vwap_below_lower", (ind, cfg) -> {
            VwapBands vwap = ind.vwap();
            return vwap != null && ind.price() < vwap.lower1();
        });
        conditions.put("vwap_above_upper", (ind, cfg) -> {
            VwapBands vwap = ind.vwap();
            return vwap != null && ind.price() > vwap.upper1();
        });

        return Map.copyOf(conditions);
    }
}
