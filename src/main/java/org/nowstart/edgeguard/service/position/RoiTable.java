package org.nowstart.edgeguard.service.position;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import org.nowstart.edgeguard.data.type.PositionSide;

/**
 * Time decaying minimum profit table keyed by holding minutes. The applicable entry is the greatest
 * key that is less than or equal to the elapsed minutes.
 */
public final class RoiTable {

    private RoiTable() {
    }

    public static Optional<Double> threshold(Map<Integer, Double> table, Duration held) {
        if (table == null || table.isEmpty()) {
            return Optional.empty();
        }
        double heldMinutes = held.toMillis() / 60_000.0;
        Map.Entry<Integer, Double> applicable = null;
        for (Map.Entry<Integer, Double> entry : new TreeMap<>(table).entrySet()) {
            if (entry.getKey() > heldMinutes) {
                break;
            }
            applicable = entry;
        }
        return applicable == null ? Optional.empty() : Optional.ofNullable(applicable.getValue());
    }

    public static boolean checkMinimalRoi(Map<Integer, Double> table, Duration held, double profitRatio) {
        return threshold(table, held)
                .map(threshold -> profitRatio >= threshold)
                .orElse(false);
    }

    public static double profitRatio(PositionSide side, double entryPrice, double price) {
        if (entryPrice <= 0) {
            return 0.0;
        }
        return side == PositionSide.SHORT
                ? (entryPrice - price) / entryPrice
                : (price - entryPrice) / entryPrice;
    }

    public static String format(Map<Integer, Double> table) {
        if (table == null || table.isEmpty()) {
            return "";
        }
        return new TreeMap<>(table).entrySet().stream()
                .map(entry -> String.format(Locale.ROOT, "%dmin→%.1f%%", entry.getKey(), entry.getValue() * 100))
                .collect(Collectors.joining("  "));
    }
}
