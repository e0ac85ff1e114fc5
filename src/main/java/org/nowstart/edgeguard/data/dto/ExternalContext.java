package org.nowstart.edgeguard.data.dto;

import java.util.List;
import java.util.Map;
import org.nowstart.edgeguard.data.type.PositionSide;
import org.nowstart.edgeguard.strategy.core.StateStore;

/**
 * Optional inputs supplied by the caller of the signal pipeline. Every field may be {@code null};
 * an absent value disables the feature that depends on it.
 *
 * @param cvd              cumulative volume delta injected into the indicator snapshot
 * @param fundingRate      funding rate percent
 * @param btcDominance     cross-asset dominance percent
 * @param btcDomChange     seven day dominance change
 * @param currentSide      side currently held for the symbol, {@code null} when flat
 * @param heldCandles      candle windows of the other symbols currently held (correlation filter)
 * @param supportLevel     externally computed pivot support (risk-reward filter)
 * @param resistanceLevel  externally computed pivot resistance (risk-reward filter)
 * @param stateStore       per strategy and symbol key-value state for plugin strategies
 */
public record ExternalContext(
        Double cvd,
        Double fundingRate,
        Double btcDominance,
        Double btcDomChange,
        PositionSide currentSide,
        Map<String, List<Candle>> heldCandles,
        Double supportLevel,
        Double resistanceLevel,
        StateStore stateStore
) {

    public static final ExternalContext EMPTY = new ExternalContext(null, null, null, null, null, null, null, null, null);

    public ExternalContext {
        heldCandles = heldCandles != null ? Map.copyOf(heldCandles) : Map.of();
    }

    public static ExternalContext forBacktest(
            PositionSide currentSide,
            Map<String, List<Candle>> heldCandles,
            StateStore stateStore
    ) {
        return new ExternalContext(null, null, null, null, currentSide, heldCandles, null, null, stateStore);
    }
}
