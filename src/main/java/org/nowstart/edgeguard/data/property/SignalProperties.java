package org.nowstart.edgeguard.data.property;

import java.util.List;
import lombok.Builder;

@Builder(toBuilder = true)
public record SignalProperties(
        List<String> buy,
        List<String> sell,
        List<String> shortEntry,
        List<String> cover
) {

    public SignalProperties {
        buy = buy != null ? List.copyOf(buy) : List.of("ma_golden_cross");
        sell = sell != null ? List.copyOf(sell) : List.of("ma_death_cross");
        shortEntry = shortEntry != null ? List.copyOf(shortEntry) : List.of();
        cover = cover != null ? List.copyOf(cover) : List.of();
    }

    public static SignalProperties defaults() {
        return builder().build();
    }
}
