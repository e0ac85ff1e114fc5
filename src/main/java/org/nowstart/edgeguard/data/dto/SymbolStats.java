package org.nowstart.edgeguard.data.dto;

public record SymbolStats(
        String symbol,
        int trades,
        int wins,
        int losses,
        double pnl,
        double winRate
) {
}
