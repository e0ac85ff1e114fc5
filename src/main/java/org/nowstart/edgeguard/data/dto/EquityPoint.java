package org.nowstart.edgeguard.data.dto;

import java.time.Instant;

public record EquityPoint(
        Instant time,
        double equity
) {
}
