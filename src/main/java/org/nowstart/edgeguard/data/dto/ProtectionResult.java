package org.nowstart.edgeguard.data.dto;

import java.time.Instant;

public record ProtectionResult(
        boolean allowed,
        String protection,
        String reason,
        Instant blockedUntil
) {

    public static final ProtectionResult ALLOWED = new ProtectionResult(true, null, null, null);

    public static ProtectionResult blocked(String protection, String reason, Instant blockedUntil) {
        return new ProtectionResult(false, protection, reason, blockedUntil);
    }
}
