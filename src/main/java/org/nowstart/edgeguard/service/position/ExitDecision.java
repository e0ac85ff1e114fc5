package org.nowstart.edgeguard.service.position;

import org.nowstart.edgeguard.data.type.ExitReason;

public record ExitDecision(double exitPrice, ExitReason reason) {
}
