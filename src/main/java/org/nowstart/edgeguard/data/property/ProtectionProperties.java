package org.nowstart.edgeguard.data.property;

import lombok.Builder;

@Builder(toBuilder = true)
public record ProtectionProperties(
        GuardProperties cooldown,
        GuardProperties stoplossGuard,
        GuardProperties maxDrawdown,
        GuardProperties lowProfitPairs
) {

    public ProtectionProperties {
        cooldown = cooldown != null ? cooldown : GuardProperties.disabled();
        stoplossGuard = stoplossGuard != null ? stoplossGuard : GuardProperties.disabled();
        maxDrawdown = maxDrawdown != null ? maxDrawdown : GuardProperties.disabled();
        lowProfitPairs = lowProfitPairs != null ? lowProfitPairs : GuardProperties.disabled();
    }

    public static ProtectionProperties defaults() {
        return builder().build();
    }

    public boolean anyEnabled() {
        return cooldown.enabled() || stoplossGuard.enabled() || maxDrawdown.enabled() || lowProfitPairs.enabled();
    }
}
