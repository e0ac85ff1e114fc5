package org.nowstart.edgeguard.data.property;

public record EnsembleMemberProperties(
        String id,
        Double weight
) {

    public EnsembleMemberProperties {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("ensemble member id is required");
        }
        id = id.trim();
        weight = weight != null ? weight : 1.0;
    }
}
