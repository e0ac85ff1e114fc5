package org.nowstart.edgeguard.data.property;

import java.util.List;
import lombok.Builder;

@Builder(toBuilder = true)
public record EnsembleProperties(
        List<EnsembleMemberProperties> members,
        // 승리 방향의 최소 가중 점수
        Double threshold,
        // true 이면 기권하지 않은 전략이 모두 같은 방향이어야 함
        Boolean unanimous
) {

    public EnsembleProperties {
        members = members != null ? List.copyOf(members) : List.of();
        threshold = threshold != null ? threshold : 0.5;
        unanimous = unanimous != null ? unanimous : false;

        if (threshold < 0 || threshold > 1) {
            throw new IllegalArgumentException("ensemble.threshold must be within 0..1");
        }
    }

    public static EnsembleProperties defaults() {
        return builder().build();
    }
}
