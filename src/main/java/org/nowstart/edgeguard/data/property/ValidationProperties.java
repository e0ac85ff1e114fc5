package org.nowstart.edgeguard.data.property;

import lombok.Builder;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Builder(toBuilder = true)
@ConfigurationProperties(prefix = "edgeguard.validation")
public record ValidationProperties(
        // walk-forward 분할 수
        Integer walkForwardFolds,
        // 각 분할의 학습 구간 비율
        Double trainRatio,
        // 몬테카를로 반복 횟수
        Integer monteCarloIterations,
        // 고정 시드, null 이면 매 실행마다 무작위
        Long monteCarloSeed,
        // 민감도 분석 병렬도
        Integer sensitivityParallelism
) {

    private static final int DEFAULT_PARALLELISM = Math.max(1, Runtime.getRuntime().availableProcessors());

    public ValidationProperties {
        walkForwardFolds = walkForwardFolds != null ? walkForwardFolds : 5;
        trainRatio = trainRatio != null ? trainRatio : 0.7;
        monteCarloIterations = monteCarloIterations != null ? monteCarloIterations : 1000;
        sensitivityParallelism = sensitivityParallelism != null ? sensitivityParallelism : DEFAULT_PARALLELISM;

        if (walkForwardFolds < 2) {
            throw new IllegalArgumentException("walk-forward-folds must be >= 2");
        }
        if (trainRatio <= 0.0 || trainRatio >= 1.0) {
            throw new IllegalArgumentException("train-ratio must be between 0 and 1");
        }
        if (monteCarloIterations <= 0) {
            throw new IllegalArgumentException("monte-carlo-iterations must be > 0");
        }
        if (sensitivityParallelism <= 0) {
            throw new IllegalArgumentException("sensitivity-parallelism must be > 0");
        }
    }

    public static ValidationProperties defaults() {
        return builder().build();
    }
}
