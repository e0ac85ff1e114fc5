package org.nowstart.edgeguard.data.property;

import java.util.List;
import lombok.Builder;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Builder(toBuilder = true)
@ConfigurationProperties(prefix = "edgeguard.backtest.runner")
public record BacktestRunnerProperties(
        Boolean enabled,
        // <symbol>.csv 파일을 읽을 디렉터리
        String dataDirectory,
        List<String> symbols,
        Boolean walkForward,
        Boolean monteCarlo,
        // 비어 있으면 민감도 분석 생략
        String sensitivityParameter,
        List<Double> sensitivityValues
) {

    private static final String DEFAULT_DATA_DIRECTORY = "data/candles";

    public BacktestRunnerProperties {
        enabled = enabled != null ? enabled : false;
        dataDirectory = dataDirectory != null && !dataDirectory.isBlank() ? dataDirectory.trim() : DEFAULT_DATA_DIRECTORY;
        symbols = symbols != null ? List.copyOf(symbols) : List.of();
        walkForward = walkForward != null ? walkForward : true;
        monteCarlo = monteCarlo != null ? monteCarlo : true;
        sensitivityParameter = sensitivityParameter != null ? sensitivityParameter.trim() : "";
        sensitivityValues = sensitivityValues != null ? List.copyOf(sensitivityValues) : List.of();

        if (enabled && symbols.isEmpty()) {
            throw new IllegalArgumentException("symbols must not be empty when the runner is enabled");
        }
    }

    public boolean sensitivityRequested() {
        return !sensitivityParameter.isBlank() && !sensitivityValues.isEmpty();
    }
}
