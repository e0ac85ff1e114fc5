package org.nowstart.edgeguard.data.exception;

import lombok.Getter;

@Getter
public class TradingConfigurationException extends RuntimeException {

    public static final String STRATEGY_NOT_FOUND = "strategy_not_found";
    public static final String DUPLICATE_STRATEGY = "duplicate_strategy";
    public static final String INVALID_PARAMETER_PATH = "invalid_parameter_path";

    private final String code;

    public TradingConfigurationException(String code, String message) {
        super(message);
        this.code = code;
    }

    public TradingConfigurationException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }
}
