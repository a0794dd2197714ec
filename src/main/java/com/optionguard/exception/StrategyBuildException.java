package com.optionguard.exception;

import java.util.Map;

public class StrategyBuildException extends BaseException {

    public StrategyBuildException(String message) {
        super(ErrorCode.STRATEGY_BUILD_FAILED, message);
    }

    public StrategyBuildException(String message, Map<String, Object> details) {
        super(ErrorCode.STRATEGY_BUILD_FAILED, message, details);
    }
}
