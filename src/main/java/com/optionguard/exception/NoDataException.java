package com.optionguard.exception;

import java.util.Map;

/**
 * Required market data (chain, expiration, quote or sensitivity) was not available.
 * Aborts the single operation that needed it; callers iterating over symbols continue.
 */
public class NoDataException extends BaseException {

    public NoDataException(String message) {
        super(ErrorCode.NO_MARKET_DATA, message);
    }

    public NoDataException(String message, Map<String, Object> details) {
        super(ErrorCode.NO_MARKET_DATA, message, details);
    }

    public NoDataException(String message, Throwable cause) {
        super(ErrorCode.NO_MARKET_DATA, message, cause);
    }
}
