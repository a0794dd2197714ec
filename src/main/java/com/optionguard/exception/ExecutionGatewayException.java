package com.optionguard.exception;

public class ExecutionGatewayException extends BaseException {

    public ExecutionGatewayException(String message) {
        super(ErrorCode.EXECUTION_ERROR, message);
    }

    public ExecutionGatewayException(String message, Throwable cause) {
        super(ErrorCode.EXECUTION_ERROR, message, cause);
    }
}
