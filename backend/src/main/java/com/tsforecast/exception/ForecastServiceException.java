package com.tsforecast.exception;

import lombok.Getter;

@Getter
public abstract class ForecastServiceException extends RuntimeException {
    private final String errorCode;
    protected ForecastServiceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    protected ForecastServiceException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
