package com.tsforecast.exception;

public class MissingParameterException extends ForecastServiceException {
    public MissingParameterException(String message) {
        super("missing_parameter", message);
    }
}
