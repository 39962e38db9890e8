package com.tsforecast.exception;

public class MalformedBodyException extends ForecastServiceException {
    public MalformedBodyException(Throwable cause) {
        super("bad_request", "Invalid JSON body.", cause);
    }
}
