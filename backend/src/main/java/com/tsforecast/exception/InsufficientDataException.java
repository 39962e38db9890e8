package com.tsforecast.exception;

public class InsufficientDataException extends ForecastServiceException {
    public InsufficientDataException(String message) {
        super("insufficient_data", message);
    }
    public InsufficientDataException(int actual, int required) {
        super("insufficient_data",
              "At least " + required + " data points are required after aggregation for a reliable forecast, got "
                  + actual + ".");
    }
}
