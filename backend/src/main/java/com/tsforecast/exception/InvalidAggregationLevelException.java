package com.tsforecast.exception;

public class InvalidAggregationLevelException extends ForecastServiceException {
    public InvalidAggregationLevelException(String level) {
        super("invalid_aggregation_level",
              "Aggregation level '" + level + "' is not supported; expected 'weekly' or 'monthly'.");
    }
}
