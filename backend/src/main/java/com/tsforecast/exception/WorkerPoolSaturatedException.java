package com.tsforecast.exception;

public class WorkerPoolSaturatedException extends ForecastServiceException {
    public WorkerPoolSaturatedException(int capacity, Throwable cause) {
        super("service_busy",
              "All background workers are busy and " + capacity + " requests are already queued. Please retry later.",
              cause);
    }
}
