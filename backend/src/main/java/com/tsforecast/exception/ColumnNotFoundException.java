package com.tsforecast.exception;

public class ColumnNotFoundException extends ForecastServiceException {
    public ColumnNotFoundException(String role) {
        super("column_not_found", "Required " + role + " column could not be found in the input data.");
    }
    public ColumnNotFoundException(String role, String column) {
        super("column_not_found",
              "Column '" + column + "' was detected as the " + role + " column but holds no usable values.");
    }
}
