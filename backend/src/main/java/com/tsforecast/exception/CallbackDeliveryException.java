package com.tsforecast.exception;

public class CallbackDeliveryException extends ForecastServiceException {
    public CallbackDeliveryException(String callbackUrl, Throwable cause) {
        super("callback_delivery_failed", "Delivery to callback '" + callbackUrl + "' failed: "
              + (cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName()), cause);
    }
}
