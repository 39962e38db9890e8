package com.tsforecast.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

/** Posted to the callback address when a background forecast fails. */
@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class CallbackFailure {
    public static final String ERROR_CODE = "callback_failed";
    public static final String FAILED = "failed";

    String error;
    String message;
    String requestId;
    String status;

    public static CallbackFailure of(String requestId, String message) {
        return CallbackFailure.builder()
            .error(ERROR_CODE)
            .message(message)
            .requestId(requestId)
            .status(FAILED)
            .build();
    }
}
