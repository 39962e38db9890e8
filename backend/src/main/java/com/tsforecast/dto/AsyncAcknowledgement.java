package com.tsforecast.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AsyncAcknowledgement {
    public static final String PROCESSING = "processing";

    boolean success;
    String message;
    String requestId;
    String status;
    String callbackUrl;
}
