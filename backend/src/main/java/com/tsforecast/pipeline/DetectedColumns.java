package com.tsforecast.pipeline;

/** Input column names resolved for the timestamp and target roles. */
public record DetectedColumns(String date, String target) {
}
