package com.tsforecast.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tsforecast.config.ForecastProperties;
import com.tsforecast.dto.PredictionRequest;
import com.tsforecast.exception.MalformedBodyException;
import com.tsforecast.exception.MissingParameterException;
import com.tsforecast.pipeline.Frequency;
import com.tsforecast.pipeline.RawRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Validates a raw {@code /predict} body and turns it into a {@link PredictionRequest}. Nothing
 * downstream runs when a required field is missing or has the wrong type.
 */
@Component
@RequiredArgsConstructor
public class PredictionRequestParser {

    /** Top-level keys, compared case-insensitively, that carry a callback address. */
    public static final Set<String> CALLBACK_KEYS = Set.of("callback", "webhook", "notify", "async", "background");

    private final ForecastProperties properties;
    private final ObjectMapper objectMapper;

    /** Parses the raw body as JSON whatever content type it was sent with. */
    public PredictionRequest parse(String rawBody) {
        JsonNode body;
        try {
            body = objectMapper.readTree(rawBody);
        } catch (JsonProcessingException ex) {
            throw new MalformedBodyException(ex);
        }
        return parse(body);
    }

    public PredictionRequest parse(JsonNode body) {
        if (body == null || !body.isObject()) {
            throw new MissingParameterException("Request body must be a JSON object.");
        }
        return PredictionRequest.builder()
            .data(parseData(body.get("data")))
            .predictionPeriod(parsePeriod(body.get("prediction_period")))
            .predictionFrequency(parseFrequency(body.get("prediction_frequency")))
            .featureColumns(parseFeatureColumns(body.get("feature_columns")))
            .confidenceInterval(parseConfidence(body.get("confidence_interval")))
            .callbackUrl(findCallbackUrl(body))
            .build();
    }

    private List<RawRecord> parseData(JsonNode node) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            throw new MissingParameterException("'data' is required and must be a non-empty list.");
        }
        List<RawRecord> records = new ArrayList<>(node.size());
        for (JsonNode row : node) {
            if (!row.isObject()) {
                throw new MissingParameterException("Every entry in 'data' must be an object.");
            }
            Map<String, Object> values = new LinkedHashMap<>();
            row.fields().forEachRemaining(e -> values.put(e.getKey(), toScalar(e.getValue())));
            records.add(RawRecord.of(values));
        }
        return records;
    }

    private int parsePeriod(JsonNode node) {
        if (node == null || !node.isIntegralNumber() || !node.canConvertToInt() || node.intValue() <= 0) {
            throw new MissingParameterException("'prediction_period' is required and must be a positive integer.");
        }
        return node.intValue();
    }

    private Frequency parseFrequency(JsonNode node) {
        if (node == null || !node.isTextual()) {
            throw new MissingParameterException("'prediction_frequency' is required and must be 'weekly' or 'monthly'.");
        }
        return Frequency.fromLabel(node.textValue())
            .filter(f -> f.label().equals(node.textValue()))
            .orElseThrow(() -> new MissingParameterException(
                "'prediction_frequency' is required and must be 'weekly' or 'monthly'."));
    }

    private List<String> parseFeatureColumns(JsonNode node) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new MissingParameterException("'feature_columns' must be a list of column names.");
        }
        List<String> columns = new ArrayList<>(node.size());
        for (JsonNode column : node) {
            if (!column.isTextual()) {
                throw new MissingParameterException("'feature_columns' must be a list of column names.");
            }
            columns.add(column.textValue());
        }
        return List.copyOf(columns);
    }

    private boolean parseConfidence(JsonNode node) {
        if (node == null || node.isNull()) {
            return properties.returnConfidenceDefault();
        }
        if (!node.isBoolean()) {
            throw new MissingParameterException("'confidence_interval' must be a boolean.");
        }
        return node.booleanValue();
    }

    /**
     * The first callback-synonym key, in body order, decides. Its value is the callback address
     * when it is a non-blank string; any other value means no callback, even if a later synonym
     * holds an address.
     */
    String findCallbackUrl(JsonNode body) {
        Iterator<Map.Entry<String, JsonNode>> fields = body.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (CALLBACK_KEYS.contains(field.getKey().toLowerCase(Locale.ROOT))) {
                JsonNode value = field.getValue();
                return value.isTextual() && !value.textValue().isBlank() ? value.textValue().trim() : null;
            }
        }
        return null;
    }

    private static Object toScalar(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isTextual()) {
            return value.textValue();
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        return value.toString();
    }
}
