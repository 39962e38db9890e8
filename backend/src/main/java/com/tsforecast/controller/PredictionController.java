package com.tsforecast.controller;

import com.tsforecast.dto.PredictionRequest;
import com.tsforecast.service.PredictionDispatchService;
import com.tsforecast.service.PredictionRequestParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class PredictionController {

    private final PredictionRequestParser requestParser;
    private final PredictionDispatchService dispatchService;

    // any content type: the body is always read as JSON
    @PostMapping(value = "/predict", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<?> predict(@RequestBody String body) {
        PredictionRequest request = requestParser.parse(body);
        log.info("POST /predict | rows={} | period={} | frequency={} | confidence={} | async={}",
                 request.getData().size(), request.getPredictionPeriod(),
                 request.getPredictionFrequency().label(), request.isConfidenceInterval(), request.isAsync());
        if (request.isAsync()) {
            return ResponseEntity.ok(dispatchService.submitAsync(request));
        }
        return ResponseEntity.ok(dispatchService.runSync(request));
    }
}
