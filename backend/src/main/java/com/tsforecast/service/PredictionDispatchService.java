package com.tsforecast.service;

import com.tsforecast.dto.AsyncAcknowledgement;
import com.tsforecast.dto.PredictionRequest;
import com.tsforecast.dto.PredictionResult;
import com.tsforecast.pipeline.PredictionPipeline;
import com.tsforecast.pipeline.PredictionPipelineFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Decides how a validated request runs: inline when it carries no callback address, otherwise
 * acknowledged at once and forecast on the callback worker pool.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PredictionDispatchService {

    static final String ACCEPTED_MESSAGE = "Request accepted, forecasting continues in the background.";

    private final PredictionPipelineFactory pipelineFactory;
    private final CallbackJobService callbackJobService;
    private final AtomicLong lastRequestNumber = new AtomicLong();

    public PredictionResult runSync(PredictionRequest request) {
        PredictionPipeline pipeline = pipelineFactory.create(request);
        return pipeline.run(request.getData());
    }

    public AsyncAcknowledgement submitAsync(PredictionRequest request) {
        String requestId = nextRequestId();
        PredictionPipeline pipeline = pipelineFactory.create(request);
        callbackJobService.submit(requestId, request.getCallbackUrl(), () -> pipeline.run(request.getData()));
        log.info("Async forecast accepted | requestId={} | rows={} | horizon={}",
                 requestId, request.getData().size(), request.getPredictionPeriod());
        return AsyncAcknowledgement.builder()
            .success(true)
            .message(ACCEPTED_MESSAGE)
            .requestId(requestId)
            .status(AsyncAcknowledgement.PROCESSING)
            .callbackUrl(request.getCallbackUrl())
            .build();
    }

    /** {@code req_} followed by a millisecond timestamp, bumped when two requests share a millisecond. */
    String nextRequestId() {
        long now = System.currentTimeMillis();
        long number = lastRequestNumber.updateAndGet(last -> Math.max(now, last + 1));
        return "req_" + number;
    }
}
