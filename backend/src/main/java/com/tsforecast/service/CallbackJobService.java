package com.tsforecast.service;

import com.tsforecast.client.CallbackClient;
import com.tsforecast.config.ForecastProperties;
import com.tsforecast.dto.CallbackFailure;
import com.tsforecast.exception.CallbackDeliveryException;
import com.tsforecast.exception.WorkerPoolSaturatedException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs callback-bearing forecasts on a fixed pool with a bounded queue and posts the outcome
 * to the callback address. Failures never reach the original caller, who has already been
 * acknowledged: a failed run turns into a {@code callback_failed} payload, and a failed
 * delivery is only logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CallbackJobService {

    private final CallbackClient callbackClient;
    private final ForecastProperties properties;

    private ThreadPoolExecutor executor;

    @PostConstruct
    void init() {
        ForecastProperties.Callback callback = properties.callback();
        AtomicInteger threadCount = new AtomicInteger();
        executor = new ThreadPoolExecutor(
            callback.poolSize(), callback.poolSize(), 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(callback.queueCapacity()),
            r -> {
                Thread t = new Thread(r, "forecast-callback-" + threadCount.incrementAndGet());
                t.setDaemon(true);
                return t;
            },
            new ThreadPoolExecutor.AbortPolicy());
        log.info("Callback worker pool started | poolSize={} | queueCapacity={}",
                 callback.poolSize(), callback.queueCapacity());
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    /**
     * Queues {@code task} and returns immediately.
     *
     * @throws WorkerPoolSaturatedException when every worker is busy and the queue is full
     */
    public void submit(String requestId, String callbackUrl, Supplier<Object> task) {
        try {
            executor.execute(() -> execute(requestId, callbackUrl, task));
        } catch (RejectedExecutionException ex) {
            log.warn("Callback job rejected | requestId={} | queued={}", requestId, executor.getQueue().size());
            throw new WorkerPoolSaturatedException(properties.callback().queueCapacity(), ex);
        }
        log.info("Callback job queued | requestId={} | callbackUrl={}", requestId, callbackUrl);
    }

    private void execute(String requestId, String callbackUrl, Supplier<Object> task) {
        try {
            Object result = task.get();
            callbackClient.deliver(callbackUrl, requestId, result);
        } catch (Exception ex) {
            String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            log.warn("Callback job failed | requestId={} | reason={}", requestId, message);
            deliverFailure(requestId, callbackUrl, message);
        }
    }

    private void deliverFailure(String requestId, String callbackUrl, String message) {
        try {
            callbackClient.deliver(callbackUrl, requestId, CallbackFailure.of(requestId, message));
        } catch (CallbackDeliveryException ex) {
            log.error("Failure notice could not be delivered | requestId={} | {}", requestId, ex.getMessage());
        }
    }
}
