package com.tsforecast.client;

import com.tsforecast.config.ForecastProperties;
import com.tsforecast.exception.CallbackDeliveryException;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Posts forecast results to client-supplied callback addresses. One attempt per payload, no
 * retry; every failure surfaces as a {@link CallbackDeliveryException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CallbackClient {

    private final ForecastProperties properties;

    private WebClient webClient;
    private Duration timeout;

    @PostConstruct
    void init() {
        timeout = properties.callback().timeout();
        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, timeout.toMillis()))
            .doOnConnected(conn -> conn.addHandlerLast(
                new ReadTimeoutHandler(timeout.toMillis(), TimeUnit.MILLISECONDS)));
        this.webClient = WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
            .build();
        log.info("CallbackClient initialised | timeout={}", timeout);
    }

    public Mono<Void> send(String callbackUrl, String requestId, Object payload) {
        String apiKey = properties.callback().apiKey();
        return Mono.defer(() -> webClient.post().uri(callbackUrl)
            .header("X-Request-ID", requestId)
            .headers(h -> {
                if (apiKey != null && !apiKey.isBlank()) {
                    h.set("X-API-Key", apiKey);
                }
            })
            .bodyValue(payload)
            .retrieve()
            .onStatus(HttpStatusCode::isError, resp ->
                resp.bodyToMono(String.class).defaultIfEmpty("")
                    .map(b -> new IllegalStateException("callback answered " + resp.statusCode().value() + ": " + b)))
            .toBodilessEntity()
            .timeout(timeout)
            .then())
            .onErrorMap(ex -> !(ex instanceof CallbackDeliveryException), ex -> new CallbackDeliveryException(callbackUrl, ex));
    }

    /** Blocking variant for worker threads. */
    public void deliver(String callbackUrl, String requestId, Object payload) {
        send(callbackUrl, requestId, payload).block();
        log.info("Callback delivered | url={} | requestId={}", callbackUrl, requestId);
    }
}
