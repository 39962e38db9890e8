package com.tsforecast.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Tags every API request with an {@code X-Request-ID} (echoed or generated, also exposed to
 * the logs through the MDC) and, when {@code forecast.auth.enabled} is set, requires a known
 * token in {@code Authorization: Bearer ...} or {@code X-API-Key}.
 */
@Slf4j
@Component
public class RequestGuardFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String API_KEY_HEADER = "X-API-Key";
    private static final String BEARER_PREFIX = "bearer ";

    private final boolean authEnabled;
    private final Set<String> allowedTokens;
    private final ObjectMapper mapper = new ObjectMapper();

    public RequestGuardFilter(ForecastProperties properties) {
        ForecastProperties.Auth auth = properties.auth();
        this.authEnabled = auth.enabled();
        this.allowedTokens = Stream.concat(auth.secretTokens().stream(), auth.apiKeys().stream())
            .filter(t -> t != null && !t.isBlank())
            .map(String::trim)
            .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return !path.startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = resolveRequestId(request);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        MDC.put("requestId", requestId);
        try {
            if (authEnabled && !isAuthorized(extractToken(request))) {
                writeError(response, HttpServletResponse.SC_UNAUTHORIZED,
                        "unauthorized", "Missing or invalid API key", request.getRequestURI(), requestId);
                return;
            }
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove("requestId");
        }
    }

    /** {@code Authorization: Bearer <token>} first, {@code X-API-Key} otherwise. */
    static String extractToken(HttpServletRequest request) {
        String authorization = request.getHeader("Authorization");
        if (authorization != null && authorization.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        String apiKey = request.getHeader(API_KEY_HEADER);
        return apiKey != null && !apiKey.isBlank() ? apiKey.trim() : null;
    }

    boolean isAuthorized(String token) {
        if (token == null) {
            return false;
        }
        byte[] provided = token.getBytes(StandardCharsets.UTF_8);
        boolean matched = false;
        for (String allowed : allowedTokens) {
            // constant-time comparison, no early exit
            matched |= MessageDigest.isEqual(provided, allowed.getBytes(StandardCharsets.UTF_8));
        }
        return matched;
    }

    private String resolveRequestId(HttpServletRequest request) {
        String existing = request.getHeader(REQUEST_ID_HEADER);
        return (existing != null && !existing.isBlank()) ? existing : UUID.randomUUID().toString();
    }

    private void writeError(HttpServletResponse response, int status, String error, String message,
                            String path, String requestId) throws IOException {
        response.setStatus(status);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        Map<String, Object> body = Map.of(
                "status", status,
                "error", error,
                "message", message,
                "path", path,
                "requestId", requestId,
                "timestamp", Instant.now().toString()
        );
        mapper.writeValue(response.getWriter(), body);
        log.warn("{} | status={} | path={} | requestId={}", message, status, path, requestId);
    }
}
