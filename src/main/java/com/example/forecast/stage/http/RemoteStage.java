package com.example.forecast.stage.http;

import com.example.forecast.model.FailureKind;
import com.example.forecast.stage.Stage;
import com.example.forecast.stage.StageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.net.SocketTimeoutException;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;

/**
 * HTTP client for a stage service exposing {@code POST /v1/invoke} and {@code GET /health}.
 * <p>
 * Transport and status errors are translated into {@link FailureKind}s so the stage client
 * can decide what is worth retrying:
 * <ul>
 *   <li>connection refused, 503: {@code UNAVAILABLE}</li>
 *   <li>read timeout, 504: {@code TIMEOUT}</li>
 *   <li>400: {@code INVALID_INPUT}; 422: {@code INTERNAL_VALIDATION}; other 5xx: {@code INTERNAL}</li>
 *   <li>empty or unparsable body: {@code INVALID_RESPONSE}</li>
 * </ul>
 */
public abstract class RemoteStage<I, C, O> implements Stage<I, C, O> {

    private static final Logger log = LoggerFactory.getLogger(RemoteStage.class);

    private final RestClient restClient;
    private final ParameterizedTypeReference<O> responseType;

    protected RemoteStage(RestClient.Builder builder, String baseUrl, ParameterizedTypeReference<O> responseType) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("No endpoint configured for remote stage");
        }
        this.restClient = builder.baseUrl(baseUrl).build();
        this.responseType = responseType;
    }

    @Override
    public O invoke(I input, C config, Instant deadline) throws StageException {
        String stageName = kind().stageName();
        O output;
        try {
            output = restClient.post()
                    .uri("/v1/invoke")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new StageInvocation<>(input, config, deadline == Instant.MAX ? null : deadline))
                    .retrieve()
                    .body(responseType);
        } catch (RestClientResponseException e) {
            throw new StageException(statusKind(e.getStatusCode().value()),
                    "%s service answered %d: %s".formatted(stageName, e.getStatusCode().value(),
                            abbreviate(e.getResponseBodyAsString())), e);
        } catch (ResourceAccessException e) {
            FailureKind kind = isReadTimeout(e) ? FailureKind.TIMEOUT : FailureKind.UNAVAILABLE;
            throw new StageException(kind, stageName + " service not reachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new StageException(FailureKind.INVALID_RESPONSE,
                    stageName + " service returned an unreadable body: " + e.getMessage(), e);
        }
        if (output == null) {
            throw new StageException(FailureKind.INVALID_RESPONSE, stageName + " service returned an empty body");
        }
        return output;
    }

    /**
     * Checks whether the stage service reports {@code {"status":"ok"}}.
     */
    @Override
    public boolean isAvailable() {
        try {
            Map<String, Object> health = restClient.get()
                    .uri("/health")
                    .retrieve()
                    .body(new ParameterizedTypeReference<Map<String, Object>>() {});
            return health != null && "ok".equals(health.get("status"));
        } catch (Exception e) {
            log.warn("{} service not available: {}", kind().stageName(), e.getMessage());
            return false;
        }
    }

    static FailureKind statusKind(int status) {
        return switch (status) {
            case 400 -> FailureKind.INVALID_INPUT;
            case 422 -> FailureKind.INTERNAL_VALIDATION;
            case 503 -> FailureKind.UNAVAILABLE;
            case 504 -> FailureKind.TIMEOUT;
            default -> status >= 500 ? FailureKind.INTERNAL : FailureKind.INVALID_RESPONSE;
        };
    }

    private static boolean isReadTimeout(ResourceAccessException e) {
        Throwable cause = e.getCause();
        while (cause != null) {
            if (cause instanceof SocketTimeoutException) {
                String message = cause.getMessage();
                // "Connect timed out" means the service never accepted the connection
                return message == null || !message.toLowerCase(Locale.ROOT).contains("connect");
            }
            cause = cause.getCause();
        }
        return false;
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "(no body)";
        }
        return body.length() > 200 ? body.substring(0, 200) + "..." : body;
    }
}
