package com.demo.gateway.observability;

import com.demo.gateway.transport.TransportException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Error Classifier: maps a transport outcome to a {@link StandardError}.
 *
 * <p>Two input modes:
 * <ol>
 *   <li>a response was received with a non-2xx status: {@link #classifyStatus}</li>
 *   <li>no response at all (exception from the transport): {@link #classify}</li>
 * </ol>
 *
 * <p>Only NETWORK_ERROR, 429, 502, 503 and 504 are retryable. Every other
 * 4xx/5xx is terminal on the first attempt.
 *
 * Used by: ResilientClient (retry predicate input), ServiceAdapter (decode failures)
 */
@Component
public class ErrorClassifier {

    private final ObjectMapper objectMapper;

    public ErrorClassifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Classify a response status. The provider body, when it is JSON with an
     * {@code error.message} or {@code message} field, supplies the message.
     */
    public StandardError classifyStatus(int status, @Nullable String body) {
        String message = serverMessage(body);
        if (message == null) {
            message = "HTTP Error " + status;
        }
        return switch (status) {
            case 400 -> new StandardError(ErrorKind.BAD_REQUEST, message, false, status, null);
            case 401 -> new StandardError(ErrorKind.UNAUTHORIZED, message, false, status, null);
            case 403 -> new StandardError(ErrorKind.FORBIDDEN, message, false, status, null);
            case 404 -> new StandardError(ErrorKind.NOT_FOUND, message, false, status, null);
            case 429 -> new StandardError(ErrorKind.RATE_LIMITED, message, true, status, null);
            case 500 -> new StandardError(ErrorKind.INTERNAL_SERVER_ERROR, message, false, status, null);
            case 502 -> new StandardError(ErrorKind.BAD_GATEWAY, message, true, status, null);
            case 503 -> new StandardError(ErrorKind.SERVICE_UNAVAILABLE, message, true, status, null);
            case 504 -> new StandardError(ErrorKind.GATEWAY_TIMEOUT, message, true, status, null);
            default -> new StandardError(ErrorKind.UNKNOWN_ERROR, message, false, status, null);
        };
    }

    /**
     * Classify a failure that produced no status.
     */
    public StandardError classify(Throwable throwable) {
        Throwable cause = unwrap(throwable);

        if (cause instanceof TimeoutException) {
            return StandardError.of(ErrorKind.NETWORK_ERROR, "Request timed out", true);
        }
        if (cause instanceof TransportException te) {
            return new StandardError(ErrorKind.NETWORK_ERROR, messageOf(te), true, null,
                te.getUrl() != null ? Map.of("url", te.getUrl()) : null);
        }
        if (cause instanceof IOException) {
            return StandardError.of(ErrorKind.NETWORK_ERROR, messageOf(cause), true);
        }

        return new StandardError(ErrorKind.UNKNOWN_ERROR, messageOf(cause), false, null,
            Map.of("exception", cause.getClass().getSimpleName()));
    }

    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable throwable) {
        String message = throwable.getMessage();
        return message != null ? message : throwable.getClass().getSimpleName();
    }

    @Nullable
    private String serverMessage(@Nullable String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            JsonNode nested = root.path("error").path("message");
            if (nested.isTextual()) {
                return nested.asText();
            }
            JsonNode flat = root.path("message");
            if (flat.isTextual()) {
                return flat.asText();
            }
            return null;
        } catch (IOException e) {
            // Non-JSON error page; the status alone describes it.
            return null;
        }
    }
}
