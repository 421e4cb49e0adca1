package com.demo.gateway.observability;

import com.demo.gateway.transport.TransportException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.ConnectException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Status table and exception mapping of ErrorClassifier.
 *
 * Retryable: NETWORK_ERROR, 429, 502, 503, 504. Everything else is terminal.
 */
class ErrorClassifierTest {

    private ErrorClassifier classifier;

    @BeforeEach
    void setup() {
        classifier = new ErrorClassifier(new ObjectMapper());
    }

    @Test
    void testClientErrors_NotRetryable() {
        assertClassified(400, ErrorKind.BAD_REQUEST, false);
        assertClassified(401, ErrorKind.UNAUTHORIZED, false);
        assertClassified(403, ErrorKind.FORBIDDEN, false);
        assertClassified(404, ErrorKind.NOT_FOUND, false);
    }

    @Test
    void testRateLimited_Retryable() {
        assertClassified(429, ErrorKind.RATE_LIMITED, true);
    }

    @Test
    void testInternalServerError_NotRetryable() {
        assertClassified(500, ErrorKind.INTERNAL_SERVER_ERROR, false);
    }

    @Test
    void testGatewayErrors_Retryable() {
        assertClassified(502, ErrorKind.BAD_GATEWAY, true);
        assertClassified(503, ErrorKind.SERVICE_UNAVAILABLE, true);
        assertClassified(504, ErrorKind.GATEWAY_TIMEOUT, true);
    }

    @Test
    void testUnlistedStatus_UnknownError() {
        StandardError error = classifier.classifyStatus(418, null);

        assertEquals(ErrorKind.UNKNOWN_ERROR, error.kind());
        assertFalse(error.retryable(), "Unlisted statuses must not be retried");
        assertEquals(418, error.httpStatus(), "Status is kept for diagnostics");
        assertEquals("HTTP Error 418", error.message());
    }

    @Test
    void testProviderMessage_NestedError() {
        StandardError error = classifier.classifyStatus(400,
            "{\"error\":{\"type\":\"invalid_request_error\",\"message\":\"max_tokens too large\"}}");

        assertEquals("max_tokens too large", error.message());
    }

    @Test
    void testProviderMessage_FlatMessage() {
        StandardError error = classifier.classifyStatus(503, "{\"message\":\"overloaded\"}");

        assertEquals("overloaded", error.message());
        assertTrue(error.retryable());
    }

    @Test
    void testNonJsonBody_FallsBackToStatusMessage() {
        StandardError error = classifier.classifyStatus(502, "<html>Bad Gateway</html>");

        assertEquals("HTTP Error 502", error.message());
    }

    @Test
    void testTimeout_NetworkError() {
        StandardError error = classifier.classify(new TimeoutException());

        assertEquals(ErrorKind.NETWORK_ERROR, error.kind());
        assertTrue(error.retryable(), "Timed out attempts are retryable");
        assertNull(error.httpStatus());
    }

    @Test
    void testTransportException_NetworkErrorWithUrl() {
        StandardError error = classifier.classify(
            new TransportException("Connection refused", "https://api.example.test/v1", new ConnectException()));

        assertEquals(ErrorKind.NETWORK_ERROR, error.kind());
        assertTrue(error.retryable());
        assertEquals("https://api.example.test/v1", error.details().get("url"));
    }

    @Test
    void testIoException_NetworkError() {
        StandardError error = classifier.classify(new IOException("Connection reset by peer"));

        assertEquals(ErrorKind.NETWORK_ERROR, error.kind());
        assertEquals("Connection reset by peer", error.message());
    }

    @Test
    void testWrappedException_Unwrapped() {
        Throwable wrapped = new CompletionException(new ExecutionException(new TimeoutException("slow")));

        assertEquals(ErrorKind.NETWORK_ERROR, classifier.classify(wrapped).kind());
    }

    @Test
    void testUnexpectedException_UnknownError() {
        StandardError error = classifier.classify(new IllegalStateException("boom"));

        assertEquals(ErrorKind.UNKNOWN_ERROR, error.kind());
        assertFalse(error.retryable());
        assertEquals("IllegalStateException", error.details().get("exception"));
    }

    private void assertClassified(int status, ErrorKind kind, boolean retryable) {
        StandardError error = classifier.classifyStatus(status, "");
        assertEquals(kind, error.kind(), "Status " + status);
        assertEquals(retryable, error.retryable(), "Retryable flag for status " + status);
        assertEquals(status, error.httpStatus());
    }
}
