package com.demo.gateway.observability;

import org.springframework.lang.Nullable;

/**
 * Result of one logical operation.
 *
 * <p>Three shapes exist: a success carrying data, a failure carrying a
 * {@link StandardError}, and a fallback, which is a success whose data is a
 * deterministic substitute and whose {@code error} records why the live call
 * path was abandoned.
 *
 * @param <T> payload type
 */
public record CallOutcome<T>(
    boolean success,
    @Nullable T data,
    int status,
    @Nullable StandardError error,
    boolean fallback
) {

    public static <T> CallOutcome<T> success(T data, int status) {
        return new CallOutcome<>(true, data, status, null, false);
    }

    public static <T> CallOutcome<T> failure(StandardError error) {
        int status = error.httpStatus() != null ? error.httpStatus() : 0;
        return new CallOutcome<>(false, null, status, error, false);
    }

    public static <T> CallOutcome<T> fallback(T data, StandardError cause) {
        return new CallOutcome<>(true, data, 200, cause, true);
    }

    public boolean isFailure() {
        return !success;
    }

    @Nullable
    public ErrorKind errorKind() {
        return error != null ? error.kind() : null;
    }

    public String resultLabel() {
        if (fallback) {
            return "FALLBACK";
        }
        return success ? "SUCCESS" : "FAILURE";
    }
}
