package com.libragraph.mailbackup.core.snapshot;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * Failure cause stored as JSON on a failed snapshot.
 */
public record SnapshotError(
        String message,
        String exceptionType,
        boolean retryable
) {
    private static final int MAX_MESSAGE = 2000;

    public static SnapshotError of(String reason) {
        return new SnapshotError(truncate(reason), null, false);
    }

    public static SnapshotError from(Throwable t) {
        return of(t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName(), t);
    }

    /**
     * A run-level reason with the exception that caused it.
     */
    public static SnapshotError of(String reason, Throwable t) {
        boolean retryable = t instanceof IOException
                || t instanceof UncheckedIOException
                || t instanceof TimeoutException
                || t instanceof SocketTimeoutException;
        return new SnapshotError(truncate(reason), t.getClass().getName(), retryable);
    }

    private static String truncate(String message) {
        if (message == null || message.length() <= MAX_MESSAGE) {
            return message;
        }
        return message.substring(0, MAX_MESSAGE);
    }
}
