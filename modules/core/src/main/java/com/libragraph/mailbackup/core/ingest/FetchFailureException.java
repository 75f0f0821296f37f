package com.libragraph.mailbackup.core.ingest;

/**
 * Fetching from the mail provider failed.
 */
public class FetchFailureException extends RuntimeException {

    public FetchFailureException(String message) {
        super(message);
    }

    public FetchFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
