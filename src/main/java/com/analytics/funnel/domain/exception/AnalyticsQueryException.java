package com.analytics.funnel.domain.exception;

/**
 * Thrown when an upstream store query fails. The analysis is aborted; no
 * partial result is produced.
 */
public class AnalyticsQueryException extends RuntimeException {

    public AnalyticsQueryException(String message, Throwable cause) {
        super(message, cause);
    }

    public AnalyticsQueryException(String message) {
        super(message);
    }
}
