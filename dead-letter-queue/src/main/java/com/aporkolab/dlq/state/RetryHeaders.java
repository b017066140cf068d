package com.aporkolab.dlq.state;

/**
 * Message header names carrying retry bookkeeping across redelivery.
 * All values are strings on the wire.
 */
public final class RetryHeaders {

    public static final String RETRY_COUNT = "x-retry-count";
    public static final String FIRST_ATTEMPT_MS = "x-retry-first-attempt-ms";
    public static final String TOTAL_DELAY_MS = "x-retry-total-delay-ms";
    public static final String LAST_ERROR = "x-retry-last-error";
    public static final String LAST_ERROR_TYPE = "x-retry-last-error-type";
    public static final String LAST_ATTEMPT_MS = "x-retry-last-attempt-ms";

    /** Best-effort annotation stamped before the final reject. */
    public static final String DLQ_REASON = "x-dlq-reason";

    /** Original publish time, epoch millis. Filled by the transport, read by the TTL check. */
    public static final String FIRST_PUBLISHED_AT = "x-first-published-ms";

    public static final String RETRY_PREFIX = "x-retry-";
    public static final String DLQ_PREFIX = "x-dlq-";

    public static final int MAX_ERROR_LENGTH = 500;

    private RetryHeaders() {
    }
}
