package com.aporkolab.dlq.middleware;

/**
 * Why a message was routed to the dead-letter destination.
 * The code is what lands in the {@code x-dlq-reason} header, logs and metrics.
 */
public enum DlqReason {

    /** Classified as a permanent failure; no retry attempted. */
    NON_RETRYABLE("non_retryable"),

    /** Retry count budget used up. */
    MAX_RETRIES_EXCEEDED("max_retries_exceeded"),

    /** Wall-clock retry budget used up. */
    MAX_DURATION_EXCEEDED("max_duration_exceeded"),

    /** Same body failed the same way too many times. */
    POISON_MESSAGE("poison_message"),

    /** Older than the message TTL. */
    MESSAGE_EXPIRED("message_expired");

    private final String code;

    DlqReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Reason code for a failure, e.g. {@code non_retryable:IllegalArgumentException}.
     */
    public String codeFor(Throwable error) {
        if (this == NON_RETRYABLE && error != null) {
            return code + ":" + error.getClass().getSimpleName();
        }
        return code;
    }
}
