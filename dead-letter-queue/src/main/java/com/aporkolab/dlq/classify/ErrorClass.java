package com.aporkolab.dlq.classify;

/**
 * Outcome of classifying a handler failure.
 */
public enum ErrorClass {

    /** Transient; eligible for backoff retry. */
    RETRYABLE,

    /** Deterministic data or logic error; retrying cannot fix it. */
    NON_RETRYABLE
}
