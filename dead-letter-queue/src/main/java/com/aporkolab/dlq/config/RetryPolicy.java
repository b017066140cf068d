package com.aporkolab.dlq.config;

/**
 * How the delay before the next retry grows with the attempt number.
 *
 * With an initial delay of 1000ms:
 * <pre>
 * attempt | IMMEDIATE | LINEAR | EXPONENTIAL (x2) | FIBONACCI
 * 1       | 0ms       | 1000ms | 1000ms           | 1000ms
 * 2       | 0ms       | 2000ms | 2000ms           | 1000ms
 * 3       | 0ms       | 3000ms | 4000ms           | 2000ms
 * 4       | 0ms       | 4000ms | 8000ms           | 3000ms
 * </pre>
 */
public enum RetryPolicy {

    /** No delay at all. Can cause retry storms. */
    IMMEDIATE,

    /** initialDelay * (attempt + 1) */
    LINEAR,

    /** initialDelay * multiplier^attempt */
    EXPONENTIAL,

    /** initialDelay * fib(attempt + 1) */
    FIBONACCI
}
