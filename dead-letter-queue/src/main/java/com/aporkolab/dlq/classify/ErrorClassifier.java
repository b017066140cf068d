package com.aporkolab.dlq.classify;

/**
 * Decides whether a handler failure is worth retrying.
 */
@FunctionalInterface
public interface ErrorClassifier {

    ErrorClass classify(Throwable error);

    default boolean isNonRetryable(Throwable error) {
        return classify(error) == ErrorClass.NON_RETRYABLE;
    }
}
