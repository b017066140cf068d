package com.aporkolab.dlq.middleware;

import com.aporkolab.dlq.state.RetryState;

/**
 * Outcome of the decision chain for one failed delivery.
 */
public final class RetryDecision {

    public enum Action {
        RETRY,
        DEAD_LETTER
    }

    private final Action action;
    private final long delayMs;
    private final RetryState nextState;
    private final DlqReason reason;
    private final String reasonCode;

    private RetryDecision(Action action, long delayMs, RetryState nextState,
                          DlqReason reason, String reasonCode) {
        this.action = action;
        this.delayMs = delayMs;
        this.nextState = nextState;
        this.reason = reason;
        this.reasonCode = reasonCode;
    }

    public static RetryDecision retry(long delayMs, RetryState nextState) {
        return new RetryDecision(Action.RETRY, delayMs, nextState, null, null);
    }

    public static RetryDecision deadLetter(DlqReason reason, Throwable error) {
        return new RetryDecision(Action.DEAD_LETTER, 0L, null, reason, reason.codeFor(error));
    }

    public boolean isRetry() {
        return action == Action.RETRY;
    }

    public Action getAction() {
        return action;
    }

    /** Wait before republishing; 0 for dead-letter decisions. */
    public long getDelayMs() {
        return delayMs;
    }

    /** State to encode into the republished message; null for dead-letter decisions. */
    public RetryState getNextState() {
        return nextState;
    }

    /** Null for retry decisions. */
    public DlqReason getReason() {
        return reason;
    }

    /** e.g. {@code non_retryable:IllegalArgumentException}; null for retry decisions. */
    public String getReasonCode() {
        return reasonCode;
    }

    @Override
    public String toString() {
        return isRetry()
                ? "RetryDecision{RETRY, delayMs=" + delayMs + ", next=" + nextState + '}'
                : "RetryDecision{DEAD_LETTER, reason=" + reasonCode + '}';
    }
}
