package com.streamearn.service;

import org.springframework.http.HttpStatus;

/**
 * Every way a reward request can end without a payout.
 */
public enum RejectionReason {
    THROTTLED(Category.RATE, true, HttpStatus.TOO_MANY_REQUESTS,
            "Too many requests. Please retry later."),
    COOLDOWN_ACTIVE(Category.POLICY, true, HttpStatus.OK,
            "Cooldown period is still active. Please wait before starting a new session."),
    SESSION_CAP_EXCEEDED(Category.POLICY, true, HttpStatus.OK,
            "Continuous session limit reached. Take a break before streaming again."),
    CONTENT_DAILY_LIMIT_EXCEEDED(Category.POLICY, true, HttpStatus.OK,
            "Daily limit for this content reached. Try other content."),
    SELF_CONSUMPTION_BLOCKED(Category.POLICY, false, HttpStatus.OK,
            "Listening to your own content does not earn rewards."),
    INSUFFICIENT_FUNDS(Category.BUDGET, false, HttpStatus.OK,
            "This month's reward pool is exhausted."),
    TIMEOUT(Category.INFRASTRUCTURE, true, HttpStatus.SERVICE_UNAVAILABLE,
            "Settlement timed out. Please retry."),
    PERSISTENCE_FAILURE(Category.INFRASTRUCTURE, true, HttpStatus.SERVICE_UNAVAILABLE,
            "Settlement could not be stored. Please retry."),
    INVARIANT_VIOLATION(Category.FATAL, false, HttpStatus.INTERNAL_SERVER_ERROR,
            "Rewards are temporarily suspended for this period.");

    public enum Category {
        RATE,
        POLICY,
        BUDGET,
        INFRASTRUCTURE,
        FATAL
    }

    private final Category category;
    private final boolean retryable;
    private final HttpStatus httpStatus;
    private final String userMessage;

    RejectionReason(Category category, boolean retryable, HttpStatus httpStatus, String userMessage) {
        this.category = category;
        this.retryable = retryable;
        this.httpStatus = httpStatus;
        this.userMessage = userMessage;
    }

    public Category category() {
        return category;
    }

    public boolean retryable() {
        return retryable;
    }

    public HttpStatus httpStatus() {
        return httpStatus;
    }

    public String userMessage() {
        return userMessage;
    }
}
