package com.familybudget.budget.analytics;

/**
 * Expected analytics outcome that callers surface as a failure result rather than an error.
 */
public abstract class AnalyticsException extends RuntimeException {

    protected AnalyticsException(String message) {
        super(message);
    }
}
