package com.familybudget.budget.analytics;

public class InsufficientHistoryException extends AnalyticsException {

    public InsufficientHistoryException(String message) {
        super(message);
    }
}
