package com.familybudget.budget.analytics;

public class NoBudgetConfiguredException extends AnalyticsException {

    public NoBudgetConfiguredException(String message) {
        super(message);
    }
}
