package com.familybudget.budget.model;

import java.util.List;

public record AnomalyReport(boolean success, int anomaliesFound, List<Anomaly> anomalies, String message) {

    public static AnomalyReport failure(String message) {
        return new AnomalyReport(false, 0, List.of(), message);
    }

    public static AnomalyReport of(List<Anomaly> anomalies) {
        String message = anomalies.isEmpty()
                ? "No unusual spending detected"
                : "Found " + anomalies.size() + " unusual transaction" + (anomalies.size() == 1 ? "" : "s");
        return new AnomalyReport(true, anomalies.size(), List.copyOf(anomalies), message);
    }
}
