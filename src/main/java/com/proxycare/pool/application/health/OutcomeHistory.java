package com.proxycare.pool.application.health;

import java.util.List;

/**
 * Status codes reported for one proxy inside the evaluation window, oldest first.
 * The last element is the outcome that triggered the evaluation.
 */
public record OutcomeHistory(Long proxyId, List<Integer> statuses) {

    public OutcomeHistory {
        statuses = (statuses == null) ? List.of() : List.copyOf(statuses);
    }

    public boolean isEmpty() {
        return statuses.isEmpty();
    }

    public int size() {
        return statuses.size();
    }

    public Integer latest() {
        return statuses.isEmpty() ? null : statuses.get(statuses.size() - 1);
    }

    public long failures() {
        return statuses.stream().filter(OutcomeHistory::isFailure).count();
    }

    public double failureRatio() {
        return statuses.isEmpty() ? 0.0 : (double) failures() / statuses.size();
    }

    public static boolean isFailure(Integer statusCode) {
        return statusCode != null && statusCode >= 400;
    }
}
