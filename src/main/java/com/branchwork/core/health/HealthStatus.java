package com.branchwork.core.health;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one component check.
 *
 * @param metadata raw figures behind {@code detail}, such as agent counts; printed by
 *                 {@code branchwork health --verbose}
 */
public record HealthStatus(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {

    /** Ordered from best to worst. */
    public enum Status { UP, DEGRADED, DOWN }

    public HealthStatus {
        Objects.requireNonNull(component, "component");
        Objects.requireNonNull(status, "status");
        detail = detail == null ? "" : detail;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static HealthStatus up(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.UP, detail, metadata);
    }

    public static HealthStatus degraded(String component, String detail, Map<String, String> metadata) {
        return new HealthStatus(component, Status.DEGRADED, detail, metadata);
    }

    public static HealthStatus down(String component, String detail) {
        return new HealthStatus(component, Status.DOWN, detail, Map.of());
    }

    /** A degraded component still serves requests. */
    public boolean isOperational() {
        return status != Status.DOWN;
    }

    /**
     * Worst status among {@code checks}; {@code UP} when there are none.
     */
    public static Status overall(Collection<HealthStatus> checks) {
        Status worst = Status.UP;
        for (HealthStatus check : checks) {
            if (check.status().compareTo(worst) > 0) {
                worst = check.status();
            }
        }
        return worst;
    }
}
