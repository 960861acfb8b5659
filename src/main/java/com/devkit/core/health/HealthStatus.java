package com.devkit.core.health;

public record HealthStatus(
    String component,
    Status status,
    String detail
) {
    public enum Status { UP, DOWN, DEGRADED }
}
