/* (C)2026 */
package com.ammann.telemetry.enumeration;

/**
 * Known multi-metric anomaly patterns recognized by composite scoring.
 */
public enum AnomalyPattern {
    RESOURCE_EXHAUSTION(
            "Resource Exhaustion",
            "Both CPU and memory are elevated, suggesting a resource-intensive workload or"
                    + " memory leak with CPU thrashing"),
    MEMORY_LEAK_SUSPECTED(
            "Memory Leak Suspected",
            "Memory usage is elevated while CPU remains normal, suggesting gradual memory"
                    + " accumulation"),
    CPU_SPIKE(
            "CPU Spike",
            "CPU usage is elevated while memory remains stable, suggesting a compute-intensive"
                    + " operation or busy loop");

    private final String label;
    private final String description;

    AnomalyPattern(String label, String description) {
        this.label = label;
        this.description = description;
    }

    public String getLabel() { return label; }

    public String getDescription() { return description; }
}
