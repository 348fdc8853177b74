package mailtask.coordinator.scheduler;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Point-in-time view of a scheduler.
 */
public record SchedulerStatus(
        @JsonProperty("running") boolean running,
        @JsonProperty("draining") boolean draining,
        @JsonProperty("processingCount") int processingCount,
        @JsonProperty("processingTaskIds") List<String> processingTaskIds,
        @JsonProperty("pollIntervalMs") long pollIntervalMs,
        @JsonProperty("maxConcurrent") int maxConcurrent,
        @JsonProperty("taskTimeoutMs") long taskTimeoutMs,
        @JsonProperty("shutdownTimeoutMs") long shutdownTimeoutMs,
        @JsonProperty("hardTimeout") boolean hardTimeout,
        @JsonProperty("agentName") String agentName) {
}
