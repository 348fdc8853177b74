package mailtask.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import mailtask.coordinator.model.TaskStats;
import mailtask.coordinator.scheduler.SchedulerStatus;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("store") String store,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("queue") TaskStats queue,
        @JsonProperty("scheduler") SchedulerStatus scheduler) {

    public static HealthResponse healthy(String uptime, String version, TaskStats queue, SchedulerStatus scheduler) {
        return new HealthResponse("healthy", "ok", uptime, version, queue, scheduler);
    }

    public static HealthResponse unhealthy(String store) {
        return new HealthResponse("unhealthy", store, null, null, null, null);
    }
}
