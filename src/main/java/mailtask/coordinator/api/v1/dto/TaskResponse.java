package mailtask.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskLog;
import mailtask.coordinator.model.TaskResult;

import java.time.Instant;
import java.util.List;

/**
 * Response DTO for a task. Logs are only included for single-task lookups.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResponse(
        @JsonProperty("id") String id,
        @JsonProperty("status") String status,
        @JsonProperty("subject") String subject,
        @JsonProperty("reporterEmail") String reporterEmail,
        @JsonProperty("retries") int retries,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("error") String error,
        @JsonProperty("result") TaskResult result,
        @JsonProperty("logs") List<TaskLog> logs) {

    public static TaskResponse from(Task task) {
        return from(task, false);
    }

    public static TaskResponse from(Task task, boolean withLogs) {
        return new TaskResponse(
                task.id(),
                task.status().wireName(),
                task.subject(),
                task.reporterEmail(),
                task.retries(),
                task.maxRetries(),
                task.createdAt(),
                task.startedAt(),
                task.completedAt(),
                task.updatedAt(),
                task.error(),
                task.result(),
                withLogs ? task.logs() : null);
    }
}
