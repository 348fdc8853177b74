package mailtask.coordinator.store.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import mailtask.coordinator.model.EmailContent;
import mailtask.coordinator.model.Task;
import mailtask.coordinator.model.TaskLog;
import mailtask.coordinator.model.TaskResult;
import mailtask.coordinator.model.TaskStatus;

import java.time.Instant;
import java.util.List;

/**
 * Stored shape of a task. Absent values are written as {@code null}.
 */
public record TaskDocument(
        @JsonProperty("id") String id,
        @JsonProperty("status") TaskStatus status,
        @JsonProperty("prompt") EmailContent prompt,
        @JsonProperty("reporterEmail") String reporterEmail,
        @JsonProperty("result") TaskResult result,
        @JsonProperty("error") String error,
        @JsonProperty("retries") int retries,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("updatedAt") Instant updatedAt,
        @JsonProperty("logs") List<TaskLog> logs) {

    public static TaskDocument from(Task task) {
        return new TaskDocument(
                task.id(),
                task.status(),
                task.prompt(),
                task.reporterEmail(),
                task.result(),
                task.error(),
                task.retries(),
                task.maxRetries(),
                task.createdAt(),
                task.startedAt(),
                task.completedAt(),
                task.updatedAt(),
                task.logs());
    }

    public Task toTask() {
        return Task.builder()
                .id(id)
                .status(status == null ? TaskStatus.PENDING : status)
                .prompt(prompt == null ? new EmailContent(null, null, null, null, null, null, null, null) : prompt)
                .reporterEmail(reporterEmail)
                .result(result)
                .error(error)
                .retries(retries)
                .maxRetries(maxRetries)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .updatedAt(updatedAt)
                .logs(logs)
                .build();
    }
}
