package mailtask.coordinator.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for manual enqueue.
 * POST /api/v1/tasks
 */
public record CreateTaskRequest(
        @JsonProperty("subject") String subject,
        @JsonProperty("from") String from,
        @JsonProperty("text") String text,
        @JsonProperty("html") String html) {

    public void validate() {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject is required");
        }
        if (from == null || from.isBlank()) {
            throw new IllegalArgumentException("from is required");
        }
    }
}
