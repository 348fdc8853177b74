package mailtask.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;

/**
 * One entry of a task's append-only log.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskLog(
        @JsonProperty("timestamp") Instant timestamp,
        @JsonProperty("level") LogLevel level,
        @JsonProperty("message") String message,
        @JsonProperty("data") JsonNode data) {

    public TaskLog {
        Objects.requireNonNull(timestamp, "timestamp is required");
        level = level == null ? LogLevel.INFO : level;
        message = message == null ? "" : message;
    }

    public static TaskLog of(Instant timestamp, LogLevel level, String message) {
        return new TaskLog(timestamp, level, message, null);
    }
}
