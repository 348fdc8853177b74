package mailtask.coordinator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Task lifecycle status.
 * Stored in lower case ("pending", "processing", ...).
 */
public enum TaskStatus {
    /** Task created or re-queued, waiting to be picked */
    PENDING("pending"),
    /** Task picked by a scheduler and handed to the agent */
    PROCESSING("processing"),
    /** Task finished successfully (terminal) */
    COMPLETED("completed"),
    /** Task exhausted its retries (terminal) */
    FAILED("failed");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    @JsonCreator
    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("status is required");
        }
        for (TaskStatus value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
