package mailtask.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

/**
 * Task counts per status.
 */
public record TaskStats(
        @JsonProperty("total") int total,
        @JsonProperty("pending") int pending,
        @JsonProperty("processing") int processing,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed) {

    public static TaskStats of(Collection<Task> tasks) {
        int pending = 0;
        int processing = 0;
        int completed = 0;
        int failed = 0;
        for (Task task : tasks) {
            switch (task.status()) {
                case PENDING -> pending++;
                case PROCESSING -> processing++;
                case COMPLETED -> completed++;
                case FAILED -> failed++;
            }
        }
        return new TaskStats(tasks.size(), pending, processing, completed, failed);
    }
}
