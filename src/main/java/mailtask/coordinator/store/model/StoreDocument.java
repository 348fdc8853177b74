package mailtask.coordinator.store.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import mailtask.coordinator.model.Task;

import java.time.Instant;
import java.util.List;

/**
 * The whole store file: every task in insertion order plus the time of the last write.
 */
public record StoreDocument(
        @JsonProperty("tasks") List<TaskDocument> tasks,
        @JsonProperty("lastUpdated") Instant lastUpdated) {

    public StoreDocument {
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
    }

    public static StoreDocument empty(Instant now) {
        return new StoreDocument(List.of(), now);
    }

    public static StoreDocument of(List<Task> tasks, Instant now) {
        return new StoreDocument(tasks.stream().map(TaskDocument::from).toList(), now);
    }

    public List<Task> toTasks() {
        return tasks.stream().map(TaskDocument::toTask).toList();
    }
}
