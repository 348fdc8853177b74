package mailtask.coordinator.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Immutable domain model of one unit of queued work.
 * Updates go through {@link #toBuilder()}.
 */
public final class Task {
    private final String id;
    private final TaskStatus status;
    private final EmailContent prompt;
    private final String reporterEmail;
    private final TaskResult result; // only when COMPLETED
    private final String error; // only when FAILED
    private final int retries;
    private final int maxRetries;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Instant updatedAt;
    private final List<TaskLog> logs;

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.prompt = Objects.requireNonNull(builder.prompt, "prompt is required");
        this.reporterEmail = builder.reporterEmail;
        this.result = builder.result;
        this.error = builder.error;
        this.retries = builder.retries;
        this.maxRetries = builder.maxRetries;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.updatedAt = builder.updatedAt;
        this.logs = List.copyOf(builder.logs);
    }

    // Getters
    public String id() {
        return id;
    }

    public TaskStatus status() {
        return status;
    }

    public EmailContent prompt() {
        return prompt;
    }

    public String reporterEmail() {
        return reporterEmail;
    }

    public TaskResult result() {
        return result;
    }

    public String error() {
        return error;
    }

    public int retries() {
        return retries;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public Instant updatedAt() {
        return updatedAt;
    }

    public List<TaskLog> logs() {
        return logs;
    }

    /** Subject of the originating mail, or empty */
    public String subject() {
        return prompt.subject() == null ? "" : prompt.subject();
    }

    /** Check if another attempt is allowed */
    public boolean canRetry() {
        return retries < maxRetries;
    }

    /** Check if task is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** Create a builder from this task (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .status(status)
                .prompt(prompt)
                .reporterEmail(reporterEmail)
                .result(result)
                .error(error)
                .retries(retries)
                .maxRetries(maxRetries)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .updatedAt(updatedAt)
                .logs(logs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private TaskStatus status = TaskStatus.PENDING;
        private EmailContent prompt;
        private String reporterEmail;
        private TaskResult result;
        private String error;
        private int retries = 0;
        private int maxRetries = 3;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private Instant updatedAt;
        private final List<TaskLog> logs = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder prompt(EmailContent prompt) {
            this.prompt = prompt;
            return this;
        }

        public Builder reporterEmail(String reporterEmail) {
            this.reporterEmail = reporterEmail;
            return this;
        }

        public Builder result(TaskResult result) {
            this.result = result;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        public Builder logs(List<TaskLog> logs) {
            this.logs.clear();
            if (logs != null) {
                this.logs.addAll(logs);
            }
            return this;
        }

        /** Append one log entry; existing entries are never dropped. */
        public Builder log(TaskLog entry) {
            this.logs.add(Objects.requireNonNull(entry, "entry"));
            return this;
        }

        public Builder log(Instant timestamp, LogLevel level, String message) {
            return log(TaskLog.of(timestamp, level, message));
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id='" + id + "', status=" + status + ", retries=" + retries + "/" + maxRetries + "}";
    }
}
