package mailtask.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Structured value returned by an agent. Every field is optional.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TaskResult(
        @JsonProperty("issueUrl") String issueUrl,
        @JsonProperty("issueNumber") Integer issueNumber,
        @JsonProperty("summary") String summary,
        @JsonProperty("todos") List<TodoItem> todos,
        @JsonProperty("response") String response,
        @JsonProperty("agentLogs") List<String> agentLogs) {

    public TaskResult {
        todos = todos == null ? null : List.copyOf(todos);
        agentLogs = agentLogs == null ? null : List.copyOf(agentLogs);
    }

    public static TaskResult summary(String summary) {
        return new TaskResult(null, null, summary, null, null, null);
    }
}
