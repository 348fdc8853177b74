package mailtask.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Follow-up item produced by an agent.
 * Status is one of pending, in-progress, completed; priority one of high, medium, low.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TodoItem(
        @JsonProperty("id") String id,
        @JsonProperty("title") String title,
        @JsonProperty("status") String status,
        @JsonProperty("priority") String priority,
        @JsonProperty("description") String description) {
}
