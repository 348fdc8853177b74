package mailtask.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Inbound mail that became a task. This is the task's prompt; the queue treats it as an opaque value.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmailContent(
        @JsonProperty("messageId") String messageId,
        @JsonProperty("subject") String subject,
        @JsonProperty("from") Address from,
        @JsonProperty("to") List<Address> to,
        @JsonProperty("date") Instant date,
        @JsonProperty("text") String text,
        @JsonProperty("html") String html,
        @JsonProperty("attachments") List<Attachment> attachments) {

    public EmailContent {
        to = to == null ? List.of() : List.copyOf(to);
        attachments = attachments == null ? null : List.copyOf(attachments);
    }

    /** Minimal content for producers that only have a subject and a body. */
    public static EmailContent of(String subject, String fromAddress, String text) {
        return new EmailContent(null, subject, Address.of(fromAddress), List.of(), Instant.now(), text, null, null);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Address(
            @JsonProperty("address") String address,
            @JsonProperty("name") String name) {

        public static Address of(String address) {
            return new Address(address, null);
        }
    }

    public record Attachment(
            @JsonProperty("filename") String filename,
            @JsonProperty("contentType") String contentType,
            @JsonProperty("size") long size) {
    }
}
